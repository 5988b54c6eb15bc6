package com.kubeprov.provisioner.api;

import com.kubeprov.provisioner.step.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps step failures raised while handling a request: bad input
 * (CONFIGURATION) is the caller's fault, anything else is ours.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(StepException.class)
    public ResponseEntity<Map<String, String>> handleStepException(StepException e) {
        HttpStatus status = e.getKind() == StepException.Kind.CONFIGURATION
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.INTERNAL_SERVER_ERROR;
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        }
        return ResponseEntity.status(status).body(Map.of(
                "kind",    e.getKind().name(),
                "message", e.getMessage()));
    }
}
