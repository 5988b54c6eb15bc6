package com.kubeprov.provisioner.step.azure;

/**
 * Thrown when Azure Resource Manager or the login endpoint returns an error
 * or cannot be reached.
 */
public class AzureApiException extends RuntimeException {

    // 0 when no HTTP response was received
    private final int statusCode;

    public AzureApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public AzureApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() { return statusCode; }
}
