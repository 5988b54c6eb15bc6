package com.kubeprov.provisioner.api.dto;

import java.util.List;

/** Response body for GET /pipelines/{provider}: the stage's steps in execution order. */
public record PipelineResponse(String stage, String provider, List<StepResponse> steps) {
}
