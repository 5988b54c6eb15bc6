package com.kubeprov.provisioner.api.dto;

import com.kubeprov.provisioner.step.StepManifest;

import java.util.List;

/**
 * One step as listed by GET /steps and GET /pipelines/{provider}.
 * {@code registered} is false for a pipeline entry no step answers to.
 */
public record StepResponse(String name, String description, List<String> depends, boolean registered) {

    public static StepResponse from(StepManifest manifest) {
        return new StepResponse(manifest.name(), manifest.description(), manifest.depends(), true);
    }

    public static StepResponse unregistered(String name) {
        return new StepResponse(name, null, List.of(), false);
    }
}
