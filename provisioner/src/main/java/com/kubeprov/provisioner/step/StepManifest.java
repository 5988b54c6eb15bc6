package com.kubeprov.provisioner.step;

import java.util.List;

/**
 * Identity and documentation contract for a step.
 *
 * @param name        Unique, stable identifier used as the registry and catalog
 *                    key and in every log line and error message (e.g. "awsCreateVPC").
 * @param description One-line summary shown in the pipeline API; no semantic role.
 * @param depends     Names of steps that must have succeeded earlier in the same
 *                    pipeline. Pipelines are pre-ordered, so this is checked by
 *                    {@code PipelineValidator}, not used for scheduling.
 */
public record StepManifest(
        String       name,
        String       description,
        List<String> depends) {

    public StepManifest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("step name must not be blank");
        }
        depends = depends == null ? List.of() : List.copyOf(depends);
    }

    public static StepManifest of(String name, String description, String... depends) {
        return new StepManifest(name, description, List.of(depends));
    }
}
