package com.kubeprov.provisioner.pipeline;

import java.util.List;

/**
 * An ordered, immutable list of step names run as one stage.
 *
 * @param name  Stage name used to attribute failures (e.g. "preProvision").
 * @param steps Step names in execution order; rollback walks them backwards.
 */
public record Pipeline(String name, List<String> steps) {

    public Pipeline {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("pipeline name must not be blank");
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static Pipeline of(String name, String... steps) {
        return new Pipeline(name, List.of(steps));
    }

    public boolean isEmpty() { return steps.isEmpty(); }
}
