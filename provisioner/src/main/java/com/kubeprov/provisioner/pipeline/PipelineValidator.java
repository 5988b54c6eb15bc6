package com.kubeprov.provisioner.pipeline;

import com.kubeprov.provisioner.step.Step;
import com.kubeprov.provisioner.step.StepRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a pipeline against the registry: every name must be registered and
 * every declared dependency must appear earlier in the same pipeline.
 */
@Component
public class PipelineValidator {

    private final StepRegistry registry;

    public PipelineValidator(StepRegistry registry) {
        this.registry = registry;
    }

    /** Problems found, one human-readable line each; empty when the pipeline is sound. */
    public List<String> validate(Pipeline pipeline) {
        List<String> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String name : pipeline.steps()) {
            Optional<Step> step = registry.find(name);
            if (step.isEmpty()) {
                problems.add(pipeline.name() + ": step '" + name + "' is not registered");
            } else {
                for (String dependency : step.get().manifest().depends()) {
                    if (!seen.contains(dependency)) {
                        problems.add(pipeline.name() + ": step '" + name + "' depends on '"
                                + dependency + "' which does not run before it");
                    }
                }
            }
            if (!seen.add(name)) {
                problems.add(pipeline.name() + ": step '" + name + "' appears more than once");
            }
        }
        return problems;
    }
}
