package com.kubeprov.provisioner.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process step registry.
 *
 * Every {@link Step} bean declared as a Spring {@code @Component} is collected
 * at startup via constructor injection, so a provider package installs its
 * steps just by declaring them. Tests build a registry from fixture steps.
 *
 * <p>Populated before any pipeline runs and only read afterwards; the
 * concurrent map makes those reads safe from every worker thread.
 */
@Component
public class StepRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepRegistry.class);

    private final Map<String, Step> steps = new ConcurrentHashMap<>();

    /**
     * Spring collects every {@code Step} bean and passes the list here.
     * Adding a new step only requires declaring it as {@code @Component}.
     */
    public StepRegistry(List<Step> allSteps) {
        allSteps.forEach(this::register);
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    /** Associate the step with its manifest name. Last registration wins. */
    public void register(Step step) {
        String name = step.manifest().name();
        Step previous = steps.put(name, step);
        if (previous != null && previous != step) {
            log.warn("Step '{}' re-registered: {} replaces {}",
                    name, step.getClass().getSimpleName(), previous.getClass().getSimpleName());
        } else {
            log.info("Registered step '{}' ({})", name, step.getClass().getSimpleName());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /** @throws StepNotFoundException if nothing is registered under {@code name} */
    public Step get(String name) {
        Step step = steps.get(name);
        if (step == null) {
            throw new StepNotFoundException(name);
        }
        return step;
    }

    public Optional<Step> find(String name) {
        return Optional.ofNullable(steps.get(name));
    }

    public boolean contains(String name) {
        return steps.containsKey(name);
    }

    /** Returns all registered step names (sorted). */
    public List<String> stepNames() {
        return steps.keySet().stream().sorted().toList();
    }

    /** Manifests of all registered steps, sorted by name. */
    public List<StepManifest> manifests() {
        return steps.values().stream()
                .map(Step::manifest)
                .sorted(Comparator.comparing(StepManifest::name))
                .toList();
    }
}
