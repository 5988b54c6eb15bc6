package com.kubeprov.provisioner.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    PipelineCatalog preProvisionCatalog() {
        return PipelineCatalog.preProvision();
    }

    /**
     * Validate every catalog pipeline and the top-level workflow once the
     * registry is populated. Problems are logged; with
     * {@code kubeprov.pipelines.fail-on-invalid=true} they abort startup.
     */
    @Bean
    CommandLineRunner verifyPipelines(PipelineCatalog catalog,
                                      ProvisioningEngine engine,
                                      PipelineValidator validator,
                                      @Value("${kubeprov.pipelines.fail-on-invalid:false}") boolean failOnInvalid) {
        return args -> {
            List<String> problems = new ArrayList<>(validator.validate(engine.workflow()));
            catalog.providers().forEach(provider -> {
                Pipeline pipeline = catalog.pipelineFor(provider);
                problems.addAll(validator.validate(pipeline));
                log.info("Pipeline '{}' for {}: {}", pipeline.name(), provider.id(), pipeline.steps());
            });
            if (problems.isEmpty()) {
                return;
            }
            problems.forEach(p -> log.warn("Invalid pipeline: {}", p));
            if (failOnInvalid) {
                throw new IllegalStateException(problems.size() + " pipeline problem(s): " + problems);
            }
        };
    }
}
