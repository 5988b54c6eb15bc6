package com.kubeprov.provisioner.api;

import com.kubeprov.provisioner.api.dto.PipelineResponse;
import com.kubeprov.provisioner.api.dto.StepResponse;
import com.kubeprov.provisioner.cloud.CloudProvider;
import com.kubeprov.provisioner.pipeline.Pipeline;
import com.kubeprov.provisioner.pipeline.PipelineCatalog;
import com.kubeprov.provisioner.step.StepRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of the registered steps and the per-provider pipelines.
 *
 * GET /pipelines/{provider}   pre-provision steps of a provider, in order
 * GET /steps                  every registered step
 */
@RestController
public class PipelineController {

    private final PipelineCatalog catalog;
    private final StepRegistry    registry;

    public PipelineController(PipelineCatalog catalog, StepRegistry registry) {
        this.catalog  = catalog;
        this.registry = registry;
    }

    /** Unknown providers are rejected with 400 by {@link ApiExceptionHandler}. */
    @GetMapping("/pipelines/{provider}")
    public PipelineResponse getPipeline(@PathVariable String provider) {
        Pipeline pipeline = catalog.pipelineFor(provider);
        List<StepResponse> steps = pipeline.steps().stream()
                .map(name -> registry.find(name)
                        .map(step -> StepResponse.from(step.manifest()))
                        .orElseGet(() -> StepResponse.unregistered(name)))
                .toList();
        String providerId = CloudProvider.fromId(provider).map(CloudProvider::id).orElse(provider);
        return new PipelineResponse(pipeline.name(), providerId, steps);
    }

    @GetMapping("/steps")
    public List<StepResponse> getSteps() {
        return registry.manifests().stream()
                .map(StepResponse::from)
                .toList();
    }
}
