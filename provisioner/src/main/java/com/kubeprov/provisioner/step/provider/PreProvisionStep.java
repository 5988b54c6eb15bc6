package com.kubeprov.provisioner.step.provider;

import com.kubeprov.provisioner.pipeline.CompositeStep;
import com.kubeprov.provisioner.pipeline.Pipeline;
import com.kubeprov.provisioner.pipeline.PipelineCatalog;
import com.kubeprov.provisioner.pipeline.PipelineExecutor;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.StepManifest;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * Creates the cloud-side prerequisites of a cluster (network, firewall,
 * identity, keys) by running the provider's pre-provision pipeline.
 *
 * The executor is injected lazily: it depends on the registry, which in turn
 * collects this step.
 */
@Component
public class PreProvisionStep extends CompositeStep {

    public static final String NAME = PipelineCatalog.PRE_PROVISION;

    private static final StepManifest MANIFEST = StepManifest.of(
            NAME, "Create provider network and identity prerequisites");

    private final PipelineCatalog catalog;

    public PreProvisionStep(PipelineCatalog catalog, @Lazy PipelineExecutor executor) {
        super(executor);
        this.catalog = catalog;
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    protected Pipeline pipelineFor(ProvisionConfig cfg) {
        return catalog.pipelineFor(cfg.provider());
    }
}
