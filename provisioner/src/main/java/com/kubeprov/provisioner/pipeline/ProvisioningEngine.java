package com.kubeprov.provisioner.pipeline;

import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.util.List;

/**
 * Entry point for the surrounding service: provision one cluster.
 *
 * Runs the top-level workflow, whose stage list comes from
 * {@code kubeprov.workflow.steps} (by default just {@code preProvision}).
 * Each stage is an ordinary registered step, usually a {@link CompositeStep}.
 */
@Component
public class ProvisioningEngine {

    public static final String WORKFLOW = "provision";

    private static final Logger log = LoggerFactory.getLogger(ProvisioningEngine.class);

    private final PipelineExecutor executor;
    private final Pipeline         workflow;

    public ProvisioningEngine(
            PipelineExecutor executor,
            @Value("${kubeprov.workflow.steps:" + PipelineCatalog.PRE_PROVISION + "}") List<String> workflowSteps) {
        this.executor = executor;
        this.workflow = new Pipeline(WORKFLOW, workflowSteps);
    }

    public Pipeline workflow() { return workflow; }

    /**
     * Run the workflow for {@code cfg.provider()}.
     *
     * @throws StepException     CONFIGURATION if {@code cfg} is null
     * @throws PipelineException if any stage failed; completed work has been rolled back
     */
    public RunReport provision(ProvisionConfig cfg, ExecutionContext ctx, PrintWriter out) {
        if (cfg == null) {
            throw new StepException(StepException.Kind.CONFIGURATION,
                    WORKFLOW + ": provisioning config is required");
        }
        log.info("Provisioning {} with stages {}", cfg, workflow.steps());
        RunReport report = executor.execute(workflow, ctx, out, cfg);
        out.printf("[%s] cluster %s prerequisites ready on %s%n",
                WORKFLOW, cfg.clusterName(), cfg.provider().id());
        return report;
    }
}
