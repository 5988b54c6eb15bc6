package com.kubeprov.provisioner.pipeline;

import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.Step;
import com.kubeprov.provisioner.step.StepException;

import java.io.PrintWriter;

/**
 * A step whose body is a whole {@link Pipeline}, run by the shared
 * {@link PipelineExecutor}.
 *
 * If an inner step fails, the executor rolls back the inner steps that
 * completed before rethrowing, so the composite leaves nothing behind and the
 * outer pipeline only has to unwind its own earlier steps. If the composite
 * completed and a later outer step fails, {@link #rollback} undoes every
 * inner step in reverse order.
 */
public abstract class CompositeStep implements Step {

    private final PipelineExecutor executor;

    protected CompositeStep(PipelineExecutor executor) {
        this.executor = executor;
    }

    /** The inner pipeline for this run; resolved fresh every time. */
    protected abstract Pipeline pipelineFor(ProvisionConfig cfg);

    @Override
    public void run(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        if (cfg == null) {
            throw new StepException(StepException.Kind.CONFIGURATION, name(),
                    name() + ": invalid config", null);
        }
        executor.execute(pipelineFor(cfg), ctx, out, cfg);
    }

    @Override
    public void rollback(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        if (cfg == null) return;
        executor.rollback(pipelineFor(cfg), ctx, out, cfg);
    }
}
