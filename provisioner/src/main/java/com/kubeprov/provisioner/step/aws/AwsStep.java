package com.kubeprov.provisioner.step.aws;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.CreateTagsRequest;
import com.amazonaws.services.ec2.model.Tag;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.Step;
import com.kubeprov.provisioner.step.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.Arrays;
import java.util.function.Supplier;

/**
 * Base class for AWS steps.
 *
 * Translates SDK failures into {@link StepException}s carrying the step name,
 * and cleans up after a half-finished {@link #doRun} by invoking the step's
 * own {@link #doRollback}: the executor never rolls back the step that
 * failed, only the ones before it. Subclasses record every resource in the
 * run's outputs right after creating it so that rollback can find it.
 */
public abstract class AwsStep implements Step {

    private static final Logger log = LoggerFactory.getLogger(AwsStep.class);

    protected final AwsClientFactory clients;

    protected AwsStep(AwsClientFactory clients) {
        this.clients = clients;
    }

    protected abstract void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg);

    protected abstract void doRollback(PrintWriter out, ProvisionConfig cfg);

    @Override
    public final void run(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        try {
            doRun(ctx, out, cfg);
        } catch (RuntimeException e) {
            StepException failure = wrap(e);
            try {
                doRollback(out, cfg);
            } catch (RuntimeException cleanup) {
                log.warn("Step '{}' could not clean up after failing: {}", name(), cleanup.getMessage());
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    @Override
    public final void rollback(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        try {
            doRollback(out, cfg);
        } catch (RuntimeException e) {
            throw wrap(e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers for subclasses
    // ------------------------------------------------------------------

    /** Tag an EC2 resource with the cluster's name and ownership tags. */
    protected void tag(AmazonEC2 ec2, String resourceId, ProvisionConfig cfg, String role) {
        ec2.createTags(new CreateTagsRequest()
                .withResources(resourceId)
                .withTags(
                        new Tag("Name", cfg.clusterName() + "-" + role),
                        new Tag("KubernetesCluster", cfg.clusterId()),
                        new Tag("kubernetes.io/cluster/" + cfg.clusterName(), "owned")));
    }

    /**
     * Poll {@code state} until it returns {@code wanted}, for at most
     * {@code maxWait} and never past the run's own deadline.
     */
    protected void awaitState(ExecutionContext ctx, String what, Duration maxWait,
                              Supplier<String> state, String wanted) {
        ExecutionContext waitCtx = ctx.withTimeout(maxWait);
        while (true) {
            String current = state.get();
            if (wanted.equals(current)) return;
            log.debug("{}: {} is '{}', waiting for '{}'", name(), what, current, wanted);
            waitCtx.throwIfDone(name() + ": waiting for " + what);
            waitCtx.sleep(clients.pollInterval());
        }
    }

    /** True if {@code e} carries one of the given AWS error codes. */
    protected static boolean hasErrorCode(AmazonServiceException e, String... codes) {
        return Arrays.asList(codes).contains(e.getErrorCode());
    }

    protected StepException wrap(RuntimeException e) {
        if (e instanceof StepException se) {
            return se;
        }
        if (e instanceof AmazonServiceException ase) {
            return new StepException(StepException.Kind.EXECUTION, name(),
                    name() + ": " + ase.getErrorCode() + ": " + ase.getErrorMessage(), ase);
        }
        return new StepException(StepException.Kind.EXECUTION, name(),
                name() + ": " + e.getMessage(), e);
    }
}
