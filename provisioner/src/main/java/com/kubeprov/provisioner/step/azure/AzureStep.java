package com.kubeprov.provisioner.step.azure;

import com.kubeprov.provisioner.step.AzureSettings;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.Step;
import com.kubeprov.provisioner.step.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Base class for Azure steps: error translation, self-cleanup after a failed
 * run and polling of long-running ARM operations.
 */
public abstract class AzureStep implements Step {

    private static final Logger log = LoggerFactory.getLogger(AzureStep.class);

    // Budget for undoing a half-finished run when the run's own context is already done.
    static final Duration CLEANUP_TIMEOUT = Duration.ofMinutes(10);

    static final String SUCCEEDED = "Succeeded";
    static final String FAILED = "Failed";

    protected final AzureManagementClient client;

    protected AzureStep(AzureManagementClient client) {
        this.client = client;
    }

    protected abstract void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg);

    protected abstract void doRollback(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg);

    @Override
    public final void run(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        try {
            doRun(ctx, out, cfg);
        } catch (RuntimeException e) {
            StepException failure = wrap(e);
            try {
                doRollback(ExecutionContext.background().withTimeout(CLEANUP_TIMEOUT), out, cfg);
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
            doRollback(ctx, out, cfg);
        } catch (RuntimeException e) {
            throw wrap(e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers for subclasses
    // ------------------------------------------------------------------

    /** Location from the Azure settings, falling back to the run's region. */
    protected String location(ProvisionConfig cfg) {
        AzureSettings azure = cfg.requireAzure();
        String location = azure.location() != null && !azure.location().isBlank() ? azure.location() : cfg.region();
        if (location == null || location.isBlank()) {
            throw new StepException(StepException.Kind.CONFIGURATION, name(),
                    name() + ": an Azure location or region is required", null);
        }
        return location;
    }

    protected static String requireSubscription(AzureSettings azure) {
        if (azure.subscriptionId() == null || azure.subscriptionId().isBlank()) {
            throw new StepException(StepException.Kind.CONFIGURATION, "azure: subscriptionId is required");
        }
        return azure.subscriptionId();
    }

    /**
     * Poll the resource's provisioning state until it is {@code Succeeded}.
     * A {@code Failed} state ends the wait with an EXECUTION error.
     */
    protected void awaitSucceeded(ExecutionContext ctx, String what, Duration maxWait, Supplier<String> state) {
        ExecutionContext waitCtx = ctx.withTimeout(maxWait);
        while (true) {
            String current = state.get();
            if (SUCCEEDED.equalsIgnoreCase(current)) return;
            if (FAILED.equalsIgnoreCase(current)) {
                throw new StepException(StepException.Kind.EXECUTION, name(),
                        name() + ": " + what + " provisioning failed", null);
            }
            log.debug("{}: {} is '{}', waiting", name(), what, current);
            waitCtx.throwIfDone(name() + ": waiting for " + what);
            waitCtx.sleep(client.pollInterval());
        }
    }

    /** Poll until {@code exists} reports false. */
    protected void awaitGone(ExecutionContext ctx, String what, Duration maxWait, BooleanSupplier exists) {
        ExecutionContext waitCtx = ctx.withTimeout(maxWait);
        while (exists.getAsBoolean()) {
            waitCtx.throwIfDone(name() + ": waiting for deletion of " + what);
            waitCtx.sleep(client.pollInterval());
        }
    }

    protected StepException wrap(RuntimeException e) {
        if (e instanceof StepException se) {
            return se;
        }
        return new StepException(StepException.Kind.EXECUTION, name(),
                name() + ": " + e.getMessage(), e);
    }
}
