package com.kubeprov.provisioner.step;

/**
 * Thrown when a provisioning step, or the engine running it, fails.
 *
 * Unchecked so steps only catch it when they have a specific recovery
 * strategy; everything else propagates to the executor, which decides
 * whether compensation is needed.
 *
 * <p>The {@link Kind} separates deployment defects ({@code CONFIGURATION})
 * from cloud failures ({@code EXECUTION}), failed undo work
 * ({@code COMPENSATION}) and a caller that gave up ({@code CANCELLED},
 * {@code TIMEOUT}).
 */
public class StepException extends RuntimeException {

    public enum Kind { CONFIGURATION, EXECUTION, COMPENSATION, CANCELLED, TIMEOUT }

    private final Kind   kind;
    private final String stepName;

    public StepException(Kind kind, String message) {
        this(kind, null, message, null);
    }

    public StepException(Kind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public StepException(Kind kind, String stepName, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind     = kind;
        this.stepName = stepName;
    }

    public Kind getKind() { return kind; }

    /** Name of the step this failure is attributed to, or null for engine-level failures. */
    public String getStepName() { return stepName; }

    /** True for failures caused by the caller cancelling or the run's deadline expiring. */
    public boolean isCancellation() {
        return kind == Kind.CANCELLED || kind == Kind.TIMEOUT;
    }

    /** Kind of any throwable: its own kind for step failures, EXECUTION for everything else. */
    public static Kind kindOf(Throwable t) {
        return t instanceof StepException se ? se.getKind() : Kind.EXECUTION;
    }
}
