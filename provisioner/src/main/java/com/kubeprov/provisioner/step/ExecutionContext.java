package com.kubeprov.provisioner.step;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation and deadline signal shared by every step of a run.
 *
 * Contexts form a tree: a child created with {@link #withTimeout} or
 * {@link #child} is done as soon as its parent is done, but cancelling a
 * child leaves the parent untouched. A context with no parent and no
 * deadline ({@link #background()}) is never done unless cancelled.
 *
 * <p>Thread-safe: the worker running the pipeline polls the context while
 * an API thread may cancel it.
 */
public final class ExecutionContext {

    public enum Reason { CANCELLED, DEADLINE_EXCEEDED }

    // Upper bound on how long sleep() goes without re-checking the context.
    private static final long POLL_SLICE_MILLIS = 50;

    private final ExecutionContext          parent;
    private final Instant                   deadline;   // null = no own deadline
    private final AtomicReference<Reason>   cancelled = new AtomicReference<>();

    private ExecutionContext(ExecutionContext parent, Instant deadline) {
        this.parent   = parent;
        this.deadline = deadline;
    }

    /** Root context: no deadline, only done once cancelled. */
    public static ExecutionContext background() {
        return new ExecutionContext(null, null);
    }

    /** Child that is additionally done once {@code timeout} has elapsed. */
    public ExecutionContext withTimeout(Duration timeout) {
        Instant candidate = Instant.now().plus(timeout);
        Instant inherited = effectiveDeadline();
        if (inherited != null && inherited.isBefore(candidate)) {
            candidate = inherited;
        }
        return new ExecutionContext(this, candidate);
    }

    /** Child that can be cancelled independently of this context. */
    public ExecutionContext child() {
        return new ExecutionContext(this, null);
    }

    /** Cancel this context and every child derived from it. Idempotent. */
    public void cancel() {
        cancelled.compareAndSet(null, Reason.CANCELLED);
    }

    /** Why this context is done, or empty while it is still live. */
    public Optional<Reason> reason() {
        Reason own = cancelled.get();
        if (own != null) return Optional.of(own);
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            return Optional.of(Reason.DEADLINE_EXCEEDED);
        }
        return parent == null ? Optional.empty() : parent.reason();
    }

    public boolean isDone() {
        return reason().isPresent();
    }

    /** Time left before the nearest deadline, or empty when there is none. */
    public Optional<Duration> remaining() {
        Instant d = effectiveDeadline();
        if (d == null) return Optional.empty();
        Duration left = Duration.between(Instant.now(), d);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Throw a CANCELLED or TIMEOUT {@link StepException} if this context is done.
     *
     * @param operation what was about to happen, used as the message prefix
     */
    public void throwIfDone(String operation) {
        Optional<Reason> r = reason();
        if (r.isPresent()) {
            throw toException(operation, r.get());
        }
    }

    /**
     * Build the exception describing why this context is done.
     * Returns a CANCELLED exception if called on a live context.
     */
    public StepException toException(String operation) {
        return toException(operation, reason().orElse(Reason.CANCELLED));
    }

    /**
     * Sleep for {@code duration}, waking early and throwing as soon as the
     * context is done. Used by every polling loop in the steps.
     */
    public void sleep(Duration duration) {
        Instant until = Instant.now().plus(duration);
        while (true) {
            throwIfDone("sleep");
            long left = Duration.between(Instant.now(), until).toMillis();
            if (left <= 0) return;
            try {
                Thread.sleep(Math.min(left, POLL_SLICE_MILLIS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StepException(StepException.Kind.CANCELLED,
                        "sleep interrupted", e);
            }
        }
    }

    private Instant effectiveDeadline() {
        Instant inherited = parent == null ? null : parent.effectiveDeadline();
        if (deadline == null) return inherited;
        if (inherited == null) return deadline;
        return deadline.isBefore(inherited) ? deadline : inherited;
    }

    private static StepException toException(String operation, Reason reason) {
        return reason == Reason.DEADLINE_EXCEEDED
                ? new StepException(StepException.Kind.TIMEOUT, operation + ": deadline exceeded")
                : new StepException(StepException.Kind.CANCELLED, operation + ": run cancelled");
    }
}
