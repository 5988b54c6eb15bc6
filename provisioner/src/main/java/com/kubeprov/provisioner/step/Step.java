package com.kubeprov.provisioner.step;

import java.io.PrintWriter;

/**
 * One named, reversible provisioning action.
 *
 * Steps are Spring singletons created once at startup and shared by every
 * run, so they must not keep per-run state in fields. Everything a run
 * produces goes into the {@link ProvisionConfig} passed in, which later
 * steps (and {@link #rollback}) read back.
 *
 * <p>Contract:
 * <ul>
 *   <li>{@link #run} performs the action and narrates progress to {@code out}.
 *       Polling loops must go through {@link ExecutionContext#sleep} or
 *       {@link ExecutionContext#throwIfDone} so a cancelled run stops promptly.
 *       Failure is signalled by throwing; a step that fails half-way cleans up
 *       what it created itself, because the executor only rolls back steps that
 *       completed.</li>
 *   <li>{@link #rollback} undoes {@link #run} on a best-effort basis. It must be
 *       idempotent and a no-op (no error, no config change) when {@link #run}
 *       never recorded anything. A thrown exception is reported but never stops
 *       the rest of the unwind.</li>
 *   <li>{@link #manifest} is pure metadata.</li>
 * </ul>
 */
public interface Step {

    /** Identity, description and declared dependencies. */
    StepManifest manifest();

    /**
     * Perform the provisioning action.
     *
     * @throws StepException (or any RuntimeException) when the action failed
     */
    void run(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg);

    /**
     * Undo the provisioning action.
     *
     * @throws StepException (or any RuntimeException) when something could not be undone
     */
    void rollback(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg);

    default String name() {
        return manifest().name();
    }
}
