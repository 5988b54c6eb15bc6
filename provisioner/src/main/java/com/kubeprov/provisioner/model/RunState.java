package com.kubeprov.provisioner.model;

/**
 * Lifecycle of a provisioning run.
 *
 *   PENDING → RUNNING → SUCCEEDED
 *                     → FAILED     (a step failed; completed steps were rolled back)
 *                     → CANCELLED  (cancelled or past its deadline; rolled back)
 *
 * A PENDING or RUNNING run whose worker disappeared is swept to FAILED.
 */
public enum RunState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
