package com.kubeprov.provisioner.pipeline;

import com.kubeprov.provisioner.step.StepException;

import java.util.ArrayList;
import java.util.List;

/**
 * A pipeline stopped before completing.
 *
 * Wraps the original failure (the cause) with the stage name and the step
 * the pipeline stopped at, and carries what the compensation pass did: the
 * steps whose rollback was invoked, newest first, and every rollback that
 * failed. Rollback failures are also attached as suppressed exceptions so
 * they show up in a logged stack trace.
 *
 * <p>Nested pipelines produce nested exceptions; {@link #stepPath()} and
 * {@link #totalRollbackFailures()} walk the chain.
 */
public class PipelineException extends StepException {

    private final String              stage;
    private final List<String>        rolledBack;
    private final List<StepException> rollbackFailures;

    public PipelineException(String stage,
                             String failedStep,
                             Kind kind,
                             Throwable cause,
                             List<String> rolledBack,
                             List<StepException> rollbackFailures) {
        super(kind, failedStep, describe(stage, failedStep, kind, cause, rollbackFailures), cause);
        this.stage            = stage;
        this.rolledBack       = List.copyOf(rolledBack);
        this.rollbackFailures = List.copyOf(rollbackFailures);
        this.rollbackFailures.forEach(this::addSuppressed);
    }

    public String getStage() { return stage; }

    /** Steps whose rollback was invoked, in invocation order (newest first). */
    public List<String> getRolledBack() { return rolledBack; }

    /** Rollbacks that failed at this level. */
    public List<StepException> getRollbackFailures() { return rollbackFailures; }

    /**
     * Failed step at every nesting level, outermost first, e.g.
     * {@code "preProvision/awsCreateSubnets"}.
     */
    public String stepPath() {
        List<String> path = new ArrayList<>();
        Throwable t = this;
        while (t != null) {
            if (t instanceof PipelineException pe && pe.getStepName() != null) {
                path.add(pe.getStepName());
            }
            t = t.getCause();
        }
        return String.join("/", path);
    }

    /** Rollback failures at this level and in every nested pipeline below it. */
    public int totalRollbackFailures() {
        int total = 0;
        Throwable t = this;
        while (t != null) {
            if (t instanceof PipelineException pe) {
                total += pe.rollbackFailures.size();
            }
            t = t.getCause();
        }
        return total;
    }

    private static String describe(String stage,
                                   String failedStep,
                                   Kind kind,
                                   Throwable cause,
                                   List<StepException> rollbackFailures) {
        StringBuilder sb = new StringBuilder(stage).append(": ");
        if (failedStep == null) {
            sb.append("pipeline could not start");
        } else if (kind == Kind.CANCELLED || kind == Kind.TIMEOUT) {
            sb.append("stopped at step '").append(failedStep).append("'");
        } else {
            sb.append("step '").append(failedStep).append("' failed");
        }
        if (cause != null) {
            sb.append(": ").append(cause.getMessage());
        }
        if (!rollbackFailures.isEmpty()) {
            sb.append(" (").append(rollbackFailures.size()).append(" rollback failure(s): ");
            sb.append(String.join(", ", rollbackFailures.stream()
                    .map(StepException::getStepName)
                    .toList()));
            sb.append(")");
        }
        return sb.toString();
    }
}
