package com.kubeprov.provisioner.pipeline;

import com.kubeprov.provisioner.cloud.CloudProvider;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.RecordingStep;
import com.kubeprov.provisioner.step.StepException;
import com.kubeprov.provisioner.step.StepRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Unit tests for PipelineExecutor: ordering, compensation, cancellation.
 * No Spring context; fixture steps record every call in a shared journal.
 */
class PipelineExecutorTest {

    List<String> journal;
    StepRegistry registry;
    SimpleMeterRegistry meters;
    PipelineExecutor executor;
    StringWriter output;
    PrintWriter out;
    ProvisionConfig cfg;

    @BeforeEach
    void setUp() {
        journal = new ArrayList<>();
        registry = new StepRegistry(List.of());
        meters = new SimpleMeterRegistry();
        executor = new PipelineExecutor(registry, meters, Duration.ofMinutes(1));
        output = new StringWriter();
        out = new PrintWriter(output, true);
        cfg = new ProvisionConfig(UUID.randomUUID(), CloudProvider.GCE, "c1", "demo", "us-central1", null, null);
    }

    private RecordingStep step(String name) {
        RecordingStep step = new RecordingStep(name, journal);
        registry.register(step);
        return step;
    }

    private PipelineException executeFailing(Pipeline pipeline, ExecutionContext ctx) {
        Throwable thrown = catchThrowable(() -> executor.execute(pipeline, ctx, out, cfg));
        assertThat(thrown).isInstanceOf(PipelineException.class);
        return (PipelineException) thrown;
    }

    private StepException rollbackFailing(Pipeline pipeline) {
        Throwable thrown = catchThrowable(() -> executor.rollback(pipeline, ExecutionContext.background(), out, cfg));
        assertThat(thrown).isInstanceOf(StepException.class);
        return (StepException) thrown;
    }

    // ------------------------------------------------------------------
    // Forward execution
    // ------------------------------------------------------------------

    @Test
    void execute_allSucceed_runsInOrderAndReportsSteps() {
        step("a");
        step("b");
        step("c");

        RunReport report = executor.execute(Pipeline.of("stage", "a", "b", "c"),
                ExecutionContext.background(), out, cfg);

        assertThat(journal).containsExactly("run:a", "run:b", "run:c");
        assertThat(report.pipeline()).isEqualTo("stage");
        assertThat(report.stepsRun()).containsExactly("a", "b", "c");
        assertThat(output.toString()).contains("[stage] a: fixture step a");
    }

    @Test
    void execute_emptyPipeline_succeedsWithoutSideEffects() {
        RunReport report = executor.execute(new Pipeline("stage", List.of()),
                ExecutionContext.background(), out, cfg);

        assertThat(report.stepsRun()).isEmpty();
        assertThat(journal).isEmpty();
        assertThat(cfg.outputs().isEmpty()).isTrue();
    }

    @Test
    void execute_nullConfig_isConfigurationError() {
        step("a");

        assertThatThrownBy(() -> executor.execute(Pipeline.of("stage", "a"),
                ExecutionContext.background(), out, null))
                .isInstanceOf(StepException.class)
                .hasMessageContaining("[CONFIGURATION]");
        assertThat(journal).isEmpty();
    }

    @Test
    void execute_unregisteredStep_failsBeforeAnyStepRuns() {
        step("a");

        PipelineException e = executeFailing(Pipeline.of("stage", "a", "missing"), ExecutionContext.background());

        assertThat(e.getKind()).isEqualTo(StepException.Kind.CONFIGURATION);
        assertThat(e.getMessage()).contains("missing");
        assertThat(journal).isEmpty();
    }

    // ------------------------------------------------------------------
    // Compensation
    // ------------------------------------------------------------------

    @Test
    void execute_stepFails_rollsBackCompletedStepsNewestFirst() {
        step("a");
        step("b");
        RuntimeException boom = new RuntimeException("quota exceeded");
        step("c").failingRun(boom);
        step("d");

        PipelineException e = executeFailing(Pipeline.of("stage", "a", "b", "c", "d"), ExecutionContext.background());

        assertThat(journal).containsExactly("run:a", "run:b", "run:c", "rollback:b", "rollback:a");
        assertThat(e.getStage()).isEqualTo("stage");
        assertThat(e.getStepName()).isEqualTo("c");
        assertThat(e.getCause()).isSameAs(boom);
        assertThat(e.getKind()).isEqualTo(StepException.Kind.EXECUTION);
        assertThat(e.getRolledBack()).containsExactly("b", "a");
        assertThat(e.getMessage()).contains("step 'c' failed").contains("quota exceeded");
        assertThat(cfg.outputs().isEmpty()).isTrue();
    }

    @Test
    void execute_firstStepFails_nothingToRollBack() {
        step("a").failingRun(new RuntimeException("denied"));
        step("b");

        PipelineException e = executeFailing(Pipeline.of("stage", "a", "b"), ExecutionContext.background());

        assertThat(journal).containsExactly("run:a");
        assertThat(e.getRolledBack()).isEmpty();
    }

    @Test
    void execute_rollbackFails_continuesAndCollectsFailures() {
        step("a").failingRollback(new RuntimeException("a stuck"));
        step("b").failingRollback(new RuntimeException("still in use"));
        step("c");
        step("d").failingRun(new RuntimeException("boom"));

        PipelineException e = executeFailing(Pipeline.of("stage", "a", "b", "c", "d"), ExecutionContext.background());

        assertThat(journal).containsExactly(
                "run:a", "run:b", "run:c", "run:d", "rollback:c", "rollback:b", "rollback:a");
        assertThat(e.getRollbackFailures())
                .extracting(StepException::getStepName)
                .containsExactly("b", "a");
        assertThat(e.getRollbackFailures())
                .extracting(StepException::getKind)
                .containsOnly(StepException.Kind.COMPENSATION);
        assertThat(e.getSuppressed()).hasSize(2);
        assertThat(e.totalRollbackFailures()).isEqualTo(2);
        assertThat(e.getMessage()).contains("2 rollback failure(s): b, a");
        assertThat(e.getCause()).hasMessage("boom");
    }

    @Test
    void rollback_unwindsWholePipelineInReverse_andReportsFailures() {
        step("a").failingRollback(new RuntimeException("a stuck"));
        step("b");
        step("c").failingRollback(new RuntimeException("c stuck"));

        StepException e = rollbackFailing(Pipeline.of("stage", "a", "b", "c"));

        assertThat(journal).containsExactly("rollback:c", "rollback:b", "rollback:a");
        assertThat(e.getKind()).isEqualTo(StepException.Kind.COMPENSATION);
        assertThat(e.getMessage()).contains("2 step rollback(s) failed");
        assertThat(e.getSuppressed()).hasSize(1);
    }

    // ------------------------------------------------------------------
    // Cancellation and deadlines
    // ------------------------------------------------------------------

    @Test
    void execute_cancelledDuringStep_nextStepNeverStarts_andCompletedWorkIsRolledBack() {
        step("a");
        RecordingStep b = step("b");
        b.duringRun(ExecutionContext::cancel);
        step("c");
        ExecutionContext ctx = ExecutionContext.background();

        PipelineException e = executeFailing(Pipeline.of("stage", "a", "b", "c"), ctx);

        assertThat(journal).containsExactly("run:a", "run:b", "rollback:b", "rollback:a");
        assertThat(e.getKind()).isEqualTo(StepException.Kind.CANCELLED);
        assertThat(e.isCancellation()).isTrue();
        assertThat(e.getStepName()).isEqualTo("c");
        assertThat(e.getMessage()).contains("stopped at step 'c'");
    }

    @Test
    void execute_rollbackAfterCancellation_getsLiveContext() {
        RecordingStep a = step("a");
        step("b").duringRun(ExecutionContext::cancel);
        step("c");

        executeFailing(Pipeline.of("stage", "a", "b", "c"), ExecutionContext.background());

        assertThat(a.rollbackContexts()).hasSize(1);
        assertThat(a.rollbackContexts().get(0).isDone()).isFalse();
    }

    @Test
    void execute_deadlineAlreadyPassed_runsNothing() {
        step("a");

        PipelineException e = executeFailing(Pipeline.of("stage", "a"), ExecutionContext.background().withTimeout(Duration.ZERO));

        assertThat(journal).isEmpty();
        assertThat(e.getKind()).isEqualTo(StepException.Kind.TIMEOUT);
    }

    // ------------------------------------------------------------------
    // Metrics
    // ------------------------------------------------------------------

    @Test
    void execute_recordsTimerAndStatusCounters() {
        step("a");
        step("b").failingRun(new RuntimeException("boom"));

        executeFailing(Pipeline.of("stage", "a", "b"), ExecutionContext.background());

        assertThat(meters.get("kubeprov.step.duration").tags("step", "a", "phase", "run").timer().count())
                .isEqualTo(1);
        assertThat(meters.get("kubeprov.step.calls")
                .tags("step", "b", "phase", "run", "status", "error").counter().count())
                .isEqualTo(1.0);
        assertThat(meters.get("kubeprov.step.calls")
                .tags("step", "a", "phase", "rollback", "status", "success").counter().count())
                .isEqualTo(1.0);
    }
}
