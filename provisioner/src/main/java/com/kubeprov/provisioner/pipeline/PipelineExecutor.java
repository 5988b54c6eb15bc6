package com.kubeprov.provisioner.pipeline;

import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.Step;
import com.kubeprov.provisioner.step.StepException;
import com.kubeprov.provisioner.step.StepRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Runs a {@link Pipeline} step by step and compensates on failure.
 *
 * <ol>
 *   <li>Resolve every step name through the registry. A missing step fails the
 *       whole pipeline before anything runs.</li>
 *   <li>Run steps strictly in order against the shared config and output.
 *       The context is checked before each step, so step N+1 never starts
 *       once the run is cancelled or past its deadline.</li>
 *   <li>On the first failure, roll back the completed steps newest first.
 *       Every rollback is attempted even if earlier ones fail, and each
 *       failure is collected.</li>
 *   <li>Throw a {@link PipelineException} naming the stage and the step, with
 *       the original failure as its cause.</li>
 * </ol>
 *
 * The same executor runs top-level workflows and the nested pipelines of
 * {@link CompositeStep}s, so compensation happens at every level a pipeline
 * runs.
 *
 * <p>Stateless apart from its collaborators; one instance serves all
 * concurrent runs.
 */
@Component
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final StepRegistry  registry;
    private final MeterRegistry meterRegistry;
    private final Duration      compensationTimeout;

    public PipelineExecutor(
            StepRegistry registry,
            MeterRegistry meterRegistry,
            @Value("${kubeprov.runs.compensation-timeout:PT10M}") Duration compensationTimeout) {
        this.registry            = registry;
        this.meterRegistry       = meterRegistry;
        this.compensationTimeout = compensationTimeout;
    }

    // ------------------------------------------------------------------
    // Forward execution
    // ------------------------------------------------------------------

    /**
     * Run every step of {@code pipeline} in order.
     *
     * @return summary of the completed run
     * @throws StepException      CONFIGURATION if {@code cfg} is null
     * @throws PipelineException  if a step is unregistered, fails, or the context
     *                            is done before the pipeline finishes
     */
    public RunReport execute(Pipeline pipeline, ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        if (cfg == null) {
            throw new StepException(StepException.Kind.CONFIGURATION,
                    pipeline.name() + ": provisioning config is required");
        }
        List<Step> steps = resolve(pipeline);

        String outerStage = MDC.get("stage");
        MDC.put("stage", pipeline.name());
        try {
            Instant started = Instant.now();
            Deque<Step> completed = new ArrayDeque<>();
            List<String> ran = new ArrayList<>();

            log.info("Pipeline '{}' starting ({} steps) for {}", pipeline.name(), steps.size(), cfg);
            for (Step step : steps) {
                String name = step.manifest().name();
                if (ctx.isDone()) {
                    StepException stop = ctx.toException(pipeline.name() + ": not starting step '" + name + "'");
                    throw compensate(pipeline, name, stop, completed, out, cfg);
                }
                try {
                    out.printf("[%s] %s: %s%n", pipeline.name(), name, step.manifest().description());
                    invoke(step, Phase.RUN, ctx, out, cfg);
                } catch (RuntimeException e) {
                    throw compensate(pipeline, name, e, completed, out, cfg);
                }
                completed.push(step);
                ran.add(name);
            }

            Duration elapsed = Duration.between(started, Instant.now());
            log.info("Pipeline '{}' completed {} steps in {} ms",
                    pipeline.name(), ran.size(), elapsed.toMillis());
            return new RunReport(pipeline.name(), ran, elapsed);
        } finally {
            restoreStage(outerStage);
        }
    }

    // ------------------------------------------------------------------
    // Compensation
    // ------------------------------------------------------------------

    /**
     * Roll back every step of {@code pipeline}, last step first.
     *
     * Used when an already-completed composite has to be undone by an outer
     * pipeline. Steps that never ran treat rollback as a no-op.
     *
     * @throws StepException COMPENSATION if any rollback failed; all are still
     *                       attempted and attached as suppressed exceptions
     */
    public void rollback(Pipeline pipeline, ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        List<Step> steps = resolve(pipeline);
        List<Step> newestFirst = new ArrayList<>(steps);
        Collections.reverse(newestFirst);

        String outerStage = MDC.get("stage");
        MDC.put("stage", pipeline.name());
        try {
            List<StepException> failures = unwind(pipeline, newestFirst, new ArrayList<>(), ctx, out, cfg);
            if (!failures.isEmpty()) {
                StepException ex = new StepException(StepException.Kind.COMPENSATION, pipeline.name(),
                        pipeline.name() + ": " + failures.size() + " step rollback(s) failed: "
                        + failures.get(0).getMessage(), failures.get(0));
                failures.stream().skip(1).forEach(ex::addSuppressed);
                throw ex;
            }
        } finally {
            restoreStage(outerStage);
        }
    }

    private PipelineException compensate(Pipeline pipeline,
                                         String failedStep,
                                         RuntimeException cause,
                                         Deque<Step> completed,
                                         PrintWriter out,
                                         ProvisionConfig cfg) {
        StepException.Kind kind = StepException.kindOf(cause);
        log.error("Pipeline '{}' stopped at step '{}' [{}]: {}",
                pipeline.name(), failedStep, kind, cause.getMessage());
        out.printf("[%s] %s FAILED: %s%n", pipeline.name(), failedStep, cause.getMessage());

        List<String> rolledBack = new ArrayList<>();
        List<StepException> failures = List.of();
        if (!completed.isEmpty()) {
            // Rollback runs even when the run itself was cancelled: it gets a
            // fresh context bounded only by the compensation timeout.
            ExecutionContext compensationCtx = ExecutionContext.background().withTimeout(compensationTimeout);
            out.printf("[%s] rolling back %d completed step(s)%n", pipeline.name(), completed.size());
            failures = unwind(pipeline, completed, rolledBack, compensationCtx, out, cfg);
        }
        return new PipelineException(pipeline.name(), failedStep, kind, cause, rolledBack, failures);
    }

    /** Roll back {@code newestFirst} in iteration order; never stops early. */
    private List<StepException> unwind(Pipeline pipeline,
                                       Iterable<Step> newestFirst,
                                       List<String> rolledBack,
                                       ExecutionContext ctx,
                                       PrintWriter out,
                                       ProvisionConfig cfg) {
        List<StepException> failures = new ArrayList<>();
        long startTime = System.currentTimeMillis();
        for (Step step : newestFirst) {
            String name = step.manifest().name();
            rolledBack.add(name);
            try {
                out.printf("[%s] %s: rolling back%n", pipeline.name(), name);
                invoke(step, Phase.ROLLBACK, ctx, out, cfg);
            } catch (RuntimeException e) {
                log.warn("Rollback of step '{}' in pipeline '{}' failed: {}",
                        name, pipeline.name(), e.getMessage());
                out.printf("[%s] %s ROLLBACK FAILED: %s%n", pipeline.name(), name, e.getMessage());
                failures.add(new StepException(StepException.Kind.COMPENSATION, name,
                        pipeline.name() + ": rollback of step '" + name + "' failed: " + e.getMessage(), e));
            }
        }
        log.info("Pipeline '{}' rollback of {} step(s) complete in {} ms ({} failed)",
                pipeline.name(), rolledBack.size(), System.currentTimeMillis() - startTime, failures.size());
        return failures;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<Step> resolve(Pipeline pipeline) {
        List<Step> steps = new ArrayList<>(pipeline.steps().size());
        for (String name : pipeline.steps()) {
            try {
                steps.add(registry.get(name));
            } catch (StepException e) {
                log.error("Pipeline '{}' references unregistered step '{}'", pipeline.name(), name);
                throw new PipelineException(pipeline.name(), null, StepException.Kind.CONFIGURATION,
                        e, List.of(), List.of());
            }
        }
        return steps;
    }

    /** Invoke one phase of a step with timing, counting and MDC. */
    private void invoke(Step step, Phase phase, ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        String name = step.manifest().name();
        String outerStep = MDC.get("step");
        MDC.put("step", name);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        long startTime = System.currentTimeMillis();
        try {
            log.info("{} step '{}'", phase.verb, name);
            if (phase == Phase.RUN) {
                step.run(ctx, out, cfg);
            } else {
                step.rollback(ctx, out, cfg);
            }
            log.info("{} step '{}' done in {} ms", phase.verb, name, System.currentTimeMillis() - startTime);
        } catch (StepException e) {
            status = e.isCancellation() ? "cancelled" : "error";
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("kubeprov.step.duration",
                    "step", name, "phase", phase.tag));
            meterRegistry.counter("kubeprov.step.calls",
                    "step", name, "phase", phase.tag, "status", status).increment();
            if (outerStep == null) {
                MDC.remove("step");
            } else {
                MDC.put("step", outerStep);
            }
        }
    }

    private static void restoreStage(String outerStage) {
        if (outerStage == null) {
            MDC.remove("stage");
        } else {
            MDC.put("stage", outerStage);
        }
    }

    private enum Phase {
        RUN("run", "Running"),
        ROLLBACK("rollback", "Rolling back");

        final String tag;
        final String verb;

        Phase(String tag, String verb) {
            this.tag  = tag;
            this.verb = verb;
        }
    }
}
