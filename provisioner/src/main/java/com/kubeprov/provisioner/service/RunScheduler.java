package com.kubeprov.provisioner.service;

import com.kubeprov.provisioner.model.ProvisioningRun;
import com.kubeprov.provisioner.pipeline.ProvisioningEngine;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.StepException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs provisioning requests on a fixed worker pool.
 *
 * Each run gets its own {@link ExecutionContext} (bounded by the run's
 * timeout) and output buffer, kept in a live table until the worker
 * finishes so that the API can cancel the run and stream its output.
 * Every 60 seconds runs that no worker owns any more are swept to FAILED.
 */
@Component
@EnableScheduling
public class RunScheduler {

    private static final Logger log = LoggerFactory.getLogger(RunScheduler.class);

    private final ProvisioningService service;
    private final ProvisioningEngine  engine;
    private final Duration            defaultTimeout;
    private final ExecutorService     workers;

    private final Map<UUID, LiveRun> live = new ConcurrentHashMap<>();

    public RunScheduler(ProvisioningService service,
                        ProvisioningEngine engine,
                        @Value("${kubeprov.runs.worker-count:4}") int workerCount,
                        @Value("${kubeprov.runs.default-timeout:PT30M}") Duration defaultTimeout) {
        this.service        = service;
        this.engine         = engine;
        this.defaultTimeout = defaultTimeout;
        this.workers        = Executors.newFixedThreadPool(workerCount);
    }

    /**
     * Record a PENDING run and queue it on the worker pool.
     *
     * @param timeout overall deadline of the run, or null for the configured default
     */
    public ProvisioningRun submit(ProvisionConfig cfg, Duration timeout) {
        ProvisioningRun run = service.create(cfg);
        ExecutionContext ctx = ExecutionContext.background()
                .withTimeout(timeout == null ? defaultTimeout : timeout);
        LiveRun liveRun = new LiveRun(ctx, new RunOutput());
        live.put(run.getId(), liveRun);
        try {
            workers.submit(() -> execute(cfg, liveRun));
        } catch (RejectedExecutionException e) {
            live.remove(run.getId());
            log.warn("Run {} rejected: worker pool is shut down", run.getId());
            return service.markFailed(run.getId(),
                    new StepException(StepException.Kind.EXECUTION, "worker pool is shut down", e), "");
        }
        return run;
    }

    /**
     * Cancel a live run. Its worker stops before the next step and rolls back.
     *
     * @return false if no worker holds the run
     */
    public boolean cancel(UUID runId) {
        LiveRun run = live.get(runId);
        if (run == null) {
            return false;
        }
        log.info("Cancelling run {}", runId);
        run.ctx().cancel();
        return true;
    }

    /** Output written so far by a live run. */
    public Optional<String> output(UUID runId) {
        return Optional.ofNullable(live.get(runId)).map(r -> r.output().contents());
    }

    public boolean isLive(UUID runId) {
        return live.containsKey(runId);
    }

    /** Sweep runs left PENDING or RUNNING by a worker that is gone. */
    @Scheduled(fixedDelay = 60_000)
    public void recoverOrphanedRuns() {
        int recovered = service.recoverOrphanedRuns(Set.copyOf(live.keySet()));
        if (recovered > 0) {
            log.warn("Marked {} orphaned run(s) FAILED", recovered);
        }
    }

    @PreDestroy
    public void shutdown() {
        live.values().forEach(r -> r.ctx().cancel());
        workers.shutdown();
    }

    // ------------------------------------------------------------------

    void execute(ProvisionConfig cfg, LiveRun liveRun) {
        UUID runId = cfg.runId();
        PrintWriter out = new PrintWriter(liveRun.output(), true);
        try {
            MDC.put("runId", runId.toString());
            MDC.put("provider", cfg.provider().id());
            service.markRunning(runId);
            engine.provision(cfg, liveRun.ctx(), out);
            out.flush();
            service.markSucceeded(runId, liveRun.output().contents());
        } catch (Exception e) {
            log.error("Run {} stopped: {}", runId, e.getMessage(), e);
            out.flush();
            try {
                service.markFailed(runId, e, liveRun.output().contents());
            } catch (Exception persist) {
                log.error("Could not record failure of run {}: {}", runId, persist.getMessage(), persist);
            }
        } finally {
            live.remove(runId);
            MDC.clear();
        }
    }

    record LiveRun(ExecutionContext ctx, RunOutput output) {}
}
