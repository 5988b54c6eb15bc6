package com.kubeprov.provisioner.service;

import com.kubeprov.provisioner.model.ProvisioningRun;
import com.kubeprov.provisioner.model.RunState;
import com.kubeprov.provisioner.pipeline.PipelineException;
import com.kubeprov.provisioner.repository.ProvisioningRunRepository;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.StepException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Persistence and state transitions of provisioning runs.
 *
 * Runs themselves are executed by {@link RunScheduler}; this service only
 * records what happened to them.
 */
@Service
public class ProvisioningService {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningService.class);

    // A non-live run untouched for this long lost its worker.
    static final Duration ORPHAN_TIMEOUT = Duration.ofMinutes(5);

    private final ProvisioningRunRepository runRepo;
    private final MeterRegistry             meterRegistry;

    public ProvisioningService(ProvisioningRunRepository runRepo, MeterRegistry meterRegistry) {
        this.runRepo       = runRepo;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Run lifecycle
    // ------------------------------------------------------------------

    /** Record a new PENDING run for {@code cfg}. */
    @Transactional
    public ProvisioningRun create(ProvisionConfig cfg) {
        ProvisioningRun run = runRepo.save(new ProvisioningRun(
                cfg.runId(), cfg.provider(), cfg.clusterId(), cfg.clusterName(), cfg.region()));
        count(run);
        log.info("Run {} created for cluster '{}' on {}", run.getId(), run.getClusterName(), run.getProvider().id());
        return run;
    }

    @Transactional
    public ProvisioningRun markRunning(UUID id) {
        ProvisioningRun run = runRepo.findById(id).orElseThrow();
        run.setState(RunState.RUNNING);
        run.setStartedAt(Instant.now());
        count(run);
        return runRepo.save(run);
    }

    @Transactional
    public ProvisioningRun markSucceeded(UUID id, String output) {
        ProvisioningRun run = runRepo.findById(id).orElseThrow();
        run.setState(RunState.SUCCEEDED);
        run.setOutput(output);
        run.setFinishedAt(Instant.now());
        count(run);
        log.info("Run {} SUCCEEDED", id);
        return runRepo.save(run);
    }

    /**
     * Record why a run stopped.
     *
     * Cancellations and expired deadlines end as CANCELLED, everything else
     * as FAILED. For pipeline failures the nested step path and the total
     * number of failed rollbacks are kept.
     */
    @Transactional
    public ProvisioningRun markFailed(UUID id, Throwable error, String output) {
        ProvisioningRun run = runRepo.findById(id).orElseThrow();
        boolean cancelled = error instanceof StepException se && se.isCancellation();
        run.setState(cancelled ? RunState.CANCELLED : RunState.FAILED);
        run.setErrorMessage(error.getMessage());
        if (error instanceof PipelineException pe) {
            run.setFailedStep(pe.stepPath().isEmpty() ? null : pe.stepPath());
            run.setRollbackFailures(pe.totalRollbackFailures());
        } else if (error instanceof StepException se) {
            run.setFailedStep(se.getStepName());
        }
        run.setOutput(output);
        run.setFinishedAt(Instant.now());
        count(run);
        if (run.getRollbackFailures() > 0) {
            log.error("Run {} {} at '{}' with {} rollback failure(s), manual cleanup may be needed: {}",
                    id, run.getState(), run.getFailedStep(), run.getRollbackFailures(), error.getMessage());
        } else {
            log.error("Run {} {} at '{}': {}", id, run.getState(), run.getFailedStep(), error.getMessage());
        }
        return runRepo.save(run);
    }

    @Transactional(readOnly = true)
    public Optional<ProvisioningRun> findById(UUID id) {
        return runRepo.findById(id);
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    /**
     * Fail PENDING or RUNNING runs that no live worker owns and that have not
     * been updated for {@link #ORPHAN_TIMEOUT}, e.g. after a restart.
     *
     * @param live ids of runs currently held by a worker of this instance
     * @return number of runs marked FAILED
     */
    @Transactional
    public int recoverOrphanedRuns(Set<UUID> live) {
        Instant cutoff = Instant.now().minus(ORPHAN_TIMEOUT);
        List<ProvisioningRun> stale = runRepo.findByStateInAndUpdatedAtBefore(
                EnumSet.of(RunState.PENDING, RunState.RUNNING), cutoff);
        int recovered = 0;
        for (ProvisioningRun run : stale) {
            if (live.contains(run.getId())) continue;
            log.warn("Recovering orphaned run {} (state={}, last update={})",
                    run.getId(), run.getState(), run.getUpdatedAt());
            run.setState(RunState.FAILED);
            run.setErrorMessage("interrupted: no worker owns this run any more; "
                    + "cloud resources it created may need manual cleanup");
            run.setFinishedAt(Instant.now());
            count(run);
            runRepo.save(run);
            recovered++;
        }
        return recovered;
    }

    private void count(ProvisioningRun run) {
        meterRegistry.counter("kubeprov.runs",
                "provider", run.getProvider().id(),
                "state", run.getState().name().toLowerCase()).increment();
    }
}
