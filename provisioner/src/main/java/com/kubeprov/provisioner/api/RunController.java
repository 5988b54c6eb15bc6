package com.kubeprov.provisioner.api;

import com.kubeprov.provisioner.api.dto.RunResponse;
import com.kubeprov.provisioner.api.dto.SubmitRunRequest;
import com.kubeprov.provisioner.cloud.CloudProvider;
import com.kubeprov.provisioner.model.ProvisioningRun;
import com.kubeprov.provisioner.service.ProvisioningService;
import com.kubeprov.provisioner.service.RunScheduler;
import com.kubeprov.provisioner.step.ProvisionConfig;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.UUID;

/**
 * REST API for provisioning runs.
 *
 * POST /runs               submit a run
 * GET  /runs/{id}          poll its state
 * GET  /runs/{id}/output   progress narration (text/plain)
 * POST /runs/{id}/cancel   cancel a live run; completed steps are rolled back
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final ProvisioningService service;
    private final RunScheduler        scheduler;

    public RunController(ProvisioningService service, RunScheduler scheduler) {
        this.service   = service;
        this.scheduler = scheduler;
    }

    /**
     * Submit a run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"provider":"aws","clusterName":"demo","region":"us-east-1",
     *          "aws":{"publicKey":"ssh-ed25519 AAAA..."}}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> submit(@RequestBody SubmitRunRequest req) {
        CloudProvider provider = CloudProvider.fromId(req.provider()).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown provider: " + req.provider()));
        if (req.timeoutSec() != null && req.timeoutSec() <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "timeoutSec must be positive");
        }
        ProvisionConfig cfg = new ProvisionConfig(
                UUID.randomUUID(), provider, req.clusterId(), req.clusterName(), req.region(),
                req.aws(), req.azure());
        Duration timeout = req.timeoutSec() == null ? null : Duration.ofSeconds(req.timeoutSec());
        ProvisioningRun run = scheduler.submit(cfg, timeout);
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
    }

    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return RunResponse.from(find(id));
    }

    /** Live output while the run is going, the persisted output afterwards. */
    @GetMapping(value = "/{id}/output", produces = MediaType.TEXT_PLAIN_VALUE)
    public String getOutput(@PathVariable UUID id) {
        return scheduler.output(id).orElseGet(() -> {
            String output = find(id).getOutput();
            return output == null ? "" : output;
        });
    }

    /**
     * HTTP 202 when a live run was cancelled,
     * HTTP 409 when the run is no longer active,
     * HTTP 404 when the run is unknown.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<RunResponse> cancel(@PathVariable UUID id) {
        ProvisioningRun run = find(id);
        if (!scheduler.cancel(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Run " + id + " is not active (state " + run.getState() + ")");
        }
        return ResponseEntity.accepted().body(RunResponse.from(run));
    }

    private ProvisioningRun find(UUID id) {
        return service.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
    }
}
