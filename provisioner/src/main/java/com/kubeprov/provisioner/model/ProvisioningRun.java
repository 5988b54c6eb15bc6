package com.kubeprov.provisioner.model;

import com.kubeprov.provisioner.cloud.CloudProvider;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One request to provision a cluster's prerequisites.
 *
 * The id is the run id carried in the {@code ProvisionConfig}, so log lines,
 * cloud tags and this row all share it. Credentials are never stored here.
 *
 * DB table: provisioning_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "provisioning_runs")
public class ProvisioningRun {

    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CloudProvider provider;

    @Column(name = "cluster_id", nullable = false)
    private String clusterId;

    @Column(name = "cluster_name", nullable = false)
    private String clusterName;

    private String region;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunState state = RunState.PENDING;

    // Nested path of the step that failed, e.g. "preProvision/awsCreateSubnets".
    @Column(name = "failed_step")
    private String failedStep;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "rollback_failures", nullable = false)
    private int rollbackFailures = 0;

    // Progress narration, written once the run finishes.
    @Column(columnDefinition = "TEXT")
    private String output;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ProvisioningRun() {}   // required by JPA

    public ProvisioningRun(UUID id, CloudProvider provider, String clusterId, String clusterName, String region) {
        this.id          = id;
        this.provider    = provider;
        this.clusterId   = clusterId;
        this.clusterName = clusterName;
        this.region      = region;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()          { return id; }
    public CloudProvider getProvider()    { return provider; }
    public String        getClusterId()   { return clusterId; }
    public String        getClusterName() { return clusterName; }
    public String        getRegion()      { return region; }
    public RunState      getState()       { return state; }
    public Instant       getCreatedAt()   { return createdAt; }
    public Instant       getUpdatedAt()   { return updatedAt; }

    public void setState(RunState state)                 { this.state = state; }
    public String getFailedStep()                        { return failedStep; }
    public void setFailedStep(String failedStep)         { this.failedStep = failedStep; }
    public String getErrorMessage()                      { return errorMessage; }
    public void setErrorMessage(String errorMessage)     { this.errorMessage = errorMessage; }
    public int getRollbackFailures()                     { return rollbackFailures; }
    public void setRollbackFailures(int v)               { this.rollbackFailures = v; }
    public String getOutput()                            { return output; }
    public void setOutput(String output)                 { this.output = output; }
    public Instant getStartedAt()                        { return startedAt; }
    public void setStartedAt(Instant startedAt)          { this.startedAt = startedAt; }
    public Instant getFinishedAt()                       { return finishedAt; }
    public void setFinishedAt(Instant finishedAt)        { this.finishedAt = finishedAt; }
}
