package com.kubeprov.provisioner.step;

import com.kubeprov.provisioner.cloud.CloudProvider;

import java.util.UUID;

/**
 * The single piece of mutable state threaded through a provisioning run.
 *
 * Identity and provider settings are fixed at construction; steps
 * communicate through {@link #outputs()}. One instance per run, owned by
 * that run's worker thread, never shared, no locking.
 */
public class ProvisionConfig {

    private final UUID             runId;
    private final CloudProvider    provider;
    private final String           clusterId;
    private final String           clusterName;
    private final String           region;
    private final AwsSettings      aws;
    private final AzureSettings    azure;
    private final ProvisionOutputs outputs = new ProvisionOutputs();

    /**
     * @throws StepException CONFIGURATION when the provider is missing, the cluster
     *                       has no name, or the provider's settings block is absent
     */
    public ProvisionConfig(UUID runId,
                           CloudProvider provider,
                           String clusterId,
                           String clusterName,
                           String region,
                           AwsSettings aws,
                           AzureSettings azure) {
        if (provider == null) {
            throw configError("provider is required");
        }
        if (clusterName == null || clusterName.isBlank()) {
            throw configError("clusterName is required");
        }
        if (provider == CloudProvider.AWS && aws == null) {
            throw configError("aws settings are required for provider 'aws'");
        }
        if (provider == CloudProvider.AZURE && azure == null) {
            throw configError("azure settings are required for provider 'azure'");
        }
        this.runId       = runId == null ? UUID.randomUUID() : runId;
        this.provider    = provider;
        this.clusterId   = clusterId == null || clusterId.isBlank()
                ? this.runId.toString().substring(0, 8) : clusterId;
        this.clusterName = clusterName;
        this.region      = region;
        this.aws         = aws;
        this.azure       = azure;
    }

    public UUID             runId()       { return runId; }
    public CloudProvider    provider()    { return provider; }
    public String           clusterId()   { return clusterId; }
    public String           clusterName() { return clusterName; }
    public String           region()      { return region; }
    public ProvisionOutputs outputs()     { return outputs; }

    public AwsSettings requireAws() {
        if (aws == null) throw configError("aws settings are not present on this run");
        return aws;
    }

    public AzureSettings requireAzure() {
        if (azure == null) throw configError("azure settings are not present on this run");
        return azure;
    }

    @Override
    public String toString() {
        return "ProvisionConfig[runId=" + runId + ", provider=" + provider.id()
                + ", cluster=" + clusterName + "/" + clusterId + ", region=" + region + "]";
    }

    private static StepException configError(String message) {
        return new StepException(StepException.Kind.CONFIGURATION, message);
    }
}
