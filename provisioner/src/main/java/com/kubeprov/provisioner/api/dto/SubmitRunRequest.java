package com.kubeprov.provisioner.api.dto;

import com.kubeprov.provisioner.step.AwsSettings;
import com.kubeprov.provisioner.step.AzureSettings;

/**
 * Request body for POST /runs.
 *
 * Required: provider, clusterName, plus the settings block of that provider
 *   (aws for "aws", azure for "azure").
 * Optional: clusterId (defaults to a prefix of the run id), region,
 *   timeoutSec (defaults to kubeprov.runs.default-timeout).
 */
public record SubmitRunRequest(String        provider,
                               String        clusterId,
                               String        clusterName,
                               String        region,
                               AwsSettings   aws,
                               AzureSettings azure,
                               Integer       timeoutSec) {
}
