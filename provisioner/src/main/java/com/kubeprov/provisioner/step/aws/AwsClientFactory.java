package com.kubeprov.provisioner.step.aws;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.AmazonEC2ClientBuilder;
import com.amazonaws.services.identitymanagement.AmazonIdentityManagement;
import com.amazonaws.services.identitymanagement.AmazonIdentityManagementClientBuilder;
import com.kubeprov.provisioner.step.AwsSettings;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.StepException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds AWS SDK clients for a run from that run's credentials and region.
 *
 * Steps are shared by every run, so they hold this factory instead of a
 * client and build (then shut down) a client per invocation.
 */
@Component
public class AwsClientFactory {

    private final Duration pollInterval;

    public AwsClientFactory(@Value("${kubeprov.aws.poll-interval:PT5S}") Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    /** How long steps wait between polls of an eventually-consistent resource. */
    public Duration pollInterval() { return pollInterval; }

    public AmazonEC2 ec2(ProvisionConfig cfg) {
        return AmazonEC2ClientBuilder.standard()
                .withCredentials(credentials(cfg.requireAws()))
                .withRegion(requireRegion(cfg))
                .build();
    }

    public AmazonIdentityManagement iam(ProvisionConfig cfg) {
        return AmazonIdentityManagementClientBuilder.standard()
                .withCredentials(credentials(cfg.requireAws()))
                .withRegion(requireRegion(cfg))
                .build();
    }

    private static AWSCredentialsProvider credentials(AwsSettings aws) {
        if (!aws.hasStaticCredentials()) {
            return DefaultAWSCredentialsProviderChain.getInstance();
        }
        return new AWSStaticCredentialsProvider(
                new BasicAWSCredentials(aws.accessKeyId(), aws.secretAccessKey()));
    }

    private static String requireRegion(ProvisionConfig cfg) {
        if (cfg.region() == null || cfg.region().isBlank()) {
            throw new StepException(StepException.Kind.CONFIGURATION, "aws: region is required");
        }
        return cfg.region();
    }
}
