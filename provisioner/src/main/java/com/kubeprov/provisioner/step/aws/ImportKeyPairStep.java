package com.kubeprov.provisioner.step.aws;

import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.DeleteKeyPairRequest;
import com.amazonaws.services.ec2.model.ImportKeyPairRequest;
import com.kubeprov.provisioner.step.AwsSettings;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.StepException;
import com.kubeprov.provisioner.step.StepManifest;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;

/** Imports the operator's SSH public key as the cluster's bootstrap key pair. */
@Component
public class ImportKeyPairStep extends AwsStep {

    public static final String NAME = "awsImportKeyPair";

    private static final StepManifest MANIFEST = StepManifest.of(
            NAME, "Import the SSH key pair used to reach cluster nodes");

    public ImportKeyPairStep(AwsClientFactory clients) {
        super(clients);
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    protected void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        AwsSettings aws = cfg.requireAws();
        if (aws.publicKey() == null || aws.publicKey().isBlank()) {
            throw new StepException(StepException.Kind.CONFIGURATION, NAME,
                    NAME + ": a public key is required", null);
        }
        String keyName = keyName(cfg);
        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            ec2.importKeyPair(new ImportKeyPairRequest(keyName, aws.publicKey().trim()));
            cfg.outputs().put(NAME, AwsOutputs.KEY_PAIR_NAME, keyName);
            out.printf("  imported key pair %s%n", keyName);
        } finally {
            ec2.shutdown();
        }
    }

    @Override
    protected void doRollback(PrintWriter out, ProvisionConfig cfg) {
        String keyName = cfg.outputs().get(AwsOutputs.KEY_PAIR_NAME).orElse(null);
        if (keyName == null) return;

        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            // DeleteKeyPair succeeds for a key that no longer exists
            ec2.deleteKeyPair(new DeleteKeyPairRequest().withKeyName(keyName));
            cfg.outputs().remove(NAME, AwsOutputs.KEY_PAIR_NAME);
            out.printf("  deleted key pair %s%n", keyName);
        } finally {
            ec2.shutdown();
        }
    }

    static String keyName(ProvisionConfig cfg) {
        String configured = cfg.requireAws().keyPairName();
        return configured == null || configured.isBlank() ? cfg.clusterName() + "-key" : configured;
    }
}
