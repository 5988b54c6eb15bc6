package com.kubeprov.provisioner.step.aws;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.CreateVpcRequest;
import com.amazonaws.services.ec2.model.DeleteVpcRequest;
import com.amazonaws.services.ec2.model.DescribeVpcsRequest;
import com.amazonaws.services.ec2.model.ModifyVpcAttributeRequest;
import com.kubeprov.provisioner.step.AwsSettings;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.ProvisionOutputs;
import com.kubeprov.provisioner.step.StepManifest;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.time.Duration;

/**
 * Creates the cluster VPC, or adopts an existing one when
 * {@link AwsSettings#vpcId()} is set. An adopted VPC is never deleted.
 */
@Component
public class CreateVpcStep extends AwsStep {

    public static final String NAME = "awsCreateVPC";

    // Present only when this step created the VPC itself.
    static final String VPC_CREATED = "aws.vpcCreated";

    private static final Duration AVAILABLE_TIMEOUT = Duration.ofMinutes(5);

    private static final StepManifest MANIFEST = StepManifest.of(
            NAME, "Create the cluster VPC");

    public CreateVpcStep(AwsClientFactory clients) {
        super(clients);
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    protected void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        AwsSettings aws = cfg.requireAws();
        ProvisionOutputs outputs = cfg.outputs();
        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            if (aws.vpcId() != null && !aws.vpcId().isBlank()) {
                String state = vpcState(ec2, aws.vpcId());
                outputs.put(NAME, AwsOutputs.VPC_ID, aws.vpcId());
                out.printf("  reusing VPC %s (%s)%n", aws.vpcId(), state);
                return;
            }

            String vpcId = ec2.createVpc(new CreateVpcRequest().withCidrBlock(aws.vpcCidr()))
                    .getVpc().getVpcId();
            outputs.put(NAME, AwsOutputs.VPC_ID, vpcId);
            outputs.put(NAME, VPC_CREATED, "true");
            out.printf("  created VPC %s (%s)%n", vpcId, aws.vpcCidr());

            awaitState(ctx, "VPC " + vpcId, AVAILABLE_TIMEOUT, () -> vpcState(ec2, vpcId), "available");
            ec2.modifyVpcAttribute(new ModifyVpcAttributeRequest()
                    .withVpcId(vpcId)
                    .withEnableDnsSupport(true));
            ec2.modifyVpcAttribute(new ModifyVpcAttributeRequest()
                    .withVpcId(vpcId)
                    .withEnableDnsHostnames(true));
            tag(ec2, vpcId, cfg, "vpc");
        } finally {
            ec2.shutdown();
        }
    }

    @Override
    protected void doRollback(PrintWriter out, ProvisionConfig cfg) {
        ProvisionOutputs outputs = cfg.outputs();
        String vpcId = outputs.get(AwsOutputs.VPC_ID).orElse(null);
        if (vpcId == null) return;

        if (outputs.contains(VPC_CREATED)) {
            AmazonEC2 ec2 = clients.ec2(cfg);
            try {
                ec2.deleteVpc(new DeleteVpcRequest().withVpcId(vpcId));
                out.printf("  deleted VPC %s%n", vpcId);
            } catch (AmazonServiceException e) {
                if (!hasErrorCode(e, "InvalidVpcID.NotFound")) throw e;
            } finally {
                ec2.shutdown();
            }
        }
        outputs.remove(NAME, VPC_CREATED);
        outputs.remove(NAME, AwsOutputs.VPC_ID);
    }

    private static String vpcState(AmazonEC2 ec2, String vpcId) {
        return ec2.describeVpcs(new DescribeVpcsRequest().withVpcIds(vpcId))
                .getVpcs().get(0).getState();
    }
}
