package com.kubeprov.provisioner.step.aws;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.AttachInternetGatewayRequest;
import com.amazonaws.services.ec2.model.CreateInternetGatewayRequest;
import com.amazonaws.services.ec2.model.DeleteInternetGatewayRequest;
import com.amazonaws.services.ec2.model.DetachInternetGatewayRequest;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.ProvisionOutputs;
import com.kubeprov.provisioner.step.StepManifest;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;

/** Creates an internet gateway and attaches it to the cluster VPC. */
@Component
public class CreateInternetGatewayStep extends AwsStep {

    public static final String NAME = "awsCreateInternetGateway";

    // VPC the gateway was attached to, present once the attach succeeded.
    static final String ATTACHED_VPC = "aws.internetGatewayVpcId";

    private static final StepManifest MANIFEST = StepManifest.of(
            NAME, "Create and attach the VPC internet gateway", CreateVpcStep.NAME);

    public CreateInternetGatewayStep(AwsClientFactory clients) {
        super(clients);
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    protected void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        ProvisionOutputs outputs = cfg.outputs();
        String vpcId = outputs.require(AwsOutputs.VPC_ID);
        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            String gatewayId = ec2.createInternetGateway(new CreateInternetGatewayRequest())
                    .getInternetGateway().getInternetGatewayId();
            outputs.put(NAME, AwsOutputs.INTERNET_GATEWAY_ID, gatewayId);
            tag(ec2, gatewayId, cfg, "igw");

            ec2.attachInternetGateway(new AttachInternetGatewayRequest()
                    .withInternetGatewayId(gatewayId)
                    .withVpcId(vpcId));
            outputs.put(NAME, ATTACHED_VPC, vpcId);
            out.printf("  attached internet gateway %s to %s%n", gatewayId, vpcId);
        } finally {
            ec2.shutdown();
        }
    }

    @Override
    protected void doRollback(PrintWriter out, ProvisionConfig cfg) {
        ProvisionOutputs outputs = cfg.outputs();
        String gatewayId = outputs.get(AwsOutputs.INTERNET_GATEWAY_ID).orElse(null);
        if (gatewayId == null) return;

        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            String vpcId = outputs.get(ATTACHED_VPC).orElse(null);
            if (vpcId != null) {
                try {
                    ec2.detachInternetGateway(new DetachInternetGatewayRequest()
                            .withInternetGatewayId(gatewayId)
                            .withVpcId(vpcId));
                } catch (AmazonServiceException e) {
                    if (!hasErrorCode(e, "Gateway.NotAttached", "InvalidInternetGatewayID.NotFound")) throw e;
                }
                outputs.remove(NAME, ATTACHED_VPC);
            }
            try {
                ec2.deleteInternetGateway(new DeleteInternetGatewayRequest().withInternetGatewayId(gatewayId));
            } catch (AmazonServiceException e) {
                if (!hasErrorCode(e, "InvalidInternetGatewayID.NotFound")) throw e;
            }
            outputs.remove(NAME, AwsOutputs.INTERNET_GATEWAY_ID);
            out.printf("  deleted internet gateway %s%n", gatewayId);
        } finally {
            ec2.shutdown();
        }
    }
}
