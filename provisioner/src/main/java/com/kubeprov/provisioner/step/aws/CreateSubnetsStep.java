package com.kubeprov.provisioner.step.aws;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.AvailabilityZone;
import com.amazonaws.services.ec2.model.CreateSubnetRequest;
import com.amazonaws.services.ec2.model.DeleteSubnetRequest;
import com.amazonaws.services.ec2.model.DescribeAvailabilityZonesRequest;
import com.amazonaws.services.ec2.model.DescribeVpcsRequest;
import com.amazonaws.services.ec2.model.Filter;
import com.amazonaws.services.ec2.model.ModifySubnetAttributeRequest;
import com.kubeprov.provisioner.step.AwsSettings;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.ProvisionOutputs;
import com.kubeprov.provisioner.step.StepException;
import com.kubeprov.provisioner.step.StepManifest;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.util.List;

/**
 * Creates one public subnet per availability zone, using the configured zones
 * or every zone the region reports as available.
 */
@Component
public class CreateSubnetsStep extends AwsStep {

    public static final String NAME = "awsCreateSubnets";

    private static final StepManifest MANIFEST = StepManifest.of(
            NAME, "Create one subnet per availability zone", CreateVpcStep.NAME);

    public CreateSubnetsStep(AwsClientFactory clients) {
        super(clients);
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    protected void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        AwsSettings aws = cfg.requireAws();
        ProvisionOutputs outputs = cfg.outputs();
        String vpcId = outputs.require(AwsOutputs.VPC_ID);
        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            List<String> zones = aws.availabilityZones().isEmpty() ? availableZones(ec2) : aws.availabilityZones();
            if (zones.isEmpty()) {
                throw new StepException(StepException.Kind.EXECUTION, NAME,
                        NAME + ": no availability zones in region " + cfg.region(), null);
            }
            String vpcCidr = ec2.describeVpcs(new DescribeVpcsRequest().withVpcIds(vpcId))
                    .getVpcs().get(0).getCidrBlock();
            List<String> cidrs = SubnetPlanner.plan(vpcCidr, zones.size());

            for (int i = 0; i < zones.size(); i++) {
                ctx.throwIfDone(NAME);
                String subnetId = ec2.createSubnet(new CreateSubnetRequest()
                        .withVpcId(vpcId)
                        .withCidrBlock(cidrs.get(i))
                        .withAvailabilityZone(zones.get(i)))
                        .getSubnet().getSubnetId();
                outputs.append(NAME, AwsOutputs.SUBNET_IDS, subnetId);
                outputs.append(NAME, AwsOutputs.SUBNET_ZONES, zones.get(i));

                tag(ec2, subnetId, cfg, "subnet-" + zones.get(i));
                ec2.modifySubnetAttribute(new ModifySubnetAttributeRequest()
                        .withSubnetId(subnetId)
                        .withMapPublicIpOnLaunch(true));
                out.printf("  created subnet %s %s in %s%n", subnetId, cidrs.get(i), zones.get(i));
            }
        } finally {
            ec2.shutdown();
        }
    }

    @Override
    protected void doRollback(PrintWriter out, ProvisionConfig cfg) {
        ProvisionOutputs outputs = cfg.outputs();
        List<String> subnetIds = outputs.getList(AwsOutputs.SUBNET_IDS);
        if (subnetIds.isEmpty()) {
            outputs.remove(NAME, AwsOutputs.SUBNET_ZONES);
            return;
        }

        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            for (String subnetId : subnetIds) {
                try {
                    ec2.deleteSubnet(new DeleteSubnetRequest().withSubnetId(subnetId));
                } catch (AmazonServiceException e) {
                    if (!hasErrorCode(e, "InvalidSubnetID.NotFound")) throw e;
                }
                out.printf("  deleted subnet %s%n", subnetId);
            }
            outputs.remove(NAME, AwsOutputs.SUBNET_IDS);
            outputs.remove(NAME, AwsOutputs.SUBNET_ZONES);
        } finally {
            ec2.shutdown();
        }
    }

    private static List<String> availableZones(AmazonEC2 ec2) {
        return ec2.describeAvailabilityZones(new DescribeAvailabilityZonesRequest()
                        .withFilters(new Filter("state", List.of("available"))))
                .getAvailabilityZones().stream()
                .map(AvailabilityZone::getZoneName)
                .sorted()
                .toList();
    }
}
