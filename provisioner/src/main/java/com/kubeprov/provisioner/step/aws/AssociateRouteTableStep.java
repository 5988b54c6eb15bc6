package com.kubeprov.provisioner.step.aws;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.AssociateRouteTableRequest;
import com.amazonaws.services.ec2.model.DisassociateRouteTableRequest;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.ProvisionOutputs;
import com.kubeprov.provisioner.step.StepManifest;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.util.List;

/** Associates every cluster subnet with the cluster route table. */
@Component
public class AssociateRouteTableStep extends AwsStep {

    public static final String NAME = "awsAssociateRouteTable";

    private static final StepManifest MANIFEST = StepManifest.of(
            NAME, "Associate the subnets with the route table",
            CreateSubnetsStep.NAME, CreateRouteTableStep.NAME);

    public AssociateRouteTableStep(AwsClientFactory clients) {
        super(clients);
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    protected void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        ProvisionOutputs outputs = cfg.outputs();
        String routeTableId = outputs.require(AwsOutputs.ROUTE_TABLE_ID);
        outputs.require(AwsOutputs.SUBNET_IDS);
        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            for (String subnetId : outputs.getList(AwsOutputs.SUBNET_IDS)) {
                ctx.throwIfDone(NAME);
                String associationId = ec2.associateRouteTable(new AssociateRouteTableRequest()
                        .withRouteTableId(routeTableId)
                        .withSubnetId(subnetId))
                        .getAssociationId();
                outputs.append(NAME, AwsOutputs.ROUTE_TABLE_ASSOCIATIONS, associationId);
                out.printf("  associated %s with %s%n", subnetId, routeTableId);
            }
        } finally {
            ec2.shutdown();
        }
    }

    @Override
    protected void doRollback(PrintWriter out, ProvisionConfig cfg) {
        List<String> associations = cfg.outputs().getList(AwsOutputs.ROUTE_TABLE_ASSOCIATIONS);
        if (associations.isEmpty()) return;

        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            for (String associationId : associations) {
                try {
                    ec2.disassociateRouteTable(new DisassociateRouteTableRequest().withAssociationId(associationId));
                } catch (AmazonServiceException e) {
                    if (!hasErrorCode(e, "InvalidAssociationID.NotFound")) throw e;
                }
            }
            cfg.outputs().remove(NAME, AwsOutputs.ROUTE_TABLE_ASSOCIATIONS);
            out.printf("  disassociated %d subnet(s)%n", associations.size());
        } finally {
            ec2.shutdown();
        }
    }
}
