package com.kubeprov.provisioner.step.aws;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.CreateRouteRequest;
import com.amazonaws.services.ec2.model.CreateRouteTableRequest;
import com.amazonaws.services.ec2.model.DeleteRouteTableRequest;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.ProvisionOutputs;
import com.kubeprov.provisioner.step.StepManifest;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;

/** Creates the cluster route table with a default route through the internet gateway. */
@Component
public class CreateRouteTableStep extends AwsStep {

    public static final String NAME = "awsCreateRouteTable";

    static final String DEFAULT_ROUTE = "0.0.0.0/0";

    private static final StepManifest MANIFEST = StepManifest.of(
            NAME, "Create the route table with a default route",
            CreateVpcStep.NAME, CreateInternetGatewayStep.NAME);

    public CreateRouteTableStep(AwsClientFactory clients) {
        super(clients);
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    protected void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        ProvisionOutputs outputs = cfg.outputs();
        String vpcId = outputs.require(AwsOutputs.VPC_ID);
        String gatewayId = outputs.require(AwsOutputs.INTERNET_GATEWAY_ID);
        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            String routeTableId = ec2.createRouteTable(new CreateRouteTableRequest().withVpcId(vpcId))
                    .getRouteTable().getRouteTableId();
            outputs.put(NAME, AwsOutputs.ROUTE_TABLE_ID, routeTableId);
            tag(ec2, routeTableId, cfg, "rt");

            ec2.createRoute(new CreateRouteRequest()
                    .withRouteTableId(routeTableId)
                    .withDestinationCidrBlock(DEFAULT_ROUTE)
                    .withGatewayId(gatewayId));
            out.printf("  created route table %s via %s%n", routeTableId, gatewayId);
        } finally {
            ec2.shutdown();
        }
    }

    @Override
    protected void doRollback(PrintWriter out, ProvisionConfig cfg) {
        String routeTableId = cfg.outputs().get(AwsOutputs.ROUTE_TABLE_ID).orElse(null);
        if (routeTableId == null) return;

        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            // routes are deleted with the table
            ec2.deleteRouteTable(new DeleteRouteTableRequest().withRouteTableId(routeTableId));
        } catch (AmazonServiceException e) {
            if (!hasErrorCode(e, "InvalidRouteTableID.NotFound")) throw e;
        } finally {
            ec2.shutdown();
        }
        cfg.outputs().remove(NAME, AwsOutputs.ROUTE_TABLE_ID);
        out.printf("  deleted route table %s%n", routeTableId);
    }
}
