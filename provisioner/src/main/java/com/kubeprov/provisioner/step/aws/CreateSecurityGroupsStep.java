package com.kubeprov.provisioner.step.aws;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.AuthorizeSecurityGroupIngressRequest;
import com.amazonaws.services.ec2.model.CreateSecurityGroupRequest;
import com.amazonaws.services.ec2.model.DeleteSecurityGroupRequest;
import com.amazonaws.services.ec2.model.IpPermission;
import com.amazonaws.services.ec2.model.IpRange;
import com.amazonaws.services.ec2.model.RevokeSecurityGroupIngressRequest;
import com.amazonaws.services.ec2.model.UserIdGroupPair;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.ProvisionOutputs;
import com.kubeprov.provisioner.step.StepManifest;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;

/**
 * Creates the masters and nodes security groups.
 *
 * Both accept SSH from anywhere, masters also accept the API server port,
 * and the two groups accept all traffic from each other. The cross-group
 * rules reference each other, so rollback revokes them before deleting.
 */
@Component
public class CreateSecurityGroupsStep extends AwsStep {

    public static final String NAME = "awsCreateSecurityGroups";

    static final String ANYWHERE = "0.0.0.0/0";
    static final int SSH_PORT = 22;
    static final int API_PORT = 443;

    private static final StepManifest MANIFEST = StepManifest.of(
            NAME, "Create masters and nodes security groups", CreateVpcStep.NAME);

    public CreateSecurityGroupsStep(AwsClientFactory clients) {
        super(clients);
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    protected void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        ProvisionOutputs outputs = cfg.outputs();
        String vpcId = outputs.require(AwsOutputs.VPC_ID);
        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            String masters = createGroup(ec2, cfg, vpcId, "masters", AwsOutputs.MASTERS_SECURITY_GROUP);
            String nodes = createGroup(ec2, cfg, vpcId, "nodes", AwsOutputs.NODES_SECURITY_GROUP);
            out.printf("  created security groups masters=%s nodes=%s%n", masters, nodes);

            ctx.throwIfDone(NAME);
            ec2.authorizeSecurityGroupIngress(new AuthorizeSecurityGroupIngressRequest()
                    .withGroupId(masters)
                    .withIpPermissions(
                            publicPort(SSH_PORT),
                            publicPort(API_PORT),
                            fromGroup(nodes)));
            ec2.authorizeSecurityGroupIngress(new AuthorizeSecurityGroupIngressRequest()
                    .withGroupId(nodes)
                    .withIpPermissions(
                            publicPort(SSH_PORT),
                            fromGroup(masters)));
        } finally {
            ec2.shutdown();
        }
    }

    @Override
    protected void doRollback(PrintWriter out, ProvisionConfig cfg) {
        ProvisionOutputs outputs = cfg.outputs();
        String masters = outputs.get(AwsOutputs.MASTERS_SECURITY_GROUP).orElse(null);
        String nodes = outputs.get(AwsOutputs.NODES_SECURITY_GROUP).orElse(null);
        if (masters == null && nodes == null) return;

        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            if (masters != null && nodes != null) {
                revoke(ec2, masters, nodes);
                revoke(ec2, nodes, masters);
            }
            if (nodes != null) {
                delete(ec2, nodes);
                outputs.remove(NAME, AwsOutputs.NODES_SECURITY_GROUP);
            }
            if (masters != null) {
                delete(ec2, masters);
                outputs.remove(NAME, AwsOutputs.MASTERS_SECURITY_GROUP);
            }
            out.println("  deleted security groups");
        } finally {
            ec2.shutdown();
        }
    }

    /** Create one group and record it under {@code outputKey} before anything else can fail. */
    private String createGroup(AmazonEC2 ec2, ProvisionConfig cfg, String vpcId, String role, String outputKey) {
        String groupId = ec2.createSecurityGroup(new CreateSecurityGroupRequest()
                .withGroupName(cfg.clusterName() + "-" + role)
                .withDescription("Kubernetes " + role + " of cluster " + cfg.clusterName())
                .withVpcId(vpcId))
                .getGroupId();
        cfg.outputs().put(NAME, outputKey, groupId);
        tag(ec2, groupId, cfg, role);
        return groupId;
    }

    private static void revoke(AmazonEC2 ec2, String groupId, String sourceGroupId) {
        try {
            ec2.revokeSecurityGroupIngress(new RevokeSecurityGroupIngressRequest()
                    .withGroupId(groupId)
                    .withIpPermissions(fromGroup(sourceGroupId)));
        } catch (AmazonServiceException e) {
            if (!hasErrorCode(e, "InvalidPermission.NotFound", "InvalidGroup.NotFound")) throw e;
        }
    }

    private static void delete(AmazonEC2 ec2, String groupId) {
        try {
            ec2.deleteSecurityGroup(new DeleteSecurityGroupRequest().withGroupId(groupId));
        } catch (AmazonServiceException e) {
            if (!hasErrorCode(e, "InvalidGroup.NotFound")) throw e;
        }
    }

    static IpPermission publicPort(int port) {
        return new IpPermission()
                .withIpProtocol("tcp")
                .withFromPort(port)
                .withToPort(port)
                .withIpv4Ranges(new IpRange().withCidrIp(ANYWHERE));
    }

    static IpPermission fromGroup(String groupId) {
        return new IpPermission()
                .withIpProtocol("-1")
                .withUserIdGroupPairs(new UserIdGroupPair().withGroupId(groupId));
    }
}
