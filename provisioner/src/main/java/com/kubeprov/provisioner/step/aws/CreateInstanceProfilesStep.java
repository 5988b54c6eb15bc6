package com.kubeprov.provisioner.step.aws;

import com.amazonaws.services.identitymanagement.AmazonIdentityManagement;
import com.amazonaws.services.identitymanagement.model.AddRoleToInstanceProfileRequest;
import com.amazonaws.services.identitymanagement.model.CreateInstanceProfileRequest;
import com.amazonaws.services.identitymanagement.model.CreateRoleRequest;
import com.amazonaws.services.identitymanagement.model.DeleteInstanceProfileRequest;
import com.amazonaws.services.identitymanagement.model.DeleteRolePolicyRequest;
import com.amazonaws.services.identitymanagement.model.DeleteRoleRequest;
import com.amazonaws.services.identitymanagement.model.NoSuchEntityException;
import com.amazonaws.services.identitymanagement.model.PutRolePolicyRequest;
import com.amazonaws.services.identitymanagement.model.RemoveRoleFromInstanceProfileRequest;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.ProvisionOutputs;
import com.kubeprov.provisioner.step.StepManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;

/**
 * Creates one IAM role and instance profile for masters and one for nodes.
 *
 * Each of the four parts (role, inline policy, profile, membership) is
 * recorded as soon as it exists, so rollback removes exactly what was made.
 */
@Component
public class CreateInstanceProfilesStep extends AwsStep {

    private static final Logger log = LoggerFactory.getLogger(CreateInstanceProfilesStep.class);

    public static final String NAME = "awsCreateInstanceProfiles";

    static final String TRUST_POLICY = """
            {"Version":"2012-10-17","Statement":[{"Effect":"Allow",\
            "Principal":{"Service":"ec2.amazonaws.com"},"Action":"sts:AssumeRole"}]}""";

    static final String MASTERS_POLICY = """
            {"Version":"2012-10-17","Statement":[{"Effect":"Allow",\
            "Action":["ec2:*","elasticloadbalancing:*","ecr:GetAuthorizationToken",\
            "ecr:BatchGetImage","ecr:GetDownloadUrlForLayer"],"Resource":"*"}]}""";

    static final String NODES_POLICY = """
            {"Version":"2012-10-17","Statement":[{"Effect":"Allow",\
            "Action":["ec2:Describe*","ecr:GetAuthorizationToken",\
            "ecr:BatchGetImage","ecr:GetDownloadUrlForLayer"],"Resource":"*"}]}""";

    private static final StepManifest MANIFEST = StepManifest.of(
            NAME, "Create IAM roles and instance profiles for masters and nodes");

    public CreateInstanceProfilesStep(AwsClientFactory clients) {
        super(clients);
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    protected void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        AmazonIdentityManagement iam = clients.iam(cfg);
        try {
            create(iam, cfg, Role.MASTERS);
            ctx.throwIfDone(NAME);
            create(iam, cfg, Role.NODES);
            out.printf("  created instance profiles %s, %s%n",
                    profileName(cfg, Role.MASTERS), profileName(cfg, Role.NODES));
        } finally {
            iam.shutdown();
        }
    }

    @Override
    protected void doRollback(PrintWriter out, ProvisionConfig cfg) {
        ProvisionOutputs outputs = cfg.outputs();
        if (!outputs.contains(Role.MASTERS.roleKey) && !outputs.contains(Role.NODES.roleKey)) return;

        AmazonIdentityManagement iam = clients.iam(cfg);
        try {
            delete(iam, outputs, Role.NODES);
            delete(iam, outputs, Role.MASTERS);
            out.println("  deleted instance profiles");
        } finally {
            iam.shutdown();
        }
    }

    // ------------------------------------------------------------------

    private void create(AmazonIdentityManagement iam, ProvisionConfig cfg, Role role) {
        ProvisionOutputs outputs = cfg.outputs();
        String name = profileName(cfg, role);

        iam.createRole(new CreateRoleRequest()
                .withRoleName(name)
                .withAssumeRolePolicyDocument(TRUST_POLICY));
        outputs.put(NAME, role.roleKey, name);

        iam.putRolePolicy(new PutRolePolicyRequest()
                .withRoleName(name)
                .withPolicyName(name)
                .withPolicyDocument(role.policy));
        outputs.put(NAME, role.policyKey, name);

        iam.createInstanceProfile(new CreateInstanceProfileRequest().withInstanceProfileName(name));
        outputs.put(NAME, role.profileKey, name);

        iam.addRoleToInstanceProfile(new AddRoleToInstanceProfileRequest()
                .withInstanceProfileName(name)
                .withRoleName(name));
        outputs.put(NAME, role.attachedKey, name);
    }

    private void delete(AmazonIdentityManagement iam, ProvisionOutputs outputs, Role role) {
        String attached = outputs.get(role.attachedKey).orElse(null);
        if (attached != null) {
            ignoreMissing(() -> iam.removeRoleFromInstanceProfile(new RemoveRoleFromInstanceProfileRequest()
                    .withInstanceProfileName(attached)
                    .withRoleName(attached)));
            outputs.remove(NAME, role.attachedKey);
        }
        String profile = outputs.get(role.profileKey).orElse(null);
        if (profile != null) {
            ignoreMissing(() -> iam.deleteInstanceProfile(new DeleteInstanceProfileRequest()
                    .withInstanceProfileName(profile)));
            outputs.remove(NAME, role.profileKey);
        }
        String policy = outputs.get(role.policyKey).orElse(null);
        if (policy != null) {
            ignoreMissing(() -> iam.deleteRolePolicy(new DeleteRolePolicyRequest()
                    .withRoleName(policy)
                    .withPolicyName(policy)));
            outputs.remove(NAME, role.policyKey);
        }
        String roleName = outputs.get(role.roleKey).orElse(null);
        if (roleName != null) {
            ignoreMissing(() -> iam.deleteRole(new DeleteRoleRequest().withRoleName(roleName)));
            outputs.remove(NAME, role.roleKey);
        }
    }

    private static void ignoreMissing(Runnable call) {
        try {
            call.run();
        } catch (NoSuchEntityException e) {
            log.debug("IAM entity already gone: {}", e.getErrorMessage());
        }
    }

    /** IAM names are account-wide, so they carry the cluster id as well as its name. */
    static String profileName(ProvisionConfig cfg, Role role) {
        return cfg.clusterName() + "-" + cfg.clusterId() + "-" + role.suffix;
    }

    enum Role {
        MASTERS("masters", MASTERS_POLICY, AwsOutputs.MASTERS_INSTANCE_PROFILE),
        NODES("nodes", NODES_POLICY, AwsOutputs.NODES_INSTANCE_PROFILE);

        final String suffix;
        final String policy;
        final String profileKey;
        final String roleKey;
        final String policyKey;
        final String attachedKey;

        Role(String suffix, String policy, String profileKey) {
            this.suffix      = suffix;
            this.policy      = policy;
            this.profileKey  = profileKey;
            this.roleKey     = "aws." + suffix + "Role";
            this.policyKey   = "aws." + suffix + "RolePolicy";
            this.attachedKey = "aws." + suffix + "RoleAttached";
        }
    }
}
