package com.kubeprov.provisioner.step;

import com.kubeprov.provisioner.cloud.CloudProvider;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProvisionOutputsTest {

    ProvisionOutputs outputs = new ProvisionOutputs();

    @Test
    void putAndGet_ownerMayOverwriteAndRemove() {
        outputs.put("createVpc", "vpcId", "vpc-1");
        outputs.put("createVpc", "vpcId", "vpc-2");

        assertThat(outputs.get("vpcId")).contains("vpc-2");

        outputs.remove("createVpc", "vpcId");
        assertThat(outputs.contains("vpcId")).isFalse();
        assertThat(outputs.isEmpty()).isTrue();
    }

    @Test
    void otherStep_mayNotOverwriteOrRemove() {
        outputs.put("createVpc", "vpcId", "vpc-1");

        assertThatThrownBy(() -> outputs.put("createSubnets", "vpcId", "vpc-9"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("owned by step 'createVpc'");
        assertThatThrownBy(() -> outputs.remove("createSubnets", "vpcId"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(outputs.get("vpcId")).contains("vpc-1");
    }

    @Test
    void remove_absentKey_isNoOp() {
        outputs.remove("anyStep", "missing");

        assertThat(outputs.isEmpty()).isTrue();
    }

    @Test
    void lists_appendAndRead() {
        outputs.append("createSubnets", "subnetIds", "subnet-a");
        outputs.append("createSubnets", "subnetIds", "subnet-b");

        assertThat(outputs.getList("subnetIds")).containsExactly("subnet-a", "subnet-b");
        assertThat(outputs.getList("missing")).isEmpty();
    }

    @Test
    void require_missingKey_isConfigurationError() {
        assertThatThrownBy(() -> outputs.require("aws.vpcId"))
                .isInstanceOf(StepException.class)
                .hasMessageContaining("aws.vpcId")
                .satisfies(e -> assertThat(((StepException) e).getKind())
                        .isEqualTo(StepException.Kind.CONFIGURATION));
    }

    @Test
    void snapshot_isImmutableCopy() {
        outputs.put("createVpc", "vpcId", "vpc-1");

        var snapshot = outputs.snapshot();
        outputs.put("createVpc", "vpcId", "vpc-2");

        assertThat(snapshot).containsEntry("vpcId", "vpc-1");
        assertThatThrownBy(() -> snapshot.put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void config_defaultsClusterIdFromRunId_andValidatesProviderSettings() {
        UUID runId = UUID.fromString("12345678-aaaa-bbbb-cccc-1234567890ab");
        ProvisionConfig cfg = new ProvisionConfig(runId, CloudProvider.GCE, null, "demo", "us-central1", null, null);

        assertThat(cfg.clusterId()).isEqualTo("12345678");
        assertThatThrownBy(() -> new ProvisionConfig(runId, CloudProvider.AWS, null, "demo", "us-east-1", null, null))
                .isInstanceOf(StepException.class)
                .hasMessageContaining("aws settings are required");
        assertThatThrownBy(() -> new ProvisionConfig(runId, CloudProvider.AZURE, null, " ", null, null,
                new AzureSettings("t", "c", "s", "sub", "westeurope", null)))
                .hasMessageContaining("clusterName is required");
    }

    @Test
    void settings_toStringHidesSecrets() {
        AwsSettings aws = new AwsSettings("AKIA", "top-secret", List.of(), null, null, null, null, null);
        AzureSettings azure = new AzureSettings("t", "c", "also-secret", "sub", null, null);

        assertThat(aws.toString()).doesNotContain("top-secret");
        assertThat(aws.vpcCidr()).isEqualTo(AwsSettings.DEFAULT_VPC_CIDR);
        assertThat(azure.toString()).doesNotContain("also-secret");
        assertThat(azure.vnetCidr()).isEqualTo(AzureSettings.DEFAULT_VNET_CIDR);
    }
}
