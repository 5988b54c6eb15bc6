package com.kubeprov.provisioner.pipeline;

import com.kubeprov.provisioner.cloud.CloudProvider;
import com.kubeprov.provisioner.step.StepException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineCatalogTest {

    PipelineCatalog catalog = PipelineCatalog.preProvision();

    @Test
    void aws_hasFixedNetworkFirstOrder() {
        Pipeline pipeline = catalog.pipelineFor(CloudProvider.AWS);

        assertThat(pipeline.name()).isEqualTo("preProvision");
        assertThat(pipeline.steps()).containsExactly(
                "awsFindAMI",
                "awsCreateVPC",
                "awsCreateSecurityGroups",
                "awsCreateInstanceProfiles",
                "awsImportKeyPair",
                "awsCreateInternetGateway",
                "awsCreateSubnets",
                "awsCreateRouteTable",
                "awsAssociateRouteTable");
    }

    @Test
    void azure_createsGroupThenVnet() {
        assertThat(catalog.pipelineFor(CloudProvider.AZURE).steps())
                .containsExactly("azureCreateGroup", "azureCreateVNet");
    }

    @Test
    void gceAndDigitalOcean_haveEmptyPipelines() {
        assertThat(catalog.pipelineFor(CloudProvider.GCE).isEmpty()).isTrue();
        assertThat(catalog.pipelineFor(CloudProvider.DIGITALOCEAN).isEmpty()).isTrue();
    }

    @Test
    void everyProviderIsCovered() {
        assertThat(catalog.providers()).containsExactlyInAnyOrder(CloudProvider.values());
    }

    @Test
    void pipelineFor_providerId_isCaseInsensitive() {
        assertThat(catalog.pipelineFor(" AWS ").steps()).hasSize(9);
    }

    @Test
    void pipelineFor_unknownProvider_isConfigurationError() {
        assertThatThrownBy(() -> catalog.pipelineFor("openstack"))
                .isInstanceOf(StepException.class)
                .hasMessageContaining("preProvision: unknown provider: openstack")
                .satisfies(e -> assertThat(((StepException) e).getKind())
                        .isEqualTo(StepException.Kind.CONFIGURATION));
    }

    @Test
    void constructor_missingProvider_rejected() {
        assertThatThrownBy(() -> new PipelineCatalog("partial", Map.of(CloudProvider.AWS, List.of("a"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("AZURE");
    }
}
