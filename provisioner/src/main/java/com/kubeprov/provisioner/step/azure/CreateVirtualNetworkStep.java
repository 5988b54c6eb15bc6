package com.kubeprov.provisioner.step.azure;

import com.kubeprov.provisioner.step.AzureSettings;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.ProvisionOutputs;
import com.kubeprov.provisioner.step.StepManifest;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/** Creates the cluster virtual network and its single subnet inside the resource group. */
@Component
public class CreateVirtualNetworkStep extends AzureStep {

    public static final String NAME = "azureCreateVNet";

    static final String API_VERSION = "2023-09-01";

    private static final Duration PROVISION_TIMEOUT = Duration.ofMinutes(10);
    private static final Duration DELETE_TIMEOUT = Duration.ofMinutes(10);

    private static final StepManifest MANIFEST = StepManifest.of(
            NAME, "Create the cluster virtual network", CreateResourceGroupStep.NAME);

    public CreateVirtualNetworkStep(AzureManagementClient client) {
        super(client);
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    protected void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        AzureSettings azure = cfg.requireAzure();
        ProvisionOutputs outputs = cfg.outputs();
        String group = outputs.require(AzureOutputs.RESOURCE_GROUP);
        String location = outputs.get(AzureOutputs.LOCATION).orElseGet(() -> location(cfg));
        String vnet = cfg.clusterName() + "-vnet";
        String subnet = cfg.clusterName() + "-subnet";
        String path = path(azure, group, vnet);

        client.putResource(azure, path, API_VERSION, Map.of(
                "location", location,
                "tags", Map.of("KubernetesCluster", cfg.clusterId()),
                "properties", Map.of(
                        "addressSpace", Map.of("addressPrefixes", List.of(azure.vnetCidr())),
                        "subnets", List.of(Map.of(
                                "name", subnet,
                                "properties", Map.of("addressPrefix", azure.vnetCidr()))))));
        outputs.put(NAME, AzureOutputs.VNET_NAME, vnet);
        outputs.put(NAME, AzureOutputs.SUBNET_NAME, subnet);
        out.printf("  created virtual network %s (%s)%n", vnet, azure.vnetCidr());

        awaitSucceeded(ctx, "virtual network " + vnet, PROVISION_TIMEOUT,
                () -> client.getResource(azure, path, API_VERSION)
                        .map(AzureManagementClient::provisioningState)
                        .orElse(null));
    }

    @Override
    protected void doRollback(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        ProvisionOutputs outputs = cfg.outputs();
        String vnet = outputs.get(AzureOutputs.VNET_NAME).orElse(null);
        String group = outputs.get(AzureOutputs.RESOURCE_GROUP).orElse(null);
        if (vnet == null || group == null) {
            outputs.remove(NAME, AzureOutputs.SUBNET_NAME);
            outputs.remove(NAME, AzureOutputs.VNET_NAME);
            return;
        }

        AzureSettings azure = cfg.requireAzure();
        String path = path(azure, group, vnet);
        if (client.deleteResource(azure, path, API_VERSION)) {
            awaitGone(ctx, "virtual network " + vnet, DELETE_TIMEOUT,
                    () -> client.getResource(azure, path, API_VERSION).isPresent());
        }
        outputs.remove(NAME, AzureOutputs.SUBNET_NAME);
        outputs.remove(NAME, AzureOutputs.VNET_NAME);
        out.printf("  deleted virtual network %s%n", vnet);
    }

    static String path(AzureSettings azure, String group, String vnet) {
        return "/subscriptions/" + requireSubscription(azure) + "/resourceGroups/" + group
                + "/providers/Microsoft.Network/virtualNetworks/" + vnet;
    }
}
