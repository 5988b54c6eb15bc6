package com.kubeprov.provisioner.step.azure;

import com.kubeprov.provisioner.step.AzureSettings;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.ProvisionOutputs;
import com.kubeprov.provisioner.step.StepManifest;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.Map;

/**
 * Creates the resource group holding every Azure resource of the cluster.
 *
 * A group that already exists is adopted and left in place on rollback;
 * only a group this step created is deleted.
 */
@Component
public class CreateResourceGroupStep extends AzureStep {

    public static final String NAME = "azureCreateGroup";

    static final String API_VERSION = "2021-04-01";

    // Present only when this step created the group itself.
    static final String GROUP_CREATED = "azure.resourceGroupCreated";

    private static final Duration PROVISION_TIMEOUT = Duration.ofMinutes(5);
    private static final Duration DELETE_TIMEOUT = Duration.ofMinutes(30);

    private static final StepManifest MANIFEST = StepManifest.of(
            NAME, "Create the cluster resource group");

    public CreateResourceGroupStep(AzureManagementClient client) {
        super(client);
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    protected void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        AzureSettings azure = cfg.requireAzure();
        ProvisionOutputs outputs = cfg.outputs();
        String group = groupName(cfg);
        String location = location(cfg);
        String path = path(azure, group);

        boolean existed = client.getResource(azure, path, API_VERSION).isPresent();
        client.putResource(azure, path, API_VERSION, Map.of(
                "location", location,
                "tags", Map.of("KubernetesCluster", cfg.clusterId())));
        outputs.put(NAME, AzureOutputs.RESOURCE_GROUP, group);
        outputs.put(NAME, AzureOutputs.LOCATION, location);
        if (!existed) {
            outputs.put(NAME, GROUP_CREATED, "true");
        }
        out.printf("  %s resource group %s in %s%n", existed ? "reusing" : "created", group, location);

        awaitSucceeded(ctx, "resource group " + group, PROVISION_TIMEOUT,
                () -> client.getResource(azure, path, API_VERSION)
                        .map(AzureManagementClient::provisioningState)
                        .orElse(null));
    }

    @Override
    protected void doRollback(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        ProvisionOutputs outputs = cfg.outputs();
        String group = outputs.get(AzureOutputs.RESOURCE_GROUP).orElse(null);
        if (group == null) return;

        if (outputs.contains(GROUP_CREATED)) {
            AzureSettings azure = cfg.requireAzure();
            String path = path(azure, group);
            if (client.deleteResource(azure, path, API_VERSION)) {
                awaitGone(ctx, "resource group " + group, DELETE_TIMEOUT,
                        () -> client.getResource(azure, path, API_VERSION).isPresent());
            }
            out.printf("  deleted resource group %s%n", group);
        }
        outputs.remove(NAME, GROUP_CREATED);
        outputs.remove(NAME, AzureOutputs.LOCATION);
        outputs.remove(NAME, AzureOutputs.RESOURCE_GROUP);
    }

    static String groupName(ProvisionConfig cfg) {
        return cfg.clusterName() + "-" + cfg.clusterId();
    }

    static String path(AzureSettings azure, String group) {
        return "/subscriptions/" + requireSubscription(azure) + "/resourcegroups/" + group;
    }
}
