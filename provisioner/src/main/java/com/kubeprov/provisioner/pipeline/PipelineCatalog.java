package com.kubeprov.provisioner.pipeline;

import com.kubeprov.provisioner.cloud.CloudProvider;
import com.kubeprov.provisioner.step.StepException;
import com.kubeprov.provisioner.step.aws.AssociateRouteTableStep;
import com.kubeprov.provisioner.step.aws.CreateInstanceProfilesStep;
import com.kubeprov.provisioner.step.aws.CreateInternetGatewayStep;
import com.kubeprov.provisioner.step.aws.CreateRouteTableStep;
import com.kubeprov.provisioner.step.aws.CreateSecurityGroupsStep;
import com.kubeprov.provisioner.step.aws.CreateSubnetsStep;
import com.kubeprov.provisioner.step.aws.CreateVpcStep;
import com.kubeprov.provisioner.step.aws.FindAmiStep;
import com.kubeprov.provisioner.step.aws.ImportKeyPairStep;
import com.kubeprov.provisioner.step.azure.CreateResourceGroupStep;
import com.kubeprov.provisioner.step.azure.CreateVirtualNetworkStep;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed per-provider step order for one stage.
 *
 * The order encodes real infrastructure dependencies (the VPC before its
 * subnets, subnets and route table before the association) and is kept
 * exactly as written here; it is not derived from
 * {@link com.kubeprov.provisioner.step.StepManifest#depends()}.
 *
 * <p>The table must cover every {@link CloudProvider}: construction fails
 * otherwise. A provider with no steps yet maps to an empty list, which runs
 * as a successful no-op.
 */
public class PipelineCatalog {

    public static final String PRE_PROVISION = "preProvision";

    private final String                            stage;
    private final Map<CloudProvider, List<String>>  table;

    public PipelineCatalog(String stage, Map<CloudProvider, List<String>> table) {
        EnumMap<CloudProvider, List<String>> copy = new EnumMap<>(CloudProvider.class);
        table.forEach((provider, steps) -> copy.put(provider, List.copyOf(steps)));
        List<CloudProvider> missing = Arrays.stream(CloudProvider.values())
                .filter(p -> !copy.containsKey(p))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "pipeline catalog '" + stage + "' has no entry for providers " + missing);
        }
        this.stage = stage;
        this.table = Collections.unmodifiableMap(copy);
    }

    /** The pre-provisioning catalog: network and identity prerequisites per provider. */
    public static PipelineCatalog preProvision() {
        Map<CloudProvider, List<String>> table = new EnumMap<>(CloudProvider.class);
        table.put(CloudProvider.AWS, List.of(
                FindAmiStep.NAME,
                CreateVpcStep.NAME,
                CreateSecurityGroupsStep.NAME,
                CreateInstanceProfilesStep.NAME,
                ImportKeyPairStep.NAME,
                CreateInternetGatewayStep.NAME,
                CreateSubnetsStep.NAME,
                CreateRouteTableStep.NAME,
                AssociateRouteTableStep.NAME));
        table.put(CloudProvider.AZURE, List.of(
                CreateResourceGroupStep.NAME,
                CreateVirtualNetworkStep.NAME));
        table.put(CloudProvider.GCE, List.of());
        table.put(CloudProvider.DIGITALOCEAN, List.of());
        return new PipelineCatalog(PRE_PROVISION, table);
    }

    public String stage() { return stage; }

    public Set<CloudProvider> providers() { return table.keySet(); }

    public Pipeline pipelineFor(CloudProvider provider) {
        return new Pipeline(stage, table.get(provider));
    }

    /**
     * @throws StepException CONFIGURATION for an identifier outside the known provider set
     */
    public Pipeline pipelineFor(String providerId) {
        return CloudProvider.fromId(providerId)
                .map(this::pipelineFor)
                .orElseThrow(() -> new StepException(StepException.Kind.CONFIGURATION,
                        stage + ": unknown provider: " + providerId));
    }
}
