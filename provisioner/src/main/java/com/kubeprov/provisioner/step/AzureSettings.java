package com.kubeprov.provisioner.step;

/**
 * Azure service-principal credentials and network inputs for one run.
 *
 * @param tenantId       AAD tenant used for the client-credentials token.
 * @param clientId       Service principal application id.
 * @param clientSecret   Service principal secret.
 * @param subscriptionId Subscription the resource group is created in.
 * @param location       Azure location; falls back to the run's region when blank.
 * @param vnetCidr       Address space of the virtual network (default 10.0.0.0/16).
 */
public record AzureSettings(
        String tenantId,
        String clientId,
        String clientSecret,
        String subscriptionId,
        String location,
        String vnetCidr) {

    public static final String DEFAULT_VNET_CIDR = "10.0.0.0/16";

    public AzureSettings {
        if (vnetCidr == null || vnetCidr.isBlank()) vnetCidr = DEFAULT_VNET_CIDR;
    }

    @Override
    public String toString() {
        return "AzureSettings[tenantId=" + tenantId
                + ", clientId=" + clientId
                + ", subscriptionId=" + subscriptionId
                + ", location=" + location
                + ", vnetCidr=" + vnetCidr + "]";
    }
}
