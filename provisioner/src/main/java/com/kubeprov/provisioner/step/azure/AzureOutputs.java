package com.kubeprov.provisioner.step.azure;

/**
 * Output keys the Azure pre-provision steps publish for later steps.
 */
public final class AzureOutputs {

    public static final String RESOURCE_GROUP = "azure.resourceGroup";
    public static final String LOCATION       = "azure.location";
    public static final String VNET_NAME      = "azure.vnetName";
    public static final String SUBNET_NAME    = "azure.subnetName";

    private AzureOutputs() {}
}
