package com.kubeprov.provisioner.step.aws;

/**
 * Output keys the AWS pre-provision steps publish for later steps.
 */
public final class AwsOutputs {

    public static final String IMAGE_ID                 = "aws.imageId";
    public static final String VPC_ID                   = "aws.vpcId";
    public static final String MASTERS_SECURITY_GROUP   = "aws.mastersSecurityGroupId";
    public static final String NODES_SECURITY_GROUP     = "aws.nodesSecurityGroupId";
    public static final String MASTERS_INSTANCE_PROFILE = "aws.mastersInstanceProfile";
    public static final String NODES_INSTANCE_PROFILE   = "aws.nodesInstanceProfile";
    public static final String KEY_PAIR_NAME            = "aws.keyPairName";
    public static final String INTERNET_GATEWAY_ID      = "aws.internetGatewayId";
    public static final String SUBNET_IDS               = "aws.subnetIds";
    public static final String SUBNET_ZONES             = "aws.subnetZones";
    public static final String ROUTE_TABLE_ID           = "aws.routeTableId";
    public static final String ROUTE_TABLE_ASSOCIATIONS = "aws.routeTableAssociationIds";

    private AwsOutputs() {}
}
