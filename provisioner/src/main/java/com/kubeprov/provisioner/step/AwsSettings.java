package com.kubeprov.provisioner.step;

import java.util.List;

/**
 * AWS credentials and network inputs for one run.
 *
 * @param accessKeyId       Blank to fall back to the default AWS credentials chain.
 * @param secretAccessKey   Paired with accessKeyId.
 * @param availabilityZones Zones to place subnets in; empty means every available zone.
 * @param vpcCidr           CIDR of the VPC to create (default 10.2.0.0/16).
 * @param vpcId             Existing VPC to reuse instead of creating one; never deleted on rollback.
 * @param keyPairName       Name to import the bootstrap key under (default "&lt;cluster&gt;-key").
 * @param publicKey         OpenSSH public key material to import.
 * @param imageId           Explicit AMI; when blank the latest Ubuntu LTS image is looked up.
 */
public record AwsSettings(
        String       accessKeyId,
        String       secretAccessKey,
        List<String> availabilityZones,
        String       vpcCidr,
        String       vpcId,
        String       keyPairName,
        String       publicKey,
        String       imageId) {

    public static final String DEFAULT_VPC_CIDR = "10.2.0.0/16";

    public AwsSettings {
        availabilityZones = availabilityZones == null ? List.of() : List.copyOf(availabilityZones);
        if (vpcCidr == null || vpcCidr.isBlank()) vpcCidr = DEFAULT_VPC_CIDR;
    }

    public boolean hasStaticCredentials() {
        return accessKeyId != null && !accessKeyId.isBlank();
    }

    // Keep the secret out of logs.
    @Override
    public String toString() {
        return "AwsSettings[accessKeyId=" + accessKeyId
                + ", availabilityZones=" + availabilityZones
                + ", vpcCidr=" + vpcCidr
                + ", vpcId=" + vpcId
                + ", keyPairName=" + keyPairName
                + ", imageId=" + imageId + "]";
    }
}
