package com.kubeprov.provisioner.step.aws;

import com.kubeprov.provisioner.step.StepException;

import java.util.ArrayList;
import java.util.List;

/**
 * Carves one subnet per availability zone out of a VPC CIDR.
 *
 * The VPC range is split into 16 equal blocks (prefix + 4) and the first
 * {@code count} of them are handed out in order, so a 10.2.0.0/16 VPC gets
 * 10.2.0.0/20, 10.2.16.0/20, ...
 */
public final class SubnetPlanner {

    static final int SPLIT_BITS = 4;
    static final int MAX_SUBNETS = 1 << SPLIT_BITS;

    // AWS rejects subnets smaller than a /28.
    private static final int SMALLEST_SUBNET_PREFIX = 28;

    private SubnetPlanner() {}

    public static List<String> plan(String vpcCidr, int count) {
        if (count < 1 || count > MAX_SUBNETS) {
            throw new StepException(StepException.Kind.CONFIGURATION,
                    "cannot plan " + count + " subnets, expected 1 to " + MAX_SUBNETS);
        }
        String[] parts = vpcCidr == null ? new String[0] : vpcCidr.trim().split("/");
        if (parts.length != 2) {
            throw invalid(vpcCidr);
        }
        long base = parseAddress(parts[0], vpcCidr);
        int prefix;
        try {
            prefix = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw invalid(vpcCidr);
        }
        if (prefix < 0 || prefix > 32) {
            throw invalid(vpcCidr);
        }
        int subnetPrefix = prefix + SPLIT_BITS;
        if (subnetPrefix > SMALLEST_SUBNET_PREFIX) {
            throw new StepException(StepException.Kind.CONFIGURATION,
                    "VPC CIDR " + vpcCidr + " is too small to split into /" + subnetPrefix + " subnets");
        }

        long networkMask = prefix == 0 ? 0L : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
        long network = base & networkMask;
        long blockSize = 1L << (32 - subnetPrefix);

        List<String> cidrs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            cidrs.add(format(network + i * blockSize) + "/" + subnetPrefix);
        }
        return cidrs;
    }

    private static long parseAddress(String address, String cidr) {
        String[] octets = address.split("\\.");
        if (octets.length != 4) {
            throw invalid(cidr);
        }
        long value = 0;
        for (String octet : octets) {
            int n;
            try {
                n = Integer.parseInt(octet);
            } catch (NumberFormatException e) {
                throw invalid(cidr);
            }
            if (n < 0 || n > 255) {
                throw invalid(cidr);
            }
            value = (value << 8) | n;
        }
        return value;
    }

    private static String format(long address) {
        return ((address >> 24) & 0xFF) + "." + ((address >> 16) & 0xFF) + "."
                + ((address >> 8) & 0xFF) + "." + (address & 0xFF);
    }

    private static StepException invalid(String cidr) {
        return new StepException(StepException.Kind.CONFIGURATION, "invalid IPv4 CIDR: " + cidr);
    }
}
