package com.kubeprov.provisioner.cloud;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of cloud providers a cluster can be provisioned on.
 *
 * The {@link #id()} is the wire identifier used in API requests and stored
 * on run records ("aws", "azure", "gce", "digitalocean").
 */
public enum CloudProvider {
    AWS("aws"),
    AZURE("azure"),
    GCE("gce"),
    DIGITALOCEAN("digitalocean");

    private final String id;

    CloudProvider(String id) {
        this.id = id;
    }

    public String id() { return id; }

    /** Case-insensitive lookup by wire identifier; empty for unknown ids. */
    public static Optional<CloudProvider> fromId(String id) {
        if (id == null) return Optional.empty();
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.id.equals(normalized))
                .findFirst();
    }
}
