package com.privguard.blockchain.identity;

import java.util.Objects;

/**
 * A configured identity before resolution.
 *
 * @param lookup platform lookup string; defaults to {@code name@nodeId}
 */
public record IdentityDefinition(String name, String nodeId, String lookup) {

    public IdentityDefinition {
        Objects.requireNonNull(name, "Identity name cannot be null");
        Objects.requireNonNull(nodeId, "Home node cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Identity name cannot be blank");
        }
        if (lookup == null || lookup.isBlank()) {
            lookup = name + "@" + nodeId;
        }
    }

    public static IdentityDefinition of(String name, String nodeId) {
        return new IdentityDefinition(name, nodeId, null);
    }
}
