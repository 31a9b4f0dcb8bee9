package com.privguard.core.domain;

import java.util.Objects;

/**
 * A cryptographic identity hosted on a node, resolved once per run.
 *
 * @param name          symbolic name used in group definitions
 * @param homeNodeId    node that holds the key material
 * @param address       resolved on-chain address
 * @param signingHandle lookup string the platform signs with (e.g. {@code alice@node1})
 */
public record Identity(String name, String homeNodeId, String address, String signingHandle) {

    public Identity {
        Objects.requireNonNull(name, "Identity name cannot be null");
        Objects.requireNonNull(homeNodeId, "Home node cannot be null");
        Objects.requireNonNull(address, "Address cannot be null");
        Objects.requireNonNull(signingHandle, "Signing handle cannot be null");
    }
}
