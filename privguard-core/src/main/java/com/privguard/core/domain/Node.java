package com.privguard.core.domain;

import java.util.Objects;

/**
 * An execution endpoint of the network under test.
 * Reachability is probed once at startup and does not change for the rest of a run.
 */
public record Node(String id, String endpoint, boolean reachable) {

    public Node {
        Objects.requireNonNull(id, "Node ID cannot be null");
        Objects.requireNonNull(endpoint, "Endpoint cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Node ID cannot be blank");
        }
    }
}
