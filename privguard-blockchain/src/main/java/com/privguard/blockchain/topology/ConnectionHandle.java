package com.privguard.blockchain.topology;

import com.privguard.core.domain.Node;
import org.web3j.protocol.Web3jService;

import java.util.Objects;

/**
 * Shared, read-only connection to a reachable node.
 */
public record ConnectionHandle(Node node, Web3jService service) {

    public ConnectionHandle {
        Objects.requireNonNull(node, "Node cannot be null");
        Objects.requireNonNull(service, "Service cannot be null");
    }

    public String nodeId() {
        return node.id();
    }
}
