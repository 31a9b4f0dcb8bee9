package com.privguard.blockchain.topology;

import com.privguard.blockchain.config.PaladinConfig;
import com.privguard.blockchain.config.PaladinConfig.NodeEndpoint;
import com.privguard.blockchain.rpc.PaladinResponse;
import com.privguard.core.domain.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The set of execution endpoints for a run.
 *
 * <p>Every configured node is probed once by {@link #initialize()}. The resulting {@link Node}
 * values never change afterwards; an unreachable node stays unreachable for the whole run and
 * any group naming one of its identities fails fast.</p>
 */
@Service
public class NodeTopology {

    private static final Logger log = LoggerFactory.getLogger(NodeTopology.class);
    static final String PROBE_METHOD = "transport_nodeName";

    private final PaladinConfig config;
    private final ServiceFactory serviceFactory;
    private final Map<String, Node> nodes;
    private final Map<String, ConnectionHandle> handles;
    private volatile boolean initialized;

    public NodeTopology(PaladinConfig config, ServiceFactory serviceFactory) {
        this.config = config;
        this.serviceFactory = serviceFactory;
        this.nodes = Collections.synchronizedMap(new LinkedHashMap<>());
        this.handles = Collections.synchronizedMap(new LinkedHashMap<>());
    }

    /**
     * Probes every configured endpoint and fixes its reachability for the run.
     */
    public synchronized List<Node> initialize() {
        if (initialized) {
            return nodes();
        }
        for (NodeEndpoint endpoint : config.getNodes()) {
            Objects.requireNonNull(endpoint.getId(), "Node ID cannot be null");
            Objects.requireNonNull(endpoint.getUrl(), "Node URL cannot be null for " + endpoint.getId());
            if (nodes.containsKey(endpoint.getId())) {
                throw new IllegalArgumentException("Duplicate node ID: " + endpoint.getId());
            }
            Web3jService service = serviceFactory.create(endpoint);
            boolean reachable = probe(endpoint, service);
            Node node = new Node(endpoint.getId(), endpoint.getUrl(), reachable);
            nodes.put(node.id(), node);
            if (reachable) {
                handles.put(node.id(), new ConnectionHandle(node, service));
                log.info("Node {} reachable at {}", node.id(), node.endpoint());
            } else {
                log.warn("Node {} unreachable at {}; groups naming its identities will be excluded",
                        node.id(), node.endpoint());
            }
        }
        initialized = true;
        return nodes();
    }

    /**
     * Returns the shared connection to a node.
     *
     * @throws UnreachableException if the node refused the connection or timed out at startup
     */
    public ConnectionHandle connect(String nodeId) throws UnreachableException {
        Node node = node(nodeId).orElseThrow(() -> new IllegalArgumentException("Unknown node: " + nodeId));
        ConnectionHandle handle = handles.get(node.id());
        if (handle == null) {
            throw new UnreachableException(node);
        }
        return handle;
    }

    /**
     * Fails fast when any of the given nodes cannot take part in a group.
     */
    public void requireReachable(Collection<String> nodeIds) throws TopologyException {
        List<String> unreachable = new ArrayList<>();
        for (String nodeId : nodeIds) {
            Optional<Node> node = node(nodeId);
            if (node.isEmpty() || !node.get().reachable()) {
                unreachable.add(nodeId);
            }
        }
        if (!unreachable.isEmpty()) {
            throw new TopologyException("Unreachable nodes: " + unreachable);
        }
    }

    public boolean isReachable(String nodeId) {
        return node(nodeId).map(Node::reachable).orElse(false);
    }

    public Optional<Node> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public List<Node> nodes() {
        synchronized (nodes) {
            return List.copyOf(nodes.values());
        }
    }

    private boolean probe(NodeEndpoint endpoint, Web3jService service) {
        try {
            PaladinResponse response = new Request<>(PROBE_METHOD, List.of(), service, PaladinResponse.class).send();
            return response != null;
        } catch (IOException e) {
            log.debug("Reachability probe for {} failed: {}", endpoint.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * A node refused the connection or timed out.
     */
    public static class UnreachableException extends Exception {
        private final transient Node node;

        public UnreachableException(Node node) {
            super("Node " + node.id() + " is unreachable at " + node.endpoint());
            this.node = node;
        }

        public Node getNode() {
            return node;
        }
    }

    /**
     * A group would name an identity homed on an unreachable node.
     */
    public static class TopologyException extends Exception {
        public TopologyException(String message) {
            super(message);
        }
    }
}
