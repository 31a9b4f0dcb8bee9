package com.privguard.blockchain.support;

import com.privguard.blockchain.config.PaladinConfig;
import com.privguard.blockchain.config.PaladinConfig.NodeEndpoint;
import com.privguard.blockchain.topology.NodeTopology;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link PaladinConfig} with fast timings and a topology over scripted nodes.
 */
public final class TestTopology {

    public static final String STORAGE_BYTECODE = "0x6080604052348015600f57600080fd5b50";

    private TestTopology() {}

    public static PaladinConfig fastConfig(String... nodeIds) {
        PaladinConfig config = new PaladinConfig();
        List<NodeEndpoint> nodes = new ArrayList<>();
        for (String nodeId : nodeIds) {
            nodes.add(new NodeEndpoint(nodeId, "http://" + nodeId + ".test:31548"));
        }
        config.setNodes(nodes);
        config.setRetryBackoff(Duration.ofMillis(5));
        config.setPollInterval(Duration.ofMillis(10));
        config.setGroupReadyTimeout(Duration.ofMillis(300));
        config.setReceiptTimeout(Duration.ofMillis(300));
        config.getProbe().setBytecode(STORAGE_BYTECODE);
        return config;
    }

    /**
     * Initialized topology in which every node answers the reachability probe.
     */
    public static NodeTopology reachable(PaladinConfig config, Map<String, ScriptedPaladinService> services) {
        services.values().forEach(service -> service.reply("transport_nodeName", "node"));
        NodeTopology topology = new NodeTopology(config, endpoint -> services.get(endpoint.getId()));
        topology.initialize();
        return topology;
    }

    public static Map<String, ScriptedPaladinService> services(String... nodeIds) {
        Map<String, ScriptedPaladinService> services = new LinkedHashMap<>();
        for (String nodeId : nodeIds) {
            services.put(nodeId, new ScriptedPaladinService());
        }
        return services;
    }
}
