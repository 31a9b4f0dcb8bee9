package com.privguard.blockchain.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.privguard.blockchain.rpc.RpcGateway;
import com.privguard.blockchain.rpc.RpcResult;
import com.privguard.blockchain.topology.ConnectionHandle;
import com.privguard.blockchain.topology.NodeTopology;
import com.privguard.blockchain.topology.NodeTopology.TopologyException;
import com.privguard.blockchain.topology.NodeTopology.UnreachableException;
import com.privguard.core.domain.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.WalletUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves symbolic identity names to addresses on their home nodes.
 *
 * <p>Resolution happens once per run and is never retried: without a ground-truth address every
 * later comparison is meaningless, so any failure aborts the run. Identities homed on a node that
 * was unreachable at startup are kept aside as stranded instead.</p>
 */
@Service
public class IdentityRegistry {

    private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);
    static final String RESOLVE_METHOD = "ptx_resolveVerifier";
    static final String ALGORITHM = "ecdsa:secp256k1";
    static final String VERIFIER_TYPE = "eth_address";

    private final NodeTopology topology;
    private final RpcGateway gateway;
    private final Map<String, Identity> identities;
    private final Map<String, String> stranded;

    public IdentityRegistry(NodeTopology topology, RpcGateway gateway) {
        this.topology = topology;
        this.gateway = gateway;
        this.identities = Collections.synchronizedMap(new LinkedHashMap<>());
        this.stranded = Collections.synchronizedMap(new LinkedHashMap<>());
    }

    /**
     * Resolves every definition. Stops at the first resolution failure.
     *
     * @return the resolved universe, stranded identities excluded
     */
    public List<Identity> resolveAll(List<IdentityDefinition> definitions) throws ResolutionException {
        for (IdentityDefinition definition : definitions) {
            if (identities.containsKey(definition.name()) || stranded.containsKey(definition.name())) {
                throw new IllegalArgumentException("Duplicate identity: " + definition.name());
            }
            if (topology.node(definition.nodeId()).isEmpty()) {
                throw new IllegalArgumentException(
                        "Identity " + definition.name() + " names unknown node " + definition.nodeId());
            }
            if (!topology.isReachable(definition.nodeId())) {
                stranded.put(definition.name(), definition.nodeId());
                log.warn("Identity {} is stranded on unreachable node {}", definition.name(), definition.nodeId());
                continue;
            }
            resolve(definition);
        }
        return universe();
    }

    /**
     * Resolves {@code name} against {@code nodeId} using the default lookup.
     */
    public Identity resolve(String name, String nodeId) throws ResolutionException {
        return resolve(IdentityDefinition.of(name, nodeId));
    }

    public Identity resolve(IdentityDefinition definition) throws ResolutionException {
        ConnectionHandle handle;
        try {
            handle = topology.connect(definition.nodeId());
        } catch (UnreachableException e) {
            throw new ResolutionException(definition, e.getMessage());
        }
        RpcResult result = gateway.invokeOnce(handle, RESOLVE_METHOD,
                List.of(definition.lookup(), ALGORITHM, VERIFIER_TYPE));
        if (!result.isOk()) {
            throw new ResolutionException(definition, result.error().reason());
        }
        String address = addressOf(result.value());
        if (address == null || !WalletUtils.isValidAddress(address)) {
            throw new ResolutionException(definition, "node returned no valid address: " + result.value());
        }
        Identity identity = new Identity(definition.name(), definition.nodeId(), address, definition.lookup());
        identities.put(identity.name(), identity);
        log.info("Resolved {} on {} to {}", identity.signingHandle(), identity.homeNodeId(), identity.address());
        return identity;
    }

    /**
     * Looks up the members of a group definition.
     *
     * @throws TopologyException if any member is homed on an unreachable node
     */
    public List<Identity> members(List<String> names) throws TopologyException {
        List<String> strandedMembers = new ArrayList<>();
        List<Identity> members = new ArrayList<>();
        for (String name : names) {
            if (stranded.containsKey(name)) {
                strandedMembers.add(name + "@" + stranded.get(name));
                continue;
            }
            members.add(identity(name).orElseThrow(
                    () -> new IllegalArgumentException("Unknown identity: " + name)));
        }
        if (!strandedMembers.isEmpty()) {
            throw new TopologyException("Members homed on unreachable nodes: " + strandedMembers);
        }
        return members;
    }

    public Optional<Identity> identity(String name) {
        return Optional.ofNullable(identities.get(name));
    }

    public List<Identity> universe() {
        synchronized (identities) {
            return List.copyOf(identities.values());
        }
    }

    public Set<String> stranded() {
        synchronized (stranded) {
            return Set.copyOf(stranded.keySet());
        }
    }

    private static String addressOf(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.asText();
        }
        JsonNode verifier = value.get("verifier");
        return verifier != null && verifier.isTextual() ? verifier.asText() : null;
    }

    /**
     * The home node could not produce a verifier for an identity. Fatal to the run.
     */
    public static class ResolutionException extends Exception {
        private final String identityName;

        public ResolutionException(IdentityDefinition definition, String detail) {
            super("Cannot resolve identity " + definition.lookup() + " on node " + definition.nodeId() + ": " + detail);
            this.identityName = definition.name();
        }

        public String getIdentityName() {
            return identityName;
        }
    }
}
