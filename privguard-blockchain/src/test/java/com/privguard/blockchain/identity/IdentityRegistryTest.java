package com.privguard.blockchain.identity;

import com.privguard.blockchain.config.PaladinConfig;
import com.privguard.blockchain.identity.IdentityRegistry.ResolutionException;
import com.privguard.blockchain.rpc.RpcGateway;
import com.privguard.blockchain.support.ScriptedPaladinService;
import com.privguard.blockchain.support.TestTopology;
import com.privguard.blockchain.topology.NodeTopology;
import com.privguard.blockchain.topology.NodeTopology.TopologyException;
import com.privguard.core.domain.Identity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for identity resolution.
 */
class IdentityRegistryTest {

    private static final String ALICE = "0x1111111111111111111111111111111111111111";
    private static final String BOB = "0x2222222222222222222222222222222222222222";

    private Map<String, ScriptedPaladinService> services;
    private IdentityRegistry registry;

    @BeforeEach
    void setUp() {
        PaladinConfig config = TestTopology.fastConfig("node1", "node2", "node3");
        services = TestTopology.services("node1", "node2", "node3");
        services.get("node1").reply("transport_nodeName", "node1");
        services.get("node2").reply("transport_nodeName", "node2");
        services.get("node3").fail("transport_nodeName");
        NodeTopology topology = new NodeTopology(config, endpoint -> services.get(endpoint.getId()));
        topology.initialize();
        registry = new IdentityRegistry(topology, new RpcGateway(config));
    }

    @Test
    void resolveAll_resolvesOnHomeNodes() throws Exception {
        // Given
        services.get("node1").reply("ptx_resolveVerifier", ALICE);
        services.get("node2").reply("ptx_resolveVerifier", BOB);

        // When
        List<Identity> universe = registry.resolveAll(List.of(
                IdentityDefinition.of("alice", "node1"),
                IdentityDefinition.of("bob", "node2")));

        // Then
        assertThat(universe).extracting(Identity::address).containsExactly(ALICE, BOB);
        assertThat(universe.get(0).signingHandle()).isEqualTo("alice@node1");
        assertThat(services.get("node1").calls("ptx_resolveVerifier").get(0).params().toString())
                .isEqualTo("[\"alice@node1\",\"ecdsa:secp256k1\",\"eth_address\"]");
    }

    @Test
    void resolveAll_strandsIdentitiesOnUnreachableNodes() throws Exception {
        // Given
        services.get("node1").reply("ptx_resolveVerifier", ALICE);

        // When
        List<Identity> universe = registry.resolveAll(List.of(
                IdentityDefinition.of("alice", "node1"),
                IdentityDefinition.of("carol", "node3")));

        // Then
        assertThat(universe).extracting(Identity::name).containsExactly("alice");
        assertThat(registry.stranded()).containsExactly("carol");
        assertThatThrownBy(() -> registry.members(List.of("alice", "carol")))
                .isInstanceOf(TopologyException.class)
                .hasMessageContaining("carol@node3");
    }

    @Test
    void resolveAll_abortsOnInvalidAddress() {
        // Given
        services.get("node1").reply("ptx_resolveVerifier", "not-an-address");

        // When/Then
        assertThatThrownBy(() -> registry.resolveAll(List.of(IdentityDefinition.of("alice", "node1"))))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("alice@node1");
    }

    @Test
    void resolve_isNotRetried() {
        // Given
        services.get("node1").failOnce("ptx_resolveVerifier").reply("ptx_resolveVerifier", ALICE);

        // When/Then
        assertThatThrownBy(() -> registry.resolve("alice", "node1")).isInstanceOf(ResolutionException.class);
        assertThat(services.get("node1").count("ptx_resolveVerifier")).isEqualTo(1);
    }

    @Test
    void resolveAll_rejectsDuplicatesAndUnknownNodes() {
        services.get("node1").reply("ptx_resolveVerifier", ALICE);

        assertThatThrownBy(() -> registry.resolveAll(List.of(
                IdentityDefinition.of("alice", "node1"),
                IdentityDefinition.of("alice", "node1"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.resolveAll(List.of(IdentityDefinition.of("dave", "node9"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void identityDefinition_defaultsLookup() {
        assertThat(IdentityDefinition.of("alice", "node1").lookup()).isEqualTo("alice@node1");
        assertThat(new IdentityDefinition("alice", "node1", "lender@node1").lookup()).isEqualTo("lender@node1");
    }
}
