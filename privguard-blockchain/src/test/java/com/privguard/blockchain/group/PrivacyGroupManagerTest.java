package com.privguard.blockchain.group;

import com.fasterxml.jackson.databind.JsonNode;
import com.privguard.blockchain.config.PaladinConfig;
import com.privguard.blockchain.group.PrivacyGroupManager.ConfirmationTimeoutException;
import com.privguard.blockchain.group.PrivacyGroupManager.GroupCreationException;
import com.privguard.blockchain.group.PrivacyGroupManager.ProbeDeploymentException;
import com.privguard.blockchain.rpc.ReceiptPoller;
import com.privguard.blockchain.rpc.RpcGateway;
import com.privguard.blockchain.support.ScriptedPaladinService;
import com.privguard.blockchain.support.TestTopology;
import com.privguard.blockchain.topology.NodeTopology;
import com.privguard.blockchain.topology.NodeTopology.TopologyException;
import com.privguard.core.domain.GroupStatus;
import com.privguard.core.domain.Identity;
import com.privguard.core.domain.PrivacyGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for group creation, confirmation and probe deployment.
 */
class PrivacyGroupManagerTest {

    private static final String PROBE = "0x3333333333333333333333333333333333333333";

    private final Identity alice = new Identity("alice", "node1", "0x1111111111111111111111111111111111111111", "alice@node1");
    private final Identity bob = new Identity("bob", "node2", "0x2222222222222222222222222222222222222222", "bob@node2");
    private final Identity carol = new Identity("carol", "node3", "0x4444444444444444444444444444444444444444", "carol@node3");

    private PaladinConfig config;
    private Map<String, ScriptedPaladinService> services;
    private PrivacyGroupManager manager;

    @BeforeEach
    void setUp() {
        config = TestTopology.fastConfig("node1", "node2", "node3");
        services = TestTopology.services("node1", "node2", "node3");
        services.get("node1").reply("transport_nodeName", "node1");
        services.get("node2").reply("transport_nodeName", "node2");
        services.get("node3").fail("transport_nodeName");
        NodeTopology topology = new NodeTopology(config, endpoint -> services.get(endpoint.getId()));
        topology.initialize();
        RpcGateway gateway = new RpcGateway(config);
        manager = new PrivacyGroupManager(topology, gateway, new ReceiptPoller(gateway, config), config);
    }

    // ==================== Creation ====================

    @Test
    void create_sendsMembersAndConfigurationFromFirstMemberNode() throws Exception {
        // Given
        services.get("node1").reply("pgroup_createGroup", Map.of("id", "0xgroup1"));

        // When
        PrivacyGroup group = manager.create("lending-run1", List.of(alice, bob));

        // Then
        assertThat(group.id()).isEqualTo("0xgroup1");
        assertThat(group.status()).isEqualTo(GroupStatus.CREATING);
        assertThat(group.members()).containsExactly("alice", "bob");
        JsonNode request = services.get("node1").calls("pgroup_createGroup").get(0).params().get(0);
        assertThat(request.get("domain").asText()).isEqualTo("pente");
        assertThat(request.get("name").asText()).isEqualTo("lending-run1");
        assertThat(request.get("members").toString()).isEqualTo("[\"alice@node1\",\"bob@node2\"]");
        assertThat(request.get("configuration").get("evmVersion").asText()).isEqualTo("shanghai");
        assertThat(request.get("configuration").get("endorsementType").asText()).isEqualTo("group_scoped_identities");
        assertThat(services.get("node2").count("pgroup_createGroup")).isZero();
        assertThat(manager.group("0xgroup1")).contains(group);
    }

    @Test
    void create_canNameMembersByAddress() throws Exception {
        // Given
        config.setMemberReference(PaladinConfig.MemberReference.ADDRESS);
        services.get("node1").reply("pgroup_createGroup", "0xgroup1");

        // When
        manager.create("lending-run1", List.of(alice, bob));

        // Then
        JsonNode request = services.get("node1").calls("pgroup_createGroup").get(0).params().get(0);
        assertThat(request.get("members").get(1).asText()).isEqualTo(bob.address());
    }

    @Test
    void create_failsFastWhenMemberNodeUnreachable() {
        assertThatThrownBy(() -> manager.create("audit-run1", List.of(alice, carol)))
                .isInstanceOf(TopologyException.class)
                .hasMessageContaining("node3");
        assertThat(services.get("node1").count("pgroup_createGroup")).isZero();
    }

    @Test
    void create_rejectedRequestIsCreationFailure() {
        services.get("node1").error("pgroup_createGroup", -32000, "invalid group configuration");

        assertThatThrownBy(() -> manager.create("lending-run1", List.of(alice, bob)))
                .isInstanceOf(GroupCreationException.class)
                .hasMessageContaining("lending-run1");
    }

    // ==================== Readiness ====================

    @Test
    void awaitReady_deploysProbeAfterConfirmation() throws Exception {
        // Given
        ScriptedPaladinService node1 = services.get("node1");
        node1.reply("pgroup_createGroup", "0xgroup1")
                .replyOnce("pgroup_getGroupById", null)
                .reply("pgroup_getGroupById", Map.of("id", "0xgroup1", "contractAddress", "0xprivacy"))
                .reply("pgroup_sendTransaction", "tx-deploy")
                .reply("ptx_getTransactionReceipt", Map.of("id", "tx-deploy", "success", true))
                .reply("ptx_getDomainReceipt", Map.of("receipt", Map.of("contractAddress", PROBE)));
        PrivacyGroup group = manager.create("lending-run1", List.of(alice, bob));

        // When
        manager.awaitReady(group);

        // Then
        assertThat(group.isTestable()).isTrue();
        assertThat(group.contractAddress()).contains(PROBE);
        JsonNode deploy = node1.calls("pgroup_sendTransaction").get(0).params().get(0);
        assertThat(deploy.get("from").asText()).isEqualTo("alice@node1");
        assertThat(deploy.get("bytecode").asText()).isEqualTo(TestTopology.STORAGE_BYTECODE);
        assertThat(deploy.get("function").get("type").asText()).isEqualTo("constructor");
        assertThat(deploy.has("idempotencyKey")).isTrue();
    }

    @Test
    void awaitReady_timeoutMarksGroupFailed() throws Exception {
        // Given
        services.get("node1").reply("pgroup_createGroup", "0xgroup1").reply("pgroup_getGroupById", null);
        PrivacyGroup group = manager.create("lending-run1", List.of(alice, bob));

        // When/Then
        assertThatThrownBy(() -> manager.awaitReady(group, Duration.ofMillis(50)))
                .isInstanceOf(ConfirmationTimeoutException.class);
        assertThat(group.status()).isEqualTo(GroupStatus.FAILED);
        assertThat(group.isTestable()).isFalse();
        assertThat(services.get("node1").count("pgroup_sendTransaction")).isZero();
    }

    @Test
    void awaitReady_failedGenesisFailsFast() throws Exception {
        // Given
        services.get("node1").reply("pgroup_createGroup", "0xgroup1")
                .reply("pgroup_getGroupById", Map.of("id", "0xgroup1", "genesisTransaction", "tx-genesis"))
                .reply("ptx_getTransactionReceipt", Map.of("success", false, "failureMessage", "endorsement failed"));
        PrivacyGroup group = manager.create("lending-run1", List.of(alice, bob));

        // When/Then
        assertThatThrownBy(() -> manager.awaitReady(group))
                .isInstanceOf(GroupCreationException.class)
                .hasMessageContaining("endorsement failed");
        assertThat(group.status()).isEqualTo(GroupStatus.FAILED);
    }

    @Test
    void awaitReady_successfulGenesisConfirmsGroup() throws Exception {
        // Given
        services.get("node1").reply("pgroup_createGroup", "0xgroup1")
                .reply("pgroup_getGroupById", Map.of("id", "0xgroup1", "genesisTransaction", "tx-genesis"))
                .reply("ptx_getTransactionReceipt", Map.of("success", true))
                .reply("pgroup_sendTransaction", Map.of("id", "tx-deploy"))
                .reply("ptx_getDomainReceipt", Map.of("receipt", Map.of("contractAddress", PROBE)));
        PrivacyGroup group = manager.create("lending-run1", List.of(alice, bob));

        // When
        manager.awaitReady(group);

        // Then
        assertThat(group.contractAddress()).contains(PROBE);
    }

    // ==================== Deployment ====================

    @Test
    void deployProbe_failedReceiptIsDeploymentFailure() throws Exception {
        // Given
        services.get("node1").reply("pgroup_createGroup", "0xgroup1")
                .reply("pgroup_getGroupById", Map.of("contractAddress", "0xprivacy"))
                .reply("pgroup_sendTransaction", "tx-deploy")
                .reply("ptx_getTransactionReceipt", Map.of("success", false, "failureMessage", "out of gas"));
        PrivacyGroup group = manager.create("lending-run1", List.of(alice, bob));

        // When/Then
        assertThatThrownBy(() -> manager.awaitReady(group))
                .isInstanceOf(ProbeDeploymentException.class)
                .hasMessageContaining("out of gas");
        assertThat(group.status()).isEqualTo(GroupStatus.FAILED);
    }

    @Test
    void deployProbe_fallsBackToReceiptContractAddress() throws Exception {
        // Given
        services.get("node1").reply("pgroup_createGroup", "0xgroup1")
                .reply("pgroup_getGroupById", Map.of("contractAddress", "0xprivacy"))
                .reply("pgroup_sendTransaction", "tx-deploy")
                .reply("ptx_getTransactionReceipt", Map.of("success", true, "contractAddress", PROBE))
                .reply("ptx_getDomainReceipt", null);
        PrivacyGroup group = manager.create("lending-run1", List.of(alice, bob));

        // When
        manager.awaitReady(group);

        // Then
        assertThat(group.contractAddress()).contains(PROBE);
    }

    @Test
    void deployProbe_requiresBytecode() throws Exception {
        // Given
        config.getProbe().setBytecode(null);
        NodeTopology topology = TestTopology.reachable(config, TestTopology.services("node1", "node2", "node3"));
        RpcGateway gateway = new RpcGateway(config);
        PrivacyGroupManager withoutBytecode =
                new PrivacyGroupManager(topology, gateway, new ReceiptPoller(gateway, config), config);
        PrivacyGroup group = new PrivacyGroup("0xgroup1", "lending", Set.of("alice"), "node1");

        // When/Then
        assertThatThrownBy(() -> withoutBytecode.deployProbe(group, alice))
                .isInstanceOf(ProbeDeploymentException.class)
                .hasMessageContaining("bytecode");
        assertThat(group.status()).isEqualTo(GroupStatus.FAILED);
    }
}
