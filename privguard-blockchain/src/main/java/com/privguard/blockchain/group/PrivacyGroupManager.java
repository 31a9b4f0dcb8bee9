package com.privguard.blockchain.group;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.privguard.blockchain.config.PaladinConfig;
import com.privguard.blockchain.config.PaladinConfig.MemberReference;
import com.privguard.blockchain.contract.ProbeContract;
import com.privguard.blockchain.rpc.BoundedPoller;
import com.privguard.blockchain.rpc.Receipt;
import com.privguard.blockchain.rpc.ReceiptPoller;
import com.privguard.blockchain.rpc.RpcGateway;
import com.privguard.blockchain.rpc.RpcResult;
import com.privguard.blockchain.topology.ConnectionHandle;
import com.privguard.blockchain.topology.NodeTopology;
import com.privguard.blockchain.topology.NodeTopology.TopologyException;
import com.privguard.blockchain.topology.NodeTopology.UnreachableException;
import com.privguard.core.domain.Identity;
import com.privguard.core.domain.PrivacyGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.WalletUtils;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates privacy groups, tracks their confirmation and deploys the probe contract into them.
 *
 * <p>Groups live for the whole run. A group becomes READY only once the platform confirmed it and
 * the probe contract is deployed; any failure on the way leaves it FAILED and out of the matrix.</p>
 */
@Service
public class PrivacyGroupManager {

    private static final Logger log = LoggerFactory.getLogger(PrivacyGroupManager.class);
    static final String CREATE_METHOD = "pgroup_createGroup";
    static final String GET_METHOD = "pgroup_getGroupById";
    static final String SEND_METHOD = "pgroup_sendTransaction";
    static final String DOMAIN_RECEIPT_METHOD = "ptx_getDomainReceipt";

    private final NodeTopology topology;
    private final RpcGateway gateway;
    private final ReceiptPoller receipts;
    private final PaladinConfig config;
    private final ProbeContract probe;
    private final Map<String, PrivacyGroup> groups;
    private final Map<String, List<Identity>> memberIdentities;

    public PrivacyGroupManager(NodeTopology topology, RpcGateway gateway, ReceiptPoller receipts,
                               PaladinConfig config) {
        this.topology = topology;
        this.gateway = gateway;
        this.receipts = receipts;
        this.config = config;
        this.probe = ProbeContract.from(config.getProbe());
        this.groups = new ConcurrentHashMap<>();
        this.memberIdentities = new ConcurrentHashMap<>();
    }

    /**
     * Submits a group creation request on the first member's home node.
     *
     * @return the group in CREATING state
     * @throws TopologyException if any member's home node is unreachable
     */
    public PrivacyGroup create(String name, List<Identity> members)
            throws TopologyException, GroupCreationException {
        Objects.requireNonNull(name, "Group name cannot be null");
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("A privacy group needs at least one member");
        }
        topology.requireReachable(members.stream().map(Identity::homeNodeId).distinct().toList());

        Identity creator = members.get(0);
        ConnectionHandle handle = connect(creator.homeNodeId());

        ArrayNode memberRefs = JsonNodeFactory.instance.arrayNode();
        Set<String> memberNames = new LinkedHashSet<>();
        for (Identity member : members) {
            memberRefs.add(config.getMemberReference() == MemberReference.ADDRESS
                    ? member.address() : member.signingHandle());
            memberNames.add(member.name());
        }
        ObjectNode configuration = JsonNodeFactory.instance.objectNode();
        configuration.put("evmVersion", config.getEvmVersion());
        configuration.put("endorsementType", config.getEndorsementType());
        configuration.put("externalCallsEnabled", Boolean.toString(config.isExternalCallsEnabled()));

        ObjectNode request = JsonNodeFactory.instance.objectNode();
        request.put("domain", config.getDomain());
        request.put("name", name);
        request.set("members", memberRefs);
        request.set("configuration", configuration);

        // Not retried: a lost reply followed by a resend would create a second group.
        RpcResult result = gateway.invokeOnce(handle, CREATE_METHOD, List.of(request));
        if (!result.isOk()) {
            throw new GroupCreationException(name, result.error().reason());
        }
        String groupId = groupIdOf(result.value())
                .orElseThrow(() -> new GroupCreationException(name, "no group ID in " + result.value()));

        PrivacyGroup group = new PrivacyGroup(groupId, name, memberNames, creator.homeNodeId());
        groups.put(groupId, group);
        memberIdentities.put(groupId, List.copyOf(members));
        log.info("Created privacy group {} ({}) on {} with members {}", name, groupId, creator.homeNodeId(), memberNames);
        return group;
    }

    /**
     * Waits for the group to be confirmed, then deploys the probe from the first member.
     */
    public PrivacyGroup awaitReady(PrivacyGroup group, Duration timeout)
            throws ConfirmationTimeoutException, GroupCreationException, ProbeDeploymentException {
        List<Identity> members = memberIdentities.get(group.id());
        if (members == null) {
            throw new IllegalArgumentException("Group " + group.id() + " was not created by this manager");
        }
        return awaitReady(group, members.get(0), timeout);
    }

    public PrivacyGroup awaitReady(PrivacyGroup group)
            throws ConfirmationTimeoutException, GroupCreationException, ProbeDeploymentException {
        return awaitReady(group, config.getGroupReadyTimeout());
    }

    public PrivacyGroup awaitReady(PrivacyGroup group, Identity deployer, Duration timeout)
            throws ConfirmationTimeoutException, GroupCreationException, ProbeDeploymentException {
        if (group.isTestable()) {
            return group;
        }
        ConnectionHandle handle = connect(group.creatorNodeId());
        Optional<Confirmation> confirmation;
        try {
            confirmation = BoundedPoller.poll(config.getPollInterval(), timeout, () -> checkConfirmation(handle, group));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            group.markFailed("interrupted while awaiting confirmation");
            throw new ConfirmationTimeoutException(group, timeout);
        }
        if (confirmation.isEmpty()) {
            group.markFailed("not confirmed within " + timeout);
            log.warn("Privacy group {} ({}) not confirmed within {}", group.name(), group.id(), timeout);
            throw new ConfirmationTimeoutException(group, timeout);
        }
        if (confirmation.get().failure() != null) {
            group.markFailed(confirmation.get().failure());
            throw new GroupCreationException(group.name(), confirmation.get().failure());
        }

        log.info("Privacy group {} confirmed, deploying probe contract as {}", group.name(), deployer.name());
        String address = deployProbe(group, deployer);
        group.markReady(address);
        log.info("Privacy group {} READY with probe contract {}", group.name(), address);
        return group;
    }

    /**
     * Deploys the probe contract into the group with a single contract-creation call.
     *
     * @return the probe contract address
     */
    public String deployProbe(PrivacyGroup group, Identity deployer) throws ProbeDeploymentException {
        if (!group.isMember(deployer.name())) {
            throw new IllegalArgumentException(deployer.name() + " is not a member of " + group.name());
        }
        String bytecode = probe.bytecode().orElseThrow(
                () -> fail(group, "no probe bytecode configured"));
        ConnectionHandle handle;
        try {
            handle = topology.connect(deployer.homeNodeId());
        } catch (UnreachableException e) {
            throw fail(group, e.getMessage());
        }

        ObjectNode tx = JsonNodeFactory.instance.objectNode();
        tx.put("domain", config.getDomain());
        tx.put("group", group.id());
        tx.put("from", deployer.signingHandle());
        tx.put("bytecode", bytecode);
        tx.set("function", probe.constructorAbi());
        tx.set("input", JsonNodeFactory.instance.objectNode());
        tx.put("idempotencyKey", UUID.randomUUID().toString());

        RpcResult submitted = gateway.invoke(handle, SEND_METHOD, List.of(tx));
        if (!submitted.isOk()) {
            throw fail(group, "deployment rejected: " + submitted.error().reason());
        }
        String transactionId = ReceiptPoller.transactionId(submitted.value())
                .orElseThrow(() -> fail(group, "deployment returned no transaction ID"));

        Optional<Receipt> receipt;
        try {
            receipt = receipts.await(handle, transactionId, config.getReceiptTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw fail(group, "interrupted waiting for deployment receipt");
        }
        if (receipt.isEmpty()) {
            throw fail(group, "deployment " + transactionId + " not confirmed within " + config.getReceiptTimeout());
        }
        if (!receipt.get().success()) {
            throw fail(group, "deployment failed: " + receipt.get().failureMessage());
        }

        String address = domainContractAddress(handle, transactionId)
                .or(() -> receipt.get().contract())
                .orElseThrow(() -> fail(group, "no contract address for deployment " + transactionId));
        if (!WalletUtils.isValidAddress(address)) {
            throw fail(group, "invalid contract address " + address);
        }
        return address;
    }

    public Optional<PrivacyGroup> group(String groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    public List<PrivacyGroup> groups() {
        return List.copyOf(groups.values());
    }

    private Optional<Confirmation> checkConfirmation(ConnectionHandle handle, PrivacyGroup group) {
        RpcResult result = gateway.invokeOnce(handle, GET_METHOD, List.of(config.getDomain(), group.id()));
        if (!result.hasValue()) {
            if (!result.isOk()) {
                log.debug("Group {} not visible yet: {}", group.id(), result.error().reason());
            }
            return Optional.empty();
        }
        JsonNode value = result.value();
        if (hasText(value, "contractAddress")) {
            return Optional.of(Confirmation.confirmed());
        }
        if (hasText(value, "genesisTransaction")) {
            Optional<Receipt> genesis = receipts.lookup(handle, value.get("genesisTransaction").asText());
            if (genesis.isPresent()) {
                return Optional.of(genesis.get().success()
                        ? Confirmation.confirmed()
                        : Confirmation.failed("genesis transaction failed: " + genesis.get().failureMessage()));
            }
        }
        return Optional.empty();
    }

    private Optional<String> domainContractAddress(ConnectionHandle handle, String transactionId) {
        RpcResult result = gateway.invoke(handle, DOMAIN_RECEIPT_METHOD, List.of(config.getDomain(), transactionId));
        if (!result.hasValue()) {
            return Optional.empty();
        }
        JsonNode address = result.value().path("receipt").path("contractAddress");
        if (address.isMissingNode() || address.isNull()) {
            address = result.value().path("contractAddress");
        }
        return address.isTextual() && !address.asText().isBlank() ? Optional.of(address.asText()) : Optional.empty();
    }

    private ConnectionHandle connect(String nodeId) {
        try {
            return topology.connect(nodeId);
        } catch (UnreachableException e) {
            // Reachability is fixed at startup and checked before creation.
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private ProbeDeploymentException fail(PrivacyGroup group, String reason) {
        group.markFailed(reason);
        log.warn("Probe deployment into group {} failed: {}", group.name(), reason);
        return new ProbeDeploymentException(group, reason);
    }

    private static Optional<String> groupIdOf(JsonNode value) {
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isTextual()) {
            return Optional.of(value.asText()).filter(id -> !id.isBlank());
        }
        return hasText(value, "id") ? Optional.of(value.get("id").asText()) : Optional.empty();
    }

    private static boolean hasText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank();
    }

    private record Confirmation(String failure) {
        static Confirmation confirmed() {
            return new Confirmation(null);
        }

        static Confirmation failed(String reason) {
            return new Confirmation(reason);
        }
    }

    /**
     * Base type for group setup failures. The group, when one exists, is FAILED.
     */
    public abstract static class PrivacyGroupException extends Exception {
        private final String groupName;

        protected PrivacyGroupException(String groupName, String message) {
            super(message);
            this.groupName = groupName;
        }

        public String getGroupName() {
            return groupName;
        }
    }

    /**
     * The platform refused or failed the creation request.
     */
    public static class GroupCreationException extends PrivacyGroupException {
        public GroupCreationException(String groupName, String reason) {
            super(groupName, "Cannot create privacy group " + groupName + ": " + reason);
        }
    }

    /**
     * The group was not confirmed before the deadline.
     */
    public static class ConfirmationTimeoutException extends PrivacyGroupException {
        public ConfirmationTimeoutException(PrivacyGroup group, Duration timeout) {
            super(group.name(), "Privacy group " + group.name() + " (" + group.id() + ") not ready within " + timeout);
        }
    }

    /**
     * The probe contract could not be deployed into a confirmed group.
     */
    public static class ProbeDeploymentException extends PrivacyGroupException {
        public ProbeDeploymentException(PrivacyGroup group, String reason) {
            super(group.name(), "Cannot deploy probe into " + group.name() + ": " + reason);
        }
    }
}
