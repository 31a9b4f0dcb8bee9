package com.privguard.blockchain.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.privguard.blockchain.config.PaladinConfig;
import com.privguard.blockchain.rpc.GatewayError;
import com.privguard.blockchain.rpc.Receipt;
import com.privguard.blockchain.rpc.ReceiptPoller;
import com.privguard.blockchain.rpc.RpcGateway;
import com.privguard.blockchain.rpc.RpcResult;
import com.privguard.blockchain.topology.ConnectionHandle;
import com.privguard.blockchain.topology.NodeTopology;
import com.privguard.blockchain.topology.NodeTopology.UnreachableException;
import com.privguard.core.domain.ActualOutcome;
import com.privguard.core.domain.Identity;
import com.privguard.core.domain.PrivacyGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues probe contract calls scoped to a group, from a given identity, through that identity's
 * home node.
 *
 * <p>Stateless: the group supplies the contract address, the identity supplies the connection.
 * A write only reports success once its receipt is confirmed, so any later read observes it.</p>
 */
@Service
public class ContractInvocationProxy {

    private static final Logger log = LoggerFactory.getLogger(ContractInvocationProxy.class);
    static final String SEND_METHOD = "pgroup_sendTransaction";
    static final String CALL_METHOD = "pgroup_call";

    private final NodeTopology topology;
    private final RpcGateway gateway;
    private final ReceiptPoller receipts;
    private final ProbeContract probe;
    private final String domain;
    private final Duration receiptTimeout;

    public ContractInvocationProxy(NodeTopology topology, RpcGateway gateway, ReceiptPoller receipts,
                                   PaladinConfig config) {
        this.topology = topology;
        this.gateway = gateway;
        this.receipts = receipts;
        this.probe = ProbeContract.from(config.getProbe());
        this.domain = config.getDomain();
        this.receiptTimeout = config.getReceiptTimeout();
    }

    /**
     * Stores {@code value} in the group's probe contract and waits for the commit.
     */
    public ActualOutcome write(PrivacyGroup group, Identity identity, BigInteger value) {
        String contract = requireTestable(group);
        ConnectionHandle handle;
        try {
            handle = topology.connect(identity.homeNodeId());
        } catch (UnreachableException e) {
            return ActualOutcome.transportError(e.getMessage());
        }

        ObjectNode input = JsonNodeFactory.instance.objectNode();
        input.put(probe.valueParameter(), value.toString());
        ObjectNode tx = JsonNodeFactory.instance.objectNode();
        tx.put("domain", domain);
        tx.put("group", group.id());
        tx.put("from", identity.signingHandle());
        tx.put("to", contract);
        tx.set("function", probe.storeAbi());
        tx.set("input", input);
        // Lets the gateway retry a transport failure without submitting the write twice.
        tx.put("idempotencyKey", UUID.randomUUID().toString());

        RpcResult submitted = gateway.invoke(handle, SEND_METHOD, List.of(tx));
        if (!submitted.isOk()) {
            return toOutcome(submitted.error());
        }
        Optional<String> transactionId = ReceiptPoller.transactionId(submitted.value());
        if (transactionId.isEmpty()) {
            return ActualOutcome.transportError(
                    probe.storeFunction() + " submission returned no transaction ID: " + submitted.value());
        }

        Optional<Receipt> receipt;
        try {
            receipt = receipts.await(handle, transactionId.get(), receiptTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ActualOutcome.transportError("interrupted waiting for commit of " + transactionId.get());
        }
        if (receipt.isEmpty()) {
            return ActualOutcome.transportError(
                    "commit of " + transactionId.get() + " not confirmed within " + receiptTimeout);
        }
        if (receipt.get().success()) {
            log.debug("{} wrote {} to group {} in {}", identity.name(), value, group.name(), transactionId.get());
            return ActualOutcome.committed();
        }
        return toOutcome(gateway.denials().classifyMessage(receipt.get().failureMessage()));
    }

    /**
     * Calls the probe's retrieve function and decodes the stored value.
     */
    public ActualOutcome read(PrivacyGroup group, Identity identity) {
        String contract = requireTestable(group);
        ConnectionHandle handle;
        try {
            handle = topology.connect(identity.homeNodeId());
        } catch (UnreachableException e) {
            return ActualOutcome.transportError(e.getMessage());
        }

        ObjectNode call = JsonNodeFactory.instance.objectNode();
        call.put("domain", domain);
        call.put("group", group.id());
        call.put("from", identity.signingHandle());
        call.put("to", contract);
        call.set("function", probe.retrieveAbi());

        RpcResult result = gateway.invoke(handle, CALL_METHOD, List.of(call));
        if (!result.isOk()) {
            return toOutcome(result.error());
        }
        if (!result.hasValue()) {
            return ActualOutcome.transportError("empty result from " + probe.retrieveFunction());
        }
        try {
            return ActualOutcome.success(decodeValue(result.value()));
        } catch (IllegalArgumentException e) {
            return ActualOutcome.transportError("malformed " + probe.retrieveFunction() + " result: " + e.getMessage());
        }
    }

    static BigInteger decodeValue(JsonNode value) {
        JsonNode output = value;
        // Outputs may be nested, e.g. {"output": ["42"]}.
        while (output.isContainerNode()) {
            output = unwrap(output);
        }
        if (output.isIntegralNumber()) {
            return output.bigIntegerValue();
        }
        if (!output.isTextual()) {
            throw new IllegalArgumentException("unexpected output " + output);
        }
        String text = output.asText().trim();
        if (text.startsWith("0x") || text.startsWith("0X")) {
            return Numeric.toBigInt(text);
        }
        try {
            return new BigInteger(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an integer: " + text);
        }
    }

    private static JsonNode unwrap(JsonNode container) {
        if (container.isArray()) {
            if (container.isEmpty()) {
                throw new IllegalArgumentException("no outputs");
            }
            return container.get(0);
        }
        if (container.has("0")) {
            return container.get("0");
        }
        if (container.has("value")) {
            return container.get("value");
        }
        if (container.has("output")) {
            return container.get("output");
        }
        if (container.size() == 1) {
            Iterator<JsonNode> fields = container.elements();
            return fields.next();
        }
        throw new IllegalArgumentException("cannot pick an output from " + container);
    }

    private String requireTestable(PrivacyGroup group) {
        if (!group.isTestable()) {
            throw new IllegalStateException("Group " + group.name() + " is not ready for testing: " + group.status());
        }
        return group.contractAddress().orElseThrow();
    }

    private static ActualOutcome toOutcome(GatewayError error) {
        if (error instanceof GatewayError.Rejected rejected) {
            return ActualOutcome.denied(rejected.reason());
        }
        return ActualOutcome.transportError(error.reason());
    }
}
