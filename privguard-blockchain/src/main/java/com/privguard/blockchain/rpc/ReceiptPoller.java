package com.privguard.blockchain.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.privguard.blockchain.config.PaladinConfig;
import com.privguard.blockchain.topology.ConnectionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Commit barrier: waits for a transaction receipt before anything may depend on the transaction.
 */
@Service
public class ReceiptPoller {

    private static final Logger log = LoggerFactory.getLogger(ReceiptPoller.class);
    static final String RECEIPT_METHOD = "ptx_getTransactionReceipt";

    private final RpcGateway gateway;
    private final Duration pollInterval;

    public ReceiptPoller(RpcGateway gateway, PaladinConfig config) {
        this.gateway = gateway;
        this.pollInterval = config.getPollInterval();
    }

    /**
     * Polls for the receipt of {@code transactionId}.
     *
     * @return the receipt, or empty if none appeared before {@code timeout}
     */
    public Optional<Receipt> await(ConnectionHandle handle, String transactionId, Duration timeout)
            throws InterruptedException {
        Optional<Receipt> receipt = BoundedPoller.poll(pollInterval, timeout, () -> fetch(handle, transactionId));
        if (receipt.isEmpty()) {
            log.warn("No receipt for transaction {} on node {} within {}", transactionId, handle.nodeId(), timeout);
        }
        return receipt;
    }

    private Optional<Receipt> fetch(ConnectionHandle handle, String transactionId) {
        RpcResult result = gateway.invokeOnce(handle, RECEIPT_METHOD, List.of(transactionId));
        if (!result.hasValue()) {
            if (!result.isOk()) {
                log.debug("Receipt lookup for {} failed: {}", transactionId, result.error().reason());
            }
            return Optional.empty();
        }
        return Optional.of(decode(transactionId, result.value()));
    }

    /**
     * Single receipt lookup without waiting.
     */
    public Optional<Receipt> lookup(ConnectionHandle handle, String transactionId) {
        return fetch(handle, transactionId);
    }

    /**
     * Extracts a transaction ID from a submission result, which is either the bare ID or an
     * object carrying an {@code id} field.
     */
    public static Optional<String> transactionId(JsonNode value) {
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isTextual()) {
            return Optional.of(value.asText()).filter(id -> !id.isBlank());
        }
        JsonNode id = value.get("id");
        return id != null && id.isTextual() ? Optional.of(id.asText()) : Optional.empty();
    }

    static Receipt decode(String transactionId, JsonNode node) {
        boolean success = node.path("success").asBoolean(false);
        String failure = text(node, "failureMessage");
        if (!success && failure == null && !node.has("success")) {
            failure = "receipt without success flag";
        }
        return new Receipt(transactionId, success, failure, text(node, "contractAddress"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
