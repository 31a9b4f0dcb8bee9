package com.privguard.blockchain.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/**
 * Either a JSON-RPC result or a {@link GatewayError}.
 */
public record RpcResult(JsonNode value, GatewayError error) {

    public RpcResult {
        if (error == null) {
            value = value != null ? value : NullNode.getInstance();
        }
    }

    public static RpcResult ok(JsonNode value) {
        return new RpcResult(value, null);
    }

    public static RpcResult failed(GatewayError error) {
        return new RpcResult(null, Objects.requireNonNull(error, "Error cannot be null"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isRejected() {
        return error instanceof GatewayError.Rejected;
    }

    public boolean isTransportError() {
        return error instanceof GatewayError.Transport;
    }

    /**
     * True when the call succeeded with a non-null result.
     */
    public boolean hasValue() {
        return isOk() && !value.isNull() && !value.isMissingNode();
    }
}
