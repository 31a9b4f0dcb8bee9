package com.privguard.blockchain.rpc;

import com.privguard.blockchain.config.PaladinConfig;
import com.privguard.blockchain.topology.ConnectionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.protocol.core.Request;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Uniform JSON-RPC request/response transport to a node.
 *
 * <p>Transport errors are retried locally with exponential backoff. Rejections are returned as-is
 * and never retried: retrying a refusal could turn an intermittent breach into a false pass.</p>
 */
@Service
public class RpcGateway {

    private static final Logger log = LoggerFactory.getLogger(RpcGateway.class);

    private final DenialClassifier denials;
    private final int transportRetries;
    private final Duration retryBackoff;

    public RpcGateway(PaladinConfig config) {
        if (config.getTransportRetries() < 0) {
            throw new IllegalArgumentException("Transport retries cannot be negative");
        }
        this.denials = new DenialClassifier(config.getStructuredDenialCodes(), config.getExtraDenialPhrases());
        this.transportRetries = config.getTransportRetries();
        this.retryBackoff = Objects.requireNonNull(config.getRetryBackoff(), "Retry backoff cannot be null");
    }

    /**
     * Invokes a method, retrying transport errors.
     */
    public RpcResult invoke(ConnectionHandle handle, String method, List<?> params) {
        RpcResult result = invokeOnce(handle, method, params);
        Duration backoff = retryBackoff;
        for (int retry = 1; retry <= transportRetries && result.isTransportError(); retry++) {
            log.warn("{} on node {} failed ({}), retry {}/{} in {} ms",
                    method, handle.nodeId(), result.error().reason(), retry, transportRetries, backoff.toMillis());
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RpcResult.failed(new GatewayError.Transport("interrupted while backing off: " + method));
            }
            backoff = backoff.multipliedBy(2);
            result = invokeOnce(handle, method, params);
        }
        return result;
    }

    /**
     * Invokes a method exactly once.
     */
    public RpcResult invokeOnce(ConnectionHandle handle, String method, List<?> params) {
        Objects.requireNonNull(handle, "Connection cannot be null");
        Objects.requireNonNull(method, "Method cannot be null");
        List<Object> arguments = params != null ? List.copyOf(params) : List.of();
        try {
            PaladinResponse response = new Request<>(method, arguments, handle.service(), PaladinResponse.class)
                    .send();
            if (response == null) {
                return RpcResult.failed(new GatewayError.Transport("empty response to " + method));
            }
            if (response.hasError()) {
                GatewayError error = denials.classify(response.getError());
                log.debug("{} on node {} returned error {} -> {}",
                        method, handle.nodeId(), response.getError().getCode(), error);
                return RpcResult.failed(error);
            }
            log.debug("{} on node {} succeeded", method, handle.nodeId());
            return RpcResult.ok(response.getResult());
        } catch (IOException e) {
            return RpcResult.failed(new GatewayError.Transport(
                    e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "")));
        }
    }

    public DenialClassifier denials() {
        return denials;
    }
}
