package com.privguard.blockchain.rpc;

import java.util.Objects;

/**
 * Why a gateway call did not produce a result.
 *
 * <p>{@link Transport} means the call never got an authoritative answer: the connection failed,
 * timed out, the reply was malformed, or the node answered with an error that cannot be recognised
 * as an authorization decision. {@link Rejected} means the node understood the call and refused it.
 * Conflating the two would turn every network blip into a false "access denied".</p>
 */
public sealed interface GatewayError permits GatewayError.Transport, GatewayError.Rejected {

    String reason();

    record Transport(String reason) implements GatewayError {
        public Transport {
            Objects.requireNonNull(reason, "Reason cannot be null");
        }
    }

    /**
     * @param code       JSON-RPC error code, null when the refusal came from a receipt
     * @param structured true when recognised by error code, false when by message text
     */
    record Rejected(Integer code, String reason, boolean structured) implements GatewayError {
        public Rejected {
            Objects.requireNonNull(reason, "Reason cannot be null");
        }
    }
}
