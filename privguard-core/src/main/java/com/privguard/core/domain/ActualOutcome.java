package com.privguard.core.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Observed result of a call against the platform.
 */
public sealed interface ActualOutcome permits ActualOutcome.Success, ActualOutcome.Denied, ActualOutcome.TransportError {

    String describe();

    static Success success(BigInteger value) {
        return new Success(value);
    }

    static Success committed() {
        return new Success(null);
    }

    static Denied denied(String reason) {
        return new Denied(reason);
    }

    static TransportError transportError(String reason) {
        return new TransportError(reason);
    }

    /**
     * The call went through. {@code value} is the decoded return value of a read, null for writes.
     */
    record Success(BigInteger value) implements ActualOutcome {

        public boolean hasValue() {
            return value != null;
        }

        @Override
        public String describe() {
            return hasValue() ? "success(" + value + ")" : "success";
        }
    }

    /**
     * The platform understood the call and refused it.
     */
    record Denied(String reason) implements ActualOutcome {

        public Denied {
            Objects.requireNonNull(reason, "Reason cannot be null");
        }

        @Override
        public String describe() {
            return "denied: " + reason;
        }
    }

    /**
     * The call failed for a reason that is not an authorization decision.
     */
    record TransportError(String reason) implements ActualOutcome {

        public TransportError {
            Objects.requireNonNull(reason, "Reason cannot be null");
        }

        @Override
        public String describe() {
            return "transport error: " + reason;
        }
    }
}
