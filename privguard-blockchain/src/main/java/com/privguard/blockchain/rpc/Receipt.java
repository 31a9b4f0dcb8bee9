package com.privguard.blockchain.rpc;

import java.util.Optional;

/**
 * Confirmation of a submitted transaction.
 */
public record Receipt(String transactionId, boolean success, String failureMessage, String contractAddress) {

    public Optional<String> contract() {
        return Optional.ofNullable(contractAddress).filter(address -> !address.isBlank());
    }
}
