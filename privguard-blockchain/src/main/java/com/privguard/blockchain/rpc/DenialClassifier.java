package com.privguard.blockchain.rpc;

import org.web3j.protocol.core.Response;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Separates authorization refusals from every other remote error.
 *
 * <p>Error codes listed as structured denials are authoritative. Paladin does not yet expose a
 * dedicated authorization code, so messages are also matched against a small, fixed phrase table.
 * Anything that matches neither is reported as a transport error and ends up inconclusive.</p>
 */
public class DenialClassifier {

    static final List<String> DEFAULT_PHRASES = List.of(
            "not a member",
            "not authorized",
            "unauthorized",
            "access denied",
            "permission denied",
            "forbidden",
            "privacy group not found"
    );

    private final Set<Integer> denialCodes;
    private final List<String> phrases;

    public DenialClassifier(Collection<Integer> denialCodes, Collection<String> extraPhrases) {
        this.denialCodes = denialCodes != null ? Set.copyOf(new HashSet<>(denialCodes)) : Set.of();
        List<String> table = new ArrayList<>(DEFAULT_PHRASES);
        if (extraPhrases != null) {
            extraPhrases.stream()
                    .filter(phrase -> phrase != null && !phrase.isBlank())
                    .map(phrase -> phrase.toLowerCase(Locale.ROOT).trim())
                    .filter(phrase -> !table.contains(phrase))
                    .forEach(table::add);
        }
        this.phrases = Collections.unmodifiableList(table);
    }

    public static DenialClassifier defaults() {
        return new DenialClassifier(Set.of(), List.of());
    }

    /**
     * Classifies a JSON-RPC error object.
     */
    public GatewayError classify(Response.Error error) {
        if (error == null) {
            return new GatewayError.Transport("error response without error object");
        }
        String message = error.getMessage() != null ? error.getMessage() : "";
        if (denialCodes.contains(error.getCode())) {
            return new GatewayError.Rejected(error.getCode(), message, true);
        }
        if (matchPhrase(message).isPresent()) {
            return new GatewayError.Rejected(error.getCode(), message, false);
        }
        return new GatewayError.Transport("remote error " + error.getCode() + ": " + message);
    }

    /**
     * Classifies a free-text failure, such as a failed receipt's message.
     */
    public GatewayError classifyMessage(String message) {
        String text = message != null ? message : "";
        if (matchPhrase(text).isPresent()) {
            return new GatewayError.Rejected(null, text, false);
        }
        return new GatewayError.Transport(text.isEmpty() ? "failure without message" : text);
    }

    public Optional<String> matchPhrase(String message) {
        if (message == null || message.isEmpty()) {
            return Optional.empty();
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return phrases.stream().filter(lower::contains).findFirst();
    }

    public List<String> phrases() {
        return phrases;
    }
}
