package com.privguard.core.report;

import com.privguard.core.domain.ActualOutcome;
import com.privguard.core.domain.Classification;
import com.privguard.core.domain.ExpectedOutcome;
import com.privguard.core.domain.Operation;
import com.privguard.core.domain.SentinelTable;
import com.privguard.core.domain.TestCase;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns raw probe observations into classified test cases.
 *
 * <p>Classification runs after every group worker finished, so the sentinel table is complete
 * and cross-group leakage can be detected regardless of worker ordering.</p>
 */
public class BreachDetector {

    /** Finding on a group's sentinel write that did not commit; member reads there were not value-checked. */
    public static final String SENTINEL_NOT_COMMITTED = "sentinel write did not commit, member reads not value-checked";

    /**
     * Base decision table for a single observation.
     */
    public static Classification classify(ExpectedOutcome expected, ActualOutcome actual) {
        if (actual instanceof ActualOutcome.Success) {
            return expected == ExpectedOutcome.DENY ? Classification.BREACH : Classification.PASS;
        }
        if (actual instanceof ActualOutcome.TransportError) {
            return Classification.INCONCLUSIVE;
        }
        return expected == ExpectedOutcome.ALLOW ? Classification.UNEXPECTED_DENIAL : Classification.PASS;
    }

    public List<TestCase> evaluateAll(List<ProbeResult> probes, SentinelTable sentinels) {
        List<TestCase> cases = new ArrayList<>(probes.size());
        for (ProbeResult probe : probes) {
            cases.add(evaluate(probe, sentinels));
        }
        return cases;
    }

    public TestCase evaluate(ProbeResult probe, SentinelTable sentinels) {
        List<String> findings = new ArrayList<>();
        ActualOutcome reported = probe.first();

        // A denial on a later repetition never hides an earlier success.
        if (probe.expected() == ExpectedOutcome.DENY) {
            Optional<ActualOutcome> success = probe.outcomes().stream()
                    .filter(ActualOutcome.Success.class::isInstance)
                    .findFirst();
            if (success.isPresent()) {
                reported = success.get();
            }
        }
        Classification classification = classify(probe.expected(), reported);
        if (classification == Classification.BREACH) {
            findings.add(probe.operation() == Operation.WRITE
                    ? "non-member write was committed"
                    : "non-member read succeeded");
        }

        if (probe.role() == ProbeRole.SENTINEL_WRITE && !(reported instanceof ActualOutcome.Success)) {
            findings.add(SENTINEL_NOT_COMMITTED);
        }

        boolean leaked = false;
        for (ActualOutcome outcome : probe.outcomes()) {
            if (!(outcome instanceof ActualOutcome.Success success) || !success.hasValue()) {
                continue;
            }
            Optional<String> owner = sentinels.ownerOf(success.value());
            if (owner.isPresent() && !owner.get().equals(probe.groupId())) {
                String finding = "cross-group leakage: observed sentinel of group " + owner.get();
                if (!findings.contains(finding)) {
                    findings.add(finding);
                }
                reported = success;
                leaked = true;
            } else if (owner.isPresent() && probe.expected() == ExpectedOutcome.DENY
                    && !findings.contains("group sentinel disclosed to non-member")) {
                findings.add("group sentinel disclosed to non-member");
            }
        }
        if (leaked) {
            classification = Classification.BREACH;
        }

        Set<String> distinct = distinctSignatures(probe.outcomes());
        if (distinct.size() > 1) {
            findings.add("non-deterministic: " + probe.outcomes().size()
                    + " identical calls produced " + distinct);
            if (classification != Classification.BREACH) {
                classification = Classification.INCONCLUSIVE;
            }
        }

        if (classification == Classification.PASS
                && probe.operation() == Operation.READ
                && probe.expected() == ExpectedOutcome.ALLOW
                && reported instanceof ActualOutcome.Success success) {
            Optional<BigInteger> sentinel = sentinels.confirmedSentinelOf(probe.groupId());
            if (sentinel.isEmpty()) {
                findings.add("sentinel not established, returned value not compared");
            } else if (!sentinel.get().equals(success.value())) {
                findings.add("value mismatch: expected " + sentinel.get() + " but read " + success.value());
                classification = Classification.INCONCLUSIVE;
            }
        }

        return new TestCase(
                probe.groupId(),
                probe.groupName(),
                probe.identityName(),
                probe.operation(),
                probe.expected(),
                reported,
                classification,
                findings
        );
    }

    private Set<String> distinctSignatures(List<ActualOutcome> outcomes) {
        Set<String> signatures = new LinkedHashSet<>();
        for (ActualOutcome outcome : outcomes) {
            if (outcome instanceof ActualOutcome.Success success) {
                signatures.add(success.hasValue() ? "success(" + success.value() + ")" : "success");
            } else if (outcome instanceof ActualOutcome.Denied) {
                signatures.add("denied");
            } else {
                signatures.add("transport-error");
            }
        }
        return signatures;
    }
}
