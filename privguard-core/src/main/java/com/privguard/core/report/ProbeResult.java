package com.privguard.core.report;

import com.privguard.core.domain.ActualOutcome;
import com.privguard.core.domain.ExpectedOutcome;
import com.privguard.core.domain.Operation;

import java.util.List;
import java.util.Objects;

/**
 * Raw, unclassified observations for one (group, identity, operation) cell.
 * Reads carry one outcome per repetition.
 */
public record ProbeResult(
        String groupId,
        String groupName,
        String identityName,
        Operation operation,
        ProbeRole role,
        ExpectedOutcome expected,
        List<ActualOutcome> outcomes
) {
    public ProbeResult {
        Objects.requireNonNull(groupId, "Group ID cannot be null");
        Objects.requireNonNull(identityName, "Identity cannot be null");
        Objects.requireNonNull(operation, "Operation cannot be null");
        Objects.requireNonNull(role, "Role cannot be null");
        Objects.requireNonNull(expected, "Expected outcome cannot be null");
        Objects.requireNonNull(outcomes, "Outcomes cannot be null");
        if (outcomes.isEmpty()) {
            throw new IllegalArgumentException("At least one outcome is required");
        }
        outcomes = List.copyOf(outcomes);
    }

    public static ProbeResult single(String groupId, String groupName, String identityName,
                                     Operation operation, ProbeRole role,
                                     ExpectedOutcome expected, ActualOutcome outcome) {
        return new ProbeResult(groupId, groupName, identityName, operation, role, expected, List.of(outcome));
    }

    public ActualOutcome first() {
        return outcomes.get(0);
    }
}
