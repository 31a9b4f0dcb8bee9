package com.privguard.core.domain;

import java.util.List;
import java.util.Objects;

/**
 * One cell of the verification matrix after classification.
 */
public record TestCase(
        String groupId,
        String groupName,
        String identityName,
        Operation operation,
        ExpectedOutcome expected,
        ActualOutcome actual,
        Classification classification,
        List<String> findings
) {
    public TestCase {
        Objects.requireNonNull(groupId, "Group ID cannot be null");
        Objects.requireNonNull(identityName, "Identity cannot be null");
        Objects.requireNonNull(operation, "Operation cannot be null");
        Objects.requireNonNull(expected, "Expected outcome cannot be null");
        Objects.requireNonNull(actual, "Actual outcome cannot be null");
        Objects.requireNonNull(classification, "Classification cannot be null");
        findings = findings != null ? List.copyOf(findings) : List.of();
    }

    public String label() {
        return groupName + "/" + identityName + "/" + operation;
    }
}
