package com.privguard.harness.orchestrator;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A declared group: a name and its ordered member names. The first member writes the sentinel.
 */
public record GroupDefinition(String name, List<String> members) {

    public GroupDefinition {
        Objects.requireNonNull(name, "Group name cannot be null");
        Objects.requireNonNull(members, "Members cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Group name cannot be blank");
        }
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Group " + name + " needs at least one member");
        }
        if (new LinkedHashSet<>(members).size() != members.size()) {
            throw new IllegalArgumentException("Group " + name + " lists a member twice: " + members);
        }
        members = List.copyOf(members);
    }

    public static GroupDefinition of(String name, String... members) {
        return new GroupDefinition(name, List.of(members));
    }
}
