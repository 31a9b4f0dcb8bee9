package com.privguard.core.report;

import java.util.List;
import java.util.Objects;

/**
 * A declared group that never entered the matrix.
 *
 * @param groupId null when the group was never created on the platform
 */
public record ExcludedGroup(String groupName, String groupId, List<String> members, Reason reason, String detail) {

    public ExcludedGroup {
        Objects.requireNonNull(groupName, "Group name cannot be null");
        Objects.requireNonNull(reason, "Reason cannot be null");
        members = members != null ? List.copyOf(members) : List.of();
    }

    public enum Reason {
        /** A member's home node is unreachable. */
        TOPOLOGY,
        /** The group was not confirmed before the deadline. */
        CONFIRMATION_TIMEOUT,
        /** The probe contract could not be deployed. */
        DEPLOYMENT_FAILED,
        /** The creation request itself failed. */
        CREATION_FAILED,
        /** The group worker stopped on an unexpected error; its observations are lost. */
        ABORTED
    }
}
