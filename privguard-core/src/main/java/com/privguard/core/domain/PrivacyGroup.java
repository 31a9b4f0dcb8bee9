package com.privguard.core.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A scoped execution context with a fixed member set.
 *
 * <p>The member set never changes after creation; a membership change means a new group.
 * The probe contract address is assigned exactly once, and the status only leaves
 * {@link GroupStatus#CREATING} once.</p>
 */
public class PrivacyGroup {

    private final String id;
    private final String name;
    private final Set<String> members;
    private final String creatorNodeId;
    private final AtomicReference<String> contractAddress;
    private final AtomicReference<GroupStatus> status;
    private volatile String failureReason;

    public PrivacyGroup(String id, String name, Set<String> members, String creatorNodeId) {
        Objects.requireNonNull(id, "Group ID cannot be null");
        Objects.requireNonNull(name, "Group name cannot be null");
        Objects.requireNonNull(members, "Members cannot be null");
        Objects.requireNonNull(creatorNodeId, "Creator node cannot be null");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A privacy group needs at least one member");
        }
        this.id = id;
        this.name = name;
        this.members = Collections.unmodifiableSet(new LinkedHashSet<>(members));
        this.creatorNodeId = creatorNodeId;
        this.contractAddress = new AtomicReference<>();
        this.status = new AtomicReference<>(GroupStatus.CREATING);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Set<String> members() {
        return members;
    }

    public boolean isMember(String identityName) {
        return identityName != null && members.contains(identityName);
    }

    public String creatorNodeId() {
        return creatorNodeId;
    }

    public GroupStatus status() {
        return status.get();
    }

    public Optional<String> contractAddress() {
        return Optional.ofNullable(contractAddress.get());
    }

    public Optional<String> failureReason() {
        return Optional.ofNullable(failureReason);
    }

    /**
     * Eligible for the verification matrix.
     */
    public boolean isTestable() {
        return status.get() == GroupStatus.READY && contractAddress.get() != null;
    }

    /**
     * Records the deployed probe contract and moves the group to READY.
     *
     * @throws IllegalStateException if an address was already assigned or the group already failed
     */
    public void markReady(String probeAddress) {
        Objects.requireNonNull(probeAddress, "Contract address cannot be null");
        if (!contractAddress.compareAndSet(null, probeAddress)) {
            throw new IllegalStateException("Probe contract already assigned for group " + id);
        }
        if (!status.compareAndSet(GroupStatus.CREATING, GroupStatus.READY)) {
            throw new IllegalStateException("Group " + id + " is " + status.get() + ", cannot become READY");
        }
    }

    /**
     * Moves the group to FAILED. Has no effect on a group that already left CREATING.
     */
    public boolean markFailed(String reason) {
        if (status.compareAndSet(GroupStatus.CREATING, GroupStatus.FAILED)) {
            this.failureReason = reason;
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "PrivacyGroup{" + name + " (" + id + "), " + status.get() + ", members=" + members + "}";
    }
}
