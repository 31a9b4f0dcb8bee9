package com.privguard.core.domain;

/**
 * Lifecycle of a privacy group. Transitions are CREATING -> READY and CREATING -> FAILED.
 */
public enum GroupStatus {
    CREATING,
    READY,
    FAILED
}
