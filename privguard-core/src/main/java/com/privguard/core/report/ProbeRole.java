package com.privguard.core.report;

/**
 * Why a call was made within a group's matrix.
 */
public enum ProbeRole {
    /** The member write that establishes the group's sentinel. */
    SENTINEL_WRITE,
    READ,
    /** A write carrying a throwaway value, issued after every read finished. */
    WRITE_PROBE
}
