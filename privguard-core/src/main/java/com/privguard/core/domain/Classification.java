package com.privguard.core.domain;

/**
 * Verdict for a single test case. Declaration order is report order.
 */
public enum Classification {
    /** A non-member observed or changed state. */
    BREACH,
    /** The outcome cannot be attributed to an authorization decision. */
    INCONCLUSIVE,
    /** A member was refused. */
    UNEXPECTED_DENIAL,
    PASS
}
