package com.privguard.core.domain;

/**
 * Ground-truth decision derived from declared membership.
 */
public enum ExpectedOutcome {
    ALLOW,
    DENY
}
