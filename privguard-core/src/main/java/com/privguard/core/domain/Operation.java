package com.privguard.core.domain;

/**
 * Kind of call made against a group's probe contract.
 */
public enum Operation {
    /** Mutating call ({@code store}). */
    WRITE,
    /** Non-mutating call ({@code retrieve}). */
    READ
}
