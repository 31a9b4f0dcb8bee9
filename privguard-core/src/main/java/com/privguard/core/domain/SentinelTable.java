package com.privguard.core.domain;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One sentinel slot per group, written once by the group's own worker and read-only afterwards.
 *
 * <p>Sentinels are drawn from {@code [2^64, 2^127)} and throwaway values from {@code [1, 2^32)},
 * so a throwaway write can never be mistaken for a sentinel.</p>
 */
public class SentinelTable {

    private static final BigInteger SENTINEL_FLOOR = BigInteger.ONE.shiftLeft(64);
    private static final int SENTINEL_RANDOM_BITS = 126;
    private static final int THROWAWAY_BITS = 32;

    private final Map<String, BigInteger> sentinels;
    private final Map<BigInteger, String> owners;
    private final Set<String> confirmed;
    private final SecureRandom random;

    public SentinelTable() {
        this(new SecureRandom());
    }

    public SentinelTable(SecureRandom random) {
        this.sentinels = new ConcurrentHashMap<>();
        this.owners = new ConcurrentHashMap<>();
        this.confirmed = ConcurrentHashMap.newKeySet();
        this.random = Objects.requireNonNull(random, "Random cannot be null");
    }

    /**
     * Draws a fresh group-unique sentinel and stores it in the group's slot.
     *
     * @throws IllegalStateException if the group already has a sentinel
     */
    public BigInteger assign(String groupId) {
        Objects.requireNonNull(groupId, "Group ID cannot be null");
        while (true) {
            BigInteger candidate = new BigInteger(SENTINEL_RANDOM_BITS, random).add(SENTINEL_FLOOR);
            if (owners.putIfAbsent(candidate, groupId) != null) {
                continue;
            }
            if (sentinels.putIfAbsent(groupId, candidate) != null) {
                owners.remove(candidate);
                throw new IllegalStateException("Sentinel already assigned for group " + groupId);
            }
            return candidate;
        }
    }

    /**
     * Marks the group's sentinel as committed on the platform.
     */
    public void confirm(String groupId) {
        if (!sentinels.containsKey(groupId)) {
            throw new IllegalStateException("No sentinel assigned for group " + groupId);
        }
        confirmed.add(groupId);
    }

    public Optional<BigInteger> sentinelOf(String groupId) {
        return Optional.ofNullable(sentinels.get(groupId));
    }

    /**
     * Sentinel of a group whose establishing write was confirmed.
     */
    public Optional<BigInteger> confirmedSentinelOf(String groupId) {
        return confirmed.contains(groupId) ? sentinelOf(groupId) : Optional.empty();
    }

    /**
     * Group that owns the given value as its sentinel, if any.
     */
    public Optional<String> ownerOf(BigInteger value) {
        return value == null ? Optional.empty() : Optional.ofNullable(owners.get(value));
    }

    public BigInteger newThrowaway() {
        BigInteger value;
        do {
            value = new BigInteger(THROWAWAY_BITS, random);
        } while (value.signum() == 0);
        return value;
    }

    public static boolean isSentinelRange(BigInteger value) {
        return value != null && value.compareTo(SENTINEL_FLOOR) >= 0;
    }

    public int size() {
        return sentinels.size();
    }
}
