package com.privguard.blockchain.rpc;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed-interval polling with an overall deadline.
 */
public final class BoundedPoller {

    private BoundedPoller() {}

    /**
     * Runs {@code attempt} until it yields a value or the deadline passes. The first attempt is
     * made immediately; at least one attempt is always made.
     */
    public static <T> Optional<T> poll(Duration interval, Duration timeout, Attempt<T> attempt)
            throws InterruptedException {
        Objects.requireNonNull(interval, "Interval cannot be null");
        Objects.requireNonNull(timeout, "Timeout cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Optional<T> result = attempt.run();
            if (result.isPresent()) {
                return result;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            Thread.sleep(Math.max(1, Math.min(interval.toMillis(), Duration.ofNanos(remaining).toMillis())));
        }
    }

    @FunctionalInterface
    public interface Attempt<T> {
        Optional<T> run();
    }
}
