package com.p14n.postrelay.listener;

import com.p14n.postrelay.data.RelayConfig;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(baseDelay * 2^attempt, maxDelay)}, where
 * {@code attempt} is the number of failures since the last successful read,
 * so the first retry already waits twice the base delay. Stateless; the
 * listener owns the attempt counter.
 */
public class ReconnectPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;

    public ReconnectPolicy(Duration baseDelay, Duration maxDelay) {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("Base delay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Max delay must not be less than base delay");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    public static ReconnectPolicy from(RelayConfig cfg) {
        return new ReconnectPolicy(cfg.reconnectDelay(), cfg.maxReconnectDelay());
    }

    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt cannot be negative");
        }
        long base = baseDelay.toNanos();
        long max = maxDelay.toNanos();
        // base * 2^attempt > max, tested without overflowing
        if (attempt >= Long.SIZE - 1 || base > (max >> attempt)) {
            return maxDelay;
        }
        return Duration.ofNanos(base << attempt);
    }
}
