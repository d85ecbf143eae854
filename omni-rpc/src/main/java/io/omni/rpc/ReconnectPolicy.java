// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff with a cap and a bounded number of consecutive
 * attempts.
 *
 * @param baseDelay   delay unit; attempt {@code n} waits {@code baseDelay * 2^n}
 * @param maxDelay    upper bound on any single delay
 * @param maxAttempts consecutive unexpected closures tolerated before the
 *                    connection gives up
 */
public record ReconnectPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {

    public static final ReconnectPolicy DEFAULT =
            new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 5);

    public ReconnectPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
    }

    /**
     * Returns {@code min(baseDelay * 2^attempts, maxDelay)}.
     */
    public Duration delayFor(final int attempts) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0");
        }
        final long base = baseDelay.toMillis();
        final long cap = maxDelay.toMillis();
        // base << attempts would exceed cap (or overflow)
        if (attempts >= Long.SIZE - 1 || base > (cap >> attempts)) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(base << attempts, cap));
    }
}
