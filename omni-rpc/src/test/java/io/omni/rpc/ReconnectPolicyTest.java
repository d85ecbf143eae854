// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class ReconnectPolicyTest {

    @Test
    void defaultsDoubleUpToCap() {
        ReconnectPolicy policy = ReconnectPolicy.DEFAULT;

        assertEquals(5, policy.maxAttempts());
        assertEquals(Duration.ofSeconds(1), policy.delayFor(0));
        assertEquals(Duration.ofSeconds(2), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(16), policy.delayFor(4));
        assertEquals(Duration.ofSeconds(30), policy.delayFor(5));
    }

    @Test
    void largeAttemptCountsDoNotOverflow() {
        ReconnectPolicy policy = ReconnectPolicy.DEFAULT;

        assertEquals(Duration.ofSeconds(30), policy.delayFor(62));
        assertEquals(Duration.ofSeconds(30), policy.delayFor(1_000));
    }

    @Test
    void exactCapIsReached() {
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ofMillis(100), Duration.ofMillis(800), 3);

        assertEquals(Duration.ofMillis(800), policy.delayFor(3));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ZERO, Duration.ofSeconds(1), 3));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 3));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), 0));
        assertThrows(IllegalArgumentException.class, () -> ReconnectPolicy.DEFAULT.delayFor(-1));
    }
}
