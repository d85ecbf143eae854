// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import java.time.Clock;
import java.util.Objects;

import io.omni.core.Hex;
import io.omni.core.crypto.HmacSha256;

/**
 * Signs outgoing calls so a validator can check them against the shared
 * secret.
 *
 * <p>
 * The signature is {@code hex(HMAC-SHA256(sharedSecret, clientId:method:timestamp:sharedSecret))},
 * lowercase without a {@code 0x} prefix. Validators are expected to reject
 * envelopes whose timestamp falls outside their freshness window; this class
 * only stamps the current wall-clock time.
 */
public final class Authenticator {

    private final Identity identity;
    private final Clock clock;

    public Authenticator(final Identity identity) {
        this(identity, Clock.systemUTC());
    }

    public Authenticator(final Identity identity, final Clock clock) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Computes the signature for one call. Pure and deterministic.
     *
     * @param clientId     the signing client's id
     * @param method       the method being called
     * @param timestamp    wall-clock time in milliseconds
     * @param sharedSecret the pre-shared secret
     * @return 64 lowercase hex characters
     */
    public static String sign(
            final String clientId, final String method, final long timestamp, final String sharedSecret) {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(sharedSecret, "sharedSecret");
        final String message = clientId + ":" + method + ":" + timestamp + ":" + sharedSecret;
        return Hex.encodeNoPrefix(HmacSha256.mac(sharedSecret, message));
    }

    /**
     * Builds the {@code auth} block for a call to {@code method}, stamped with
     * the current time.
     */
    public Envelope.Auth authenticate(final String method) {
        final long timestamp = clock.millis();
        return new Envelope.Auth(
                identity.clientId(),
                sign(identity.clientId(), method, timestamp, identity.sharedSecret()),
                timestamp,
                identity.protocolVersion());
    }

    public Identity identity() {
        return identity;
    }
}
