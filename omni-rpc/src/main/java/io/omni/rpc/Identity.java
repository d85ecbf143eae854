// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import java.security.SecureRandom;
import java.util.Objects;

import io.omni.core.Hex;

/**
 * The credentials a client authenticates with: its id, the secret shared with
 * the validators, and the protocol version it speaks.
 *
 * <p>
 * {@link #toString()} never includes the shared secret.
 *
 * @param clientId        the wallet's client id, e.g. {@code omni_lx3k9a2b_3f9a0c1d2e4b5a69}
 * @param sharedSecret    the pre-shared HMAC key
 * @param protocolVersion the protocol version sent in every envelope
 */
public record Identity(String clientId, String sharedSecret, String protocolVersion) {

    /** Protocol version spoken by this client. */
    public static final String DEFAULT_PROTOCOL_VERSION = "1.0.0";

    private static final SecureRandom RANDOM = new SecureRandom();

    public Identity {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(sharedSecret, "sharedSecret");
        if (clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be blank");
        }
        if (sharedSecret.isEmpty()) {
            throw new IllegalArgumentException("sharedSecret must not be empty");
        }
        if (protocolVersion == null || protocolVersion.isBlank()) {
            protocolVersion = DEFAULT_PROTOCOL_VERSION;
        }
    }

    /**
     * Creates an identity with a freshly generated client id and the default
     * protocol version.
     */
    public static Identity generate(final String sharedSecret) {
        return new Identity(generateClientId(), sharedSecret, DEFAULT_PROTOCOL_VERSION);
    }

    /**
     * Generates a client id of the form {@code omni_<base36 millis>_<16 hex chars>}.
     */
    public static String generateClientId() {
        final byte[] random = new byte[8];
        RANDOM.nextBytes(random);
        return "omni_" + Long.toString(System.currentTimeMillis(), 36) + "_" + Hex.encodeNoPrefix(random);
    }

    @Override
    public String toString() {
        return "Identity[clientId=" + clientId + ", sharedSecret=***, protocolVersion=" + protocolVersion + "]";
    }
}
