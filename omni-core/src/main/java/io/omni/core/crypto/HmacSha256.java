// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * HMAC-SHA256 (RFC 2104) backed by BouncyCastle.
 *
 * <p>
 * A new {@link HMac} is created per call; the BouncyCastle engine is not
 * thread-safe and is cheap to construct.
 */
public final class HmacSha256 {

    /** Output length in bytes. */
    public static final int MAC_LENGTH = 32;

    private HmacSha256() {
        // Utility class
    }

    /**
     * Computes HMAC-SHA256 of {@code data} under {@code key}.
     *
     * @param key  the MAC key (any length)
     * @param data the message
     * @return 32-byte MAC
     * @throws NullPointerException if key or data is null
     */
    public static byte[] mac(final byte[] key, final byte[] data) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(data, "data cannot be null");

        final HMac hmac = new HMac(new SHA256Digest());
        hmac.init(new KeyParameter(key));
        hmac.update(data, 0, data.length);
        final byte[] result = new byte[MAC_LENGTH];
        hmac.doFinal(result, 0);
        return result;
    }

    /**
     * Computes HMAC-SHA256 over UTF-8 encoded strings.
     */
    public static byte[] mac(final String key, final String data) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        return mac(key.getBytes(StandardCharsets.UTF_8), data.getBytes(StandardCharsets.UTF_8));
    }
}
