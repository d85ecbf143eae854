// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc.internal;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import io.omni.core.Hex;

/**
 * Internal utility methods shared by the WebSocket and HTTP call paths.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper instance for JSON serialization/deserialization.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    /** Length of a call id in random bytes (128 bits). */
    public static final int CALL_ID_BYTES = 16;

    private static final SecureRandom RANDOM = new SecureRandom();

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns a fresh 128-bit random call id as 32 lowercase hex characters.
     */
    public static String newCallId() {
        final byte[] bytes = new byte[CALL_ID_BYTES];
        RANDOM.nextBytes(bytes);
        return Hex.encodeNoPrefix(bytes);
    }

    /**
     * Recursively extracts error data from nested JSON-RPC error payloads.
     *
     * <p>
     * Common pattern: a node returns {@code {data: {data: "0x..."}}}, this
     * flattens to {@code "0x..."}.
     *
     * @param dataValue the error data object from the response
     * @return extracted error data string, or null if dataValue is null
     */
    public static @Nullable String extractErrorData(final @Nullable Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            return extractFromIterable(map.values(), dataValue);
        }
        if (dataValue instanceof Iterable<?> iterable) {
            return extractFromIterable(iterable, dataValue);
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (final Object item : iterable) {
            final String extracted = extractErrorData(item);
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }

    /**
     * Decodes a numeric result to BigInteger.
     *
     * <p>
     * Strings with a {@code 0x} prefix are read as hex quantities, other
     * strings as decimal; JSON numbers are converted directly. {@code null}
     * and {@code "0x"} decode to zero.
     *
     * @throws NumberFormatException if the value is not numeric
     */
    public static BigInteger decodeQuantity(final @Nullable Object value) {
        if (value == null) {
            return BigInteger.ZERO;
        }
        if (value instanceof BigInteger big) {
            return big;
        }
        if (value instanceof Number number) {
            return new BigInteger(number.toString());
        }
        final String text = value.toString().trim();
        if (text.isEmpty()) {
            return BigInteger.ZERO;
        }
        if (Hex.hasPrefix(text)) {
            final String normalized = Hex.cleanPrefix(text);
            return normalized.isEmpty() ? BigInteger.ZERO : new BigInteger(normalized, 16);
        }
        return new BigInteger(text);
    }

    /**
     * Converts BigInteger to hex quantity string with "0x" prefix.
     */
    public static String toQuantityHex(final BigInteger value) {
        return "0x" + value.toString(16);
    }
}
