// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.core;

/**
 * Formatter for structured debug lines.
 *
 * <p>
 * All lines use a bracketed {@code [OPERATION]} prefix followed by
 * {@code key=value} pairs, with long hex values shortened to
 * {@code 0x1234...5678} and durations shown as {@code 1.50ms} or
 * {@code 2.00s}.
 *
 * <pre>{@code
 * DebugLogger.logRpc(LogFormatter.formatRpc("eth_getBalance", 1050));
 * // [RPC] method=eth_getBalance duration=1.05ms
 *
 * DebugLogger.logRpc(LogFormatter.formatRpcError("eth_call", -32000, "execution reverted", 980));
 * // [RPC-ERROR] method=eth_call code=-32000 message=execution reverted duration=0.98ms
 * }</pre>
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;

    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: [RPC] method=eth_chainId duration=1.06ms
     */
    public static String formatRpc(String method, long durationMicros) {
        return String.format("[RPC] method=%s %s", method, duration(durationMicros));
    }

    /**
     * Format: [RPC-REQUEST] method=eth_getBalance frame={"id":"3f9a...",...}
     *
     * <p>
     * The frame carries the call's signature; {@link DebugLogger} sanitizes it.
     */
    public static String formatRpcRequest(String method, String frame) {
        return "[RPC-REQUEST] method=" + method + " frame=" + frame;
    }

    /**
     * Format: [RPC-ERROR] method=eth_call code=-32000 message=error duration=1.50ms
     */
    public static String formatRpcError(String method, Object code, String message, long durationMicros) {
        return String.format(
                "[RPC-ERROR] method=%s code=%s message=%s %s",
                method, code, message, duration(durationMicros));
    }

    /**
     * Format: [RPC-CACHED] method=omni_getNFTs servedBy=validator-2
     */
    public static String formatRpcCached(String method, String servedBy) {
        return String.format("[RPC-CACHED] method=%s servedBy=%s", method, servedBy);
    }

    /**
     * Format: [CONNECT] endpoint=wss://validator1.example:8546 attempt=2
     */
    public static String formatConnect(String endpoint, long attempt) {
        return String.format("[CONNECT] endpoint=%s attempt=%d", endpoint, attempt);
    }

    /**
     * Format: [TX-BROADCAST] hash=0x1234...5678 route=http duration=3.20ms
     */
    public static String formatBroadcast(String hash, String route, long durationMicros) {
        return String.format(
                "[TX-BROADCAST] hash=%s route=%s %s",
                shortenHash(hash), route, duration(durationMicros));
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return "duration=" + formatted;
    }

    /**
     * Shortens a hash to a readable format: {@code 0xabcd...ef12}.
     */
    static String shortenHash(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
