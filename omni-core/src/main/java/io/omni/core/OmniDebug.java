// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.core;

/**
 * Global toggle for enabling verbose per-call debug logging.
 */
public final class OmniDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean connectionLogging = false;

    private OmniDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || connectionLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        connectionLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setConnectionLogging(final boolean enabled) {
        connectionLogging = enabled;
    }

    public static boolean isConnectionLoggingEnabled() {
        return connectionLogging;
    }
}
