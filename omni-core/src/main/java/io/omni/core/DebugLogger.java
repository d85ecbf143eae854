// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for per-call and per-connection diagnostics.
 *
 * <p>
 * Output goes to the {@code io.omni.debug} SLF4J logger at INFO, and only when
 * the matching {@link OmniDebug} switch is on. Every line is passed through
 * {@link LogSanitizer} first.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.omni.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!OmniDebug.isRpcLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logConnection(final String message, final Object... args) {
        if (!OmniDebug.isConnectionLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!OmniDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
