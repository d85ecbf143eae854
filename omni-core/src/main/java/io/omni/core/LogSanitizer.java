// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts envelope signatures and the signed transaction of {@code eth_sendRawTransaction}</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern SIGNATURE =
            Pattern.compile("\"signature\"\\s*:\\s*\"[0-9a-fA-Fx]+\"");
    private static final Pattern RAW_TX = Pattern.compile(
            "(\"method\"\\s*:\\s*\"eth_sendRawTransaction\"\\s*,\\s*\"params\"\\s*:\\s*\\[\\s*)\"0x[0-9a-fA-F]+\"");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"signature\"")) {
            sanitized = SIGNATURE.matcher(sanitized).replaceAll("\"signature\":\"***[REDACTED]***\"");
        }

        if (sanitized.contains("eth_sendRawTransaction")) {
            sanitized = RAW_TX.matcher(sanitized).replaceAll("$1\"0x***[REDACTED]***\"");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
