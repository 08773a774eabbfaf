// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts the raw transaction passed to
 * {@code blockchain.transaction.broadcast}, so signed transactions never end
 * up in logs before they are published</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /**
     * Maximum length for sanitized log output. Logs exceeding this will be truncated.
     */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    static final String REDACTED = "***[REDACTED]***";

    private static final Pattern BROADCAST_PARAMS = Pattern.compile(
            "(\"method\"\\s*:\\s*\"blockchain\\.transaction\\.broadcast\"\\s*,\\s*\"params\"\\s*:\\s*\\[\\s*\")"
                    + "[0-9a-fA-F]+(\")");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("blockchain.transaction.broadcast")) {
            sanitized = BROADCAST_PARAMS.matcher(sanitized)
                    .replaceAll("$1" + Matcher.quoteReplacement(REDACTED) + "$2");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
