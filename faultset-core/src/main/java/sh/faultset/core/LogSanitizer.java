// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core;

import java.util.regex.Pattern;

/**
 * Utility that keeps debug log payloads readable.
 *
 * <p>
 * Performs two operations:
 * <ul>
 * <li>Collapses line breaks, since member renderings may span several lines</li>
 * <li>Truncates excessively long logs; a group may hold thousands of members</li>
 * </ul>
 */
public final class LogSanitizer {

    /**
     * Maximum length for sanitized log output. Logs exceeding this will be truncated.
     */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern LINE_BREAKS = Pattern.compile("\\R\\s*");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = LINE_BREAKS.matcher(input).replaceAll(" | ");

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
