// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for the opt-in {@link FaultsetDebug} channels.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.faultset.debug");

    private DebugLogger() {
    }

    public static void logRegistry(final String message, final Object... args) {
        if (!FaultsetDebug.isRegistryLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logConstruction(final String message, final Object... args) {
        if (!FaultsetDebug.isConstructionLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!FaultsetDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
