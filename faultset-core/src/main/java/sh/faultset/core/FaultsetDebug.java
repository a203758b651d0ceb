// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core;

/**
 * Global toggle for enabling verbose debug logging across faultset.
 *
 * <p>Initial values come from the system properties {@code faultset.debug}
 * (both channels), {@code faultset.debug.registry} and
 * {@code faultset.debug.construction}. They can be changed at runtime.
 *
 * <p>Thread safety: the individual flags are volatile. The compound check in
 * {@link #isEnabled()} is not atomic, which only matters for best-effort logging.
 */
public final class FaultsetDebug {

    private static final boolean ALL_FROM_PROPERTY = Boolean.getBoolean("faultset.debug");

    private static volatile boolean registryLogging =
            ALL_FROM_PROPERTY || Boolean.getBoolean("faultset.debug.registry");
    private static volatile boolean constructionLogging =
            ALL_FROM_PROPERTY || Boolean.getBoolean("faultset.debug.construction");

    private FaultsetDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either registry or construction logging is enabled
     */
    public static boolean isEnabled() {
        return registryLogging || constructionLogging;
    }

    public static void setEnabled(final boolean enabled) {
        registryLogging = enabled;
        constructionLogging = enabled;
    }

    public static void setRegistryLogging(final boolean enabled) {
        registryLogging = enabled;
    }

    public static boolean isRegistryLoggingEnabled() {
        return registryLogging;
    }

    public static void setConstructionLogging(final boolean enabled) {
        constructionLogging = enabled;
    }

    public static boolean isConstructionLoggingEnabled() {
        return constructionLogging;
    }
}
