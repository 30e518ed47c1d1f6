// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core;

/**
 * Global toggle for verbose debug logging across aptos4j modules.
 *
 * <p>Each flag is volatile. {@link #isEnabled()} reads both flags without locking; a brief
 * inconsistency during concurrent updates only affects whether one log line is emitted.
 */
public final class AptosDebug {

    private static volatile boolean transportLogging = false;
    private static volatile boolean txLogging = false;

    private AptosDebug() {
    }

    /**
     * @return true if either transport or transaction logging is enabled
     */
    public static boolean isEnabled() {
        return transportLogging || txLogging;
    }

    public static void setEnabled(final boolean enabled) {
        transportLogging = enabled;
        txLogging = enabled;
    }

    public static void setTransportLogging(final boolean enabled) {
        transportLogging = enabled;
    }

    public static boolean isTransportLoggingEnabled() {
        return transportLogging;
    }

    public static void setTxLogging(final boolean enabled) {
        txLogging = enabled;
    }

    public static boolean isTxLoggingEnabled() {
        return txLogging;
    }
}
