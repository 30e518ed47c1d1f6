// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central debug logger. Output goes to the {@code sh.aptos4j.debug} SLF4J logger at INFO,
 * gated by the flags in {@link AptosDebug}.
 */
public final class DebugLogger {

    /** Logger name that applications can route or silence independently. */
    public static final String LOGGER_NAME = "sh.aptos4j.debug";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private DebugLogger() {
    }

    public static void logTransport(final String message, final Object... args) {
        if (!AptosDebug.isTransportLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logTx(final String message, final Object... args) {
        if (!AptosDebug.isTxLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects the global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!AptosDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    // Always sanitized: payloads may carry key material.
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : String.format(message, args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
