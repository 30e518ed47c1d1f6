// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core;

import java.util.Locale;

/**
 * Compact bracketed log lines for transport calls and the transaction lifecycle.
 *
 * <p>
 * Every line starts with a tag such as {@code [HTTP]} or {@code [TX-SUBMIT]}. Hashes and
 * addresses are shortened to {@code 0x1234...abcd}; durations are rendered as {@code 1.5ms}
 * or {@code 2.0s}.
 */
public final class LogFormatter {

    private LogFormatter() {
    }

    public static String formatHttp(final String method, final String path, final int status, final long durationMicros) {
        return String.format(Locale.ROOT, "[HTTP] %s %s status=%d time=%s",
                method, path, status, formatDuration(durationMicros));
    }

    public static String formatHttpError(final String method, final String path, final String error, final long durationMicros) {
        return String.format(Locale.ROOT, "[HTTP-ERROR] %s %s error=%s time=%s",
                method, path, error, formatDuration(durationMicros));
    }

    public static String formatTxBuild(final String sender, final long sequenceNumber, final int chainId,
                                       final long maxGasAmount, final long gasUnitPrice) {
        return String.format(Locale.ROOT, "[TX-BUILD] sender=%s seq=%s chain=%d maxGas=%s gasPrice=%s",
                shorten(sender), Long.toUnsignedString(sequenceNumber), chainId,
                Long.toUnsignedString(maxGasAmount), Long.toUnsignedString(gasUnitPrice));
    }

    public static String formatTxSubmit(final String hash, final long durationMicros) {
        return String.format(Locale.ROOT, "[TX-SUBMIT] hash=%s time=%s", shorten(hash), formatDuration(durationMicros));
    }

    public static String formatTxSimulate(final String sender, final int results) {
        return String.format(Locale.ROOT, "[TX-SIMULATE] sender=%s results=%d", shorten(sender), results);
    }

    public static String formatTxWait(final String hash, final long timeoutMillis) {
        return String.format(Locale.ROOT, "[TX-WAIT] hash=%s timeout=%dms", shorten(hash), timeoutMillis);
    }

    public static String formatTxResult(final String hash, final boolean success, final String vmStatus) {
        return String.format(Locale.ROOT, "[TX-RESULT] hash=%s success=%s vmStatus=%s",
                shorten(hash), success, vmStatus);
    }

    /**
     * Shortens long hex values to {@code 0x1234...abcd}.
     *
     * @param value the value, may be null
     * @return the shortened value
     */
    static String shorten(final String value) {
        if (value == null) {
            return "null";
        }
        if (value.length() <= 14) {
            return value;
        }
        return value.substring(0, 6) + "..." + value.substring(value.length() - 4);
    }

    static String formatDuration(final long micros) {
        if (micros < 1_000) {
            return micros + "us";
        }
        if (micros < 1_000_000) {
            return String.format(Locale.ROOT, "%.1fms", micros / 1_000.0);
        }
        return String.format(Locale.ROOT, "%.1fs", micros / 1_000_000.0);
    }
}
