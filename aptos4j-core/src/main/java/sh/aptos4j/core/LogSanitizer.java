// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core;

import java.util.regex.Pattern;

/**
 * Removes sensitive data from debug log payloads.
 *
 * <p>
 * Redacts AIP-80 private keys ({@code ed25519-priv-0x...}, {@code secp256k1-priv-0x...}) and
 * JSON {@code "private_key"} / {@code "privateKey"} values, then truncates overly long output.
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern AIP80_KEY_PATTERN =
            Pattern.compile("(ed25519|secp256k1)-priv-(0x)?[0-9a-fA-F]+");

    private static final Pattern JSON_KEY_PATTERN =
            Pattern.compile("\"(private_key|privateKey)\"\\s*:\\s*\"[^\"]+\"");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("-priv-")) {
            sanitized = AIP80_KEY_PATTERN.matcher(sanitized).replaceAll("$1-priv-***[REDACTED]***");
        }

        if (sanitized.contains("rivate")) {
            sanitized = JSON_KEY_PATTERN.matcher(sanitized).replaceAll("\"$1\":\"***[REDACTED]***\"");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            final int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
