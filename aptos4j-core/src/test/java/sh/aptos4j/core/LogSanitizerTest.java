// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void redactsAip80Keys() {
        String input = "key=secp256k1-priv-0xd107155adf816a0a94c6db3c9489c13ad8a1eda7ada2e558ba3bfa47c020347e done";

        assertEquals("key=secp256k1-priv-***[REDACTED]*** done", LogSanitizer.sanitize(input));
    }

    @Test
    void redactsJsonPrivateKeyFields() {
        assertEquals("{\"private_key\":\"***[REDACTED]***\"}",
                LogSanitizer.sanitize("{\"private_key\":\"0x1234\"}"));
        assertEquals("{\"privateKey\":\"***[REDACTED]***\"}",
                LogSanitizer.sanitize("{\"privateKey\" : \"abcd\"}"));
    }

    @Test
    void leavesPublicDataAlone() {
        String input = "{\"sender\":\"0x1\",\"public_key\":\"0xde19e5d1\"}";
        assertEquals(input, LogSanitizer.sanitize(input));
    }

    @Test
    void nullBecomesLiteral() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }

    @Test
    void truncatesToExactMaxLength() {
        String sanitized = LogSanitizer.sanitize("x".repeat(3000));

        assertEquals(2000, sanitized.length());
        assertEquals("x".repeat(1986) + "...(truncated)", sanitized);
    }

    @Test
    void doesNotTruncateAtExactLimit() {
        String exactLimit = "y".repeat(2000);
        assertEquals(exactLimit, LogSanitizer.sanitize(exactLimit));
        assertTrue(LogSanitizer.sanitize("y".repeat(2001)).endsWith("...(truncated)"));
    }
}
