// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.aptos4j.core.crypto.PrivateKeyFormat.KeyType;
import sh.aptos4j.core.crypto.PrivateKeyFormat.Mode;
import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.Hex;

class PrivateKeyFormatTest {

    private static final String RAW = "0xc5338cd251c22daa8c9c9cc94f498cc8a5c7e1d2e75287a5dda91096fe64efa5";

    private final Logger logger = (Logger) LoggerFactory.getLogger(PrivateKeyFormat.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    void formatsWithPrefix() {
        assertEquals("ed25519-priv-" + RAW, PrivateKeyFormat.format(Hex.decode(RAW), KeyType.ED25519));
        assertEquals("secp256k1-priv-" + RAW, PrivateKeyFormat.format(Hex.decode(RAW), KeyType.SECP256K1));
    }

    @Test
    void parsesPrefixedKeyWithoutWarning() {
        byte[] bytes = PrivateKeyFormat.parse("ed25519-priv-" + RAW, KeyType.ED25519, Mode.STRICT);

        assertArrayEquals(Hex.decode(RAW), bytes);
        assertTrue(appender.list.isEmpty());
    }

    @Test
    @DisplayName("raw hex in WARN mode logs an AIP-80 recommendation")
    void warnsOnRawHex() {
        byte[] bytes = PrivateKeyFormat.parse(RAW, KeyType.ED25519, Mode.WARN);

        assertArrayEquals(Hex.decode(RAW), bytes);
        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().startsWith("It is recommended that private keys are AIP-80 compliant"));
        assertFalse(event.getFormattedMessage().contains(RAW.substring(2)));
    }

    @Test
    void lenientModeIsSilent() {
        PrivateKeyFormat.parse(RAW, KeyType.SECP256K1, Mode.LENIENT);
        assertTrue(appender.list.isEmpty());
    }

    @Test
    void strictModeRequiresPrefix() {
        CryptoException e = assertThrows(CryptoException.class,
                () -> PrivateKeyFormat.parse(RAW, KeyType.ED25519, Mode.STRICT));
        assertEquals("private key must be AIP-80 compliant when strict mode is enabled", e.getMessage());
    }

    @Test
    void rejectsOtherKeyTypePrefix() {
        assertThrows(CryptoException.class,
                () -> PrivateKeyFormat.parse("secp256k1-priv-" + RAW, KeyType.ED25519, Mode.LENIENT));
    }

    @Test
    void rejectsMalformedHex() {
        assertThrows(CryptoException.class,
                () -> PrivateKeyFormat.parse("ed25519-priv-0xzz", KeyType.ED25519, Mode.LENIENT));
    }
}
