// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.Hex;

/**
 * AIP-80 text form for private keys: {@code <type>-priv-0x<hex>}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * String text = PrivateKeyFormat.format(seed, PrivateKeyFormat.KeyType.ED25519);
 * byte[] seed = PrivateKeyFormat.parse(text, PrivateKeyFormat.KeyType.ED25519, Mode.STRICT);
 * }</pre>
 *
 * @see <a href="https://github.com/aptos-foundation/AIPs/blob/main/aips/aip-80.md">AIP-80</a>
 * @since 0.1.0
 */
public final class PrivateKeyFormat {

    private static final Logger log = LoggerFactory.getLogger(PrivateKeyFormat.class);

    /** Key types with an AIP-80 prefix. */
    public enum KeyType {
        ED25519("ed25519-priv-"),
        SECP256K1("secp256k1-priv-");

        private final String prefix;

        KeyType(final String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    /** How to treat input without the AIP-80 prefix. */
    public enum Mode {
        /** Accept raw hex and log a warning. */
        WARN,
        /** Accept raw hex silently. */
        LENIENT,
        /** Require the AIP-80 prefix. */
        STRICT
    }

    private PrivateKeyFormat() {
        // Utility class
    }

    /**
     * @param keyBytes the raw key
     * @param type     the key type
     * @return e.g. {@code ed25519-priv-0xc5338c...}
     */
    public static String format(final byte[] keyBytes, final KeyType type) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        return type.prefix + Hex.encode(keyBytes);
    }

    /**
     * Parses AIP-80 text, or raw hex unless {@code mode} is {@link Mode#STRICT}.
     *
     * @param text the key text
     * @param type the expected key type
     * @param mode handling of unprefixed input
     * @return the key bytes
     * @throws CryptoException if the text is malformed, has another type's prefix, or lacks the
     *                         prefix in strict mode
     */
    public static byte[] parse(final String text, final KeyType type, final Mode mode) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");

        if (text.startsWith(type.prefix)) {
            return decodeHex(text.substring(type.prefix.length()));
        }
        for (KeyType other : KeyType.values()) {
            if (other != type && text.startsWith(other.prefix)) {
                throw new CryptoException("expected a " + type.prefix + " key but got " + other.prefix);
            }
        }
        if (mode == Mode.STRICT) {
            throw new CryptoException("private key must be AIP-80 compliant when strict mode is enabled");
        }
        final byte[] bytes = decodeHex(text);
        if (mode == Mode.WARN) {
            log.warn("It is recommended that private keys are AIP-80 compliant "
                    + "(https://github.com/aptos-foundation/AIPs/blob/main/aips/aip-80.md)");
        }
        return bytes;
    }

    private static byte[] decodeHex(final String hex) {
        try {
            return Hex.decode(hex);
        } catch (IllegalArgumentException e) {
            throw new CryptoException("invalid private key hex", e);
        }
    }
}
