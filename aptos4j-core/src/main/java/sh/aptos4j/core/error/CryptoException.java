// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.error;

/**
 * Thrown when key or signature material is malformed (wrong length, bad encoding, unknown scheme). Verification itself never throws; it returns {@code false}.
 *
 * @since 0.1.0
 */
public final class CryptoException extends AptosException {

    public CryptoException(final String message) {
        super(message);
    }

    public CryptoException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
