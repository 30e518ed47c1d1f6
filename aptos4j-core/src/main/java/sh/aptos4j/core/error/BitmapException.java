// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.error;

/**
 * Thrown when a multi-signature bitmap is invalid: duplicate index, index beyond the key limit, or a signature count that does not match the set bits.
 *
 * @since 0.1.0
 */
public final class BitmapException extends AptosException {

    public BitmapException(final String message) {
        super(message);
    }

    public BitmapException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
