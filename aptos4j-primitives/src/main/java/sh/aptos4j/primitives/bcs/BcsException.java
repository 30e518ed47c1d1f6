// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.primitives.bcs;

/**
 * Thrown when a value cannot be written or read in BCS form.
 *
 * <p>On the read side this is recorded on the {@link Deserializer} rather than thrown, and
 * surfaces from {@link Bcs#deserialize(byte[], BcsReader)}.
 *
 * @since 0.1.0
 */
public final class BcsException extends RuntimeException {

    public BcsException(final String message) {
        super(message);
    }

    public BcsException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
