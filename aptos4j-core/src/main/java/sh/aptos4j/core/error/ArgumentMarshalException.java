// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.error;

/**
 * Thrown when a user value cannot be converted to BCS under its declared Move type:
 * out-of-range integers, nulls where a value is required, or an unsupported Java type.
 *
 * @since 0.1.0
 */
public final class ArgumentMarshalException extends AptosException {

    public ArgumentMarshalException(final String message) {
        super(message);
    }

    public ArgumentMarshalException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * Prefixes the message with the position of the failing argument.
     *
     * @param index zero-based argument index
     * @param cause the underlying failure
     * @return a new exception naming the argument
     */
    public static ArgumentMarshalException atArgument(final int index, final ArgumentMarshalException cause) {
        return new ArgumentMarshalException("argument " + index + ": " + cause.getMessage(), cause);
    }
}
