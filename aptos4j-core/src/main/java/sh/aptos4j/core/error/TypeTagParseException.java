// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.error;

/**
 * Thrown when a Move type string or type tag is ill-formed: bad syntax, wrong arity, type parameters on a primitive, or a generic index out of bounds.
 *
 * @since 0.1.0
 */
public final class TypeTagParseException extends AptosException {

    public TypeTagParseException(final String message) {
        super(message);
    }

    public TypeTagParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
