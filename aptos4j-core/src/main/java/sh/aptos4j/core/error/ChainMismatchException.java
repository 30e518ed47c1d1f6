// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.error;

/**
 * Thrown when the node reports a chain id other than the one the client was configured for.
 *
 * @since 0.1.0
 */
public final class ChainMismatchException extends TxnException {

    private final int expected;
    private final int actual;

    public ChainMismatchException(final int expected, final int actual) {
        super("Chain id mismatch: expected " + expected + " but node reports " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
