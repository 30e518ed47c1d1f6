// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.error;

/**
 * Base class for transaction-related failures (building, signing, submission, confirmation).
 * <p>
 * Left {@code non-sealed} so applications can add their own transaction failure types.
 * <p>
 * <strong>SDK-provided subclasses:</strong>
 * <ul>
 * <li>{@link sh.aptos4j.core.builder.AptosTxBuilderException} - invalid builder state</li>
 * <li>{@link ChainMismatchException} - node reports a different chain id</li>
 * <li>{@link TransactionTimeoutException} - transaction not committed in time</li>
 * </ul>
 *
 * @since 0.1.0
 */
public non-sealed class TxnException extends AptosException {

    public TxnException(final String message) {
        super(message);
    }

    public TxnException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public boolean isSequenceNumberTooOld() {
        final String msg = getMessage();
        return msg != null && msg.toUpperCase(java.util.Locale.ROOT).contains("SEQUENCE_NUMBER_TOO_OLD");
    }

    public boolean isExpired() {
        final String msg = getMessage();
        return msg != null && msg.toUpperCase(java.util.Locale.ROOT).contains("TRANSACTION_EXPIRED");
    }
}
