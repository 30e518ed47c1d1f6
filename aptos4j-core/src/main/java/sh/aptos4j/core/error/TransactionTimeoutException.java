// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.error;

import java.time.Duration;

/**
 * Thrown when a submitted transaction is still pending after the wait timeout.
 *
 * @since 0.1.0
 */
public final class TransactionTimeoutException extends TxnException {

    private final String hash;

    public TransactionTimeoutException(final String hash, final Duration timeout) {
        super("Timed out after " + timeout.toMillis() + "ms waiting for transaction " + hash);
        this.hash = hash;
    }

    public String hash() {
        return hash;
    }
}
