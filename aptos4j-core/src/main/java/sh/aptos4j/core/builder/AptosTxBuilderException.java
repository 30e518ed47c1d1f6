// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.builder;

import sh.aptos4j.core.error.TxnException;

/** Thrown when a transaction builder or request is in an invalid state. */
public final class AptosTxBuilderException extends TxnException {
    public AptosTxBuilderException(final String message) {
        super(message);
    }

    public AptosTxBuilderException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
