// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.error;

/**
 * Base runtime exception for aptos4j failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * AptosException
 * ├── {@link TypeTagParseException} - unparsable or ill-formed Move types
 * ├── {@link ArgumentMarshalException} - a value does not fit its declared Move type
 * ├── {@link CryptoException} - malformed keys or signatures
 * ├── {@link BitmapException} - invalid multi-signature bitmaps
 * ├── {@link TransportException} - node communication failures
 * └── {@link TxnException} - transaction building and submission failures
 *     ├── {@link sh.aptos4j.core.builder.AptosTxBuilderException AptosTxBuilderException}
 *     ├── {@link ChainMismatchException}
 *     └── {@link TransactionTimeoutException}
 * </pre>
 *
 * <p>
 * Encoding problems raised by the BCS codec are reported as
 * {@link sh.aptos4j.primitives.bcs.BcsException}, which lives in the primitives module and is
 * therefore outside this hierarchy.
 *
 * <pre>{@code
 * try {
 *     client.signAndSubmit(signer, request);
 * } catch (TransportException e) {
 *     // node rejected the request or was unreachable
 * } catch (AptosException e) {
 *     // anything else raised by the SDK
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class AptosException extends RuntimeException
        permits TypeTagParseException,
        ArgumentMarshalException,
        CryptoException,
        BitmapException,
        TransportException,
        TxnException {

    public AptosException(final String message) {
        super(message);
    }

    public AptosException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
