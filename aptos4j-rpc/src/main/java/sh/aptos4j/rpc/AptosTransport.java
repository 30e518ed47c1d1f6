// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.rpc;

import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.aptos4j.core.error.TransactionTimeoutException;
import sh.aptos4j.core.error.TransportException;
import sh.aptos4j.core.types.AccountAddress;

/**
 * Boundary between transaction building and an Aptos node.
 *
 * <p>
 * Payloads cross the boundary as BCS bytes, so implementations need no knowledge of the
 * transaction model. Implementations are free to cache, retry and back off.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe.
 *
 * <p>
 * <strong>Built-in Implementations:</strong>
 * <ul>
 * <li>{@link HttpAptosTransport} - the node REST API over HTTP/HTTPS</li>
 * </ul>
 *
 * @since 0.1.0
 */
public interface AptosTransport extends AutoCloseable {

    /**
     * @return the chain id the node reports
     * @throws TransportException if the node cannot be reached or answers with an error
     */
    int getChainId();

    /**
     * Returns the next sequence number for {@code address}. Accounts the node has never seen
     * start at zero.
     *
     * @param address the account
     * @return the sequence number, unsigned
     * @throws TransportException if the request fails
     */
    long getSequenceNumber(AccountAddress address);

    /**
     * Submits a BCS-encoded signed transaction.
     *
     * @param bcsSignedTransaction the encoded transaction
     * @return the transaction hash the node accepted, 0x-prefixed
     * @throws TransportException if the node rejects the transaction
     */
    String submitSignedTransaction(byte[] bcsSignedTransaction);

    /**
     * Blocks until the transaction is committed or the implementation's wait timeout elapses.
     *
     * @param hash the 0x-prefixed transaction hash
     * @return the committed result
     * @throws TransactionTimeoutException if the transaction is still pending at the deadline
     * @throws TransportException          if the request fails
     */
    TransactionResult waitForTransaction(String hash);

    /**
     * Calls a view function.
     *
     * @param bcsViewPayload the BCS-encoded view request
     * @param ledgerVersion  the ledger version to read at, or null for the latest
     * @return the decoded JSON return values
     * @throws TransportException if the request fails
     */
    List<Object> view(byte[] bcsViewPayload, @Nullable Long ledgerVersion);

    /**
     * @return the node's gas unit price estimate in octas
     * @throws TransportException if the request fails
     */
    long estimateGasPrice();

    /**
     * Simulates a signed transaction. The transaction must carry simulation authenticators.
     *
     * @param bcsSignedTransaction the encoded simulation transaction
     * @return the simulated outcomes
     * @throws TransportException if the request fails
     */
    List<TransactionResult> simulateTransaction(byte[] bcsSignedTransaction);

    /**
     * Creates a default HTTP transport.
     *
     * @param url the node REST base URL
     * @return a new transport
     */
    static AptosTransport http(final String url) {
        return HttpAptosTransport.builder(url).build();
    }

    @Override
    default void close() {
    }
}
