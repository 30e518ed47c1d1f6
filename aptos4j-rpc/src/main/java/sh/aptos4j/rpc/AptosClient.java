// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.rpc;

import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.aptos4j.core.auth.Signer;
import sh.aptos4j.core.builder.AptosTxBuilderException;
import sh.aptos4j.core.builder.TransactionRequest;
import sh.aptos4j.core.error.ChainMismatchException;
import sh.aptos4j.core.tx.RawTransaction;
import sh.aptos4j.core.tx.SignedTransaction;
import sh.aptos4j.core.tx.ViewPayload;

/**
 * Builds, signs, simulates and submits transactions for one sending account.
 *
 * <p>
 * Missing request fields are filled before signing: the chain id and sequence number from the
 * node, gas and expiration from {@link sh.aptos4j.core.builder.TransactionDefaults}. The request's
 * sender must be the client's signer.
 *
 * @see DefaultAptosClient
 * @since 0.1.0
 */
public interface AptosClient {

    /**
     * @return the node's chain id, fetched once and cached
     * @throws ChainMismatchException if it differs from the configured chain id
     */
    int chainId();

    /**
     * Fills the request and builds the raw transaction without signing it.
     *
     * @param request the transaction to build
     * @return the raw transaction
     * @throws AptosTxBuilderException if the request's sender is not the client's signer
     */
    RawTransaction prepare(TransactionRequest request);

    /**
     * Simulates a single-sender or multi-agent transaction with zero signatures.
     *
     * @param request   the transaction
     * @param secondary secondary signers, in the order the request names them
     * @param feePayer  the fee payer for a fee-payer request, or null to simulate without one
     * @return the node's simulated results
     */
    List<TransactionResult> simulate(
            TransactionRequest request, List<? extends Signer> secondary, @Nullable Signer feePayer);

    default List<TransactionResult> simulate(final TransactionRequest request) {
        return simulate(request, List.of(), null);
    }

    /**
     * Signs with every participant and submits.
     *
     * @param request   the transaction
     * @param secondary secondary signers, in the order the request names them
     * @param feePayer  the fee payer, required exactly when the request is a fee-payer request
     * @return the submitted transaction hash
     */
    String signAndSubmit(TransactionRequest request, List<? extends Signer> secondary, @Nullable Signer feePayer);

    default String signAndSubmit(final TransactionRequest request) {
        return signAndSubmit(request, List.of(), null);
    }

    /**
     * Signs, submits and waits for the transaction to commit.
     *
     * @param request the single-sender transaction
     * @return the committed result
     */
    TransactionResult signAndSubmitAndWait(TransactionRequest request);

    /**
     * Submits an already signed transaction.
     *
     * @param signed the transaction
     * @return the submitted transaction hash
     */
    String submit(SignedTransaction signed);

    TransactionResult waitForTransaction(String hash);

    /**
     * Calls a view function.
     *
     * @param payload       the view request
     * @param ledgerVersion the ledger version, or null for the latest
     * @return decoded JSON return values
     */
    List<Object> view(ViewPayload payload, @Nullable Long ledgerVersion);
}
