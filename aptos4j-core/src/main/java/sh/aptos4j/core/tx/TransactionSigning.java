// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.aptos4j.core.auth.AccountAuthenticator;
import sh.aptos4j.core.auth.Signer;
import sh.aptos4j.core.auth.TransactionAuthenticator;
import sh.aptos4j.core.types.AccountAddress;

/**
 * Assembles {@link SignedTransaction}s from a raw transaction and its participants.
 * <p>
 * The {@code simulate*} methods produce the same shapes with each participant's
 * {@link Signer#simulationAuthenticator()}; the node accepts them only on its simulation
 * endpoint.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * SignedTransaction single = TransactionSigning.sign(raw, alice);
 * SignedTransaction sponsored = TransactionSigning.signFeePayer(raw, alice, List.of(), sponsor);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class TransactionSigning {

    private TransactionSigning() {
        // Utility class
    }

    /**
     * Signs a single-sender transaction.
     *
     * @param raw    the transaction; its sender should be {@code signer.address()}
     * @param signer the sender
     * @return the signed transaction
     */
    public static SignedTransaction sign(final RawTransaction raw, final Signer signer) {
        Objects.requireNonNull(raw, "raw cannot be null");
        Objects.requireNonNull(signer, "signer cannot be null");
        final AccountAuthenticator sender = signer.sign(raw.signingMessage());
        return new SignedTransaction(raw, TransactionAuthenticator.of(sender));
    }

    /**
     * Signs a multi-agent transaction. Every participant signs the same
     * {@link RawTransactionWithData.MultiAgent} message.
     *
     * @param raw        the transaction
     * @param sender     the sender
     * @param secondary  secondary signers, in the order their addresses appear in the message
     * @return the signed transaction
     */
    public static SignedTransaction signMultiAgent(
            final RawTransaction raw, final Signer sender, final List<? extends Signer> secondary) {
        Objects.requireNonNull(raw, "raw cannot be null");
        Objects.requireNonNull(sender, "sender cannot be null");
        final List<AccountAddress> addresses = addresses(secondary);
        final byte[] message = new RawTransactionWithData.MultiAgent(raw, addresses).signingMessage();
        final List<AccountAuthenticator> authenticators = new ArrayList<>(secondary.size());
        for (Signer signer : secondary) {
            authenticators.add(signer.sign(message));
        }
        return new SignedTransaction(raw,
                new TransactionAuthenticator.MultiAgent(sender.sign(message), addresses, authenticators));
    }

    /**
     * Signs a fee-payer transaction. All participants sign the message naming the real fee payer.
     *
     * @param raw       the transaction
     * @param sender    the sender
     * @param secondary secondary signers, possibly empty
     * @param feePayer  the account paying gas
     * @return the signed transaction
     */
    public static SignedTransaction signFeePayer(
            final RawTransaction raw,
            final Signer sender,
            final List<? extends Signer> secondary,
            final Signer feePayer) {
        Objects.requireNonNull(raw, "raw cannot be null");
        Objects.requireNonNull(sender, "sender cannot be null");
        Objects.requireNonNull(feePayer, "feePayer cannot be null");
        final List<AccountAddress> addresses = addresses(secondary);
        final byte[] message = new RawTransactionWithData.FeePayer(raw, addresses, feePayer.address()).signingMessage();
        final List<AccountAuthenticator> authenticators = new ArrayList<>(secondary.size());
        for (Signer signer : secondary) {
            authenticators.add(signer.sign(message));
        }
        return new SignedTransaction(raw, new TransactionAuthenticator.FeePayer(
                sender.sign(message), addresses, authenticators, feePayer.address(), feePayer.sign(message)));
    }

    /**
     * Signs as sender or secondary signer before the fee payer is known, over the message with
     * {@link AccountAddress#ZERO} in the fee payer slot.
     *
     * @param raw       the transaction
     * @param signer    the participant
     * @param secondary addresses of all secondary signers
     * @return the participant's authenticator, to be combined with
     *         {@link #attachFeePayer(RawTransaction, AccountAuthenticator, List, List, Signer)}
     */
    public static AccountAuthenticator signWithoutFeePayer(
            final RawTransaction raw, final Signer signer, final List<AccountAddress> secondary) {
        Objects.requireNonNull(signer, "signer cannot be null");
        return signer.sign(new RawTransactionWithData.FeePayer(raw, secondary, AccountAddress.ZERO).signingMessage());
    }

    /**
     * Completes a fee-payer transaction whose other participants signed with
     * {@link #signWithoutFeePayer(RawTransaction, Signer, List)}.
     *
     * @param raw                     the transaction
     * @param senderAuthenticator     the sender's signature
     * @param secondaryAddresses      secondary signer addresses
     * @param secondaryAuthenticators their signatures, same order
     * @param feePayer                the account paying gas; signs the message with its address
     * @return the signed transaction
     */
    public static SignedTransaction attachFeePayer(
            final RawTransaction raw,
            final AccountAuthenticator senderAuthenticator,
            final List<AccountAddress> secondaryAddresses,
            final List<AccountAuthenticator> secondaryAuthenticators,
            final Signer feePayer) {
        Objects.requireNonNull(feePayer, "feePayer cannot be null");
        final byte[] message = new RawTransactionWithData.FeePayer(raw, secondaryAddresses, feePayer.address())
                .signingMessage();
        return new SignedTransaction(raw, new TransactionAuthenticator.FeePayer(senderAuthenticator,
                secondaryAddresses, secondaryAuthenticators, feePayer.address(), feePayer.sign(message)));
    }

    /**
     * @param raw    the transaction
     * @param signer the sender
     * @return a simulation-only transaction carrying zero signatures
     */
    public static SignedTransaction simulate(final RawTransaction raw, final Signer signer) {
        Objects.requireNonNull(raw, "raw cannot be null");
        Objects.requireNonNull(signer, "signer cannot be null");
        return new SignedTransaction(raw, TransactionAuthenticator.of(signer.simulationAuthenticator()));
    }

    public static SignedTransaction simulateMultiAgent(
            final RawTransaction raw, final Signer sender, final List<? extends Signer> secondary) {
        Objects.requireNonNull(raw, "raw cannot be null");
        Objects.requireNonNull(sender, "sender cannot be null");
        return new SignedTransaction(raw, new TransactionAuthenticator.MultiAgent(
                sender.simulationAuthenticator(), addresses(secondary), simulationAuthenticators(secondary)));
    }

    /**
     * Simulation form of a fee-payer transaction.
     *
     * @param raw       the transaction
     * @param sender    the sender
     * @param secondary secondary signers, possibly empty
     * @param feePayer  the fee payer, or {@code null} to simulate with {@link AccountAddress#ZERO}
     *                  and a {@link AccountAuthenticator.None} fee payer authenticator
     * @return the simulation transaction
     */
    public static SignedTransaction simulateFeePayer(
            final RawTransaction raw,
            final Signer sender,
            final List<? extends Signer> secondary,
            final @Nullable Signer feePayer) {
        Objects.requireNonNull(raw, "raw cannot be null");
        Objects.requireNonNull(sender, "sender cannot be null");
        final AccountAddress feePayerAddress = feePayer != null ? feePayer.address() : AccountAddress.ZERO;
        final AccountAuthenticator feePayerAuth = feePayer != null
                ? feePayer.simulationAuthenticator()
                : new AccountAuthenticator.None();
        return new SignedTransaction(raw, new TransactionAuthenticator.FeePayer(sender.simulationAuthenticator(),
                addresses(secondary), simulationAuthenticators(secondary), feePayerAddress, feePayerAuth));
    }

    private static List<AccountAddress> addresses(final List<? extends Signer> signers) {
        Objects.requireNonNull(signers, "secondary cannot be null");
        final List<AccountAddress> addresses = new ArrayList<>(signers.size());
        for (Signer signer : signers) {
            addresses.add(signer.address());
        }
        return addresses;
    }

    private static List<AccountAuthenticator> simulationAuthenticators(final List<? extends Signer> signers) {
        final List<AccountAuthenticator> authenticators = new ArrayList<>(signers.size());
        for (Signer signer : signers) {
            authenticators.add(signer.simulationAuthenticator());
        }
        return authenticators;
    }
}
