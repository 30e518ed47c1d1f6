// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.auth;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.aptos4j.core.crypto.Ed25519PublicKey;
import sh.aptos4j.core.crypto.Ed25519Signature;
import sh.aptos4j.core.crypto.MultiEd25519PublicKey;
import sh.aptos4j.core.crypto.MultiEd25519Signature;
import sh.aptos4j.core.tx.RawTransaction;
import sh.aptos4j.core.tx.RawTransactionWithData;
import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.primitives.bcs.BcsSerializable;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * All signatures attached to a transaction.
 * <p>
 * Discriminants: {@link Ed25519} = 0, {@link MultiEd25519} = 1, {@link MultiAgent} = 2,
 * {@link FeePayer} = 3, {@link SingleSender} = 4. The two legacy variants carry only a key and
 * signature; the others wrap {@link AccountAuthenticator}s.
 *
 * @since 0.1.0
 */
public sealed interface TransactionAuthenticator extends BcsSerializable {

    int ED25519 = 0;
    int MULTI_ED25519 = 1;
    int MULTI_AGENT = 2;
    int FEE_PAYER = 3;
    int SINGLE_SENDER = 4;

    int variant();

    /** @return the sender's authenticator */
    AccountAuthenticator sender();

    /**
     * Recomputes the signing message(s) for {@code raw} and checks every authenticator.
     *
     * @param raw the transaction these signatures claim to cover
     * @return true only if every participant's signature is valid
     */
    boolean verify(RawTransaction raw);

    void serializeBody(Serializer serializer);

    @Override
    default void serialize(final Serializer serializer) {
        serializer.uleb128(variant());
        serializeBody(serializer);
    }

    /**
     * Wraps a sender authenticator for a single-signer transaction.
     *
     * @param sender the sender's authenticator
     * @return Ed25519 and MultiEd25519 map to their legacy variants; SingleKey and MultiKey map to
     *         {@link SingleSender}
     * @throws IllegalArgumentException for {@link AccountAuthenticator.None}
     */
    static TransactionAuthenticator of(final AccountAuthenticator sender) {
        Objects.requireNonNull(sender, "sender cannot be null");
        if (sender instanceof AccountAuthenticator.Ed25519 ed) {
            return new Ed25519(ed.publicKey(), ed.signature());
        }
        if (sender instanceof AccountAuthenticator.MultiEd25519 multi) {
            return new MultiEd25519(multi.publicKey(), multi.signature());
        }
        if (sender instanceof AccountAuthenticator.SingleKey || sender instanceof AccountAuthenticator.MultiKey) {
            return new SingleSender(sender);
        }
        throw new IllegalArgumentException("a sender cannot use a " + sender.getClass().getSimpleName() + " authenticator");
    }

    static TransactionAuthenticator deserialize(final Deserializer deserializer) {
        final long variant = deserializer.uleb128();
        if (deserializer.hasError()) {
            return null;
        }
        if (variant == ED25519) {
            return new Ed25519(Ed25519PublicKey.deserialize(deserializer), Ed25519Signature.deserialize(deserializer));
        }
        if (variant == MULTI_ED25519) {
            return new MultiEd25519(MultiEd25519PublicKey.deserialize(deserializer),
                    MultiEd25519Signature.deserialize(deserializer));
        }
        if (variant == MULTI_AGENT) {
            final AccountAuthenticator sender = AccountAuthenticator.deserialize(deserializer);
            final List<AccountAddress> addresses = deserializer.sequence(AccountAddress::deserialize);
            final List<AccountAuthenticator> signers = deserializer.sequence(AccountAuthenticator::deserialize);
            return deserializer.hasError() ? null : newMultiAgent(deserializer, sender, addresses, signers);
        }
        if (variant == FEE_PAYER) {
            final AccountAuthenticator sender = AccountAuthenticator.deserialize(deserializer);
            final List<AccountAddress> addresses = deserializer.sequence(AccountAddress::deserialize);
            final List<AccountAuthenticator> signers = deserializer.sequence(AccountAuthenticator::deserialize);
            final AccountAddress feePayerAddress = AccountAddress.deserialize(deserializer);
            final AccountAuthenticator feePayer = AccountAuthenticator.deserialize(deserializer);
            if (deserializer.hasError()) {
                return null;
            }
            try {
                return new FeePayer(sender, addresses, signers, feePayerAddress, feePayer);
            } catch (IllegalArgumentException e) {
                deserializer.setError(e.getMessage());
                return null;
            }
        }
        if (variant == SINGLE_SENDER) {
            final AccountAuthenticator sender = AccountAuthenticator.deserialize(deserializer);
            return deserializer.hasError() ? null : new SingleSender(sender);
        }
        deserializer.setError("unknown TransactionAuthenticator variant " + variant);
        return null;
    }

    private static TransactionAuthenticator newMultiAgent(
            final Deserializer deserializer,
            final AccountAuthenticator sender,
            final List<AccountAddress> addresses,
            final List<AccountAuthenticator> signers) {
        try {
            return new MultiAgent(sender, addresses, signers);
        } catch (IllegalArgumentException e) {
            deserializer.setError(e.getMessage());
            return null;
        }
    }

    /** Legacy single Ed25519 sender. */
    record Ed25519(Ed25519PublicKey publicKey, Ed25519Signature signature) implements TransactionAuthenticator {
        @Override
        public int variant() {
            return ED25519;
        }

        @Override
        public AccountAuthenticator sender() {
            return new AccountAuthenticator.Ed25519(publicKey, signature);
        }

        @Override
        public boolean verify(final RawTransaction raw) {
            return sender().verify(raw.signingMessage());
        }

        @Override
        public void serializeBody(final Serializer serializer) {
            publicKey.serialize(serializer);
            signature.serialize(serializer);
        }
    }

    /** Legacy MultiEd25519 sender. */
    record MultiEd25519(MultiEd25519PublicKey publicKey, MultiEd25519Signature signature)
            implements TransactionAuthenticator {
        @Override
        public int variant() {
            return MULTI_ED25519;
        }

        @Override
        public AccountAuthenticator sender() {
            return new AccountAuthenticator.MultiEd25519(publicKey, signature);
        }

        @Override
        public boolean verify(final RawTransaction raw) {
            return sender().verify(raw.signingMessage());
        }

        @Override
        public void serializeBody(final Serializer serializer) {
            publicKey.serialize(serializer);
            signature.serialize(serializer);
        }
    }

    /** Sender plus secondary signers, all signing the same {@link RawTransactionWithData.MultiAgent}. */
    record MultiAgent(
            AccountAuthenticator sender,
            List<AccountAddress> secondarySignerAddresses,
            List<AccountAuthenticator> secondarySigners) implements TransactionAuthenticator {

        public MultiAgent {
            Objects.requireNonNull(sender, "sender cannot be null");
            secondarySignerAddresses = List.copyOf(secondarySignerAddresses);
            secondarySigners = List.copyOf(secondarySigners);
            if (secondarySignerAddresses.size() != secondarySigners.size()) {
                throw new IllegalArgumentException("got " + secondarySignerAddresses.size()
                        + " secondary signer addresses but " + secondarySigners.size() + " authenticators");
            }
        }

        @Override
        public int variant() {
            return MULTI_AGENT;
        }

        @Override
        public boolean verify(final RawTransaction raw) {
            final byte[] message = new RawTransactionWithData.MultiAgent(raw, secondarySignerAddresses).signingMessage();
            if (!sender.verify(message)) {
                return false;
            }
            for (AccountAuthenticator signer : secondarySigners) {
                if (!signer.verify(message)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public void serializeBody(final Serializer serializer) {
            sender.serialize(serializer);
            serializer.sequence(secondarySignerAddresses);
            serializer.sequence(secondarySigners);
        }
    }

    /**
     * Sender, optional secondary signers and a separate account paying gas.
     * <p>
     * The fee payer signs a message naming its own address. The sender and secondary signers may
     * have signed either that message or the one with {@link AccountAddress#ZERO} in the fee
     * payer slot, which lets them sign before the fee payer is chosen.
     */
    record FeePayer(
            AccountAuthenticator sender,
            List<AccountAddress> secondarySignerAddresses,
            List<AccountAuthenticator> secondarySigners,
            AccountAddress feePayerAddress,
            AccountAuthenticator feePayer) implements TransactionAuthenticator {

        public FeePayer {
            Objects.requireNonNull(sender, "sender cannot be null");
            Objects.requireNonNull(feePayerAddress, "feePayerAddress cannot be null");
            Objects.requireNonNull(feePayer, "feePayer cannot be null");
            secondarySignerAddresses = List.copyOf(secondarySignerAddresses);
            secondarySigners = List.copyOf(secondarySigners);
            if (secondarySignerAddresses.size() != secondarySigners.size()) {
                throw new IllegalArgumentException("got " + secondarySignerAddresses.size()
                        + " secondary signer addresses but " + secondarySigners.size() + " authenticators");
            }
        }

        @Override
        public int variant() {
            return FEE_PAYER;
        }

        @Override
        public boolean verify(final RawTransaction raw) {
            final byte[] withFeePayer = new RawTransactionWithData.FeePayer(
                    raw, secondarySignerAddresses, feePayerAddress).signingMessage();
            if (!feePayer.verify(withFeePayer)) {
                return false;
            }
            final byte[] withZero = new RawTransactionWithData.FeePayer(
                    raw, secondarySignerAddresses, AccountAddress.ZERO).signingMessage();
            final List<AccountAuthenticator> participants = new ArrayList<>(secondarySigners.size() + 1);
            participants.add(sender);
            participants.addAll(secondarySigners);
            for (AccountAuthenticator participant : participants) {
                if (!participant.verify(withFeePayer) && !participant.verify(withZero)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public void serializeBody(final Serializer serializer) {
            sender.serialize(serializer);
            serializer.sequence(secondarySignerAddresses);
            serializer.sequence(secondarySigners);
            feePayerAddress.serialize(serializer);
            feePayer.serialize(serializer);
        }
    }

    /** SingleKey or MultiKey sender. */
    record SingleSender(AccountAuthenticator sender) implements TransactionAuthenticator {

        public SingleSender {
            Objects.requireNonNull(sender, "sender cannot be null");
        }

        @Override
        public int variant() {
            return SINGLE_SENDER;
        }

        @Override
        public boolean verify(final RawTransaction raw) {
            return sender.verify(raw.signingMessage());
        }

        @Override
        public void serializeBody(final Serializer serializer) {
            sender.serialize(serializer);
        }
    }
}
