// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.auth;

import java.util.Objects;

import sh.aptos4j.core.crypto.AnyPublicKey;
import sh.aptos4j.core.crypto.AnySignature;
import sh.aptos4j.core.crypto.Ed25519PrivateKey;
import sh.aptos4j.core.crypto.Ed25519Signature;
import sh.aptos4j.core.crypto.PrivateKey;
import sh.aptos4j.core.crypto.Secp256k1Signature;
import sh.aptos4j.core.crypto.SingleKeySignature;
import sh.aptos4j.core.types.AccountAddress;

/**
 * Signer for a SingleKey account (scheme {@code 0x02}) backed by an Ed25519 or secp256k1 key.
 * <p>
 * Produces {@link AccountAuthenticator.SingleKey} authenticators, which a transaction carries
 * as {@link TransactionAuthenticator.SingleSender}. Usable as a member of a
 * {@link MultiKeySigner}.
 *
 * @since 0.1.0
 */
public final class SingleKeySigner implements Signer {

    private final PrivateKey privateKey;
    private final AnyPublicKey publicKey;
    private final AccountAddress address;

    public SingleKeySigner(final PrivateKey privateKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey cannot be null");
        this.publicKey = AnyPublicKey.of(privateKey.publicKey());
        this.address = authenticationKey().toAccountAddress();
    }

    public SingleKeySigner(final PrivateKey privateKey, final AccountAddress address) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey cannot be null");
        this.publicKey = AnyPublicKey.of(privateKey.publicKey());
        this.address = Objects.requireNonNull(address, "address cannot be null");
    }

    @Override
    public AccountAddress address() {
        return address;
    }

    @Override
    public AnyPublicKey publicKey() {
        return publicKey;
    }

    @Override
    public AccountAuthenticator.SingleKey sign(final byte[] message) {
        return new AccountAuthenticator.SingleKey(publicKey, signRaw(message));
    }

    /**
     * Signs without wrapping in an authenticator, for use inside a multi-key signature.
     *
     * @param message the signing message
     * @return the tagged signature
     */
    AnySignature signRaw(final byte[] message) {
        Objects.requireNonNull(message, "message cannot be null");
        return new AnySignature(privateKey.sign(message));
    }

    @Override
    public AccountAuthenticator.SingleKey simulationAuthenticator() {
        return new AccountAuthenticator.SingleKey(publicKey, zeroSignature());
    }

    AnySignature zeroSignature() {
        final SingleKeySignature zero = privateKey instanceof Ed25519PrivateKey
                ? Ed25519Signature.zero()
                : Secp256k1Signature.zero();
        return new AnySignature(zero);
    }

    @Override
    public String toString() {
        return "SingleKeySigner[address=" + address + ", variant=" + publicKey.variant() + "]";
    }
}
