// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.auth;

import java.util.Objects;

import sh.aptos4j.core.crypto.Ed25519PrivateKey;
import sh.aptos4j.core.crypto.Ed25519PublicKey;
import sh.aptos4j.core.crypto.Ed25519Signature;
import sh.aptos4j.core.types.AccountAddress;

/**
 * Signer for a legacy Ed25519 account (authentication key scheme {@code 0x00}).
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Ed25519Signer signer = new Ed25519Signer(Ed25519PrivateKey.fromAip80(text));
 * SignedTransaction signed = TransactionSigning.sign(raw, signer);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Ed25519Signer implements Signer {

    private final Ed25519PrivateKey privateKey;
    private final Ed25519PublicKey publicKey;
    private final AccountAddress address;

    public Ed25519Signer(final Ed25519PrivateKey privateKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey cannot be null");
        this.publicKey = privateKey.publicKey();
        this.address = authenticationKey().toAccountAddress();
    }

    /**
     * @param privateKey the key
     * @param address    the account address, for accounts whose key has been rotated
     */
    public Ed25519Signer(final Ed25519PrivateKey privateKey, final AccountAddress address) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey cannot be null");
        this.publicKey = privateKey.publicKey();
        this.address = Objects.requireNonNull(address, "address cannot be null");
    }

    /** @return a signer over a freshly generated key */
    public static Ed25519Signer generate() {
        return new Ed25519Signer(Ed25519PrivateKey.generate());
    }

    @Override
    public AccountAddress address() {
        return address;
    }

    @Override
    public Ed25519PublicKey publicKey() {
        return publicKey;
    }

    @Override
    public AccountAuthenticator.Ed25519 sign(final byte[] message) {
        Objects.requireNonNull(message, "message cannot be null");
        return new AccountAuthenticator.Ed25519(publicKey, privateKey.sign(message));
    }

    @Override
    public AccountAuthenticator.Ed25519 simulationAuthenticator() {
        return new AccountAuthenticator.Ed25519(publicKey, Ed25519Signature.zero());
    }

    @Override
    public String toString() {
        return "Ed25519Signer[address=" + address + "]";
    }
}
