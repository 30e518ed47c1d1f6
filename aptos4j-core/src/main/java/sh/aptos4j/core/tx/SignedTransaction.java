// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.util.Objects;

import sh.aptos4j.core.auth.TransactionAuthenticator;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Bcs;
import sh.aptos4j.primitives.bcs.BcsSerializable;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * A raw transaction together with its authenticator, ready for submission.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * SignedTransaction signed = TransactionSigning.sign(raw, signer);
 * transport.submitSignedTransaction(signed.toBcs());
 * String hash = signed.hashHex();
 * }</pre>
 *
 * @param rawTransaction the signed transaction body
 * @param authenticator  every participant's signature
 * @since 0.1.0
 */
public record SignedTransaction(RawTransaction rawTransaction, TransactionAuthenticator authenticator)
        implements BcsSerializable {

    /** HTTP content type for a BCS-encoded signed transaction. */
    public static final String CONTENT_TYPE = "application/x.aptos.signed_transaction+bcs";

    public SignedTransaction {
        Objects.requireNonNull(rawTransaction, "rawTransaction cannot be null");
        Objects.requireNonNull(authenticator, "authenticator cannot be null");
    }

    /**
     * Recomputes the signing message(s) and checks every authenticator against them.
     *
     * @return true if all signatures are valid; never throws
     */
    public boolean verify() {
        return authenticator.verify(rawTransaction);
    }

    /** @return the 32-byte on-chain transaction hash */
    public byte[] hash() {
        return TransactionPrehash.transactionHash(this);
    }

    /** @return {@link #hash()} as 0x-prefixed lowercase hex */
    public String hashHex() {
        return Hex.encode(hash());
    }

    @Override
    public void serialize(final Serializer serializer) {
        rawTransaction.serialize(serializer);
        authenticator.serialize(serializer);
    }

    public static SignedTransaction deserialize(final Deserializer deserializer) {
        final RawTransaction raw = RawTransaction.deserialize(deserializer);
        final TransactionAuthenticator authenticator = TransactionAuthenticator.deserialize(deserializer);
        return deserializer.hasError() ? null : new SignedTransaction(raw, authenticator);
    }

    /**
     * @param bytes BCS bytes of a signed transaction
     * @return the decoded transaction
     * @throws sh.aptos4j.primitives.bcs.BcsException if the bytes are malformed or have trailing data
     */
    public static SignedTransaction fromBcs(final byte[] bytes) {
        return Bcs.deserialize(bytes, SignedTransaction::deserialize);
    }
}
