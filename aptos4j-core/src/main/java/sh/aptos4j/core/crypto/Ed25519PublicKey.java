// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * 32-byte Ed25519 public key.
 * <p>
 * Usable directly as a legacy account key (scheme {@link DeriveScheme#ED25519}) or wrapped in
 * an {@link AnyPublicKey}. BCS encoding is the key as length-prefixed bytes.
 *
 * @param bytes the encoded curve point
 * @since 0.1.0
 */
public record Ed25519PublicKey(byte[] bytes) implements AccountPublicKey, SingleKeyPublicKey {

    public static final int LENGTH = 32;

    public Ed25519PublicKey {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new CryptoException("Ed25519 public key must be " + LENGTH + " bytes, got " + bytes.length);
        }
        bytes = Arrays.copyOf(bytes, LENGTH);
    }

    public static Ed25519PublicKey fromHex(final String hex) {
        return new Ed25519PublicKey(Hex.decode(hex));
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, LENGTH);
    }

    @Override
    public byte[] toBytes() {
        return bytes();
    }

    @Override
    public DeriveScheme scheme() {
        return DeriveScheme.ED25519;
    }

    @Override
    public int anyVariant() {
        return AnyPublicKey.ED25519;
    }

    /**
     * Pure Ed25519 verification (RFC 8032).
     */
    @Override
    public boolean verify(final byte[] message, final Signature signature) {
        if (message == null || !(signature instanceof Ed25519Signature ed25519)) {
            return false;
        }
        try {
            final Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, new Ed25519PublicKeyParameters(bytes, 0));
            verifier.update(message, 0, message.length);
            return verifier.verifySignature(ed25519.bytes());
        } catch (IllegalArgumentException e) {
            // not a valid curve point
            return false;
        }
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.bytes(bytes);
    }

    public static Ed25519PublicKey deserialize(final Deserializer deserializer) {
        final byte[] raw = deserializer.bytes();
        if (deserializer.hasError()) {
            return null;
        }
        if (raw.length != LENGTH) {
            deserializer.setError("Ed25519 public key must be " + LENGTH + " bytes, got " + raw.length);
            return null;
        }
        return new Ed25519PublicKey(raw);
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof Ed25519PublicKey other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Ed25519PublicKey[" + Hex.encode(bytes) + "]";
    }
}
