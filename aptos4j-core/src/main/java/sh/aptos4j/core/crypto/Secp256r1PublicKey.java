// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Uncompressed P-256 public key, as used by WebAuthn passkeys.
 * <p>
 * Carried so that accounts holding such keys can be encoded and their authentication keys
 * derived. WebAuthn assertions are not checked locally, so {@link #verify} always returns
 * {@code false}.
 *
 * @param bytes the 65-byte uncompressed point
 * @since 0.1.0
 */
public record Secp256r1PublicKey(byte[] bytes) implements SingleKeyPublicKey {

    public static final int LENGTH = 65;

    public Secp256r1PublicKey {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new CryptoException("secp256r1 public key must be " + LENGTH + " bytes, got " + bytes.length);
        }
        bytes = Arrays.copyOf(bytes, LENGTH);
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
    public int anyVariant() {
        return AnyPublicKey.SECP256R1;
    }

    @Override
    public boolean verify(final byte[] message, final Signature signature) {
        return false;
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.bytes(bytes);
    }

    public static Secp256r1PublicKey deserialize(final Deserializer deserializer) {
        final byte[] raw = deserializer.bytes();
        if (deserializer.hasError()) {
            return null;
        }
        try {
            return new Secp256r1PublicKey(raw);
        } catch (CryptoException e) {
            deserializer.setError(e.getMessage());
            return null;
        }
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof Secp256r1PublicKey other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Secp256r1PublicKey[" + Hex.encode(bytes) + "]";
    }
}
