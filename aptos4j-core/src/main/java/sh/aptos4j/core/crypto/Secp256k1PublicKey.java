// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Uncompressed secp256k1 public key ({@code 0x04 || X || Y}, 65 bytes).
 * <p>
 * Only usable inside an {@link AnyPublicKey}. Verification hashes the message with SHA3-256
 * and checks an ECDSA signature over the digest.
 *
 * @param bytes the uncompressed point
 * @since 0.1.0
 */
public record Secp256k1PublicKey(byte[] bytes) implements SingleKeyPublicKey {

    public static final int LENGTH = 65;

    public Secp256k1PublicKey {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new CryptoException("secp256k1 public key must be " + LENGTH + " bytes, got " + bytes.length);
        }
        if (bytes[0] != 0x04) {
            throw new CryptoException("secp256k1 public key must be uncompressed (0x04 prefix)");
        }
        bytes = Arrays.copyOf(bytes, LENGTH);
    }

    public static Secp256k1PublicKey fromHex(final String hex) {
        return new Secp256k1PublicKey(Hex.decode(hex));
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
        return AnyPublicKey.SECP256K1;
    }

    @Override
    public boolean verify(final byte[] message, final Signature signature) {
        if (message == null || !(signature instanceof Secp256k1Signature secp)) {
            return false;
        }
        return EcdsaSigner.verify(Sha3Hash.hash(message), secp.bytes(), bytes);
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.bytes(bytes);
    }

    public static Secp256k1PublicKey deserialize(final Deserializer deserializer) {
        final byte[] raw = deserializer.bytes();
        if (deserializer.hasError()) {
            return null;
        }
        try {
            return new Secp256k1PublicKey(raw);
        } catch (CryptoException e) {
            deserializer.setError(e.getMessage());
            return null;
        }
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof Secp256k1PublicKey other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Secp256k1PublicKey[" + Hex.encode(bytes) + "]";
    }
}
