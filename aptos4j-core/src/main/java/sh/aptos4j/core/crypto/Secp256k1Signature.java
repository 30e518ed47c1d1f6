// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * 64-byte secp256k1 ECDSA signature {@code r || s}.
 * <p>
 * Construction rejects high-S values, so every instance is in canonical low-S form. BCS
 * encoding is length-prefixed bytes.
 *
 * @param bytes {@code r || s}, 32 bytes each, big-endian
 * @since 0.1.0
 */
public record Secp256k1Signature(byte[] bytes) implements SingleKeySignature {

    public static final int LENGTH = 64;

    public Secp256k1Signature {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new CryptoException("secp256k1 signature must be " + LENGTH + " bytes, got " + bytes.length);
        }
        final BigInteger s = new BigInteger(1, Arrays.copyOfRange(bytes, 32, 64));
        if (s.compareTo(EcdsaSigner.HALF_CURVE_ORDER) > 0) {
            throw new CryptoException("secp256k1 signature is not in low-S form");
        }
        bytes = Arrays.copyOf(bytes, LENGTH);
    }

    /** @return an all-zero signature used for simulation */
    public static Secp256k1Signature zero() {
        return new Secp256k1Signature(new byte[LENGTH]);
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
        return AnySignature.SECP256K1;
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.bytes(bytes);
    }

    public static Secp256k1Signature deserialize(final Deserializer deserializer) {
        final byte[] raw = deserializer.bytes();
        if (deserializer.hasError()) {
            return null;
        }
        try {
            return new Secp256k1Signature(raw);
        } catch (CryptoException e) {
            deserializer.setError(e.getMessage());
            return null;
        }
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof Secp256k1Signature other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Secp256k1Signature[" + Hex.encode(bytes) + "]";
    }
}
