// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * 64-byte Ed25519 signature, BCS-encoded as length-prefixed bytes.
 *
 * @param bytes {@code R || S}
 * @since 0.1.0
 */
public record Ed25519Signature(byte[] bytes) implements SingleKeySignature {

    public static final int LENGTH = 64;

    public Ed25519Signature {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new CryptoException("Ed25519 signature must be " + LENGTH + " bytes, got " + bytes.length);
        }
        bytes = Arrays.copyOf(bytes, LENGTH);
    }

    /** @return an all-zero signature used for simulation */
    public static Ed25519Signature zero() {
        return new Ed25519Signature(new byte[LENGTH]);
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
        return AnySignature.ED25519;
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.bytes(bytes);
    }

    public static Ed25519Signature deserialize(final Deserializer deserializer) {
        final byte[] raw = deserializer.bytes();
        if (deserializer.hasError()) {
            return null;
        }
        if (raw.length != LENGTH) {
            deserializer.setError("Ed25519 signature must be " + LENGTH + " bytes, got " + raw.length);
            return null;
        }
        return new Ed25519Signature(raw);
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof Ed25519Signature other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Ed25519Signature[" + Hex.encode(bytes) + "]";
    }
}
