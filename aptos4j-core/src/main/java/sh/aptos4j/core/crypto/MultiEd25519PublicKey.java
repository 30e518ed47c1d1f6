// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Legacy k-of-n Ed25519 account key.
 * <p>
 * {@link #toBytes()} is the concatenated 32-byte keys followed by the threshold byte; BCS wraps
 * that blob as length-prefixed bytes.
 *
 * @param keys      1 to 32 public keys
 * @param threshold signatures required, between 1 and the key count
 * @since 0.1.0
 */
public record MultiEd25519PublicKey(List<Ed25519PublicKey> keys, int threshold) implements AccountPublicKey {

    public MultiEd25519PublicKey {
        Objects.requireNonNull(keys, "keys cannot be null");
        keys = List.copyOf(keys);
        if (keys.isEmpty() || keys.size() > MultiKeyBitmap.MAX_KEYS) {
            throw new CryptoException("MultiEd25519 requires 1 to " + MultiKeyBitmap.MAX_KEYS + " keys, got " + keys.size());
        }
        if (threshold < 1 || threshold > keys.size()) {
            throw new CryptoException("threshold " + threshold + " must be between 1 and " + keys.size());
        }
    }

    @Override
    public byte[] toBytes() {
        final byte[] out = new byte[keys.size() * Ed25519PublicKey.LENGTH + 1];
        for (int i = 0; i < keys.size(); i++) {
            System.arraycopy(keys.get(i).bytes(), 0, out, i * Ed25519PublicKey.LENGTH, Ed25519PublicKey.LENGTH);
        }
        out[out.length - 1] = (byte) threshold;
        return out;
    }

    /**
     * Parses the concatenated-keys-plus-threshold form.
     *
     * @param bytes the raw blob
     * @return the key
     * @throws CryptoException if the blob is malformed
     */
    public static MultiEd25519PublicKey fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length < Ed25519PublicKey.LENGTH + 1 || (bytes.length - 1) % Ed25519PublicKey.LENGTH != 0) {
            throw new CryptoException("invalid MultiEd25519 public key length " + bytes.length);
        }
        final int count = (bytes.length - 1) / Ed25519PublicKey.LENGTH;
        final List<Ed25519PublicKey> keys = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            keys.add(new Ed25519PublicKey(java.util.Arrays.copyOfRange(bytes,
                    i * Ed25519PublicKey.LENGTH, (i + 1) * Ed25519PublicKey.LENGTH)));
        }
        return new MultiEd25519PublicKey(keys, bytes[bytes.length - 1] & 0xFF);
    }

    @Override
    public DeriveScheme scheme() {
        return DeriveScheme.MULTI_ED25519;
    }

    @Override
    public boolean verify(final byte[] message, final Signature signature) {
        if (!(signature instanceof MultiEd25519Signature multi)) {
            return false;
        }
        return ThresholdVerifier.verify(message, keys, threshold, multi.signatures(), multi.bitmap());
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.bytes(toBytes());
    }

    public static MultiEd25519PublicKey deserialize(final Deserializer deserializer) {
        final byte[] raw = deserializer.bytes();
        if (deserializer.hasError()) {
            return null;
        }
        try {
            return fromBytes(raw);
        } catch (CryptoException e) {
            deserializer.setError(e.getMessage());
            return null;
        }
    }
}
