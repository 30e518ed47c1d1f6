// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.List;
import java.util.Objects;

import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * k-of-n account key over mixed key types.
 * <p>
 * BCS: sequence of {@link AnyPublicKey} followed by the threshold as u8. {@link #toBytes()} is
 * that encoding.
 *
 * @param keys      1 to 32 keys
 * @param threshold signatures required, between 1 and the key count
 * @since 0.1.0
 */
public record MultiKey(List<AnyPublicKey> keys, int threshold) implements AccountPublicKey {

    public MultiKey {
        Objects.requireNonNull(keys, "keys cannot be null");
        keys = List.copyOf(keys);
        if (keys.isEmpty() || keys.size() > MultiKeyBitmap.MAX_KEYS) {
            throw new CryptoException("MultiKey requires 1 to " + MultiKeyBitmap.MAX_KEYS + " keys, got " + keys.size());
        }
        if (threshold < 1 || threshold > keys.size()) {
            throw new CryptoException("threshold " + threshold + " must be between 1 and " + keys.size());
        }
    }

    /**
     * @param key a member key
     * @return its position, or -1 if it is not part of this MultiKey
     */
    public int indexOf(final AnyPublicKey key) {
        return keys.indexOf(key);
    }

    @Override
    public byte[] toBytes() {
        return toBcs();
    }

    @Override
    public DeriveScheme scheme() {
        return DeriveScheme.MULTI_KEY;
    }

    @Override
    public boolean verify(final byte[] message, final Signature signature) {
        if (!(signature instanceof MultiKeySignature multi)) {
            return false;
        }
        return ThresholdVerifier.verify(message, keys, threshold, multi.signatures(), multi.bitmap());
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.sequence(keys);
        serializer.u8(threshold);
    }

    public static MultiKey deserialize(final Deserializer deserializer) {
        final List<AnyPublicKey> keys = deserializer.sequence(AnyPublicKey::deserialize);
        final int threshold = deserializer.u8();
        if (deserializer.hasError()) {
            return null;
        }
        try {
            return new MultiKey(keys, threshold);
        } catch (CryptoException e) {
            deserializer.setError(e.getMessage());
            return null;
        }
    }
}
