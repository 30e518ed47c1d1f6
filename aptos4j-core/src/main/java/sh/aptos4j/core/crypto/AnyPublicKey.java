// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.Objects;

import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Tagged single key used by SingleKey and MultiKey accounts.
 * <p>
 * BCS: ULEB128 variant ({@link #ED25519}, {@link #SECP256K1}, {@link #SECP256R1},
 * {@link #KEYLESS}) followed by the key. {@link #toBytes()} is that whole encoding, which is
 * what the authentication key hashes.
 *
 * @param key the wrapped key
 * @since 0.1.0
 */
public record AnyPublicKey(SingleKeyPublicKey key) implements AccountPublicKey {

    public static final int ED25519 = 0;
    public static final int SECP256K1 = 1;
    public static final int SECP256R1 = 2;
    public static final int KEYLESS = 3;

    public AnyPublicKey {
        Objects.requireNonNull(key, "key cannot be null");
    }

    public static AnyPublicKey of(final SingleKeyPublicKey key) {
        return new AnyPublicKey(key);
    }

    public int variant() {
        return key.anyVariant();
    }

    @Override
    public byte[] toBytes() {
        return toBcs();
    }

    @Override
    public DeriveScheme scheme() {
        return DeriveScheme.SINGLE_KEY;
    }

    /**
     * Accepts an {@link AnySignature} or a bare signature whose variant matches the key.
     */
    @Override
    public boolean verify(final byte[] message, final Signature signature) {
        final Signature inner = signature instanceof AnySignature any ? any.signature() : signature;
        if (!(inner instanceof SingleKeySignature single) || single.anyVariant() != key.anyVariant()) {
            return false;
        }
        return key.verify(message, inner);
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.uleb128(key.anyVariant());
        key.serialize(serializer);
    }

    public static AnyPublicKey deserialize(final Deserializer deserializer) {
        final long variant = deserializer.uleb128();
        if (deserializer.hasError()) {
            return null;
        }
        final SingleKeyPublicKey key;
        if (variant == ED25519) {
            key = Ed25519PublicKey.deserialize(deserializer);
        } else if (variant == SECP256K1) {
            key = Secp256k1PublicKey.deserialize(deserializer);
        } else if (variant == SECP256R1) {
            key = Secp256r1PublicKey.deserialize(deserializer);
        } else if (variant == KEYLESS) {
            key = KeylessPublicKey.deserialize(deserializer);
        } else {
            deserializer.setError("unknown AnyPublicKey variant " + variant);
            return null;
        }
        return deserializer.hasError() ? null : new AnyPublicKey(key);
    }
}
