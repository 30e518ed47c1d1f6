// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.auth;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.aptos4j.core.crypto.AccountPublicKey;
import sh.aptos4j.core.crypto.AnyPublicKey;
import sh.aptos4j.core.crypto.AnySignature;
import sh.aptos4j.core.crypto.Ed25519PublicKey;
import sh.aptos4j.core.crypto.Ed25519Signature;
import sh.aptos4j.core.crypto.MultiEd25519PublicKey;
import sh.aptos4j.core.crypto.MultiEd25519Signature;
import sh.aptos4j.core.crypto.MultiKeySignature;
import sh.aptos4j.core.crypto.Signature;
import sh.aptos4j.core.crypto.SingleKeySignature;
import sh.aptos4j.primitives.bcs.BcsSerializable;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Proof that one account approved a message: a public key and a signature of the matching
 * scheme.
 * <p>
 * Discriminants: {@link Ed25519} = 0, {@link MultiEd25519} = 1, {@link SingleKey} = 2,
 * {@link MultiKey} = 3, {@link None} = 4. {@link #verify(byte[])} never throws; {@link None}
 * never verifies.
 *
 * @since 0.1.0
 */
public sealed interface AccountAuthenticator extends BcsSerializable {

    int ED25519 = 0;
    int MULTI_ED25519 = 1;
    int SINGLE_KEY = 2;
    int MULTI_KEY = 3;
    int NONE = 4;

    int variant();

    /** @return the account key, or {@code null} for {@link None} */
    @Nullable AccountPublicKey publicKey();

    /** @return the signature, or {@code null} for {@link None} */
    @Nullable Signature signature();

    /**
     * @param message the signed bytes
     * @return whether the signature is valid for the message under the key
     */
    boolean verify(byte[] message);

    /** Writes the body after the discriminant. */
    void serializeBody(Serializer serializer);

    @Override
    default void serialize(final Serializer serializer) {
        serializer.uleb128(variant());
        serializeBody(serializer);
    }

    /**
     * Pairs a key with a signature, choosing the authenticator by key type.
     *
     * @param publicKey the account key
     * @param signature a signature of the matching scheme
     * @return the authenticator
     * @throws IllegalArgumentException if the key and signature types do not match
     */
    static AccountAuthenticator fromKeyAndSignature(final AccountPublicKey publicKey, final Signature signature) {
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");
        if (publicKey instanceof Ed25519PublicKey key && signature instanceof Ed25519Signature sig) {
            return new Ed25519(key, sig);
        }
        if (publicKey instanceof MultiEd25519PublicKey key && signature instanceof MultiEd25519Signature sig) {
            return new MultiEd25519(key, sig);
        }
        if (publicKey instanceof AnyPublicKey key) {
            if (signature instanceof AnySignature sig) {
                return new SingleKey(key, sig);
            }
            if (signature instanceof SingleKeySignature sig) {
                return new SingleKey(key, new AnySignature(sig));
            }
        }
        if (publicKey instanceof sh.aptos4j.core.crypto.MultiKey key && signature instanceof MultiKeySignature sig) {
            return new MultiKey(key, sig);
        }
        throw new IllegalArgumentException("signature " + signature.getClass().getSimpleName()
                + " does not match public key " + publicKey.getClass().getSimpleName());
    }

    static AccountAuthenticator deserialize(final Deserializer deserializer) {
        final long variant = deserializer.uleb128();
        if (deserializer.hasError()) {
            return null;
        }
        final AccountAuthenticator auth;
        if (variant == ED25519) {
            auth = new Ed25519(Ed25519PublicKey.deserialize(deserializer), Ed25519Signature.deserialize(deserializer));
        } else if (variant == MULTI_ED25519) {
            auth = new MultiEd25519(MultiEd25519PublicKey.deserialize(deserializer),
                    MultiEd25519Signature.deserialize(deserializer));
        } else if (variant == SINGLE_KEY) {
            auth = new SingleKey(AnyPublicKey.deserialize(deserializer), AnySignature.deserialize(deserializer));
        } else if (variant == MULTI_KEY) {
            auth = new MultiKey(sh.aptos4j.core.crypto.MultiKey.deserialize(deserializer),
                    MultiKeySignature.deserialize(deserializer));
        } else if (variant == NONE) {
            return new None();
        } else {
            deserializer.setError("unknown AccountAuthenticator variant " + variant);
            return null;
        }
        return deserializer.hasError() ? null : auth;
    }

    /** Legacy single Ed25519 key. */
    record Ed25519(Ed25519PublicKey publicKey, Ed25519Signature signature) implements AccountAuthenticator {
        @Override
        public int variant() {
            return ED25519;
        }

        @Override
        public boolean verify(final byte[] message) {
            return publicKey != null && signature != null && publicKey.verify(message, signature);
        }

        @Override
        public void serializeBody(final Serializer serializer) {
            publicKey.serialize(serializer);
            signature.serialize(serializer);
        }
    }

    /** Legacy k-of-n Ed25519. */
    record MultiEd25519(MultiEd25519PublicKey publicKey, MultiEd25519Signature signature)
            implements AccountAuthenticator {
        @Override
        public int variant() {
            return MULTI_ED25519;
        }

        @Override
        public boolean verify(final byte[] message) {
            return publicKey != null && signature != null && publicKey.verify(message, signature);
        }

        @Override
        public void serializeBody(final Serializer serializer) {
            publicKey.serialize(serializer);
            signature.serialize(serializer);
        }
    }

    /** One key of any supported type; key and signature variants must match. */
    record SingleKey(AnyPublicKey publicKey, AnySignature signature) implements AccountAuthenticator {
        @Override
        public int variant() {
            return SINGLE_KEY;
        }

        @Override
        public boolean verify(final byte[] message) {
            return publicKey != null && signature != null
                    && publicKey.variant() == signature.variant()
                    && publicKey.verify(message, signature);
        }

        @Override
        public void serializeBody(final Serializer serializer) {
            publicKey.serialize(serializer);
            signature.serialize(serializer);
        }
    }

    /** k-of-n over mixed key types. */
    record MultiKey(sh.aptos4j.core.crypto.MultiKey publicKey, MultiKeySignature signature)
            implements AccountAuthenticator {
        @Override
        public int variant() {
            return MULTI_KEY;
        }

        @Override
        public boolean verify(final byte[] message) {
            return publicKey != null && signature != null && publicKey.verify(message, signature);
        }

        @Override
        public void serializeBody(final Serializer serializer) {
            publicKey.serialize(serializer);
            signature.serialize(serializer);
        }
    }

    /** Placeholder for a participant that has not signed; used in simulation. */
    record None() implements AccountAuthenticator {
        @Override
        public int variant() {
            return NONE;
        }

        @Override
        public @Nullable AccountPublicKey publicKey() {
            return null;
        }

        @Override
        public @Nullable Signature signature() {
            return null;
        }

        @Override
        public boolean verify(final byte[] message) {
            return false;
        }

        @Override
        public void serializeBody(final Serializer serializer) {
            // no body
        }
    }
}
