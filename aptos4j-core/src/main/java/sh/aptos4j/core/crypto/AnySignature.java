// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.Objects;

import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Tagged single signature matching {@link AnyPublicKey}.
 * <p>
 * Only Ed25519 and secp256k1 signatures are modeled. WebAuthn and keyless signature variants
 * are recognized on decode and rejected with an explicit error.
 *
 * @param signature the wrapped signature
 * @since 0.1.0
 */
public record AnySignature(SingleKeySignature signature) implements Signature {

    public static final int ED25519 = 0;
    public static final int SECP256K1 = 1;
    public static final int WEBAUTHN = 2;
    public static final int KEYLESS = 3;

    public AnySignature {
        Objects.requireNonNull(signature, "signature cannot be null");
    }

    public int variant() {
        return signature.anyVariant();
    }

    @Override
    public byte[] toBytes() {
        return toBcs();
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.uleb128(signature.anyVariant());
        signature.serialize(serializer);
    }

    public static AnySignature deserialize(final Deserializer deserializer) {
        final long variant = deserializer.uleb128();
        if (deserializer.hasError()) {
            return null;
        }
        final SingleKeySignature signature;
        if (variant == ED25519) {
            signature = Ed25519Signature.deserialize(deserializer);
        } else if (variant == SECP256K1) {
            signature = Secp256k1Signature.deserialize(deserializer);
        } else if (variant == WEBAUTHN) {
            deserializer.setError("WebAuthn signatures are not supported");
            return null;
        } else if (variant == KEYLESS) {
            deserializer.setError("keyless signatures are not supported");
            return null;
        } else {
            deserializer.setError("unknown AnySignature variant " + variant);
            return null;
        }
        return deserializer.hasError() ? null : new AnySignature(signature);
    }
}
