// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

/**
 * Key types that can sit inside an {@link AnyPublicKey}.
 *
 * @since 0.1.0
 */
public sealed interface SingleKeyPublicKey extends PublicKey
        permits Ed25519PublicKey, Secp256k1PublicKey, Secp256r1PublicKey, KeylessPublicKey {

    /** @return the {@link AnyPublicKey} discriminant of this key type */
    int anyVariant();
}
