// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

/**
 * Signature types that can sit inside an {@link AnySignature}.
 *
 * @since 0.1.0
 */
public sealed interface SingleKeySignature extends Signature permits Ed25519Signature, Secp256k1Signature {

    /** @return the {@link AnySignature} discriminant of this signature type */
    int anyVariant();
}
