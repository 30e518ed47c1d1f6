// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import javax.security.auth.Destroyable;

/**
 * A signing key usable inside a single-key account.
 * <p>
 * Implementations never print key material from {@code toString()} and refuse to sign once
 * {@link #destroy()} has been called.
 *
 * @since 0.1.0
 */
public sealed interface PrivateKey extends Destroyable permits Ed25519PrivateKey, Secp256k1PrivateKey {

    /** @return the matching public key */
    SingleKeyPublicKey publicKey();

    /**
     * Signs a message.
     *
     * @param message the message bytes
     * @return the signature
     * @throws IllegalStateException if the key has been destroyed
     */
    SingleKeySignature sign(byte[] message);

    /**
     * @return a copy of the 32 private key bytes
     * @throws IllegalStateException if the key has been destroyed
     */
    byte[] toBytes();

    /**
     * @return the key in AIP-80 form, e.g. {@code ed25519-priv-0x...}
     * @throws IllegalStateException if the key has been destroyed
     */
    String toAip80();

    @Override
    void destroy();
}
