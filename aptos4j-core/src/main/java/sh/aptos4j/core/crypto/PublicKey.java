// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import sh.aptos4j.primitives.bcs.BcsSerializable;

/**
 * A key that can check signatures.
 * <p>
 * {@link #verify(byte[], Signature)} never throws for malformed or mismatched input; it returns
 * {@code false}.
 *
 * @since 0.1.0
 */
public interface PublicKey extends BcsSerializable {

    /**
     * Raw key material. For composite keys this is the encoding that feeds the
     * authentication key.
     *
     * @return a fresh copy of the key bytes
     */
    byte[] toBytes();

    /**
     * @param message   the signed message
     * @param signature the signature to check
     * @return true only if the signature is of a matching kind and valid for the message
     */
    boolean verify(byte[] message, Signature signature);
}
