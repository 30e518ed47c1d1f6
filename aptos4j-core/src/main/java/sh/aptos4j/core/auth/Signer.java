// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.auth;

import sh.aptos4j.core.crypto.AccountPublicKey;
import sh.aptos4j.core.crypto.AuthenticationKey;
import sh.aptos4j.core.types.AccountAddress;

/**
 * An account able to approve transactions.
 * <p>
 * Implementations may hold a local key or delegate to an external key store. Callers never see
 * key material; they get back an {@link AccountAuthenticator} ready to be placed in a
 * {@link TransactionAuthenticator}.
 *
 * @since 0.1.0
 */
public interface Signer {

    /**
     * Returns the account address this signer acts for.
     * <p>
     * Defaults to the address derived from the authentication key; accounts whose key was
     * rotated must supply their original address.
     *
     * @return the account address
     */
    AccountAddress address();

    /** @return the account public key */
    AccountPublicKey publicKey();

    /** @return {@code SHA3-256(publicKey bytes || scheme)} */
    default AuthenticationKey authenticationKey() {
        return AuthenticationKey.fromPublicKey(publicKey());
    }

    /**
     * Signs a prehashed signing message.
     *
     * @param message the full signing message, domain prefix included
     * @return the authenticator carrying this signer's key and signature
     */
    AccountAuthenticator sign(byte[] message);

    /**
     * Returns an authenticator of the same shape as {@link #sign(byte[])} with the real public
     * key and a zero-filled signature, for transaction simulation.
     *
     * @return the simulation authenticator
     */
    AccountAuthenticator simulationAuthenticator();
}
