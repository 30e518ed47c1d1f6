// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

/**
 * A public key that can control an account, and so has an authentication key.
 *
 * @since 0.1.0
 */
public interface AccountPublicKey extends PublicKey {

    /** @return the scheme byte mixed into the authentication key */
    DeriveScheme scheme();

    /** @return {@code SHA3-256(toBytes() || scheme)} */
    default AuthenticationKey authenticationKey() {
        return AuthenticationKey.fromPublicKey(this);
    }
}
