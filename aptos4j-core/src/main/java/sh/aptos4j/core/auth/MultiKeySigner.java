// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.auth;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.jspecify.annotations.Nullable;

import sh.aptos4j.core.crypto.AnySignature;
import sh.aptos4j.core.crypto.MultiKey;
import sh.aptos4j.core.crypto.MultiKeySignature;
import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.core.types.AccountAddress;

/**
 * Signer for a k-of-n MultiKey account (scheme {@code 0x03}).
 * <p>
 * Holds the account's {@link MultiKey} and enough member signers to meet its threshold. Every
 * member signs; the bitmap lists their key positions in ascending order.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MultiKey key = new MultiKey(List.of(a.publicKey(), b.publicKey(), c.publicKey()), 2);
 * MultiKeySigner signer = new MultiKeySigner(key, List.of(a, c));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class MultiKeySigner implements Signer {

    private final MultiKey multiKey;
    private final Map<Integer, SingleKeySigner> signers;
    private final AccountAddress address;

    /**
     * @param multiKey the account key
     * @param signers  members who will sign; each public key must be part of {@code multiKey}
     * @throws CryptoException if a signer is not a member, appears twice, or there are fewer
     *                         signers than the threshold
     */
    public MultiKeySigner(final MultiKey multiKey, final List<SingleKeySigner> signers) {
        this(multiKey, signers, null);
    }

    public MultiKeySigner(final MultiKey multiKey, final List<SingleKeySigner> signers,
            final @Nullable AccountAddress address) {
        this.multiKey = Objects.requireNonNull(multiKey, "multiKey cannot be null");
        Objects.requireNonNull(signers, "signers cannot be null");
        final TreeMap<Integer, SingleKeySigner> byIndex = new TreeMap<>();
        for (SingleKeySigner signer : signers) {
            final int index = multiKey.indexOf(signer.publicKey());
            if (index < 0) {
                throw new CryptoException("signer " + signer.publicKey() + " is not part of the MultiKey");
            }
            if (byIndex.put(index, signer) != null) {
                throw new CryptoException("duplicate signer for key index " + index);
            }
        }
        if (byIndex.size() < multiKey.threshold()) {
            throw new CryptoException("MultiKey threshold is " + multiKey.threshold()
                    + " but only " + byIndex.size() + " signer(s) were given");
        }
        this.signers = Collections.unmodifiableMap(byIndex);
        this.address = address != null ? address : authenticationKey().toAccountAddress();
    }

    @Override
    public AccountAddress address() {
        return address;
    }

    @Override
    public MultiKey publicKey() {
        return multiKey;
    }

    @Override
    public AccountAuthenticator.MultiKey sign(final byte[] message) {
        Objects.requireNonNull(message, "message cannot be null");
        final Map<Integer, AnySignature> signatures = new TreeMap<>();
        signers.forEach((index, signer) -> signatures.put(index, signer.signRaw(message)));
        return new AccountAuthenticator.MultiKey(multiKey, MultiKeySignature.of(signatures));
    }

    @Override
    public AccountAuthenticator.MultiKey simulationAuthenticator() {
        final Map<Integer, AnySignature> signatures = new TreeMap<>();
        signers.forEach((index, signer) -> signatures.put(index, signer.zeroSignature()));
        return new AccountAuthenticator.MultiKey(multiKey, MultiKeySignature.of(signatures));
    }

    @Override
    public String toString() {
        return "MultiKeySigner[address=" + address + ", signers=" + signers.keySet()
                + ", threshold=" + multiKey.threshold() + "]";
    }
}
