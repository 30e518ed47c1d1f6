// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import sh.aptos4j.core.error.CryptoException;

/**
 * Ed25519 signing key held as its 32-byte seed.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Ed25519PrivateKey key = Ed25519PrivateKey.fromAip80("ed25519-priv-0x...");
 * Ed25519Signature sig = key.sign(message);
 * boolean ok = key.publicKey().verify(message, sig);
 * }</pre>
 *
 * <p>
 * Implements {@link javax.security.auth.Destroyable}: {@link #destroy()} drops the key
 * parameters and zeroes the seed copy, after which signing throws {@link IllegalStateException}.
 *
 * @since 0.1.0
 */
public final class Ed25519PrivateKey implements PrivateKey {

    public static final int LENGTH = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Ed25519PublicKey publicKey;
    private volatile Ed25519PrivateKeyParameters parameters;
    private volatile byte[] seed;
    private volatile boolean destroyed = false;

    private Ed25519PrivateKey(final byte[] seed) {
        if (seed.length != LENGTH) {
            throw new CryptoException("Ed25519 private key must be " + LENGTH + " bytes, got " + seed.length);
        }
        this.seed = Arrays.copyOf(seed, LENGTH);
        this.parameters = new Ed25519PrivateKeyParameters(this.seed, 0);
        this.publicKey = new Ed25519PublicKey(parameters.generatePublicKey().getEncoded());
    }

    /**
     * @param seed 32-byte seed; copied, not retained
     * @return the key
     * @throws CryptoException if the seed has the wrong length
     */
    public static Ed25519PrivateKey fromBytes(final byte[] seed) {
        Objects.requireNonNull(seed, "seed cannot be null");
        return new Ed25519PrivateKey(seed);
    }

    /**
     * Parses AIP-80 text or raw hex, warning when the AIP-80 prefix is missing.
     *
     * @param text the key text
     * @return the key
     */
    public static Ed25519PrivateKey fromAip80(final String text) {
        return fromAip80(text, PrivateKeyFormat.Mode.WARN);
    }

    public static Ed25519PrivateKey fromAip80(final String text, final PrivateKeyFormat.Mode mode) {
        final byte[] raw = PrivateKeyFormat.parse(text, PrivateKeyFormat.KeyType.ED25519, mode);
        try {
            return new Ed25519PrivateKey(raw);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    /** @return a key from a fresh random seed */
    public static Ed25519PrivateKey generate() {
        final byte[] raw = new byte[LENGTH];
        RANDOM.nextBytes(raw);
        try {
            return new Ed25519PrivateKey(raw);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    @Override
    public Ed25519PublicKey publicKey() {
        return publicKey;
    }

    @Override
    public Ed25519Signature sign(final byte[] message) {
        Objects.requireNonNull(message, "message cannot be null");
        final Ed25519PrivateKeyParameters key;
        synchronized (this) {
            checkNotDestroyed();
            key = parameters;
        }
        final Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, key);
        signer.update(message, 0, message.length);
        return new Ed25519Signature(signer.generateSignature());
    }

    @Override
    public byte[] toBytes() {
        synchronized (this) {
            checkNotDestroyed();
            return Arrays.copyOf(seed, LENGTH);
        }
    }

    @Override
    public String toAip80() {
        final byte[] raw = toBytes();
        try {
            return PrivateKeyFormat.format(raw, PrivateKeyFormat.KeyType.ED25519);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            if (seed != null) {
                Arrays.fill(seed, (byte) 0);
            }
            seed = null;
            parameters = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Ed25519PrivateKey has been destroyed");
        }
    }

    @Override
    public String toString() {
        return destroyed ? "Ed25519PrivateKey[destroyed]" : "Ed25519PrivateKey[publicKey=" + publicKey + "]";
    }
}
