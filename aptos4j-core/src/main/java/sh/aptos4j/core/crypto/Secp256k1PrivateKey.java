// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import sh.aptos4j.core.error.CryptoException;

/**
 * secp256k1 signing key.
 * <p>
 * {@link #sign(byte[])} hashes the message with SHA3-256 and produces a deterministic
 * (RFC 6979) low-S ECDSA signature.
 *
 * <h2>Security Considerations</h2>
 *
 * <p>
 * Implements {@link javax.security.auth.Destroyable}. {@code BigInteger} is immutable, so
 * {@link #destroy()} cannot wipe the scalar from memory, but it drops the reference and makes
 * every later signing call fail.
 *
 * @since 0.1.0
 */
public final class Secp256k1PrivateKey implements PrivateKey {

    public static final int LENGTH = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Secp256k1PublicKey publicKey;
    private volatile BigInteger privateKeyValue;
    private volatile boolean destroyed = false;

    private Secp256k1PrivateKey(final byte[] keyBytes) {
        if (keyBytes.length != LENGTH) {
            throw new CryptoException("secp256k1 private key must be " + LENGTH + " bytes, got " + keyBytes.length);
        }
        final BigInteger value = new BigInteger(1, keyBytes);
        if (value.signum() == 0) {
            throw new CryptoException("secp256k1 private key cannot be zero");
        }
        if (value.compareTo(EcdsaSigner.CURVE.getN()) >= 0) {
            throw new CryptoException("secp256k1 private key must be less than curve order");
        }
        this.privateKeyValue = value;
        this.publicKey = new Secp256k1PublicKey(EcdsaSigner.publicKey(value));
    }

    /**
     * @param keyBytes 32-byte big-endian scalar; copied, not retained
     * @return the key
     * @throws CryptoException if the bytes are not a valid scalar
     */
    public static Secp256k1PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        return new Secp256k1PrivateKey(keyBytes);
    }

    /**
     * Parses AIP-80 text or raw hex, warning when the AIP-80 prefix is missing.
     *
     * @param text the key text
     * @return the key
     */
    public static Secp256k1PrivateKey fromAip80(final String text) {
        return fromAip80(text, PrivateKeyFormat.Mode.WARN);
    }

    public static Secp256k1PrivateKey fromAip80(final String text, final PrivateKeyFormat.Mode mode) {
        final byte[] raw = PrivateKeyFormat.parse(text, PrivateKeyFormat.KeyType.SECP256K1, mode);
        try {
            return new Secp256k1PrivateKey(raw);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    /** @return a key drawn from {@link SecureRandom}, retried until it is a valid scalar */
    public static Secp256k1PrivateKey generate() {
        final byte[] raw = new byte[LENGTH];
        try {
            while (true) {
                RANDOM.nextBytes(raw);
                final BigInteger value = new BigInteger(1, raw);
                if (value.signum() > 0 && value.compareTo(EcdsaSigner.CURVE.getN()) < 0) {
                    return new Secp256k1PrivateKey(raw);
                }
            }
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    @Override
    public Secp256k1PublicKey publicKey() {
        return publicKey;
    }

    @Override
    public Secp256k1Signature sign(final byte[] message) {
        Objects.requireNonNull(message, "message cannot be null");
        final BigInteger key;
        synchronized (this) {
            checkNotDestroyed();
            key = privateKeyValue;
        }
        return new Secp256k1Signature(EcdsaSigner.sign(Sha3Hash.hash(message), key));
    }

    @Override
    public byte[] toBytes() {
        synchronized (this) {
            checkNotDestroyed();
            return EcdsaSigner.toBytes32(privateKeyValue);
        }
    }

    @Override
    public String toAip80() {
        final byte[] raw = toBytes();
        try {
            return PrivateKeyFormat.format(raw, PrivateKeyFormat.KeyType.SECP256K1);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            privateKeyValue = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Secp256k1PrivateKey has been destroyed");
        }
    }

    @Override
    public String toString() {
        return destroyed ? "Secp256k1PrivateKey[destroyed]" : "Secp256k1PrivateKey[publicKey=" + publicKey + "]";
    }
}
