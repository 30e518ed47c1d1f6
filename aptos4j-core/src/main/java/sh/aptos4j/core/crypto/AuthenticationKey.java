// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.BcsSerializable;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * 32-byte authentication key: {@code SHA3-256(public key bytes || scheme byte)}.
 * <p>
 * A freshly created account's address equals its authentication key. BCS encoding is
 * length-prefixed bytes.
 *
 * @param bytes the 32 key bytes
 * @since 0.1.0
 */
public record AuthenticationKey(byte[] bytes) implements BcsSerializable {

    public static final int LENGTH = 32;

    public AuthenticationKey {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new CryptoException("authentication key must be " + LENGTH + " bytes, got " + bytes.length);
        }
        bytes = Arrays.copyOf(bytes, LENGTH);
    }

    /**
     * Derives the key for an account public key.
     *
     * @param publicKey the account key
     * @return {@code SHA3-256(publicKey.toBytes() || publicKey.scheme())}
     */
    public static AuthenticationKey fromPublicKey(final AccountPublicKey publicKey) {
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        return fromBytesAndScheme(publicKey.toBytes(), publicKey.scheme());
    }

    /**
     * @param material bytes to hash
     * @param scheme   the scheme byte appended before hashing
     * @return the derived key
     */
    public static AuthenticationKey fromBytesAndScheme(final byte[] material, final DeriveScheme scheme) {
        Objects.requireNonNull(material, "material cannot be null");
        Objects.requireNonNull(scheme, "scheme cannot be null");
        return new AuthenticationKey(Sha3Hash.hash(material, new byte[] {scheme.value()}));
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, LENGTH);
    }

    public AccountAddress toAccountAddress() {
        return new AccountAddress(bytes);
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.bytes(bytes);
    }

    public static AuthenticationKey deserialize(final Deserializer deserializer) {
        final byte[] raw = deserializer.bytes();
        if (deserializer.hasError()) {
            return null;
        }
        if (raw.length != LENGTH) {
            deserializer.setError("authentication key must be " + LENGTH + " bytes, got " + raw.length);
            return null;
        }
        return new AuthenticationKey(raw);
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof AuthenticationKey other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return Hex.encode(bytes);
    }
}
