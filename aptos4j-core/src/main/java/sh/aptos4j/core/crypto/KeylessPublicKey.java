// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Keyless (OpenID-based) account key: the issuer and an identity commitment.
 * <p>
 * Zero-knowledge proofs are verified on chain only; {@link #verify} always returns
 * {@code false}.
 *
 * @param issuer       the {@code iss} claim value
 * @param idCommitment the identity commitment bytes
 * @since 0.1.0
 */
public record KeylessPublicKey(String issuer, byte[] idCommitment) implements SingleKeyPublicKey {

    public KeylessPublicKey {
        Objects.requireNonNull(issuer, "issuer cannot be null");
        Objects.requireNonNull(idCommitment, "idCommitment cannot be null");
        idCommitment = Arrays.copyOf(idCommitment, idCommitment.length);
    }

    @Override
    public byte[] idCommitment() {
        return Arrays.copyOf(idCommitment, idCommitment.length);
    }

    @Override
    public byte[] toBytes() {
        return toBcs();
    }

    @Override
    public int anyVariant() {
        return AnyPublicKey.KEYLESS;
    }

    @Override
    public boolean verify(final byte[] message, final Signature signature) {
        return false;
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.string(issuer);
        serializer.bytes(idCommitment);
    }

    public static KeylessPublicKey deserialize(final Deserializer deserializer) {
        final String issuer = deserializer.string();
        final byte[] idc = deserializer.bytes();
        return deserializer.hasError() ? null : new KeylessPublicKey(issuer, idc);
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof KeylessPublicKey other
                && issuer.equals(other.issuer) && Arrays.equals(idCommitment, other.idCommitment));
    }

    @Override
    public int hashCode() {
        return 31 * issuer.hashCode() + Arrays.hashCode(idCommitment);
    }

    @Override
    public String toString() {
        return "KeylessPublicKey[issuer=" + issuer + ", idCommitment=" + Hex.encode(idCommitment) + "]";
    }
}
