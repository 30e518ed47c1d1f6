// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.SHA3;

/**
 * SHA3-256 hashing utility.
 *
 * <p>
 * Aptos uses SHA3-256 (FIPS 202, not Keccak-256) for authentication keys, derived addresses,
 * transaction signing prefixes and transaction hashes.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * byte[] prefix = Sha3Hash.hash("APTOS::RawTransaction");
 * byte[] authKey = Sha3Hash.hash(publicKey.toBytes(), new byte[] {0x00});
 * }</pre>
 *
 * <h2>Thread Safety and Memory Management</h2>
 *
 * <p>
 * Digest instances are cached per thread in a {@link ThreadLocal}. In thread pools that are
 * shared across class loaders, call {@link #cleanup()} before handing a thread back.
 *
 * @since 0.1.0
 */
public final class Sha3Hash {

    private static final ThreadLocal<SHA3.Digest256> DIGEST = ThreadLocal.withInitial(SHA3.Digest256::new);

    private Sha3Hash() {
        // Utility class
    }

    /**
     * Computes the SHA3-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final SHA3.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes the SHA3-256 hash of several arrays concatenated, without building the
     * concatenation.
     *
     * @param inputs the data arrays to hash
     * @return 32-byte hash
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        final SHA3.Digest256 digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input);
        }
        return digest.digest();
    }

    /**
     * Hashes the UTF-8 bytes of a domain separator such as {@code APTOS::RawTransaction}.
     *
     * @param domain the text to hash
     * @return 32-byte hash
     */
    public static byte[] hash(final String domain) {
        Objects.requireNonNull(domain, "domain cannot be null");
        return hash(domain.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Removes the cached digest instance from the current thread.
     *
     * @see ThreadLocal#remove()
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
