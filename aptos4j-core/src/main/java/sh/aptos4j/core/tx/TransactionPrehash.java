// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.util.Objects;

import sh.aptos4j.core.crypto.Sha3Hash;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Domain-separated signing messages and transaction hashes.
 * <p>
 * Each message is a 32-byte prefix, {@code SHA3-256} of a domain string, followed by the BCS
 * bytes of the signed structure. The prefixes are computed once.
 *
 * @since 0.1.0
 */
public final class TransactionPrehash {

    private static final byte[] RAW_TRANSACTION_PREFIX = Sha3Hash.hash("APTOS::RawTransaction");
    private static final byte[] RAW_TRANSACTION_WITH_DATA_PREFIX = Sha3Hash.hash("APTOS::RawTransactionWithData");
    private static final byte[] TRANSACTION_PREFIX = Sha3Hash.hash("APTOS::Transaction");

    /** Variant of {@code Transaction::UserTransaction} in the hashed transaction enum. */
    private static final int USER_TRANSACTION = 0;

    private TransactionPrehash() {
        // Utility class
    }

    /** @return a copy of {@code SHA3-256("APTOS::RawTransaction")} */
    public static byte[] rawTransactionPrefix() {
        return RAW_TRANSACTION_PREFIX.clone();
    }

    /** @return a copy of {@code SHA3-256("APTOS::RawTransactionWithData")} */
    public static byte[] rawTransactionWithDataPrefix() {
        return RAW_TRANSACTION_WITH_DATA_PREFIX.clone();
    }

    public static byte[] signingMessage(final RawTransaction raw) {
        Objects.requireNonNull(raw, "raw cannot be null");
        return prefixed(RAW_TRANSACTION_PREFIX, raw.toBcs());
    }

    public static byte[] signingMessage(final RawTransactionWithData data) {
        Objects.requireNonNull(data, "data cannot be null");
        return prefixed(RAW_TRANSACTION_WITH_DATA_PREFIX, data.toBcs());
    }

    /**
     * Hash under which the chain indexes a user transaction:
     * {@code SHA3-256(SHA3-256("APTOS::Transaction") || 0x00 || BCS(signed))}.
     *
     * @param signed the signed transaction
     * @return 32-byte hash
     */
    public static byte[] transactionHash(final SignedTransaction signed) {
        Objects.requireNonNull(signed, "signed cannot be null");
        return Sha3Hash.hash(TRANSACTION_PREFIX, new byte[] {USER_TRANSACTION}, signed.toBcs());
    }

    private static byte[] prefixed(final byte[] prefix, final byte[] body) {
        final Serializer out = new Serializer(prefix.length + body.length);
        out.fixedBytes(prefix);
        out.fixedBytes(body);
        return out.toByteArray();
    }
}
