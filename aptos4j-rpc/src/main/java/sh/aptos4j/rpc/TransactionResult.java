// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.rpc;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a committed or simulated transaction, as reported by the node.
 *
 * @param hash     0x-prefixed transaction hash
 * @param type     the node's transaction type, for example {@code user_transaction}
 * @param version  ledger version, or null while pending
 * @param success  whether execution succeeded
 * @param vmStatus the VM status string, or null while pending
 * @param gasUsed  gas units consumed, unsigned
 * @since 0.1.0
 */
public record TransactionResult(
        String hash,
        String type,
        @Nullable Long version,
        boolean success,
        @Nullable String vmStatus,
        long gasUsed) {

    /** Type reported for transactions still in the mempool. */
    public static final String PENDING_TYPE = "pending_transaction";

    public TransactionResult {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
    }

    public boolean isPending() {
        return PENDING_TYPE.equals(type);
    }

    static TransactionResult fromJson(final JsonNode node) {
        final JsonNode version = node.get("version");
        final JsonNode gasUsed = node.get("gas_used");
        return new TransactionResult(
                node.path("hash").asText(""),
                node.path("type").asText(""),
                version == null || version.isNull() ? null : Long.parseUnsignedLong(version.asText()),
                node.path("success").asBoolean(false),
                node.path("vm_status").asText(null),
                gasUsed == null || gasUsed.isNull() ? 0L : Long.parseUnsignedLong(gasUsed.asText()));
    }
}
