// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.builder;

import org.jspecify.annotations.Nullable;

import sh.aptos4j.core.tx.TransactionPayload;
import sh.aptos4j.core.types.AccountAddress;

/**
 * Shared validation for {@link TxBuilder} and {@link TransactionRequest}.
 */
final class BuilderValidation {

    private BuilderValidation() {
        // Utility class
    }

    static void validateTarget(final @Nullable AccountAddress sender, final @Nullable TransactionPayload payload) {
        if (sender == null) {
            throw new AptosTxBuilderException("Transaction must have a sender");
        }
        if (payload == null) {
            throw new AptosTxBuilderException("Transaction must have a payload");
        }
    }

    static void validateGas(final @Nullable Long maxGasAmount, final @Nullable Long gasUnitPrice) {
        if (maxGasAmount != null && maxGasAmount <= 0) {
            throw new AptosTxBuilderException("maxGasAmount must be > 0, got: " + maxGasAmount);
        }
        if (gasUnitPrice != null && gasUnitPrice < 0) {
            throw new AptosTxBuilderException("gasUnitPrice must be >= 0, got: " + gasUnitPrice);
        }
    }

    static void validateExpiration(final @Nullable Long expirationSeconds) {
        if (expirationSeconds != null && expirationSeconds < 0) {
            throw new AptosTxBuilderException("expirationSeconds must be >= 0, got: " + expirationSeconds);
        }
    }

    static void validateChainId(final @Nullable Integer chainId) {
        if (chainId != null && (chainId < 0 || chainId > 0xFF)) {
            throw new AptosTxBuilderException("chainId must be between 0 and 255, got: " + chainId);
        }
    }
}
