// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.builder;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.aptos4j.core.tx.RawTransaction;
import sh.aptos4j.core.tx.RawTransactionWithData;
import sh.aptos4j.core.tx.TransactionPayload;
import sh.aptos4j.core.types.AccountAddress;

/**
 * A transaction to be built, with optional fields left for the client to fill.
 *
 * <p>
 * <strong>Optional vs Required Fields:</strong>
 * <ul>
 * <li><strong>Required:</strong> {@code sender} and {@code payload}</li>
 * <li><strong>Filled from the node:</strong> {@code sequenceNumber} and {@code chainId}</li>
 * <li><strong>Filled from {@link TransactionDefaults}:</strong> {@code maxGasAmount},
 * {@code gasUnitPrice} and {@code expirationSeconds}</li>
 * <li><strong>Shape:</strong> a non-null {@code feePayer} makes a fee-payer transaction
 * ({@link AccountAddress#ZERO} while the sponsor is unknown); a non-empty
 * {@code secondarySigners} without a fee payer makes a multi-agent transaction</li>
 * </ul>
 *
 * @param sender            the sending account
 * @param payload           what to execute
 * @param sequenceNumber    the sender's sequence number, or null to fetch
 * @param maxGasAmount      gas units, or null for the default
 * @param gasUnitPrice      octas per gas unit, or null for the default or an estimate
 * @param expirationSeconds seconds from now until expiry, or null for the default
 * @param chainId           chain id, or null to fetch
 * @param feePayer          the fee payer, or null for none
 * @param secondarySigners  additional signer addresses, never null
 * @since 0.1.0
 */
public record TransactionRequest(
        AccountAddress sender,
        TransactionPayload payload,
        @Nullable Long sequenceNumber,
        @Nullable Long maxGasAmount,
        @Nullable Long gasUnitPrice,
        @Nullable Long expirationSeconds,
        @Nullable Integer chainId,
        @Nullable AccountAddress feePayer,
        List<AccountAddress> secondarySigners) {

    public TransactionRequest {
        BuilderValidation.validateTarget(sender, payload);
        BuilderValidation.validateGas(maxGasAmount, gasUnitPrice);
        BuilderValidation.validateExpiration(expirationSeconds);
        BuilderValidation.validateChainId(chainId);
        secondarySigners = secondarySigners == null ? List.of() : List.copyOf(secondarySigners);
    }

    public boolean isFeePayer() {
        return feePayer != null;
    }

    public boolean isMultiAgent() {
        return feePayer == null && !secondarySigners.isEmpty();
    }

    public TransactionRequest withSequenceNumber(final long sequenceNumber) {
        return new TransactionRequest(sender, payload, sequenceNumber, maxGasAmount, gasUnitPrice,
                expirationSeconds, chainId, feePayer, secondarySigners);
    }

    public TransactionRequest withChainId(final int chainId) {
        return new TransactionRequest(sender, payload, sequenceNumber, maxGasAmount, gasUnitPrice,
                expirationSeconds, chainId, feePayer, secondarySigners);
    }

    public TransactionRequest withGasUnitPrice(final long gasUnitPrice) {
        return new TransactionRequest(sender, payload, sequenceNumber, maxGasAmount, gasUnitPrice,
                expirationSeconds, chainId, feePayer, secondarySigners);
    }

    /**
     * Builds the raw transaction. Expiration is {@code clock.instant() + expirationSeconds}.
     *
     * @param defaults values for the null gas and expiration fields
     * @param clock    time source for the expiration timestamp
     * @return the raw transaction
     * @throws AptosTxBuilderException if {@code sequenceNumber} or {@code chainId} is still null,
     *                                  or the expiration timestamp does not fit in a long
     */
    public RawTransaction toRawTransaction(final TransactionDefaults defaults, final Clock clock) {
        Objects.requireNonNull(defaults, "defaults cannot be null");
        Objects.requireNonNull(clock, "clock cannot be null");
        if (sequenceNumber == null) {
            throw new AptosTxBuilderException("sequenceNumber must be set before building");
        }
        if (chainId == null) {
            throw new AptosTxBuilderException("chainId must be set before building");
        }
        final long ttl = expirationSeconds != null ? expirationSeconds : defaults.expirationSeconds();
        final long expiration;
        try {
            expiration = Math.addExact(clock.instant().getEpochSecond(), ttl);
        } catch (ArithmeticException e) {
            throw new AptosTxBuilderException("expiration timestamp overflows: now + " + ttl, e);
        }
        return new RawTransaction(
                sender,
                sequenceNumber,
                payload,
                maxGasAmount != null ? maxGasAmount : defaults.maxGasAmount(),
                gasUnitPrice != null ? gasUnitPrice : defaults.gasUnitPrice(),
                expiration,
                chainId);
    }

    /**
     * Wraps a built raw transaction in the signing envelope this request calls for.
     *
     * @param raw the raw transaction built from this request
     * @return the multi-agent or fee-payer envelope, or {@code null} for a single-sender transaction
     */
    public @Nullable RawTransactionWithData withData(final RawTransaction raw) {
        if (feePayer != null) {
            return new RawTransactionWithData.FeePayer(raw, secondarySigners, feePayer);
        }
        if (!secondarySigners.isEmpty()) {
            return new RawTransactionWithData.MultiAgent(raw, secondarySigners);
        }
        return null;
    }
}
