// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.builder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.aptos4j.core.tx.EntryFunction;
import sh.aptos4j.core.tx.TransactionPayload;
import sh.aptos4j.core.types.AccountAddress;

/**
 * Fluent builder for {@link TransactionRequest}.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * TransactionRequest request = TxBuilder.create()
 *     .sender(alice.address())
 *     .payload(transfer)
 *     .maxGasAmount(20_000)
 *     .feePayer(AccountAddress.ZERO)
 *     .build();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class TxBuilder {
    private AccountAddress sender;
    private TransactionPayload payload;
    private Long sequenceNumber;
    private Long maxGasAmount;
    private Long gasUnitPrice;
    private Long expirationSeconds;
    private Integer chainId;
    private AccountAddress feePayer;
    private final List<AccountAddress> secondarySigners = new ArrayList<>();

    private TxBuilder() {}

    public static TxBuilder create() {
        return new TxBuilder();
    }

    public TxBuilder sender(final AccountAddress sender) {
        this.sender = sender;
        return this;
    }

    public TxBuilder payload(final TransactionPayload payload) {
        this.payload = payload;
        return this;
    }

    /**
     * Shorthand for {@code payload(entryFunction)}.
     *
     * @param entryFunction the entry function call
     * @return this builder for chaining
     */
    public TxBuilder entryFunction(final EntryFunction entryFunction) {
        return payload(entryFunction);
    }

    public TxBuilder sequenceNumber(final long sequenceNumber) {
        this.sequenceNumber = sequenceNumber;
        return this;
    }

    public TxBuilder maxGasAmount(final long maxGasAmount) {
        this.maxGasAmount = maxGasAmount;
        return this;
    }

    public TxBuilder gasUnitPrice(final long gasUnitPrice) {
        this.gasUnitPrice = gasUnitPrice;
        return this;
    }

    /**
     * @param expirationSeconds seconds from build time until the transaction expires
     * @return this builder for chaining
     */
    public TxBuilder expirationSeconds(final long expirationSeconds) {
        this.expirationSeconds = expirationSeconds;
        return this;
    }

    public TxBuilder chainId(final int chainId) {
        this.chainId = chainId;
        return this;
    }

    /**
     * Makes this a fee-payer transaction.
     *
     * @param feePayer the sponsor, or {@link AccountAddress#ZERO} if not yet known
     * @return this builder for chaining
     */
    public TxBuilder feePayer(final AccountAddress feePayer) {
        this.feePayer = feePayer;
        return this;
    }

    public TxBuilder secondarySigner(final AccountAddress address) {
        this.secondarySigners.add(Objects.requireNonNull(address, "address cannot be null"));
        return this;
    }

    public TxBuilder secondarySigners(final List<AccountAddress> addresses) {
        Objects.requireNonNull(addresses, "addresses cannot be null");
        addresses.forEach(this::secondarySigner);
        return this;
    }

    /**
     * @return the request
     * @throws AptosTxBuilderException if the sender or payload is missing or a value is out of range
     */
    public TransactionRequest build() {
        return new TransactionRequest(sender, payload, sequenceNumber, maxGasAmount, gasUnitPrice,
                expirationSeconds, chainId, feePayer, secondarySigners);
    }
}
