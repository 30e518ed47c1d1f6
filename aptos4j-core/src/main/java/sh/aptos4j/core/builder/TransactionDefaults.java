// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.builder;

/**
 * Values applied to a {@link TransactionRequest} field left {@code null}.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * TransactionDefaults defaults = TransactionDefaults.builder()
 *     .maxGasAmount(200_000)
 *     .expirationSeconds(60)
 *     .build();
 * }</pre>
 *
 * @param maxGasAmount      gas units, must be &gt; 0 (default 100_000)
 * @param gasUnitPrice      octas per gas unit, must be &gt;= 0 (default 100)
 * @param expirationSeconds seconds from now until expiry, must be &gt;= 0 (default 300)
 * @since 0.1.0
 */
public record TransactionDefaults(long maxGasAmount, long gasUnitPrice, long expirationSeconds) {

    public static final long DEFAULT_MAX_GAS_AMOUNT = 100_000L;

    public static final long DEFAULT_GAS_UNIT_PRICE = 100L;

    public static final long DEFAULT_EXPIRATION_SECONDS = 300L;

    public TransactionDefaults {
        if (maxGasAmount <= 0) {
            throw new IllegalArgumentException("maxGasAmount must be > 0, got: " + maxGasAmount);
        }
        if (gasUnitPrice < 0) {
            throw new IllegalArgumentException("gasUnitPrice must be >= 0, got: " + gasUnitPrice);
        }
        if (expirationSeconds < 0) {
            throw new IllegalArgumentException("expirationSeconds must be >= 0, got: " + expirationSeconds);
        }
    }

    public static TransactionDefaults defaults() {
        return new TransactionDefaults(DEFAULT_MAX_GAS_AMOUNT, DEFAULT_GAS_UNIT_PRICE, DEFAULT_EXPIRATION_SECONDS);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder initialized with the defaults. */
    public static final class Builder {
        private long maxGasAmount = DEFAULT_MAX_GAS_AMOUNT;
        private long gasUnitPrice = DEFAULT_GAS_UNIT_PRICE;
        private long expirationSeconds = DEFAULT_EXPIRATION_SECONDS;

        private Builder() {}

        public Builder maxGasAmount(long maxGasAmount) {
            this.maxGasAmount = maxGasAmount;
            return this;
        }

        public Builder gasUnitPrice(long gasUnitPrice) {
            this.gasUnitPrice = gasUnitPrice;
            return this;
        }

        public Builder expirationSeconds(long expirationSeconds) {
            this.expirationSeconds = expirationSeconds;
            return this;
        }

        /**
         * @return the defaults
         * @throws IllegalArgumentException if any value is out of range
         */
        public TransactionDefaults build() {
            return new TransactionDefaults(maxGasAmount, gasUnitPrice, expirationSeconds);
        }
    }
}
