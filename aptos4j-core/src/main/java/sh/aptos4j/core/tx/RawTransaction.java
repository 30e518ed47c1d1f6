// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.util.Objects;

import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.primitives.bcs.BcsSerializable;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Unsigned transaction.
 * <p>
 * The u64 fields hold raw unsigned bits; use {@link Long#toUnsignedString(long)} to display
 * them. {@link #signingMessage()} is what a single sender signs.
 *
 * @param sender                  the sending account
 * @param sequenceNumber          the sender's next sequence number
 * @param payload                 what to execute
 * @param maxGasAmount            gas units the sender is willing to spend
 * @param gasUnitPrice            octas per gas unit
 * @param expirationTimestampSecs unix time after which the transaction is discarded
 * @param chainId                 target chain, 0 to 255
 * @since 0.1.0
 */
public record RawTransaction(
        AccountAddress sender,
        long sequenceNumber,
        TransactionPayload payload,
        long maxGasAmount,
        long gasUnitPrice,
        long expirationTimestampSecs,
        int chainId) implements BcsSerializable {

    public RawTransaction {
        Objects.requireNonNull(sender, "sender cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
        if (chainId < 0 || chainId > 0xFF) {
            throw new IllegalArgumentException("chainId must fit in u8, got " + chainId);
        }
    }

    /** @return {@code SHA3-256("APTOS::RawTransaction") || BCS(this)} */
    public byte[] signingMessage() {
        return TransactionPrehash.signingMessage(this);
    }

    @Override
    public void serialize(final Serializer serializer) {
        sender.serialize(serializer);
        serializer.u64(sequenceNumber);
        TransactionPayload.write(serializer, payload);
        serializer.u64(maxGasAmount);
        serializer.u64(gasUnitPrice);
        serializer.u64(expirationTimestampSecs);
        serializer.u8(chainId);
    }

    public static RawTransaction deserialize(final Deserializer deserializer) {
        final AccountAddress sender = AccountAddress.deserialize(deserializer);
        final long sequenceNumber = deserializer.u64();
        final TransactionPayload payload = TransactionPayload.read(deserializer);
        final long maxGas = deserializer.u64();
        final long gasPrice = deserializer.u64();
        final long expiration = deserializer.u64();
        final int chainId = deserializer.u8();
        if (deserializer.hasError()) {
            return null;
        }
        return new RawTransaction(sender, sequenceNumber, payload, maxGas, gasPrice, expiration, chainId);
    }

    @Override
    public String toString() {
        return "RawTransaction[sender=" + sender
                + ", sequenceNumber=" + Long.toUnsignedString(sequenceNumber)
                + ", payload=" + payload
                + ", maxGasAmount=" + Long.toUnsignedString(maxGasAmount)
                + ", gasUnitPrice=" + Long.toUnsignedString(gasUnitPrice)
                + ", expirationTimestampSecs=" + Long.toUnsignedString(expirationTimestampSecs)
                + ", chainId=" + chainId + "]";
    }
}
