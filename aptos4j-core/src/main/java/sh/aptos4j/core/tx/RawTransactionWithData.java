// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.util.List;
import java.util.Objects;

import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.primitives.bcs.BcsSerializable;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * The message signed by every participant of a multi-agent or fee-payer transaction: the raw
 * transaction plus the other participants' addresses.
 * <p>
 * Discriminants: {@link MultiAgent} = 0, {@link FeePayer} = 1.
 *
 * @since 0.1.0
 */
public sealed interface RawTransactionWithData extends BcsSerializable {

    int MULTI_AGENT = 0;
    int FEE_PAYER = 1;

    RawTransaction rawTransaction();

    List<AccountAddress> secondarySigners();

    /** @return {@code SHA3-256("APTOS::RawTransactionWithData") || BCS(this)} */
    default byte[] signingMessage() {
        return TransactionPrehash.signingMessage(this);
    }

    static RawTransactionWithData deserialize(final Deserializer deserializer) {
        final long variant = deserializer.uleb128();
        if (deserializer.hasError()) {
            return null;
        }
        if (variant != MULTI_AGENT && variant != FEE_PAYER) {
            deserializer.setError("unknown RawTransactionWithData variant " + variant);
            return null;
        }
        final RawTransaction raw = RawTransaction.deserialize(deserializer);
        final List<AccountAddress> secondaries = deserializer.sequence(AccountAddress::deserialize);
        if (variant == MULTI_AGENT) {
            return deserializer.hasError() ? null : new MultiAgent(raw, secondaries);
        }
        final AccountAddress feePayer = AccountAddress.deserialize(deserializer);
        return deserializer.hasError() ? null : new FeePayer(raw, secondaries, feePayer);
    }

    /**
     * @param rawTransaction   the transaction
     * @param secondarySigners addresses of the secondary signers, in signing order
     */
    record MultiAgent(RawTransaction rawTransaction, List<AccountAddress> secondarySigners)
            implements RawTransactionWithData {

        public MultiAgent {
            Objects.requireNonNull(rawTransaction, "rawTransaction cannot be null");
            Objects.requireNonNull(secondarySigners, "secondarySigners cannot be null");
            secondarySigners = List.copyOf(secondarySigners);
        }

        @Override
        public void serialize(final Serializer serializer) {
            serializer.uleb128(MULTI_AGENT);
            rawTransaction.serialize(serializer);
            serializer.sequence(secondarySigners);
        }
    }

    /**
     * @param rawTransaction   the transaction
     * @param secondarySigners addresses of the secondary signers, in signing order
     * @param feePayer         the fee payer, or {@link AccountAddress#ZERO} while still unknown
     */
    record FeePayer(RawTransaction rawTransaction, List<AccountAddress> secondarySigners, AccountAddress feePayer)
            implements RawTransactionWithData {

        public FeePayer {
            Objects.requireNonNull(rawTransaction, "rawTransaction cannot be null");
            Objects.requireNonNull(secondarySigners, "secondarySigners cannot be null");
            Objects.requireNonNull(feePayer, "feePayer cannot be null");
            secondarySigners = List.copyOf(secondarySigners);
        }

        @Override
        public void serialize(final Serializer serializer) {
            serializer.uleb128(FEE_PAYER);
            rawTransaction.serialize(serializer);
            serializer.sequence(secondarySigners);
            feePayer.serialize(serializer);
        }
    }
}
