// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.builder;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.aptos4j.core.tx.EntryFunction;
import sh.aptos4j.core.tx.ModuleId;
import sh.aptos4j.core.tx.RawTransaction;
import sh.aptos4j.core.tx.RawTransactionWithData;
import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.primitives.bcs.Bcs;

class TxBuilderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);
    private static final AccountAddress SENDER = AccountAddress.fromString("0xa11ce");
    private static final EntryFunction TRANSFER = new EntryFunction(ModuleId.parse("0x1::aptos_account"), "transfer",
            List.of(), List.of(AccountAddress.TWO.toBcs(), Bcs.serializeU64(10)));

    @Nested
    @DisplayName("build()")
    class Build {

        @Test
        void requiresSenderAndPayload() {
            AptosTxBuilderException noSender = assertThrows(AptosTxBuilderException.class,
                    () -> TxBuilder.create().payload(TRANSFER).build());
            assertEquals("Transaction must have a sender", noSender.getMessage());

            AptosTxBuilderException noPayload = assertThrows(AptosTxBuilderException.class,
                    () -> TxBuilder.create().sender(SENDER).build());
            assertEquals("Transaction must have a payload", noPayload.getMessage());
        }

        @Test
        void validatesRanges() {
            assertThrows(AptosTxBuilderException.class,
                    () -> TxBuilder.create().sender(SENDER).payload(TRANSFER).maxGasAmount(0).build());
            assertThrows(AptosTxBuilderException.class,
                    () -> TxBuilder.create().sender(SENDER).payload(TRANSFER).gasUnitPrice(-1).build());
            assertThrows(AptosTxBuilderException.class,
                    () -> TxBuilder.create().sender(SENDER).payload(TRANSFER).expirationSeconds(-5).build());
            assertThrows(AptosTxBuilderException.class,
                    () -> TxBuilder.create().sender(SENDER).payload(TRANSFER).chainId(256).build());
        }

        @Test
        void leavesUnsetFieldsNull() {
            TransactionRequest request = TxBuilder.create().sender(SENDER).entryFunction(TRANSFER).build();

            assertNull(request.sequenceNumber());
            assertNull(request.chainId());
            assertNull(request.gasUnitPrice());
            assertFalse(request.isFeePayer());
            assertFalse(request.isMultiAgent());
            assertTrue(request.secondarySigners().isEmpty());
        }
    }

    @Nested
    class RawTransactions {

        @Test
        void appliesDefaultsAndClock() {
            RawTransaction raw = TxBuilder.create().sender(SENDER).payload(TRANSFER)
                    .sequenceNumber(3).chainId(2).build()
                    .toRawTransaction(TransactionDefaults.defaults(), CLOCK);

            assertEquals(SENDER, raw.sender());
            assertEquals(3, raw.sequenceNumber());
            assertEquals(TransactionDefaults.DEFAULT_MAX_GAS_AMOUNT, raw.maxGasAmount());
            assertEquals(TransactionDefaults.DEFAULT_GAS_UNIT_PRICE, raw.gasUnitPrice());
            assertEquals(1_700_000_000L + TransactionDefaults.DEFAULT_EXPIRATION_SECONDS, raw.expirationTimestampSecs());
            assertEquals(2, raw.chainId());
        }

        @Test
        void explicitValuesWin() {
            TransactionDefaults defaults = TransactionDefaults.builder().maxGasAmount(5_000).build();
            RawTransaction raw = TxBuilder.create().sender(SENDER).payload(TRANSFER)
                    .sequenceNumber(0).chainId(4).gasUnitPrice(150).expirationSeconds(30).build()
                    .toRawTransaction(defaults, CLOCK);

            assertEquals(5_000, raw.maxGasAmount());
            assertEquals(150, raw.gasUnitPrice());
            assertEquals(1_700_000_030L, raw.expirationTimestampSecs());
        }

        @Test
        void expirationOverflowIsRejected() {
            TransactionRequest request = TxBuilder.create().sender(SENDER).payload(TRANSFER)
                    .sequenceNumber(0).chainId(4).expirationSeconds(Long.MAX_VALUE).build();

            AptosTxBuilderException ex = assertThrows(AptosTxBuilderException.class,
                    () -> request.toRawTransaction(TransactionDefaults.defaults(), CLOCK));
            assertInstanceOf(ArithmeticException.class, ex.getCause());
        }

        @Test
        void sequenceNumberAndChainIdRequired() {
            TransactionRequest request = TxBuilder.create().sender(SENDER).payload(TRANSFER).build();

            assertThrows(AptosTxBuilderException.class,
                    () -> request.toRawTransaction(TransactionDefaults.defaults(), CLOCK));
            assertThrows(AptosTxBuilderException.class,
                    () -> request.withSequenceNumber(1).toRawTransaction(TransactionDefaults.defaults(), CLOCK));
            assertNotNull(request.withSequenceNumber(1).withChainId(1)
                    .toRawTransaction(TransactionDefaults.defaults(), CLOCK));
        }
    }

    @Nested
    class Envelopes {

        @Test
        void singleSenderHasNoEnvelope() {
            TransactionRequest request = TxBuilder.create().sender(SENDER).payload(TRANSFER)
                    .sequenceNumber(0).chainId(1).build();
            assertNull(request.withData(request.toRawTransaction(TransactionDefaults.defaults(), CLOCK)));
        }

        @Test
        void secondarySignersMakeMultiAgent() {
            TransactionRequest request = TxBuilder.create().sender(SENDER).payload(TRANSFER)
                    .secondarySigner(AccountAddress.THREE).sequenceNumber(0).chainId(1).build();

            assertTrue(request.isMultiAgent());
            RawTransactionWithData data = request.withData(request.toRawTransaction(TransactionDefaults.defaults(), CLOCK));
            assertInstanceOf(RawTransactionWithData.MultiAgent.class, data);
            assertEquals(List.of(AccountAddress.THREE), data.secondarySigners());
        }

        @Test
        void feePayerTakesPrecedence() {
            TransactionRequest request = TxBuilder.create().sender(SENDER).payload(TRANSFER)
                    .secondarySigners(List.of(AccountAddress.THREE)).feePayer(AccountAddress.ZERO)
                    .sequenceNumber(0).chainId(1).build();

            assertTrue(request.isFeePayer());
            assertFalse(request.isMultiAgent());
            RawTransactionWithData.FeePayer data = assertInstanceOf(RawTransactionWithData.FeePayer.class,
                    request.withData(request.toRawTransaction(TransactionDefaults.defaults(), CLOCK)));
            assertEquals(AccountAddress.ZERO, data.feePayer());
        }
    }

    @Test
    void defaultsRejectBadValues() {
        assertThrows(IllegalArgumentException.class, () -> TransactionDefaults.builder().maxGasAmount(0).build());
        assertThrows(IllegalArgumentException.class, () -> TransactionDefaults.builder().gasUnitPrice(-1).build());
        assertThrows(IllegalArgumentException.class, () -> TransactionDefaults.builder().expirationSeconds(-1).build());
    }
}
