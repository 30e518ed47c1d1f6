// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.core.types.PrimitiveTypeTag;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Bcs;
import sh.aptos4j.primitives.bcs.BcsException;
import sh.aptos4j.primitives.bcs.Serializer;

class TransactionPayloadTest {

    private static byte[] withVariant(final TransactionPayload payload) {
        Serializer serializer = new Serializer();
        TransactionPayload.write(serializer, payload);
        return serializer.toByteArray();
    }

    private static TransactionPayload read(final byte[] bytes) {
        return Bcs.deserialize(bytes, TransactionPayload::read);
    }

    @Nested
    class EntryFunctions {

        @Test
        @DisplayName("layout is module, name, type args, length-prefixed args")
        void layout() {
            EntryFunction fn = new EntryFunction(ModuleId.parse("0x1::aptos_account"), "transfer", List.of(),
                    List.of(AccountAddress.ONE.toBcs(), Bcs.serializeU64(1)));
            String expected = "02"
                    + "00".repeat(31) + "01"
                    + "0d" + Hex.encodeNoPrefix("aptos_account".getBytes())
                    + "08" + Hex.encodeNoPrefix("transfer".getBytes())
                    + "00"
                    + "02"
                    + "20" + "00".repeat(31) + "01"
                    + "08" + "0100000000000000";

            assertEquals(expected, Hex.encodeNoPrefix(withVariant(fn)));
            assertEquals(fn, read(withVariant(fn)));
        }

        @Test
        void argumentsAreCopied() {
            byte[] arg = {1};
            EntryFunction fn = new EntryFunction(ModuleId.parse("0x1::m"), "f", List.of(), List.of(arg));
            arg[0] = 2;
            fn.args().get(0)[0] = 3;

            assertArrayEquals(new byte[] {1}, fn.args().get(0));
        }

        @Test
        void moduleIdParsing() {
            ModuleId id = ModuleId.parse("0x1::aptos_account");

            assertEquals(AccountAddress.ONE, id.address());
            assertEquals("aptos_account", id.name());
            assertEquals("0x1::aptos_account", id.toString());
            assertThrows(IllegalArgumentException.class, () -> ModuleId.parse("0x1"));
            assertThrows(IllegalArgumentException.class, () -> ModuleId.parse("0x1::a::b"));
        }
    }

    @Nested
    class Scripts {

        @Test
        void boolArgumentEncodesAsVariantFiveThenOne() {
            assertArrayEquals(new byte[] {0x05, 0x01}, new ScriptArgument.Bool(true).toBcs());
        }

        @Test
        void argumentVariants() {
            assertArrayEquals(new byte[] {0x00, (byte) 0xFF}, new ScriptArgument.U8(255).toBcs());
            assertArrayEquals(new byte[] {0x06, 0x02, 0x01}, new ScriptArgument.U16(0x0102).toBcs());
            assertArrayEquals(new byte[] {0x04, 0x02, 0x0A, 0x0B}, new ScriptArgument.U8Vector(new byte[] {10, 11}).toBcs());
            assertEquals(17, new ScriptArgument.U128(BigInteger.ONE).toBcs().length);
            assertEquals(33, new ScriptArgument.U256(BigInteger.ONE).toBcs().length);
            assertEquals(33, new ScriptArgument.Address(AccountAddress.ONE).toBcs().length);
        }

        @Test
        void scriptRoundTrips() {
            Script script = new Script(new byte[] {(byte) 0xA1, 0x1C}, List.of(PrimitiveTypeTag.U64),
                    List.of(new ScriptArgument.U64(5), new ScriptArgument.Bool(false), new ScriptArgument.U32(9)));
            byte[] bytes = withVariant(script);

            assertEquals(TransactionPayload.SCRIPT, bytes[0]);
            assertEquals(script, read(bytes));
        }

        @Test
        void outOfRangeArgumentsRejected() {
            assertThrows(IllegalArgumentException.class, () -> new ScriptArgument.U8(256));
            assertThrows(IllegalArgumentException.class, () -> new ScriptArgument.U16(-1));
        }
    }

    @Nested
    class Multisigs {

        @Test
        void withAndWithoutInnerPayload() {
            Multisig empty = new Multisig(AccountAddress.THREE, null);
            Multisig full = new Multisig(AccountAddress.THREE, Transactions.transfer(AccountAddress.ONE, 1));

            byte[] emptyBytes = withVariant(empty);
            assertEquals(1 + 32 + 1, emptyBytes.length);
            assertEquals(0, emptyBytes[emptyBytes.length - 1]);
            assertEquals(empty, read(emptyBytes));

            byte[] fullBytes = withVariant(full);
            assertEquals(1, fullBytes[33]);
            assertEquals(0, fullBytes[34]);
            assertEquals(full, read(fullBytes));
        }
    }

    @Test
    @DisplayName("module bundles and unknown variants are decode errors")
    void unsupportedVariants() {
        BcsException bundle = assertThrows(BcsException.class, () -> read(new byte[] {0x01, 0x00}));
        assertTrue(bundle.getMessage().contains("module bundle"), bundle.getMessage());
        assertThrows(BcsException.class, () -> read(new byte[] {0x09}));
    }
}
