// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.abi;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.aptos4j.core.error.ArgumentMarshalException;
import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.core.types.GenericTag;
import sh.aptos4j.core.types.PrimitiveTypeTag;
import sh.aptos4j.core.types.StructTag;
import sh.aptos4j.core.types.TypeTag;
import sh.aptos4j.core.types.VectorTag;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Bcs;

class ArgumentMarshallerTest {

    private static byte[] marshal(final String type, final Object value) {
        return ArgumentMarshaller.marshal(TypeTag.parse(type), value);
    }

    @Nested
    @DisplayName("integers")
    class Integers {

        @Test
        void acceptsNumbersAndDecimalStrings() {
            assertArrayEquals(Bcs.serializeU64(1_000), marshal("u64", 1_000));
            assertArrayEquals(Bcs.serializeU64(1_000), marshal("u64", 1_000L));
            assertArrayEquals(Bcs.serializeU64(1_000), marshal("u64", "1000"));
            assertArrayEquals(Bcs.serializeU64(1_000), marshal("u64", BigInteger.valueOf(1_000)));
            assertArrayEquals(Bcs.serializeU64(1_000), marshal("u64", 1_000.0d));
            assertArrayEquals(Bcs.serializeU64(1_000), marshal("u64", new BigDecimal("1000.00")));
            assertArrayEquals(new byte[] {(byte) 0xFF}, marshal("u8", (short) 255));
        }

        @Test
        void maxU64FromString() {
            assertArrayEquals(Hex.decode("0xffffffffffffffff"), marshal("u64", "18446744073709551615"));
        }

        @Test
        void rangeErrorsNameTheType() {
            ArgumentMarshalException e = assertThrows(ArgumentMarshalException.class, () -> marshal("u8", 256));
            assertEquals("value 256 out of range for u8", e.getMessage());
            assertThrows(ArgumentMarshalException.class, () -> marshal("u64", -1));
            assertThrows(ArgumentMarshalException.class, () -> marshal("u128", BigInteger.ONE.shiftLeft(128)));
        }

        @Test
        void signedIntegers() {
            assertArrayEquals(new byte[] {(byte) 0xFF}, marshal("i8", -1));
            assertArrayEquals(new byte[] {(byte) 0x80}, marshal("i8", -128));
            assertThrows(ArgumentMarshalException.class, () -> marshal("i8", 128));
            assertArrayEquals(Hex.decode("0xfeffffffffffffff"), marshal("i64", "-2"));
        }

        @Test
        void rejectsFractionsAndGarbage() {
            ArgumentMarshalException fraction = assertThrows(ArgumentMarshalException.class,
                    () -> marshal("u64", 1.5d));
            assertTrue(fraction.getMessage().contains("fractional value"), fraction.getMessage());
            assertThrows(ArgumentMarshalException.class, () -> marshal("u64", Double.NaN));
            assertThrows(ArgumentMarshalException.class, () -> marshal("u64", "0x10"));
            assertThrows(ArgumentMarshalException.class, () -> marshal("u64", true));
            assertThrows(ArgumentMarshalException.class, () -> marshal("u64", null));
        }
    }

    @Nested
    class Scalars {

        @Test
        void bools() {
            assertArrayEquals(new byte[] {1}, marshal("bool", true));
            assertArrayEquals(new byte[] {0}, marshal("bool", "false"));
            ArgumentMarshalException e = assertThrows(ArgumentMarshalException.class, () -> marshal("bool", 1));
            assertEquals("expected bool, got Integer", e.getMessage());
        }

        @Test
        void addresses() {
            assertArrayEquals(AccountAddress.ONE.toBcs(), marshal("address", "0x1"));
            assertArrayEquals(AccountAddress.ONE.toBcs(), marshal("address", AccountAddress.ONE));
            assertThrows(ArgumentMarshalException.class, () -> marshal("address", "0xzz"));
            assertThrows(ArgumentMarshalException.class, () -> marshal("address", 1));
        }

        @Test
        void stringsAndObjects() {
            assertArrayEquals(Bcs.serializeString("hi"), marshal("0x1::string::String", "hi"));
            assertArrayEquals(AccountAddress.THREE.toBcs(),
                    marshal("0x1::object::Object<0x1::fungible_asset::Metadata>", "0x3"));
            assertThrows(ArgumentMarshalException.class, () -> marshal("0x1::string::String", 5));
        }

        @Test
        void arbitraryStructsUnsupported() {
            ArgumentMarshalException e = assertThrows(ArgumentMarshalException.class,
                    () -> marshal("0x1::coin::Coin<0x1::aptos_coin::AptosCoin>", "x"));
            assertTrue(e.getMessage().startsWith("unsupported struct argument type"), e.getMessage());
        }
    }

    @Nested
    class Vectors {

        @Test
        void byteVectorsFromBytesOrUtf8() {
            assertArrayEquals(new byte[] {2, 0x0A, 0x0B}, marshal("vector<u8>", new byte[] {0x0A, 0x0B}));
            assertArrayEquals(new byte[] {2, 'h', 'i'}, marshal("vector<u8>", "hi"));
            assertArrayEquals(new byte[] {2, 1, 2}, marshal("vector<u8>", List.of(1, 2)));
        }

        @Test
        void listsAndArrays() {
            byte[] expected = Hex.decode("0x0201000000000000000200000000000000");

            assertArrayEquals(expected, marshal("vector<u64>", List.of(1, 2)));
            assertArrayEquals(expected, marshal("vector<u64>", new long[] {1, 2}));
            assertArrayEquals(expected, marshal("vector<u64>", new String[] {"1", "2"}));
        }

        @Test
        void nestedVectors() {
            assertArrayEquals(new byte[] {2, 1, 1, 0}, marshal("vector<vector<bool>>", List.of(List.of(true), List.of())));
        }

        @Test
        void elementErrorsNameTheIndex() {
            ArgumentMarshalException e = assertThrows(ArgumentMarshalException.class,
                    () -> marshal("vector<u8>", Arrays.asList(1, 300)));
            assertTrue(e.getMessage().startsWith("element 1 of vector<u8>:"), e.getMessage());
        }

        @Test
        void nonCollectionRejected() {
            assertThrows(ArgumentMarshalException.class, () -> marshal("vector<u64>", 5));
        }
    }

    @Nested
    class Options {

        @Test
        void nullIsNoneAnythingElseIsSome() {
            assertArrayEquals(new byte[] {0}, marshal("0x1::option::Option<u8>", null));
            assertArrayEquals(new byte[] {1, 7}, marshal("0x1::option::Option<u8>", 7));
        }

        @Test
        void hexIsPlainStringByDefault() {
            assertArrayEquals(new byte[] {1, 4, '0', 'x', '0', '0'},
                    marshal("0x1::option::Option<vector<u8>>", "0x00"));
        }

        @Test
        @DisplayName("compatibility mode reads BCS hex for options")
        void compatibilityHex() {
            TypeTag type = TypeTag.parse("0x1::option::Option<u64>");
            MarshalOptions options = MarshalOptions.compatibilityMode();

            assertArrayEquals(new byte[] {0},
                    ArgumentMarshaller.marshal(type, "0x00", List.of(), options));
            assertArrayEquals(Hex.decode("0x010500000000000000"),
                    ArgumentMarshaller.marshal(type, "0x010500000000000000", List.of(), options));
        }

        @Test
        void compatibilityAddressIsFixedWidth() {
            TypeTag type = TypeTag.parse("0x1::option::Option<address>");
            byte[] input = new byte[33];
            input[0] = 1;
            input[32] = 1;

            assertArrayEquals(input,
                    ArgumentMarshaller.marshal(type, Hex.encode(input), List.of(), MarshalOptions.compatibilityMode()));
        }

        @Test
        void compatibilityRejectsBadHex() {
            TypeTag type = TypeTag.parse("0x1::option::Option<u64>");
            MarshalOptions options = MarshalOptions.compatibilityMode();

            assertThrows(ArgumentMarshalException.class,
                    () -> ArgumentMarshaller.marshal(type, "0x02", List.of(), options));
            assertThrows(ArgumentMarshalException.class,
                    () -> ArgumentMarshaller.marshal(type, "0x0105", List.of(), options));
            assertThrows(ArgumentMarshalException.class,
                    () -> ArgumentMarshaller.marshal(type, "0x0000", List.of(), options));
            assertThrows(ArgumentMarshalException.class,
                    () -> ArgumentMarshaller.marshal(type, "0xq", List.of(), options));
        }
    }

    @Test
    void genericsResolveAgainstTypeArguments() {
        byte[] bytes = ArgumentMarshaller.marshal(new VectorTag(new GenericTag(0)), List.of("a"),
                List.of(StructTag.string()), MarshalOptions.defaults());

        assertArrayEquals(new byte[] {1, 1, 'a'}, bytes);
        assertThrows(ArgumentMarshalException.class,
                () -> ArgumentMarshaller.marshal(new GenericTag(1), 1, List.of(PrimitiveTypeTag.U8),
                        MarshalOptions.defaults()));
    }
}
