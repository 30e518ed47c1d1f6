// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.aptos4j.core.error.TypeTagParseException;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Bcs;
import sh.aptos4j.primitives.bcs.BcsException;

class TypeTagTest {

    private static final String COIN_STORE = "0x1::coin::CoinStore<0x1::aptos_coin::AptosCoin>";

    @Nested
    @DisplayName("parsing")
    class Parsing {

        @Test
        void primitives() {
            assertEquals(PrimitiveTypeTag.BOOL, TypeTag.parse("bool"));
            assertEquals(PrimitiveTypeTag.U256, TypeTag.parse("u256"));
            assertEquals(PrimitiveTypeTag.I64, TypeTag.parse(" i64 "));
            assertEquals(PrimitiveTypeTag.SIGNER, TypeTag.parse("signer"));
        }

        @Test
        void nestedStruct() {
            TypeTag tag = TypeTag.parse(COIN_STORE);

            StructTag struct = assertInstanceOf(StructTag.class, tag);
            assertEquals(AccountAddress.ONE, struct.address());
            assertEquals("coin", struct.module());
            assertEquals("CoinStore", struct.name());
            assertEquals(List.of(StructTag.aptosCoin()), struct.typeParams());
            assertEquals(COIN_STORE, tag.toString());
        }

        @Test
        void whitespaceIsIgnored() {
            assertEquals(TypeTag.parse("0x1::pair::Pair<u8,vector<address>>"),
                    TypeTag.parse(" 0x1 :: pair :: Pair < u8 , vector < address > > "));
        }

        @Test
        void vectorsReferencesAndGenerics() {
            assertEquals(new VectorTag(new VectorTag(PrimitiveTypeTag.U8)), TypeTag.parse("vector<vector<u8>>"));
            assertEquals(new ReferenceTag(PrimitiveTypeTag.SIGNER), TypeTag.parse("&signer"));
            assertEquals(new VectorTag(new GenericTag(3)), TypeTag.parse("vector<T3>"));
        }

        @Test
        void longAddressesAreShortenedInText() {
            TypeTag tag = TypeTag.parse(
                    "0x0000000000000000000000000000000000000000000000000000000000000001::string::String");
            assertEquals(StructTag.string(), tag);
            assertEquals("0x1::string::String", tag.toString());
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "",
            "   ",
            "u7",
            "vector",
            "vector<>",
            "vector<u8,u8>",
            "vector<u8",
            "u8<u8>",
            "0x1::coin",
            "0x1::coin::",
            "0x1::coin::Coin<",
            "0xzz::coin::Coin",
            "u8 u8",
            "<u8>",
            "T99999999999"
        })
        void rejectsMalformedTypes(final String text) {
            assertThrows(TypeTagParseException.class, () -> TypeTag.parse(text));
        }

        @Test
        void errorNamesThePosition() {
            TypeTagParseException e = assertThrows(TypeTagParseException.class, () -> TypeTag.parse("vector<u8"));
            assertTrue(e.getMessage().contains("position"), e.getMessage());
        }
    }

    @Nested
    @DisplayName("BCS")
    class Encoding {

        @Test
        void primitiveDiscriminants() {
            assertArrayEquals(new byte[] {0x00}, PrimitiveTypeTag.BOOL.toBcs());
            assertArrayEquals(new byte[] {0x04}, PrimitiveTypeTag.ADDRESS.toBcs());
            assertArrayEquals(new byte[] {0x08}, PrimitiveTypeTag.U16.toBcs());
            assertArrayEquals(new byte[] {0x10}, PrimitiveTypeTag.I256.toBcs());
            assertArrayEquals(new byte[] {0x06, 0x01}, new VectorTag(PrimitiveTypeTag.U8).toBcs());
        }

        @Test
        void structLayout() {
            byte[] bytes = StructTag.aptosCoin().toBcs();
            String expected = "07" + "00".repeat(31) + "01"
                    + "0a" + Hex.encodeNoPrefix("aptos_coin".getBytes())
                    + "09" + Hex.encodeNoPrefix("AptosCoin".getBytes())
                    + "00";
            assertEquals(expected, Hex.encodeNoPrefix(bytes));
        }

        @Test
        void genericAndReferenceBodies() {
            assertArrayEquals(new byte[] {(byte) 0xFE, 0x01, 0x02, 0x00}, new GenericTag(2).toBcs());
            assertArrayEquals(new byte[] {(byte) 0xFF, 0x01, 0x05}, new ReferenceTag(PrimitiveTypeTag.SIGNER).toBcs());
        }

        @Test
        void nestedTagsDecode() {
            TypeTag tag = TypeTag.parse("vector<0x1::option::Option<0x1::object::Object<T0>>>");
            assertEquals(tag, Bcs.deserialize(tag.toBcs(), TypeTag::deserialize));
        }

        @Test
        void unknownDiscriminantFails() {
            assertThrows(BcsException.class, () -> Bcs.deserialize(new byte[] {0x11}, TypeTag::deserialize));
        }
    }

    @Test
    void frameworkCheck() {
        assertTrue(StructTag.string().isFramework("string", "String"));
        assertFalse(new StructTag(AccountAddress.TWO, "string", "String").isFramework("string", "String"));
    }
}
