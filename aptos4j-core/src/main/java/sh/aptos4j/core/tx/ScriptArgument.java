// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.BcsSerializable;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Typed script argument. Unlike entry function arguments, script arguments carry their type
 * as a discriminant: U8=0, U64=1, U128=2, Address=3, U8Vector=4, Bool=5, U16=6, U32=7,
 * U256=8.
 *
 * @since 0.1.0
 */
public sealed interface ScriptArgument extends BcsSerializable {

    /** @return the argument discriminant */
    int variant();

    /** Writes the value after the discriminant. */
    void serializeValue(Serializer serializer);

    @Override
    default void serialize(final Serializer serializer) {
        serializer.uleb128(variant());
        serializeValue(serializer);
    }

    static ScriptArgument deserialize(final Deserializer deserializer) {
        final long variant = deserializer.uleb128();
        if (deserializer.hasError()) {
            return null;
        }
        final ScriptArgument arg;
        switch ((int) Math.min(variant, Integer.MAX_VALUE)) {
            case 0:
                arg = new U8(deserializer.u8());
                break;
            case 1:
                arg = new U64(deserializer.u64());
                break;
            case 2:
                arg = new U128(deserializer.u128());
                break;
            case 3:
                arg = new Address(AccountAddress.deserialize(deserializer));
                break;
            case 4:
                arg = new U8Vector(deserializer.bytes());
                break;
            case 5:
                arg = new Bool(deserializer.bool());
                break;
            case 6:
                arg = new U16(deserializer.u16());
                break;
            case 7:
                arg = new U32(deserializer.u32());
                break;
            case 8:
                arg = new U256(deserializer.u256());
                break;
            default:
                deserializer.setError("unknown script argument variant " + variant);
                return null;
        }
        return deserializer.hasError() ? null : arg;
    }

    record U8(int value) implements ScriptArgument {
        public U8 {
            if (value < 0 || value > 0xFF) {
                throw new IllegalArgumentException("u8 out of range: " + value);
            }
        }

        @Override
        public int variant() {
            return 0;
        }

        @Override
        public void serializeValue(final Serializer serializer) {
            serializer.u8(value);
        }
    }

    /** @param value raw u64 bits */
    record U64(long value) implements ScriptArgument {
        @Override
        public int variant() {
            return 1;
        }

        @Override
        public void serializeValue(final Serializer serializer) {
            serializer.u64(value);
        }
    }

    record U128(BigInteger value) implements ScriptArgument {
        public U128 {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public int variant() {
            return 2;
        }

        @Override
        public void serializeValue(final Serializer serializer) {
            serializer.u128(value);
        }
    }

    record Address(AccountAddress value) implements ScriptArgument {
        public Address {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public int variant() {
            return 3;
        }

        @Override
        public void serializeValue(final Serializer serializer) {
            value.serialize(serializer);
        }
    }

    record U8Vector(byte[] value) implements ScriptArgument {
        public U8Vector {
            Objects.requireNonNull(value, "value cannot be null");
            value = Arrays.copyOf(value, value.length);
        }

        @Override
        public byte[] value() {
            return Arrays.copyOf(value, value.length);
        }

        @Override
        public int variant() {
            return 4;
        }

        @Override
        public void serializeValue(final Serializer serializer) {
            serializer.bytes(value);
        }

        @Override
        public boolean equals(final Object o) {
            return this == o || (o instanceof U8Vector other && Arrays.equals(value, other.value));
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "U8Vector[" + Hex.encode(value) + "]";
        }
    }

    record Bool(boolean value) implements ScriptArgument {
        @Override
        public int variant() {
            return 5;
        }

        @Override
        public void serializeValue(final Serializer serializer) {
            serializer.bool(value);
        }
    }

    record U16(int value) implements ScriptArgument {
        public U16 {
            if (value < 0 || value > 0xFFFF) {
                throw new IllegalArgumentException("u16 out of range: " + value);
            }
        }

        @Override
        public int variant() {
            return 6;
        }

        @Override
        public void serializeValue(final Serializer serializer) {
            serializer.u16(value);
        }
    }

    record U32(long value) implements ScriptArgument {
        public U32 {
            if (value < 0 || value > 0xFFFF_FFFFL) {
                throw new IllegalArgumentException("u32 out of range: " + value);
            }
        }

        @Override
        public int variant() {
            return 7;
        }

        @Override
        public void serializeValue(final Serializer serializer) {
            serializer.u32(value);
        }
    }

    record U256(BigInteger value) implements ScriptArgument {
        public U256 {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public int variant() {
            return 8;
        }

        @Override
        public void serializeValue(final Serializer serializer) {
            serializer.u256(value);
        }
    }
}
