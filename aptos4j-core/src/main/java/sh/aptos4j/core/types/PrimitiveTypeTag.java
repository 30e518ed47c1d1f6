// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.types;

import org.jspecify.annotations.Nullable;

import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Move primitive types and their BCS discriminants.
 *
 * @since 0.1.0
 */
public enum PrimitiveTypeTag implements TypeTag {
    BOOL(0, "bool"),
    U8(1, "u8"),
    U64(2, "u64"),
    U128(3, "u128"),
    ADDRESS(4, "address"),
    SIGNER(5, "signer"),
    U16(8, "u16"),
    U32(9, "u32"),
    U256(10, "u256"),
    I8(11, "i8"),
    I16(12, "i16"),
    I32(13, "i32"),
    I64(14, "i64"),
    I128(15, "i128"),
    I256(16, "i256");

    private final int variant;
    private final String text;

    PrimitiveTypeTag(final int variant, final String text) {
        this.variant = variant;
        this.text = text;
    }

    @Override
    public int variant() {
        return variant;
    }

    @Override
    public void serializeBody(final Serializer serializer) {
        // primitives have no body
    }

    /** @return true for the unsigned and signed integer types */
    public boolean isInteger() {
        return this != BOOL && this != ADDRESS && this != SIGNER;
    }

    /** @return true for i8 through i256 */
    public boolean isSigned() {
        return variant >= I8.variant;
    }

    /**
     * Width of an integer type in bits.
     *
     * @return the bit width
     * @throws IllegalStateException for non-integer types
     */
    public int bitWidth() {
        switch (this) {
            case U8:
            case I8:
                return 8;
            case U16:
            case I16:
                return 16;
            case U32:
            case I32:
                return 32;
            case U64:
            case I64:
                return 64;
            case U128:
            case I128:
                return 128;
            case U256:
            case I256:
                return 256;
            default:
                throw new IllegalStateException(text + " is not an integer type");
        }
    }

    /**
     * Looks up a primitive by its text form.
     *
     * @param text e.g. {@code u64}
     * @return the primitive, or {@code null} if the name is not a primitive
     */
    public static @Nullable PrimitiveTypeTag fromText(final String text) {
        for (PrimitiveTypeTag tag : values()) {
            if (tag.text.equals(text)) {
                return tag;
            }
        }
        return null;
    }

    static @Nullable PrimitiveTypeTag fromVariant(final long variant) {
        for (PrimitiveTypeTag tag : values()) {
            if (tag.variant == variant) {
                return tag;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return text;
    }
}
