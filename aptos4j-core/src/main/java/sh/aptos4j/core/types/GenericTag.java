// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.types;

import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Generic type parameter {@code T<index>} of a function signature. The body is the index as a
 * u16.
 *
 * @param index zero-based position in the function's type parameters
 * @since 0.1.0
 */
public record GenericTag(int index) implements TypeTag {

    public GenericTag {
        if (index < 0 || index > 0xFFFF) {
            throw new IllegalArgumentException("generic index out of range: " + index);
        }
    }

    @Override
    public int variant() {
        return GENERIC;
    }

    @Override
    public void serializeBody(final Serializer serializer) {
        serializer.u16(index);
    }

    @Override
    public String toString() {
        return "T" + index;
    }
}
