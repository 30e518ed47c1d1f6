// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.types;

import java.util.Objects;

import sh.aptos4j.primitives.bcs.Serializer;

/**
 * {@code vector<T>}.
 *
 * @param element the element type
 * @since 0.1.0
 */
public record VectorTag(TypeTag element) implements TypeTag {

    public VectorTag {
        Objects.requireNonNull(element, "element cannot be null");
    }

    @Override
    public int variant() {
        return VECTOR;
    }

    @Override
    public void serializeBody(final Serializer serializer) {
        element.serialize(serializer);
    }

    @Override
    public String toString() {
        return "vector<" + element + ">";
    }
}
