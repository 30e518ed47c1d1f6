// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.types;

import java.util.Objects;

import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Reference type {@code &T}. Only appears in function signatures.
 *
 * @param target the referenced type
 * @since 0.1.0
 */
public record ReferenceTag(TypeTag target) implements TypeTag {

    public ReferenceTag {
        Objects.requireNonNull(target, "target cannot be null");
    }

    @Override
    public int variant() {
        return REFERENCE;
    }

    @Override
    public void serializeBody(final Serializer serializer) {
        target.serialize(serializer);
    }

    @Override
    public String toString() {
        return "&" + target;
    }
}
