// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.types;

import sh.aptos4j.primitives.bcs.BcsSerializable;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * A Move type: a primitive, {@code vector<T>}, a struct, a reference {@code &T} or a generic
 * parameter {@code T<n>}.
 * <p>
 * Every variant is encoded as a ULEB128 discriminant followed by its body. {@link #toString()}
 * returns the canonical text form, which {@link TypeTagParser#parse(String)} accepts back.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * TypeTag coinStore = TypeTag.parse("0x1::coin::CoinStore<0x1::aptos_coin::AptosCoin>");
 * TypeTag bytes = new VectorTag(PrimitiveTypeTag.U8);
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed interface TypeTag extends BcsSerializable
        permits PrimitiveTypeTag, VectorTag, StructTag, ReferenceTag, GenericTag {

    int VECTOR = 6;
    int STRUCT = 7;
    int GENERIC = 254;
    int REFERENCE = 255;

    /**
     * @return the ULEB128 discriminant of this variant
     */
    int variant();

    /**
     * Parses the canonical text form of a type.
     *
     * @param text the type, e.g. {@code vector<0x1::string::String>}
     * @return the parsed tag
     * @throws sh.aptos4j.core.error.TypeTagParseException if the text is not a valid type
     */
    static TypeTag parse(final String text) {
        return TypeTagParser.parse(text);
    }

    /**
     * Reads one tag, recording an error on the deserializer for unknown discriminants.
     *
     * @param deserializer the input
     * @return the tag, or {@link PrimitiveTypeTag#BOOL} after an error
     */
    static TypeTag deserialize(final Deserializer deserializer) {
        final long variant = deserializer.uleb128();
        if (deserializer.hasError()) {
            return PrimitiveTypeTag.BOOL;
        }
        if (variant == VECTOR) {
            return new VectorTag(deserialize(deserializer));
        }
        if (variant == STRUCT) {
            return StructTag.deserializeBody(deserializer);
        }
        if (variant == REFERENCE) {
            return new ReferenceTag(deserialize(deserializer));
        }
        if (variant == GENERIC) {
            return new GenericTag(deserializer.u16());
        }
        final PrimitiveTypeTag primitive = PrimitiveTypeTag.fromVariant(variant);
        if (primitive == null) {
            deserializer.setError("unknown TypeTag variant " + variant);
            return PrimitiveTypeTag.BOOL;
        }
        return primitive;
    }

    /** Writes the discriminant; variants write their body after it. */
    @Override
    default void serialize(final Serializer serializer) {
        serializer.uleb128(variant());
        serializeBody(serializer);
    }

    /**
     * Writes the variant body without the discriminant.
     *
     * @param serializer the output
     */
    void serializeBody(Serializer serializer);
}
