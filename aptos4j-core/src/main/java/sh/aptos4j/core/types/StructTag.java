// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.types;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Struct type {@code address::module::Name<T1,T2>}.
 * <p>
 * BCS body: the 32-byte address, the module and name as strings, then the sequence of type
 * parameters. The text form prints the address in short form and joins parameters with
 * {@code ,} and no space.
 *
 * @param address    the publishing account
 * @param module     the module name
 * @param name       the struct name
 * @param typeParams the type arguments, possibly empty
 * @since 0.1.0
 */
public record StructTag(AccountAddress address, String module, String name, List<TypeTag> typeParams)
        implements TypeTag {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_0-9]+");

    public StructTag {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(module, "module cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(typeParams, "typeParams cannot be null");
        if (!IDENTIFIER.matcher(module).matches()) {
            throw new IllegalArgumentException("invalid module name: " + module);
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid struct name: " + name);
        }
        typeParams = List.copyOf(typeParams);
    }

    public StructTag(final AccountAddress address, final String module, final String name) {
        this(address, module, name, List.of());
    }

    /** @return {@code 0x1::string::String} */
    public static StructTag string() {
        return new StructTag(AccountAddress.ONE, "string", "String");
    }

    /** @return {@code 0x1::option::Option<T>} */
    public static StructTag option(final TypeTag inner) {
        return new StructTag(AccountAddress.ONE, "option", "Option", List.of(inner));
    }

    /** @return {@code 0x1::object::Object<T>} */
    public static StructTag object(final TypeTag inner) {
        return new StructTag(AccountAddress.ONE, "object", "Object", List.of(inner));
    }

    /** @return {@code 0x1::aptos_coin::AptosCoin} */
    public static StructTag aptosCoin() {
        return new StructTag(AccountAddress.ONE, "aptos_coin", "AptosCoin");
    }

    /**
     * @param module the module name
     * @param name   the struct name
     * @return whether this struct is {@code 0x1::module::name}
     */
    public boolean isFramework(final String module, final String name) {
        return AccountAddress.ONE.equals(address) && this.module.equals(module) && this.name.equals(name);
    }

    @Override
    public int variant() {
        return STRUCT;
    }

    @Override
    public void serializeBody(final Serializer serializer) {
        address.serialize(serializer);
        serializer.string(module);
        serializer.string(name);
        serializer.sequence(typeParams);
    }

    static TypeTag deserializeBody(final Deserializer deserializer) {
        final AccountAddress address = AccountAddress.deserialize(deserializer);
        final String module = deserializer.string();
        final String name = deserializer.string();
        final List<TypeTag> params = deserializer.sequence(TypeTag::deserialize);
        if (deserializer.hasError()) {
            return PrimitiveTypeTag.BOOL;
        }
        try {
            return new StructTag(address, module, name, params);
        } catch (IllegalArgumentException e) {
            deserializer.setError(e.getMessage());
            return PrimitiveTypeTag.BOOL;
        }
    }

    @Override
    public String toString() {
        final String base = address.toShortString() + "::" + module + "::" + name;
        if (typeParams.isEmpty()) {
            return base;
        }
        return typeParams.stream().map(TypeTag::toString).collect(Collectors.joining(",", base + "<", ">"));
    }
}
