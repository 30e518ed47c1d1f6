// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.util.List;
import java.util.Objects;

import sh.aptos4j.core.types.TypeTag;
import sh.aptos4j.primitives.bcs.BcsSerializable;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Body of a BCS view request: same shape as {@link EntryFunction}, sent with content type
 * {@value #CONTENT_TYPE}.
 *
 * @param module   the module holding the view function
 * @param function the function name
 * @param typeArgs type arguments
 * @param args     BCS-encoded arguments
 * @since 0.1.0
 */
public record ViewPayload(ModuleId module, String function, List<TypeTag> typeArgs, List<byte[]> args)
        implements BcsSerializable {

    public static final String CONTENT_TYPE = "application/x.aptos.view_function+bcs";

    public ViewPayload {
        Objects.requireNonNull(module, "module cannot be null");
        Objects.requireNonNull(function, "function cannot be null");
        Objects.requireNonNull(typeArgs, "typeArgs cannot be null");
        typeArgs = List.copyOf(typeArgs);
        args = Arguments.copyOf(args);
    }

    @Override
    public List<byte[]> args() {
        return Arguments.copyOf(args);
    }

    @Override
    public void serialize(final Serializer serializer) {
        module.serialize(serializer);
        serializer.string(function);
        serializer.sequence(typeArgs);
        Arguments.write(serializer, args);
    }

    public static ViewPayload deserialize(final Deserializer deserializer) {
        final ModuleId module = ModuleId.deserialize(deserializer);
        final String function = deserializer.string();
        final List<TypeTag> typeArgs = deserializer.sequence(TypeTag::deserialize);
        final List<byte[]> args = Arguments.read(deserializer);
        return deserializer.hasError() ? null : new ViewPayload(module, function, typeArgs, args);
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof ViewPayload other
                && module.equals(other.module)
                && function.equals(other.function)
                && typeArgs.equals(other.typeArgs)
                && Arguments.equal(args, other.args));
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, function, typeArgs, Arguments.hash(args));
    }

    @Override
    public String toString() {
        return "ViewPayload[" + module + "::" + function + typeArgs + ", args=" + args.size() + "]";
    }
}
