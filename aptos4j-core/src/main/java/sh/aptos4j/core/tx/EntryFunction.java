// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.util.List;
import java.util.Objects;

import sh.aptos4j.core.types.TypeTag;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Call of a public entry function.
 * <p>
 * BCS: module id, function name, type arguments, then the argument count followed by each
 * argument as length-prefixed BCS bytes.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EntryFunction transfer = new EntryFunction(
 *         ModuleId.parse("0x1::aptos_account"), "transfer",
 *         List.of(),
 *         List.of(recipient.toBcs(), Bcs.serializeU64(1_000L)));
 * }</pre>
 *
 * @param module   the module holding the function
 * @param function the function name
 * @param typeArgs type arguments
 * @param args     BCS-encoded arguments, signer parameters excluded
 * @since 0.1.0
 */
public record EntryFunction(ModuleId module, String function, List<TypeTag> typeArgs, List<byte[]> args)
        implements TransactionPayload {

    public EntryFunction {
        Objects.requireNonNull(module, "module cannot be null");
        Objects.requireNonNull(function, "function cannot be null");
        Objects.requireNonNull(typeArgs, "typeArgs cannot be null");
        if (function.isEmpty()) {
            throw new IllegalArgumentException("function name cannot be empty");
        }
        typeArgs = List.copyOf(typeArgs);
        args = Arguments.copyOf(args);
    }

    /** Returns copies of the argument blobs. */
    @Override
    public List<byte[]> args() {
        return Arguments.copyOf(args);
    }

    @Override
    public int variant() {
        return ENTRY_FUNCTION;
    }

    @Override
    public void serialize(final Serializer serializer) {
        module.serialize(serializer);
        serializer.string(function);
        serializer.sequence(typeArgs);
        Arguments.write(serializer, args);
    }

    public static EntryFunction deserialize(final Deserializer deserializer) {
        final ModuleId module = ModuleId.deserialize(deserializer);
        final String function = deserializer.string();
        final List<TypeTag> typeArgs = deserializer.sequence(TypeTag::deserialize);
        final List<byte[]> args = Arguments.read(deserializer);
        if (deserializer.hasError()) {
            return null;
        }
        if (function.isEmpty()) {
            deserializer.setError("function name cannot be empty");
            return null;
        }
        return new EntryFunction(module, function, typeArgs, args);
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof EntryFunction other
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
        return "EntryFunction[" + module + "::" + function + typeArgs + ", args=" + args.size() + "]";
    }
}
