// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import sh.aptos4j.core.types.TypeTag;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Compiled Move script with its type arguments and typed arguments.
 *
 * @param code     script bytecode
 * @param typeArgs type arguments
 * @param args     typed arguments
 * @since 0.1.0
 */
public record Script(byte[] code, List<TypeTag> typeArgs, List<ScriptArgument> args) implements TransactionPayload {

    public Script {
        Objects.requireNonNull(code, "code cannot be null");
        Objects.requireNonNull(typeArgs, "typeArgs cannot be null");
        Objects.requireNonNull(args, "args cannot be null");
        code = Arrays.copyOf(code, code.length);
        typeArgs = List.copyOf(typeArgs);
        args = List.copyOf(args);
    }

    @Override
    public byte[] code() {
        return Arrays.copyOf(code, code.length);
    }

    @Override
    public int variant() {
        return SCRIPT;
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.bytes(code);
        serializer.sequence(typeArgs);
        serializer.sequence(args);
    }

    public static Script deserialize(final Deserializer deserializer) {
        final byte[] code = deserializer.bytes();
        final List<TypeTag> typeArgs = deserializer.sequence(TypeTag::deserialize);
        final List<ScriptArgument> args = deserializer.sequence(ScriptArgument::deserialize);
        return deserializer.hasError() ? null : new Script(code, typeArgs, args);
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof Script other
                && Arrays.equals(code, other.code)
                && typeArgs.equals(other.typeArgs)
                && args.equals(other.args));
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(code), typeArgs, args);
    }

    @Override
    public String toString() {
        return "Script[code=" + code.length + " bytes, typeArgs=" + typeArgs + ", args=" + args + "]";
    }
}
