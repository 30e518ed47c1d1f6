// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.abi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.aptos4j.core.error.ArgumentMarshalException;
import sh.aptos4j.core.tx.EntryFunction;
import sh.aptos4j.core.tx.ModuleId;
import sh.aptos4j.core.tx.ViewPayload;
import sh.aptos4j.core.types.TypeTag;

/**
 * Binds user arguments to a Move function ABI and produces an {@link EntryFunction} or
 * {@link ViewPayload}.
 * <p>
 * Leading {@code signer}/{@code &signer} parameters are not supplied by the caller. Type
 * arguments may be given as {@link TypeTag}s or as Move type strings.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EntryFunction transfer = EntryFunctionFactory.entryFunction(
 *         coinModuleAbi, "transfer",
 *         List.of("0x1::aptos_coin::AptosCoin"),
 *         List.of(recipient, 1_000L));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class EntryFunctionFactory {

    private EntryFunctionFactory() {
        // Utility class
    }

    /**
     * Looks up an entry function in a module ABI and binds the arguments.
     *
     * @throws ArgumentMarshalException if the function is missing, not an entry function, or
     *                                  the arguments do not match
     */
    public static EntryFunction entryFunction(
            final MoveModule module,
            final String functionName,
            final List<?> typeArgs,
            final List<?> args) {
        return entryFunction(module, functionName, typeArgs, args, MarshalOptions.defaults());
    }

    public static EntryFunction entryFunction(
            final MoveModule module,
            final String functionName,
            final List<?> typeArgs,
            final List<?> args,
            final MarshalOptions options) {
        Objects.requireNonNull(module, "module cannot be null");
        Objects.requireNonNull(functionName, "functionName cannot be null");
        final MoveFunction function = module.function(functionName)
                .orElseThrow(() -> new ArgumentMarshalException(
                        "entry function " + functionName + " not found in module " + module.name()));
        if (!function.isEntry()) {
            throw new ArgumentMarshalException(
                    "function " + functionName + " is not an entry function in module " + module.name());
        }
        return entryFunction(function, module.moduleId(), typeArgs, args, options);
    }

    /**
     * Binds arguments to a function ABI.
     *
     * @param function the function ABI
     * @param module   the module holding it
     * @param typeArgs {@link TypeTag}s or type strings, one per generic parameter
     * @param args     one value per non-signer parameter
     * @param options  marshalling options
     * @return the entry function payload
     * @throws ArgumentMarshalException if a count does not match or an argument does not fit
     */
    public static EntryFunction entryFunction(
            final MoveFunction function,
            final ModuleId module,
            final List<?> typeArgs,
            final List<?> args,
            final MarshalOptions options) {
        Objects.requireNonNull(function, "function cannot be null");
        Objects.requireNonNull(module, "module cannot be null");
        final List<TypeTag> tags = typeArguments(function, typeArgs);
        return new EntryFunction(module, function.name(), tags, arguments(function, tags, args, options));
    }

    public static ViewPayload viewPayload(
            final MoveModule module,
            final String functionName,
            final List<?> typeArgs,
            final List<?> args) {
        Objects.requireNonNull(module, "module cannot be null");
        Objects.requireNonNull(functionName, "functionName cannot be null");
        final MoveFunction function = module.function(functionName)
                .orElseThrow(() -> new ArgumentMarshalException(
                        "function " + functionName + " not found in module " + module.name()));
        return viewPayload(function, module.moduleId(), typeArgs, args, MarshalOptions.defaults());
    }

    /**
     * Binds arguments for a view call. The function need not be an entry function.
     *
     * @return the view request body
     * @throws ArgumentMarshalException if a count does not match or an argument does not fit
     */
    public static ViewPayload viewPayload(
            final MoveFunction function,
            final ModuleId module,
            final List<?> typeArgs,
            final List<?> args,
            final MarshalOptions options) {
        Objects.requireNonNull(function, "function cannot be null");
        Objects.requireNonNull(module, "module cannot be null");
        final List<TypeTag> tags = typeArguments(function, typeArgs);
        return new ViewPayload(module, function.name(), tags, arguments(function, tags, args, options));
    }

    private static List<TypeTag> typeArguments(final MoveFunction function, final List<?> typeArgs) {
        Objects.requireNonNull(typeArgs, "typeArgs cannot be null");
        if (typeArgs.size() != function.genericTypeParams().size()) {
            throw new ArgumentMarshalException("function " + function.name() + " expects "
                    + function.genericTypeParams().size() + " type argument(s) but " + typeArgs.size()
                    + " were supplied");
        }
        final List<TypeTag> tags = new ArrayList<>(typeArgs.size());
        for (int i = 0; i < typeArgs.size(); i++) {
            final Object typeArg = typeArgs.get(i);
            if (typeArg instanceof TypeTag tag) {
                tags.add(tag);
            } else if (typeArg instanceof String text) {
                tags.add(TypeTag.parse(text));
            } else {
                throw new ArgumentMarshalException("type argument " + i + " must be a TypeTag or String, got "
                        + (typeArg == null ? "null" : typeArg.getClass().getSimpleName()));
            }
        }
        return tags;
    }

    private static List<byte[]> arguments(
            final MoveFunction function,
            final List<TypeTag> typeArgs,
            final List<?> args,
            final MarshalOptions options) {
        Objects.requireNonNull(args, "args cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        final List<TypeTag> types = function.argumentTypes();
        if (args.size() != types.size()) {
            throw new ArgumentMarshalException("function " + function.name() + " expects " + types.size()
                    + " argument(s) but " + args.size() + " were supplied");
        }
        final List<byte[]> encoded = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); i++) {
            try {
                encoded.add(ArgumentMarshaller.marshal(types.get(i), args.get(i), typeArgs, options));
            } catch (ArgumentMarshalException e) {
                throw ArgumentMarshalException.atArgument(i, e);
            }
        }
        return encoded;
    }
}
