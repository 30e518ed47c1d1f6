// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.abi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.aptos4j.core.types.PrimitiveTypeTag;
import sh.aptos4j.core.types.ReferenceTag;
import sh.aptos4j.core.types.TypeTag;

/**
 * ABI of one exposed Move function, as published in a module's {@code exposed_functions}.
 *
 * @param name              the function name
 * @param visibility        {@code public}, {@code friend} or {@code private}
 * @param isEntry           whether it can be called from a transaction
 * @param isView            whether it is annotated {@code #[view]}
 * @param genericTypeParams one entry per type parameter, holding its ability constraints
 * @param params            parameter types in Move syntax, e.g. {@code &signer}, {@code u64}
 * @param returns           return types in Move syntax
 * @since 0.1.0
 */
public record MoveFunction(
        String name,
        String visibility,
        boolean isEntry,
        boolean isView,
        List<List<String>> genericTypeParams,
        List<String> params,
        List<String> returns) {

    public MoveFunction {
        Objects.requireNonNull(name, "name cannot be null");
        visibility = visibility == null ? "public" : visibility;
        genericTypeParams = genericTypeParams == null ? List.of() : genericTypeParams.stream().map(List::copyOf).toList();
        params = params == null ? List.of() : List.copyOf(params);
        returns = returns == null ? List.of() : List.copyOf(returns);
    }

    /**
     * Shorthand for an entry function with unconstrained type parameters.
     *
     * @param name          the function name
     * @param typeParamCount number of type parameters
     * @param params        parameter types in Move syntax
     * @return the ABI
     */
    public static MoveFunction entry(final String name, final int typeParamCount, final List<String> params) {
        final List<List<String>> generics = new ArrayList<>(typeParamCount);
        for (int i = 0; i < typeParamCount; i++) {
            generics.add(List.of());
        }
        return new MoveFunction(name, "public", true, false, generics, params, List.of());
    }

    /**
     * Parses the parameter types and drops the leading {@code signer} and {@code &signer}
     * parameters, which the VM fills from the transaction's signers.
     *
     * @return the types of the arguments a caller supplies
     * @throws sh.aptos4j.core.error.TypeTagParseException if a parameter type is malformed
     */
    public List<TypeTag> argumentTypes() {
        final List<TypeTag> types = new ArrayList<>(params.size());
        boolean leading = true;
        for (String param : params) {
            final TypeTag tag = TypeTag.parse(param);
            if (leading && isSigner(tag)) {
                continue;
            }
            leading = false;
            types.add(tag);
        }
        return types;
    }

    private static boolean isSigner(final TypeTag tag) {
        if (tag == PrimitiveTypeTag.SIGNER) {
            return true;
        }
        return tag instanceof ReferenceTag ref && ref.target() == PrimitiveTypeTag.SIGNER;
    }
}
