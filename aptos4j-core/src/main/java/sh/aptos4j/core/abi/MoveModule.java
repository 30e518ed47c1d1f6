// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.abi;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import sh.aptos4j.core.tx.ModuleId;
import sh.aptos4j.core.types.AccountAddress;

/**
 * ABI of a published Move module.
 *
 * @param address          the publishing account
 * @param name             the module name
 * @param friends          friend modules, as {@code address::name}
 * @param exposedFunctions public and entry functions
 * @since 0.1.0
 */
public record MoveModule(AccountAddress address, String name, List<String> friends, List<MoveFunction> exposedFunctions) {

    public MoveModule {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        friends = friends == null ? List.of() : List.copyOf(friends);
        exposedFunctions = exposedFunctions == null ? List.of() : List.copyOf(exposedFunctions);
    }

    public ModuleId moduleId() {
        return new ModuleId(address, name);
    }

    /**
     * @param functionName the function to look up
     * @return the function's ABI, if the module exposes it
     */
    public Optional<MoveFunction> function(final String functionName) {
        for (MoveFunction function : exposedFunctions) {
            if (function.name().equals(functionName)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }
}
