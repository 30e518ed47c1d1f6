// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.util.Objects;

import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.primitives.bcs.BcsSerializable;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Fully qualified Move module: publishing address plus module name.
 *
 * @param address the publisher
 * @param name    the module name
 * @since 0.1.0
 */
public record ModuleId(AccountAddress address, String name) implements BcsSerializable {

    public ModuleId {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("module name cannot be empty");
        }
    }

    /**
     * Parses {@code address::module}.
     *
     * @param text e.g. {@code 0x1::aptos_account}
     * @return the module id
     */
    public static ModuleId parse(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        final int sep = text.indexOf("::");
        if (sep < 0 || text.indexOf("::", sep + 2) >= 0) {
            throw new IllegalArgumentException("module id must be address::name: " + text);
        }
        return new ModuleId(AccountAddress.fromString(text.substring(0, sep)), text.substring(sep + 2));
    }

    @Override
    public void serialize(final Serializer serializer) {
        address.serialize(serializer);
        serializer.string(name);
    }

    public static ModuleId deserialize(final Deserializer deserializer) {
        final AccountAddress address = AccountAddress.deserialize(deserializer);
        final String name = deserializer.string();
        if (deserializer.hasError()) {
            return null;
        }
        if (name.isEmpty()) {
            deserializer.setError("module name cannot be empty");
            return null;
        }
        return new ModuleId(address, name);
    }

    @Override
    public String toString() {
        return address.toShortString() + "::" + name;
    }
}
