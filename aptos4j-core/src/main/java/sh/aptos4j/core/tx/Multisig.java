// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Execution of a transaction on behalf of an on-chain multisig account.
 * <p>
 * BCS: the multisig address, then an optional inner payload. The inner payload has a single
 * variant, an entry function (discriminant 0). Without an inner payload the chain executes the
 * payload already stored with the approved proposal.
 *
 * @param multisigAddress the multisig account
 * @param entryFunction   the call to run, or {@code null} to use the stored payload
 * @since 0.1.0
 */
public record Multisig(AccountAddress multisigAddress, @Nullable EntryFunction entryFunction)
        implements TransactionPayload {

    /** Discriminant of the only inner payload type. */
    public static final int INNER_ENTRY_FUNCTION = 0;

    public Multisig {
        Objects.requireNonNull(multisigAddress, "multisigAddress cannot be null");
    }

    @Override
    public int variant() {
        return MULTISIG;
    }

    @Override
    public void serialize(final Serializer serializer) {
        multisigAddress.serialize(serializer);
        serializer.option(entryFunction, (s, fn) -> {
            s.uleb128(INNER_ENTRY_FUNCTION);
            fn.serialize(s);
        });
    }

    public static Multisig deserialize(final Deserializer deserializer) {
        final AccountAddress address = AccountAddress.deserialize(deserializer);
        final Optional<EntryFunction> inner = deserializer.option(d -> {
            final long variant = d.uleb128();
            if (!d.hasError() && variant != INNER_ENTRY_FUNCTION) {
                d.setError("unknown multisig payload variant " + variant);
            }
            return d.hasError() ? null : EntryFunction.deserialize(d);
        });
        return deserializer.hasError() ? null : new Multisig(address, inner.orElse(null));
    }
}
