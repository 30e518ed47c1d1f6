// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.util.List;

import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.core.types.StructTag;
import sh.aptos4j.primitives.bcs.Bcs;

/** Shared fixtures for transaction tests. */
final class Transactions {

    private Transactions() {
    }

    static EntryFunction transfer(final AccountAddress to, final long amount) {
        return new EntryFunction(ModuleId.parse("0x1::coin"), "transfer", List.of(StructTag.aptosCoin()),
                List.of(to.toBcs(), Bcs.serializeU64(amount)));
    }

    static RawTransaction raw(final AccountAddress sender) {
        return new RawTransaction(sender, 7, transfer(AccountAddress.TWO, 100), 1_000, 100, 1_700_000_000L, 4);
    }
}
