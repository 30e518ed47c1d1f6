// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.abi;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.aptos4j.core.error.ArgumentMarshalException;
import sh.aptos4j.core.tx.EntryFunction;
import sh.aptos4j.core.tx.ViewPayload;
import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.core.types.StructTag;
import sh.aptos4j.primitives.bcs.Bcs;

class EntryFunctionFactoryTest {

    private static final MoveFunction TRANSFER_COINS =
            MoveFunction.entry("transfer_coins", 1, List.of("&signer", "address", "u64"));
    private static final MoveFunction BALANCE = new MoveFunction("balance", "public", false, true,
            List.of(List.of()), List.of("address"), List.of("u64"));
    private static final MoveFunction INTERNAL = new MoveFunction("internal", "public", false, false,
            List.of(), List.of("u8"), List.of());
    private static final MoveModule ACCOUNT = new MoveModule(AccountAddress.ONE, "aptos_account", List.of(),
            List.of(TRANSFER_COINS, BALANCE, INTERNAL));

    @Test
    void signerParametersAreSkipped() {
        assertEquals(2, TRANSFER_COINS.argumentTypes().size());
    }

    @Test
    void buildsEntryFunctionFromModuleAbi() {
        EntryFunction fn = EntryFunctionFactory.entryFunction(ACCOUNT, "transfer_coins",
                List.of("0x1::aptos_coin::AptosCoin"), List.of("0x2", 500L));

        assertEquals("0x1::aptos_account", fn.module().toString());
        assertEquals("transfer_coins", fn.function());
        assertEquals(List.of(StructTag.aptosCoin()), fn.typeArgs());
        assertArrayEquals(AccountAddress.TWO.toBcs(), fn.args().get(0));
        assertArrayEquals(Bcs.serializeU64(500), fn.args().get(1));
    }

    @Test
    void missingOrNonEntryFunctionsRejected() {
        ArgumentMarshalException missing = assertThrows(ArgumentMarshalException.class,
                () -> EntryFunctionFactory.entryFunction(ACCOUNT, "nope", List.of(), List.of()));
        assertEquals("entry function nope not found in module aptos_account", missing.getMessage());

        ArgumentMarshalException notEntry = assertThrows(ArgumentMarshalException.class,
                () -> EntryFunctionFactory.entryFunction(ACCOUNT, "internal", List.of(), List.of(1)));
        assertEquals("function internal is not an entry function in module aptos_account", notEntry.getMessage());
    }

    @Test
    void countMismatchesRejected() {
        ArgumentMarshalException types = assertThrows(ArgumentMarshalException.class,
                () -> EntryFunctionFactory.entryFunction(ACCOUNT, "transfer_coins", List.of(), List.of("0x2", 1)));
        assertTrue(types.getMessage().contains("expects 1 type argument(s) but 0 were supplied"), types.getMessage());

        ArgumentMarshalException args = assertThrows(ArgumentMarshalException.class,
                () -> EntryFunctionFactory.entryFunction(ACCOUNT, "transfer_coins",
                        List.of(StructTag.aptosCoin()), List.of("0x2")));
        assertTrue(args.getMessage().contains("expects 2 argument(s) but 1 were supplied"), args.getMessage());
    }

    @Test
    void argumentErrorsCarryTheIndex() {
        ArgumentMarshalException e = assertThrows(ArgumentMarshalException.class,
                () -> EntryFunctionFactory.entryFunction(ACCOUNT, "transfer_coins",
                        List.of(StructTag.aptosCoin()), List.of("0x2", -1)));
        assertEquals("argument 1: value -1 out of range for u64", e.getMessage());
    }

    @Test
    void viewPayloadDoesNotRequireEntry() {
        ViewPayload view = EntryFunctionFactory.viewPayload(ACCOUNT, "balance",
                List.of(StructTag.aptosCoin()), List.of(AccountAddress.THREE));

        assertEquals("balance", view.function());
        assertArrayEquals(AccountAddress.THREE.toBcs(), view.args().get(0));
        assertEquals(view, Bcs.deserialize(view.toBcs(), ViewPayload::deserialize));
    }
}
