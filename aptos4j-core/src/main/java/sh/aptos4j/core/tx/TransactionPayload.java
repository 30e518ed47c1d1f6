// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import sh.aptos4j.primitives.bcs.BcsSerializable;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * What a transaction executes.
 * <p>
 * Discriminants: {@link #SCRIPT}, {@link #MODULE_BUNDLE} (retired, rejected on decode and not
 * constructible), {@link #ENTRY_FUNCTION}, {@link #MULTISIG}. {@link #serialize} on an
 * implementation writes only its body; {@link #write} prefixes the discriminant.
 *
 * @since 0.1.0
 */
public sealed interface TransactionPayload extends BcsSerializable permits Script, EntryFunction, Multisig {

    int SCRIPT = 0;
    int MODULE_BUNDLE = 1;
    int ENTRY_FUNCTION = 2;
    int MULTISIG = 3;

    /** @return the payload discriminant */
    int variant();

    /**
     * Writes the discriminant and the payload body.
     *
     * @param serializer the output
     * @param payload    the payload
     */
    static void write(final Serializer serializer, final TransactionPayload payload) {
        serializer.uleb128(payload.variant());
        payload.serialize(serializer);
    }

    /**
     * Reads a discriminant and the matching payload.
     *
     * @param deserializer the input
     * @return the payload, or {@code null} after an error
     */
    static TransactionPayload read(final Deserializer deserializer) {
        final long variant = deserializer.uleb128();
        if (deserializer.hasError()) {
            return null;
        }
        if (variant == SCRIPT) {
            return Script.deserialize(deserializer);
        }
        if (variant == ENTRY_FUNCTION) {
            return EntryFunction.deserialize(deserializer);
        }
        if (variant == MULTISIG) {
            return Multisig.deserialize(deserializer);
        }
        if (variant == MODULE_BUNDLE) {
            deserializer.setError("module bundle payloads are not supported");
            return null;
        }
        deserializer.setError("unknown transaction payload variant " + variant);
        return null;
    }
}
