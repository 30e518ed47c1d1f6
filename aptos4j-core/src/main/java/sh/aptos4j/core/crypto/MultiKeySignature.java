// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import sh.aptos4j.core.error.BitmapException;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Signature for a {@link MultiKey}.
 * <p>
 * BCS: sequence of {@link AnySignature} in ascending key order, then the bitmap as
 * length-prefixed bytes (at most 4).
 *
 * @param signatures one signature per set bitmap bit
 * @param bitmap     which keys signed
 * @since 0.1.0
 */
public record MultiKeySignature(List<AnySignature> signatures, MultiKeyBitmap bitmap) implements Signature {

    public MultiKeySignature {
        Objects.requireNonNull(signatures, "signatures cannot be null");
        Objects.requireNonNull(bitmap, "bitmap cannot be null");
        signatures = List.copyOf(signatures);
        if (bitmap.count() != signatures.size()) {
            throw new BitmapException("bitmap has " + bitmap.count() + " bits set but there are "
                    + signatures.size() + " signatures");
        }
    }

    /**
     * Builds a signature from signatures keyed by key index, sorting them by index.
     *
     * @param byIndex signature for each signing key position
     * @return the combined signature
     * @throws BitmapException on an index of 32 or more
     */
    public static MultiKeySignature of(final Map<Integer, AnySignature> byIndex) {
        final TreeMap<Integer, AnySignature> sorted = new TreeMap<>(byIndex);
        return new MultiKeySignature(new ArrayList<>(sorted.values()), MultiKeyBitmap.of(sorted.keySet()));
    }

    @Override
    public byte[] toBytes() {
        return toBcs();
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.sequence(signatures);
        serializer.bytes(bitmap.toBytes());
    }

    public static MultiKeySignature deserialize(final Deserializer deserializer) {
        final List<AnySignature> signatures = deserializer.sequence(AnySignature::deserialize);
        final byte[] bits = deserializer.bytes();
        if (deserializer.hasError()) {
            return null;
        }
        try {
            return new MultiKeySignature(signatures, MultiKeyBitmap.fromBytes(bits));
        } catch (BitmapException e) {
            deserializer.setError(e.getMessage());
            return null;
        }
    }
}
