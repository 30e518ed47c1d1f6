// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import sh.aptos4j.core.error.BitmapException;
import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Legacy MultiEd25519 signature: the signatures in ascending key order followed by a fixed
 * 4-byte bitmap, BCS-encoded as one length-prefixed blob.
 *
 * @param signatures one signature per set bitmap bit
 * @param bitmap     which keys signed
 * @since 0.1.0
 */
public record MultiEd25519Signature(List<Ed25519Signature> signatures, MultiKeyBitmap bitmap) implements Signature {

    public MultiEd25519Signature {
        Objects.requireNonNull(signatures, "signatures cannot be null");
        Objects.requireNonNull(bitmap, "bitmap cannot be null");
        signatures = List.copyOf(signatures);
        // the wire form is always 4 bytes; store it that way so decoded values compare equal
        bitmap = MultiKeyBitmap.fromBytes(bitmap.toFixedBytes());
        if (bitmap.count() != signatures.size()) {
            throw new BitmapException("bitmap has " + bitmap.count() + " bits set but there are "
                    + signatures.size() + " signatures");
        }
    }

    /**
     * Builds a signature from signatures keyed by key index; order of the map does not matter.
     *
     * @param byIndex signature for each signing key position
     * @return the combined signature
     * @throws BitmapException on an index of 32 or more
     */
    public static MultiEd25519Signature of(final Map<Integer, Ed25519Signature> byIndex) {
        final TreeMap<Integer, Ed25519Signature> sorted = new TreeMap<>(byIndex);
        return new MultiEd25519Signature(new ArrayList<>(sorted.values()), MultiKeyBitmap.of(sorted.keySet()));
    }

    @Override
    public byte[] toBytes() {
        final byte[] out = new byte[signatures.size() * Ed25519Signature.LENGTH + MultiKeyBitmap.MAX_BYTES];
        for (int i = 0; i < signatures.size(); i++) {
            System.arraycopy(signatures.get(i).bytes(), 0, out, i * Ed25519Signature.LENGTH, Ed25519Signature.LENGTH);
        }
        System.arraycopy(bitmap.toFixedBytes(), 0, out, out.length - MultiKeyBitmap.MAX_BYTES, MultiKeyBitmap.MAX_BYTES);
        return out;
    }

    /**
     * Parses the signatures-plus-bitmap blob.
     *
     * @param bytes the raw blob
     * @return the signature
     * @throws CryptoException if the length is wrong
     * @throws BitmapException if the bitmap does not match the signature count
     */
    public static MultiEd25519Signature fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        final int sigBytes = bytes.length - MultiKeyBitmap.MAX_BYTES;
        if (sigBytes < 0 || sigBytes % Ed25519Signature.LENGTH != 0) {
            throw new CryptoException("invalid MultiEd25519 signature length " + bytes.length);
        }
        final List<Ed25519Signature> sigs = new ArrayList<>();
        for (int offset = 0; offset < sigBytes; offset += Ed25519Signature.LENGTH) {
            sigs.add(new Ed25519Signature(Arrays.copyOfRange(bytes, offset, offset + Ed25519Signature.LENGTH)));
        }
        return new MultiEd25519Signature(sigs, MultiKeyBitmap.fromBytes(Arrays.copyOfRange(bytes, sigBytes, bytes.length)));
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.bytes(toBytes());
    }

    public static MultiEd25519Signature deserialize(final Deserializer deserializer) {
        final byte[] raw = deserializer.bytes();
        if (deserializer.hasError()) {
            return null;
        }
        try {
            return fromBytes(raw);
        } catch (CryptoException | BitmapException e) {
            deserializer.setError(e.getMessage());
            return null;
        }
    }
}
