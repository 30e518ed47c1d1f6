// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

import sh.aptos4j.core.error.BitmapException;
import sh.aptos4j.primitives.Hex;

/**
 * Signer bitmap of a multi-signature: bit {@code i} set means key {@code i} signed.
 * <p>
 * Bits are counted from the most significant bit of the first byte, so index {@code i} lives
 * at {@code byte[i / 8] & (0x80 >> (i % 8))}. At most 32 keys, so at most 4 bytes. A bitmap
 * built from indices is as short as it can be; a decoded bitmap keeps its original length.
 *
 * @since 0.1.0
 */
public final class MultiKeyBitmap {

    /** Largest number of keys a bitmap can address. */
    public static final int MAX_KEYS = 32;

    /** Largest encoded bitmap in bytes. */
    public static final int MAX_BYTES = MAX_KEYS / 8;

    private final byte[] bits;

    private MultiKeyBitmap(final byte[] bits) {
        this.bits = bits;
    }

    /**
     * Builds a bitmap with the given indices set.
     *
     * @param indices key positions
     * @return the bitmap
     * @throws BitmapException on a duplicate index or an index of 32 or more
     */
    public static MultiKeyBitmap of(final Collection<Integer> indices) {
        Objects.requireNonNull(indices, "indices cannot be null");
        byte[] bits = new byte[0];
        for (Integer index : indices) {
            Objects.requireNonNull(index, "index cannot be null");
            if (index < 0 || index >= MAX_KEYS) {
                throw new BitmapException("bitmap index " + index + " out of range [0, " + MAX_KEYS + ")");
            }
            final int byteIndex = index / 8;
            if (byteIndex >= bits.length) {
                bits = Arrays.copyOf(bits, byteIndex + 1);
            }
            final int mask = 0x80 >>> (index % 8);
            if ((bits[byteIndex] & mask) != 0) {
                throw new BitmapException("index " + index + " already in bitmap");
            }
            bits[byteIndex] |= (byte) mask;
        }
        return new MultiKeyBitmap(bits);
    }

    public static MultiKeyBitmap of(final int... indices) {
        final java.util.List<Integer> boxed = new java.util.ArrayList<>(indices.length);
        for (int index : indices) {
            boxed.add(index);
        }
        return of(boxed);
    }

    /**
     * Wraps encoded bitmap bytes.
     *
     * @param bytes up to 4 bytes
     * @return the bitmap
     * @throws BitmapException if there are more than 4 bytes
     */
    public static MultiKeyBitmap fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length > MAX_BYTES) {
            throw new BitmapException("bitmap must be at most " + MAX_BYTES + " bytes, got " + bytes.length);
        }
        return new MultiKeyBitmap(Arrays.copyOf(bytes, bytes.length));
    }

    public boolean contains(final int index) {
        if (index < 0 || index >= bits.length * 8) {
            return false;
        }
        return (bits[index / 8] & (0x80 >>> (index % 8))) != 0;
    }

    /** @return the set indices in ascending order */
    public int[] indices() {
        final int[] out = new int[count()];
        int n = 0;
        for (int i = 0; i < bits.length * 8; i++) {
            if (contains(i)) {
                out[n++] = i;
            }
        }
        return out;
    }

    /** @return the number of set bits */
    public int count() {
        int total = 0;
        for (byte b : bits) {
            total += Integer.bitCount(b & 0xFF);
        }
        return total;
    }

    /** @return a copy of the bitmap bytes at their current length */
    public byte[] toBytes() {
        return Arrays.copyOf(bits, bits.length);
    }

    /** @return the bitmap zero-padded to {@link #MAX_BYTES} bytes */
    public byte[] toFixedBytes() {
        return Arrays.copyOf(bits, MAX_BYTES);
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof MultiKeyBitmap other && Arrays.equals(bits, other.bits));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bits);
    }

    @Override
    public String toString() {
        return "MultiKeyBitmap[" + Hex.encode(bits) + "]";
    }
}
