// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.primitives.bcs;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Growable BCS output buffer.
 *
 * <p>Fixed-width integers are written little-endian. Lengths, sequence counts and variant
 * discriminants are written as ULEB128. Unsigned 64-bit values travel in a Java {@code long}
 * and are written bit-for-bit, so {@code -1L} encodes {@code 2^64 - 1}; use
 * {@link #u64(BigInteger)} when range checking is wanted.
 *
 * <p>A value that does not fit its declared width throws {@link BcsException} immediately.
 *
 * <p><b>Thread safety:</b> not thread-safe. Use one instance per encoding operation, or call
 * {@link #reset()} between operations on the same thread.
 *
 * @since 0.1.0
 */
public final class Serializer {

    /** Largest value the ULEB128 writer accepts (lengths and discriminants are u32 on chain). */
    public static final long MAX_ULEB128 = 0xFFFF_FFFFL;

    private static final int DEFAULT_CAPACITY = 64;

    private byte[] buffer;
    private int size;

    public Serializer() {
        this(DEFAULT_CAPACITY);
    }

    public Serializer(final int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity cannot be negative: " + initialCapacity);
        }
        this.buffer = new byte[Math.max(initialCapacity, 8)];
    }

    public void u8(final int value) {
        if (value < 0 || value > 0xFF) {
            throw new BcsException("u8 out of range: " + value);
        }
        writeByte(value);
    }

    public void u16(final int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new BcsException("u16 out of range: " + value);
        }
        writeLittleEndian(value, 2);
    }

    public void u32(final long value) {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new BcsException("u32 out of range: " + value);
        }
        writeLittleEndian(value, 4);
    }

    /**
     * Writes the 64 bits of {@code value} as an unsigned integer.
     *
     * @param value raw bits of the u64
     */
    public void u64(final long value) {
        writeLittleEndian(value, 8);
    }

    public void u64(final BigInteger value) {
        writeUnsigned(value, 8, "u64");
    }

    public void u128(final BigInteger value) {
        writeUnsigned(value, 16, "u128");
    }

    public void u256(final BigInteger value) {
        writeUnsigned(value, 32, "u256");
    }

    public void i8(final int value) {
        if (value < Byte.MIN_VALUE || value > Byte.MAX_VALUE) {
            throw new BcsException("i8 out of range: " + value);
        }
        writeByte(value & 0xFF);
    }

    public void i16(final int value) {
        if (value < Short.MIN_VALUE || value > Short.MAX_VALUE) {
            throw new BcsException("i16 out of range: " + value);
        }
        writeLittleEndian(value, 2);
    }

    public void i32(final int value) {
        writeLittleEndian(value, 4);
    }

    public void i64(final long value) {
        writeLittleEndian(value, 8);
    }

    public void i128(final BigInteger value) {
        writeSigned(value, 16, "i128");
    }

    public void i256(final BigInteger value) {
        writeSigned(value, 32, "i256");
    }

    public void bool(final boolean value) {
        writeByte(value ? 1 : 0);
    }

    /**
     * Writes {@code value} as ULEB128: seven bits per byte, low group first, high bit set on
     * every byte except the last.
     *
     * @param value a value in {@code [0, 2^32 - 1]}
     * @throws BcsException if the value is out of range
     */
    public void uleb128(final long value) {
        if (value < 0 || value > MAX_ULEB128) {
            throw new BcsException("uleb128 out of range: " + value);
        }
        long remaining = value;
        while (remaining >= 0x80) {
            writeByte((int) ((remaining & 0x7F) | 0x80));
            remaining >>>= 7;
        }
        writeByte((int) remaining);
    }

    /**
     * Writes a length-prefixed byte string.
     *
     * @param value the bytes
     */
    public void bytes(final byte[] value) {
        Objects.requireNonNull(value, "bytes cannot be null");
        uleb128(value.length);
        fixedBytes(value);
    }

    /**
     * Writes raw bytes with no length prefix; the length is agreed out of band.
     *
     * @param value the bytes
     */
    public void fixedBytes(final byte[] value) {
        Objects.requireNonNull(value, "bytes cannot be null");
        ensureCapacity(value.length);
        System.arraycopy(value, 0, buffer, size, value.length);
        size += value.length;
    }

    /**
     * Writes a string as length-prefixed UTF-8.
     *
     * @param value the string
     */
    public void string(final String value) {
        Objects.requireNonNull(value, "string cannot be null");
        bytes(value.getBytes(StandardCharsets.UTF_8));
    }

    public void struct(final BcsSerializable value) {
        Objects.requireNonNull(value, "struct cannot be null");
        value.serialize(this);
    }

    /**
     * Writes a count-prefixed sequence of serializable values.
     *
     * @param values the elements, in order
     */
    public void sequence(final List<? extends BcsSerializable> values) {
        Objects.requireNonNull(values, "sequence cannot be null");
        uleb128(values.size());
        for (BcsSerializable value : values) {
            struct(value);
        }
    }

    /**
     * Writes a count-prefixed sequence using {@code writer} for each element.
     *
     * @param values the elements, in order
     * @param writer element encoder
     * @param <T>    element type
     */
    public <T> void sequence(final List<T> values, final BcsWriter<T> writer) {
        Objects.requireNonNull(values, "sequence cannot be null");
        Objects.requireNonNull(writer, "writer cannot be null");
        uleb128(values.size());
        for (T value : values) {
            writer.write(this, value);
        }
    }

    /**
     * Writes {@code 0} for a null value, otherwise {@code 1} followed by the value.
     *
     * @param value  the optional value, may be null
     * @param writer encoder for a present value
     * @param <T>    value type
     */
    public <T> void option(final T value, final BcsWriter<T> writer) {
        Objects.requireNonNull(writer, "writer cannot be null");
        if (value == null) {
            bool(false);
        } else {
            bool(true);
            writer.write(this, value);
        }
    }

    /** @return number of bytes written so far */
    public int size() {
        return size;
    }

    /** @return a copy of the bytes written so far */
    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    /** Discards everything written, keeping the allocated buffer. */
    public void reset() {
        size = 0;
    }

    private void writeByte(final int value) {
        ensureCapacity(1);
        buffer[size++] = (byte) value;
    }

    private void writeLittleEndian(final long value, final int width) {
        ensureCapacity(width);
        for (int i = 0; i < width; i++) {
            buffer[size++] = (byte) (value >>> (8 * i));
        }
    }

    private void writeUnsigned(final BigInteger value, final int width, final String type) {
        Objects.requireNonNull(value, type + " cannot be null");
        if (value.signum() < 0 || value.bitLength() > width * 8) {
            throw new BcsException(type + " out of range: " + value);
        }
        writeTwosComplement(value, width);
    }

    private void writeSigned(final BigInteger value, final int width, final String type) {
        Objects.requireNonNull(value, type + " cannot be null");
        // bitLength excludes the sign bit
        if (value.bitLength() > width * 8 - 1) {
            throw new BcsException(type + " out of range: " + value);
        }
        writeTwosComplement(value, width);
    }

    private void writeTwosComplement(final BigInteger value, final int width) {
        final byte[] bigEndian = value.toByteArray();
        final byte fill = value.signum() < 0 ? (byte) 0xFF : 0;
        ensureCapacity(width);
        for (int i = 0; i < width; i++) {
            final int source = bigEndian.length - 1 - i;
            buffer[size++] = source >= 0 ? bigEndian[source] : fill;
        }
    }

    private void ensureCapacity(final int extra) {
        final int required = size + extra;
        if (required < 0) {
            throw new BcsException("serialized value too large");
        }
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }
}
