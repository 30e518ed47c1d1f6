// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.primitives.bcs;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cursor over BCS input with a sticky error.
 *
 * <p>Reads never throw on malformed input. The first problem is recorded with
 * {@link #setError(String)}; later problems are ignored so the original cause is preserved, and
 * every read after an error returns a zero value ({@code 0}, {@code false}, an empty array or
 * {@code null}) without moving the cursor. Check {@link #error()} at a natural boundary, or
 * use {@link Bcs#deserialize(byte[], BcsReader)} which also rejects trailing bytes.
 *
 * <p>The source array is not copied and must not change while it is being read.
 *
 * <p><b>Thread safety:</b> not thread-safe; use one instance per decode.
 *
 * @since 0.1.0
 */
public final class Deserializer {

    private final byte[] source;
    private int position;
    private BcsException error;

    public Deserializer(final byte[] source) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
    }

    /** @return the first recorded error, or {@code null} if decoding is healthy */
    public BcsException error() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }

    /**
     * Records an error unless one is already present.
     *
     * @param message description of the problem
     */
    public void setError(final String message) {
        setError(new BcsException(message));
    }

    /**
     * Records an error unless one is already present.
     *
     * @param cause the problem
     */
    public void setError(final BcsException cause) {
        if (error == null) {
            error = Objects.requireNonNull(cause, "cause cannot be null");
        }
    }

    /** @return bytes left after the cursor */
    public int remaining() {
        return source.length - position;
    }

    /** @return current cursor offset */
    public int position() {
        return position;
    }

    public int u8() {
        if (!require(1, "u8")) {
            return 0;
        }
        return source[position++] & 0xFF;
    }

    public int u16() {
        return (int) readLittleEndian(2, "u16");
    }

    public long u32() {
        return readLittleEndian(4, "u32");
    }

    /** @return raw bits of the u64; interpret with {@link Long#toUnsignedString(long)} */
    public long u64() {
        return readLittleEndian(8, "u64");
    }

    public BigInteger u128() {
        return readUnsigned(16, "u128");
    }

    public BigInteger u256() {
        return readUnsigned(32, "u256");
    }

    public int i8() {
        if (!require(1, "i8")) {
            return 0;
        }
        return source[position++];
    }

    public int i16() {
        return (short) readLittleEndian(2, "i16");
    }

    public int i32() {
        return (int) readLittleEndian(4, "i32");
    }

    public long i64() {
        return readLittleEndian(8, "i64");
    }

    public BigInteger i128() {
        return readSigned(16, "i128");
    }

    public BigInteger i256() {
        return readSigned(32, "i256");
    }

    /** @return the boolean; any byte other than 0 or 1 is an error */
    public boolean bool() {
        if (!require(1, "bool")) {
            return false;
        }
        final int value = source[position] & 0xFF;
        if (value > 1) {
            setError("invalid bool byte 0x" + Integer.toHexString(value) + " at offset " + position);
            return false;
        }
        position++;
        return value == 1;
    }

    /**
     * Reads a ULEB128 value. Values needing a shift of 64 bits or more, and non-minimal
     * encodings with a trailing zero group, are rejected.
     *
     * @return the decoded value, or 0 after an error
     */
    public long uleb128() {
        if (error != null) {
            return 0;
        }
        long value = 0;
        int shift = 0;
        while (true) {
            if (position >= source.length) {
                setError("not enough bytes remaining to deserialize uleb128");
                return 0;
            }
            final int b = source[position++] & 0xFF;
            final long group = b & 0x7F;
            if (shift >= 64 || (shift == 63 && group > 1)) {
                setError("uleb128 overflows 64 bits");
                return 0;
            }
            value |= group << shift;
            if ((b & 0x80) == 0) {
                if (b == 0 && shift > 0) {
                    setError("non-canonical uleb128 encoding");
                    return 0;
                }
                return value;
            }
            shift += 7;
        }
    }

    /**
     * Reads a ULEB128 length and checks it against the remaining input.
     *
     * @param what name used in error messages
     * @return the length, or 0 after an error
     */
    public int length(final String what) {
        final long length = uleb128();
        if (error != null) {
            return 0;
        }
        if (length < 0 || length > Serializer.MAX_ULEB128) {
            setError(what + " length " + Long.toUnsignedString(length) + " exceeds " + Serializer.MAX_ULEB128);
            return 0;
        }
        if (length > remaining()) {
            setError("not enough bytes remaining to deserialize " + what + ": need " + length
                    + ", have " + remaining());
            return 0;
        }
        return (int) length;
    }

    /** @return a length-prefixed byte string */
    public byte[] bytes() {
        final int length = length("bytes");
        if (error != null) {
            return new byte[0];
        }
        return take(length);
    }

    /** @return a length-prefixed UTF-8 string */
    public String string() {
        return new String(bytes(), StandardCharsets.UTF_8);
    }

    /**
     * Reads {@code length} raw bytes with no prefix.
     *
     * @param length number of bytes
     * @return the bytes, or an empty array after an error
     */
    public byte[] fixedBytes(final int length) {
        if (length < 0) {
            setError("fixed byte length cannot be negative: " + length);
            return new byte[0];
        }
        if (!require(length, "fixed bytes")) {
            return new byte[0];
        }
        return take(length);
    }

    /**
     * Runs {@code reader} unless an error is already present.
     *
     * @param reader the value reader
     * @param <T>    value type
     * @return the value, or {@code null} after an error
     */
    public <T> T struct(final BcsReader<T> reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        if (error != null) {
            return null;
        }
        return reader.read(this);
    }

    /**
     * Reads a count-prefixed sequence. Stops at the first element error.
     *
     * @param reader element reader
     * @param <T>    element type
     * @return an unmodifiable list, empty after an error
     */
    public <T> List<T> sequence(final BcsReader<T> reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        final long count = uleb128();
        if (error != null) {
            return List.of();
        }
        if (count < 0 || count > Serializer.MAX_ULEB128) {
            setError("sequence length " + Long.toUnsignedString(count) + " exceeds " + Serializer.MAX_ULEB128);
            return List.of();
        }
        // every element takes at least one byte
        if (count > remaining()) {
            setError("sequence length " + count + " exceeds remaining " + remaining() + " byte(s)");
            return List.of();
        }
        final List<T> out = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) {
            final T value = reader.read(this);
            if (error != null) {
                return List.of();
            }
            out.add(value);
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Reads an option: a 0/1 presence byte, then the value when present.
     *
     * @param reader value reader
     * @param <T>    value type
     * @return the value if present
     */
    public <T> Optional<T> option(final BcsReader<T> reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        final boolean present = bool();
        if (error != null || !present) {
            return Optional.empty();
        }
        final T value = reader.read(this);
        return error != null ? Optional.empty() : Optional.ofNullable(value);
    }

    private boolean require(final int count, final String what) {
        if (error != null) {
            return false;
        }
        if (remaining() < count) {
            setError("not enough bytes remaining to deserialize " + what);
            return false;
        }
        return true;
    }

    private byte[] take(final int count) {
        final byte[] out = Arrays.copyOfRange(source, position, position + count);
        position += count;
        return out;
    }

    private long readLittleEndian(final int width, final String what) {
        if (!require(width, what)) {
            return 0;
        }
        long value = 0;
        for (int i = 0; i < width; i++) {
            value |= (long) (source[position + i] & 0xFF) << (8 * i);
        }
        position += width;
        return value;
    }

    private BigInteger readUnsigned(final int width, final String what) {
        if (!require(width, what)) {
            return BigInteger.ZERO;
        }
        return new BigInteger(1, reversed(width));
    }

    private BigInteger readSigned(final int width, final String what) {
        if (!require(width, what)) {
            return BigInteger.ZERO;
        }
        return new BigInteger(reversed(width));
    }

    private byte[] reversed(final int width) {
        final byte[] bigEndian = new byte[width];
        for (int i = 0; i < width; i++) {
            bigEndian[width - 1 - i] = source[position + i];
        }
        position += width;
        return bigEndian;
    }
}
