// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.primitives.bcs;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * One-shot BCS helpers.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * byte[] encoded = Bcs.serializeU64(1L);            // 01 00 00 00 00 00 00 00
 * TypeTag tag = Bcs.deserialize(bytes, TypeTag::deserialize);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Bcs {

    private Bcs() {
        // Utility class
    }

    /**
     * Serializes a single value with a fresh {@link Serializer}.
     *
     * @param value the value
     * @return its BCS bytes
     */
    public static byte[] serialize(final BcsSerializable value) {
        Objects.requireNonNull(value, "value cannot be null");
        final Serializer serializer = new Serializer();
        value.serialize(serializer);
        return serializer.toByteArray();
    }

    /**
     * Decodes exactly one value from {@code bytes}.
     *
     * @param bytes  the encoded input
     * @param reader the value reader
     * @param <T>    value type
     * @return the decoded value
     * @throws BcsException if decoding recorded an error or left bytes unread
     */
    public static <T> T deserialize(final byte[] bytes, final BcsReader<T> reader) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        Objects.requireNonNull(reader, "reader cannot be null");
        final Deserializer deserializer = new Deserializer(bytes);
        final T value = reader.read(deserializer);
        if (deserializer.hasError()) {
            throw deserializer.error();
        }
        if (deserializer.remaining() > 0) {
            throw new BcsException("deserialize failed: remaining " + deserializer.remaining() + " byte(s)");
        }
        return value;
    }

    public static byte[] serializeU8(final int value) {
        return write(s -> s.u8(value));
    }

    public static byte[] serializeU16(final int value) {
        return write(s -> s.u16(value));
    }

    public static byte[] serializeU32(final long value) {
        return write(s -> s.u32(value));
    }

    public static byte[] serializeU64(final long value) {
        return write(s -> s.u64(value));
    }

    public static byte[] serializeU128(final BigInteger value) {
        return write(s -> s.u128(value));
    }

    public static byte[] serializeU256(final BigInteger value) {
        return write(s -> s.u256(value));
    }

    public static byte[] serializeBool(final boolean value) {
        return write(s -> s.bool(value));
    }

    public static byte[] serializeUleb128(final long value) {
        return write(s -> s.uleb128(value));
    }

    public static byte[] serializeBytes(final byte[] value) {
        return write(s -> s.bytes(value));
    }

    public static byte[] serializeString(final String value) {
        return write(s -> s.string(value));
    }

    /**
     * Serializes a count-prefixed sequence of values.
     *
     * @param values the elements
     * @param writer element encoder
     * @param <T>    element type
     * @return the BCS bytes
     */
    public static <T> byte[] serializeSequence(final List<T> values, final BcsWriter<T> writer) {
        return write(s -> s.sequence(values, writer));
    }

    private static byte[] write(final java.util.function.Consumer<Serializer> body) {
        final Serializer serializer = new Serializer(16);
        body.accept(serializer);
        return serializer.toByteArray();
    }
}
