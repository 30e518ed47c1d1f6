// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.abi;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.aptos4j.core.error.ArgumentMarshalException;
import sh.aptos4j.core.types.AccountAddress;
import sh.aptos4j.core.types.GenericTag;
import sh.aptos4j.core.types.PrimitiveTypeTag;
import sh.aptos4j.core.types.ReferenceTag;
import sh.aptos4j.core.types.StructTag;
import sh.aptos4j.core.types.TypeTag;
import sh.aptos4j.core.types.VectorTag;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.BcsException;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Converts plain Java values into the BCS bytes of a Move argument.
 * <p>
 * Dispatch is on the declared {@link TypeTag}:
 * <ul>
 * <li>integers accept {@link Number} (fractional floats and decimals rejected) or decimal
 * strings, range-checked against the width</li>
 * <li>{@code bool} accepts {@link Boolean} or {@code "true"}/{@code "false"}</li>
 * <li>{@code address}, {@code signer} and {@code 0x1::object::Object<T>} accept an
 * {@link AccountAddress} or its hex text</li>
 * <li>{@code vector<u8>} accepts {@code byte[]}; a {@link String} is taken as its UTF-8 bytes,
 * not decoded as hex</li>
 * <li>other vectors accept a {@link List}, an object array or a primitive array</li>
 * <li>{@code 0x1::string::String} accepts a {@link String}</li>
 * <li>{@code 0x1::option::Option<T>} encodes {@code null} as none, anything else as some</li>
 * <li>{@code &T} and {@code T0..Tn} resolve to the referenced or bound type</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * byte[] amount = ArgumentMarshaller.marshal(PrimitiveTypeTag.U64, 1_000L);
 * byte[] names = ArgumentMarshaller.marshal(TypeTag.parse("vector<0x1::string::String>"), List.of("a", "b"));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ArgumentMarshaller {

    private ArgumentMarshaller() {
        // Utility class
    }

    public static byte[] marshal(final TypeTag type, final @Nullable Object value) {
        return marshal(type, value, List.of(), MarshalOptions.defaults());
    }

    /**
     * @param type     the declared Move type
     * @param value    the user value
     * @param generics type arguments bound to {@code T0..Tn}
     * @param options  marshalling options
     * @return the BCS bytes of the value
     * @throws ArgumentMarshalException if the value does not fit the type
     */
    public static byte[] marshal(
            final TypeTag type,
            final @Nullable Object value,
            final List<TypeTag> generics,
            final MarshalOptions options) {
        final Serializer out = new Serializer(32);
        write(out, type, value, generics, options);
        return out.toByteArray();
    }

    /**
     * Writes {@code value} as {@code type} into an existing serializer.
     *
     * @throws ArgumentMarshalException if the value does not fit the type
     */
    public static void write(
            final Serializer out,
            final TypeTag type,
            final @Nullable Object value,
            final List<TypeTag> generics,
            final MarshalOptions options) {
        Objects.requireNonNull(out, "out cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(generics, "generics cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        if (type instanceof PrimitiveTypeTag primitive) {
            writePrimitive(out, primitive, value);
        } else if (type instanceof VectorTag vector) {
            writeVector(out, vector, value, generics, options);
        } else if (type instanceof StructTag struct) {
            writeStruct(out, struct, value, generics, options);
        } else if (type instanceof ReferenceTag reference) {
            write(out, reference.target(), value, generics, options);
        } else if (type instanceof GenericTag generic) {
            write(out, resolve(generic, generics), value, generics, options);
        } else {
            throw new ArgumentMarshalException("unsupported type " + type);
        }
    }

    private static TypeTag resolve(final GenericTag generic, final List<TypeTag> generics) {
        if (generic.index() >= generics.size()) {
            throw new ArgumentMarshalException("type parameter " + generic + " is out of bounds, "
                    + generics.size() + " type argument(s) given");
        }
        return generics.get(generic.index());
    }

    private static void writePrimitive(final Serializer out, final PrimitiveTypeTag type, final @Nullable Object value) {
        if (value == null) {
            throw new ArgumentMarshalException("expected " + type + ", got null");
        }
        if (type.isInteger()) {
            writeInteger(out, type, toBigInteger(type, value));
            return;
        }
        switch (type) {
            case BOOL:
                out.bool(toBoolean(value));
                break;
            case ADDRESS:
            case SIGNER:
                toAddress(type, value).serialize(out);
                break;
            default:
                throw new ArgumentMarshalException("unsupported type " + type);
        }
    }

    private static void writeInteger(final Serializer out, final PrimitiveTypeTag type, final BigInteger value) {
        final int bits = type.bitWidth();
        final BigInteger min;
        final BigInteger max;
        if (type.isSigned()) {
            min = BigInteger.ONE.shiftLeft(bits - 1).negate();
            max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
        } else {
            min = BigInteger.ZERO;
            max = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
        }
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            throw new ArgumentMarshalException("value " + value + " out of range for " + type);
        }
        switch (type) {
            case U8:
                out.u8(value.intValue());
                break;
            case U16:
                out.u16(value.intValue());
                break;
            case U32:
                out.u32(value.longValue());
                break;
            case U64:
                out.u64(value);
                break;
            case U128:
                out.u128(value);
                break;
            case U256:
                out.u256(value);
                break;
            case I8:
                out.i8(value.intValue());
                break;
            case I16:
                out.i16(value.intValue());
                break;
            case I32:
                out.i32(value.intValue());
                break;
            case I64:
                out.i64(value.longValue());
                break;
            case I128:
                out.i128(value);
                break;
            case I256:
                out.i256(value);
                break;
            default:
                throw new ArgumentMarshalException("unsupported integer type " + type);
        }
    }

    private static BigInteger toBigInteger(final PrimitiveTypeTag type, final Object value) {
        if (value instanceof BigInteger big) {
            return big;
        }
        if (value instanceof BigDecimal decimal) {
            return exact(type, decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            final double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ArgumentMarshalException("expected " + type + ", got " + value);
            }
            return exact(type, new BigDecimal(d));
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return BigInteger.valueOf(((Number) value).longValue());
        }
        if (value instanceof String text) {
            try {
                return new BigInteger(text.trim(), 10);
            } catch (NumberFormatException e) {
                throw new ArgumentMarshalException("expected " + type + ", got non-numeric string \"" + text + "\"", e);
            }
        }
        throw new ArgumentMarshalException("expected " + type + ", got " + value.getClass().getSimpleName());
    }

    private static BigInteger exact(final PrimitiveTypeTag type, final BigDecimal value) {
        try {
            return value.toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new ArgumentMarshalException("expected " + type + ", got fractional value " + value.toPlainString(), e);
        }
    }

    private static boolean toBoolean(final Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if ("true".equals(value)) {
            return true;
        }
        if ("false".equals(value)) {
            return false;
        }
        throw new ArgumentMarshalException("expected bool, got " + describe(value));
    }

    private static AccountAddress toAddress(final TypeTag type, final @Nullable Object value) {
        if (value instanceof AccountAddress address) {
            return address;
        }
        if (value instanceof String text) {
            try {
                return AccountAddress.fromString(text);
            } catch (IllegalArgumentException e) {
                throw new ArgumentMarshalException("expected " + type + ", got invalid address \"" + text + "\"", e);
            }
        }
        throw new ArgumentMarshalException("expected " + type + ", got " + describe(value));
    }

    private static void writeVector(
            final Serializer out,
            final VectorTag type,
            final @Nullable Object value,
            final List<TypeTag> generics,
            final MarshalOptions options) {
        if (value == null) {
            throw new ArgumentMarshalException("expected " + type + ", got null");
        }
        TypeTag element = type.element();
        if (element instanceof GenericTag generic) {
            element = resolve(generic, generics);
        } else if (element instanceof ReferenceTag reference) {
            element = reference.target();
        }
        if (element == PrimitiveTypeTag.U8) {
            if (value instanceof byte[] bytes) {
                out.bytes(bytes);
                return;
            }
            if (value instanceof String text) {
                out.bytes(text.getBytes(StandardCharsets.UTF_8));
                return;
            }
        }
        final List<?> items = asList(type, value);
        out.uleb128(items.size());
        for (int i = 0; i < items.size(); i++) {
            try {
                write(out, element, items.get(i), generics, options);
            } catch (ArgumentMarshalException e) {
                throw new ArgumentMarshalException("element " + i + " of " + type + ": " + e.getMessage(), e);
            }
        }
    }

    private static List<?> asList(final VectorTag type, final Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        if (value.getClass().isArray()) {
            final int length = Array.getLength(value);
            final List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return list;
        }
        throw new ArgumentMarshalException("expected " + type + " as a List or array, got " + describe(value));
    }

    private static void writeStruct(
            final Serializer out,
            final StructTag type,
            final @Nullable Object value,
            final List<TypeTag> generics,
            final MarshalOptions options) {
        if (type.isFramework("string", "String")) {
            if (!(value instanceof String text)) {
                throw new ArgumentMarshalException("expected 0x1::string::String, got " + describe(value));
            }
            out.string(text);
        } else if (type.isFramework("object", "Object")) {
            toAddress(type, value).serialize(out);
        } else if (type.isFramework("option", "Option")) {
            if (type.typeParams().size() != 1) {
                throw new ArgumentMarshalException("0x1::option::Option takes exactly one type parameter, got "
                        + type.typeParams().size());
            }
            writeOption(out, type.typeParams().get(0), value, generics, options);
        } else {
            throw new ArgumentMarshalException("unsupported struct argument type " + type);
        }
    }

    private static void writeOption(
            final Serializer out,
            final TypeTag inner,
            final @Nullable Object value,
            final List<TypeTag> generics,
            final MarshalOptions options) {
        if (value == null) {
            out.u8(0);
            return;
        }
        if (options.compatibility() && value instanceof String text) {
            final byte[] encoded;
            try {
                encoded = Hex.decode(text);
            } catch (IllegalArgumentException e) {
                throw new ArgumentMarshalException("expected BCS hex for option, got \"" + text + "\"", e);
            }
            final Deserializer in = new Deserializer(encoded);
            final long count = in.uleb128();
            if (!in.hasError() && count == 0) {
                out.u8(0);
            } else if (!in.hasError() && count == 1) {
                out.u8(1);
                reencode(out, inner, in, generics);
            } else if (!in.hasError()) {
                throw new ArgumentMarshalException("option hex must hold 0 or 1 elements, got " + count);
            }
            if (in.hasError()) {
                throw new ArgumentMarshalException("malformed option hex \"" + text + "\": " + in.error().getMessage(),
                        in.error());
            }
            if (in.remaining() > 0) {
                throw new ArgumentMarshalException("option hex \"" + text + "\" has " + in.remaining() + " trailing byte(s)");
            }
            return;
        }
        out.u8(1);
        write(out, inner, value, generics, options);
    }

    /** Copies one already-encoded value of {@code type} from {@code in} to {@code out}. */
    private static void reencode(final Serializer out, final TypeTag type, final Deserializer in, final List<TypeTag> generics) {
        if (type instanceof PrimitiveTypeTag primitive) {
            reencodePrimitive(out, primitive, in);
        } else if (type instanceof VectorTag vector) {
            final long length = in.uleb128();
            if (in.hasError()) {
                return;
            }
            if (length > in.remaining()) {
                in.setError(new BcsException("vector length " + length + " exceeds remaining input"));
                return;
            }
            out.uleb128(length);
            for (long i = 0; i < length && !in.hasError(); i++) {
                reencode(out, vector.element(), in, generics);
            }
        } else if (type instanceof ReferenceTag reference) {
            reencode(out, reference.target(), in, generics);
        } else if (type instanceof GenericTag generic) {
            reencode(out, resolve(generic, generics), in, generics);
        } else if (type instanceof StructTag struct) {
            if (struct.isFramework("string", "String")) {
                out.bytes(in.bytes());
            } else if (struct.isFramework("object", "Object")) {
                out.fixedBytes(in.fixedBytes(AccountAddress.LENGTH));
            } else if (struct.isFramework("option", "Option") && struct.typeParams().size() == 1) {
                final boolean present = in.bool();
                out.bool(present);
                if (present) {
                    reencode(out, struct.typeParams().get(0), in, generics);
                }
            } else {
                throw new ArgumentMarshalException("unsupported struct in option hex: " + struct);
            }
        }
    }

    private static void reencodePrimitive(final Serializer out, final PrimitiveTypeTag type, final Deserializer in) {
        switch (type) {
            case BOOL:
                out.bool(in.bool());
                break;
            case U8:
                out.u8(in.u8());
                break;
            case U16:
                out.u16(in.u16());
                break;
            case U32:
                out.u32(in.u32());
                break;
            case U64:
                out.u64(in.u64());
                break;
            case U128:
                out.u128(in.u128());
                break;
            case U256:
                out.u256(in.u256());
                break;
            case I8:
                out.i8(in.i8());
                break;
            case I16:
                out.i16(in.i16());
                break;
            case I32:
                out.i32(in.i32());
                break;
            case I64:
                out.i64(in.i64());
                break;
            case I128:
                out.i128(in.i128());
                break;
            case I256:
                out.i256(in.i256());
                break;
            case ADDRESS:
                out.fixedBytes(in.fixedBytes(AccountAddress.LENGTH));
                break;
            default:
                throw new ArgumentMarshalException(type + " cannot appear in option hex");
        }
    }

    private static String describe(final @Nullable Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
