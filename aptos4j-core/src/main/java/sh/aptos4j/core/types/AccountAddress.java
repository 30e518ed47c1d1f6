// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.types;

import java.util.Arrays;
import java.util.Objects;

import sh.aptos4j.core.crypto.DeriveScheme;
import sh.aptos4j.core.crypto.Sha3Hash;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.BcsSerializable;
import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * 32-byte Aptos account address.
 * <p>
 * <strong>String forms (AIP-40):</strong>
 * <ul>
 * <li>Special addresses ({@code 0x0} to {@code 0xf}): {@code 0x} plus one nibble</li>
 * <li>Long form: {@code 0x} plus exactly 64 hex characters</li>
 * <li>Short form: leading zero bytes stripped, first byte printed without padding</li>
 * </ul>
 * {@link #toString()} gives the special form for special addresses and the long form otherwise.
 * <p>
 * BCS encoding is the 32 raw bytes with no length prefix.
 *
 * @param bytes the 32 address bytes
 * @since 0.1.0
 */
public record AccountAddress(byte[] bytes) implements BcsSerializable {

    /** Address length in bytes. */
    public static final int LENGTH = 32;

    public static final AccountAddress ZERO = special(0x0);
    public static final AccountAddress ONE = special(0x1);
    public static final AccountAddress TWO = special(0x2);
    public static final AccountAddress THREE = special(0x3);
    public static final AccountAddress FOUR = special(0x4);
    public static final AccountAddress TEN = special(0xA);

    public AccountAddress {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("AccountAddress must be " + LENGTH + " bytes, got " + bytes.length);
        }
        bytes = Arrays.copyOf(bytes, LENGTH);
    }

    /**
     * Returns a copy of the address bytes.
     *
     * @return 32 bytes
     */
    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, LENGTH);
    }

    public static AccountAddress fromBytes(final byte[] bytes) {
        return new AccountAddress(bytes);
    }

    /**
     * Parses an address leniently: the {@code 0x} prefix is optional and 1 to 64 hex
     * characters are accepted, left-padded with zeros.
     *
     * @param value the text form
     * @return the address
     * @throws IllegalArgumentException if the text is empty, too long or not hex
     */
    public static AccountAddress fromString(final String value) {
        Objects.requireNonNull(value, "address cannot be null");
        return parseDigits(Hex.cleanPrefix(value), value);
    }

    /**
     * Parses an address that must start with {@code 0x}, otherwise as lenient as
     * {@link #fromString(String)}.
     *
     * @param value the text form
     * @return the address
     * @throws IllegalArgumentException if the prefix is missing or the digits are invalid
     */
    public static AccountAddress fromStringWithPrefix(final String value) {
        Objects.requireNonNull(value, "address cannot be null");
        if (!Hex.hasPrefix(value)) {
            throw new IllegalArgumentException("AccountAddress missing 0x: " + value);
        }
        return parseDigits(value.substring(2), value);
    }

    /**
     * Parses the AIP-40 canonical form only: special addresses as {@code 0x0..0xf}, everything
     * else as 64 hex characters.
     *
     * @param value the text form
     * @return the address
     * @throws IllegalArgumentException if the text is not canonical
     */
    public static AccountAddress fromStringStrict(final String value) {
        final AccountAddress address = fromStringWithPrefix(value);
        final int digits = value.length() - 2;
        if (address.isSpecial() ? digits != 1 && digits != 64 : digits != 64) {
            throw new IllegalArgumentException("AccountAddress is not in canonical form: " + value);
        }
        return address;
    }

    private static AccountAddress parseDigits(final String digits, final String original) {
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("AccountAddress too short: " + original);
        }
        if (digits.length() > LENGTH * 2) {
            throw new IllegalArgumentException("AccountAddress too long: " + original);
        }
        if (!Hex.isHex(digits)) {
            throw new IllegalArgumentException("AccountAddress is not hex: " + original);
        }
        final byte[] raw = Hex.decode((digits.length() & 1) == 1 ? "0" + digits : digits);
        final byte[] padded = new byte[LENGTH];
        System.arraycopy(raw, 0, padded, LENGTH - raw.length, raw.length);
        return new AccountAddress(padded);
    }

    /**
     * Special addresses have 31 leading zero bytes and a last byte below {@code 0x10}.
     *
     * @return whether this is one of {@code 0x0..0xf}
     */
    public boolean isSpecial() {
        for (int i = 0; i < LENGTH - 1; i++) {
            if (bytes[i] != 0) {
                return false;
            }
        }
        return (bytes[LENGTH - 1] & 0xFF) < 0x10;
    }

    /** @return {@code 0x} plus 64 lowercase hex characters */
    public String toLongString() {
        return Hex.encode(bytes);
    }

    /** @return the address with leading zero bytes removed and the first nibble unpadded */
    public String toShortString() {
        int first = 0;
        while (first < LENGTH - 1 && bytes[first] == 0) {
            first++;
        }
        return "0x" + Integer.toHexString(bytes[first] & 0xFF)
                + Hex.encodeNoPrefix(Arrays.copyOfRange(bytes, first + 1, LENGTH));
    }

    /**
     * Derives an address from this address, a seed and a scheme byte:
     * {@code SHA3-256(this || seed || scheme)}.
     *
     * @param seed   the seed bytes
     * @param scheme the derive scheme
     * @return the derived address
     */
    public AccountAddress derive(final byte[] seed, final DeriveScheme scheme) {
        Objects.requireNonNull(seed, "seed cannot be null");
        Objects.requireNonNull(scheme, "scheme cannot be null");
        return new AccountAddress(Sha3Hash.hash(bytes, seed, new byte[] {scheme.value()}));
    }

    /** Address of a named object created by this account. */
    public AccountAddress namedObjectAddress(final byte[] seed) {
        return derive(seed, DeriveScheme.OBJECT_FROM_SEED);
    }

    /** Address of an object created by the object at this address. */
    public AccountAddress objectAddressFromObject(final AccountAddress objectAddress) {
        Objects.requireNonNull(objectAddress, "objectAddress cannot be null");
        return derive(objectAddress.bytes, DeriveScheme.OBJECT_FROM_OBJECT);
    }

    /**
     * Address of an object created from a GUID of this account. The seed is the BCS form of
     * the GUID: {@code creation_num} as u64 followed by this address.
     *
     * @param creationNumber the GUID creation number (u64 bits)
     * @return the derived address
     */
    public AccountAddress objectAddressFromGuid(final long creationNumber) {
        final Serializer serializer = new Serializer(40);
        serializer.u64(creationNumber);
        serializer.fixedBytes(bytes);
        return derive(serializer.toByteArray(), DeriveScheme.OBJECT_FROM_GUID);
    }

    /** Address of a resource account created by this account. */
    public AccountAddress resourceAccountAddress(final byte[] seed) {
        return derive(seed, DeriveScheme.RESOURCE_ACCOUNT);
    }

    @Override
    public void serialize(final Serializer serializer) {
        serializer.fixedBytes(bytes);
    }

    public static AccountAddress deserialize(final Deserializer deserializer) {
        final byte[] raw = deserializer.fixedBytes(LENGTH);
        return deserializer.hasError() ? ZERO : new AccountAddress(raw);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccountAddress other)) {
            return false;
        }
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return isSpecial() ? toShortString() : toLongString();
    }

    private static AccountAddress special(final int last) {
        final byte[] raw = new byte[LENGTH];
        raw[LENGTH - 1] = (byte) last;
        return new AccountAddress(raw);
    }
}
