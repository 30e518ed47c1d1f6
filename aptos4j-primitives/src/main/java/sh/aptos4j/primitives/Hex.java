// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.primitives;

import java.util.Arrays;
import java.util.Objects;

/**
 * Lowercase hex encoding and decoding with optional {@code 0x} prefixes.
 *
 * <p>Decoding is case-insensitive and requires an even number of digits. Callers that need
 * relaxed odd-length handling (such as account address parsing) pad before decoding.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without a {@code 0x} prefix.
     *
     * @param hexString the string to decode
     * @return the decoded bytes, empty for {@code "0x"} or {@code ""}
     * @throws IllegalArgumentException if the input is null, has an odd number of digits,
     *                                  or contains a non-hex character
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int start = hasPrefix(hexString) ? 2 : 0;
        final int digits = hexString.length() - start;
        if (digits == 0) {
            return new byte[0];
        }
        if ((digits & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final byte[] result = new byte[digits / 2];
        for (int i = 0; i < result.length; i++) {
            final int high = toNibble(hexString.charAt(start + i * 2), hexString);
            final int low = toNibble(hexString.charAt(start + i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }
        return result;
    }

    /**
     * Encodes bytes as lowercase hex with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return the prefixed hex string
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Encodes a sub-range of {@code bytes} as lowercase hex with a {@code 0x} prefix.
     *
     * @param bytes  the source array
     * @param offset first byte to encode
     * @param length number of bytes to encode
     * @return the prefixed hex string
     * @throws IllegalArgumentException if {@code bytes} is null
     * @throws IndexOutOfBoundsException if the range does not fit the array
     */
    public static String encode(final byte[] bytes, final int offset, final int length) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        Objects.checkFromIndexSize(offset, length, bytes.length);
        return "0x" + new String(toChars(bytes, offset, length));
    }

    /**
     * Encodes bytes as lowercase hex without a prefix.
     *
     * @param bytes the bytes to encode
     * @return the hex digits
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        return new String(toChars(bytes, 0, bytes.length));
    }

    /**
     * Strips a leading {@code 0x} or {@code 0X} when present.
     *
     * @param hexString the string to clean
     * @return the string without its prefix
     * @throws IllegalArgumentException if {@code hexString} is null
     */
    public static String cleanPrefix(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return hasPrefix(hexString) ? hexString.substring(2) : hexString;
    }

    /**
     * Returns {@code true} if the string starts with {@code 0x} (case-insensitive).
     *
     * @param hexString the string to check, may be null
     * @return whether the prefix is present
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    /**
     * Returns {@code true} if every character after an optional prefix is a hex digit.
     * An empty digit string is considered valid.
     *
     * @param hexString the string to check, may be null
     * @return whether the string only holds hex digits
     */
    public static boolean isHex(final String hexString) {
        if (hexString == null) {
            return false;
        }
        final int start = hasPrefix(hexString) ? 2 : 0;
        for (int i = start; i < hexString.length(); i++) {
            final char c = hexString.charAt(i);
            if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
                return false;
            }
        }
        return true;
    }

    private static char[] toChars(final byte[] bytes, final int offset, final int length) {
        final char[] chars = new char[length * 2];
        for (int i = 0; i < length; i++) {
            final int v = bytes[offset + i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return chars;
    }

    private static int toNibble(final char c, final String originalInput) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }
}
