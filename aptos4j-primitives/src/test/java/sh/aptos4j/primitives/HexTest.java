// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {

    @Test
    @DisplayName("Encoding empty and single bytes")
    void encodesBasicValues() {
        assertEquals("0x", Hex.encode(new byte[] {}));
        assertEquals("0x00", Hex.encode(new byte[] {0x00}));
        assertEquals("0xff", Hex.encode(new byte[] {(byte) 0xFF}));
    }

    @Test
    void encodesWithAndWithoutPrefix() {
        byte[] bytes = new byte[] {0x01, 0x23, (byte) 0xAB, (byte) 0xCD};
        assertEquals("0x0123abcd", Hex.encode(bytes));
        assertEquals("0123abcd", Hex.encodeNoPrefix(bytes));
        assertEquals("0x23ab", Hex.encode(bytes, 1, 2));
    }

    @Test
    void decodesIgnoringCase() {
        byte[] expected = new byte[] {0x0A, (byte) 0xBC, (byte) 0xDE, (byte) 0xF0};
        assertArrayEquals(expected, Hex.decode("0x0AbCdEf0"));
        assertArrayEquals(expected, Hex.decode("0X0aBcDeF0"));
        assertArrayEquals(expected, Hex.decode("0aBcDeF0"));
        assertArrayEquals(new byte[0], Hex.decode("0x"));
    }

    @Test
    void prefixHelpers() {
        assertEquals("1234", Hex.cleanPrefix("0x1234"));
        assertEquals("1234", Hex.cleanPrefix("1234"));
        assertTrue(Hex.hasPrefix("0Xff"));
        assertFalse(Hex.hasPrefix("1"));
        assertFalse(Hex.hasPrefix(null));
    }

    @Test
    void isHexChecksDigitsOnly() {
        assertTrue(Hex.isHex("0xabc"));
        assertTrue(Hex.isHex("ABC123"));
        assertTrue(Hex.isHex("0x"));
        assertFalse(Hex.isHex("0xg1"));
        assertFalse(Hex.isHex("12 34"));
        assertFalse(Hex.isHex(null));
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0x1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xz1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.cleanPrefix(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.encode(null));
        assertThrows(IndexOutOfBoundsException.class, () -> Hex.encode(new byte[2], 1, 2));
    }
}
