// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HexTest {

    @Test
    void encodesLowercaseWithoutPrefix() {
        assertEquals("00ff10ab", Hex.encodeNoPrefix(new byte[] {0x00, (byte) 0xff, 0x10, (byte) 0xab}));
    }

    @Test
    void encodesWithPrefix() {
        assertEquals("0x0a", Hex.encode(new byte[] {0x0a}));
        assertEquals("0x", Hex.encode(new byte[0]));
    }

    @Test
    void cleansPrefix() {
        assertEquals("10", Hex.cleanPrefix("0x10"));
        assertEquals("10", Hex.cleanPrefix("0X10"));
        assertEquals("10", Hex.cleanPrefix("10"));
    }

    @Test
    void detectsPrefix() {
        assertTrue(Hex.hasPrefix("0xabc"));
        assertFalse(Hex.hasPrefix("abc"));
        assertFalse(Hex.hasPrefix("0"));
        assertFalse(Hex.hasPrefix(null));
    }

    @Test
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> Hex.encodeNoPrefix(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.cleanPrefix(null));
    }
}
