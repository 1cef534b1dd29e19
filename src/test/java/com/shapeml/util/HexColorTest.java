package com.shapeml.util;

import static org.junit.jupiter.api.Assertions.*;

import org.joml.Vector4d;
import org.junit.jupiter.api.Test;

public class HexColorTest {

    @Test
    void validity() {
        assertTrue(HexColor.isValid("#a0B1c2", false));
        assertTrue(HexColor.isValid("#a0b1c2ff", true));
        assertFalse(HexColor.isValid("#a0b1c2ff", false));
        assertFalse(HexColor.isValid("a0b1c2", true));
        assertFalse(HexColor.isValid("#a0b1g2", true));
        assertFalse(HexColor.isValid(null, true));
    }

    @Test
    void parse_components() {
        Vector4d c = HexColor.parse("#ff8000");
        assertEquals(1.0, c.x, 1e-9);
        assertEquals(128.0 / 255.0, c.y, 1e-9);
        assertEquals(0.0, c.z, 1e-9);
        assertEquals(1.0, c.w, 1e-9);
        assertEquals(0.0, HexColor.parse("#ffffff00").w, 1e-9);
    }

    @Test
    void parse_rejects_invalid() {
        assertThrows(IllegalArgumentException.class, () -> HexColor.parse("red"));
    }
}
