package com.shapeml.util;

import org.joml.Vector4d;

/** {@code #RRGGBB} and {@code #RRGGBBAA} color strings. */
public final class HexColor {

    private HexColor() {}

    private static int hexDigit(char c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'A' && c <= 'F') return c - 'A' + 10;
        if (c >= 'a' && c <= 'f') return c - 'a' + 10;
        return -1;
    }

    public static boolean isValid(String hex, boolean allowAlpha) {
        if (hex == null) return false;
        if (!(hex.length() == 7 || (allowAlpha && hex.length() == 9))) return false;
        if (hex.charAt(0) != '#') return false;
        for (int i = 1; i < hex.length(); i++) {
            if (hexDigit(hex.charAt(i)) < 0) return false;
        }
        return true;
    }

    /** Components in [0, 1]. Alpha is 1 for the six digit form. Expects a valid string. */
    public static Vector4d parse(String hex) {
        if (!isValid(hex, true)) throw new IllegalArgumentException("Not a hex color: " + hex);
        double r = component(hex, 1);
        double g = component(hex, 3);
        double b = component(hex, 5);
        double a = hex.length() == 9 ? component(hex, 7) : 1.0;
        return new Vector4d(r, g, b, a);
    }

    private static double component(String hex, int at) {
        return (hexDigit(hex.charAt(at)) * 16 + hexDigit(hex.charAt(at + 1))) / 255.0;
    }
}
