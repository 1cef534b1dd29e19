package com.shapeml.util;

/**
 * Improved Perlin gradient noise in two and three dimensions, plus fractional
 * Brownian motion built from summed octaves.
 */
public final class Noise {

    private static final int[] PERM = new int[512];

    static {
        int[] p = {
            151, 160, 137, 91, 90, 15, 131, 13, 201, 95, 96, 53, 194, 233, 7, 225, 140,
            36, 103, 30, 69, 142, 8, 99, 37, 240, 21, 10, 23, 190, 6, 148, 247, 120,
            234, 75, 0, 26, 197, 62, 94, 252, 219, 203, 117, 35, 11, 32, 57, 177, 33,
            88, 237, 149, 56, 87, 174, 20, 125, 136, 171, 168, 68, 175, 74, 165, 71,
            134, 139, 48, 27, 166, 77, 146, 158, 231, 83, 111, 229, 122, 60, 211, 133,
            230, 220, 105, 92, 41, 55, 46, 245, 40, 244, 102, 143, 54, 65, 25, 63, 161,
            1, 216, 80, 73, 209, 76, 132, 187, 208, 89, 18, 169, 200, 196, 135, 130,
            116, 188, 159, 86, 164, 100, 109, 198, 173, 186, 3, 64, 52, 217, 226, 250,
            124, 123, 5, 202, 38, 147, 118, 126, 255, 82, 85, 212, 207, 206, 59, 227,
            47, 16, 58, 17, 182, 189, 28, 42, 223, 183, 170, 213, 119, 248, 152, 2, 44,
            154, 163, 70, 221, 153, 101, 155, 167, 43, 172, 9, 129, 22, 39, 253, 19, 98,
            108, 110, 79, 113, 224, 232, 178, 185, 112, 104, 218, 246, 97, 228, 251, 34,
            242, 193, 238, 210, 144, 12, 191, 179, 162, 241, 81, 51, 145, 235, 249, 14,
            239, 107, 49, 192, 214, 31, 181, 199, 106, 157, 184, 84, 204, 176, 115, 121,
            50, 45, 127, 4, 150, 254, 138, 236, 205, 93, 222, 114, 67, 29, 24, 72, 243,
            141, 128, 195, 78, 66, 215, 61, 156, 180
        };
        for (int i = 0; i < 256; i++) {
            PERM[i] = p[i];
            PERM[i + 256] = p[i];
        }
    }

    private Noise() {}

    private static double fade(double t) {
        return t * t * t * (t * (t * 6.0 - 15.0) + 10.0);
    }

    private static double lerp(double a, double b, double t) {
        return a + t * (b - a);
    }

    private static double grad2(int hash, double x, double y) {
        switch (hash & 7) {
            case 0: return x + y;
            case 1: return -x + y;
            case 2: return x - y;
            case 3: return -x - y;
            case 4: return x;
            case 5: return -x;
            case 6: return y;
            default: return -y;
        }
    }

    private static double grad3(int hash, double x, double y, double z) {
        switch (hash & 15) {
            case 0: return x + y;
            case 1: return -x + y;
            case 2: return x - y;
            case 3: return -x - y;
            case 4: return x + z;
            case 5: return -x + z;
            case 6: return x - z;
            case 7: return -x - z;
            case 8: return y + z;
            case 9: return -y + z;
            case 10: return y - z;
            case 11: return -y - z;
            case 12: return y + x;
            case 13: return -x + y;
            case 14: return -y + z;
            default: return -y - z;
        }
    }

    public static double perlin(double x, double y) {
        int xi = (int) Math.floor(x);
        int yi = (int) Math.floor(y);
        x -= xi;
        y -= yi;
        xi &= 255;
        yi &= 255;

        double u = fade(x);
        double v = fade(y);

        // Hash sums wrap at 8 bits.
        int a = (PERM[xi] + yi) & 255;
        int b = (PERM[xi + 1] + yi) & 255;

        double gAA = grad2(PERM[a], x, y);
        double gBA = grad2(PERM[b], x - 1.0, y);
        double gAB = grad2(PERM[a + 1], x, y - 1.0);
        double gBB = grad2(PERM[b + 1], x - 1.0, y - 1.0);

        return lerp(lerp(gAA, gBA, u), lerp(gAB, gBB, u), v);
    }

    public static double perlin(double x, double y, double z) {
        int xi = (int) Math.floor(x);
        int yi = (int) Math.floor(y);
        int zi = (int) Math.floor(z);
        x -= xi;
        y -= yi;
        z -= zi;
        xi &= 255;
        yi &= 255;
        zi &= 255;

        double u = fade(x);
        double v = fade(y);
        double w = fade(z);

        int a = (PERM[xi] + yi) & 255;
        int b = (PERM[xi + 1] + yi) & 255;
        int aa = (PERM[a] + zi) & 255;
        int ab = (PERM[a + 1] + zi) & 255;
        int ba = (PERM[b] + zi) & 255;
        int bb = (PERM[b + 1] + zi) & 255;

        double gAAA = grad3(PERM[aa], x, y, z);
        double gBAA = grad3(PERM[ba], x - 1.0, y, z);
        double gABA = grad3(PERM[ab], x, y - 1.0, z);
        double gBBA = grad3(PERM[bb], x - 1.0, y - 1.0, z);
        double gAAB = grad3(PERM[aa + 1], x, y, z - 1.0);
        double gBAB = grad3(PERM[ba + 1], x - 1.0, y, z - 1.0);
        double gABB = grad3(PERM[ab + 1], x, y - 1.0, z - 1.0);
        double gBBB = grad3(PERM[bb + 1], x - 1.0, y - 1.0, z - 1.0);

        return lerp(lerp(lerp(gAAA, gBAA, u), lerp(gABA, gBBA, u), v),
                lerp(lerp(gAAB, gBAB, u), lerp(gABB, gBBB, u), v),
                w);
    }

    /** Sum of {@code octaves} noise layers, each scaled in frequency by {@code lacunarity} and in amplitude by {@code gain}. */
    public static double fbm(double x, double y, int octaves, double lacunarity, double gain) {
        double frequency = 1.0;
        double amplitude = 1.0;
        double sum = 0.0;
        for (int i = 0; i < octaves; i++) {
            sum += perlin(x * frequency, y * frequency) * amplitude;
            frequency *= lacunarity;
            amplitude *= gain;
        }
        return sum;
    }

    public static double fbm(double x, double y, double z, int octaves, double lacunarity, double gain) {
        double frequency = 1.0;
        double amplitude = 1.0;
        double sum = 0.0;
        for (int i = 0; i < octaves; i++) {
            sum += perlin(x * frequency, y * frequency, z * frequency) * amplitude;
            frequency *= lacunarity;
            amplitude *= gain;
        }
        return sum;
    }
}
