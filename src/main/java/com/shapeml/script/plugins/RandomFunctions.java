package com.shapeml.script.plugins;

import static com.shapeml.script.parser.Value.Type.FLOAT;
import static com.shapeml.script.parser.Value.Type.INT;

import java.util.Random;

import com.shapeml.script.eval.BuiltinRegistry;
import com.shapeml.script.eval.Invocation;
import com.shapeml.script.parser.Value;
import com.shapeml.util.Noise;

/**
 * RandomFunctions
 *
 * Seeded random numbers and coherent noise. All draws come from the session's random
 * stream, so a derivation is reproducible for a given seed.
 *
 * Usage:
 *   RandomFunctions.register(registry);
 *
 * Then in grammars:
 *   rule Lot = { sizeY(rand_uniform(10, 30)) extrude(noise(pos_world_x, pos_world_z) * 4 + 8) Block };
 */
public final class RandomFunctions {

    private static final double NOISE_SCALE = 16.0 / 128.0;
    private static final double FBM_SCALE = 4.0 / 128.0;
    private static final double FBM_LACUNARITY = 2.0;
    private static final double FBM_GAIN = 0.5;

    private RandomFunctions() {}

    public static void register(BuiltinRegistry registry) {

        // Inclusive on both ends.
        registry.function("rand_int").args(INT, INT)
                .check(inv -> inv.checkGreaterThan(1, 0))
                .run(inv -> {
                    Random rnd = inv.interpreter().random();
                    long lo = inv.intArg(0);
                    long span = (long) inv.intArg(1) - lo + 1;
                    long offset = span <= Integer.MAX_VALUE
                            ? rnd.nextInt((int) span)
                            : Math.floorMod(rnd.nextLong(), span);
                    return inv.returns(Value.integer((int) (lo + offset)));
                });

        registry.function("rand_uniform").args(FLOAT, FLOAT)
                .check(inv -> inv.checkGreaterThan(1, 0))
                .run(inv -> {
                    double lo = inv.floatArg(0);
                    double hi = inv.floatArg(1);
                    return inv.returns(Value.number(lo + inv.interpreter().random().nextDouble() * (hi - lo)));
                });

        registry.function("rand_normal").args(FLOAT, FLOAT)
                .check(inv -> inv.checkGreaterThanZero(1))
                .run(inv -> inv.returns(Value.number(
                        inv.floatArg(0) + inv.interpreter().random().nextGaussian() * inv.floatArg(1))));

        registry.function("noise").variadic()
                .check(inv -> inv.checkArgNumber(2, 3) && inv.validateTypes(FLOAT, 0))
                .run(inv -> {
                    double x = (float) inv.floatArg(0) * NOISE_SCALE;
                    double y = (float) inv.floatArg(1) * NOISE_SCALE;
                    if (inv.argCount() == 2) return inv.returns(Value.number(Noise.perlin(x, y)));
                    double z = (float) inv.floatArg(2) * NOISE_SCALE;
                    return inv.returns(Value.number(Noise.perlin(x, y, z)));
                });

        // fBm(x, y, octaves [, lacunarity, gain]) or fBm(x, y, z, octaves [, lacunarity, gain])
        registry.function("fBm").variadic()
                .check(RandomFunctions::checkFbm)
                .run(inv -> {
                    int n = inv.argCount();
                    double x = (float) inv.floatArg(0) * FBM_SCALE;
                    double y = (float) inv.floatArg(1) * FBM_SCALE;
                    if (n % 2 == 1) {
                        double lacunarity = n == 5 ? inv.floatArg(3) : FBM_LACUNARITY;
                        double gain = n == 5 ? inv.floatArg(4) : FBM_GAIN;
                        return inv.returns(Value.number(Noise.fbm(x, y, inv.intArg(2), lacunarity, gain)));
                    }
                    double z = (float) inv.floatArg(2) * FBM_SCALE;
                    double lacunarity = n == 6 ? inv.floatArg(4) : FBM_LACUNARITY;
                    double gain = n == 6 ? inv.floatArg(5) : FBM_GAIN;
                    return inv.returns(Value.number(Noise.fbm(x, y, z, inv.intArg(3), lacunarity, gain)));
                });

        registry.function("seed").run(inv -> inv.returns(Value.integer(inv.interpreter().seed())));
    }

    private static boolean checkFbm(Invocation inv) {
        if (!inv.checkArgNumber(3, 5, 4, 6)) return false;
        int octavesIdx = inv.argCount() % 2 == 1 ? 2 : 3;
        for (int i = 0; i < inv.argCount(); i++) {
            if (!inv.validateType(i == octavesIdx ? INT : FLOAT, i)) return false;
        }
        return true;
    }
}
