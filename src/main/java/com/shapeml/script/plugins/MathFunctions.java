package com.shapeml.script.plugins;

import static com.shapeml.script.parser.Value.Type.BOOL;
import static com.shapeml.script.parser.Value.Type.FLOAT;
import static com.shapeml.script.parser.Value.Type.INT;
import static com.shapeml.script.parser.Value.Type.STRING;

import java.util.function.DoubleUnaryOperator;

import com.shapeml.script.eval.BuiltinRegistry;
import com.shapeml.script.eval.Invocation;
import com.shapeml.script.parser.Value;

/**
 * MathFunctions
 *
 * Type conversions and the numeric function library of the grammar language.
 * Angles are in degrees throughout.
 *
 * Usage:
 *   MathFunctions.register(registry);
 *
 * Then in grammars:
 *   const h = clamp(2.0, 10.0, height * 0.5);
 *   rule Pillar = { rotateY(asin(0.5)) scaleY(max(1, floor(n))) Column_ };
 */
public final class MathFunctions {

    private MathFunctions() {}

    public static void register(BuiltinRegistry registry) {

        // Conversions: the positional type check does the work.
        registry.function("bool").args(BOOL).run(inv -> inv.returns(inv.arg(0)));
        registry.function("int").args(INT).run(inv -> inv.returns(inv.arg(0)));
        registry.function("float").args(FLOAT).run(inv -> inv.returns(inv.arg(0)));
        registry.function("string").args(STRING).run(inv -> inv.returns(inv.arg(0)));

        registry.function("abs").variadic()
                .check(inv -> {
                    if (!inv.checkArgNumber(1)) return false;
                    Value.Type t = inv.arg(0).type;
                    if (t != FLOAT && t != INT) {
                        return inv.fail("The parameter for 'abs' needs to be " + INT.label() + " or "
                                + FLOAT.label() + ".");
                    }
                    return true;
                })
                .run(inv -> inv.returns(inv.arg(0).type == FLOAT
                        ? Value.number(Math.abs(inv.floatArg(0)))
                        : Value.integer(Math.abs(inv.intArg(0)))));

        unary(registry, "ceil", Math::ceil);
        unary(registry, "floor", Math::floor);
        // Halfway cases round away from zero.
        unary(registry, "round", x -> x < 0.0 ? -Math.floor(-x + 0.5) : Math.floor(x + 0.5));
        unary(registry, "fract", x -> x - (long) x);

        registry.function("sign").args(FLOAT)
                .run(inv -> inv.returns(Value.integer(inv.floatArg(0) >= 0.0 ? 1 : -1)));

        unary(registry, "sin", x -> Math.sin(Math.toRadians(x)));
        unary(registry, "cos", x -> Math.cos(Math.toRadians(x)));
        unary(registry, "tan", x -> Math.tan(Math.toRadians(x)));

        registry.function("asin").args(FLOAT)
                .check(inv -> inv.checkRange(0, -1.0, 1.0))
                .run(inv -> inv.returns(Value.number(Math.toDegrees(Math.asin(inv.floatArg(0))))));

        registry.function("acos").args(FLOAT)
                .check(inv -> inv.checkRange(0, -1.0, 1.0))
                .run(inv -> inv.returns(Value.number(Math.toDegrees(Math.acos(inv.floatArg(0))))));

        unary(registry, "atan", x -> Math.toDegrees(Math.atan(x)));

        registry.function("atan2").args(FLOAT, FLOAT)
                .run(inv -> inv.returns(Value.number(Math.toDegrees(Math.atan2(inv.floatArg(0), inv.floatArg(1))))));

        registry.function("sqrt").args(FLOAT)
                .check(inv -> inv.checkGreaterEqualThanZero(0))
                .run(inv -> inv.returns(Value.number(Math.sqrt(inv.floatArg(0)))));

        registry.function("pow").args(FLOAT, FLOAT)
                .run(inv -> inv.returns(Value.number(Math.pow(inv.floatArg(0), inv.floatArg(1)))));

        unary(registry, "exp", Math::exp);

        registry.function("log").args(FLOAT)
                .check(inv -> inv.checkGreaterThanZero(0))
                .run(inv -> inv.returns(Value.number(Math.log(inv.floatArg(0)))));

        registry.function("log10").args(FLOAT)
                .check(inv -> inv.checkGreaterThanZero(0))
                .run(inv -> inv.returns(Value.number(Math.log10(inv.floatArg(0)))));

        registry.function("max").variadic()
                .check(MathFunctions::unifyNumbers)
                .run(inv -> inv.returns(inv.arg(0).type == INT
                        ? Value.integer(Math.max(inv.intArg(0), inv.intArg(1)))
                        : Value.number(Math.max(inv.floatArg(0), inv.floatArg(1)))));

        registry.function("min").variadic()
                .check(MathFunctions::unifyNumbers)
                .run(inv -> inv.returns(inv.arg(0).type == INT
                        ? Value.integer(Math.min(inv.intArg(0), inv.intArg(1)))
                        : Value.number(Math.min(inv.floatArg(0), inv.floatArg(1)))));

        // clamp(lo, hi, x)
        registry.function("clamp").args(FLOAT, FLOAT, FLOAT)
                .check(inv -> inv.checkGreaterEqualThan(1, 0))
                .run(inv -> {
                    double x = inv.floatArg(2);
                    if (x < inv.floatArg(0)) return inv.returns(inv.arg(0));
                    if (x > inv.floatArg(1)) return inv.returns(inv.arg(1));
                    return inv.returns(inv.arg(2));
                });

        // TODO: return x < edge ? 0.0 : 1.0
        registry.function("step").args(FLOAT, FLOAT)
                .run(inv -> inv.returns(Value.number(1.0)));

        registry.function("smooth_step").args(FLOAT, FLOAT, FLOAT)
                .check(inv -> inv.checkGreaterThan(1, 0))
                .run(inv -> {
                    double edge0 = inv.floatArg(0);
                    double edge1 = inv.floatArg(1);
                    double t = (inv.floatArg(2) - edge0) / (edge1 - edge0);
                    t = Math.max(Math.min(t, 1.0), 0.0);
                    return inv.returns(Value.number(t * t * (3.0 - 2.0 * t)));
                });

        registry.function("lerp").args(FLOAT, FLOAT, FLOAT)
                .check(inv -> inv.checkRange(2, 0.0, 1.0))
                .run(inv -> {
                    double alpha = inv.floatArg(2);
                    return inv.returns(Value.number(inv.floatArg(0) * (1.0 - alpha) + inv.floatArg(1) * alpha));
                });

        registry.function("pi").run(inv -> inv.returns(Value.number(Math.PI)));
    }

    private static void unary(BuiltinRegistry registry, String name, DoubleUnaryOperator fn) {
        registry.function(name).args(FLOAT)
                .run(inv -> inv.returns(Value.number(fn.applyAsDouble(inv.floatArg(0)))));
    }

    /** Two arguments, both promoted to float when either is float, else both to int. */
    private static boolean unifyNumbers(Invocation inv) {
        if (!inv.checkArgNumber(2)) return false;
        boolean anyFloat = inv.arg(0).type == FLOAT || inv.arg(1).type == FLOAT;
        Value.Type target = anyFloat ? FLOAT : INT;
        if (inv.arg(0).changeType(target) == null || inv.arg(1).changeType(target) == null) {
            return inv.fail("Cannot convert all parameters for '" + inv.name() + "' to " + INT.label()
                    + " or " + FLOAT.label() + ".");
        }
        return inv.validateType(target, 0) && inv.validateType(target, 1);
    }
}
