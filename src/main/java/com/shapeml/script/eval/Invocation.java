package com.shapeml.script.eval;

import java.util.ArrayList;
import java.util.List;

import org.joml.Vector3d;

import com.shapeml.geometry.Mesh;
import com.shapeml.script.interpreter.Interpreter;
import com.shapeml.script.interpreter.OpStringFrame;
import com.shapeml.script.interpreter.Result;
import com.shapeml.script.interpreter.RuntimeError;
import com.shapeml.script.interpreter.ShapeStack;
import com.shapeml.script.parser.Locator;
import com.shapeml.script.parser.ShapeOp;
import com.shapeml.script.parser.Value;
import com.shapeml.shape.Shape;

/**
 * One call of a built-in: the evaluated arguments, the interpreter session and, for
 * shape operations, the frame of the shape operation string being applied.
 *
 * The {@code check*} and {@code validateType} helpers return true when the check passes
 * and otherwise record a message and return false, so checks chain with {@code &&}.
 */
public final class Invocation {
    private final Builtin builtin;
    private final List<Value> args;
    private final Interpreter interpreter;
    private final OpStringFrame frame;
    private Value returnValue;
    private String error;

    public Invocation(Builtin builtin, List<Value> args, Interpreter interpreter, OpStringFrame frame) {
        this.builtin = builtin;
        this.args = new ArrayList<>(args);
        this.interpreter = interpreter;
        this.frame = frame;
    }

    /** Validates and executes. A failure carries no locator; the caller attributes it. */
    public Result<Value> run() {
        boolean ok = validate()
                && (builtin.special() == null || builtin.special().test(this))
                && builtin.body().run(this);
        if (!ok) {
            String msg = error != null ? error : "Evaluation of " + builtin + " failed.";
            return Result.fail(new RuntimeError(msg, Locator.NONE));
        }
        return Result.ok(returnValue);
    }

    private boolean validate() {
        if (builtin.arity() == Builtin.VARIADIC) return true;
        if (!checkArgNumber(builtin.arity())) return false;
        List<Value.Type> types = builtin.argTypes();
        for (int i = 0; i < types.size(); i++) {
            if (!validateType(types.get(i), i)) return false;
        }
        return true;
    }

    // -------------------------
    // Context
    // -------------------------

    public Builtin builtin() { return builtin; }

    public String name() { return builtin.name(); }

    public Interpreter interpreter() { return interpreter; }

    public ShapeStack stack() { return interpreter.shapeStack(); }

    /** Shape on top of the scope stack, null when no derivation is running. */
    public Shape shape() {
        ShapeStack stack = interpreter.shapeStack();
        return stack.size() == 0 ? null : stack.top();
    }

    /** Frame of the enclosing shape operation string; null outside shape operations. */
    public OpStringFrame frame() { return frame; }

    /** Applies a nested shape operation string within the current frame. */
    public Result<Void> apply(List<ShapeOp> ops) {
        return interpreter.applyShapeOpString(ops, frame.output());
    }

    // -------------------------
    // Arguments
    // -------------------------

    public int argCount() { return args.size(); }

    public Value arg(int i) { return args.get(i); }

    public double floatArg(int i) { return args.get(i).asFloat(); }

    public int intArg(int i) { return args.get(i).asInt(); }

    public String stringArg(int i) { return args.get(i).asString(); }

    public List<ShapeOp> opsArg(int i) { return args.get(i).asOps(); }

    public Vector3d vecArg(int i) {
        return new Vector3d(floatArg(i), floatArg(i + 1), floatArg(i + 2));
    }

    /** Numeric argument as double, for checks that accept ints and floats. */
    private double num(int i) {
        Value v = args.get(i);
        return v.type == Value.Type.INT ? v.asInt() : v.asFloat();
    }

    private boolean isNumber(int i) {
        Value.Type t = args.get(i).type;
        return t == Value.Type.INT || t == Value.Type.FLOAT;
    }

    // -------------------------
    // Outcome
    // -------------------------

    public boolean returns(Value value) {
        this.returnValue = value;
        return true;
    }

    public boolean done() {
        return true;
    }

    public boolean fail(String message) {
        this.error = message;
        return false;
    }

    /** Records a nested failure below an {@code Inside <kind> '<name>':} breadcrumb. */
    public boolean propagate(RuntimeError inner) {
        return fail("Inside " + builtin.kind().label() + " '" + builtin.name() + "':\nERROR"
                + inner.where() + ": " + inner.message());
    }

    private String subject() {
        return builtin.kind().label() + " '" + builtin.name() + "'";
    }

    // -------------------------
    // Checks
    // -------------------------

    /** Coerces argument {@code idx} in place. */
    public boolean validateType(Value.Type expected, int idx) {
        Value converted = args.get(idx).changeType(expected);
        if (converted == null) {
            return fail("Cannot convert parameter " + (idx + 1) + " for " + subject() + " to "
                    + expected.label() + ".");
        }
        args.set(idx, converted);
        return true;
    }

    /** Coerces every argument from {@code from} on. */
    public boolean validateTypes(Value.Type expected, int from) {
        for (int i = from; i < args.size(); i++) {
            if (!validateType(expected, i)) return false;
        }
        return true;
    }

    public boolean checkArgNumber(int... counts) {
        for (int c : counts) {
            if (c == args.size()) return true;
        }
        StringBuilder sb = new StringBuilder("The ").append(subject()).append(" takes ");
        if (counts.length > 1) {
            for (int i = 0; i < counts.length - 1; i++) {
                sb.append(counts[i]).append(counts.length > 2 ? ", " : " ");
            }
            sb.append("or ");
        }
        sb.append(counts[counts.length - 1]).append(" arguments, but ").append(args.size()).append(" were provided.");
        return fail(sb.toString());
    }

    public boolean checkNonEmptyMesh() {
        Mesh mesh = shape().mesh();
        if (mesh == null) {
            return fail("The " + subject() + " cannot be evaluated for a shape that has no mesh set.");
        }
        if (mesh.isEmpty()) {
            return fail("The " + subject() + " cannot be evaluated for a shape with an empty mesh.");
        }
        return true;
    }

    public boolean checkSingleFaceMesh() {
        if (shape().mesh().faceCount() != 1) {
            return fail("The " + subject() + " is only defined for shapes with meshes with exactly 1 face.");
        }
        return true;
    }

    /** Arguments {@code idx..idx+2} must form a vector of non-zero length. */
    public boolean checkDirectionVector(int idx) {
        if (vecArg(idx).length() < Mesh.EPSILON) {
            return fail("Parameters " + (idx + 1) + ", " + (idx + 2) + ", and " + (idx + 3) + " for "
                    + subject() + " need to define a vector with norm greater than 0.");
        }
        return true;
    }

    public boolean checkGreaterThanZero(int idx) {
        if (isNumber(idx) && num(idx) <= 0.0) {
            return fail("Parameter " + (idx + 1) + " for " + subject() + " needs to be greater than 0.");
        }
        return true;
    }

    public boolean checkGreaterEqualThanZero(int idx) {
        if (isNumber(idx) && num(idx) < 0.0) {
            return fail("Parameter " + (idx + 1) + " for " + subject() + " must not be smaller than 0.");
        }
        return true;
    }

    public boolean checkGreaterThan(int idx1, int idx2) {
        if (isNumber(idx1) && num(idx1) <= num(idx2)) {
            return fail("Parameter " + (idx1 + 1) + " for " + subject()
                    + " needs to be greater than parameter " + (idx2 + 1) + ". ");
        }
        return true;
    }

    public boolean checkGreaterEqualThan(int idx1, int idx2) {
        if (isNumber(idx1) && num(idx1) < num(idx2)) {
            return fail("Parameter " + (idx1 + 1) + " for " + subject()
                    + " must not be smaller than parameter " + (idx2 + 1) + ". ");
        }
        return true;
    }

    public boolean checkGreaterEqualThanValue(int idx, double min) {
        if (num(idx) < min) {
            return fail("Parameter " + (idx + 1) + " for " + subject() + " must not be smaller than "
                    + Value.formatGeneral(min) + ". ");
        }
        return true;
    }

    /** Inclusive range check for int or float arguments. */
    public boolean checkRange(int idx, double min, double max) {
        double v = num(idx);
        if (v < min || v > max) {
            return fail("Parameter " + (idx + 1) + " for " + subject() + " must be in the range ["
                    + Value.formatGeneral(min) + ", " + Value.formatGeneral(max) + "].");
        }
        return true;
    }
}
