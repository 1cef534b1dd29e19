package com.shapeml.script.plugins;

import static com.shapeml.script.parser.Value.Type.FLOAT;
import static com.shapeml.script.parser.Value.Type.INT;
import static com.shapeml.script.parser.Value.Type.SHAPE_OP_STRING;
import static com.shapeml.script.parser.Value.Type.STRING;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.joml.Vector3d;

import com.shapeml.geometry.Mesh;
import com.shapeml.geometry.Plane;
import com.shapeml.script.eval.BuiltinRegistry;
import com.shapeml.script.eval.Invocation;
import com.shapeml.script.interpreter.Result;
import com.shapeml.script.parser.ShapeOp;
import com.shapeml.shape.Shape;

/**
 * SplitOps
 *
 * Subdivision of the current shape. Every piece is pushed as a copy of the current
 * shape with its own mesh and index, the piece's operation string is applied to it,
 * and the copy is popped again.
 *
 * Split patterns consist of 'f' (fixed size) and 's' (stretchable) elements, with at
 * most one level of parentheses marking a part that repeats to fill the scope:
 *
 *   splitX("s(ff)s", 1, Corner, 2, Window, 0.5, Pillar, 1, Corner)
 *
 * Usage:
 *   SplitOps.register(registry);
 *
 * Then in grammars:
 *   rule Facade = { splitRepeatY(3.2, Floor) };
 *   rule Mass = { splitFace("top", Roof, "side", Facade) };
 */
public final class SplitOps {

    private static final double MIN_SPLIT_SIZE = 0.0001;

    private static final Set<String> FACE_SELECTORS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "front", "back", "left", "right", "top", "bottom", "all", "horizontal", "vertical", "side")));

    private static final double COS_HORIZONTAL = Math.cos(Math.toRadians(11.25));
    private static final double COS_VERTICAL = Math.cos(Math.toRadians(78.75));

    private SplitOps() {}

    public static void register(BuiltinRegistry registry) {
        splitRepeat(registry, "splitRepeatX", 0);
        splitRepeat(registry, "splitRepeatY", 1);
        splitRepeat(registry, "splitRepeatZ", 2);

        patternSplit(registry, "splitX", 0);
        patternSplit(registry, "splitY", 1);
        patternSplit(registry, "splitZ", 2);

        registerFaceSplits(registry);
    }

    // -------------------------
    // Axis splits
    // -------------------------

    private static void splitRepeat(BuiltinRegistry registry, String name, int axis) {
        registry.shapeOp(name).args(FLOAT, SHAPE_OP_STRING)
                .check(inv -> inv.checkNonEmptyMesh() && inv.checkGreaterEqualThanValue(0, MIN_SPLIT_SIZE))
                .run(inv -> {
                    double total = component(inv.shape().size(), axis);
                    int reps = Math.max((int) Math.round(total / inv.floatArg(0)), 1);
                    List<Double> sizes = new ArrayList<>(Collections.nCopies(reps, total / reps));
                    List<List<ShapeOp>> ops = new ArrayList<>(Collections.nCopies(reps, inv.opsArg(1)));
                    return applySplit(inv, axis, total, sizes, ops);
                });
    }

    private static void patternSplit(BuiltinRegistry registry, String name, int axis) {
        registry.shapeOp(name).variadic()
                .check(SplitOps::checkPatternSplit)
                .run(inv -> {
                    SplitPattern pattern = SplitPattern.parse(inv.stringArg(0));
                    List<Double> sizes = new ArrayList<>();
                    List<List<ShapeOp>> ops = new ArrayList<>();
                    for (int i = 1; i < inv.argCount(); i += 2) {
                        sizes.add(inv.floatArg(i));
                        ops.add(inv.opsArg(i + 1));
                    }
                    double total = component(inv.shape().size(), axis);
                    List<Integer> order = pattern.layout(sizes, total);
                    List<Double> finalSizes = new ArrayList<>(order.size());
                    List<List<ShapeOp>> finalOps = new ArrayList<>(order.size());
                    for (int idx : order) {
                        finalSizes.add(sizes.get(idx));
                        finalOps.add(ops.get(idx));
                    }
                    return applySplit(inv, axis, total, finalSizes, finalOps);
                });
    }

    private static boolean checkPatternSplit(Invocation inv) {
        if (!inv.checkNonEmptyMesh()) return false;
        if (inv.argCount() < 3) {
            return inv.fail("Shape operation '" + inv.name() + "' needs at least 3 arguments.");
        }
        if (!inv.validateType(STRING, 0)) return false;
        SplitPattern pattern = SplitPattern.parse(inv.stringArg(0));
        if (pattern == null) {
            return inv.fail("Shape operation '" + inv.name() + "' is called with an invalid split pattern '"
                    + inv.stringArg(0) + "'.");
        }
        int required = 1 + pattern.size() * 2;
        if (inv.argCount() != required) {
            return inv.fail("Shape operation '" + inv.name() + "' needs " + required + " arguments, but "
                    + inv.argCount() + " were provided.");
        }
        for (int i = 1; i < inv.argCount(); i += 2) {
            if (!inv.validateType(FLOAT, i) || !inv.checkGreaterEqualThanValue(i, MIN_SPLIT_SIZE)
                    || !inv.validateType(SHAPE_OP_STRING, i + 1)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Cuts the scaled mesh into consecutive slabs along {@code axis}. The last slab takes
     * the remainder unless the sizes fall short of {@code total}. Empty slabs are skipped.
     */
    private static boolean applySplit(Invocation inv, int axis, double total, List<Double> sizes,
                                      List<List<ShapeOp>> ops) {
        if (sizes.isEmpty()) return inv.done();

        Shape shape = inv.shape();
        Mesh rest = shape.mesh().copy();
        rest.transformUnitTrafoAndScale(shape.size());
        Vector3d dir = new Vector3d();
        dir.setComponent(axis, 1.0);

        double distance = 0.0;
        for (int i = 0; i < sizes.size(); i++) {
            distance += sizes.get(i);
            Mesh below;
            if (i < sizes.size() - 1 || distance < total - Mesh.EPSILON) {
                Mesh.Split split = rest.split(new Plane(dir, distance));
                below = split.below;
                rest = split.above;
            } else {
                below = rest;
            }
            if (below.isEmpty()) continue;

            Shape piece = shape.copy();
            piece.setMeshAndAdaptScope(below);
            piece.setIndex(i);
            if (!applyToPiece(inv, piece, ops.get(i))) return false;
        }
        return inv.done();
    }

    private static double component(Vector3d v, int axis) {
        return v.get(axis);
    }

    // -------------------------
    // Face splits
    // -------------------------

    private static void registerFaceSplits(BuiltinRegistry registry) {
        // splitFace(selector, ops, selector, ops, ...): each face goes to the first selector it matches.
        registry.shapeOp("splitFace").variadic()
                .check(inv -> {
                    if (!inv.checkNonEmptyMesh()) return false;
                    if (inv.argCount() == 0) {
                        return inv.fail("Shape operation 'splitFace' cannot be called without arguments.");
                    }
                    if (inv.argCount() % 2 != 0) {
                        return inv.fail("Shape operation 'splitFace' needs an even number of arguments.");
                    }
                    for (int i = 0; i < inv.argCount(); i += 2) {
                        if (!inv.validateType(STRING, i)) return false;
                        if (!FACE_SELECTORS.contains(inv.stringArg(i))) {
                            return inv.fail("Parameter " + (i + 1) + " for shape operation 'splitFace' is not a "
                                    + "valid string selector.");
                        }
                        if (!inv.validateType(SHAPE_OP_STRING, i + 1)) return false;
                    }
                    return true;
                })
                .run(inv -> {
                    Shape shape = inv.shape();
                    Mesh tmp = scaledCopy(shape);
                    Set<Integer> used = new HashSet<>();
                    int index = 0;
                    for (int i = 0; i < inv.argCount(); i += 2) {
                        String selector = inv.stringArg(i);
                        for (int f = 0; f < tmp.faceCount(); f++) {
                            if (used.contains(f)) continue;
                            Vector3d normal = tmp.faceNormal(f);
                            if (!matches(selector, normal)) continue;
                            used.add(f);
                            if (!applyToFace(inv, shape, tmp, f, normal, index++, inv.opsArg(i + 1))) return false;
                        }
                    }
                    return inv.done();
                });

        // splitFaceAlongDir(dx, dy, dz, maxAngle, ops)
        registry.shapeOp("splitFaceAlongDir").args(FLOAT, FLOAT, FLOAT, FLOAT, SHAPE_OP_STRING)
                .check(inv -> inv.checkNonEmptyMesh() && inv.checkDirectionVector(0)
                        && inv.checkRange(3, 0.0, 180.0))
                .run(inv -> {
                    Shape shape = inv.shape();
                    Vector3d dir = inv.vecArg(0).normalize();
                    double minCos = Math.cos(Math.toRadians(inv.floatArg(3))) - Mesh.EPSILON;
                    Mesh tmp = scaledCopy(shape);
                    int index = 0;
                    for (int f = 0; f < tmp.faceCount(); f++) {
                        Vector3d normal = tmp.faceNormal(f);
                        if (normal.dot(dir) < minCos) continue;
                        if (!applyToFace(inv, shape, tmp, f, normal, index++, inv.opsArg(4))) return false;
                    }
                    return inv.done();
                });

        // splitFaceByIndex(i1, i2, ..., ops)
        registry.shapeOp("splitFaceByIndex").variadic()
                .check(inv -> {
                    if (!inv.checkNonEmptyMesh()) return false;
                    if (inv.argCount() < 2) {
                        return inv.fail("Shape operation 'splitFaceByIndex' requires at least 2 arguments.");
                    }
                    int faces = inv.shape().mesh().faceCount();
                    for (int i = 0; i < inv.argCount() - 1; i++) {
                        if (!inv.validateType(INT, i)) return false;
                        if (inv.intArg(i) < 0 || inv.intArg(i) >= faces) {
                            return inv.fail("Parameter " + (i + 1) + " for shape operation 'splitFaceByIndex' must be "
                                    + "non-negative and smaller than the number of faces in the shape's mesh.");
                        }
                    }
                    return inv.validateType(SHAPE_OP_STRING, inv.argCount() - 1);
                })
                .run(inv -> {
                    Shape shape = inv.shape();
                    Mesh tmp = scaledCopy(shape);
                    List<ShapeOp> ops = inv.opsArg(inv.argCount() - 1);
                    for (int i = 0; i < inv.argCount() - 1; i++) {
                        int f = inv.intArg(i);
                        if (!applyToFace(inv, shape, tmp, f, tmp.faceNormal(f), i, ops)) return false;
                    }
                    return inv.done();
                });
    }

    /** Classifies a face normal given in scope coordinates. */
    static boolean matches(String selector, Vector3d n) {
        double ax = Math.abs(n.x);
        double ay = Math.abs(n.y);
        double az = Math.abs(n.z);
        switch (selector) {
            case "all": return true;
            case "horizontal": return ay >= COS_HORIZONTAL;
            case "vertical": return ay < COS_VERTICAL;
            case "side": return ay < COS_HORIZONTAL;
            case "left": return n.x < 0.0 && ax >= ay && ax > az;
            case "right": return n.x > 0.0 && ax >= ay && ax > az;
            case "bottom": return n.y < 0.0 && ay >= az && ay > ax;
            case "top": return n.y > 0.0 && ay >= az && ay > ax;
            case "back": return n.z < 0.0 && az >= ax && az > ay;
            case "front": return n.z > 0.0 && az >= ax && az > ay;
            default: return false;
        }
    }

    private static boolean applyToFace(Invocation inv, Shape shape, Mesh mesh, int face, Vector3d normal,
                                       int index, List<ShapeOp> ops) {
        Shape piece = shape.copy();
        piece.setMeshAfterFaceSplit(mesh.faceComponent(face), normal);
        piece.setIndex(index);
        return applyToPiece(inv, piece, ops);
    }

    private static boolean applyToPiece(Invocation inv, Shape piece, List<ShapeOp> ops) {
        inv.stack().push(piece);
        Result<Void> r = inv.apply(ops);
        if (r.failed()) return inv.propagate(r.error());
        inv.stack().pop();
        return true;
    }

    private static Mesh scaledCopy(Shape shape) {
        Mesh tmp = shape.mesh().copy();
        tmp.transformUnitTrafoAndScale(shape.size());
        return tmp;
    }

    // -------------------------
    // Pattern layout
    // -------------------------

    /** Parsed split pattern: per element whether it is fixed and whether it is outside the repeat group. */
    static final class SplitPattern {
        final List<Boolean> fixed = new ArrayList<>();
        final List<Boolean> outer = new ArrayList<>();
        final List<int[]> repeats = new ArrayList<>();

        int size() {
            return fixed.size();
        }

        /** Null when the pattern is empty or malformed. */
        static SplitPattern parse(String pattern) {
            if (pattern.isEmpty()) return null;
            SplitPattern p = new SplitPattern();
            boolean isOuter = true;
            for (int i = 0; i < pattern.length(); i++) {
                char c = pattern.charAt(i);
                switch (c) {
                    case '(':
                        if (!isOuter) return null;
                        isOuter = false;
                        p.repeats.add(new int[] {p.fixed.size(), p.fixed.size()});
                        break;
                    case ')':
                        if (isOuter) return null;
                        isOuter = true;
                        p.repeats.get(p.repeats.size() - 1)[1] = p.fixed.size();
                        break;
                    case 'f':
                    case 's':
                        p.fixed.add(c == 'f');
                        p.outer.add(isOuter);
                        break;
                    default:
                        return null;
                }
            }
            return isOuter ? p : null;
        }

        /**
         * Scales the stretchable sizes in place and returns the element indices in split
         * order, with each repeat group expanded.
         */
        List<Integer> layout(List<Double> sizes, double total) {
            double outerFixed = 0.0;
            double outerStretch = 0.0;
            int numOuterStretch = 0;
            double innerFixed = 0.0;
            double innerStretch = 0.0;
            int numInnerStretch = 0;
            for (int i = 0; i < sizes.size(); i++) {
                double s = sizes.get(i);
                if (outer.get(i)) {
                    if (fixed.get(i)) {
                        outerFixed += s;
                    } else {
                        outerStretch += s;
                        numOuterStretch++;
                    }
                } else if (fixed.get(i)) {
                    innerFixed += s;
                } else {
                    innerStretch += s;
                    numInnerStretch++;
                }
            }

            double outerSum = outerFixed + outerStretch;
            double innerSum = innerFixed + innerStretch;
            int reps = 0;
            if (outerSum < total - Mesh.EPSILON && innerSum > 0.0) {
                int ideal = (int) Math.round((total - outerSum) / innerSum);
                int max = innerFixed > 0.0 ? (int) ((total - outerFixed) / innerFixed) : Integer.MAX_VALUE;
                reps = Math.min(ideal, max);
                // A single stretched repetition can still fill the scope when the outer part cannot stretch.
                if (ideal == 0 && max > 0 && numOuterStretch == 0 && numInnerStretch != 0
                        && total - outerFixed >= innerFixed - Mesh.EPSILON) {
                    reps = 1;
                }
            }

            double available = total - outerFixed - reps * innerFixed;
            double required = outerStretch + reps * innerStretch;
            double factor = available / required;
            for (int i = 0; i < sizes.size(); i++) {
                if (!fixed.get(i)) sizes.set(i, sizes.get(i) * factor);
            }

            List<Integer> order = new ArrayList<>();
            double sum = 0.0;
            int repIdx = 0;
            int i = 0;
            while (i < sizes.size()) {
                if (repIdx < repeats.size() && i == repeats.get(repIdx)[0]) {
                    int count = repeats.get(repIdx)[1] - i;
                    for (int r = 0; r < reps; r++) {
                        for (int k = 0; k < count; k++) {
                            order.add(i + k);
                            sum += sizes.get(i + k);
                        }
                    }
                    i += count;
                    repIdx++;
                    continue;
                }
                if (sum + sizes.get(i) >= total + Mesh.EPSILON) break;
                order.add(i);
                sum += sizes.get(i);
                i++;
            }
            return order;
        }
    }
}
