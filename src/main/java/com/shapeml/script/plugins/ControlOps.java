package com.shapeml.script.plugins;

import static com.shapeml.script.parser.Value.Type.INT;
import static com.shapeml.script.parser.Value.Type.SHAPE_OP_STRING;
import static com.shapeml.script.parser.Value.Type.STRING;

import java.util.List;

import com.shapeml.geometry.Octree;
import com.shapeml.script.eval.BuiltinRegistry;
import com.shapeml.script.eval.Invocation;
import com.shapeml.script.interpreter.Result;
import com.shapeml.script.interpreter.ShapeStack;
import com.shapeml.script.parser.ShapeOp;
import com.shapeml.shape.OcclusionShape;
import com.shapeml.shape.Shape;

/**
 * ControlOps
 *
 * Scope stack manipulation, repetition, custom attributes, visibility, output and
 * occluder registration.
 *
 * Usage:
 *   ControlOps.register(registry);
 *
 * Then in grammars:
 *   rule Floor = { repeat(4, { translateX(index * 3) Window }) set("kind", "floor") };
 *   rule Debug = { printLn("size: " + size_x) hide Debug_ };
 */
public final class ControlOps {

    private static final int MAX_REPETITIONS = 100000;

    private ControlOps() {}

    public static void register(BuiltinRegistry registry) {

        registry.shapeOp("print").args(STRING)
                .run(inv -> {
                    inv.interpreter().out().print(inv.stringArg(0));
                    return inv.done();
                });

        registry.shapeOp("printLn").args(STRING)
                .run(inv -> {
                    inv.interpreter().out().print(inv.stringArg(0) + '\n');
                    return inv.done();
                });

        // Occluders are registered with their scope's oriented box.
        registry.shapeOp("octreeAdd")
                .check(Invocation::checkNonEmptyMesh)
                .run(inv -> {
                    Octree<OcclusionShape> octree = inv.interpreter().octree();
                    if (octree != null) {
                        OcclusionShape occ = new OcclusionShape(inv.shape());
                        octree.insert(occ.aabb(), occ);
                    }
                    return inv.done();
                });

        registry.shapeOp("[")
                .run(inv -> {
                    inv.stack().push(inv.shape().copy());
                    return inv.done();
                });

        registry.shapeOp("]")
                .check(inv -> inv.stack().size() <= inv.frame().stackStartSize()
                        ? inv.fail("There are more pops ']' than pushes '[' in a shape operation string.")
                        : true)
                .run(inv -> {
                    inv.stack().pop();
                    return inv.done();
                });

        // set(name, value): value may be of any type.
        registry.shapeOp("set").variadic()
                .check(inv -> {
                    if (inv.argCount() != 2) {
                        return inv.fail("Shape operation 'set' takes 2 arguments but " + inv.argCount()
                                + " were provided.");
                    }
                    if (!inv.validateType(STRING, 0)) return false;
                    if (!ShapeAttributes.isValidCustomAttributeName(inv.stringArg(0))) {
                        return inv.fail("Parameter 1 for shape operation 'set' is not a valid name for a custom "
                                + "shape attribute. (Provided name: " + inv.arg(0) + ".)");
                    }
                    return true;
                })
                .run(inv -> {
                    inv.shape().setCustomAttribute(inv.stringArg(0), inv.arg(1));
                    return inv.done();
                });

        registry.shapeOp("hide")
                .run(inv -> {
                    inv.shape().setVisible(false);
                    return inv.done();
                });

        registry.shapeOp("show")
                .run(inv -> {
                    inv.shape().setVisible(true);
                    return inv.done();
                });

        // Each iteration works on its own copy of the current shape.
        registry.shapeOp("repeat").args(INT, SHAPE_OP_STRING)
                .check(inv -> inv.checkRange(0, 0, MAX_REPETITIONS))
                .run(inv -> {
                    ShapeStack stack = inv.stack();
                    List<ShapeOp> body = inv.opsArg(1);
                    for (int i = 0; i < inv.intArg(0); i++) {
                        Shape copy = inv.shape().copy();
                        copy.setIndex(i);
                        stack.push(copy);
                        Result<Void> r = inv.apply(body);
                        if (r.failed()) return inv.propagate(r.error());
                        stack.pop();
                    }
                    return inv.done();
                });

        // Iterations share the current shape; its index is restored afterwards.
        registry.shapeOp("repeatNoPush").args(INT, SHAPE_OP_STRING)
                .check(inv -> inv.checkRange(0, 0, MAX_REPETITIONS))
                .run(inv -> {
                    Shape shape = inv.shape();
                    int savedIndex = shape.index();
                    List<ShapeOp> body = inv.opsArg(1);
                    for (int i = 0; i < inv.intArg(0); i++) {
                        inv.shape().setIndex(i);
                        Result<Void> r = inv.apply(body);
                        if (r.failed()) return inv.propagate(r.error());
                    }
                    shape.setIndex(savedIndex);
                    return inv.done();
                });
    }
}
