package com.shapeml.script.plugins;

import static com.shapeml.script.parser.Value.Type.FLOAT;

import org.joml.Matrix3d;
import org.joml.Vector3d;

import com.shapeml.geometry.Mesh;
import com.shapeml.script.eval.BuiltinRegistry;
import com.shapeml.script.eval.Invocation;
import com.shapeml.shape.Shape;

/**
 * TransformOps
 *
 * Shape operations that move, size, scale, rotate and center the scope of the shape
 * on top of the scope stack. Translations are in the scope's own frame; angles are
 * in degrees.
 *
 * Usage:
 *   TransformOps.register(registry);
 *
 * Then in grammars:
 *   rule Tower = { [ translateY(10) scaleCenter(0.8) rotateY(45) Top ] Base };
 */
public final class TransformOps {

    private TransformOps() {}

    public static void register(BuiltinRegistry registry) {
        registerTranslations(registry);
        registerSizeAndScale(registry);
        registerRotations(registry);
        registerAxisTurns(registry);
        registerCentering(registry);
    }

    private static void registerTranslations(BuiltinRegistry registry) {
        registry.shapeOp("translate").args(FLOAT, FLOAT, FLOAT)
                .run(inv -> { inv.shape().translate(inv.vecArg(0)); return inv.done(); });
        registry.shapeOp("translateX").args(FLOAT)
                .run(inv -> { inv.shape().translateX(inv.floatArg(0)); return inv.done(); });
        registry.shapeOp("translateY").args(FLOAT)
                .run(inv -> { inv.shape().translateY(inv.floatArg(0)); return inv.done(); });
        registry.shapeOp("translateZ").args(FLOAT)
                .run(inv -> { inv.shape().translateZ(inv.floatArg(0)); return inv.done(); });

        // Absolute variants: the argument replaces the world-space translation.
        registry.shapeOp("translateAbs").args(FLOAT, FLOAT, FLOAT)
                .run(inv -> {
                    Shape s = inv.shape();
                    s.translate(inv.vecArg(0).sub(s.worldPosition()));
                    return inv.done();
                });
        registry.shapeOp("translateAbsX").args(FLOAT)
                .run(inv -> {
                    Shape s = inv.shape();
                    s.translateX(inv.floatArg(0) - s.worldPosition().x);
                    return inv.done();
                });
        registry.shapeOp("translateAbsY").args(FLOAT)
                .run(inv -> {
                    Shape s = inv.shape();
                    s.translateY(inv.floatArg(0) - s.worldPosition().y);
                    return inv.done();
                });
        registry.shapeOp("translateAbsZ").args(FLOAT)
                .run(inv -> {
                    Shape s = inv.shape();
                    s.translateZ(inv.floatArg(0) - s.worldPosition().z);
                    return inv.done();
                });
    }

    private static void registerSizeAndScale(BuiltinRegistry registry) {
        registry.shapeOp("size").args(FLOAT, FLOAT, FLOAT)
                .check(inv -> inv.checkGreaterEqualThanZero(0) && inv.checkGreaterEqualThanZero(1)
                        && inv.checkGreaterEqualThanZero(2))
                .run(inv -> { inv.shape().setSize(inv.vecArg(0)); return inv.done(); });
        registry.shapeOp("sizeX").args(FLOAT)
                .check(inv -> inv.checkGreaterEqualThanZero(0))
                .run(inv -> { inv.shape().setSizeX(inv.floatArg(0)); return inv.done(); });
        registry.shapeOp("sizeY").args(FLOAT)
                .check(inv -> inv.checkGreaterEqualThanZero(0))
                .run(inv -> { inv.shape().setSizeY(inv.floatArg(0)); return inv.done(); });
        registry.shapeOp("sizeZ").args(FLOAT)
                .check(inv -> inv.checkGreaterEqualThanZero(0))
                .run(inv -> { inv.shape().setSizeZ(inv.floatArg(0)); return inv.done(); });

        registry.shapeOp("scale").variadic()
                .check(TransformOps::checkScaleFactors)
                .run(inv -> { inv.shape().scale(scaleFactors(inv)); return inv.done(); });
        registry.shapeOp("scaleX").args(FLOAT)
                .check(inv -> inv.checkGreaterEqualThanZero(0))
                .run(inv -> { inv.shape().scaleX(inv.floatArg(0)); return inv.done(); });
        registry.shapeOp("scaleY").args(FLOAT)
                .check(inv -> inv.checkGreaterEqualThanZero(0))
                .run(inv -> { inv.shape().scaleY(inv.floatArg(0)); return inv.done(); });
        registry.shapeOp("scaleZ").args(FLOAT)
                .check(inv -> inv.checkGreaterEqualThanZero(0))
                .run(inv -> { inv.shape().scaleZ(inv.floatArg(0)); return inv.done(); });

        // Scaling about the scope center instead of the scope origin.
        registry.shapeOp("scaleCenter").variadic()
                .check(TransformOps::checkScaleFactors)
                .run(inv -> {
                    Shape s = inv.shape();
                    Vector3d factors = scaleFactors(inv);
                    Vector3d shift = new Vector3d(1.0).sub(factors).mul(s.size()).mul(0.5);
                    s.translate(shift);
                    s.scale(factors);
                    return inv.done();
                });
        registry.shapeOp("scaleCenterX").args(FLOAT)
                .check(inv -> inv.checkGreaterEqualThanZero(0))
                .run(inv -> {
                    Shape s = inv.shape();
                    double f = inv.floatArg(0);
                    s.translateX(0.5 * s.sizeX() * (1.0 - f));
                    s.scaleX(f);
                    return inv.done();
                });
        registry.shapeOp("scaleCenterY").args(FLOAT)
                .check(inv -> inv.checkGreaterEqualThanZero(0))
                .run(inv -> {
                    Shape s = inv.shape();
                    double f = inv.floatArg(0);
                    s.translateY(0.5 * s.sizeY() * (1.0 - f));
                    s.scaleY(f);
                    return inv.done();
                });
        registry.shapeOp("scaleCenterZ").args(FLOAT)
                .check(inv -> inv.checkGreaterEqualThanZero(0))
                .run(inv -> {
                    Shape s = inv.shape();
                    double f = inv.floatArg(0);
                    s.translateZ(0.5 * s.sizeZ() * (1.0 - f));
                    s.scaleZ(f);
                    return inv.done();
                });
    }

    private static boolean checkScaleFactors(Invocation inv) {
        if (!inv.checkArgNumber(1, 3)) return false;
        for (int i = 0; i < inv.argCount(); i++) {
            if (!inv.validateType(FLOAT, i) || !inv.checkGreaterEqualThanZero(i)) return false;
        }
        return true;
    }

    private static Vector3d scaleFactors(Invocation inv) {
        if (inv.argCount() == 3) return inv.vecArg(0);
        return new Vector3d(inv.floatArg(0));
    }

    private static void registerRotations(BuiltinRegistry registry) {
        registry.shapeOp("rotate").args(FLOAT, FLOAT, FLOAT, FLOAT)
                .check(inv -> inv.checkDirectionVector(0))
                .run(inv -> { inv.shape().rotate(inv.vecArg(0), inv.floatArg(3)); return inv.done(); });
        registry.shapeOp("rotateX").args(FLOAT)
                .run(inv -> { inv.shape().rotateX(inv.floatArg(0)); return inv.done(); });
        registry.shapeOp("rotateY").args(FLOAT)
                .run(inv -> { inv.shape().rotateY(inv.floatArg(0)); return inv.done(); });
        registry.shapeOp("rotateZ").args(FLOAT)
                .run(inv -> { inv.shape().rotateZ(inv.floatArg(0)); return inv.done(); });

        // Scope rotations keep the mesh in place and re-fit the scope around it.
        registry.shapeOp("rotateScope").args(FLOAT, FLOAT, FLOAT, FLOAT)
                .check(inv -> inv.checkDirectionVector(0) && inv.checkNonEmptyMesh())
                .run(inv -> { inv.shape().rotateScope(inv.vecArg(0), inv.floatArg(3)); return inv.done(); });
        registry.shapeOp("rotateScopeX").args(FLOAT)
                .check(Invocation::checkNonEmptyMesh)
                .run(inv -> { inv.shape().rotateScope(new Vector3d(1, 0, 0), inv.floatArg(0)); return inv.done(); });
        registry.shapeOp("rotateScopeY").args(FLOAT)
                .check(Invocation::checkNonEmptyMesh)
                .run(inv -> { inv.shape().rotateScope(new Vector3d(0, 1, 0), inv.floatArg(0)); return inv.done(); });
        registry.shapeOp("rotateScopeZ").args(FLOAT)
                .check(Invocation::checkNonEmptyMesh)
                .run(inv -> { inv.shape().rotateScope(new Vector3d(0, 0, 1), inv.floatArg(0)); return inv.done(); });
        registry.shapeOp("rotateScopeXYToXZ")
                .run(inv -> { inv.shape().rotateScopeXYToXZ(); return inv.done(); });

        // Turtle-style roll: keeps the y-axis and makes the z-axis horizontal.
        registry.shapeOp("rotateZAxisHorizontal").run(inv -> {
            Shape s = inv.shape();
            Vector3d localUp = new Vector3d(0, 1, 0);
            Shape parent = s.parent();
            if (parent != null) parent.worldTrafo().get3x3(new Matrix3d()).getRow(1, localUp);

            Matrix3d rot = s.rotation();
            Vector3d y = rot.getColumn(1, new Vector3d());
            Vector3d newZ = localUp.cross(y, new Vector3d());
            if (newZ.lengthSquared() > Mesh.EPSILON) {
                newZ.normalize();
                rot.setColumn(0, y.cross(newZ, new Vector3d()));
                rot.setColumn(2, newZ);
                s.setRotation(rot);
            }
            return inv.done();
        });

        // Rotates the scope so its y-axis points up in world space.
        registry.shapeOp("rotateHorizontal").run(inv -> {
            Shape s = inv.shape();
            Matrix3d worldRot = s.worldTrafo().get3x3(new Matrix3d());
            Vector3d upLocal = worldRot.transpose(new Matrix3d()).transform(new Vector3d(0, 1, 0));
            double cos = upLocal.y;
            if (cos < 1.0 - Mesh.EPSILON) {
                cos = Math.max(Math.min(cos, 1.0), -1.0);
                Vector3d axis = new Vector3d(0, 1, 0).cross(upLocal);
                s.rotate(axis, Math.toDegrees(Math.acos(cos)));
            }
            return inv.done();
        });
    }

    private static void registerAxisTurns(BuiltinRegistry registry) {
        registry.shapeOp("turnYAxisToVec").args(FLOAT, FLOAT, FLOAT)
                .run(inv -> {
                    Shape s = inv.shape();
                    Vector3d v = toParentFrame(s, inv.vecArg(0));
                    Matrix3d rot = s.rotation();
                    Vector3d newY = rot.getColumn(1, new Vector3d()).add(v).normalize();
                    setFrameFromY(s, rot, newY);
                    return inv.done();
                });

        registry.shapeOp("turnYAxisPerpToVec").args(FLOAT, FLOAT, FLOAT)
                .run(inv -> {
                    Shape s = inv.shape();
                    Vector3d dir = toParentFrame(s, inv.vecArg(0));
                    Matrix3d rot = s.rotation();
                    Vector3d y = rot.getColumn(1, new Vector3d());
                    Vector3d perp = dir.cross(y, new Vector3d()).cross(dir).normalize().mul(dir.length());
                    Vector3d newY = new Vector3d(y).add(perp).normalize();
                    setFrameFromY(s, rot, newY);
                    return inv.done();
                });

        registry.shapeOp("turnZAxisToVec").args(FLOAT, FLOAT, FLOAT)
                .run(inv -> {
                    Shape s = inv.shape();
                    Vector3d dir = toParentFrame(s, inv.vecArg(0));
                    Matrix3d rot = s.rotation();
                    Vector3d newZ = rot.getColumn(2, new Vector3d());
                    if (newZ.dot(dir) > 0.0) newZ.add(dir); else newZ.sub(dir);
                    newZ.normalize();
                    Vector3d normal = rot.getColumn(0, new Vector3d()).cross(newZ);
                    Vector3d x = newZ.cross(normal, new Vector3d()).normalize();
                    rot.setColumn(0, x);
                    rot.setColumn(1, newZ.cross(x, new Vector3d()).negate());
                    rot.setColumn(2, newZ);
                    s.setRotation(rot);
                    return inv.done();
                });
    }

    /** Expresses a world-space direction in the frame the shape's rotation is relative to. */
    private static Vector3d toParentFrame(Shape s, Vector3d v) {
        Shape parent = s.parent();
        if (parent == null) return v;
        return parent.worldTrafo().get3x3(new Matrix3d()).transpose().transform(v);
    }

    private static void setFrameFromY(Shape s, Matrix3d rot, Vector3d newY) {
        Vector3d normal = rot.getColumn(0, new Vector3d()).cross(newY);
        Vector3d x = newY.cross(normal, new Vector3d()).normalize();
        rot.setColumn(0, x);
        rot.setColumn(1, newY);
        rot.setColumn(2, newY.cross(x, new Vector3d()).negate());
        s.setRotation(rot);
    }

    private static void registerCentering(BuiltinRegistry registry) {
        center(registry, "center", true, true, true);
        center(registry, "centerX", true, false, false);
        center(registry, "centerY", false, true, false);
        center(registry, "centerZ", false, false, true);

        registry.shapeOp("centerAtOrigin").run(inv -> {
            Shape s = inv.shape();
            s.translate(s.size().mul(-0.5));
            return inv.done();
        });
        registry.shapeOp("centerAtOriginX").run(inv -> { inv.shape().translateX(-0.5 * inv.shape().sizeX()); return inv.done(); });
        registry.shapeOp("centerAtOriginY").run(inv -> { inv.shape().translateY(-0.5 * inv.shape().sizeY()); return inv.done(); });
        registry.shapeOp("centerAtOriginZ").run(inv -> { inv.shape().translateZ(-0.5 * inv.shape().sizeZ()); return inv.done(); });
    }

    /** Centers in the shape below on the stack, or in the parent when the stack has one entry. */
    private static void center(BuiltinRegistry registry, String name, boolean x, boolean y, boolean z) {
        registry.shapeOp(name).run(inv -> {
            Shape reference = inv.stack().topMinusN(1);
            if (reference == null) reference = inv.shape().parent();
            if (reference == null) {
                return inv.fail("Shape operation '" + name + "' cannot be evaluated because the current shape "
                        + "has no reference or parent shape.");
            }
            inv.shape().centerInOtherShape(reference, x, y, z);
            return inv.done();
        });
    }
}
