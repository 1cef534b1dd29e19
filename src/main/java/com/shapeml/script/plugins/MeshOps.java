package com.shapeml.script.plugins;

import static com.shapeml.script.parser.Value.Type.FLOAT;
import static com.shapeml.script.parser.Value.Type.INT;
import static com.shapeml.script.parser.Value.Type.STRING;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import org.joml.Matrix3d;
import org.joml.Vector2d;
import org.joml.Vector3d;

import com.shapeml.geometry.Aabb;
import com.shapeml.geometry.Mesh;
import com.shapeml.geometry.Plane;
import com.shapeml.geometry.Primitives;
import com.shapeml.script.eval.BuiltinRegistry;
import com.shapeml.script.eval.Invocation;
import com.shapeml.shape.Shape;

/**
 * MeshOps
 *
 * Shape operations that create or reshape the mesh of the current shape: procedural
 * primitives, asset meshes, extrusions, roofs, mirroring, normals, trimming, free-form
 * deformation and texture coordinates.
 *
 * Procedural meshes are built once per parameter set and shared through the session's
 * mesh cache under ids starting with '!'.
 *
 * Usage:
 *   MeshOps.register(registry);
 *
 * Then in grammars:
 *   rule Lot = { quad extrude(12) Building };
 *   rule Roof = { roofGable(30, 0.4, 0.2) Roof_ };
 */
public final class MeshOps {

    private static final double SHAPE_THRESHOLD = 0.001;
    private static final double ROOF_ANGLE_MIN = 0.001;
    private static final double ROOF_ANGLE_MAX = 85.0;
    private static final int MAX_RESOLUTION = 256;

    private MeshOps() {}

    public static void register(BuiltinRegistry registry) {
        registerExtrusions(registry);
        registerMeshEdits(registry);
        registerTrimming(registry);
        registerFfd(registry);
        registerTextureCoordinates(registry);
        registerPolygons(registry);
        registerSolids(registry);
        registerRoofs(registry);
    }

    // -------------------------
    // Extrusion
    // -------------------------

    private static void registerExtrusions(BuiltinRegistry registry) {
        // extrude(length) or extrude(dx, dy, dz, length)
        registry.shapeOp("extrude").variadic()
                .check(inv -> {
                    if (!inv.checkArgNumber(1, 4) || !inv.validateTypes(FLOAT, 0)) return false;
                    int lengthIdx = 0;
                    if (inv.argCount() == 4) {
                        if (!inv.checkDirectionVector(0)) return false;
                        lengthIdx = 3;
                    }
                    return inv.checkGreaterThanZero(lengthIdx) && inv.checkNonEmptyMesh()
                            && inv.checkSingleFaceMesh();
                })
                .run(inv -> {
                    Shape shape = inv.shape();
                    Mesh tmp = scaledCopy(shape);
                    if (inv.argCount() == 4) {
                        if (!tmp.extrudeAlongDirection(inv.vecArg(0), inv.floatArg(3))) {
                            return failExtrusionAngle(inv);
                        }
                    } else {
                        tmp.extrudeAlongNormal(inv.floatArg(0));
                    }
                    shape.setMeshAndAdaptScope(tmp);
                    return inv.done();
                });

        // Direction given in world coordinates.
        registry.shapeOp("extrudeWorld").args(FLOAT, FLOAT, FLOAT, FLOAT)
                .check(inv -> inv.checkDirectionVector(0) && inv.checkGreaterThanZero(3)
                        && inv.checkNonEmptyMesh() && inv.checkSingleFaceMesh())
                .run(inv -> {
                    Shape shape = inv.shape();
                    Mesh tmp = scaledCopy(shape);
                    Matrix3d worldLinear = shape.worldTrafo().get3x3(new Matrix3d()).transpose();
                    Vector3d local = worldLinear.transform(inv.vecArg(0));
                    if (!tmp.extrudeAlongDirection(local, inv.floatArg(3))) {
                        return failExtrusionAngle(inv);
                    }
                    shape.setMeshAndAdaptScope(tmp);
                    return inv.done();
                });
    }

    private static boolean failExtrusionAngle(Invocation inv) {
        return inv.fail("In shape operation '" + inv.name() + "', the angle between the direction and the "
                + "face normal must be smaller than 90 degrees.");
    }

    // -------------------------
    // Mirror and normals
    // -------------------------

    private static void registerMeshEdits(BuiltinRegistry registry) {
        editMesh(registry, "mirrorX", m -> m.mirror(new Plane(new Vector3d(1, 0, 0), 0.0)));
        editMesh(registry, "mirrorY", m -> m.mirror(new Plane(new Vector3d(0, 1, 0), 0.0)));
        editMesh(registry, "mirrorZ", m -> m.mirror(new Plane(new Vector3d(0, 0, 1), 0.0)));
        editMesh(registry, "normalsFlip", m -> m.flipWinding(true));
        editMesh(registry, "normalsFlat", Mesh::removeFaceVertexNormals);

        // Smoothing runs on the mesh in scope coordinates.
        registry.shapeOp("normalsSmooth")
                .check(Invocation::checkNonEmptyMesh)
                .run(inv -> {
                    Shape shape = inv.shape();
                    Mesh tmp = scaledCopy(shape);
                    tmp.computeFaceVertexNormals();
                    shape.setMesh(tmp);
                    return inv.done();
                });
    }

    /** Registers an op that edits a copy of the mesh and keeps the scope as it is. */
    private static void editMesh(BuiltinRegistry registry, String name, Consumer<Mesh> edit) {
        registry.shapeOp(name)
                .check(Invocation::checkNonEmptyMesh)
                .run(inv -> {
                    Mesh tmp = inv.shape().mesh().copy();
                    edit.accept(tmp);
                    inv.shape().setMesh(tmp);
                    return inv.done();
                });
    }

    // -------------------------
    // Trimming
    // -------------------------

    private static void registerTrimming(BuiltinRegistry registry) {
        trim(registry, "trim", false);
        trim(registry, "trimLocal", true);

        // trimPlane(nx, ny, nz, dist) or trimPlane(nx, ny, nz, px, py, pz)
        registry.shapeOp("trimPlane").variadic()
                .check(inv -> inv.checkArgNumber(4, 6) && inv.validateTypes(FLOAT, 0)
                        && inv.checkDirectionVector(0))
                .run(inv -> {
                    Vector3d normal = inv.vecArg(0);
                    Plane plane = inv.argCount() == 6
                            ? new Plane(normal, inv.vecArg(3))
                            : new Plane(normal, inv.floatArg(3));
                    inv.shape().addTrimPlane(plane);
                    return inv.done();
                });
    }

    private static void trim(BuiltinRegistry registry, String name, boolean localOnly) {
        registry.shapeOp(name)
                .check(Invocation::checkNonEmptyMesh)
                .run(inv -> {
                    Shape shape = inv.shape();
                    shape.trim(localOnly);
                    if (shape.mesh().isEmpty()) {
                        return inv.fail("Shape operation '" + name + "' leaves an empty mesh behind.");
                    }
                    return inv.done();
                });
    }

    // -------------------------
    // Free-form deformation
    // -------------------------

    private static void registerFfd(BuiltinRegistry registry) {
        registry.shapeOp("ffdReset").args(INT, INT, INT)
                .check(inv -> inv.checkRange(0, 1, 5) && inv.checkRange(1, 1, 5) && inv.checkRange(2, 1, 5))
                .run(inv -> {
                    inv.shape().ffdReset(inv.intArg(0), inv.intArg(1), inv.intArg(2));
                    return inv.done();
                });

        registry.shapeOp("ffdTranslate").args(INT, INT, INT, FLOAT, FLOAT, FLOAT)
                .check(MeshOps::checkControlPoint)
                .run(inv -> translateControlPoint(inv, inv.vecArg(3)));
        registry.shapeOp("ffdTranslateX").args(INT, INT, INT, FLOAT)
                .check(MeshOps::checkControlPoint)
                .run(inv -> translateControlPoint(inv, new Vector3d(inv.floatArg(3), 0, 0)));
        registry.shapeOp("ffdTranslateY").args(INT, INT, INT, FLOAT)
                .check(MeshOps::checkControlPoint)
                .run(inv -> translateControlPoint(inv, new Vector3d(0, inv.floatArg(3), 0)));
        registry.shapeOp("ffdTranslateZ").args(INT, INT, INT, FLOAT)
                .check(MeshOps::checkControlPoint)
                .run(inv -> translateControlPoint(inv, new Vector3d(0, 0, inv.floatArg(3))));

        registry.shapeOp("ffdApply")
                .check(Invocation::checkNonEmptyMesh)
                .run(inv -> {
                    inv.shape().ffdApply();
                    return inv.done();
                });
    }

    private static boolean checkControlPoint(Invocation inv) {
        int[] res = inv.shape().ffdResolution();
        for (int i = 0; i < 3; i++) {
            if (!inv.checkRange(i, 0, res[i])) return false;
        }
        return true;
    }

    private static boolean translateControlPoint(Invocation inv, Vector3d offset) {
        inv.shape().ffdTranslate(inv.intArg(0), inv.intArg(1), inv.intArg(2), offset);
        return inv.done();
    }

    // -------------------------
    // Texture coordinates
    // -------------------------

    private static void registerTextureCoordinates(BuiltinRegistry registry) {
        registry.shapeOp("uvScale").args(FLOAT, FLOAT)
                .check(inv -> inv.checkGreaterThanZero(0) && inv.checkGreaterThanZero(1)
                        && inv.checkNonEmptyMesh() && checkUvs(inv))
                .run(inv -> {
                    Mesh tmp = inv.shape().mesh().copy();
                    tmp.texTransformUV(inv.floatArg(0), inv.floatArg(1), 0.0, 0.0);
                    inv.shape().setMesh(tmp);
                    return inv.done();
                });

        registry.shapeOp("uvTranslate").args(FLOAT, FLOAT)
                .check(inv -> inv.checkNonEmptyMesh() && checkUvs(inv))
                .run(inv -> {
                    Mesh tmp = inv.shape().mesh().copy();
                    tmp.texTransformUV(1.0, 1.0, inv.floatArg(0), inv.floatArg(1));
                    inv.shape().setMesh(tmp);
                    return inv.done();
                });

        // uvSetupProjectionXY(width, height [, uOffset, vOffset])
        registry.shapeOp("uvSetupProjectionXY").variadic()
                .check(inv -> inv.checkArgNumber(2, 4) && inv.validateTypes(FLOAT, 0)
                        && inv.checkGreaterThanZero(0) && inv.checkGreaterThanZero(1))
                .run(inv -> {
                    double u = inv.argCount() == 4 ? inv.floatArg(2) : 0.0;
                    double v = inv.argCount() == 4 ? inv.floatArg(3) : 0.0;
                    inv.shape().textureSetupProjectionInXY(inv.floatArg(0), inv.floatArg(1), u, v);
                    return inv.done();
                });

        registry.shapeOp("uvProject")
                .check(Invocation::checkNonEmptyMesh)
                .run(inv -> inv.shape().textureProjectUV()
                        ? inv.done()
                        : inv.fail("Shape operation 'uvProject' failed because there is no ancestor that "
                                + "has a projection set."));
    }

    private static boolean checkUvs(Invocation inv) {
        if (!inv.shape().mesh().hasUvs()) {
            return inv.fail("Shape operation '" + inv.name() + "' cannot be applied to shape with mesh "
                    + "without UV coordinates.");
        }
        return true;
    }

    // -------------------------
    // Planar meshes
    // -------------------------

    private static void registerPolygons(BuiltinRegistry registry) {
        registry.shapeOp("mesh").args(STRING)
                .run(inv -> {
                    String uri = inv.interpreter().grammar().basePath() + inv.stringArg(0);
                    Mesh mesh = inv.interpreter().meshCache().get(uri);
                    if (mesh == null) {
                        return inv.fail("Shape operation 'mesh' failed to load the file '"
                                + inv.stringArg(0) + "'.");
                    }
                    inv.shape().setMeshIntoScope(mesh);
                    return inv.done();
                });

        registry.shapeOp("quad")
                .run(inv -> cached(inv, "!quad", () -> Primitives.unitSquare().toMesh()));

        registry.shapeOp("circle").args(INT)
                .check(inv -> inv.checkRange(0, 3, MAX_RESOLUTION))
                .run(inv -> cached(inv, "!circle_" + inv.intArg(0),
                        () -> Primitives.unitCircle(inv.intArg(0)).toMesh()));

        // shapeL(backWidth, leftWidth)
        registry.shapeOp("shapeL").args(FLOAT, FLOAT)
                .check(inv -> inv.checkRange(0, SHAPE_THRESHOLD, inv.shape().sizeZ() - SHAPE_THRESHOLD)
                        && inv.checkRange(1, SHAPE_THRESHOLD, inv.shape().sizeX() - SHAPE_THRESHOLD))
                .run(inv -> {
                    Shape s = inv.shape();
                    s.setMeshIntoScope(Primitives.shapeL(s.sizeX(), s.sizeZ(),
                            inv.floatArg(0), inv.floatArg(1)).toMesh());
                    return inv.done();
                });

        // shapeU(backWidth, leftWidth, rightWidth)
        registry.shapeOp("shapeU").args(FLOAT, FLOAT, FLOAT)
                .check(inv -> {
                    double sx = inv.shape().sizeX();
                    if (!inv.checkRange(0, SHAPE_THRESHOLD, inv.shape().sizeZ() - SHAPE_THRESHOLD)
                            || !inv.checkRange(1, SHAPE_THRESHOLD, sx - SHAPE_THRESHOLD)
                            || !inv.checkRange(2, SHAPE_THRESHOLD, sx - SHAPE_THRESHOLD)) {
                        return false;
                    }
                    if (inv.floatArg(1) + inv.floatArg(2) >= sx - SHAPE_THRESHOLD) {
                        return inv.fail("The sum of parameter 2 and 3 of shape operation 'shapeU' needs to be "
                                + "smaller than 'size_x'.");
                    }
                    return true;
                })
                .run(inv -> {
                    Shape s = inv.shape();
                    s.setMeshIntoScope(Primitives.shapeU(s.sizeX(), s.sizeZ(),
                            inv.floatArg(0), inv.floatArg(1), inv.floatArg(2)).toMesh());
                    return inv.done();
                });

        // shapeT(topWidth, verticalWidth, verticalPosition)
        registry.shapeOp("shapeT").args(FLOAT, FLOAT, FLOAT)
                .check(inv -> inv.checkRange(0, SHAPE_THRESHOLD, inv.shape().sizeZ() - SHAPE_THRESHOLD)
                        && inv.checkRange(1, SHAPE_THRESHOLD, inv.shape().sizeX() - SHAPE_THRESHOLD)
                        && inv.checkRange(2, SHAPE_THRESHOLD, 1.0 - SHAPE_THRESHOLD))
                .run(inv -> {
                    Shape s = inv.shape();
                    s.setMeshIntoScope(Primitives.shapeT(s.sizeX(), s.sizeZ(),
                            inv.floatArg(0), inv.floatArg(1), inv.floatArg(2)).toMesh());
                    return inv.done();
                });

        // shapeH(leftWidth, horizontalWidth, rightWidth, horizontalPosition)
        registry.shapeOp("shapeH").args(FLOAT, FLOAT, FLOAT, FLOAT)
                .check(inv -> {
                    double sx = inv.shape().sizeX();
                    if (!inv.checkRange(0, SHAPE_THRESHOLD, sx - SHAPE_THRESHOLD)
                            || !inv.checkRange(1, SHAPE_THRESHOLD, inv.shape().sizeZ() - SHAPE_THRESHOLD)
                            || !inv.checkRange(2, SHAPE_THRESHOLD, sx - SHAPE_THRESHOLD)
                            || !inv.checkRange(3, SHAPE_THRESHOLD, 1.0 - SHAPE_THRESHOLD)) {
                        return false;
                    }
                    if (inv.floatArg(0) + inv.floatArg(2) >= sx - SHAPE_THRESHOLD) {
                        return inv.fail("The sum of parameter 1 and 3 of shape operation 'shapeH' needs to be "
                                + "smaller than 'size_x'.");
                    }
                    return true;
                })
                .run(inv -> {
                    Shape s = inv.shape();
                    s.setMeshIntoScope(Primitives.shapeH(s.sizeX(), s.sizeZ(), inv.floatArg(0),
                            inv.floatArg(1), inv.floatArg(2), inv.floatArg(3)).toMesh());
                    return inv.done();
                });

        // polygon(x1, y1, x2, y2, x3, y3, ...), points given in a 2D xy frame.
        registry.shapeOp("polygon").variadic()
                .check(inv -> {
                    if (inv.argCount() % 2 == 1) {
                        return inv.fail("Shape operation 'polygon' needs an even number of parameters.");
                    }
                    if (inv.argCount() < 6) {
                        return inv.fail("Shape operation 'polygon' needs at least 6 parameters (at least 3 "
                                + "positions).");
                    }
                    return inv.validateTypes(FLOAT, 0);
                })
                .run(inv -> {
                    inv.shape().setMeshIntoScope(polygonMesh(inv));
                    return inv.done();
                });
    }

    private static Mesh polygonMesh(Invocation inv) {
        List<Vector3d> points = new ArrayList<>();
        for (int i = 0; i < inv.argCount(); i += 2) {
            points.add(new Vector3d(inv.floatArg(i), 0.0, inv.floatArg(i + 1)));
        }
        Aabb aabb = Aabb.of(points);
        Vector3d min = aabb.min();

        List<Vector2d> uvs = new ArrayList<>(points.size());
        for (Vector3d p : points) {
            uvs.add(new Vector2d((p.x - min.x) * 0.5 / aabb.extent.x, (p.z - min.z) * 0.5 / aabb.extent.z));
        }
        // The user's y axis maps onto -z, mirrored about the box center.
        for (Vector3d p : points) {
            p.z = 2.0 * aabb.center.z - p.z;
        }
        return Mesh.fromPolygon(points, uvs);
    }

    // -------------------------
    // Solids
    // -------------------------

    private static void registerSolids(BuiltinRegistry registry) {
        registry.shapeOp("grid").args(INT, INT)
                .check(inv -> inv.checkRange(0, 1, MAX_RESOLUTION) && inv.checkRange(1, 1, MAX_RESOLUTION))
                .run(inv -> cached(inv, "!grid_" + inv.intArg(0) + '_' + inv.intArg(1),
                        () -> Primitives.unitGrid(inv.intArg(0), inv.intArg(1))));

        registry.shapeOp("disk").args(INT, INT)
                .check(inv -> inv.checkRange(0, 3, MAX_RESOLUTION) && inv.checkRange(1, 1, MAX_RESOLUTION))
                .run(inv -> cached(inv, "!disk_" + inv.intArg(0) + '_' + inv.intArg(1),
                        () -> Primitives.unitDisk(inv.intArg(0), inv.intArg(1))));

        registry.shapeOp("cube")
                .run(inv -> cached(inv, "!cube", Primitives::unitCube));

        registry.shapeOp("box").args(INT, INT, INT)
                .check(inv -> inv.checkRange(0, 1, MAX_RESOLUTION) && inv.checkRange(1, 1, MAX_RESOLUTION)
                        && inv.checkRange(2, 1, MAX_RESOLUTION))
                .run(inv -> cached(inv, "!box" + suffix(inv, 3),
                        () -> Primitives.unitBox(inv.intArg(0), inv.intArg(1), inv.intArg(2))));

        roundSolid(registry, "cylinder", true,
                inv -> Primitives.unitCylinder(inv.intArg(0), inv.intArg(1), inv.intArg(2), true));
        roundSolid(registry, "cylinderFlat", true,
                inv -> Primitives.unitCylinder(inv.intArg(0), inv.intArg(1), inv.intArg(2), false));
        roundSolid(registry, "cone", true,
                inv -> Primitives.unitCone(inv.intArg(0), inv.intArg(1), inv.intArg(2), true));
        roundSolid(registry, "coneFlat", true,
                inv -> Primitives.unitCone(inv.intArg(0), inv.intArg(1), inv.intArg(2), false));
        roundSolid(registry, "sphere", false,
                inv -> Primitives.unitSphere(inv.intArg(0), inv.intArg(1), true));
        roundSolid(registry, "sphereFlat", false,
                inv -> Primitives.unitSphere(inv.intArg(0), inv.intArg(1), false));

        torus(registry, "torus", true);
        torus(registry, "torusFlat", false);
    }

    /**
     * Cylinders and cones take (nPhi, nY, nRad); spheres take (nPhi, nTheta). The mesh
     * is cached under the op name and its resolution.
     */
    private static void roundSolid(BuiltinRegistry registry, String name, boolean threeArgs,
                                   Function<Invocation, Mesh> factory) {
        BuiltinRegistry.Definition b = threeArgs
                ? registry.shapeOp(name).args(INT, INT, INT)
                : registry.shapeOp(name).args(INT, INT);
        b.check(inv -> inv.checkRange(0, 3, MAX_RESOLUTION)
                        && inv.checkRange(1, threeArgs ? 1 : 2, MAX_RESOLUTION)
                        && (!threeArgs || inv.checkRange(2, 1, MAX_RESOLUTION)))
                .run(inv -> cached(inv, "!" + name + suffix(inv, inv.argCount()), () -> factory.apply(inv)));
    }

    private static void torus(BuiltinRegistry registry, String name, boolean smooth) {
        registry.shapeOp(name).args(FLOAT, FLOAT, INT, INT)
                .check(inv -> {
                    if (!inv.checkGreaterThanZero(1)) return false;
                    if (inv.floatArg(0) < inv.floatArg(1)) {
                        return inv.fail("Parameter 0 for shape operation '" + name + "' needs to be larger "
                                + "than parameter 1.");
                    }
                    return inv.checkRange(2, 3, MAX_RESOLUTION) && inv.checkRange(3, 3, MAX_RESOLUTION);
                })
                .run(inv -> cached(inv, "!" + name + '_' + inv.floatArg(0) + '_' + inv.floatArg(1)
                                + '_' + inv.intArg(2) + '_' + inv.intArg(3),
                        () -> Primitives.torus(inv.floatArg(0), inv.floatArg(1), inv.intArg(2),
                                inv.intArg(3), smooth)));
    }

    private static String suffix(Invocation inv, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) sb.append('_').append(inv.intArg(i));
        return sb.toString();
    }

    private static boolean cached(Invocation inv, String id, Supplier<Mesh> factory) {
        Mesh mesh = inv.interpreter().meshCache().getOrCreate(id, factory);
        inv.shape().setMeshIntoScope(mesh);
        return inv.done();
    }

    // -------------------------
    // Roofs
    // -------------------------

    private static void registerRoofs(BuiltinRegistry registry) {
        // roofHip(angle [, overhang])
        registry.shapeOp("roofHip").variadic()
                .check(inv -> inv.checkArgNumber(1, 2) && inv.validateTypes(FLOAT, 0)
                        && inv.checkRange(0, ROOF_ANGLE_MIN, ROOF_ANGLE_MAX)
                        && (inv.argCount() == 1 || inv.checkGreaterThanZero(1))
                        && inv.checkNonEmptyMesh() && inv.checkSingleFaceMesh())
                .run(inv -> {
                    double overhang = inv.argCount() == 2 ? inv.floatArg(1) : 0.0;
                    return hipOrGable(inv, overhang, false, 0.0);
                });

        // roofGable(angle [, overhangSide, overhangGable])
        registry.shapeOp("roofGable").variadic()
                .check(inv -> inv.checkArgNumber(1, 3) && inv.validateTypes(FLOAT, 0)
                        && inv.checkRange(0, ROOF_ANGLE_MIN, ROOF_ANGLE_MAX)
                        && (inv.argCount() == 1 || inv.checkGreaterThanZero(1) && inv.checkGreaterThanZero(2))
                        && inv.checkNonEmptyMesh() && inv.checkSingleFaceMesh())
                .run(inv -> {
                    boolean overhangs = inv.argCount() == 3;
                    return hipOrGable(inv, overhangs ? inv.floatArg(1) : 0.0, true,
                            overhangs ? inv.floatArg(2) : 0.0);
                });

        // roofPyramid(height [, overhang])
        registry.shapeOp("roofPyramid").variadic()
                .check(inv -> inv.checkArgNumber(1, 2) && inv.validateTypes(FLOAT, 0)
                        && inv.checkGreaterThanZero(0)
                        && (inv.argCount() == 1 || inv.checkGreaterThanZero(1))
                        && inv.checkNonEmptyMesh() && inv.checkSingleFaceMesh())
                .run(inv -> {
                    Shape shape = inv.shape();
                    Mesh tmp = scaledCopy(shape);
                    tmp.extrudeRoofPyramid(inv.floatArg(0), inv.argCount() == 2 ? inv.floatArg(1) : 0.0);
                    shape.setMeshAndAdaptScope(tmp);
                    return inv.done();
                });

        registry.shapeOp("roofShed").args(FLOAT)
                .check(inv -> inv.checkRange(0, ROOF_ANGLE_MIN, ROOF_ANGLE_MAX)
                        && inv.checkNonEmptyMesh() && inv.checkSingleFaceMesh())
                .run(inv -> {
                    Shape shape = inv.shape();
                    Mesh tmp = scaledCopy(shape);
                    tmp.extrudeRoofShed(inv.floatArg(0));
                    shape.setMeshAndAdaptScope(tmp);
                    return inv.done();
                });
    }

    private static boolean hipOrGable(Invocation inv, double overhangSide, boolean gable, double overhangGable) {
        Shape shape = inv.shape();
        Mesh tmp = scaledCopy(shape);
        if (!tmp.extrudeRoofHipOrGable(inv.floatArg(0), overhangSide, gable, overhangGable)) {
            return inv.fail("Shape operation '" + inv.name() + "' is only supported for convex footprints.");
        }
        shape.setMeshAndAdaptScope(tmp);
        return inv.done();
    }

    /** Copy of the shape's mesh in scope coordinates. */
    private static Mesh scaledCopy(Shape shape) {
        Mesh tmp = shape.mesh().copy();
        tmp.transformUnitTrafoAndScale(shape.size());
        return tmp;
    }
}
