package com.shapeml.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.joml.Matrix3d;
import org.joml.Matrix4d;
import org.joml.Vector2d;
import org.joml.Vector3d;

/**
 * Polygon mesh with one normal per face and optional per face-vertex normals and
 * texture coordinates.
 *
 * Faces do not share vertex storage; adjacency is recovered by comparing positions
 * where an algorithm needs it. A mesh handed to a shape is treated as immutable:
 * every geometry-changing operation works on a {@link #copy()}.
 */
public final class Mesh {

    /** Geometric tolerance used by every mesh algorithm. */
    public static final double EPSILON = 1e-7;

    static final class Face {
        final List<Vector3d> positions;
        final Vector3d normal;
        /** Per face-vertex normals, null when the mesh has none. */
        final List<Vector3d> normals;
        /** Per face-vertex uvs, null when the mesh has none. */
        final List<Vector2d> uvs;

        Face(List<Vector3d> positions, Vector3d normal, List<Vector3d> normals, List<Vector2d> uvs) {
            this.positions = positions;
            this.normal = normal;
            this.normals = normals;
            this.uvs = uvs;
        }

        int size() { return positions.size(); }

        Face copy() {
            return new Face(copyVec3(positions), new Vector3d(normal),
                    normals == null ? null : copyVec3(normals),
                    uvs == null ? null : copyVec2(uvs));
        }

        Face reversed(boolean flipNormals) {
            List<Vector3d> p = copyVec3(positions);
            Collections.reverse(p);
            List<Vector3d> n = null;
            if (normals != null) {
                n = copyVec3(normals);
                Collections.reverse(n);
                if (flipNormals) n.forEach(Vector3d::negate);
            }
            List<Vector2d> t = null;
            if (uvs != null) {
                t = copyVec2(uvs);
                Collections.reverse(t);
            }
            Vector3d fn = new Vector3d(normal);
            if (flipNormals) fn.negate();
            return new Face(p, fn, n, t);
        }
    }

    /** Scale and translation that map the mesh bounding box onto a box of a given size at the origin. */
    public static final class UnitTrafo {
        public final Vector3d translation;
        public final Vector3d scale;

        UnitTrafo(Vector3d translation, Vector3d scale) {
            this.translation = translation;
            this.scale = scale;
        }
    }

    /** Result of {@link #split(Plane)}. Either side may be empty. */
    public static final class Split {
        public final Mesh below;
        public final Mesh above;

        Split(Mesh below, Mesh above) {
            this.below = below;
            this.above = above;
        }
    }

    private final List<Face> faces = new ArrayList<>();
    private boolean hasVertexNormals;
    private boolean hasUvs;
    private String name = "";
    private Aabb aabb;

    public Mesh() {}

    Mesh(boolean hasVertexNormals, boolean hasUvs) {
        this.hasVertexNormals = hasVertexNormals;
        this.hasUvs = hasUvs;
    }

    // -------------------------
    // Construction
    // -------------------------

    /** A mesh made of one polygon. {@code uvs} may be null. */
    public static Mesh fromPolygon(List<Vector3d> polygon, List<Vector2d> uvs) {
        Mesh mesh = new Mesh(false, uvs != null);
        mesh.addFace(copyVec3(polygon), null, null, uvs == null ? null : copyVec2(uvs));
        return mesh;
    }

    /**
     * Builds a mesh from shared vertex arrays. Normal and uv arrays with their index
     * lists are optional (pass null) but must come in pairs.
     */
    public static Mesh fromIndexed(List<Vector3d> vertices, List<int[]> indices,
                                   List<Vector3d> normals, List<int[]> normalIndices,
                                   List<Vector2d> uvs, List<int[]> uvIndices) {
        boolean withNormals = normals != null && normalIndices != null;
        boolean withUvs = uvs != null && uvIndices != null;
        Mesh mesh = new Mesh(withNormals, withUvs);
        for (int f = 0; f < indices.size(); f++) {
            int[] idx = indices.get(f);
            List<Vector3d> p = new ArrayList<>(idx.length);
            for (int i : idx) p.add(new Vector3d(vertices.get(i)));

            List<Vector3d> n = null;
            if (withNormals) {
                n = new ArrayList<>(idx.length);
                for (int i : normalIndices.get(f)) n.add(new Vector3d(normals.get(i)).normalize());
            }
            List<Vector2d> t = null;
            if (withUvs) {
                t = new ArrayList<>(idx.length);
                for (int i : uvIndices.get(f)) t.add(new Vector2d(uvs.get(i)));
            }
            mesh.addFace(p, null, n, t);
        }
        return mesh;
    }

    /** Adds a face; a null {@code normal} is computed from the polygon. */
    void addFace(List<Vector3d> positions, Vector3d normal, List<Vector3d> normals, List<Vector2d> uvs) {
        if (positions.size() < 3) return;
        Vector3d n = normal != null ? new Vector3d(normal) : newellNormal(positions);
        List<Vector3d> fvNormals = null;
        if (hasVertexNormals) {
            fvNormals = normals != null ? normals : filled(n, positions.size());
        }
        List<Vector2d> fvUvs = null;
        if (hasUvs) {
            fvUvs = uvs != null ? uvs : filled(new Vector2d(), positions.size());
        }
        faces.add(new Face(positions, n, fvNormals, fvUvs));
        aabb = null;
    }

    public Mesh copy() {
        Mesh m = new Mesh(hasVertexNormals, hasUvs);
        for (Face f : faces) m.faces.add(f.copy());
        m.name = name;
        return m;
    }

    // -------------------------
    // Queries
    // -------------------------

    public int faceCount() { return faces.size(); }
    public boolean isEmpty() { return faces.isEmpty(); }
    public boolean hasUvs() { return hasUvs; }
    public boolean hasVertexNormals() { return hasVertexNormals; }

    /** Source of the mesh, e.g. the file it was loaded from. */
    public String name() { return name; }
    public void setName(String name) { this.name = name == null ? "" : name; }

    public List<Vector3d> facePositions(int face) {
        return Collections.unmodifiableList(faces.get(face).positions);
    }

    public Vector3d faceNormal(int face) {
        return new Vector3d(faces.get(face).normal);
    }

    /** Face-vertex uvs of a face or null. */
    public List<Vector2d> faceUvs(int face) {
        List<Vector2d> uvs = faces.get(face).uvs;
        return uvs == null ? null : Collections.unmodifiableList(uvs);
    }

    public List<Vector3d> faceVertexNormals(int face) {
        List<Vector3d> n = faces.get(face).normals;
        return n == null ? null : Collections.unmodifiableList(n);
    }

    public int vertexCount() {
        int count = 0;
        for (Face f : faces) count += f.size();
        return count;
    }

    public Aabb aabb() {
        if (aabb == null) {
            List<Vector3d> all = new ArrayList<>();
            for (Face f : faces) all.addAll(f.positions);
            aabb = Aabb.of(all);
        }
        return aabb;
    }

    /** Area of a face, half the length of its Newell vector. */
    public double faceArea(int face) {
        return 0.5 * newellVector(faces.get(face).positions).length();
    }

    public double area() {
        double sum = 0.0;
        for (int i = 0; i < faces.size(); i++) sum += faceArea(i);
        return sum;
    }

    /** A new mesh holding only the given face. */
    public Mesh faceComponent(int face) {
        Mesh m = new Mesh(hasVertexNormals, hasUvs);
        m.faces.add(faces.get(face).copy());
        m.name = name;
        return m;
    }

    // -------------------------
    // Unit transform
    // -------------------------

    /** Per-axis factor that scales the bounding box to unit size, 0 along flat axes. */
    public Vector3d unitTrafoScale() {
        Vector3d size = new Vector3d(aabb().extent).mul(2.0);
        return new Vector3d(
                size.x < EPSILON ? 0.0 : 1.0 / size.x,
                size.y < EPSILON ? 0.0 : 1.0 / size.y,
                size.z < EPSILON ? 0.0 : 1.0 / size.z);
    }

    /** Translation moving the bounding box minimum to the origin. */
    public Vector3d unitTrafoTranslation() {
        return aabb().min().negate();
    }

    public UnitTrafo scaledUnitTrafo(Vector3d scale) {
        Vector3d combined = new Vector3d(scale).mul(unitTrafoScale());
        Vector3d translation = new Vector3d(combined).mul(unitTrafoTranslation());
        return new UnitTrafo(translation, combined);
    }

    /** Applies {@code p' = trafo * (scale . p)} to positions and the matching transform to normals. */
    public void transform(Matrix4d trafo, Vector3d scale) {
        Matrix3d normalMatrix = trafo.get3x3(new Matrix3d()).mul(normalMatrixFromScale(scale));
        for (Face f : faces) {
            for (Vector3d p : f.positions) {
                p.mul(scale);
                trafo.transformPosition(p);
            }
            transformNormal(normalMatrix, f.normal);
            if (f.normals != null) {
                for (Vector3d n : f.normals) transformNormal(normalMatrix, n);
            }
        }
        aabb = null;
    }

    /** Moves and scales the mesh so that its bounding box becomes {@code [0, size]}. */
    public void transformUnitTrafoAndScale(Vector3d size) {
        UnitTrafo t = scaledUnitTrafo(size);
        transform(new Matrix4d().translation(t.translation), t.scale);
    }

    private static Matrix3d normalMatrixFromScale(Vector3d s) {
        if (s.x != 0.0 && s.y != 0.0 && s.z != 0.0) {
            return new Matrix3d().scaling(1.0 / s.x, 1.0 / s.y, 1.0 / s.z);
        }
        return new Matrix3d().scaling(s.x == 0.0 ? 1.0 : 0.0, s.y == 0.0 ? 1.0 : 0.0, s.z == 0.0 ? 1.0 : 0.0);
    }

    private static void transformNormal(Matrix3d m, Vector3d n) {
        m.transform(n);
        double len = n.length();
        if (len > 0.0) n.div(len);
    }

    // -------------------------
    // Texture coordinates
    // -------------------------

    /** Assigns uvs from the xy coordinates of the unit-box positions mapped by {@code texTrafo}. */
    public void texProjectUVInUnitXY(Matrix4d texTrafo) {
        Vector3d trans = unitTrafoTranslation();
        Vector3d scale = unitTrafoScale();
        hasUvs = true;
        for (int i = 0; i < faces.size(); i++) {
            Face f = faces.get(i);
            List<Vector2d> uvs = new ArrayList<>(f.size());
            for (Vector3d p : f.positions) {
                Vector3d local = new Vector3d(p).add(trans).mul(scale);
                texTrafo.transformPosition(local);
                uvs.add(new Vector2d(local.x, local.y));
            }
            faces.set(i, new Face(f.positions, f.normal, f.normals, uvs));
        }
    }

    /** {@code uv' = scale . uv + translation}. */
    public void texTransformUV(double scaleU, double scaleV, double translateU, double translateV) {
        if (!hasUvs) throw new IllegalStateException("Mesh has no uv coordinates");
        for (Face f : faces) {
            for (Vector2d uv : f.uvs) {
                uv.set(uv.x * scaleU + translateU, uv.y * scaleV + translateV);
            }
        }
    }

    // -------------------------
    // Normals and winding
    // -------------------------

    public void flipWinding(boolean flipNormals) {
        for (int i = 0; i < faces.size(); i++) {
            faces.set(i, faces.get(i).reversed(flipNormals));
        }
    }

    public void removeFaceVertexNormals() {
        hasVertexNormals = false;
        for (int i = 0; i < faces.size(); i++) {
            Face f = faces.get(i);
            faces.set(i, new Face(f.positions, f.normal, null, f.uvs));
        }
    }

    /** Smooth normals: area-weighted average of the normals of all faces sharing a position. */
    public void computeFaceVertexNormals() {
        Map<PointKey, Vector3d> sums = new HashMap<>();
        for (int i = 0; i < faces.size(); i++) {
            Face f = faces.get(i);
            double area = faceArea(i);
            for (Vector3d p : f.positions) {
                sums.computeIfAbsent(new PointKey(p), k -> new Vector3d())
                        .fma(area, f.normal);
            }
        }
        hasVertexNormals = true;
        for (int i = 0; i < faces.size(); i++) {
            Face f = faces.get(i);
            List<Vector3d> normals = new ArrayList<>(f.size());
            for (Vector3d p : f.positions) {
                Vector3d n = new Vector3d(sums.get(new PointKey(p)));
                double len = n.length();
                normals.add(len > 0.0 ? n.div(len) : new Vector3d(f.normal));
            }
            faces.set(i, new Face(f.positions, f.normal, normals, f.uvs));
        }
    }

    private void recomputeFaceNormals() {
        for (int i = 0; i < faces.size(); i++) {
            Face f = faces.get(i);
            faces.set(i, new Face(f.positions, newellNormal(f.positions), f.normals, f.uvs));
        }
    }

    // -------------------------
    // Extrusion and roofs
    // -------------------------

    public boolean extrudeAlongNormal(double length) {
        if (faces.size() != 1) return false;
        return extrudeAlongDirection(faces.get(0).normal, length);
    }

    /**
     * Extrudes the single face of the mesh into a prism. Faces are ordered top, bottom,
     * then sides. Fails when the mesh has more than one face or the direction is not
     * in the front half space of the face.
     */
    public boolean extrudeAlongDirection(Vector3d direction, double length) {
        if (faces.size() != 1) return false;
        Face orig = faces.get(0);
        Vector3d dir = new Vector3d(direction).normalize();
        if (orig.normal.dot(dir) < EPSILON) return false;

        Vector3d offset = new Vector3d(dir).mul(length);
        List<Vector3d> bottom = orig.positions;
        List<Vector3d> top = new ArrayList<>(bottom.size());
        for (Vector3d p : bottom) top.add(new Vector3d(p).add(offset));

        faces.clear();
        hasVertexNormals = false;
        hasUvs = false;

        addFace(top, orig.normal, null, null);
        List<Vector3d> reversed = copyVec3(bottom);
        Collections.reverse(reversed);
        addFace(reversed, new Vector3d(orig.normal).negate(), null, null);

        int n = bottom.size();
        for (int i = 0; i < n; i++) {
            int next = (i + 1) % n;
            List<Vector3d> side = new ArrayList<>(4);
            side.add(new Vector3d(bottom.get(i)));
            side.add(new Vector3d(bottom.get(next)));
            side.add(new Vector3d(top.get(next)));
            side.add(new Vector3d(top.get(i)));
            addFace(side, null, null, null);
        }
        return true;
    }

    /**
     * Pyramid over the single face with its apex {@code height} above the vertex average.
     * With an overhang the eave vertices slide down the roof planes until they sit
     * {@code overhang} below the footprint, and the bottom face is dropped.
     */
    public void extrudeRoofPyramid(double height, double overhang) {
        if (faces.size() != 1) throw new IllegalStateException("Pyramid roofs need a single face mesh");
        Face orig = faces.get(0);
        Vector3d center = new Vector3d();
        for (Vector3d p : orig.positions) center.add(p);
        center.div(orig.size()).fma(height, orig.normal);

        List<Vector3d> bottom = copyVec3(orig.positions);
        Vector3d bottomNormal = new Vector3d(orig.normal).negate();
        if (overhang > 0.0) {
            for (Vector3d pos : bottom) {
                Vector3d dir = new Vector3d(pos).sub(center).normalize();
                double dot = dir.dot(bottomNormal);
                pos.fma(overhang / dot, dir);
            }
        }

        faces.clear();
        hasVertexNormals = false;
        hasUvs = false;

        if (overhang <= 0.0) {
            List<Vector3d> reversed = copyVec3(bottom);
            Collections.reverse(reversed);
            addFace(reversed, bottomNormal, null, null);
        }
        int n = bottom.size();
        for (int i = 0; i < n; i++) {
            List<Vector3d> tri = new ArrayList<>(3);
            tri.add(new Vector3d(bottom.get(i)));
            tri.add(new Vector3d(bottom.get((i + 1) % n)));
            tri.add(new Vector3d(center));
            addFace(tri, null, null, null);
        }
    }

    /** Shed roof rising along local +x with the given angle in degrees. */
    public void extrudeRoofShed(double angle) {
        if (faces.size() != 1) throw new IllegalStateException("Shed roofs need a single face mesh");
        Face orig = faces.get(0);
        double slope = Math.tan(Math.toRadians(angle));

        List<Vector3d> bottom = orig.positions;
        List<Vector3d> top = new ArrayList<>(bottom.size());
        boolean[] raised = new boolean[bottom.size()];
        for (int i = 0; i < bottom.size(); i++) {
            Vector3d p = bottom.get(i);
            if (p.x > EPSILON) {
                top.add(new Vector3d(p).fma(p.x * slope, orig.normal));
                raised[i] = true;
            } else {
                top.add(new Vector3d(p));
            }
        }

        faces.clear();
        hasVertexNormals = false;
        hasUvs = false;

        List<Vector3d> reversed = copyVec3(bottom);
        Collections.reverse(reversed);
        addFace(reversed, new Vector3d(orig.normal).negate(), null, null);
        addFace(copyVec3(top), null, null, null);

        int n = bottom.size();
        for (int i = 0; i < n; i++) {
            int next = (i + 1) % n;
            List<Vector3d> side = new ArrayList<>(4);
            side.add(new Vector3d(bottom.get(i)));
            side.add(new Vector3d(bottom.get(next)));
            if (raised[next]) side.add(new Vector3d(top.get(next)));
            if (raised[i]) side.add(new Vector3d(top.get(i)));
            if (side.size() > 2) addFace(side, null, null, null);
        }
    }

    /**
     * Hip or gable roof over the single (convex) face. Returns false when the footprint
     * is not convex.
     */
    public boolean extrudeRoofHipOrGable(double angle, double overhangSide, boolean gable, double overhangGable) {
        if (faces.size() != 1) throw new IllegalStateException("Hip and gable roofs need a single face mesh");
        List<List<Vector3d>> roof = RoofBuilder.build(faces.get(0).positions, faces.get(0).normal,
                angle, overhangSide, gable, overhangGable);
        if (roof == null) return false;
        faces.clear();
        hasVertexNormals = false;
        hasUvs = false;
        for (List<Vector3d> polygon : roof) addFace(polygon, null, null, null);
        return true;
    }

    // -------------------------
    // Splitting, mirroring, deformation
    // -------------------------

    /**
     * Cuts the mesh with a plane and closes the cut with cap faces. Faces lying in the
     * plane go below when their normal agrees with the plane normal.
     */
    public Split split(Plane plane) {
        Mesh below = new Mesh(hasVertexNormals, hasUvs);
        Mesh above = new Mesh(hasVertexNormals, hasUvs);
        below.name = name;
        above.name = name;

        for (Face f : faces) {
            int n = f.size();
            double[] d = new double[n];
            int[] side = new int[n];
            boolean anyBelow = false;
            boolean anyAbove = false;
            for (int i = 0; i < n; i++) {
                d[i] = plane.distance(f.positions.get(i));
                side[i] = d[i] < -EPSILON ? -1 : (d[i] > EPSILON ? 1 : 0);
                anyBelow |= side[i] < 0;
                anyAbove |= side[i] > 0;
            }

            if (!anyBelow && !anyAbove) {
                (f.normal.dot(plane.normal) > 0.0 ? below : above).faces.add(f.copy());
                continue;
            }
            if (!anyAbove) {
                below.faces.add(f.copy());
                continue;
            }
            if (!anyBelow) {
                above.faces.add(f.copy());
                continue;
            }

            FaceBuilder lo = new FaceBuilder(f);
            FaceBuilder hi = new FaceBuilder(f);
            for (int i = 0; i < n; i++) {
                int next = (i + 1) % n;
                if (side[i] <= 0) lo.addCorner(i);
                if (side[i] >= 0) hi.addCorner(i);
                if (side[i] * side[next] < 0) {
                    lo.addIntersection(i, next, d[i], d[next]);
                    hi.addIntersection(i, next, d[i], d[next]);
                }
            }
            below.faces.add(lo.build());
            above.faces.add(hi.build());
        }

        below.addCaps(plane, new Vector3d(plane.normal));
        above.addCaps(plane, new Vector3d(plane.normal).negate());
        below.aabb = null;
        above.aabb = null;
        return new Split(below, above);
    }

    /** Collects a polygon while clipping one face, interpolating the face-vertex attributes. */
    private static final class FaceBuilder {
        private final Face src;
        private final List<Vector3d> positions = new ArrayList<>();
        private final List<Vector3d> normals;
        private final List<Vector2d> uvs;

        FaceBuilder(Face src) {
            this.src = src;
            this.normals = src.normals == null ? null : new ArrayList<>();
            this.uvs = src.uvs == null ? null : new ArrayList<>();
        }

        void addCorner(int i) {
            positions.add(new Vector3d(src.positions.get(i)));
            if (normals != null) normals.add(new Vector3d(src.normals.get(i)));
            if (uvs != null) uvs.add(new Vector2d(src.uvs.get(i)));
        }

        /** Interpolates from the lexicographically smaller endpoint so neighbouring faces agree exactly. */
        void addIntersection(int a, int b, double da, double db) {
            if (PointKey.compare(src.positions.get(a), src.positions.get(b)) > 0) {
                int ti = a; a = b; b = ti;
                double td = da; da = db; db = td;
            }
            double t = da / (da - db);
            positions.add(new Vector3d(src.positions.get(a)).lerp(src.positions.get(b), t));
            if (normals != null) {
                normals.add(new Vector3d(src.normals.get(a)).lerp(src.normals.get(b), t).normalize());
            }
            if (uvs != null) {
                Vector2d ua = src.uvs.get(a);
                Vector2d ub = src.uvs.get(b);
                uvs.add(new Vector2d(ua.x + t * (ub.x - ua.x), ua.y + t * (ub.y - ua.y)));
            }
        }

        Face build() {
            return new Face(positions, new Vector3d(src.normal), normals, uvs);
        }
    }

    /**
     * Closes the holes along the plane. Boundary edges lying in the plane are collected,
     * edges used in both directions cancel out, and the remainder is chained into loops.
     */
    private void addCaps(Plane plane, Vector3d capNormal) {
        if (faces.isEmpty()) return;

        Map<EdgeKey, Integer> open = new LinkedHashMap<>();
        Map<PointKey, Vector3d> points = new HashMap<>();
        for (Face f : faces) {
            int n = f.size();
            for (int i = 0; i < n; i++) {
                Vector3d a = f.positions.get(i);
                Vector3d b = f.positions.get((i + 1) % n);
                if (!plane.on(a) || !plane.on(b)) continue;
                PointKey ka = new PointKey(a);
                PointKey kb = new PointKey(b);
                if (ka.equals(kb)) continue;
                points.putIfAbsent(ka, a);
                points.putIfAbsent(kb, b);
                EdgeKey opposite = new EdgeKey(kb, ka);
                Integer count = open.get(opposite);
                if (count != null) {
                    if (count == 1) open.remove(opposite);
                    else open.put(opposite, count - 1);
                } else {
                    open.merge(new EdgeKey(ka, kb), 1, Integer::sum);
                }
            }
        }
        if (open.isEmpty()) return;

        // Cap edges run against the boundary edges.
        Map<PointKey, List<PointKey>> next = new LinkedHashMap<>();
        for (Map.Entry<EdgeKey, Integer> e : open.entrySet()) {
            for (int c = 0; c < e.getValue(); c++) {
                next.computeIfAbsent(e.getKey().to, k -> new ArrayList<>()).add(e.getKey().from);
            }
        }

        Vector3d u = anyPerpendicular(capNormal);
        Vector3d v = new Vector3d(capNormal).cross(u);

        while (!next.isEmpty()) {
            PointKey start = next.keySet().iterator().next();
            List<PointKey> loop = new ArrayList<>();
            PointKey cur = start;
            boolean closed = false;
            while (true) {
                List<PointKey> outs = next.get(cur);
                if (outs == null || outs.isEmpty()) break;
                PointKey to = outs.remove(outs.size() - 1);
                if (outs.isEmpty()) next.remove(cur);
                loop.add(cur);
                cur = to;
                if (cur.equals(start)) {
                    closed = true;
                    break;
                }
            }
            if (!closed || loop.size() < 3) continue;

            List<Vector3d> polygon = new ArrayList<>(loop.size());
            List<Vector2d> uvs = hasUvs ? new ArrayList<>(loop.size()) : null;
            for (PointKey k : loop) {
                Vector3d p = new Vector3d(points.get(k));
                polygon.add(p);
                if (uvs != null) uvs.add(new Vector2d(p.dot(u), p.dot(v)));
            }
            addFace(polygon, capNormal, hasVertexNormals ? filled(capNormal, polygon.size()) : null, uvs);
        }
    }

    /** Reflects the mesh about a plane. */
    public void mirror(Plane plane) {
        for (Face f : faces) {
            for (Vector3d p : f.positions) {
                p.fma(-2.0 * plane.distance(p), plane.normal);
            }
            reflect(f.normal, plane.normal);
            if (f.normals != null) {
                for (Vector3d n : f.normals) reflect(n, plane.normal);
            }
        }
        aabb = null;
        flipWinding(false);
    }

    private static void reflect(Vector3d v, Vector3d axis) {
        v.fma(-2.0 * v.dot(axis), axis);
    }

    /**
     * Free-form deformation with a Bezier volume. Positions must lie in the unit box;
     * {@code cps} holds {@code (l+1)(m+1)(n+1)} control points, x index fastest.
     */
    public void transformFFD(List<Vector3d> cps, int l, int m, int n) {
        if (cps.size() != (l + 1) * (m + 1) * (n + 1)) {
            throw new IllegalArgumentException("Wrong number of control points");
        }
        for (Face f : faces) {
            for (Vector3d p : f.positions) {
                Vector3d out = new Vector3d();
                for (int k = 0; k <= n; k++) {
                    double bk = bernstein(n, k, p.z);
                    for (int j = 0; j <= m; j++) {
                        double bj = bernstein(m, j, p.y);
                        for (int i = 0; i <= l; i++) {
                            double w = bernstein(l, i, p.x) * bj * bk;
                            out.fma(w, cps.get(i + j * (l + 1) + k * (l + 1) * (m + 1)));
                        }
                    }
                }
                p.set(out);
            }
        }
        aabb = null;
        recomputeFaceNormals();
        if (hasVertexNormals) computeFaceVertexNormals();
    }

    private static double bernstein(int degree, int i, double t) {
        double binom = 1.0;
        for (int k = 1; k <= i; k++) binom = binom * (degree - i + k) / k;
        return binom * Math.pow(t, i) * Math.pow(1.0 - t, degree - i);
    }

    // -------------------------
    // Helpers
    // -------------------------

    static Vector3d newellVector(List<Vector3d> polygon) {
        Vector3d n = new Vector3d();
        int size = polygon.size();
        for (int i = 0; i < size; i++) {
            Vector3d a = polygon.get(i);
            Vector3d b = polygon.get((i + 1) % size);
            n.x += (a.y - b.y) * (a.z + b.z);
            n.y += (a.z - b.z) * (a.x + b.x);
            n.z += (a.x - b.x) * (a.y + b.y);
        }
        return n;
    }

    static Vector3d newellNormal(List<Vector3d> polygon) {
        Vector3d n = newellVector(polygon);
        double len = n.length();
        return len > 0.0 ? n.div(len) : n;
    }

    static Vector3d anyPerpendicular(Vector3d n) {
        Vector3d axis = Math.abs(n.x) < 0.9 ? new Vector3d(1, 0, 0) : new Vector3d(0, 1, 0);
        return axis.cross(n).normalize();
    }

    static List<Vector3d> copyVec3(List<Vector3d> src) {
        List<Vector3d> out = new ArrayList<>(src.size());
        for (Vector3d v : src) out.add(new Vector3d(v));
        return out;
    }

    static List<Vector2d> copyVec2(List<Vector2d> src) {
        List<Vector2d> out = new ArrayList<>(src.size());
        for (Vector2d v : src) out.add(new Vector2d(v));
        return out;
    }

    private static List<Vector3d> filled(Vector3d v, int count) {
        List<Vector3d> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) out.add(new Vector3d(v));
        return out;
    }

    private static List<Vector2d> filled(Vector2d v, int count) {
        List<Vector2d> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) out.add(new Vector2d(v));
        return out;
    }

    /** Exact position key; -0.0 and 0.0 compare equal. */
    static final class PointKey {
        final double x;
        final double y;
        final double z;

        PointKey(Vector3d p) {
            this.x = p.x + 0.0;
            this.y = p.y + 0.0;
            this.z = p.z + 0.0;
        }

        static int compare(Vector3d a, Vector3d b) {
            int c = Double.compare(a.x + 0.0, b.x + 0.0);
            if (c != 0) return c;
            c = Double.compare(a.y + 0.0, b.y + 0.0);
            if (c != 0) return c;
            return Double.compare(a.z + 0.0, b.z + 0.0);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PointKey)) return false;
            PointKey k = (PointKey) o;
            return Double.compare(x, k.x) == 0 && Double.compare(y, k.y) == 0 && Double.compare(z, k.z) == 0;
        }

        @Override
        public int hashCode() {
            long h = Double.doubleToLongBits(x);
            h = h * 31 + Double.doubleToLongBits(y);
            h = h * 31 + Double.doubleToLongBits(z);
            return (int) (h ^ (h >>> 32));
        }
    }

    private static final class EdgeKey {
        final PointKey from;
        final PointKey to;

        EdgeKey(PointKey from, PointKey to) {
            this.from = from;
            this.to = to;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof EdgeKey)) return false;
            EdgeKey e = (EdgeKey) o;
            return from.equals(e.from) && to.equals(e.to);
        }

        @Override
        public int hashCode() {
            return from.hashCode() * 31 + to.hashCode();
        }
    }
}
