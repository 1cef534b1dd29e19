package com.shapeml.geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.joml.Vector2d;
import org.joml.Vector3d;

/**
 * Procedural polygons and meshes.
 *
 * Unit primitives are centered at the origin and fit into the unit box, except the
 * sphere which occupies [0, 1]. Polygons lie in the xz plane facing +y. Round shapes
 * start at angle 1.5 pi and place a half step before each sample so that the first
 * edge is parallel to the x axis.
 */
public final class Primitives {

    private static final double START_ANGLE = 1.5 * Math.PI;

    private Primitives() {}

    /** Polygon with one uv per corner. */
    public static final class Polygon {
        public final List<Vector3d> points;
        public final List<Vector2d> uvs;

        Polygon(List<Vector3d> points, List<Vector2d> uvs) {
            this.points = points;
            this.uvs = uvs;
        }

        public Mesh toMesh() {
            return Mesh.fromPolygon(points, uvs);
        }
    }

    private static double ringAngle(int i, int n) {
        return START_ANGLE + 2.0 * Math.PI * (i - 0.5) / n;
    }

    private static Vector3d onRing(double angle, double radius, double y) {
        return new Vector3d(Math.cos(angle) * radius, y, -Math.sin(angle) * radius);
    }

    private static Vector3d v(double x, double y, double z) { return new Vector3d(x, y, z); }
    private static Vector2d t(double u, double w) { return new Vector2d(u, w); }

    // -------------------------
    // Polygons
    // -------------------------

    public static Polygon unitSquare() {
        return new Polygon(
                Arrays.asList(v(-0.5, 0, 0.5), v(0.5, 0, 0.5), v(0.5, 0, -0.5), v(-0.5, 0, -0.5)),
                Arrays.asList(t(0, 0), t(1, 0), t(1, 1), t(0, 1)));
    }

    public static Polygon unitCircle(int n) {
        List<Vector3d> points = new ArrayList<>(n);
        List<Vector2d> uvs = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Vector3d p = onRing(ringAngle(i, n), 0.5, 0.0);
            points.add(p);
            uvs.add(t(0.5 + p.x, 0.5 - p.z));
        }
        return new Polygon(points, uvs);
    }

    /** L outline within {@code w x h} with a back wing along x and a left wing along z. */
    public static Polygon shapeL(double w, double h, double backWidth, double leftWidth) {
        return new Polygon(
                Arrays.asList(v(0, 0, h), v(leftWidth, 0, h), v(leftWidth, 0, backWidth),
                        v(w, 0, backWidth), v(w, 0, 0), v(0, 0, 0)),
                Arrays.asList(t(0, 0), t(leftWidth / w, 0), t(leftWidth / w, (h - backWidth) / h),
                        t(1, (h - backWidth) / h), t(1, 1), t(0, 1)));
    }

    public static Polygon shapeU(double w, double h, double backWidth, double leftWidth, double rightWidth) {
        double r = w - rightWidth;
        double hb = (h - backWidth) / h;
        return new Polygon(
                Arrays.asList(v(0, 0, h), v(leftWidth, 0, h), v(leftWidth, 0, backWidth),
                        v(r, 0, backWidth), v(r, 0, h), v(w, 0, h), v(w, 0, 0), v(0, 0, 0)),
                Arrays.asList(t(0, 0), t(leftWidth / w, 0), t(leftWidth / w, hb),
                        t(r / w, hb), t(r / w, 0), t(1, 0), t(1, 1), t(0, 1)));
    }

    public static Polygon shapeT(double w, double h, double topWidth, double verticalWidth, double verticalPosition) {
        double w1 = verticalPosition * (w - verticalWidth);
        double w2 = w1 + verticalWidth;
        List<Vector3d> points = Arrays.asList(v(w1, 0, h), v(w2, 0, h), v(w2, 0, topWidth), v(w, 0, topWidth),
                v(w, 0, 0), v(0, 0, 0), v(0, 0, topWidth), v(w1, 0, topWidth));
        return new Polygon(points, planarUvs(points, w, h));
    }

    public static Polygon shapeH(double w, double h, double leftWidth, double horizontalWidth,
                                 double rightWidth, double horizontalPosition) {
        double h1 = horizontalPosition * (h - horizontalWidth);
        double h2 = h1 + horizontalWidth;
        double r = w - rightWidth;
        List<Vector3d> points = Arrays.asList(v(0, 0, h), v(leftWidth, 0, h), v(leftWidth, 0, h2),
                v(r, 0, h2), v(r, 0, h), v(w, 0, h), v(w, 0, 0), v(r, 0, 0), v(r, 0, h1),
                v(leftWidth, 0, h1), v(leftWidth, 0, 0), v(0, 0, 0));
        return new Polygon(points, planarUvs(points, w, h));
    }

    private static List<Vector2d> planarUvs(List<Vector3d> points, double w, double h) {
        List<Vector2d> uvs = new ArrayList<>(points.size());
        for (Vector3d p : points) uvs.add(t(p.x / w, (h - p.z) / h));
        return uvs;
    }

    // -------------------------
    // Meshes
    // -------------------------

    public static Mesh unitGrid(int nx, int nz) {
        Mesh mesh = new Mesh(false, true);
        double sx = 1.0 / nx;
        double sz = 1.0 / nz;
        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < nz; j++) {
                mesh.addFace(
                        Arrays.asList(v(i * sx - 0.5, 0, (j + 1) * sz - 0.5), v((i + 1) * sx - 0.5, 0, (j + 1) * sz - 0.5),
                                v((i + 1) * sx - 0.5, 0, j * sz - 0.5), v(i * sx - 0.5, 0, j * sz - 0.5)),
                        null, null,
                        Arrays.asList(t(i * sx, 1 - (j + 1) * sz), t((i + 1) * sx, 1 - (j + 1) * sz),
                                t((i + 1) * sx, 1 - j * sz), t(i * sx, 1 - j * sz)));
            }
        }
        return mesh;
    }

    public static Mesh unitDisk(int nPhi, int nRad) {
        Mesh mesh = new Mesh(false, true);
        addCap(mesh, nPhi, nRad, 0.0, true, null);
        return mesh;
    }

    /** Adds a disk of radius 0.5 at height {@code y}, split into {@code nRad} rings, facing up or down. */
    private static void addCap(Mesh mesh, int nPhi, int nRad, double y, boolean up, Vector3d normal) {
        for (int k = 0; k < nRad; k++) {
            double rIn = 0.5 * k / nRad;
            double rOut = 0.5 * (k + 1) / nRad;
            for (int i = 0; i < nPhi; i++) {
                double a0 = ringAngle(i, nPhi);
                double a1 = ringAngle(i + 1, nPhi);
                List<Vector3d> face = new ArrayList<>(4);
                face.add(onRing(a0, rOut, y));
                face.add(onRing(a1, rOut, y));
                if (k == 0) {
                    face.add(v(0, y, 0));
                } else {
                    face.add(onRing(a1, rIn, y));
                    face.add(onRing(a0, rIn, y));
                }
                if (!up) {
                    // Same outline, opposite winding.
                    Vector3d first = face.remove(0);
                    face.add(1, first);
                    if (face.size() == 4) {
                        Vector3d third = face.remove(3);
                        face.add(2, third);
                    }
                }
                List<Vector2d> uvs = new ArrayList<>(face.size());
                for (Vector3d p : face) uvs.add(t(0.5 + p.x, up ? 0.5 - p.z : 0.5 + p.z));
                List<Vector3d> normals = null;
                if (normal != null) {
                    normals = new ArrayList<>(face.size());
                    for (int c = 0; c < face.size(); c++) normals.add(new Vector3d(normal));
                }
                mesh.addFace(face, null, normals, uvs);
            }
        }
    }

    public static Mesh unitCube() {
        return unitBox(1, 1, 1);
    }

    /** Box with every side subdivided into a grid. Sides come in the order top, bottom, front, right, back, left. */
    public static Mesh unitBox(int nx, int ny, int nz) {
        Mesh mesh = new Mesh(false, true);
        addGridSide(mesh, v(-0.5, 0.5, 0.5), v(1, 0, 0), nx, v(0, 0, -1), nz);
        addGridSide(mesh, v(-0.5, -0.5, -0.5), v(1, 0, 0), nx, v(0, 0, 1), nz);
        addGridSide(mesh, v(-0.5, -0.5, 0.5), v(1, 0, 0), nx, v(0, 1, 0), ny);
        addGridSide(mesh, v(0.5, -0.5, 0.5), v(0, 0, -1), nz, v(0, 1, 0), ny);
        addGridSide(mesh, v(0.5, -0.5, -0.5), v(-1, 0, 0), nx, v(0, 1, 0), ny);
        addGridSide(mesh, v(-0.5, -0.5, -0.5), v(0, 0, 1), nz, v(0, 1, 0), ny);
        return mesh;
    }

    private static void addGridSide(Mesh mesh, Vector3d origin, Vector3d du, int nu, Vector3d dv, int nv) {
        for (int j = 0; j < nv; j++) {
            for (int i = 0; i < nu; i++) {
                double u0 = (double) i / nu;
                double u1 = (double) (i + 1) / nu;
                double v0 = (double) j / nv;
                double v1 = (double) (j + 1) / nv;
                mesh.addFace(
                        Arrays.asList(gridPoint(origin, du, dv, u0, v0), gridPoint(origin, du, dv, u1, v0),
                                gridPoint(origin, du, dv, u1, v1), gridPoint(origin, du, dv, u0, v1)),
                        null, null,
                        Arrays.asList(t(u0, v0), t(u1, v0), t(u1, v1), t(u0, v1)));
            }
        }
    }

    private static Vector3d gridPoint(Vector3d origin, Vector3d du, Vector3d dv, double s, double w) {
        return new Vector3d(origin).fma(s, du).fma(w, dv);
    }

    public static Mesh unitCylinder(int nPhi, int nY, int nRad, boolean smooth) {
        Mesh mesh = new Mesh(smooth, true);
        addCap(mesh, nPhi, nRad, 0.5, true, smooth ? v(0, 1, 0) : null);
        addCap(mesh, nPhi, nRad, -0.5, false, smooth ? v(0, -1, 0) : null);
        for (int j = 0; j < nY; j++) {
            double y0 = (double) j / nY - 0.5;
            double y1 = (double) (j + 1) / nY - 0.5;
            for (int i = 0; i < nPhi; i++) {
                double a0 = ringAngle(i, nPhi);
                double a1 = ringAngle(i + 1, nPhi);
                List<Vector3d> normals = null;
                if (smooth) {
                    Vector3d n0 = onRing(a0, 1.0, 0.0);
                    Vector3d n1 = onRing(a1, 1.0, 0.0);
                    normals = Arrays.asList(n0, n1, new Vector3d(n1), new Vector3d(n0));
                }
                mesh.addFace(
                        Arrays.asList(onRing(a0, 0.5, y0), onRing(a1, 0.5, y0), onRing(a1, 0.5, y1), onRing(a0, 0.5, y1)),
                        null, normals,
                        Arrays.asList(t((double) i / nPhi, y0 + 0.5), t((double) (i + 1) / nPhi, y0 + 0.5),
                                t((double) (i + 1) / nPhi, y1 + 0.5), t((double) i / nPhi, y1 + 0.5)));
            }
        }
        return mesh;
    }

    public static Mesh unitCone(int nPhi, int nY, int nRad, boolean smooth) {
        Mesh mesh = new Mesh(smooth, true);
        addCap(mesh, nPhi, nRad, -0.5, false, smooth ? v(0, -1, 0) : null);
        double inv = 1.0 / Math.sqrt(5.0);
        for (int j = 0; j < nY; j++) {
            double h0 = (double) j / nY;
            double h1 = (double) (j + 1) / nY;
            double r0 = 0.5 * (1.0 - h0);
            double r1 = 0.5 * (1.0 - h1);
            for (int i = 0; i < nPhi; i++) {
                double a0 = ringAngle(i, nPhi);
                double a1 = ringAngle(i + 1, nPhi);
                Vector3d n0 = onRing(a0, 2.0 * inv, inv);
                Vector3d n1 = onRing(a1, 2.0 * inv, inv);
                List<Vector3d> face = new ArrayList<>(4);
                List<Vector3d> normals = new ArrayList<>(4);
                List<Vector2d> uvs = new ArrayList<>(4);
                face.add(onRing(a0, r0, h0 - 0.5));
                face.add(onRing(a1, r0, h0 - 0.5));
                normals.add(n0);
                normals.add(n1);
                uvs.add(t((double) i / nPhi, h0));
                uvs.add(t((double) (i + 1) / nPhi, h0));
                if (j == nY - 1) {
                    face.add(v(0, 0.5, 0));
                    normals.add(onRing(START_ANGLE + 2.0 * Math.PI * i / nPhi, 2.0 * inv, inv));
                    uvs.add(t((i + 0.5) / nPhi, 1.0));
                } else {
                    face.add(onRing(a1, r1, h1 - 0.5));
                    face.add(onRing(a0, r1, h1 - 0.5));
                    normals.add(new Vector3d(n1));
                    normals.add(new Vector3d(n0));
                    uvs.add(t((double) (i + 1) / nPhi, h1));
                    uvs.add(t((double) i / nPhi, h1));
                }
                mesh.addFace(face, null, smooth ? normals : null, uvs);
            }
        }
        return mesh;
    }

    /** Sphere of diameter 1 inside the box [0, 1]. */
    public static Mesh unitSphere(int nPhi, int nTheta, boolean smooth) {
        Mesh mesh = new Mesh(smooth, true);
        Vector3d center = v(0.5, 0.5, 0.5);
        // Ring j holds latitude theta_j, j = 0 is the south pole, j = nTheta the north pole.
        for (int j = 0; j < nTheta; j++) {
            double th0 = Math.PI * (-0.5 + (double) j / nTheta);
            double th1 = Math.PI * (-0.5 + (double) (j + 1) / nTheta);
            for (int i = 0; i < nPhi; i++) {
                double a0 = ringAngle(i, nPhi);
                double a1 = ringAngle(i + 1, nPhi);
                List<Vector3d> dirs = new ArrayList<>(4);
                List<Vector2d> uvs = new ArrayList<>(4);
                if (j == 0) {
                    dirs.add(v(0, -1, 0));
                    dirs.add(sphereDir(a1, th1));
                    dirs.add(sphereDir(a0, th1));
                    uvs.add(t((i + 0.5) / nPhi, 0.0));
                    uvs.add(t((double) (i + 1) / nPhi, (double) (j + 1) / nTheta));
                    uvs.add(t((double) i / nPhi, (double) (j + 1) / nTheta));
                } else if (j == nTheta - 1) {
                    dirs.add(sphereDir(a0, th0));
                    dirs.add(sphereDir(a1, th0));
                    dirs.add(v(0, 1, 0));
                    uvs.add(t((double) i / nPhi, (double) j / nTheta));
                    uvs.add(t((double) (i + 1) / nPhi, (double) j / nTheta));
                    uvs.add(t((i + 0.5) / nPhi, 1.0));
                } else {
                    dirs.add(sphereDir(a0, th0));
                    dirs.add(sphereDir(a1, th0));
                    dirs.add(sphereDir(a1, th1));
                    dirs.add(sphereDir(a0, th1));
                    uvs.add(t((double) i / nPhi, (double) j / nTheta));
                    uvs.add(t((double) (i + 1) / nPhi, (double) j / nTheta));
                    uvs.add(t((double) (i + 1) / nPhi, (double) (j + 1) / nTheta));
                    uvs.add(t((double) i / nPhi, (double) (j + 1) / nTheta));
                }
                List<Vector3d> face = new ArrayList<>(dirs.size());
                for (Vector3d d : dirs) face.add(new Vector3d(d).mul(0.5).add(center));
                mesh.addFace(face, null, smooth ? dirs : null, uvs);
            }
        }
        return mesh;
    }

    private static Vector3d sphereDir(double phi, double theta) {
        return v(Math.cos(phi) * Math.cos(theta), Math.sin(theta), -Math.sin(phi) * Math.cos(theta));
    }

    /** Torus around the y axis with ring radius {@code r1} and tube radius {@code r2}. */
    public static Mesh torus(double r1, double r2, int nPhi, int nTheta, boolean smooth) {
        Mesh mesh = new Mesh(smooth, true);
        for (int i = 0; i < nPhi; i++) {
            for (int j = 0; j < nTheta; j++) {
                int[][] corners = { { i, j }, { i + 1, j }, { i + 1, j + 1 }, { i, j + 1 } };
                List<Vector3d> face = new ArrayList<>(4);
                List<Vector3d> normals = new ArrayList<>(4);
                List<Vector2d> uvs = new ArrayList<>(4);
                for (int[] c : corners) {
                    double phi = ringAngle(c[0], nPhi);
                    double theta = 2.0 * Math.PI * (c[1] - 0.5) / nTheta;
                    double ring = r1 + r2 * Math.cos(theta);
                    face.add(v(ring * Math.cos(phi), r2 * Math.sin(theta), -ring * Math.sin(phi)));
                    normals.add(v(Math.cos(theta) * Math.cos(phi), Math.sin(theta), -Math.cos(theta) * Math.sin(phi)));
                    uvs.add(t((double) c[0] / nPhi, (c[1] - 0.5) / nTheta));
                }
                mesh.addFace(face, null, smooth ? normals : null, uvs);
            }
        }
        return mesh;
    }
}
