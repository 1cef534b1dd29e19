package com.shapeml.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.joml.Matrix3d;
import org.joml.Vector2d;
import org.joml.Vector3d;

/**
 * Hip and gable roofs over convex footprints.
 *
 * For a convex polygon the hip roof is the lower envelope of the planes rising from
 * each edge with the roof angle: the face of edge i covers the footprint points that
 * are at least as close to edge i as to any other edge. A gable roof turns the edges
 * whose hip face is a triangle into vertical walls and leaves them out of the envelope.
 */
final class RoofBuilder {

    private static final double TOL = 1e-9;

    private RoofBuilder() {}

    /** Roof polygons in the frame of the footprint, or null when the footprint is not convex. */
    static List<List<Vector3d>> build(List<Vector3d> footprint, Vector3d normal, double angle,
                                      double overhangSide, boolean gable, double overhangGable) {
        Matrix3d rot = footprintRotation(normal);
        Matrix3d back = new Matrix3d(rot).transpose();

        double baseHeight = 0.0;
        List<Vector2d> poly = new ArrayList<>();
        for (Vector3d p : footprint) {
            Vector3d r = rot.transform(new Vector3d(p));
            poly.add(new Vector2d(r.x, -r.z));
            baseHeight += r.y;
        }
        baseHeight /= footprint.size();

        poly = simplify(poly);
        if (poly.size() < 3 || !isConvex(poly)) return null;

        int n = poly.size();
        Vector2d[] inward = new Vector2d[n];
        for (int i = 0; i < n; i++) {
            Vector2d e = new Vector2d(poly.get((i + 1) % n)).sub(poly.get(i)).normalize();
            inward[i] = new Vector2d(-e.y, e.x);
        }

        boolean[] isGable = new boolean[n];
        if (gable) {
            boolean all = true;
            for (int i = 0; i < n; i++) {
                isGable[i] = envelopeRegion(poly, inward, i, new boolean[n]).size() == 3;
                all &= isGable[i];
            }
            if (all) isGable = new boolean[n];
        }

        double slope = Math.tan(Math.toRadians(angle));
        Lift lift = new Lift(poly, inward, isGable, slope, baseHeight, back, overhangSide, overhangGable);

        List<List<Vector3d>> result = new ArrayList<>();
        List<List<Vector2d>> regions = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (isGable[i]) continue;
            List<Vector2d> region = envelopeRegion(poly, inward, i, isGable);
            regions.add(region);
            if (region.size() < 3) continue;
            List<Vector3d> face = new ArrayList<>(region.size());
            for (Vector2d q : region) face.add(lift.roofPoint(q, distance(poly, inward, i, q)));
            result.add(face);
        }

        for (int g = 0; g < n; g++) {
            if (isGable[g]) result.add(gableWall(poly, inward, g, regions, lift));
        }

        if (overhangSide <= 0.0 && overhangGable <= 0.0) {
            List<Vector3d> bottom = new ArrayList<>(n);
            for (Vector2d q : poly) bottom.add(lift.toLocal(q, 0.0));
            Collections.reverse(bottom);
            result.add(bottom);
        }
        return result;
    }

    /** Rows are the in-plane x axis, the face normal and the in-plane z axis. */
    static Matrix3d footprintRotation(Vector3d normal) {
        Vector3d newZ = new Vector3d(1, 0, 0).cross(normal);
        Vector3d tmp = new Vector3d(0, 1, 0).cross(normal);
        if (tmp.lengthSquared() > newZ.lengthSquared()) newZ = tmp;
        tmp = new Vector3d(0, 0, 1).cross(normal);
        if (tmp.lengthSquared() > newZ.lengthSquared()) newZ = tmp;
        newZ.normalize();
        Vector3d newX = new Vector3d(normal).cross(newZ);
        Matrix3d rot = new Matrix3d();
        rot.setRow(0, newX);
        rot.setRow(1, normal);
        rot.setRow(2, newZ);
        return rot;
    }

    private static double distance(List<Vector2d> poly, Vector2d[] inward, int edge, Vector2d q) {
        Vector2d n = inward[edge];
        return n.x * (q.x - poly.get(edge).x) + n.y * (q.y - poly.get(edge).y);
    }

    /** Footprint clipped to the points closer to {@code edge} than to every other non-excluded edge. */
    private static List<Vector2d> envelopeRegion(List<Vector2d> poly, Vector2d[] inward, int edge, boolean[] excluded) {
        List<Vector2d> region = new ArrayList<>(poly);
        for (int j = 0; j < poly.size() && region.size() >= 3; j++) {
            if (j == edge || excluded[j]) continue;
            final int other = j;
            region = clip(region, q -> distance(poly, inward, edge, q) - distance(poly, inward, other, q));
        }
        return simplify(region);
    }

    private interface Linear {
        double eval(Vector2d q);
    }

    /** Keeps the part of a convex polygon where {@code f <= 0}. */
    private static List<Vector2d> clip(List<Vector2d> poly, Linear f) {
        List<Vector2d> out = new ArrayList<>();
        int n = poly.size();
        for (int i = 0; i < n; i++) {
            Vector2d a = poly.get(i);
            Vector2d b = poly.get((i + 1) % n);
            double fa = f.eval(a);
            double fb = f.eval(b);
            if (fa <= TOL) out.add(new Vector2d(a));
            if ((fa < -TOL && fb > TOL) || (fa > TOL && fb < -TOL)) {
                double t = fa / (fa - fb);
                out.add(new Vector2d(a.x + t * (b.x - a.x), a.y + t * (b.y - a.y)));
            }
        }
        return out;
    }

    /** Drops repeated and collinear points. */
    private static List<Vector2d> simplify(List<Vector2d> poly) {
        List<Vector2d> pts = new ArrayList<>();
        for (Vector2d p : poly) {
            if (pts.isEmpty() || pts.get(pts.size() - 1).distance(p) > 1e-7) pts.add(p);
        }
        while (pts.size() > 1 && pts.get(0).distance(pts.get(pts.size() - 1)) <= 1e-7) {
            pts.remove(pts.size() - 1);
        }
        boolean changed = true;
        while (changed && pts.size() >= 3) {
            changed = false;
            for (int i = 0; i < pts.size(); i++) {
                Vector2d prev = pts.get((i + pts.size() - 1) % pts.size());
                Vector2d cur = pts.get(i);
                Vector2d next = pts.get((i + 1) % pts.size());
                if (Math.abs(cross(prev, cur, next)) < 1e-10) {
                    pts.remove(i);
                    changed = true;
                    break;
                }
            }
        }
        return pts;
    }

    private static double cross(Vector2d a, Vector2d b, Vector2d c) {
        return (b.x - a.x) * (c.y - b.y) - (b.y - a.y) * (c.x - b.x);
    }

    private static boolean isConvex(List<Vector2d> poly) {
        int n = poly.size();
        for (int i = 0; i < n; i++) {
            if (cross(poly.get(i), poly.get((i + 1) % n), poly.get((i + 2) % n)) < -1e-9) return false;
        }
        return true;
    }

    /** Vertical wall over a gable edge, closed at the top by the roof profile. */
    private static List<Vector3d> gableWall(List<Vector2d> poly, Vector2d[] inward, int g,
                                            List<List<Vector2d>> regions, Lift lift) {
        int n = poly.size();
        Vector2d a = poly.get(g);
        Vector2d b = poly.get((g + 1) % n);
        Vector2d dir = new Vector2d(b).sub(a);
        double len = dir.length();
        dir.div(len);

        List<Vector2d> profile = new ArrayList<>();
        for (List<Vector2d> region : regions) {
            for (Vector2d q : region) {
                if (Math.abs(distance(poly, inward, g, q)) > 1e-7) continue;
                double s = along(dir, a, q);
                if (s <= 1e-7 || s >= len - 1e-7) continue;
                boolean dup = false;
                for (Vector2d p : profile) dup |= p.distance(q) < 1e-7;
                if (!dup) profile.add(q);
            }
        }
        profile.sort((p, q) -> Double.compare(along(dir, a, q), along(dir, a, p)));

        List<Vector3d> wall = new ArrayList<>();
        wall.add(lift.toLocal(a, 0.0));
        wall.add(lift.toLocal(b, 0.0));
        for (Vector2d q : profile) wall.add(lift.toLocal(q, lift.envelopeHeight(q)));
        return wall;
    }

    private static double along(Vector2d dir, Vector2d origin, Vector2d q) {
        return dir.x * (q.x - origin.x) + dir.y * (q.y - origin.y);
    }

    /** Maps 2D roof points back to the footprint frame, applying overhangs to roof faces. */
    private static final class Lift {
        final List<Vector2d> poly;
        final Vector2d[] inward;
        final boolean[] isGable;
        final double slope;
        final double baseHeight;
        final Matrix3d back;
        final double overhangSide;
        final double overhangGable;

        Lift(List<Vector2d> poly, Vector2d[] inward, boolean[] isGable, double slope, double baseHeight,
             Matrix3d back, double overhangSide, double overhangGable) {
            this.poly = poly;
            this.inward = inward;
            this.isGable = isGable;
            this.slope = slope;
            this.baseHeight = baseHeight;
            this.back = back;
            this.overhangSide = overhangSide;
            this.overhangGable = overhangGable;
        }

        Vector3d toLocal(Vector2d q, double height) {
            return back.transform(new Vector3d(q.x, baseHeight + height, -q.y));
        }

        double envelopeHeight(Vector2d q) {
            double min = Double.MAX_VALUE;
            for (int i = 0; i < poly.size(); i++) {
                if (!isGable[i]) min = Math.min(min, distance(poly, inward, i, q));
            }
            return Math.max(0.0, min) * slope;
        }

        Vector3d roofPoint(Vector2d q, double dist) {
            double height = dist * slope;
            Vector2d moved = new Vector2d(q);
            int n = poly.size();

            if (height < 1e-7) {
                for (int c = 0; c < n; c++) {
                    if (poly.get(c).distance(q) > 1e-7) continue;
                    int prev = (c + n - 1) % n;
                    if (!isGable[prev] && !isGable[c]) {
                        if (overhangSide > 0.0) {
                            Vector2d bis = new Vector2d(inward[prev]).add(inward[c]).normalize();
                            double s = bis.dot(inward[c]);
                            moved.add(bis.mul(-overhangSide / s));
                            height = -overhangSide * slope;
                        }
                    } else {
                        for (int e : new int[] { prev, c }) {
                            if (isGable[e]) {
                                moved.add(new Vector2d(inward[e]).mul(-overhangGable));
                            } else {
                                moved.add(new Vector2d(inward[e]).mul(-overhangSide));
                                height = -overhangSide * slope;
                            }
                        }
                    }
                    break;
                }
            } else if (overhangGable > 0.0) {
                for (int g = 0; g < n; g++) {
                    if (isGable[g] && Math.abs(distance(poly, inward, g, q)) < 1e-7) {
                        moved.add(new Vector2d(inward[g]).mul(-overhangGable));
                    }
                }
            }
            return toLocal(moved, height);
        }
    }
}
