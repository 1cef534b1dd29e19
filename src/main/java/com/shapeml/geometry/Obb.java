package com.shapeml.geometry;

import org.joml.Vector3d;

/** Oriented box: center, three orthonormal axes and half extents along them. */
public final class Obb {
    public final Vector3d center;
    public final Vector3d[] axes;
    public final Vector3d extent;

    public Obb(Vector3d center, Vector3d[] axes, Vector3d extent) {
        if (axes.length != 3) throw new IllegalArgumentException("An OBB needs 3 axes");
        this.center = new Vector3d(center);
        this.axes = new Vector3d[] { new Vector3d(axes[0]), new Vector3d(axes[1]), new Vector3d(axes[2]) };
        this.extent = new Vector3d(extent);
    }

    public Obb withExtent(Vector3d newExtent) {
        return new Obb(center, axes, newExtent);
    }

    public boolean contains(Vector3d p) {
        Vector3d d = new Vector3d(p).sub(center);
        for (int i = 0; i < 3; i++) {
            if (Math.abs(d.dot(axes[i])) > extent.get(i)) return false;
        }
        return true;
    }

    /** True when all 8 corners of {@code other} lie inside this box. */
    public boolean contains(Obb other) {
        Vector3d ex = new Vector3d(other.axes[0]).mul(other.extent.x);
        Vector3d ey = new Vector3d(other.axes[1]).mul(other.extent.y);
        Vector3d ez = new Vector3d(other.axes[2]).mul(other.extent.z);
        for (int sx = -1; sx <= 1; sx += 2) {
            for (int sy = -1; sy <= 1; sy += 2) {
                for (int sz = -1; sz <= 1; sz += 2) {
                    Vector3d corner = new Vector3d(other.center)
                            .fma(sx, ex).fma(sy, ey).fma(sz, ez);
                    if (!contains(corner)) return false;
                }
            }
        }
        return true;
    }

    /** Separating axis test over the 15 candidate axes. */
    public boolean intersects(Obb other) {
        double[][] r = new double[3][3];
        double[][] absR = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                r[i][j] = axes[i].dot(other.axes[j]);
                absR[i][j] = Math.abs(r[i][j]) + Mesh.EPSILON;
            }
        }

        Vector3d d = new Vector3d(other.center).sub(center);
        double[] t = { d.dot(axes[0]), d.dot(axes[1]), d.dot(axes[2]) };
        double[] a = { extent.x, extent.y, extent.z };
        double[] b = { other.extent.x, other.extent.y, other.extent.z };

        for (int i = 0; i < 3; i++) {
            double ra = a[i];
            double rb = b[0] * absR[i][0] + b[1] * absR[i][1] + b[2] * absR[i][2];
            if (Math.abs(t[i]) > ra + rb) return false;
        }
        for (int i = 0; i < 3; i++) {
            double ra = a[0] * absR[0][i] + a[1] * absR[1][i] + a[2] * absR[2][i];
            double rb = b[i];
            if (Math.abs(t[0] * r[0][i] + t[1] * r[1][i] + t[2] * r[2][i]) > ra + rb) return false;
        }

        // Cross products A_i x B_j.
        for (int i = 0; i < 3; i++) {
            int i1 = (i + 1) % 3;
            int i2 = (i + 2) % 3;
            for (int j = 0; j < 3; j++) {
                int j1 = (j + 1) % 3;
                int j2 = (j + 2) % 3;
                double ra = a[i1] * absR[i2][j] + a[i2] * absR[i1][j];
                double rb = b[j1] * absR[i][j2] + b[j2] * absR[i][j1];
                double dist = t[i2] * r[i1][j] - t[i1] * r[i2][j];
                if (Math.abs(dist) > ra + rb) return false;
            }
        }
        return true;
    }
}
