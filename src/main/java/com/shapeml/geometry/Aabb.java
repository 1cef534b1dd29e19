package com.shapeml.geometry;

import java.util.Collection;

import org.joml.Vector3d;

/** Axis-aligned box stored as center and half extent. */
public final class Aabb {
    public final Vector3d center;
    public final Vector3d extent;

    public Aabb(Vector3d center, Vector3d extent) {
        this.center = new Vector3d(center);
        this.extent = new Vector3d(extent);
    }

    /** The bounding box of the points. An empty collection yields a degenerate box at the origin. */
    public static Aabb of(Collection<Vector3d> points) {
        if (points.isEmpty()) return new Aabb(new Vector3d(), new Vector3d());
        Vector3d min = new Vector3d(Double.MAX_VALUE);
        Vector3d max = new Vector3d(-Double.MAX_VALUE);
        for (Vector3d p : points) {
            min.min(p);
            max.max(p);
        }
        return fromMinMax(min, max);
    }

    public static Aabb fromMinMax(Vector3d min, Vector3d max) {
        Vector3d c = new Vector3d(min).add(max).mul(0.5);
        Vector3d e = new Vector3d(max).sub(min).mul(0.5);
        return new Aabb(c, e);
    }

    public Vector3d min() { return new Vector3d(center).sub(extent); }
    public Vector3d max() { return new Vector3d(center).add(extent); }

    public Aabb merge(Aabb other) {
        Vector3d min = min().min(other.min());
        Vector3d max = max().max(other.max());
        return fromMinMax(min, max);
    }

    public boolean intersects(Aabb other) {
        return Math.abs(center.x - other.center.x) <= extent.x + other.extent.x
                && Math.abs(center.y - other.center.y) <= extent.y + other.extent.y
                && Math.abs(center.z - other.center.z) <= extent.z + other.extent.z;
    }

    @Override
    public String toString() {
        return "Aabb(center=" + center + ", extent=" + extent + ")";
    }
}
