package com.shapeml.geometry;

import org.joml.Matrix3d;
import org.joml.Matrix4d;
import org.joml.Vector3d;

/** Plane {@code n . p = dist} with a unit normal. */
public final class Plane {
    public final Vector3d normal;
    public final double dist;

    public Plane(Vector3d normal, double dist) {
        this.normal = new Vector3d(normal).normalize();
        this.dist = dist;
    }

    public Plane(Vector3d normal, Vector3d point) {
        this.normal = new Vector3d(normal).normalize();
        this.dist = this.normal.dot(point);
    }

    public static Plane fromPoints(Vector3d p1, Vector3d p2, Vector3d p3) {
        Vector3d a = new Vector3d(p2).sub(p1);
        Vector3d b = new Vector3d(p3).sub(p1);
        return new Plane(a.cross(b), p1);
    }

    public double distance(Vector3d p) {
        return normal.dot(p) - dist;
    }

    public boolean on(Vector3d p) { return Math.abs(distance(p)) < Mesh.EPSILON; }
    public boolean above(Vector3d p) { return distance(p) > 0.0; }
    public boolean below(Vector3d p) { return distance(p) < 0.0; }

    /** The plane moved by an affine transform with invertible linear part. */
    public Plane transform(Matrix4d trafo) {
        Matrix3d linear = trafo.get3x3(new Matrix3d());
        Vector3d n = linear.invert().transpose().transform(new Vector3d(normal));
        Vector3d p = trafo.transformPosition(new Vector3d(normal).mul(dist));
        return new Plane(n, p);
    }

    @Override
    public String toString() {
        return "Plane(" + normal + ", " + dist + ")";
    }
}
