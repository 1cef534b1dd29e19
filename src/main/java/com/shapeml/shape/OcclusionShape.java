package com.shapeml.shape;

import com.shapeml.geometry.Aabb;
import com.shapeml.geometry.Obb;

/** Snapshot of a shape's world-space volume as stored in the occlusion octree. */
public final class OcclusionShape {
    private final String name;
    private final Shape parent;
    private final Obb obb;
    private final Aabb aabb;

    public OcclusionShape(Shape shape) {
        this.name = shape.name();
        this.parent = shape.parent();
        this.obb = shape.worldObb();
        this.aabb = shape.worldAabb();
    }

    public String name() { return name; }

    /** Parent of the inserted shape, null for the root. */
    public Shape parent() { return parent; }

    public Obb obb() { return obb; }

    public Aabb aabb() { return aabb; }
}
