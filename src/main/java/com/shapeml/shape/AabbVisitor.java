package com.shapeml.shape;

import com.shapeml.geometry.Aabb;

/** Accumulates the world-space bounding box of all visited scopes. */
public final class AabbVisitor implements ShapeVisitor {
    private Aabb aabb;

    @Override
    public void visit(Shape shape) {
        Aabb box = shape.worldAabb();
        aabb = aabb == null ? box : aabb.merge(box);
    }

    public void reset() {
        aabb = null;
    }

    /** Null until at least one shape was visited. */
    public Aabb aabb() {
        return aabb;
    }
}
