package com.shapeml.shape;

/** Callback for pre-order walks over a shape tree. */
@FunctionalInterface
public interface ShapeVisitor {
    void visit(Shape shape);
}
