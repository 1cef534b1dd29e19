package com.shapeml.shape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Collects the shapes without children, in tree order. */
public final class LeafVisitor implements ShapeVisitor {
    private final List<Shape> leaves = new ArrayList<>();

    @Override
    public void visit(Shape shape) {
        if (shape.isLeaf()) leaves.add(shape);
    }

    public List<Shape> leaves() {
        return Collections.unmodifiableList(leaves);
    }
}
