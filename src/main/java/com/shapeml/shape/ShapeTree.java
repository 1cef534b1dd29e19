package com.shapeml.shape;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Arena that owns every attached shape of one derivation. Shapes are addressed by id,
 * parents are looked up rather than held, and the whole tree is dropped at once.
 */
public final class ShapeTree {
    private final List<Shape> shapes = new ArrayList<>();

    /** Creates the root shape. Any previous content of the arena is discarded. */
    public Shape createRoot(String name) {
        shapes.clear();
        Shape root = new Shape(this, -1);
        root.setName(name);
        root.assignId(0);
        shapes.add(root);
        return root;
    }

    public Shape root() {
        return shapes.isEmpty() ? null : shapes.get(0);
    }

    public Shape get(int id) {
        return shapes.get(id);
    }

    public int size() {
        return shapes.size();
    }

    public void clear() {
        shapes.clear();
    }

    void attach(Shape shape) {
        if (shape.tree() != this) throw new IllegalArgumentException("Shape belongs to another tree");
        if (shape.isAttached()) throw new IllegalStateException("Shape '" + shape.name() + "' is already attached");
        Shape parent = shape.parent();
        if (parent == null || !parent.isAttached()) {
            throw new IllegalStateException("Shape '" + shape.name() + "' has no attached parent");
        }
        int id = shapes.size();
        shape.assignId(id);
        shapes.add(shape);
        parent.addChildId(id);
    }

    void walk(Shape start, ShapeVisitor visitor) {
        Deque<Shape> todo = new ArrayDeque<>();
        todo.push(start);
        while (!todo.isEmpty()) {
            Shape s = todo.pop();
            visitor.visit(s);
            List<Shape> children = s.children();
            for (int i = children.size() - 1; i >= 0; i--) todo.push(children.get(i));
        }
    }

    public void accept(ShapeVisitor visitor) {
        Shape root = root();
        if (root != null) walk(root, visitor);
    }

    /** Depth-indented dump, one line per shape, two spaces per level. */
    public static String print(Shape start) {
        StringBuilder sb = new StringBuilder();
        start.accept(shape -> {
            for (int i = 0; i < shape.depth(); i++) sb.append("  ");
            sb.append(shape).append('\n');
        });
        return sb.toString();
    }
}
