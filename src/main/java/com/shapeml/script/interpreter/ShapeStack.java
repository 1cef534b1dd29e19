package com.shapeml.script.interpreter;

import java.util.ArrayList;
import java.util.List;

import com.shapeml.shape.Shape;

/** Stack of working copies manipulated by a shape operation string. */
public final class ShapeStack {
    private final List<Shape> stack = new ArrayList<>();

    public void push(Shape shape) {
        stack.add(shape);
    }

    public void pop() {
        if (stack.isEmpty()) throw new IllegalStateException("Pop on an empty shape stack");
        stack.remove(stack.size() - 1);
    }

    public Shape top() {
        if (stack.isEmpty()) throw new IllegalStateException("Top of an empty shape stack");
        return stack.get(stack.size() - 1);
    }

    /** The shape {@code n} entries below the top, or null. */
    public Shape topMinusN(int n) {
        int idx = stack.size() - n - 1;
        return idx >= 0 ? stack.get(idx) : null;
    }

    public int size() {
        return stack.size();
    }

    public void clear() {
        stack.clear();
    }
}
