package com.shapeml.script.interpreter;

import java.util.List;

import com.shapeml.shape.Shape;

/** State of one shape operation string being applied. */
public final class OpStringFrame {
    private final int stackStartSize;
    private final List<Shape> output;

    OpStringFrame(int stackStartSize, List<Shape> output) {
        this.stackStartSize = stackStartSize;
        this.output = output;
    }

    /** Size of the scope stack when the string started; pops must not go below it. */
    public int stackStartSize() { return stackStartSize; }

    /** Receives the non-terminal shapes created by the string. */
    public List<Shape> output() { return output; }
}
