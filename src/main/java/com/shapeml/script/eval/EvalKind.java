package com.shapeml.script.eval;

/** The three contexts a built-in can be evaluated in. */
public enum EvalKind {
    SHAPE_OPERATION("shape operation"),
    SHAPE_ATTRIBUTE("shape attribute"),
    FUNCTION("function");

    private final String label;

    EvalKind(String label) { this.label = label; }

    /** Name used in diagnostics, e.g. {@code shape operation}. */
    public String label() { return label; }
}
