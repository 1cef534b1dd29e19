package com.shapeml.script.interpreter;

import com.shapeml.script.parser.Locator;

/** A grammar-level failure: a message and the source position it is attributed to. */
public final class RuntimeError {
    private final String message;
    private final Locator locator;

    public RuntimeError(String message, Locator locator) {
        this.message = message;
        this.locator = locator == null ? Locator.NONE : locator;
    }

    public String message() { return message; }

    public Locator locator() { return locator; }

    /** {@code " (file: F, line: N)"} or the empty string. */
    public String where() { return locator.where(); }

    /** Same message attributed to another position. */
    public RuntimeError at(Locator other) {
        return new RuntimeError(message, other);
    }

    /** Wraps this error below a breadcrumb line such as {@code Inside function 'f':}. */
    public RuntimeError wrap(String breadcrumb, Locator outer) {
        return new RuntimeError(breadcrumb + "\nERROR" + where() + ": " + message, outer);
    }

    @Override
    public String toString() {
        return "ERROR" + where() + ": " + message;
    }
}
