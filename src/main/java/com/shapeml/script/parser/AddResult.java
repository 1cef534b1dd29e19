package com.shapeml.script.parser;

/** Outcome of adding a declaration to a {@link Grammar}. */
public enum AddResult {
    OK,
    NAME_COLLISION,
    DUPLICATE_ARG,
    PREDECESSOR_ENDS_IN_UNDERSCORE
}
