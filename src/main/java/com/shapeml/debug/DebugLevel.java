package com.shapeml.debug;

/** Severity of a message passed to a {@link DebugSink}. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel other) {
        return ordinal() >= other.ordinal();
    }
}
