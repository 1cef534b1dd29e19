package com.shapeml.debug;

/** Pluggable target for interpreter diagnostics (stderr, a test buffer, a GUI console). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
