package com.shapeml.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global diagnostics hub shared by the lexer, parser and interpreter.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Silent by default, embedding code opts in by installing a sink
 */
public final class Debug {

    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    // Declared after NOOP so the constructor sees it initialized.
    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    /**
     * A sink that prints every message at or above {@code minLevel} as one line.
     * The message text is written as is; warnings and errors already carry their prefix.
     */
    public static DebugSink streamSink(PrintStream out, DebugLevel minLevel) {
        return (level, tag, message, error) -> {
            if (!level.atLeast(minLevel)) return;
            out.println(message);
            if (error != null) error.printStackTrace(out);
        };
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
