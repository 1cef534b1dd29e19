package com.shapeml.script.interpreter;

import java.util.Collections;
import java.util.Map;

import com.shapeml.script.parser.Value;

/** Argument bindings of one active user function call. */
public final class CallFrame {
    final String functionName;
    final Map<String, Value> arguments;

    CallFrame(String functionName, Map<String, Value> arguments) {
        this.functionName = functionName;
        this.arguments = Collections.unmodifiableMap(arguments);
    }

    Value lookup(String name) {
        return arguments.get(name);
    }
}
