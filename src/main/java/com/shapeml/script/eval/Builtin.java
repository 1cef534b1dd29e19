package com.shapeml.script.eval;

import java.util.Collections;
import java.util.List;

import com.shapeml.script.parser.Value;

/**
 * Metadata and behavior of one built-in shape operation, shape attribute or function.
 *
 * Evaluation runs in three steps: the generic validation (argument count and positional
 * type coercion, skipped for {@link #VARIADIC} built-ins), the optional special check,
 * and the body. Each step returns false after recording a message on the invocation.
 */
public final class Builtin {

    /** Arity of built-ins that validate their arguments themselves. */
    public static final int VARIADIC = -1;

    @FunctionalInterface
    public interface Check {
        boolean test(Invocation inv);
    }

    @FunctionalInterface
    public interface Body {
        boolean run(Invocation inv);
    }

    private final String name;
    private final EvalKind kind;
    private final int arity;
    private final List<Value.Type> argTypes;
    private final Check special;
    private final Body body;

    Builtin(String name, EvalKind kind, int arity, List<Value.Type> argTypes, Check special, Body body) {
        if (arity != VARIADIC && arity != argTypes.size()) {
            throw new IllegalArgumentException("Built-in '" + name + "' declares " + arity
                    + " arguments but " + argTypes.size() + " types");
        }
        this.name = name;
        this.kind = kind;
        this.arity = arity;
        this.argTypes = Collections.unmodifiableList(argTypes);
        this.special = special;
        this.body = body;
    }

    public String name() { return name; }
    public EvalKind kind() { return kind; }
    public int arity() { return arity; }
    public List<Value.Type> argTypes() { return argTypes; }

    Check special() { return special; }
    Body body() { return body; }

    @Override
    public String toString() {
        return kind.label() + " '" + name + "'";
    }
}
