package com.shapeml.script.parser;

import java.util.Collections;
import java.util.List;

import com.shapeml.script.parser.Expr.ExprInterface;

/** A {@code func name(a, b) = expr;} declaration. */
public final class UserFunction {
    public final String name;
    public final List<String> params;
    public final ExprInterface body;

    public UserFunction(String name, List<String> params, ExprInterface body) {
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.body = body;
    }

    static String printParams(List<String> params) {
        if (params.isEmpty()) return "";
        return "(" + String.join(", ", params) + ")";
    }

    @Override
    public String toString() {
        return "func " + name + printParams(params) + " = " + Expr.print(body) + ";";
    }
}
