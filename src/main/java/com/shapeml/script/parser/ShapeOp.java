package com.shapeml.script.parser;

import java.util.Collections;
import java.util.List;

import com.shapeml.script.parser.Expr.ExprInterface;

/** One entry of a shape operation string: {@code name(args)}, {@code ^name(args)}, {@code [} or {@code ]}. */
public final class ShapeOp {
    public final String name;
    public final List<ExprInterface> args;
    public final boolean reference;
    public final Locator locator;

    public ShapeOp(String name, List<ExprInterface> args, boolean reference, Locator locator) {
        this.name = name;
        this.args = args == null ? Collections.emptyList() : Collections.unmodifiableList(args);
        this.reference = reference;
        this.locator = locator;
    }

    /** Same operation with different argument expressions. */
    public ShapeOp withArgs(List<ExprInterface> newArgs) {
        return new ShapeOp(name, newArgs, reference, locator);
    }

    private String printOne() {
        return (reference ? "^" : "") + name + Expr.printArgs(args);
    }

    /**
     * Inline form {@code { a(1) b }} or, with {@code lineBreaks}, one operation per
     * line indented by two spaces.
     */
    public static String print(List<ShapeOp> ops, boolean lineBreaks) {
        StringBuilder sb = new StringBuilder();
        if (lineBreaks) {
            sb.append("{\n");
            for (ShapeOp op : ops) {
                sb.append("  ").append(op.printOne()).append('\n');
            }
            sb.append('}');
        } else {
            sb.append('{');
            for (ShapeOp op : ops) {
                sb.append(' ').append(op.printOne());
            }
            sb.append(" }");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return printOne();
    }
}
