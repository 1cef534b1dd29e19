package com.shapeml.script.parser;

import java.util.Collections;
import java.util.List;

import com.shapeml.script.parser.Expr.ExprInterface;

/**
 * A production rule {@code rule Pred(args) : probability :: condition = { ops };}.
 * Probability and condition are null when omitted.
 */
public final class Rule {
    public final String predecessor;
    public final List<String> params;
    public final ExprInterface probability;
    public final ExprInterface condition;
    public final List<ShapeOp> successor;
    /** Position right after the closing brace, used for push/pop balance errors. */
    public final Locator lastLine;

    public Rule(String predecessor, List<String> params, ExprInterface probability,
                ExprInterface condition, List<ShapeOp> successor, Locator lastLine) {
        this.predecessor = predecessor;
        this.params = Collections.unmodifiableList(params);
        this.probability = probability;
        this.condition = condition;
        this.successor = Collections.unmodifiableList(successor);
        this.lastLine = lastLine;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("rule ");
        sb.append(predecessor).append(UserFunction.printParams(params));
        if (probability != null) sb.append(" : ").append(Expr.print(probability));
        if (condition != null) sb.append(" :: ").append(Expr.print(condition));
        sb.append(" = ").append(ShapeOp.print(successor, true)).append(';');
        return sb.toString();
    }
}
