package com.shapeml.script.parser;

import java.util.Collections;
import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitScopeExpr(Scope expr);
        R visitOpExpr(Op expr);
        R visitNameExpr(Name expr);
    }

    public enum OpType {
        PLUS("+"),
        MINUS("-"),
        MULT("*"),
        DIV("/"),
        MODULO("%"),
        LESS_EQUAL("<="),
        GREATER_EQUAL(">="),
        LESS("<"),
        GREATER(">"),
        EQUAL("=="),
        NOT_EQUAL("!="),
        AND("&&"),
        OR("||"),
        NOT("!"),
        NEGATE("-");

        public final String symbol;

        OpType(String symbol) { this.symbol = symbol; }

        public boolean isUnary() { return this == NOT || this == NEGATE; }
    }

    // -------------------------
    // Expression nodes
    // -------------------------

    public static final class Literal implements ExprInterface {
        public final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        @Override
        public String toString() { return print(this); }
    }

    /** Parenthesized expression; evaluates to its inner expression. */
    public static final class Scope implements ExprInterface {
        public final ExprInterface inner;

        public Scope(ExprInterface inner) {
            this.inner = inner;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitScopeExpr(this);
        }

        @Override
        public String toString() { return print(this); }
    }

    public static final class Op implements ExprInterface {
        /** Null for unary operators. */
        public final ExprInterface left;
        public final OpType op;
        public final ExprInterface right;
        public final Locator locator;

        public Op(ExprInterface left, OpType op, ExprInterface right, Locator locator) {
            if (op.isUnary() != (left == null)) {
                throw new IllegalArgumentException("Operator " + op + " has the wrong number of operands");
            }
            this.left = left;
            this.op = op;
            this.right = right;
            this.locator = locator;
        }

        public static Op unary(OpType op, ExprInterface right, Locator locator) {
            return new Op(null, op, right, locator);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitOpExpr(this);
        }

        @Override
        public String toString() { return print(this); }
    }

    /**
     * Reference to a variable, parameter, attribute or function. Whether shape-local
     * state may be consulted is fixed when the node is parsed.
     */
    public static final class Name implements ExprInterface {
        public final String name;
        public final List<ExprInterface> args;
        public final boolean shapeLocal;
        public final Locator locator;

        public Name(String name, List<ExprInterface> args, boolean shapeLocal, Locator locator) {
            this.name = name;
            this.args = args == null ? Collections.emptyList() : Collections.unmodifiableList(args);
            this.shapeLocal = shapeLocal;
            this.locator = locator;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNameExpr(this);
        }

        @Override
        public String toString() { return print(this); }
    }

    // -------------------------
    // Printing
    // -------------------------

    public static String print(ExprInterface expr) {
        return expr.accept(PRINTER);
    }

    static String printArgs(List<ExprInterface> args) {
        if (args.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(print(args.get(i)));
        }
        return sb.append(')').toString();
    }

    private static final ExprVisitor<String> PRINTER = new ExprVisitor<String>() {
        @Override
        public String visitLiteralExpr(Literal expr) {
            return expr.value.toString();
        }

        @Override
        public String visitScopeExpr(Scope expr) {
            return "(" + print(expr.inner) + ")";
        }

        @Override
        public String visitOpExpr(Op expr) {
            if (expr.op.isUnary()) {
                return expr.op.symbol + print(expr.right);
            }
            return print(expr.left) + " " + expr.op.symbol + " " + print(expr.right);
        }

        @Override
        public String visitNameExpr(Name expr) {
            return expr.name + printArgs(expr.args);
        }
    };
}
