package com.shapeml.script.interpreter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.shapeml.script.parser.Expr;
import com.shapeml.script.parser.Expr.ExprInterface;
import com.shapeml.script.parser.Expr.ExprVisitor;
import com.shapeml.script.parser.ShapeOp;
import com.shapeml.script.parser.Value;

/**
 * Deep copy of an expression in which every reference to a bound function argument is
 * replaced by its value. Used when a user function returns a shape operation string so
 * that the string no longer depends on the call frame.
 */
final class CopyWithBindings implements ExprVisitor<Result<ExprInterface>> {
    private final Map<String, Value> bindings;

    CopyWithBindings(Map<String, Value> bindings) {
        this.bindings = bindings;
    }

    Result<List<ShapeOp>> copyOps(List<ShapeOp> ops) {
        List<ShapeOp> out = new ArrayList<>(ops.size());
        for (ShapeOp op : ops) {
            Result<List<ExprInterface>> args = copyAll(op.args);
            if (args.failed()) return args.propagate();
            out.add(op.withArgs(args.value()));
        }
        return Result.ok(out);
    }

    private Result<List<ExprInterface>> copyAll(List<ExprInterface> exprs) {
        List<ExprInterface> out = new ArrayList<>(exprs.size());
        for (ExprInterface e : exprs) {
            Result<ExprInterface> r = e.accept(this);
            if (r.failed()) return r.propagate();
            out.add(r.value());
        }
        return Result.ok(out);
    }

    @Override
    public Result<ExprInterface> visitLiteralExpr(Expr.Literal expr) {
        return Result.ok(new Expr.Literal(expr.value));
    }

    @Override
    public Result<ExprInterface> visitScopeExpr(Expr.Scope expr) {
        Result<ExprInterface> inner = expr.inner.accept(this);
        if (inner.failed()) return inner;
        return Result.ok(new Expr.Scope(inner.value()));
    }

    @Override
    public Result<ExprInterface> visitOpExpr(Expr.Op expr) {
        Result<ExprInterface> right = expr.right.accept(this);
        if (right.failed()) return right;
        if (expr.left == null) {
            return Result.ok(Expr.Op.unary(expr.op, right.value(), expr.locator));
        }
        Result<ExprInterface> left = expr.left.accept(this);
        if (left.failed()) return left;
        return Result.ok(new Expr.Op(left.value(), expr.op, right.value(), expr.locator));
    }

    @Override
    public Result<ExprInterface> visitNameExpr(Expr.Name expr) {
        Value bound = bindings.get(expr.name);
        if (bound == null) {
            Result<List<ExprInterface>> args = copyAll(expr.args);
            if (args.failed()) return args.propagate();
            return Result.ok(new Expr.Name(expr.name, args.value(), expr.shapeLocal, expr.locator));
        }
        if (!expr.args.isEmpty()) {
            return Result.fail(new RuntimeError(
                    "Passing arguments to parameters is not allowed: '" + expr.name + "'.", expr.locator));
        }
        return Result.ok(new Expr.Literal(bound));
    }
}
