package com.shapeml.script.interpreter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.shapeml.script.eval.Builtin;
import com.shapeml.script.eval.EvalKind;
import com.shapeml.script.eval.Invocation;
import com.shapeml.script.parser.Expr;
import com.shapeml.script.parser.Expr.ExprInterface;
import com.shapeml.script.parser.Expr.ExprVisitor;
import com.shapeml.script.parser.Expr.OpType;
import com.shapeml.script.parser.ShapeOp;
import com.shapeml.script.parser.UserFunction;
import com.shapeml.script.parser.Value;
import com.shapeml.shape.Shape;

/** Evaluates expressions against the state of one interpreter session. */
final class ExpressionEvaluator implements ExprVisitor<Result<Value>> {
    private final Interpreter interpreter;

    ExpressionEvaluator(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    Result<Value> eval(ExprInterface expr) {
        return expr.accept(this);
    }

    Result<List<Value>> evalAll(List<ExprInterface> exprs) {
        List<Value> out = new ArrayList<>(exprs.size());
        for (ExprInterface e : exprs) {
            Result<Value> r = eval(e);
            if (r.failed()) return r.propagate();
            out.add(r.value());
        }
        return Result.ok(out);
    }

    @Override
    public Result<Value> visitLiteralExpr(Expr.Literal expr) {
        return Result.ok(expr.value);
    }

    @Override
    public Result<Value> visitScopeExpr(Expr.Scope expr) {
        return eval(expr.inner);
    }

    // -------------------------
    // Operators
    // -------------------------

    @Override
    public Result<Value> visitOpExpr(Expr.Op expr) {
        Result<Value> l = expr.left != null ? eval(expr.left) : Result.ok(Value.integer(0));
        if (l.failed()) return l;
        Result<Value> r = eval(expr.right);
        if (r.failed()) return r;
        Value left = l.value();
        Value right = r.value();
        OpType op = expr.op;

        if (left.type == Value.Type.SHAPE_OP_STRING || right.type == Value.Type.SHAPE_OP_STRING) {
            return error("Cannot apply operator '" + op.symbol + "' to shape operation strings.", expr);
        }

        if (left.type == Value.Type.STRING || right.type == Value.Type.STRING) {
            String ls = left.changeType(Value.Type.STRING).asString();
            String rs = right.changeType(Value.Type.STRING).asString();
            switch (op) {
                case PLUS: return Result.ok(Value.string(ls + rs));
                case EQUAL: return Result.ok(Value.bool(ls.equals(rs)));
                case NOT_EQUAL: return Result.ok(Value.bool(!ls.equals(rs)));
                default: return error("Cannot apply operator '" + op.symbol + "' to strings. ", expr);
            }
        }

        boolean useFloat = false;
        switch (op) {
            case AND:
            case OR:
                left = left.changeType(Value.Type.BOOL);
                right = right.changeType(Value.Type.BOOL);
                break;
            case NOT:
                right = right.changeType(Value.Type.BOOL);
                break;
            case NEGATE:
                if (right.type == Value.Type.BOOL) {
                    right = right.changeType(Value.Type.INT);
                } else if (right.type == Value.Type.FLOAT) {
                    useFloat = true;
                }
                break;
            case MODULO:
                if (left.type == Value.Type.FLOAT || right.type == Value.Type.FLOAT) {
                    return error("Cannot apply operator '%' to floats.", expr);
                }
                left = left.changeType(Value.Type.INT);
                right = right.changeType(Value.Type.INT);
                break;
            default:
                if (left.type == Value.Type.FLOAT || right.type == Value.Type.FLOAT) {
                    left = left.changeType(Value.Type.FLOAT);
                    right = right.changeType(Value.Type.FLOAT);
                    useFloat = true;
                } else {
                    left = left.changeType(Value.Type.INT);
                    right = right.changeType(Value.Type.INT);
                }
        }

        Value ret;
        switch (op) {
            case PLUS:
                ret = useFloat ? Value.number(left.asFloat() + right.asFloat()) : Value.integer(left.asInt() + right.asInt());
                break;
            case MINUS:
                ret = useFloat ? Value.number(left.asFloat() - right.asFloat()) : Value.integer(left.asInt() - right.asInt());
                break;
            case MULT:
                ret = useFloat ? Value.number(left.asFloat() * right.asFloat()) : Value.integer(left.asInt() * right.asInt());
                break;
            case DIV:
                if (!useFloat && right.asInt() == 0) return error("Integer division by zero.", expr);
                ret = useFloat ? Value.number(left.asFloat() / right.asFloat()) : Value.integer(left.asInt() / right.asInt());
                break;
            case MODULO:
                if (right.asInt() == 0) return error("Integer division by zero.", expr);
                ret = Value.integer(left.asInt() % right.asInt());
                break;
            case LESS_EQUAL:
                ret = Value.bool(useFloat ? left.asFloat() <= right.asFloat() : left.asInt() <= right.asInt());
                break;
            case GREATER_EQUAL:
                ret = Value.bool(useFloat ? left.asFloat() >= right.asFloat() : left.asInt() >= right.asInt());
                break;
            case LESS:
                ret = Value.bool(useFloat ? left.asFloat() < right.asFloat() : left.asInt() < right.asInt());
                break;
            case GREATER:
                ret = Value.bool(useFloat ? left.asFloat() > right.asFloat() : left.asInt() > right.asInt());
                break;
            case EQUAL:
                ret = Value.bool(useFloat ? left.asFloat() == right.asFloat() : left.asInt() == right.asInt());
                break;
            case NOT_EQUAL:
                ret = Value.bool(useFloat ? left.asFloat() != right.asFloat() : left.asInt() != right.asInt());
                break;
            case AND:
                ret = Value.bool(left.asBool() && right.asBool());
                break;
            case OR:
                ret = Value.bool(left.asBool() || right.asBool());
                break;
            case NOT:
                ret = Value.bool(!right.asBool());
                break;
            case NEGATE:
                ret = useFloat ? Value.number(-right.asFloat()) : Value.integer(-right.asInt());
                break;
            default:
                throw new IllegalStateException("Unhandled operator " + op);
        }

        if (ret.type == Value.Type.FLOAT && !Double.isFinite(ret.asFloat())) {
            return error("The result of operation '" + op.symbol + "' is NaN or +/- infinity.", expr);
        }
        return Result.ok(ret);
    }

    private static Result<Value> error(String message, Expr.Op expr) {
        return Result.fail(new RuntimeError(message, expr.locator));
    }

    // -------------------------
    // Name resolution
    // -------------------------

    @Override
    public Result<Value> visitNameExpr(Expr.Name expr) {
        String name = expr.name;

        CallFrame frame = interpreter.callStack.peek();
        if (frame != null) {
            Value v = frame.lookup(name);
            if (v != null) {
                if (!expr.args.isEmpty()) return fail("Arguments cannot have parameters: '" + name + "'.", expr);
                return Result.ok(v);
            }
        }

        if (expr.shapeLocal) {
            Shape current = interpreter.currentShape();
            Value v = current == null ? null : current.getParameter(name);
            if (v != null) {
                if (!expr.args.isEmpty()) {
                    return fail("Passing arguments to rule parameters is not allowed: '" + name + "'.", expr);
                }
                return Result.ok(v);
            }
            Shape top = interpreter.shapeStack().size() == 0 ? null : interpreter.shapeStack().top();
            v = top == null ? null : top.getCustomAttribute(name);
            if (v != null) {
                if (!expr.args.isEmpty()) {
                    return fail("Passing arguments to custom shape attributes is not allowed: '" + name + "'.", expr);
                }
                return Result.ok(v);
            }
        }

        Builtin func = interpreter.builtins().lookup(EvalKind.FUNCTION, name);
        if (func != null) {
            Result<Value> r = invoke(func, expr);
            if (r.failed()) return r;
            Value v = r.value();
            if (v.type == Value.Type.FLOAT && !Double.isFinite(v.asFloat())) {
                return fail("The result of function '" + name + "' is NaN or +/- infinity.", expr);
            }
            return r;
        }

        if (expr.shapeLocal && interpreter.shapeStack().size() > 0) {
            Builtin attr = interpreter.builtins().lookup(EvalKind.SHAPE_ATTRIBUTE, name);
            if (attr != null) return invoke(attr, expr);
        }

        Value global = interpreter.globalVariable(name);
        if (global != null) {
            if (!expr.args.isEmpty()) {
                return fail("Passing arguments to global variables (parameters or constants) is not allowed: '"
                        + name + "'.", expr);
            }
            return Result.ok(global);
        }

        UserFunction userFunc = interpreter.grammar().functions().get(name);
        if (userFunc != null) return callUserFunction(userFunc, expr);

        return fail("There is no variable with the name '" + name + "'.", expr);
    }

    private Result<Value> invoke(Builtin builtin, Expr.Name expr) {
        Result<List<Value>> args = evalAll(expr.args);
        if (args.failed()) return args.propagate();
        Result<Value> r = new Invocation(builtin, args.value(), interpreter, null).run();
        if (r.failed()) return Result.fail(r.error().at(expr.locator));
        return r;
    }

    private Result<Value> callUserFunction(UserFunction func, Expr.Name expr) {
        String name = func.name;
        if (interpreter.callStack.size() == Interpreter.MAX_FUNCTION_DEPTH) {
            return fail("Function '" + name + "' reached the max recursion depth ("
                    + Interpreter.MAX_FUNCTION_DEPTH + ").", expr);
        }
        if (func.params.size() != expr.args.size()) {
            return fail("Custom function '" + name + "' takes " + func.params.size() + " arguments but "
                    + expr.args.size() + " were provided.", expr);
        }
        Map<String, Value> bindings = new HashMap<>();
        for (int i = 0; i < expr.args.size(); i++) {
            Result<Value> a = eval(expr.args.get(i));
            if (a.failed()) return a;
            bindings.put(func.params.get(i), a.value());
        }

        interpreter.callStack.push(new CallFrame(name, bindings));
        Result<Value> ret;
        try {
            ret = eval(func.body);
            if (ret.isOk() && ret.value().type == Value.Type.SHAPE_OP_STRING && !bindings.isEmpty()) {
                Result<List<ShapeOp>> copied = new CopyWithBindings(bindings).copyOps(ret.value().asOps());
                ret = copied.failed() ? copied.propagate() : Result.ok(Value.ops(copied.value()));
            }
        } finally {
            interpreter.callStack.pop();
        }
        if (ret.failed()) {
            return Result.fail(ret.error().wrap("Inside function '" + name + "':", expr.locator));
        }
        return ret;
    }

    private static Result<Value> fail(String message, Expr.Name expr) {
        return Result.fail(new RuntimeError(message, expr.locator));
    }
}
