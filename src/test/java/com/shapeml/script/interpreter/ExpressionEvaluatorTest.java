package com.shapeml.script.interpreter;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.shapeml.script.ShapeMl;
import com.shapeml.script.parser.Grammar;
import com.shapeml.script.parser.Value;

public class ExpressionEvaluatorTest {

    /** Evaluates {@code expr} as the constant {@code r} of an otherwise empty grammar. */
    private static Result<Value> eval(String prelude, String expr) {
        Result<Grammar> g = ShapeMl.parseString("expr.shp", prelude + "\nconst r = " + expr + ";");
        assertTrue(g.isOk(), () -> g.error().toString());
        Result<Interpreter> session = Interpreter.create(g.value());
        if (session.failed()) return session.propagate();
        return Result.ok(session.value().constants().get("r"));
    }

    private static Value ok(String expr) {
        Result<Value> r = eval("", expr);
        assertTrue(r.isOk(), () -> expr + " failed: " + r.error());
        return r.value();
    }

    private static RuntimeError fails(String prelude, String expr) {
        Result<Value> r = eval(prelude, expr);
        assertTrue(r.failed(), () -> expr + " should fail but gave " + r.value());
        return r.error();
    }

    @Test
    void arithmetic_mixes_int_and_float() {
        assertEquals(Value.number(2.0), ok("(6.0 - 2) * 0.5"));
        assertEquals(Value.integer(7), ok("1 + 2 * 3"));
        assertEquals(Value.integer(-4), ok("-(2 + 2)"));
        assertEquals(Value.integer(2), ok("7 / 3"));
    }

    @Test
    void string_concatenation() {
        assertEquals(Value.string("Hello world!"), ok("\"Hello\" + \" world!\""));
        assertEquals(Value.string("n=3"), ok("\"n=\" + 3"));
    }

    @Test
    void string_subtraction_fails() {
        fails("", "\"Hello\" - \" world!\"");
    }

    @Test
    void string_negation_fails() {
        fails("", "!\"Hello world!\"");
    }

    @Test
    void modulo() {
        assertEquals(Value.integer(1), ok("true % 2"));
        fails("", "1.1 % 2");
    }

    @Test
    void integer_division_by_zero_fails() {
        fails("", "1 / 0");
    }

    @Test
    void comparison_and_logic() {
        assertEquals(Value.bool(true), ok("1 < 2 && 2.5 >= 2"));
        assertEquals(Value.bool(false), ok("!(1 == 1) || false"));
        assertEquals(Value.bool(true), ok("\"a\" != \"b\""));
    }

    @Test
    void builtin_functions() {
        assertEquals(Value.number(2.0), ok("ceil(1.23)"));
        assertEquals(Value.number(1.0), ok("floor(1.23)"));
        assertEquals(Value.number(2.0), ok("round(1.5)"));
        assertEquals(Value.number(-2.0), ok("round(-1.5)"));
        assertEquals(Value.integer(-1), ok("sign(-2.1)"));
        assertEquals(Value.number(0.34), ok("fract(2.34)"));
        assertEquals(Value.integer(2), ok("int(2.34)"));
        assertEquals(Value.number(1.0), ok("sin(90.0)"));
        assertEquals(Value.number(-1.0), ok("cos(180.0)"));
        assertEquals(Value.number(1.0), ok("tan(45.0)"));
        assertEquals(Value.number(-90.0), ok("asin(-1.0)"));
        assertEquals(Value.number(180.0), ok("acos(-1.0)"));
        assertEquals(Value.number(45.0), ok("atan(1.0)"));
        assertEquals(Value.number(-135.0), ok("atan2(-1.0, -1.0)"));
        assertEquals(Value.number(5.0), ok("sqrt(25.0)"));
        assertEquals(Value.number(81.0), ok("pow(3.0, 4.0)"));
        assertEquals(Value.number(Math.exp(7.0)), ok("exp(7.0)"));
        assertEquals(Value.number(0.0), ok("log(1.0)"));
        assertEquals(Value.number(4.0), ok("log10(10000.0)"));
        assertEquals(Value.number(4.0), ok("max(3.0, 4)"));
        assertEquals(Value.integer(3), ok("min(3, 4)"));
    }

    @Test
    void builtin_argument_errors() {
        fails("", "sin(90.0, 180.0)");
        fails("", "asin(2.0)");
        fails("", "sqrt(\"x\")");
    }

    @Test
    void unknown_name_fails() {
        RuntimeError err = fails("", "unknown");
        assertTrue(err.message().contains("unknown"), err.message());
    }

    @Test
    void user_function_call() {
        Result<Value> r = eval("func my_func(my_arg) = my_arg + 1;", "my_func(10)");
        assertTrue(r.isOk());
        assertEquals(Value.integer(11), r.value());
    }

    @Test
    void user_function_arity_mismatch_fails() {
        fails("func f(a, b) = a + b;", "f(1)");
    }

    @Test
    void recursive_function_reaches_depth_limit() {
        RuntimeError err = fails("func rec_func = rec_func;", "rec_func");
        assertTrue(err.message().contains("reached the max recursion depth (" + Interpreter.MAX_FUNCTION_DEPTH + ")"),
                err.message());
    }

    @Test
    void constants_see_parameters_and_earlier_constants() {
        Result<Value> r = eval("param p = 10;\nconst c = p * 2;", "c + 1");
        assertTrue(r.isOk());
        assertEquals(Value.integer(21), r.value());
    }

    @Test
    void shape_op_strings_reject_operators() {
        fails("", "{ A } + { B }");
        fails("", "-{ A }");
    }

    @Test
    void shape_attributes_are_not_available_in_constants() {
        fails("", "size_x");
    }

    @Test
    void step_currently_returns_one() {
        assertEquals(Value.number(1.0), ok("step(0.5, 0.2)"));
        assertEquals(Value.number(1.0), ok("step(0.5, 0.9)"));
    }
}
