package com.shapeml.script;

import java.util.regex.Pattern;

import com.shapeml.script.interpreter.Interpreter;
import com.shapeml.script.interpreter.Result;
import com.shapeml.script.interpreter.RuntimeError;
import com.shapeml.script.parser.Grammar;
import com.shapeml.script.parser.Locator;
import com.shapeml.script.parser.Parser;
import com.shapeml.script.parser.Value;
import com.shapeml.shape.Shape;

/**
 * Entry point for embedding the grammar language.
 *
 * - Parses a grammar from a file or from memory (with #include resolved relative to the file)
 * - Creates an interpreter session from {@link Interpreter.Options}
 * - Derives the shape tree from the axiom
 *
 * Typical use:
 *   Result<Shape> root = ShapeMl.deriveFile("city.shp", new Interpreter.Options().seed(42));
 */
public final class ShapeMl {

    private static final Pattern INT_PATTERN = Pattern.compile("[-+]?\\d{1,18}");
    private static final Pattern FLOAT_PATTERN = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private ShapeMl() {}

    /** Parses a grammar file with the standard built-in library. */
    public static Result<Grammar> parseFile(String fileName) {
        Grammar grammar = new Grammar();
        Parser parser = new Parser();
        if (!parser.parse(fileName, grammar)) {
            return Result.fail(new RuntimeError(parseMessage(parser), Locator.NONE));
        }
        return Result.ok(grammar);
    }

    /** Parses grammar source held in memory. {@code fileName} names it in diagnostics. */
    public static Result<Grammar> parseString(String fileName, String source) {
        Grammar grammar = new Grammar();
        Parser parser = new Parser();
        if (!parser.parseString(fileName, source, grammar)) {
            return Result.fail(new RuntimeError(parseMessage(parser), Locator.NONE));
        }
        return Result.ok(grammar);
    }

    /** Creates a session for {@code grammar} and derives it. */
    public static Result<Shape> derive(Grammar grammar, Interpreter.Options options) {
        Result<Interpreter> session = Interpreter.create(grammar, options);
        if (session.failed()) return session.propagate();
        return session.value().derive();
    }

    public static Result<Shape> deriveFile(String fileName, Interpreter.Options options) {
        Result<Grammar> grammar = parseFile(fileName);
        if (grammar.failed()) return grammar.propagate();
        return derive(grammar.value(), options);
    }

    public static Result<Shape> deriveString(String fileName, String source, Interpreter.Options options) {
        Result<Grammar> grammar = parseString(fileName, source);
        if (grammar.failed()) return grammar.propagate();
        return derive(grammar.value(), options);
    }

    /**
     * Parses a command-line parameter value: {@code true}/{@code false}, then int,
     * then float. Anything else is taken as a string.
     */
    public static Value parseParameterValue(String text) {
        if (text.equals("true")) return Value.bool(true);
        if (text.equals("false")) return Value.bool(false);
        if (INT_PATTERN.matcher(text).matches()) {
            long l = Long.parseLong(text);
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return Value.integer((int) l);
        }
        if (FLOAT_PATTERN.matcher(text).matches()) {
            double d = Double.parseDouble(text);
            if (!Double.isInfinite(d)) return Value.number(d);
        }
        return Value.string(text);
    }

    private static String parseMessage(Parser parser) {
        String msg = parser.lastError();
        return msg == null ? "Parsing failed." : msg;
    }
}
