package com.shapeml.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.shapeml.debug.Debug;
import com.shapeml.debug.DebugLevel;
import com.shapeml.script.interpreter.Interpreter;
import com.shapeml.script.interpreter.Result;
import com.shapeml.script.parser.Grammar;
import com.shapeml.script.parser.Lexer;
import com.shapeml.script.parser.Token;
import com.shapeml.script.parser.TokenType;
import com.shapeml.shape.Shape;
import com.shapeml.shape.ShapeJson;
import com.shapeml.shape.ShapeTree;

/**
 * Command-line driver: lexes, parses and derives one grammar file.
 *
 * Exit codes: 0 success, 1 lexing, parsing or derivation failed, 2 bad usage,
 * 3 the JSON export could not be written.
 */
public final class ShapeMlCli {

    private static final String TAG = "shapeml.cli";

    private static final String USAGE = String.join("\n",
            "Usage: ShapeMlCli [options] <grammar-file>",
            "  --axiom NAME            start symbol (default: Axiom)",
            "  --seed INT              random seed (default: " + Interpreter.DEFAULT_SEED + ")",
            "  --parameter NAME=VALUE  override a grammar parameter; repeatable",
            "  --max-steps INT         derivation step limit (default: " + Interpreter.DEFAULT_MAX_STEPS + ")",
            "  --only-lexer            print the token stream and stop",
            "  --only-parser           parse and stop",
            "  --print-grammar         print the parsed grammar",
            "  --print-shape-tree      print the derived shape tree",
            "  --export-json FILE      write the derived shape tree as JSON",
            "  --help                  show this help");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs the driver and returns the process exit code. */
    static int run(String[] args) {
        Debug.get().setSink(Debug.streamSink(System.err, DebugLevel.WARN));

        Interpreter.Options options = new Interpreter.Options();
        boolean onlyLexer = false;
        boolean onlyParser = false;
        boolean printGrammar = false;
        boolean printShapeTree = false;
        String exportJson = null;
        List<String> files = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--help":
                    System.out.println(USAGE);
                    return 0;
                case "--only-lexer": onlyLexer = true; break;
                case "--only-parser": onlyParser = true; break;
                case "--print-grammar": printGrammar = true; break;
                case "--print-shape-tree": printShapeTree = true; break;
                case "--axiom":
                case "--seed":
                case "--parameter":
                case "--max-steps":
                case "--export-json": {
                    if (i + 1 >= args.length) return usage("Missing value for " + a + ".");
                    String v = args[++i];
                    if (a.equals("--axiom")) {
                        options.axiom(v);
                    } else if (a.equals("--export-json")) {
                        exportJson = v;
                    } else if (a.equals("--parameter")) {
                        int eq = v.indexOf('=');
                        if (eq <= 0) return usage("Expected NAME=VALUE after --parameter, got '" + v + "'.");
                        options.parameter(v.substring(0, eq), ShapeMl.parseParameterValue(v.substring(eq + 1)));
                    } else {
                        Integer n = parseInt(v);
                        if (n == null) return usage("Expected an integer after " + a + ", got '" + v + "'.");
                        if (a.equals("--seed")) {
                            options.seed(n);
                        } else {
                            if (n <= 0) return usage("--max-steps needs to be greater than 0.");
                            options.maxSteps(n);
                        }
                    }
                    break;
                }
                default:
                    if (a.startsWith("--")) return usage("Unknown option '" + a + "'.");
                    files.add(a);
            }
        }
        if (files.size() != 1) return usage("Expected exactly one grammar file.");
        String file = files.get(0);

        if (onlyLexer) return printTokens(file);

        Result<Grammar> grammar = ShapeMl.parseFile(file);
        if (grammar.failed()) return 1;
        if (printGrammar) System.out.println(grammar.value());
        if (onlyParser) return 0;

        Result<Interpreter> session = Interpreter.create(grammar.value(), options);
        if (session.failed()) return 1;
        Result<Shape> root = session.value().derive();
        if (root.failed()) return 1;

        if (printShapeTree) System.out.print(ShapeTree.print(root.value()));
        if (exportJson != null) {
            try {
                Files.write(Path.of(exportJson), ShapeJson.toPrettyString(root.value()).getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                Debug.get().e(TAG, "ERROR: Cannot write '" + exportJson + "': " + e.getMessage());
                return 3;
            }
        }
        return 0;
    }

    private static int printTokens(String file) {
        Lexer lexer = new Lexer();
        if (!lexer.open(file)) return 1;
        for (Token t : lexer.tokenize()) {
            System.out.println(t);
            if (t.type() == TokenType.ERROR) return 1;
        }
        return 0;
    }

    private static Integer parseInt(String s) {
        try {
            return Integer.valueOf(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int usage(String message) {
        System.err.println(message);
        System.err.println(USAGE);
        return 2;
    }

    private ShapeMlCli() {}
}
