package com.shapeml.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.shapeml.debug.Debug;
import com.shapeml.script.parser.Expr.ExprInterface;
import com.shapeml.script.parser.Expr.Literal;
import com.shapeml.script.parser.Expr.Name;
import com.shapeml.script.parser.Expr.Op;
import com.shapeml.script.parser.Expr.OpType;
import com.shapeml.script.parser.Expr.Scope;

/**
 * Recursive-descent parser that fills a {@link Grammar} from a token stream.
 *
 * <pre>
 * stmt_list := (stmt ';')* EOF
 * stmt      := parameter | constant | function | rule
 * </pre>
 *
 * Expressions parsed inside a rule's probability, condition or successor are marked
 * as allowed to see shape-local state.
 */
public class Parser {
    private static final String TAG = "shapeml.parser";

    private Lexer lexer;
    private Grammar grammar;
    private Token lookahead;
    private boolean shapeLocalsAllowed = false;
    private String lastError;

    /** Parses a grammar file. Returns false if lexing or parsing failed. */
    public boolean parse(String fileName, Grammar grammar) {
        Lexer lex = new Lexer();
        if (!lex.open(fileName)) {
            lastError = lex.lastError();
            Debug.get().e(TAG, "ERROR: Initialization of lexer failed.");
            return false;
        }
        return run(lex, fileName, grammar);
    }

    /** Parses an in-memory source; {@code fileName} is used for locators and include paths. */
    public boolean parseString(String fileName, String source, Grammar grammar) {
        Lexer lex = new Lexer();
        lex.openSource(fileName, source);
        return run(lex, fileName, grammar);
    }

    public String lastError() {
        return lastError;
    }

    private boolean run(Lexer lex, String fileName, Grammar target) {
        lexer = lex;
        grammar = target;
        lastError = null;

        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        if (slash >= 0) {
            grammar.setBasePath(fileName.substring(0, slash + 1));
        }
        grammar.setFileName(fileName.substring(slash + 1));

        shapeLocalsAllowed = false;
        lookahead = lexer.scan();
        try {
            statementList();
            return true;
        } catch (ParseError e) {
            if (lookahead.type == TokenType.ERROR) {
                lastError = lookahead.lexeme;
            } else if (e.semantic) {
                lastError = prefix() + e.getMessage();
                Debug.get().e(TAG, lastError);
            } else {
                StringBuilder sb = new StringBuilder(prefix());
                sb.append("Unexpected token of type ").append(lookahead.type).append('.');
                String expected = e.expectedText();
                if (!expected.isEmpty()) {
                    sb.append(" Expected a token of type ").append(expected).append('.');
                }
                lastError = sb.toString();
                Debug.get().e(TAG, lastError);
            }
            return false;
        } finally {
            lexer = null;
            grammar = null;
        }
    }

    private String prefix() {
        return "ERROR (file: " + lookahead.file + ", line: " + lookahead.line + "): ";
    }

    // -------------------------
    // Statements
    // -------------------------

    private void statementList() {
        while (!check(TokenType.END_OF_FILE)) {
            if (check(TokenType.ERROR)) throw ParseError.mismatch();
            statement();
            consume(TokenType.SEMICOLON);
        }
    }

    private void statement() {
        if (check(TokenType.PARAM)) {
            parameter();
        } else if (check(TokenType.CONST)) {
            constant();
        } else if (check(TokenType.FUNC)) {
            function();
        } else if (check(TokenType.RULE)) {
            rule();
        } else {
            throw ParseError.mismatch(TokenType.PARAM, TokenType.CONST, TokenType.FUNC, TokenType.RULE);
        }
    }

    private static String collision(String what, String name) {
        return "Cannot create " + what + " '" + name + "'. It is either a reserved name or there "
                + "already exists a variable with that name.";
    }

    private void parameter() {
        consume(TokenType.PARAM);
        String name = consumeId();
        consume(TokenType.ASSIGN);
        Value value = parameterLiteral();
        if (grammar.addParameter(name, value) == AddResult.NAME_COLLISION) {
            throw ParseError.semantic(collision("parameter", name));
        }
    }

    private void constant() {
        consume(TokenType.CONST);
        String name = consumeId();
        consume(TokenType.ASSIGN);
        ExprInterface expr = genericExpr();
        if (grammar.addConstant(name, expr) == AddResult.NAME_COLLISION) {
            throw ParseError.semantic(collision("constant", name));
        }
    }

    private void function() {
        consume(TokenType.FUNC);
        String name = consumeId();
        List<String> params = argumentNames();
        consume(TokenType.ASSIGN);
        ExprInterface body = genericExpr();

        AddResult added = grammar.addFunction(new UserFunction(name, params, body));
        if (added == AddResult.NAME_COLLISION) {
            throw ParseError.semantic(collision("function", name));
        } else if (added == AddResult.DUPLICATE_ARG) {
            throw ParseError.semantic("Cannot create function '" + name
                    + "' which takes several arguments with the same name.");
        }
    }

    private void rule() {
        consume(TokenType.RULE);
        String predecessor = consumeId();
        List<String> params = argumentNames();

        shapeLocalsAllowed = true;
        ExprInterface probability = match(TokenType.COLON) ? expression() : null;
        ExprInterface condition = match(TokenType.DOUBLE_COLON) ? expression() : null;
        shapeLocalsAllowed = false;

        consume(TokenType.ASSIGN);
        List<ShapeOp> successor = shapeOpString();
        Locator lastLine = Locator.of(lookahead);

        AddResult added = grammar.addRule(new Rule(predecessor, params, probability, condition, successor, lastLine));
        switch (added) {
            case NAME_COLLISION:
                throw ParseError.semantic("Cannot create production rule '" + predecessor
                        + "'. This name is reserved for predefined shape operations.");
            case DUPLICATE_ARG:
                throw ParseError.semantic("Cannot create production rule '" + predecessor
                        + "' which takes several arguments with the same name.");
            case PREDECESSOR_ENDS_IN_UNDERSCORE:
                throw ParseError.semantic("Cannot create production rule '" + predecessor
                        + "'. Names that end with an underscore are reserved for terminals.");
            default:
                break;
        }
    }

    private List<String> argumentNames() {
        List<String> names = new ArrayList<>();
        if (match(TokenType.BRACKET_ROUND_OPEN)) {
            do {
                names.add(consumeId());
            } while (match(TokenType.COMMA));
            if (!check(TokenType.BRACKET_ROUND_CLOSE)) {
                throw ParseError.mismatch(TokenType.COMMA, TokenType.BRACKET_ROUND_CLOSE);
            }
            advance();
        }
        return names;
    }

    // -------------------------
    // Shape operation strings
    // -------------------------

    private ExprInterface genericExpr() {
        if (check(TokenType.BRACKET_CURLY_OPEN)) {
            return new Literal(Value.ops(shapeOpString()));
        }
        return expression();
    }

    private List<ShapeOp> shapeOpString() {
        consume(TokenType.BRACKET_CURLY_OPEN);
        List<ShapeOp> ops = new ArrayList<>();
        while (!check(TokenType.BRACKET_CURLY_CLOSE)) {
            ops.add(shapeOp());
        }
        consume(TokenType.BRACKET_CURLY_CLOSE);
        return ops;
    }

    private ShapeOp shapeOp() {
        boolean reference = match(TokenType.CARET);
        Locator locator = Locator.of(lookahead);
        String name;
        if (reference) {
            name = consumeId();
        } else if (check(TokenType.ID)) {
            name = consumeId();
        } else if (match(TokenType.BRACKET_SQUARE_OPEN)) {
            name = "[";
        } else if (match(TokenType.BRACKET_SQUARE_CLOSE)) {
            name = "]";
        } else {
            throw ParseError.mismatch(TokenType.ID, TokenType.CARET, TokenType.BRACKET_SQUARE_OPEN,
                    TokenType.BRACKET_SQUARE_CLOSE, TokenType.BRACKET_CURLY_CLOSE);
        }

        boolean previous = shapeLocalsAllowed;
        shapeLocalsAllowed = true;
        List<ExprInterface> args = callArguments();
        shapeLocalsAllowed = previous;
        return new ShapeOp(name, args, reference, locator);
    }

    private List<ExprInterface> callArguments() {
        List<ExprInterface> args = new ArrayList<>();
        if (match(TokenType.BRACKET_ROUND_OPEN)) {
            do {
                args.add(genericExpr());
            } while (match(TokenType.COMMA));
            if (!check(TokenType.BRACKET_ROUND_CLOSE)) {
                throw ParseError.mismatch(TokenType.COMMA, TokenType.BRACKET_ROUND_CLOSE);
            }
            advance();
        }
        return args;
    }

    // -------------------------
    // Expressions, lowest precedence first
    // -------------------------

    private ExprInterface expression() {
        ExprInterface expr = and();
        while (check(TokenType.OP_OR)) {
            Locator loc = Locator.of(advance());
            expr = new Op(expr, OpType.OR, and(), loc);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = equality();
        while (check(TokenType.OP_AND)) {
            Locator loc = Locator.of(advance());
            expr = new Op(expr, OpType.AND, equality(), loc);
        }
        return expr;
    }

    private ExprInterface equality() {
        ExprInterface expr = relational();
        while (true) {
            OpType op;
            if (check(TokenType.OP_EQUAL)) op = OpType.EQUAL;
            else if (check(TokenType.OP_NOT_EQUAL)) op = OpType.NOT_EQUAL;
            else break;
            Locator loc = Locator.of(advance());
            expr = new Op(expr, op, relational(), loc);
        }
        return expr;
    }

    private ExprInterface relational() {
        ExprInterface expr = additive();
        while (true) {
            OpType op;
            if (check(TokenType.OP_LESS)) op = OpType.LESS;
            else if (check(TokenType.OP_LESS_EQUAL)) op = OpType.LESS_EQUAL;
            else if (check(TokenType.OP_GREATER)) op = OpType.GREATER;
            else if (check(TokenType.OP_GREATER_EQUAL)) op = OpType.GREATER_EQUAL;
            else break;
            Locator loc = Locator.of(advance());
            expr = new Op(expr, op, additive(), loc);
        }
        return expr;
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        while (true) {
            OpType op;
            if (check(TokenType.OP_PLUS)) op = OpType.PLUS;
            else if (check(TokenType.OP_MINUS)) op = OpType.MINUS;
            else break;
            Locator loc = Locator.of(advance());
            expr = new Op(expr, op, multiplicative(), loc);
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        while (true) {
            OpType op;
            if (check(TokenType.OP_MULT)) op = OpType.MULT;
            else if (check(TokenType.OP_DIV)) op = OpType.DIV;
            else if (check(TokenType.OP_MODULO)) op = OpType.MODULO;
            else break;
            Locator loc = Locator.of(advance());
            expr = new Op(expr, op, unary(), loc);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (check(TokenType.OP_NOT)) {
            Locator loc = Locator.of(advance());
            return Op.unary(OpType.NOT, primary(), loc);
        }
        if (check(TokenType.OP_MINUS)) {
            Locator loc = Locator.of(advance());
            return Op.unary(OpType.NEGATE, primary(), loc);
        }
        return primary();
    }

    private ExprInterface primary() {
        if (match(TokenType.BRACKET_ROUND_OPEN)) {
            ExprInterface inner = expression();
            consume(TokenType.BRACKET_ROUND_CLOSE);
            return new Scope(inner);
        }
        if (check(TokenType.ID)) {
            Locator loc = Locator.of(lookahead);
            String name = consumeId();
            List<ExprInterface> args = callArguments();
            return new Name(name, args, shapeLocalsAllowed, loc);
        }
        return new Literal(literal());
    }

    private Value literal() {
        if (match(TokenType.TRUE)) return Value.bool(true);
        if (match(TokenType.FALSE)) return Value.bool(false);
        if (check(TokenType.INT)) return Value.integer(advance().intValue());
        if (check(TokenType.FLOAT)) return Value.number(advance().floatValue());
        if (check(TokenType.STRING)) return Value.string(advance().lexeme);
        throw ParseError.mismatch();
    }

    /** Parameter defaults: a literal, optionally a negated number. */
    private Value parameterLiteral() {
        if (match(TokenType.OP_MINUS)) {
            if (check(TokenType.INT)) return Value.integer(-advance().intValue());
            if (check(TokenType.FLOAT)) return Value.number(-advance().floatValue());
            throw ParseError.mismatch(TokenType.INT, TokenType.FLOAT);
        }
        return literal();
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private boolean check(TokenType type) {
        return lookahead.type == type;
    }

    private Token advance() {
        Token previous = lookahead;
        lookahead = lexer.scan();
        return previous;
    }

    private boolean match(TokenType type) {
        if (!check(type)) return false;
        advance();
        return true;
    }

    private Token consume(TokenType type) {
        if (!check(type)) throw ParseError.mismatch(type);
        return advance();
    }

    private String consumeId() {
        return consume(TokenType.ID).lexeme;
    }
}
