package com.shapeml.script.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.shapeml.debug.Debug;

/**
 * Tokenizer for grammar files with an include stack.
 *
 * On the first failure a single ERROR token is produced whose lexeme holds the
 * formatted message; scanning must stop there.
 */
public class Lexer {
    public static final int MAX_INCLUDE_DEPTH = 20;
    private static final String TAG = "shapeml.lexer";

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("const", TokenType.CONST);
        map.put("func", TokenType.FUNC);
        map.put("param", TokenType.PARAM);
        map.put("rule", TokenType.RULE);
        keywords = Collections.unmodifiableMap(map);
    }

    private static final class LexerState {
        final String fileName;
        final String source;
        int current = 0;
        int line = 1;
        boolean lineStart = true;

        LexerState(String fileName, String source) {
            this.fileName = Token.intern(fileName);
            this.source = source;
        }
    }

    private final Deque<LexerState> states = new ArrayDeque<>();
    private String lastError;

    /** Opens a grammar file. Returns false (and records the error) if it cannot be read. */
    public boolean open(String fileName) {
        String source;
        try {
            source = Files.readString(Path.of(fileName), StandardCharsets.ISO_8859_1);
        } catch (IOException | RuntimeException e) {
            if (!states.isEmpty()) {
                states.peek().line--;  // the directive's new line was already counted
            }
            error("Cannot open file '" + fileName + "' for lexing.");
            return false;
        }
        states.push(new LexerState(fileName, source));
        return true;
    }

    /** Lexes an in-memory source. Includes are resolved relative to {@code fileName}'s directory. */
    public void openSource(String fileName, String source) {
        states.push(new LexerState(fileName, source));
    }

    public String lastError() {
        return lastError;
    }

    /** Scans until END_OF_FILE or ERROR; the terminal token is included. */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token tok = scan();
        while (tok.type != TokenType.END_OF_FILE && tok.type != TokenType.ERROR) {
            tokens.add(tok);
            tok = scan();
        }
        tokens.add(tok);
        return tokens;
    }

    public Token scan() {
        if (states.isEmpty()) {
            throw new IllegalStateException("Lexer has no open input");
        }
        boolean lineStart = state().lineStart;

        Token tok = nextToken();
        while (tok.type == TokenType.NEW_LINE) {
            lineStart = true;
            tok = nextToken();
        }
        state().lineStart = false;

        if (tok.type == TokenType.HASHTAG) {
            if (!lineStart) {
                return error("Preprocessor directives must be on their own line.");
            }
            Token failure = handlePreprocessorDirective();
            if (failure != null) return failure;
            return scan();
        } else if (tok.type == TokenType.END_OF_FILE && states.size() > 1) {
            states.pop();
            return scan();
        }
        return tok;
    }

    private LexerState state() {
        return states.peek();
    }

    private Token nextToken() {
        LexerState s = state();
        while (true) {
            if (isAtEnd()) {
                return Token.of(TokenType.END_OF_FILE, s.line, s.fileName);
            }
            char c = advance();

            if (c == ' ' || c == '\t') {
                continue;
            } else if (c == '\n') {
                return Token.of(TokenType.NEW_LINE, s.line++, s.fileName);
            } else if (c == '\r') {
                match('\n');
                return Token.of(TokenType.NEW_LINE, s.line++, s.fileName);
            } else if (c == '/' && peek() == '*') {
                advance();
                if (!blockComment()) {
                    return error("Reached EOF before closing comment with */.");
                }
            } else if (c == '/' && peek() == '/') {
                while (!isAtEnd() && peek() != '\n' && peek() != '\r') advance();
            } else if (isDigit(c)) {
                return number(c);
            } else if (c == '"') {
                return string();
            } else if (isAlpha(c)) {
                return identifier(c);
            } else {
                Token tok = punctuation(c);
                if (tok == null) {
                    return error("Unknown char: '" + c + "'.");
                }
                return tok;
            }
        }
    }

    private boolean blockComment() {
        LexerState s = state();
        while (true) {
            if (isAtEnd()) return false;
            char c = advance();
            if (c == '*' && peek() == '/') {
                advance();
                return true;
            }
            if (c == '\n') {
                s.line++;
            } else if (c == '\r') {
                s.line++;
                match('\n');
            }
        }
    }

    private Token number(char first) {
        LexerState s = state();
        long sum = 0;
        boolean overflow = false;
        double sumD = 0.0;
        char c = first;
        while (true) {
            if (!overflow) {
                sum = 10 * sum + (c - '0');
                if (sum > Integer.MAX_VALUE) overflow = true;
            }
            sumD = 10.0 * sumD + (c - '0');
            if (!isDigit(peek())) break;
            c = advance();
        }

        if (peek() != '.') {
            if (overflow) return error("Integer overflow.");
            return Token.ofInt((int) sum, s.line, s.fileName);
        }
        advance();
        if (!isDigit(peek())) {
            return error("Expected a digit after the decimal point.");
        }
        double exp = 1.0;
        while (isDigit(peek())) {
            exp *= 10.0;
            sumD += (advance() - '0') / exp;
        }
        if (Double.isInfinite(sumD)) {
            return error("Floating point number at infinity.");
        }
        return Token.ofFloat(sumD, s.line, s.fileName);
    }

    private Token string() {
        LexerState s = state();
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (isAtEnd()) return error("Reached EOF inside string.");
            char c = advance();
            if (c < 32 || c > 126) return error("Illegal character in string.");

            if (c == '"') {
                break;
            } else if (c == '\\' && peek() == '"') {
                advance();
                sb.append('"');
            } else if (c == '\\' && peek() == 'n') {
                advance();
                sb.append('\n');
            } else if (c == '\\' && peek() == 't') {
                advance();
                sb.append('\t');
            } else {
                sb.append(c);
            }
        }
        return Token.ofString(sb.toString(), s.line, s.fileName);
    }

    private Token identifier(char first) {
        LexerState s = state();
        StringBuilder sb = new StringBuilder().append(first);
        while (isAlphaNumeric(peek())) sb.append(advance());
        String text = sb.toString();
        TokenType keyword = keywords.get(text);
        if (keyword != null) return Token.of(keyword, s.line, s.fileName);
        return Token.ofId(text, s.line, s.fileName);
    }

    private Token punctuation(char c) {
        TokenType type;
        switch (c) {
            case ',': type = TokenType.COMMA; break;
            case ';': type = TokenType.SEMICOLON; break;
            case ':': type = match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON; break;
            case '^': type = TokenType.CARET; break;
            case '#': type = TokenType.HASHTAG; break;
            case '(': type = TokenType.BRACKET_ROUND_OPEN; break;
            case ')': type = TokenType.BRACKET_ROUND_CLOSE; break;
            case '[': type = TokenType.BRACKET_SQUARE_OPEN; break;
            case ']': type = TokenType.BRACKET_SQUARE_CLOSE; break;
            case '{': type = TokenType.BRACKET_CURLY_OPEN; break;
            case '}': type = TokenType.BRACKET_CURLY_CLOSE; break;
            case '+': type = TokenType.OP_PLUS; break;
            case '-': type = TokenType.OP_MINUS; break;
            case '*': type = TokenType.OP_MULT; break;
            case '/': type = TokenType.OP_DIV; break;
            case '%': type = TokenType.OP_MODULO; break;
            case '<': type = match('=') ? TokenType.OP_LESS_EQUAL : TokenType.OP_LESS; break;
            case '>': type = match('=') ? TokenType.OP_GREATER_EQUAL : TokenType.OP_GREATER; break;
            case '=': type = match('=') ? TokenType.OP_EQUAL : TokenType.ASSIGN; break;
            case '!': type = match('=') ? TokenType.OP_NOT_EQUAL : TokenType.OP_NOT; break;
            case '&':
                if (!match('&')) return null;
                type = TokenType.OP_AND;
                break;
            case '|':
                if (!match('|')) return null;
                type = TokenType.OP_OR;
                break;
            default:
                return null;
        }
        return Token.of(type, state().line, state().fileName);
    }

    /** Handles {@code #include "path"}. Returns an ERROR token on failure, else null. */
    private Token handlePreprocessorDirective() {
        Token tok = nextToken();
        if (tok.type == TokenType.ERROR) return tok;
        if (tok.type != TokenType.ID) {
            return error(unexpected(tok.type) + "Expected a token of type ID that is recognized by the preprocesor.");
        }
        if (!"include".equals(tok.lexeme)) {
            return error("'" + tok.lexeme + "' is not a valid preprocessor directive.");
        }

        tok = nextToken();
        if (tok.type == TokenType.ERROR) return tok;
        if (tok.type != TokenType.STRING) {
            return error(unexpected(tok.type) + "Expected a token of type STRING that contains a path to a file.");
        }
        String includePath = tok.lexeme;

        tok = nextToken();
        if (tok.type == TokenType.ERROR) return tok;
        if (tok.type != TokenType.NEW_LINE) {
            return error(unexpected(tok.type) + "Preprocessor directives must be on their own line.");
        }
        state().lineStart = true;

        if (!includePath.isEmpty()) {
            String current = state().fileName == null ? "" : state().fileName;
            int slash = Math.max(current.lastIndexOf('/'), current.lastIndexOf('\\'));
            includePath = current.substring(0, slash + 1) + includePath;

            if (states.size() == MAX_INCLUDE_DEPTH) {
                state().line--;
                return error("To many nested include files. Reached max level of " + MAX_INCLUDE_DEPTH + ".");
            }
            if (!open(includePath)) {
                LexerState s = state();
                return Token.error(lastError, s.line, s.fileName);
            }
        }
        return null;
    }

    private static String unexpected(TokenType type) {
        return "Unexpected token of type " + type + ". ";
    }

    private Token error(String message) {
        LexerState s = state();
        String prefix = (s == null || s.fileName == null)
                ? "ERROR: "
                : "ERROR (file: " + s.fileName + ", line " + s.line + "): ";
        lastError = prefix + message;
        Debug.get().e(TAG, lastError);
        int line = s == null ? -1 : s.line;
        String file = s == null ? null : s.fileName;
        return Token.error(lastError, line, file);
    }

    private boolean isAtEnd() {
        LexerState s = state();
        return s.current >= s.source.length();
    }

    private char advance() {
        LexerState s = state();
        return s.source.charAt(s.current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || peek() != expected) return false;
        state().current++;
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : state().source.charAt(state().current);
    }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
