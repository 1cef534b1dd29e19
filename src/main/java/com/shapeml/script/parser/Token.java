package com.shapeml.script.parser;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public class Token {
    private static final double FLOAT_EPSILON = 1e-8;
    private static final ConcurrentHashMap<String, String> FILE_NAMES = new ConcurrentHashMap<>();

    final TokenType type;
    /** Identifier or string payload; for ERROR tokens the formatted lexer message. */
    public final String lexeme;
    final Object literal;
    public final int line;
    public final String file;

    Token(TokenType type, String lexeme, Object literal, int line, String file) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.file = intern(file);
    }

    public static Token of(TokenType type, int line, String file) {
        return new Token(type, null, null, line, file);
    }

    public static Token ofInt(int value, int line, String file) {
        return new Token(TokenType.INT, null, value, line, file);
    }

    public static Token ofFloat(double value, int line, String file) {
        return new Token(TokenType.FLOAT, null, value, line, file);
    }

    public static Token ofString(String value, int line, String file) {
        return new Token(TokenType.STRING, value, null, line, file);
    }

    public static Token ofId(String id, int line, String file) {
        return new Token(TokenType.ID, id, null, line, file);
    }

    static Token error(String message, int line, String file) {
        return new Token(TokenType.ERROR, message, null, line, file);
    }

    /** File names are shared so locators of one file point at the same string. */
    static String intern(String file) {
        if (file == null || file.isEmpty()) return null;
        return FILE_NAMES.computeIfAbsent(file, f -> f);
    }

    public TokenType type() { return type; }

    public int intValue() {
        if (type != TokenType.INT) throw new IllegalStateException("Expected INT token, got " + type);
        return (Integer) literal;
    }

    public double floatValue() {
        if (type != TokenType.FLOAT) throw new IllegalStateException("Expected FLOAT token, got " + type);
        return (Double) literal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        if (type != other.type || line != other.line || !Objects.equals(file, other.file)) return false;
        switch (type) {
            case INT:
                return intValue() == other.intValue();
            case FLOAT:
                return Math.abs(floatValue() - other.floatValue()) < FLOAT_EPSILON;
            case STRING:
            case ID:
                return Objects.equals(lexeme, other.lexeme);
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, line, file);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Token (type: ").append(type);
        switch (type) {
            case INT: sb.append(", value: ").append(intValue()); break;
            case FLOAT: sb.append(", value: ").append(Value.formatGeneral(floatValue())); break;
            case STRING: sb.append(", value: \"").append(lexeme).append('"'); break;
            case ID: sb.append(", value: ").append(lexeme); break;
            default: break;
        }
        sb.append(", line: ").append(line);
        sb.append(", file: ").append(file).append(')');
        return sb.toString();
    }
}
