package com.shapeml.script.parser;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.List;

/**
 * Runtime value of the grammar language: a tagged union of bool, int, float,
 * string and shape operation string. Values are immutable.
 */
public class Value {
    public enum Type {
        FLOAT("float"),
        INT("int"),
        BOOL("bool"),
        STRING("string"),
        SHAPE_OP_STRING("shape operation string");

        private final String label;

        Type(String label) { this.label = label; }

        public String label() { return label; }
    }

    private static final double EPSILON = 1e-8;

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value integer(int i) { return new Value(Type.INT, i); }
    public static Value number(double d) { return new Value(Type.FLOAT, d); }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value ops(List<ShapeOp> ops) { return new Value(Type.SHAPE_OP_STRING, Collections.unmodifiableList(ops)); }

    public Type getType() { return type; }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (Boolean) value;
    }

    public int asInt() {
        if (type != Type.INT) throw new IllegalStateException("Expected int, got " + type);
        return (Integer) value;
    }

    public double asFloat() {
        if (type != Type.FLOAT) throw new IllegalStateException("Expected float, got " + type);
        return (Double) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<ShapeOp> asOps() {
        if (type != Type.SHAPE_OP_STRING) throw new IllegalStateException("Expected shape operation string, got " + type);
        return (List<ShapeOp>) value;
    }

    public boolean isNumeric() {
        return type == Type.INT || type == Type.FLOAT || type == Type.BOOL;
    }

    /**
     * Returns this value converted to {@code target}, or null when the conversion is illegal.
     * Numbers and bools convert freely among each other, everything but shape operation
     * strings stringifies, and nothing converts back from a string.
     */
    public Value changeType(Type target) {
        if (type == target) return this;
        if (type == Type.SHAPE_OP_STRING || target == Type.SHAPE_OP_STRING) return null;
        switch (target) {
            case FLOAT:
                switch (type) {
                    case INT: return number(asInt());
                    case BOOL: return number(asBool() ? 1.0 : 0.0);
                    default: return null;
                }
            case INT:
                switch (type) {
                    case FLOAT: return integer((int) asFloat());
                    case BOOL: return integer(asBool() ? 1 : 0);
                    default: return null;
                }
            case BOOL:
                switch (type) {
                    case FLOAT: return bool(asFloat() != 0.0);
                    case INT: return bool(asInt() != 0);
                    default: return null;
                }
            case STRING:
                return string(stringify());
            default:
                return null;
        }
    }

    /** The text a value turns into when it is coerced to a string. */
    private String stringify() {
        switch (type) {
            case FLOAT: return formatGeneral(asFloat());
            case INT: return Integer.toString(asInt());
            case BOOL: return asBool() ? "1" : "0";
            default: return (String) value;
        }
    }

    /**
     * Formats like a default C++ output stream: six significant digits, trailing
     * zeros dropped, scientific notation for very small and very large magnitudes.
     */
    public static String formatGeneral(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0.0) return (1.0 / d < 0) ? "-0" : "0";

        BigDecimal rounded = new BigDecimal(d).round(new MathContext(6, RoundingMode.HALF_EVEN));
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= 6) {
            BigDecimal mantissa = rounded.movePointLeft(exponent);
            String m = stripZeros(mantissa.toPlainString());
            String sign = exponent < 0 ? "-" : "+";
            int abs = Math.abs(exponent);
            return m + "e" + sign + (abs < 10 ? "0" : "") + abs;
        }
        return stripZeros(rounded.toPlainString());
    }

    private static String stripZeros(String s) {
        if (s.indexOf('.') < 0) return s;
        int end = s.length();
        while (s.charAt(end - 1) == '0') end--;
        if (s.charAt(end - 1) == '.') end--;
        return s.substring(0, end);
    }

    /** Float literal text that the lexer reads back as the same number. */
    public static String formatLiteral(double d) {
        String plain = BigDecimal.valueOf(d).toPlainString();
        if (plain.indexOf('.') < 0) plain = plain + ".0";
        return plain;
    }

    static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case FLOAT:
                return Math.abs(asFloat() - other.asFloat()) < EPSILON;
            case SHAPE_OP_STRING:
                return toString().equals(other.toString());
            default:
                return value.equals(other.value);
        }
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        switch (type) {
            case FLOAT:
                return formatLiteral(asFloat());
            case INT:
                return Integer.toString(asInt());
            case BOOL:
                return asBool() ? "true" : "false";
            case STRING:
                return '"' + escape(asString()) + '"';
            case SHAPE_OP_STRING:
                return ShapeOp.print(asOps(), false);
            default:
                return "";
        }
    }

    /** Prints {@code (a, b, c)} or nothing for an empty list. */
    public static String printList(List<Value> values) {
        if (values.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(values.get(i));
        }
        return sb.append(')').toString();
    }
}
