package com.shapeml.script.parser;

import java.util.List;

/**
 * Thrown inside the parser when a statement cannot be built. A token mismatch lists the
 * expected token kinds (possibly none); a semantic failure carries a full message.
 */
final class ParseError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    final boolean semantic;
    final List<TokenType> expected;

    private ParseError(String message, boolean semantic, List<TokenType> expected) {
        super(message);
        this.semantic = semantic;
        this.expected = expected;
    }

    static ParseError mismatch(TokenType... expected) {
        return new ParseError("token mismatch", false, List.of(expected));
    }

    static ParseError semantic(String message) {
        return new ParseError(message, true, List.of());
    }

    /** {@code X} or {@code (X, Y, Z)}; empty when nothing specific was expected. */
    String expectedText() {
        if (expected.isEmpty()) return "";
        if (expected.size() == 1) return expected.get(0).name();
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < expected.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(expected.get(i).name());
        }
        return sb.append(')').toString();
    }
}
