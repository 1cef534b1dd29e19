package com.shapeml.script.parser;

public enum TokenType {
    ERROR,
    END_OF_FILE,
    NEW_LINE,

    // Literals
    TRUE, FALSE, INT, FLOAT, STRING, ID,

    // Punctuation
    COMMA, SEMICOLON, DOUBLE_COLON, COLON, CARET, HASHTAG,
    BRACKET_ROUND_OPEN, BRACKET_ROUND_CLOSE,
    BRACKET_SQUARE_OPEN, BRACKET_SQUARE_CLOSE,
    BRACKET_CURLY_OPEN, BRACKET_CURLY_CLOSE,

    // Keywords
    CONST, FUNC, PARAM, RULE,

    // Operators
    OP_PLUS, OP_MINUS, OP_MULT, OP_DIV, OP_MODULO,
    OP_LESS_EQUAL, OP_GREATER_EQUAL, OP_LESS, OP_GREATER,
    OP_EQUAL, OP_NOT_EQUAL, OP_AND, OP_OR, OP_NOT,
    ASSIGN
}
