package com.shapeml.script.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LexerTest {

    private static List<Token> lex(String src) {
        Lexer lexer = new Lexer();
        lexer.openSource("test.shp", src);
        return lexer.tokenize();
    }

    private static Token last(List<Token> tokens) {
        return tokens.get(tokens.size() - 1);
    }

    @Test
    void empty_source_is_a_single_eof() {
        List<Token> tokens = lex("");
        assertEquals(1, tokens.size());
        assertEquals(TokenType.END_OF_FILE, tokens.get(0).type());
    }

    @Test
    void operators_and_punctuation() {
        List<Token> tokens = lex("+ - * / % <= >= < > == != && || ! = , ; :: : ^ ( ) [ ] { }");
        TokenType[] expected = {
            TokenType.OP_PLUS, TokenType.OP_MINUS, TokenType.OP_MULT, TokenType.OP_DIV, TokenType.OP_MODULO,
            TokenType.OP_LESS_EQUAL, TokenType.OP_GREATER_EQUAL, TokenType.OP_LESS, TokenType.OP_GREATER,
            TokenType.OP_EQUAL, TokenType.OP_NOT_EQUAL, TokenType.OP_AND, TokenType.OP_OR, TokenType.OP_NOT,
            TokenType.ASSIGN, TokenType.COMMA, TokenType.SEMICOLON, TokenType.DOUBLE_COLON, TokenType.COLON,
            TokenType.CARET, TokenType.BRACKET_ROUND_OPEN, TokenType.BRACKET_ROUND_CLOSE,
            TokenType.BRACKET_SQUARE_OPEN, TokenType.BRACKET_SQUARE_CLOSE,
            TokenType.BRACKET_CURLY_OPEN, TokenType.BRACKET_CURLY_CLOSE, TokenType.END_OF_FILE
        };
        assertEquals(expected.length, tokens.size());
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], tokens.get(i).type(), "token " + i);
        }
    }

    @Test
    void keywords_and_identifiers() {
        List<Token> tokens = lex("param const func rule true false Axiom _x1 Window_");
        assertEquals(TokenType.PARAM, tokens.get(0).type());
        assertEquals(TokenType.CONST, tokens.get(1).type());
        assertEquals(TokenType.FUNC, tokens.get(2).type());
        assertEquals(TokenType.RULE, tokens.get(3).type());
        assertEquals(TokenType.TRUE, tokens.get(4).type());
        assertEquals(TokenType.FALSE, tokens.get(5).type());
        assertEquals(TokenType.ID, tokens.get(6).type());
        assertEquals("Axiom", tokens.get(6).lexeme);
        assertEquals("_x1", tokens.get(7).lexeme);
        assertEquals("Window_", tokens.get(8).lexeme);
    }

    @Test
    void numbers() {
        List<Token> tokens = lex("0 42 2147483647 1.5 0.25 3.");
        assertEquals(42, tokens.get(1).intValue());
        assertEquals(Integer.MAX_VALUE, tokens.get(2).intValue());
        assertEquals(1.5, tokens.get(3).floatValue(), 1e-9);
        assertEquals(0.25, tokens.get(4).floatValue(), 1e-9);
        assertEquals(6, tokens.size());
        assertEquals(TokenType.ERROR, last(tokens).type());
        assertTrue(last(tokens).lexeme.contains("Expected a digit after the decimal point."));
    }

    @Test
    void int_overflow_is_an_error() {
        List<Token> tokens = lex("2147483648");
        assertEquals(1, tokens.size());
        assertEquals(TokenType.ERROR, tokens.get(0).type());
        assertTrue(tokens.get(0).lexeme.contains("Integer overflow."));
    }

    @Test
    void strings_and_line_numbers() {
        List<Token> tokens = lex("\"abc\"\n\n\"d e\"");
        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("abc", tokens.get(0).lexeme);
        assertEquals(1, tokens.get(0).line);
        assertEquals("d e", tokens.get(1).lexeme);
        assertEquals(3, tokens.get(1).line);
    }

    @Test
    void unterminated_string_is_an_error() {
        Token t = last(lex("\"abc"));
        assertEquals(TokenType.ERROR, t.type());
        assertTrue(t.lexeme.contains("Reached EOF inside string."));
    }

    @Test
    void unknown_char_stops_tokenizing() {
        List<Token> tokens = lex("a $ b");
        assertEquals(2, tokens.size());
        assertEquals(TokenType.ERROR, tokens.get(1).type());
        assertTrue(tokens.get(1).lexeme.startsWith("ERROR (file: test.shp, line 1): "));
    }

    @Test
    void comments_are_skipped() {
        List<Token> tokens = lex("a // line comment\n/* block\ncomment */ b");
        assertEquals(3, tokens.size());
        assertEquals("a", tokens.get(0).lexeme);
        assertEquals("b", tokens.get(1).lexeme);
        assertEquals(3, tokens.get(1).line);
    }

    @Test
    void unterminated_block_comment_is_an_error() {
        Token t = last(lex("a /* never closed"));
        assertEquals(TokenType.ERROR, t.type());
        assertTrue(t.lexeme.contains("Reached EOF before closing comment with */."));
    }

    @Test
    void include_splices_tokens_of_other_file(@TempDir Path dir) throws IOException {
        Files.write(dir.resolve("inner.shp"), "const b = 2;".getBytes(StandardCharsets.UTF_8));
        Path main = dir.resolve("main.shp");
        Files.write(main, "#include \"inner.shp\"\nconst a = 1;".getBytes(StandardCharsets.UTF_8));

        Lexer lexer = new Lexer();
        assertTrue(lexer.open(main.toString()));
        List<Token> tokens = lexer.tokenize();
        assertEquals(TokenType.END_OF_FILE, last(tokens).type());
        assertEquals("b", tokens.get(1).lexeme);
        assertTrue(tokens.get(1).file.endsWith("inner.shp"));
        assertEquals("a", tokens.get(6).lexeme);
        assertTrue(tokens.get(6).file.endsWith("main.shp"));
    }

    @Test
    void include_depth_is_limited(@TempDir Path dir) throws IOException {
        int files = Lexer.MAX_INCLUDE_DEPTH + 2;
        for (int i = 0; i < files; i++) {
            String body = i + 1 < files ? "#include \"f" + (i + 1) + ".shp\"\n" : "const x = 1;\n";
            Files.write(dir.resolve("f" + i + ".shp"), body.getBytes(StandardCharsets.UTF_8));
        }
        Lexer lexer = new Lexer();
        assertTrue(lexer.open(dir.resolve("f0.shp").toString()));
        Token t = last(lexer.tokenize());
        assertEquals(TokenType.ERROR, t.type());
        assertTrue(t.lexeme.contains("Reached max level of 20."));
    }

    @Test
    void directive_must_be_on_its_own_line() {
        Token t = last(lex("const a = 1; #include \"x.shp\""));
        assertEquals(TokenType.ERROR, t.type());
        assertTrue(t.lexeme.contains("Preprocessor directives must be on their own line."));
    }
}
