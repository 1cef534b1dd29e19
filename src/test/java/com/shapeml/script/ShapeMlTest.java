package com.shapeml.script;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shapeml.script.interpreter.Interpreter;
import com.shapeml.script.interpreter.Result;
import com.shapeml.script.parser.Grammar;
import com.shapeml.script.parser.Value;
import com.shapeml.shape.Shape;

public class ShapeMlTest {

    @Test
    void parameter_values_are_typed() {
        assertEquals(Value.bool(true), ShapeMl.parseParameterValue("true"));
        assertEquals(Value.bool(false), ShapeMl.parseParameterValue("false"));
        assertEquals(Value.integer(-12), ShapeMl.parseParameterValue("-12"));
        assertEquals(Value.number(2.5), ShapeMl.parseParameterValue("2.5"));
        assertEquals(Value.number(3.0), ShapeMl.parseParameterValue("3."));
        assertEquals(Value.number(1e10), ShapeMl.parseParameterValue("10000000000"));
        assertEquals(Value.string("brick"), ShapeMl.parseParameterValue("brick"));
        assertEquals(Value.string("True"), ShapeMl.parseParameterValue("True"));
    }

    @Test
    void parse_failure_carries_parser_message() {
        Result<Grammar> g = ShapeMl.parseString("bad.shp", "rule Axiom = { A }");
        assertTrue(g.failed());
        assertTrue(g.error().message().startsWith("ERROR (file: bad.shp, line: 1): "), g.error().message());
    }

    @Test
    void missing_file_fails() {
        assertTrue(ShapeMl.parseFile("/does/not/exist.shp").failed());
    }

    @Test
    void derive_file_resolves_includes(@TempDir Path dir) throws IOException {
        Files.write(dir.resolve("lib.shp"), "rule Part = { Part_ };\n".getBytes(StandardCharsets.UTF_8));
        Path main = dir.resolve("main.shp");
        Files.write(main, "#include \"lib.shp\"\nrule Axiom = { Part };\n".getBytes(StandardCharsets.UTF_8));
        Result<Shape> root = ShapeMl.deriveFile(main.toString(), new Interpreter.Options());
        assertTrue(root.isOk(), () -> root.error().toString());
        assertEquals("Part_", root.value().children().get(0).children().get(0).name());
    }

    @Test
    void cli_exit_codes(@TempDir Path dir) throws IOException {
        assertEquals(0, ShapeMlCli.run(new String[] {"--help"}));
        assertEquals(2, ShapeMlCli.run(new String[] {}));
        assertEquals(2, ShapeMlCli.run(new String[] {"--seed", "abc", "x.shp"}));
        assertEquals(2, ShapeMlCli.run(new String[] {"--max-steps", "0", "x.shp"}));
        assertEquals(2, ShapeMlCli.run(new String[] {"--bogus", "x.shp"}));
        assertEquals(2, ShapeMlCli.run(new String[] {"--parameter", "novalue", "x.shp"}));
        assertEquals(1, ShapeMlCli.run(new String[] {dir.resolve("missing.shp").toString()}));

        Path grammar = dir.resolve("g.shp");
        Files.write(grammar, "param n = 1;\nrule Axiom = { quad repeat(n, { Tile_ }) };\n"
                .getBytes(StandardCharsets.UTF_8));
        assertEquals(0, ShapeMlCli.run(new String[] {"--only-lexer", grammar.toString()}));
        assertEquals(0, ShapeMlCli.run(new String[] {"--only-parser", "--print-grammar", grammar.toString()}));

        Path out = dir.resolve("tree.json");
        assertEquals(0, ShapeMlCli.run(new String[] {
            "--seed", "3", "--parameter", "n=4", "--export-json", out.toString(), grammar.toString()}));
        JsonNode json = new ObjectMapper().readTree(out.toFile());
        assertEquals(4, json.get("children").size());

        assertEquals(3, ShapeMlCli.run(new String[] {
            "--export-json", dir.resolve("no/such/dir/tree.json").toString(), grammar.toString()}));
    }
}
