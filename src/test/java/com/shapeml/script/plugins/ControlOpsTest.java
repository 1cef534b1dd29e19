package com.shapeml.script.plugins;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.shapeml.script.ShapeMl;
import com.shapeml.script.interpreter.Interpreter;
import com.shapeml.script.interpreter.Result;
import com.shapeml.script.parser.Value;
import com.shapeml.shape.Shape;

public class ControlOpsTest {

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    private Result<Shape> derive(String src) {
        Interpreter.Options o = new Interpreter.Options()
                .out(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        return ShapeMl.deriveString("control.shp", src, o);
    }

    private String printed() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private static List<Shape> named(Result<Shape> root, String name) {
        assertTrue(root.isOk(), () -> root.error().toString());
        List<Shape> out = new ArrayList<>();
        root.value().accept(s -> {
            if (s.name().equals(name)) out.add(s);
        });
        return out;
    }

    @Test
    void print_and_print_ln() {
        assertTrue(derive("rule Axiom = { print(\"a\") print(1) printLn(2.5) printLn(true) };").isOk());
        assertEquals("a12.5\n1\n", printed());
    }

    @Test
    void repeat_sets_index_on_copies() {
        List<Shape> pieces = named(derive("rule Axiom = { repeat(3, { P_ }) };"), "P_");
        assertEquals(3, pieces.size());
        for (int i = 0; i < 3; i++) assertEquals(i, pieces.get(i).index());
    }

    @Test
    void repeat_body_sees_index() {
        assertTrue(derive("rule Axiom = { repeat(3, { print(index) }) };").isOk());
        assertEquals("012", printed());
    }

    @Test
    void repeat_without_push_accumulates_transforms() {
        List<Shape> pieces = named(derive("rule Axiom = { repeatNoPush(3, { translateX(2) P_ }) };"), "P_");
        assertEquals(3, pieces.size());
        assertEquals(6.0, pieces.get(2).position().x, 1e-9);
        assertEquals(2, pieces.get(2).index());
    }

    @Test
    void repeat_count_range() {
        assertTrue(derive("rule Axiom = { repeat(-1, { P_ }) };").failed());
        assertTrue(derive("rule Axiom = { repeat(0, { P_ }) };").isOk());
    }

    @Test
    void brackets_restore_scope() {
        List<Shape> shapes = named(derive("rule Axiom = { [ translateX(5) A_ ] B_ };"), "B_");
        assertEquals(0.0, shapes.get(0).position().x, 1e-9);
    }

    @Test
    void pop_without_push_fails() {
        Result<Shape> r = derive("rule Axiom = { A ] };");
        assertTrue(r.failed());
        assertTrue(r.error().message().contains("There are more pops ']' than pushes '['"));
    }

    @Test
    void custom_attributes_are_inherited() {
        List<Shape> leaves = named(derive("rule Axiom = { set(\"floor\", 3) A };\n"
                + "rule A = { printLn(get(\"floor\") + 1) set(\"kind\", \"window\") W_ };"), "W_");
        assertEquals("4\n", printed());
        assertEquals(Value.string("window"), leaves.get(0).getCustomAttribute("kind"));
        assertEquals(Value.integer(3), leaves.get(0).getCustomAttribute("floor"));
    }

    @Test
    void set_checks_name_and_arity() {
        Result<Shape> badName = derive("rule Axiom = { set(\"1abc\", 3) };");
        assertTrue(badName.failed());
        assertTrue(badName.error().message().contains("is not a valid name for a custom shape attribute"));
        assertTrue(derive("rule Axiom = { set(\"a\") };").failed());
    }

    @Test
    void get_of_unknown_attribute_fails() {
        assertTrue(derive("rule Axiom = { printLn(get(\"nothing\")) };").failed());
    }

    @Test
    void hide_and_show() {
        assertFalse(named(derive("rule Axiom = { hide H_ };"), "H_").get(0).visible());
        assertTrue(named(derive("rule Axiom = { hide show S_ };"), "S_").get(0).visible());
    }

    @Test
    void occlusion_against_registered_occluders() {
        Result<Shape> root = derive("rule Axiom = { A B };\n"
                + "rule A = { size(4, 4, 4) cube octreeAdd A_ };\n"
                + "rule B = { size(4, 4, 4) cube [ scaleCenter(0.5, 0.5, 0.5) printLn(occlusion) ] "
                + "[ translateX(10) printLn(occlusion) ] };");
        assertTrue(root.isOk(), () -> root.error().toString());
        assertEquals("full\nnone\n", printed());
    }

    @Test
    void shape_attributes() {
        assertTrue(derive("rule Axiom = { size(2, 3, 4) print(size_x + size_y + size_z) "
                + "translate(1, 2, 3) print(\" \" + pos_y) };").isOk());
        assertEquals("9 2", printed());
    }
}
