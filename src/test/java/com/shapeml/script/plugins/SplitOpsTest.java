package com.shapeml.script.plugins;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.joml.Vector3d;
import org.junit.jupiter.api.Test;

import com.shapeml.script.ShapeMl;
import com.shapeml.script.interpreter.Interpreter;
import com.shapeml.script.interpreter.Result;
import com.shapeml.shape.Shape;

public class SplitOpsTest {

    private static Result<Shape> derive(String src) {
        Interpreter.Options o = new Interpreter.Options()
                .out(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
        return ShapeMl.deriveString("split.shp", src, o);
    }

    private static List<Shape> named(Shape root, String name) {
        List<Shape> out = new ArrayList<>();
        root.accept(s -> {
            if (s.name().equals(name)) out.add(s);
        });
        return out;
    }

    @Test
    void split_repeat_rounds_to_whole_pieces() {
        Result<Shape> root = derive("rule Axiom = { size(10, 0, 4) quad splitRepeatX(2.4, { P_ }) };");
        assertTrue(root.isOk(), () -> root.error().toString());
        List<Shape> pieces = named(root.value(), "P_");
        assertEquals(4, pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            assertEquals(2.5, pieces.get(i).sizeX(), 1e-6);
            assertEquals(4.0, pieces.get(i).sizeZ(), 1e-6);
            assertEquals(i, pieces.get(i).index());
        }
    }

    @Test
    void split_repeat_never_drops_below_one_piece() {
        Result<Shape> root = derive("rule Axiom = { size(1, 0, 1) quad splitRepeatZ(5, { P_ }) };");
        assertTrue(root.isOk());
        assertEquals(1, named(root.value(), "P_").size());
    }

    @Test
    void pattern_split_stretches_middle() {
        Result<Shape> root = derive("rule Axiom = { size(10, 0, 4) quad "
                + "splitX(\"fsf\", 1, { A_ }, 1, { B_ }, 1, { C_ }) };");
        assertTrue(root.isOk(), () -> root.error().toString());
        assertEquals(1.0, named(root.value(), "A_").get(0).sizeX(), 1e-6);
        assertEquals(8.0, named(root.value(), "B_").get(0).sizeX(), 1e-6);
        assertEquals(1.0, named(root.value(), "C_").get(0).sizeX(), 1e-6);
    }

    @Test
    void pattern_split_errors() {
        Result<Shape> few = derive("rule Axiom = { quad splitX(\"f\", 1) };");
        assertTrue(few.failed());
        assertTrue(few.error().message().contains("needs at least 3 arguments."));

        Result<Shape> bad = derive("rule Axiom = { quad splitX(\"fx\", 1, { A_ }, 1, { B_ }) };");
        assertTrue(bad.failed());
        assertTrue(bad.error().message().contains("invalid split pattern 'fx'"));

        Result<Shape> count = derive("rule Axiom = { quad splitX(\"ff\", 1, { A_ }) };");
        assertTrue(count.failed());
        assertTrue(count.error().message().contains("needs 5 arguments, but 3 were provided."));
    }

    @Test
    void pattern_parsing() {
        assertNull(SplitOps.SplitPattern.parse(""));
        assertNull(SplitOps.SplitPattern.parse("(("));
        assertNull(SplitOps.SplitPattern.parse("f)"));
        assertNull(SplitOps.SplitPattern.parse("(f"));
        assertNull(SplitOps.SplitPattern.parse("fa"));
        assertEquals(3, SplitOps.SplitPattern.parse("f(sf)").size());
    }

    @Test
    void layout_scales_stretch_elements() {
        List<Double> sizes = new ArrayList<>(Arrays.asList(1.0, 1.0, 1.0));
        List<Integer> order = SplitOps.SplitPattern.parse("fsf").layout(sizes, 10.0);
        assertEquals(Arrays.asList(0, 1, 2), order);
        assertEquals(8.0, sizes.get(1), 1e-9);
    }

    @Test
    void layout_repeats_stretchable_group() {
        List<Double> sizes = new ArrayList<>(Arrays.asList(3.0));
        List<Integer> order = SplitOps.SplitPattern.parse("(s)").layout(sizes, 10.0);
        assertEquals(Arrays.asList(0, 0, 0), order);
        assertEquals(10.0 / 3.0, sizes.get(0), 1e-9);
    }

    @Test
    void layout_repeats_fixed_group_between_outer_elements() {
        List<Double> sizes = new ArrayList<>(Arrays.asList(1.0, 2.0, 1.0));
        List<Integer> order = SplitOps.SplitPattern.parse("f(f)f").layout(sizes, 10.0);
        assertEquals(Arrays.asList(0, 1, 1, 1, 1, 2), order);
    }

    @Test
    void split_face_distributes_cube_faces() {
        Result<Shape> root = derive("rule Axiom = { cube splitFace(\"top\", { T_ }, \"side\", { S_ }, "
                + "\"bottom\", { B_ }) };");
        assertTrue(root.isOk(), () -> root.error().toString());
        assertEquals(1, named(root.value(), "T_").size());
        assertEquals(4, named(root.value(), "S_").size());
        assertEquals(1, named(root.value(), "B_").size());
    }

    @Test
    void split_face_first_selector_wins() {
        Result<Shape> root = derive("rule Axiom = { cube splitFace(\"all\", { A_ }, \"top\", { T_ }) };");
        assertTrue(root.isOk());
        assertEquals(6, named(root.value(), "A_").size());
        assertTrue(named(root.value(), "T_").isEmpty());
    }

    @Test
    void split_face_rejects_unknown_selector() {
        Result<Shape> root = derive("rule Axiom = { cube splitFace(\"up\", { A_ }) };");
        assertTrue(root.failed());
        assertTrue(root.error().message().contains("is not a valid string selector."));
    }

    @Test
    void split_face_along_direction() {
        Result<Shape> root = derive("rule Axiom = { cube splitFaceAlongDir(0, 1, 0, 10, { Up_ }) };");
        assertTrue(root.isOk());
        assertEquals(1, named(root.value(), "Up_").size());
    }

    @Test
    void split_face_by_index_checks_range() {
        Result<Shape> ok = derive("rule Axiom = { cube splitFaceByIndex(0, 5, { F_ }) };");
        assertTrue(ok.isOk());
        assertEquals(2, named(ok.value(), "F_").size());

        Result<Shape> bad = derive("rule Axiom = { cube splitFaceByIndex(6, { F_ }) };");
        assertTrue(bad.failed());
        assertTrue(bad.error().message().contains("must be non-negative and smaller than the number of faces"));
    }

    @Test
    void selectors() {
        assertTrue(SplitOps.matches("top", new Vector3d(0, 1, 0)));
        assertFalse(SplitOps.matches("top", new Vector3d(0, -1, 0)));
        assertTrue(SplitOps.matches("front", new Vector3d(0, 0, 1)));
        assertTrue(SplitOps.matches("left", new Vector3d(-1, 0, 0)));
        assertTrue(SplitOps.matches("side", new Vector3d(1, 0, 0)));
        assertFalse(SplitOps.matches("side", new Vector3d(0, 1, 0)));
        assertTrue(SplitOps.matches("horizontal", new Vector3d(0, -1, 0)));
        assertTrue(SplitOps.matches("vertical", new Vector3d(0, 0, -1)));
        assertFalse(SplitOps.matches("nonsense", new Vector3d(0, 1, 0)));
    }
}
