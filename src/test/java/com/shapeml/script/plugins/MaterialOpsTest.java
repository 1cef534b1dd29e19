package com.shapeml.script.plugins;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.joml.Vector4d;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.shapeml.script.ShapeMl;
import com.shapeml.script.interpreter.Interpreter;
import com.shapeml.script.interpreter.Result;
import com.shapeml.shape.Material;
import com.shapeml.shape.Shape;

public class MaterialOpsTest {

    private static Result<Shape> derive(String src) {
        return ShapeMl.deriveString("material.shp", src, new Interpreter.Options());
    }

    private static Material material(Result<Shape> root, String name) {
        assertTrue(root.isOk(), () -> root.error().toString());
        List<Shape> out = new ArrayList<>();
        root.value().accept(s -> {
            if (s.name().equals(name)) out.add(s);
        });
        assertEquals(1, out.size());
        return out.get(0).material();
    }

    @Test
    void color_from_hex_and_components() {
        Material hex = material(derive("rule Axiom = { color(\"#ff000080\") M_ };"), "M_");
        Vector4d c = hex.color();
        assertEquals(1.0, c.x, 1e-9);
        assertEquals(0.0, c.y, 1e-9);
        assertEquals(128.0 / 255.0, c.w, 1e-9);

        Material rgb = material(derive("rule Axiom = { color(0.5, 0.25, 1) M_ };"), "M_");
        assertEquals(0.25, rgb.color().y, 1e-9);
        assertEquals(1.0, rgb.color().w, 1e-9);
    }

    @Test
    void color_rejects_bad_input() {
        assertTrue(derive("rule Axiom = { color(\"red\") };").failed());
        assertTrue(derive("rule Axiom = { color(1.5, 0, 0) };").failed());
        assertTrue(derive("rule Axiom = { color(1, 0) };").failed());
    }

    @Test
    void pbr_parameters_are_in_unit_range() {
        Material m = material(derive("rule Axiom = { metallic(0.3) roughness(0.7) reflectance(1) M_ };"), "M_");
        assertEquals(0.3, m.metallic(), 1e-9);
        assertEquals(0.7, m.roughness(), 1e-9);
        assertEquals(1.0, m.reflectance(), 1e-9);
        assertTrue(derive("rule Axiom = { metallic(-0.1) };").failed());
    }

    @Test
    void material_name_characters() {
        assertEquals("brick_red-2", material(derive("rule Axiom = { materialName(\"brick_red-2\") M_ };"), "M_").name());
        Result<Shape> bad = derive("rule Axiom = { materialName(\"a b\") };");
        assertTrue(bad.failed());
        assertTrue(bad.error().message().contains("[_-0-9a-zA-Z]"));
    }

    @Test
    void material_is_inherited_by_children() {
        Material m = material(derive("rule Axiom = { color(\"#00ff00\") A };\nrule A = { B_ };"), "B_");
        assertEquals(1.0, m.color().y, 1e-9);
    }

    @Test
    void texture_must_exist_relative_to_grammar(@TempDir Path dir) throws IOException {
        Files.write(dir.resolve("wall.png"), new byte[] {1, 2, 3});
        Path grammar = dir.resolve("tex.shp");
        Files.write(grammar, ("rule Axiom = { texture(\"wall.png\") T_ [ textureNone N_ ] };\n")
                .getBytes(StandardCharsets.UTF_8));
        Result<Shape> root = ShapeMl.deriveFile(grammar.toString(), new Interpreter.Options());
        assertEquals("wall.png", material(root, "T_").texture());
        assertEquals("", material(root, "N_").texture());

        Files.write(grammar, "rule Axiom = { texture(\"missing.png\") };\n".getBytes(StandardCharsets.UTF_8));
        Result<Shape> missing = ShapeMl.deriveFile(grammar.toString(), new Interpreter.Options());
        assertTrue(missing.failed());
        assertTrue(missing.error().message().contains("'missing.png'"));
    }
}
