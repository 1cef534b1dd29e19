package com.shapeml.script.plugins;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.shapeml.geometry.MeshCache;
import com.shapeml.script.ShapeMl;
import com.shapeml.script.interpreter.Interpreter;
import com.shapeml.script.interpreter.Result;
import com.shapeml.shape.Shape;

public class MeshOpsTest {

    private final MeshCache cache = new MeshCache();

    private Result<Shape> derive(String src) {
        Interpreter.Options o = new Interpreter.Options()
                .meshCache(cache)
                .out(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
        return ShapeMl.deriveString("mesh.shp", src, o);
    }

    private static Shape only(Shape root, String name) {
        List<Shape> out = new ArrayList<>();
        root.accept(s -> {
            if (s.name().equals(name)) out.add(s);
        });
        assertEquals(1, out.size(), "shapes named " + name);
        return out.get(0);
    }

    private static void assertFails(Result<Shape> r, String fragment) {
        assertTrue(r.failed(), "expected failure containing: " + fragment);
        assertTrue(r.error().message().contains(fragment), r.error().message());
    }

    @Test
    void quad_keeps_scope_size() {
        Result<Shape> root = derive("rule Axiom = { size(4, 0, 2) quad Q_ };");
        assertTrue(root.isOk());
        Shape q = only(root.value(), "Q_");
        assertEquals(4.0, q.sizeX(), 1e-9);
        assertEquals(0.0, q.sizeY(), 1e-9);
        assertEquals(2.0, q.sizeZ(), 1e-9);
        assertEquals(1, q.mesh().faceCount());
    }

    @Test
    void extrude_closes_the_prism() {
        Result<Shape> root = derive("rule Axiom = { size(4, 0, 2) quad extrude(3) E_ };");
        assertTrue(root.isOk(), () -> root.error().toString());
        Shape e = only(root.value(), "E_");
        assertEquals(3.0, e.sizeY(), 1e-6);
        assertEquals(4.0, e.sizeX(), 1e-6);
        assertEquals(6, e.mesh().faceCount());
    }

    @Test
    void extrude_argument_checks() {
        assertFails(derive("rule Axiom = { quad extrude(-1) };"), "");
        assertFails(derive("rule Axiom = { quad extrude(1, 2) };"), "");
        assertFails(derive("rule Axiom = { cube extrude(1) };"), "");
        assertFails(derive("rule Axiom = { extrude(1) };"), "");
    }

    @Test
    void extrude_along_direction_rejects_backward_direction() {
        assertFails(derive("rule Axiom = { quad extrude(0, -1, 0, 2) };"),
                "the angle between the direction and the face normal must be smaller than 90 degrees.");
    }

    @Test
    void procedural_meshes_are_cached() {
        Result<Shape> root = derive("rule Axiom = { [ cylinder(8, 1, 1) A_ ] [ cylinder(8, 1, 1) B_ ] };");
        assertTrue(root.isOk(), () -> root.error().toString());
        assertNotNull(cache.get("!cylinder_8_1_1"));
        assertEquals(1.0, only(root.value(), "A_").sizeY(), 1e-6);
    }

    @Test
    void solid_resolution_ranges() {
        assertFails(derive("rule Axiom = { cylinder(2, 1, 1) };"), "");
        assertFails(derive("rule Axiom = { sphere(8, 1) };"), "");
        assertTrue(derive("rule Axiom = { sphere(8, 4) S_ };").isOk());
    }

    @Test
    void torus_radii_are_ordered() {
        assertFails(derive("rule Axiom = { torus(0.5, 1.0, 8, 8) };"), "needs to be larger than parameter 1.");
        assertTrue(derive("rule Axiom = { torus(1.0, 0.25, 8, 8) T_ };").isOk());
    }

    @Test
    void planar_shapes_check_their_widths() {
        assertTrue(derive("rule Axiom = { size(10, 0, 8) shapeL(3, 3) L_ };").isOk());
        assertFails(derive("rule Axiom = { size(10, 0, 8) shapeL(9, 3) };"), "");
    }

    @Test
    void polygon_needs_point_pairs() {
        assertTrue(derive("rule Axiom = { polygon(0, 0, 4, 0, 4, 3) P_ };").isOk());
        assertFails(derive("rule Axiom = { polygon(0, 0, 4, 0, 4) };"), "");
        assertFails(derive("rule Axiom = { polygon(0, 0, 4, 0) };"), "");
    }

    @Test
    void roofs_on_quad() {
        Result<Shape> pyramid = derive("rule Axiom = { size(4, 0, 4) quad roofPyramid(2) R_ };");
        assertTrue(pyramid.isOk(), () -> pyramid.error().toString());
        assertEquals(2.0, only(pyramid.value(), "R_").sizeY(), 1e-6);
        assertEquals(5, only(pyramid.value(), "R_").mesh().faceCount());

        Result<Shape> hip = derive("rule Axiom = { size(6, 0, 4) quad roofHip(45) R_ };");
        assertTrue(hip.isOk(), () -> hip.error().toString());
        assertEquals(2.0, only(hip.value(), "R_").sizeY(), 1e-6);
    }

    @Test
    void hip_roof_needs_convex_footprint() {
        assertFails(derive("rule Axiom = { size(10, 0, 8) shapeL(3, 3) roofHip(30) };"),
                "is only supported for convex footprints.");
    }

    @Test
    void roof_angle_range() {
        assertFails(derive("rule Axiom = { quad roofGable(90) };"), "");
    }

    @Test
    void mirror_and_normals_keep_face_count() {
        Result<Shape> root = derive("rule Axiom = { cube mirrorX normalsFlip normalsSmooth M_ };");
        assertTrue(root.isOk(), () -> root.error().toString());
        assertEquals(6, only(root.value(), "M_").mesh().faceCount());
    }

    @Test
    void trim_plane_cuts_mesh() {
        Result<Shape> root = derive("rule Axiom = { cube trimPlane(1, 0, 0, 0.25) trimLocal T_ };");
        assertTrue(root.isOk(), () -> root.error().toString());
        Shape t = only(root.value(), "T_");
        assertTrue(t.hasNonEmptyMesh());
        assertEquals(0.25, t.sizeX(), 1e-6);
        assertEquals(1.0, t.sizeY(), 1e-6);
    }

    @Test
    void ffd_resolution_is_checked() {
        assertTrue(derive("rule Axiom = { cube ffdReset(2, 2, 2) ffdTranslateY(1, 1, 1, 0.5) ffdApply F_ };").isOk());
        assertFails(derive("rule Axiom = { cube ffdReset(2, 2, 2) ffdTranslateY(3, 1, 1, 0.5) };"), "");
        assertFails(derive("rule Axiom = { cube ffdReset(0, 2, 2) };"), "");
    }

    @Test
    void missing_mesh_file_fails() {
        assertFails(derive("rule Axiom = { mesh(\"does/not/exist.obj\") };"), "");
    }
}
