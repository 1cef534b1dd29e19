package com.shapeml.geometry;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.joml.Matrix4d;
import org.joml.Vector3d;
import org.junit.jupiter.api.Test;

public class MeshTest {

    private static Mesh square() {
        return Primitives.unitSquare().toMesh();
    }

    @Test
    void unit_square_faces_up() {
        Mesh m = square();
        assertEquals(1, m.faceCount());
        assertEquals(4, m.vertexCount());
        assertEquals(1.0, m.area(), 1e-9);
        Vector3d n = m.faceNormal(0);
        assertEquals(1.0, n.y, 1e-9);
        assertTrue(m.hasUvs());
    }

    @Test
    void extrusion_builds_closed_prism() {
        Mesh m = square();
        assertTrue(m.extrudeAlongNormal(2.0));
        assertEquals(6, m.faceCount());
        assertEquals(2 * 1.0 + 4 * 2.0, m.area(), 1e-9);
        assertEquals(1.0, m.aabb().extent.y, 1e-9);
        assertEquals(1.0, m.faceNormal(0).y, 1e-9);
        assertEquals(-1.0, m.faceNormal(1).y, 1e-9);
    }

    @Test
    void extrusion_against_normal_is_rejected() {
        Mesh m = square();
        assertFalse(m.extrudeAlongDirection(new Vector3d(0, -1, 0), 1.0));
        assertEquals(1, m.faceCount());
    }

    @Test
    void extrusion_needs_single_face() {
        assertFalse(Primitives.unitCube().extrudeAlongNormal(1.0));
    }

    @Test
    void split_closes_both_halves() {
        Mesh cube = Primitives.unitCube();
        Mesh.Split split = cube.split(new Plane(new Vector3d(1, 0, 0), 0.0));
        assertEquals(6, split.below.faceCount());
        assertEquals(6, split.above.faceCount());
        assertEquals(4.0, split.below.area(), 1e-9);
        assertEquals(0.0, split.below.aabb().max().x, 1e-9);
        assertEquals(0.0, split.above.aabb().min().x, 1e-9);
    }

    @Test
    void split_outside_leaves_one_side_empty() {
        Mesh.Split split = Primitives.unitCube().split(new Plane(new Vector3d(0, 1, 0), 2.0));
        assertTrue(split.above.isEmpty());
        assertEquals(6, split.below.faceCount());
    }

    @Test
    void mirror_keeps_area_and_outward_normals() {
        Mesh m = Primitives.unitCube();
        m.transform(new Matrix4d().translation(1, 0, 0), new Vector3d(1, 1, 1));
        m.mirror(new Plane(new Vector3d(1, 0, 0), 0.0));
        assertEquals(6.0, m.area(), 1e-9);
        assertEquals(-1.0, m.aabb().center.x, 1e-9);
        for (int f = 0; f < m.faceCount(); f++) {
            Vector3d toFace = new Vector3d(m.facePositions(f).get(0)).sub(m.aabb().center);
            assertTrue(m.faceNormal(f).dot(toFace) > 0.0, "face " + f + " points inward");
        }
    }

    @Test
    void copy_is_independent() {
        Mesh m = square();
        Mesh c = m.copy();
        assertTrue(c.extrudeAlongNormal(1.0));
        assertEquals(1, m.faceCount());
        assertEquals(6, c.faceCount());
    }

    @Test
    void unit_trafo_moves_box_to_origin() {
        Mesh m = Primitives.unitCube();
        m.transformUnitTrafoAndScale(new Vector3d(2, 4, 6));
        assertEquals(0.0, m.aabb().min().x, 1e-9);
        assertEquals(4.0, m.aabb().max().y, 1e-9);
        assertEquals(6.0, m.aabb().max().z, 1e-9);
    }

    @Test
    void pyramid_roof_apex_height() {
        Mesh m = square();
        m.extrudeRoofPyramid(3.0, 0.0);
        assertEquals(5, m.faceCount());
        assertEquals(1.5, m.aabb().extent.y, 1e-9);
    }

    @Test
    void hip_roof_rejects_concave_footprint() {
        Mesh l = Primitives.shapeL(10, 8, 3, 3).toMesh();
        assertFalse(l.extrudeRoofHipOrGable(30.0, 0.0, false, 0.0));
        Mesh quad = Primitives.unitSquare().toMesh();
        assertTrue(quad.extrudeRoofHipOrGable(45.0, 0.0, false, 0.0));
        assertEquals(0.25, quad.aabb().extent.y, 1e-9);
    }

    @Test
    void indexed_mesh() {
        Mesh m = Mesh.fromIndexed(
                Arrays.asList(new Vector3d(0, 0, 0), new Vector3d(1, 0, 0), new Vector3d(0, 1, 0), new Vector3d(0, 0, 1)),
                Arrays.asList(new int[] {0, 2, 1}, new int[] {0, 1, 3}, new int[] {0, 3, 2}, new int[] {1, 2, 3}),
                null, null, null, null);
        assertEquals(4, m.faceCount());
        assertFalse(m.hasUvs());
        assertFalse(m.hasVertexNormals());
        assertEquals(-1.0, m.faceNormal(0).z, 1e-9);
    }
}
