package com.shapeml.geometry;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;

import org.junit.jupiter.api.Test;

public class ObjLoaderTest {

    private static Mesh parse(String obj) throws IOException {
        return ObjLoader.parse(new BufferedReader(new StringReader(obj)), "test.obj");
    }

    @Test
    void quad_with_uvs_and_normals() throws IOException {
        Mesh m = parse(String.join("\n",
                "# quad",
                "v 0 0 0", "v 1 0 0", "v 1 0 -1", "v 0 0 -1",
                "vt 0 0", "vt 1 0", "vt 1 1", "vt 0 1",
                "vn 0 1 0",
                "f 1/1/1 2/2/1 3/3/1 4/4/1"));
        assertEquals(1, m.faceCount());
        assertTrue(m.hasUvs());
        assertTrue(m.hasVertexNormals());
        assertEquals(1.0, m.area(), 1e-9);
        assertEquals(1.0, m.faceNormal(0).y, 1e-9);
    }

    @Test
    void negative_indices_are_relative() throws IOException {
        Mesh m = parse("v 0 0 0\nv 1 0 0\nv 0 1 0\nf -3 -2 -1\n");
        assertEquals(1, m.faceCount());
        assertFalse(m.hasUvs());
        assertEquals(0.5, m.area(), 1e-9);
    }

    @Test
    void partial_attributes_are_dropped() throws IOException {
        Mesh m = parse("v 0 0 0\nv 1 0 0\nv 0 1 0\nv 0 0 1\nvt 0 0\nf 1/1 2/1 3/1\nf 1 2 4\n");
        assertEquals(2, m.faceCount());
        assertFalse(m.hasUvs());
    }

    @Test
    void out_of_range_index_fails() {
        IOException e = assertThrows(IOException.class, () -> parse("v 0 0 0\nf 1 2 3\n"));
        assertTrue(e.getMessage().contains("test.obj:2"));
    }

    @Test
    void malformed_vertex_fails() {
        assertThrows(IOException.class, () -> parse("v 0 zero 0\n"));
    }

    @Test
    void file_without_faces_fails() {
        IOException e = assertThrows(IOException.class, () -> parse("v 0 0 0\n"));
        assertTrue(e.getMessage().endsWith("no faces"));
    }
}
