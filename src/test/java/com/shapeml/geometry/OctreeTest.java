package com.shapeml.geometry;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.joml.Vector3d;
import org.junit.jupiter.api.Test;

public class OctreeTest {

    private static Aabb box(double x, double y, double z, double r) {
        return new Aabb(new Vector3d(x, y, z), new Vector3d(r, r, r));
    }

    @Test
    void query_returns_overlapping_boxes_only() {
        Octree<String> tree = new Octree<>(new Vector3d(), 100.0);
        tree.insert(box(10, 10, 10, 1), "a");
        tree.insert(box(-40, 5, 60, 2), "b");
        tree.insert(box(0, 0, 0, 80), "big");
        assertEquals(3, tree.size());

        List<String> hits = tree.query(box(10.5, 10, 10, 0.2));
        assertTrue(hits.contains("a"));
        assertTrue(hits.contains("big"));
        assertFalse(hits.contains("b"));

        assertTrue(tree.query(box(95, 95, 95, 1)).isEmpty());
    }

    @Test
    void many_small_boxes() {
        Octree<Integer> tree = new Octree<>(new Vector3d(), Octree.DEFAULT_HALF_WIDTH);
        for (int i = 0; i < 100; i++) tree.insert(box(i * 3.0, 0, 0, 1), i);
        assertEquals(100, tree.size());
        List<Integer> hits = tree.query(box(30, 0, 0, 0.5));
        assertEquals(1, hits.size());
        assertEquals(10, hits.get(0));
    }
}
