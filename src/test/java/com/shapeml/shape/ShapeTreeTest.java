package com.shapeml.shape;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.joml.Vector3d;
import org.junit.jupiter.api.Test;

import com.shapeml.script.parser.Value;

public class ShapeTreeTest {

    private static Shape child(Shape parent, String name) {
        Shape s = parent.createOffspring();
        s.setName(name);
        s.appendToParent();
        return s;
    }

    @Test
    void arena_links_parents_and_children() {
        ShapeTree tree = new ShapeTree();
        Shape root = tree.createRoot("Axiom");
        Shape a = child(root, "A");
        Shape b = child(root, "B");
        Shape c = child(a, "C");

        assertEquals(4, tree.size());
        assertSame(root, tree.root());
        assertNull(root.parent());
        assertSame(a, c.parent());
        assertEquals(2, c.depth());
        assertEquals(List.of(a, b), root.children());
        assertTrue(c.isAncestor(root));
        assertFalse(b.isAncestor(a));
        assertTrue(b.isLeaf());
        assertFalse(a.isLeaf());
    }

    @Test
    void visits_in_pre_order() {
        ShapeTree tree = new ShapeTree();
        Shape root = tree.createRoot("R");
        Shape a = child(root, "A");
        child(a, "A1");
        child(root, "B");

        List<String> names = new ArrayList<>();
        tree.accept(s -> names.add(s.name()));
        assertEquals(List.of("R", "A", "A1", "B"), names);

        LeafVisitor leaves = new LeafVisitor();
        tree.accept(leaves);
        assertEquals(2, leaves.leaves().size());
    }

    @Test
    void copies_are_detached_until_appended() {
        ShapeTree tree = new ShapeTree();
        Shape root = tree.createRoot("R");
        Shape template = root.createOffspring();
        assertFalse(template.isAttached());
        Shape copy = template.copy();
        copy.setName("X");
        copy.appendToParent();
        assertTrue(copy.isAttached());
        assertFalse(template.isAttached());
        assertEquals(2, tree.size());
        assertThrows(IllegalStateException.class, copy::appendToParent);
    }

    @Test
    void offspring_inherits_attributes_but_not_transform() {
        ShapeTree tree = new ShapeTree();
        Shape root = tree.createRoot("R");
        root.translateX(3.0);
        root.setCustomAttribute("kind", Value.string("house"));
        Shape kid = child(root, "K");
        assertEquals(0.0, kid.position().x, 1e-9);
        assertEquals(3.0, kid.worldPosition().x, 1e-9);
        assertEquals(Value.string("house"), kid.getCustomAttribute("kind"));
    }

    @Test
    void world_transform_accumulates() {
        ShapeTree tree = new ShapeTree();
        Shape root = tree.createRoot("R");
        root.translate(new Vector3d(1, 2, 3));
        Shape a = child(root, "A");
        a.rotateY(90.0);
        Shape b = a.createOffspring();
        b.translateX(1.0);
        b.setName("B");
        b.appendToParent();
        Vector3d p = b.worldPosition();
        assertEquals(1.0, p.x, 1e-9);
        assertEquals(2.0, p.y, 1e-9);
        assertEquals(2.0, p.z, 1e-9);
    }

    @Test
    void print_indents_by_depth() {
        ShapeTree tree = new ShapeTree();
        Shape root = tree.createRoot("R");
        Shape a = child(root, "A");
        child(a, "A1");
        String[] lines = ShapeTree.print(root).split("\n");
        assertEquals(3, lines.length);
        assertTrue(lines[0].startsWith("name: \"R\""));
        assertTrue(lines[1].startsWith("  name: \"A\""));
        assertTrue(lines[2].startsWith("    name: \"A1\""));
        assertTrue(lines[0].contains("; visible: yes; terminal: no"));
    }

    @Test
    void create_root_resets_arena() {
        ShapeTree tree = new ShapeTree();
        child(tree.createRoot("R"), "A");
        tree.createRoot("S");
        assertEquals(1, tree.size());
        assertEquals("S", tree.root().name());
    }
}
