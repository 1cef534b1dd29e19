package com.shapeml.script.eval;

import static com.shapeml.script.parser.Value.Type.FLOAT;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class BuiltinRegistryTest {

    @Test
    void standard_library_is_complete() {
        BuiltinRegistry r = BuiltinRegistry.standard();
        int total = r.names(EvalKind.SHAPE_OPERATION).size() + r.names(EvalKind.SHAPE_ATTRIBUTE).size()
                + r.names(EvalKind.FUNCTION).size();
        assertTrue(total >= 120, "built-ins: " + total);
        assertTrue(r.hasShapeOp("extrude"));
        assertTrue(r.hasShapeOp("splitX"));
        assertTrue(r.hasShapeOp("["));
        assertTrue(r.hasAttribute("size_x"));
        assertTrue(r.hasAttribute("occlusion"));
        assertTrue(r.hasFunction("rand_uniform"));
        assertFalse(r.hasFunction("extrude"));
        assertNull(r.lookup(EvalKind.FUNCTION, "nope"));
    }

    @Test
    void standard_registry_is_sealed() {
        assertThrows(IllegalStateException.class,
                () -> BuiltinRegistry.standard().function("extra").run(inv -> inv.done()));
    }

    @Test
    void duplicate_names_are_rejected_per_kind() {
        BuiltinRegistry r = new BuiltinRegistry();
        r.function("twice").args(FLOAT).run(inv -> inv.done());
        r.shapeOp("twice").run(inv -> inv.done());
        assertThrows(IllegalStateException.class, () -> r.function("twice").run(inv -> inv.done()));
        assertEquals(1, r.names(EvalKind.FUNCTION).size());
    }
}
