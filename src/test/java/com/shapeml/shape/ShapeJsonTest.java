package com.shapeml.shape;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shapeml.script.ShapeMl;
import com.shapeml.script.interpreter.Interpreter;
import com.shapeml.script.interpreter.Result;

public class ShapeJsonTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Test
    void derived_tree_exports_as_nested_json() throws Exception {
        Result<Shape> root = ShapeMl.deriveString("json.shp",
                "rule Axiom = { size(2, 0, 3) quad translateY(1) color(\"#ff0000\") set(\"level\", 2) "
                        + "[ materialName(\"roof\") Roof_ ] Wall_ };",
                new Interpreter.Options());
        assertTrue(root.isOk(), () -> root.error().toString());

        JsonNode json = om.readTree(ShapeJson.toPrettyString(root.value()));
        assertEquals("Axiom", json.get("name").asText());
        assertFalse(json.get("terminal").asBoolean());
        assertEquals(2, json.get("children").size());

        JsonNode roof = json.get("children").get(0);
        assertEquals("Roof_", roof.get("name").asText());
        assertTrue(roof.get("terminal").asBoolean());
        assertEquals(1, roof.get("faces").asInt());
        assertEquals(1.0, roof.get("position").get(1).asDouble(), 1e-9);
        assertEquals(3.0, roof.get("size").get(2).asDouble(), 1e-9);
        assertEquals("roof", roof.get("material").get("name").asText());
        assertEquals(1.0, roof.get("material").get("color").get(0).asDouble(), 1e-9);
        assertEquals(2, roof.get("attributes").get("level").asInt());
        assertEquals(1.0, roof.get("rotation").get(3).asDouble(), 1e-9);

        JsonNode wall = json.get("children").get(1);
        assertFalse(wall.get("material").has("name"));
        assertEquals(0, wall.get("children").size());
    }

    @Test
    void shape_without_mesh() {
        ShapeTree tree = new ShapeTree();
        Shape root = tree.createRoot("Empty");
        JsonNode json = ShapeJson.toJson(root);
        assertFalse(json.get("mesh").asBoolean());
        assertFalse(json.has("faces"));
        assertFalse(json.has("index"));
        assertFalse(json.has("attributes"));
    }
}
