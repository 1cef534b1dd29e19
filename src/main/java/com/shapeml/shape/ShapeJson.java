package com.shapeml.shape;

import java.util.IdentityHashMap;
import java.util.Map;

import org.joml.Matrix3d;
import org.joml.Quaterniond;
import org.joml.Vector3d;
import org.joml.Vector4d;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shapeml.script.parser.Value;

/**
 * JSON export of a derived shape tree. Each shape becomes an object with its world
 * transform, size, flags, material, custom attributes and a {@code children} array.
 */
public final class ShapeJson {
    private static final ObjectMapper om = new ObjectMapper();

    private ShapeJson() {}

    public static ObjectNode toJson(Shape root) {
        Map<Shape, ObjectNode> nodes = new IdentityHashMap<>();
        ObjectNode[] rootNode = new ObjectNode[1];
        root.accept(shape -> {
            ObjectNode n = shapeNode(shape);
            nodes.put(shape, n);
            Shape parent = shape.parent();
            ObjectNode parentNode = parent == null ? null : nodes.get(parent);
            if (parentNode == null) {
                rootNode[0] = n;
            } else {
                ((ArrayNode) parentNode.get("children")).add(n);
            }
        });
        return rootNode[0];
    }

    public static String toPrettyString(Shape root) throws JsonProcessingException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(root));
    }

    private static ObjectNode shapeNode(Shape shape) {
        ObjectNode n = om.createObjectNode();
        n.put("name", shape.name());
        if (shape.index() >= 0) n.put("index", shape.index());
        n.put("terminal", shape.terminal());
        n.put("visible", shape.visible());
        n.put("mesh", shape.mesh() != null);
        if (shape.mesh() != null) n.put("faces", shape.mesh().faceCount());

        Vector3d pos = shape.worldPosition();
        n.set("position", array(pos.x, pos.y, pos.z));
        Quaterniond q = new Quaterniond().setFromNormalized(shape.worldTrafo().get3x3(new Matrix3d()));
        n.set("rotation", array(q.x, q.y, q.z, q.w));
        Vector3d size = shape.size();
        n.set("size", array(size.x, size.y, size.z));

        ObjectNode mat = om.createObjectNode();
        Material m = shape.material();
        if (!m.name().isEmpty()) mat.put("name", m.name());
        Vector4d c = m.color();
        mat.set("color", array(c.x, c.y, c.z, c.w));
        mat.put("metallic", m.metallic());
        mat.put("roughness", m.roughness());
        mat.put("reflectance", m.reflectance());
        if (!m.texture().isEmpty()) mat.put("texture", m.texture());
        n.set("material", mat);

        if (!shape.customAttributes().isEmpty()) {
            ObjectNode attrs = om.createObjectNode();
            for (Map.Entry<String, Value> e : shape.customAttributes().entrySet()) {
                putValue(attrs, e.getKey(), e.getValue());
            }
            n.set("attributes", attrs);
        }
        n.set("children", om.createArrayNode());
        return n;
    }

    private static void putValue(ObjectNode target, String key, Value v) {
        switch (v.type) {
            case BOOL: target.put(key, v.asBool()); break;
            case INT: target.put(key, v.asInt()); break;
            case FLOAT: target.put(key, v.asFloat()); break;
            case STRING: target.put(key, v.asString()); break;
            default: target.put(key, v.toString());
        }
    }

    private static ArrayNode array(double... values) {
        ArrayNode a = om.createArrayNode();
        for (double d : values) a.add(d);
        return a;
    }
}
