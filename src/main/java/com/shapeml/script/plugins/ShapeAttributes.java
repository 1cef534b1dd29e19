package com.shapeml.script.plugins;

import static com.shapeml.script.parser.Value.Type.STRING;

import java.util.List;
import java.util.function.Function;

import org.joml.Vector3d;

import com.shapeml.geometry.Mesh;
import com.shapeml.geometry.Obb;
import com.shapeml.geometry.Octree;
import com.shapeml.script.eval.BuiltinRegistry;
import com.shapeml.script.parser.Value;
import com.shapeml.shape.OcclusionShape;
import com.shapeml.shape.Shape;

/**
 * ShapeAttributes
 *
 * Read-only properties of the shape on top of the scope stack. They resolve only in
 * expressions inside shape operation strings, rule conditions and probabilities.
 *
 * Usage:
 *   ShapeAttributes.register(registry);
 *
 * Then in grammars:
 *   rule Facade :: size_x > 10 = { splitX("s(f)", 1, Floor) };
 *   rule Window :: occlusion("Wall") != "full" = { Window_ };
 */
public final class ShapeAttributes {

    private static final double OCCLUSION_THRESHOLD_SCALE = 0.999;

    private ShapeAttributes() {}

    public static void register(BuiltinRegistry registry) {

        attr(registry, "size_x", s -> Value.number(s.sizeX()));
        attr(registry, "size_y", s -> Value.number(s.sizeY()));
        attr(registry, "size_z", s -> Value.number(s.sizeZ()));

        attr(registry, "pos_x", s -> Value.number(s.position().x));
        attr(registry, "pos_y", s -> Value.number(s.position().y));
        attr(registry, "pos_z", s -> Value.number(s.position().z));

        attr(registry, "pos_world_x", s -> Value.number(s.worldPosition().x));
        attr(registry, "pos_world_y", s -> Value.number(s.worldPosition().y));
        attr(registry, "pos_world_z", s -> Value.number(s.worldPosition().z));

        registry.attribute("area")
                .check(inv -> inv.checkNonEmptyMesh() && inv.checkSingleFaceMesh())
                .run(inv -> {
                    Shape s = inv.shape();
                    Mesh tmp = s.mesh().copy();
                    tmp.transformUnitTrafoAndScale(s.size());
                    return inv.returns(Value.number(tmp.faceArea(0)));
                });

        attr(registry, "color_r", s -> Value.number(s.material().color().x));
        attr(registry, "color_g", s -> Value.number(s.material().color().y));
        attr(registry, "color_b", s -> Value.number(s.material().color().z));
        attr(registry, "color_a", s -> Value.number(s.material().color().w));
        attr(registry, "metallic", s -> Value.number(s.material().metallic()));
        attr(registry, "roughness", s -> Value.number(s.material().roughness()));
        attr(registry, "reflectance", s -> Value.number(s.material().reflectance()));
        attr(registry, "texture", s -> Value.string(s.material().texture()));
        attr(registry, "material_name", s -> Value.string(s.material().name()));

        registry.attribute("index").run(inv -> {
            int index = inv.shape().index();
            if (index < 0) return inv.fail("Built-in shape attribute 'index' has not been set yet.");
            return inv.returns(Value.integer(index));
        });

        attr(registry, "visible", s -> Value.bool(s.visible()));
        attr(registry, "depth", s -> Value.integer(s.depth()));
        attr(registry, "label", s -> Value.string(s.name()));

        registry.attribute("get").args(STRING)
                .check(inv -> {
                    if (!isValidCustomAttributeName(inv.stringArg(0))) {
                        return inv.fail("Parameter 1 for shape attribute 'get' is not a valid name for a custom "
                                + "shape attribute.(Provided name: " + inv.arg(0) + ".)");
                    }
                    return true;
                })
                .run(inv -> {
                    Value v = inv.shape().getCustomAttribute(inv.stringArg(0));
                    if (v == null) {
                        return inv.fail("Parameter 1 for shape attribute 'get' is not the name of any of the "
                                + "custom shape attributes.(Provided name: " + inv.arg(0) + ".)");
                    }
                    return inv.returns(v);
                });

        // "none", "partial" or "full", optionally restricted to occluders with a given label.
        registry.attribute("occlusion").variadic()
                .check(inv -> {
                    if (!inv.checkArgNumber(0, 1)) return false;
                    if (inv.argCount() == 1) {
                        if (!inv.validateType(STRING, 0)) return false;
                        if (inv.stringArg(0).isEmpty()) {
                            return inv.fail("Parameter 1 for shape attribute 'occlusion' cannot be an empty string.");
                        }
                    }
                    return true;
                })
                .run(inv -> {
                    Octree<OcclusionShape> octree = inv.interpreter().octree();
                    if (octree == null) return inv.returns(Value.string("none"));

                    Shape shape = inv.shape();
                    String label = inv.argCount() == 1 ? inv.stringArg(0) : null;
                    List<OcclusionShape> candidates = octree.query(shape.worldAabb());
                    Obb obb = shape.worldObb();
                    Obb threshold = obb.withExtent(obb.extent.mul(OCCLUSION_THRESHOLD_SCALE, new Vector3d()));

                    String result = "none";
                    for (OcclusionShape occ : candidates) {
                        if (shape.isAncestor(occ.parent())) continue;
                        if (label != null && !label.equals(occ.name())) continue;
                        if (occ.obb().contains(threshold)) return inv.returns(Value.string("full"));
                        if (occ.obb().intersects(threshold)) result = "partial";
                    }
                    return inv.returns(Value.string(result));
                });
    }

    private static void attr(BuiltinRegistry registry, String name, Function<Shape, Value> getter) {
        registry.attribute(name).run(inv -> inv.returns(getter.apply(inv.shape())));
    }

    /**
     * Custom attribute names start with a letter or an underscore. Only the first
     * character is inspected.
     */
    static boolean isValidCustomAttributeName(String name) {
        if (name.isEmpty()) return false;
        char c = name.charAt(0);
        return Character.isLetter(c) && c < 128 || c == '_';
    }
}
