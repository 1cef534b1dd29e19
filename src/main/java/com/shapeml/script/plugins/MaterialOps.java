package com.shapeml.script.plugins;

import static com.shapeml.script.parser.Value.Type.FLOAT;
import static com.shapeml.script.parser.Value.Type.STRING;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.function.BiConsumer;

import org.joml.Vector4d;

import com.shapeml.script.eval.BuiltinRegistry;
import com.shapeml.shape.Material;
import com.shapeml.util.HexColor;

/**
 * MaterialOps
 *
 * Shape operations that edit the material of the current shape. Offspring inherit
 * the material at the moment they are created.
 *
 * Usage:
 *   MaterialOps.register(registry);
 *
 * Then in grammars:
 *   rule Wall = { color("#c8b89a") roughness(0.8) texture("assets/brick.png") Wall_ };
 */
public final class MaterialOps {

    private MaterialOps() {}

    public static void register(BuiltinRegistry registry) {

        // color("#rrggbb[aa]"), color(r, g, b) or color(r, g, b, a)
        registry.shapeOp("color").variadic()
                .check(inv -> {
                    if (!inv.checkArgNumber(1, 3, 4)) return false;
                    if (inv.argCount() > 1) {
                        for (int i = 0; i < inv.argCount(); i++) {
                            if (!inv.validateType(FLOAT, i) || !inv.checkRange(i, 0.0, 1.0)) return false;
                        }
                        return true;
                    }
                    if (!inv.validateType(STRING, 0)) return false;
                    if (!HexColor.isValid(inv.stringArg(0), true)) {
                        return inv.fail("The parameter for shape operation 'color' is not a valid color in hex format.");
                    }
                    return true;
                })
                .run(inv -> {
                    Vector4d color;
                    if (inv.argCount() == 1) {
                        color = HexColor.parse(inv.stringArg(0));
                    } else {
                        double a = inv.argCount() == 4 ? inv.floatArg(3) : 1.0;
                        color = new Vector4d(inv.floatArg(0), inv.floatArg(1), inv.floatArg(2), a);
                    }
                    inv.shape().material().setColor(color);
                    return inv.done();
                });

        unitParameter(registry, "metallic", Material::setMetallic);
        unitParameter(registry, "roughness", Material::setRoughness);
        unitParameter(registry, "reflectance", Material::setReflectance);

        registry.shapeOp("texture").args(STRING)
                .check(inv -> inv.stringArg(0).isEmpty()
                        ? inv.fail("The parameter for shape operation 'texture' cannot be the empty string.")
                        : true)
                .run(inv -> {
                    String path = inv.interpreter().grammar().basePath() + inv.stringArg(0);
                    if (!Files.isReadable(Paths.get(path))) {
                        return inv.fail("The parameter for shape operation 'texture' is not a valid/existing path "
                                + "to a file '" + inv.stringArg(0) + "'.");
                    }
                    inv.shape().material().setTexture(inv.stringArg(0));
                    return inv.done();
                });

        registry.shapeOp("textureNone")
                .run(inv -> {
                    inv.shape().material().setTexture("");
                    return inv.done();
                });

        registry.shapeOp("materialName").args(STRING)
                .check(inv -> {
                    String name = inv.stringArg(0);
                    if (name.isEmpty()) {
                        return inv.fail("The parameter for shape operation 'materialName' cannot be the empty string.");
                    }
                    for (int i = 0; i < name.length(); i++) {
                        char c = name.charAt(i);
                        boolean ok = c < 128 && Character.isLetterOrDigit(c) || c == '-' || c == '_';
                        if (!ok) return inv.fail("The 'materialName' must consist of [_-0-9a-zA-Z].");
                    }
                    return true;
                })
                .run(inv -> {
                    inv.shape().material().setName(inv.stringArg(0));
                    return inv.done();
                });
    }

    /** A float material parameter restricted to [0, 1]. */
    private static void unitParameter(BuiltinRegistry registry, String name, BiConsumer<Material, Double> setter) {
        registry.shapeOp(name).args(FLOAT)
                .check(inv -> inv.checkRange(0, 0.0, 1.0))
                .run(inv -> {
                    setter.accept(inv.shape().material(), inv.floatArg(0));
                    return inv.done();
                });
    }
}
