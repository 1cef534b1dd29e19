package com.shapeml.script.plugins;

import static com.shapeml.script.parser.Value.Type.STRING;

import java.nio.file.Files;
import java.nio.file.Paths;

import com.shapeml.geometry.Aabb;
import com.shapeml.geometry.Mesh;
import com.shapeml.script.eval.BuiltinRegistry;
import com.shapeml.script.parser.Value;

/**
 * AssetFunctions
 *
 * Queries on files next to the grammar. Paths are relative to the grammar's directory;
 * ids starting with '!' name procedural meshes already in the mesh cache.
 *
 * Usage:
 *   AssetFunctions.register(registry);
 *
 * Then in grammars:
 *   const doorWidth = mesh_info("assets/door.obj", "size_x");
 *   rule Door :: file_exists("assets/door.obj") = { mesh("assets/door.obj") Door_ };
 */
public final class AssetFunctions {

    private AssetFunctions() {}

    public static void register(BuiltinRegistry registry) {

        registry.function("mesh_info").args(STRING, STRING)
                .check(inv -> {
                    String axis = inv.stringArg(1);
                    if (!axis.equals("size_x") && !axis.equals("size_y") && !axis.equals("size_z")) {
                        return inv.fail("Parameter 2 for 'mesh_info' is invalid. (Provided value: " + inv.arg(1)
                                + ".) Allowed values are only \"size_x\", \"size_y\", and \"size_z\".");
                    }
                    return true;
                })
                .run(inv -> {
                    String uri = inv.stringArg(0);
                    if (!uri.isEmpty() && uri.charAt(0) != '!') {
                        uri = inv.interpreter().grammar().basePath() + uri;
                    }
                    Mesh mesh = inv.interpreter().meshCache().get(uri);
                    if (mesh == null) {
                        return inv.fail("Shape operation 'mesh_info' failed to access the file '" + inv.stringArg(0)
                                + "' or the file doesn't contain a mesh.");
                    }
                    Aabb aabb = mesh.aabb();
                    switch (inv.stringArg(1)) {
                        case "size_x": return inv.returns(Value.number(aabb.extent.x * 2.0));
                        case "size_y": return inv.returns(Value.number(aabb.extent.y * 2.0));
                        default: return inv.returns(Value.number(aabb.extent.z * 2.0));
                    }
                });

        registry.function("file_exists").args(STRING)
                .check(inv -> inv.stringArg(0).isEmpty()
                        ? inv.fail("The parameter for shape operation 'file_exists' cannot be the empty string.")
                        : true)
                .run(inv -> {
                    String path = inv.interpreter().grammar().basePath() + inv.stringArg(0);
                    return inv.returns(Value.bool(Files.isRegularFile(Paths.get(path))));
                });
    }
}
