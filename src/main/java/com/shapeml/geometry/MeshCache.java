package com.shapeml.geometry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import com.shapeml.debug.Debug;

/**
 * Meshes by uri. File uris are loaded on first access; procedural meshes are inserted
 * under keys starting with {@code !}. Cached meshes are shared and must not be mutated.
 */
public final class MeshCache {

    private static final String TAG = "shapeml.assets";

    private final Map<String, Mesh> meshes = new HashMap<>();

    /** The mesh for {@code uri}, loading it if needed, or null when it cannot be loaded. */
    public synchronized Mesh get(String uri) {
        Mesh mesh = meshes.get(uri);
        if (mesh != null) return mesh;
        if (uri.startsWith("!")) return null;
        try {
            mesh = ObjLoader.load(Path.of(uri));
        } catch (IOException | RuntimeException e) {
            Debug.get().w(TAG, "Cannot load mesh '" + uri + "': " + e.getMessage());
            return null;
        }
        meshes.put(uri, mesh);
        return mesh;
    }

    public synchronized boolean has(String uri) {
        return meshes.containsKey(uri);
    }

    public synchronized void insert(String uri, Mesh mesh) {
        if (meshes.containsKey(uri)) throw new IllegalStateException("Mesh '" + uri + "' is already cached");
        meshes.put(uri, mesh);
    }

    /** Cached procedural mesh, built on first request. */
    public synchronized Mesh getOrCreate(String key, Supplier<Mesh> factory) {
        Mesh mesh = meshes.get(key);
        if (mesh == null) {
            mesh = factory.get();
            insert(key, mesh);
        }
        return mesh;
    }

    public synchronized int size() {
        return meshes.size();
    }
}
