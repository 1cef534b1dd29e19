package com.shapeml.geometry;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.joml.Vector2d;
import org.joml.Vector3d;

/**
 * Reader for Wavefront OBJ files: {@code v}, {@code vt}, {@code vn} and polygonal
 * {@code f} records with 1-based or negative indices. Groups, objects and materials
 * are ignored. Normals and uvs are kept only when every face references them.
 */
public final class ObjLoader {

    private ObjLoader() {}

    public static Mesh load(Path path) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Mesh mesh = parse(in, path.toString());
            mesh.setName(path.toString());
            return mesh;
        }
    }

    static Mesh parse(BufferedReader in, String source) throws IOException {
        List<Vector3d> vertices = new ArrayList<>();
        List<Vector2d> uvs = new ArrayList<>();
        List<Vector3d> normals = new ArrayList<>();
        List<int[]> vIdx = new ArrayList<>();
        List<int[]> tIdx = new ArrayList<>();
        List<int[]> nIdx = new ArrayList<>();
        boolean allUvs = true;
        boolean allNormals = true;

        String line;
        int lineNo = 0;
        while ((line = in.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("\\s+");
            try {
                switch (parts[0]) {
                    case "v":
                        vertices.add(new Vector3d(Double.parseDouble(parts[1]), Double.parseDouble(parts[2]),
                                Double.parseDouble(parts[3])));
                        break;
                    case "vt":
                        uvs.add(new Vector2d(Double.parseDouble(parts[1]), Double.parseDouble(parts[2])));
                        break;
                    case "vn":
                        normals.add(new Vector3d(Double.parseDouble(parts[1]), Double.parseDouble(parts[2]),
                                Double.parseDouble(parts[3])));
                        break;
                    case "f": {
                        int n = parts.length - 1;
                        if (n < 3) throw new IOException(source + ":" + lineNo + ": face with fewer than 3 vertices");
                        int[] fv = new int[n];
                        int[] ft = new int[n];
                        int[] fn = new int[n];
                        for (int i = 0; i < n; i++) {
                            String[] refs = parts[i + 1].split("/", -1);
                            fv[i] = resolve(refs[0], vertices.size(), source, lineNo);
                            if (refs.length > 1 && !refs[1].isEmpty()) {
                                ft[i] = resolve(refs[1], uvs.size(), source, lineNo);
                            } else {
                                allUvs = false;
                            }
                            if (refs.length > 2 && !refs[2].isEmpty()) {
                                fn[i] = resolve(refs[2], normals.size(), source, lineNo);
                            } else {
                                allNormals = false;
                            }
                        }
                        vIdx.add(fv);
                        tIdx.add(ft);
                        nIdx.add(fn);
                        break;
                    }
                    default:
                        break;
                }
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                throw new IOException(source + ":" + lineNo + ": malformed record '" + line + "'", e);
            }
        }

        if (vIdx.isEmpty()) throw new IOException(source + ": no faces");
        return Mesh.fromIndexed(vertices, vIdx,
                allNormals ? normals : null, allNormals ? nIdx : null,
                allUvs ? uvs : null, allUvs ? tIdx : null);
    }

    private static int resolve(String ref, int count, String source, int lineNo) throws IOException {
        int i = Integer.parseInt(ref);
        int idx = i < 0 ? count + i : i - 1;
        if (idx < 0 || idx >= count) {
            throw new IOException(source + ":" + lineNo + ": index " + ref + " out of range");
        }
        return idx;
    }
}
