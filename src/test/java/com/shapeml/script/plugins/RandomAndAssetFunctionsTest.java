package com.shapeml.script.plugins;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.shapeml.script.ShapeMl;
import com.shapeml.script.interpreter.Interpreter;
import com.shapeml.script.interpreter.Result;
import com.shapeml.script.parser.Grammar;
import com.shapeml.script.parser.Value;

public class RandomAndAssetFunctionsTest {

    private static Result<Interpreter> session(String fileName, String src, int seed) {
        Result<Grammar> g = ShapeMl.parseString(fileName, src);
        assertTrue(g.isOk(), () -> g.error().toString());
        return Interpreter.create(g.value(), new Interpreter.Options().seed(seed));
    }

    private static Map<String, Value> constants(String src, int seed) {
        Result<Interpreter> s = session("fn.shp", src, seed);
        assertTrue(s.isOk(), () -> s.error().toString());
        return s.value().constants();
    }

    @Test
    void random_streams_follow_the_seed() {
        String src = "const a = rand_uniform(0, 1);\nconst b = rand_int(1, 6);\nconst c = rand_normal(0, 1);";
        assertEquals(constants(src, 42), constants(src, 42));
        assertNotEquals(constants(src, 42).get("a"), constants(src, 43).get("a"));
        assertEquals(Value.integer(42), constants("const s = seed;", 42).get("s"));
    }

    @Test
    void random_ranges() {
        StringBuilder src = new StringBuilder();
        for (int i = 0; i < 50; i++) {
            src.append("const i").append(i).append(" = rand_int(-2, 2);\n");
            src.append("const f").append(i).append(" = rand_uniform(10, 11);\n");
        }
        Map<String, Value> c = constants(src.toString(), Interpreter.DEFAULT_SEED);
        for (int i = 0; i < 50; i++) {
            int v = c.get("i" + i).asInt();
            assertTrue(v >= -2 && v <= 2, "rand_int gave " + v);
            double f = c.get("f" + i).asFloat();
            assertTrue(f >= 10.0 && f < 11.0, "rand_uniform gave " + f);
        }
    }

    @Test
    void random_argument_checks() {
        assertTrue(session("fn.shp", "const a = rand_int(5, 5);", 1).failed());
        assertTrue(session("fn.shp", "const a = rand_uniform(1, 0);", 1).failed());
        assertTrue(session("fn.shp", "const a = rand_normal(0, 0);", 1).failed());
    }

    @Test
    void noise_is_bounded_and_deterministic() {
        Map<String, Value> c = constants("const n2 = noise(3.7, 1.2);\nconst n3 = noise(3.7, 1.2, 9.1);\n"
                + "const f = fBm(1.5, 2.5, 4);\nconst g = fBm(1.5, 2.5, 0.5, 4, 2.0, 0.5);", 1);
        for (String k : new String[] {"n2", "n3"}) {
            double v = c.get(k).asFloat();
            assertTrue(v >= -1.0 && v <= 1.0, k + " = " + v);
        }
        for (String k : new String[] {"f", "g"}) {
            double v = c.get(k).asFloat();
            assertTrue(v >= -2.0 && v <= 2.0, k + " = " + v);
        }
        assertEquals(c.get("n2"), constants("const n2 = noise(3.7, 1.2);", 99).get("n2"));
        assertTrue(session("fn.shp", "const f = fBm(1, 2);", 1).failed());
    }

    @Test
    void asset_queries(@TempDir Path dir) throws IOException {
        Files.write(dir.resolve("box.obj"), String.join("\n",
                "v 0 0 0", "v 2 0 0", "v 2 3 0", "v 0 3 0", "f 1 2 3 4", "").getBytes(StandardCharsets.UTF_8));
        String file = dir.resolve("assets.shp").toString();
        String src = "const w = mesh_info(\"box.obj\", \"size_x\");\n"
                + "const h = mesh_info(\"box.obj\", \"size_y\");\n"
                + "const yes = file_exists(\"box.obj\");\n"
                + "const no = file_exists(\"nothing.obj\");";
        Result<Interpreter> s = session(file, src, 1);
        assertTrue(s.isOk(), () -> s.error().toString());
        Map<String, Value> c = s.value().constants();
        assertEquals(Value.number(2.0), c.get("w"));
        assertEquals(Value.number(3.0), c.get("h"));
        assertEquals(Value.bool(true), c.get("yes"));
        assertEquals(Value.bool(false), c.get("no"));

        Result<Interpreter> bad = session(file, "const d = mesh_info(\"box.obj\", \"depth\");", 1);
        assertTrue(bad.failed());
        assertTrue(bad.error().message().contains("Allowed values are only"));
        assertTrue(session(file, "const d = mesh_info(\"nothing.obj\", \"size_x\");", 1).failed());
    }
}
