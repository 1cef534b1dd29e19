package com.shapeml.script.interpreter;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import com.shapeml.debug.Debug;
import com.shapeml.script.ShapeMl;
import com.shapeml.script.parser.Grammar;
import com.shapeml.script.parser.Value;
import com.shapeml.shape.Shape;

public class InterpreterTest {

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    private Interpreter.Options options() {
        return new Interpreter.Options().out(new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private static Grammar grammar(String src) {
        Result<Grammar> g = ShapeMl.parseString("test.shp", src);
        assertTrue(g.isOk(), () -> g.error().toString());
        return g.value();
    }

    private static String resource(String name) throws IOException {
        try (InputStream in = InterpreterTest.class.getResourceAsStream("/grammars/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static Interpreter session(Grammar g, Interpreter.Options o) {
        Result<Interpreter> s = Interpreter.create(g, o);
        assertTrue(s.isOk(), () -> s.error().toString());
        return s.value();
    }

    private static List<Shape> named(Shape root, String name) {
        List<Shape> out = new ArrayList<>();
        root.accept(s -> {
            if (s.name().equals(name)) out.add(s);
        });
        return out;
    }

    @Test
    void hello_world_prints_through_references() throws IOException {
        Interpreter interp = session(grammar(resource("hello.shp")), options().seed(1234));
        Result<Shape> root = interp.derive(100);
        assertTrue(root.isOk(), () -> root.error().toString());
        assertEquals("Hello World!15103\nHello World!15103\n", printed());

        assertEquals("Axiom", root.value().name());
        assertEquals(2, named(root.value(), "Asdf_").size());
        assertTrue(named(root.value(), "Terminal_0_").get(0).terminal());
    }

    @Test
    void infinite_function_recursion_is_reported() {
        Grammar g = grammar("rule Axiom = { printLn(infini_func(0)) };\n"
                + "func infini_func(p) = infini_func(p) + 1;");
        Interpreter interp = session(g, options());
        Result<Shape> root = interp.derive(100);
        assertTrue(root.failed());
        assertTrue(root.error().message().endsWith("Function 'infini_func' reached the max recursion depth (20)."),
                root.error().message());
        String last = interp.diagnostics().get(interp.diagnostics().size() - 1);
        assertTrue(last.startsWith("ERROR"), last);
    }

    @Test
    void rule_probabilities_are_respected() {
        Grammar g = grammar("rule Axiom = { quad repeat(2000, { A }) };\n"
                + "rule A : 9 = { X_ };\n"
                + "rule A : 1 = { Y_ };");
        Result<Shape> root = session(g, options()).derive();
        assertTrue(root.isOk(), () -> root.error().toString());
        int x = named(root.value(), "X_").size();
        int y = named(root.value(), "Y_").size();
        assertEquals(2000, x + y);
        assertTrue(x > 1700 && x < 1900, "X_ count " + x);
    }

    @Test
    void same_seed_gives_same_derivation() {
        String src = "rule Axiom = { quad repeat(50, { A }) };\n"
                + "rule A : 0.5 = { X_ };\n"
                + "rule A : 0.5 = { Y_ };";
        Result<Shape> a = session(grammar(src), options().seed(7)).derive();
        Result<Shape> b = session(grammar(src), options().seed(7)).derive();
        assertEquals(named(a.value(), "X_").size(), named(b.value(), "X_").size());
    }

    @Test
    void zero_probabilities_fall_back_to_uniform_choice() {
        Grammar g = grammar("rule Axiom = { quad repeat(400, { A }) };\n"
                + "rule A : 0 = { X_ };\n"
                + "rule A : 0 = { Y_ };");
        Result<Shape> root = session(g, options()).derive();
        assertTrue(root.isOk());
        int x = named(root.value(), "X_").size();
        assertTrue(x > 120 && x < 280, "X_ count " + x);
    }

    @Test
    void conditions_select_rules() {
        Grammar g = grammar("rule Axiom = { A(1) A(5) };\n"
                + "rule A(n) :: n > 2 = { Big_ };\n"
                + "rule A(n) :: n <= 2 = { Small_ };");
        Result<Shape> root = session(g, options()).derive();
        assertTrue(root.isOk());
        assertEquals(1, named(root.value(), "Big_").size());
        assertEquals(1, named(root.value(), "Small_").size());
    }

    @Test
    void rule_arguments_are_bound() {
        Grammar g = grammar("rule Axiom = { A(3, \"x\") };\n"
                + "rule A(n, s) = { printLn(s + n * 2) };");
        assertTrue(session(g, options()).derive().isOk());
        assertEquals("x6\n", printed());
    }

    @Test
    void missing_rules_are_warnings() {
        Grammar g = grammar("rule Axiom = { A B(1) C };\n"
                + "rule B = { X_ };\n"
                + "rule C :: false = { X_ };");
        Interpreter interp = session(g, options());
        assertTrue(interp.derive().isOk());
        List<String> d = interp.diagnostics();
        assertTrue(d.contains("WARNING: No rule or shape operations found for 'A'."), d.toString());
        assertTrue(d.contains("WARNING: No rule found for 'B' with 1 parameters."), d.toString());
        assertTrue(d.contains("WARNING: No rule with true condition found for 'C'."), d.toString());
    }

    @Test
    void max_steps_stops_endless_derivations() {
        Grammar g = grammar("rule Axiom = { Axiom };");
        Interpreter interp = session(g, options().maxSteps(10));
        Result<Shape> root = interp.derive();
        assertTrue(root.isOk());
        assertEquals(11, interp.tree().size());
        assertTrue(interp.diagnostics().get(0).contains("Reached max derivation depth (10)"));
    }

    @Test
    void unbalanced_brackets_fail() {
        Result<Shape> pushes = session(grammar("rule Axiom = { [ A_ };"), options()).derive();
        assertTrue(pushes.failed());
        assertTrue(pushes.error().message().contains("There are more pushes '[' than pops ']'"));

        Result<Shape> pops = session(grammar("rule Axiom = { ] };"), options()).derive();
        assertTrue(pops.failed());
        assertTrue(pops.error().message().contains("There are more pops ']' than pushes '['"));
    }

    @Test
    void parameter_overrides_replace_defaults() {
        Grammar g = grammar("param n = 1;\nrule Axiom = { printLn(n) };");
        Interpreter interp = session(g, options()
                .parameter("n", Value.integer(5))
                .parameter("missing", Value.bool(true)));
        assertTrue(interp.derive().isOk());
        assertEquals("5\n", printed());
        assertTrue(interp.diagnostics().get(0).contains("'missing' does not exist"));
    }

    @Test
    void custom_axiom() {
        Grammar g = grammar("rule Start = { printLn(\"start\") };");
        assertTrue(session(g, options().axiom("Start")).derive().isOk());
        assertEquals("start\n", printed());
    }

    @Test
    void failing_constant_fails_session_creation() {
        Result<Interpreter> s = Interpreter.create(grammar("const c = 1 / 0;"), options());
        assertTrue(s.failed());
        assertTrue(s.error().message().startsWith("In constant 'c': "));
    }

    @Test
    void interrupt_stops_derivation() {
        AtomicBoolean stop = new AtomicBoolean(true);
        Result<Shape> root = session(grammar("rule Axiom = { A };"), options().interrupt(stop)).derive();
        assertTrue(root.failed());
        assertEquals("Derivation was interrupted.", root.error().message());
    }

    @Test
    void errors_carry_the_rule_name() {
        Result<Shape> root = session(grammar("rule Axiom = { quad extrude(-1) };"), options()).derive();
        assertTrue(root.failed());
        assertTrue(root.error().message().startsWith("In rule 'Axiom': "), root.error().message());
    }

    @Test
    void example_building_derives() throws IOException {
        Interpreter interp = session(grammar(resource("building.shp")), options());
        Result<Shape> root = interp.derive();
        assertTrue(root.isOk(), () -> root.error().toString());
        assertFalse(named(root.value(), "Mass").isEmpty());
        assertFalse(named(root.value(), "Facade").isEmpty());
        assertEquals(1, named(root.value(), "RoofSurface_").size());
    }

    @Test
    void warnings_need_no_installed_sink() {
        Debug.get().setSink(null);
        Interpreter interp = session(grammar("rule Axiom = { Missing };"), options());
        Result<Shape> root = interp.derive();
        assertTrue(root.isOk());
        assertTrue(interp.diagnostics().contains("WARNING: No rule or shape operations found for 'Missing'."),
                interp.diagnostics().toString());
    }

    @Test
    void single_enabled_rule_draws_no_random_number() {
        Grammar g = grammar("rule Axiom = { A(1) };\n"
                + "rule A(n) :: n > 2 = { Big_ };\n"
                + "rule A(n) :: n <= 2 = { Small_ };");
        Interpreter interp = session(g, options().seed(4242));
        Result<Shape> root = interp.derive();
        assertTrue(root.isOk());
        assertEquals(1, named(root.value(), "Small_").size());
        assertEquals(new Random(4242).nextDouble(), interp.random().nextDouble());
    }

    @Test
    void derive_again_leaves_earlier_tree_untouched() {
        Interpreter interp = session(grammar("rule Axiom = { quad A B_ };\n"
                + "rule A = { quad C_ D };\n"
                + "rule D = { quad E_ };"), options());
        Result<Shape> first = interp.derive(1);
        assertTrue(first.isOk());
        List<String> before = new ArrayList<>();
        first.value().accept(s -> before.add(s.name()));
        assertEquals(List.of("Axiom", "A", "B_"), before);

        Result<Shape> second = interp.derive(10);
        assertTrue(second.isOk());
        assertNotSame(first.value(), second.value());

        List<String> after = new ArrayList<>();
        first.value().accept(s -> after.add(s.name()));
        assertEquals(before, after);

        List<String> full = new ArrayList<>();
        second.value().accept(s -> full.add(s.name()));
        assertEquals(List.of("Axiom", "A", "C_", "D", "E_", "B_"), full);
    }

    @Test
    void occluders_do_not_carry_over_between_derivations() {
        Interpreter interp = session(grammar("rule Axiom = { size(4, 4, 4) cube printLn(occlusion) octreeAdd A_ };"),
                options());
        assertTrue(interp.derive().isOk());
        assertTrue(interp.derive().isOk());
        assertEquals("none\nnone\n", printed());
    }
}
