package com.shapeml.script.interpreter;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

import org.joml.Vector3d;

import com.shapeml.debug.Debug;
import com.shapeml.geometry.MeshCache;
import com.shapeml.geometry.Octree;
import com.shapeml.script.eval.Builtin;
import com.shapeml.script.eval.BuiltinRegistry;
import com.shapeml.script.eval.EvalKind;
import com.shapeml.script.eval.Invocation;
import com.shapeml.script.parser.Expr;
import com.shapeml.script.parser.Expr.ExprInterface;
import com.shapeml.script.parser.Grammar;
import com.shapeml.script.parser.Locator;
import com.shapeml.script.parser.Rule;
import com.shapeml.script.parser.ShapeOp;
import com.shapeml.script.parser.Value;
import com.shapeml.shape.OcclusionShape;
import com.shapeml.shape.Shape;
import com.shapeml.shape.ShapeTree;

/**
 * One derivation session over a parsed {@link Grammar}.
 *
 * A session owns its random stream, call stack, scope stack and evaluated constants.
 * Sessions are not thread-safe; derive in parallel by creating one session per thread.
 *
 * <pre>
 *   Result&lt;Interpreter&gt; session = Interpreter.create(grammar, new Interpreter.Options().seed(7));
 *   Result&lt;Shape&gt; root = session.value().derive();
 * </pre>
 */
public final class Interpreter {
    public static final int MAX_FUNCTION_DEPTH = 20;
    public static final int MAX_REFERENCE_DEPTH = 20;
    public static final int DEFAULT_SEED = 666;
    public static final int DEFAULT_MAX_STEPS = 1000;
    public static final String DEFAULT_AXIOM = "Axiom";

    static final String TAG = "shapeml.interpreter";

    /** Session configuration. Unset collaborators are created with their defaults. */
    public static final class Options {
        private String axiom = DEFAULT_AXIOM;
        private int seed = DEFAULT_SEED;
        private final Map<String, Value> parameters = new LinkedHashMap<>();
        private int maxSteps = DEFAULT_MAX_STEPS;
        private MeshCache meshCache;
        private Octree<OcclusionShape> octree;
        private boolean octreeDisabled = false;
        private PrintStream out = System.out;
        private AtomicBoolean interrupt = new AtomicBoolean(false);

        public Options axiom(String axiom) {
            if (axiom == null || axiom.isEmpty()) throw new IllegalArgumentException("axiom must not be empty");
            this.axiom = axiom;
            return this;
        }

        public Options seed(int seed) {
            this.seed = seed;
            return this;
        }

        public Options parameter(String name, Value value) {
            this.parameters.put(name, value);
            return this;
        }

        public Options parameters(Map<String, Value> values) {
            this.parameters.putAll(values);
            return this;
        }

        public Options maxSteps(int maxSteps) {
            if (maxSteps < 0) throw new IllegalArgumentException("maxSteps must not be negative");
            this.maxSteps = maxSteps;
            return this;
        }

        public Options meshCache(MeshCache meshCache) {
            this.meshCache = meshCache;
            return this;
        }

        public Options octree(Octree<OcclusionShape> octree) {
            this.octree = octree;
            this.octreeDisabled = octree == null;
            return this;
        }

        public Options out(PrintStream out) {
            this.out = out;
            return this;
        }

        public Options interrupt(AtomicBoolean interrupt) {
            this.interrupt = interrupt;
            return this;
        }

        public String axiom() { return axiom; }
        public int seed() { return seed; }
        public int maxSteps() { return maxSteps; }
    }

    private final Grammar grammar;
    private final BuiltinRegistry builtins;
    private final Options options;
    private final Random random;
    private final MeshCache meshCache;
    private final boolean ownsOctree;
    private Octree<OcclusionShape> octree;
    private final ExpressionEvaluator evaluator;

    private final Map<String, Value> parameters = new LinkedHashMap<>();
    private final Map<String, Value> constants = new LinkedHashMap<>();

    final Deque<CallFrame> callStack = new ArrayDeque<>();
    private final ShapeStack shapeStack = new ShapeStack();
    private ShapeTree tree = new ShapeTree();
    private int referenceDepth = 0;
    private Shape currentShape;

    private final List<String> diagnostics = new ArrayList<>();

    private Interpreter(Grammar grammar, Options options) {
        this.grammar = grammar;
        this.builtins = grammar.builtins();
        this.options = options;
        this.random = new Random(options.seed);
        this.meshCache = options.meshCache != null ? options.meshCache : new MeshCache();
        this.ownsOctree = options.octree == null && !options.octreeDisabled;
        this.octree = ownsOctree ? newOctree() : options.octree;
        this.evaluator = new ExpressionEvaluator(this);
    }

    /**
     * Creates a session: merges parameter overrides into the grammar defaults and
     * evaluates all constants in declaration order.
     */
    public static Result<Interpreter> create(Grammar grammar, Options options) {
        if (grammar == null) throw new IllegalArgumentException("grammar must not be null");
        Interpreter interp = new Interpreter(grammar, options == null ? new Options() : options);

        interp.parameters.putAll(grammar.parameters());
        for (Map.Entry<String, Value> e : interp.options.parameters.entrySet()) {
            if (interp.parameters.containsKey(e.getKey())) {
                interp.parameters.put(e.getKey(), e.getValue());
            } else {
                interp.warn("WARNING: The parameter '" + e.getKey()
                        + "' does not exist in the grammar and will be ignored.");
            }
        }

        for (Map.Entry<String, ExprInterface> e : grammar.constants().entrySet()) {
            Result<Value> r = interp.evaluate(e.getValue());
            if (r.failed()) {
                RuntimeError err = new RuntimeError("In constant '" + e.getKey() + "': " + r.error().message(),
                        r.error().locator());
                interp.error(err);
                return Result.fail(err);
            }
            interp.constants.put(e.getKey(), r.value());
        }
        return Result.ok(interp);
    }

    private static Octree<OcclusionShape> newOctree() {
        return new Octree<>(new Vector3d(), Octree.DEFAULT_HALF_WIDTH);
    }

    public static Result<Interpreter> create(Grammar grammar) {
        return create(grammar, new Options());
    }

    // -------------------------
    // Derivation
    // -------------------------

    /** Derives a fresh tree from the axiom with the configured step limit. */
    public Result<Shape> derive() {
        return derive(options.maxSteps);
    }

    public Result<Shape> derive(int maxSteps) {
        // Trees returned by earlier calls stay intact.
        tree = new ShapeTree();
        if (ownsOctree) octree = newOctree();
        Shape root = tree.createRoot(options.axiom);
        callStack.clear();
        shapeStack.clear();
        referenceDepth = 0;

        List<Shape> generation = new ArrayList<>();
        generation.add(root);

        for (int step = 0; step < maxSteps && !generation.isEmpty(); step++) {
            if (options.interrupt.get()) {
                RuntimeError err = new RuntimeError("Derivation was interrupted.", Locator.NONE);
                error(err);
                return Result.fail(err);
            }

            List<Shape> next = new ArrayList<>();
            for (Shape s : generation) {
                currentShape = s;
                shapeStack.clear();
                shapeStack.push(s.createOffspring());

                Result<Rule> selected = selectRule(s);
                Result<Void> applied = selected.failed() ? selected.propagate() : Result.ok();
                if (applied.isOk() && selected.value() != null) {
                    s.setRule(selected.value());
                    applied = applyShapeOpString(selected.value().successor, next);
                }
                if (applied.failed()) {
                    RuntimeError err = new RuntimeError("In rule '" + s.name() + "': " + applied.error().message(),
                            applied.error().locator());
                    error(err);
                    shapeStack.clear();
                    return Result.fail(err);
                }
            }
            generation = next;
        }
        shapeStack.clear();
        currentShape = null;

        if (!generation.isEmpty()) {
            warn("WARNING: Reached max derivation depth (" + maxSteps
                    + "), but the model is not fully derived yet.");
        }
        return Result.ok(root);
    }

    /**
     * Applies a shape operation string to the scope stack. Non-terminal shapes it
     * creates are appended to {@code output}.
     */
    public Result<Void> applyShapeOpString(List<ShapeOp> ops, List<Shape> output) {
        OpStringFrame frame = new OpStringFrame(shapeStack.size(), output);

        for (ShapeOp op : ops) {
            if (op.reference) {
                Result<Void> r = applyReference(op, output);
                if (r.failed()) return r;
                continue;
            }

            Result<List<Value>> args = evaluator.evalAll(op.args);
            if (args.failed()) return args.propagate();

            Builtin builtin = builtins.lookup(EvalKind.SHAPE_OPERATION, op.name);
            if (builtin != null) {
                Result<Value> r = new Invocation(builtin, args.value(), this, frame).run();
                if (r.failed()) return Result.fail(r.error().at(op.locator));
                continue;
            }

            Shape created = shapeStack.top().copy();
            created.setName(op.name);
            created.appendToParent();
            created.setParameters(args.value());

            if (op.name.endsWith("_")) {
                if (!created.parameters().isEmpty()) {
                    warn("WARNING" + op.locator.where() + ": The arguments passed to terminal '" + op.name
                            + "' will be ignored.");
                }
                if (!created.hasNonEmptyMesh()) {
                    warn("WARNING" + op.locator.where() + ": Creation of terminal '" + op.name
                            + "' with no mesh or an empty one.");
                }
                created.setTerminal(true);
            } else {
                output.add(created);
            }
        }

        if (shapeStack.size() != frame.stackStartSize()) {
            Rule rule = currentShape == null ? null : currentShape.rule();
            return Result.fail(new RuntimeError(
                    "There are more pushes '[' than pops ']' in a shape operation string.",
                    rule == null ? Locator.NONE : rule.lastLine));
        }
        return Result.ok();
    }

    private Result<Void> applyReference(ShapeOp op, List<Shape> output) {
        if (referenceDepth == MAX_REFERENCE_DEPTH) {
            return Result.fail(new RuntimeError("Dereferencing '" + op.name + "' reached the max recursion depth ("
                    + MAX_REFERENCE_DEPTH + ") for nested references.", op.locator));
        }
        referenceDepth++;
        try {
            Result<Value> ref = evaluator.eval(new Expr.Name(op.name, op.args, true, op.locator));
            if (ref.failed()) return ref.propagate();
            if (ref.value().type != Value.Type.SHAPE_OP_STRING) {
                return Result.fail(new RuntimeError("'" + op.name
                        + "' is not of type shape operation string and cannot be referenced as such.", op.locator));
            }
            Result<Void> r = applyShapeOpString(ref.value().asOps(), output);
            if (r.failed()) {
                return Result.fail(r.error().wrap("Inside reference to '" + op.name + "':", op.locator));
            }
            return r;
        } finally {
            referenceDepth--;
        }
    }

    /**
     * Picks the rule that rewrites {@code shape}, or an ok result holding null when no
     * rule applies (a warning is emitted in that case).
     */
    Result<Rule> selectRule(Shape shape) {
        String sym = shape.name();
        List<Rule> candidates = grammar.rulesFor(sym);
        if (candidates.isEmpty()) {
            warn("WARNING: No rule or shape operations found for '" + sym + "'.");
            return Result.ok(null);
        }

        int paramCount = shape.parameters().size();
        List<Rule> rules = new ArrayList<>();
        for (Rule rule : candidates) {
            if (rule.params.size() == paramCount) rules.add(rule);
        }
        if (rules.isEmpty()) {
            warn("WARNING: No rule found for '" + sym + "' with " + paramCount + " parameters.");
            return Result.ok(null);
        }

        List<Rule> enabled = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.condition == null) {
                enabled.add(rule);
                continue;
            }
            Result<Value> cond = evaluateWithRule(shape, rule, rule.condition);
            if (cond.failed()) return cond.propagate();
            Value b = cond.value().changeType(Value.Type.BOOL);
            if (b == null) {
                return Result.fail(new RuntimeError("The condition of a rule for '" + sym
                        + "' cannot be converted to bool.", rule.lastLine));
            }
            if (b.asBool()) enabled.add(rule);
        }
        if (enabled.isEmpty()) {
            warn("WARNING: No rule with true condition found for '" + sym + Value.printList(shape.parameters()) + "'.");
            return Result.ok(null);
        }

        if (enabled.size() == 1) return Result.ok(enabled.get(0));

        double[] weights = new double[enabled.size()];
        double total = 0.0;
        for (int i = 0; i < enabled.size(); i++) {
            Rule rule = enabled.get(i);
            double w = 1.0;
            if (rule.probability != null) {
                Result<Value> p = evaluateWithRule(shape, rule, rule.probability);
                if (p.failed()) return p.propagate();
                Value f = p.value().changeType(Value.Type.FLOAT);
                if (f == null) {
                    return Result.fail(new RuntimeError("The probability of a rule for '" + sym
                            + "' cannot be converted to float.", rule.lastLine));
                }
                w = f.asFloat();
            }
            weights[i] = Math.max(0.0, w);
            total += weights[i];
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] = total > 0.0 ? weights[i] / total : 1.0 / weights.length;
        }

        double draw = random.nextDouble();
        double cumulative = 0.0;
        for (int i = 0; i < weights.length; i++) {
            cumulative += weights[i];
            if (draw <= cumulative) return Result.ok(enabled.get(i));
        }
        return Result.ok(enabled.get(enabled.size() - 1));
    }

    private Result<Value> evaluateWithRule(Shape shape, Rule rule, ExprInterface expr) {
        shape.setRule(rule);
        try {
            return evaluate(expr);
        } finally {
            shape.setRule(null);
        }
    }

    // -------------------------
    // Evaluation
    // -------------------------

    /** Evaluates an expression in the current state of the session. */
    public Result<Value> evaluate(ExprInterface expr) {
        return evaluator.eval(expr);
    }

    /** A parameter (with overrides applied) or an evaluated constant, or null. */
    public Value globalVariable(String name) {
        Value v = parameters.get(name);
        return v != null ? v : constants.get(name);
    }

    // -------------------------
    // Diagnostics
    // -------------------------

    /** Logs a warning and records it on the session. */
    public void warn(String message) {
        diagnostics.add(message);
        Debug.get().w(TAG, message);
    }

    void error(RuntimeError err) {
        String text = err.toString();
        diagnostics.add(text);
        Debug.get().e(TAG, text);
    }

    /** Every warning and error text emitted by this session, in order. */
    public List<String> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    // -------------------------
    // Accessors
    // -------------------------

    public Grammar grammar() { return grammar; }

    public BuiltinRegistry builtins() { return builtins; }

    public Random random() { return random; }

    public int seed() { return options.seed; }

    public ShapeStack shapeStack() { return shapeStack; }

    /** The shape whose rule is being applied, null outside a derivation. */
    public Shape currentShape() { return currentShape; }

    public MeshCache meshCache() { return meshCache; }

    /** Occlusion octree, or null when occlusion queries are disabled. */
    public Octree<OcclusionShape> octree() { return octree; }

    public PrintStream out() { return options.out; }

    public ShapeTree tree() { return tree; }

    public Shape root() { return tree.root(); }

    public Map<String, Value> parameters() { return Collections.unmodifiableMap(parameters); }

    public Map<String, Value> constants() { return Collections.unmodifiableMap(constants); }
}
