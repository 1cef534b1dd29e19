package com.shapeml.script.eval;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.shapeml.script.parser.Value;
import com.shapeml.script.plugins.AssetFunctions;
import com.shapeml.script.plugins.ControlOps;
import com.shapeml.script.plugins.MaterialOps;
import com.shapeml.script.plugins.MathFunctions;
import com.shapeml.script.plugins.MeshOps;
import com.shapeml.script.plugins.RandomFunctions;
import com.shapeml.script.plugins.ShapeAttributes;
import com.shapeml.script.plugins.SplitOps;
import com.shapeml.script.plugins.TransformOps;

/**
 * Name to built-in tables, one per {@link EvalKind}. Plugins fill a registry through
 * {@link #shapeOp}, {@link #attribute} and {@link #function}:
 *
 * <pre>
 *   registry.shapeOp("translateX").args(FLOAT).run(inv -&gt; { ... });
 *   registry.function("noise").variadic().check(inv -&gt; ...).run(inv -&gt; ...);
 * </pre>
 *
 * Registering a name twice within one kind is a programming error.
 */
public final class BuiltinRegistry {

    private final Map<EvalKind, Map<String, Builtin>> tables = new EnumMap<>(EvalKind.class);
    private boolean sealed = false;

    public BuiltinRegistry() {
        for (EvalKind kind : EvalKind.values()) tables.put(kind, new LinkedHashMap<>());
    }

    private static final class StandardHolder {
        static final BuiltinRegistry INSTANCE = createStandard();
    }

    /** The registry with the full built-in library. Shared and read-only. */
    public static BuiltinRegistry standard() {
        return StandardHolder.INSTANCE;
    }

    private static BuiltinRegistry createStandard() {
        BuiltinRegistry r = new BuiltinRegistry();
        TransformOps.register(r);
        MeshOps.register(r);
        MaterialOps.register(r);
        SplitOps.register(r);
        ControlOps.register(r);
        ShapeAttributes.register(r);
        MathFunctions.register(r);
        RandomFunctions.register(r);
        AssetFunctions.register(r);
        r.seal();
        return r;
    }

    /** Rejects any further registration. */
    public void seal() {
        sealed = true;
    }

    public Definition shapeOp(String name) {
        return new Definition(EvalKind.SHAPE_OPERATION, name);
    }

    public Definition attribute(String name) {
        return new Definition(EvalKind.SHAPE_ATTRIBUTE, name);
    }

    public Definition function(String name) {
        return new Definition(EvalKind.FUNCTION, name);
    }

    void add(Builtin b) {
        if (sealed) throw new IllegalStateException("Registry is sealed, cannot add " + b);
        Map<String, Builtin> table = tables.get(b.kind());
        if (table.containsKey(b.name())) {
            throw new IllegalStateException("Duplicate registration of " + b);
        }
        table.put(b.name(), b);
    }

    /** The built-in of the given kind, or null. */
    public Builtin lookup(EvalKind kind, String name) {
        return tables.get(kind).get(name);
    }

    public boolean hasShapeOp(String name) { return tables.get(EvalKind.SHAPE_OPERATION).containsKey(name); }
    public boolean hasAttribute(String name) { return tables.get(EvalKind.SHAPE_ATTRIBUTE).containsKey(name); }
    public boolean hasFunction(String name) { return tables.get(EvalKind.FUNCTION).containsKey(name); }

    public Set<String> names(EvalKind kind) {
        return Collections.unmodifiableSet(tables.get(kind).keySet());
    }

    /** Fluent definition of one built-in; {@link #run} registers it. */
    public final class Definition {
        private final EvalKind kind;
        private final String name;
        private int arity = 0;
        private List<Value.Type> types = new ArrayList<>();
        private Builtin.Check special;

        Definition(EvalKind kind, String name) {
            this.kind = kind;
            this.name = name;
        }

        /** Fixed positional argument types; the arity is their count. */
        public Definition args(Value.Type... argTypes) {
            this.types = new ArrayList<>(Arrays.asList(argTypes));
            this.arity = argTypes.length;
            return this;
        }

        /** The argument count and types are validated by the special check alone. */
        public Definition variadic() {
            this.types = new ArrayList<>();
            this.arity = Builtin.VARIADIC;
            return this;
        }

        public Definition check(Builtin.Check check) {
            this.special = check;
            return this;
        }

        public void run(Builtin.Body body) {
            add(new Builtin(name, kind, arity, types, special, body));
        }
    }
}
