package com.shapeml.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.shapeml.script.eval.BuiltinRegistry;
import com.shapeml.script.parser.Expr.ExprInterface;

/**
 * Symbol tables of a parsed grammar file.
 *
 * Parameter, constant and function names must be unique among each other and may not
 * shadow a built-in function or shape attribute. Rule predecessors may not shadow a
 * built-in shape operation. Tables keep declaration order.
 */
public class Grammar {
    private final BuiltinRegistry builtins;

    private String basePath = "";
    private String fileName = "";

    private final Map<String, Value> parameters = new LinkedHashMap<>();
    private final Map<String, ExprInterface> constants = new LinkedHashMap<>();
    private final Map<String, UserFunction> functions = new LinkedHashMap<>();
    private final Map<String, List<Rule>> rules = new LinkedHashMap<>();
    private final List<Rule> ruleOrdering = new ArrayList<>();

    public Grammar() {
        this(BuiltinRegistry.standard());
    }

    public Grammar(BuiltinRegistry builtins) {
        this.builtins = builtins;
    }

    public AddResult addParameter(String name, Value value) {
        if (nameTaken(name)) return AddResult.NAME_COLLISION;
        parameters.put(name, value);
        return AddResult.OK;
    }

    public AddResult addConstant(String name, ExprInterface expr) {
        if (nameTaken(name)) return AddResult.NAME_COLLISION;
        constants.put(name, expr);
        return AddResult.OK;
    }

    public AddResult addFunction(UserFunction func) {
        if (nameTaken(func.name)) return AddResult.NAME_COLLISION;
        if (hasDuplicates(func.params)) return AddResult.DUPLICATE_ARG;
        functions.put(func.name, func);
        return AddResult.OK;
    }

    public AddResult addRule(Rule rule) {
        if (builtins.hasShapeOp(rule.predecessor)) return AddResult.NAME_COLLISION;
        if (hasDuplicates(rule.params)) return AddResult.DUPLICATE_ARG;
        if (rule.predecessor.endsWith("_")) return AddResult.PREDECESSOR_ENDS_IN_UNDERSCORE;
        rules.computeIfAbsent(rule.predecessor, k -> new ArrayList<>()).add(rule);
        ruleOrdering.add(rule);
        return AddResult.OK;
    }

    private boolean nameTaken(String name) {
        return parameters.containsKey(name)
                || constants.containsKey(name)
                || functions.containsKey(name)
                || builtins.hasFunction(name)
                || builtins.hasAttribute(name);
    }

    private static boolean hasDuplicates(List<String> names) {
        Set<String> seen = new HashSet<>();
        for (String n : names) {
            if (!seen.add(n)) return true;
        }
        return false;
    }

    public BuiltinRegistry builtins() { return builtins; }

    /** Directory of the grammar file including the trailing separator, or empty. */
    public String basePath() { return basePath; }
    public void setBasePath(String basePath) { this.basePath = basePath; }

    public String fileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }

    public Map<String, Value> parameters() { return Collections.unmodifiableMap(parameters); }
    public Map<String, ExprInterface> constants() { return Collections.unmodifiableMap(constants); }
    public Map<String, UserFunction> functions() { return Collections.unmodifiableMap(functions); }

    public List<Rule> rulesFor(String predecessor) {
        List<Rule> list = rules.get(predecessor);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public List<Rule> rules() { return Collections.unmodifiableList(ruleOrdering); }

    /**
     * Prints parameters, constants, functions and rules, one statement per line,
     * with a blank line between groups and between rules. The output parses back
     * into an equivalent grammar.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        boolean first = true;

        if (!parameters.isEmpty()) {
            first = false;
            for (Map.Entry<String, Value> e : parameters.entrySet()) {
                sb.append("param ").append(e.getKey()).append(" = ").append(e.getValue()).append(";\n");
            }
        }
        if (!constants.isEmpty()) {
            if (!first) sb.append('\n');
            first = false;
            for (Map.Entry<String, ExprInterface> e : constants.entrySet()) {
                sb.append("const ").append(e.getKey()).append(" = ")
                        .append(Expr.print(e.getValue())).append(";\n");
            }
        }
        if (!functions.isEmpty()) {
            if (!first) sb.append('\n');
            first = false;
            for (UserFunction f : functions.values()) {
                sb.append(f).append('\n');
            }
        }
        for (Rule r : ruleOrdering) {
            if (!first) sb.append('\n');
            first = false;
            sb.append(r).append('\n');
        }
        return sb.toString();
    }
}
