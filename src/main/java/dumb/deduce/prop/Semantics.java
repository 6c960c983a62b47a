package dumb.deduce.prop;

import dumb.deduce.Names;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static dumb.deduce.prop.Formula.not;

/** Truth-value semantics of propositional formulas and inference rules. */
public enum Semantics {
    ;

    public static final int MAX_VARIABLES = 30;

    /**
     * Truth value of {@code formula} in {@code model}, which must assign every
     * variable of the formula.
     */
    public static boolean evaluate(Formula formula, Model model) {
        for (var v : formula.variables())
            if (!model.contains(v))
                throw new IllegalArgumentException("Model " + model + " does not assign " + v + " of " + formula);
        return eval(formula, model);
    }

    private static boolean eval(Formula f, Model model) {
        if (f instanceof Formula.Var v) return model.get(v.name());
        if (f instanceof Formula.Const c) return c.value();
        if (f instanceof Formula.Not n) return !eval(n.operand(), model);
        var b = (Formula.Bin) f;
        return b.op().apply(eval(b.first(), model), eval(b.second(), model));
    }

    /**
     * All models over {@code variables}, lexicographically ordered with
     * {@code false} before {@code true} and the first variable most
     * significant. The list is computed on access and can be iterated any
     * number of times.
     */
    public static List<Model> allModels(List<String> variables) {
        for (var v : variables)
            if (!Names.isPropVariable(v)) throw new IllegalArgumentException("Not a variable: " + v);
        if (variables.size() > MAX_VARIABLES)
            throw new IllegalArgumentException("Too many variables for a truth table: " + variables.size());
        var vars = List.copyOf(variables);
        var n = vars.size();
        return new AbstractList<>() {
            @Override
            public Model get(int index) {
                if (index < 0 || index >= size()) throw new IndexOutOfBoundsException(index);
                var m = new LinkedHashMap<String, Boolean>(n * 2);
                for (var i = 0; i < n; i++)
                    m.put(vars.get(i), ((index >> (n - 1 - i)) & 1) == 1);
                return Model.of(m);
            }

            @Override
            public int size() {
                return 1 << n;
            }
        };
    }

    public static List<Boolean> truthValues(Formula formula, Iterable<Model> models) {
        var values = new ArrayList<Boolean>();
        for (var m : models) values.add(evaluate(formula, m));
        return values;
    }

    public static boolean isTautology(Formula formula) {
        return !truthValues(formula, allModels(sortedVariables(formula))).contains(false);
    }

    public static boolean isContradiction(Formula formula) {
        return !isSatisfiable(formula);
    }

    public static boolean isSatisfiable(Formula formula) {
        return truthValues(formula, allModels(sortedVariables(formula))).contains(true);
    }

    /**
     * The conjunction of literals, in the model's order, that holds in
     * {@code model} and in no other model over the same variables.
     */
    public static Formula synthesizeForModel(Model model) {
        if (model.size() == 0) throw new IllegalArgumentException("Empty model");
        var literals = new ArrayList<Formula>();
        for (var v : model.variables())
            literals.add(literal(v, model.get(v)));
        return chain(Op.AND, literals);
    }

    /**
     * A formula in disjunctive normal form over {@code variables} whose truth
     * table is {@code values}, given in {@link #allModels(List)} order. When no
     * value is true the result is {@code (x&~x)} for the first variable.
     */
    public static Formula synthesize(List<String> variables, List<Boolean> values) {
        var models = checkTable(variables, values);
        var clauses = new ArrayList<Formula>();
        for (var i = 0; i < values.size(); i++)
            if (values.get(i)) clauses.add(synthesizeForModel(models.get(i)));
        if (clauses.isEmpty()) {
            var x = new Formula.Var(variables.get(0));
            return new Formula.Bin(Op.AND, x, not(x));
        }
        return chain(Op.OR, clauses);
    }

    /**
     * A formula in conjunctive normal form over {@code variables} whose truth
     * table is {@code values}. When every value is true the result is
     * {@code (x|~x)} for the first variable.
     */
    public static Formula synthesizeCnf(List<String> variables, List<Boolean> values) {
        var models = checkTable(variables, values);
        var clauses = new ArrayList<Formula>();
        for (var i = 0; i < values.size(); i++) {
            if (values.get(i)) continue;
            var m = models.get(i);
            var literals = new ArrayList<Formula>();
            for (var v : m.variables())
                literals.add(literal(v, !m.get(v)));
            clauses.add(chain(Op.OR, literals));
        }
        if (clauses.isEmpty()) {
            var x = new Formula.Var(variables.get(0));
            return new Formula.Bin(Op.OR, x, not(x));
        }
        return chain(Op.AND, clauses);
    }

    /**
     * Literals capturing {@code model}: {@code x} for each true variable and
     * {@code ~x} for each false one, ordered alphabetically by variable.
     */
    public static List<Formula> formulaeCapturingModel(Model model) {
        return model.variables().stream().sorted()
                .map(v -> literal(v, model.get(v)))
                .toList();
    }

    public static boolean evaluateInference(InferenceRule rule, Model model) {
        for (var a : rule.assumptions())
            if (!evaluate(a, model)) return true;
        return evaluate(rule.conclusion(), model);
    }

    /** Whether the conclusion of {@code rule} holds in every model of all its assumptions. */
    public static boolean isSoundInference(InferenceRule rule) {
        for (var m : allModels(rule.variables().stream().sorted().toList()))
            if (!evaluateInference(rule, m)) return false;
        return true;
    }

    static List<String> sortedVariables(Formula formula) {
        return formula.variables().stream().sorted().toList();
    }

    private static Formula literal(String variable, boolean positive) {
        var x = new Formula.Var(variable);
        return positive ? x : not(x);
    }

    /** Right-nested {@code (a op (b op (c ...)))}. */
    private static Formula chain(Op op, List<Formula> items) {
        var f = items.get(items.size() - 1);
        for (var i = items.size() - 2; i >= 0; i--)
            f = new Formula.Bin(op, items.get(i), f);
        return f;
    }

    private static List<Model> checkTable(List<String> variables, List<Boolean> values) {
        if (variables.isEmpty()) throw new IllegalArgumentException("No variables to synthesize over");
        var models = allModels(variables);
        if (models.size() != values.size())
            throw new IllegalArgumentException("Expected " + models.size() + " truth values, got " + values.size());
        return models;
    }
}
