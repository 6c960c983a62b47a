package dumb.deduce.fol;

import dumb.deduce.FreshNames;
import dumb.deduce.Names;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Immutable first-order formula: an equality or relation over terms, a
 * negation, a binary connective ({@code & | ->}) or a quantification.
 */
sealed public interface Formula permits Formula.Eq, Formula.Rel, Formula.Not, Formula.Bin, Formula.Quant {

    static Formula parse(String s) {
        return FolParser.parseFormula(s);
    }

    static FolParser.Parsed<Formula> parsePrefix(String s) {
        return FolParser.parseFormulaPrefix(s);
    }

    /** Variables with an occurrence outside the scope of any quantifier on them. */
    default Set<String> freeVariables() {
        if (this instanceof Eq e) return union(e.left.variables(), e.right.variables());
        if (this instanceof Rel r) return termVariables(r.args);
        if (this instanceof Not n) return n.operand.freeVariables();
        if (this instanceof Bin b) return union(b.first.freeVariables(), b.second.freeVariables());
        var q = (Quant) this;
        var s = new TreeSet<>(q.body.freeVariables());
        s.remove(q.variable);
        return s;
    }

    /** All variable names, bound or free, including quantified ones. */
    default Set<String> variables() {
        if (this instanceof Eq e) return union(e.left.variables(), e.right.variables());
        if (this instanceof Rel r) return termVariables(r.args);
        if (this instanceof Not n) return n.operand.variables();
        if (this instanceof Bin b) return union(b.first.variables(), b.second.variables());
        var q = (Quant) this;
        var s = new TreeSet<>(q.body.variables());
        s.add(q.variable);
        return s;
    }

    default Set<String> constants() {
        var s = new TreeSet<String>();
        terms(this).forEach(t -> s.addAll(t.constants()));
        return s;
    }

    default Set<Arity> functions() {
        var s = new HashSet<Arity>();
        terms(this).forEach(t -> s.addAll(t.functions()));
        return s;
    }

    default Set<Arity> relations() {
        var s = new HashSet<Arity>();
        collectRelations(this, s);
        return s;
    }

    /**
     * Simultaneously replaces each constant, and each free occurrence of each
     * variable, named by a key of {@code map}.
     *
     * <pre>
     * Ay[x=c] with {c: plus(d,x), x: c} is Ay[c=plus(d,x)]
     * Ay[x=c] with {c: plus(d,y)} throws ForbiddenVariableError(y)
     * </pre>
     *
     * @throws ForbiddenVariableError if a substituted term contains a variable
     *                                of {@code forbidden}, or one that a
     *                                quantifier around the substitution point binds
     */
    default Formula substitute(Map<String, Term> map, Set<String> forbidden) {
        for (var k : map.keySet())
            if (!Names.isConstant(k) && !Names.isVariable(k))
                throw new IllegalArgumentException("Only constants and variables can be substituted: " + k);
        for (var v : forbidden)
            if (!Names.isVariable(v)) throw new IllegalArgumentException("Not a variable: " + v);
        return substituteRecursive(this, map, forbidden);
    }

    default Formula substitute(Map<String, Term> map) {
        return substitute(map, Set.of());
    }

    /**
     * Replaces every outermost equality, relation or quantification by a
     * fresh propositional variable from {@code names}, left to right, reusing
     * the variable for equal subformulas.
     */
    default Skeleton propositionalSkeleton(FreshNames names) {
        return Skeleton.of(this, names);
    }

    static Formula fromPropositionalSkeleton(dumb.deduce.prop.Formula skeleton, Map<String, Formula> map) {
        return Skeleton.restore(skeleton, map);
    }

    JSONObject toJson();

    private static Formula substituteRecursive(Formula f, Map<String, Term> map, Set<String> forbidden) {
        if (f instanceof Eq e)
            return new Eq(e.left.substitute(map, forbidden), e.right.substitute(map, forbidden));
        if (f instanceof Rel r)
            return new Rel(r.name, r.args.stream().map(t -> t.substitute(map, forbidden)).toList());
        if (f instanceof Not n) return new Not(substituteRecursive(n.operand, map, forbidden));
        if (f instanceof Bin b)
            return new Bin(b.op, substituteRecursive(b.first, map, forbidden), substituteRecursive(b.second, map, forbidden));
        var q = (Quant) f;
        // the bound variable is not free below: drop it as a key, and no substituted term may mention it
        var inner = new HashMap<>(map);
        inner.remove(q.variable);
        var innerForbidden = new HashSet<>(forbidden);
        innerForbidden.add(q.variable);
        return new Quant(q.quantifier, q.variable, substituteRecursive(q.body, inner, innerForbidden));
    }

    private static List<Term> terms(Formula f) {
        if (f instanceof Eq e) return List.of(e.left, e.right);
        if (f instanceof Rel r) return r.args;
        if (f instanceof Not n) return terms(n.operand);
        if (f instanceof Bin b) return Stream.concat(terms(b.first).stream(), terms(b.second).stream()).toList();
        return terms(((Quant) f).body);
    }

    private static void collectRelations(Formula f, Set<Arity> into) {
        if (f instanceof Rel r) into.add(new Arity(r.name, r.args.size()));
        else if (f instanceof Not n) collectRelations(n.operand, into);
        else if (f instanceof Bin b) {
            collectRelations(b.first, into);
            collectRelations(b.second, into);
        } else if (f instanceof Quant q) collectRelations(q.body, into);
    }

    private static Set<String> termVariables(List<Term> terms) {
        var s = new TreeSet<String>();
        terms.forEach(t -> s.addAll(t.variables()));
        return s;
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        var s = new TreeSet<>(a);
        s.addAll(b);
        return s;
    }

    private static JSONArray json(List<Term> terms) {
        var a = new JSONArray();
        terms.forEach(t -> a.put(t.toJson()));
        return a;
    }

    record Eq(Term left, Term right) implements Formula {
        public Eq {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "eq")
                    .put("args", json(List.of(left, right)))
                    .put("text", toString());
        }

        @Override
        public String toString() {
            return left + Names.EQUALS + right;
        }
    }

    record Rel(String name, List<Term> args) implements Formula {
        public Rel {
            requireNonNull(name);
            if (!Names.isRelation(name)) throw new IllegalArgumentException("Not a relation name: " + name);
            args = List.copyOf(args);
        }

        public Rel(String name, Term... args) {
            this(name, List.of(args));
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "rel")
                    .put("name", name)
                    .put("args", json(args))
                    .put("text", toString());
        }

        @Override
        public String toString() {
            return args.stream().map(Term::toString).collect(Collectors.joining(",", name + "(", ")"));
        }
    }

    record Not(Formula operand) implements Formula {
        public Not {
            requireNonNull(operand);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "not")
                    .put("operand", operand.toJson())
                    .put("text", toString());
        }

        @Override
        public String toString() {
            return Names.NOT + operand;
        }
    }

    record Bin(String op, Formula first, Formula second) implements Formula {
        public Bin {
            if (!Names.isFolBinary(requireNonNull(op))) throw new IllegalArgumentException("Not a binary operator: " + op);
            requireNonNull(first);
            requireNonNull(second);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "bin")
                    .put("op", op)
                    .put("first", first.toJson())
                    .put("second", second.toJson())
                    .put("text", toString());
        }

        @Override
        public String toString() {
            return "(" + first + op + second + ")";
        }
    }

    record Quant(String quantifier, String variable, Formula body) implements Formula {
        public Quant {
            if (!Names.isQuantifier(requireNonNull(quantifier)))
                throw new IllegalArgumentException("Not a quantifier: " + quantifier);
            if (!Names.isVariable(requireNonNull(variable)))
                throw new IllegalArgumentException("Quantified name is not a variable: " + variable);
            requireNonNull(body);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "quant")
                    .put("quantifier", quantifier)
                    .put("variable", variable)
                    .put("body", body.toJson())
                    .put("text", toString());
        }

        @Override
        public String toString() {
            return quantifier + variable + "[" + body + "]";
        }
    }
}
