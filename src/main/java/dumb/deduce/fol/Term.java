package dumb.deduce.fol;

import dumb.deduce.Names;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Immutable first-order term: a variable, a constant, or a function applied to
 * one or more terms.
 */
sealed public interface Term permits Term.Var, Term.Const, Term.App {

    static Term parse(String s) {
        return FolParser.parseTerm(s);
    }

    static FolParser.Parsed<Term> parsePrefix(String s) {
        return FolParser.parseTermPrefix(s);
    }

    default Set<String> variables() {
        var s = new TreeSet<String>();
        collect(this, s, Var.class);
        return s;
    }

    default Set<String> constants() {
        var s = new TreeSet<String>();
        collect(this, s, Const.class);
        return s;
    }

    default Set<Arity> functions() {
        var s = new HashSet<Arity>();
        collectFunctions(this, s);
        return s;
    }

    /**
     * Simultaneously replaces each constant or variable named by a key of
     * {@code map}. Substituted terms are not substituted into again.
     *
     * <pre>f(x,c) with {c: plus(d,x), x: c} is f(c,plus(d,x))</pre>
     *
     * @throws ForbiddenVariableError if a substituted term contains a variable of {@code forbidden}
     */
    default Term substitute(Map<String, Term> map, Set<String> forbidden) {
        for (var k : map.keySet())
            if (!Names.isConstant(k) && !Names.isVariable(k))
                throw new IllegalArgumentException("Only constants and variables can be substituted: " + k);
        return substituteRecursive(this, map, forbidden);
    }

    default Term substitute(Map<String, Term> map) {
        return substitute(map, Set.of());
    }

    JSONObject toJson();

    private static Term substituteRecursive(Term t, Map<String, Term> map, Set<String> forbidden) {
        if (t instanceof App a)
            return new App(a.function, a.args.stream().map(x -> substituteRecursive(x, map, forbidden)).toList());
        var name = t instanceof Var v ? v.name : ((Const) t).name;
        var replacement = map.get(name);
        if (replacement == null) return t;
        for (var v : replacement.variables())
            if (forbidden.contains(v)) throw new ForbiddenVariableError(v);
        return replacement;
    }

    private static void collect(Term t, Set<String> into, Class<? extends Term> kind) {
        if (t instanceof App a) a.args.forEach(x -> collect(x, into, kind));
        else if (kind.isInstance(t)) into.add(t.toString());
    }

    private static void collectFunctions(Term t, Set<Arity> into) {
        if (t instanceof App a) {
            into.add(new Arity(a.function, a.args.size()));
            a.args.forEach(x -> collectFunctions(x, into));
        }
    }

    record Var(String name) implements Term {
        public Var {
            requireNonNull(name);
            if (!Names.isVariable(name)) throw new IllegalArgumentException("Not a variable name: " + name);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "var")
                    .put("name", name)
                    .put("text", toString());
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Const(String name) implements Term {
        public Const {
            requireNonNull(name);
            if (!Names.isConstant(name)) throw new IllegalArgumentException("Not a constant name: " + name);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "const")
                    .put("name", name)
                    .put("text", toString());
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record App(String function, List<Term> args) implements Term {
        public App {
            requireNonNull(function);
            if (!Names.isFunction(function)) throw new IllegalArgumentException("Not a function name: " + function);
            args = List.copyOf(args);
            if (args.isEmpty()) throw new IllegalArgumentException("Function application needs arguments: " + function);
        }

        public App(String function, Term... args) {
            this(function, List.of(args));
        }

        public int arity() {
            return args.size();
        }

        @Override
        public JSONObject toJson() {
            var jsonArgs = new JSONArray();
            args.forEach(a -> jsonArgs.put(a.toJson()));
            return new JSONObject()
                    .put("type", "app")
                    .put("function", function)
                    .put("args", jsonArgs)
                    .put("text", toString());
        }

        @Override
        public String toString() {
            return args.stream().map(Term::toString).collect(Collectors.joining(",", function + "(", ")"));
        }
    }
}
