package dumb.deduce.prop;

import dumb.deduce.Names;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;

/**
 * Immutable propositional formula. {@link #toString()} is the standard
 * notation, and {@link #parse(String)} its inverse.
 */
sealed public interface Formula permits Formula.Var, Formula.Const, Formula.Not, Formula.Bin {

    static Formula parse(String s) {
        return FormulaParser.parse(s);
    }

    static FormulaParser.Prefix parsePrefix(String s) {
        return FormulaParser.parsePrefix(s);
    }

    static boolean isFormula(String s) {
        return FormulaParser.isFormula(s);
    }

    static Formula not(Formula f) {
        return new Not(f);
    }

    static Formula implies(Formula a, Formula b) {
        return new Bin(Op.IMPLIES, a, b);
    }

    default Set<String> variables() {
        var s = new TreeSet<String>();
        collectVariables(this, s);
        return s;
    }

    default Set<String> operators() {
        var s = new TreeSet<String>();
        collectOperators(this, s);
        return s;
    }

    /**
     * Simultaneously replaces every variable that is a key of {@code map}.
     *
     * <pre>((p->p)|z) with {p: (q&r)} is (((q&r)->(q&r))|z)</pre>
     */
    default Formula substituteVariables(Map<String, Formula> map) {
        for (var v : map.keySet())
            if (!Names.isPropVariable(v)) throw new IllegalArgumentException("Not a variable: " + v);
        return substituteVariablesRecursive(this, map);
    }

    /**
     * Replaces every operator or constant that is a key of {@code map} by its
     * template, in which {@code p} stands for the first operand and {@code q}
     * for the second. Templates are applied to operands that were already
     * rewritten.
     *
     * <pre>((x&y)&~z) with {&: ~(~p|~q)} is ~(~~(~x|~y)|~~z)</pre>
     */
    default Formula substituteOperators(Map<String, Formula> map) {
        map.forEach((op, template) -> {
            if (!(Names.isPropBinary(op) || Names.isUnary(op) || Names.isPropConstant(op)))
                throw new IllegalArgumentException("Not an operator: " + op);
            if (!Set.of("p", "q").containsAll(template.variables()))
                throw new IllegalArgumentException("Operator template may only use p and q: " + template);
        });
        return substituteOperatorsRecursive(this, map);
    }

    private static void collectVariables(Formula f, Set<String> into) {
        if (f instanceof Var v) into.add(v.name);
        else if (f instanceof Not n) collectVariables(n.operand, into);
        else if (f instanceof Bin b) {
            collectVariables(b.first, into);
            collectVariables(b.second, into);
        }
    }

    private static void collectOperators(Formula f, Set<String> into) {
        if (f instanceof Const c) into.add(c.toString());
        else if (f instanceof Not n) {
            into.add(Names.NOT);
            collectOperators(n.operand, into);
        } else if (f instanceof Bin b) {
            into.add(b.op.symbol);
            collectOperators(b.first, into);
            collectOperators(b.second, into);
        }
    }

    private static Formula substituteVariablesRecursive(Formula f, Map<String, Formula> map) {
        if (f instanceof Var v) return map.getOrDefault(v.name, v);
        if (f instanceof Not n) return new Not(substituteVariablesRecursive(n.operand, map));
        if (f instanceof Bin b)
            return new Bin(b.op, substituteVariablesRecursive(b.first, map), substituteVariablesRecursive(b.second, map));
        return f;
    }

    private static Formula substituteOperatorsRecursive(Formula f, Map<String, Formula> map) {
        if (f instanceof Const c) return map.getOrDefault(c.toString(), c);
        if (f instanceof Not n) {
            var operand = substituteOperatorsRecursive(n.operand, map);
            var template = map.get(Names.NOT);
            return template == null ? new Not(operand) : template.substituteVariables(Map.of("p", operand));
        }
        if (f instanceof Bin b) {
            var first = substituteOperatorsRecursive(b.first, map);
            var second = substituteOperatorsRecursive(b.second, map);
            var template = map.get(b.op.symbol);
            return template == null ? new Bin(b.op, first, second) : template.substituteVariables(Map.of("p", first, "q", second));
        }
        return f;
    }

    record Var(String name) implements Formula {
        public Var {
            requireNonNull(name);
            if (!Names.isPropVariable(name))
                throw new IllegalArgumentException("Not a propositional variable: " + name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Const(boolean value) implements Formula {
        public static final Const T = new Const(true), F = new Const(false);

        @Override
        public String toString() {
            return value ? Names.TRUE : Names.FALSE;
        }
    }

    record Not(Formula operand) implements Formula {
        public Not {
            requireNonNull(operand);
        }

        @Override
        public String toString() {
            return Names.NOT + operand;
        }
    }

    record Bin(Op op, Formula first, Formula second) implements Formula {
        public Bin {
            requireNonNull(op);
            requireNonNull(first);
            requireNonNull(second);
        }

        @Override
        public String toString() {
            return "(" + first + op.symbol + second + ")";
        }
    }
}
