package dumb.deduce.fol;

import dumb.deduce.FreshNames;
import dumb.deduce.prop.Op;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Propositional abstraction of a first-order formula: {@code skeleton} is
 * over fresh atoms and {@code map} sends each atom to the equality, relation
 * or quantification it stands for, in order of first appearance.
 */
public record Skeleton(dumb.deduce.prop.Formula skeleton, Map<String, Formula> map) {

    public Skeleton {
        map = Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    /** Inverse of the extraction. */
    public Formula restore() {
        return restore(skeleton, map);
    }

    static Skeleton of(Formula f, FreshNames names) {
        var atoms = new HashMap<Formula, String>();
        var map = new LinkedHashMap<String, Formula>();
        var skeleton = abstractRecursive(f, names, atoms, map);
        return new Skeleton(skeleton, map);
    }

    static Formula restore(dumb.deduce.prop.Formula skeleton, Map<String, Formula> map) {
        if (skeleton instanceof dumb.deduce.prop.Formula.Var v) {
            var f = map.get(v.name());
            if (f == null) throw new IllegalArgumentException("No first-order formula for atom " + v.name());
            return f;
        }
        if (skeleton instanceof dumb.deduce.prop.Formula.Not n) return new Formula.Not(restore(n.operand(), map));
        if (skeleton instanceof dumb.deduce.prop.Formula.Bin b)
            return new Formula.Bin(b.op().symbol, restore(b.first(), map), restore(b.second(), map));
        throw new IllegalArgumentException("Constants have no first-order counterpart: " + skeleton);
    }

    private static dumb.deduce.prop.Formula abstractRecursive(Formula f, FreshNames names,
                                                              Map<Formula, String> atoms, Map<String, Formula> map) {
        if (f instanceof Formula.Not n)
            return new dumb.deduce.prop.Formula.Not(abstractRecursive(n.operand(), names, atoms, map));
        if (f instanceof Formula.Bin b) {
            var op = Op.of(b.op()).orElseThrow();
            var first = abstractRecursive(b.first(), names, atoms, map);
            return new dumb.deduce.prop.Formula.Bin(op, first, abstractRecursive(b.second(), names, atoms, map));
        }
        var atom = atoms.computeIfAbsent(f, k -> {
            var name = names.next();
            map.put(name, k);
            return name;
        });
        return new dumb.deduce.prop.Formula.Var(atom);
    }
}
