package dumb.deduce.prop;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.deduce.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Zero or more assumptions and a conclusion. Used both as a schema (an axiom
 * or lemma cited by proof lines) and as the statement a proof establishes.
 */
public record InferenceRule(List<Formula> assumptions, Formula conclusion) {

    public InferenceRule {
        assumptions = List.copyOf(requireNonNull(assumptions));
        requireNonNull(conclusion);
    }

    public InferenceRule(Formula conclusion) {
        this(List.of(), conclusion);
    }

    public static InferenceRule parse(List<String> assumptions, String conclusion) {
        return new InferenceRule(assumptions.stream().map(Formula::parse).toList(), Formula.parse(conclusion));
    }

    public Set<String> variables() {
        var s = new TreeSet<String>();
        assumptions.forEach(a -> s.addAll(a.variables()));
        s.addAll(conclusion.variables());
        return s;
    }

    public InferenceRule specialize(Map<String, Formula> map) {
        return new InferenceRule(
                assumptions.stream().map(a -> a.substituteVariables(map)).toList(),
                conclusion.substituteVariables(map));
    }

    /**
     * Union of two specialization maps, or {@code null} if either is
     * {@code null} or they disagree on a shared variable.
     */
    @Nullable
    public static Map<String, Formula> mergeSpecializationMaps(@Nullable Map<String, Formula> a, @Nullable Map<String, Formula> b) {
        if (a == null || b == null) return null;
        var merged = new HashMap<>(a);
        for (var e : b.entrySet()) {
            var prev = merged.putIfAbsent(e.getKey(), e.getValue());
            if (prev != null && !prev.equals(e.getValue())) return null;
        }
        return Collections.unmodifiableMap(merged);
    }

    /**
     * The minimal map under which {@code general} becomes {@code specific}:
     * variables of the general formula match any subformula, everything else
     * must agree node for node. {@code null} if there is none.
     */
    @Nullable
    public static Map<String, Formula> formulaSpecializationMap(Formula general, Formula specific) {
        if (general instanceof Formula.Var v) return Map.of(v.name(), specific);
        if (general instanceof Formula.Const)
            return general.equals(specific) ? Map.of() : null;
        if (general instanceof Formula.Not g)
            return specific instanceof Formula.Not s ? formulaSpecializationMap(g.operand(), s.operand()) : null;
        var g = (Formula.Bin) general;
        if (!(specific instanceof Formula.Bin s) || g.op() != s.op()) return null;
        return mergeSpecializationMaps(
                formulaSpecializationMap(g.first(), s.first()),
                formulaSpecializationMap(g.second(), s.second()));
    }

    /** The minimal map under which this rule becomes {@code specialization}, or {@code null}. */
    @Nullable
    public Map<String, Formula> specializationMap(InferenceRule specialization) {
        var n = assumptions.size();
        if (n != specialization.assumptions.size()) return null;
        Map<String, Formula> map = Map.of();
        for (var i = 0; i < n; i++) {
            map = mergeSpecializationMaps(map, formulaSpecializationMap(assumptions.get(i), specialization.assumptions.get(i)));
            if (map == null) return null;
        }
        return mergeSpecializationMaps(map, formulaSpecializationMap(conclusion, specialization.conclusion));
    }

    public boolean isSpecializationOf(InferenceRule general) {
        return general.specializationMap(this) != null;
    }

    public JsonNode toJson() {
        var n = Json.node();
        var a = n.putArray("assumptions");
        assumptions.forEach(f -> a.add(f.toString()));
        n.put("conclusion", conclusion.toString());
        return n;
    }

    @Override
    public String toString() {
        return assumptions.stream().map(Formula::toString).collect(Collectors.joining(", ", "[", "]")) + " ==> " + conclusion;
    }
}
