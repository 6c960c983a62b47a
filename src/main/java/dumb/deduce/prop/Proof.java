package dumb.deduce.prop;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.deduce.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A deductive proof of {@link #statement} via {@link #rules}: each line is
 * an assumption of the statement or follows from earlier lines by a
 * specialization of an allowed rule.
 */
public record Proof(InferenceRule statement, Set<InferenceRule> rules, List<Line> lines) {

    public Proof {
        requireNonNull(statement);
        rules = Set.copyOf(requireNonNull(rules));
        lines = List.copyOf(requireNonNull(lines));
    }

    public int size() {
        return lines.size();
    }

    public Line line(int i) {
        return lines.get(i);
    }

    public Line lastLine() {
        return lines.get(lines.size() - 1);
    }

    public Formula conclusion() {
        return statement.conclusion();
    }

    public List<Formula> assumptions() {
        return statement.assumptions();
    }

    /**
     * The rule the given line claims to specialize: the cited lines' formulas
     * as assumptions and the line's formula as conclusion. {@code null} for
     * assumption lines.
     */
    @Nullable
    public InferenceRule ruleForLine(int lineNumber) {
        var line = lines.get(lineNumber);
        if (line.isAssumption()) return null;
        var cited = new ArrayList<Formula>(line.assumptions.size());
        for (var i : line.assumptions) cited.add(lines.get(i).formula);
        return new InferenceRule(cited, line.formula);
    }

    public boolean isLineValid(int lineNumber) {
        var line = lines.get(lineNumber);
        if (line.isAssumption()) return statement.assumptions().contains(line.formula);
        if (!rules.contains(line.rule)) return false;
        for (var i : line.assumptions)
            if (i < 0 || i >= lineNumber) return false;
        return requireNonNull(ruleForLine(lineNumber)).isSpecializationOf(line.rule);
    }

    /** Index of the first line that does not follow, or -1 when all lines do. */
    public int firstInvalidLine() {
        for (var i = 0; i < lines.size(); i++)
            if (!isLineValid(i)) return i;
        return -1;
    }

    public boolean isValid() {
        return !lines.isEmpty() && firstInvalidLine() == -1 && lastLine().formula.equals(statement.conclusion());
    }

    public JsonNode toJson() {
        var n = Json.node();
        n.set("statement", statement.toJson());
        var r = n.putArray("rules");
        rules.stream().map(InferenceRule::toString).sorted().forEach(r::add);
        var l = n.putArray("lines");
        for (var line : lines) {
            var j = l.addObject().put("formula", line.formula.toString());
            if (!line.isAssumption()) {
                j.put("rule", line.rule.toString());
                var c = j.putArray("assumptions");
                line.assumptions.forEach(c::add);
            }
        }
        return n;
    }

    @Override
    public String toString() {
        var s = new StringBuilder("Proof of ").append(statement).append(" via inference rules:\n");
        rules.stream().sorted(Comparator.comparing(InferenceRule::toString))
                .forEach(r -> s.append("  ").append(r).append('\n'));
        s.append("Lines:\n");
        for (var i = 0; i < lines.size(); i++)
            s.append(String.format("%3d) ", i)).append(lines.get(i)).append('\n');
        return s.toString();
    }

    /**
     * A formula justified either as an assumption ({@code rule == null}) or
     * by a rule applied to the formulas of earlier lines.
     */
    public record Line(Formula formula, @Nullable InferenceRule rule, @Nullable List<Integer> assumptions) {
        public Line {
            requireNonNull(formula);
            if ((rule == null) != (assumptions == null))
                throw new IllegalArgumentException("A line has both a rule and cited lines, or neither");
            if (assumptions != null) assumptions = List.copyOf(assumptions);
        }

        public Line(Formula formula) {
            this(formula, null, (List<Integer>) null);
        }

        public Line(Formula formula, InferenceRule rule, Integer... assumptions) {
            this(formula, rule, List.of(assumptions));
        }

        public boolean isAssumption() {
            return rule == null;
        }

        @Override
        public String toString() {
            if (isAssumption()) return formula.toString();
            return formula + " Inference Rule " + rule + (assumptions.isEmpty() ? "" : " on " + assumptions);
        }
    }
}
