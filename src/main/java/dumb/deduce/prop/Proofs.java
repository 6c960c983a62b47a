package dumb.deduce.prop;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Specializing proofs and inlining lemma proofs into proofs that cite them. */
public enum Proofs {
    ;

    static void requireValid(Proof proof, String what) {
        if (!proof.isValid())
            throw new IllegalArgumentException("Invalid " + what + ": " + proof.statement() + " (line " + proof.firstInvalidLine() + ")");
    }

    /**
     * Rewrites every line of {@code proof} by the map taking its statement to
     * {@code specialization}, keeping rules and citations.
     */
    public static Proof proveSpecialization(Proof proof, InferenceRule specialization) {
        requireValid(proof, "proof");
        var map = proof.statement().specializationMap(specialization);
        if (map == null)
            throw new IllegalArgumentException(specialization + " is not a specialization of " + proof.statement());
        var lines = new ArrayList<Proof.Line>(proof.size());
        for (var line : proof.lines())
            lines.add(new Proof.Line(line.formula().substituteVariables(map), line.rule(), line.assumptions()));
        return new Proof(specialization, proof.rules(), lines);
    }

    /**
     * Replaces line {@code lineNumber} of {@code main}, which cites the rule
     * {@code lemma} proves, by the lemma's proof specialized to that line.
     * Lemma assumption lines become copies of the main lines they stand for;
     * later citations shift by the number of inserted lines.
     */
    public static Proof inlineProofOnce(Proof main, int lineNumber, Proof lemma) {
        var target = main.line(lineNumber);
        if (!lemma.statement().equals(target.rule()))
            throw new IllegalArgumentException("Line " + lineNumber + " does not cite " + lemma.statement());
        var specialized = proveSpecialization(lemma, requireNonNull(main.ruleForLine(lineNumber)));
        var cited = requireNonNull(target.assumptions());
        var lemmaAssumptions = specialized.assumptions();

        var lines = new ArrayList<Proof.Line>(main.size() + specialized.size() - 1);
        lines.addAll(main.lines().subList(0, lineNumber));
        for (var line : specialized.lines()) {
            if (line.isAssumption()) {
                lines.add(main.line(cited.get(lemmaAssumptions.indexOf(line.formula()))));
            } else {
                lines.add(new Proof.Line(line.formula(), line.rule(), shift(line.assumptions(), 0, lineNumber)));
            }
        }
        var growth = specialized.size() - 1;
        for (var i = lineNumber + 1; i < main.size(); i++) {
            var line = main.line(i);
            lines.add(line.isAssumption() ? line
                    : new Proof.Line(line.formula(), line.rule(), shift(line.assumptions(), lineNumber, growth)));
        }
        var rules = new HashSet<>(main.rules());
        rules.addAll(lemma.rules());
        return new Proof(main.statement(), rules, lines);
    }

    /**
     * Inlines {@code lemma} at every line citing it. The result no longer
     * allows the lemma's rule.
     */
    public static Proof inlineProof(Proof main, Proof lemma) {
        requireValid(lemma, "lemma proof");
        var proof = main;
        for (var i = 0; i < proof.size(); i++) {
            if (lemma.statement().equals(proof.line(i).rule())) {
                var before = proof.size();
                proof = inlineProofOnce(proof, i, lemma);
                i += proof.size() - before;
            }
        }
        var rules = new HashSet<>(proof.rules());
        rules.addAll(lemma.rules());
        rules.remove(lemma.statement());
        return new Proof(proof.statement(), rules, proof.lines());
    }

    private static List<Integer> shift(List<Integer> citations, int from, int by) {
        return citations.stream().map(c -> c >= from ? c + by : c).toList();
    }
}
