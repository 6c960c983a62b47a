package dumb.deduce.prop;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static dumb.deduce.prop.Axioms.D;
import static dumb.deduce.prop.Axioms.I0;
import static dumb.deduce.prop.Axioms.I1;
import static dumb.deduce.prop.Axioms.I2;
import static dumb.deduce.prop.Axioms.MP;
import static dumb.deduce.prop.Axioms.N;
import static dumb.deduce.prop.Formula.implies;
import static dumb.deduce.prop.Formula.not;
import static dumb.deduce.prop.Proofs.requireValid;
import static java.util.Objects.requireNonNull;

/**
 * Proof maneuvers built on modus ponens: corollaries, combination of two
 * proofs, the deduction theorem and proofs by contradiction. Inputs are
 * never modified; every maneuver returns a new proof.
 */
public enum Deduction {
    ;

    /** The formula {@link #proveByContradiction(Proof)} expects as conclusion. */
    public static final Formula CONTRADICTION = Formula.parse("~(p->p)");

    /**
     * Extends a proof of {@code A} into a proof of {@code consequent} from the
     * same assumptions, using an assumptionless {@code conditional} that
     * specializes to {@code (A->consequent)}.
     */
    public static Proof proveCorollary(Proof antecedentProof, Formula consequent, InferenceRule conditional) {
        requireValid(antecedentProof, "antecedent proof");
        var step = implies(antecedentProof.conclusion(), consequent);
        requireInstance(step, conditional);

        var n = antecedentProof.size();
        var lines = new ArrayList<>(antecedentProof.lines());
        lines.add(new Proof.Line(step, conditional));
        lines.add(new Proof.Line(consequent, MP, n - 1, n));
        return new Proof(new InferenceRule(antecedentProof.assumptions(), consequent),
                union(antecedentProof.rules(), MP, conditional), lines);
    }

    /**
     * Combines proofs of {@code A} and {@code B} from the same assumptions into
     * a proof of {@code consequent}, using an assumptionless
     * {@code doubleConditional} that specializes to {@code (A->(B->consequent))}.
     * The second proof's citations are shifted past the first proof.
     */
    public static Proof combineProofs(Proof antecedent1Proof, Proof antecedent2Proof, Formula consequent, InferenceRule doubleConditional) {
        requireValid(antecedent1Proof, "first antecedent proof");
        requireValid(antecedent2Proof, "second antecedent proof");
        if (!antecedent1Proof.assumptions().equals(antecedent2Proof.assumptions()))
            throw new IllegalArgumentException("Proofs to combine have different assumptions: "
                    + antecedent1Proof.assumptions() + " vs " + antecedent2Proof.assumptions());
        var a = antecedent1Proof.conclusion();
        var b = antecedent2Proof.conclusion();
        var step = implies(a, implies(b, consequent));
        requireInstance(step, doubleConditional);

        var n1 = antecedent1Proof.size();
        var lines = new ArrayList<>(antecedent1Proof.lines());
        for (var line : antecedent2Proof.lines())
            lines.add(line.isAssumption() ? line
                    : new Proof.Line(line.formula(), line.rule(), line.assumptions().stream().map(i -> i + n1).toList()));
        var last2 = lines.size() - 1;
        lines.add(new Proof.Line(step, doubleConditional));
        var stepLine = lines.size() - 1;
        lines.add(new Proof.Line(implies(b, consequent), MP, n1 - 1, stepLine));
        lines.add(new Proof.Line(consequent, MP, last2, stepLine + 1));

        var rules = union(antecedent1Proof.rules(), MP, doubleConditional);
        rules.addAll(antecedent2Proof.rules());
        return new Proof(new InferenceRule(antecedent1Proof.assumptions(), consequent), rules, lines);
    }

    /**
     * The deduction theorem: turns a proof of {@code C} whose last assumption is
     * {@code phi} into a proof of {@code (phi->C)} from the other assumptions.
     * Each original line {@code psi} becomes a short derivation of
     * {@code (phi->psi)}. The proof may only use {@code MP} and assumptionless
     * rules.
     */
    public static Proof removeAssumption(Proof proof) {
        requireValid(proof, "proof");
        var assumptions = proof.assumptions();
        if (assumptions.isEmpty())
            throw new IllegalArgumentException("Proof has no assumption to remove: " + proof.statement());
        for (var r : proof.rules())
            if (!r.equals(MP) && !r.assumptions().isEmpty())
                throw new IllegalArgumentException("Rule " + r + " is neither MP nor assumptionless");

        var phi = assumptions.get(assumptions.size() - 1);
        var lines = new ArrayList<Proof.Line>();
        // original line index -> index of the line proving (phi->formula)
        var lifted = new int[proof.size()];
        for (var i = 0; i < proof.size(); i++) {
            var line = proof.line(i);
            var psi = line.formula();
            if (psi.equals(phi)) {
                lines.add(new Proof.Line(implies(phi, phi), I0));
            } else if (line.isAssumption() || requireNonNull(line.assumptions()).isEmpty()) {
                lines.add(line);
                lines.add(new Proof.Line(implies(psi, implies(phi, psi)), I1));
                lines.add(new Proof.Line(implies(phi, psi), MP, lines.size() - 2, lines.size() - 1));
            } else {
                // MP from alpha (first citation) and (alpha->psi) (second citation)
                var cited = line.assumptions();
                var alpha = proof.line(cited.get(0)).formula();
                var distributed = implies(implies(phi, alpha), implies(phi, psi));
                lines.add(new Proof.Line(implies(implies(phi, implies(alpha, psi)), distributed), D));
                lines.add(new Proof.Line(distributed, MP, lifted[cited.get(1)], lines.size() - 1));
                lines.add(new Proof.Line(implies(phi, psi), MP, lifted[cited.get(0)], lines.size() - 1));
            }
            lifted[i] = lines.size() - 1;
        }
        var statement = new InferenceRule(assumptions.subList(0, assumptions.size() - 1), implies(phi, proof.conclusion()));
        return new Proof(statement, union(proof.rules(), MP, I0, I1, D), lines);
    }

    /**
     * Derives any {@code conclusion} from proofs of {@code A} and {@code ~A}
     * that share their assumptions.
     */
    public static Proof proofFromInconsistency(Proof proofOfAffirmation, Proof proofOfNegation, Formula conclusion) {
        if (!not(proofOfAffirmation.conclusion()).equals(proofOfNegation.conclusion()))
            throw new IllegalArgumentException(proofOfNegation.conclusion() + " is not the negation of " + proofOfAffirmation.conclusion());
        return combineProofs(proofOfNegation, proofOfAffirmation, conclusion, I2);
    }

    /**
     * Turns a proof of {@code ~(p->p)} whose last assumption is {@code ~phi}
     * into a proof of {@code phi} from the other assumptions.
     */
    public static Proof proveByContradiction(Proof proof) {
        if (!proof.conclusion().equals(CONTRADICTION))
            throw new IllegalArgumentException("Expected a proof of " + CONTRADICTION + ", got " + proof.conclusion());
        var assumptions = proof.assumptions();
        if (assumptions.isEmpty() || !(assumptions.get(assumptions.size() - 1) instanceof Formula.Not negated))
            throw new IllegalArgumentException("Last assumption must be a negation: " + proof.statement());

        var phi = negated.operand();
        var selfImplication = ((Formula.Not) CONTRADICTION).operand();
        var lifted = removeAssumption(proof);
        var lines = new ArrayList<>(lifted.lines());
        var n = lines.size();
        lines.add(new Proof.Line(implies(lifted.conclusion(), implies(selfImplication, phi)), N));
        lines.add(new Proof.Line(implies(selfImplication, phi), MP, n - 1, n));
        lines.add(new Proof.Line(selfImplication, I0));
        lines.add(new Proof.Line(phi, MP, n + 2, n + 1));
        var statement = new InferenceRule(assumptions.subList(0, assumptions.size() - 1), phi);
        return new Proof(statement, union(lifted.rules(), MP, I0, N), lines);
    }

    private static void requireInstance(Formula step, InferenceRule rule) {
        if (!rule.assumptions().isEmpty() || !new InferenceRule(step).isSpecializationOf(rule))
            throw new IllegalArgumentException(step + " is not an instance of the assumptionless rule " + rule);
    }

    private static Set<InferenceRule> union(Set<InferenceRule> rules, InferenceRule... more) {
        var s = new HashSet<>(rules);
        s.addAll(List.of(more));
        return s;
    }
}
