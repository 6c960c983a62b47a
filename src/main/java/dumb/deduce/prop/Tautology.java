package dumb.deduce.prop;

import dumb.deduce.Names;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static dumb.deduce.prop.Axioms.AXIOMATIC_SYSTEM;
import static dumb.deduce.prop.Axioms.I1;
import static dumb.deduce.prop.Axioms.I2;
import static dumb.deduce.prop.Axioms.MP;
import static dumb.deduce.prop.Axioms.NI;
import static dumb.deduce.prop.Axioms.NN;
import static dumb.deduce.prop.Axioms.R;
import static dumb.deduce.prop.Formula.implies;
import static dumb.deduce.prop.Formula.not;
import static dumb.deduce.prop.Semantics.evaluate;
import static dumb.deduce.prop.Semantics.formulaeCapturingModel;

/**
 * The Tautology Theorem made constructive: every tautology over {@code ->}
 * and {@code ~} gets an axiomatic proof via {@link Axioms#AXIOMATIC_SYSTEM},
 * built by case analysis over the truth table.
 */
public enum Tautology {
    ;

    private static final Set<String> IMPLICATIONAL = Set.of(Names.IMPLIES, Names.NOT);

    /**
     * Proves {@code formula}, if it holds in {@code model}, or its negation
     * otherwise, from the literals capturing the model.
     */
    public static Proof proveInModel(Formula formula, Model model) {
        requireImplicational(formula);
        var assumptions = formulaeCapturingModel(model);
        if (formula instanceof Formula.Var) {
            var literal = model.get(((Formula.Var) formula).name()) ? formula : not(formula);
            return new Proof(new InferenceRule(assumptions, literal), AXIOMATIC_SYSTEM, List.of(new Proof.Line(literal)));
        }
        if (formula instanceof Formula.Not n) {
            var inner = proveInModel(n.operand(), model);
            // inner proves ~X (the formula itself) or X, from which ~~X follows
            return evaluate(n.operand(), model) ? Deduction.proveCorollary(inner, not(formula), NN) : inner;
        }
        var b = (Formula.Bin) formula;
        var first = evaluate(b.first(), model);
        if (!first)
            return Deduction.proveCorollary(proveInModel(b.first(), model), formula, I2);
        if (evaluate(b.second(), model))
            return Deduction.proveCorollary(proveInModel(b.second(), model), formula, I1);
        return Deduction.combineProofs(proveInModel(b.first(), model), proveInModel(b.second(), model), not(formula), NI);
    }

    /**
     * Discharges the case split on the last assumption: from proofs of
     * {@code C} under {@code x} and under {@code ~x} (other assumptions
     * equal) derives {@code C} without it.
     */
    public static Proof reduceAssumption(Proof proofFromAffirmation, Proof proofFromNegation) {
        var aff = proofFromAffirmation.assumptions();
        var neg = proofFromNegation.assumptions();
        if (aff.isEmpty() || neg.size() != aff.size()
                || !aff.subList(0, aff.size() - 1).equals(neg.subList(0, neg.size() - 1))
                || !not(aff.get(aff.size() - 1)).equals(neg.get(neg.size() - 1)))
            throw new IllegalArgumentException("Proofs do not split on their last assumption: "
                    + proofFromAffirmation.statement() + " / " + proofFromNegation.statement());
        if (!proofFromAffirmation.conclusion().equals(proofFromNegation.conclusion()))
            throw new IllegalArgumentException("Proofs have different conclusions");
        return Deduction.combineProofs(
                Deduction.removeAssumption(proofFromAffirmation),
                Deduction.removeAssumption(proofFromNegation),
                proofFromAffirmation.conclusion(), R);
    }

    public static Proof proveTautology(Formula tautology) {
        return proveTautology(tautology, Model.EMPTY);
    }

    /**
     * Proves {@code tautology} from the literals capturing {@code model}, which
     * must assign an alphabetical prefix of the tautology's variables.
     */
    public static Proof proveTautology(Formula tautology, Model model) {
        requireImplicational(tautology);
        var variables = Semantics.sortedVariables(tautology);
        var assigned = model.variables().stream().sorted().toList();
        if (assigned.size() > variables.size() || !variables.subList(0, assigned.size()).equals(assigned))
            throw new IllegalArgumentException("Model " + model + " does not assign an alphabetical prefix of " + variables);
        if (!Semantics.isTautology(tautology))
            throw new IllegalArgumentException("Not a tautology: " + tautology);
        return prove(tautology, model, variables);
    }

    private static Proof prove(Formula tautology, Model model, List<String> variables) {
        if (model.size() == variables.size()) return proveInModel(tautology, model);
        var next = variables.get(model.size());
        return reduceAssumption(
                prove(tautology, model.with(next, true), variables),
                prove(tautology, model.with(next, false), variables));
    }

    /**
     * A proof of {@code formula} when it is a tautology, otherwise the first
     * falsifying model in alphabetical truth-table order.
     */
    public static Verdict proofOrCounterexample(Formula formula) {
        requireImplicational(formula);
        for (var m : Semantics.allModels(Semantics.sortedVariables(formula)))
            if (!evaluate(formula, m)) return new Verdict.Found(m);
        return new Verdict.Proved(proveTautology(formula));
    }

    /**
     * {@code [a1, ..., an] ==> c} as {@code (a1->(...->(an->c)))}; the
     * conclusion alone when there are no assumptions.
     */
    public static Formula encodeAsFormula(InferenceRule rule) {
        var f = rule.conclusion();
        var assumptions = rule.assumptions();
        for (var i = assumptions.size() - 1; i >= 0; i--)
            f = implies(assumptions.get(i), f);
        return f;
    }

    /**
     * Proves a sound rule: proves its encoding as a tautology, then peels one
     * implication per assumption with an assumption line and modus ponens.
     */
    public static Proof proveSoundInference(InferenceRule rule) {
        rule.assumptions().forEach(Tautology::requireImplicational);
        requireImplicational(rule.conclusion());
        if (!Semantics.isSoundInference(rule))
            throw new IllegalArgumentException("Not a sound inference: " + rule);

        var encoded = encodeAsFormula(rule);
        var tautology = proveTautology(encoded);
        var lines = new ArrayList<>(tautology.lines());
        var implication = lines.size() - 1;
        var remaining = encoded;
        for (var a : rule.assumptions()) {
            remaining = ((Formula.Bin) remaining).second();
            lines.add(new Proof.Line(a));
            lines.add(new Proof.Line(remaining, MP, lines.size() - 1, implication));
            implication = lines.size() - 1;
        }
        return new Proof(rule, AXIOMATIC_SYSTEM, lines);
    }

    /**
     * A model of all {@code formulae} if one exists, otherwise a proof of
     * {@code ~(p->p)} from them.
     */
    public static Verdict modelOrInconsistency(List<Formula> formulae) {
        var rule = new InferenceRule(formulae, Deduction.CONTRADICTION);
        if (Semantics.isSoundInference(rule))
            return new Verdict.Proved(proveSoundInference(rule));
        return proofOrCounterexample(encodeAsFormula(rule));
    }

    private static void requireImplicational(Formula f) {
        if (!IMPLICATIONAL.containsAll(f.operators()))
            throw new IllegalArgumentException("Only -> and ~ are supported: " + f);
    }
}
