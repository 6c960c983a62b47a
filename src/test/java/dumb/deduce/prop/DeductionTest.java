package dumb.deduce.prop;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static dumb.deduce.prop.Axioms.I1;
import static dumb.deduce.prop.Axioms.MP;
import static dumb.deduce.prop.Axioms.NI;
import static dumb.deduce.prop.Axioms.NN;
import static dumb.deduce.prop.ProofTest.f;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeductionTest {

    /** A one-line proof of {@code line} from {@code assumptions}, which must contain it. */
    private static Proof assumed(List<String> assumptions, String line) {
        return new Proof(InferenceRule.parse(assumptions, line), Set.of(MP), List.of(new Proof.Line(f(line))));
    }

    @Test
    void corollary() {
        var proof = Deduction.proveCorollary(assumed(List.of("x"), "x"), f("~~x"), NN);
        assertTrue(proof.isValid());
        assertEquals(InferenceRule.parse(List.of("x"), "~~x"), proof.statement());
        assertEquals(3, proof.size());
        assertEquals(Set.of(MP, NN), proof.rules());
    }

    @Test
    void corollaryRejectsWrongConditional() {
        assertThrows(IllegalArgumentException.class,
                () -> Deduction.proveCorollary(assumed(List.of("x"), "x"), f("~~x"), I1));
    }

    @Test
    void combine() {
        var assumptions = List.of("x", "~y");
        var proof = Deduction.combineProofs(assumed(assumptions, "x"), assumed(assumptions, "~y"), f("~(x->y)"), NI);
        assertTrue(proof.isValid());
        assertEquals(InferenceRule.parse(assumptions, "~(x->y)"), proof.statement());
        assertEquals(5, proof.size());
    }

    @Test
    void combineRequiresSameAssumptions() {
        assertThrows(IllegalArgumentException.class, () -> Deduction.combineProofs(
                assumed(List.of("x"), "x"), assumed(List.of("~y"), "~y"), f("~(x->y)"), NI));
    }

    @Test
    void removeAssumption() {
        var statement = InferenceRule.parse(List.of("x", "(x->y)", "(y->z)"), "z");
        var proof = new Proof(statement, Set.of(MP), List.of(
                new Proof.Line(f("x")),
                new Proof.Line(f("(x->y)")),
                new Proof.Line(f("y"), MP, 0, 1),
                new Proof.Line(f("(y->z)")),
                new Proof.Line(f("z"), MP, 2, 3)));
        var lifted = Deduction.removeAssumption(proof);
        assertTrue(lifted.isValid());
        assertEquals(InferenceRule.parse(List.of("x", "(x->y)"), "((y->z)->z)"), lifted.statement());

        var twice = Deduction.removeAssumption(lifted);
        assertTrue(twice.isValid());
        assertEquals(InferenceRule.parse(List.of("x"), "((x->y)->((y->z)->z))"), twice.statement());
    }

    @Test
    void removeAssumptionOfAssumptionlessProof() {
        assertThrows(IllegalArgumentException.class, () -> Deduction.removeAssumption(ProofTest.selfImplication()));
    }

    @Test
    void contradiction() {
        var assumptions = List.of("x", "~x");
        var inconsistency = Deduction.proofFromInconsistency(
                assumed(assumptions, "x"), assumed(assumptions, "~x"), Deduction.CONTRADICTION);
        assertTrue(inconsistency.isValid());
        assertEquals(Deduction.CONTRADICTION, inconsistency.conclusion());

        var proof = Deduction.proveByContradiction(inconsistency);
        assertTrue(proof.isValid());
        assertEquals(InferenceRule.parse(List.of("x"), "x"), proof.statement());
    }

    @Test
    void proofFromInconsistencyNeedsNegation() {
        var assumptions = List.of("x", "y");
        assertThrows(IllegalArgumentException.class, () -> Deduction.proofFromInconsistency(
                assumed(assumptions, "x"), assumed(assumptions, "y"), f("z")));
    }

    @Test
    void proveByContradictionNeedsNegatedLastAssumption() {
        var assumptions = List.of("~x", "x");
        var inconsistency = Deduction.proofFromInconsistency(
                assumed(assumptions, "x"), assumed(assumptions, "~x"), Deduction.CONTRADICTION);
        assertThrows(IllegalArgumentException.class, () -> Deduction.proveByContradiction(inconsistency));
    }
}
