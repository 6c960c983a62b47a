package dumb.deduce.prop;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static dumb.deduce.prop.Axioms.D;
import static dumb.deduce.prop.Axioms.I0;
import static dumb.deduce.prop.Axioms.I1;
import static dumb.deduce.prop.Axioms.MP;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProofTest {

    static Formula f(String text) {
        return Formula.parse(text);
    }

    /** The classic derivation of {@code (p->p)} from {@code I1} and {@code D}. */
    static Proof selfImplication() {
        return new Proof(I0, Set.of(MP, I1, D), List.of(
                new Proof.Line(f("((p->((p->p)->p))->((p->(p->p))->(p->p)))"), D),
                new Proof.Line(f("(p->((p->p)->p))"), I1),
                new Proof.Line(f("((p->(p->p))->(p->p))"), MP, 1, 0),
                new Proof.Line(f("(p->(p->p))"), I1),
                new Proof.Line(f("(p->p)"), MP, 3, 2)));
    }

    @Test
    void formulaSpecializationMap() {
        assertEquals(Map.of("p", f("(x&y)"), "q", f("~z")),
                InferenceRule.formulaSpecializationMap(f("(p->q)"), f("((x&y)->~z)")));
        assertNull(InferenceRule.formulaSpecializationMap(f("(p->p)"), f("(x->y)")));
        assertNull(InferenceRule.formulaSpecializationMap(f("(T->p)"), f("(F->x)")));
        assertNull(InferenceRule.formulaSpecializationMap(f("(p->q)"), f("(x|y)")));
        assertEquals(Map.of(), InferenceRule.formulaSpecializationMap(f("~T"), f("~T")));
    }

    @Test
    void mergeSpecializationMaps() {
        assertEquals(Map.of("p", f("x"), "q", f("y")),
                InferenceRule.mergeSpecializationMaps(Map.of("p", f("x")), Map.of("q", f("y"), "p", f("x"))));
        assertNull(InferenceRule.mergeSpecializationMaps(Map.of("p", f("x")), Map.of("p", f("y"))));
        assertNull(InferenceRule.mergeSpecializationMaps(null, Map.of()));
    }

    @Test
    void ruleSpecialization() {
        var instance = InferenceRule.parse(List.of("(x|y)", "((x|y)->~z)"), "~z");
        assertTrue(instance.isSpecializationOf(MP));
        assertEquals(Map.of("p", f("(x|y)"), "q", f("~z")), MP.specializationMap(instance));
        assertEquals(instance, MP.specialize(Map.of("p", f("(x|y)"), "q", f("~z"))));
        assertFalse(InferenceRule.parse(List.of("x", "(y->z)"), "z").isSpecializationOf(MP));
        assertFalse(new InferenceRule(f("(x->x)")).isSpecializationOf(MP));
        assertEquals(Set.of("p", "q"), MP.variables());
        assertEquals("[p, (p->q)] ==> q", MP.toString());
    }

    @Test
    void validProof() {
        var proof = selfImplication();
        assertTrue(proof.isValid());
        assertEquals(-1, proof.firstInvalidLine());
        assertEquals(InferenceRule.parse(List.of("(p->(p->p))", "((p->(p->p))->(p->p))"), "(p->p)"), proof.ruleForLine(4));
        assertNull(new Proof(MP, Set.of(), List.of(new Proof.Line(f("p")))).ruleForLine(0));
    }

    @Test
    void assumptionLinesMustBeAssumptions() {
        var statement = InferenceRule.parse(List.of("x", "(x->y)"), "y");
        var good = new Proof(statement, Set.of(MP), List.of(
                new Proof.Line(f("x")),
                new Proof.Line(f("(x->y)")),
                new Proof.Line(f("y"), MP, 0, 1)));
        assertTrue(good.isValid());

        var bad = new Proof(statement, Set.of(MP), List.of(
                new Proof.Line(f("y")),
                new Proof.Line(f("(x->y)"))));
        assertFalse(bad.isLineValid(0));
        assertEquals(0, bad.firstInvalidLine());
        assertFalse(bad.isValid());
    }

    @Test
    void citationsMustPointBackwards() {
        var statement = InferenceRule.parse(List.of("x", "(x->y)"), "y");
        var proof = new Proof(statement, Set.of(MP), List.of(
                new Proof.Line(f("y"), MP, 1, 2),
                new Proof.Line(f("x")),
                new Proof.Line(f("(x->y)")),
                new Proof.Line(f("y"), MP, 1, 2)));
        assertFalse(proof.isLineValid(0));
        assertTrue(proof.isLineValid(3));
        assertFalse(proof.isValid());
    }

    @Test
    void rulesMustBeAllowed() {
        var proof = new Proof(I0, Set.of(MP, I1), selfImplication().lines());
        assertFalse(proof.isLineValid(0));
        assertTrue(proof.isLineValid(1));
        assertFalse(proof.isValid());
    }

    @Test
    void lastLineMustBeConclusion() {
        var lines = selfImplication().lines();
        var proof = new Proof(I0, Set.of(MP, I1, D), lines.subList(0, 4));
        assertEquals(-1, proof.firstInvalidLine());
        assertFalse(proof.isValid());
        assertFalse(new Proof(I0, Set.of(MP), List.of()).isValid());
    }

    @Test
    void lineNeedsRuleAndCitationsTogether() {
        assertThrows(IllegalArgumentException.class, () -> new Proof.Line(f("p"), null, List.of(0)));
    }

    @Test
    void json() {
        var j = selfImplication().toJson();
        assertEquals("(p->p)", j.get("statement").get("conclusion").asText());
        assertEquals(3, j.get("rules").size());
        assertEquals(5, j.get("lines").size());
        assertEquals(3, j.get("lines").get(4).get("assumptions").get(0).asInt());
        assertTrue(selfImplication().toString().startsWith("Proof of [] ==> (p->p)"));
    }
}
