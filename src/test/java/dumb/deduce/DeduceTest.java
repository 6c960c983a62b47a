package dumb.deduce;

import dumb.deduce.prop.Formula;
import dumb.deduce.prop.InferenceRule;
import dumb.deduce.prop.Model;
import dumb.deduce.prop.Proof;
import dumb.deduce.util.Json;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static dumb.deduce.prop.Axioms.MP;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeduceTest {

    @Test
    void defaults() {
        var c = new Configuration();
        assertEquals("z", c.freshNamePrefix());
        assertEquals(16, c.truthTableLimit());
        assertTrue(c.verifyProofs());
    }

    @Test
    void missingKeysTakeDefaults() throws Exception {
        var c = Json.obj("{\"verifyProofs\": false}", Configuration.class);
        assertEquals(new Configuration("z", 16, false), c);
    }

    @Test
    void invalidConfigurationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Configuration("a", 16, true));
        assertThrows(IllegalArgumentException.class, () -> new Configuration("z", -1, true));
    }

    @Test
    void loadsConfigurationFile() throws Exception {
        var d = Deduce.load(Path.of(getClass().getResource("/config/deduce.json").toURI()));
        assertEquals(new Configuration("w", 8, true), d.config);
        var s = d.skeleton(d.firstOrder("(R(x)&x=c)"));
        assertEquals("(w1&w2)", s.skeleton().toString());
    }

    @Test
    void sharedFreshNamesNeverRepeat() {
        var names = new FreshNames();
        var a = new Deduce(new Configuration(), names);
        var b = new Deduce(new Configuration(), names);
        assertEquals("z1", a.skeleton(a.firstOrder("R(x)")).skeleton().toString());
        assertEquals("z2", b.skeleton(b.firstOrder("R(x)")).skeleton().toString());
        assertEquals("z3", a.skeleton(a.firstOrder("Q(y)")).skeleton().toString());
    }

    @Test
    void decideProvesTautologies() {
        var d = new Deduce();
        var v = d.decide(d.proposition("((p->q)->(~q->~p))"));
        assertTrue(v.proved());
        assertTrue(d.verify(v.proof()));
    }

    @Test
    void decideFindsCounterexamples() {
        var d = new Deduce();
        var v = d.decide(d.proposition("((p->q)->p)"));
        assertFalse(v.proved());
        assertEquals(Model.of("p", false, "q", false), v.model());
    }

    @Test
    void decideRespectsTruthTableLimit() {
        var d = new Deduce(new Configuration("z", 2, true));
        assertThrows(IllegalArgumentException.class, () -> d.decide(d.proposition("(p->(q->(r->p)))")));
    }

    @Test
    void proveSound() {
        var d = new Deduce();
        var rule = InferenceRule.parse(List.of("(p->q)", "(q->r)"), "(p->r)");
        var proof = d.proveSound(rule);
        assertEquals(rule, proof.statement());
        assertTrue(proof.isValid());
        assertThrows(IllegalArgumentException.class, () -> d.proveSound(InferenceRule.parse(List.of("q"), "p")));
    }

    @Test
    void verifyReportsInvalidProofs() {
        var d = new Deduce();
        var bad = new Proof(MP, Set.of(MP), List.of(new Proof.Line(Formula.parse("q"))));
        assertFalse(d.verify(bad));
    }

    @Test
    void exportsProofAsJson() throws Exception {
        var d = new Deduce();
        var proof = d.decide(d.proposition("(p->p)")).proof();
        var tree = Json.the.readTree(d.json(proof));
        assertEquals("(p->p)", tree.get("statement").get("conclusion").asText());
        assertEquals(proof.size(), tree.get("lines").size());
    }

    @Test
    void parsesTerms() {
        var d = new Deduce();
        assertEquals("f(x,c)", d.term("f(x,c)").toString());
    }
}
