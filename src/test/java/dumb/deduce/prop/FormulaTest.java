package dumb.deduce.prop;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormulaTest {

    @ParameterizedTest
    @ValueSource(strings = {"x", "x12", "T", "F", "~~p", "(p&q)", "(p|q)", "(p->q)", "(p<->q)", "(p+q)",
            "(p-&q)", "(p-|q)", "((p->q)->~(r<->T))", "~(x12-|(y+~F))"})
    void printsWhatItParses(String text) {
        var f = Formula.parse(text);
        assertEquals(text, f.toString());
        assertEquals(f, f.substituteVariables(Map.of()));
        assertTrue(Formula.isFormula(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a", "(p)", "(p&q", "p&q", "(p=q)", "~", "(p->q))", "x1x", "((p->q)"})
    void rejectsMalformedText(String text) {
        assertFalse(Formula.isFormula(text));
        assertThrows(MalformedFormulaException.class, () -> Formula.parse(text));
    }

    @Test
    void parsePrefixReportsRemainder() {
        var p = Formula.parsePrefix("(p->q)xyz");
        assertTrue(p.ok());
        assertEquals("(p->q)", p.formula().toString());
        assertEquals("xyz", p.remainder());
        assertNull(p.error());
    }

    @Test
    void parsePrefixConsumesWholeVariableName() {
        var p = Formula.parsePrefix("x12&");
        assertEquals(new Formula.Var("x12"), p.formula());
        assertEquals("&", p.remainder());
    }

    @Test
    void parsePrefixReportsFailureAsValue() {
        var p = Formula.parsePrefix("");
        assertFalse(p.ok());
        assertEquals("Empty string", p.error());

        var q = Formula.parsePrefix("(p#q)");
        assertFalse(q.ok());
        assertTrue(q.error().contains("binary operator"), q.error());
    }

    @Test
    void rootOperatorFollowsLeftOperand() {
        var f = assertInstanceOf(Formula.Bin.class, Formula.parse("((p->q)-&(r<->s))"));
        assertEquals(Op.NAND, f.op());
        assertEquals("(p->q)", f.first().toString());
        assertEquals("(r<->s)", f.second().toString());
    }

    @Test
    void equalityIsStructural() {
        assertEquals(Formula.parse("(p->~q)"), Formula.implies(new Formula.Var("p"), Formula.not(new Formula.Var("q"))));
        assertEquals(Formula.parse("(p->~q)").hashCode(), Formula.parse("(p->~q)").hashCode());
    }

    @Test
    void variablesAndOperators() {
        var f = Formula.parse("((x|~y)->(T&x1))");
        assertEquals(Set.of("x", "y", "x1"), f.variables());
        assertEquals(Set.of("|", "~", "->", "&", "T"), f.operators());
    }

    @Test
    void substituteVariablesIsSimultaneous() {
        var f = Formula.parse("((p->p)|z)");
        assertEquals("(((q&r)->(q&r))|z)", f.substituteVariables(Map.of("p", Formula.parse("(q&r)"))).toString());
        assertEquals("(q->p)", Formula.parse("(p->q)")
                .substituteVariables(Map.of("p", Formula.parse("q"), "q", Formula.parse("p"))).toString());
    }

    @Test
    void substituteVariablesRejectsNonVariableKeys() {
        assertThrows(IllegalArgumentException.class, () -> Formula.parse("p").substituteVariables(Map.of("T", Formula.parse("p"))));
    }

    @Test
    void substituteOperatorsRewritesBottomUp() {
        var f = Formula.parse("((x&y)&~z)");
        var g = f.substituteOperators(Map.of("&", Formula.parse("~(~p|~q)")));
        assertEquals("~(~~(~x|~y)|~~z)", g.toString());
    }

    @Test
    void substituteOperatorsReplacesConstantsAndNegation() {
        var f = Formula.parse("(~T->F)");
        var g = f.substituteOperators(Map.of(
                "T", Formula.parse("(p|~p)"),
                "F", Formula.parse("(p&~p)"),
                "~", Formula.parse("(p-|p)")));
        assertEquals("(((p|~p)-|(p|~p))->(p&~p))", g.toString());
    }

    @Test
    void substituteOperatorsRejectsTemplatesOverOtherVariables() {
        assertThrows(IllegalArgumentException.class,
                () -> Formula.parse("(x&y)").substituteOperators(Map.of("&", Formula.parse("(p&r)"))));
    }
}
