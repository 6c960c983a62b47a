package dumb.deduce.prop;

import java.util.List;
import java.util.Set;

/** The implication/negation axiom schemas proofs in this package cite. */
public enum Axioms {
    ;

    public static final InferenceRule MP = InferenceRule.parse(List.of("p", "(p->q)"), "q");
    public static final InferenceRule I0 = axiom("(p->p)");
    public static final InferenceRule I1 = axiom("(q->(p->q))");
    public static final InferenceRule D = axiom("((p->(q->r))->((p->q)->(p->r)))");
    public static final InferenceRule I2 = axiom("(~p->(p->q))");
    public static final InferenceRule N = axiom("((~q->~p)->(p->q))");
    public static final InferenceRule NI = axiom("(p->(~q->~(p->q)))");
    public static final InferenceRule NN = axiom("(p->~~p)");
    public static final InferenceRule R = axiom("((q->p)->((~q->p)->p))");

    public static final Set<InferenceRule> AXIOMATIC_SYSTEM = Set.of(MP, I0, I1, D, I2, N, NI, NN, R);

    private static InferenceRule axiom(String conclusion) {
        return new InferenceRule(Formula.parse(conclusion));
    }
}
