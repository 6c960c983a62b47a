package dumb.deduce.prop;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/** Either a proof or a model, as decided by the {@link Tautology} prover. */
sealed public interface Verdict permits Verdict.Proved, Verdict.Found {

    @Nullable
    default Proof proof() {
        return this instanceof Proved p ? p.proof : null;
    }

    @Nullable
    default Model model() {
        return this instanceof Found f ? f.model : null;
    }

    default boolean proved() {
        return this instanceof Proved;
    }

    record Proved(Proof proof) implements Verdict {
        public Proved {
            requireNonNull(proof);
        }
    }

    record Found(Model model) implements Verdict {
        public Found {
            requireNonNull(model);
        }
    }
}
