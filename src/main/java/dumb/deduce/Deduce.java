package dumb.deduce;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.deduce.fol.Skeleton;
import dumb.deduce.fol.Term;
import dumb.deduce.prop.Formula;
import dumb.deduce.prop.InferenceRule;
import dumb.deduce.prop.Proof;
import dumb.deduce.prop.Semantics;
import dumb.deduce.prop.Tautology;
import dumb.deduce.prop.Verdict;
import dumb.deduce.util.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static dumb.deduce.util.Log.error;
import static dumb.deduce.util.Log.message;
import static dumb.deduce.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Entry point tying the parsers, the tautology prover and the proof checker
 * to one {@link Configuration}.
 */
public class Deduce {

    public final Configuration config;
    private final FreshNames names;

    public Deduce() {
        this(new Configuration());
    }

    public Deduce(Configuration config) {
        this(config, new FreshNames(config.freshNamePrefix()));
    }

    /** Instances given the same {@code names} never hand out the same skeleton atom. */
    public Deduce(Configuration config, FreshNames names) {
        this.config = requireNonNull(config);
        this.names = requireNonNull(names);
        message("Deduce configured: " + config);
    }

    public static Deduce load(Path file) throws IOException {
        return new Deduce(Json.obj(Files.readString(file), Configuration.class));
    }

    public Formula proposition(String text) {
        return Formula.parse(text);
    }

    public dumb.deduce.fol.Formula firstOrder(String text) {
        return dumb.deduce.fol.Formula.parse(text);
    }

    public Term term(String text) {
        return Term.parse(text);
    }

    /** Skeleton over this instance's fresh names; atoms never repeat across calls sharing them. */
    public Skeleton skeleton(dumb.deduce.fol.Formula formula) {
        return formula.propositionalSkeleton(names);
    }

    /** A verified proof of {@code formula}, or a falsifying model. */
    public Verdict decide(Formula formula) {
        checkLimit(formula.variables().size(), formula);
        var v = Tautology.proofOrCounterexample(formula);
        if (v instanceof Verdict.Proved p) requireVerified(p.proof());
        else message(formula + " is falsified by " + v.model());
        return v;
    }

    public Proof proveSound(InferenceRule rule) {
        checkLimit(rule.variables().size(), rule);
        if (!Semantics.isSoundInference(rule))
            throw new IllegalArgumentException("Not a sound inference: " + rule);
        var proof = Tautology.proveSoundInference(rule);
        requireVerified(proof);
        return proof;
    }

    public boolean verify(Proof proof) {
        if (proof.isValid()) return true;
        var line = proof.firstInvalidLine();
        if (line >= 0)
            warning("Invalid line " + line + " of proof of " + proof.statement() + ": " + proof.line(line));
        else
            warning("Proof of " + proof.statement() + " does not end in its conclusion");
        return false;
    }

    /** Indented JSON text of {@code proof}. */
    public String json(Proof proof) throws JsonProcessingException {
        return Json.str(proof.toJson());
    }

    private void requireVerified(Proof proof) {
        if (config.verifyProofs() && !verify(proof)) {
            var msg = "Produced an invalid proof of " + proof.statement();
            error(msg);
            throw new IllegalStateException(msg);
        }
    }

    private void checkLimit(int variables, Object subject) {
        if (variables > config.truthTableLimit()) {
            var msg = subject + " has " + variables + " variables, over the truth table limit of " + config.truthTableLimit();
            warning(msg);
            throw new IllegalArgumentException(msg);
        }
    }
}
