package de.psi.separators.smt;

import de.psi.separators.ast.Model;

/** Outcome of an equivalence query: equivalent, a labelled counterexample, or out of time. */
public final class EquivalenceResult {
    public enum Kind {
        EQUIVALENT, COUNTEREXAMPLE, TIMEOUT
    }

    private static final EquivalenceResult EQUIVALENT = new EquivalenceResult(Kind.EQUIVALENT, null);
    private static final EquivalenceResult TIMEOUT = new EquivalenceResult(Kind.TIMEOUT, null);

    private final Kind kind;
    private final Model model;

    private EquivalenceResult(Kind kind, Model model) {
        this.kind = kind;
        this.model = model;
    }

    public static EquivalenceResult equivalent() {
        return EQUIVALENT;
    }

    public static EquivalenceResult timeout() {
        return TIMEOUT;
    }

    public static EquivalenceResult counterexample(Model model) {
        if (model == null) throw new IllegalArgumentException("counterexample without a model");
        return new EquivalenceResult(Kind.COUNTEREXAMPLE, model);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isEquivalent() {
        return kind == Kind.EQUIVALENT;
    }

    public boolean isTimeout() {
        return kind == Kind.TIMEOUT;
    }

    /** The counterexample, or null unless this is a counterexample result. */
    public Model getModel() {
        return model;
    }

    @Override
    public String toString() {
        return kind == Kind.COUNTEREXAMPLE ? "counterexample " + model.getLabel() : kind.toString().toLowerCase();
    }
}
