package de.psi.separators.learn;

import de.psi.separators.util.Timer;

/** Mutable settings for one learning run. */
public final class LearnOptions {

    /** The solver used to find counterexamples. */
    public enum Backend {
        Z3, CVC4
    }

    /** Which solver answers equivalence queries. */
    public Backend backend = Backend.Z3;

    /** The cvc4 executable, looked up on PATH unless it contains a path separator. */
    public String cvc4 = "cvc4";

    /** Upper bound on clauses in the separator's matrix. */
    public int maxClauses = 10;

    /** Upper bound on the quantifier depth of separating formulas. */
    public int maxDepth = 1000;

    /**
     * Time budget in milliseconds, applied separately to counterexample search and
     * to separation. {@link Timer#UNLIMITED} means no budget.
     */
    public long timeoutMillis = Timer.UNLIMITED;

    /** Largest per-sort universe size tried while shrinking a Z3 counterexample. */
    public int minimizeLimit = 100000;
}
