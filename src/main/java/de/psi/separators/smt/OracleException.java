package de.psi.separators.smt;

/**
 * Thrown when a solver neither proves two formulas equivalent nor produces a
 * counterexample, and the time budget is not exhausted either.
 */
public class OracleException extends Exception {
    private static final long serialVersionUID = 1L;

    public OracleException(String message) {
        super(message);
    }
}
