package de.psi.separators.smt;

import de.psi.separators.ast.Formula;
import de.psi.separators.util.Timer;
import edu.mit.csail.sdg.alloy4.Err;

/**
 * Decides whether a candidate formula is equivalent to the target modulo the
 * axioms. A counterexample satisfying the candidate but not the target is
 * labelled {@code -}; one satisfying the target but not the candidate is
 * labelled {@code +}.
 */
public interface Oracle {
    EquivalenceResult findModelOrEquivalence(Formula current, Formula target, Timer timer) throws Err, OracleException;
}
