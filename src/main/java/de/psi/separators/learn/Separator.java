package de.psi.separators.learn;

import java.util.List;

import de.psi.separators.ast.Formula;
import de.psi.separators.ast.Model;
import de.psi.separators.util.Timer;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.Pair;

/**
 * Searches for a formula that holds on a set of positive models and fails on a set
 * of negative ones.
 */
public interface Separator {

    /**
     * Formulas whose function symbols decide which quantifier orders keep the search
     * inside the decidable fragment. Called once, before any model is added.
     */
    void setReferenceFormulas(List<Formula> formulas);

    /** Registers a model and returns its identifier, unique within this separator. */
    int addModel(Model model);

    /**
     * Returns a formula true on every model in {@code pos}, false on every model in
     * {@code neg}, and true on the second model of each pair in {@code imp} whenever
     * it is true on the first; or null if no formula within the bounds exists. The
     * search charges its time to {@code timer} and stops once it has expired.
     */
    Formula separate(List<Integer> pos, List<Integer> neg, List<Pair<Integer, Integer>> imp,
            int maxClauses, int maxDepth, Timer timer, Timer matrixTimer) throws Err;
}
