package de.psi.separators.smt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.microsoft.z3.Status;

import de.psi.separators.ast.Formula;
import de.psi.separators.ast.Model;
import de.psi.separators.util.Timer;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * Answers equivalence queries with the embedded Z3. Counterexamples are shrunk by
 * bounding every sort to k elements for increasing k, so the first model found has
 * the smallest universes Z3 can give.
 */
public class Z3Oracle implements Oracle {
    private static final Logger log = LogManager.getLogger(Z3Oracle.class);

    private final Z3Translator z3;
    private final int minimizeLimit;

    public Z3Oracle(Z3Translator z3, int minimizeLimit) {
        this.z3 = z3;
        this.minimizeLimit = minimizeLimit;
    }

    @Override
    public EquivalenceResult findModelOrEquivalence(Formula current, Formula target, Timer timer) throws Err, OracleException {
        Status r1 = check(current, target, timer);
        if (r1 == Status.SATISFIABLE) return minimized(current, target, timer, "-");
        Status r2 = check(target, current, timer);
        if (r2 == Status.SATISFIABLE) return minimized(target, current, timer, "+");
        if (r1 == Status.UNSATISFIABLE && r2 == Status.UNSATISFIABLE) return EquivalenceResult.equivalent();
        if (timer.expired()) return EquivalenceResult.timeout();
        throw new OracleException("Z3 did not produce equivalence or model");
    }

    private Status check(Formula a, Formula b, Timer timer) throws Err {
        z3.push();
        try {
            z3.assertDifference(a, b);
            z3.setTimeout(timer);
            Status r = z3.getSolver().check();
            log.debug("z3 check: {}", r);
            return r;
        } finally {
            z3.pop();
        }
    }

    private EquivalenceResult minimized(Formula a, Formula b, Timer timer, String label) throws Err {
        for (int k = 1; k < minimizeLimit; k++) {
            if (timer.expired()) return EquivalenceResult.timeout();
            z3.push();
            try {
                z3.assertSortBounds(k);
                z3.assertDifference(a, b);
                z3.setTimeout(timer);
                if (z3.getSolver().check() == Status.SATISFIABLE) {
                    log.debug("counterexample with at most {} elements per sort", k);
                    Model m = z3.extractModel(z3.getSolver().getModel(), label);
                    return EquivalenceResult.counterexample(m);
                }
            } finally {
                z3.pop();
            }
        }
        throw new ErrorFatal("No counterexample with fewer than " + minimizeLimit + " elements per sort");
    }
}
