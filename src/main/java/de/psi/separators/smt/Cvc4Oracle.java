package de.psi.separators.smt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.microsoft.z3.Status;

import de.psi.separators.ast.Formula;
import de.psi.separators.ast.Model;
import de.psi.separators.util.Timer;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.Pair;

/**
 * Answers equivalence queries by handing the Z3 solver state to cvc4, whose finite
 * model finding returns small counterexamples without explicit minimization.
 */
public class Cvc4Oracle implements Oracle {
    private static final Logger log = LogManager.getLogger(Cvc4Oracle.class);

    private final Z3Translator z3;
    private final Cvc4Solver cvc4;

    public Cvc4Oracle(Z3Translator z3, Cvc4Solver cvc4) {
        this.z3 = z3;
        this.cvc4 = cvc4;
    }

    @Override
    public EquivalenceResult findModelOrEquivalence(Formula current, Formula target, Timer timer) throws Err, OracleException {
        Pair<Status, Model> r1 = solve(current, target, timer);
        if (r1.b != null) return labelled(r1.b, "-");
        Pair<Status, Model> r2 = solve(target, current, timer);
        if (r2.b != null) return labelled(r2.b, "+");
        if (r1.a == Status.UNSATISFIABLE && r2.a == Status.UNSATISFIABLE) return EquivalenceResult.equivalent();
        if (timer.expired()) return EquivalenceResult.timeout();
        throw new OracleException("CVC4 did not produce equivalence or model");
    }

    private Pair<Status, Model> solve(Formula a, Formula b, Timer timer) throws Err {
        SmtScript script;
        z3.push();
        try {
            z3.assertDifference(a, b);
            script = SmtScript.fromZ3(z3.toSmtLib());
        } finally {
            z3.pop();
        }
        Pair<Status, Model> r = cvc4.solve(script, z3.getSignature(), timer);
        log.debug("cvc4 check: {}", r.a);
        return r;
    }

    private static EquivalenceResult labelled(Model m, String label) {
        m.setLabel(label);
        return EquivalenceResult.counterexample(m);
    }
}
