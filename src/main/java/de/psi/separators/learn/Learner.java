package de.psi.separators.learn;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Vector;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import de.psi.separators.ast.Formula;
import de.psi.separators.ast.Model;
import de.psi.separators.ast.Signature;
import de.psi.separators.check.Evaluator;
import de.psi.separators.smt.Cvc4Oracle;
import de.psi.separators.smt.Cvc4Solver;
import de.psi.separators.smt.EquivalenceResult;
import de.psi.separators.smt.Oracle;
import de.psi.separators.smt.OracleException;
import de.psi.separators.smt.Z3Oracle;
import de.psi.separators.smt.Z3Translator;
import de.psi.separators.util.Timer;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.Pair;

/**
 * Learns a formula equivalent to a target modulo axioms by alternating between an
 * equivalence oracle and a {@link Separator}, or separates a fixed set of labelled
 * models in one step.
 */
public final class Learner {
    private static final Logger log = LogManager.getLogger(Learner.class);

    private Learner() {
    }

    public static LearningResult learn(Signature sig, List<Formula> axioms, Formula target, LearnOptions options,
            Separator separator) throws Err {
        List<Formula> reference = new Vector<Formula>(axioms);
        reference.add(target);
        reference.add(Formula.not(target));
        separator.setReferenceFormulas(reference);
        Z3Translator z3 = new Z3Translator(sig, axioms);
        try {
            return learn(oracle(z3, options), target, options, separator);
        } finally {
            z3.close();
        }
    }

    static Oracle oracle(Z3Translator z3, LearnOptions options) {
        switch (options.backend) {
        case CVC4:
            return new Cvc4Oracle(z3, new Cvc4Solver(options.cvc4));
        default:
            return new Z3Oracle(z3, options.minimizeLimit);
        }
    }

    /**
     * The refinement loop: each counterexample is added to the separator as a
     * positive or negative model until the oracle reports equivalence.
     */
    public static LearningResult learn(Oracle oracle, Formula target, LearnOptions options, Separator separator) throws Err {
        LearningResult result = new LearningResult(options.timeoutMillis);
        Timer ct = result.getCounterexampleTimer();
        Timer st = result.getSeparationTimer();
        List<Integer> pos = new Vector<Integer>();
        List<Integer> neg = new Vector<Integer>();
        List<Pair<Integer, Integer>> imp = new Vector<Pair<Integer, Integer>>();
        try {
            while (true) {
                log.debug("Checking formula {}", result.getCurrent());
                EquivalenceResult r;
                ct.start();
                try {
                    r = oracle.findModelOrEquivalence(result.getCurrent(), target, ct);
                } finally {
                    ct.stop();
                }
                if (r.isTimeout() || ct.expired()) {
                    result.setReason(LearningResult.TIMEOUT);
                    break;
                }
                if (r.isEquivalent()) {
                    log.info("Formula matches: {}", result.getCurrent().pretty());
                    result.setSuccess(true);
                    break;
                }

                Model m = r.getModel();
                Formula c;
                st.start();
                try {
                    int id = separator.addModel(m);
                    result.addModel(m);
                    if (m.getLabel().startsWith("+")) pos.add(id); else neg.add(id);
                    log.debug("New model is:\n{}", m);
                    log.info("Have new model, now have {} models total", result.getModels().size());
                    c = separator.separate(pos, neg, imp, options.maxClauses, options.maxDepth, st, result.getMatrixTimer());
                } finally {
                    st.stop();
                }
                if (st.expired()) {
                    result.setReason(LearningResult.TIMEOUT);
                    break;
                }
                if (c == null) {
                    result.setReason(LearningResult.NO_SEPARATOR);
                    break;
                }
                log.info("Learned new possible formula: {}", c.pretty());
                result.setCurrent(c);
            }
        } catch (OracleException e) {
            log.error("Error: {}", e.getMessage());
            result.setReason(e.getMessage());
        }
        return result;
    }

    /**
     * Batch mode: separates the models of an example set in a single call. Each
     * label stands for all models carrying it.
     */
    public static LearningResult separate(ExampleSet examples, LearnOptions options, Separator separator) throws Err {
        LearningResult result = new LearningResult(options.timeoutMillis);
        separator.setReferenceFormulas(examples.getAxioms());
        Map<String, List<Integer>> mapping = new LinkedHashMap<String, List<Integer>>();
        for (Model m : examples.getModels()) {
            List<Integer> ids = mapping.get(m.getLabel());
            if (ids == null) mapping.put(m.getLabel(), ids = new Vector<Integer>());
            ids.add(separator.addModel(m));
            result.addModel(m);
        }

        Timer st = result.getSeparationTimer();
        Formula c;
        st.start();
        try {
            List<Integer> pos = new Vector<Integer>();
            for (String a : examples.getPositive()) pos.addAll(idsOf(mapping, a));
            List<Integer> neg = new Vector<Integer>();
            for (String a : examples.getNegative()) neg.addAll(idsOf(mapping, a));
            List<Pair<Integer, Integer>> imp = new Vector<Pair<Integer, Integer>>();
            for (Pair<String, String> ab : examples.getImplications())
                for (int x : idsOf(mapping, ab.a))
                    for (int y : idsOf(mapping, ab.b))
                        imp.add(new Pair<Integer, Integer>(x, y));
            log.debug("pos {} neg {} imp {}", pos, neg, imp);
            c = separator.separate(pos, neg, imp, options.maxClauses, options.maxDepth, st, result.getMatrixTimer());
        } finally {
            st.stop();
        }
        if (st.expired()) {
            result.setReason(LearningResult.TIMEOUT);
        } else if (c == null) {
            result.setReason(LearningResult.NO_SEPARATOR);
        } else {
            result.setCurrent(c);
            result.setSuccess(true);
            for (Model m : examples.getModels()) {
                boolean v = Evaluator.check(c, m);
                log.info("{} {}", m.getLabel(), v);
                result.addEvaluation(m.getLabel(), v);
            }
        }
        return result;
    }

    private static List<Integer> idsOf(Map<String, List<Integer>> mapping, String label) {
        List<Integer> ids = mapping.get(label);
        return ids != null ? ids : new Vector<Integer>();
    }
}
