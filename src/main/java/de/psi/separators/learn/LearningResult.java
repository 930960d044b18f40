package de.psi.separators.learn;

import java.util.Collections;
import java.util.List;
import java.util.Vector;

import de.psi.separators.ast.Formula;
import de.psi.separators.ast.Model;
import de.psi.separators.util.Timer;
import edu.mit.csail.sdg.alloy4.Pair;

public class LearningResult {
    public static final String TIMEOUT = "timeout";
    public static final String NO_SEPARATOR = "couldn't separate models under given restrictions";

    private boolean success = false;
    private Formula current = Formula.FALSE;
    private final Timer counterexampleTimer;
    private final Timer separationTimer;
    private final Timer matrixTimer = Timer.unlimited();
    private final List<Model> models = new Vector<Model>();
    private final List<Pair<String, Boolean>> evaluations = new Vector<Pair<String, Boolean>>();
    private String reason = "";

    public LearningResult(long timeoutMillis) {
        this.counterexampleTimer = new Timer(timeoutMillis);
        this.separationTimer = new Timer(timeoutMillis);
    }

    public boolean isSuccess() {
        return success;
    }

    void setSuccess(boolean success) {
        this.success = success;
    }

    public Formula getCurrent() {
        return current;
    }

    void setCurrent(Formula current) {
        this.current = current;
    }

    public Timer getCounterexampleTimer() {
        return counterexampleTimer;
    }

    public Timer getSeparationTimer() {
        return separationTimer;
    }

    public Timer getMatrixTimer() {
        return matrixTimer;
    }

    public List<Model> getModels() {
        return Collections.unmodifiableList(models);
    }

    void addModel(Model m) {
        models.add(m);
    }

    /** Label and truth value of every model under the learned formula, batch mode only. */
    public List<Pair<String, Boolean>> getEvaluations() {
        return Collections.unmodifiableList(evaluations);
    }

    void addEvaluation(String label, boolean value) {
        evaluations.add(new Pair<String, Boolean>(label, value));
    }

    public String getReason() {
        return reason;
    }

    void setReason(String reason) {
        this.reason = reason;
    }

    @Override
    public String toString() {
        return (success ? "success: " + current.pretty() : "failure: " + reason) + " (" + models.size()
                + " models, counterexamples " + counterexampleTimer + ", separation " + separationTimer + ")";
    }
}
