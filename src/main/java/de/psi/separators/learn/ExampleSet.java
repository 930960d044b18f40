package de.psi.separators.learn;

import java.util.Collections;
import java.util.List;
import java.util.Vector;

import de.psi.separators.ast.Formula;
import de.psi.separators.ast.Helpers;
import de.psi.separators.ast.Model;
import de.psi.separators.ast.Signature;
import edu.mit.csail.sdg.alloy4.ErrorFatal;
import edu.mit.csail.sdg.alloy4.Pair;

/**
 * Input of a batch separation: labelled models over a signature, and which labels
 * must be positive, negative, or related by implication.
 */
public class ExampleSet {
    private final Signature sig;
    private final List<Formula> axioms = new Vector<Formula>();
    private final List<Model> models = new Vector<Model>();
    private final List<String> constraintPos = new Vector<String>();
    private final List<String> constraintNeg = new Vector<String>();
    private final List<Pair<String, String>> constraintImp = new Vector<Pair<String, String>>();

    public ExampleSet(Signature sig) {
        this.sig = sig;
    }

    public Signature getSignature() {
        return sig;
    }

    public void addAxiom(Formula f) {
        axioms.add(f);
    }

    public void addModel(Model m) throws ErrorFatal {
        if (m.getSignature() != sig) throw new IllegalArgumentException("model " + m.getLabel() + " has another signature");
        if (!Helpers.isComplete(m, sig)) throw new ErrorFatal("model " + m.getLabel() + " is incomplete");
        models.add(m);
    }

    public void addPositive(String label) {
        constraintPos.add(label);
    }

    public void addNegative(String label) {
        constraintNeg.add(label);
    }

    /** Models labelled {@code from} being positive forces models labelled {@code to} to be. */
    public void addImplication(String from, String to) {
        constraintImp.add(new Pair<String, String>(from, to));
    }

    public List<Formula> getAxioms() {
        return Collections.unmodifiableList(axioms);
    }

    public List<Model> getModels() {
        return Collections.unmodifiableList(models);
    }

    public List<String> getPositive() {
        return Collections.unmodifiableList(constraintPos);
    }

    public List<String> getNegative() {
        return Collections.unmodifiableList(constraintNeg);
    }

    public List<Pair<String, String>> getImplications() {
        return Collections.unmodifiableList(constraintImp);
    }
}
