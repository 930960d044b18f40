package de.psi.separators.check;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import de.psi.separators.ast.Formula;
import de.psi.separators.ast.Model;
import de.psi.separators.ast.Term;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.ConstList.TempList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * Evaluates formulas directly on a finite {@link Model}. Free variables are looked
 * up in the assumptions first, then among the model's constants.
 */
public final class Evaluator extends Formula.Visitor<Boolean> {
    private final Model model;
    private final Map<String, Integer> assumptions;

    private Evaluator(Model model, Map<String, Integer> assumptions) {
        this.model = model;
        this.assumptions = new HashMap<String, Integer>(assumptions);
    }

    public static boolean check(Formula formula, Model model) throws Err {
        return check(formula, model, Collections.<String, Integer>emptyMap());
    }

    public static boolean check(Formula formula, Model model, Map<String, Integer> assumptions) throws Err {
        return new Evaluator(model, assumptions).visitThis(formula);
    }

    public static int resolve(Term term, Model model, Map<String, Integer> assumptions) throws Err {
        return new TermResolver(model, assumptions).visitThis(term);
    }

    private static final class TermResolver extends Term.Visitor<Integer> {
        private final Model model;
        private final Map<String, Integer> assumptions;

        TermResolver(Model model, Map<String, Integer> assumptions) {
            this.model = model;
            this.assumptions = assumptions;
        }

        @Override
        public Integer visit(Term.Var x) throws Err {
            Integer e = assumptions.get(x.getName());
            if (e == null) e = model.getConstants().get(x.getName());
            if (e == null) throw new ErrorFatal("variable " + x.getName() + " not defined");
            return e;
        }

        @Override
        public Integer visit(Term.Func x) throws Err {
            Map<ConstList<Integer>, Integer> table = model.getFunction(x.getName());
            if (table == null) throw new ErrorFatal("function " + x.getName() + " not defined");
            ConstList<Integer> args = resolveAll(this, x.getArgs());
            Integer e = table.get(args);
            if (e == null) throw new ErrorFatal("function " + x.getName() + " undefined on " + args);
            return e;
        }
    }

    private static ConstList<Integer> resolveAll(TermResolver r, List<Term> terms) throws Err {
        TempList<Integer> ids = new TempList<Integer>();
        for (Term t : terms) ids.add(r.visitThis(t));
        return ids.makeConst();
    }

    private int resolve(Term t) throws Err {
        return new TermResolver(model, assumptions).visitThis(t);
    }

    @Override
    public Boolean visit(Formula.And x) throws Err {
        for (Formula f : x.getChildren())
            if (!visitThis(f)) return false;
        return true;
    }

    @Override
    public Boolean visit(Formula.Or x) throws Err {
        for (Formula f : x.getChildren())
            if (visitThis(f)) return true;
        return false;
    }

    @Override
    public Boolean visit(Formula.Not x) throws Err {
        return !visitThis(x.getBody());
    }

    @Override
    public Boolean visit(Formula.Equal x) throws Err {
        return resolve(x.getLeft()) == resolve(x.getRight());
    }

    @Override
    public Boolean visit(Formula.Relation x) throws Err {
        Set<ConstList<Integer>> tuples = model.getRelation(x.getName());
        if (tuples == null) throw new ErrorFatal("relation " + x.getName() + " not defined");
        return tuples.contains(resolveAll(new TermResolver(model, assumptions), x.getArgs()));
    }

    @Override
    public Boolean visit(Formula.Forall x) throws Err {
        return quantify(x, false);
    }

    @Override
    public Boolean visit(Formula.Exists x) throws Err {
        return quantify(x, true);
    }

    // Stops at the first element whose value of the body equals "stopOn".
    private boolean quantify(Formula.Quantified x, boolean stopOn) throws Err {
        Integer saved = assumptions.get(x.getVar());
        try {
            for (int e : model.elemsOfSort(x.getSort())) {
                assumptions.put(x.getVar(), e);
                if (visitThis(x.getBody()) == stopOn) return stopOn;
            }
            return !stopOn;
        } finally {
            if (saved == null) assumptions.remove(x.getVar()); else assumptions.put(x.getVar(), saved);
        }
    }
}
