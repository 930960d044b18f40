package de.psi.separators.smt;

import java.util.List;
import java.util.Vector;

import de.psi.separators.ast.Model;
import de.psi.separators.ast.Signature;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorSyntax;

/**
 * Reads models written by {@link Model#toString()}:
 * <pre>
 * (model LABEL
 *   ((e0 S) (e1 S))
 *   (= c e0)
 *   (r e0 e1)
 *   (= (f e0) e1)
 * )
 * </pre>
 */
public final class ModelReader {

    private ModelReader() {
    }

    public static List<Model> read(Signature sig, String text) throws Err {
        List<Model> models = new Vector<Model>();
        for (SExpr e : SExpr.parse(text)) {
            if (!(e instanceof SExpr.SList) || !((SExpr.SList) e).hasHead("model"))
                throw new ErrorSyntax("Expected (model ...) but found " + e);
            models.add(readModel(sig, (SExpr.SList) e));
        }
        return models;
    }

    private static Model readModel(Signature sig, SExpr.SList form) throws Err {
        Model m = new Model(sig);
        int i = 1;
        if (i < form.size() && form.get(i) instanceof SExpr.Symbol) {
            m.setLabel(((SExpr.Symbol) form.get(i)).getName());
            i++;
        }
        if (i >= form.size() || !(form.get(i) instanceof SExpr.SList))
            throw new ErrorSyntax("Model " + m.getLabel() + " has no element list");
        for (SExpr el : ((SExpr.SList) form.get(i)).getItems()) {
            List<String> pair = symbols(el);
            if (pair.size() != 2) throw new ErrorSyntax("Expected (element sort) but found " + el);
            if (!sig.getSorts().contains(pair.get(1))) throw new ErrorSyntax("Unknown sort in " + el);
            if (!m.addElem(pair.get(0), pair.get(1))) throw new ErrorSyntax("Duplicate element " + pair.get(0));
        }
        for (i++; i < form.size(); i++) readFact(sig, m, form.get(i));
        return m;
    }

    private static void readFact(Signature sig, Model m, SExpr fact) throws Err {
        if (!(fact instanceof SExpr.SList) || ((SExpr.SList) fact).size() == 0)
            throw new ErrorSyntax("Expected a fact but found " + fact);
        SExpr.SList f = (SExpr.SList) fact;
        if (f.hasHead("=") && f.size() == 3) {
            SExpr lhs = f.get(1);
            String rhs = symbol(f.get(2));
            if (lhs instanceof SExpr.Symbol) {
                String c = ((SExpr.Symbol) lhs).getName();
                if (!sig.getConstants().containsKey(c)) throw new ErrorSyntax("Unknown constant " + c);
                if (!m.addConstant(c, rhs)) throw new ErrorSyntax("Constant " + c + " is assigned twice");
            } else {
                List<String> app = symbols(lhs);
                if (app.isEmpty() || !sig.getFunctions().containsKey(app.get(0)))
                    throw new ErrorSyntax("Unknown function application " + lhs);
                if (!m.addFunction(app.get(0), app.subList(1, app.size()), rhs))
                    throw new ErrorSyntax("Function application " + lhs + " is assigned twice");
            }
        } else {
            List<String> atom = symbols(f);
            if (!sig.getRelations().containsKey(atom.get(0))) throw new ErrorSyntax("Unknown relation in " + f);
            m.addRelation(atom.get(0), atom.subList(1, atom.size()));
        }
    }

    private static String symbol(SExpr e) throws ErrorSyntax {
        if (!(e instanceof SExpr.Symbol)) throw new ErrorSyntax("Expected a name but found " + e);
        return ((SExpr.Symbol) e).getName();
    }

    private static List<String> symbols(SExpr e) throws ErrorSyntax {
        if (!(e instanceof SExpr.SList)) throw new ErrorSyntax("Expected a list but found " + e);
        List<String> names = new Vector<String>();
        for (SExpr x : ((SExpr.SList) e).getItems()) names.add(symbol(x));
        return names;
    }
}
