package de.psi.separators.smt;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Vector;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import de.psi.separators.ast.Helpers;
import de.psi.separators.ast.Model;
import de.psi.separators.ast.Signature;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;
import edu.mit.csail.sdg.alloy4.Pair;

/**
 * Turns the model cvc4 prints with {@code --dump-models} into a complete {@link Model}.
 * Element names only appear in {@code ; rep:} comments, so they are collected from
 * the raw lines before the S-expression tree is read.
 */
public final class Cvc4ModelParser {
    private static final Pattern DECLARE_SORT = Pattern.compile("\\(declare-sort ([^\\s]+) 0\\)");
    private static final Pattern REP = Pattern.compile("; rep: ([^\\s]+)");

    private Cvc4ModelParser() {
    }

    public static Model parse(Signature sig, List<String> lines) throws Err {
        Model m = new Model(sig);

        String lastSort = "";
        for (String l : lines) {
            Matcher d = DECLARE_SORT.matcher(l);
            if (d.lookingAt()) {
                lastSort = d.group(1);
                continue;
            }
            Matcher r = REP.matcher(l);
            if (r.lookingAt()) m.addElem(r.group(1), lastSort);
        }
        for (String sort : sig.getSorts())
            if (m.elemsOfSort(sort).isEmpty()) m.addElem("@uc_" + sort + "_0", sort);

        StringBuilder text = new StringBuilder();
        for (String l : lines) text.append(l).append('\n');
        List<SExpr> top = SExpr.parse(text.toString());
        if (top.isEmpty() || !(top.get(0) instanceof SExpr.SList) || !((SExpr.SList) top.get(0)).hasHead("model"))
            throw new ErrorFatal("cvc4 output is not a model: " + text);
        List<SExpr> items = ((SExpr.SList) top.get(0)).getItems();
        for (SExpr item : items.subList(1, items.size())) {
            if (item instanceof SExpr.SList && ((SExpr.SList) item).hasHead("declare-sort")) continue;
            if (item instanceof SExpr.SList && ((SExpr.SList) item).hasHead("define-fun")) {
                define(sig, m, (SExpr.SList) item);
                continue;
            }
            throw new ErrorFatal("Unexpected entry in cvc4 model: " + item);
        }

        complete(sig, m);
        if (!Helpers.isComplete(m, sig)) throw new ErrorFatal("cvc4 model is incomplete:\n" + m);
        return m;
    }

    private static void define(Signature sig, Model m, SExpr.SList def) throws Err {
        if (def.size() != 5) throw new ErrorFatal("Malformed define-fun: " + def);
        String name = name(def.get(1));
        String result = name(def.get(3));
        SExpr value = def.get(4);
        if (sig.getConstants().containsKey(name)) {
            m.addConstant(name, name(value));
        } else if (sig.getRelations().containsKey(name)) {
            if (!result.equals("Bool")) throw new ErrorFatal("Relation " + name + " is defined with result " + result);
            List<String> params = params(def.get(2));
            for (ConstList<Integer> t : Helpers.product(Helpers.universes(m, sig.getRelations().get(name)))) {
                List<String> args = names(m, t);
                if ("true".equals(SExprEvaluator.eval(bind(params, args), value))) m.addRelation(name, args);
            }
        } else if (sig.getFunctions().containsKey(name)) {
            Pair<ConstList<String>, String> type = sig.getFunctions().get(name);
            if (!result.equals(type.b)) throw new ErrorFatal("Function " + name + " is defined with result " + result);
            List<String> params = params(def.get(2));
            for (ConstList<Integer> t : Helpers.product(Helpers.universes(m, type.a))) {
                List<String> args = names(m, t);
                m.addFunction(name, args, SExprEvaluator.eval(bind(params, args), value));
            }
        }
    }

    // Constants and function entries cvc4 left out get the first element of their sort.
    private static void complete(Signature sig, Model m) throws Err {
        for (Map.Entry<String, String> c : sig.getConstants().entrySet())
            if (!m.getConstants().containsKey(c.getKey()))
                m.addConstant(c.getKey(), m.nameOf(m.elemsOfSort(c.getValue()).get(0)));
        for (Map.Entry<String, Pair<ConstList<String>, String>> f : sig.getFunctions().entrySet()) {
            String v = m.nameOf(m.elemsOfSort(f.getValue().b).get(0));
            Map<ConstList<Integer>, Integer> table = m.getFunction(f.getKey());
            for (ConstList<Integer> t : Helpers.product(Helpers.universes(m, f.getValue().a)))
                if (!table.containsKey(t)) m.addFunction(f.getKey(), names(m, t), v);
        }
    }

    private static String name(SExpr e) throws ErrorFatal {
        if (!(e instanceof SExpr.Symbol)) throw new ErrorFatal("Expected a symbol in cvc4 model but found " + e);
        return ((SExpr.Symbol) e).getName();
    }

    private static List<String> params(SExpr e) throws ErrorFatal {
        if (!(e instanceof SExpr.SList)) throw new ErrorFatal("Expected a parameter list but found " + e);
        List<String> params = new Vector<String>();
        for (SExpr p : ((SExpr.SList) e).getItems()) {
            if (!(p instanceof SExpr.SList) || ((SExpr.SList) p).size() != 2)
                throw new ErrorFatal("Malformed parameter " + p);
            params.add(name(((SExpr.SList) p).get(0)));
        }
        return params;
    }

    private static List<String> names(Model m, List<Integer> tuple) {
        List<String> n = new Vector<String>();
        for (int id : tuple) n.add(m.nameOf(id));
        return n;
    }

    private static Map<String, String> bind(List<String> params, List<String> args) throws ErrorFatal {
        if (params.size() != args.size()) throw new ErrorFatal("Parameter count mismatch: " + params + " vs " + args);
        Map<String, String> env = new HashMap<String, String>();
        for (int i = 0; i < params.size(); i++) env.put(params.get(i), args.get(i));
        return env;
    }
}
