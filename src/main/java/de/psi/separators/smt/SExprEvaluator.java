package de.psi.separators.smt;

import java.util.Map;

import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * Evaluates the ground bodies of {@code define-fun} entries in a solver model.
 * Symbols evaluate to themselves unless they are bound parameters; booleans are
 * the symbols {@code true} and {@code false}.
 */
public final class SExprEvaluator extends SExpr.Visitor<String> {
    private final Map<String, String> env;

    public SExprEvaluator(Map<String, String> env) {
        this.env = env;
    }

    public static String eval(Map<String, String> env, SExpr value) throws Err {
        return new SExprEvaluator(env).visitThis(value);
    }

    @Override
    public String visit(SExpr.Symbol symbol) {
        String v = env.get(symbol.getName());
        return v != null ? v : symbol.getName();
    }

    @Override
    public String visit(SExpr.SList list) throws Err {
        if (list.size() == 0 || !(list.get(0) instanceof SExpr.Symbol))
            throw new ErrorFatal("Cannot evaluate " + list);
        String head = ((SExpr.Symbol) list.get(0)).getName();
        if (head.equals("ite")) {
            arity(list, 4);
            return "true".equals(visitThis(list.get(1))) ? visitThis(list.get(2)) : visitThis(list.get(3));
        } else if (head.equals("=")) {
            arity(list, 3);
            return bool(visitThis(list.get(1)).equals(visitThis(list.get(2))));
        } else if (head.equals("and")) {
            if (list.size() < 2) throw new ErrorFatal("Empty conjunction in " + list);
            for (int i = 1; i < list.size(); i++)
                if (!"true".equals(visitThis(list.get(i)))) return "false";
            return "true";
        } else if (head.equals("or")) {
            if (list.size() < 2) throw new ErrorFatal("Empty disjunction in " + list);
            for (int i = 1; i < list.size(); i++)
                if ("true".equals(visitThis(list.get(i)))) return "true";
            return "false";
        } else if (head.equals("not")) {
            arity(list, 2);
            return bool(!"true".equals(visitThis(list.get(1))));
        }
        throw new ErrorFatal("Cannot evaluate " + list);
    }

    private static void arity(SExpr.SList list, int n) throws ErrorFatal {
        if (list.size() != n) throw new ErrorFatal("Wrong number of arguments in " + list);
    }

    private static String bool(boolean b) {
        return b ? "true" : "false";
    }
}
