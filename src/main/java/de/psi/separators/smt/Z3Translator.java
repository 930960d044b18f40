package de.psi.separators.smt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.Vector;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;

import de.psi.separators.ast.Environment;
import de.psi.separators.ast.Formula;
import de.psi.separators.ast.Helpers;
import de.psi.separators.ast.Model;
import de.psi.separators.ast.Signature;
import de.psi.separators.ast.Term;
import de.psi.separators.util.Timer;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;
import edu.mit.csail.sdg.alloy4.Pair;

/**
 * The Z3 side of one learning run: a context, a solver holding the axioms, and the
 * Z3 symbols of every sort, constant, relation and function of the signature.
 * Every run creates its own translator, so runs over different signatures never
 * share symbol tables.
 */
public final class Z3Translator implements AutoCloseable {
    private final Signature sig;
    private final Environment env;
    private final Context ctx;
    private final Solver solver;
    private final Map<String, Sort> sorts = new LinkedHashMap<String, Sort>();
    private final Map<String, Expr<Sort>> constants = new LinkedHashMap<String, Expr<Sort>>();
    private final Map<String, FuncDecl<BoolSort>> relations = new LinkedHashMap<String, FuncDecl<BoolSort>>();
    private final Map<String, FuncDecl<Sort>> functions = new LinkedHashMap<String, FuncDecl<Sort>>();

    public Z3Translator(Signature sig, List<Formula> axioms) throws Err {
        this.sig = sig;
        this.env = new Environment(sig);
        this.ctx = new Context();
        try {
            this.solver = ctx.mkSolver();
            for (String s : sig.getSorts())
                sorts.put(s, ctx.mkUninterpretedSort(s));
            for (Map.Entry<String, String> c : sig.getConstants().entrySet())
                constants.put(c.getKey(), ctx.mkConst(c.getKey(), sorts.get(c.getValue())));
            for (Map.Entry<String, ConstList<String>> r : sig.getRelations().entrySet())
                relations.put(r.getKey(), ctx.mkFuncDecl(r.getKey(), domain(r.getValue()), ctx.getBoolSort()));
            for (Map.Entry<String, Pair<ConstList<String>, String>> f : sig.getFunctions().entrySet())
                functions.put(f.getKey(), ctx.mkFuncDecl(f.getKey(), domain(f.getValue().a), sorts.get(f.getValue().b)));
            for (Formula ax : axioms)
                solver.add(translate(ax));
        } catch (Err e) {
            ctx.close();
            throw e;
        } catch (RuntimeException e) {
            ctx.close();
            throw e;
        }
    }

    private Sort[] domain(List<String> argSorts) {
        Sort[] d = new Sort[argSorts.size()];
        for (int i = 0; i < d.length; i++) d[i] = sorts.get(argSorts.get(i));
        return d;
    }

    private Sort sort(String name) throws ErrorFatal {
        Sort s = sorts.get(name);
        if (s == null) throw new ErrorFatal("Cannot convert unknown sort " + name + " to z3");
        return s;
    }

    public Signature getSignature() {
        return sig;
    }

    public Solver getSolver() {
        return solver;
    }

    private final Term.Visitor<Expr<Sort>> termTranslator = new Term.Visitor<Expr<Sort>>() {
        @Override
        public Expr<Sort> visit(Term.Var x) throws Err {
            String s = env.lookupVar(x.getName());
            if (s == null) throw new ErrorFatal("Cannot convert invalid formula to z3: " + x.getName() + " is not bound");
            return ctx.mkConst(x.getName(), sort(s));
        }

        @Override
        public Expr<Sort> visit(Term.Func x) throws Err {
            FuncDecl<Sort> f = functions.get(x.getName());
            if (f == null) throw new ErrorFatal("Cannot convert unknown function " + x.getName() + " to z3");
            return ctx.mkApp(f, args(x.getArgs()));
        }
    };

    private Expr<?>[] args(List<Term> terms) throws Err {
        Expr<?>[] a = new Expr<?>[terms.size()];
        for (int i = 0; i < a.length; i++) a[i] = termTranslator.visitThis(terms.get(i));
        return a;
    }

    private final Formula.Visitor<BoolExpr> formulaTranslator = new Formula.Visitor<BoolExpr>() {
        private BoolExpr[] children(Formula.Junction x) throws Err {
            BoolExpr[] c = new BoolExpr[x.getChildren().size()];
            for (int i = 0; i < c.length; i++) c[i] = visitThis(x.getChildren().get(i));
            return c;
        }

        @Override
        public BoolExpr visit(Formula.And x) throws Err {
            if (x.getChildren().isEmpty()) return ctx.mkTrue();
            return ctx.mkAnd(children(x));
        }

        @Override
        public BoolExpr visit(Formula.Or x) throws Err {
            if (x.getChildren().isEmpty()) return ctx.mkFalse();
            return ctx.mkOr(children(x));
        }

        @Override
        public BoolExpr visit(Formula.Not x) throws Err {
            return ctx.mkNot(visitThis(x.getBody()));
        }

        @Override
        public BoolExpr visit(Formula.Equal x) throws Err {
            return ctx.mkEq(termTranslator.visitThis(x.getLeft()), termTranslator.visitThis(x.getRight()));
        }

        @Override
        public BoolExpr visit(Formula.Relation x) throws Err {
            FuncDecl<BoolSort> r = relations.get(x.getName());
            if (r == null) throw new ErrorFatal("Cannot convert unknown relation " + x.getName() + " to z3");
            return (BoolExpr) ctx.mkApp(r, args(x.getArgs()));
        }

        private BoolExpr body(Formula.Quantified x) throws Err {
            sort(x.getSort());
            env.bind(x.getVar(), x.getSort());
            try {
                return visitThis(x.getBody());
            } finally {
                env.pop();
            }
        }

        @Override
        public BoolExpr visit(Formula.Forall x) throws Err {
            BoolExpr body = body(x);
            Expr<?>[] bv = { ctx.mkConst(x.getVar(), sort(x.getSort())) };
            return ctx.mkForall(bv, body, 1, null, null, null, null);
        }

        @Override
        public BoolExpr visit(Formula.Exists x) throws Err {
            BoolExpr body = body(x);
            Expr<?>[] bv = { ctx.mkConst(x.getVar(), sort(x.getSort())) };
            return ctx.mkExists(bv, body, 1, null, null, null, null);
        }
    };

    public BoolExpr translate(Formula f) throws Err {
        return formulaTranslator.visitThis(f);
    }

    public Expr<Sort> translate(Term t) throws Err {
        return termTranslator.visitThis(t);
    }

    public void push() {
        solver.push();
    }

    public void pop() {
        solver.pop();
    }

    /** Asserts {@code a /\ ~b} in the current scope. */
    public void assertDifference(Formula a, Formula b) throws Err {
        solver.add(translate(a));
        solver.add(ctx.mkNot(translate(b)));
    }

    /**
     * Asserts that every sort has at most k elements: each element equals one of
     * the fresh constants {@code elem_S_0 .. elem_S_k-1}.
     */
    public void assertSortBounds(int k) {
        for (Map.Entry<String, Sort> s : sorts.entrySet()) {
            Expr<Sort> bv = ctx.mkConst("elem_" + s.getKey(), s.getValue());
            BoolExpr[] eqs = new BoolExpr[k];
            for (int i = 0; i < k; i++)
                eqs[i] = ctx.mkEq(ctx.mkConst("elem_" + s.getKey() + "_" + i, s.getValue()), bv);
            solver.add(ctx.mkForall(new Expr<?>[] { bv }, ctx.mkOr(eqs), 1, null, null, null, null));
        }
    }

    /** Limits the next check to the time left on the timer. */
    public void setTimeout(Timer timer) {
        if (timer.isUnlimited()) return;
        Params p = ctx.mkParams();
        p.add("timeout", (int) Math.max(1, Math.min(timer.remaining(), Integer.MAX_VALUE)));
        solver.setParameters(p);
    }

    /** The solver's declarations and assertions as SMT-LIB text. */
    public String toSmtLib() {
        return solver.toString();
    }

    private static final Comparator<Expr<Sort>> byName = new Comparator<Expr<Sort>>() {
        @Override
        public int compare(Expr<Sort> a, Expr<Sort> b) {
            return a.toString().compareTo(b.toString());
        }
    };

    /**
     * Builds a {@link Model} from a Z3 model by enumerating every sort's universe and
     * evaluating all symbols on all argument tuples.
     */
    public Model extractModel(com.microsoft.z3.Model m, String label) throws Err {
        Model result = new Model(sig);
        result.setLabel(label);
        Map<String, List<Expr<Sort>>> univs = new TreeMap<String, List<Expr<Sort>>>();
        for (String s : new TreeSet<String>(sig.getSorts())) {
            Expr<Sort>[] univ = m.getSortUniverse(sort(s));
            if (univ == null || univ.length == 0) throw new ErrorFatal("z3 model has an empty universe for " + s);
            List<Expr<Sort>> elems = new ArrayList<Expr<Sort>>(Arrays.asList(univ));
            Collections.sort(elems, byName);
            for (Expr<Sort> e : elems) result.addElem(e.toString(), s);
            univs.put(s, elems);
        }
        for (String c : new TreeSet<String>(sig.getConstants().keySet()))
            result.addConstant(c, m.eval(constants.get(c), true).toString());
        for (Map.Entry<String, ConstList<String>> r : new TreeMap<String, ConstList<String>>(sig.getRelations()).entrySet()) {
            for (ConstList<Expr<Sort>> t : Helpers.product(universes(univs, r.getValue()))) {
                if (m.eval(ctx.mkApp(relations.get(r.getKey()), t.toArray(new Expr<?>[0])), true).isTrue())
                    result.addRelation(r.getKey(), names(t));
            }
        }
        for (Map.Entry<String, Pair<ConstList<String>, String>> f : new TreeMap<String, Pair<ConstList<String>, String>>(sig.getFunctions()).entrySet()) {
            for (ConstList<Expr<Sort>> t : Helpers.product(universes(univs, f.getValue().a))) {
                Expr<Sort> v = m.eval(ctx.mkApp(functions.get(f.getKey()), t.toArray(new Expr<?>[0])), true);
                result.addFunction(f.getKey(), names(t), v.toString());
            }
        }
        return result;
    }

    private static List<List<Expr<Sort>>> universes(Map<String, List<Expr<Sort>>> univs, List<String> sorts) {
        List<List<Expr<Sort>>> l = new Vector<List<Expr<Sort>>>();
        for (String s : sorts) l.add(univs.get(s));
        return l;
    }

    private static List<String> names(List<Expr<Sort>> tuple) {
        List<String> n = new Vector<String>();
        for (Expr<Sort> e : tuple) n.add(e.toString());
        return n;
    }

    @Override
    public void close() {
        ctx.close();
    }
}
