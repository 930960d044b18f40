package de.psi.separators.ast;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Vector;

import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.ConstList.TempList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.Pair;

public class Helpers {

    static <T extends Comparable<? super T>> int compareLists(List<T> a, List<T> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    public static <T extends Comparable<? super T>> Comparator<List<T>> listComparator() {
        return new Comparator<List<T>>() {
            @Override
            public int compare(List<T> a, List<T> b) {
                return compareLists(a, b);
            }
        };
    }

    /** All tuples of the cartesian product of the given lists, first position varying slowest. */
    public static <T> List<ConstList<T>> product(List<? extends List<T>> lists) {
        List<ConstList<T>> result = new Vector<ConstList<T>>();
        addProductTuples(lists, 0, new Vector<T>(), result);
        return result;
    }

    private static <T> void addProductTuples(List<? extends List<T>> lists, int depth, List<T> prefix, List<ConstList<T>> result) {
        if (depth == lists.size()) {
            result.add(ConstList.make(prefix));
            return;
        }
        for (T x : lists.get(depth)) {
            prefix.add(x);
            addProductTuples(lists, depth + 1, prefix, result);
            prefix.remove(prefix.size() - 1);
        }
    }

    /**
     * Whether every sort has an element, every constant, relation and function is
     * interpreted, and every function is defined on all argument tuples.
     */
    public static boolean isComplete(Model model, Signature sig) {
        for (String sort : sig.getSorts())
            if (model.elemsOfSort(sort).isEmpty()) return false;
        for (String c : sig.getConstants().keySet())
            if (!model.getConstants().containsKey(c)) return false;
        for (String rel : sig.getRelations().keySet())
            if (model.getRelation(rel) == null) return false;
        for (Map.Entry<String, Pair<ConstList<String>, String>> f : sig.getFunctions().entrySet()) {
            Map<ConstList<Integer>, Integer> table = model.getFunction(f.getKey());
            if (table == null) return false;
            for (ConstList<Integer> t : product(universes(model, f.getValue().a)))
                if (!table.containsKey(t)) return false;
        }
        return true;
    }

    public static List<List<Integer>> universes(Model model, List<String> sorts) {
        List<List<Integer>> univs = new Vector<List<Integer>>();
        for (String s : sorts) univs.add(model.elemsOfSort(s));
        return univs;
    }

    private static final Term.Visitor<Set<String>> termFreeVars = new Term.Visitor<Set<String>>() {
        @Override
        public Set<String> visit(Term.Var x) {
            Set<String> vs = new LinkedHashSet<String>();
            vs.add(x.getName());
            return vs;
        }

        @Override
        public Set<String> visit(Term.Func x) throws Err {
            Set<String> vs = new LinkedHashSet<String>();
            for (Term a : x.getArgs()) vs.addAll(visitThis(a));
            return vs;
        }
    };

    private static final Formula.Visitor<Set<String>> freeVars = new Formula.Visitor<Set<String>>() {
        private Set<String> junction(Formula.Junction x) throws Err {
            Set<String> vs = new LinkedHashSet<String>();
            for (Formula c : x.getChildren()) vs.addAll(visitThis(c));
            return vs;
        }

        private Set<String> terms(List<Term> ts) throws Err {
            Set<String> vs = new LinkedHashSet<String>();
            for (Term t : ts) vs.addAll(termFreeVars.visitThis(t));
            return vs;
        }

        private Set<String> quantified(Formula.Quantified x) throws Err {
            Set<String> vs = visitThis(x.getBody());
            vs.remove(x.getVar());
            return vs;
        }

        @Override
        public Set<String> visit(Formula.And x) throws Err { return junction(x); }

        @Override
        public Set<String> visit(Formula.Or x) throws Err { return junction(x); }

        @Override
        public Set<String> visit(Formula.Not x) throws Err { return visitThis(x.getBody()); }

        @Override
        public Set<String> visit(Formula.Equal x) throws Err {
            Set<String> vs = termFreeVars.visitThis(x.getLeft());
            vs.addAll(termFreeVars.visitThis(x.getRight()));
            return vs;
        }

        @Override
        public Set<String> visit(Formula.Relation x) throws Err { return terms(x.getArgs()); }

        @Override
        public Set<String> visit(Formula.Forall x) throws Err { return quantified(x); }

        @Override
        public Set<String> visit(Formula.Exists x) throws Err { return quantified(x); }
    };

    public static Set<String> freeVars(Term t) throws Err {
        return termFreeVars.visitThis(t);
    }

    public static Set<String> freeVars(Formula f) throws Err {
        return freeVars.visitThis(f);
    }

    public static Term renameFreeVars(Term t, final Map<String, String> mapping) throws Err {
        return new Term.Visitor<Term>() {
            @Override
            public Term visit(Term.Var x) {
                String to = mapping.get(x.getName());
                return to == null ? x : Term.var(to);
            }

            @Override
            public Term visit(Term.Func x) throws Err {
                TempList<Term> args = new TempList<Term>();
                for (Term a : x.getArgs()) args.add(visitThis(a));
                return Term.func(x.getName(), args.makeConst());
            }
        }.visitThis(t);
    }

    private static ConstList<Term> renameAll(List<Term> ts, Map<String, String> mapping) throws Err {
        TempList<Term> out = new TempList<Term>();
        for (Term t : ts) out.add(renameFreeVars(t, mapping));
        return out.makeConst();
    }

    /**
     * Renames free variables. Below a quantifier whose variable is a key of the
     * mapping, that one entry is left out; other entries still apply there, and
     * target names are not checked against deeper binders.
     */
    public static Formula renameFreeVars(Formula f, final Map<String, String> mapping) throws Err {
        return new Formula.Visitor<Formula>() {
            private List<Formula> children(Formula.Junction x) throws Err {
                TempList<Formula> out = new TempList<Formula>();
                for (Formula c : x.getChildren()) out.add(visitThis(c));
                return out.makeConst();
            }

            private Map<String, String> below(Formula.Quantified x) {
                if (!mapping.containsKey(x.getVar())) return mapping;
                Map<String, String> m = new HashMap<String, String>(mapping);
                m.remove(x.getVar());
                return m;
            }

            @Override
            public Formula visit(Formula.And x) throws Err { return Formula.and(children(x)); }

            @Override
            public Formula visit(Formula.Or x) throws Err { return Formula.or(children(x)); }

            @Override
            public Formula visit(Formula.Not x) throws Err { return Formula.not(visitThis(x.getBody())); }

            @Override
            public Formula visit(Formula.Equal x) throws Err {
                return Formula.equal(renameFreeVars(x.getLeft(), mapping), renameFreeVars(x.getRight(), mapping));
            }

            @Override
            public Formula visit(Formula.Relation x) throws Err {
                return new Formula.Relation(x.getName(), renameAll(x.getArgs(), mapping));
            }

            @Override
            public Formula visit(Formula.Forall x) throws Err {
                return Formula.forall(x.getVar(), x.getSort(), renameFreeVars(x.getBody(), below(x)));
            }

            @Override
            public Formula visit(Formula.Exists x) throws Err {
                return Formula.exists(x.getVar(), x.getSort(), renameFreeVars(x.getBody(), below(x)));
            }
        }.visitThis(f);
    }
}
