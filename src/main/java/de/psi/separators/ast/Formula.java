package de.psi.separators.ast;

import java.util.Arrays;
import java.util.List;

import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;

/**
 * A multi-sorted first-order formula. The set of variants is closed: every
 * traversal goes through {@link Visitor}, which has one abstract method per variant.
 * Formulas are immutable and compare structurally.
 */
public abstract class Formula implements Comparable<Formula> {

    public static final Formula TRUE = new And(ConstList.<Formula>make());
    public static final Formula FALSE = new Or(ConstList.<Formula>make());

    public static Formula and(Formula... fs) {
        return new And(Arrays.asList(fs));
    }

    public static Formula and(List<Formula> fs) {
        return new And(fs);
    }

    public static Formula or(Formula... fs) {
        return new Or(Arrays.asList(fs));
    }

    public static Formula or(List<Formula> fs) {
        return new Or(fs);
    }

    public static Formula not(Formula f) {
        return new Not(f);
    }

    public static Formula implies(Formula a, Formula b) {
        return or(not(a), b);
    }

    public static Formula equal(Term a, Term b) {
        return new Equal(a, b);
    }

    public static Formula rel(String name, Term... args) {
        return new Relation(name, Arrays.asList(args));
    }

    public static Formula forall(String var, String sort, Formula body) {
        return new Forall(var, sort, body);
    }

    public static Formula exists(String var, String sort, Formula body) {
        return new Exists(var, sort, body);
    }

    private Formula() {
    }

    /** Orders the variants by name first, then by their fields. */
    abstract String tag();

    abstract int compareSameTag(Formula that);

    @Override
    public final int compareTo(Formula that) {
        int c = tag().compareTo(that.tag());
        return c != 0 ? c : compareSameTag(that);
    }

    public abstract <T> T accept(Visitor<T> visitor) throws Err;

    /** Infix form, e.g. {@code \A x \in N : (edge = x x => x = x)}. */
    public abstract String pretty();

    /** Common base of {@link And} and {@link Or}. */
    public static abstract class Junction extends Formula {
        private final ConstList<Formula> children;

        private Junction(List<Formula> children) {
            this.children = ConstList.make(children);
        }

        public ConstList<Formula> getChildren() {
            return children;
        }

        @Override
        int compareSameTag(Formula that) {
            return Helpers.compareLists(children, ((Junction) that).children);
        }

        @Override
        public boolean equals(Object o) {
            return o != null && o.getClass() == getClass() && ((Junction) o).children.equals(children);
        }

        @Override
        public int hashCode() {
            return tag().hashCode() * 31 + children.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(").append(tag().toLowerCase());
            for (Formula f : children) sb.append(" ").append(f);
            return sb.append(")").toString();
        }

        String prettyJoin(String op) {
            StringBuilder sb = new StringBuilder("(");
            boolean first = true;
            for (Formula f : children) {
                if (first) first = false; else sb.append(op);
                sb.append(f.pretty());
            }
            return sb.append(")").toString();
        }
    }

    public static final class And extends Junction {
        public And(List<Formula> conjuncts) {
            super(conjuncts);
        }

        @Override
        String tag() {
            return "And";
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public String pretty() {
            List<Formula> c = getChildren();
            if (c.isEmpty()) return "true";
            if (c.size() == 1) return c.get(0).pretty();
            return prettyJoin(" /\\ ");
        }
    }

    public static final class Or extends Junction {
        public Or(List<Formula> disjuncts) {
            super(disjuncts);
        }

        @Override
        String tag() {
            return "Or";
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public String pretty() {
            List<Formula> c = getChildren();
            if (c.isEmpty()) return "false";
            if (c.size() == 1) return c.get(0).pretty();
            if (c.size() == 2) {
                Formula a = c.get(0), b = c.get(1);
                if (a instanceof Not && !(b instanceof Not))
                    return "(" + ((Not) a).getBody().pretty() + " => " + b.pretty() + ")";
                if (b instanceof Not && !(a instanceof Not))
                    return "(" + ((Not) b).getBody().pretty() + " => " + a.pretty() + ")";
            }
            return prettyJoin(" \\/ ");
        }
    }

    public static final class Not extends Formula {
        private final Formula body;

        public Not(Formula body) {
            if (body == null) throw new NullPointerException();
            this.body = body;
        }

        public Formula getBody() {
            return body;
        }

        @Override
        String tag() {
            return "Not";
        }

        @Override
        int compareSameTag(Formula that) {
            return body.compareTo(((Not) that).body);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Not && ((Not) o).body.equals(body);
        }

        @Override
        public int hashCode() {
            return ~body.hashCode();
        }

        @Override
        public String toString() {
            return "(not " + body + ")";
        }

        @Override
        public String pretty() {
            if (body instanceof Relation) {
                Relation r = (Relation) body;
                return r.getName() + " # " + r.prettyArgs();
            }
            if (body instanceof Equal) {
                Equal e = (Equal) body;
                return e.getLeft().pretty() + " # " + e.getRight().pretty();
            }
            return "~(" + body.pretty() + ")";
        }
    }

    public static final class Equal extends Formula {
        private final Term left;
        private final Term right;

        public Equal(Term left, Term right) {
            if (left == null || right == null) throw new NullPointerException();
            this.left = left;
            this.right = right;
        }

        public Term getLeft() {
            return left;
        }

        public Term getRight() {
            return right;
        }

        @Override
        String tag() {
            return "Equal";
        }

        @Override
        int compareSameTag(Formula that) {
            Equal e = (Equal) that;
            int c = left.compareTo(e.left);
            return c != 0 ? c : right.compareTo(e.right);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Equal)) return false;
            Equal e = (Equal) o;
            return left.equals(e.left) && right.equals(e.right);
        }

        @Override
        public int hashCode() {
            return 17 * left.hashCode() + right.hashCode();
        }

        @Override
        public String toString() {
            return "(= " + left + " " + right + ")";
        }

        @Override
        public String pretty() {
            return left.pretty() + " = " + right.pretty();
        }
    }

    public static final class Relation extends Formula {
        private final String name;
        private final ConstList<Term> args;

        public Relation(String name, List<Term> args) {
            if (name == null) throw new NullPointerException();
            this.name = name;
            this.args = ConstList.make(args);
        }

        public String getName() {
            return name;
        }

        public ConstList<Term> getArgs() {
            return args;
        }

        @Override
        String tag() {
            return "Relation";
        }

        @Override
        int compareSameTag(Formula that) {
            Relation r = (Relation) that;
            int c = name.compareTo(r.name);
            return c != 0 ? c : Helpers.compareLists(args, r.args);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Relation)) return false;
            Relation r = (Relation) o;
            return name.equals(r.name) && args.equals(r.args);
        }

        @Override
        public int hashCode() {
            return 13 * name.hashCode() + args.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(").append(name);
            for (Term a : args) sb.append(" ").append(a);
            return sb.append(")").toString();
        }

        String prettyArgs() {
            StringBuilder sb = new StringBuilder();
            for (Term a : args) {
                if (sb.length() > 0) sb.append(" ");
                sb.append(a.pretty());
            }
            return sb.toString();
        }

        @Override
        public String pretty() {
            return name + " = " + prettyArgs();
        }
    }

    /** Common base of {@link Forall} and {@link Exists}. */
    public static abstract class Quantified extends Formula {
        private final String var;
        private final String sort;
        private final Formula body;

        private Quantified(String var, String sort, Formula body) {
            if (var == null || sort == null || body == null) throw new NullPointerException();
            this.var = var;
            this.sort = sort;
            this.body = body;
        }

        public String getVar() {
            return var;
        }

        public String getSort() {
            return sort;
        }

        public Formula getBody() {
            return body;
        }

        @Override
        int compareSameTag(Formula that) {
            Quantified q = (Quantified) that;
            int c = var.compareTo(q.var);
            if (c == 0) c = sort.compareTo(q.sort);
            return c != 0 ? c : body.compareTo(q.body);
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || o.getClass() != getClass()) return false;
            Quantified q = (Quantified) o;
            return var.equals(q.var) && sort.equals(q.sort) && body.equals(q.body);
        }

        @Override
        public int hashCode() {
            return ((tag().hashCode() * 31 + var.hashCode()) * 31 + sort.hashCode()) * 31 + body.hashCode();
        }

        @Override
        public String toString() {
            return "(" + tag().toLowerCase() + " " + var + " " + sort + " " + body + ")";
        }
    }

    public static final class Forall extends Quantified {
        public Forall(String var, String sort, Formula body) {
            super(var, sort, body);
        }

        @Override
        String tag() {
            return "Forall";
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public String pretty() {
            return "\\A " + getVar() + " \\in " + getSort() + " : " + getBody().pretty();
        }
    }

    public static final class Exists extends Quantified {
        public Exists(String var, String sort, Formula body) {
            super(var, sort, body);
        }

        @Override
        String tag() {
            return "Exists";
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public String pretty() {
            return "\\E " + getVar() + " \\in " + getSort() + " : " + getBody().pretty();
        }
    }

    public static abstract class Visitor<T> {
        public final T visitThis(Formula x) throws Err { return x.accept(this); }

        public abstract T visit(And x) throws Err;

        public abstract T visit(Or x) throws Err;

        public abstract T visit(Not x) throws Err;

        public abstract T visit(Equal x) throws Err;

        public abstract T visit(Relation x) throws Err;

        public abstract T visit(Forall x) throws Err;

        public abstract T visit(Exists x) throws Err;
    }
}
