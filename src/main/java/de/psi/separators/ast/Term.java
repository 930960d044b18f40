package de.psi.separators.ast;

import java.util.Arrays;
import java.util.List;

import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;

/**
 * A first-order term: either a variable (which also names constants) or the
 * application of a function symbol. Terms are immutable and compare structurally;
 * variables order before applications.
 */
public abstract class Term implements Comparable<Term> {

    public static Term var(String name) {
        return new Var(name);
    }

    public static Term func(String name, Term... args) {
        return new Func(name, Arrays.asList(args));
    }

    public static Term func(String name, List<Term> args) {
        return new Func(name, args);
    }

    private Term() {
    }

    public static final class Var extends Term {
        private final String name;

        public Var(String name) {
            if (name == null) throw new NullPointerException();
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Var && ((Var) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public int compareTo(Term that) {
            if (that instanceof Func) return -1;
            return name.compareTo(((Var) that).name);
        }

        @Override
        public String pretty() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Func extends Term {
        private final String name;
        private final ConstList<Term> args;

        public Func(String name, List<Term> args) {
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
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Func)) return false;
            Func that = (Func) o;
            return name.equals(that.name) && args.equals(that.args);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + args.hashCode();
        }

        @Override
        public int compareTo(Term that) {
            if (that instanceof Var) return 1;
            Func f = (Func) that;
            int c = name.compareTo(f.name);
            return c != 0 ? c : Helpers.compareLists(args, f.args);
        }

        @Override
        public String pretty() {
            StringBuilder sb = new StringBuilder(name).append("[");
            boolean first = true;
            for (Term a : args) {
                if (first) first = false; else sb.append(", ");
                sb.append(a.pretty());
            }
            return sb.append("]").toString();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(").append(name);
            for (Term a : args) sb.append(" ").append(a);
            return sb.append(")").toString();
        }
    }

    public static abstract class Visitor<T> {
        public final T visitThis(Term x) throws Err { return x.accept(this); }

        public abstract T visit(Var x) throws Err;

        public abstract T visit(Func x) throws Err;
    }

    public abstract <T> T accept(Visitor<T> visitor) throws Err;

    /** Human readable form, {@code f[a, b]}. */
    public abstract String pretty();
}
