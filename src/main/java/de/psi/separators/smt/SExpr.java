package de.psi.separators.smt;

import java.util.Arrays;
import java.util.List;
import java.util.Vector;

import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorSyntax;

/**
 * A parenthesized expression as found in SMT-LIB output: either a symbol or a
 * list of expressions.
 */
public abstract class SExpr {

    public static SExpr sym(String name) {
        return new Symbol(name);
    }

    public static SExpr call(String funcName, SExpr... args) {
        List<SExpr> l = new Vector<SExpr>();
        l.add(new Symbol(funcName));
        l.addAll(Arrays.asList(args));
        return new SList(l);
    }

    public static class Symbol extends SExpr {
        private final String name;

        public Symbol(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean isSymbol(String name) {
            return this.name.equals(name);
        }

        @Override
        public String toString() {
            return name;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }
    }

    public static class SList extends SExpr {
        private final List<SExpr> items;

        public SList(List<SExpr> items) {
            this.items = items;
        }

        public List<SExpr> getItems() {
            return items;
        }

        public int size() {
            return items.size();
        }

        public SExpr get(int i) {
            return items.get(i);
        }

        /** Whether the first item is the given symbol. */
        public boolean hasHead(String name) {
            return !items.isEmpty() && items.get(0).isSymbol(name);
        }

        @Override
        public String toString() {
            boolean first = true;
            StringBuilder sb = new StringBuilder();
            sb.append("(");
            for (SExpr expr : items) {
                if (first) first = false; else sb.append(" ");
                sb.append(expr.toString());
            }
            sb.append(")");
            return sb.toString();
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }
    }

    public static abstract class Visitor<T> {
        public final T visitThis(SExpr x) throws Err { return x.accept(this); }

        public abstract T visit(Symbol symbol) throws Err;

        public abstract T visit(SList list) throws Err;
    }

    public abstract <T> T accept(Visitor<T> visitor) throws Err;

    public boolean isSymbol(String name) {
        return false;
    }

    /**
     * Parses every top-level expression of the text. Line comments start with
     * {@code ;}; {@code |quoted symbols|} and {@code "strings"} are kept as one symbol.
     */
    public static List<SExpr> parse(String text) throws ErrorSyntax {
        List<SExpr> top = new Vector<SExpr>();
        List<List<SExpr>> open = new Vector<List<SExpr>>();
        int i = 0, n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == ';') {
                while (i < n && text.charAt(i) != '\n') i++;
            } else if (c == '(') {
                open.add(new Vector<SExpr>());
                i++;
            } else if (c == ')') {
                if (open.isEmpty()) throw new ErrorSyntax("Unbalanced ')' at offset " + i);
                SExpr list = new SList(open.remove(open.size() - 1));
                (open.isEmpty() ? top : open.get(open.size() - 1)).add(list);
                i++;
            } else {
                int start = i;
                if (c == '|' || c == '"') {
                    int end = text.indexOf(c, i + 1);
                    if (end < 0) throw new ErrorSyntax("Unterminated " + c + " at offset " + i);
                    i = end + 1;
                } else {
                    while (i < n && !Character.isWhitespace(text.charAt(i)) && "();".indexOf(text.charAt(i)) < 0) i++;
                }
                SExpr sym = new Symbol(text.substring(start, i));
                (open.isEmpty() ? top : open.get(open.size() - 1)).add(sym);
            }
        }
        if (!open.isEmpty()) throw new ErrorSyntax("Missing ')' at end of input");
        return top;
    }
}
