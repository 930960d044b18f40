package de.psi.separators.ast;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Vector;

import edu.mit.csail.sdg.alloy4.Pair;

/**
 * Sorts of the variables in scope while walking a formula. Quantifiers bind on
 * the way down and pop on the way up; a rebound name gets its outer sort back on pop.
 */
public final class Environment {
    private final Signature sig;
    private final Map<String, String> bound = new HashMap<String, String>();
    // (name, sort it shadowed or null)
    private final List<Pair<String, String>> stack = new Vector<Pair<String, String>>();

    public Environment(Signature sig) {
        this.sig = sig;
    }

    public Signature getSignature() {
        return sig;
    }

    public void bind(String var, String sort) {
        stack.add(new Pair<String, String>(var, bound.get(var)));
        bound.put(var, sort);
    }

    public void pop() {
        if (stack.isEmpty()) throw new IllegalStateException("pop() without a matching bind()");
        Pair<String, String> top = stack.remove(stack.size() - 1);
        if (top.b == null) bound.remove(top.a); else bound.put(top.a, top.b);
    }

    public int depth() {
        return stack.size();
    }

    /** Returns the sort of a bound variable or constant, or null if the name is neither. */
    public String lookupVar(String name) {
        String s = bound.get(name);
        return s != null ? s : sig.getConstants().get(name);
    }
}
