package de.psi.separators.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.Vector;

import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.ConstList.TempList;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * A finite structure over a {@link Signature}. Elements are numbered densely in the
 * order they are added; relations and functions are stored over element ids.
 * <p>
 * The label marks the role of the model: "+" for a positive example, "-" for a
 * negative one, or whatever label an example file gave it. A model must not be
 * changed once it has been handed to a separator.
 */
public final class Model {
    private final Signature sig;
    private String label = "";
    private final List<String> names = new Vector<String>();
    private final List<String> sorts = new Vector<String>();
    private final Map<String, Integer> elems = new HashMap<String, Integer>();
    private final Map<String, List<Integer>> elemsOfSort = new LinkedHashMap<String, List<Integer>>();
    private final Map<String, Integer> constants = new LinkedHashMap<String, Integer>();
    private final Map<String, Set<ConstList<Integer>>> relations = new LinkedHashMap<String, Set<ConstList<Integer>>>();
    private final Map<String, Map<ConstList<Integer>, Integer>> functions = new LinkedHashMap<String, Map<ConstList<Integer>, Integer>>();

    public Model(Signature sig) {
        this.sig = sig;
        for (String r : sig.getRelations().keySet())
            relations.put(r, new LinkedHashSet<ConstList<Integer>>());
        for (String f : sig.getFunctions().keySet())
            functions.put(f, new LinkedHashMap<ConstList<Integer>, Integer>());
    }

    public Signature getSignature() {
        return sig;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label == null ? "" : label;
    }

    /** Adds a new element; returns false and changes nothing if the name is taken. */
    public boolean addElem(String name, String sort) throws ErrorFatal {
        if (elems.containsKey(name)) return false;
        if (!sig.getSorts().contains(sort)) throw new ErrorFatal("Element " + name + " has undeclared sort " + sort);
        int id = names.size();
        elems.put(name, id);
        names.add(name);
        sorts.add(sort);
        List<Integer> univ = elemsOfSort.get(sort);
        if (univ == null) elemsOfSort.put(sort, univ = new Vector<Integer>());
        univ.add(id);
        return true;
    }

    /** Assigns a constant; returns false and changes nothing if it is already assigned. */
    public boolean addConstant(String name, String elem) throws ErrorFatal {
        if (constants.containsKey(name)) return false;
        constants.put(name, idOf(elem));
        return true;
    }

    public void addRelation(String rel, List<String> args) throws ErrorFatal {
        Set<ConstList<Integer>> tuples = relations.get(rel);
        if (tuples == null) throw new ErrorFatal("Relation " + rel + " is not in the signature");
        tuples.add(tuple(args));
    }

    /** Defines one entry of a function table; returns false and changes nothing if it is already defined. */
    public boolean addFunction(String func, List<String> args, String result) throws ErrorFatal {
        Map<ConstList<Integer>, Integer> table = functions.get(func);
        if (table == null) throw new ErrorFatal("Function " + func + " is not in the signature");
        ConstList<Integer> t = tuple(args);
        if (table.containsKey(t)) return false;
        table.put(t, idOf(result));
        return true;
    }

    private ConstList<Integer> tuple(List<String> args) throws ErrorFatal {
        TempList<Integer> t = new TempList<Integer>();
        for (String a : args) t.add(idOf(a));
        return t.makeConst();
    }

    private int idOf(String elem) throws ErrorFatal {
        Integer id = elems.get(elem);
        if (id == null) throw new ErrorFatal("Unknown element " + elem);
        return id;
    }

    public int size() {
        return names.size();
    }

    public String nameOf(int id) {
        return names.get(id);
    }

    /** Returns the id of the named element, or null. */
    public Integer getElem(String name) {
        return elems.get(name);
    }

    /** Returns the sort of the named element, or null. */
    public String sortOf(String name) {
        Integer id = elems.get(name);
        return id == null ? null : sorts.get(id);
    }

    public List<Integer> elemsOfSort(String sort) {
        List<Integer> univ = elemsOfSort.get(sort);
        return univ == null ? Collections.<Integer>emptyList() : Collections.unmodifiableList(univ);
    }

    /** Universe of the sort at the given index of the (finalized) signature. */
    public List<Integer> elemsOfSortIndex(int index) {
        return elemsOfSort(sig.getSortNames().get(index));
    }

    public Map<String, Integer> getConstants() {
        return Collections.unmodifiableMap(constants);
    }

    /** Returns the tuples of the relation, or null if the relation is unknown. */
    public Set<ConstList<Integer>> getRelation(String rel) {
        Set<ConstList<Integer>> tuples = relations.get(rel);
        return tuples == null ? null : Collections.unmodifiableSet(tuples);
    }

    /** Returns the table of the function, or null if the function is unknown. */
    public Map<ConstList<Integer>, Integer> getFunction(String func) {
        Map<ConstList<Integer>, Integer> table = functions.get(func);
        return table == null ? null : Collections.unmodifiableMap(table);
    }

    private String tupleNames(List<Integer> t) {
        StringBuilder sb = new StringBuilder();
        for (int i : t) {
            if (sb.length() > 0) sb.append(" ");
            sb.append(names.get(i));
        }
        return sb.toString();
    }

    /** Prints the model in the {@code (model label ((e S) ...) facts...)} text form. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(model ").append(label).append("\n  (");
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) sb.append(" ");
            sb.append("(").append(names.get(i)).append(" ").append(sorts.get(i)).append(")");
        }
        sb.append(")\n");
        for (Map.Entry<String, Integer> c : new TreeMap<String, Integer>(constants).entrySet())
            sb.append("  (= ").append(c.getKey()).append(" ").append(names.get(c.getValue())).append(")\n");
        for (Map.Entry<String, Set<ConstList<Integer>>> r : new TreeMap<String, Set<ConstList<Integer>>>(relations).entrySet()) {
            List<ConstList<Integer>> tuples = new ArrayList<ConstList<Integer>>(r.getValue());
            Collections.sort(tuples, Helpers.<Integer>listComparator());
            for (ConstList<Integer> t : tuples)
                sb.append("  (").append(r.getKey()).append(" ").append(tupleNames(t)).append(")\n");
        }
        for (Map.Entry<String, Map<ConstList<Integer>, Integer>> f : new TreeMap<String, Map<ConstList<Integer>, Integer>>(functions).entrySet()) {
            List<ConstList<Integer>> args = new ArrayList<ConstList<Integer>>(f.getValue().keySet());
            Collections.sort(args, Helpers.<Integer>listComparator());
            for (ConstList<Integer> t : args) {
                sb.append("  (= (").append(f.getKey());
                if (!t.isEmpty()) sb.append(" ").append(tupleNames(t));
                sb.append(") ").append(names.get(f.getValue().get(t))).append(")\n");
            }
        }
        return sb.append(")\n").toString();
    }
}
