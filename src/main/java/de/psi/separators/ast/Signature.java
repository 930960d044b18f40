package de.psi.separators.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.Vector;

import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.ErrorSyntax;
import edu.mit.csail.sdg.alloy4.Pair;

/**
 * The vocabulary of a multi-sorted first-order structure: sorts, constants,
 * relations and functions. Names are unique across all four kinds.
 */
public final class Signature {

    public static final ConstList<String> RESERVED = ConstList.make(Arrays.asList(
            "", "sort", "relation", "constant", "function", "axiom", "model",
            "forall", "exists", "and", "or", "not", "implies", "="));

    private final Set<String> sorts = new LinkedHashSet<String>();
    private final List<String> sortNames = new Vector<String>();
    private final Map<String, Integer> sortIndices = new HashMap<String, Integer>();
    private final Map<String, String> constants = new LinkedHashMap<String, String>();
    private final Map<String, ConstList<String>> relations = new LinkedHashMap<String, ConstList<String>>();
    private final Map<String, Pair<ConstList<String>, String>> functions = new LinkedHashMap<String, Pair<ConstList<String>, String>>();

    public boolean isFreeName(String name) {
        return !RESERVED.contains(name) && !sorts.contains(name) && !constants.containsKey(name)
                && !relations.containsKey(name) && !functions.containsKey(name);
    }

    private void checkFree(String name) throws ErrorSyntax {
        if (!isFreeName(name))
            throw new ErrorSyntax("The name \"" + name + "\" is reserved or already declared.");
    }

    private void checkSort(String sort) throws ErrorSyntax {
        if (!sorts.contains(sort))
            throw new ErrorSyntax("The sort \"" + sort + "\" is not declared.");
    }

    /** Declares a sort. A signature that was finalized must be finalized again afterwards. */
    public void addSort(String sort) throws ErrorSyntax {
        checkFree(sort);
        sorts.add(sort);
        sortNames.clear();
        sortIndices.clear();
    }

    public void addConstant(String name, String sort) throws ErrorSyntax {
        checkSort(sort);
        checkFree(name);
        constants.put(name, sort);
    }

    public void addRelation(String name, String... sorts) throws ErrorSyntax {
        addRelation(name, Arrays.asList(sorts));
    }

    public void addRelation(String name, List<String> argSorts) throws ErrorSyntax {
        for (String s : argSorts) checkSort(s);
        checkFree(name);
        relations.put(name, ConstList.make(argSorts));
    }

    public void addFunction(String name, List<String> argSorts, String resultSort) throws ErrorSyntax {
        for (String s : argSorts) checkSort(s);
        checkSort(resultSort);
        checkFree(name);
        functions.put(name, new Pair<ConstList<String>, String>(ConstList.make(argSorts), resultSort));
    }

    /**
     * Fixes the order of the sorts (lexicographic) and gives every sort a dense index.
     */
    public void finalizeSorts() {
        sortNames.clear();
        sortIndices.clear();
        for (String s : new TreeSet<String>(sorts)) {
            sortIndices.put(s, sortNames.size());
            sortNames.add(s);
        }
    }

    public boolean isFinalized() {
        return sortNames.size() == sorts.size();
    }

    /** Returns the index of the sort, or -1 if it is unknown or the signature is not finalized. */
    public int sortIndex(String sort) {
        Integer i = sortIndices.get(sort);
        return i == null ? -1 : i;
    }

    public List<String> getSortNames() {
        return Collections.unmodifiableList(sortNames);
    }

    public Set<String> getSorts() {
        return Collections.unmodifiableSet(sorts);
    }

    public Map<String, String> getConstants() {
        return Collections.unmodifiableMap(constants);
    }

    public Map<String, ConstList<String>> getRelations() {
        return Collections.unmodifiableMap(relations);
    }

    public Map<String, Pair<ConstList<String>, String>> getFunctions() {
        return Collections.unmodifiableMap(functions);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("; Sig\n");
        for (String s : new TreeSet<String>(sorts))
            sb.append("(sort ").append(s).append(")\n");
        for (Map.Entry<String, String> c : new TreeMap<String, String>(constants).entrySet())
            sb.append("(constant ").append(c.getKey()).append(" ").append(c.getValue()).append(")\n");
        for (Map.Entry<String, ConstList<String>> r : new TreeMap<String, ConstList<String>>(relations).entrySet()) {
            sb.append("(relation ").append(r.getKey());
            for (String s : r.getValue()) sb.append(" ").append(s);
            sb.append(")\n");
        }
        for (Map.Entry<String, Pair<ConstList<String>, String>> f : new TreeMap<String, Pair<ConstList<String>, String>>(functions).entrySet()) {
            sb.append("(function ").append(f.getKey());
            for (String s : f.getValue().a) sb.append(" ").append(s);
            sb.append(" ").append(f.getValue().b).append(")\n");
        }
        return sb.toString();
    }
}
