package de.psi.separators.smt;

import java.util.List;
import java.util.Vector;

import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * An SMT-LIB script in the dialect cvc4 accepts, built from a Z3 solver dump.
 */
public class SmtScript {
    private final List<String> lines = new Vector<String>();

    private SmtScript() {
        lines.add("(set-logic UF)");
    }

    public static SmtScript fromZ3(String smtlib) throws ErrorFatal {
        SmtScript script = new SmtScript();
        boolean checkSat = false;
        for (String line : smtlib.split("\n")) {
            String st = line.trim();
            if (st.isEmpty() || st.startsWith(";") || st.startsWith("(set-info ")) continue;
            if (st.contains("@")) throw new ErrorFatal("Z3 internal name in SMT-LIB output: " + st);
            if (st.startsWith("(declare-sort ") && !st.endsWith(" 0)")) {
                if (!st.endsWith(")")) throw new ErrorFatal("Malformed sort declaration: " + st);
                st = st.substring(0, st.length() - 1) + " 0)";
            }
            if (st.equals("(check-sat)")) checkSat = true;
            script.lines.add(st);
        }
        // the Java API prints assertions only
        if (!checkSat) script.lines.add("(check-sat)");
        return script;
    }

    public List<String> getLines() {
        return lines;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String l : lines) {
            sb.append(l);
            sb.append('\n');
        }
        return sb.toString();
    }
}
