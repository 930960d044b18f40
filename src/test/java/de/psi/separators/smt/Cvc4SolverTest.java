package de.psi.separators.smt;

import java.util.Arrays;
import java.util.List;
import java.util.Vector;

import org.junit.Assume;
import org.junit.Test;

import com.microsoft.z3.Status;

import de.psi.separators.ast.Formula;
import de.psi.separators.ast.Model;
import de.psi.separators.ast.Signature;
import de.psi.separators.util.Timer;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.Pair;

import static de.psi.separators.ast.Formula.*;
import static de.psi.separators.ast.Term.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class Cvc4SolverTest {

    private static Signature sig() throws Err {
        Signature sig = new Signature();
        sig.addSort("N");
        sig.addSort("M");
        sig.addConstant("c", "N");
        sig.addConstant("d", "M");
        sig.addRelation("edge", "N", "N");
        sig.addFunction("f", Arrays.asList("N"), "N");
        sig.addFunction("g", Arrays.asList("N"), "M");
        return sig;
    }

    @Test
    public void verdicts() throws Err {
        assertEquals(Status.UNSATISFIABLE, Cvc4Solver.interpret(Arrays.asList("unsat"), sig()).a);
        assertEquals(Status.UNKNOWN, Cvc4Solver.interpret(Arrays.asList("", "unknown"), sig()).a);
        Pair<Status, Model> weird = Cvc4Solver.interpret(Arrays.asList("(error \"parse error\")"), sig());
        assertEquals(Status.UNKNOWN, weird.a);
        assertNull(weird.b);
        assertEquals(Status.UNKNOWN, Cvc4Solver.interpret(Arrays.<String>asList(), sig()).a);
    }

    @Test
    public void satCarriesModel() throws Err {
        List<String> lines = new Vector<String>();
        lines.add("sat");
        lines.addAll(Cvc4ModelParserTest.OUTPUT);
        Pair<Status, Model> r = Cvc4Solver.interpret(lines, sig());
        assertEquals(Status.SATISFIABLE, r.a);
        assertNotNull(r.b);
        assertEquals(3, r.b.size());
    }

    @Test
    public void missingExecutableIsUnknown() throws Err {
        Cvc4Solver cvc4 = new Cvc4Solver("/nonexistent/cvc4-binary");
        assertTrue(!cvc4.isPresent());
        SmtScript script = SmtScript.fromZ3("(declare-sort N 0)\n");
        assertEquals(Status.UNKNOWN, cvc4.solve(script, sig(), Timer.unlimited()).a);
    }

    @Test
    public void oracleWithInstalledCvc4() throws Exception {
        Cvc4Solver cvc4 = new Cvc4Solver("cvc4");
        Assume.assumeTrue(cvc4.isPresent());

        Signature sig = new Signature();
        sig.addSort("N");
        sig.addRelation("edge", "N", "N");
        List<Formula> axioms = Arrays.asList(forall("x", "N", not(rel("edge", var("x"), var("x")))));
        Formula empty = forall("x", "N", forall("y", "N", not(rel("edge", var("x"), var("y")))));
        Formula some = exists("x", "N", exists("y", "N", rel("edge", var("x"), var("y"))));

        Z3Translator z3 = new Z3Translator(sig, axioms);
        try {
            Timer t = new Timer(60000);
            EquivalenceResult r = new Cvc4Oracle(z3, cvc4).findModelOrEquivalence(empty, some, t);
            assertEquals(EquivalenceResult.Kind.COUNTEREXAMPLE, r.getKind());
            assertEquals("-", r.getModel().getLabel());
            assertTrue(new Cvc4Oracle(z3, cvc4).findModelOrEquivalence(empty, not(some), t).isEquivalent());
        } finally {
            z3.close();
        }
    }
}
