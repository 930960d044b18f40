package de.psi.separators.smt;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.microsoft.z3.Status;

import de.psi.separators.ast.Formula;
import de.psi.separators.ast.Helpers;
import de.psi.separators.ast.Model;
import de.psi.separators.ast.Signature;
import de.psi.separators.check.Evaluator;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

import static de.psi.separators.ast.Formula.*;
import static de.psi.separators.ast.Term.func;
import static de.psi.separators.ast.Term.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class Z3TranslatorTest {

    private static Signature sig() throws Err {
        Signature sig = new Signature();
        sig.addSort("N");
        sig.addSort("C");
        sig.addConstant("start", "N");
        sig.addRelation("edge", "N", "N");
        sig.addFunction("color", Arrays.asList("N"), "C");
        return sig;
    }

    @Test
    public void extractedModelSatisfiesAssertions() throws Err {
        Signature sig = sig();
        List<Formula> axioms = Arrays.asList(
                exists("x", "N", not(equal(var("x"), var("start")))),
                forall("x", "N", exists("y", "N", rel("edge", var("x"), var("y")))),
                forall("x", "N", forall("y", "N", or(not(rel("edge", var("x"), var("y"))),
                        not(equal(func("color", var("x")), func("color", var("y"))))))));
        Z3Translator z3 = new Z3Translator(sig, axioms);
        try {
            assertEquals(Status.SATISFIABLE, z3.getSolver().check());
            Model m = z3.extractModel(z3.getSolver().getModel(), "x");
            assertEquals("x", m.getLabel());
            assertTrue(Helpers.isComplete(m, sig));
            assertTrue(m.elemsOfSort("N").size() >= 2);
            assertTrue(m.elemsOfSort("C").size() >= 2);
            for (Formula ax : axioms) assertTrue(ax.toString(), Evaluator.check(ax, m));
        } finally {
            z3.close();
        }
    }

    @Test
    public void sortBoundsLimitUniverses() throws Err {
        Signature sig = sig();
        Z3Translator z3 = new Z3Translator(sig, Collections.<Formula>emptyList());
        try {
            z3.push();
            z3.assertSortBounds(1);
            z3.getSolver().add(z3.translate(exists("x", "N", not(equal(var("x"), var("start"))))));
            assertEquals(Status.UNSATISFIABLE, z3.getSolver().check());
            z3.pop();
            z3.push();
            z3.assertSortBounds(2);
            z3.getSolver().add(z3.translate(exists("x", "N", not(equal(var("x"), var("start"))))));
            assertEquals(Status.SATISFIABLE, z3.getSolver().check());
            Model m = z3.extractModel(z3.getSolver().getModel(), "");
            assertEquals(2, m.elemsOfSort("N").size());
            z3.pop();
        } finally {
            z3.close();
        }
    }

    @Test
    public void emptyJunctions() throws Err {
        Z3Translator z3 = new Z3Translator(sig(), Collections.<Formula>emptyList());
        try {
            assertTrue(z3.translate(TRUE).isTrue());
            assertTrue(z3.translate(FALSE).isFalse());
        } finally {
            z3.close();
        }
    }

    @Test
    public void serialisedSolverDeclaresSymbols() throws Err {
        Z3Translator z3 = new Z3Translator(sig(), Arrays.asList(forall("x", "N", rel("edge", var("x"), var("start")))));
        try {
            String smt = z3.toSmtLib();
            assertTrue(smt, smt.contains("(declare-sort N"));
            assertTrue(smt, smt.contains("edge"));
            assertTrue(smt, smt.contains("forall"));
        } finally {
            z3.close();
        }
    }

    @Test(expected = ErrorFatal.class)
    public void unboundVariable() throws Err {
        Z3Translator z3 = new Z3Translator(sig(), Collections.<Formula>emptyList());
        try {
            z3.translate(rel("edge", var("x"), var("start")));
        } finally {
            z3.close();
        }
    }

    @Test(expected = ErrorFatal.class)
    public void unknownRelation() throws Err {
        Z3Translator z3 = new Z3Translator(sig(), Collections.<Formula>emptyList());
        try {
            z3.translate(forall("x", "N", rel("path", var("x"))));
        } finally {
            z3.close();
        }
    }

    @Test
    public void malformedAxiomFailsConstruction() throws Err {
        try {
            new Z3Translator(sig(), Arrays.asList(forall("x", "N", rel("path", var("x")))));
            throw new AssertionError("axiom over an unknown relation was accepted");
        } catch (ErrorFatal expected) {
        }
        Z3Translator z3 = new Z3Translator(sig(), Arrays.asList(forall("x", "N", rel("edge", var("x"), var("x")))));
        try {
            assertEquals(Status.SATISFIABLE, z3.getSolver().check());
        } finally {
            z3.close();
        }
    }

    @Test
    public void bindingsArePoppedAfterQuantifiers() throws Err {
        Z3Translator z3 = new Z3Translator(sig(), Collections.<Formula>emptyList());
        try {
            z3.translate(forall("x", "N", rel("edge", var("x"), var("x"))));
            try {
                z3.translate(rel("edge", var("x"), var("x")));
                throw new AssertionError("x is still bound");
            } catch (ErrorFatal expected) {
            }
        } finally {
            z3.close();
        }
    }
}
