package de.psi.separators.smt;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.Vector;

import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import de.psi.separators.ast.Formula;
import de.psi.separators.ast.Model;
import de.psi.separators.ast.Signature;
import de.psi.separators.check.Evaluator;
import de.psi.separators.util.Timer;
import edu.mit.csail.sdg.alloy4.Err;

import static de.psi.separators.ast.Formula.*;
import static de.psi.separators.ast.Term.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class Z3OracleTest {
    static final Formula IRREFLEXIVE = forall("x", "N", not(rel("edge", var("x"), var("x"))));
    static final Formula EMPTY = forall("x", "N", forall("y", "N", not(rel("edge", var("x"), var("y")))));
    static final Formula SOME = exists("x", "N", exists("y", "N", rel("edge", var("x"), var("y"))));
    static final Formula ANTISYMMETRIC = forall("x", "N", forall("y", "N", or(
            not(rel("edge", var("x"), var("y"))), not(rel("edge", var("y"), var("x"))), equal(var("x"), var("y")))));
    static final Formula SYMMETRIC = forall("x", "N", forall("y", "N",
            implies(rel("edge", var("x"), var("y")), rel("edge", var("y"), var("x")))));

    private static Signature sig;
    private static Z3Translator z3;
    private static Oracle oracle;

    @BeforeClass
    public static void setUp() throws Err {
        sig = new Signature();
        sig.addSort("N");
        sig.addRelation("edge", "N", "N");
        z3 = new Z3Translator(sig, Arrays.asList(IRREFLEXIVE));
        oracle = new Z3Oracle(z3, 100000);
    }

    @AfterClass
    public static void tearDown() {
        z3.close();
    }

    @Test
    public void weakCandidateGetsPositiveExample() throws Exception {
        EquivalenceResult r = oracle.findModelOrEquivalence(EMPTY, ANTISYMMETRIC, Timer.unlimited());
        assertEquals(EquivalenceResult.Kind.COUNTEREXAMPLE, r.getKind());
        Model m = r.getModel();
        assertEquals("+", m.getLabel());
        assertTrue(Evaluator.check(ANTISYMMETRIC, m));
        assertFalse(Evaluator.check(EMPTY, m));
        // minimized: one edge needs two elements
        assertEquals(2, m.size());
    }

    @Test
    public void strongCandidateGetsNegativeExample() throws Exception {
        EquivalenceResult r = oracle.findModelOrEquivalence(ANTISYMMETRIC, EMPTY, Timer.unlimited());
        Model m = r.getModel();
        assertEquals("-", m.getLabel());
        assertTrue(Evaluator.check(ANTISYMMETRIC, m));
        assertFalse(Evaluator.check(EMPTY, m));
    }

    @Test
    public void equivalentModuloAxioms() throws Exception {
        assertTrue(oracle.findModelOrEquivalence(TRUE, IRREFLEXIVE, Timer.unlimited()).isEquivalent());
        assertTrue(oracle.findModelOrEquivalence(EMPTY, not(SOME), Timer.unlimited()).isEquivalent());
    }

    @Test
    public void smallestCounterexample() throws Exception {
        EquivalenceResult r = oracle.findModelOrEquivalence(FALSE, TRUE, Timer.unlimited());
        assertEquals("+", r.getModel().getLabel());
        assertEquals(1, r.getModel().size());
    }

    private static Model randomModel(Random rnd) throws Err {
        Model m = new Model(sig);
        int n = 1 + rnd.nextInt(4);
        for (int i = 0; i < n; i++) m.addElem("e" + i, "N");
        for (int i = 0; i < n; i++)
            for (int j = 0; j < n; j++)
                if (i != j && rnd.nextBoolean()) m.addRelation("edge", Arrays.asList("e" + i, "e" + j));
        return m;
    }

    @Test
    public void soundOnRandomModels() throws Exception {
        Random rnd = new Random(42);
        List<Model> models = new Vector<Model>();
        for (int i = 0; i < 100; i++) models.add(randomModel(rnd));

        List<Formula> formulas = Arrays.asList(TRUE, FALSE, IRREFLEXIVE, EMPTY, SOME, ANTISYMMETRIC, SYMMETRIC);
        for (Formula a : formulas) {
            for (Formula b : formulas) {
                EquivalenceResult r = oracle.findModelOrEquivalence(a, b, Timer.unlimited());
                if (r.isEquivalent()) {
                    for (Model m : models)
                        assertEquals(a + " vs " + b + " on\n" + m, Evaluator.check(a, m), Evaluator.check(b, m));
                } else {
                    Model m = r.getModel();
                    assertTrue(Evaluator.check(IRREFLEXIVE, m));
                    boolean minus = m.getLabel().equals("-");
                    assertEquals(minus, Evaluator.check(a, m));
                    assertEquals(!minus, Evaluator.check(b, m));
                }
            }
        }
    }
}
