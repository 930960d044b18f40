package de.psi.separators.smt;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;
import edu.mit.csail.sdg.alloy4.ErrorSyntax;

import static de.psi.separators.smt.SExpr.call;
import static de.psi.separators.smt.SExpr.sym;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SExprTest {

    @Test
    public void simple() {
        SExpr e = call("=", sym("x"), call("f", sym("y")));
        assertEquals("(= x (f y))", e.toString());
    }

    @Test
    public void parseSkipsComments() throws ErrorSyntax {
        List<SExpr> top = SExpr.parse("; header\n(model\n; rep: @uc_N_0\n(declare-sort N 0)) |a b| \"s t\"");
        assertEquals(3, top.size());
        SExpr.SList model = (SExpr.SList) top.get(0);
        assertTrue(model.hasHead("model"));
        assertEquals(2, model.size());
        assertEquals("(declare-sort N 0)", model.get(1).toString());
        assertTrue(top.get(1).isSymbol("|a b|"));
        assertTrue(top.get(2).isSymbol("\"s t\""));
    }

    @Test(expected = ErrorSyntax.class)
    public void unbalanced() throws ErrorSyntax {
        SExpr.parse("(a (b)");
    }

    @Test(expected = ErrorSyntax.class)
    public void extraClose() throws ErrorSyntax {
        SExpr.parse("(a))");
    }

    private static String eval(String text, Map<String, String> env) throws Err {
        return SExprEvaluator.eval(env, SExpr.parse(text).get(0));
    }

    @Test
    public void evaluateDefinitionBodies() throws Err {
        Map<String, String> env = new HashMap<String, String>();
        env.put("_arg_1", "e0");
        env.put("_arg_2", "e1");
        assertEquals("true", eval("(and (= _arg_1 e0) (not (= _arg_2 e0)))", env));
        assertEquals("false", eval("(or (= _arg_1 e1) false)", env));
        assertEquals("e1", eval("(ite (= _arg_1 e0) _arg_2 _arg_1)", env));
        assertEquals("e5", eval("e5", env));
    }

    @Test(expected = ErrorFatal.class)
    public void unsupportedOperator() throws Err {
        eval("(distinct a b)", new HashMap<String, String>());
    }

    @Test(expected = ErrorFatal.class)
    public void wrongArity() throws Err {
        eval("(not a b)", new HashMap<String, String>());
    }
}
