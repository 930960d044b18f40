package de.psi.separators.ast;

import java.util.Arrays;

import org.junit.Test;

import edu.mit.csail.sdg.alloy4.ErrorSyntax;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SignatureTest {

    private static Signature graph() throws ErrorSyntax {
        Signature sig = new Signature();
        sig.addSort("node");
        sig.addSort("edge_t");
        sig.addConstant("root", "node");
        sig.addRelation("edge", "node", "node");
        sig.addFunction("succ", Arrays.asList("node"), "node");
        return sig;
    }

    @Test
    public void declarationsAreVisible() throws ErrorSyntax {
        Signature sig = graph();
        assertTrue(sig.getSorts().contains("node"));
        assertEquals("node", sig.getConstants().get("root"));
        assertEquals(Arrays.asList("node", "node"), sig.getRelations().get("edge"));
        assertEquals("node", sig.getFunctions().get("succ").b);
    }

    @Test
    public void namesAreDisjoint() throws ErrorSyntax {
        Signature sig = graph();
        assertFalse(sig.isFreeName("edge"));
        assertFalse(sig.isFreeName("root"));
        assertFalse(sig.isFreeName("forall"));
        assertFalse(sig.isFreeName(""));
        assertTrue(sig.isFreeName("other"));
    }

    @Test(expected = ErrorSyntax.class)
    public void relationNameClashesWithConstant() throws ErrorSyntax {
        graph().addRelation("root", "node");
    }

    @Test(expected = ErrorSyntax.class)
    public void reservedWordIsRejected() throws ErrorSyntax {
        graph().addSort("and");
    }

    @Test(expected = ErrorSyntax.class)
    public void undeclaredSortIsRejected() throws ErrorSyntax {
        graph().addConstant("c", "missing");
    }

    @Test
    public void finalizeSortsIndexesLexicographically() throws ErrorSyntax {
        Signature sig = graph();
        sig.finalizeSorts();
        assertTrue(sig.isFinalized());
        assertEquals(Arrays.asList("edge_t", "node"), sig.getSortNames());
        assertEquals(0, sig.sortIndex("edge_t"));
        assertEquals(1, sig.sortIndex("node"));
        assertEquals(-1, sig.sortIndex("missing"));
    }

    @Test
    public void printing() throws ErrorSyntax {
        assertEquals("; Sig\n(sort edge_t)\n(sort node)\n(constant root node)\n(relation edge node node)\n"
                + "(function succ node node)\n", graph().toString());
    }
}
