package de.psi.separators.ast;

import org.junit.Test;

import edu.mit.csail.sdg.alloy4.ErrorSyntax;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class EnvironmentTest {

    private static Signature sig() throws ErrorSyntax {
        Signature sig = new Signature();
        sig.addSort("A");
        sig.addSort("B");
        sig.addConstant("c", "A");
        return sig;
    }

    @Test
    public void boundNamesShadowConstants() throws ErrorSyntax {
        Environment env = new Environment(sig());
        assertEquals("A", env.lookupVar("c"));
        env.bind("c", "B");
        assertEquals("B", env.lookupVar("c"));
        env.pop();
        assertEquals("A", env.lookupVar("c"));
    }

    @Test
    public void popRestoresShadowedBinding() throws ErrorSyntax {
        Environment env = new Environment(sig());
        env.bind("x", "A");
        env.bind("x", "B");
        assertEquals(2, env.depth());
        assertEquals("B", env.lookupVar("x"));
        env.pop();
        assertEquals("A", env.lookupVar("x"));
        env.pop();
        assertNull(env.lookupVar("x"));
        assertEquals(0, env.depth());
    }

    @Test(expected = IllegalStateException.class)
    public void popOnEmptyEnvironment() throws ErrorSyntax {
        new Environment(sig()).pop();
    }
}
