package com.circuitsim.engine;

import com.circuitsim.api.Component;
import com.circuitsim.component.*;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TerminalsTest {

    /** Terminal fields declared on both a base class and a subclass. */
    static class Base implements Component {
        int n1;
        int gain;

        @Override
        public String name() {
            return "X1";
        }
    }

    static class Derived extends Base {
        int n2;
        static int n3;
        long n4;
    }

    @Test
    public void testFieldNamingConvention() {
        assertTrue(Terminals.isTerminalFieldName("n"));
        assertTrue(Terminals.isTerminalFieldName("n1"));
        assertTrue(Terminals.isTerminalFieldName("n42"));
        assertTrue(Terminals.isTerminalFieldName("nplus"));
        assertTrue(Terminals.isTerminalFieldName("nminus"));
        assertFalse(Terminals.isTerminalFieldName("name"));
        assertFalse(Terminals.isTerminalFieldName("portNum"));
        assertFalse(Terminals.isTerminalFieldName("n1x"));
    }

    @Test
    public void testFieldScanWalksHierarchy() {
        Terminals t = Terminals.of(new Derived());
        assertEquals(List.of("n1", "n2"), t.names());
    }

    @Test
    public void testReadWriteFields() {
        Resistor r = new Resistor("R1", 100);
        Terminals t = Terminals.of(r);
        assertEquals(List.of("n1", "n2"), t.names());
        t.write(t.requireIndex("n2"), 7);
        assertEquals(7, r.getN2());
        assertEquals(7, t.read(1));
        assertEquals(0, r.getN1());
    }

    @Test
    public void testPortNumberIsNotATerminal() {
        Terminals t = Terminals.of(new PowerSource("P1", 1));
        assertEquals(List.of("nplus", "nminus"), t.names());
    }

    @Test
    public void testProviderTerminals() {
        Mosfet m = new Mosfet("M1");
        Terminals t = Terminals.of(m);
        assertEquals(List.of("gate", "drain", "source", "bulk"), t.names());
        t.write(t.requireIndex("drain"), 3);
        assertEquals(3, m.node("drain"));
    }

    @Test
    public void testDynamicArity() {
        SParameterFile s = new SParameterFile("S1", "amp.s3p");
        assertEquals(3, s.numPorts());
        assertEquals(List.of("n1", "n2", "n3", "ref"), Terminals.of(s).names());
    }

    @Test
    public void testNoTerminals() {
        assertEquals(0, Terminals.of(new Substrate("Sub1", 9.8, 0.635e-3, 17.5e-6, 0.0)).count());
    }

    @Test
    public void testUnknownTerminalMessage() {
        try {
            Terminals.of(new Resistor("R1", 100)).requireIndex("nplus");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("R1"));
            assertTrue(e.getMessage().contains("nplus"));
            assertTrue(e.getMessage().contains("[n1, n2]"));
        }
    }
}
