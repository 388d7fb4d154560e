package com.circuitsim.engine;

import com.circuitsim.api.Component;
import com.circuitsim.api.Pin;
import com.circuitsim.component.*;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class CircuitTest {

    // V1 -> R1 -> R2 -> GND, V1.nminus -> GND
    private static final class Divider {
        final Circuit c = new Circuit("divider");
        final DcVoltageSource v1 = new DcVoltageSource("V1", 5.0);
        final Resistor r1 = new Resistor("R1", 1000);
        final Resistor r2 = new Resistor("R2", 1000);
        final Ground gnd = new Ground();

        Divider() {
            c.connect(v1.pin("nplus"), r1.pin("n1"));
            c.connect(r1.pin("n2"), r2.pin("n1"));
            c.connect(r2.pin("n2"), gnd.pin("n"));
            c.connect(v1.pin("nminus"), gnd.pin("n"));
        }
    }

    @Test
    public void testDividerNumbering() {
        Divider d = new Divider();
        NodeTable t = d.c.resolveNodes();

        assertEquals(4, d.c.componentCount());
        assertEquals(1, t.nodeOf(d.v1, "nplus"));
        assertEquals(0, t.nodeOf(d.v1, "nminus"));
        assertEquals(1, t.nodeOf(d.r1, "n1"));
        assertEquals(2, t.nodeOf(d.r1, "n2"));
        assertEquals(2, t.nodeOf(d.r2, "n1"));
        assertEquals(0, t.nodeOf(d.r2, "n2"));
        assertEquals(2, t.maxNodeId());
        assertEquals(3, t.netCount());
        assertTrue(t.hasGround());
    }

    @Test
    public void testWriteBack() {
        Divider d = new Divider();
        d.c.resolveNodes();
        assertEquals(1, d.v1.getNplus());
        assertEquals(0, d.v1.getNminus());
        assertEquals(2, d.r1.getN2());
        assertEquals(0, d.gnd.getN());
    }

    @Test
    public void testAddComponentIsIdempotent() {
        Circuit c = new Circuit();
        Resistor r = new Resistor("R1", 50);
        assertSame(r, c.addComponent(r));
        assertSame(r, c.addComponent(r));
        assertEquals(1, c.componentCount());
        assertEquals(2, c.pinCount());
    }

    @Test
    public void testConnectIsSymmetricAndIdempotent() {
        Circuit c = new Circuit();
        Resistor a = new Resistor("RA", 50);
        Resistor b = new Resistor("RB", 50);
        c.connect(a.pin("n2"), b.pin("n1"));
        c.connect(b.pin("n1"), a.pin("n2"));
        c.connect(a.pin("n2"), b.pin("n1"));
        NodeTable t = c.resolveNodes();
        assertEquals(t.nodeOf(a, "n2"), t.nodeOf(b, "n1"));
        assertEquals(3, t.netCount());
    }

    @Test
    public void testResolveIsIdempotent() {
        Divider d = new Divider();
        NodeTable first = d.c.resolveNodes();
        NodeTable second = d.c.resolveNodes();
        for (Component comp : d.c.components())
            for (String term : d.c.terminalNames(comp))
                assertEquals(first.nodeOf(comp, term), second.nodeOf(comp, term));
    }

    @Test
    public void testIsolatedTerminalGetsOwnNode() {
        Divider d = new Divider();
        Resistor floating = d.c.addComponent(new Resistor("R3", 10));
        NodeTable t = d.c.resolveNodes();

        int n1 = t.nodeOf(floating, "n1");
        int n2 = t.nodeOf(floating, "n2");
        assertTrue(n1 > 0);
        assertTrue(n2 > 0);
        assertNotEquals(n1, n2);
        assertEquals(1, t.pinsOn(n1).size());
        assertEquals(4, t.maxNodeId());
    }

    @Test
    public void testSeparateGroundsAllMapToZero() {
        Circuit c = new Circuit();
        Ground g1 = new Ground("G1");
        Ground g2 = new Ground("G2");
        Resistor a = new Resistor("RA", 50);
        Resistor b = new Resistor("RB", 50);
        c.connect(a.pin("n2"), g1.pin("n"));
        c.connect(b.pin("n2"), g2.pin("n"));
        NodeTable t = c.resolveNodes();

        assertEquals(0, t.nodeOf(a, "n2"));
        assertEquals(0, t.nodeOf(b, "n2"));
        assertEquals(0, t.nodeOf(g1, "n"));
        assertEquals(0, t.nodeOf(g2, "n"));
        assertNotEquals(t.nodeOf(a, "n1"), t.nodeOf(b, "n1"));
        assertFalse(c.areConnected(g1.pin("n"), g2.pin("n")));
        assertEquals(3, t.netCount());
    }

    @Test
    public void testNoGround() {
        Circuit c = new Circuit();
        Resistor r = new Resistor("R1", 50);
        c.addComponent(r);
        NodeTable t = c.resolveNodes();
        assertFalse(t.hasGround());
        assertEquals(2, t.netCount());
        assertTrue(t.pinsOn(NodeTable.GROUND).isEmpty());
    }

    @Test
    public void testUnknownTerminalFailsWithoutMutation() {
        Circuit c = new Circuit();
        Resistor r1 = new Resistor("R1", 50);
        Resistor r2 = new Resistor("R2", 50);
        try {
            c.connect(r1.pin("n1"), r2.pin("nplus"));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("R2"));
            assertTrue(e.getMessage().contains("nplus"));
        }
        assertEquals(0, c.componentCount());
    }

    @Test(expected = IllegalStateException.class)
    public void testNodeTableBeforeResolve() {
        new Divider().c.nodeTable();
    }

    @Test
    public void testReResolveAfterEdit() {
        Divider d = new Divider();
        d.c.resolveNodes();
        assertTrue(d.c.isResolved());

        // Short R2, so R1.n2 joins ground
        d.c.connect(d.r2.pin("n1"), d.gnd.pin("n"));
        assertFalse(d.c.isResolved());
        assertEquals(2, d.r1.getN2());

        NodeTable t = d.c.resolveNodes();
        assertTrue(d.c.isResolved());
        assertEquals(0, t.nodeOf(d.r1, "n2"));
        assertEquals(0, d.r1.getN2());
        assertEquals(1, t.maxNodeId());
    }

    @Test
    public void testTableDoesNotSeeLaterComponents() {
        Divider d = new Divider();
        NodeTable t = d.c.resolveNodes();
        Resistor late = d.c.addComponent(new Resistor("R9", 1));
        assertFalse(t.contains(late));
        assertEquals(NodeTable.UNASSIGNED, t.nodeOf(late, "n1"));
    }

    @Test
    public void testSParameterFileTerminals() {
        Circuit c = new Circuit();
        SParameterFile s = new SParameterFile("S1", "filter.s2p");
        PowerSource p1 = new PowerSource("P1", 1);
        PowerSource p2 = new PowerSource("P2", 2);
        Ground g = new Ground();
        c.connect(p1.pin("nplus"), s.pin("n1"));
        c.connect(p2.pin("nplus"), s.pin("n2"));
        c.connect(s.pin("ref"), g.pin("n"));
        c.connect(p1.pin("nminus"), g.pin("n"));
        c.connect(p2.pin("nminus"), g.pin("n"));
        NodeTable t = c.resolveNodes();

        assertEquals(List.of("n1", "n2", "ref"), t.terminalNames(s));
        assertEquals(1, s.node("n1"));
        assertEquals(2, s.node("n2"));
        assertEquals(0, s.node("ref"));
        assertEquals(t.nodeOf(p2, "nplus"), s.node("n2"));
    }

    @Test
    public void testTerminalFreeComponentIsSkipped() {
        Divider d = new Divider();
        Substrate sub = d.c.addComponent(new Substrate("Sub1", 9.8, 0.635e-3, 17.5e-6, 0.0));
        NodeTable t = d.c.resolveNodes();
        assertTrue(t.contains(sub));
        assertTrue(t.terminalNames(sub).isEmpty());
        assertEquals(3, t.netCount());
    }

    @Test
    public void testProviderComponentsResolve() {
        Circuit c = new Circuit();
        Diode d = new Diode("D1");
        Resistor r = new Resistor("R1", 50);
        Ground g = new Ground();
        c.connect(r.pin("n2"), d.pin("anode"));
        c.connect(d.pin("cathode"), g.pin("n"));
        c.resolveNodes();
        assertEquals(0, d.cathode());
        assertEquals(r.getN2(), d.anode());
        assertTrue(d.anode() > 0);
    }

    /**
     * Random connection sequences: two pins share a node id iff they are in the
     * same connected component of the declared connection graph.
     */
    @Test
    public void testPartitionMatchesReachability() {
        Random rnd = new Random(42);
        for (int round = 0; round < 20; round++) {
            Circuit c = new Circuit();
            List<Pin> pins = new ArrayList<>();
            Ground g = new Ground();
            c.addComponent(g);
            pins.add(g.pin("n"));
            for (int i = 0; i < 12; i++) {
                Resistor r = c.addComponent(new Resistor("R" + i, 1));
                pins.add(r.pin("n1"));
                pins.add(r.pin("n2"));
            }

            Map<Pin, List<Pin>> adj = new HashMap<>();
            for (Pin p : pins)
                adj.put(p, new ArrayList<>());
            int edges = rnd.nextInt(20);
            for (int e = 0; e < edges; e++) {
                Pin a = pins.get(rnd.nextInt(pins.size()));
                Pin b = pins.get(rnd.nextInt(pins.size()));
                c.connect(a, b);
                adj.get(a).add(b);
                adj.get(b).add(a);
            }

            NodeTable t = c.resolveNodes();
            Set<Pin> groundNet = reachable(adj, g.pin("n"));
            for (Pin a : pins) {
                Set<Pin> net = reachable(adj, a);
                assertEquals(groundNet.contains(a), t.nodeOf(a) == NodeTable.GROUND);
                for (Pin b : pins)
                    assertEquals(a + " vs " + b, net.contains(b), t.nodeOf(a) == t.nodeOf(b));
            }

            // Ids are dense from 1
            Set<Integer> ids = new TreeSet<>();
            for (Pin p : pins)
                if (t.nodeOf(p) != NodeTable.GROUND)
                    ids.add(t.nodeOf(p));
            int expected = 1;
            for (int id : ids)
                assertEquals(expected++, id);
        }
    }

    private static Set<Pin> reachable(Map<Pin, List<Pin>> adj, Pin start) {
        Set<Pin> seen = new HashSet<>();
        Deque<Pin> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            Pin p = stack.pop();
            if (seen.add(p))
                adj.get(p).forEach(stack::push);
        }
        return seen;
    }
}
