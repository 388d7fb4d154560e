package com.circuitsim.result;

import com.circuitsim.component.*;
import com.circuitsim.dsl.CircuitBuilder;
import com.circuitsim.engine.Circuit;
import com.circuitsim.io.Dataset;
import com.circuitsim.io.QucsDatasetParser;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class SimulationResultTest {

    private static final String DC_OUTPUT = String.join("\n",
            "<Qucs Dataset 0.0.22>",
            "<dep _net1.V>", "+5.0e+00", "</dep>",
            "<dep _net2.V>", "+2.5e+00", "</dep>",
            "<dep V1.I>", "-2.5e-03", "</dep>",
            "<dep VP1.V>", "+2.5e+00", "</dep>",
            "<dep IP1.I>", "+2.5e-03", "</dep>");

    private Circuit circuit;
    private DcVoltageSource v1;
    private Resistor r1;
    private Resistor r2;
    private VoltageProbe vp1;

    @Before
    public void setUp() {
        CircuitBuilder b = CircuitBuilder.create("divider");
        v1 = b.dcVoltageSource("V1", 5.0);
        r1 = b.resistor("R1", 1e3);
        r2 = b.resistor("R2", 1e3);
        b.ground("GND");
        vp1 = b.add(new VoltageProbe("VP1"));
        b.connect("V1.nplus", "R1.n1")
                .connect("R1.n2", "R2.n1")
                .net("R2.n2", "V1.nminus", "GND")
                .connect("VP1.n1", "R2.n1")
                .connect("VP1.n2", "GND");
        circuit = b.buildResolved();
    }

    private SimulationResult dc(String output) {
        return new SimulationResult(circuit.nodeTable(), TypedResults.dc(QucsDatasetParser.parse(output)));
    }

    @Test
    public void testVoltageAtPin() {
        SimulationResult res = dc(DC_OUTPUT);
        assertEquals(5.0, res.voltageAtPin(r1, "n1").re(0), 0.0);
        assertEquals(2.5, res.voltageAtPin(r1, "n2").re(0), 0.0);
        assertEquals(2.5, res.voltage(r2.pin("n1")).re(0), 0.0);
    }

    @Test
    public void testGroundPinIsZeroWithoutLookup() {
        // No "gnd" vector exists in the output
        SimulationResult res = dc(DC_OUTPUT);
        assertEquals(ComplexVector.zeros(1), res.voltageAtPin(r2, "n2"));
        assertEquals(ComplexVector.zeros(1), res.voltageAtPin(v1, "nminus"));
    }

    @Test
    public void testVoltageAcross() {
        SimulationResult res = dc(DC_OUTPUT);
        assertEquals(2.5, res.voltageAcross(r1, "n1", "n2").re(0), 0.0);
        assertEquals(2.5, res.voltageAcross(r2, "n1", "n2").re(0), 0.0);
        assertEquals(-2.5, res.voltageBetween(r2.pin("n2"), r1.pin("n2")).re(0), 0.0);
    }

    @Test
    public void testPinCurrentSignConvention() {
        SimulationResult res = dc(DC_OUTPUT);
        ComplexVector i = res.currentThrough(v1);
        ComplexVector first = res.currentIntoPin(v1, "nplus");
        ComplexVector second = res.currentIntoPin(v1, "nminus");

        assertEquals(i, first);
        assertEquals(i.negate(), second);
        assertEquals(0.0, first.re(0) + second.re(0), 0.0);
    }

    @Test
    public void testCurrentNotAvailable() {
        try {
            dc(DC_OUTPUT).currentThrough(r1);
            fail("Expected CurrentNotAvailableException");
        } catch (CurrentNotAvailableException e) {
            assertEquals("R1.I", e.requested());
            assertEquals(List.of("IP1", "V1"), e.available());
        }
    }

    @Test
    public void testPinNotConnected() {
        Resistor stranger = new Resistor("R9", 1);
        try {
            dc(DC_OUTPUT).voltageAtPin(stranger, "n1");
            fail("Expected PinNotConnectedException");
        } catch (PinNotConnectedException e) {
            assertEquals("R9.n1", e.requested());
            assertTrue(e.available().contains("R1"));
        }
    }

    @Test
    public void testComponentAddedAfterResolutionIsNotConnected() {
        Resistor late = circuit.addComponent(new Resistor("R3", 1));
        try {
            dc(DC_OUTPUT).voltageAtPin(late, "n1");
            fail("Expected PinNotConnectedException");
        } catch (PinNotConnectedException e) {
            assertFalse(e.available().contains("R3"));
        }
    }

    @Test(expected = VectorNotFoundException.class)
    public void testMissingNodeVector() {
        dc("<Qucs Dataset 0.0.22>\n<dep _net1.V>\n+5.0e+00\n</dep>\n").voltageAtPin(r1, "n2");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownTerminal() {
        dc(DC_OUTPUT).voltageAtPin(r1, "nplus");
    }

    @Test
    public void testProbes() {
        SimulationResult res = dc(DC_OUTPUT);
        assertEquals(2.5, res.probeVoltage(vp1).re(0), 0.0);
        assertEquals(2.5e-3, res.probeCurrent("IP1").re(0), 0.0);
    }

    @Test
    public void testPower() {
        SimulationResult res = dc(DC_OUTPUT);
        assertEquals(-0.0125, res.power(v1, "nplus", "nminus"), 1e-15);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPinCurrentNeedsTwoTerminals() {
        Mosfet m = circuit.addComponent(new Mosfet("M1"));
        circuit.resolveNodes();
        dc(DC_OUTPUT).currentIntoPin(m, "gate");
    }

    @Test
    public void testAcGroundHasSweepLength() {
        Dataset ds = QucsDatasetParser.parse(String.join("\n",
                "<Qucs Dataset 0.0.22>",
                "<indep acfrequency 2>", "+1.0e+09", "+2.0e+09", "</indep>",
                "<dep _net1.v acfrequency>", "+1.0e+00+j0.0e+00", "+1.0e+00+j0.0e+00", "</dep>",
                "<dep _net2.v acfrequency>", "+5.0e-01+j1.0e-01", "+4.0e-01+j2.0e-01", "</dep>"));
        SimulationResult res = new SimulationResult(circuit.nodeTable(), TypedResults.ac(ds));

        assertEquals(ComplexVector.zeros(2), res.voltageAtPin(r2, "n2"));
        ComplexVector across = res.voltageAcross(r1, "n1", "n2");
        assertEquals(0.5, across.re(0), 1e-12);
        assertEquals(-0.2, across.im(1), 1e-12);
    }

    @Test(expected = IllegalStateException.class)
    public void testPowerOnlyForDc() {
        Dataset ds = QucsDatasetParser.parse("<Qucs Dataset 0.0.22>\n<dep V1.i>\n+1.0e+00\n</dep>\n");
        new SimulationResult(circuit.nodeTable(), TypedResults.ac(ds)).power(v1, "nplus", "nminus");
    }
}
