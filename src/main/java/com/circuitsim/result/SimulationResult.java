package com.circuitsim.result;

import com.circuitsim.api.Component;
import com.circuitsim.api.Pin;
import com.circuitsim.engine.NodeTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers pin-level questions about a simulation run.
 *
 * <p>
 * Joins the {@link NodeTable} of the resolution that produced the netlist with
 * the typed view of the solver's output, so callers ask for "the voltage at
 * R1.n2" instead of "the vector named _net3.V". The node table is the
 * authority: values written back into component fields are not consulted.
 *
 * <p>
 * Current sign convention: a two-terminal component's branch current
 * {@code I} flows internally from its first terminal to its second.
 * {@link #currentIntoPin} returns {@code I} at the first terminal and
 * {@code -I} at the second, so the two always sum to zero.
 */
public final class SimulationResult {
    private final NodeTable nodes;
    private final NodalResult result;

    public SimulationResult(NodeTable nodes, NodalResult result) {
        this.nodes = nodes;
        this.result = result;
    }

    public NodeTable nodes() {
        return nodes;
    }

    public NodalResult result() {
        return result;
    }

    public AnalysisKind kind() {
        return result.kind();
    }

    /**
     * Voltage at a component terminal. Ground pins read as zero without a
     * lookup.
     *
     * @throws PinNotConnectedException if the component was not resolved.
     * @throws VectorNotFoundException  if the solver reported no voltage for
     *                                  the pin's node.
     * @throws IllegalArgumentException if the component has no such terminal.
     */
    public ComplexVector voltageAtPin(Component component, String terminal) {
        int node = nodes.nodeOf(component, terminal);
        if (node == NodeTable.UNASSIGNED)
            throw new PinNotConnectedException(component.name() + "." + terminal, componentNames());
        if (node == NodeTable.GROUND)
            return ComplexVector.zeros(result.points());
        return result.voltage(NodeTable.nodeName(node));
    }

    public ComplexVector voltage(Pin pin) {
        return voltageAtPin(pin.component(), pin.terminal());
    }

    /** {@code V(terminalA) - V(terminalB)} of one component. */
    public ComplexVector voltageAcross(Component component, String terminalA, String terminalB) {
        return voltageAtPin(component, terminalA).minus(voltageAtPin(component, terminalB));
    }

    /** {@code V(a) - V(b)} for pins on any components. */
    public ComplexVector voltageBetween(Pin a, Pin b) {
        return voltage(a).minus(voltage(b));
    }

    /**
     * Branch current reported for a component.
     *
     * @throws CurrentNotAvailableException if the solver reports none; only
     *                                      sources, inductors and current
     *                                      probes carry one.
     */
    public ComplexVector currentThrough(Component component) {
        return result.current(component.name());
    }

    /**
     * Current flowing into a terminal from the external circuit.
     *
     * @throws IllegalArgumentException if the component does not have exactly
     *                                  two terminals or lacks the named one.
     */
    public ComplexVector currentIntoPin(Component component, String terminal) {
        if (!nodes.contains(component))
            throw new PinNotConnectedException(component.name() + "." + terminal, componentNames());
        List<String> terminals = nodes.terminalNames(component);
        if (terminals.size() != 2)
            throw new IllegalArgumentException("Pin current needs a two-terminal component; "
                    + component.name() + " has " + terminals);
        int idx = terminals.indexOf(terminal);
        if (idx < 0)
            throw new IllegalArgumentException("Component '" + component.name() + "' has no terminal '"
                    + terminal + "'. Terminals: " + terminals);
        ComplexVector i = currentThrough(component);
        return idx == 0 ? i : i.negate();
    }

    public ComplexVector currentIntoPin(Pin pin) {
        return currentIntoPin(pin.component(), pin.terminal());
    }

    /** Voltage reported by a voltage probe under its own name. */
    public ComplexVector probeVoltage(String probeName) {
        return result.voltage(probeName);
    }

    public ComplexVector probeVoltage(Component probe) {
        return probeVoltage(probe.name());
    }

    /** Current reported by a current probe under its own name. */
    public ComplexVector probeCurrent(String probeName) {
        return result.current(probeName);
    }

    public ComplexVector probeCurrent(Component probe) {
        return probeCurrent(probe.name());
    }

    /**
     * DC power {@code V(a, b) * I}. Positive means the component absorbs
     * power.
     *
     * @throws IllegalStateException if this is not an operating point.
     */
    public double power(Component component, String terminalA, String terminalB) {
        if (result.kind() != AnalysisKind.DC)
            throw new IllegalStateException("Power is only defined for DC results, not " + result.kind());
        double v = DcResult.first(voltageAcross(component, terminalA, terminalB));
        double i = DcResult.first(currentThrough(component));
        return v * i;
    }

    private List<String> componentNames() {
        List<String> names = new ArrayList<>();
        for (Component c : nodes.components())
            names.add(c.name());
        return names;
    }
}
