package com.circuitsim.util;

import com.circuitsim.api.Component;
import com.circuitsim.api.Pin;
import com.circuitsim.engine.Circuit;
import com.circuitsim.engine.NodeTable;

import java.util.List;

/**
 * Diagnostic utility for inspecting a resolved circuit.
 *
 * <p>
 * Intended for debugging and error reports. Builds strings; not meant for
 * repeated use on large circuits.
 */
public final class CircuitExplain {
    private final Circuit circuit;
    private final NodeTable nodes;

    /**
     * @throws IllegalStateException if the circuit was never resolved.
     */
    public CircuitExplain(Circuit circuit) {
        this.circuit = circuit;
        this.nodes = circuit.nodeTable();
    }

    /** Dumps one component with the node each terminal landed on. */
    public String explainComponent(Component component) {
        StringBuilder sb = new StringBuilder(128);
        sb.append("Component: ").append(component.name()).append('\n')
                .append("  Type: ").append(component.getClass().getSimpleName()).append('\n');
        if (!nodes.contains(component))
            return sb.append("  (not resolved)\n").toString();
        List<String> terminals = nodes.terminalNames(component);
        if (terminals.isEmpty())
            return sb.append("  (no terminals)\n").toString();
        for (String t : terminals) {
            int node = nodes.nodeOf(component, t);
            sb.append("  ").append(t).append(" -> ").append(NodeTable.nodeName(node)).append('\n');
        }
        return sb.toString();
    }

    /** Lists every net with the pins on it, ground first. */
    public String dumpNets() {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Circuit '").append(circuit.name()).append("' (").append(nodes.components().size())
                .append(" components, ").append(nodes.netCount()).append(" nets)");
        if (!circuit.isResolved())
            sb.append(" [stale]");
        sb.append('\n');
        for (int id = nodes.hasGround() ? NodeTable.GROUND : 1; id <= nodes.maxNodeId(); id++) {
            List<Pin> pins = nodes.pinsOn(id);
            sb.append("  ").append(NodeTable.nodeName(id)).append(": ");
            for (int i = 0; i < pins.size(); i++) {
                if (i > 0)
                    sb.append(", ");
                sb.append(pins.get(i));
            }
            if (pins.size() == 1)
                sb.append(" (floating)");
            sb.append('\n');
        }
        return sb.toString();
    }
}
