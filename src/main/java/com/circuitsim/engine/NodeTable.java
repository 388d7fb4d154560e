package com.circuitsim.engine;

import com.circuitsim.api.Component;
import com.circuitsim.api.Pin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable result of one node resolution pass.
 *
 * Maps every (component, terminal) pin that was in the circuit at resolution
 * time to its node id. Node 0 is ground; all other ids are dense from 1 and are
 * stable only within the pass that produced this table.
 *
 * Data layout mirrors the circuit's arena: {@code pinBase[c]} is the first pin
 * index of component {@code c}, and {@code nodeByPin} is indexed by pin index.
 */
public final class NodeTable {
    public static final int GROUND = 0;
    public static final int UNASSIGNED = -1;

    private final Map<Component, Integer> componentIndex;
    private final List<Component> components;
    private final List<Terminals> terminals;
    private final int[] pinBase;
    private final int[] nodeByPin;
    private final int maxNodeId;
    private final boolean grounded;

    NodeTable(List<Component> components, List<Terminals> terminals, int[] pinBase, int[] nodeByPin,
            int maxNodeId, boolean grounded) {
        this.components = List.copyOf(components);
        this.terminals = List.copyOf(terminals);
        this.pinBase = pinBase;
        this.nodeByPin = nodeByPin;
        this.maxNodeId = maxNodeId;
        this.grounded = grounded;
        Map<Component, Integer> idx = new IdentityHashMap<>(components.size() * 2);
        for (int i = 0; i < components.size(); i++)
            idx.put(components.get(i), i);
        this.componentIndex = Collections.unmodifiableMap(idx);
    }

    /** Solver-side node name: "gnd" for node 0, "_net&lt;N&gt;" otherwise. */
    public static String nodeName(int nodeId) {
        if (nodeId < 0)
            throw new IllegalArgumentException("Unassigned node id: " + nodeId);
        return nodeId == GROUND ? "gnd" : "_net" + nodeId;
    }

    public boolean contains(Component component) {
        return componentIndex.containsKey(component);
    }

    /**
     * Node id of a pin, or {@link #UNASSIGNED} if the component was not part of
     * the circuit when this table was built.
     *
     * @throws IllegalArgumentException if the component has no such terminal.
     */
    public int nodeOf(Component component, String terminal) {
        Integer ci = componentIndex.get(component);
        if (ci == null)
            return UNASSIGNED;
        return nodeByPin[pinBase[ci] + terminals.get(ci).requireIndex(terminal)];
    }

    public int nodeOf(Pin pin) {
        return nodeOf(pin.component(), pin.terminal());
    }

    /** Ordered terminal names of a resolved component. */
    public List<String> terminalNames(Component component) {
        Integer ci = componentIndex.get(component);
        if (ci == null)
            throw new IllegalArgumentException("Component '" + component.name() + "' was not resolved");
        return terminals.get(ci).names();
    }

    /** All pins resolved to the given node, in component insertion order. */
    public List<Pin> pinsOn(int nodeId) {
        List<Pin> pins = new ArrayList<>();
        for (int ci = 0; ci < components.size(); ci++) {
            Terminals t = terminals.get(ci);
            for (int ti = 0; ti < t.count(); ti++)
                if (nodeByPin[pinBase[ci] + ti] == nodeId)
                    pins.add(new Pin(components.get(ci), t.names().get(ti)));
        }
        return pins;
    }

    /** Highest assigned node id; 0 if every net is grounded or the circuit has no pins. */
    public int maxNodeId() {
        return maxNodeId;
    }

    /** Number of distinct nets, counting the ground net once if present. */
    public int netCount() {
        return maxNodeId + (grounded ? 1 : 0);
    }

    public boolean hasGround() {
        return grounded;
    }

    public int pinCount() {
        return nodeByPin.length;
    }

    public List<Component> components() {
        return components;
    }
}
