package com.circuitsim.engine;

import com.circuitsim.api.Component;
import com.circuitsim.api.GroundReference;
import com.circuitsim.api.Pin;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * A circuit graph: an ordered, identity-deduplicated set of components plus the
 * declared pin-to-pin connections.
 *
 * <p>
 * Storage is an arena. Each component receives a dense index when added, and
 * each of its terminals a dense pin index ({@code pinBase[component] + terminal}).
 * Connections are unions in a {@link DisjointSet} over pin indices, so nothing
 * is keyed on object addresses or hashes.
 *
 * <p>
 * Lifecycle: add components and connect pins in any order, then call
 * {@link #resolveNodes()}. Resolution is a full recomputation; it may be called
 * again after further edits. Node ids read from components before the first
 * resolution are the sentinel 0 and mean "unknown", not "grounded".
 *
 * <p>
 * Not thread-safe. Mutated only by {@code addComponent}, {@code connect} and
 * {@code resolveNodes}.
 */
public final class Circuit {
    private static final Logger log = LogManager.getLogger(Circuit.class);

    private final String name;
    private final List<Component> components = new ArrayList<>();
    private final Map<Component, Integer> componentIndex = new IdentityHashMap<>();
    private final List<Terminals> terminals = new ArrayList<>();
    private final DisjointSet pins = new DisjointSet(64);
    private int[] pinBase = new int[16];

    private NodeTable nodeTable;
    // True when edits happened after the last resolution.
    private boolean stale = true;

    public Circuit() {
        this("circuit");
    }

    public Circuit(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Adds a component if the same instance is not already present.
     *
     * @return the component (which may have been present already).
     */
    public <C extends Component> C addComponent(C component) {
        if (componentIndex.containsKey(component))
            return component;
        int ci = components.size();
        if (ci == pinBase.length)
            pinBase = Arrays.copyOf(pinBase, ci * 2);

        Terminals t = Terminals.of(component);
        pinBase[ci] = pins.size();
        for (int i = 0; i < t.count(); i++)
            pins.add();

        components.add(component);
        componentIndex.put(component, ci);
        terminals.add(t);
        stale = true;
        return component;
    }

    /**
     * Declares two pins electrically connected. Both owning components are added
     * if missing. Symmetric and idempotent.
     *
     * @throws IllegalArgumentException if either terminal does not exist on its
     *                                  component.
     */
    public void connect(Pin a, Pin b) {
        // Validate both before mutating anything.
        Terminals.of(a.component()).requireIndex(a.terminal());
        Terminals.of(b.component()).requireIndex(b.terminal());
        addComponent(a.component());
        addComponent(b.component());
        pins.union(pinIndex(a), pinIndex(b));
        stale = true;
    }

    public void connect(Component a, String terminalA, Component b, String terminalB) {
        connect(new Pin(a, terminalA), new Pin(b, terminalB));
    }

    /** True if both pins are currently in the same net. */
    public boolean areConnected(Pin a, Pin b) {
        if (!contains(a.component()) || !contains(b.component()))
            return a.equals(b);
        return pins.connected(pinIndex(a), pinIndex(b));
    }

    /**
     * Assigns canonical node ids to every net.
     *
     * Steps:
     * 1. Mark the root of every ground-reference terminal as ground.
     * 2. Walk pins in component insertion order and terminal order; the first
     * time a root is seen it receives 0 if grounded, else the next id from 1.
     * 3. Write each pin's id back into its component terminal.
     *
     * Walking in insertion order makes the numbering deterministic for a given
     * sequence of adds and connects, so repeated calls yield identical tables.
     *
     * @return the new node table, also retained as {@link #nodeTable()}.
     */
    public NodeTable resolveNodes() {
        final int n = pins.size();
        boolean[] groundRoot = new boolean[n];
        boolean grounded = false;
        for (int ci = 0; ci < components.size(); ci++) {
            if (!(components.get(ci) instanceof GroundReference))
                continue;
            for (int ti = 0; ti < terminals.get(ci).count(); ti++) {
                groundRoot[pins.find(pinBase[ci] + ti)] = true;
                grounded = true;
            }
        }

        int[] nodeOfRoot = new int[n];
        Arrays.fill(nodeOfRoot, NodeTable.UNASSIGNED);
        int[] nodeByPin = new int[n];
        int next = 1;
        for (int p = 0; p < n; p++) {
            int root = pins.find(p);
            if (nodeOfRoot[root] == NodeTable.UNASSIGNED)
                nodeOfRoot[root] = groundRoot[root] ? NodeTable.GROUND : next++;
            nodeByPin[p] = nodeOfRoot[root];
        }

        for (int ci = 0; ci < components.size(); ci++) {
            Terminals t = terminals.get(ci);
            for (int ti = 0; ti < t.count(); ti++)
                t.write(ti, nodeByPin[pinBase[ci] + ti]);
        }

        nodeTable = new NodeTable(components, terminals, Arrays.copyOf(pinBase, components.size()), nodeByPin,
                next - 1, grounded);
        stale = false;
        log.debug("Resolved circuit '{}': {} components, {} pins, {} nets (ground: {})",
                name, components.size(), n, nodeTable.netCount(), grounded);
        return nodeTable;
    }

    /**
     * Returns the table from the most recent resolution.
     *
     * @throws IllegalStateException if {@link #resolveNodes()} was never called.
     */
    public NodeTable nodeTable() {
        if (nodeTable == null)
            throw new IllegalStateException("Circuit '" + name + "' has not been resolved");
        return nodeTable;
    }

    /** True if a resolution has run and no edits happened since. */
    public boolean isResolved() {
        return nodeTable != null && !stale;
    }

    public boolean contains(Component component) {
        return componentIndex.containsKey(component);
    }

    public List<Component> components() {
        return Collections.unmodifiableList(components);
    }

    public int componentCount() {
        return components.size();
    }

    public int pinCount() {
        return pins.size();
    }

    /** Terminal names of a component in this circuit. */
    public List<String> terminalNames(Component component) {
        return terminals.get(requireComponent(component)).names();
    }

    private int pinIndex(Pin pin) {
        int ci = requireComponent(pin.component());
        return pinBase[ci] + terminals.get(ci).requireIndex(pin.terminal());
    }

    private int requireComponent(Component component) {
        Integer ci = componentIndex.get(component);
        if (ci == null)
            throw new IllegalArgumentException("Component '" + component.name() + "' is not in circuit '" + name + "'");
        return ci;
    }
}
