package com.circuitsim.api;

/**
 * A component instance in a circuit graph.
 *
 * Components are opaque data bags to the net resolution engine. The engine only
 * needs three things from them:
 *
 * 1. Identity: Two components are the same instance iff they are the same Java
 * object. Circuits deduplicate by identity, never by {@link #name()}.
 *
 * 2. Name: The name is what the external solver uses to report branch currents
 * (e.g. "V1.I") and what probes are keyed by in typed results.
 *
 * 3. Terminals: Either the component implements {@link TerminalProvider}, or its
 * terminals are discovered from {@code int} fields named {@code n},
 * {@code n<digits>}, {@code nplus} or {@code nminus}. Any other {@code int}
 * field (port numbers, counts) is a plain parameter.
 *
 * Components carry no electrical equations. Solving is delegated to the external
 * simulator.
 */
public interface Component {

    /**
     * Returns the instance name, as emitted into the netlist.
     *
     * @return the component name, e.g. "R1".
     */
    String name();

    /**
     * Returns a pin reference to one of this component's terminals.
     * The terminal name is validated when the pin is used, not here.
     *
     * @param terminal terminal name, e.g. "n1" or "nplus".
     * @return the pin.
     */
    default Pin pin(String terminal) {
        return new Pin(this, terminal);
    }
}
