package com.circuitsim.dsl;

import com.circuitsim.api.Component;
import com.circuitsim.api.Pin;
import com.circuitsim.component.*;
import com.circuitsim.engine.Circuit;
import com.circuitsim.engine.Terminals;

import java.util.*;

/**
 * Circuit Builder -- name-addressed construction API.
 *
 * Usage Pattern:
 * 1. Create a builder: CircuitBuilder b = CircuitBuilder.create("divider");
 * 2. Add components: b.dcVoltageSource("V1", 5.0); b.resistor("R1", 1e3);
 * 3. Wire pins by reference: b.connect("V1.nplus", "R1.n1");
 * 4. Build: Circuit c = b.build();
 *
 * A pin reference is {@code "<component>.<terminal>"}. A bare component name
 * refers to the only terminal of a single-terminal component, so
 * {@code b.connect("R2.n2", "GND")} wires to ground.
 */
public final class CircuitBuilder {
    private final Circuit circuit;
    private final Map<String, Component> componentsByName = new LinkedHashMap<>();

    private boolean built;

    private CircuitBuilder(String name) {
        this.circuit = new Circuit(name);
    }

    public static CircuitBuilder create(String name) {
        return new CircuitBuilder(name);
    }

    // ── Components ───────────────────────────────────────────────

    /**
     * Adds any component under its own name.
     *
     * @throws IllegalArgumentException if the name is already taken.
     */
    public <C extends Component> C add(C component) {
        checkNotBuilt();
        if (componentsByName.containsKey(component.name()))
            throw new IllegalArgumentException("Duplicate component name: " + component.name());
        componentsByName.put(component.name(), component);
        return circuit.addComponent(component);
    }

    public Ground ground(String name) {
        return add(new Ground(name));
    }

    public Resistor resistor(String name, double ohms) {
        return add(new Resistor(name, ohms));
    }

    public Capacitor capacitor(String name, double farads) {
        return add(new Capacitor(name, farads));
    }

    public Inductor inductor(String name, double henries) {
        return add(new Inductor(name, henries));
    }

    public DcVoltageSource dcVoltageSource(String name, double volts) {
        return add(new DcVoltageSource(name, volts));
    }

    public DcCurrentSource dcCurrentSource(String name, double amps) {
        return add(new DcCurrentSource(name, amps));
    }

    public PowerSource port(String name, int portNum) {
        return add(new PowerSource(name, portNum));
    }

    // ── Connections ──────────────────────────────────────────────

    /** Connects two pins given as references. */
    public CircuitBuilder connect(String pinA, String pinB) {
        checkNotBuilt();
        circuit.connect(pin(pinA), pin(pinB));
        return this;
    }

    /** Connects every listed pin into one net. */
    public CircuitBuilder net(String... pins) {
        checkNotBuilt();
        if (pins.length < 2)
            throw new IllegalArgumentException("A net needs at least two pins, got " + Arrays.toString(pins));
        Pin first = pin(pins[0]);
        for (int i = 1; i < pins.length; i++)
            circuit.connect(first, pin(pins[i]));
        return this;
    }

    public CircuitBuilder connect(Pin a, Pin b) {
        checkNotBuilt();
        circuit.connect(a, b);
        return this;
    }

    /**
     * Resolves a pin reference against the components added so far.
     *
     * @throws IllegalArgumentException for an unknown component, or a bare name
     *                                  on a component without exactly one
     *                                  terminal.
     */
    public Pin pin(String reference) {
        int dot = reference.lastIndexOf('.');
        String componentName = dot < 0 ? reference : reference.substring(0, dot);
        Component c = component(componentName);
        if (dot >= 0)
            return c.pin(reference.substring(dot + 1));

        List<String> terminals = Terminals.of(c).names();
        if (terminals.size() != 1)
            throw new IllegalArgumentException("Pin reference '" + reference + "' must name a terminal: "
                    + c.name() + " has terminals " + terminals);
        return c.pin(terminals.get(0));
    }

    public Component component(String name) {
        Component c = componentsByName.get(name);
        if (c == null)
            throw new IllegalArgumentException("Unknown component: " + name);
        return c;
    }

    public Map<String, Component> componentsByName() {
        return Collections.unmodifiableMap(componentsByName);
    }

    // ── Build ────────────────────────────────────────────────────

    /**
     * Finishes construction. The returned circuit is not yet resolved; call
     * {@link Circuit#resolveNodes()} or use {@link #buildResolved()}.
     */
    public Circuit build() {
        checkNotBuilt();
        built = true;
        return circuit;
    }

    public Circuit buildResolved() {
        Circuit c = build();
        c.resolveNodes();
        return c;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Circuit already built");
    }
}
