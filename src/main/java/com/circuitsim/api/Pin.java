package com.circuitsim.api;

import java.util.Objects;

/**
 * One terminal of one component instance.
 *
 * Pins compare the component by identity and the terminal by name, matching the
 * way circuits deduplicate components.
 */
public final class Pin {
    private final Component component;
    private final String terminal;

    public Pin(Component component, String terminal) {
        this.component = Objects.requireNonNull(component, "component");
        this.terminal = Objects.requireNonNull(terminal, "terminal");
    }

    public Component component() {
        return component;
    }

    public String terminal() {
        return terminal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Pin))
            return false;
        Pin other = (Pin) o;
        return component == other.component && terminal.equals(other.terminal);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(component) + terminal.hashCode();
    }

    @Override
    public String toString() {
        return component.name() + "." + terminal;
    }
}
