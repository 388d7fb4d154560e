package com.circuitsim.component;

import com.circuitsim.api.Component;

import java.util.Objects;

/**
 * Base class holding the component name.
 *
 * Subclasses declare their terminals either as {@code int} fields following the
 * terminal naming convention or by implementing
 * {@link com.circuitsim.api.TerminalProvider}. Terminal fields hold 0 until the
 * circuit is resolved.
 */
public abstract class AbstractComponent implements Component {
    private final String name;

    protected AbstractComponent(String name) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isBlank())
            throw new IllegalArgumentException("Component name must not be blank");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }

    static double requirePositive(double value, String what) {
        if (!(value > 0))
            throw new IllegalArgumentException(what + " must be positive, got " + value);
        return value;
    }
}
