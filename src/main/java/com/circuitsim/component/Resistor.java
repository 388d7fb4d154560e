package com.circuitsim.component;

import lombok.Getter;

/**
 * Ideal resistance between {@code n1} and {@code n2}.
 */
@Getter
public class Resistor extends AbstractComponent {
    private int n1;
    private int n2;

    /** Resistance in Ohm. */
    private final double r;

    public Resistor(String name, double r) {
        super(name);
        this.r = requirePositive(r, "Resistance");
    }
}
