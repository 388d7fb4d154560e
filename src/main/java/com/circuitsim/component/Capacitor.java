package com.circuitsim.component;

import lombok.Getter;

/**
 * Ideal capacitance between {@code n1} and {@code n2}.
 */
@Getter
public class Capacitor extends AbstractComponent {
    private int n1;
    private int n2;

    /** Capacitance in F. */
    private final double c;

    public Capacitor(String name, double c) {
        super(name);
        this.c = requirePositive(c, "Capacitance");
    }
}
