package com.circuitsim.component;

import lombok.Getter;

/**
 * Ideal inductance between {@code n1} and {@code n2}.
 */
@Getter
public class Inductor extends AbstractComponent {
    private int n1;
    private int n2;

    /** Inductance in H. */
    private final double l;

    public Inductor(String name, double l) {
        super(name);
        this.l = requirePositive(l, "Inductance");
    }
}
