package com.circuitsim.component;

import lombok.Getter;

/**
 * Reports {@code V(n1) - V(n2)} under its own name.
 */
@Getter
public class VoltageProbe extends AbstractComponent {
    private int n1;
    private int n2;

    public VoltageProbe(String name) {
        super(name);
    }
}
