package com.circuitsim.component;

import lombok.Getter;

/**
 * Zero-ohm series element reporting the current from {@code n1} to {@code n2}.
 */
@Getter
public class CurrentProbe extends AbstractComponent {
    private int n1;
    private int n2;

    public CurrentProbe(String name) {
        super(name);
    }
}
