package com.circuitsim.component;

import com.circuitsim.api.GroundReference;

import lombok.Getter;

/**
 * Ground reference. Its single terminal always resolves to node 0.
 */
@Getter
public class Ground extends AbstractComponent implements GroundReference {
    private int n;

    public Ground(String name) {
        super(name);
    }

    public Ground() {
        this("GND");
    }
}
