package com.circuitsim.component;

import lombok.Getter;

/**
 * Ideal DC voltage source. The solver reports its branch current as
 * {@code <name>.I}, flowing internally from {@code nplus} to {@code nminus}.
 */
@Getter
public class DcVoltageSource extends AbstractComponent {
    private int nplus;
    private int nminus;

    private final double dc;

    public DcVoltageSource(String name, double dc) {
        super(name);
        this.dc = dc;
    }
}
