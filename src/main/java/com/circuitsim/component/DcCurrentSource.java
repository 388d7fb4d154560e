package com.circuitsim.component;

import lombok.Getter;

/**
 * Ideal DC current source, current flowing internally from {@code nplus} to
 * {@code nminus}.
 */
@Getter
public class DcCurrentSource extends AbstractComponent {
    private int nplus;
    private int nminus;

    private final double dc;

    public DcCurrentSource(String name, double dc) {
        super(name);
        this.dc = dc;
    }
}
