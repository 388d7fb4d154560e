package com.circuitsim.component;

import lombok.Getter;

/**
 * S-parameter port termination.
 *
 * <p>
 * {@code portNum} is an {@code int} parameter, not a terminal: only
 * {@code nplus} and {@code nminus} take part in node resolution.
 */
@Getter
public class PowerSource extends AbstractComponent {
    private int nplus;
    private int nminus;

    private final int portNum;
    private final double impedance;

    public PowerSource(String name, int portNum) {
        this(name, portNum, 50.0);
    }

    public PowerSource(String name, int portNum, double impedance) {
        super(name);
        if (portNum < 1)
            throw new IllegalArgumentException("Port number must be >= 1, got " + portNum);
        this.portNum = portNum;
        this.impedance = requirePositive(impedance, "Port impedance");
    }
}
