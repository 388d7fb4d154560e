package com.circuitsim.component;

import lombok.Getter;

/**
 * Sinusoidal voltage source used for AC sweeps and transient runs.
 */
@Getter
public class AcVoltageSource extends AbstractComponent {
    private int nplus;
    private int nminus;

    private final double amplitude;
    private final double phaseDeg;
    private final double frequency;

    public AcVoltageSource(String name, double amplitude) {
        this(name, amplitude, 0.0, 1e9);
    }

    public AcVoltageSource(String name, double amplitude, double phaseDeg, double frequency) {
        super(name);
        this.amplitude = amplitude;
        this.phaseDeg = phaseDeg;
        this.frequency = frequency;
    }
}
