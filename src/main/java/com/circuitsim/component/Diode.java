package com.circuitsim.component;

import java.util.List;

/**
 * PN junction diode. Terminals are {@code cathode} then {@code anode}, the order
 * the netlist lists them in.
 */
public class Diode extends ProvidedTerminals {
    private final double saturationCurrent;
    private final double emissionCoefficient;

    public Diode(String name) {
        this(name, 1e-15, 1.0);
    }

    public Diode(String name, double saturationCurrent, double emissionCoefficient) {
        super(name, List.of("cathode", "anode"));
        this.saturationCurrent = requirePositive(saturationCurrent, "Saturation current");
        this.emissionCoefficient = requirePositive(emissionCoefficient, "Emission coefficient");
    }

    public double saturationCurrent() {
        return saturationCurrent;
    }

    public double emissionCoefficient() {
        return emissionCoefficient;
    }

    public int anode() {
        return node("anode");
    }

    public int cathode() {
        return node("cathode");
    }
}
