package com.circuitsim.component;

import java.util.List;

/**
 * Four-terminal MOSFET.
 */
public class Mosfet extends ProvidedTerminals {
    public enum Polarity {
        NFET, PFET
    }

    private final Polarity polarity;
    private final double thresholdVoltage;

    public Mosfet(String name) {
        this(name, Polarity.NFET, 1.0);
    }

    public Mosfet(String name, Polarity polarity, double thresholdVoltage) {
        super(name, List.of("gate", "drain", "source", "bulk"));
        this.polarity = polarity;
        this.thresholdVoltage = thresholdVoltage;
    }

    public Polarity polarity() {
        return polarity;
    }

    public double thresholdVoltage() {
        return thresholdVoltage;
    }
}
