package com.circuitsim.component;

/**
 * Microstrip substrate definition. Has no electrical terminals; it is referenced
 * by name from line components and skipped by node resolution.
 */
public class Substrate extends AbstractComponent {
    private final double er;
    private final double height;
    private final double thickness;
    private final double lossTangent;

    public Substrate(String name, double er, double height, double thickness, double lossTangent) {
        super(name);
        this.er = requirePositive(er, "Relative permittivity");
        this.height = requirePositive(height, "Substrate height");
        this.thickness = thickness;
        this.lossTangent = lossTangent;
    }

    public double er() {
        return er;
    }

    public double height() {
        return height;
    }

    public double thickness() {
        return thickness;
    }

    public double lossTangent() {
        return lossTangent;
    }
}
