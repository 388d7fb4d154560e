package com.circuitsim.result;

import com.circuitsim.io.Dataset;

import java.util.Map;

/** Operating point. Every vector holds a single real sample. */
public final class DcResult extends NodalResult {

    DcResult(Dataset dataset, Map<String, ComplexVector> voltages, Map<String, ComplexVector> currents) {
        super(dataset, voltages, currents, 1);
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.DC;
    }

    /** Scalar voltage of a node or probe. */
    public double voltageValue(String name) {
        return first(voltage(name));
    }

    /** Scalar branch current of a component. */
    public double currentValue(String componentName) {
        return first(current(componentName));
    }

    static double first(ComplexVector v) {
        return v.isEmpty() ? 0.0 : v.re(0);
    }
}
