package com.circuitsim.result;

import com.circuitsim.io.Dataset;

import java.util.Map;

/** Small-signal frequency sweep. */
public final class AcResult extends NodalResult {
    private final double[] frequencies;

    AcResult(Dataset dataset, double[] frequencies, Map<String, ComplexVector> voltages,
            Map<String, ComplexVector> currents, int points) {
        super(dataset, voltages, currents, points);
        this.frequencies = frequencies;
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.AC;
    }

    /** Sweep frequencies in Hz. */
    public double[] frequencies() {
        return frequencies.clone();
    }
}
