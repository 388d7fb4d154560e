package com.circuitsim.result;

import com.circuitsim.io.Dataset;

import java.util.Map;

/** Time-domain run. Samples are real. */
public final class TransientResult extends NodalResult {
    private final double[] time;

    TransientResult(Dataset dataset, double[] time, Map<String, ComplexVector> voltages,
            Map<String, ComplexVector> currents, int points) {
        super(dataset, voltages, currents, points);
        this.time = time;
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.TRANSIENT;
    }

    /** Time points in seconds. */
    public double[] time() {
        return time.clone();
    }
}
