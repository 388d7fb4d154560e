package com.circuitsim.result;

import com.circuitsim.io.Dataset;

import java.util.Collections;
import java.util.Map;

/**
 * Scattering parameters over a frequency sweep.
 *
 * <p>
 * Entries are stored sparsely, keyed by 1-based port pair. A pair the solver did
 * not report (ports with no electrical path between them) reads as a zero
 * vector of the sweep length.
 */
public final class SParameterResult implements TypedResult {
    public static final double DEFAULT_Z0 = 50.0;

    private final Dataset dataset;
    private final double[] frequencies;
    private final int numPorts;
    private final double z0;
    private final Map<PortPair, ComplexVector> entries;

    /** 1-based (output, input) port pair. */
    public record PortPair(int i, int j) {
        @Override
        public String toString() {
            return AnalysisKind.sParameterVector(i, j);
        }
    }

    SParameterResult(Dataset dataset, double[] frequencies, int numPorts, double z0,
            Map<PortPair, ComplexVector> entries) {
        this.dataset = dataset;
        this.frequencies = frequencies;
        this.numPorts = numPorts;
        this.z0 = z0;
        this.entries = Collections.unmodifiableMap(entries);
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.S_PARAMETER;
    }

    @Override
    public Dataset dataset() {
        return dataset;
    }

    @Override
    public int points() {
        return frequencies.length;
    }

    public double[] frequencies() {
        return frequencies.clone();
    }

    public int numPorts() {
        return numPorts;
    }

    /** Reference impedance in Ohm. */
    public double z0() {
        return z0;
    }

    /** Entries the solver actually reported. */
    public Map<PortPair, ComplexVector> reported() {
        return entries;
    }

    public boolean isReported(int i, int j) {
        return entries.containsKey(new PortPair(i, j));
    }

    /**
     * S<sub>ij</sub> over the sweep.
     *
     * @throws IllegalArgumentException if a port index is outside 1..numPorts.
     */
    public ComplexVector s(int i, int j) {
        checkPort(i);
        checkPort(j);
        ComplexVector v = entries.get(new PortPair(i, j));
        return v != null ? v : ComplexVector.zeros(frequencies.length);
    }

    /** Full matrix, 0-based: {@code sMatrix()[i-1][j-1] == s(i, j)}. */
    public ComplexVector[][] sMatrix() {
        ComplexVector[][] m = new ComplexVector[numPorts][numPorts];
        for (int i = 1; i <= numPorts; i++)
            for (int j = 1; j <= numPorts; j++)
                m[i - 1][j - 1] = s(i, j);
        return m;
    }

    /** |S<sub>ij</sub>| in dB at every sweep point. */
    public double[] magnitudeDb(int i, int j) {
        double[] mag = s(i, j).abs();
        for (int k = 0; k < mag.length; k++)
            mag[k] = 20.0 * Math.log10(mag[k]);
        return mag;
    }

    private void checkPort(int p) {
        if (p < 1 || p > numPorts)
            throw new IllegalArgumentException("Port " + p + " out of range 1.." + numPorts);
    }

    @Override
    public String toString() {
        return "SParameterResult[ports=" + numPorts + ", points=" + frequencies.length + ", z0=" + z0
                + ", reported=" + entries.keySet() + "]";
    }
}
