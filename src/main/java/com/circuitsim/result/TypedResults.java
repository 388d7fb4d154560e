package com.circuitsim.result;

import com.circuitsim.io.DataVector;
import com.circuitsim.io.Dataset;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds typed views from a dataset by vector naming convention.
 *
 * <ul>
 * <li>DC: {@code <node>.V}, {@code <component>.I}</li>
 * <li>AC: {@code <node>.v}, {@code <component>.i} over {@code acfrequency}</li>
 * <li>Transient: {@code <node>.Vt}, {@code <component>.It} over {@code time}</li>
 * <li>S-parameters: {@code S[i,j]} over {@code frequency}</li>
 * </ul>
 *
 * Vectors that match no convention are ignored. Extraction never fails on
 * missing vectors; the views report what is there.
 */
public final class TypedResults {
    private static final Logger log = LogManager.getLogger(TypedResults.class);

    private static final Pattern S_ENTRY = Pattern.compile("S\\[\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\]");

    private TypedResults() {
        // Utility class
    }

    public static TypedResult extract(Dataset dataset, AnalysisKind kind) {
        return switch (kind) {
            case DC -> dc(dataset);
            case AC -> ac(dataset);
            case TRANSIENT -> tran(dataset);
            case S_PARAMETER -> sParameters(dataset);
        };
    }

    public static DcResult dc(Dataset dataset) {
        Map<String, ComplexVector> v = new LinkedHashMap<>();
        Map<String, ComplexVector> i = new LinkedHashMap<>();
        split(dataset, AnalysisKind.DC, v, i);
        logExtracted(AnalysisKind.DC, v.size(), i.size(), 1);
        return new DcResult(dataset, v, i);
    }

    public static AcResult ac(Dataset dataset) {
        Map<String, ComplexVector> v = new LinkedHashMap<>();
        Map<String, ComplexVector> i = new LinkedHashMap<>();
        split(dataset, AnalysisKind.AC, v, i);
        double[] f = sweep(dataset, AnalysisKind.AC);
        logExtracted(AnalysisKind.AC, v.size(), i.size(), f.length);
        return new AcResult(dataset, f, v, i, points(f, v, i));
    }

    public static TransientResult tran(Dataset dataset) {
        Map<String, ComplexVector> v = new LinkedHashMap<>();
        Map<String, ComplexVector> i = new LinkedHashMap<>();
        split(dataset, AnalysisKind.TRANSIENT, v, i);
        double[] t = sweep(dataset, AnalysisKind.TRANSIENT);
        logExtracted(AnalysisKind.TRANSIENT, v.size(), i.size(), t.length);
        return new TransientResult(dataset, t, v, i, points(t, v, i));
    }

    /** S-parameters with the port count inferred from the highest index seen and a 50 Ohm reference. */
    public static SParameterResult sParameters(Dataset dataset) {
        return sParameters(dataset, -1, SParameterResult.DEFAULT_Z0);
    }

    /**
     * @param numPorts port count, or a non-positive value to infer it from the
     *                 highest port index in the dataset.
     * @param z0       reference impedance in Ohm.
     */
    public static SParameterResult sParameters(Dataset dataset, int numPorts, double z0) {
        if (!(z0 > 0))
            throw new IllegalArgumentException("Reference impedance must be positive, got " + z0);

        Map<SParameterResult.PortPair, ComplexVector> entries = new LinkedHashMap<>();
        int maxPort = 0;
        for (DataVector dv : dataset.dependentVectors().values()) {
            Matcher m = S_ENTRY.matcher(dv.name());
            if (!m.matches())
                continue;
            int i;
            int j;
            try {
                i = Integer.parseInt(m.group(1));
                j = Integer.parseInt(m.group(2));
            } catch (NumberFormatException e) {
                log.warn("Ignoring S-parameter vector with out of range port index: {}", dv.name());
                continue;
            }
            if (i < 1 || j < 1) {
                log.warn("Ignoring S-parameter vector with invalid port index: {}", dv.name());
                continue;
            }
            entries.put(new SParameterResult.PortPair(i, j), dv.values());
            maxPort = Math.max(maxPort, Math.max(i, j));
        }

        int ports = numPorts > 0 ? numPorts : maxPort;
        if (numPorts > 0 && maxPort > numPorts)
            throw new IllegalArgumentException("Dataset reports port " + maxPort + " but circuit has "
                    + numPorts + " ports");

        double[] f = sweep(dataset, AnalysisKind.S_PARAMETER);
        if (f.length == 0 && !entries.isEmpty())
            log.warn("S-parameter dataset has no '{}' vector", AnalysisKind.S_PARAMETER.sweepVector());
        log.debug("Extracted S-parameters: {} ports, {} of {} entries reported, {} points",
                ports, entries.size(), ports * ports, f.length);
        return new SParameterResult(dataset, f, ports, z0, entries);
    }

    private static void split(Dataset dataset, AnalysisKind kind, Map<String, ComplexVector> voltages,
            Map<String, ComplexVector> currents) {
        String vSuffix = kind.voltageVector("");
        String iSuffix = kind.currentVector("");
        for (DataVector dv : dataset.dependentVectors().values()) {
            String name = dv.name();
            if (name.endsWith(vSuffix) && name.length() > vSuffix.length())
                voltages.put(name.substring(0, name.length() - vSuffix.length()), dv.values());
            else if (name.endsWith(iSuffix) && name.length() > iSuffix.length())
                currents.put(name.substring(0, name.length() - iSuffix.length()), dv.values());
        }
    }

    private static double[] sweep(Dataset dataset, AnalysisKind kind) {
        DataVector axis = dataset.independentVectors().get(kind.sweepVector());
        return axis != null ? axis.values().real() : new double[0];
    }

    /** Sweep length, or the longest vector when the sweep axis is missing. */
    private static int points(double[] sweep, Map<String, ComplexVector> v, Map<String, ComplexVector> i) {
        if (sweep.length > 0)
            return sweep.length;
        int n = 0;
        for (ComplexVector cv : v.values())
            n = Math.max(n, cv.size());
        for (ComplexVector cv : i.values())
            n = Math.max(n, cv.size());
        return n;
    }

    private static void logExtracted(AnalysisKind kind, int voltages, int currents, int points) {
        log.debug("Extracted {} result: {} voltages, {} currents, {} points", kind, voltages, currents, points);
    }
}
