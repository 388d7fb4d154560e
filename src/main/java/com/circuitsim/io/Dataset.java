package com.circuitsim.io;

import com.circuitsim.result.ComplexVector;
import com.circuitsim.result.VectorNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed solver output. Immutable.
 *
 * <p>
 * Independent (sweep) and dependent vectors are kept in separate maps; a name
 * is never present in both. Both maps preserve the order vectors appeared in.
 */
public final class Dataset {
    private final SimulationStatus status;
    private final String version;
    private final Map<String, DataVector> independent;
    private final Map<String, DataVector> dependent;
    private final List<String> errors;
    private final List<String> warnings;
    private final String rawOutput;

    Dataset(SimulationStatus status, String version, Map<String, DataVector> independent,
            Map<String, DataVector> dependent, List<String> errors, List<String> warnings, String rawOutput) {
        this.status = status;
        this.version = version;
        this.independent = Collections.unmodifiableMap(new LinkedHashMap<>(independent));
        this.dependent = Collections.unmodifiableMap(new LinkedHashMap<>(dependent));
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
        this.rawOutput = rawOutput;
    }

    /** Dataset for a simulation that was never executed. */
    public static Dataset notRun() {
        return new Dataset(SimulationStatus.NOT_RUN, "", Map.of(), Map.of(), List.of(), List.of(), "");
    }

    public SimulationStatus status() {
        return status;
    }

    /** Format version from the header, or "" if none was seen. */
    public String version() {
        return version;
    }

    public Map<String, DataVector> independentVectors() {
        return independent;
    }

    public Map<String, DataVector> dependentVectors() {
        return dependent;
    }

    public List<String> errors() {
        return errors;
    }

    public List<String> warnings() {
        return warnings;
    }

    public String rawOutput() {
        return rawOutput;
    }

    public boolean hasErrors() {
        return status != SimulationStatus.SUCCESS || !errors.isEmpty();
    }

    public boolean contains(String name) {
        return independent.containsKey(name) || dependent.containsKey(name);
    }

    /** All vector names, independent first, each group in order of appearance. */
    public List<String> vectorNames() {
        List<String> names = new ArrayList<>(independent.size() + dependent.size());
        names.addAll(independent.keySet());
        names.addAll(dependent.keySet());
        return names;
    }

    /**
     * @throws VectorNotFoundException if neither map holds the name.
     */
    public DataVector vector(String name) {
        DataVector v = independent.get(name);
        if (v == null)
            v = dependent.get(name);
        if (v == null)
            throw new VectorNotFoundException(name, vectorNames());
        return v;
    }

    public ComplexVector complexVector(String name) {
        return vector(name).values();
    }

    public double[] realVector(String name) {
        return vector(name).values().real();
    }

    public double[] imagVector(String name) {
        return vector(name).values().imag();
    }

    @Override
    public String toString() {
        return "Dataset[status=" + status + ", version=" + version + ", vectors=" + vectorNames().size()
                + ", errors=" + errors.size() + ", warnings=" + warnings.size() + "]";
    }
}
