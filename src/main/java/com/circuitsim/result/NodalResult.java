package com.circuitsim.result;

import com.circuitsim.io.Dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node voltages and branch currents of a DC, AC or transient run.
 *
 * <p>
 * Voltages are keyed by node name ({@code "_net1"}) or probe name, currents by
 * component name, both with the analysis suffix removed.
 */
public abstract class NodalResult implements TypedResult {
    private final Dataset dataset;
    private final Map<String, ComplexVector> voltages;
    private final Map<String, ComplexVector> currents;
    private final int points;

    protected NodalResult(Dataset dataset, Map<String, ComplexVector> voltages,
            Map<String, ComplexVector> currents, int points) {
        this.dataset = dataset;
        this.voltages = Collections.unmodifiableMap(new LinkedHashMap<>(voltages));
        this.currents = Collections.unmodifiableMap(new LinkedHashMap<>(currents));
        this.points = points;
    }

    @Override
    public Dataset dataset() {
        return dataset;
    }

    @Override
    public int points() {
        return points;
    }

    public Map<String, ComplexVector> voltages() {
        return voltages;
    }

    public Map<String, ComplexVector> currents() {
        return currents;
    }

    public boolean hasVoltage(String name) {
        return voltages.containsKey(name);
    }

    public boolean hasCurrent(String componentName) {
        return currents.containsKey(componentName);
    }

    /**
     * @throws VectorNotFoundException if no voltage is reported under the name.
     */
    public ComplexVector voltage(String name) {
        ComplexVector v = voltages.get(name);
        if (v == null)
            throw new VectorNotFoundException(kind().voltageVector(name), sorted(voltages.keySet()));
        return v;
    }

    /**
     * @throws CurrentNotAvailableException if the component reports no current.
     */
    public ComplexVector current(String componentName) {
        ComplexVector i = currents.get(componentName);
        if (i == null)
            throw new CurrentNotAvailableException(componentName, kind().currentVector(componentName),
                    sorted(currents.keySet()));
        return i;
    }

    static List<String> sorted(Iterable<String> names) {
        List<String> out = new ArrayList<>();
        names.forEach(out::add);
        Collections.sort(out);
        return out;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[points=" + points + ", voltages=" + voltages.keySet()
                + ", currents=" + currents.keySet() + "]";
    }
}
