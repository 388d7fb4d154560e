package com.circuitsim;

import com.circuitsim.api.Component;
import com.circuitsim.component.PowerSource;
import com.circuitsim.engine.Circuit;
import com.circuitsim.engine.NodeTable;
import com.circuitsim.io.Dataset;
import com.circuitsim.io.JsonCircuitCompiler;
import com.circuitsim.io.QucsDatasetParser;
import com.circuitsim.result.AnalysisKind;
import com.circuitsim.result.NodalResult;
import com.circuitsim.result.SParameterResult;
import com.circuitsim.result.SimulationResult;
import com.circuitsim.result.TypedResults;
import com.circuitsim.util.CircuitExplain;
import com.circuitsim.util.DatasetSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A high-level wrapper tying circuit construction, node resolution and result
 * binding together.
 * <p>
 * Typical round trip:
 * <ul>
 * <li>load a JSON circuit (or wrap a {@link Circuit} built in code)</li>
 * <li>{@link #resolve()} to number the nets</li>
 * <li>emit the netlist and run the solver (outside this library)</li>
 * <li>{@link #bind(String, AnalysisKind)} the solver's stdout and query
 * pins</li>
 * </ul>
 */
public class CircuitSim {
    private static final Logger log = LogManager.getLogger(CircuitSim.class);

    private final Circuit circuit;
    private final Map<String, Component> components;

    /**
     * Loads a circuit from a JSON file path string.
     *
     * @param jsonPath relative or absolute path to the JSON circuit definition.
     */
    public CircuitSim(String jsonPath) {
        this(Path.of(jsonPath));
    }

    public CircuitSim(Path jsonPath) {
        JsonCircuitCompiler.CompiledCircuit compiled;
        try {
            compiled = new JsonCircuitCompiler().load(jsonPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load circuit definition from " + jsonPath, e);
        }
        this.circuit = compiled.circuit();
        this.components = compiled.componentsByName();
        log.info("Loaded circuit '{}' from {}", circuit.name(), jsonPath);
    }

    /** Wraps a circuit built in code. Component names must be unique. */
    public CircuitSim(Circuit circuit) {
        this.circuit = circuit;
        Map<String, Component> byName = new LinkedHashMap<>();
        for (Component c : circuit.components()) {
            if (byName.putIfAbsent(c.name(), c) != null)
                throw new IllegalArgumentException("Duplicate component name: " + c.name());
        }
        this.components = byName;
    }

    public Circuit circuit() {
        return circuit;
    }

    public Component component(String name) {
        Component c = components.get(name);
        if (c == null)
            throw new IllegalArgumentException("Unknown component: " + name);
        return c;
    }

    /** Resolves nodes if the circuit changed since the last resolution. */
    public NodeTable resolve() {
        return circuit.isResolved() ? circuit.nodeTable() : circuit.resolveNodes();
    }

    /** Parses solver output. Never throws for malformed output. */
    public Dataset parse(String solverOutput) {
        return QucsDatasetParser.parse(solverOutput);
    }

    /**
     * Parses solver output and binds it to the node numbering of the last
     * resolution, the one the netlist was written from. Edits made since then
     * do not renumber the bound result.
     *
     * @param kind DC, AC or TRANSIENT.
     * @throws IllegalArgumentException for S-parameter runs; use
     *                                  {@link #sParameters(String)}.
     * @throws IllegalStateException    if the circuit was never resolved.
     */
    public SimulationResult bind(String solverOutput, AnalysisKind kind) {
        return bind(parse(solverOutput), kind);
    }

    public SimulationResult bind(Dataset dataset, AnalysisKind kind) {
        if (kind == AnalysisKind.S_PARAMETER)
            throw new IllegalArgumentException("S-parameter results are port based; use sParameters()");
        if (dataset.hasErrors())
            log.warn("Binding dataset with status {}:\n{}", dataset.status(), DatasetSummary.of(dataset));
        NodeTable table = circuit.nodeTable();
        if (!circuit.isResolved())
            log.warn("Circuit '{}' changed since it was resolved; binding to the previous node numbering",
                    circuit.name());
        NodalResult typed = (NodalResult) TypedResults.extract(dataset, kind);
        return new SimulationResult(table, typed);
    }

    /** S-parameters sized by the circuit's port count, referenced to the first port's impedance. */
    public SParameterResult sParameters(String solverOutput) {
        int ports = 0;
        double z0 = SParameterResult.DEFAULT_Z0;
        for (Component c : circuit.components()) {
            if (c instanceof PowerSource p) {
                if (p.getPortNum() == 1)
                    z0 = p.getImpedance();
                ports = Math.max(ports, p.getPortNum());
            }
        }
        return TypedResults.sParameters(parse(solverOutput), ports, z0);
    }

    public String explain() {
        resolve();
        return new CircuitExplain(circuit).dumpNets();
    }
}
