package com.circuitsim.io;

import com.circuitsim.api.Component;
import com.circuitsim.dsl.CircuitBuilder;
import com.circuitsim.engine.Circuit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Compiles a JSON {@link CircuitDefinition} into a {@link Circuit}.
 *
 * <pre>
 * {"circuit": {
 *   "name": "divider",
 *   "components": [
 *     {"name": "V1", "type": "dc_voltage_source", "properties": {"dc": 5.0}},
 *     {"name": "R1", "type": "resistor", "properties": {"r": 1000}},
 *     {"name": "GND", "type": "ground"}
 *   ],
 *   "connections": [["V1.nplus", "R1.n1"], ["V1.nminus", "R1.n2", "GND"]]
 * }}
 * </pre>
 *
 * Missing properties fall back to per-type defaults.
 */
public final class JsonCircuitCompiler {
    private static final Logger log = LogManager.getLogger(JsonCircuitCompiler.class);

    private final ObjectMapper mapper = new ObjectMapper();

    /** Reads a circuit file. */
    public CircuitDefinition parseFile(Path path) throws IOException {
        return mapper.readValue(path.toFile(), CircuitDefinition.class);
    }

    /**
     * Reads a circuit definition from JSON text.
     *
     * @throws IllegalArgumentException if the text is not a valid definition.
     */
    public CircuitDefinition parse(String json) {
        try {
            return mapper.readValue(json, CircuitDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid circuit JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String toJson(CircuitDefinition def) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(def);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize circuit definition", e);
        }
    }

    /** Parses and compiles a file. The circuit is returned unresolved. */
    public CompiledCircuit load(Path path) throws IOException {
        return compile(parseFile(path));
    }

    /**
     * Compiles the definition. Components are added in file order, then every
     * connection entry is joined into one net.
     *
     * @throws IllegalArgumentException on unknown types, duplicate names or bad
     *                                  pin references.
     */
    public CompiledCircuit compile(CircuitDefinition def) {
        CircuitDefinition.CircuitInfo info = def.getCircuit();
        if (info == null)
            throw new IllegalArgumentException("Missing 'circuit' key");
        String name = info.getName() != null ? info.getName() : "circuit";

        CircuitBuilder builder = CircuitBuilder.create(name);
        Map<String, String> types = new LinkedHashMap<>();
        for (CircuitDefinition.ComponentDef cd : nullToEmpty(info.getComponents())) {
            if (cd.getName() == null || cd.getType() == null)
                throw new IllegalArgumentException("Component entry needs 'name' and 'type': " + cd);
            ComponentType type = ComponentType.fromString(cd.getType());
            Map<String, Object> props = cd.getProperties() != null ? cd.getProperties() : Collections.emptyMap();
            builder.add(type.getFactory().create(cd.getName(), props));
            types.put(cd.getName(), type.name());
        }

        int nets = 0;
        for (List<String> net : nullToEmpty(info.getConnections())) {
            builder.net(net.toArray(new String[0]));
            nets++;
        }

        Map<String, Component> byName = builder.componentsByName();
        log.info("Compiled circuit '{}': {} components, {} connection groups", name, byName.size(), nets);
        return new CompiledCircuit(name, info.getDescription(), builder.build(),
                Collections.unmodifiableMap(new LinkedHashMap<>(byName)),
                Collections.unmodifiableMap(types));
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    static double getDouble(Map<String, Object> props, String key, double def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
    }

    static int getInt(Map<String, Object> props, String key, int def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString());
    }

    static String getString(Map<String, Object> props, String key, String def) {
        Object v = props.get(key);
        return v == null ? def : v.toString();
    }

    /** Factory for creating components from JSON definitions. */
    @FunctionalInterface
    public interface ComponentFactory {
        Component create(String name, Map<String, Object> properties);
    }

    /** The result of compilation: an unresolved circuit plus name lookups. */
    public record CompiledCircuit(
            String name, String description, Circuit circuit,
            Map<String, Component> componentsByName, Map<String, String> logicalTypes) {

        public Component component(String componentName) {
            Component c = componentsByName.get(componentName);
            if (c == null)
                throw new IllegalArgumentException("Unknown component: " + componentName);
            return c;
        }
    }
}
