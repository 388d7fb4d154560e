package com.circuitsim.io;

import com.circuitsim.component.*;

import static com.circuitsim.io.JsonCircuitCompiler.getDouble;
import static com.circuitsim.io.JsonCircuitCompiler.getInt;
import static com.circuitsim.io.JsonCircuitCompiler.getString;

import java.util.Locale;

public enum ComponentType {
    GROUND(Ground.class, (name, props) -> new Ground(name)),
    RESISTOR(Resistor.class, (name, props) -> new Resistor(name, getDouble(props, "r", 50.0))),
    CAPACITOR(Capacitor.class, (name, props) -> new Capacitor(name, getDouble(props, "c", 1e-12))),
    INDUCTOR(Inductor.class, (name, props) -> new Inductor(name, getDouble(props, "l", 1e-9))),
    DC_VOLTAGE_SOURCE(DcVoltageSource.class, (name, props) -> new DcVoltageSource(name, getDouble(props, "dc", 0.0))),
    DC_CURRENT_SOURCE(DcCurrentSource.class, (name, props) -> new DcCurrentSource(name, getDouble(props, "dc", 0.0))),
    AC_VOLTAGE_SOURCE(AcVoltageSource.class, (name, props) -> new AcVoltageSource(name,
            getDouble(props, "amplitude", 1.0), getDouble(props, "phase", 0.0), getDouble(props, "frequency", 1e9))),
    POWER_SOURCE(PowerSource.class, (name, props) -> new PowerSource(name,
            getInt(props, "port", 1), getDouble(props, "impedance", 50.0))),
    VOLTAGE_PROBE(VoltageProbe.class, (name, props) -> new VoltageProbe(name)),
    CURRENT_PROBE(CurrentProbe.class, (name, props) -> new CurrentProbe(name)),
    DIODE(Diode.class, (name, props) -> new Diode(name,
            getDouble(props, "is", 1e-15), getDouble(props, "n", 1.0))),
    MOSFET(Mosfet.class, (name, props) -> new Mosfet(name,
            Mosfet.Polarity.valueOf(getString(props, "polarity", "nfet").toUpperCase(Locale.ROOT)),
            getDouble(props, "vth", 1.0))),
    SPARAMETER_FILE(SParameterFile.class, (name, props) -> {
        String file = getString(props, "file", null);
        if (file == null)
            throw new IllegalArgumentException("sparameter_file '" + name + "' needs a 'file' property");
        int ports = getInt(props, "ports", -1);
        return ports > 0 ? new SParameterFile(name, file, ports) : new SParameterFile(name, file);
    }),
    SUBSTRATE(Substrate.class, (name, props) -> new Substrate(name,
            getDouble(props, "er", 9.8), getDouble(props, "h", 0.635e-3),
            getDouble(props, "t", 17.5e-6), getDouble(props, "tand", 0.0)));

    private final Class<?> componentClass;
    private final JsonCircuitCompiler.ComponentFactory factory;

    ComponentType(Class<?> componentClass, JsonCircuitCompiler.ComponentFactory factory) {
        this.componentClass = componentClass;
        this.factory = factory;
    }

    public Class<?> getComponentClass() {
        return componentClass;
    }

    public JsonCircuitCompiler.ComponentFactory getFactory() {
        return factory;
    }

    /** Case-insensitive; "dc-voltage-source", "DC_VOLTAGE_SOURCE" and "DcVoltageSource" all match. */
    public static ComponentType fromString(String text) {
        String key = normalize(text);
        for (ComponentType t : ComponentType.values()) {
            if (normalize(t.name()).equals(key) || normalize(t.componentClass.getSimpleName()).equals(key))
                return t;
        }
        throw new IllegalArgumentException("Unknown ComponentType: " + text);
    }

    private static String normalize(String s) {
        return s.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
