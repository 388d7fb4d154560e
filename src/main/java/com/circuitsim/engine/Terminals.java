package com.circuitsim.engine;

import com.circuitsim.api.Component;
import com.circuitsim.api.TerminalProvider;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Ordered terminal view of one component: names plus read/write access to each
 * terminal's node id.
 *
 * <p>
 * Discovery rule: a component implementing {@link TerminalProvider} is asked
 * directly. Anything else is scanned by reflection for instance {@code int}
 * fields named {@code n}, {@code n<digits>}, {@code nplus} or {@code nminus},
 * superclass fields first, in declaration order. A component with no such
 * fields has zero terminals and never takes part in node resolution.
 */
public abstract class Terminals {
    private static final Pattern TERMINAL_FIELD = Pattern.compile("n|n\\d+|nplus|nminus");

    // Scanned once per class; the field layout of a class never changes.
    private static final Map<Class<?>, Field[]> FIELD_CACHE = new ConcurrentHashMap<>();

    protected final Component component;

    private Terminals(Component component) {
        this.component = component;
    }

    /** Returns the terminal view for a component. */
    public static Terminals of(Component component) {
        if (component instanceof TerminalProvider provider)
            return new ProviderTerminals(component, provider);
        return new FieldTerminals(component, FIELD_CACHE.computeIfAbsent(component.getClass(), Terminals::scan));
    }

    /** True if a field name follows the terminal naming convention. */
    public static boolean isTerminalFieldName(String fieldName) {
        return TERMINAL_FIELD.matcher(fieldName).matches();
    }

    public abstract List<String> names();

    public int count() {
        return names().size();
    }

    /** Index of a terminal name, or -1 if the component has no such terminal. */
    public int indexOf(String terminal) {
        return names().indexOf(terminal);
    }

    /**
     * Index of a terminal name.
     *
     * @throws IllegalArgumentException if the component has no such terminal.
     */
    public int requireIndex(String terminal) {
        int idx = indexOf(terminal);
        if (idx < 0)
            throw new IllegalArgumentException("Component '" + component.name() + "' ("
                    + component.getClass().getSimpleName() + ") has no terminal '" + terminal
                    + "'. Terminals: " + names());
        return idx;
    }

    public abstract int read(int index);

    public abstract void write(int index, int nodeId);

    private static Field[] scan(Class<?> type) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass())
            hierarchy.add(c);
        Collections.reverse(hierarchy);

        List<Field> found = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field f : c.getDeclaredFields()) {
                if (f.getType() != int.class || Modifier.isStatic(f.getModifiers()) || f.isSynthetic())
                    continue;
                if (!isTerminalFieldName(f.getName()))
                    continue;
                f.setAccessible(true);
                found.add(f);
            }
        }
        return found.toArray(new Field[0]);
    }

    private static final class ProviderTerminals extends Terminals {
        private final TerminalProvider provider;
        private final List<String> names;

        ProviderTerminals(Component component, TerminalProvider provider) {
            super(component);
            this.provider = provider;
            this.names = List.copyOf(provider.terminalNames());
        }

        @Override
        public List<String> names() {
            return names;
        }

        @Override
        public int read(int index) {
            return provider.node(names.get(index));
        }

        @Override
        public void write(int index, int nodeId) {
            provider.assignNode(names.get(index), nodeId);
        }
    }

    private static final class FieldTerminals extends Terminals {
        private final Field[] fields;
        private final List<String> names;

        FieldTerminals(Component component, Field[] fields) {
            super(component);
            this.fields = fields;
            List<String> n = new ArrayList<>(fields.length);
            for (Field f : fields)
                n.add(f.getName());
            this.names = Collections.unmodifiableList(n);
        }

        @Override
        public List<String> names() {
            return names;
        }

        @Override
        public int read(int index) {
            try {
                return fields[index].getInt(component);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot read terminal " + names.get(index)
                        + " of " + component.name(), e);
            }
        }

        @Override
        public void write(int index, int nodeId) {
            try {
                fields[index].setInt(component, nodeId);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot write terminal " + names.get(index)
                        + " of " + component.name(), e);
            }
        }
    }
}
