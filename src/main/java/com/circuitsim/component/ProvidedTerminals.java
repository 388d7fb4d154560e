package com.circuitsim.component;

import com.circuitsim.api.TerminalProvider;

import java.util.List;

/**
 * Base for components whose terminal names do not follow the {@code n1/nplus}
 * field convention. Node ids live in an array indexed like the name list.
 */
abstract class ProvidedTerminals extends AbstractComponent implements TerminalProvider {
    private final List<String> terminalNames;
    private final int[] nodes;

    ProvidedTerminals(String name, List<String> terminalNames) {
        super(name);
        this.terminalNames = List.copyOf(terminalNames);
        this.nodes = new int[this.terminalNames.size()];
    }

    @Override
    public final List<String> terminalNames() {
        return terminalNames;
    }

    @Override
    public final int node(String terminal) {
        return nodes[indexOf(terminal)];
    }

    @Override
    public final void assignNode(String terminal, int nodeId) {
        nodes[indexOf(terminal)] = nodeId;
    }

    private int indexOf(String terminal) {
        int idx = terminalNames.indexOf(terminal);
        if (idx < 0)
            throw new IllegalArgumentException("Unknown terminal '" + terminal + "' on " + name());
        return idx;
    }
}
