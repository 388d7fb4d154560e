package com.circuitsim.api;

import java.util.List;

/**
 * Capability interface for components whose terminals cannot (or should not) be
 * discovered from field names.
 *
 * Implement this when the component has semantic pin names ("anode", "gate"),
 * or a terminal count that is only known at construction time (an N-port data
 * file has N+1 terminals).
 *
 * The order of {@link #terminalNames()} is significant: the first two terminals
 * define the branch-current sign convention for two-terminal sources.
 */
public interface TerminalProvider {

    /** Ordered, fixed terminal names. Must not change after construction. */
    List<String> terminalNames();

    /** Current node id of a terminal (0 until resolved). */
    int node(String terminal);

    /** Called by the resolver to publish a resolved node id. */
    void assignNode(String terminal, int nodeId);
}
