package com.circuitsim.api;

/**
 * Marker for components whose terminals are the circuit's reference node.
 *
 * Every net touching a terminal of a ground reference resolves to node 0. Separate
 * ground components need not be wired together: ground is a single virtual node.
 */
public interface GroundReference extends Component {
}
