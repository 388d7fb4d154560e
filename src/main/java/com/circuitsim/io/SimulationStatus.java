package com.circuitsim.io;

/** Outcome of a solver run as read from its output. */
public enum SimulationStatus {
    SUCCESS,
    /** Solver reported at least one error line. */
    ERROR,
    /** Output was empty or carried no recognizable dataset. */
    PARSE_ERROR,
    NOT_RUN
}
