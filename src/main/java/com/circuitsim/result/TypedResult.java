package com.circuitsim.result;

import com.circuitsim.io.Dataset;

/**
 * Analysis-shaped, read-only view of a {@link Dataset}.
 */
public interface TypedResult {

    AnalysisKind kind();

    /** The dataset this view was derived from. */
    Dataset dataset();

    /** Number of sweep points; 1 for an operating point. */
    int points();
}
