package com.circuitsim.result;

import java.util.List;

/**
 * The solver reports no branch current for the component. Only voltage sources,
 * inductors and current probes carry one.
 */
public class CurrentNotAvailableException extends ResultLookupException {
    public CurrentNotAvailableException(String component, String vectorName, List<String> available) {
        super("Current through '" + component + "' not available (no vector '" + vectorName
                + "'). Available: " + available, vectorName, available);
    }
}
