package com.circuitsim.result;

import java.util.List;

/**
 * Raised when a requested quantity is not present in a simulation result.
 * Carries the requested key and the keys that were available.
 */
public class ResultLookupException extends RuntimeException {
    private final String requested;
    private final List<String> available;

    public ResultLookupException(String message, String requested, List<String> available) {
        super(message);
        this.requested = requested;
        this.available = List.copyOf(available);
    }

    public String requested() {
        return requested;
    }

    public List<String> available() {
        return available;
    }
}
