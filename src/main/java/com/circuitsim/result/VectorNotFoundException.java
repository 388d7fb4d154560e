package com.circuitsim.result;

import java.util.List;

public class VectorNotFoundException extends ResultLookupException {
    public VectorNotFoundException(String vectorName, List<String> available) {
        super("Vector '" + vectorName + "' not found. Available: " + available, vectorName, available);
    }
}
