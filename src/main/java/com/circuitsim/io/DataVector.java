package com.circuitsim.io;

import com.circuitsim.result.ComplexVector;

import java.util.List;

/**
 * One named vector from a dataset.
 *
 * @param name         vector name, e.g. "frequency" or "_net1.v".
 * @param values       samples; real data has zero imaginary parts.
 * @param dependencies independent vectors this one is swept over (empty for
 *                     independent vectors).
 * @param independent  true for sweep axes.
 */
public record DataVector(String name, ComplexVector values, List<String> dependencies, boolean independent) {
    public DataVector {
        dependencies = List.copyOf(dependencies);
    }

    public int size() {
        return values.size();
    }
}
