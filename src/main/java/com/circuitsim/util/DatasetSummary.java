package com.circuitsim.util;

import com.circuitsim.io.DataVector;
import com.circuitsim.io.Dataset;

/**
 * Human-readable summary of a parsed dataset.
 */
public final class DatasetSummary {
    private DatasetSummary() {
        // Utility class
    }

    public static String of(Dataset ds) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Qucs Dataset Summary\n")
                .append("  Status: ").append(ds.status()).append('\n')
                .append("  Version: ").append(ds.version().isEmpty() ? "(none)" : ds.version()).append('\n');

        if (!ds.errors().isEmpty()) {
            sb.append("  Errors (").append(ds.errors().size()).append("):\n");
            for (String e : ds.errors())
                sb.append("    ").append(e).append('\n');
        }
        if (!ds.warnings().isEmpty()) {
            sb.append("  Warnings (").append(ds.warnings().size()).append("):\n");
            for (String w : ds.warnings())
                sb.append("    ").append(w).append('\n');
        }

        sb.append("  Independent vectors (").append(ds.independentVectors().size()).append("):\n");
        for (DataVector v : ds.independentVectors().values())
            sb.append("    ").append(v.name()).append(": ").append(v.size()).append(" points\n");

        sb.append("  Dependent vectors (").append(ds.dependentVectors().size()).append("):\n");
        for (DataVector v : ds.dependentVectors().values()) {
            sb.append("    ").append(v.name()).append(": ").append(v.size()).append(" points");
            if (!v.dependencies().isEmpty())
                sb.append(" (depends on: ").append(String.join(", ", v.dependencies())).append(')');
            sb.append('\n');
        }
        return sb.toString();
    }
}
