package com.circuitsim.result;

import java.util.Locale;

/**
 * Analysis families and the vector naming each one uses in a Qucs dataset.
 */
public enum AnalysisKind {
    DC(null, ".V", ".I"),
    AC("acfrequency", ".v", ".i"),
    TRANSIENT("time", ".Vt", ".It"),
    S_PARAMETER("frequency", ".v", ".i");

    private final String sweepVector;
    private final String voltageSuffix;
    private final String currentSuffix;

    AnalysisKind(String sweepVector, String voltageSuffix, String currentSuffix) {
        this.sweepVector = sweepVector;
        this.voltageSuffix = voltageSuffix;
        this.currentSuffix = currentSuffix;
    }

    /** Name of the independent sweep vector, or null for a single operating point. */
    public String sweepVector() {
        return sweepVector;
    }

    /** Dataset vector holding the voltage of a named node. */
    public String voltageVector(String nodeName) {
        return nodeName + voltageSuffix;
    }

    /** Dataset vector holding the branch current of a named component. */
    public String currentVector(String componentName) {
        return componentName + currentSuffix;
    }

    /** Dataset vector of an S-parameter entry, 1-based. */
    public static String sParameterVector(int i, int j) {
        return "S[" + i + "," + j + "]";
    }

    public static AnalysisKind fromString(String s) {
        String key = s.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (key) {
        case "DC":
            return DC;
        case "AC":
            return AC;
        case "TRAN":
        case "TRANSIENT":
            return TRANSIENT;
        case "SP":
        case "SPARAM":
        case "S_PARAMETER":
        case "S_PARAMETERS":
            return S_PARAMETER;
        default:
            throw new IllegalArgumentException("Unknown analysis: " + s);
        }
    }
}
