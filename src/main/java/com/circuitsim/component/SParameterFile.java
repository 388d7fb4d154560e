package com.circuitsim.component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * N-port block backed by a Touchstone file. Exposes {@code n1..nN} plus a
 * shared {@code ref} terminal, so an N-port has N+1 terminals.
 */
public class SParameterFile extends ProvidedTerminals {
    private static final Pattern TOUCHSTONE_EXT = Pattern.compile(".*\\.s(\\d+)p$");

    private final String file;
    private final int numPorts;

    public SParameterFile(String name, String file) {
        this(name, file, portsFromExtension(file));
    }

    public SParameterFile(String name, String file, int numPorts) {
        super(name, terminalNames(numPorts));
        this.file = file;
        this.numPorts = numPorts;
    }

    public String file() {
        return file;
    }

    public int numPorts() {
        return numPorts;
    }

    /**
     * Port count from a Touchstone extension such as {@code .s2p}.
     *
     * @throws IllegalArgumentException if the name carries no port count.
     */
    public static int portsFromExtension(String file) {
        Matcher m = TOUCHSTONE_EXT.matcher(file.toLowerCase(Locale.ROOT));
        if (!m.matches())
            throw new IllegalArgumentException("Cannot infer port count from file name: " + file);
        return Integer.parseInt(m.group(1));
    }

    private static List<String> terminalNames(int numPorts) {
        if (numPorts < 1)
            throw new IllegalArgumentException("Port count must be >= 1, got " + numPorts);
        List<String> names = new ArrayList<>(numPorts + 1);
        for (int i = 1; i <= numPorts; i++)
            names.add("n" + i);
        names.add("ref");
        return names;
    }
}
