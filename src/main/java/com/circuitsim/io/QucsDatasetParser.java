package com.circuitsim.io;

import com.circuitsim.result.ComplexVector;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the Qucs dataset text the solver writes to stdout.
 *
 * <p>
 * Format:
 *
 * <pre>
 * &lt;Qucs Dataset 0.0.19&gt;
 * &lt;indep frequency 3&gt;
 *   +1.00000000000000e+09
 *   ...
 * &lt;/indep&gt;
 * &lt;dep S[1,1] frequency&gt;
 *   +5.00000000000000e-01-j5.00000000000000e-01
 *   ...
 * &lt;/dep&gt;
 * </pre>
 *
 * <p>
 * Parsing never throws on malformed content. Solver error lines, unparseable
 * values and size mismatches end up in the dataset's status, errors and
 * warnings, and whatever vectors could be read are kept.
 */
public final class QucsDatasetParser {
    private static final Logger log = LogManager.getLogger(QucsDatasetParser.class);

    private static final Pattern VERSION = Pattern.compile("<(?:Qucs )?Dataset ([^>]+)>");
    private static final Pattern INDEP = Pattern.compile("<indep\\s+(\\S+)\\s+(\\d+)>");
    private static final Pattern DEP = Pattern.compile("<dep\\s+(\\S+)(.*)>");
    private static final Pattern REAL = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Pattern IMAG_MARKER = Pattern.compile("[+-]j");

    private QucsDatasetParser() {
        // Utility class
    }

    /** Reads and parses a dataset file. */
    public static Dataset parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses raw solver output. Total: never throws for malformed input. */
    public static Dataset parse(String output) {
        if (output == null || output.isBlank()) {
            log.warn("Empty solver output");
            return new Dataset(SimulationStatus.PARSE_ERROR, "", Map.of(), Map.of(),
                    List.of("Empty output received"), List.of(), output == null ? "" : output);
        }

        Scan scan = new Scan();
        String[] lines = output.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++)
            scan.line(i + 1, lines[i].strip());
        scan.finish();

        Dataset ds = new Dataset(scan.status, scan.version, scan.independent, scan.dependent,
                scan.errors, scan.warnings, output);
        log.debug("Parsed dataset: status={}, version='{}', {} independent, {} dependent, {} errors, {} warnings",
                ds.status(), ds.version(), ds.independentVectors().size(), ds.dependentVectors().size(),
                ds.errors().size(), ds.warnings().size());
        if (ds.status() != SimulationStatus.SUCCESS)
            log.warn("Dataset status {}: {}", ds.status(), ds.errors());
        return ds;
    }

    /**
     * Parses one value line: a real number such as {@code +1.5e-03}, or a complex
     * number such as {@code +1.0e+00-j5.0e-01}. A blank string is zero.
     *
     * @return a two element array {re, im}.
     * @throws NumberFormatException if the text is neither form.
     */
    public static double[] parseValue(String text) {
        String s = text.strip();
        if (s.isEmpty())
            return new double[] { 0.0, 0.0 };

        Matcher j = IMAG_MARKER.matcher(s);
        // A complex value always carries its real part: "-j1.0" alone is rejected.
        if (j.find()) {
            double re = parseReal(s.substring(0, j.start()), text);
            String imag = s.charAt(j.start()) + s.substring(j.start() + 2);
            return new double[] { re, parseReal(imag, text) };
        }
        return new double[] { parseReal(s, text), 0.0 };
    }

    private static double parseReal(String s, String original) {
        if (!REAL.matcher(s).matches())
            throw new NumberFormatException("Not a dataset value: '" + original + "'");
        return Double.parseDouble(s);
    }

    private static boolean isErrorLine(String lower) {
        return lower.startsWith("error") || lower.startsWith("fatal") || lower.contains("error:");
    }

    private static boolean isWarningLine(String lower) {
        return lower.startsWith("warning") || lower.contains("warning:");
    }

    /** Mutable state of one parse. */
    private static final class Scan {
        private final Map<String, DataVector> independent = new LinkedHashMap<>();
        private final Map<String, DataVector> dependent = new LinkedHashMap<>();
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private SimulationStatus status = SimulationStatus.SUCCESS;
        private String version = "";

        // Open block, if any.
        private String blockName;
        private boolean blockIndependent;
        private int blockExpected;
        private List<String> blockDeps = List.of();
        private int blockStartLine;
        private double[] re = new double[16];
        private double[] im = new double[16];
        private int count;

        void line(int lineNum, String s) {
            if (s.isEmpty())
                return;

            Matcher m = VERSION.matcher(s);
            if (m.matches()) {
                version = m.group(1).strip();
                return;
            }

            String lower = s.toLowerCase(Locale.ROOT);
            if (isErrorLine(lower)) {
                errors.add(s);
                status = SimulationStatus.ERROR;
                return;
            }
            if (isWarningLine(lower)) {
                warnings.add(s);
                return;
            }

            m = INDEP.matcher(s);
            if (m.matches()) {
                interruptOpenBlock(lineNum);
                open(m.group(1), true, List.of(), lineNum);
                try {
                    blockExpected = Integer.parseInt(m.group(2));
                } catch (NumberFormatException e) {
                    blockExpected = -1;
                    warnings.add("Invalid size '" + m.group(2) + "' for vector '" + m.group(1)
                            + "' at line " + lineNum);
                }
                return;
            }
            m = DEP.matcher(s);
            if (m.matches()) {
                interruptOpenBlock(lineNum);
                String deps = m.group(2).strip();
                open(m.group(1), false, deps.isEmpty() ? List.of() : Arrays.asList(deps.split("\\s+")), lineNum);
                return;
            }

            if (s.equals("</indep>") || s.equals("</dep>")) {
                close(s.equals("</indep>"), lineNum);
                return;
            }

            if (blockName == null || s.startsWith("<"))
                return;
            try {
                double[] v = parseValue(s);
                append(v[0], v[1]);
            } catch (NumberFormatException e) {
                warnings.add("Failed to parse value at line " + lineNum + ": '" + s + "'");
            }
        }

        void finish() {
            if (blockName != null) {
                warnings.add("Vector '" + blockName + "' opened at line " + blockStartLine
                        + " was not closed before end of output");
                store();
            }
            if (version.isEmpty() && independent.isEmpty() && dependent.isEmpty()) {
                if (errors.isEmpty())
                    errors.add("No valid Qucs dataset found in output");
                status = SimulationStatus.PARSE_ERROR;
            }
        }

        private void open(String name, boolean indep, List<String> deps, int lineNum) {
            blockName = name;
            blockIndependent = indep;
            blockExpected = -1;
            blockDeps = deps;
            blockStartLine = lineNum;
            count = 0;
        }

        private void interruptOpenBlock(int lineNum) {
            if (blockName == null)
                return;
            warnings.add("Vector '" + blockName + "' opened at line " + blockStartLine
                    + " was interrupted by a new block at line " + lineNum);
            store();
        }

        private void close(boolean indepTag, int lineNum) {
            if (blockName == null) {
                warnings.add("Unexpected closing tag at line " + lineNum);
                return;
            }
            if (indepTag != blockIndependent)
                warnings.add("Vector '" + blockName + "' closed with mismatched tag at line " + lineNum);
            store();
        }

        private void store() {
            ComplexVector values = ComplexVector.of(Arrays.copyOf(re, count), Arrays.copyOf(im, count));
            DataVector dv = new DataVector(blockName, values, blockIndependent ? List.of() : blockDeps,
                    blockIndependent);
            Map<String, DataVector> target = blockIndependent ? independent : dependent;
            Map<String, DataVector> other = blockIndependent ? dependent : independent;
            if (other.remove(blockName) != null)
                warnings.add("Vector '" + blockName + "' redefined as "
                        + (blockIndependent ? "independent" : "dependent"));
            target.put(blockName, dv);
            if (blockIndependent && blockExpected >= 0 && count != blockExpected)
                warnings.add("Vector '" + blockName + "' has " + count + " values, expected " + blockExpected);
            blockName = null;
            count = 0;
        }

        private void append(double r, double i) {
            if (count == re.length) {
                re = Arrays.copyOf(re, count * 2);
                im = Arrays.copyOf(im, count * 2);
            }
            re[count] = r;
            im[count] = i;
            count++;
        }
    }
}
