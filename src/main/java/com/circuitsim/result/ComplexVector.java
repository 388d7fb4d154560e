package com.circuitsim.result;

import java.util.Arrays;

/**
 * Immutable vector of complex samples stored as parallel real/imaginary arrays.
 * Real-valued data simply has an all-zero imaginary part.
 */
public final class ComplexVector {
    private static final ComplexVector EMPTY = new ComplexVector(new double[0], new double[0]);

    private final double[] re;
    private final double[] im;

    private ComplexVector(double[] re, double[] im) {
        this.re = re;
        this.im = im;
    }

    public static ComplexVector of(double[] re, double[] im) {
        if (re.length != im.length)
            throw new IllegalArgumentException("Real/imag length mismatch: " + re.length + " vs " + im.length);
        return new ComplexVector(re.clone(), im.clone());
    }

    public static ComplexVector ofReal(double... re) {
        return new ComplexVector(re.clone(), new double[re.length]);
    }

    public static ComplexVector zeros(int size) {
        return size == 0 ? EMPTY : new ComplexVector(new double[size], new double[size]);
    }

    public int size() {
        return re.length;
    }

    public boolean isEmpty() {
        return re.length == 0;
    }

    public double re(int i) {
        return re[i];
    }

    public double im(int i) {
        return im[i];
    }

    /** Copy of the real parts. */
    public double[] real() {
        return re.clone();
    }

    /** Copy of the imaginary parts. */
    public double[] imag() {
        return im.clone();
    }

    /** True if every imaginary part is exactly zero. */
    public boolean isReal() {
        for (double v : im)
            if (v != 0.0)
                return false;
        return true;
    }

    public double abs(int i) {
        return Math.hypot(re[i], im[i]);
    }

    /** Magnitudes of all samples. */
    public double[] abs() {
        double[] out = new double[re.length];
        for (int i = 0; i < out.length; i++)
            out[i] = Math.hypot(re[i], im[i]);
        return out;
    }

    /** Phase of each sample in degrees. */
    public double[] phaseDeg() {
        double[] out = new double[re.length];
        for (int i = 0; i < out.length; i++)
            out[i] = Math.toDegrees(Math.atan2(im[i], re[i]));
        return out;
    }

    public ComplexVector negate() {
        double[] r = new double[re.length];
        double[] m = new double[im.length];
        for (int i = 0; i < r.length; i++) {
            r[i] = -re[i];
            m[i] = -im[i];
        }
        return new ComplexVector(r, m);
    }

    /** Element-wise {@code this - other}. */
    public ComplexVector minus(ComplexVector other) {
        requireSameSize(other);
        double[] r = new double[re.length];
        double[] m = new double[im.length];
        for (int i = 0; i < r.length; i++) {
            r[i] = re[i] - other.re[i];
            m[i] = im[i] - other.im[i];
        }
        return new ComplexVector(r, m);
    }

    /** Element-wise complex product. */
    public ComplexVector times(ComplexVector other) {
        requireSameSize(other);
        double[] r = new double[re.length];
        double[] m = new double[im.length];
        for (int i = 0; i < r.length; i++) {
            r[i] = re[i] * other.re[i] - im[i] * other.im[i];
            m[i] = re[i] * other.im[i] + im[i] * other.re[i];
        }
        return new ComplexVector(r, m);
    }

    private void requireSameSize(ComplexVector other) {
        if (other.re.length != re.length)
            throw new IllegalArgumentException("Vector size mismatch: " + re.length + " vs " + other.re.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ComplexVector))
            return false;
        ComplexVector other = (ComplexVector) o;
        return Arrays.equals(re, other.re) && Arrays.equals(im, other.im);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(re) + Arrays.hashCode(im);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        int shown = Math.min(re.length, 8);
        for (int i = 0; i < shown; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(re[i]);
            if (im[i] != 0.0)
                sb.append(im[i] < 0 ? "-j" : "+j").append(Math.abs(im[i]));
        }
        if (re.length > shown)
            sb.append(", ... (").append(re.length).append(" values)");
        return sb.append(']').toString();
    }
}
