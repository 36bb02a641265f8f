/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.phasecurve;

/**
 * Linear interpolation of field output between the sampled mu bins.
 *
 * <p>The field returns one intensity per sampled mu. A query mu at or below
 * the smallest sampled mu takes the first bin unchanged, one above the
 * largest takes the last bin unchanged, and anything in between is linearly
 * interpolated between the bracketing bins {@code mus[j] < mu <= mus[j+1]}.
 * Brackets for a fixed set of query mus are located once, at construction.</p>
 */
public final class MuBandInterpolator {
    private final double[] sampleMus;
    private final Bracket[] brackets;

    /**
     * @param sampleMus strictly increasing mu values of the field's bins
     * @param queryMus mu values that will be looked up by index
     * @throws InvalidInputException if {@code sampleMus} is empty, not finite
     *     or not strictly increasing
     */
    public MuBandInterpolator(double[] sampleMus, double[] queryMus) {
        requireStrictlyIncreasing(sampleMus);
        this.sampleMus = sampleMus.clone();
        this.brackets = new Bracket[queryMus.length];
        for (int i = 0; i < queryMus.length; i++) {
            brackets[i] = locate(this.sampleMus, queryMus[i]);
        }
    }

    /**
     * @throws InvalidInputException unless the values are finite and strictly
     *     increasing
     */
    public static void requireStrictlyIncreasing(double[] mus) {
        if (mus.length == 0) {
            throw new InvalidInputException("At least one mu value is required");
        }
        for (int i = 0; i < mus.length; i++) {
            if (!Double.isFinite(mus[i])) {
                throw new InvalidInputException("mu[" + i + "] is not finite: " + mus[i]);
            }
            if (i > 0 && !(mus[i] > mus[i - 1])) {
                throw new InvalidInputException(
                        "mus must be strictly increasing, but mu[" + (i - 1) + "]=" + mus[i - 1]
                                + " and mu[" + i + "]=" + mus[i]);
            }
        }
    }

    public int sampleMuCount() {
        return sampleMus.length;
    }

    public int queryCount() {
        return brackets.length;
    }

    /** Lower sampled bin used for a query mu. */
    public int lowerBin(int queryIndex) {
        return brackets[queryIndex].lower;
    }

    /** Whether a query mu falls strictly inside the sampled range. */
    public boolean interpolates(int queryIndex) {
        return brackets[queryIndex].interpolate;
    }

    /**
     * Per-wavelength intensity at a precomputed query mu.
     *
     * @param intensity field output, shape (wavelengths, sampled mus)
     */
    public double[] interpolate(double[][] intensity, int queryIndex) {
        return apply(brackets[queryIndex], intensity);
    }

    /** Per-wavelength intensity at an arbitrary mu. */
    public double[] interpolate(double[][] intensity, double mu) {
        return apply(locate(sampleMus, mu), intensity);
    }

    private static double[] apply(Bracket b, double[][] intensity) {
        double[] out = new double[intensity.length];
        for (int w = 0; w < intensity.length; w++) {
            double lo = intensity[w][b.lower];
            out[w] = b.interpolate ? lo + (intensity[w][b.lower + 1] - lo) * b.fraction : lo;
        }
        return out;
    }

    private static Bracket locate(double[] mus, double mu) {
        if (Double.isNaN(mu)) {
            throw new InvalidInputException("Query mu is NaN");
        }
        int last = mus.length - 1;
        if (mu <= mus[0]) {
            return new Bracket(0, false, 0.0);
        }
        if (mu > mus[last]) {
            return new Bracket(last, false, 0.0);
        }
        int upper = upperBound(mus, mu);
        int lower = upper - 1;
        return new Bracket(lower, true, (mu - mus[lower]) / (mus[upper] - mus[lower]));
    }

    /**
     * First index in a sorted array where arr[index] >= x.
     * If x is larger than all entries, returns the last index.
     */
    private static int upperBound(double[] arr, double x) {
        int lo = 0;
        int hi = arr.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (arr[mid] < x) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    private record Bracket(int lower, boolean interpolate, double fraction) {}
}
