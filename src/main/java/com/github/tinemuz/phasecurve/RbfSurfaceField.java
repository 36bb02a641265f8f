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

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vector-valued radial basis function interpolant over the unit sphere.
 *
 * <p>The interpolant is
 * <pre>
 *   f(q) = sum_i c_i * phi(|q - x_i|) + d_0 + d_1*qx' + d_2*qy' + d_3*qz'
 * </pre>
 * where {@code q'} is {@code q} shifted and scaled into the sample bounding
 * box. Coefficients come from the augmented system
 * <pre>
 *   | K + s*I   P | | c |   | y |
 *   | P^T       0 | | d | = | 0 |
 * </pre>
 * solved once with an LU decomposition for every (wavelength, mu) column at
 * the same time. The smoothing term {@code s} keeps the system regular when
 * samples coincide, as they do at the poles and at the +/-180 degree seam of
 * a longitude/latitude grid.</p>
 *
 * <p>A field that is linear in x, y and z is reproduced exactly for any
 * smoothing value.</p>
 */
public final class RbfSurfaceField implements SurfaceField {
    private static final Logger log = LoggerFactory.getLogger(RbfSurfaceField.class);
    private static final int POLY_TERMS = 4; // 1, x, y, z

    private final RadialKernel kernel;
    private final double[][] centers;
    private final int wavelengths;
    private final int muBins;
    private final double[] shift = new double[3];
    private final double[] scale = new double[3];
    // Row-major (sample, wavelength*muBins) kernel weights
    private final double[] weights;
    // Row-major (term, wavelength*muBins) polynomial weights
    private final double[] polyWeights;

    private RbfSurfaceField(RadialKernel kernel, double[][] centers, int wavelengths, int muBins) {
        this.kernel = kernel;
        this.centers = centers;
        this.wavelengths = wavelengths;
        this.muBins = muBins;
        int columns = wavelengths * muBins;
        this.weights = new double[centers.length * columns];
        this.polyWeights = new double[POLY_TERMS * columns];
    }

    /** Fitter with the given kernel and smoothing. */
    public static SurfaceFieldFitter fitter(RadialKernel kernel, double smoothing) {
        return (directions, intensities) -> fit(directions, intensities, kernel, smoothing);
    }

    /**
     * Fit the interpolant to scattered samples.
     *
     * @param directions sample directions, shape (n, 3)
     * @param intensities sample values, shape (n, wavelengths, muBins)
     * @param kernel radial basis function
     * @param smoothing non-negative value added to the kernel diagonal
     * @throws InvalidShapeException if the sample arrays disagree in shape
     * @throws InvalidInputException if a sample is not finite, the linear
     *     system is singular, or there are fewer samples than polynomial terms
     */
    public static RbfSurfaceField fit(
            double[][] directions, double[][][] intensities, RadialKernel kernel, double smoothing) {
        if (directions.length != intensities.length) {
            throw new InvalidShapeException(
                    "Number of sample directions (" + directions.length
                            + ") does not match number of intensity vectors (" + intensities.length + ")");
        }
        if (!(smoothing >= 0.0) || Double.isInfinite(smoothing)) {
            throw new InvalidInputException("Smoothing must be a finite non-negative value, got " + smoothing);
        }
        final int n = directions.length;
        if (n < POLY_TERMS) {
            throw new InvalidInputException(
                    "At least " + POLY_TERMS + " samples are needed for a linear polynomial tail, got " + n);
        }
        final int wavelengths = intensities[0].length;
        final int muBins = wavelengths == 0 ? 0 : intensities[0][0].length;
        final int columns = wavelengths * muBins;

        double[][] centers = new double[n][];
        for (int i = 0; i < n; i++) {
            if (directions[i].length != 3) {
                throw new InvalidShapeException(
                        "Sample direction " + i + " has " + directions[i].length + " components");
            }
            for (double v : directions[i]) {
                if (!Double.isFinite(v)) {
                    throw new InvalidInputException("Sample direction " + i + " is not finite");
                }
            }
            centers[i] = directions[i].clone();
        }
        RbfSurfaceField field = new RbfSurfaceField(kernel, centers, wavelengths, muBins);
        field.computeShiftAndScale();

        long start = System.nanoTime();
        int size = n + POLY_TERMS;
        DMatrixRMaj lhs = new DMatrixRMaj(size, size);
        DMatrixRMaj rhs = new DMatrixRMaj(size, columns);
        double[] poly = new double[POLY_TERMS];
        int coincident = 0;
        for (int i = 0; i < n; i++) {
            double[] xi = centers[i];
            for (int k = i; k < n; k++) {
                double r = distance(xi, centers[k]);
                if (k != i && r == 0.0) coincident++;
                double phi = kernel.evaluate(r);
                lhs.unsafe_set(i, k, phi);
                lhs.unsafe_set(k, i, phi);
            }
            lhs.unsafe_set(i, i, lhs.unsafe_get(i, i) + smoothing);
            field.polynomialTerms(xi[0], xi[1], xi[2], poly);
            for (int t = 0; t < POLY_TERMS; t++) {
                lhs.unsafe_set(i, n + t, poly[t]);
                lhs.unsafe_set(n + t, i, poly[t]);
            }

            double[][] sample = intensities[i];
            if (sample.length != wavelengths) {
                throw new InvalidShapeException(
                        "Sample " + i + " has " + sample.length + " wavelengths, expected " + wavelengths);
            }
            for (int w = 0; w < wavelengths; w++) {
                if (sample[w].length != muBins) {
                    throw new InvalidShapeException(
                            "Sample " + i + " has " + sample[w].length + " mu bins, expected " + muBins);
                }
                for (int m = 0; m < muBins; m++) {
                    if (!Double.isFinite(sample[w][m])) {
                        throw new InvalidInputException(
                                "Sample " + i + " has non-finite intensity at wavelength " + w
                                        + ", mu bin " + m + ": " + sample[w][m]);
                    }
                    rhs.unsafe_set(i, w * muBins + m, sample[w][m]);
                }
            }
        }
        if (coincident > 0) {
            log.warn(
                    "{} pairs of coincident sample directions; fit relies on smoothing {}",
                    coincident,
                    smoothing);
        }

        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.lu(size);
        if (!solver.setA(lhs)) {
            throw new InvalidInputException(
                    "Radial basis system for " + n + " samples is singular; "
                            + "check for degenerate sample directions or increase smoothing");
        }
        DMatrixRMaj solution = new DMatrixRMaj(size, columns);
        solver.solve(rhs, solution);
        for (int i = 0; i < solution.getNumElements(); i++) {
            if (!Double.isFinite(solution.data[i])) {
                throw new InvalidInputException(
                        "Radial basis system for " + n + " samples is singular; "
                                + "check for degenerate sample directions or increase smoothing");
            }
        }
        System.arraycopy(solution.data, 0, field.weights, 0, n * columns);
        System.arraycopy(solution.data, n * columns, field.polyWeights, 0, POLY_TERMS * columns);

        if (log.isDebugEnabled()) {
            log.debug(
                    "Fitted {} kernel to {} samples x {} columns in {} ms",
                    kernel,
                    n,
                    columns,
                    String.format("%.1f", (System.nanoTime() - start) / 1e6));
        }
        return field;
    }

    @Override
    public int wavelengthCount() {
        return wavelengths;
    }

    @Override
    public int muBinCount() {
        return muBins;
    }

    public int sampleCount() {
        return centers.length;
    }

    public RadialKernel kernel() {
        return kernel;
    }

    @Override
    public double[][] query(double x, double y, double z) {
        final int columns = wavelengths * muBins;
        double[] acc = new double[columns];
        double[] q = {x, y, z};
        for (int i = 0; i < centers.length; i++) {
            double phi = kernel.evaluate(distance(q, centers[i]));
            if (phi == 0.0) continue;
            int base = i * columns;
            for (int c = 0; c < columns; c++) {
                acc[c] += phi * weights[base + c];
            }
        }
        double[] poly = new double[POLY_TERMS];
        polynomialTerms(x, y, z, poly);
        for (int t = 0; t < POLY_TERMS; t++) {
            int base = t * columns;
            for (int c = 0; c < columns; c++) {
                acc[c] += poly[t] * polyWeights[base + c];
            }
        }
        double[][] out = new double[wavelengths][muBins];
        for (int w = 0; w < wavelengths; w++) {
            System.arraycopy(acc, w * muBins, out[w], 0, muBins);
        }
        return out;
    }

    // Center the polynomial coordinates on the bounding box, scaled to [-1, 1]
    private void computeShiftAndScale() {
        for (int axis = 0; axis < 3; axis++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] c : centers) {
                min = Math.min(min, c[axis]);
                max = Math.max(max, c[axis]);
            }
            shift[axis] = (max + min) / 2.0;
            double half = (max - min) / 2.0;
            scale[axis] = half == 0.0 ? 1.0 : half;
        }
    }

    private void polynomialTerms(double x, double y, double z, double[] out) {
        out[0] = 1.0;
        out[1] = (x - shift[0]) / scale[0];
        out[2] = (y - shift[1]) / scale[1];
        out[3] = (z - shift[2]) / scale[2];
    }

    private static double distance(double[] a, double[] b) {
        double dx = a[0] - b[0];
        double dy = a[1] - b[1];
        double dz = a[2] - b[2];
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}
