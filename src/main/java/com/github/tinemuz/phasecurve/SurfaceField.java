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
 * Continuous intensity field over the unit sphere.
 *
 * <p>Implementations are immutable once built; queries never change fitted
 * state and may be issued concurrently.</p>
 */
public interface SurfaceField {

    int wavelengthCount();

    int muBinCount();

    /**
     * Intensity at a direction, indexed by (wavelength, sample mu bin). The
     * direction need not be one of the fitted samples.
     */
    double[][] query(double x, double y, double z);

    /**
     * Intensity for each of several directions.
     *
     * @param directions array of shape (q, 3)
     * @return array of shape (q, wavelengths, muBins)
     */
    default double[][][] query(double[][] directions) {
        double[][][] out = new double[directions.length][][];
        for (int i = 0; i < directions.length; i++) {
            double[] d = directions[i];
            if (d.length != 3) {
                throw new InvalidShapeException("Query direction " + i + " has " + d.length + " components");
            }
            out[i] = query(d[0], d[1], d[2]);
        }
        return out;
    }
}
