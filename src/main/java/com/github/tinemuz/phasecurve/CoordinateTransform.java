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
 * Conversion of planetographic longitude/latitude pairs to unit vectors.
 *
 * <p>Latitude is mapped to a polar angle measured from the south pole,
 * {@code theta = (lat + 90) / 180 * pi}, so that {@code z = -1} at latitude
 * +90 and {@code z = +1} at latitude -90. This matches the body frame that
 * {@link PhaseRotation} rotates the observer hemisphere into.</p>
 */
public final class CoordinateTransform {

    private CoordinateTransform() {}

    /**
     * Unit vector for a single longitude/latitude pair in degrees.
     *
     * @return {@code {x, y, z}}
     */
    public static double[] toCartesian(double lonDeg, double latDeg) {
        double phi = lonDeg / 180.0 * Math.PI;
        double theta = (latDeg + 90.0) / 180.0 * Math.PI;
        double sinTheta = Math.sin(theta);
        return new double[] {
            Math.cos(phi) * sinTheta, Math.sin(phi) * sinTheta, Math.cos(theta)
        };
    }

    /**
     * Unit vectors for flattened longitude/latitude arrays in degrees.
     *
     * @return array of shape (n, 3)
     * @throws InvalidShapeException if the arrays differ in length
     */
    public static double[][] toCartesian(double[] lonDeg, double[] latDeg) {
        if (lonDeg.length != latDeg.length) {
            throw new InvalidShapeException(
                    "Longitude and latitude lengths differ: "
                            + lonDeg.length + " vs " + latDeg.length);
        }
        double[][] out = new double[lonDeg.length][];
        for (int i = 0; i < lonDeg.length; i++) {
            out[i] = toCartesian(lonDeg[i], latDeg[i]);
        }
        return out;
    }
}
