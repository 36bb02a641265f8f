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
 * Rotation from the observer frame of the quadrature grid into the body frame
 * of the surface samples for one rotational phase.
 *
 * <p>The matrix is {@code A * Rx(-2*pi*phase)} where {@code A} moves the
 * grid's z axis (towards the observer) onto the body x axis, keeps y and maps
 * x onto -z:
 * <pre>
 *       |  0  0  1 |
 *   A = |  0  1  0 |
 *       | -1  0  0 |
 * </pre>
 * At phase 0 the sub-observer point is therefore longitude 0, latitude 0.
 * The composition is a fixed contract; confirm it against the external solver
 * convention before changing it.</p>
 */
public final class PhaseRotation {
    private static final double[][] AXIS_REALIGNMENT = {
        {0, 0, 1},
        {0, 1, 0},
        {-1, 0, 0}
    };

    private final double phase;
    private final double[][] m;

    private PhaseRotation(double phase, double[][] m) {
        this.phase = phase;
        this.m = m;
    }

    /**
     * @param phase fraction of one rotation
     * @throws InvalidInputException if the phase is not finite
     */
    public static PhaseRotation forPhase(double phase) {
        if (!Double.isFinite(phase)) {
            throw new InvalidInputException("Phase must be finite, got " + phase);
        }
        double angle = -phase * 2.0 * Math.PI;
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        double[][] rx = {
            {1, 0, 0},
            {0, cos, -sin},
            {0, sin, cos}
        };
        return new PhaseRotation(phase, multiply(AXIS_REALIGNMENT, rx));
    }

    public double phase() {
        return phase;
    }

    /** Copy of the 3x3 matrix, row-major. */
    public double[][] matrix() {
        return new double[][] {m[0].clone(), m[1].clone(), m[2].clone()};
    }

    /** Rotate an observer-frame vector into the body frame. */
    public double[] apply(double[] v) {
        return new double[] {
            m[0][0] * v[0] + m[0][1] * v[1] + m[0][2] * v[2],
            m[1][0] * v[0] + m[1][1] * v[1] + m[1][2] * v[2],
            m[2][0] * v[0] + m[2][1] * v[1] + m[2][2] * v[2]
        };
    }

    private static double[][] multiply(double[][] a, double[][] b) {
        double[][] out = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                out[i][j] = a[i][0] * b[0][j] + a[i][1] * b[1][j] + a[i][2] * b[2][j];
            }
        }
        return out;
    }
}
