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
 * One cell of the observer-hemisphere quadrature.
 *
 * @param muIndex index of the cell's mu band in the grid
 * @param mu cosine of the emission angle at the cell center
 * @param azimuth azimuth of the cell center in radians
 * @param muWeight width of the mu band
 * @param azimuthWeight width of the azimuth band in radians
 */
public record QuadratureCell(int muIndex, double mu, double azimuth, double muWeight, double azimuthWeight) {

    /** Solid-angle weight {@code dmu * dphi}. */
    public double weight() {
        return muWeight * azimuthWeight;
    }

    /**
     * Observer-frame direction of the cell center, with z pointing at the
     * observer.
     */
    public double[] direction() {
        double sinTheta = Math.sqrt(1.0 - mu * mu);
        return new double[] {Math.cos(azimuth) * sinTheta, Math.sin(azimuth) * sinTheta, mu};
    }
}
