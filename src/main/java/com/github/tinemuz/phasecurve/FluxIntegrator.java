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

import java.util.List;

/**
 * Disk-integrated flux for one phase.
 *
 * <p>For every quadrature cell the observer-frame direction is rotated into
 * the body frame, the field is sampled there, the result is interpolated to
 * the cell's mu, and {@code I * mu * dmu * dphi} is added to a per-wavelength
 * accumulator. The mu factor is the projected-area foreshortening of the
 * emitting surface element.</p>
 *
 * <p>Instances hold only immutable, phase-independent state and can be shared
 * between threads; each call owns its accumulator.</p>
 */
public final class FluxIntegrator {
    private final QuadratureGrid grid;
    private final MuBandInterpolator muInterpolator;
    private final double[][] observerDirections;

    /**
     * @param grid hemisphere quadrature
     * @param sampleMus strictly increasing mu values of the field's bins
     */
    public FluxIntegrator(QuadratureGrid grid, double[] sampleMus) {
        this.grid = grid;
        this.muInterpolator = new MuBandInterpolator(sampleMus, grid.muCenters());
        List<QuadratureCell> cells = grid.cells();
        this.observerDirections = new double[cells.size()][];
        for (int c = 0; c < cells.size(); c++) {
            observerDirections[c] = cells.get(c).direction();
        }
    }

    public QuadratureGrid grid() {
        return grid;
    }

    /**
     * @return flux per wavelength
     * @throws InvalidShapeException if the field's mu bins do not match the
     *     sample mus this integrator was built with
     */
    public double[] integrate(SurfaceField field, PhaseRotation rotation) {
        if (field.muBinCount() != muInterpolator.sampleMuCount()) {
            throw new InvalidShapeException(
                    "Field has " + field.muBinCount() + " mu bins, integrator expects "
                            + muInterpolator.sampleMuCount());
        }
        double[] flux = new double[field.wavelengthCount()];
        List<QuadratureCell> cells = grid.cells();
        for (int c = 0; c < cells.size(); c++) {
            QuadratureCell cell = cells.get(c);
            double[] body = rotation.apply(observerDirections[c]);
            double[][] intensity = field.query(body[0], body[1], body[2]);
            double[] atMu = muInterpolator.interpolate(intensity, cell.muIndex());
            double factor = cell.mu() * cell.muWeight() * cell.azimuthWeight();
            for (int w = 0; w < flux.length; w++) {
                flux[w] += atMu[w] * factor;
            }
        }
        return flux;
    }
}
