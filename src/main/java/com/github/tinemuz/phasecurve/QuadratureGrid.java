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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tensor-product midpoint quadrature over the observer-facing hemisphere.
 *
 * <p>Mu bands partition [1, 0] in descending order (sub-observer point first,
 * limb last); azimuth bands partition [0, 2*pi). The grid depends only on its
 * resolution, never on sample data, and is shared read-only across phases.</p>
 */
public final class QuadratureGrid {
    public static final int DEFAULT_MU_CELLS = 10;
    public static final int DEFAULT_AZIMUTH_CELLS = 10;

    private final double[] muCenters;
    private final double[] muWidths;
    private final double[] azimuthCenters;
    private final double[] azimuthWidths;
    private final List<QuadratureCell> cells;

    public QuadratureGrid(int muCells, int azimuthCells) {
        if (muCells < 1 || azimuthCells < 1) {
            throw new InvalidInputException(
                    "Quadrature needs at least one cell per axis, got " + muCells + "x" + azimuthCells);
        }
        double[] muEdges = new double[muCells + 1];
        for (int i = 0; i <= muCells; i++) {
            muEdges[i] = 1.0 - (double) i / muCells;
        }
        muEdges[muCells] = 0.0;
        double[] azEdges = new double[azimuthCells + 1];
        for (int i = 0; i <= azimuthCells; i++) {
            azEdges[i] = 2.0 * Math.PI * i / azimuthCells;
        }

        muCenters = new double[muCells];
        muWidths = new double[muCells];
        for (int i = 0; i < muCells; i++) {
            muCenters[i] = (muEdges[i] + muEdges[i + 1]) / 2.0;
            muWidths[i] = Math.abs(muEdges[i + 1] - muEdges[i]);
        }
        azimuthCenters = new double[azimuthCells];
        azimuthWidths = new double[azimuthCells];
        for (int j = 0; j < azimuthCells; j++) {
            azimuthCenters[j] = (azEdges[j] + azEdges[j + 1]) / 2.0;
            azimuthWidths[j] = azEdges[j + 1] - azEdges[j];
        }

        List<QuadratureCell> list = new ArrayList<>(muCells * azimuthCells);
        for (int j = 0; j < azimuthCells; j++) {
            for (int i = 0; i < muCells; i++) {
                list.add(new QuadratureCell(i, muCenters[i], azimuthCenters[j], muWidths[i], azimuthWidths[j]));
            }
        }
        cells = Collections.unmodifiableList(list);
    }

    /** The 10 x 10 grid. */
    public static QuadratureGrid standard() {
        return new QuadratureGrid(DEFAULT_MU_CELLS, DEFAULT_AZIMUTH_CELLS);
    }

    /** Cells in azimuth-major order. */
    public List<QuadratureCell> cells() {
        return cells;
    }

    public int size() {
        return cells.size();
    }

    /** Mu band centers, descending from the sub-observer point to the limb. */
    public double[] muCenters() {
        return muCenters.clone();
    }

    public double[] muWidths() {
        return muWidths.clone();
    }

    public double[] azimuthCenters() {
        return azimuthCenters.clone();
    }

    public double[] azimuthWidths() {
        return azimuthWidths.clone();
    }

    /**
     * Flux of a unit isotropic emitter on this grid, i.e. the sum of
     * {@code mu * dmu * dphi} over all cells. Equals pi for any resolution.
     */
    public double hemisphereIntegral() {
        double sum = 0.0;
        for (QuadratureCell cell : cells) {
            sum += cell.mu() * cell.weight();
        }
        return sum;
    }
}
