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

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces the accepted input layouts to the canonical flattened form used by
 * the engine: {@code lon[M]}, {@code lat[M]} and {@code intensity[M][W][D]}.
 *
 * <p>Longitude and latitude may be rank 1 (already flattened) or rank 2 (a
 * grid, flattened row-major). Intensity may be rank 3 {@code (M, W, D)} or
 * rank 4 {@code (M1, M2, W, D)}. Anything else is rejected.</p>
 */
final class InputNormalizer {
    private static final Logger log = LoggerFactory.getLogger(InputNormalizer.class);

    private InputNormalizer() {}

    static Normalized normalize(ShapedArray lon, ShapedArray lat, double[] mus, ShapedArray intensity) {
        if (lon == null || lat == null || mus == null || intensity == null) {
            throw new InvalidInputException("lon, lat, mus and intensity are required");
        }
        double[] flatLon = flattenCoordinate(lon, "lon");
        double[] flatLat = flattenCoordinate(lat, "lat");
        if (flatLon.length != flatLat.length) {
            throw new InvalidShapeException(
                    "lon and lat hold different numbers of points: "
                            + flatLon.length + " vs " + flatLat.length);
        }
        if (lon.rank() == 2 && lat.rank() == 2 && !Arrays.equals(lon.shape(), lat.shape())) {
            throw new InvalidShapeException(
                    "lon grid " + Arrays.toString(lon.shape())
                            + " and lat grid " + Arrays.toString(lat.shape()) + " differ");
        }
        int points = flatLon.length;
        if (points == 0) {
            throw new InvalidInputException("At least one surface point is required");
        }

        int wlAxis;
        if (intensity.rank() == 3) {
            wlAxis = 1;
            if (intensity.dim(0) != points) {
                throw new InvalidShapeException(
                        "intensity has " + intensity.dim(0) + " points, lon/lat have " + points);
            }
        } else if (intensity.rank() == 4) {
            wlAxis = 2;
            if (intensity.dim(0) * intensity.dim(1) != points) {
                throw new InvalidShapeException(
                        "intensity grid " + intensity.dim(0) + "x" + intensity.dim(1)
                                + " does not match " + points + " lon/lat points");
            }
            requireSameGrid(intensity, lon, "lon");
            requireSameGrid(intensity, lat, "lat");
        } else {
            throw new InvalidShapeException(
                    "intensity must have rank 3 (points, wavelengths, mus) or rank 4 "
                            + "(grid1, grid2, wavelengths, mus), got shape "
                            + Arrays.toString(intensity.shape()));
        }

        int wavelengths = intensity.dim(wlAxis);
        int muBins = intensity.dim(wlAxis + 1);
        if (wavelengths == 0 || muBins == 0) {
            throw new InvalidShapeException(
                    "intensity needs at least one wavelength and one mu bin, got shape "
                            + Arrays.toString(intensity.shape()));
        }
        if (mus.length != muBins) {
            throw new InvalidShapeException(
                    "mus has " + mus.length + " values but intensity has " + muBins + " mu bins");
        }

        for (int p = 0; p < points; p++) {
            if (!Double.isFinite(flatLon[p]) || !Double.isFinite(flatLat[p])) {
                throw new InvalidInputException(
                        "Surface point " + p + " has non-finite coordinates lon=" + flatLon[p]
                                + ", lat=" + flatLat[p]);
            }
        }

        // Row-major flattening of the leading grid axes keeps the flat index identical.
        double[][][] cube = new double[points][wavelengths][muBins];
        int pos = 0;
        for (int p = 0; p < points; p++) {
            for (int w = 0; w < wavelengths; w++) {
                for (int m = 0; m < muBins; m++) {
                    double value = intensity.get(pos++);
                    if (!Double.isFinite(value)) {
                        throw new InvalidInputException(
                                "Intensity of surface point " + p + " at wavelength " + w
                                        + ", mu bin " + m + " is not finite: " + value);
                    }
                    cube[p][w][m] = value;
                }
            }
        }
        log.debug(
                "Normalized input: lon {} lat {} intensity {} -> {} points, {} wavelengths, {} mu bins",
                Arrays.toString(lon.shape()),
                Arrays.toString(lat.shape()),
                Arrays.toString(intensity.shape()),
                points,
                wavelengths,
                muBins);
        return new Normalized(flatLon, flatLat, mus.clone(), cube);
    }

    private static void requireSameGrid(ShapedArray intensity, ShapedArray coordinate, String name) {
        if (coordinate.rank() == 2
                && (coordinate.dim(0) != intensity.dim(0) || coordinate.dim(1) != intensity.dim(1))) {
            throw new InvalidShapeException(
                    "intensity grid " + Arrays.toString(intensity.shape())
                            + " does not match " + name + " grid " + Arrays.toString(coordinate.shape()));
        }
    }

    private static double[] flattenCoordinate(ShapedArray coordinate, String name) {
        if (coordinate.rank() != 1 && coordinate.rank() != 2) {
            throw new InvalidShapeException(
                    name + " must have rank 1 (flattened) or rank 2 (grid), got shape "
                            + Arrays.toString(coordinate.shape()));
        }
        return coordinate.toFlatArray();
    }

    // Canonical engine input
    record Normalized(double[] lon, double[] lat, double[] mus, double[][][] intensity) {
        int points() {
            return lon.length;
        }

        int wavelengths() {
            return intensity[0].length;
        }

        int muBins() {
            return mus.length;
        }
    }
}
