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

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * End-to-end tests for PhaseCurveModel.
 *
 * <p>Tests cover: - Output shape and default phases - Isotropic and dayside
 * fields with analytic fluxes - Phase ordering and parallel evaluation -
 * Shape and input validation - The spectrum provider boundary
 */
class PhaseCurveModelTest {
    private static final double FLUX_TOLERANCE = 1e-6;
    // Sum over the standard grid of mu^2 * dmu
    private static final double MU_SQUARED_MIDPOINT = 0.3325;

    @Nested
    @DisplayName("Core Functionality Tests")
    class CoreFunctionalityTests {

        @Test
        @DisplayName("Gridded isotropic body: every phase sees the same flux")
        void griddedIsotropicBody() {
            double[] lons = SampleSurfaces.linspace(-180, 180, 31);
            double[] lats = SampleSurfaces.linspace(-90, 90, 11);
            double[][] lon = new double[lats.length][lons.length];
            double[][] lat = new double[lats.length][lons.length];
            for (int i = 0; i < lats.length; i++) {
                for (int j = 0; j < lons.length; j++) {
                    lon[i][j] = lons[j];
                    lat[i][j] = lats[i];
                }
            }
            double[] mus = SampleSurfaces.linspace(-1, 1, 20);
            double[][][][] intensity = new double[lats.length][lons.length][10][mus.length];
            for (double[][][] row : intensity) {
                for (double[][] cell : row) {
                    for (double[] spectrum : cell) {
                        Arrays.fill(spectrum, 1.0);
                    }
                }
            }
            double[] phases = SampleSurfaces.linspace(0, 1, 11);

            double[][] curve = PhaseCurveModel.compute(phases, lon, lat, mus, intensity);

            assertEquals(11, curve.length);
            for (double[] row : curve) {
                assertEquals(10, row.length);
            }
            for (int w = 0; w < 10; w++) {
                for (int p = 0; p < phases.length; p++) {
                    assertTrue(curve[p][w] > 0, "Flux positive");
                    assertEquals(curve[0][w], curve[p][w], FLUX_TOLERANCE, "Phase " + p + " wavelength " + w);
                    assertEquals(Math.PI, curve[p][w], FLUX_TOLERANCE, "Unit intensity integrates to pi");
                }
            }
        }

        @Test
        @DisplayName("Flattened isotropic body: flux is value times the hemisphere constant")
        void flattenedIsotropicBody() {
            int n = 60;
            double value = 3.7;
            double[][] curve = PhaseCurveModel.compute(
                    new double[] {0.0, 0.2, 0.45, 0.8},
                    SampleSurfaces.fibonacciLon(n),
                    SampleSurfaces.fibonacciLat(n),
                    new double[] {0.1, 0.5, 0.9},
                    SampleSurfaces.constant(n, 4, 3, value));

            double expected = value * QuadratureGrid.standard().hemisphereIntegral();
            assertEquals(4, curve.length);
            for (double[] row : curve) {
                assertEquals(4, row.length);
                for (double f : row) assertEquals(expected, f, FLUX_TOLERANCE);
            }
        }

        @Test
        @DisplayName("Dayside-bright body peaks at phase 0 and dips at phase 0.5")
        void daysideBody() {
            int n = 80;
            double[] lon = SampleSurfaces.fibonacciLon(n);
            double[] lat = SampleSurfaces.fibonacciLat(n);
            double[][] curve = PhaseCurveModel.compute(
                    new double[] {0.0, 0.25, 0.5, 0.75},
                    lon,
                    lat,
                    new double[] {0.0, 1.0},
                    SampleSurfaces.dayside(lon, lat, 2, 2));

            double day = Math.PI + 2 * Math.PI * MU_SQUARED_MIDPOINT;
            double night = Math.PI - 2 * Math.PI * MU_SQUARED_MIDPOINT;
            for (int w = 0; w < 2; w++) {
                double scale = w + 1;
                assertEquals(scale * day, curve[0][w], FLUX_TOLERANCE, "Phase 0");
                assertEquals(scale * Math.PI, curve[1][w], FLUX_TOLERANCE, "Phase 0.25");
                assertEquals(scale * night, curve[2][w], FLUX_TOLERANCE, "Phase 0.5");
                assertEquals(scale * Math.PI, curve[3][w], FLUX_TOLERANCE, "Phase 0.75");
            }
        }

        @Test
        @DisplayName("Default phases are 11 evenly spaced values in [0, 1]")
        void defaultPhases() {
            double[] phases = PhaseCurveModel.defaultPhases();
            assertEquals(11, phases.length);
            assertEquals(0.0, phases[0], 0.0);
            assertEquals(1.0, phases[10], 0.0);
            assertEquals(0.3, phases[3], 1e-15);

            int n = 20;
            double[][] curve = PhaseCurveModel.compute(
                    ShapedArray.of(SampleSurfaces.fibonacciLon(n)),
                    ShapedArray.of(SampleSurfaces.fibonacciLat(n)),
                    new double[] {0.5},
                    ShapedArray.of(SampleSurfaces.constant(n, 2, 1, 1.0)));
            assertEquals(11, curve.length);
        }

        @Test
        @DisplayName("No phases give an empty curve")
        void noPhases() {
            int n = 10;
            double[][] curve = PhaseCurveModel.compute(
                    new double[0],
                    SampleSurfaces.fibonacciLon(n),
                    SampleSurfaces.fibonacciLat(n),
                    new double[] {0.5},
                    SampleSurfaces.constant(n, 2, 1, 1.0));
            assertEquals(0, curve.length);
        }
    }

    @Nested
    @DisplayName("Phase Ordering Tests")
    class PhaseOrderingTests {
        private final double[] lon = SampleSurfaces.fibonacciLon(50);
        private final double[] lat = SampleSurfaces.fibonacciLat(50);
        private final double[] mus = {0.0, 0.5, 1.0};
        private final double[][][] intensity = limbDarkenedHotSpot(lon, lat, mus);

        @Test
        @DisplayName("Swapping two phases swaps only their rows")
        void swapPhases() {
            double[] phases = {0.0, 0.1, 0.3, 0.6, 0.85};
            double[] swapped = phases.clone();
            swapped[1] = phases[3];
            swapped[3] = phases[1];

            double[][] a = PhaseCurveModel.compute(phases, lon, lat, mus, intensity);
            double[][] b = PhaseCurveModel.compute(swapped, lon, lat, mus, intensity);

            assertArrayEquals(a[0], b[0], 0.0);
            assertArrayEquals(a[1], b[3], 0.0);
            assertArrayEquals(a[2], b[2], 0.0);
            assertArrayEquals(a[3], b[1], 0.0);
            assertArrayEquals(a[4], b[4], 0.0);
            assertNotEquals(a[1][0], a[3][0], 1e-6, "Rows differ so the swap is observable");
        }

        @Test
        @DisplayName("Parallel evaluation matches sequential row for row")
        void parallelMatchesSequential() {
            double[] phases = SampleSurfaces.linspace(0, 1, 17);
            PhaseCurveConfig sequential = PhaseCurveConfig.builtIn();
            PhaseCurveConfig parallel = sequential.withParallel(true);

            double[][] a = PhaseCurveModel.compute(
                    phases, ShapedArray.of(lon), ShapedArray.of(lat), mus, ShapedArray.of(intensity), sequential);
            double[][] b = PhaseCurveModel.compute(
                    phases, ShapedArray.of(lon), ShapedArray.of(lat), mus, ShapedArray.of(intensity), parallel);

            assertEquals(a.length, b.length);
            for (int i = 0; i < a.length; i++) {
                assertArrayEquals(a[i], b[i], 0.0, "Row " + i);
            }
        }

        @Test
        @DisplayName("Whole rotations repeat the curve")
        void periodicity() {
            double[][] curve = PhaseCurveModel.compute(new double[] {0.2, 1.2, -0.8}, lon, lat, mus, intensity);
            assertArrayEquals(curve[0], curve[1], 1e-9);
            assertArrayEquals(curve[0], curve[2], 1e-9);
        }
    }

    @Nested
    @DisplayName("Shape Validation Tests")
    class ShapeValidationTests {
        private final double[] phases = {0.0};
        private final double[] mus = {0.2, 0.8};

        @Test
        @DisplayName("Rank-3 longitude is rejected")
        void lonRankThree() {
            ShapedArray lon = ShapedArray.of(new double[8], 2, 2, 2);
            ShapedArray lat = ShapedArray.of(new double[8]);
            assertThrows(
                    InvalidShapeException.class,
                    () -> PhaseCurveModel.compute(phases, lon, lat, mus, ShapedArray.of(new double[8 * 2], 8, 1, 2)));
        }

        @Test
        @DisplayName("Rank-0 latitude is rejected")
        void latRankZero() {
            ShapedArray lon = ShapedArray.of(new double[1]);
            ShapedArray lat = ShapedArray.of(new double[1], new int[0]);
            assertThrows(
                    InvalidShapeException.class,
                    () -> PhaseCurveModel.compute(phases, lon, lat, mus, ShapedArray.of(new double[2], 1, 1, 2)));
        }

        @Test
        @DisplayName("Intensity of rank 2 or 5 is rejected")
        void intensityRank() {
            ShapedArray lon = ShapedArray.of(new double[4]);
            ShapedArray lat = ShapedArray.of(new double[4]);
            assertThrows(
                    InvalidShapeException.class,
                    () -> PhaseCurveModel.compute(phases, lon, lat, mus, ShapedArray.of(new double[8], 4, 2)));
            assertThrows(
                    InvalidShapeException.class,
                    () -> PhaseCurveModel.compute(
                            phases, lon, lat, mus, ShapedArray.of(new double[8], 2, 2, 1, 1, 2)));
        }

        @Test
        @DisplayName("Longitude and latitude sizes must agree")
        void lonLatMismatch() {
            assertThrows(
                    InvalidShapeException.class,
                    () -> PhaseCurveModel.compute(
                            phases,
                            ShapedArray.of(new double[5]),
                            ShapedArray.of(new double[4]),
                            mus,
                            ShapedArray.of(new double[10], 5, 1, 2)));
        }

        @Test
        @DisplayName("Intensity point count must match longitude/latitude")
        void pointMismatch() {
            assertThrows(
                    InvalidShapeException.class,
                    () -> PhaseCurveModel.compute(
                            phases,
                            ShapedArray.of(new double[5]),
                            ShapedArray.of(new double[5]),
                            mus,
                            ShapedArray.of(new double[8], 4, 1, 2)));
        }

        @Test
        @DisplayName("Rank-4 intensity must match the longitude grid")
        void gridMismatch() {
            assertThrows(
                    InvalidShapeException.class,
                    () -> PhaseCurveModel.compute(
                            phases,
                            ShapedArray.of(new double[6], 2, 3),
                            ShapedArray.of(new double[6], 2, 3),
                            mus,
                            ShapedArray.of(new double[12], 3, 2, 1, 2)));
        }

        @Test
        @DisplayName("Latitude grid must have the longitude grid's shape")
        void transposedLatGrid() {
            ShapedArray lon = ShapedArray.of(new double[6], 2, 3);
            ShapedArray lat = ShapedArray.of(new double[6], 3, 2);
            assertThrows(
                    InvalidShapeException.class,
                    () -> PhaseCurveModel.compute(phases, lon, lat, mus, ShapedArray.of(new double[12], 2, 3, 1, 2)));
            assertThrows(
                    InvalidShapeException.class,
                    () -> PhaseCurveModel.compute(phases, lon, lat, mus, ShapedArray.of(new double[12], 6, 1, 2)));
        }

        @Test
        @DisplayName("Rank-4 intensity must match the latitude grid")
        void latGridMismatch() {
            assertThrows(
                    InvalidShapeException.class,
                    () -> PhaseCurveModel.compute(
                            phases,
                            ShapedArray.of(new double[6]),
                            ShapedArray.of(new double[6], 2, 3),
                            mus,
                            ShapedArray.of(new double[12], 3, 2, 1, 2)));
        }

        @Test
        @DisplayName("Number of mus must match the intensity's last axis")
        void muCountMismatch() {
            assertThrows(
                    InvalidShapeException.class,
                    () -> PhaseCurveModel.compute(
                            phases,
                            ShapedArray.of(new double[4]),
                            ShapedArray.of(new double[4]),
                            new double[] {0.1, 0.5, 0.9},
                            ShapedArray.of(new double[8], 4, 1, 2)));
        }

        @Test
        @DisplayName("Ragged nested arrays are rejected")
        void raggedArrays() {
            double[][] lon = {{0, 10}, {20}};
            assertThrows(InvalidShapeException.class, () -> ShapedArray.of(lon));
            assertThrows(InvalidShapeException.class, () -> ShapedArray.of(new double[5], 2, 2));
        }

        @Test
        @DisplayName("Rank-4 intensity flattens row-major like the longitude grid")
        void rankFourFlattening() {
            double[] lons = SampleSurfaces.linspace(-150, 150, 6);
            double[] lats = SampleSurfaces.linspace(-60, 60, 4);
            double[][] lon = new double[lats.length][lons.length];
            double[][] lat = new double[lats.length][lons.length];
            double[] flatLon = new double[lats.length * lons.length];
            double[] flatLat = new double[flatLon.length];
            for (int i = 0; i < lats.length; i++) {
                for (int j = 0; j < lons.length; j++) {
                    lon[i][j] = lons[j];
                    lat[i][j] = lats[i];
                    flatLon[i * lons.length + j] = lons[j];
                    flatLat[i * lons.length + j] = lats[i];
                }
            }
            double[][][] flat = SampleSurfaces.dayside(flatLon, flatLat, 1, 2);
            double[][][][] grid = new double[lats.length][lons.length][][];
            for (int i = 0; i < lats.length; i++) {
                for (int j = 0; j < lons.length; j++) {
                    grid[i][j] = flat[i * lons.length + j];
                }
            }
            double[] mus = {0.0, 1.0};
            double[] phases = {0.0, 0.4};

            double[][] fromGrid = PhaseCurveModel.compute(phases, lon, lat, mus, grid);
            double[][] fromFlat = PhaseCurveModel.compute(phases, flatLon, flatLat, mus, flat);
            for (int p = 0; p < phases.length; p++) {
                assertArrayEquals(fromFlat[p], fromGrid[p], 0.0);
            }
        }
    }

    @Nested
    @DisplayName("Edge Cases and Error Handling")
    class EdgeCaseTests {
        private final double[] lon = SampleSurfaces.fibonacciLon(10);
        private final double[] lat = SampleSurfaces.fibonacciLat(10);

        @Test
        @DisplayName("Non-monotonic mus are rejected before fitting")
        void nonMonotonicMus() {
            assertThrows(
                    InvalidInputException.class,
                    () -> PhaseCurveModel.compute(
                            new double[] {0.0}, lon, lat, new double[] {0.5, 0.2}, SampleSurfaces.constant(10, 1, 2, 1.0)));
        }

        @Test
        @DisplayName("Non-finite intensity names the offending point")
        void nonFiniteIntensity() {
            double[][][] intensity = SampleSurfaces.constant(10, 1, 2, 1.0);
            intensity[3][0][0] = Double.NaN;
            InvalidInputException e = assertThrows(
                    InvalidInputException.class,
                    () -> PhaseCurveModel.compute(new double[] {0.0}, lon, lat, new double[] {0.2, 0.8}, intensity));
            assertTrue(e.getMessage().contains("surface point 3"), e.getMessage());
            assertFalse(e.getMessage().contains("singular"), e.getMessage());
        }

        @Test
        @DisplayName("Non-finite coordinates are rejected")
        void nonFiniteCoordinates() {
            double[] badLon = lon.clone();
            badLon[5] = Double.POSITIVE_INFINITY;
            InvalidInputException e = assertThrows(
                    InvalidInputException.class,
                    () -> PhaseCurveModel.compute(
                            new double[] {0.0}, badLon, lat, new double[] {0.5}, SampleSurfaces.constant(10, 1, 1, 1.0)));
            assertTrue(e.getMessage().contains("Surface point 5"), e.getMessage());
        }

        @Test
        @DisplayName("Non-finite phases are rejected")
        void nonFinitePhase() {
            assertThrows(
                    InvalidInputException.class,
                    () -> PhaseCurveModel.compute(
                            new double[] {0.0, Double.NaN}, lon, lat, new double[] {0.5}, SampleSurfaces.constant(10, 1, 1, 1.0)));
        }

        @Test
        @DisplayName("Missing inputs are rejected")
        void missingInputs() {
            assertThrows(
                    InvalidInputException.class,
                    () -> PhaseCurveModel.compute(
                            null, ShapedArray.of(lon), ShapedArray.of(lat), new double[] {0.5},
                            ShapedArray.of(SampleSurfaces.constant(10, 1, 1, 1.0))));
            assertThrows(
                    InvalidInputException.class,
                    () -> PhaseCurveModel.compute(
                            new double[] {0.0}, ShapedArray.of(lon), ShapedArray.of(lat), null,
                            ShapedArray.of(SampleSurfaces.constant(10, 1, 1, 1.0))));
        }

        @Test
        @DisplayName("A custom field fitter replaces the radial basis fit")
        void customFitter() {
            SurfaceFieldFitter uniform = (directions, intensities) -> {
                assertEquals(10, directions.length);
                return new FluxIntegratorTest.FieldStub(
                        intensities[0].length, intensities[0][0].length, (x, y, z, w, m) -> 5.0);
            };
            double[][] curve = PhaseCurveModel.compute(
                    new double[] {0.0, 0.5},
                    ShapedArray.of(lon),
                    ShapedArray.of(lat),
                    new double[] {0.5},
                    ShapedArray.of(SampleSurfaces.constant(10, 3, 1, 0.0)),
                    PhaseCurveConfig.builtIn(),
                    uniform);
            for (double[] row : curve) {
                for (double f : row) assertEquals(5.0 * Math.PI, f, 1e-12);
            }
        }
    }

    @Nested
    @DisplayName("Spectrum Provider Tests")
    class SpectrumProviderTests {
        private final SurfaceGrid grid = new SurfaceGrid() {
            private final double[] lon = SampleSurfaces.fibonacciLon(40);
            private final double[] lat = SampleSurfaces.fibonacciLat(40);

            @Override
            public int cellCount() {
                return lon.length;
            }

            @Override
            public double longitude(int cell) {
                return lon[cell];
            }

            @Override
            public double latitude(int cell) {
                return lat[cell];
            }
        };

        @Test
        @DisplayName("Provider spectra are assembled per cell and mu")
        void assembledSpectra() {
            double[] mus = {0.0, 1.0};
            // Linear limb darkening, same for every cell: I = (w + 1) * (1 - 0.6 * (1 - mu))
            SpectrumProvider provider = (cell, mu) -> new double[] {1 - 0.6 * (1 - mu), 2 * (1 - 0.6 * (1 - mu))};

            double[][] curve = PhaseCurveModel.compute(new double[] {0.0, 0.7}, grid, provider, mus);

            double expected = 2 * Math.PI * (0.4 * 0.5 + 0.6 * MU_SQUARED_MIDPOINT);
            for (double[] row : curve) {
                assertEquals(expected, row[0], FLUX_TOLERANCE);
                assertEquals(2 * expected, row[1], FLUX_TOLERANCE);
            }
        }

        @Test
        @DisplayName("A missing spectrum names the cell and mu")
        void missingSpectrum() {
            SpectrumProvider provider = (cell, mu) -> cell == 4 ? null : new double[] {1.0};
            InvalidInputException e = assertThrows(
                    InvalidInputException.class,
                    () -> PhaseCurveModel.compute(new double[] {0.0}, grid, provider, new double[] {0.5}));
            assertTrue(e.getMessage().contains("cell 4"), e.getMessage());
            assertTrue(e.getMessage().contains("0.5"), e.getMessage());
        }

        @Test
        @DisplayName("Spectra of differing length are rejected")
        void inconsistentSpectra() {
            SpectrumProvider provider = (cell, mu) -> cell == 7 ? new double[2] : new double[3];
            assertThrows(
                    InvalidShapeException.class,
                    () -> PhaseCurveModel.compute(new double[] {0.0}, grid, provider, new double[] {0.5}));
        }
    }

    // Hot spot at longitude 30 with limb darkening, sampled at the given mus
    private static double[][][] limbDarkenedHotSpot(double[] lon, double[] lat, double[] mus) {
        double[][][] out = new double[lon.length][2][mus.length];
        for (int p = 0; p < lon.length; p++) {
            double spot = Math.exp(Math.cos(Math.toRadians(lon[p] - 30)) * Math.cos(Math.toRadians(lat[p])));
            for (int w = 0; w < 2; w++) {
                for (int m = 0; m < mus.length; m++) {
                    out[p][w][m] = (w + 1) * spot * (0.4 + 0.6 * mus[m]);
                }
            }
        }
        return out;
    }
}
