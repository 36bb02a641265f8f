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

import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Disk-integrated phase curve of a rotating spherical body.
 *
 * <p>Given scattered surface intensities (longitude, latitude, and for each
 * point an intensity per wavelength and sampled emission-angle cosine mu),
 * this class fits a continuous field over the sphere once and, for every
 * requested phase, integrates the emergent intensity over the hemisphere
 * facing the observer. The result is a matrix with one row per phase, in the
 * order given, and one column per wavelength.</p>
 *
 * <p>Longitude and latitude are accepted flattened (rank 1) or as grids
 * (rank 2); intensity as {@code (points, wavelengths, mus)} or
 * {@code (grid1, grid2, wavelengths, mus)}. Phases are fractions of one
 * rotation.</p>
 *
 * <p>All methods are stateless and thread-safe.</p>
 */
public final class PhaseCurveModel {
    private static final Logger log = LoggerFactory.getLogger(PhaseCurveModel.class);
    private static final int DEFAULT_PHASE_COUNT = 11;

    private PhaseCurveModel() {}

    /** Eleven evenly spaced phases from 0 to 1 inclusive. */
    public static double[] defaultPhases() {
        double[] phases = new double[DEFAULT_PHASE_COUNT];
        for (int i = 0; i < DEFAULT_PHASE_COUNT; i++) {
            phases[i] = (double) i / (DEFAULT_PHASE_COUNT - 1);
        }
        return phases;
    }

    /** Phase curve at {@link #defaultPhases()} with default settings. */
    public static double[][] compute(ShapedArray lon, ShapedArray lat, double[] mus, ShapedArray intensity) {
        return compute(defaultPhases(), lon, lat, mus, intensity);
    }

    /** Phase curve with default settings. */
    public static double[][] compute(
            double[] phases, ShapedArray lon, ShapedArray lat, double[] mus, ShapedArray intensity) {
        return compute(phases, lon, lat, mus, intensity, PhaseCurveConfig.defaults());
    }

    /** Phase curve for flattened samples with default settings. */
    public static double[][] compute(
            double[] phases, double[] lon, double[] lat, double[] mus, double[][][] intensity) {
        return compute(phases, ShapedArray.of(lon), ShapedArray.of(lat), mus, ShapedArray.of(intensity));
    }

    /** Phase curve for gridded samples with default settings. */
    public static double[][] compute(
            double[] phases, double[][] lon, double[][] lat, double[] mus, double[][][][] intensity) {
        return compute(phases, ShapedArray.of(lon), ShapedArray.of(lat), mus, ShapedArray.of(intensity));
    }

    /** Phase curve using the kernel, smoothing, quadrature and parallelism of {@code config}. */
    public static double[][] compute(
            double[] phases,
            ShapedArray lon,
            ShapedArray lat,
            double[] mus,
            ShapedArray intensity,
            PhaseCurveConfig config) {
        return compute(phases, lon, lat, mus, intensity, config, config.fitter());
    }

    /**
     * Evaluate the phase curve.
     *
     * @param phases phases in fractions of a rotation; output rows follow this order
     * @param lon longitudes in degrees, rank 1 or 2
     * @param lat latitudes in degrees, same shape as {@code lon}
     * @param mus strictly increasing emission-angle cosines of the intensity's last axis
     * @param intensity rank 3 {@code (M, W, D)} or rank 4 {@code (M1, M2, W, D)}
     * @param config quadrature resolution and parallelism
     * @param fitter builds the surface field; {@code config}'s kernel and
     *     smoothing apply only through {@link PhaseCurveConfig#fitter()}
     * @return flux, shape {@code (phases.length, W)}
     * @throws InvalidShapeException if an input has an unsupported rank or
     *     the sizes disagree
     * @throws InvalidInputException if mus are not strictly increasing, a
     *     phase is not finite, or the field cannot be fitted
     */
    public static double[][] compute(
            double[] phases,
            ShapedArray lon,
            ShapedArray lat,
            double[] mus,
            ShapedArray intensity,
            PhaseCurveConfig config,
            SurfaceFieldFitter fitter) {
        if (phases == null) {
            throw new InvalidInputException("phases are required");
        }
        for (int i = 0; i < phases.length; i++) {
            if (!Double.isFinite(phases[i])) {
                throw new InvalidInputException("phase[" + i + "] is not finite: " + phases[i]);
            }
        }
        InputNormalizer.Normalized input = InputNormalizer.normalize(lon, lat, mus, intensity);
        MuBandInterpolator.requireStrictlyIncreasing(input.mus());
        if (phases.length == 0) {
            return new double[0][];
        }

        long start = System.nanoTime();
        double[][] directions = CoordinateTransform.toCartesian(input.lon(), input.lat());
        SurfaceField field = fitter.fit(directions, input.intensity());
        FluxIntegrator integrator = new FluxIntegrator(config.quadrature(), input.mus());

        double[][] curve = new double[phases.length][];
        if (config.parallel()) {
            IntStream.range(0, phases.length)
                    .parallel()
                    .forEach(i -> curve[i] = integrator.integrate(field, PhaseRotation.forPhase(phases[i])));
        } else {
            for (int i = 0; i < phases.length; i++) {
                curve[i] = integrator.integrate(field, PhaseRotation.forPhase(phases[i]));
            }
        }
        if (log.isDebugEnabled()) {
            log.debug(
                    "Computed {} phases x {} wavelengths from {} samples on {} quadrature cells in {} ms",
                    phases.length,
                    input.wavelengths(),
                    input.points(),
                    integrator.grid().size(),
                    String.format("%.1f", (System.nanoTime() - start) / 1e6));
        }
        return curve;
    }

    /** Phase curve from an external dataset and spectrum source with default settings. */
    public static double[][] compute(
            double[] phases, SurfaceGrid grid, SpectrumProvider provider, double[] mus) {
        return compute(phases, grid, provider, mus, PhaseCurveConfig.defaults());
    }

    /**
     * Phase curve from an external dataset and spectrum source. The provider
     * is asked for every (cell, mu) pair and the resulting
     * {@code (cells, wavelengths, mus)} tensor is evaluated as usual.
     *
     * @throws InvalidShapeException if spectra differ in length
     * @throws InvalidInputException if the provider returns no spectrum
     */
    public static double[][] compute(
            double[] phases,
            SurfaceGrid grid,
            SpectrumProvider provider,
            double[] mus,
            PhaseCurveConfig config) {
        if (grid == null || provider == null || mus == null) {
            throw new InvalidInputException("grid, provider and mus are required");
        }
        MuBandInterpolator.requireStrictlyIncreasing(mus);
        int cells = grid.cellCount();
        double[] lon = new double[cells];
        double[] lat = new double[cells];
        double[][][] intensity = new double[cells][][];
        int wavelengths = -1;
        for (int c = 0; c < cells; c++) {
            lon[c] = grid.longitude(c);
            lat[c] = grid.latitude(c);
            for (int d = 0; d < mus.length; d++) {
                double[] spectrum = provider.spectrum(c, mus[d]);
                if (spectrum == null) {
                    throw new InvalidInputException("No spectrum for cell " + c + " at mu " + mus[d]);
                }
                if (wavelengths < 0) {
                    wavelengths = spectrum.length;
                } else if (spectrum.length != wavelengths) {
                    throw new InvalidShapeException(
                            "Spectrum for cell " + c + " at mu " + mus[d] + " has " + spectrum.length
                                    + " wavelengths, expected " + wavelengths);
                }
                if (intensity[c] == null) {
                    intensity[c] = new double[wavelengths][mus.length];
                }
                for (int w = 0; w < wavelengths; w++) {
                    intensity[c][w][d] = spectrum[w];
                }
            }
        }
        log.debug("Assembled spectra for {} cells x {} mus x {} wavelengths", cells, mus.length, wavelengths);
        return compute(
                phases,
                ShapedArray.of(lon),
                ShapedArray.of(lat),
                mus,
                ShapedArray.of(intensity),
                config);
    }
}
