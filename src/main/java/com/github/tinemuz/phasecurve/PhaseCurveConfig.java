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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable settings for a phase curve computation.
 *
 * <p>Defaults come from the classpath resource {@code phasecurve.properties},
 * read once on first use. Without the resource the built-in values apply:
 * thin-plate-spline kernel, smoothing 0.1, a 10 x 10 quadrature and
 * sequential phase evaluation. Use the {@code with*} methods to override
 * single settings for one call.</p>
 */
public final class PhaseCurveConfig {
    private static final Logger log = LoggerFactory.getLogger(PhaseCurveConfig.class);
    static final String RESOURCE = "phasecurve.properties";

    static final String KEY_KERNEL = "phasecurve.rbf.kernel";
    static final String KEY_SMOOTHING = "phasecurve.rbf.smoothing";
    static final String KEY_MU_CELLS = "phasecurve.quadrature.mu-cells";
    static final String KEY_AZIMUTH_CELLS = "phasecurve.quadrature.azimuth-cells";
    static final String KEY_PARALLEL = "phasecurve.parallel";

    private static final PhaseCurveConfig BUILT_IN =
            new PhaseCurveConfig(
                    RadialKernel.THIN_PLATE_SPLINE,
                    0.1,
                    QuadratureGrid.DEFAULT_MU_CELLS,
                    QuadratureGrid.DEFAULT_AZIMUTH_CELLS,
                    false);
    private static volatile PhaseCurveConfig defaults;

    private final RadialKernel kernel;
    private final double smoothing;
    private final int muCells;
    private final int azimuthCells;
    private final boolean parallel;

    private PhaseCurveConfig(
            RadialKernel kernel, double smoothing, int muCells, int azimuthCells, boolean parallel) {
        if (kernel == null) {
            throw new InvalidInputException("Kernel is required");
        }
        if (!(smoothing >= 0.0) || Double.isInfinite(smoothing)) {
            throw new InvalidInputException("Smoothing must be a finite non-negative value, got " + smoothing);
        }
        if (muCells < 1 || azimuthCells < 1) {
            throw new InvalidInputException(
                    "Quadrature needs at least one cell per axis, got " + muCells + "x" + azimuthCells);
        }
        this.kernel = kernel;
        this.smoothing = smoothing;
        this.muCells = muCells;
        this.azimuthCells = azimuthCells;
        this.parallel = parallel;
    }

    /**
     * Settings from {@code phasecurve.properties}, or the built-in values when
     * the resource is absent.
     *
     * @throws IllegalStateException if the resource cannot be read or parsed
     */
    public static PhaseCurveConfig defaults() {
        PhaseCurveConfig d = defaults;
        if (d == null) {
            synchronized (PhaseCurveConfig.class) {
                d = defaults;
                if (d == null) {
                    d = loadFromResource(RESOURCE);
                    defaults = d;
                }
            }
        }
        return d;
    }

    /** Built-in values, ignoring any classpath resource. */
    public static PhaseCurveConfig builtIn() {
        return BUILT_IN;
    }

    /**
     * Read settings from a classpath resource; keys that are absent keep their
     * built-in value.
     *
     * @throws IllegalStateException if the resource cannot be read or a value
     *     cannot be parsed
     */
    static PhaseCurveConfig loadFromResource(String resource) {
        InputStream in = PhaseCurveConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.debug("No '{}' on classpath; using built-in defaults", resource);
            return BUILT_IN;
        }
        Properties props = new Properties();
        try (InputStream stream = in) {
            props.load(stream);
        } catch (IOException e) {
            log.error("Failed to read phase curve settings '{}'", resource, e);
            throw new IllegalStateException("Failed to read phase curve settings '" + resource + "'", e);
        }
        try {
            PhaseCurveConfig config =
                    new PhaseCurveConfig(
                            RadialKernel.fromName(
                                    props.getProperty(KEY_KERNEL, BUILT_IN.kernel.name())),
                            Double.parseDouble(
                                    props.getProperty(KEY_SMOOTHING, Double.toString(BUILT_IN.smoothing)).trim()),
                            Integer.parseInt(
                                    props.getProperty(KEY_MU_CELLS, Integer.toString(BUILT_IN.muCells)).trim()),
                            Integer.parseInt(
                                    props.getProperty(KEY_AZIMUTH_CELLS, Integer.toString(BUILT_IN.azimuthCells))
                                            .trim()),
                            Boolean.parseBoolean(
                                    props.getProperty(KEY_PARALLEL, Boolean.toString(BUILT_IN.parallel)).trim()));
            log.debug("Loaded phase curve settings from '{}': {}", resource, config);
            return config;
        } catch (IllegalArgumentException e) {
            log.error("Failed to parse phase curve settings '{}'", resource, e);
            throw new IllegalStateException("Failed to parse phase curve settings '" + resource + "'", e);
        }
    }

    public RadialKernel kernel() {
        return kernel;
    }

    public double smoothing() {
        return smoothing;
    }

    public int muCells() {
        return muCells;
    }

    public int azimuthCells() {
        return azimuthCells;
    }

    public boolean parallel() {
        return parallel;
    }

    public PhaseCurveConfig withKernel(RadialKernel kernel) {
        return new PhaseCurveConfig(kernel, smoothing, muCells, azimuthCells, parallel);
    }

    public PhaseCurveConfig withSmoothing(double smoothing) {
        return new PhaseCurveConfig(kernel, smoothing, muCells, azimuthCells, parallel);
    }

    public PhaseCurveConfig withQuadrature(int muCells, int azimuthCells) {
        return new PhaseCurveConfig(kernel, smoothing, muCells, azimuthCells, parallel);
    }

    public PhaseCurveConfig withParallel(boolean parallel) {
        return new PhaseCurveConfig(kernel, smoothing, muCells, azimuthCells, parallel);
    }

    /** Fitter for the configured kernel and smoothing. */
    public SurfaceFieldFitter fitter() {
        return RbfSurfaceField.fitter(kernel, smoothing);
    }

    /** Quadrature for the configured resolution. */
    public QuadratureGrid quadrature() {
        return new QuadratureGrid(muCells, azimuthCells);
    }

    @Override
    public String toString() {
        return "PhaseCurveConfig{"
                + "kernel=" + kernel
                + ", smoothing=" + smoothing
                + ", muCells=" + muCells
                + ", azimuthCells=" + azimuthCells
                + ", parallel=" + parallel
                + '}';
    }
}
