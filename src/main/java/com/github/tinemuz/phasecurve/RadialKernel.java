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

import java.util.Locale;

/** Polyharmonic radial basis functions usable with a linear polynomial tail. */
public enum RadialKernel {
    /** {@code -r} */
    LINEAR {
        @Override
        public double evaluate(double r) {
            return -r;
        }
    },
    /** {@code r^2 ln r}, zero at the origin. */
    THIN_PLATE_SPLINE {
        @Override
        public double evaluate(double r) {
            return r == 0.0 ? 0.0 : r * r * Math.log(r);
        }
    },
    /** {@code r^3} */
    CUBIC {
        @Override
        public double evaluate(double r) {
            return r * r * r;
        }
    };

    public abstract double evaluate(double r);

    /**
     * Parse a kernel name such as {@code thin_plate_spline} or
     * {@code THIN-PLATE-SPLINE}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static RadialKernel fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
