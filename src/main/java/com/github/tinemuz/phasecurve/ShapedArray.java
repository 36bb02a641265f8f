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

/**
 * Dense row-major array of doubles with an explicit shape.
 *
 * <p>Lets callers hand over longitude, latitude and intensity data either as
 * flattened sequences or as grids, leaving rank checks to
 * {@link InputNormalizer}. Instances copy their input and never expose the
 * backing array.</p>
 */
public final class ShapedArray {
    private final double[] data;
    private final int[] shape;

    private ShapedArray(double[] data, int[] shape) {
        this.data = data;
        this.shape = shape;
    }

    /**
     * Wrap a flat row-major buffer with the given shape.
     *
     * @throws InvalidShapeException if the product of the dimensions does not
     *     equal the buffer length or a dimension is negative
     */
    public static ShapedArray of(double[] data, int... shape) {
        long size = 1;
        for (int d : shape) {
            if (d < 0) {
                throw new InvalidShapeException("Negative dimension in shape " + Arrays.toString(shape));
            }
            size *= d;
        }
        if (size != data.length) {
            throw new InvalidShapeException(
                    "Shape " + Arrays.toString(shape) + " needs " + size
                            + " values, got " + data.length);
        }
        return new ShapedArray(data.clone(), shape.clone());
    }

    public static ShapedArray of(double[] values) {
        return new ShapedArray(values.clone(), new int[] {values.length});
    }

    public static ShapedArray of(double[][] values) {
        int rows = values.length;
        int cols = rows == 0 ? 0 : values[0].length;
        double[] flat = new double[rows * cols];
        for (int i = 0; i < rows; i++) {
            requireLength(values[i], cols);
            System.arraycopy(values[i], 0, flat, i * cols, cols);
        }
        return new ShapedArray(flat, new int[] {rows, cols});
    }

    public static ShapedArray of(double[][][] values) {
        int d0 = values.length;
        int d1 = d0 == 0 ? 0 : values[0].length;
        int d2 = d1 == 0 ? 0 : values[0][0].length;
        double[] flat = new double[d0 * d1 * d2];
        int pos = 0;
        for (double[][] plane : values) {
            requireLength(plane, d1);
            for (double[] row : plane) {
                requireLength(row, d2);
                System.arraycopy(row, 0, flat, pos, d2);
                pos += d2;
            }
        }
        return new ShapedArray(flat, new int[] {d0, d1, d2});
    }

    public static ShapedArray of(double[][][][] values) {
        int d0 = values.length;
        int d1 = d0 == 0 ? 0 : values[0].length;
        int d2 = d1 == 0 ? 0 : values[0][0].length;
        int d3 = d2 == 0 ? 0 : values[0][0][0].length;
        double[] flat = new double[d0 * d1 * d2 * d3];
        int pos = 0;
        for (double[][][] cube : values) {
            requireLength(cube, d1);
            for (double[][] plane : cube) {
                requireLength(plane, d2);
                for (double[] row : plane) {
                    requireLength(row, d3);
                    System.arraycopy(row, 0, flat, pos, d3);
                    pos += d3;
                }
            }
        }
        return new ShapedArray(flat, new int[] {d0, d1, d2, d3});
    }

    public int rank() {
        return shape.length;
    }

    public int dim(int axis) {
        return shape[axis];
    }

    public int[] shape() {
        return shape.clone();
    }

    public int size() {
        return data.length;
    }

    /** Value at a row-major flat index. */
    public double get(int flatIndex) {
        return data[flatIndex];
    }

    /** Copy of the values in row-major order. */
    public double[] toFlatArray() {
        return data.clone();
    }

    @Override
    public String toString() {
        return "ShapedArray" + Arrays.toString(shape);
    }

    private static void requireLength(Object[] part, int expected) {
        if (part.length != expected) {
            throw new InvalidShapeException(
                    "Ragged array: expected length " + expected + ", got " + part.length);
        }
    }

    private static void requireLength(double[] part, int expected) {
        if (part.length != expected) {
            throw new InvalidShapeException(
                    "Ragged array: expected length " + expected + ", got " + part.length);
        }
    }
}
