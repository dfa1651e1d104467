/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fuel.ndarray;

import org.fuel.api.exception.FormatException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.DataType;
import org.fuel.api.ndarray.types.Shape;

/**
 * {@code NDImageUtils} is an image processing utility to resize, rotate and remap arrays whose last
 * two axes are {@code (height, width)}.
 *
 * <p>Every leading axis is treated as a stack of independent planes. Integer results are rounded
 * and saturated to the input type.
 */
public final class NDImageUtils {

    private NDImageUtils() {}

    /**
     * Resizes the last two axes of an array.
     *
     * @param array an array of rank 2 or more
     * @param height the new height
     * @param width the new width
     * @param interpolation the resampling mode
     * @return the resized array, same type as the input
     */
    public static NDArray resize(
            NDArray array, int height, int width, Interpolation interpolation) {
        Shape shape = checkPlanes(array);
        int h = (int) shape.get(-2);
        int w = (int) shape.get(-1);
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Invalid size " + height + 'x' + width);
        }
        double scaleY = (double) h / height;
        double scaleX = (double) w / width;
        double[] src = array.toDoubleArray();
        int planes = src.length / (h * w);
        double[] out = new double[planes * height * width];
        DataType type = array.getDataType();
        for (int p = 0; p < planes; ++p) {
            for (int r = 0; r < height; ++r) {
                double sy = (r + 0.5) * scaleY - 0.5;
                for (int c = 0; c < width; ++c) {
                    double sx = (c + 0.5) * scaleX - 0.5;
                    double v = sample(src, p * h * w, h, w, sy, sx, interpolation);
                    out[(p * height + r) * width + c] = type.saturate(v);
                }
            }
        }
        long[] outShape = shape.getShape();
        outShape[outShape.length - 2] = height;
        outShape[outShape.length - 1] = width;
        return NDArray.create(out, new Shape(outShape), type);
    }

    /**
     * Rotates the last two axes of an array counterclockwise around the center of the plane.
     *
     * <p>Each output cell is mapped back through the inverse rotation from its top-left corner,
     * translating back by the integer half extents of the plane. Cells that map outside the
     * source are filled with zero. Nearest-neighbor resampling reads the source cell the mapped
     * position falls in; the other modes interpolate around it. A zero angle leaves planes of
     * even height and width unchanged.
     *
     * @param array an array of rank 2 or more
     * @param angle the rotation angle in radians
     * @param interpolation the resampling mode
     * @return the rotated array, same shape and type as the input
     */
    public static NDArray rotate(NDArray array, double angle, Interpolation interpolation) {
        Shape shape = checkPlanes(array);
        int h = (int) shape.get(-2);
        int w = (int) shape.get(-1);
        double[] src = array.toDoubleArray();
        int planes = src.length / (h * w);
        double[] out = new double[src.length];
        DataType type = array.getDataType();

        double cos = Math.cos(-angle);
        double sin = Math.sin(-angle);
        for (int r = 0; r < h; ++r) {
            double y = r - h / 2.0;
            for (int c = 0; c < w; ++c) {
                double x = c - w / 2.0;
                double xin = cos * x + sin * y + w / 2;
                double yin = -sin * x + cos * y + h / 2;
                if (xin < 0 || xin >= w || yin < 0 || yin >= h) {
                    continue;
                }
                for (int p = 0; p < planes; ++p) {
                    int offset = p * h * w;
                    double v;
                    if (interpolation == Interpolation.NEAREST) {
                        v = src[offset + (int) yin * w + (int) xin];
                    } else {
                        v = sample(src, offset, h, w, yin - 0.5, xin - 0.5, interpolation);
                    }
                    out[offset + r * w + c] = type.saturate(v);
                }
            }
        }
        return NDArray.create(out, shape, type);
    }

    /**
     * Remaps every value with a power law, independently of the other values of the array.
     *
     * <p>A value {@code v} becomes {@code sign(v) * scale * (|v| / scale)^gamma}, where the scale
     * is the largest value of an integer type and 1 for floating point types. The result is
     * rounded and saturated to the type of the array.
     *
     * @param array the array
     * @param gamma the exponent, positive
     * @return the remapped array, same shape and type as the input
     */
    public static NDArray gammaCorrection(NDArray array, double gamma) {
        if (gamma == 1) {
            return array.map(v -> v);
        }
        DataType type = array.getDataType();
        double scale = type.isFloating() ? 1 : type.maxValue();
        double[] values = array.toDoubleArray();
        for (int i = 0; i < values.length; ++i) {
            double v = values[i];
            double corrected = Math.signum(v) * scale * Math.pow(Math.abs(v) / scale, gamma);
            values[i] = type.saturate(corrected);
        }
        return NDArray.create(values, array.getShape(), type);
    }

    private static Shape checkPlanes(NDArray array) {
        Shape shape = array.getShape();
        if (shape.dimension() < 2) {
            throw new FormatException("Expected an array with height and width, got " + shape);
        }
        return shape;
    }

    /**
     * Samples a plane at a position given in cell coordinates, where the center of cell {@code i}
     * is at {@code i}. Neighbors outside the plane are clamped to the edge.
     */
    private static double sample(
            double[] src,
            int offset,
            int h,
            int w,
            double sy,
            double sx,
            Interpolation interpolation) {
        switch (interpolation) {
            case BILINEAR:
                {
                    int y0 = (int) Math.floor(sy);
                    int x0 = (int) Math.floor(sx);
                    double fy = sy - y0;
                    double fx = sx - x0;
                    double top =
                            at(src, offset, h, w, y0, x0) * (1 - fx)
                                    + at(src, offset, h, w, y0, x0 + 1) * fx;
                    double bottom =
                            at(src, offset, h, w, y0 + 1, x0) * (1 - fx)
                                    + at(src, offset, h, w, y0 + 1, x0 + 1) * fx;
                    return top * (1 - fy) + bottom * fy;
                }
            case BICUBIC:
                {
                    int y0 = (int) Math.floor(sy);
                    int x0 = (int) Math.floor(sx);
                    double fy = sy - y0;
                    double fx = sx - x0;
                    double total = 0;
                    for (int j = -1; j <= 2; ++j) {
                        double row = 0;
                        for (int i = -1; i <= 2; ++i) {
                            row += at(src, offset, h, w, y0 + j, x0 + i) * cubic(i - fx);
                        }
                        total += row * cubic(j - fy);
                    }
                    return total;
                }
            case NEAREST:
            default:
                return at(
                        src,
                        offset,
                        h,
                        w,
                        (int) Math.floor(sy + 0.5),
                        (int) Math.floor(sx + 0.5));
        }
    }

    private static double at(double[] src, int offset, int h, int w, int y, int x) {
        int yy = Math.max(0, Math.min(h - 1, y));
        int xx = Math.max(0, Math.min(w - 1, x));
        return src[offset + yy * w + xx];
    }

    /** Keys cubic convolution kernel with {@code a = -0.5}. */
    private static double cubic(double t) {
        double a = -0.5;
        double x = Math.abs(t);
        if (x < 1) {
            return ((a + 2) * x - (a + 3)) * x * x + 1;
        } else if (x < 2) {
            return ((a * x - 5 * a) * x + 8 * a) * x - 4 * a;
        }
        return 0;
    }
}
