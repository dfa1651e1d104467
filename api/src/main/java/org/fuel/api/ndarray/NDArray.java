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

package org.fuel.api.ndarray;

import java.util.Arrays;
import java.util.List;
import java.util.function.DoubleUnaryOperator;
import org.fuel.api.exception.FormatException;
import org.fuel.api.ndarray.types.DataType;
import org.fuel.api.ndarray.types.Shape;

/**
 * An n-dimensional array held in row-major order.
 *
 * <p>Values are stored as {@code double} and kept within the domain of the array's {@link
 * DataType}, so a {@code uint8} array only ever holds integers in {@code [0, 255]}. Arrays are
 * never mutated by transforms: every operation returns a new {@code NDArray}.
 */
public class NDArray {

    private double[] data;
    private Shape shape;
    private DataType dataType;
    private String name;

    private NDArray(double[] data, Shape shape, DataType dataType) {
        if (data.length != shape.size()) {
            throw new IllegalArgumentException(
                    "Data size " + data.length + " does not match shape " + shape);
        }
        this.data = data;
        this.shape = shape;
        this.dataType = dataType;
    }

    /**
     * Creates an array of the given type, converting every value to that type.
     *
     * @param data the values in row-major order
     * @param shape the shape of the array
     * @param dataType the data type of the array
     * @return a new {@code NDArray}
     */
    public static NDArray create(double[] data, Shape shape, DataType dataType) {
        double[] values = new double[data.length];
        for (int i = 0; i < values.length; ++i) {
            values[i] = dataType.cast(data[i]);
        }
        return new NDArray(values, shape, dataType);
    }

    /**
     * Creates a {@code float32} array.
     *
     * @param data the values in row-major order
     * @param shape the shape of the array
     * @return a new {@code NDArray}
     */
    public static NDArray create(float[] data, Shape shape) {
        double[] values = new double[data.length];
        for (int i = 0; i < values.length; ++i) {
            values[i] = data[i];
        }
        return new NDArray(values, shape, DataType.FLOAT32);
    }

    /**
     * Creates an {@code int32} array.
     *
     * @param data the values in row-major order
     * @param shape the shape of the array
     * @return a new {@code NDArray}
     */
    public static NDArray create(int[] data, Shape shape) {
        return new NDArray(Arrays.stream(data).asDoubleStream().toArray(), shape, DataType.INT32);
    }

    /**
     * Creates a {@code uint8} array, reading each byte as unsigned.
     *
     * @param data the values in row-major order
     * @param shape the shape of the array
     * @return a new {@code NDArray}
     */
    public static NDArray create(byte[] data, Shape shape) {
        double[] values = new double[data.length];
        for (int i = 0; i < values.length; ++i) {
            values[i] = data[i] & 0xFF;
        }
        return new NDArray(values, shape, DataType.UINT8);
    }

    /**
     * Creates an array filled with zeros.
     *
     * @param shape the shape of the array
     * @param dataType the data type of the array
     * @return a new {@code NDArray}
     */
    public static NDArray zeros(Shape shape, DataType dataType) {
        return new NDArray(new double[Math.toIntExact(shape.size())], shape, dataType);
    }

    /**
     * Returns evenly spaced values {@code 0, 1, ..., stop - 1} as a 1-D array, wrapped to the
     * given type.
     *
     * @param stop the end of the interval, exclusive
     * @param dataType the data type of the array
     * @return a new {@code NDArray}
     */
    public static NDArray arange(int stop, DataType dataType) {
        double[] values = new double[stop];
        for (int i = 0; i < stop; ++i) {
            values[i] = i;
        }
        return create(values, new Shape(stop), dataType);
    }

    /**
     * Joins arrays of identical shape and type along a new leading axis.
     *
     * @param arrays the arrays to stack
     * @return the stacked {@code NDArray}
     * @throws FormatException if the list is empty or shapes or types differ
     */
    public static NDArray stack(List<NDArray> arrays) {
        if (arrays.isEmpty()) {
            throw new FormatException("Cannot stack an empty list of arrays");
        }
        NDArray first = arrays.get(0);
        int size = first.data.length;
        double[] values = new double[size * arrays.size()];
        for (int i = 0; i < arrays.size(); ++i) {
            NDArray array = arrays.get(i);
            if (!array.shape.equals(first.shape) || array.dataType != first.dataType) {
                throw new FormatException(
                        "Cannot stack "
                                + array.shape
                                + ' '
                                + array.dataType
                                + " onto "
                                + first.shape
                                + ' '
                                + first.dataType);
            }
            System.arraycopy(array.data, 0, values, i * size, size);
        }
        return new NDArray(values, new Shape(arrays.size()).addAll(first.shape), first.dataType);
    }

    /**
     * Joins arrays along an existing axis. All other dimensions and the type must agree.
     *
     * @param arrays the arrays to join
     * @param axis the axis to join along
     * @return the joined {@code NDArray}
     * @throws FormatException if the list is empty or the arrays do not line up
     */
    public static NDArray concat(List<NDArray> arrays, int axis) {
        if (arrays.isEmpty()) {
            throw new FormatException("Cannot concatenate an empty list of arrays");
        }
        NDArray first = arrays.get(0);
        long total = 0;
        for (NDArray array : arrays) {
            if (array.dataType != first.dataType
                    || array.shape.dimension() != first.shape.dimension()
                    || !array.shape.remove(axis).equals(first.shape.remove(axis))) {
                throw new FormatException(
                        "Cannot concatenate " + array.shape + " with " + first.shape);
            }
            total += array.shape.get(axis);
        }
        long outer = first.shape.slice(0, axis).size();
        Shape outShape = Shape.update(first.shape, axis, total);
        double[] values = new double[Math.toIntExact(outShape.size())];
        int pos = 0;
        for (long o = 0; o < outer; ++o) {
            for (NDArray array : arrays) {
                int block = Math.toIntExact(array.shape.slice(axis).size());
                System.arraycopy(array.data, Math.toIntExact(o * block), values, pos, block);
                pos += block;
            }
        }
        return new NDArray(values, outShape, first.dataType);
    }

    /**
     * Returns the name of this array.
     *
     * @return the name, or {@code null}
     */
    public String getName() {
        return name;
    }

    /**
     * Sets the name of this array.
     *
     * @param name the name
     */
    public void setName(String name) {
        this.name = name;
    }

    /**
     * Returns the shape of this array.
     *
     * @return the {@link Shape}
     */
    public Shape getShape() {
        return shape;
    }

    /**
     * Returns the data type of this array.
     *
     * @return the {@link DataType}
     */
    public DataType getDataType() {
        return dataType;
    }

    /**
     * Returns the number of elements.
     *
     * @return the number of elements
     */
    public long size() {
        return data.length;
    }

    /**
     * Returns the rank of this array.
     *
     * @return the number of axes
     */
    public int getRank() {
        return shape.dimension();
    }

    /**
     * Returns the element at the given position.
     *
     * @param indices one index per axis
     * @return the element value
     */
    public double getDouble(long... indices) {
        if (indices.length != shape.dimension()) {
            throw new IllegalArgumentException(
                    "Expected " + shape.dimension() + " indices, got " + indices.length);
        }
        long[] strides = shape.strides();
        long flat = 0;
        for (int i = 0; i < indices.length; ++i) {
            if (indices[i] < 0 || indices[i] >= shape.get(i)) {
                throw new IndexOutOfBoundsException(
                        "Index " + Arrays.toString(indices) + " out of bounds for " + shape);
            }
            flat += indices[i] * strides[i];
        }
        return data[Math.toIntExact(flat)];
    }

    /**
     * Returns a copy of the values in row-major order.
     *
     * @return the values
     */
    public double[] toDoubleArray() {
        return data.clone();
    }

    /**
     * Returns the values in row-major order as boxed numbers of the matching Java type.
     *
     * @return the values
     */
    public Number[] toArray() {
        Number[] out = new Number[data.length];
        for (int i = 0; i < data.length; ++i) {
            out[i] = dataType.isFloating() ? (Number) data[i] : (Number) (long) data[i];
        }
        return out;
    }

    /**
     * Returns the values as unsigned bytes. Only valid for {@code uint8} arrays.
     *
     * @return the values
     */
    public byte[] toUint8Array() {
        if (dataType != DataType.UINT8) {
            throw new FormatException("Expected uint8 array, got " + dataType);
        }
        byte[] out = new byte[data.length];
        for (int i = 0; i < data.length; ++i) {
            out[i] = (byte) (int) data[i];
        }
        return out;
    }

    /**
     * Returns an array with the same data and a new shape.
     *
     * @param newShape the new dimensions
     * @return the reshaped {@code NDArray}
     */
    public NDArray reshape(long... newShape) {
        Shape target = new Shape(newShape);
        if (target.size() != data.length) {
            throw new FormatException("Cannot reshape " + shape + " to " + target);
        }
        return new NDArray(data.clone(), target, dataType);
    }

    /**
     * Returns the sub-array at the given index of the leading axis.
     *
     * @param index the index along axis 0
     * @return a new {@code NDArray} of one dimension less
     */
    public NDArray get(long index) {
        return take(0, index);
    }

    /**
     * Returns the sub-array at the given index of an axis, dropping that axis.
     *
     * @param axis the axis to index
     * @param index the index along the axis
     * @return a new {@code NDArray} of one dimension less
     */
    public NDArray take(int axis, long index) {
        if (axis < 0 || axis >= shape.dimension()) {
            throw new FormatException("Axis " + axis + " out of range for shape " + shape);
        }
        if (index < 0 || index >= shape.get(axis)) {
            throw new IndexOutOfBoundsException(
                    "Index " + index + " out of bounds for axis " + axis + " of " + shape);
        }
        int outer = Math.toIntExact(shape.slice(0, axis).size());
        int inner = Math.toIntExact(shape.slice(axis + 1).size());
        int dim = Math.toIntExact(shape.get(axis));
        double[] values = new double[outer * inner];
        for (int o = 0; o < outer; ++o) {
            System.arraycopy(data, (o * dim + (int) index) * inner, values, o * inner, inner);
        }
        return new NDArray(values, shape.remove(axis), dataType);
    }

    /**
     * Returns the box {@code [offset, offset + length)} of the trailing axes. Leading axes not
     * covered by {@code offsets} are kept whole.
     *
     * @param offsets the start of the box on each trailing axis
     * @param lengths the extent of the box on each trailing axis
     * @return the cropped {@code NDArray}
     */
    public NDArray crop(long[] offsets, long[] lengths) {
        int rank = shape.dimension();
        int lead = rank - offsets.length;
        if (offsets.length != lengths.length || lead < 0) {
            throw new FormatException(
                    "Cannot crop " + offsets.length + " axes of an array of shape " + shape);
        }
        long[] start = new long[rank];
        long[] outShape = shape.getShape();
        for (int i = 0; i < offsets.length; ++i) {
            if (offsets[i] < 0 || lengths[i] < 0 || offsets[i] + lengths[i] > shape.get(lead + i)) {
                throw new IndexOutOfBoundsException(
                        "Window "
                                + Arrays.toString(offsets)
                                + '+'
                                + Arrays.toString(lengths)
                                + " exceeds "
                                + shape);
            }
            start[lead + i] = offsets[i];
            outShape[lead + i] = lengths[i];
        }
        Shape out = new Shape(outShape, shape.getLayout());
        double[] values = new double[Math.toIntExact(out.size())];
        long[] strides = shape.strides();
        long[] index = new long[rank];
        for (int i = 0; i < values.length; ++i) {
            long flat = 0;
            for (int d = 0; d < rank; ++d) {
                flat += (start[d] + index[d]) * strides[d];
            }
            values[i] = data[(int) flat];
            increment(index, outShape);
        }
        return new NDArray(values, out, dataType);
    }

    /**
     * Reverses the order of elements along an axis.
     *
     * @param axis the axis to reverse, negative values count from the end
     * @return the flipped {@code NDArray}
     */
    public NDArray flip(int axis) {
        int rank = shape.dimension();
        int a = axis < 0 ? rank + axis : axis;
        if (a < 0 || a >= rank) {
            throw new FormatException("Axis " + axis + " out of range for shape " + shape);
        }
        int outer = Math.toIntExact(shape.slice(0, a).size());
        int inner = Math.toIntExact(shape.slice(a + 1).size());
        int dim = Math.toIntExact(shape.get(a));
        double[] values = new double[data.length];
        for (int o = 0; o < outer; ++o) {
            for (int i = 0; i < dim; ++i) {
                System.arraycopy(
                        data,
                        (o * dim + i) * inner,
                        values,
                        (o * dim + dim - 1 - i) * inner,
                        inner);
            }
        }
        return new NDArray(values, shape, dataType);
    }

    /**
     * Permutes the axes of this array.
     *
     * @param axes the new order of the axes
     * @return the transposed {@code NDArray}
     */
    public NDArray transpose(int... axes) {
        int rank = shape.dimension();
        if (axes.length != rank) {
            throw new FormatException("Axes " + Arrays.toString(axes) + " do not match " + shape);
        }
        long[] outShape = new long[rank];
        long[] strides = shape.strides();
        long[] srcStrides = new long[rank];
        for (int i = 0; i < rank; ++i) {
            outShape[i] = shape.get(axes[i]);
            srcStrides[i] = strides[axes[i]];
        }
        double[] values = new double[data.length];
        long[] index = new long[rank];
        for (int i = 0; i < values.length; ++i) {
            long flat = 0;
            for (int d = 0; d < rank; ++d) {
                flat += index[d] * srcStrides[d];
            }
            values[i] = data[(int) flat];
            increment(index, outShape);
        }
        return new NDArray(values, new Shape(outShape), dataType);
    }

    /**
     * Converts this array to another data type.
     *
     * @param type the target type
     * @return the converted {@code NDArray}
     */
    public NDArray toType(DataType type) {
        return create(data, shape, type);
    }

    /**
     * Applies a function to every element. Results are converted back to this array's type.
     *
     * @param function the function to apply
     * @return a new {@code NDArray} of the same shape and type
     */
    public NDArray map(DoubleUnaryOperator function) {
        double[] values = new double[data.length];
        for (int i = 0; i < values.length; ++i) {
            values[i] = dataType.cast(function.applyAsDouble(data[i]));
        }
        return new NDArray(values, shape, dataType);
    }

    /**
     * Returns the sum of all elements.
     *
     * @return the sum
     */
    public double sum() {
        double total = 0;
        for (double v : data) {
            total += v;
        }
        return total;
    }

    /**
     * Returns the smallest element.
     *
     * @return the minimum
     */
    public double min() {
        return Arrays.stream(data).min().orElseThrow(() -> new FormatException("Empty array"));
    }

    /**
     * Returns the largest element.
     *
     * @return the maximum
     */
    public double max() {
        return Arrays.stream(data).max().orElseThrow(() -> new FormatException("Empty array"));
    }

    /**
     * Returns {@code true} if both arrays have the same shape, type and values.
     *
     * @param other the array to compare with
     * @return whether the contents are equal
     */
    public boolean contentEquals(NDArray other) {
        return other != null
                && dataType == other.dataType
                && shape.equals(other.shape)
                && Arrays.equals(data, other.data);
    }

    /** Advances a row-major multi-index by one. */
    static void increment(long[] index, long[] bounds) {
        for (int d = index.length - 1; d >= 0; --d) {
            if (++index[d] < bounds[d]) {
                return;
            }
            index[d] = 0;
        }
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(64);
        sb.append("ND: ").append(shape).append(' ').append(dataType);
        if (name != null) {
            sb.append(" '").append(name).append('\'');
        }
        if (data.length <= 64) {
            sb.append(' ').append(Arrays.toString(toArray()));
        }
        return sb.toString();
    }
}
