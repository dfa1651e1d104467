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

package org.fuel.api.ndarray.types;

import java.util.Arrays;
import java.util.stream.LongStream;
import org.fuel.api.ndarray.NDArray;

/**
 * A class that presents the {@link NDArray}'s shape information.
 *
 * <p>Every dimension is known and non-negative. An optional {@link LayoutType} per axis records the
 * meaning of the axis; it does not take part in equality.
 */
public class Shape {

    private long[] shape;
    private LayoutType[] layout;

    /**
     * Constructs and initializes a {@code Shape} with specified dimension as {@code (long...
     * shape)}.
     *
     * @param shape the dimensions of the shape
     * @throws IllegalArgumentException Thrown if any element in Shape is negative
     */
    public Shape(long... shape) {
        this(shape, unknownLayout(shape.length));
    }

    /**
     * Constructs and initializes a {@code Shape} with specified dimension and layout.
     *
     * @param shape the size of each axis of the shape
     * @param layout the {@link LayoutType} of each axis in the shape
     * @throws IllegalArgumentException Thrown if any element in Shape is negative. Also thrown if
     *     the shape and layout do not have equal sizes.
     */
    public Shape(long[] shape, LayoutType[] layout) {
        if (Arrays.stream(shape).anyMatch(s -> s < 0)) {
            throw new IllegalArgumentException("The shape must be >= 0: " + Arrays.toString(shape));
        }
        if (shape.length != layout.length) {
            throw new IllegalArgumentException("The shape and layout must have the same length");
        }
        this.shape = shape.clone();
        this.layout = layout.clone();
    }

    private static LayoutType[] unknownLayout(int length) {
        LayoutType[] layout = new LayoutType[length];
        Arrays.fill(layout, LayoutType.UNKNOWN);
        return layout;
    }

    /**
     * Returns a new shape altering the given dimension.
     *
     * @param shape the shape to update
     * @param dimension the dimension to get the shape in
     * @param value the value to set the dimension to
     * @return a new shape with the update applied
     */
    public static Shape update(Shape shape, int dimension, long value) {
        long[] newShape = shape.shape.clone();
        newShape[dimension] = value;
        return new Shape(newShape, shape.layout);
    }

    /**
     * Returns the dimensions of the {@code Shape}.
     *
     * @return a copy of the dimensions of the {@code Shape}
     */
    public long[] getShape() {
        return shape.clone();
    }

    /**
     * Returns the shape in the given dimension. Negative dimensions count from the end.
     *
     * @param dimension the dimension to get the shape in
     * @return the shape in the given dimension
     */
    public long get(int dimension) {
        return shape[dimension < 0 ? shape.length + dimension : dimension];
    }

    /**
     * Returns the total size.
     *
     * @return the total size
     */
    public long size() {
        long total = 1;
        for (long v : shape) {
            total *= v;
        }
        return total;
    }

    /**
     * Returns the number of dimensions of this {@code Shape}.
     *
     * @return the number of dimensions of this {@code Shape}
     */
    public int dimension() {
        return shape.length;
    }

    /**
     * Creates a new {@code Shape} whose content is a slice of this shape.
     *
     * @param beginIndex the beginning index, inclusive
     * @return a new {@code Shape} whose content is a slice of this shape
     */
    public Shape slice(int beginIndex) {
        return slice(beginIndex, shape.length);
    }

    /**
     * Creates a new {@code Shape} whose content is a slice of this shape.
     *
     * <p>The sub shape begins at the specified {@code beginIndex} and extends to {@code endIndex -
     * 1}.
     *
     * @param beginIndex the beginning index, inclusive
     * @param endIndex the ending index, exclusive
     * @return a new {@code Shape} whose content is a slice of this shape
     */
    public Shape slice(int beginIndex, int endIndex) {
        return new Shape(
                Arrays.copyOfRange(shape, beginIndex, endIndex),
                Arrays.copyOfRange(layout, beginIndex, endIndex));
    }

    /**
     * Returns a new shape without the given axis.
     *
     * @param axis the axis to drop
     * @return a new {@code Shape} of one dimension less
     */
    public Shape remove(int axis) {
        long[] out = new long[shape.length - 1];
        LayoutType[] outLayout = new LayoutType[shape.length - 1];
        for (int i = 0, j = 0; i < shape.length; ++i) {
            if (i != axis) {
                out[j] = shape[i];
                outLayout[j++] = layout[i];
            }
        }
        return new Shape(out, outLayout);
    }

    /**
     * Joins this shape with specified {@code other} shape.
     *
     * @param other the shape to join
     * @return the joined {@code Shape}
     */
    public Shape addAll(Shape other) {
        LayoutType[] joined = Arrays.copyOf(layout, layout.length + other.layout.length);
        System.arraycopy(other.layout, 0, joined, layout.length, other.layout.length);
        return new Shape(
                LongStream.concat(Arrays.stream(shape), Arrays.stream(other.shape)).toArray(),
                joined);
    }

    /**
     * Returns the head index of the shape.
     *
     * @return the head index of the shape
     * @throws IndexOutOfBoundsException Thrown if the shape is empty
     */
    public long head() {
        // scalar case
        if (shape.length == 0) {
            throw new IndexOutOfBoundsException("can't get value from scalar shape.");
        }
        return shape[0];
    }

    /**
     * Returns {@code true} if the NDArray is a scalar.
     *
     * @return whether the NDArray is a scalar
     */
    public boolean isScalar() {
        return dimension() == 0;
    }

    /**
     * Returns the layout type for each axis in this shape.
     *
     * @return the layout type for each axis in this shape
     */
    public LayoutType[] getLayout() {
        return layout.clone();
    }

    /**
     * Returns the row-major strides of this shape, in elements.
     *
     * @return the stride of each axis
     */
    public long[] strides() {
        long[] strides = new long[shape.length];
        long stride = 1;
        for (int i = shape.length - 1; i >= 0; --i) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    /** {@inheritDoc} */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Shape shape1 = (Shape) o;
        return Arrays.equals(shape, shape1.shape);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return Arrays.hashCode(shape);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('(');
        for (int i = 0; i < shape.length; ++i) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(shape[i]);
        }
        sb.append(')');
        return sb.toString();
    }
}
