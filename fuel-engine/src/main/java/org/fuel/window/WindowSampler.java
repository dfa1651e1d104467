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

package org.fuel.window;

import java.util.Arrays;
import org.fuel.api.exception.ConfigException;
import org.fuel.api.exception.FormatException;
import org.fuel.api.exception.SizeException;
import org.fuel.api.ndarray.types.Shape;
import org.fuel.random.RandomState;

/**
 * Computes crop windows for an example of shape {@code (channel, spatial...)} and a window shape
 * over the spatial axes only.
 *
 * <p>Three placements are supported:
 *
 * <ul>
 *   <li>fixed - each axis starts at 0 or ends at the last cell, selected by a location of 0 or 1.
 *   <li>center - the offset is {@code floor((dim - window) / 2)}.
 *   <li>random - one uniform integer in {@code [0, dim - window]} per spatial axis, drawn in axis
 *       order.
 * </ul>
 *
 * <p>Callers that process a batch draw one window per example, in example order, so a batch and the
 * same examples processed one at a time consume the generator identically.
 */
public final class WindowSampler {

    private WindowSampler() {}

    /**
     * Validates a window shape given at construction time.
     *
     * @param windowShape the window extent per spatial axis
     * @return a copy of the window shape
     * @throws ConfigException if the shape is empty or holds a non-positive extent
     */
    public static long[] checkWindowShape(long... windowShape) {
        if (windowShape == null || windowShape.length == 0) {
            throw new ConfigException("Window shape must have at least one axis");
        }
        for (long length : windowShape) {
            if (length <= 0) {
                throw new ConfigException(
                        "Window shape must be positive: " + Arrays.toString(windowShape));
            }
        }
        return windowShape.clone();
    }

    /**
     * Validates a fixed location given at construction time.
     *
     * @param location 0 (start) or 1 (end) per spatial axis
     * @param rank the rank of the window
     * @return a copy of the location
     * @throws ConfigException if the length does not match or a value is not 0 or 1
     */
    public static int[] checkLocation(int[] location, int rank) {
        if (location == null || location.length != rank) {
            throw new ConfigException(
                    "Location must have "
                            + rank
                            + " entries, got "
                            + (location == null ? "null" : Arrays.toString(location)));
        }
        for (int l : location) {
            if (l != 0 && l != 1) {
                throw new ConfigException(
                        "Location entries must be 0 or 1, got " + Arrays.toString(location));
            }
        }
        return location.clone();
    }

    /**
     * Checks that a window fits into an example.
     *
     * @param exampleShape the shape {@code (channel, spatial...)}
     * @param windowShape the window extent per spatial axis
     * @throws FormatException if the example rank is not the window rank plus one
     * @throws SizeException if the window is larger than the example on any axis
     */
    public static void validate(Shape exampleShape, long[] windowShape) {
        if (exampleShape.dimension() != windowShape.length + 1) {
            throw new FormatException(
                    "Expected an example of rank "
                            + (windowShape.length + 1)
                            + " for window "
                            + Arrays.toString(windowShape)
                            + ", got shape "
                            + exampleShape);
        }
        for (int i = 0; i < windowShape.length; ++i) {
            if (windowShape[i] > exampleShape.get(i + 1)) {
                throw new SizeException(
                        "Window "
                                + Arrays.toString(windowShape)
                                + " does not fit into example of shape "
                                + exampleShape);
            }
        }
    }

    /**
     * Returns the window at a fixed corner.
     *
     * @param exampleShape the shape {@code (channel, spatial...)}
     * @param windowShape the window extent per spatial axis
     * @param location 0 (start) or 1 (end) per spatial axis
     * @return the window
     */
    public static Window fixed(Shape exampleShape, long[] windowShape, int[] location) {
        validate(exampleShape, windowShape);
        long[] offsets = new long[windowShape.length];
        for (int i = 0; i < offsets.length; ++i) {
            offsets[i] = location[i] * (exampleShape.get(i + 1) - windowShape[i]);
        }
        return new Window(offsets, windowShape);
    }

    /**
     * Returns the centered window.
     *
     * @param exampleShape the shape {@code (channel, spatial...)}
     * @param windowShape the window extent per spatial axis
     * @return the window
     */
    public static Window center(Shape exampleShape, long[] windowShape) {
        validate(exampleShape, windowShape);
        long[] offsets = new long[windowShape.length];
        for (int i = 0; i < offsets.length; ++i) {
            offsets[i] = (exampleShape.get(i + 1) - windowShape[i]) / 2;
        }
        return new Window(offsets, windowShape);
    }

    /**
     * Returns a window at a uniformly random position.
     *
     * @param exampleShape the shape {@code (channel, spatial...)}
     * @param windowShape the window extent per spatial axis
     * @param rng the generator, one draw per spatial axis with a non-zero slack
     * @return the window
     */
    public static Window random(Shape exampleShape, long[] windowShape, RandomState rng) {
        validate(exampleShape, windowShape);
        long[] offsets = new long[windowShape.length];
        for (int i = 0; i < offsets.length; ++i) {
            offsets[i] = rng.randomIntegers(0, exampleShape.get(i + 1) - windowShape[i]);
        }
        return new Window(offsets, windowShape);
    }
}
