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

import org.fuel.api.exception.SizeException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.DataType;
import org.fuel.api.ndarray.types.Shape;
import org.fuel.random.RandomState;

/**
 * Samples crop windows biased toward the informative regions of a weight volume.
 *
 * <p>The heatmap is the weight divided by its sum over an interior region that leaves out the
 * first two cells and the last cell of every spatial axis. The margin is a fixed constant and is
 * not derived from the window size.
 */
public final class HeatmapSampler {

    /** Cells skipped at the start of every spatial axis when normalizing. */
    public static final int MARGIN_START = 2;

    /** Cells skipped at the end of every spatial axis when normalizing. */
    public static final int MARGIN_END = 1;

    private HeatmapSampler() {}

    /**
     * Normalizes a weight array into a heatmap.
     *
     * @param weight the weight, with {@code spatialRank} trailing spatial axes
     * @param spatialRank the number of trailing spatial axes
     * @return a {@code float64} array of the same shape
     * @throws SizeException if the interior region is empty or sums to zero
     */
    public static NDArray calculateHeatmap(NDArray weight, int spatialRank) {
        Shape shape = weight.getShape();
        if (spatialRank <= 0 || spatialRank > shape.dimension()) {
            throw new SizeException(
                    "Cannot take " + spatialRank + " spatial axes from weight of shape " + shape);
        }
        long[] offsets = new long[spatialRank];
        long[] lengths = new long[spatialRank];
        int lead = shape.dimension() - spatialRank;
        for (int i = 0; i < spatialRank; ++i) {
            offsets[i] = MARGIN_START;
            lengths[i] = shape.get(lead + i) - MARGIN_START - MARGIN_END;
            if (lengths[i] <= 0) {
                throw new SizeException("Weight of shape " + shape + " has no interior region");
            }
        }
        double interior = weight.crop(offsets, lengths).sum();
        if (interior == 0) {
            throw new SizeException("Weight sums to zero over its interior region");
        }
        return NDArray.create(weight.toDoubleArray(), shape, DataType.FLOAT64)
                .map(v -> v / interior);
    }

    /**
     * Draws a window whose position is chosen with probability proportional to the heatmap value,
     * summed over channels, at the window center. Consumes one double from the generator.
     *
     * @param heatmap the heatmap of one example, shape {@code (channel, spatial...)}
     * @param windowShape the window extent per spatial axis
     * @param rng the generator
     * @return the window
     * @throws SizeException if no valid position carries positive weight
     */
    public static Window sample(NDArray heatmap, long[] windowShape, RandomState rng) {
        Shape shape = heatmap.getShape();
        WindowSampler.validate(shape, windowShape);
        int rank = windowShape.length;
        long[] strides = shape.strides();
        double[] values = heatmap.toDoubleArray();
        long channels = shape.get(0);

        long[] slack = new long[rank];
        int count = 1;
        for (int i = 0; i < rank; ++i) {
            slack[i] = shape.get(i + 1) - windowShape[i] + 1;
            count = Math.multiplyExact(count, Math.toIntExact(slack[i]));
        }
        double[] weights = new double[count];
        long[] position = new long[rank];
        for (int k = 0; k < count; ++k) {
            long flat = 0;
            for (int i = 0; i < rank; ++i) {
                flat += (position[i] + windowShape[i] / 2) * strides[i + 1];
            }
            double w = 0;
            for (long c = 0; c < channels; ++c) {
                w += values[(int) (flat + c * strides[0])];
            }
            weights[k] = w;
            for (int i = rank - 1; i >= 0; --i) {
                if (++position[i] < slack[i]) {
                    break;
                }
                position[i] = 0;
            }
        }

        int chosen = rng.choice(weights);
        long[] offsets = new long[rank];
        for (int i = rank - 1; i >= 0; --i) {
            offsets[i] = chosen % slack[i];
            chosen /= (int) slack[i];
        }
        return new Window(offsets, windowShape);
    }
}
