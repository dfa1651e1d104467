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

package org.fuel.transformer.image;

import org.fuel.api.batch.Batch;
import org.fuel.api.ndarray.NDArray;
import org.fuel.random.RandomState;
import org.fuel.stream.DataStream;
import org.fuel.transformer.ArrayTransformer;
import org.fuel.transformer.BatchAdapter;

/**
 * Randomly mirrors examples along their last two axes.
 *
 * <p>A horizontal flip (last axis) and a vertical flip (second to last axis) are each applied with
 * probability 0.5. Only enabled axes consume draws. A single example draws horizontal then
 * vertical; a batch draws the horizontal decision of every example first, then every vertical
 * one, whatever the form of the batch.
 */
public class RandomSpatialFlip extends ArrayTransformer {

    private boolean flipHorizontal;
    private boolean flipVertical;

    /**
     * Constructs a {@code RandomSpatialFlip}.
     *
     * @param dataStream the stream to wrap
     * @param flipHorizontal whether to flip the last axis
     * @param flipVertical whether to flip the second to last axis
     * @param rng the generator to draw from, or {@code null} to use one seeded with the default
     *     seed
     * @param whichSources the sources to transform, all sources if empty
     */
    public RandomSpatialFlip(
            DataStream dataStream,
            boolean flipHorizontal,
            boolean flipVertical,
            RandomState rng,
            String... whichSources) {
        super(dataStream, 3, whichSources);
        this.flipHorizontal = flipHorizontal;
        this.flipVertical = flipVertical;
        setRandomState(rng);
    }

    /** {@inheritDoc} */
    @Override
    protected NDArray transformExample(NDArray example, String sourceName) {
        boolean horizontal = flipHorizontal && getRandomState().bernoulli(0.5);
        boolean vertical = flipVertical && getRandomState().bernoulli(0.5);
        return flip(example, horizontal, vertical);
    }

    /** {@inheritDoc} */
    @Override
    public Batch transformSourceBatch(Object batch, String sourceName) {
        Batch input = Batch.fromValue(batch);
        for (NDArray example : input) {
            BatchAdapter.checkExample(example, getMinimumRank());
        }
        boolean[] horizontal = draw(flipHorizontal, input.size());
        boolean[] vertical = draw(flipVertical, input.size());
        int[] cursor = new int[1];
        return input.mapExamples(
                e -> {
                    int i = cursor[0]++;
                    return flip(e, horizontal[i], vertical[i]);
                });
    }

    private boolean[] draw(boolean enabled, int size) {
        boolean[] flips = new boolean[size];
        if (enabled) {
            for (int i = 0; i < size; ++i) {
                flips[i] = getRandomState().bernoulli(0.5);
            }
        }
        return flips;
    }

    private static NDArray flip(NDArray example, boolean horizontal, boolean vertical) {
        NDArray output = example;
        if (horizontal) {
            output = output.flip(-1);
        }
        if (vertical) {
            output = output.flip(-2);
        }
        return output == example ? example.map(v -> v) : output;
    }
}
