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

import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.LayoutType;
import org.fuel.random.RandomState;
import org.fuel.stream.DataStream;
import org.fuel.transformer.ArrayTransformer;
import org.fuel.window.WindowSampler;

/**
 * Crops a fixed-size window at a random position of every example.
 *
 * <p>Each example draws one offset per spatial axis, in axis order. A 2-D window is checked against
 * {@code (channel, height, width)} axis labels.
 */
public class RandomFixedSizeCrop extends ArrayTransformer {

    private long[] windowShape;

    /**
     * Constructs a {@code RandomFixedSizeCrop}.
     *
     * @param dataStream the stream to wrap
     * @param windowShape the window extent per spatial axis
     * @param rng the generator to draw from, or {@code null} to use one seeded with the default
     *     seed
     * @param whichSources the sources to transform, all sources if empty
     */
    public RandomFixedSizeCrop(
            DataStream dataStream, long[] windowShape, RandomState rng, String... whichSources) {
        super(dataStream, 2, whichSources);
        this.windowShape = WindowSampler.checkWindowShape(windowShape);
        setRandomState(rng);
    }

    /** {@inheritDoc} */
    @Override
    protected NDArray transformExample(NDArray example, String sourceName) {
        if (windowShape.length == 2) {
            verifyAxisLabels(sourceName, LayoutType.CHANNEL, LayoutType.HEIGHT, LayoutType.WIDTH);
        }
        return WindowSampler.random(example.getShape(), windowShape, getRandomState())
                .apply(example);
    }
}
