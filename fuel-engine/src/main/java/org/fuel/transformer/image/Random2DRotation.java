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

import org.fuel.api.exception.ConfigException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.LayoutType;
import org.fuel.ndarray.Interpolation;
import org.fuel.ndarray.NDImageUtils;
import org.fuel.random.RandomState;
import org.fuel.stream.DataStream;
import org.fuel.transformer.ArrayTransformer;

/**
 * Rotates every example by a random angle around the center of its last two axes.
 *
 * <p>Each example draws one angle, uniform in {@code (-maximumRotation, maximumRotation]}, and
 * every channel of the example is rotated by it. Corners left uncovered are filled with zero and
 * the output keeps the shape and type of the input.
 */
public class Random2DRotation extends ArrayTransformer {

    private double maximumRotation;
    private Interpolation resample;

    /**
     * Constructs a {@code Random2DRotation} rotating by up to a quarter turn with nearest-neighbor
     * resampling.
     *
     * @param dataStream the stream to wrap
     * @param rng the generator to draw from, or {@code null} to use one seeded with the default
     *     seed
     * @param whichSources the sources to transform, all sources if empty
     */
    public Random2DRotation(DataStream dataStream, RandomState rng, String... whichSources) {
        this(dataStream, Math.PI / 2, "nearest", rng, whichSources);
    }

    /**
     * Constructs a {@code Random2DRotation}.
     *
     * @param dataStream the stream to wrap
     * @param maximumRotation the largest rotation in radians, in {@code (0, pi)}
     * @param resample the resampling mode, {@code nearest}, {@code bilinear} or {@code bicubic}
     * @param rng the generator to draw from, or {@code null} to use one seeded with the default
     *     seed
     * @param whichSources the sources to transform, all sources if empty
     * @throws ConfigException if the rotation bound or the resampling mode is invalid
     */
    public Random2DRotation(
            DataStream dataStream,
            double maximumRotation,
            String resample,
            RandomState rng,
            String... whichSources) {
        super(dataStream, 3, whichSources);
        if (!(maximumRotation > 0 && maximumRotation < Math.PI)) {
            throw new ConfigException(
                    "Maximum rotation must be in (0, pi), got " + maximumRotation);
        }
        this.maximumRotation = maximumRotation;
        this.resample = Interpolation.fromValue(resample);
        setRandomState(rng);
    }

    /** {@inheritDoc} */
    @Override
    protected NDArray transformExample(NDArray example, String sourceName) {
        if (example.getRank() == 3) {
            verifyAxisLabels(sourceName, LayoutType.CHANNEL, LayoutType.HEIGHT, LayoutType.WIDTH);
        }
        double angle = getRandomState().uniform(-maximumRotation, maximumRotation);
        return NDImageUtils.rotate(example, angle, resample);
    }
}
