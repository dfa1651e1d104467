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
import org.fuel.api.exception.FormatException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.LayoutType;
import org.fuel.api.ndarray.types.Shape;
import org.fuel.ndarray.Interpolation;
import org.fuel.ndarray.NDImageUtils;
import org.fuel.stream.DataStream;
import org.fuel.transformer.ArrayTransformer;

/**
 * Resizes images that are smaller than a minimum height or width.
 *
 * <p>An image below the minimum on either axis is scaled up, keeping its aspect ratio, until both
 * axes reach the minimum. Larger images are returned unchanged. Examples are {@code (height,
 * width)} or {@code (channel, height, width)}.
 */
public class MinimumImageDimensions extends ArrayTransformer {

    private int minimumHeight;
    private int minimumWidth;
    private Interpolation resample;

    /**
     * Constructs a {@code MinimumImageDimensions} with nearest-neighbor resampling.
     *
     * @param dataStream the stream to wrap
     * @param minimumShape the minimum {@code (height, width)}
     * @param whichSources the sources to transform, all sources if empty
     */
    public MinimumImageDimensions(
            DataStream dataStream, int[] minimumShape, String... whichSources) {
        this(dataStream, minimumShape, Interpolation.NEAREST, whichSources);
    }

    /**
     * Constructs a {@code MinimumImageDimensions}.
     *
     * @param dataStream the stream to wrap
     * @param minimumShape the minimum {@code (height, width)}
     * @param resample the resampling mode
     * @param whichSources the sources to transform, all sources if empty
     * @throws ConfigException if the shape is not two positive integers or the mode is missing
     */
    public MinimumImageDimensions(
            DataStream dataStream,
            int[] minimumShape,
            Interpolation resample,
            String... whichSources) {
        super(dataStream, 2, whichSources);
        if (minimumShape == null
                || minimumShape.length != 2
                || minimumShape[0] <= 0
                || minimumShape[1] <= 0) {
            throw new ConfigException("Minimum shape must be two positive integers");
        }
        if (resample == null) {
            throw new ConfigException("Resampling mode must be given");
        }
        minimumHeight = minimumShape[0];
        minimumWidth = minimumShape[1];
        this.resample = resample;
    }

    /** {@inheritDoc} */
    @Override
    protected NDArray transformExample(NDArray example, String sourceName) {
        Shape shape = example.getShape();
        if (shape.dimension() > 3) {
            throw new FormatException(
                    "Expected an image of rank 2 or 3, got shape " + shape);
        }
        if (shape.dimension() == 3) {
            verifyAxisLabels(sourceName, LayoutType.CHANNEL, LayoutType.HEIGHT, LayoutType.WIDTH);
        }
        long height = shape.get(-2);
        long width = shape.get(-1);
        if (height >= minimumHeight && width >= minimumWidth) {
            return example.map(v -> v);
        }
        double multiplier =
                Math.max(
                        1,
                        Math.max((double) minimumWidth / width, (double) minimumHeight / height));
        int newHeight = (int) Math.ceil(height * multiplier);
        int newWidth = (int) Math.ceil(width * multiplier);
        return NDImageUtils.resize(example, newHeight, newWidth, resample);
    }
}
