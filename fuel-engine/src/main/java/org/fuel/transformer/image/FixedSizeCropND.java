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
import org.fuel.stream.DataStream;
import org.fuel.transformer.ArrayTransformer;
import org.fuel.window.WindowSampler;

/**
 * Crops a fixed-size window at a fixed corner of every example.
 *
 * <p>Examples are {@code (channel, spatial...)} with as many spatial axes as the window. For each
 * spatial axis, a location of 0 places the window at the start and 1 places it at the end.
 */
public class FixedSizeCropND extends ArrayTransformer {

    protected long[] windowShape;
    private int[] location;

    /**
     * Constructs a {@code FixedSizeCropND}.
     *
     * @param dataStream the stream to wrap
     * @param windowShape the window extent per spatial axis
     * @param location 0 (start) or 1 (end) per spatial axis
     * @param whichSources the sources to transform, all sources if empty
     * @throws org.fuel.api.exception.ConfigException if the window or location is malformed
     */
    public FixedSizeCropND(
            DataStream dataStream, long[] windowShape, int[] location, String... whichSources) {
        super(dataStream, 2, whichSources);
        this.windowShape = WindowSampler.checkWindowShape(windowShape);
        this.location = WindowSampler.checkLocation(location, windowShape.length);
    }

    /** {@inheritDoc} */
    @Override
    protected NDArray transformExample(NDArray example, String sourceName) {
        return WindowSampler.fixed(example.getShape(), windowShape, location).apply(example);
    }
}
