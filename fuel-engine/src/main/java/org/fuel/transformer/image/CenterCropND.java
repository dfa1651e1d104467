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

/** Crops the centered window of every {@code (channel, spatial...)} example. */
public class CenterCropND extends ArrayTransformer {

    private long[] windowShape;

    /**
     * Constructs a {@code CenterCropND}.
     *
     * @param dataStream the stream to wrap
     * @param windowShape the window extent per spatial axis
     * @param whichSources the sources to transform, all sources if empty
     */
    public CenterCropND(DataStream dataStream, long[] windowShape, String... whichSources) {
        super(dataStream, 2, whichSources);
        this.windowShape = WindowSampler.checkWindowShape(windowShape);
    }

    /** {@inheritDoc} */
    @Override
    protected NDArray transformExample(NDArray example, String sourceName) {
        return WindowSampler.center(example.getShape(), windowShape).apply(example);
    }
}
