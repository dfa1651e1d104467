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
import org.fuel.stream.DataStream;

/** Crops a fixed-size window at a fixed corner of every {@code (channel, height, width)} image. */
public class FixedSizeCrop extends FixedSizeCropND {

    /**
     * Constructs a {@code FixedSizeCrop}.
     *
     * @param dataStream the stream to wrap
     * @param windowShape the window {@code (height, width)}
     * @param location 0 (start) or 1 (end) for the height and width axes
     * @param whichSources the sources to transform, all sources if empty
     * @throws ConfigException if the window is not 2-D or the location is malformed
     */
    public FixedSizeCrop(
            DataStream dataStream, long[] windowShape, int[] location, String... whichSources) {
        super(dataStream, check2d(windowShape), location, whichSources);
    }

    static long[] check2d(long[] windowShape) {
        if (windowShape == null || windowShape.length != 2) {
            throw new ConfigException("Window shape must be (height, width)");
        }
        return windowShape;
    }

    /** {@inheritDoc} */
    @Override
    protected NDArray transformExample(NDArray example, String sourceName) {
        verifyAxisLabels(sourceName, LayoutType.CHANNEL, LayoutType.HEIGHT, LayoutType.WIDTH);
        return super.transformExample(example, sourceName);
    }
}
