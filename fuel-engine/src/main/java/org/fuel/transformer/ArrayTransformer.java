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

package org.fuel.transformer;

import org.fuel.api.batch.Batch;
import org.fuel.api.ndarray.NDArray;
import org.fuel.stream.DataStream;

/**
 * A {@link SourcewiseTransformer} whose operation maps one array example to another.
 *
 * <p>Batches are handled by the {@link BatchAdapter}, so subclasses only implement {@link
 * #transformExample(NDArray, String)} and every example of a batch is processed exactly as if it
 * had been pulled on its own.
 */
public abstract class ArrayTransformer extends SourcewiseTransformer {

    private int minimumRank;

    /**
     * Constructs an {@code ArrayTransformer}.
     *
     * @param dataStream the stream to wrap
     * @param minimumRank the smallest example rank the operation accepts
     * @param whichSources the sources to transform, all sources if empty
     */
    protected ArrayTransformer(DataStream dataStream, int minimumRank, String... whichSources) {
        super(dataStream, whichSources);
        this.minimumRank = minimumRank;
    }

    /**
     * Transforms one example.
     *
     * @param example an example of at least the minimum rank
     * @param sourceName the source name
     * @return a new array
     */
    protected abstract NDArray transformExample(NDArray example, String sourceName);

    /**
     * Returns the smallest example rank this transformer accepts.
     *
     * @return the minimum rank
     */
    public int getMinimumRank() {
        return minimumRank;
    }

    /** {@inheritDoc} */
    @Override
    public NDArray transformSourceExample(Object example, String sourceName) {
        return (NDArray)
                BatchAdapter.apply(
                        example, false, minimumRank, e -> transformExample(e, sourceName));
    }

    /** {@inheritDoc} */
    @Override
    public Batch transformSourceBatch(Object batch, String sourceName) {
        return (Batch)
                BatchAdapter.apply(batch, true, minimumRank, e -> transformExample(e, sourceName));
    }
}
