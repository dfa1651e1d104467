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
import org.fuel.api.exception.FormatException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.transform.Transform;

/**
 * Applies a per-example operation to either a single example or any form of {@link Batch}.
 *
 * <p>Examples are passed straight to the operation. Batches are mapped example by example, in
 * order, and come back in the same form; a dense batch becomes a list batch if the results do not
 * share one shape.
 */
public final class BatchAdapter {

    private BatchAdapter() {}

    /**
     * Applies an operation to a source value.
     *
     * @param value an {@link NDArray} example, or a batch in any form accepted by {@link
     *     Batch#fromValue(Object)}
     * @param isBatch whether the value is a batch
     * @param minimumRank the smallest example rank the operation accepts
     * @param transform the per-example operation
     * @return the transformed example or {@link Batch}
     * @throws FormatException if the value is not array-like or an example rank is too small
     */
    public static Object apply(
            Object value, boolean isBatch, int minimumRank, Transform transform) {
        if (!isBatch) {
            return transform.transform(checkExample(value, minimumRank));
        }
        Batch batch = Batch.fromValue(value);
        return batch.mapExamples(e -> transform.transform(checkExample(e, minimumRank)));
    }

    /**
     * Checks that a value is an array of at least the given rank.
     *
     * @param value the value
     * @param minimumRank the smallest accepted rank
     * @return the value as an {@link NDArray}
     * @throws FormatException if the value is not an array or its rank is too small
     */
    public static NDArray checkExample(Object value, int minimumRank) {
        if (!(value instanceof NDArray)) {
            throw new FormatException(
                    "Expected an array example, got "
                            + (value == null ? "null" : value.getClass().getName()));
        }
        NDArray example = (NDArray) value;
        if (example.getRank() < minimumRank) {
            throw new FormatException(
                    "Expected an example of rank >= "
                            + minimumRank
                            + ", got shape "
                            + example.getShape());
        }
        return example;
    }
}
