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

package org.fuel.stream;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.fuel.api.batch.Batch;
import org.fuel.api.exception.ConfigException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.LayoutType;
import org.fuel.api.util.PairList;

/**
 * A {@link DataStream} over data held in memory, read sequentially.
 *
 * <p>The container of each source decides the form of its batches: a stacked {@link NDArray}
 * yields dense batches, a {@code List} yields list batches and an {@code NDArray[]} yields
 * object-array batches. Lists of other values, such as encoded images, are batched as plain lists.
 * The last batch of an epoch may be shorter than the batch size.
 */
public final class IndexableDataStream implements DataStream {

    private PairList<String, Object> data;
    private Map<String, LayoutType[]> axisLabels;
    private int batchSize;
    private int numExamples;

    IndexableDataStream(Builder builder) {
        data = builder.data;
        axisLabels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.axisLabels));
        batchSize = builder.batchSize;
        numExamples = builder.numExamples;
    }

    /**
     * Creates a builder to build an {@code IndexableDataStream}.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** {@inheritDoc} */
    @Override
    public boolean producesExamples() {
        return batchSize == 0;
    }

    /** {@inheritDoc} */
    @Override
    public List<String> getSources() {
        return data.keys();
    }

    /** {@inheritDoc} */
    @Override
    public Map<String, LayoutType[]> getAxisLabels() {
        return axisLabels;
    }

    /**
     * Returns the number of examples per epoch.
     *
     * @return the number of examples
     */
    public int getNumExamples() {
        return numExamples;
    }

    /** {@inheritDoc} */
    @Override
    public Iterator<Record> iterator() {
        return new Iterator<Record>() {

            private int cursor;

            /** {@inheritDoc} */
            @Override
            public boolean hasNext() {
                return cursor < numExamples;
            }

            /** {@inheritDoc} */
            @Override
            public Record next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                List<Object> values = new ArrayList<>(data.size());
                if (producesExamples()) {
                    for (Object source : data.values()) {
                        values.add(example(source, cursor));
                    }
                    cursor++;
                } else {
                    int end = Math.min(cursor + batchSize, numExamples);
                    for (Object source : data.values()) {
                        values.add(batch(source, cursor, end));
                    }
                    cursor = end;
                }
                return new Record(data.keys(), values);
            }
        };
    }

    private static Object example(Object source, int index) {
        if (source instanceof NDArray) {
            return ((NDArray) source).get(index);
        } else if (source instanceof NDArray[]) {
            return ((NDArray[]) source)[index];
        }
        return ((List<?>) source).get(index);
    }

    private static Object batch(Object source, int from, int to) {
        if (source instanceof NDArray) {
            NDArray array = (NDArray) source;
            long[] offsets = new long[array.getRank()];
            long[] lengths = array.getShape().getShape();
            offsets[0] = from;
            lengths[0] = to - from;
            return Batch.dense(array.crop(offsets, lengths));
        } else if (source instanceof NDArray[]) {
            return Batch.objectArray(Arrays.copyOfRange((NDArray[]) source, from, to));
        }
        List<?> list = ((List<?>) source).subList(from, to);
        if (!list.isEmpty() && list.stream().allMatch(e -> e instanceof NDArray)) {
            List<NDArray> examples = new ArrayList<>(list.size());
            for (Object e : list) {
                examples.add((NDArray) e);
            }
            return Batch.list(examples);
        }
        return new ArrayList<>(list);
    }

    /** The Builder to construct an {@link IndexableDataStream}. */
    public static final class Builder {

        PairList<String, Object> data = new PairList<>();
        Map<String, LayoutType[]> axisLabels = new LinkedHashMap<>();
        int batchSize;
        int numExamples = -1;

        Builder() {}

        /**
         * Adds a source held as one array whose leading axis indexes the examples.
         *
         * @param name the source name
         * @param examples the stacked examples
         * @return this builder
         */
        public Builder addSource(String name, NDArray examples) {
            return add(name, examples, examples.getShape().head());
        }

        /**
         * Adds a source held as a list of examples.
         *
         * @param name the source name
         * @param examples the examples, arrays or raw values such as {@code byte[]}
         * @return this builder
         */
        public Builder addSource(String name, List<?> examples) {
            return add(name, new ArrayList<>(examples), examples.size());
        }

        /**
         * Adds a source held as an array of arrays.
         *
         * @param name the source name
         * @param examples the examples
         * @return this builder
         */
        public Builder addSource(String name, NDArray[] examples) {
            return add(name, examples.clone(), examples.length);
        }

        private Builder add(String name, Object source, long size) {
            if (data.contains(name)) {
                throw new ConfigException("Duplicate source " + name);
            }
            if (numExamples >= 0 && numExamples != size) {
                throw new ConfigException(
                        "Source " + name + " has " + size + " examples, expected " + numExamples);
            }
            numExamples = Math.toIntExact(size);
            data.add(name, source);
            return this;
        }

        /**
         * Declares the axis labels of a source.
         *
         * @param name the source name
         * @param labels the layout of each axis of one record value
         * @return this builder
         */
        public Builder setAxisLabels(String name, LayoutType... labels) {
            axisLabels.put(name, labels.clone());
            return this;
        }

        /**
         * Sets the batch size; 0 makes the stream produce single examples.
         *
         * @param batchSize the number of examples per batch
         * @return this builder
         */
        public Builder setBatchSize(int batchSize) {
            if (batchSize < 0) {
                throw new ConfigException("Batch size must be >= 0, got " + batchSize);
            }
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Builds the {@link IndexableDataStream}.
         *
         * @return the new stream
         */
        public IndexableDataStream build() {
            if (data.isEmpty()) {
                throw new ConfigException("A stream needs at least one source");
            }
            return new IndexableDataStream(this);
        }
    }
}
