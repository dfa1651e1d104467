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

package org.fuel.api.batch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.fuel.api.exception.FormatException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.transform.Transform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered collection of examples of one source, grouped for one iteration step.
 *
 * <p>A batch comes in one of three forms:
 *
 * <ul>
 *   <li>{@link Kind#DENSE} - one array whose leading axis is the batch index.
 *   <li>{@link Kind#LIST} - an ordered list of arrays whose shapes may differ.
 *   <li>{@link Kind#OBJECT_ARRAY} - a fixed-length array of arrays whose shapes may differ.
 * </ul>
 *
 * <p>Every element of a batch has the same rank. {@link #mapExamples(Transform)} applies a
 * per-example operation and reassembles the results in the same form, except that a dense batch
 * whose results no longer share one shape becomes a list.
 */
public abstract class Batch implements Iterable<NDArray> {

    private static final Logger logger = LoggerFactory.getLogger(Batch.class);

    /** The form of a batch. */
    public enum Kind {
        DENSE,
        LIST,
        OBJECT_ARRAY
    }

    Batch() {}

    /**
     * Creates a dense batch.
     *
     * @param array the stacked examples, batch index first
     * @return a new dense {@code Batch}
     * @throws FormatException if the array is a scalar
     */
    public static Batch dense(NDArray array) {
        return new Dense(array);
    }

    /**
     * Creates a list batch.
     *
     * @param examples the examples in order
     * @return a new list {@code Batch}
     * @throws FormatException if the examples have different ranks
     */
    public static Batch list(List<NDArray> examples) {
        return new ListBatch(examples);
    }

    /**
     * Creates an object-array batch.
     *
     * @param examples the examples in order
     * @return a new object-array {@code Batch}
     * @throws FormatException if the examples have different ranks
     */
    public static Batch objectArray(NDArray... examples) {
        return new ObjectArray(examples);
    }

    /**
     * Wraps a source value pulled from a batch stream.
     *
     * @param value a {@code Batch}, an {@link NDArray}, a {@code List} of arrays or an array of
     *     arrays
     * @return the matching {@code Batch}
     * @throws FormatException if the value is not array-like
     */
    public static Batch fromValue(Object value) {
        if (value instanceof Batch) {
            return (Batch) value;
        } else if (value instanceof NDArray) {
            return dense((NDArray) value);
        } else if (value instanceof NDArray[]) {
            return objectArray((NDArray[]) value);
        } else if (value instanceof List) {
            List<NDArray> examples = new ArrayList<>();
            for (Object element : (List<?>) value) {
                if (!(element instanceof NDArray)) {
                    throw new FormatException("Batch element is not an array: " + typeOf(element));
                }
                examples.add((NDArray) element);
            }
            return list(examples);
        }
        throw new FormatException("Value is not an array-like batch: " + typeOf(value));
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }

    static void checkRanks(List<NDArray> examples) {
        for (NDArray example : examples) {
            if (example == null) {
                throw new FormatException("Batch element is null");
            }
            if (example.getRank() != examples.get(0).getRank()) {
                throw new FormatException(
                        "Batch elements have different ranks: "
                                + examples.get(0).getShape()
                                + " and "
                                + example.getShape());
            }
        }
    }

    /**
     * Returns the form of this batch.
     *
     * @return the {@link Kind}
     */
    public abstract Kind getKind();

    /**
     * Returns the number of examples.
     *
     * @return the number of examples
     */
    public abstract int size();

    /**
     * Returns one example.
     *
     * @param index the position of the example
     * @return the example
     */
    public abstract NDArray get(int index);

    /**
     * Applies a per-example operation to every example, in order.
     *
     * @param transform the operation
     * @return a new {@code Batch} holding the results
     */
    public abstract Batch mapExamples(Transform transform);

    /**
     * Returns the examples as a list.
     *
     * @return an unmodifiable list of the examples
     */
    public List<NDArray> toList() {
        List<NDArray> list = new ArrayList<>(size());
        for (NDArray example : this) {
            list.add(example);
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * Returns the examples as one array, batch index first.
     *
     * @return the stacked examples
     * @throws FormatException if the examples do not share one shape
     */
    public NDArray toDense() {
        return NDArray.stack(toList());
    }

    /** {@inheritDoc} */
    @Override
    public Iterator<NDArray> iterator() {
        return new Iterator<NDArray>() {

            private int cursor;

            /** {@inheritDoc} */
            @Override
            public boolean hasNext() {
                return cursor < size();
            }

            /** {@inheritDoc} */
            @Override
            public NDArray next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return get(cursor++);
            }
        };
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getKind()).append(" batch of ").append(size()).append(':');
        for (NDArray example : this) {
            sb.append(' ').append(example.getShape());
        }
        return sb.toString();
    }

    /** A batch held as one array. */
    public static final class Dense extends Batch {

        private NDArray array;

        Dense(NDArray array) {
            if (array.getShape().isScalar()) {
                throw new FormatException("A dense batch needs a batch axis, got a scalar");
            }
            this.array = array;
        }

        /**
         * Returns the stacked array.
         *
         * @return the array, batch index first
         */
        public NDArray getArray() {
            return array;
        }

        /** {@inheritDoc} */
        @Override
        public Kind getKind() {
            return Kind.DENSE;
        }

        /** {@inheritDoc} */
        @Override
        public int size() {
            return Math.toIntExact(array.getShape().head());
        }

        /** {@inheritDoc} */
        @Override
        public NDArray get(int index) {
            return array.get(index);
        }

        /** {@inheritDoc} */
        @Override
        public NDArray toDense() {
            return array;
        }

        /** {@inheritDoc} */
        @Override
        public Batch mapExamples(Transform transform) {
            if (size() == 0) {
                return this;
            }
            List<NDArray> results = new ArrayList<>(size());
            boolean uniform = true;
            for (int i = 0; i < size(); ++i) {
                NDArray result = transform.transform(get(i));
                NDArray first = results.isEmpty() ? result : results.get(0);
                uniform =
                        uniform
                                && result.getShape().equals(first.getShape())
                                && result.getDataType() == first.getDataType();
                results.add(result);
            }
            if (uniform) {
                return new Dense(NDArray.stack(results));
            }
            logger.debug("Dense batch results differ in shape, returning a list batch");
            return new ListBatch(results);
        }
    }

    /** A batch held as a list of arrays. */
    public static final class ListBatch extends Batch {

        private List<NDArray> examples;

        ListBatch(List<NDArray> examples) {
            checkRanks(examples);
            this.examples = new ArrayList<>(examples);
        }

        /** {@inheritDoc} */
        @Override
        public Kind getKind() {
            return Kind.LIST;
        }

        /** {@inheritDoc} */
        @Override
        public int size() {
            return examples.size();
        }

        /** {@inheritDoc} */
        @Override
        public NDArray get(int index) {
            return examples.get(index);
        }

        /** {@inheritDoc} */
        @Override
        public Batch mapExamples(Transform transform) {
            List<NDArray> results = new ArrayList<>(examples.size());
            for (NDArray example : examples) {
                results.add(transform.transform(example));
            }
            return new ListBatch(results);
        }
    }

    /** A batch held as a fixed-length array of arrays. */
    public static final class ObjectArray extends Batch {

        private NDArray[] examples;

        ObjectArray(NDArray[] examples) {
            checkRanks(Arrays.asList(examples));
            this.examples = examples.clone();
        }

        /**
         * Returns the examples as an array.
         *
         * @return a copy of the element array
         */
        public NDArray[] toArray() {
            return examples.clone();
        }

        /** {@inheritDoc} */
        @Override
        public Kind getKind() {
            return Kind.OBJECT_ARRAY;
        }

        /** {@inheritDoc} */
        @Override
        public int size() {
            return examples.length;
        }

        /** {@inheritDoc} */
        @Override
        public NDArray get(int index) {
            return examples[index];
        }

        /** {@inheritDoc} */
        @Override
        public Batch mapExamples(Transform transform) {
            NDArray[] results = new NDArray[examples.length];
            for (int i = 0; i < examples.length; ++i) {
                results[i] = transform.transform(examples[i]);
            }
            return new ObjectArray(results);
        }
    }
}
