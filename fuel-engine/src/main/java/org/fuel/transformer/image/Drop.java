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

import org.fuel.api.batch.Batch;
import org.fuel.api.exception.ConfigException;
import org.fuel.api.exception.FormatException;
import org.fuel.api.exception.SizeException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.Shape;
import org.fuel.random.RandomState;
import org.fuel.stream.DataStream;
import org.fuel.transformer.BatchAdapter;
import org.fuel.transformer.SourcewiseTransformer;

/**
 * Corrupts volumes by blanking their border and by randomly zeroing single values.
 *
 * <p>Border blanking keeps the cells {@code [border, dim - border)} of every spatial axis and
 * zeroes the rest. Dropout zeroes each value independently with probability {@code dropout},
 * drawing once per value in row-major order. Blanking runs first.
 */
public class Drop extends SourcewiseTransformer {

    /** Which leading axes of an array are not spatial. */
    public enum Scope {
        /** A full batch, with leading batch and channel axes. */
        BATCH(2),
        /** A single example, with a leading channel axis. */
        EXAMPLE(1);

        private int leadingAxes;

        Scope(int leadingAxes) {
            this.leadingAxes = leadingAxes;
        }

        /**
         * Returns the number of non-spatial leading axes.
         *
         * @return the number of leading axes
         */
        public int getLeadingAxes() {
            return leadingAxes;
        }
    }

    private int border;
    private double dropout;

    /**
     * Constructs a {@code Drop}.
     *
     * @param dataStream the stream to wrap
     * @param border the number of cells to blank at both ends of every spatial axis
     * @param dropout the probability of zeroing each value
     * @param rng the generator to draw from, or {@code null} to use one seeded with the default
     *     seed
     * @param whichSources the sources to transform, all sources if empty
     * @throws ConfigException if the border is negative or the probability is not in [0, 1]
     */
    public Drop(
            DataStream dataStream,
            int border,
            double dropout,
            RandomState rng,
            String... whichSources) {
        super(dataStream, whichSources);
        if (border < 0) {
            throw new ConfigException("Border must be >= 0, got " + border);
        }
        if (!(dropout >= 0 && dropout <= 1)) {
            throw new ConfigException("Dropout must be in [0, 1], got " + dropout);
        }
        this.border = border;
        this.dropout = dropout;
        setRandomState(rng);
    }

    /** {@inheritDoc} */
    @Override
    public NDArray transformSourceExample(Object example, String sourceName) {
        return apply(BatchAdapter.checkExample(example, 0), Scope.EXAMPLE);
    }

    /** {@inheritDoc} */
    @Override
    public Batch transformSourceBatch(Object batch, String sourceName) {
        Batch input = Batch.fromValue(batch);
        if (input instanceof Batch.Dense) {
            return Batch.dense(apply(((Batch.Dense) input).getArray(), Scope.BATCH));
        }
        return input.mapExamples(e -> apply(e, Scope.EXAMPLE));
    }

    /**
     * Applies border blanking and dropout to an array.
     *
     * @param volume the array
     * @param scope whether the array is a full batch or a single example
     * @return the corrupted array
     * @throws FormatException if the array has no spatial axis
     * @throws SizeException if the border covers half of a spatial axis or more
     */
    public NDArray apply(NDArray volume, Scope scope) {
        NDArray output = volume;
        if (border > 0) {
            output = blankBorder(output, border, scope);
        } else {
            checkRank(output, scope);
        }
        if (dropout > 0) {
            output = dropout(output, dropout, getRandomState());
        }
        return output == volume ? volume.map(v -> v) : output;
    }

    /**
     * Zeroes every cell closer than {@code border} cells to either end of any spatial axis.
     *
     * @param volume the array
     * @param border the width of the blanked border
     * @param scope whether the array is a full batch or a single example
     * @return a new array
     */
    public static NDArray blankBorder(NDArray volume, int border, Scope scope) {
        Shape shape = checkRank(volume, scope);
        int lead = scope.getLeadingAxes();
        int rank = shape.dimension();
        for (int d = lead; d < rank; ++d) {
            if (2L * border >= shape.get(d)) {
                throw new SizeException(
                        "Border "
                                + border
                                + " is too large for spatial shape "
                                + shape.slice(lead));
            }
        }
        double[] values = volume.toDoubleArray();
        long[] index = new long[rank];
        long[] dims = shape.getShape();
        for (int i = 0; i < values.length; ++i) {
            for (int d = lead; d < rank; ++d) {
                if (index[d] < border || index[d] >= dims[d] - border) {
                    values[i] = 0;
                    break;
                }
            }
            for (int d = rank - 1; d >= 0; --d) {
                if (++index[d] < dims[d]) {
                    break;
                }
                index[d] = 0;
            }
        }
        return NDArray.create(values, shape, volume.getDataType());
    }

    /**
     * Zeroes each value independently with the given probability.
     *
     * @param volume the array
     * @param dropout the probability of zeroing a value
     * @param rng the generator, one draw per value in row-major order
     * @return a new array
     */
    public static NDArray dropout(NDArray volume, double dropout, RandomState rng) {
        double[] values = volume.toDoubleArray();
        double keep = 1 - dropout;
        for (int i = 0; i < values.length; ++i) {
            if (!rng.bernoulli(keep)) {
                values[i] = 0;
            }
        }
        return NDArray.create(values, volume.getShape(), volume.getDataType());
    }

    private static Shape checkRank(NDArray volume, Scope scope) {
        Shape shape = volume.getShape();
        if (shape.dimension() <= scope.getLeadingAxes()) {
            throw new FormatException(
                    "Expected at least one spatial axis after "
                            + scope.getLeadingAxes()
                            + " leading axes, got shape "
                            + shape);
        }
        return shape;
    }
}
