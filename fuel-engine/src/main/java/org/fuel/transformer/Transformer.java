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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.fuel.api.ndarray.types.LayoutType;
import org.fuel.api.util.Utils;
import org.fuel.random.RandomState;
import org.fuel.stream.DataStream;
import org.fuel.stream.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link DataStream} that transforms every record pulled from a wrapped stream.
 *
 * <p>Randomized transformers draw from a {@link RandomState} that is either supplied by the caller
 * or created on first use from the default seed captured when the transformer was built.
 */
public abstract class Transformer implements DataStream {

    private static final Logger logger = LoggerFactory.getLogger(Transformer.class);

    protected DataStream dataStream;

    private RandomState rng;
    private long defaultSeed;
    private Set<String> verifiedSources = new HashSet<>();

    /**
     * Constructs a {@code Transformer}.
     *
     * @param dataStream the stream to wrap
     */
    protected Transformer(DataStream dataStream) {
        this.dataStream = Objects.requireNonNull(dataStream, "dataStream");
        defaultSeed = Utils.getDefaultSeed();
    }

    /**
     * Transforms one record of the wrapped stream.
     *
     * @param record a record holding examples or batches, as {@link #producesExamples()} says
     * @return the transformed record
     */
    public abstract Record transform(Record record);

    /**
     * Returns the wrapped stream.
     *
     * @return the wrapped stream
     */
    public DataStream getDataStream() {
        return dataStream;
    }

    /**
     * Returns the generator this transformer draws from, creating it with the default seed if the
     * caller did not supply one.
     *
     * @return the generator
     */
    public RandomState getRandomState() {
        if (rng == null) {
            logger.debug(
                    "{} creates its generator with seed {}",
                    getClass().getSimpleName(),
                    defaultSeed);
            rng = new RandomState(defaultSeed);
        }
        return rng;
    }

    /**
     * Sets the generator this transformer draws from. Sharing one generator between transformers
     * makes a whole pipeline reproducible from a single seed.
     *
     * @param rng the generator, or {@code null} to fall back to the default seed
     */
    public void setRandomState(RandomState rng) {
        this.rng = rng;
    }

    /** {@inheritDoc} */
    @Override
    public boolean producesExamples() {
        return dataStream.producesExamples();
    }

    /** {@inheritDoc} */
    @Override
    public List<String> getSources() {
        return dataStream.getSources();
    }

    /** {@inheritDoc} */
    @Override
    public Map<String, LayoutType[]> getAxisLabels() {
        return dataStream.getAxisLabels();
    }

    /** {@inheritDoc} */
    @Override
    public Iterator<Record> iterator() {
        Iterator<Record> upstream = dataStream.iterator();
        return new Iterator<Record>() {

            /** {@inheritDoc} */
            @Override
            public boolean hasNext() {
                return upstream.hasNext();
            }

            /** {@inheritDoc} */
            @Override
            public Record next() {
                return transform(upstream.next());
            }
        };
    }

    /**
     * Logs a warning if the wrapped stream declares axis labels for a source that differ from what
     * this transformer expects. Each source is checked once.
     *
     * @param source the source name
     * @param expected the layout of one example, without the batch axis
     */
    protected void verifyAxisLabels(String source, LayoutType... expected) {
        if (!verifiedSources.add(source)) {
            return;
        }
        LayoutType[] actual = dataStream.getAxisLabels().get(source);
        if (actual == null) {
            return;
        }
        LayoutType[] wanted = expected;
        if (!producesExamples()) {
            wanted = new LayoutType[expected.length + 1];
            wanted[0] = LayoutType.BATCH;
            System.arraycopy(expected, 0, wanted, 1, expected.length);
        }
        if (!Arrays.equals(actual, wanted)) {
            logger.warn(
                    "{} expects axis labels {} for source {}, got {}",
                    getClass().getSimpleName(),
                    LayoutType.toLabels(wanted),
                    source,
                    LayoutType.toLabels(actual));
        }
    }
}
