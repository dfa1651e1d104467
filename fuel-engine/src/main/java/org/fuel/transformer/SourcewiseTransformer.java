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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.fuel.api.exception.ConfigException;
import org.fuel.stream.DataStream;
import org.fuel.stream.Record;

/**
 * A {@link Transformer} that applies the same operation to each selected source independently.
 *
 * <p>Sources outside {@code whichSources} pass through unchanged.
 */
public abstract class SourcewiseTransformer extends Transformer {

    private Set<String> whichSources;

    /**
     * Constructs a {@code SourcewiseTransformer}.
     *
     * @param dataStream the stream to wrap
     * @param whichSources the sources to transform, all sources if empty
     * @throws ConfigException if a named source is not produced by the stream
     */
    protected SourcewiseTransformer(DataStream dataStream, String... whichSources) {
        super(dataStream);
        if (whichSources == null || whichSources.length == 0) {
            this.whichSources = new LinkedHashSet<>(dataStream.getSources());
        } else {
            for (String source : whichSources) {
                if (!dataStream.getSources().contains(source)) {
                    throw new ConfigException(
                            "Unknown source " + source + ", stream has " + dataStream.getSources());
                }
            }
            this.whichSources = new LinkedHashSet<>(Arrays.asList(whichSources));
        }
    }

    /**
     * Transforms the value of one source in an example stream.
     *
     * @param example the example
     * @param sourceName the source name
     * @return the transformed example
     */
    public abstract Object transformSourceExample(Object example, String sourceName);

    /**
     * Transforms the value of one source in a batch stream.
     *
     * @param batch the batch
     * @param sourceName the source name
     * @return the transformed batch
     */
    public abstract Object transformSourceBatch(Object batch, String sourceName);

    /**
     * Returns the sources this transformer applies to.
     *
     * @return the selected source names
     */
    public Set<String> getWhichSources() {
        return Collections.unmodifiableSet(whichSources);
    }

    /** {@inheritDoc} */
    @Override
    public Record transform(Record record) {
        List<Object> values = new ArrayList<>(record.size());
        for (int i = 0; i < record.size(); ++i) {
            String source = record.getSources().get(i);
            Object value = record.get(i);
            if (whichSources.contains(source)) {
                value =
                        producesExamples()
                                ? transformSourceExample(value, source)
                                : transformSourceBatch(value, source);
            }
            values.add(value);
        }
        return new Record(record.getSources(), values);
    }
}
