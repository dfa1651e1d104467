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

import java.util.List;
import org.fuel.api.util.PairList;

/** One step of a {@link DataStream}: a value per source, in source order. */
public final class Record {

    private PairList<String, Object> values;

    /**
     * Constructs a {@code Record}.
     *
     * @param values the value of each source, in source order
     */
    public Record(PairList<String, Object> values) {
        this.values = values;
    }

    /**
     * Constructs a {@code Record} from parallel lists.
     *
     * @param sources the source names
     * @param values the value of each source
     */
    public Record(List<String> sources, List<Object> values) {
        this(new PairList<>(sources, values));
    }

    /**
     * Returns the value of a source.
     *
     * @param source the source name
     * @return the value, or {@code null} if the record has no such source
     */
    public Object get(String source) {
        return values.get(source);
    }

    /**
     * Returns the value at a position.
     *
     * @param index the position of the source
     * @return the value
     */
    public Object get(int index) {
        return values.valueAt(index);
    }

    /**
     * Returns the source names.
     *
     * @return the source names in order
     */
    public List<String> getSources() {
        return values.keys();
    }

    /**
     * Returns the number of sources.
     *
     * @return the number of sources
     */
    public int size() {
        return values.size();
    }

    /**
     * Returns a record with one value replaced.
     *
     * @param source the source to replace
     * @param value the new value
     * @return a new {@code Record}
     * @throws IllegalArgumentException if the record has no such source
     */
    public Record with(String source, Object value) {
        int index = values.indexOf(source);
        if (index < 0) {
            throw new IllegalArgumentException("Record has no source " + source);
        }
        PairList<String, Object> copy = new PairList<>(values.keys(), values.values());
        copy.set(index, value);
        return new Record(copy);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Record{");
        for (int i = 0; i < values.size(); ++i) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(values.keys().get(i)).append('=').append(values.valueAt(i));
        }
        return sb.append('}').toString();
    }
}
