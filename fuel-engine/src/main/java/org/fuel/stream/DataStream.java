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
import java.util.Map;
import org.fuel.api.ndarray.types.LayoutType;

/**
 * A stream of records, each holding one value per named source.
 *
 * <p>A stream either produces single examples or batches of examples; every call to {@link
 * #iterator()} starts a new epoch.
 */
public interface DataStream extends Iterable<Record> {

    /**
     * Returns {@code true} if the stream produces single examples rather than batches.
     *
     * @return whether records hold examples
     */
    boolean producesExamples();

    /**
     * Returns the names of the sources, in record order.
     *
     * @return the source names
     */
    List<String> getSources();

    /**
     * Returns the axis labels of the sources that declare them.
     *
     * @return a map from source name to the layout of each axis
     */
    Map<String, LayoutType[]> getAxisLabels();
}
