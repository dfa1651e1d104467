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
import org.fuel.ndarray.NDImageUtils;
import org.fuel.stream.DataStream;
import org.fuel.transformer.ArrayTransformer;

/**
 * Applies a fixed gamma correction to every value of every example.
 *
 * <p>Each value is corrected on its own, so a batch gives the same result whatever its form and
 * the same result as correcting the whole batch array at once.
 *
 * @see NDImageUtils#gammaCorrection(NDArray, double)
 */
public class GammaCorrectionND extends ArrayTransformer {

    private double gamma;

    /**
     * Constructs a {@code GammaCorrectionND}.
     *
     * @param dataStream the stream to wrap
     * @param gamma the exponent, positive
     * @param whichSources the sources to transform, all sources if empty
     * @throws ConfigException if gamma is not a positive finite number
     */
    public GammaCorrectionND(DataStream dataStream, double gamma, String... whichSources) {
        super(dataStream, 1, whichSources);
        if (!(gamma > 0) || Double.isInfinite(gamma)) {
            throw new ConfigException("Gamma must be positive, got " + gamma);
        }
        this.gamma = gamma;
    }

    /** {@inheritDoc} */
    @Override
    protected NDArray transformExample(NDArray example, String sourceName) {
        return NDImageUtils.gammaCorrection(example, gamma);
    }
}
