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

package org.fuel.api.util;

import org.fuel.api.exception.ConfigException;

/** A class containing utility methods. */
public final class Utils {

    public static final String DEFAULT_SEED = "fuel.default_seed";
    public static final String DEFAULT_SEED_ENV = "FUEL_DEFAULT_SEED";
    public static final String IMAGE_CODEC = "fuel.image_codec";
    public static final String IMAGE_CODEC_ENV = "FUEL_IMAGE_CODEC";

    private Utils() {}

    /**
     * Returns a configuration value, looking at the system property first and the environment
     * variable second.
     *
     * @param property the name of the system property
     * @param env the name of the environment variable
     * @return the configured value, or {@code null} if neither is set
     */
    public static String getConfig(String property, String env) {
        String value = System.getProperty(property);
        if (value == null || value.isEmpty()) {
            value = System.getenv(env);
            if (value == null || value.isEmpty()) {
                return null;
            }
        }
        return value.trim();
    }

    /**
     * Returns the seed used by transforms that own their random state.
     *
     * @return the configured default seed, {@code 1} if none is set
     * @throws ConfigException if the configured seed is not a non-negative 32-bit integer
     */
    public static long getDefaultSeed() {
        String value = getConfig(DEFAULT_SEED, DEFAULT_SEED_ENV);
        if (value == null) {
            return 1;
        }
        try {
            long seed = Long.parseLong(value);
            if (seed < 0 || seed > 0xFFFFFFFFL) {
                throw new ConfigException("Default seed out of range [0, 2^32): " + value);
            }
            return seed;
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid default seed: " + value, e);
        }
    }

    /**
     * Returns the index of the first occurrence of the specified element in {@code array}, or -1
     * if this list does not contain the element.
     *
     * @param array the input array
     * @param value the element to search for
     * @param <T> the array type
     * @return the index of the first occurrence of the specified element in {@code array}, or -1
     */
    public static <T> int indexOf(T[] array, T value) {
        if (array != null) {
            for (int i = 0; i < array.length; ++i) {
                if (value.equals(array[i])) {
                    return i;
                }
            }
        }
        return -1;
    }
}
