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

package org.fuel.ndarray;

import java.util.Locale;
import org.fuel.api.exception.ConfigException;

/** The resampling modes used when an image is resized or rotated. */
public enum Interpolation {
    NEAREST,
    BILINEAR,
    BICUBIC;

    /**
     * Returns the mode with the given name, ignoring case.
     *
     * @param name the name, such as {@code "nearest"}
     * @return the matching {@code Interpolation}
     * @throws ConfigException if the name matches no mode
     */
    public static Interpolation fromValue(String name) {
        if (name != null) {
            for (Interpolation mode : values()) {
                if (mode.name().equalsIgnoreCase(name.trim())) {
                    return mode;
                }
            }
        }
        throw new ConfigException("Unknown resampling mode: " + name);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
