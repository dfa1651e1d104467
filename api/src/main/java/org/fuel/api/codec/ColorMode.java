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

package org.fuel.api.codec;

import org.fuel.api.exception.ConfigException;

/** The color modes an {@link ImageCodec} can convert images to. */
public enum ColorMode {
    L("L", 1),
    RGB("RGB", 3),
    RGBA("RGBA", 4),
    CMYK("CMYK", 4),
    YCBCR("YCbCr", 3);

    private String value;
    private int channels;

    ColorMode(String value, int channels) {
        this.value = value;
        this.channels = channels;
    }

    /**
     * Returns the conventional name of the mode, such as {@code "YCbCr"}.
     *
     * @return the name of the mode
     */
    public String getValue() {
        return value;
    }

    /**
     * Returns the number of channels of an image in this mode.
     *
     * @return the number of channels
     */
    public int getChannels() {
        return channels;
    }

    /**
     * Returns the mode with the given name.
     *
     * @param value the name of the mode
     * @return the matching {@code ColorMode}
     * @throws ConfigException if no mode has that name
     */
    public static ColorMode fromValue(String value) {
        for (ColorMode mode : values()) {
            if (mode.value.equals(value)) {
                return mode;
            }
        }
        throw new ConfigException("Unknown color mode: " + value);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return value;
    }
}
