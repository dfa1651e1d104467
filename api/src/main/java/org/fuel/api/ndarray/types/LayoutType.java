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

package org.fuel.api.ndarray.types;

import java.util.Arrays;
import java.util.stream.Collectors;
import org.fuel.api.ndarray.NDArray;

/**
 * An enum to represent the meaning of a particular axis in an {@link NDArray}.
 *
 * <p>Each layout type has a single character code and the axis label used by data streams, for
 * example {@code "channel"} for {@link LayoutType#CHANNEL}.
 */
public enum LayoutType {
    BATCH('N', "batch"),
    CHANNEL('C', "channel"),
    DEPTH('D', "depth"),
    HEIGHT('H', "height"),
    WIDTH('W', "width"),
    TIME('T', "time"),
    BYTES('B', "bytes"),
    X('X', "x"),
    Y('Y', "y"),
    Z('Z', "z"),
    UNKNOWN('?', "unknown");

    private char value;
    private String label;

    LayoutType(char value, String label) {
        this.value = value;
        this.label = label;
    }

    /**
     * Returns the character representation of the layout type.
     *
     * @return the character representation of the layout type
     */
    public char getValue() {
        return value;
    }

    /**
     * Returns the axis label of the layout type.
     *
     * @return the axis label, such as {@code "height"}
     */
    public String getLabel() {
        return label;
    }

    /**
     * Converts the character to the matching layout type.
     *
     * @param value the character to convert
     * @return the matching layout type
     * @throws IllegalArgumentException thrown if the character does not match any layout type
     */
    public static LayoutType fromValue(char value) {
        for (LayoutType type : LayoutType.values()) {
            if (value == type.value) {
                return type;
            }
        }
        throw new IllegalArgumentException(
                "The value does not match any layoutTypes. Use '?' for Unknown");
    }

    /**
     * Converts each character to the matching layout type.
     *
     * @param layout the character string to convert
     * @return the list of layout types for each character in the string
     * @throws IllegalArgumentException thrown if the character does not match any layout type
     */
    public static LayoutType[] fromValue(String layout) {
        LayoutType[] types = new LayoutType[layout.length()];
        for (int i = 0; i < types.length; ++i) {
            types[i] = fromValue(layout.charAt(i));
        }
        return types;
    }

    /**
     * Converts an axis label to the matching layout type.
     *
     * @param label the axis label, such as {@code "width"}
     * @return the matching layout type, or {@link LayoutType#UNKNOWN} for other labels
     */
    public static LayoutType fromLabel(String label) {
        for (LayoutType type : LayoutType.values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * Converts a layout type array to a string of the character representations.
     *
     * @param layouts the layout type to convert
     * @return the string of the character representations
     */
    public static String toString(LayoutType[] layouts) {
        StringBuilder sb = new StringBuilder(layouts.length);
        for (LayoutType layout : layouts) {
            sb.append(layout.getValue());
        }
        return sb.toString();
    }

    /**
     * Formats a layout type array as a tuple of axis labels.
     *
     * @param layouts the layout types to format
     * @return a string such as {@code (batch, channel, height, width)}
     */
    public static String toLabels(LayoutType[] layouts) {
        return Arrays.stream(layouts)
                .map(LayoutType::getLabel)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
