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

import org.fuel.api.ndarray.NDArray;

/** An enum representing the underlying {@link NDArray}'s data type. */
public enum DataType {
    FLOAT32(Format.FLOATING, 4),
    FLOAT64(Format.FLOATING, 8),
    UINT8(Format.UINT, 1),
    UINT16(Format.UINT, 2),
    INT8(Format.INT, 1),
    INT16(Format.INT, 2),
    INT32(Format.INT, 4),
    INT64(Format.INT, 8),
    BOOLEAN(Format.BOOLEAN, 1);

    /** The general data type format categories. */
    public enum Format {
        FLOATING,
        UINT,
        INT,
        BOOLEAN
    }

    private Format format;
    private int numOfBytes;

    DataType(Format format, int numOfBytes) {
        this.format = format;
        this.numOfBytes = numOfBytes;
    }

    /**
     * Returns the number of bytes for each element.
     *
     * @return the number of bytes for each element
     */
    public int getNumOfBytes() {
        return numOfBytes;
    }

    /**
     * Returns the format of the data type.
     *
     * @return the format of the data type
     */
    public Format getFormat() {
        return format;
    }

    /**
     * Checks whether it is a floating data type.
     *
     * @return whether it is a floating data type
     */
    public boolean isFloating() {
        return format == Format.FLOATING;
    }

    /**
     * Checks whether it is an integer data type.
     *
     * @return whether it is an integer type
     */
    public boolean isInteger() {
        return format == Format.UINT || format == Format.INT;
    }

    /**
     * Returns the smallest value this type can hold.
     *
     * @return the smallest representable value
     */
    public double minValue() {
        switch (this) {
            case FLOAT32:
                return -Float.MAX_VALUE;
            case FLOAT64:
                return -Double.MAX_VALUE;
            case INT8:
                return Byte.MIN_VALUE;
            case INT16:
                return Short.MIN_VALUE;
            case INT32:
                return Integer.MIN_VALUE;
            case INT64:
                return Long.MIN_VALUE;
            default:
                return 0;
        }
    }

    /**
     * Returns the largest value this type can hold.
     *
     * @return the largest representable value
     */
    public double maxValue() {
        switch (this) {
            case FLOAT32:
                return Float.MAX_VALUE;
            case FLOAT64:
                return Double.MAX_VALUE;
            case UINT8:
                return 255;
            case UINT16:
                return 65535;
            case INT8:
                return Byte.MAX_VALUE;
            case INT16:
                return Short.MAX_VALUE;
            case INT32:
                return Integer.MAX_VALUE;
            case INT64:
                return Long.MAX_VALUE;
            default:
                return 1;
        }
    }

    /**
     * Converts a value to this type the way an array type conversion does: floating values are
     * rounded to the precision of the type, integer types truncate toward zero and wrap around.
     *
     * @param value the value to convert
     * @return the converted value
     */
    public double cast(double value) {
        switch (this) {
            case FLOAT32:
                return (float) value;
            case FLOAT64:
                return value;
            case BOOLEAN:
                return value != 0 ? 1 : 0;
            case UINT8:
                return ((long) value) & 0xFFL;
            case UINT16:
                return ((long) value) & 0xFFFFL;
            case INT8:
                return (byte) (long) value;
            case INT16:
                return (short) (long) value;
            case INT32:
                return (int) (long) value;
            case INT64:
            default:
                return (long) value;
        }
    }

    /**
     * Converts a value computed by interpolation back to this type: integer types round to the
     * nearest integer and saturate at the bounds of the type.
     *
     * @param value the value to convert
     * @return the converted value
     */
    public double saturate(double value) {
        if (isFloating()) {
            return cast(value);
        }
        double rounded = Math.rint(value);
        return Math.max(minValue(), Math.min(maxValue(), rounded));
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
