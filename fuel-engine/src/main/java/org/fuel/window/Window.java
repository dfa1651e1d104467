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

package org.fuel.window;

import java.util.Arrays;
import org.fuel.api.ndarray.NDArray;

/**
 * An N-D box over the spatial axes of an example, given as a start offset and a length per axis.
 */
public final class Window {

    private long[] offsets;
    private long[] lengths;

    /**
     * Constructs a {@code Window}.
     *
     * @param offsets the start of the window on each spatial axis
     * @param lengths the extent of the window on each spatial axis
     */
    public Window(long[] offsets, long[] lengths) {
        if (offsets.length != lengths.length) {
            throw new IllegalArgumentException("Offsets and lengths must have the same rank");
        }
        this.offsets = offsets.clone();
        this.lengths = lengths.clone();
    }

    /**
     * Returns the start offsets.
     *
     * @return a copy of the offset of each spatial axis
     */
    public long[] getOffsets() {
        return offsets.clone();
    }

    /**
     * Returns the lengths.
     *
     * @return a copy of the length of each spatial axis
     */
    public long[] getLengths() {
        return lengths.clone();
    }

    /**
     * Returns the rank of the window.
     *
     * @return the number of spatial axes
     */
    public int getRank() {
        return offsets.length;
    }

    /**
     * Cuts this window out of the trailing axes of an array.
     *
     * @param array an example or a dense batch
     * @return the windowed array
     */
    public NDArray apply(NDArray array) {
        return array.crop(offsets, lengths);
    }

    /** {@inheritDoc} */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Window)) {
            return false;
        }
        Window other = (Window) o;
        return Arrays.equals(offsets, other.offsets) && Arrays.equals(lengths, other.lengths);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(offsets) + Arrays.hashCode(lengths);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "Window{offsets="
                + Arrays.toString(offsets)
                + ", lengths="
                + Arrays.toString(lengths)
                + '}';
    }
}
