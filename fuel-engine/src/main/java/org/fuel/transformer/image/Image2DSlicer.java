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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.fuel.api.batch.Batch;
import org.fuel.api.exception.ConfigException;
import org.fuel.api.exception.FormatException;
import org.fuel.api.exception.SizeException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.LayoutType;
import org.fuel.random.RandomState;
import org.fuel.stream.DataStream;
import org.fuel.transformer.BatchAdapter;
import org.fuel.transformer.SourcewiseTransformer;

/**
 * Reduces {@code (channel, x, y, z)} volumes to 2-D slices.
 *
 * <p>With a spatial axis selected, one slice is taken along that axis. Without one, a slice is
 * taken along each of the three spatial axes and the slices are stacked either along the channel
 * axis of the example or along the batch axis, three consecutive slices per example. The slice
 * index is the middle index of the axis or a uniform random index, drawn per example and then per
 * axis.
 */
public class Image2DSlicer extends SourcewiseTransformer {

    private static final int SPATIAL_AXES = 3;

    /** Where to take a slice along an axis. */
    public enum SliceLocation {
        CENTER,
        RANDOM;

        /**
         * Returns the location with the given name, ignoring case.
         *
         * @param value {@code "center"} or {@code "random"}
         * @return the matching location
         * @throws ConfigException for any other value
         */
        public static SliceLocation fromValue(String value) {
            if (value != null) {
                for (SliceLocation location : values()) {
                    if (location.name().equalsIgnoreCase(value)) {
                        return location;
                    }
                }
            }
            throw new ConfigException("Slice location must be center or random, got " + value);
        }
    }

    /** The axis that collects the slices when no spatial axis is selected. */
    public enum Fold {
        BATCH,
        CHANNEL
    }

    private SliceLocation sliceLocation;
    private int dimension;
    private Fold fold;

    /**
     * Constructs an {@code Image2DSlicer} that slices along one spatial axis.
     *
     * @param dataStream the stream to wrap
     * @param sliceLocation {@code "center"} or {@code "random"}
     * @param dimensionToSlice {@code "0"}, {@code "1"}, {@code "2"}, {@code "x"}, {@code "y"} or
     *     {@code "z"}
     * @param rng the generator to draw from, or {@code null} to use one seeded with the default
     *     seed
     * @param whichSources the sources to transform, all sources if empty
     */
    public Image2DSlicer(
            DataStream dataStream,
            String sliceLocation,
            String dimensionToSlice,
            RandomState rng,
            String... whichSources) {
        this(dataStream, sliceLocation, dimensionToSlice, null, rng, whichSources);
    }

    /**
     * Constructs an {@code Image2DSlicer}.
     *
     * @param dataStream the stream to wrap
     * @param sliceLocation {@code "center"} or {@code "random"}
     * @param dimensionToSlice a spatial axis, or {@code null} to slice along all three
     * @param fold where to stack the slices when {@code dimensionToSlice} is {@code null}
     * @param rng the generator to draw from, or {@code null} to use one seeded with the default
     *     seed
     * @param whichSources the sources to transform, all sources if empty
     * @throws ConfigException if a selector is invalid
     */
    public Image2DSlicer(
            DataStream dataStream,
            String sliceLocation,
            String dimensionToSlice,
            Fold fold,
            RandomState rng,
            String... whichSources) {
        super(dataStream, whichSources);
        this.sliceLocation = SliceLocation.fromValue(sliceLocation);
        this.dimension = parseDimension(dimensionToSlice);
        if (dimension < 0) {
            if (fold == null) {
                throw new ConfigException("Slicing all axes needs a batch or channel fold");
            }
            if (fold == Fold.BATCH && dataStream.producesExamples()) {
                throw new ConfigException("Cannot fold slices into the batch axis of an example");
            }
        }
        this.fold = fold;
        setRandomState(rng);
    }

    private static int parseDimension(String value) {
        if (value == null) {
            return -1;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "0":
            case "x":
                return 0;
            case "1":
            case "y":
                return 1;
            case "2":
            case "z":
                return 2;
            default:
                throw new ConfigException("Unknown dimension to slice: " + value);
        }
    }

    /** {@inheritDoc} */
    @Override
    public Map<String, LayoutType[]> getAxisLabels() {
        Map<String, LayoutType[]> labels = new HashMap<>(dataStream.getAxisLabels());
        for (String source : getWhichSources()) {
            LayoutType[] layout = labels.get(source);
            if (layout == null || layout.length < SPATIAL_AXES) {
                continue;
            }
            int spatialStart = layout.length - SPATIAL_AXES;
            List<LayoutType> out = new ArrayList<>(Arrays.asList(layout).subList(0, spatialStart));
            if (dimension >= 0) {
                for (int d = 0; d < SPATIAL_AXES; ++d) {
                    if (d != dimension) {
                        out.add(layout[spatialStart + d]);
                    }
                }
            } else {
                out.add(LayoutType.HEIGHT);
                out.add(LayoutType.WIDTH);
            }
            labels.put(source, out.toArray(new LayoutType[0]));
        }
        return labels;
    }

    /** {@inheritDoc} */
    @Override
    public NDArray transformSourceExample(Object example, String sourceName) {
        List<NDArray> slices = slices(checkVolume(example));
        return slices.size() == 1 ? slices.get(0) : NDArray.concat(slices, 0);
    }

    /** {@inheritDoc} */
    @Override
    public Batch transformSourceBatch(Object batch, String sourceName) {
        Batch input = Batch.fromValue(batch);
        if (dimension >= 0 || fold == Fold.CHANNEL) {
            return input.mapExamples(e -> transformSourceExample(e, sourceName));
        }
        List<NDArray> output = new ArrayList<>(input.size() * SPATIAL_AXES);
        for (NDArray example : input) {
            output.addAll(slices(checkVolume(example)));
        }
        switch (input.getKind()) {
            case DENSE:
                try {
                    return Batch.dense(NDArray.stack(output));
                } catch (FormatException e) {
                    throw new SizeException(
                            "Slices along different axes differ in shape, cannot stack them", e);
                }
            case OBJECT_ARRAY:
                return Batch.objectArray(output.toArray(new NDArray[0]));
            case LIST:
            default:
                return Batch.list(output);
        }
    }

    private static NDArray checkVolume(Object value) {
        NDArray volume = BatchAdapter.checkExample(value, SPATIAL_AXES + 1);
        if (volume.getRank() != SPATIAL_AXES + 1) {
            throw new FormatException(
                    "Expected a (channel, x, y, z) volume, got shape " + volume.getShape());
        }
        return volume;
    }

    private List<NDArray> slices(NDArray volume) {
        List<NDArray> slices = new ArrayList<>(SPATIAL_AXES);
        if (dimension >= 0) {
            slices.add(slice(volume, dimension));
            return slices;
        }
        for (int d = 0; d < SPATIAL_AXES; ++d) {
            slices.add(slice(volume, d));
        }
        if (fold == Fold.CHANNEL) {
            for (NDArray slice : slices) {
                if (!slice.getShape().slice(1).equals(slices.get(0).getShape().slice(1))) {
                    throw new SizeException(
                            "Cannot fold slices of volume "
                                    + volume.getShape()
                                    + " into the channel axis, spatial axes differ");
                }
            }
        }
        return slices;
    }

    private NDArray slice(NDArray volume, int axis) {
        long length = volume.getShape().get(axis + 1);
        long index;
        if (sliceLocation == SliceLocation.CENTER) {
            index = length / 2;
        } else {
            index = getRandomState().randomIntegers(0, length - 1);
        }
        return volume.take(axis + 1, index);
    }
}
