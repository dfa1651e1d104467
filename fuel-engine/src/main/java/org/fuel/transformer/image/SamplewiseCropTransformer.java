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
import java.util.Collections;
import java.util.List;
import org.fuel.api.batch.Batch;
import org.fuel.api.exception.ConfigException;
import org.fuel.api.exception.SizeException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.random.RandomState;
import org.fuel.stream.DataStream;
import org.fuel.stream.Record;
import org.fuel.transformer.BatchAdapter;
import org.fuel.transformer.Transformer;
import org.fuel.window.HeatmapSampler;
import org.fuel.window.Window;
import org.fuel.window.WindowSampler;

/**
 * Crops co-registered sources of each example with one shared window.
 *
 * <p>Examples are {@code (channel, spatial...)}. For every example a single window is chosen and
 * applied to all selected sources, so volumes and their labels stay aligned. With a weight source
 * the window position is drawn from the heatmap of that source (see {@link HeatmapSampler});
 * otherwise it is drawn uniformly, one integer per spatial axis.
 *
 * <p>The per-source methods take an optional seed. A non-null seed draws from a new generator
 * created for that call only and leaves the generator of the transformer untouched.
 */
public class SamplewiseCropTransformer extends Transformer {

    private long[] windowShape;
    private String weightSource;
    private List<String> whichSources;

    /**
     * Constructs a {@code SamplewiseCropTransformer}.
     *
     * @param dataStream the stream to wrap
     * @param windowShape the window extent per spatial axis
     * @param weightSource the source whose values bias the window position, or {@code null}
     * @param whichSources the sources to crop, or {@code null} for all sources
     * @param rng the generator to draw from, or {@code null} to use one seeded with the default
     *     seed
     * @throws ConfigException if the window is malformed or a source is unknown
     */
    public SamplewiseCropTransformer(
            DataStream dataStream,
            long[] windowShape,
            String weightSource,
            List<String> whichSources,
            RandomState rng) {
        super(dataStream);
        this.windowShape = WindowSampler.checkWindowShape(windowShape);
        List<String> sources = dataStream.getSources();
        if (weightSource != null && !sources.contains(weightSource)) {
            throw new ConfigException("Unknown weight source " + weightSource);
        }
        if (whichSources == null || whichSources.isEmpty()) {
            this.whichSources = new ArrayList<>(sources);
        } else {
            for (String source : whichSources) {
                if (!sources.contains(source)) {
                    throw new ConfigException("Unknown source " + source);
                }
            }
            this.whichSources = new ArrayList<>(whichSources);
        }
        this.weightSource = weightSource;
        setRandomState(rng);
    }

    /**
     * Returns the sources this transformer crops.
     *
     * @return the selected source names
     */
    public List<String> getWhichSources() {
        return Collections.unmodifiableList(whichSources);
    }

    /**
     * Normalizes a weight array by its sum over the interior of its spatial axes.
     *
     * @param weight an example or a dense batch of the weight source
     * @return the heatmap
     */
    public NDArray calculateHeatmap(NDArray weight) {
        return HeatmapSampler.calculateHeatmap(weight, windowShape.length);
    }

    /**
     * Crops one example with a uniformly placed window.
     *
     * @param example the example, {@code (channel, spatial...)}
     * @param sourceName the source name
     * @param seed a seed for this call only, or {@code null} to use the transformer's generator
     * @return the cropped example
     */
    public NDArray transformSourceExample(Object example, String sourceName, Long seed) {
        NDArray array = BatchAdapter.checkExample(example, 2);
        RandomState rng = seed == null ? getRandomState() : new RandomState(seed);
        return WindowSampler.random(array.getShape(), windowShape, rng).apply(array);
    }

    /**
     * Crops every example of a batch with its own uniformly placed window.
     *
     * <p>A call seed is applied to each example on its own, so every example is cropped as
     * {@link #transformSourceExample(Object, String, Long)} would crop it with the same seed.
     *
     * @param batch the batch
     * @param sourceName the source name
     * @param seed a seed for this call only, or {@code null} to use the transformer's generator
     * @return the cropped batch
     */
    public Batch transformSourceBatch(Object batch, String sourceName, Long seed) {
        return Batch.fromValue(batch).mapExamples(e -> transformSourceExample(e, sourceName, seed));
    }

    /** {@inheritDoc} */
    @Override
    public Record transform(Record record) {
        RandomState rng = getRandomState();
        if (producesExamples()) {
            Window window = pickWindow(referenceOf(record), weightOf(record), rng);
            Record output = record;
            for (String source : whichSources) {
                output = output.with(source, crop(record.get(source), window));
            }
            return output;
        }

        List<Batch> inputs = new ArrayList<>(whichSources.size());
        for (String source : whichSources) {
            inputs.add(Batch.fromValue(record.get(source)));
        }
        Batch weights = weightSource == null ? null : Batch.fromValue(record.get(weightSource));
        int size = inputs.get(0).size();
        for (Batch input : inputs) {
            if (input.size() != size || (weights != null && weights.size() != size)) {
                throw new SizeException("Cropped sources have different batch sizes");
            }
        }
        List<List<NDArray>> outputs = new ArrayList<>(inputs.size());
        for (int s = 0; s < inputs.size(); ++s) {
            outputs.add(new ArrayList<>(size));
        }
        for (int i = 0; i < size; ++i) {
            NDArray weight = weights == null ? null : weights.get(i);
            NDArray reference = weight == null ? inputs.get(0).get(i) : weight;
            Window window = pickWindow(reference, weight, rng);
            for (int s = 0; s < inputs.size(); ++s) {
                outputs.get(s).add(crop(inputs.get(s).get(i), window));
            }
        }
        Record output = record;
        for (int s = 0; s < inputs.size(); ++s) {
            output = output.with(whichSources.get(s), rebuild(inputs.get(s), outputs.get(s)));
        }
        return output;
    }

    private NDArray referenceOf(Record record) {
        String source = weightSource == null ? whichSources.get(0) : weightSource;
        Object value = record.get(source);
        return BatchAdapter.checkExample(value, 2);
    }

    private NDArray weightOf(Record record) {
        return weightSource == null ? null : BatchAdapter.checkExample(record.get(weightSource), 2);
    }

    private Window pickWindow(NDArray reference, NDArray weight, RandomState rng) {
        if (weight != null) {
            return HeatmapSampler.sample(calculateHeatmap(weight), windowShape, rng);
        }
        return WindowSampler.random(reference.getShape(), windowShape, rng);
    }

    private NDArray crop(Object value, Window window) {
        NDArray example = BatchAdapter.checkExample(value, 2);
        WindowSampler.validate(example.getShape(), windowShape);
        return window.apply(example);
    }

    private static Batch rebuild(Batch input, List<NDArray> examples) {
        switch (input.getKind()) {
            case DENSE:
                return Batch.dense(NDArray.stack(examples));
            case OBJECT_ARRAY:
                return Batch.objectArray(examples.toArray(new NDArray[0]));
            case LIST:
            default:
                return Batch.list(examples);
        }
    }
}
