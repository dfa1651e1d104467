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

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.fuel.api.batch.Batch;
import org.fuel.api.codec.ColorMode;
import org.fuel.api.codec.ImageCodec;
import org.fuel.api.exception.DecodeException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.LayoutType;
import org.fuel.stream.DataStream;
import org.fuel.transformer.SourcewiseTransformer;

/**
 * Decodes encoded images into {@code uint8} arrays of shape {@code (channel, height, width)}.
 *
 * <p>Without a color mode every image keeps its own channels, so a batch may mix greyscale and
 * color images. Batches are returned as list batches.
 */
public class ImagesFromBytes extends SourcewiseTransformer {

    private static final LayoutType[] EXAMPLE_LAYOUT = {
        LayoutType.CHANNEL, LayoutType.HEIGHT, LayoutType.WIDTH
    };

    private ColorMode colorMode;
    private ImageCodec codec;

    /**
     * Constructs an {@code ImagesFromBytes} using the configured {@link ImageCodec}.
     *
     * @param dataStream the stream to wrap
     * @param colorMode the mode to convert to, such as {@code "RGB"}, or {@code null}
     * @param whichSources the sources to transform, all sources if empty
     * @throws org.fuel.api.exception.ConfigException if the mode is unknown or no codec is found
     */
    public ImagesFromBytes(DataStream dataStream, String colorMode, String... whichSources) {
        this(dataStream, colorMode, ImageCodec.getInstance(), whichSources);
    }

    /**
     * Constructs an {@code ImagesFromBytes}.
     *
     * @param dataStream the stream to wrap
     * @param colorMode the mode to convert to, such as {@code "RGB"}, or {@code null}
     * @param codec the codec to decode with
     * @param whichSources the sources to transform, all sources if empty
     * @throws org.fuel.api.exception.ConfigException if the mode is unknown
     */
    public ImagesFromBytes(
            DataStream dataStream, String colorMode, ImageCodec codec, String... whichSources) {
        super(dataStream, whichSources);
        this.colorMode = colorMode == null ? null : ColorMode.fromValue(colorMode);
        this.codec = codec;
    }

    /** {@inheritDoc} */
    @Override
    public Map<String, LayoutType[]> getAxisLabels() {
        Map<String, LayoutType[]> labels = new HashMap<>(dataStream.getAxisLabels());
        for (String source : getWhichSources()) {
            if (producesExamples()) {
                labels.put(source, EXAMPLE_LAYOUT.clone());
            } else {
                LayoutType[] layout = new LayoutType[EXAMPLE_LAYOUT.length + 1];
                layout[0] = LayoutType.BATCH;
                System.arraycopy(EXAMPLE_LAYOUT, 0, layout, 1, EXAMPLE_LAYOUT.length);
                labels.put(source, layout);
            }
        }
        return labels;
    }

    /** {@inheritDoc} */
    @Override
    public NDArray transformSourceExample(Object example, String sourceName) {
        NDArray image = codec.decode(toBytes(example));
        if (colorMode != null) {
            image = codec.convert(image, colorMode);
        }
        return image.transpose(2, 0, 1);
    }

    /** {@inheritDoc} */
    @Override
    public Batch transformSourceBatch(Object batch, String sourceName) {
        List<?> buffers;
        if (batch instanceof List) {
            buffers = (List<?>) batch;
        } else if (batch instanceof Object[]) {
            buffers = Arrays.asList((Object[]) batch);
        } else {
            throw new DecodeException(
                    "Expected a batch of encoded images, got " + describe(batch));
        }
        List<NDArray> images = new ArrayList<>(buffers.size());
        for (Object buffer : buffers) {
            images.add(transformSourceExample(buffer, sourceName));
        }
        return Batch.list(images);
    }

    private static byte[] toBytes(Object value) {
        if (value instanceof byte[]) {
            return (byte[]) value;
        } else if (value instanceof ByteBuffer) {
            ByteBuffer buffer = ((ByteBuffer) value).duplicate();
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        }
        throw new DecodeException("Expected an encoded image, got " + describe(value));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
