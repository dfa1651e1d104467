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

import java.util.ServiceLoader;
import org.fuel.api.exception.ConfigException;
import org.fuel.api.exception.DecodeException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code ImageCodec} turns encoded image buffers into {@code uint8} arrays.
 *
 * <p>Decoded images are laid out as {@code (height, width, channel)}. Use {@link #getInstance()} to
 * get the codec selected by the {@code fuel.image_codec} system property (or the {@code
 * FUEL_IMAGE_CODEC} environment variable), or else the highest ranked {@link ImageCodecProvider}
 * found on the class path.
 */
public abstract class ImageCodec {

    private static final Logger logger = LoggerFactory.getLogger(ImageCodec.class);

    private static ImageCodecProvider provider;

    private static synchronized ImageCodecProvider initProvider() {
        String wanted = Utils.getConfig(Utils.IMAGE_CODEC, Utils.IMAGE_CODEC_ENV);
        ImageCodecProvider best = null;
        for (ImageCodecProvider candidate : ServiceLoader.load(ImageCodecProvider.class)) {
            logger.debug("Found ImageCodecProvider: {}", candidate.getCodecName());
            if (wanted != null) {
                if (wanted.equals(candidate.getCodecName())) {
                    return candidate;
                }
            } else if (best == null || candidate.getCodecRank() > best.getCodecRank()) {
                best = candidate;
            }
        }
        if (wanted != null) {
            throw new ConfigException("Image codec not found: " + wanted);
        }
        if (best == null) {
            throw new ConfigException("No ImageCodecProvider found");
        }
        return best;
    }

    /**
     * Returns the configured {@code ImageCodec}.
     *
     * @return the instance of {@code ImageCodec}
     * @throws ConfigException if no matching codec is available
     */
    public static synchronized ImageCodec getInstance() {
        if (provider == null) {
            provider = initProvider();
        }
        return provider.getCodec();
    }

    /**
     * Returns the name of the codec.
     *
     * @return the name of the codec
     */
    public abstract String getCodecName();

    /**
     * Decodes an encoded image.
     *
     * @param data the encoded bytes
     * @return a {@code uint8} array of shape {@code (height, width, channel)} in the image's own
     *     color mode
     * @throws DecodeException if the bytes cannot be interpreted as an image
     */
    public abstract NDArray decode(byte[] data);

    /**
     * Converts a decoded image to a color mode.
     *
     * @param image a {@code uint8} array of shape {@code (height, width, channel)}
     * @param mode the target mode
     * @return a {@code uint8} array with {@code mode.getChannels()} channels
     * @throws DecodeException if the image layout is not one the codec produces
     */
    public abstract NDArray convert(NDArray image, ColorMode mode);
}
