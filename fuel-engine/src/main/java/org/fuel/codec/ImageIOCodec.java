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

package org.fuel.codec;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.fuel.api.codec.ColorMode;
import org.fuel.api.codec.ImageCodec;
import org.fuel.api.exception.DecodeException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.DataType;
import org.fuel.api.ndarray.types.Shape;

/**
 * An {@link ImageCodec} backed by {@link ImageIO}.
 *
 * <p>Greyscale images decode to one channel (two with alpha), everything else to RGB or RGBA.
 */
public class ImageIOCodec extends ImageCodec {

    static final String NAME = "ImageIO";

    /** {@inheritDoc} */
    @Override
    public String getCodecName() {
        return NAME;
    }

    /** {@inheritDoc} */
    @Override
    public NDArray decode(byte[] data) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(data));
        } catch (IOException e) {
            throw new DecodeException("Failed to decode image", e);
        }
        if (image == null) {
            throw new DecodeException("Unrecognized image format");
        }
        int height = image.getHeight();
        int width = image.getWidth();
        ColorModel cm = image.getColorModel();
        boolean grey =
                !(cm instanceof IndexColorModel)
                        && cm.getColorSpace().getType() == ColorSpace.TYPE_GRAY;
        int channels = grey ? (cm.hasAlpha() ? 2 : 1) : (cm.hasAlpha() ? 4 : 3);
        byte[] pixels = new byte[height * width * channels];
        Raster raster = image.getRaster();
        int pos = 0;
        for (int y = 0; y < height; ++y) {
            for (int x = 0; x < width; ++x) {
                if (grey) {
                    for (int b = 0; b < channels; ++b) {
                        int bits = cm.getComponentSize(b);
                        int sample = raster.getSample(x, y, b);
                        pixels[pos++] = (byte) (bits == 8 ? sample : scale(sample, bits));
                    }
                } else {
                    int argb = image.getRGB(x, y);
                    pixels[pos++] = (byte) (argb >> 16);
                    pixels[pos++] = (byte) (argb >> 8);
                    pixels[pos++] = (byte) argb;
                    if (channels == 4) {
                        pixels[pos++] = (byte) (argb >>> 24);
                    }
                }
            }
        }
        return NDArray.create(pixels, new Shape(height, width, channels));
    }

    private static int scale(int sample, int bits) {
        long max = (1L << bits) - 1;
        return (int) Math.round(sample * 255.0 / max);
    }

    /** {@inheritDoc} */
    @Override
    public NDArray convert(NDArray image, ColorMode mode) {
        Shape shape = image.getShape();
        if (shape.dimension() != 3 || image.getDataType() != DataType.UINT8) {
            throw new DecodeException(
                    "Expected a uint8 (height, width, channel) image, got "
                            + shape
                            + ' '
                            + image.getDataType());
        }
        int channels = (int) shape.get(2);
        if (channels < 1 || channels > 4) {
            throw new DecodeException("Unsupported number of channels: " + channels);
        }
        byte[] src = image.toUint8Array();
        int count = src.length / channels;
        int outChannels = mode.getChannels();
        byte[] out = new byte[count * outChannels];
        for (int i = 0; i < count; ++i) {
            int base = i * channels;
            int r;
            int g;
            int b;
            int a = 255;
            if (channels <= 2) {
                r = src[base] & 0xFF;
                g = r;
                b = r;
                if (channels == 2) {
                    a = src[base + 1] & 0xFF;
                }
            } else {
                r = src[base] & 0xFF;
                g = src[base + 1] & 0xFF;
                b = src[base + 2] & 0xFF;
                if (channels == 4) {
                    a = src[base + 3] & 0xFF;
                }
            }
            int o = i * outChannels;
            switch (mode) {
                case L:
                    out[o] = (byte) ((r * 19595 + g * 38470 + b * 7471 + 0x8000) >> 16);
                    break;
                case RGB:
                    out[o] = (byte) r;
                    out[o + 1] = (byte) g;
                    out[o + 2] = (byte) b;
                    break;
                case RGBA:
                    out[o] = (byte) r;
                    out[o + 1] = (byte) g;
                    out[o + 2] = (byte) b;
                    out[o + 3] = (byte) a;
                    break;
                case CMYK:
                    out[o] = (byte) (255 - r);
                    out[o + 1] = (byte) (255 - g);
                    out[o + 2] = (byte) (255 - b);
                    out[o + 3] = 0;
                    break;
                case YCBCR:
                    out[o] = clamp(0.299 * r + 0.587 * g + 0.114 * b);
                    out[o + 1] = clamp(128 - 0.168736 * r - 0.331264 * g + 0.5 * b);
                    out[o + 2] = clamp(128 + 0.5 * r - 0.418688 * g - 0.081312 * b);
                    break;
                default:
                    throw new DecodeException("Unsupported color mode: " + mode);
            }
        }
        return NDArray.create(out, new Shape(shape.get(0), shape.get(1), outChannels));
    }

    private static byte clamp(double value) {
        return (byte) Math.max(0, Math.min(255, Math.round(value)));
    }
}
