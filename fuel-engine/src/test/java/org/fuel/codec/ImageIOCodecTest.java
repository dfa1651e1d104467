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

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.fuel.api.codec.ColorMode;
import org.fuel.api.codec.ImageCodec;
import org.fuel.api.exception.DecodeException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.DataType;
import org.fuel.api.ndarray.types.Shape;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ImageIOCodecTest {

    static byte[] encode(BufferedImage image) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        ImageIO.write(image, "png", bos);
        return bos.toByteArray();
    }

    static BufferedImage colorImage() {
        BufferedImage image = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, 0xC86432);
        image.setRGB(2, 1, 0x0000FF);
        return image;
    }

    @Test
    public void testServiceLookup() {
        Assert.assertEquals(ImageCodec.getInstance().getCodecName(), ImageIOCodec.NAME);
    }

    @Test
    public void testDecodeColor() throws IOException {
        NDArray image = new ImageIOCodec().decode(encode(colorImage()));
        Assert.assertEquals(image.getShape(), new Shape(2, 3, 3));
        Assert.assertEquals(image.getDataType(), DataType.UINT8);
        Assert.assertEquals(image.getDouble(0, 0, 0), 200.0);
        Assert.assertEquals(image.getDouble(0, 0, 1), 100.0);
        Assert.assertEquals(image.getDouble(0, 0, 2), 50.0);
        Assert.assertEquals(image.getDouble(1, 2, 2), 255.0);
    }

    @Test
    public void testDecodeGrey() throws IOException {
        BufferedImage grey = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_GRAY);
        grey.getRaster().setSample(1, 0, 0, 77);
        NDArray image = new ImageIOCodec().decode(encode(grey));
        Assert.assertEquals(image.getShape(), new Shape(2, 2, 1));
        Assert.assertEquals(image.getDouble(0, 1, 0), 77.0);
    }

    @Test
    public void testConvert() throws IOException {
        ImageIOCodec codec = new ImageIOCodec();
        NDArray image = codec.decode(encode(colorImage()));

        NDArray luma = codec.convert(image, ColorMode.L);
        Assert.assertEquals(luma.getShape(), new Shape(2, 3, 1));
        Assert.assertEquals(luma.getDouble(0, 0, 0), 124.0);

        NDArray rgba = codec.convert(image, ColorMode.RGBA);
        Assert.assertEquals(rgba.getDouble(0, 0, 3), 255.0);

        NDArray cmyk = codec.convert(image, ColorMode.CMYK);
        Assert.assertEquals(cmyk.getDouble(0, 0, 0), 55.0);
        Assert.assertEquals(cmyk.getDouble(0, 0, 3), 0.0);
    }

    @Test(expectedExceptions = DecodeException.class)
    public void testDecodeGarbage() {
        new ImageIOCodec().decode(new byte[] {1, 2, 3, 4});
    }
}
