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

package org.fuel.ndarray;

import org.fuel.api.exception.ConfigException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.DataType;
import org.fuel.api.ndarray.types.Shape;
import org.testng.Assert;
import org.testng.annotations.Test;

public class NDImageUtilsTest {

    @Test
    public void testRotate() {
        NDArray plane = NDArray.arange(20, DataType.UINT8).reshape(4, 5);
        double angle = 0.19646918559786164;
        NDArray rotated = NDImageUtils.rotate(plane, angle, Interpolation.NEAREST);
        double[] expected = {
            0, 0, 0, 2, 3,
            0, 0, 1, 7, 8,
            0, 5, 6, 12, 13,
            0, 10, 11, 17, 18
        };
        Assert.assertEquals(rotated.getShape(), new Shape(4, 5));
        Assert.assertEquals(rotated.getDataType(), DataType.UINT8);
        Assert.assertEquals(rotated.toDoubleArray(), expected);
    }

    @Test
    public void testRotateByZero() {
        NDArray image = NDArray.arange(2 * 4 * 6, DataType.FLOAT32).reshape(2, 4, 6);
        NDArray rotated = NDImageUtils.rotate(image, 0, Interpolation.NEAREST);
        Assert.assertTrue(rotated.contentEquals(image));
    }

    @Test
    public void testResizeNearest() {
        NDArray image = NDArray.arange(6, DataType.UINT8).reshape(1, 2, 3);
        NDArray resized = NDImageUtils.resize(image, 4, 6, Interpolation.NEAREST);
        Assert.assertEquals(resized.getShape(), new Shape(1, 4, 6));
        double[] expected = {
            0, 0, 1, 1, 2, 2,
            0, 0, 1, 1, 2, 2,
            3, 3, 4, 4, 5, 5,
            3, 3, 4, 4, 5, 5
        };
        Assert.assertEquals(resized.toDoubleArray(), expected);
    }

    @Test
    public void testResizeKeepsConstant() {
        NDArray image = NDArray.zeros(new Shape(2, 3, 3), DataType.UINT8).map(v -> 7);
        for (Interpolation mode : Interpolation.values()) {
            NDArray resized = NDImageUtils.resize(image, 5, 4, mode);
            Assert.assertEquals(resized.getShape(), new Shape(2, 5, 4));
            Assert.assertEquals(resized.min(), 7.0);
            Assert.assertEquals(resized.max(), 7.0);
        }
    }

    @Test
    public void testGammaCorrection() {
        NDArray image = NDArray.create(new double[] {0, 128, 255}, new Shape(3), DataType.UINT8);
        NDArray corrected = NDImageUtils.gammaCorrection(image, 0.5);
        Assert.assertEquals(corrected.toDoubleArray(), new double[] {0, 181, 255});

        NDArray floats = NDArray.create(new float[] {1, 3, 5}, new Shape(3));
        Assert.assertEquals(
                NDImageUtils.gammaCorrection(floats, 2).toDoubleArray(), new double[] {1, 9, 25});

        NDArray signed = NDArray.create(new double[] {-64, 64}, new Shape(2), DataType.INT8);
        // (64 / 127)^2 * 127 = 32.25
        Assert.assertEquals(
                NDImageUtils.gammaCorrection(signed, 2).toDoubleArray(), new double[] {-32, 32});
        Assert.assertTrue(NDImageUtils.gammaCorrection(image, 1).contentEquals(image));
    }

    @Test
    public void testInterpolationNames() {
        Assert.assertEquals(Interpolation.fromValue("Bilinear"), Interpolation.BILINEAR);
        Assert.assertThrows(ConfigException.class, () -> Interpolation.fromValue("lanczos"));
    }
}
