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

import java.util.Arrays;
import org.fuel.api.batch.Batch;
import org.fuel.api.exception.ConfigException;
import org.fuel.api.exception.FormatException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.DataType;
import org.fuel.api.ndarray.types.LayoutType;
import org.fuel.api.ndarray.types.Shape;
import org.fuel.random.RandomState;
import org.fuel.stream.IndexableDataStream;
import org.fuel.stream.Record;
import org.testng.Assert;
import org.testng.annotations.Test;

public class Random2DRotationTest {

    // seed 123 draws the angles 0.19646918559786164 and -0.21386066504962054

    private static final double[] FIRST = {
        0, 0, 0, 2, 3,
        0, 0, 1, 7, 8,
        0, 5, 6, 12, 13,
        0, 10, 11, 17, 18,
        0, 0, 0, 22, 23,
        0, 20, 21, 27, 28,
        0, 25, 26, 32, 33,
        0, 30, 31, 37, 38,
        0, 0, 0, 42, 43,
        0, 40, 41, 47, 48,
        0, 45, 46, 52, 53,
        0, 50, 51, 57, 58
    };

    private static final double[] SECOND = {
        0, 0, 1, 0, 0,
        0, 5, 6, 2, 3,
        0, 10, 11, 7, 8,
        0, 15, 16, 12, 13,
        0, 20, 21, 0, 0,
        0, 25, 26, 22, 23,
        0, 30, 31, 27, 28,
        0, 35, 36, 32, 33,
        0, 40, 41, 0, 0,
        0, 45, 46, 42, 43,
        0, 50, 51, 47, 48,
        0, 55, 56, 52, 53
    };

    private static final double[] SECOND_WIDE = {
        0, 0, 1, 2, 0, 0,
        0, 6, 7, 8, 3, 4,
        12, 13, 14, 15, 9, 10,
        18, 19, 20, 15, 16, 17,
        0, 24, 25, 26, 0, 0,
        0, 30, 31, 32, 27, 28,
        36, 37, 38, 39, 33, 34,
        42, 43, 44, 39, 40, 41,
        0, 48, 49, 50, 0, 0,
        0, 54, 55, 56, 51, 52,
        60, 61, 62, 63, 57, 58,
        66, 67, 68, 63, 64, 65
    };

    private static NDArray image() {
        return NDArray.arange(60, DataType.UINT8).reshape(3, 4, 5);
    }

    private static NDArray images() {
        return NDArray.stack(Arrays.asList(image(), image()));
    }

    private static IndexableDataStream stream(int batchSize) {
        return IndexableDataStream.builder()
                .addSource("features", images())
                .setAxisLabels("features", LayoutType.fromValue("CHW"))
                .setBatchSize(batchSize)
                .build();
    }

    private static Random2DRotation rotation(IndexableDataStream stream) {
        return new Random2DRotation(stream, 0.5, "nearest", new RandomState(123));
    }

    @Test
    public void testGoldenExample() {
        NDArray rotated = rotation(stream(0)).transformSourceExample(image(), "features");
        Assert.assertEquals(rotated.getShape(), new Shape(3, 4, 5));
        Assert.assertEquals(rotated.getDataType(), DataType.UINT8);
        Assert.assertEquals(rotated.toDoubleArray(), FIRST);
    }

    @Test
    public void testFloatExample() {
        NDArray example = NDArray.arange(60, DataType.FLOAT32).reshape(3, 4, 5);
        NDArray rotated = rotation(stream(0)).transformSourceExample(example, "features");
        Assert.assertEquals(rotated.getDataType(), DataType.FLOAT32);
        Assert.assertEquals(rotated.toDoubleArray(), FIRST);
    }

    @Test
    public void testExampleStream() {
        int count = 0;
        for (Record record : rotation(stream(0))) {
            NDArray rotated = (NDArray) record.get("features");
            Assert.assertEquals(rotated.toDoubleArray(), count == 0 ? FIRST : SECOND);
            count++;
        }
        Assert.assertEquals(count, 2);
    }

    @Test
    public void testDenseBatch() {
        Batch output = rotation(stream(2)).transformSourceBatch(images(), "features");
        Assert.assertEquals(output.getKind(), Batch.Kind.DENSE);
        Assert.assertEquals(output.toDense().getShape(), new Shape(2, 3, 4, 5));
        Assert.assertEquals(output.get(0).toDoubleArray(), FIRST);
        Assert.assertEquals(output.get(1).toDoubleArray(), SECOND);
    }

    @Test
    public void testRaggedBatch() {
        NDArray wide = NDArray.arange(72, DataType.UINT8).reshape(3, 4, 6);
        Batch[] inputs = {
            Batch.list(Arrays.asList(image(), wide)), Batch.objectArray(image(), wide)
        };
        for (Batch input : inputs) {
            Batch output = rotation(stream(2)).transformSourceBatch(input, "features");
            Assert.assertEquals(output.getKind(), input.getKind());
            Assert.assertEquals(output.get(0).toDoubleArray(), FIRST);
            Assert.assertEquals(output.get(1).getShape(), new Shape(3, 4, 6));
            Assert.assertEquals(output.get(1).toDoubleArray(), SECOND_WIDE);
        }
    }

    @Test
    public void testOneDrawPerExample() {
        RandomState rng = new RandomState(123);
        Random2DRotation rotation = new Random2DRotation(stream(2), 0.5, "bilinear", rng);
        rotation.transformSourceBatch(images(), "features");
        Assert.assertEquals(rng.randomSample(), 0.2268514535642031);
    }

    @Test
    public void testInvalidConfiguration() {
        IndexableDataStream stream = stream(0);
        RandomState rng = new RandomState(1);
        Assert.assertThrows(
                ConfigException.class, () -> new Random2DRotation(stream, 0, "nearest", rng));
        Assert.assertThrows(
                ConfigException.class,
                () -> new Random2DRotation(stream, Math.PI, "nearest", rng));
        Assert.assertThrows(
                ConfigException.class, () -> new Random2DRotation(stream, -1, "nearest", rng));
        Assert.assertThrows(
                ConfigException.class, () -> new Random2DRotation(stream, 0.5, "lanczos", rng));
    }

    @Test(expectedExceptions = FormatException.class)
    public void testRankTooSmall() {
        rotation(stream(0))
                .transformSourceExample(NDArray.zeros(new Shape(4, 5), DataType.UINT8), "features");
    }
}
