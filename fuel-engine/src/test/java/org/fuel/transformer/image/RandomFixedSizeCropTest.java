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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.fuel.api.batch.Batch;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.DataType;
import org.fuel.api.ndarray.types.Shape;
import org.fuel.random.RandomState;
import org.fuel.stream.IndexableDataStream;
import org.fuel.stream.Record;
import org.testng.Assert;
import org.testng.annotations.Test;

public class RandomFixedSizeCropTest {

    private static NDArray images() {
        return NDArray.arange(2 * 30, DataType.UINT8).reshape(2, 1, 5, 6);
    }

    private static IndexableDataStream stream(int batchSize) {
        return IndexableDataStream.builder()
                .addSource("features", images())
                .setBatchSize(batchSize)
                .build();
    }

    private static RandomFixedSizeCrop crop(IndexableDataStream stream, long seed) {
        return new RandomFixedSizeCrop(stream, new long[] {2, 3}, new RandomState(seed));
    }

    @Test
    public void testSeededWindow() {
        // seed 123 draws offsets (2, 1) and then (2, 2)
        RandomFixedSizeCrop crop = crop(stream(0), 123);
        NDArray output = crop.transformSourceExample(images().get(0), "features");
        Assert.assertEquals(output.getShape(), new Shape(1, 2, 3));
        Assert.assertEquals(output.toDoubleArray(), new double[] {13, 14, 15, 19, 20, 21});
    }

    @Test
    public void testRepeatable() {
        List<NDArray> first = new ArrayList<>();
        for (Record record : crop(stream(0), 7)) {
            first.add((NDArray) record.get("features"));
        }
        int i = 0;
        for (Record record : crop(stream(0), 7)) {
            Assert.assertTrue(((NDArray) record.get("features")).contentEquals(first.get(i++)));
        }
    }

    @Test
    public void testDenseMatchesList() {
        NDArray images = images();
        Batch dense = crop(stream(2), 123).transformSourceBatch(images, "features");
        Batch list =
                crop(stream(2), 123)
                        .transformSourceBatch(
                                Arrays.asList(images.get(0), images.get(1)), "features");
        Assert.assertEquals(dense.getKind(), Batch.Kind.DENSE);
        for (int i = 0; i < 2; ++i) {
            Assert.assertTrue(dense.get(i).contentEquals(list.get(i)));
        }
        Assert.assertEquals(dense.get(1).getDouble(0, 0, 0), 30.0 + 2 * 6 + 2);
    }

    @Test
    public void testOffsetsCoverAllPositions() {
        RandomFixedSizeCrop crop = crop(stream(0), 1);
        NDArray example = images().get(0);
        Set<Double> corners = new HashSet<>();
        for (int epoch = 0; epoch < 500; ++epoch) {
            corners.add(crop.transformSourceExample(example, "features").getDouble(0, 0, 0));
        }
        Assert.assertEquals(corners.size(), 4 * 4);
    }
}
