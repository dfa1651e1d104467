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

package org.fuel.api.batch;

import java.util.Arrays;
import java.util.Collections;
import org.fuel.api.exception.FormatException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.DataType;
import org.fuel.api.ndarray.types.Shape;
import org.testng.Assert;
import org.testng.annotations.Test;

public class BatchTest {

    private static NDArray batchArray() {
        return NDArray.arange(24, DataType.UINT8).reshape(2, 3, 4);
    }

    @Test
    public void testKinds() {
        NDArray array = batchArray();
        Batch dense = Batch.dense(array);
        Batch list = Batch.list(dense.toList());
        Batch objectArray = Batch.objectArray(array.get(0), array.get(1));

        Assert.assertEquals(dense.getKind(), Batch.Kind.DENSE);
        Assert.assertEquals(list.getKind(), Batch.Kind.LIST);
        Assert.assertEquals(objectArray.getKind(), Batch.Kind.OBJECT_ARRAY);
        for (Batch batch : Arrays.asList(dense, list, objectArray)) {
            Assert.assertEquals(batch.size(), 2);
            Assert.assertTrue(batch.get(1).contentEquals(array.get(1)));
            Assert.assertTrue(batch.toDense().contentEquals(array));
        }
    }

    @Test
    public void testMapExamplesKeepsKind() {
        NDArray array = batchArray();
        Batch list = Batch.list(Arrays.asList(array.get(0), array.get(1)));
        Batch mapped = list.mapExamples(e -> e.flip(-1));
        Assert.assertEquals(mapped.getKind(), Batch.Kind.LIST);
        Assert.assertTrue(mapped.get(0).contentEquals(array.get(0).flip(-1)));

        Batch objectArray = Batch.objectArray(array.get(0), array.get(1));
        mapped = objectArray.mapExamples(e -> e.flip(0));
        Assert.assertEquals(mapped.getKind(), Batch.Kind.OBJECT_ARRAY);
        Assert.assertTrue(mapped.get(1).contentEquals(array.get(1).flip(0)));

        Batch dense = Batch.dense(array).mapExamples(e -> e.map(v -> v + 1));
        Assert.assertEquals(dense.getKind(), Batch.Kind.DENSE);
        Assert.assertTrue(dense.toDense().contentEquals(array.map(v -> v + 1)));
    }

    @Test
    public void testDenseDowngradesToList() {
        int[] counter = {0};
        Batch output =
                Batch.dense(batchArray())
                        .mapExamples(
                                e -> {
                                    long width = 4 - counter[0]++;
                                    return e.crop(new long[] {0}, new long[] {width});
                                });
        Assert.assertEquals(output.getKind(), Batch.Kind.LIST);
        Assert.assertEquals(output.size(), 2);
        Assert.assertEquals(output.get(0).getShape(), new Shape(3, 4));
        Assert.assertEquals(output.get(1).getShape(), new Shape(3, 3));
    }

    @Test
    public void testFromValue() {
        NDArray array = batchArray();
        Assert.assertEquals(Batch.fromValue(array).getKind(), Batch.Kind.DENSE);
        Assert.assertEquals(
                Batch.fromValue(new NDArray[] {array.get(0)}).getKind(), Batch.Kind.OBJECT_ARRAY);
        Assert.assertEquals(
                Batch.fromValue(Collections.singletonList(array.get(0))).getKind(),
                Batch.Kind.LIST);
    }

    @Test(expectedExceptions = FormatException.class)
    public void testFromValueRejectsBytes() {
        Batch.fromValue(new byte[] {1, 2, 3});
    }

    @Test(expectedExceptions = FormatException.class)
    public void testRankMismatch() {
        Batch.list(Arrays.asList(batchArray().get(0), batchArray()));
    }
}
