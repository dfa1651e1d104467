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

package org.fuel.stream;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import org.fuel.api.batch.Batch;
import org.fuel.api.exception.ConfigException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.DataType;
import org.fuel.api.ndarray.types.LayoutType;
import org.testng.Assert;
import org.testng.annotations.Test;

public class IndexableDataStreamTest {

    private static NDArray features() {
        return NDArray.arange(3 * 2 * 2, DataType.UINT8).reshape(3, 1, 2, 2);
    }

    @Test
    public void testExamples() {
        IndexableDataStream stream =
                IndexableDataStream.builder()
                        .addSource("features", features())
                        .addSource("targets", Arrays.asList("a", "b", "c"))
                        .setAxisLabels("features", LayoutType.fromValue("CHW"))
                        .build();
        Assert.assertTrue(stream.producesExamples());
        Assert.assertEquals(stream.getSources(), Arrays.asList("features", "targets"));
        Assert.assertEquals(stream.getNumExamples(), 3);
        Assert.assertEquals(
                LayoutType.toLabels(stream.getAxisLabels().get("features")),
                "(channel, height, width)");

        int count = 0;
        for (Record record : stream) {
            NDArray example = (NDArray) record.get("features");
            Assert.assertTrue(example.contentEquals(features().get(count)));
            Assert.assertEquals(record.get(1), "abc".substring(count, count + 1));
            count++;
        }
        Assert.assertEquals(count, 3);
    }

    @Test
    public void testBatches() {
        NDArray[] objects = {features().get(0), features().get(1), features().get(2)};
        List<byte[]> encoded = Arrays.asList(new byte[1], new byte[2], new byte[3]);
        IndexableDataStream stream =
                IndexableDataStream.builder()
                        .addSource("dense", features())
                        .addSource("list", Arrays.asList(objects))
                        .addSource("objects", objects)
                        .addSource("encoded", encoded)
                        .setBatchSize(2)
                        .build();
        Assert.assertFalse(stream.producesExamples());

        Iterator<Record> it = stream.iterator();
        Record first = it.next();
        Assert.assertEquals(((Batch) first.get("dense")).getKind(), Batch.Kind.DENSE);
        Assert.assertEquals(((Batch) first.get("list")).getKind(), Batch.Kind.LIST);
        Assert.assertEquals(((Batch) first.get("objects")).getKind(), Batch.Kind.OBJECT_ARRAY);
        Assert.assertEquals(((List<?>) first.get("encoded")).size(), 2);
        Assert.assertEquals(((Batch) first.get("dense")).size(), 2);

        Record last = it.next();
        Assert.assertEquals(((Batch) last.get("dense")).size(), 1);
        Assert.assertTrue(((Batch) last.get("objects")).get(0).contentEquals(objects[2]));
        Assert.assertFalse(it.hasNext());
    }

    @Test
    public void testRecordWith() {
        Record record = new Record(Arrays.asList("a", "b"), Arrays.asList(1, 2));
        Record updated = record.with("b", 3);
        Assert.assertEquals(updated.get("b"), 3);
        Assert.assertEquals(record.get("b"), 2);
        Assert.assertThrows(IllegalArgumentException.class, () -> record.with("c", 0));
    }

    @Test
    public void testInvalidSources() {
        Assert.assertThrows(
                ConfigException.class,
                () ->
                        IndexableDataStream.builder()
                                .addSource("features", features())
                                .addSource("features", features()));
        Assert.assertThrows(
                ConfigException.class,
                () ->
                        IndexableDataStream.builder()
                                .addSource("features", features())
                                .addSource("targets", Arrays.asList(1, 2)));
        Assert.assertThrows(ConfigException.class, () -> IndexableDataStream.builder().build());
    }
}
