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

package org.fuel.api.ndarray.types;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ShapeTest {

    @Test
    public void testDimensions() {
        Shape shape = new Shape(2, 3, 4);
        Assert.assertEquals(shape.size(), 24);
        Assert.assertEquals(shape.dimension(), 3);
        Assert.assertEquals(shape.head(), 2);
        Assert.assertEquals(shape.get(-2), 3);
        Assert.assertEquals(shape.strides(), new long[] {12, 4, 1});
        Assert.assertEquals(shape.toString(), "(2, 3, 4)");
    }

    @Test
    public void testSliceAndRemove() {
        LayoutType[] layout = LayoutType.fromValue("NCHW");
        Shape shape = new Shape(new long[] {8, 3, 32, 24}, layout);
        Shape spatial = shape.slice(2);
        Assert.assertEquals(spatial, new Shape(32, 24));
        Assert.assertEquals(LayoutType.toString(spatial.getLayout()), "HW");
        Shape example = shape.remove(0);
        Assert.assertEquals(example, new Shape(3, 32, 24));
        Assert.assertEquals(LayoutType.toString(example.getLayout()), "CHW");
        Assert.assertEquals(new Shape(3).addAll(spatial), new Shape(3, 32, 24));
        Assert.assertEquals(Shape.update(shape, 0, 1), new Shape(1, 3, 32, 24));
    }

    @Test
    public void testLayoutIgnoredByEquality() {
        Shape labelled = new Shape(new long[] {2, 2}, LayoutType.fromValue("HW"));
        Assert.assertEquals(labelled, new Shape(2, 2));
        Assert.assertEquals(labelled.hashCode(), new Shape(2, 2).hashCode());
        Assert.assertTrue(new Shape().isScalar());
        Assert.assertEquals(new Shape(2, 0).size(), 0);
    }

    @Test
    public void testAxisLabels() {
        LayoutType[] layout = {LayoutType.BATCH, LayoutType.CHANNEL, LayoutType.HEIGHT};
        Assert.assertEquals(LayoutType.toLabels(layout), "(batch, channel, height)");
        Assert.assertEquals(LayoutType.fromLabel("width"), LayoutType.WIDTH);
        Assert.assertEquals(LayoutType.fromLabel("elevation"), LayoutType.UNKNOWN);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeDimension() {
        new Shape(2, -1);
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void testScalarHead() {
        new Shape().head();
    }
}
