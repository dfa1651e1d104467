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

package org.fuel.window;

import java.util.HashSet;
import java.util.Set;
import org.fuel.api.exception.ConfigException;
import org.fuel.api.exception.FormatException;
import org.fuel.api.exception.SizeException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.DataType;
import org.fuel.api.ndarray.types.Shape;
import org.fuel.random.RandomState;
import org.testng.Assert;
import org.testng.annotations.Test;

public class WindowSamplerTest {

    @Test
    public void testCornersCoverExample() {
        NDArray example = NDArray.arange(2 * 5 * 7, DataType.INT32).reshape(2, 5, 7);
        long[] window = {3, 4};
        int[][] corners = {{0, 0}, {0, 1}, {1, 0}, {1, 1}};
        Set<Double> seen = new HashSet<>();
        for (int[] corner : corners) {
            NDArray crop = WindowSampler.fixed(example.getShape(), window, corner).apply(example);
            Assert.assertEquals(crop.getShape(), new Shape(2, 3, 4));
            for (double v : crop.toDoubleArray()) {
                seen.add(v);
            }
        }
        Assert.assertEquals(seen.size(), 70);
    }

    @Test
    public void testFixedOffsets() {
        Shape shape = new Shape(1, 10, 8, 6);
        Window window = WindowSampler.fixed(shape, new long[] {4, 8, 2}, new int[] {1, 0, 1});
        Assert.assertEquals(window.getOffsets(), new long[] {6, 0, 4});
        Assert.assertEquals(window.getLengths(), new long[] {4, 8, 2});
    }

    @Test
    public void testCenter() {
        Window window = WindowSampler.center(new Shape(3, 7, 6), new long[] {4, 3});
        Assert.assertEquals(window.getOffsets(), new long[] {1, 1});
    }

    @Test
    public void testRandomDrawsPerAxis() {
        RandomState rng = new RandomState(123);
        Shape shape = new Shape(1, 5, 6);
        long[] size = {2, 3};
        Assert.assertEquals(WindowSampler.random(shape, size, rng).getOffsets(), new long[] {2, 1});
        Assert.assertEquals(WindowSampler.random(shape, size, rng).getOffsets(), new long[] {2, 2});
    }

    @Test
    public void testFullWindowDrawsNothing() {
        RandomState rng = new RandomState(123);
        Window window = WindowSampler.random(new Shape(1, 4, 4), new long[] {4, 4}, rng);
        Assert.assertEquals(window.getOffsets(), new long[] {0, 0});
        Assert.assertEquals(rng.randomSample(), 0.6964691855978616);
    }

    @Test(expectedExceptions = SizeException.class)
    public void testWindowTooLarge() {
        WindowSampler.center(new Shape(1, 4, 4), new long[] {5, 2});
    }

    @Test(expectedExceptions = FormatException.class)
    public void testRankMismatch() {
        WindowSampler.center(new Shape(4, 4), new long[] {2, 2});
    }

    @Test
    public void testInvalidConfiguration() {
        Assert.assertThrows(
                ConfigException.class, () -> WindowSampler.checkLocation(new int[] {0, 2}, 2));
        Assert.assertThrows(
                ConfigException.class, () -> WindowSampler.checkLocation(new int[] {0}, 2));
        Assert.assertThrows(ConfigException.class, () -> WindowSampler.checkWindowShape(2, 0));
        Assert.assertThrows(ConfigException.class, () -> WindowSampler.checkWindowShape());
    }
}
