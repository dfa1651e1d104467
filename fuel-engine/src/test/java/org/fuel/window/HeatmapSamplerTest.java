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

import org.fuel.api.exception.SizeException;
import org.fuel.api.ndarray.NDArray;
import org.fuel.api.ndarray.types.DataType;
import org.fuel.api.ndarray.types.Shape;
import org.fuel.random.RandomState;
import org.testng.Assert;
import org.testng.annotations.Test;

public class HeatmapSamplerTest {

    @Test
    public void testInteriorNormalization() {
        double[] values = new double[25];
        values[0] = 100;
        for (int r = 2; r < 4; ++r) {
            for (int c = 2; c < 4; ++c) {
                values[r * 5 + c] = 1;
            }
        }
        NDArray heatmap =
                HeatmapSampler.calculateHeatmap(
                        NDArray.create(values, new Shape(1, 5, 5), DataType.UINT8), 2);
        Assert.assertEquals(heatmap.getDataType(), DataType.FLOAT64);
        Assert.assertEquals(heatmap.getDouble(0, 2, 2), 0.25);
        Assert.assertEquals(heatmap.getDouble(0, 0, 0), 25.0);
    }

    @Test
    public void testSampleFollowsWeight() {
        double[] values = new double[36];
        values[3 * 6 + 3] = 2;
        NDArray heatmap =
                HeatmapSampler.calculateHeatmap(
                        NDArray.create(values, new Shape(1, 6, 6), DataType.FLOAT32), 2);
        Assert.assertEquals(heatmap.getDouble(0, 3, 3), 1.0);
        for (long seed = 0; seed < 5; ++seed) {
            RandomState rng = new RandomState(seed);
            Window window = HeatmapSampler.sample(heatmap, new long[] {3, 3}, rng);
            Assert.assertEquals(window.getOffsets(), new long[] {2, 2});
        }
    }

    @Test
    public void testSampleSumsChannels() {
        double[] values = new double[2 * 6 * 6];
        values[2 * 6 + 2] = 1;
        values[36 + 4 * 6 + 4] = 1;
        NDArray heatmap = NDArray.create(values, new Shape(2, 6, 6), DataType.FLOAT64);
        // offsets (1, 1) and (3, 3) are equally likely; 0.696 picks the second
        Window window = HeatmapSampler.sample(heatmap, new long[] {3, 3}, new RandomState(123));
        Assert.assertEquals(window.getOffsets(), new long[] {3, 3});
    }

    @Test(expectedExceptions = SizeException.class)
    public void testNoInterior() {
        HeatmapSampler.calculateHeatmap(NDArray.zeros(new Shape(1, 3, 8), DataType.FLOAT32), 2);
    }

    @Test(expectedExceptions = SizeException.class)
    public void testZeroInterior() {
        HeatmapSampler.calculateHeatmap(NDArray.zeros(new Shape(1, 6, 6), DataType.FLOAT32), 2);
    }
}
