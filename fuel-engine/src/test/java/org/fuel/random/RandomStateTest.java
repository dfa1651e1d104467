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

package org.fuel.random;

import org.apache.commons.rng.core.source32.MersenneTwister;
import org.fuel.api.exception.SizeException;
import org.testng.Assert;
import org.testng.annotations.Test;

public class RandomStateTest {

    @Test
    public void testRawOutput() {
        Assert.assertEquals(new RandomState(5489).nextUint32(), 3499211612L);
        RandomState rng = new RandomState(123);
        Assert.assertEquals(rng.nextUint32(), 2991312382L);
        Assert.assertEquals(rng.nextUint32(), 3062119789L);
    }

    @Test
    public void testRandomSample() {
        RandomState rng = new RandomState(123);
        Assert.assertEquals(rng.randomSample(), 0.6964691855978616);
        Assert.assertEquals(rng.randomSample(), 0.28613933495037946);
        Assert.assertEquals(rng.randomSample(), 0.2268514535642031);
        Assert.assertEquals(rng.randomSample(), 0.5513147690828912);

        rng.setSeed(10);
        Assert.assertEquals(rng.randomSample(), 0.771320643266746);
        Assert.assertEquals(rng.uniform(-1, 1), 2 * 0.0207519493594015 - 1, 1e-15);
    }

    @Test
    public void testSingleWordSeeding() {
        MersenneTwister arraySeeded = new MersenneTwister(new int[] {5489});
        Assert.assertNotEquals(arraySeeded.nextInt() & 0xFFFFFFFFL, 3499211612L);

        RandomState rng = new RandomState(123);
        long[] first = new long[700];
        for (int i = 0; i < first.length; ++i) {
            first[i] = rng.nextUint32();
        }
        rng.setSeed(123);
        for (long value : first) {
            Assert.assertEquals(rng.nextUint32(), value);
        }
    }

    @Test
    public void testRandomIntegers() {
        RandomState rng = new RandomState(123);
        long[] values = new long[8];
        for (int i = 0; i < values.length; ++i) {
            values[i] = rng.randomIntegers(0, 3);
        }
        Assert.assertEquals(values, new long[] {2, 1, 2, 2, 0, 2, 2, 1});
    }

    @Test
    public void testEmptyRangeDrawsNothing() {
        RandomState rng = new RandomState(123);
        Assert.assertEquals(rng.randomIntegers(4, 4), 4L);
        Assert.assertEquals(rng.randomSample(), 0.6964691855978616);
    }

    @Test(expectedExceptions = SizeException.class)
    public void testInvalidRange() {
        new RandomState(1).randomIntegers(3, 2);
    }

    @Test
    public void testBernoulli() {
        RandomState rng = new RandomState(10);
        // 0.771 and 0.021
        Assert.assertTrue(rng.bernoulli(0.5));
        Assert.assertFalse(rng.bernoulli(0.5));

        // probability 0 draws nothing, probability 1 takes 0.771
        rng = new RandomState(10);
        Assert.assertFalse(rng.bernoulli(0));
        Assert.assertTrue(rng.bernoulli(1));
        Assert.assertFalse(rng.bernoulli(0.5));
        Assert.assertEquals(rng.randomSample(), 0.6336482349262754);

        // keep with probability 0.8: 0.696 kept, then 0.286 kept
        rng = new RandomState(123);
        Assert.assertTrue(rng.bernoulli(0.8));
        Assert.assertTrue(rng.bernoulli(0.8));
    }

    @Test
    public void testChoice() {
        RandomState rng = new RandomState(123);
        double[] weights = {1, 1, 1, 1};
        Assert.assertEquals(rng.choice(weights), 2);
        Assert.assertEquals(rng.choice(weights), 1);

        rng = new RandomState(123);
        double[] sparse = {0, 5, 0, 0};
        for (int i = 0; i < 20; ++i) {
            Assert.assertEquals(rng.choice(sparse), 1);
        }
    }

    @Test
    public void testInvalidChoice() {
        RandomState rng = new RandomState(1);
        Assert.assertThrows(SizeException.class, () -> rng.choice(new double[0]));
        Assert.assertThrows(SizeException.class, () -> rng.choice(new double[] {0, 0}));
        Assert.assertThrows(SizeException.class, () -> rng.choice(new double[] {1, -1}));
    }
}
