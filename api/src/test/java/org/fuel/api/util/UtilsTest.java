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

package org.fuel.api.util;

import org.fuel.api.codec.ColorMode;
import org.fuel.api.exception.ConfigException;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

public class UtilsTest {

    @AfterMethod
    public void tearDown() {
        System.clearProperty(Utils.DEFAULT_SEED);
    }

    @Test
    public void testDefaultSeed() {
        System.setProperty(Utils.DEFAULT_SEED, " 123 ");
        Assert.assertEquals(Utils.getDefaultSeed(), 123L);
    }

    @Test(expectedExceptions = ConfigException.class)
    public void testInvalidDefaultSeed() {
        System.setProperty(Utils.DEFAULT_SEED, "seed");
        Utils.getDefaultSeed();
    }

    @Test(expectedExceptions = ConfigException.class)
    public void testDefaultSeedOutOfRange() {
        System.setProperty(Utils.DEFAULT_SEED, "4294967296");
        Utils.getDefaultSeed();
    }

    @Test
    public void testIndexOf() {
        String[] values = {"a", "b"};
        Assert.assertEquals(Utils.indexOf(values, "b"), 1);
        Assert.assertEquals(Utils.indexOf(values, "c"), -1);
    }

    @Test
    public void testColorMode() {
        Assert.assertEquals(ColorMode.fromValue("YCbCr"), ColorMode.YCBCR);
        Assert.assertEquals(ColorMode.CMYK.getChannels(), 4);
        Assert.assertThrows(ConfigException.class, () -> ColorMode.fromValue("HSV"));
    }
}
