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

package org.fuel.integration.util;

import org.fuel.api.batch.Batch;
import org.fuel.api.ndarray.NDArray;
import org.testng.Assert;

public final class Assertions {

    private static final double RTOL = 1e-5;
    private static final double ATOL = 1e-3;

    private Assertions() {}

    private static String message(Object actual, Object expected, String prefix) {
        StringBuilder sb = new StringBuilder(100);
        if (prefix != null) {
            sb.append(prefix);
        }
        sb.append(System.lineSeparator())
                .append("Expected: ")
                .append(expected)
                .append(System.lineSeparator())
                .append("Actual: ")
                .append(actual);
        return sb.toString();
    }

    public static void assertAlmostEquals(double actual, double expected) {
        if (Math.abs(actual - expected) > (ATOL + RTOL * Math.abs(expected))) {
            throw new AssertionError(message(actual, expected, null));
        }
    }

    public static void assertAlmostEquals(NDArray actual, NDArray expected) {
        if (!actual.getShape().equals(expected.getShape())) {
            throw new AssertionError(
                    message(actual.getShape(), expected.getShape(), "The shapes differ"));
        }
        double[] a = actual.toDoubleArray();
        double[] b = expected.toDoubleArray();
        for (int i = 0; i < a.length; ++i) {
            if (Math.abs(a[i] - b[i]) > (ATOL + RTOL * Math.abs(b[i]))) {
                throw new AssertionError("Expected: " + b[i] + " but got " + a[i] + " at " + i);
            }
        }
    }

    /**
     * Asserts that two arrays have the same type, shape and values, bit for bit.
     *
     * @param actual the actual array
     * @param expected the expected array
     */
    public static void assertIdentical(NDArray actual, NDArray expected) {
        Assert.assertTrue(
                actual.contentEquals(expected), message(actual, expected, "Arrays differ"));
    }

    /**
     * Asserts that two batches hold identical examples in the same order, whatever their form.
     *
     * @param actual the actual batch
     * @param expected the expected batch
     */
    public static void assertIdentical(Batch actual, Batch expected) {
        Assert.assertEquals(
                actual.size(), expected.size(), message(actual, expected, "Batch sizes differ"));
        for (int i = 0; i < actual.size(); ++i) {
            assertIdentical(actual.get(i), expected.get(i));
        }
    }
}
