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

import java.util.Arrays;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.core.RandomProviderDefaultState;
import org.apache.commons.rng.core.source32.MersenneTwister;
import org.apache.commons.rng.core.util.NumberFactory;
import org.fuel.api.exception.SizeException;

/**
 * A Mersenne Twister (MT19937) random number generator.
 *
 * <p>Seeding and every derived draw follow the classic NumPy {@code RandomState}, so the same seed
 * yields the same sequence of doubles, bounded integers, Bernoulli outcomes and weighted choices.
 * The 32-bit outputs come from the Commons RNG {@link MersenneTwister}; the samplers on top of it
 * are NumPy's. Instances are not thread safe; each one is owned by a single transform or caller.
 */
public class RandomState {

    private static final int N = 624;

    private RestorableUniformRandomProvider source;

    /**
     * Creates a generator with the given seed.
     *
     * @param seed the seed, taken modulo 2<sup>32</sup>
     */
    public RandomState(long seed) {
        setSeed(seed);
    }

    /**
     * Resets the generator to the state produced by a seed.
     *
     * <p>NumPy seeds an integer with the single-word {@code init_genrand} routine, while the
     * {@link MersenneTwister} constructor runs {@code init_by_array}, which yields a different
     * state for the same value. The word state is therefore computed here and restored into the
     * provider.
     *
     * @param seed the seed, taken modulo 2<sup>32</sup>
     */
    public final void setSeed(long seed) {
        int[] state = new int[N + 1];
        state[0] = (int) seed;
        for (int i = 1; i < N; ++i) {
            state[i] = 1812433253 * (state[i - 1] ^ (state[i - 1] >>> 30)) + i;
        }
        // position past the end, the next output regenerates the whole block
        state[N] = N;

        MersenneTwister twister = new MersenneTwister(new int[] {(int) seed});
        byte[] saved = ((RandomProviderDefaultState) twister.saveState()).getState();
        byte[] words = NumberFactory.makeByteArray(state);
        System.arraycopy(words, 0, saved, 0, words.length);
        twister.restoreState(new RandomProviderDefaultState(saved));
        source = twister;
    }

    /**
     * Returns the next raw 32-bit output.
     *
     * @return an unsigned 32-bit value
     */
    public long nextUint32() {
        return source.nextInt() & 0xFFFFFFFFL;
    }

    /**
     * Returns a double in {@code [0, 1)} with 53 random bits. Consumes two 32-bit outputs.
     *
     * @return the next double
     */
    public double randomSample() {
        long a = nextUint32() >>> 5;
        long b = nextUint32() >>> 6;
        return (a * 67108864.0 + b) / 9007199254740992.0;
    }

    /**
     * Returns a double drawn uniformly from {@code [low, high)}.
     *
     * @param low the lower bound
     * @param high the upper bound
     * @return the next uniform value
     */
    public double uniform(double low, double high) {
        return low + (high - low) * randomSample();
    }

    /**
     * Returns an integer drawn uniformly from the closed interval {@code [low, high]}.
     *
     * <p>Draws 32-bit outputs masked to the smallest covering power of two and rejects values above
     * the range. An empty range ({@code low == high}) consumes no output.
     *
     * @param low the smallest value
     * @param high the largest value
     * @return the next integer
     * @throws SizeException if {@code high < low} or the range does not fit in 32 bits
     */
    public long randomIntegers(long low, long high) {
        long range = high - low;
        if (range < 0 || range > 0xFFFFFFFFL) {
            throw new SizeException("Invalid integer range [" + low + ", " + high + "]");
        }
        if (range == 0) {
            return low;
        }
        long mask = range;
        mask |= mask >>> 1;
        mask |= mask >>> 2;
        mask |= mask >>> 4;
        mask |= mask >>> 8;
        mask |= mask >>> 16;
        long value;
        do {
            value = nextUint32() & mask;
        } while (value > range);
        return low + value;
    }

    /**
     * Returns the outcome of one Bernoulli trial, computed by inversion from a single uniform
     * draw. A probability of exactly 0 consumes no draw; any other probability, 1 included,
     * consumes one double.
     *
     * @param p the probability of returning {@code true}
     * @return the outcome of the trial
     */
    public boolean bernoulli(double p) {
        if (p == 0) {
            return false;
        }
        if (p <= 0.5) {
            return inversion(p);
        }
        return !inversion(1.0 - p);
    }

    private boolean inversion(double p) {
        double qn = Math.exp(Math.log(1.0 - p));
        return randomSample() > qn;
    }

    /**
     * Returns an index drawn with the given non-negative weights. Consumes one double.
     *
     * @param weights the weight of each index, not necessarily normalized
     * @return the chosen index
     * @throws SizeException if the weights are empty, negative or sum to zero
     */
    public int choice(double[] weights) {
        if (weights.length == 0) {
            throw new SizeException("Cannot choose from an empty set of weights");
        }
        double[] cdf = new double[weights.length];
        double total = 0;
        for (int i = 0; i < weights.length; ++i) {
            if (weights[i] < 0 || Double.isNaN(weights[i])) {
                throw new SizeException("Invalid weight " + weights[i] + " at index " + i);
            }
            total += weights[i];
            cdf[i] = total;
        }
        if (!(total > 0) || Double.isInfinite(total)) {
            throw new SizeException("Weights must have a positive finite sum, got " + total);
        }
        for (int i = 0; i < cdf.length; ++i) {
            cdf[i] /= total;
        }
        double u = randomSample();
        int index = Arrays.binarySearch(cdf, u);
        if (index < 0) {
            return -index - 1;
        }
        // first position whose cumulative weight is strictly greater than u
        while (index < cdf.length && cdf[index] <= u) {
            ++index;
        }
        return Math.min(index, cdf.length - 1);
    }
}
