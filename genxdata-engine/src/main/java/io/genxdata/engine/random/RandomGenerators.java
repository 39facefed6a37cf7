package io.genxdata.engine.random;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.DiscreteProbabilityCollectionSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.List;

/**
 * Random number generators for column strategies, based on Apache Commons RNG.
 *
 * <p>Every generator created here is restorable, so strategies can remember their
 * initial state and return to it on reset.
 */
public final class RandomGenerators {

    /**
     * Available PRNG algorithms.
     * XO_SHI_RO_256_PP is the default for its statistical quality and speed.
     */
    public enum Algorithm {
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * Creates a new random number generator with the specified algorithm and seed.
     *
     * @param algorithm The PRNG algorithm to use
     * @param seed The seed for deterministic random generation
     * @return A restorable uniform random provider
     */
    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return (RestorableUniformRandomProvider) algorithm.getSource().create(seed);
    }

    /// Creates a generator with the default algorithm.
    public static RestorableUniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /// Creates a generator from the given seed, or from a fresh random seed when it is null.
    public static RestorableUniformRandomProvider create(Long seed) {
        return create(seed != null ? seed : newSeed());
    }

    /// @return a seed drawn from the system entropy source
    public static long newSeed() {
        return RandomSource.createLong();
    }

    /**
     * Shuffles a list in-place using the Fisher-Yates algorithm.
     *
     * @param <T> The type of elements in the list
     * @param list The list to shuffle
     * @param rng The random number generator
     */
    public static <T> void shuffle(List<T> list, UniformRandomProvider rng) {
        int size = list.size();
        for (int i = size - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            T temp = list.get(i);
            list.set(i, list.get(j));
            list.set(j, temp);
        }
    }

    /// Returns a random permutation of {@code 0..size-1}.
    public static int[] permutation(int size, UniformRandomProvider rng) {
        int[] order = new int[size];
        for (int i = 0; i < size; i++) {
            order[i] = i;
        }
        for (int i = size - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            int temp = order[i];
            order[i] = order[j];
            order[j] = temp;
        }
        return order;
    }

    /**
     * Creates a sampler that returns the items of a list with the given relative weights.
     * The weights do not need to be normalized.
     */
    public static <T> DiscreteProbabilityCollectionSampler<T> weighted(
        List<T> items, double[] weights, UniformRandomProvider rng) {
        return new DiscreteProbabilityCollectionSampler<>(rng, items, weights);
    }
}
