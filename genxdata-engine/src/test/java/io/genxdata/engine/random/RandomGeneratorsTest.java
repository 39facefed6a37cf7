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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class RandomGeneratorsTest {

    @Test
    public void testSameSeedSameSequence() {
        assertThat(RandomGenerators.create(99L).nextLong()).isEqualTo(RandomGenerators.create(99L).nextLong());
    }

    @Test
    public void testPermutationContainsEveryIndex() {
        int[] order = RandomGenerators.permutation(20, RandomGenerators.create(1L));
        int[] sorted = order.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < 20; i++) {
            assertThat(sorted[i]).isEqualTo(i);
        }
    }

    @Test
    public void testShuffleIsDeterministicForSeed() {
        List<Integer> a = new ArrayList<>(List.of(1, 2, 3, 4, 5, 6, 7, 8));
        List<Integer> b = new ArrayList<>(a);
        RandomGenerators.shuffle(a, RandomGenerators.create(5L));
        RandomGenerators.shuffle(b, RandomGenerators.create(5L));
        assertThat(a).isEqualTo(b).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6, 7, 8);
    }

    @Test
    public void testWeightedNeverPicksZeroWeight() {
        var sampler = RandomGenerators.weighted(List.of("a", "b"), new double[]{1.0, 0.0}, RandomGenerators.create(3L));
        for (int i = 0; i < 100; i++) {
            assertThat(sampler.sample()).isEqualTo("a");
        }
    }
}
