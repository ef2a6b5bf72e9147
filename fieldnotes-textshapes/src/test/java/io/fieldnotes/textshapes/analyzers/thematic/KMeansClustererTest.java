package io.fieldnotes.textshapes.analyzers.thematic;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class KMeansClustererTest {

    private static final double[][] TWO_GROUPS = {
        {1.0, 0.0}, {0.98, 0.2}, {0.95, 0.31},
        {0.0, 1.0}, {0.2, 0.98}, {0.31, 0.95}
    };

    @Test
    void testSeparatesTwoDirections() {
        KMeansClusterer.ClusteringResult result = new KMeansClusterer(TWO_GROUPS, 2, 42L).fit();

        int[] a = result.assignments();
        assertEquals(a[0], a[1]);
        assertEquals(a[0], a[2]);
        assertEquals(a[3], a[4]);
        assertEquals(a[3], a[5]);
        assertNotEquals(a[0], a[3]);
        assertTrue(result.converged());
        assertArrayEquals(new int[]{3, 3}, result.clusterSizes());
    }

    @Test
    void testDeterministicPerSeed() {
        KMeansClusterer.ClusteringResult first = new KMeansClusterer(TWO_GROUPS, 3, 7L).fit();
        KMeansClusterer.ClusteringResult second = new KMeansClusterer(TWO_GROUPS, 3, 7L).fit();

        assertArrayEquals(first.assignments(), second.assignments());
        assertEquals(first.inertia(), second.inertia());
    }

    @Test
    void testDuplicatePointsFillEveryCluster() {
        double[][] same = new double[6][];
        for (int i = 0; i < same.length; i++) same[i] = new double[]{0.6, 0.8};

        KMeansClusterer.ClusteringResult result = new KMeansClusterer(same, 3, 42L).fit();

        for (int size : result.clusterSizes()) {
            assertTrue(size > 0);
        }
    }

    @Test
    void testIterationBoundReportsNonConvergence() {
        KMeansClusterer.ClusteringResult result = new KMeansClusterer(TWO_GROUPS, 2, 42L, 1).fit();

        assertFalse(result.converged());
        assertEquals(1, result.iterations());
        assertEquals(TWO_GROUPS.length, result.assignments().length);
    }

    @Test
    void testArguments() {
        assertThrows(IllegalArgumentException.class, () -> new KMeansClusterer(new double[0][], 1, 1L));
        assertThrows(IllegalArgumentException.class, () -> new KMeansClusterer(TWO_GROUPS, 7, 1L));
        assertThrows(IllegalArgumentException.class, () -> new KMeansClusterer(TWO_GROUPS, 0, 1L));
        assertThrows(IllegalArgumentException.class, () -> new KMeansClusterer(TWO_GROUPS, 2, 1L, 0));
    }
}
