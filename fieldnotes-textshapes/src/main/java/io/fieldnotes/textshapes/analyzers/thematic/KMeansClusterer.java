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

import io.fieldnotes.textshapes.text.TextUtils;

import java.util.Arrays;
import java.util.Random;

/// Seeded k-means with cosine distance.
///
/// ## Algorithm
///
/// 1. **Seeding**: k-means++ driven by `new Random(seed)`. When every
///    remaining point is at distance 0 from the chosen centroids (duplicate
///    texts), the lowest unchosen index is taken.
/// 2. **Assignment**: each point joins its nearest centroid; equal distances
///    go to the lowest centroid index.
/// 3. **Repair**: an empty cluster takes the member farthest from the
///    centroid of the largest cluster (lowest point index on ties), so every
///    cluster is non-empty whenever `n >= k`.
/// 4. **Update**: centroids become member means.
///
/// Iteration stops when assignments no longer change or after
/// `maxIterations` passes. Without convergence the lowest-inertia assignment
/// seen is returned with `converged == false`.
///
/// ## Usage
/// ```java
/// KMeansClusterer clusterer = new KMeansClusterer(unitVectors, 3, 42L);
/// ClusteringResult result = clusterer.fit();
/// int[] assignments = result.assignments();
/// ```
///
/// ## Thread Safety
///
/// Not thread-safe; use one instance per fit.
public final class KMeansClusterer {

    /// Iteration bound for assignment updates
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private final double[][] vectors;
    private final int k;
    private final int maxIterations;
    private final Random random;

    public KMeansClusterer(double[][] vectors, int k, long seed) {
        this(vectors, k, seed, DEFAULT_MAX_ITERATIONS);
    }

    /// Creates a clusterer.
    ///
    /// @param vectors points to cluster, one row per record
    /// @param k number of clusters, `1 <= k <= vectors.length`
    /// @param seed random seed for centroid seeding
    /// @param maxIterations iteration bound
    public KMeansClusterer(double[][] vectors, int k, long seed, int maxIterations) {
        if (vectors == null || vectors.length == 0) {
            throw new IllegalArgumentException("vectors cannot be null or empty");
        }
        if (k < 1 || k > vectors.length) {
            throw new IllegalArgumentException("k must be in [1, " + vectors.length + "], got: " + k);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive, got: " + maxIterations);
        }
        this.vectors = vectors;
        this.k = k;
        this.maxIterations = maxIterations;
        this.random = new Random(seed);
    }

    /// Runs k-means to convergence or the iteration bound.
    public ClusteringResult fit() {
        double[][] centroids = seedCentroids();
        int[] assignments = null;
        int[] best = null;
        double[][] bestCentroids = null;
        double bestInertia = Double.POSITIVE_INFINITY;
        boolean converged = false;
        int iterations = 0;

        while (iterations < maxIterations) {
            iterations++;
            int[] next = assign(centroids);
            repairEmptyClusters(next, centroids);
            if (assignments != null && Arrays.equals(next, assignments)) {
                converged = true;
                break;
            }
            assignments = next;
            centroids = updateCentroids(assignments);
            double inertia = inertia(assignments, centroids);
            if (inertia < bestInertia) {
                bestInertia = inertia;
                best = Arrays.copyOf(assignments, assignments.length);
                bestCentroids = copy(centroids);
            }
        }

        if (converged) {
            return new ClusteringResult(assignments, centroids, iterations, true, inertia(assignments, centroids));
        }
        return new ClusteringResult(best, bestCentroids, iterations, false, bestInertia);
    }

    private double[][] seedCentroids() {
        int n = vectors.length;
        double[][] centroids = new double[k][];
        boolean[] chosen = new boolean[n];
        int first = random.nextInt(n);
        centroids[0] = Arrays.copyOf(vectors[first], vectors[first].length);
        chosen[first] = true;

        double[] nearest = new double[n];
        Arrays.fill(nearest, Double.POSITIVE_INFINITY);
        for (int c = 1; c < k; c++) {
            double total = 0.0;
            for (int i = 0; i < n; i++) {
                double d = TextUtils.cosineDistance(vectors[i], centroids[c - 1]);
                nearest[i] = Math.min(nearest[i], d);
                if (!chosen[i]) total += nearest[i] * nearest[i];
            }
            int pick = -1;
            if (total > 0.0) {
                double r = random.nextDouble() * total;
                double cumulative = 0.0;
                for (int i = 0; i < n; i++) {
                    if (chosen[i]) continue;
                    cumulative += nearest[i] * nearest[i];
                    if (cumulative >= r && nearest[i] > 0.0) {
                        pick = i;
                        break;
                    }
                }
            }
            if (pick < 0) {
                for (int i = 0; i < n; i++) {
                    if (!chosen[i]) {
                        pick = i;
                        break;
                    }
                }
            }
            centroids[c] = Arrays.copyOf(vectors[pick], vectors[pick].length);
            chosen[pick] = true;
        }
        return centroids;
    }

    private int[] assign(double[][] centroids) {
        int[] assignments = new int[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            int bestCluster = 0;
            double bestDistance = TextUtils.cosineDistance(vectors[i], centroids[0]);
            for (int c = 1; c < k; c++) {
                double d = TextUtils.cosineDistance(vectors[i], centroids[c]);
                if (d < bestDistance) {
                    bestDistance = d;
                    bestCluster = c;
                }
            }
            assignments[i] = bestCluster;
        }
        return assignments;
    }

    /// Moves a point into every empty cluster, taken from the largest cluster.
    private void repairEmptyClusters(int[] assignments, double[][] centroids) {
        int[] sizes = new int[k];
        for (int a : assignments) sizes[a]++;
        for (int empty = 0; empty < k; empty++) {
            if (sizes[empty] > 0) continue;
            int donor = 0;
            for (int c = 1; c < k; c++) {
                if (sizes[c] > sizes[donor]) donor = c;
            }
            int farthest = -1;
            double farthestDistance = -1.0;
            for (int i = 0; i < assignments.length; i++) {
                if (assignments[i] != donor) continue;
                double d = TextUtils.cosineDistance(vectors[i], centroids[donor]);
                if (d > farthestDistance) {
                    farthestDistance = d;
                    farthest = i;
                }
            }
            assignments[farthest] = empty;
            sizes[donor]--;
            sizes[empty]++;
            centroids[empty] = Arrays.copyOf(vectors[farthest], vectors[farthest].length);
        }
    }

    private double[][] updateCentroids(int[] assignments) {
        int dims = vectors[0].length;
        double[][] centroids = new double[k][dims];
        int[] sizes = new int[k];
        for (int i = 0; i < vectors.length; i++) {
            int c = assignments[i];
            sizes[c]++;
            for (int d = 0; d < dims; d++) {
                centroids[c][d] += vectors[i][d];
            }
        }
        for (int c = 0; c < k; c++) {
            if (sizes[c] == 0) continue;
            for (int d = 0; d < dims; d++) {
                centroids[c][d] /= sizes[c];
            }
        }
        return centroids;
    }

    private double inertia(int[] assignments, double[][] centroids) {
        double sum = 0.0;
        for (int i = 0; i < vectors.length; i++) {
            sum += TextUtils.cosineDistance(vectors[i], centroids[assignments[i]]);
        }
        return sum;
    }

    private static double[][] copy(double[][] m) {
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            out[i] = Arrays.copyOf(m[i], m[i].length);
        }
        return out;
    }

    /// Result of a k-means fit.
    ///
    /// @param assignments cluster index per point
    /// @param centroids cluster means
    /// @param iterations assignment passes run
    /// @param converged whether assignments stabilized before the bound
    /// @param inertia sum of cosine distances to assigned centroids
    public record ClusteringResult(
        int[] assignments,
        double[][] centroids,
        int iterations,
        boolean converged,
        double inertia
    ) {
        /// Number of points per cluster.
        public int[] clusterSizes() {
            int[] sizes = new int[centroids.length];
            for (int a : assignments) sizes[a]++;
            return sizes;
        }

        @Override
        public String toString() {
            return String.format("ClusteringResult[k=%d, iters=%d, converged=%s, inertia=%.4f, sizes=%s]",
                centroids.length, iterations, converged, inertia, Arrays.toString(clusterSizes()));
        }
    }
}
