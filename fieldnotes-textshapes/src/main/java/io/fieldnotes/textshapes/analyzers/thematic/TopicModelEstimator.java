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

import java.util.Arrays;
import java.util.Random;

/// Probabilistic latent semantic analysis fitted by Expectation-Maximization.
///
/// ## Model
///
/// Each record `d` has a topic distribution `P(z|d)` and each topic a term
/// distribution `P(w|z)`. The likelihood of the count matrix `n(d,w)` is
/// ```
/// L = Σ_d Σ_w n(d,w) · log Σ_z P(z|d) · P(w|z)
/// ```
///
/// ## Algorithm
///
/// 1. **E-step**: `P(z|d,w) ∝ P(z|d) · P(w|z)`
/// 2. **M-step**: `P(w|z) ∝ Σ_d n(d,w) · P(z|d,w)` and
///    `P(z|d) ∝ Σ_w n(d,w) · P(z|d,w)`
///
/// Both distributions start from `new Random(seed)`, so a fixed seed gives
/// a fixed fit. Iteration stops when the relative change in log-likelihood
/// falls below the threshold, or at the iteration bound.
///
/// Records without any vocabulary term keep a uniform topic distribution and
/// so resolve to topic 0.
///
/// ## Thread Safety
///
/// Not thread-safe; use one instance per fit.
public final class TopicModelEstimator {

    /// Iteration bound for EM
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    /// Relative log-likelihood change treated as converged
    public static final double DEFAULT_CONVERGENCE_THRESHOLD = 1e-6;

    /// Small constant to avoid log(0)
    private static final double LOG_EPSILON = 1e-300;

    private final double[][] counts;
    private final int k;
    private final int vocabularySize;
    private final int maxIterations;
    private final double convergenceThreshold;

    private final double[][] docTopics;
    private final double[][] topicTerms;

    public TopicModelEstimator(double[][] counts, int k, long seed) {
        this(counts, k, seed, DEFAULT_MAX_ITERATIONS, DEFAULT_CONVERGENCE_THRESHOLD);
    }

    /// Creates an estimator.
    ///
    /// @param counts document-term counts
    /// @param k number of topics
    /// @param seed random seed for initialization
    /// @param maxIterations EM iteration bound
    /// @param convergenceThreshold relative log-likelihood change for convergence
    public TopicModelEstimator(double[][] counts, int k, long seed, int maxIterations, double convergenceThreshold) {
        if (counts == null || counts.length == 0) {
            throw new IllegalArgumentException("counts cannot be null or empty");
        }
        if (k < 1) {
            throw new IllegalArgumentException("k must be positive, got: " + k);
        }
        this.counts = counts;
        this.k = k;
        this.vocabularySize = counts[0].length;
        this.maxIterations = maxIterations;
        this.convergenceThreshold = convergenceThreshold;

        Random random = new Random(seed);
        this.topicTerms = new double[k][vocabularySize];
        for (int z = 0; z < k; z++) {
            for (int w = 0; w < vocabularySize; w++) {
                topicTerms[z][w] = 0.01 + random.nextDouble();
            }
            normalize(topicTerms[z]);
        }
        this.docTopics = new double[counts.length][k];
        for (int d = 0; d < counts.length; d++) {
            if (rowSum(counts[d]) == 0.0) {
                Arrays.fill(docTopics[d], 1.0 / k);
                continue;
            }
            for (int z = 0; z < k; z++) {
                docTopics[d][z] = 0.01 + random.nextDouble();
            }
            normalize(docTopics[d]);
        }
    }

    /// Runs EM until convergence or the iteration bound.
    public TopicModelResult fit() {
        double lastLogLikelihood = Double.NEGATIVE_INFINITY;
        boolean converged = false;
        int iterations;
        for (iterations = 0; iterations < maxIterations; iterations++) {
            double[][] nextTopicTerms = new double[k][vocabularySize];
            double[][] nextDocTopics = new double[counts.length][k];
            double logLikelihood = 0.0;
            double[] posterior = new double[k];

            for (int d = 0; d < counts.length; d++) {
                for (int w = 0; w < vocabularySize; w++) {
                    double n = counts[d][w];
                    if (n == 0.0) continue;
                    double denom = 0.0;
                    for (int z = 0; z < k; z++) {
                        posterior[z] = docTopics[d][z] * topicTerms[z][w];
                        denom += posterior[z];
                    }
                    logLikelihood += n * Math.log(Math.max(denom, LOG_EPSILON));
                    if (denom <= 0.0) continue;
                    for (int z = 0; z < k; z++) {
                        double r = n * posterior[z] / denom;
                        nextDocTopics[d][z] += r;
                        nextTopicTerms[z][w] += r;
                    }
                }
            }

            if (iterations > 0) {
                double change = Math.abs(logLikelihood - lastLogLikelihood);
                if (change <= convergenceThreshold * Math.max(1.0, Math.abs(logLikelihood))) {
                    lastLogLikelihood = logLikelihood;
                    converged = true;
                    break;
                }
            }
            lastLogLikelihood = logLikelihood;

            for (int z = 0; z < k; z++) {
                if (rowSum(nextTopicTerms[z]) > 0.0) {
                    normalize(nextTopicTerms[z]);
                    topicTerms[z] = nextTopicTerms[z];
                }
            }
            for (int d = 0; d < counts.length; d++) {
                if (rowSum(nextDocTopics[d]) > 0.0) {
                    normalize(nextDocTopics[d]);
                    docTopics[d] = nextDocTopics[d];
                }
            }
        }

        return new TopicModelResult(copy(docTopics), copy(topicTerms), lastLogLikelihood, iterations, converged);
    }

    private static double rowSum(double[] row) {
        double s = 0.0;
        for (double v : row) s += v;
        return s;
    }

    private static void normalize(double[] row) {
        double s = rowSum(row);
        if (s <= 0.0) return;
        for (int i = 0; i < row.length; i++) {
            row[i] /= s;
        }
    }

    private static double[][] copy(double[][] m) {
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            out[i] = Arrays.copyOf(m[i], m[i].length);
        }
        return out;
    }

    /// Finds the index of the maximum value; ties resolve to the lowest index.
    static int argmax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) best = i;
        }
        return best;
    }

    /// Result of a topic model fit.
    ///
    /// @param docTopics `P(z|d)` per record
    /// @param topicTerms `P(w|z)` per topic
    /// @param logLikelihood final log-likelihood
    /// @param iterations EM iterations run
    /// @param converged whether the fit converged before the bound
    public record TopicModelResult(
        double[][] docTopics,
        double[][] topicTerms,
        double logLikelihood,
        int iterations,
        boolean converged
    ) {
        /// Most probable topic per record, lowest index on ties.
        public int[] hardAssignments() {
            int[] out = new int[docTopics.length];
            for (int d = 0; d < docTopics.length; d++) {
                out[d] = argmax(docTopics[d]);
            }
            return out;
        }

        public int numTopics() {
            return topicTerms.length;
        }

        @Override
        public String toString() {
            return String.format("TopicModelResult[k=%d, LL=%.2f, iters=%d, converged=%s]",
                topicTerms.length, logLikelihood, iterations, converged);
        }
    }
}
