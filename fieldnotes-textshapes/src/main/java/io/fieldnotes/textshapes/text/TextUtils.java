package io.fieldnotes.textshapes.text;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Text processing utilities shared by all analyzers.
///
/// ## Tokens
///
/// A token is a maximal run of letters and digits, optionally followed by an
/// apostrophe suffix (`don't`, `client's`). Tokens are lower-cased with
/// [Locale#ROOT] so tokenization never depends on the platform locale.
///
/// ## Sentences
///
/// Sentences are the non-blank segments between runs of `.`, `!` and `?`.
/// A non-blank text always has at least one sentence.
///
/// ## Usage
/// ```java
/// List<String> tokens = TextUtils.tokenize("Staff weren't helpful.");
/// // [staff, weren't, helpful]
///
/// TextUtils.Statistics stats = TextUtils.computeStatistics(new double[]{3, 5, 7});
/// ```
public final class TextUtils {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+(?:['’][\\p{L}]+)?");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]+");

    private TextUtils() {} // Utility class

    /// Splits text into lower-cased word tokens.
    ///
    /// @param text the text to tokenize
    /// @return tokens in text order, possibly empty
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            tokens.add(m.group().toLowerCase(Locale.ROOT).replace('’', '\''));
        }
        return tokens;
    }

    /// Tokenizes and drops stop words.
    ///
    /// @param text the text to tokenize
    /// @param stopWords lower-cased words to drop
    /// @return content tokens in text order
    public static List<String> contentTokens(String text, Set<String> stopWords) {
        List<String> tokens = tokenize(text);
        tokens.removeIf(stopWords::contains);
        return tokens;
    }

    /// Counts word tokens.
    public static int wordCount(String text) {
        return tokenize(text).size();
    }

    /// Splits text into sentences.
    ///
    /// @param text the text to split
    /// @return trimmed, non-blank sentences
    public static List<String> sentences(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null) {
            return sentences;
        }
        for (String part : SENTENCE_BREAK.split(text)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                sentences.add(trimmed);
            }
        }
        if (sentences.isEmpty() && !text.isBlank()) {
            sentences.add(text.trim());
        }
        return sentences;
    }

    /// Normalizes text for duplicate detection: tokens joined by single spaces.
    public static String normalize(String text) {
        return String.join(" ", tokenize(text));
    }

    /// Counts tokens preserving first-seen order.
    ///
    /// @param tokens tokens to count
    /// @return insertion-ordered counts
    public static Map<String, Integer> countInOrder(Collection<String> tokens) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return counts;
    }

    /// Returns the `limit` most frequent entries, ties kept in first-seen order.
    ///
    /// @param counts insertion-ordered counts
    /// @param limit maximum number of entries
    /// @return ranked term counts
    public static List<TermCount> topCounts(Map<String, Integer> counts, int limit) {
        List<TermCount> ranked = new ArrayList<>(counts.size());
        counts.forEach((term, count) -> ranked.add(new TermCount(term, count)));
        // List.sort is stable, so equal counts stay in insertion order
        ranked.sort((a, b) -> Integer.compare(b.count(), a.count()));
        return ranked.size() > limit ? new ArrayList<>(ranked.subList(0, limit)) : ranked;
    }

    /// Computes cosine similarity between two vectors.
    ///
    /// Zero vectors have similarity 0 with everything.
    ///
    /// @throws IllegalArgumentException if vectors have different dimensions
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same dimension");
        }
        double dot = 0.0, normA = 0.0, normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double sim = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, sim));
    }

    /// Cosine distance, `1 - cosineSimilarity(a, b)`.
    public static double cosineDistance(double[] a, double[] b) {
        return 1.0 - cosineSimilarity(a, b);
    }

    /// Returns a unit-length copy of a vector, or a zero copy for a zero vector.
    public static double[] normalizeL2(double[] v) {
        double norm = 0.0;
        for (double x : v) norm += x * x;
        double[] out = Arrays.copyOf(v, v.length);
        if (norm == 0.0) {
            return out;
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < out.length; i++) {
            out[i] /= norm;
        }
        return out;
    }

    /// Jaccard overlap of two sets; 0 when both are empty.
    public static <T> double jaccard(Set<T> a, Set<T> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (T t : a) {
            if (b.contains(t)) intersection++;
        }
        int union = a.size() + b.size() - intersection;
        return union == 0 ? 0.0 : (double) intersection / union;
    }

    /// Computes basic statistics for an array of values.
    ///
    /// The standard deviation is the population form, so a single value or a
    /// constant array has `stdDev == 0`.
    ///
    /// @param values input values
    /// @return min, mean, max and standard deviation; all zero for an empty array
    public static Statistics computeStatistics(double[] values) {
        if (values.length == 0) {
            return new Statistics(0.0, 0.0, 0.0, 0.0);
        }
        double sum = 0.0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double v : values) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / values.length;
        double sumSq = 0.0;
        for (double v : values) {
            double diff = v - mean;
            sumSq += diff * diff;
        }
        return new Statistics(min, mean, max, Math.sqrt(sumSq / values.length));
    }

    /// Median of the values; 0 for an empty array.
    public static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /// Clamps a value into `[lo, hi]`.
    public static double clamp(double value, double lo, double hi) {
        return Math.max(lo, Math.min(hi, value));
    }

    /// Statistical summary of a set of values.
    ///
    /// @param min minimum value
    /// @param mean arithmetic mean
    /// @param max maximum value
    /// @param stdDev population standard deviation
    public record Statistics(double min, double mean, double max, double stdDev) {

        /// Coefficient of variation, `stdDev / mean`; 0 when the mean is 0.
        public double coefficientOfVariation() {
            return mean == 0.0 ? 0.0 : stdDev / mean;
        }

        @Override
        public String toString() {
            return String.format("Statistics[min=%.2f, mean=%.2f, max=%.2f, stdDev=%.2f]",
                min, mean, max, stdDev);
        }
    }

    /// A term with its occurrence count.
    public record TermCount(String term, int count) {}
}
