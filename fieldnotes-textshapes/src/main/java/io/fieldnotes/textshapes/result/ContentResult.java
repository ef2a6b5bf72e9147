package io.fieldnotes.textshapes.result;

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

import io.fieldnotes.textshapes.analyzers.content.ContentGroup;
import io.fieldnotes.textshapes.analyzers.content.ContentPatterns;
import io.fieldnotes.textshapes.analyzers.content.PartOfSpeech;
import io.fieldnotes.textshapes.text.TextUtils;
import io.fieldnotes.textshapes.text.TextUtils.TermCount;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Output of [io.fieldnotes.textshapes.analyzers.content.ContentAnalyzer].
///
/// @param envelope common result fields
/// @param recordCount number of records analyzed
/// @param wordCounts statistics of words per record
/// @param sentenceCounts statistics of sentences per record
/// @param lexicalDiversity unique tokens over total tokens
/// @param totalTokens all tokens in the corpus
/// @param uniqueTokens distinct tokens in the corpus
/// @param ngrams top n-grams keyed by `n`
/// @param posDistribution share of tokens per part of speech
/// @param categoryAssignments record id to category
/// @param categoryDistribution records per category, including `uncategorized`
/// @param topWords most frequent non-stop-words
/// @param questionDensity question marks per record
/// @param exclamationDensity exclamation marks per record
/// @param patterns n-gram repetition and repeated phrases
/// @param groups per-metadata-value breakdown, groups of two or more records in first-seen order
public record ContentResult(
    ResultEnvelope envelope,
    int recordCount,
    TextUtils.Statistics wordCounts,
    TextUtils.Statistics sentenceCounts,
    double lexicalDiversity,
    int totalTokens,
    int uniqueTokens,
    Map<Integer, List<TermCount>> ngrams,
    Map<PartOfSpeech, Double> posDistribution,
    Map<String, String> categoryAssignments,
    Map<String, Integer> categoryDistribution,
    List<TermCount> topWords,
    double questionDensity,
    double exclamationDensity,
    ContentPatterns patterns,
    List<ContentGroup> groups
) implements AnalysisResult {

    public ContentResult {
        Objects.requireNonNull(envelope, "envelope cannot be null");
        Map<Integer, List<TermCount>> ngramCopy = new LinkedHashMap<>();
        ngrams.forEach((n, list) -> ngramCopy.put(n, List.copyOf(list)));
        ngrams = Collections.unmodifiableMap(ngramCopy);
        Map<PartOfSpeech, Double> posCopy = new EnumMap<>(PartOfSpeech.class);
        posCopy.putAll(posDistribution);
        posDistribution = Collections.unmodifiableMap(posCopy);
        categoryAssignments = Collections.unmodifiableMap(new LinkedHashMap<>(categoryAssignments));
        categoryDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(categoryDistribution));
        topWords = List.copyOf(topWords);
        Objects.requireNonNull(patterns, "patterns cannot be null");
        groups = List.copyOf(groups);
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.CONTENT;
    }

    /// The group with the most records, earliest on ties; null without groups.
    public ContentGroup largestGroup() {
        ContentGroup largest = null;
        for (ContentGroup group : groups) {
            if (largest == null || group.recordCount() > largest.recordCount()) largest = group;
        }
        return largest;
    }

    /// Top n-grams of one size, empty if that size was not configured.
    public List<TermCount> ngrams(int n) {
        return ngrams.getOrDefault(n, List.of());
    }
}
