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

import io.fieldnotes.textshapes.analyzers.sentiment.CategorySentiment;
import io.fieldnotes.textshapes.analyzers.sentiment.Emotion;
import io.fieldnotes.textshapes.analyzers.sentiment.IntensityLevel;
import io.fieldnotes.textshapes.analyzers.sentiment.RecordSentiment;
import io.fieldnotes.textshapes.analyzers.sentiment.SentimentLabel;
import io.fieldnotes.textshapes.analyzers.sentiment.TrendPoint;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Output of [io.fieldnotes.textshapes.analyzers.sentiment.SentimentAnalyzer].
///
/// @param envelope common result fields
/// @param records per-record scores in corpus order
/// @param meanPolarity mean record polarity
/// @param medianPolarity median record polarity
/// @param meanSubjectivity mean record subjectivity
/// @param volatility population variance of polarity
/// @param trend daily mean polarity, empty without timestamps
/// @param byCategory per-category aggregates, empty without categories
/// @param labelDistribution records per polarity label
/// @param emotionDistribution records per dominant emotion
/// @param intensityDistribution records per intensity level
/// @param sentimentShifts label changes along the time-ordered sequence
/// @param consistency `1 - shifts / (n - 1)`, 1 for fewer than two records
public record SentimentResult(
    ResultEnvelope envelope,
    List<RecordSentiment> records,
    double meanPolarity,
    double medianPolarity,
    double meanSubjectivity,
    double volatility,
    List<TrendPoint> trend,
    Map<String, CategorySentiment> byCategory,
    Map<SentimentLabel, Integer> labelDistribution,
    Map<Emotion, Integer> emotionDistribution,
    Map<IntensityLevel, Integer> intensityDistribution,
    int sentimentShifts,
    double consistency
) implements AnalysisResult {

    public SentimentResult {
        Objects.requireNonNull(envelope, "envelope cannot be null");
        records = List.copyOf(records);
        trend = List.copyOf(trend);
        byCategory = Collections.unmodifiableMap(new LinkedHashMap<>(byCategory));
        labelDistribution = Collections.unmodifiableMap(copyOf(labelDistribution, SentimentLabel.class));
        emotionDistribution = Collections.unmodifiableMap(copyOf(emotionDistribution, Emotion.class));
        intensityDistribution = Collections.unmodifiableMap(copyOf(intensityDistribution, IntensityLevel.class));
    }

    private static <E extends Enum<E>> Map<E, Integer> copyOf(Map<E, Integer> source, Class<E> type) {
        Map<E, Integer> copy = new EnumMap<>(type);
        copy.putAll(source);
        return copy;
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.SENTIMENT;
    }

    /// Looks up the score of one record.
    ///
    /// @return the score, or null if the record was not scored
    public RecordSentiment forRecord(String recordId) {
        for (RecordSentiment rs : records) {
            if (rs.recordId().equals(recordId)) return rs;
        }
        return null;
    }

    public boolean hasTrend() {
        return !trend.isEmpty();
    }
}
