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

import io.fieldnotes.textshapes.analyzers.statistics.DataQuality;
import io.fieldnotes.textshapes.analyzers.statistics.DescriptiveSummary;
import io.fieldnotes.textshapes.analyzers.statistics.Insight;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Output of [io.fieldnotes.textshapes.analyzers.statistics.QualitativeStatistics].
///
/// @param envelope common result fields; confidence is the quality score over 100
/// @param descriptive descriptive statistics
/// @param quality data-quality assessment
/// @param insights observations, highest priority first
/// @param recommendations methodology recommendations
/// @param summarizedKinds analyzer results that were summarized, empty in standalone mode
public record StatisticsResult(
    ResultEnvelope envelope,
    DescriptiveSummary descriptive,
    DataQuality quality,
    List<Insight> insights,
    List<String> recommendations,
    Set<AnalyzerKind> summarizedKinds
) implements AnalysisResult {

    public StatisticsResult {
        Objects.requireNonNull(envelope, "envelope cannot be null");
        Objects.requireNonNull(descriptive, "descriptive cannot be null");
        Objects.requireNonNull(quality, "quality cannot be null");
        insights = List.copyOf(insights);
        recommendations = List.copyOf(recommendations);
        Set<AnalyzerKind> kinds = EnumSet.noneOf(AnalyzerKind.class);
        kinds.addAll(summarizedKinds);
        summarizedKinds = Collections.unmodifiableSet(kinds);
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.STATISTICS;
    }

    public boolean isSummarizing() {
        return !summarizedKinds.isEmpty();
    }
}
