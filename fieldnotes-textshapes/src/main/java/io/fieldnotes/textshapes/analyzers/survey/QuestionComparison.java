package io.fieldnotes.textshapes.analyzers.survey;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Cross-question comparison. Questions without answers are left out.
///
/// @param metrics per-question figures in dataset order
/// @param bySentiment question ids, most positive first
/// @param byLength question ids, most detailed first
/// @param mostPositive highest mean polarity, or null without answered questions
/// @param mostNegative lowest mean polarity, or null
/// @param mostDetailed highest mean words per answer, or null
/// @param differences pairwise differences, largest sentiment difference first
public record QuestionComparison(
    Map<String, QuestionMetrics> metrics,
    List<String> bySentiment,
    List<String> byLength,
    String mostPositive,
    String mostNegative,
    String mostDetailed,
    List<QuestionDifference> differences
) {
    public QuestionComparison {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        bySentiment = List.copyOf(bySentiment);
        byLength = List.copyOf(byLength);
        differences = List.copyOf(differences);
    }

    /// Most contrasting pair, or null with fewer than two answered questions.
    public QuestionDifference mostContrasting() {
        return differences.isEmpty() ? null : differences.get(0);
    }
}
