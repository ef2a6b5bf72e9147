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

import io.fieldnotes.textshapes.analyzers.survey.QuestionComparison;
import io.fieldnotes.textshapes.analyzers.survey.QuestionReport;
import io.fieldnotes.textshapes.analyzers.survey.QuestionStatus;
import io.fieldnotes.textshapes.analyzers.survey.RespondentPatterns;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Output of [io.fieldnotes.textshapes.analyzers.survey.SurveyAnalyzer].
///
/// @param envelope common result fields; confidence is the share of fully analyzed questions
/// @param byQuestion per-question reports in dataset order
/// @param comparison cross-question comparison
/// @param respondentPatterns respondent engagement, or null when answers carry no respondent ids
public record SurveyResult(
    ResultEnvelope envelope,
    Map<String, QuestionReport> byQuestion,
    QuestionComparison comparison,
    RespondentPatterns respondentPatterns
) implements AnalysisResult {

    public SurveyResult {
        Objects.requireNonNull(envelope, "envelope cannot be null");
        Objects.requireNonNull(comparison, "comparison cannot be null");
        byQuestion = Collections.unmodifiableMap(new LinkedHashMap<>(byQuestion));
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.SURVEY;
    }

    /// Question ids with the given status, in dataset order.
    public List<String> questionsWithStatus(QuestionStatus status) {
        List<String> ids = new ArrayList<>();
        byQuestion.forEach((id, report) -> {
            if (report.status() == status) ids.add(id);
        });
        return ids;
    }
}
