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

import io.fieldnotes.textshapes.result.AnalysisWarning;
import io.fieldnotes.textshapes.result.ContentResult;
import io.fieldnotes.textshapes.result.SentimentResult;

import java.util.List;
import java.util.Objects;

/// Analysis of the answers to one question.
///
/// @param questionId the question
/// @param status how far the question could be analyzed
/// @param responseCount number of answers
/// @param content structure analysis, null unless status is OK
/// @param sentiment sentiment analysis, null unless status is OK
/// @param patterns response-quality counts
/// @param representatives longest, median and shortest answers; null without answers
/// @param warnings issues specific to this question
public record QuestionReport(
    String questionId,
    QuestionStatus status,
    int responseCount,
    ContentResult content,
    SentimentResult sentiment,
    ResponsePatterns patterns,
    RepresentativeResponses representatives,
    List<AnalysisWarning> warnings
) {
    public QuestionReport {
        Objects.requireNonNull(questionId, "questionId cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(patterns, "patterns cannot be null");
        warnings = List.copyOf(warnings);
    }

    public boolean isAnalyzed() {
        return status == QuestionStatus.OK;
    }
}
