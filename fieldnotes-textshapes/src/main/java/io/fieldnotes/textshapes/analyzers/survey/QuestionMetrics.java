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

/// Per-question figures used for comparison.
///
/// @param questionId the question
/// @param responseCount answers
/// @param meanPolarity mean lexicon polarity of the answers
/// @param polarityVariance population variance of polarity
/// @param meanWords mean words per answer
/// @param responseRate fraction of answers that are not non-responses
public record QuestionMetrics(
    String questionId,
    int responseCount,
    double meanPolarity,
    double polarityVariance,
    double meanWords,
    double responseRate
) {}
