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

/// Engagement profile of one respondent.
///
/// @param respondentId the respondent
/// @param answered questions answered
/// @param questions questions in the survey
/// @param completionRate answered over questions
/// @param meanWords mean words per answer
/// @param consistency `1 - min(1, CV)` of the answer word counts
/// @param engagement `0.5 completion + 0.3 consistency + 0.2 min(1, meanWords / 20)`
/// @param level coarse level
public record RespondentEngagement(
    String respondentId,
    int answered,
    int questions,
    double completionRate,
    double meanWords,
    double consistency,
    double engagement,
    EngagementLevel level
) {}
