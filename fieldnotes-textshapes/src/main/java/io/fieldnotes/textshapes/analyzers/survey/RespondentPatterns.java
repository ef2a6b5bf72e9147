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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// Respondent-level view of a survey.
///
/// @param respondentKey metadata key used to identify respondents
/// @param respondents respondents with at least one answer, in first-seen order
/// @param excludedRespondents roster entries with no answers
/// @param unattributedResponses answers without the respondent key
/// @param meanEngagement mean engagement over `respondents`, 0 when empty
/// @param levelCounts respondents per level
public record RespondentPatterns(
    String respondentKey,
    List<RespondentEngagement> respondents,
    List<String> excludedRespondents,
    int unattributedResponses,
    double meanEngagement,
    Map<EngagementLevel, Integer> levelCounts
) {
    public RespondentPatterns {
        respondents = List.copyOf(respondents);
        excludedRespondents = List.copyOf(excludedRespondents);
        Map<EngagementLevel, Integer> counts = new EnumMap<>(EngagementLevel.class);
        counts.putAll(levelCounts);
        levelCounts = Collections.unmodifiableMap(counts);
    }

    public RespondentEngagement respondent(String respondentId) {
        for (RespondentEngagement r : respondents) {
            if (r.respondentId().equals(respondentId)) return r;
        }
        return null;
    }
}
