package io.fieldnotes.textshapes.analyzers.sentiment;

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

import java.util.Objects;

/// Sentiment of a single record.
///
/// @param recordId the scored record
/// @param polarity in `[-1, 1]`
/// @param subjectivity in `[0, 1]`
/// @param emotion dominant emotion
/// @param intensity `|polarity|`
/// @param intensityLevel bucketed intensity
/// @param label five-way polarity label
/// @param confidence `min(1, words / 10)`
/// @param lowConfidence true for single-word or non-lexical text
/// @param matchedTerms number of lexicon words that contributed
public record RecordSentiment(
    String recordId,
    double polarity,
    double subjectivity,
    Emotion emotion,
    double intensity,
    IntensityLevel intensityLevel,
    SentimentLabel label,
    double confidence,
    boolean lowConfidence,
    int matchedTerms
) {
    public RecordSentiment {
        Objects.requireNonNull(recordId, "recordId cannot be null");
        if (polarity < -1.0 || polarity > 1.0) {
            throw new IllegalArgumentException("polarity out of range: " + polarity);
        }
        if (subjectivity < 0.0 || subjectivity > 1.0) {
            throw new IllegalArgumentException("subjectivity out of range: " + subjectivity);
        }
    }
}
