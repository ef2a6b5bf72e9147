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

/// Response-quality counts for one question.
///
/// Every response falls in exactly one of `nonResponses`, `uncertain`,
/// `shortResponses`, `detailedResponses` or the unnamed medium band, checked
/// in that order. Positive and negative indicator counts are independent of
/// that banding.
///
/// @param total responses
/// @param validResponses responses that are not non-responses
/// @param nonResponses answers such as `n/a` or `skip`
/// @param uncertain answers such as `not sure`
/// @param shortResponses fewer than 3 words
/// @param detailedResponses 20 words or more
/// @param positiveIndicators responses containing an agreement word
/// @param negativeIndicators responses containing a disagreement word
/// @param meanWords mean words per response
/// @param meanCharacters mean characters per response
public record ResponsePatterns(
    int total,
    int validResponses,
    int nonResponses,
    int uncertain,
    int shortResponses,
    int detailedResponses,
    int positiveIndicators,
    int negativeIndicators,
    double meanWords,
    double meanCharacters
) {
    public static final ResponsePatterns EMPTY = new ResponsePatterns(0, 0, 0, 0, 0, 0, 0, 0, 0.0, 0.0);

    /// Valid responses over all responses; 0 without responses.
    public double responseRate() {
        return total == 0 ? 0.0 : (double) validResponses / total;
    }

    public double detailedRate() {
        return total == 0 ? 0.0 : (double) detailedResponses / total;
    }
}
