package io.fieldnotes.textshapes.analyzers.statistics;

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

/// Data-quality assessment of a corpus.
///
/// ## Score
///
/// | Input | Formula |
/// |-------|---------|
/// | corpus only | `100 (0.4 adequacy + 0.3 answered + 0.3 uniqueness)` |
/// | with sentiment or content results | `100 (0.35 adequacy + 0.25 answered + 0.2 uniqueness + 0.2 analyzerConfidence)` |
///
/// where `adequacy` is the share of records with at least five words,
/// `answered` is one minus the share of stock non-responses, and
/// `uniqueness` is distinct normalized texts over records.
///
/// ## Sub-metrics
///
/// `usabilityRate` is the percentage of records that are neither
/// non-responses nor under three words. `richnessScore` is the percentage
/// that are neither repetitive (over five words, under half of them distinct)
/// nor low-information (over five words, under 30 % content words).
///
/// @param score overall score in `[0, 100]`
/// @param adequacy share of records with ≥ 5 words
/// @param answered share of records that are not non-responses
/// @param uniqueness distinct normalized texts over records
/// @param analyzerConfidence mean sentiment/content confidence, or null in standalone mode
/// @param usabilityRate percentage of usable records
/// @param richnessScore percentage of content-rich records
/// @param nonResponses stock non-response count
/// @param veryShort records under three words
/// @param repetitive repetitive records
/// @param lowInformation low-information records
/// @param duplicates records repeating an earlier normalized text
public record DataQuality(
    double score,
    double adequacy,
    double answered,
    double uniqueness,
    Double analyzerConfidence,
    double usabilityRate,
    double richnessScore,
    int nonResponses,
    int veryShort,
    int repetitive,
    int lowInformation,
    int duplicates
) {
    public DataQuality {
        if (Double.isNaN(score) || score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("score must be in [0, 100], got: " + score);
        }
    }

    public boolean usedAnalyzerConfidence() {
        return analyzerConfidence != null;
    }

    /// Completion rate in percent, the `answered` share scaled to 100.
    public double completionRate() {
        return answered * 100.0;
    }
}
