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

/// The structured output of one analyzer.
///
/// A closed union over the six analyzer kinds. Every variant is an immutable
/// record carrying analyzer-specific data plus a shared [ResultEnvelope].
///
/// ```java
/// AnalysisResult result = report.getResult(AnalyzerKind.SENTIMENT);
/// if (result instanceof SentimentResult sentiment) {
///     System.out.println("mean polarity " + sentiment.meanPolarity());
/// }
/// ```
public sealed interface AnalysisResult
    permits SentimentResult, ThematicResult, ContentResult, CodingResult, SurveyResult, StatisticsResult {

    /// The analyzer kind that produced this result.
    AnalyzerKind kind();

    /// Method, confidence, warnings and summary.
    ResultEnvelope envelope();
}
