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

/// Absolute differences between two questions.
///
/// @param first question earlier in dataset order
/// @param second question later in dataset order
/// @param sentimentDifference |Δ mean polarity|
/// @param wordCountDifference |Δ mean words|
/// @param responseRateDifference |Δ response rate|
public record QuestionDifference(
    String first,
    String second,
    double sentimentDifference,
    double wordCountDifference,
    double responseRateDifference
) {}
