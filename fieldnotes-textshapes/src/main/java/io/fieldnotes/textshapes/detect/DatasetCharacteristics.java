package io.fieldnotes.textshapes.detect;

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

/// Measured properties of a dataset.
///
/// Ratios are the share of records showing the marker at least once.
///
/// @param recordCount records
/// @param meanWords mean words per record
/// @param lengthVariation coefficient of variation of words per record
/// @param lexicalDiversity distinct tokens over all tokens
/// @param uniqueRatio distinct normalized texts over records
/// @param grouped whether answers are grouped by question
/// @param questionCount number of question groups, 0 without grouping
/// @param hasTimestamps any record has a timestamp
/// @param hasCategories any record has a category
/// @param interviewMarkerRatio dialogue markers such as `Interviewer:` or `tell me about`
/// @param surveyPatternRatio rating and agreement language
/// @param opinionRatio opinion words such as `think` or `feel`
/// @param structureRatio lists, labels and ordinal markers
/// @param causalRatio causal language such as `because` or `due to`
/// @param sampleSize sample-size category
public record DatasetCharacteristics(
    int recordCount,
    double meanWords,
    double lengthVariation,
    double lexicalDiversity,
    double uniqueRatio,
    boolean grouped,
    int questionCount,
    boolean hasTimestamps,
    boolean hasCategories,
    double interviewMarkerRatio,
    double surveyPatternRatio,
    double opinionRatio,
    double structureRatio,
    double causalRatio,
    SampleSize sampleSize
) {}
