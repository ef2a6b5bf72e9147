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

import io.fieldnotes.textshapes.text.TextUtils;

import java.util.List;

/// Descriptive statistics of a corpus. Word figures are per record.
///
/// Standard deviation is the sample estimate (0 for one record); skewness is
/// 0 below three records.
///
/// @param recordCount records
/// @param totalWords word tokens over all records
/// @param totalCharacters characters over all records
/// @param meanWords mean words per record
/// @param medianWords median words per record
/// @param stdDevWords sample standard deviation of words per record
/// @param minWords fewest words in a record
/// @param maxWords most words in a record
/// @param q1Words first quartile of words per record
/// @param q3Words third quartile of words per record
/// @param skewness skewness of words per record
/// @param meanCharacters mean characters per record
/// @param sentenceCount sentences over all records
/// @param vocabularySize distinct tokens
/// @param lexicalDiversity distinct tokens over all tokens
/// @param hapaxLegomena tokens occurring exactly once
/// @param topWords most frequent non-stop words
public record DescriptiveSummary(
    int recordCount,
    long totalWords,
    long totalCharacters,
    double meanWords,
    double medianWords,
    double stdDevWords,
    double minWords,
    double maxWords,
    double q1Words,
    double q3Words,
    double skewness,
    double meanCharacters,
    int sentenceCount,
    int vocabularySize,
    double lexicalDiversity,
    int hapaxLegomena,
    List<TextUtils.TermCount> topWords
) {
    public DescriptiveSummary {
        topWords = List.copyOf(topWords);
    }

    public double interquartileRange() {
        return q3Words - q1Words;
    }
}
