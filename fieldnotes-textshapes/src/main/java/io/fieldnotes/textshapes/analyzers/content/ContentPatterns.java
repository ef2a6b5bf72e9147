package io.fieldnotes.textshapes.analyzers.content;

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

import java.util.List;

/// Repetition across the corpus.
///
/// Bigrams and trigrams are counted over stop-word-filtered tokens, within
/// each record.
///
/// @param totalBigrams bigram occurrences
/// @param uniqueBigrams distinct bigrams
/// @param uniqueTrigrams distinct trigrams
/// @param bigramRepetitionRate `(totalBigrams - uniqueBigrams) / totalBigrams`, 0 without bigrams
/// @param phrasePatterns sentence pairs within a record sharing several words, in record order
public record ContentPatterns(
    int totalBigrams,
    int uniqueBigrams,
    int uniqueTrigrams,
    double bigramRepetitionRate,
    List<PhrasePattern> phrasePatterns
) {

    public ContentPatterns {
        phrasePatterns = List.copyOf(phrasePatterns);
    }
}
