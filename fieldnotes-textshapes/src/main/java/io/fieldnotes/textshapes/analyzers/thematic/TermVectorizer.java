package io.fieldnotes.textshapes.analyzers.thematic;

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

import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.text.TextUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Term-frequency vectorization with one vocabulary per call.
///
/// The vocabulary holds every non-stop-word token of at least
/// [#MIN_TERM_LENGTH] characters, indexed in first-seen order across the
/// corpus. The same corpus and stop words always produce the same matrix.
public final class TermVectorizer {

    /// Shorter tokens are dropped from the vocabulary.
    public static final int MIN_TERM_LENGTH = 3;

    private TermVectorizer() {}

    /// Builds the document-term count matrix.
    ///
    /// @param corpus the corpus
    /// @param stopWords words left out of the vocabulary
    /// @return the matrix, one row per record in corpus order
    public static TermMatrix vectorize(TextCorpus corpus, Set<String> stopWords) {
        Map<String, Integer> index = new LinkedHashMap<>();
        List<List<String>> docs = new ArrayList<>(corpus.size());
        for (String text : corpus.texts()) {
            List<String> terms = new ArrayList<>();
            for (String token : TextUtils.tokenize(text)) {
                if (token.length() < MIN_TERM_LENGTH || stopWords.contains(token)) continue;
                index.putIfAbsent(token, index.size());
                terms.add(token);
            }
            docs.add(terms);
        }
        double[][] counts = new double[docs.size()][index.size()];
        for (int d = 0; d < docs.size(); d++) {
            for (String term : docs.get(d)) {
                counts[d][index.get(term)]++;
            }
        }
        return new TermMatrix(Collections.unmodifiableList(new ArrayList<>(index.keySet())), counts);
    }

    /// Document-term counts with their vocabulary.
    ///
    /// @param vocabulary terms in column order
    /// @param counts `counts[record][term]`
    public record TermMatrix(List<String> vocabulary, double[][] counts) {

        public int rows() {
            return counts.length;
        }

        public int dimensions() {
            return vocabulary.size();
        }

        /// Rows scaled to unit length; zero rows stay zero.
        public double[][] normalizedRows() {
            double[][] out = new double[counts.length][];
            for (int i = 0; i < counts.length; i++) {
                out[i] = TextUtils.normalizeL2(counts[i]);
            }
            return out;
        }

        /// Occurrence vector of one term across all records.
        public double[] column(int term) {
            double[] col = new double[counts.length];
            for (int d = 0; d < counts.length; d++) {
                col[d] = counts[d][term];
            }
            return col;
        }
    }
}
