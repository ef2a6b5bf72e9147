package io.fieldnotes.textshapes.analyzers.coding;

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

import io.fieldnotes.textshapes.ValidationException;
import io.fieldnotes.textshapes.config.AnalysisOptions;
import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.harness.CorpusAnalyzer;
import io.fieldnotes.textshapes.result.AnalyzerKind;
import io.fieldnotes.textshapes.result.CodingResult;

import java.util.List;
import java.util.Map;

/// Runs keyword coding from configured `keyword_codes` in a fresh session.
///
/// Each call creates its own [QualitativeCoder], so runs are independent.
/// Callers that want to keep the session use [QualitativeCoder] directly.
public final class KeywordCodingAnalyzer implements CorpusAnalyzer<CodingResult> {

    private final Map<String, List<String>> keywordCodes;

    public KeywordCodingAnalyzer(AnalysisOptions options) {
        this.keywordCodes = options.keywordCodes();
    }

    @Override
    public AnalyzerKind getAnalyzerKind() {
        return AnalyzerKind.CODING;
    }

    @Override
    public String getDescription() {
        return "Keyword coding with frequency, co-occurrence and coverage";
    }

    /// @throws ValidationException if the corpus is empty or no keyword codes are configured
    @Override
    public CodingResult run(TextCorpus corpus) {
        corpus.requireNonEmpty("Coding");
        if (keywordCodes.isEmpty()) {
            throw new ValidationException("Coding requires keyword_codes");
        }
        QualitativeCoder coder = new QualitativeCoder("auto");
        coder.autoCodeKeywords(corpus, keywordCodes);
        return coder.report(corpus);
    }
}
