package io.fieldnotes.textshapes.harness;

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
import io.fieldnotes.textshapes.result.AnalysisResult;
import io.fieldnotes.textshapes.result.AnalyzerKind;

/// Shared capability of the analyzers: turn a corpus into one result.
///
/// ## Purpose
///
/// Every analyzer reads a [TextCorpus] and produces an immutable
/// [AnalysisResult] of its kind. Analyzers never mutate the corpus and never
/// read each other's output, so the [AnalysisOrchestrator] may run them in any
/// order or concurrently with identical results.
///
/// ## Implementations
///
/// The set is closed; the orchestrator dispatches on [AnalyzerKind]:
///
/// | Kind | Implementation |
/// |------|----------------|
/// | content | [io.fieldnotes.textshapes.analyzers.content.ContentAnalyzer] |
/// | sentiment | [io.fieldnotes.textshapes.analyzers.sentiment.SentimentAnalyzer] |
/// | thematic | [io.fieldnotes.textshapes.analyzers.thematic.ThematicAnalyzer] |
/// | coding | [io.fieldnotes.textshapes.analyzers.coding.KeywordCodingAnalyzer] |
/// | survey | [io.fieldnotes.textshapes.analyzers.survey.SurveyAnalyzer] |
/// | statistics | [io.fieldnotes.textshapes.analyzers.statistics.QualitativeStatistics] |
///
/// ## Thread Safety
///
/// Implementations hold only immutable configuration and are safe to share.
///
/// @param <R> the result type produced
public interface CorpusAnalyzer<R extends AnalysisResult> {

    /// Returns the kind of result this analyzer produces.
    AnalyzerKind getAnalyzerKind();

    /// Analyzes the corpus.
    ///
    /// @param corpus a non-empty corpus
    /// @return the result
    /// @throws io.fieldnotes.textshapes.ValidationException if the corpus is empty
    R run(TextCorpus corpus);

    /// Returns a human-readable description of this analyzer.
    default String getDescription() {
        return getAnalyzerKind().mnemonic() + " analyzer";
    }
}
