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

/// Offline qualitative analysis of free-text research responses.
///
/// ## Packages
///
/// - [io.fieldnotes.textshapes.corpus] - records, corpora and survey datasets
/// - [io.fieldnotes.textshapes.analyzers] - the six analyzers
/// - [io.fieldnotes.textshapes.detect] - dataset profiling and method recommendation
/// - [io.fieldnotes.textshapes.harness] - the orchestrator that runs analyzers and merges results
/// - [io.fieldnotes.textshapes.result] - the result union, envelope and merged report
/// - [io.fieldnotes.textshapes.config] - analysis options
/// - [io.fieldnotes.textshapes.report] - JSON rendering of results
///
/// ## Usage
///
/// ```java
/// TextCorpus corpus = TextCorpus.builder("interviews")
///     .add("I loved how quickly the clinic responded.")
///     .add("Waiting times were frustrating and too long.")
///     .build();
///
/// AnalysisReport report = new AnalysisOrchestrator()
///     .generateReport(corpus, AnalysisOptions.defaults());
/// System.out.println(report.getSummary());
/// ```
package io.fieldnotes.textshapes;
