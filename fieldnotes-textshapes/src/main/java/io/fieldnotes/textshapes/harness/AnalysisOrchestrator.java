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

import io.fieldnotes.textshapes.ValidationException;
import io.fieldnotes.textshapes.analyzers.coding.KeywordCodingAnalyzer;
import io.fieldnotes.textshapes.analyzers.content.ContentAnalyzer;
import io.fieldnotes.textshapes.analyzers.sentiment.SentimentAnalyzer;
import io.fieldnotes.textshapes.analyzers.statistics.QualitativeStatistics;
import io.fieldnotes.textshapes.analyzers.survey.SurveyAnalyzer;
import io.fieldnotes.textshapes.analyzers.thematic.ThematicAnalyzer;
import io.fieldnotes.textshapes.config.AnalysisOptions;
import io.fieldnotes.textshapes.corpus.SurveyDataset;
import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.detect.AutoDetector;
import io.fieldnotes.textshapes.detect.DatasetAssessment;
import io.fieldnotes.textshapes.detect.Recommendation;
import io.fieldnotes.textshapes.result.AnalysisReport;
import io.fieldnotes.textshapes.result.AnalysisResult;
import io.fieldnotes.textshapes.result.AnalyzerKind;
import io.fieldnotes.textshapes.result.FailedAnalysis;
import io.fieldnotes.textshapes.result.StatisticsResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/// Selects analyzers for a dataset, runs them, and merges their results.
///
/// ## Purpose
///
/// This is the outward entry point of the library. One call profiles the
/// input with [AutoDetector], decides which analyzers run, executes them
/// over the same read-only corpus, and returns one immutable
/// [AnalysisReport]. No state is kept between calls.
///
/// ## Modes
///
/// - **auto** (`analysis_type=auto`): runs every analyzer the assessment marks
///   RUN or DEGRADED. An analyzer that throws is logged and recorded as a
///   [FailedAnalysis]; the others still complete.
/// - **explicit** (one or more analyzer names): runs exactly those analyzers.
///   A kind below its minimum record count is rejected with a
///   [ValidationException] unless `allow_degraded` is set, and failures
///   propagate to the caller.
///
/// ## Ordering
///
/// Independent analyzers run in [AnalyzerKind] declaration order, or
/// concurrently when `parallel` is set. Results are always collected in that
/// order, so parallel output equals sequential output. Statistics runs last
/// and summarizes the results gathered before it.
///
/// ## Usage
///
/// ```java
/// AnalysisOrchestrator orchestrator = new AnalysisOrchestrator();
/// AnalysisReport report = orchestrator.generateReport(corpus, AnalysisOptions.defaults());
/// System.out.println(report.getSummary());
/// ```
///
/// ## Executors
///
/// The no-argument constructor creates a work-stealing pool for each parallel
/// call and shuts it down afterwards. An injected executor belongs to the
/// caller and is never shut down here.
public final class AnalysisOrchestrator {

    private static final Logger logger = LogManager.getLogger(AnalysisOrchestrator.class);

    private final ExecutorService executor;
    private final Map<AnalyzerKind, CorpusAnalyzer<?>> replacements;

    /// Creates an orchestrator that manages its own threads for parallel runs.
    public AnalysisOrchestrator() {
        this(null, List.of());
    }

    /// Creates an orchestrator that runs parallel work on a caller-owned executor.
    ///
    /// @param executor the executor to use when `parallel` is set
    public AnalysisOrchestrator(ExecutorService executor) {
        this(Objects.requireNonNull(executor, "executor cannot be null"), List.of());
    }

    /// Creates an orchestrator whose analyzers of the given kinds replace the
    /// built-in ones.
    ///
    /// @param executor caller-owned executor, or null for a pool per parallel call
    /// @param analyzers replacement analyzers, at most one per kind
    AnalysisOrchestrator(ExecutorService executor, List<? extends CorpusAnalyzer<?>> analyzers) {
        this.executor = executor;
        Map<AnalyzerKind, CorpusAnalyzer<?>> byKind = new EnumMap<>(AnalyzerKind.class);
        for (CorpusAnalyzer<?> analyzer : analyzers) {
            if (byKind.put(analyzer.getAnalyzerKind(), analyzer) != null) {
                throw new IllegalArgumentException("More than one " + analyzer.getAnalyzerKind() + " analyzer");
            }
        }
        this.replacements = byKind;
    }

    /// Analyzes a corpus as configured by the options.
    public AnalysisReport generateReport(TextCorpus corpus, AnalysisOptions options) {
        return detectAndRun(corpus, null, options);
    }

    /// Analyzes a survey as configured by the options.
    public AnalysisReport generateReport(SurveyDataset dataset, AnalysisOptions options) {
        return detectAndRun(dataset, null, options);
    }

    /// Profiles and analyzes a corpus.
    ///
    /// A corpus whose records carry `question_id` metadata is treated as a
    /// survey for the survey analyzer.
    ///
    /// @param corpus the records to analyze
    /// @param requested `auto`, a comma-separated list of analyzer names, or
    ///                  null to use the options' `analysis_type`
    /// @param options analysis options
    /// @return the merged report
    /// @throws ValidationException for an empty corpus, an unknown analyzer
    ///         name, or an explicit request below an analyzer's minimum
    public AnalysisReport detectAndRun(TextCorpus corpus, String requested, AnalysisOptions options) {
        Objects.requireNonNull(corpus, "corpus cannot be null");
        if (corpus.isEmpty()) {
            throw new ValidationException("Cannot analyze empty corpus '" + corpus.sourceId() + "'");
        }
        SurveyDataset dataset = corpus.hasMetadataKey(TextCorpus.QUESTION_ID_KEY)
            ? SurveyDataset.fromCorpus(corpus, TextCorpus.QUESTION_ID_KEY) : null;
        AnalysisOptions effective = resolve(options, requested);
        DatasetAssessment assessment = new AutoDetector(effective).assess(corpus);
        return execute(corpus, dataset, assessment, effective);
    }

    /// Profiles and analyzes a survey.
    ///
    /// The survey analyzer reads the dataset directly; every other analyzer
    /// reads all answers flattened into one corpus.
    ///
    /// @throws ValidationException if no question has any response
    public AnalysisReport detectAndRun(SurveyDataset dataset, String requested, AnalysisOptions options) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        if (dataset.totalResponses() == 0) {
            throw new ValidationException("Survey '" + dataset.surveyId() + "' has no responses");
        }
        AnalysisOptions effective = resolve(options, requested);
        DatasetAssessment assessment = new AutoDetector(effective).assess(dataset);
        return execute(dataset.flatten(), dataset, assessment, effective);
    }

    private static AnalysisOptions resolve(AnalysisOptions options, String requested) {
        Objects.requireNonNull(options, "options cannot be null");
        return requested == null ? options : options.toBuilder().analysisType(requested).build();
    }

    private AnalysisReport execute(TextCorpus corpus, SurveyDataset dataset, DatasetAssessment assessment,
                                   AnalysisOptions options) {
        long startTime = System.currentTimeMillis();
        AnalysisReport.Mode mode = options.isAuto() ? AnalysisReport.Mode.AUTO : AnalysisReport.Mode.EXPLICIT;
        List<AnalyzerKind> kinds = mode == AnalysisReport.Mode.AUTO
            ? assessment.selectedKinds() : explicitKinds(options, corpus.size());
        logger.debug("Running {} analyzers on {} records ({} mode): {}",
            kinds.size(), corpus.size(), mode, kinds);

        List<AnalyzerKind> independent = new ArrayList<>(kinds);
        independent.remove(AnalyzerKind.STATISTICS);

        Map<AnalyzerKind, AnalysisResult> results = new EnumMap<>(AnalyzerKind.class);
        List<FailedAnalysis> failures = new ArrayList<>();
        if (options.parallel() && independent.size() > 1) {
            runParallel(independent, corpus, dataset, options, mode, results, failures);
        } else {
            for (AnalyzerKind kind : independent) {
                try {
                    results.put(kind, dispatch(kind, corpus, dataset, options));
                } catch (RuntimeException e) {
                    recordFailure(kind, e, mode, failures);
                }
            }
        }

        if (kinds.contains(AnalyzerKind.STATISTICS)) {
            try {
                CorpusAnalyzer<?> replacement = replacements.get(AnalyzerKind.STATISTICS);
                results.put(AnalyzerKind.STATISTICS, replacement != null ? replacement.run(corpus)
                    : new QualitativeStatistics(options).generateComprehensiveSummary(corpus, new EnumMap<>(results)));
            } catch (RuntimeException e) {
                recordFailure(AnalyzerKind.STATISTICS, e, mode, failures);
            }
        }

        List<String> recommendations = recommendations(assessment, results);
        long processingTime = System.currentTimeMillis() - startTime;
        AnalysisReport report = new AnalysisReport(mode, assessment, results, failures, recommendations,
            processingTime);
        logger.info("Analyzed '{}' as {}: {} succeeded, {} failed in {}ms",
            corpus.sourceId(), assessment.profile(), results.size(), failures.size(), processingTime);
        return report;
    }

    private static List<AnalyzerKind> explicitKinds(AnalysisOptions options, int recordCount) {
        List<AnalyzerKind> kinds = new ArrayList<>(options.requestedKinds());
        for (AnalyzerKind kind : kinds) {
            if (!kind.meetsMinimum(recordCount)) {
                if (!options.allowDegraded()) {
                    throw new ValidationException(kind + " analysis requires at least " + kind.minimumRecords()
                        + " records, got " + recordCount + "; set allow_degraded to run it anyway");
                }
                logger.warn("Running {} below its minimum of {} records ({} given)",
                    kind, kind.minimumRecords(), recordCount);
            }
        }
        return kinds;
    }

    private void runParallel(List<AnalyzerKind> kinds, TextCorpus corpus, SurveyDataset dataset,
                             AnalysisOptions options, AnalysisReport.Mode mode,
                             Map<AnalyzerKind, AnalysisResult> results, List<FailedAnalysis> failures) {
        boolean ownsExecutor = executor == null;
        ExecutorService pool = ownsExecutor ? Executors.newWorkStealingPool() : executor;
        Map<AnalyzerKind, Future<AnalysisResult>> futures = new EnumMap<>(AnalyzerKind.class);
        try {
            for (AnalyzerKind kind : kinds) {
                futures.put(kind, pool.submit(() -> dispatch(kind, corpus, dataset, options)));
            }
            for (Map.Entry<AnalyzerKind, Future<AnalysisResult>> entry : futures.entrySet()) {
                try {
                    results.put(entry.getKey(), entry.getValue().get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException re) {
                        recordFailure(entry.getKey(), re, mode, failures);
                    } else if (cause instanceof Error error) {
                        throw error;
                    } else {
                        recordFailure(entry.getKey(), new IllegalStateException(cause), mode, failures);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for analyzers", e);
        } catch (RuntimeException | Error e) {
            futures.values().forEach(f -> f.cancel(true));
            throw e;
        } finally {
            if (ownsExecutor) {
                pool.shutdownNow();
            }
        }
    }

    private AnalysisResult dispatch(AnalyzerKind kind, TextCorpus corpus, SurveyDataset dataset,
                                    AnalysisOptions options) {
        logger.debug("Starting {} analysis", kind);
        CorpusAnalyzer<?> replacement = replacements.get(kind);
        if (replacement != null) {
            return replacement.run(corpus);
        }
        return switch (kind) {
            case CONTENT -> new ContentAnalyzer(options).analyzeStructure(corpus);
            case SENTIMENT -> new SentimentAnalyzer().score(corpus);
            case THEMATIC -> new ThematicAnalyzer(options).identifyThemes(corpus);
            case CODING -> new KeywordCodingAnalyzer(options).run(corpus);
            case SURVEY -> dataset != null
                ? new SurveyAnalyzer(options).analyze(dataset) : new SurveyAnalyzer(options).run(corpus);
            case STATISTICS -> new QualitativeStatistics(options).generateComprehensiveSummary(corpus);
        };
    }

    private static void recordFailure(AnalyzerKind kind, RuntimeException error, AnalysisReport.Mode mode,
                                      List<FailedAnalysis> failures) {
        if (mode == AnalysisReport.Mode.EXPLICIT) {
            throw error;
        }
        logger.warn("{} analysis failed: {}", kind, error.getMessage(), error);
        failures.add(FailedAnalysis.of(kind, error));
    }

    private static List<String> recommendations(DatasetAssessment assessment,
                                                Map<AnalyzerKind, AnalysisResult> results) {
        Set<String> out = new LinkedHashSet<>();
        if (results.get(AnalyzerKind.STATISTICS) instanceof StatisticsResult statistics) {
            out.addAll(statistics.recommendations());
        }
        switch (assessment.profile()) {
            case INTERVIEW -> out.add("For interview data, ensure consistent probing techniques across interviews");
            case OPEN_SURVEY, STRUCTURED_SURVEY ->
                out.add("For survey data, consider response validation and optional follow-up questions");
            case MIXED -> out.add("Response lengths vary widely; consider analyzing short and long responses separately");
            case INSUFFICIENT_DATA -> out.add("Collect more responses before drawing conclusions");
        }
        for (Recommendation r : assessment.recommendations()) {
            if (r.status() == Recommendation.Status.DEGRADED && results.containsKey(r.kind())) {
                out.add(r.kind() + " analysis ran in degraded mode; results are indicative only");
            }
        }
        return new ArrayList<>(out);
    }
}
