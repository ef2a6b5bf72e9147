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

import io.fieldnotes.textshapes.detect.DatasetAssessment;
import io.fieldnotes.textshapes.detect.DatasetProfile;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Merged output of one orchestrated analysis call.
 *
 * <h2>Purpose</h2>
 *
 * <p>Holds the result of every analyzer that ran, keyed by {@link AnalyzerKind} in run order,
 * together with the analyzers that failed, the dataset assessment that drove the selection,
 * top-level recommendations and the processing time.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * AnalysisReport report = orchestrator.generateReport(corpus, options);
 *
 * SentimentResult sentiment = report.getResult(AnalyzerKind.SENTIMENT, SentimentResult.class);
 *
 * if (report.hasFailures()) {
 *     report.getFailures().forEach(f ->
 *         System.err.println(f.kind() + " failed: " + f.message()));
 * }
 * }</pre>
 *
 * @see io.fieldnotes.textshapes.harness.AnalysisOrchestrator
 */
public final class AnalysisReport {

    /** Selection mode of the call. */
    public enum Mode {
        AUTO,
        EXPLICIT;

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Mode mode;
    private final DatasetAssessment assessment;
    private final Map<AnalyzerKind, AnalysisResult> results;
    private final List<FailedAnalysis> failures;
    private final List<String> recommendations;
    private final long processingTimeMs;

    /**
     * Creates a report.
     *
     * @param mode how the analyzers were selected
     * @param assessment dataset profile, characteristics and ranked analyzers
     * @param results results by kind
     * @param failures analyzers that threw in auto mode
     * @param recommendations top-level recommendation strings
     * @param processingTimeMs total processing time in milliseconds
     */
    public AnalysisReport(Mode mode, DatasetAssessment assessment, Map<AnalyzerKind, AnalysisResult> results,
                          List<FailedAnalysis> failures, List<String> recommendations, long processingTimeMs) {
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
        this.assessment = Objects.requireNonNull(assessment, "assessment cannot be null");
        Map<AnalyzerKind, AnalysisResult> ordered = new EnumMap<>(AnalyzerKind.class);
        ordered.putAll(results);
        this.results = Collections.unmodifiableMap(ordered);
        this.failures = List.copyOf(failures);
        this.recommendations = List.copyOf(recommendations);
        this.processingTimeMs = processingTimeMs;
    }

    public Mode getMode() {
        return mode;
    }

    public DatasetAssessment getAssessment() {
        return assessment;
    }

    /**
     * Returns the detected dataset profile.
     *
     * @return the profile
     */
    public DatasetProfile getProfile() {
        return assessment.profile();
    }

    /**
     * Gets a result by kind with type safety.
     *
     * @param kind the analyzer kind
     * @param resultClass the expected result class
     * @param <R> the result type
     * @return the result, or null if not present or of another type
     */
    public <R extends AnalysisResult> R getResult(AnalyzerKind kind, Class<R> resultClass) {
        AnalysisResult result = results.get(kind);
        return resultClass.isInstance(result) ? resultClass.cast(result) : null;
    }

    /**
     * Gets a result by kind.
     *
     * @param kind the analyzer kind
     * @return the result, or null if the analyzer did not run or failed
     */
    public AnalysisResult getResult(AnalyzerKind kind) {
        return results.get(kind);
    }

    public boolean hasResult(AnalyzerKind kind) {
        return results.containsKey(kind);
    }

    /**
     * Returns all results in run order.
     *
     * @return unmodifiable map of kind to result
     */
    public Map<AnalyzerKind, AnalysisResult> getResults() {
        return results;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public List<FailedAnalysis> getFailures() {
        return failures;
    }

    /**
     * Gets the failure of one analyzer.
     *
     * @param kind the analyzer kind
     * @return the failure, or null if it did not fail
     */
    public FailedAnalysis getFailure(AnalyzerKind kind) {
        for (FailedAnalysis f : failures) {
            if (f.kind() == kind) return f;
        }
        return null;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    /**
     * Returns a multi-line summary of the report.
     *
     * @return human-readable summary
     */
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("AnalysisReport:\n");
        sb.append(String.format(Locale.ROOT, "  Profile: %s (%s mode, %d records)\n",
            assessment.profile(), mode, assessment.characteristics().recordCount()));
        sb.append(String.format(Locale.ROOT, "  Processing time: %dms\n", processingTimeMs));
        sb.append(String.format(Locale.ROOT, "  Successful: %d, Failed: %d\n", results.size(), failures.size()));

        if (!results.isEmpty()) {
            sb.append("  Results:\n");
            for (Map.Entry<AnalyzerKind, AnalysisResult> entry : results.entrySet()) {
                sb.append(String.format(Locale.ROOT, "    - %s: %s\n",
                    entry.getKey(), entry.getValue().envelope().summary()));
            }
        }

        if (!failures.isEmpty()) {
            sb.append("  Failures:\n");
            for (FailedAnalysis f : failures) {
                sb.append(String.format(Locale.ROOT, "    - %s: %s (%s)\n", f.kind(), f.message(), f.errorType()));
            }
        }

        if (!recommendations.isEmpty()) {
            sb.append("  Recommendations:\n");
            for (String r : recommendations) {
                sb.append("    - ").append(r).append('\n');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "AnalysisReport[profile=%s, results=%d, failures=%d, time=%dms]",
            assessment.profile(), results.size(), failures.size(), processingTimeMs);
    }
}
