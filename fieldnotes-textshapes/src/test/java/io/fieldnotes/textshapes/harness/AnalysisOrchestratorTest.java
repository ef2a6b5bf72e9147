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
import io.fieldnotes.textshapes.config.AnalysisOptions;
import io.fieldnotes.textshapes.corpus.SurveyDataset;
import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.detect.DatasetProfile;
import io.fieldnotes.textshapes.report.ReportGson;
import io.fieldnotes.textshapes.result.AnalysisReport;
import io.fieldnotes.textshapes.result.AnalyzerKind;
import io.fieldnotes.textshapes.result.FailedAnalysis;
import io.fieldnotes.textshapes.result.SentimentResult;
import io.fieldnotes.textshapes.result.StatisticsResult;
import io.fieldnotes.textshapes.result.SurveyResult;
import io.fieldnotes.textshapes.result.ThematicResult;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class AnalysisOrchestratorTest {

    private static final List<String> FEEDBACK = List.of(
        "The coffee was excellent and the staff were friendly",
        "Service was slow and the coffee arrived cold",
        "I love the pastries, they are always fresh",
        "Prices are too high for such small portions",
        "Friendly staff and a calm place to work",
        "The wifi kept dropping which was frustrating",
        "Great coffee, I come back every morning",
        "Long queue at lunch, the wait was terrible",
        "Fresh bread and good music, very pleasant visit",
        "Tables were dirty and nobody cleaned them",
        "The new menu has nice vegetarian options",
        "Parking is difficult but the coffee is worth it");

    private final AnalysisOrchestrator orchestrator = new AnalysisOrchestrator();

    @Test
    void testAutoModeOnThreeShortTexts() {
        TextCorpus corpus = TextCorpus.ofTexts("tiny", List.of("good", "bad", "ok"));

        AnalysisReport report = orchestrator.generateReport(corpus, AnalysisOptions.defaults());

        assertEquals(AnalysisReport.Mode.AUTO, report.getMode());
        assertEquals(DatasetProfile.OPEN_SURVEY, report.getProfile());
        assertEquals(List.of(AnalyzerKind.SENTIMENT, AnalyzerKind.THEMATIC, AnalyzerKind.STATISTICS),
            List.copyOf(report.getResults().keySet()));
        assertFalse(report.hasFailures());

        ThematicResult thematic = report.getResult(AnalyzerKind.THEMATIC, ThematicResult.class);
        assertNotNull(thematic);
        assertEquals("single_theme", thematic.envelope().method());
        assertNull(report.getResult(AnalyzerKind.THEMATIC, SentimentResult.class));
        assertFalse(report.hasResult(AnalyzerKind.CONTENT));

        assertThat(report.getRecommendations())
            .contains("Collect at least 10 responses for reliable thematic analysis",
                "For survey data, consider response validation and optional follow-up questions",
                "sentiment analysis ran in degraded mode; results are indicative only",
                "thematic analysis ran in degraded mode; results are indicative only");
    }

    @Test
    void testStatisticsSummarizesEarlierResults() {
        TextCorpus corpus = TextCorpus.ofTexts("tiny", List.of("good", "bad", "ok"));

        StatisticsResult statistics = orchestrator.generateReport(corpus, AnalysisOptions.defaults())
            .getResult(AnalyzerKind.STATISTICS, StatisticsResult.class);

        assertNotNull(statistics);
        assertThat(statistics.summarizedKinds()).containsExactly(AnalyzerKind.SENTIMENT, AnalyzerKind.THEMATIC);
    }

    @Test
    void testExplicitRequestBelowMinimumIsRejected() {
        TextCorpus corpus = TextCorpus.ofTexts("tiny", List.of("good", "bad", "ok"));

        ValidationException e = assertThrows(ValidationException.class,
            () -> orchestrator.detectAndRun(corpus, "thematic", AnalysisOptions.defaults()));
        assertEquals("thematic analysis requires at least 10 records, got 3; set allow_degraded to run it anyway",
            e.getMessage());
    }

    @Test
    void testExplicitRequestWithAllowDegraded() {
        TextCorpus corpus = TextCorpus.ofTexts("tiny", List.of("good", "bad", "ok"));
        AnalysisOptions options = AnalysisOptions.builder().allowDegraded(true).build();

        AnalysisReport report = orchestrator.detectAndRun(corpus, "thematic", options);

        assertEquals(AnalysisReport.Mode.EXPLICIT, report.getMode());
        assertEquals(List.of(AnalyzerKind.THEMATIC), List.copyOf(report.getResults().keySet()));
        assertTrue(report.getResult(AnalyzerKind.THEMATIC).envelope()
            .hasWarning("insufficient_data_for_clustering"));
    }

    @Test
    void testExplicitRequestRunsOnlyNamedAnalyzers() {
        TextCorpus corpus = TextCorpus.ofTexts("feedback", FEEDBACK);
        AnalysisOptions options = AnalysisOptions.builder().analysisType("statistics,sentiment").build();

        AnalysisReport report = orchestrator.generateReport(corpus, options);

        assertEquals(List.of(AnalyzerKind.SENTIMENT, AnalyzerKind.STATISTICS),
            List.copyOf(report.getResults().keySet()));
    }

    @Test
    void testInvalidInput() {
        assertThrows(ValidationException.class,
            () -> orchestrator.generateReport(TextCorpus.empty("none"), AnalysisOptions.defaults()));
        assertThrows(ValidationException.class,
            () -> orchestrator.detectAndRun(TextCorpus.ofTexts("t", FEEDBACK), "sentimental",
                AnalysisOptions.defaults()));

        SurveyDataset silent = SurveyDataset.builder("silent")
            .question("q1", TextCorpus.empty("q1"))
            .build();
        ValidationException e = assertThrows(ValidationException.class,
            () -> orchestrator.generateReport(silent, AnalysisOptions.defaults()));
        assertThat(e.getMessage()).contains("has no responses");
    }

    @Test
    void testParallelOutputEqualsSequential() {
        TextCorpus corpus = TextCorpus.ofTexts("feedback", FEEDBACK);
        AnalysisOptions sequential = AnalysisOptions.defaults();
        AnalysisOptions parallel = sequential.toBuilder().parallel(true).build();

        AnalysisReport a = orchestrator.generateReport(corpus, sequential);
        AnalysisReport b = orchestrator.generateReport(corpus, parallel);

        assertEquals(a.getResults().keySet(), b.getResults().keySet());
        assertThat(a.getResults().size()).isGreaterThan(2);
        assertEquals(ReportGson.compactGson().toJson(a.getResults()),
            ReportGson.compactGson().toJson(b.getResults()));
        assertEquals(a.getRecommendations(), b.getRecommendations());
    }

    /// Sentiment analyzer whose lexicon cannot be loaded.
    static final class BrokenSentimentAnalyzer implements CorpusAnalyzer<SentimentResult> {
        @Override
        public AnalyzerKind getAnalyzerKind() {
            return AnalyzerKind.SENTIMENT;
        }

        @Override
        public SentimentResult run(TextCorpus corpus) {
            throw new IllegalStateException("lexicon unavailable");
        }
    }

    private static AnalysisOrchestrator withBrokenSentiment() {
        return new AnalysisOrchestrator(null, List.of(new BrokenSentimentAnalyzer()));
    }

    @Test
    void testAutoModeRecordsFailureAndKeepsOtherResults() {
        TextCorpus corpus = TextCorpus.ofTexts("feedback", FEEDBACK);
        AnalysisReport healthy = orchestrator.generateReport(corpus, AnalysisOptions.defaults());
        assertTrue(healthy.hasResult(AnalyzerKind.SENTIMENT));

        AnalysisReport report = withBrokenSentiment().generateReport(corpus, AnalysisOptions.defaults());

        assertTrue(report.hasFailures());
        FailedAnalysis failure = report.getFailure(AnalyzerKind.SENTIMENT);
        assertNotNull(failure);
        assertEquals("IllegalStateException", failure.errorType());
        assertEquals("lexicon unavailable", failure.message());
        assertThat(report.getFailures()).hasSize(1);

        Set<AnalyzerKind> expected = new LinkedHashSet<>(healthy.getResults().keySet());
        expected.remove(AnalyzerKind.SENTIMENT);
        assertEquals(expected, report.getResults().keySet());
        assertThat(report.getResults()).isNotEmpty();
        assertThat(report.getSummary()).contains("Failures:").contains("lexicon unavailable (IllegalStateException)");

        StatisticsResult statistics = report.getResult(AnalyzerKind.STATISTICS, StatisticsResult.class);
        if (statistics != null) {
            assertThat(statistics.summarizedKinds()).doesNotContain(AnalyzerKind.SENTIMENT);
        }
    }

    @Test
    void testParallelAutoModeRecordsFailure() {
        TextCorpus corpus = TextCorpus.ofTexts("feedback", FEEDBACK);
        AnalysisOptions options = AnalysisOptions.builder().parallel(true).build();

        AnalysisReport sequential = withBrokenSentiment().generateReport(corpus, AnalysisOptions.defaults());
        AnalysisReport parallel = withBrokenSentiment().generateReport(corpus, options);

        assertEquals("lexicon unavailable", parallel.getFailure(AnalyzerKind.SENTIMENT).message());
        assertEquals(sequential.getResults().keySet(), parallel.getResults().keySet());
        assertFalse(parallel.hasResult(AnalyzerKind.SENTIMENT));
    }

    @Test
    void testExplicitModePropagatesFailure() {
        TextCorpus corpus = TextCorpus.ofTexts("feedback", FEEDBACK);

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> withBrokenSentiment().detectAndRun(corpus, "sentiment,content", AnalysisOptions.defaults()));
        assertEquals("lexicon unavailable", e.getMessage());

        AnalysisOptions parallel = AnalysisOptions.builder().parallel(true).build();
        assertThrows(IllegalStateException.class,
            () -> withBrokenSentiment().detectAndRun(corpus, "sentiment,content", parallel));

        AnalysisReport unaffected = withBrokenSentiment().detectAndRun(corpus, "content", AnalysisOptions.defaults());
        assertFalse(unaffected.hasFailures());
        assertTrue(unaffected.hasResult(AnalyzerKind.CONTENT));
    }

    @Test
    void testInjectedExecutorIsNotShutDown() {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            AnalysisOrchestrator shared = new AnalysisOrchestrator(pool);
            AnalysisReport report = shared.generateReport(TextCorpus.ofTexts("feedback", FEEDBACK),
                AnalysisOptions.builder().parallel(true).build());

            assertTrue(report.hasResult(AnalyzerKind.SENTIMENT));
            assertFalse(pool.isShutdown());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testSurveyDataset() {
        SurveyDataset dataset = SurveyDataset.builder("visit")
            .question("q1", TextCorpus.ofTexts("q1",
                List.of("Agree", "Strongly agree", "Disagree", "Agree", "Neutral")))
            .question("q2", TextCorpus.ofTexts("q2",
                List.of("Satisfied", "Very satisfied", "Not satisfied", "Satisfied", "Fine")))
            .build();

        AnalysisReport report = orchestrator.detectAndRun(dataset, "survey,statistics", AnalysisOptions.defaults());

        SurveyResult survey = report.getResult(AnalyzerKind.SURVEY, SurveyResult.class);
        assertNotNull(survey);
        assertEquals(List.of("q1", "q2"), List.copyOf(survey.byQuestion().keySet()));
        assertEquals(DatasetProfile.STRUCTURED_SURVEY, report.getProfile());
        assertTrue(report.hasResult(AnalyzerKind.STATISTICS));
    }

    @Test
    void testGroupedCorpusSelectsSurveyAnalysis() {
        TextCorpus.Builder builder = TextCorpus.builder("flat");
        String[] answers = {"Agree", "Disagree", "Agree", "Strongly agree", "Neutral"};
        for (String answer : answers) {
            builder.add(null, answer, null, null, Map.of("question_id", "q1"));
        }

        AnalysisReport report = orchestrator.generateReport(builder.build(), AnalysisOptions.defaults());

        assertTrue(report.hasResult(AnalyzerKind.SURVEY));
        assertEquals(List.of("q1"),
            List.copyOf(report.getResult(AnalyzerKind.SURVEY, SurveyResult.class).byQuestion().keySet()));
    }

    @Test
    void testReportSummary() {
        AnalysisReport report = orchestrator.generateReport(TextCorpus.ofTexts("tiny", List.of("good", "bad", "ok")),
            AnalysisOptions.defaults());

        String summary = report.getSummary();
        assertThat(summary).contains("Profile: OPEN_SURVEY (auto mode, 3 records)")
            .contains("Successful: 3, Failed: 0")
            .contains("- sentiment: ")
            .contains("Recommendations:");
        assertThat(report.toString()).startsWith("AnalysisReport[profile=OPEN_SURVEY, results=3, failures=0");
        assertThat(report.getProcessingTimeMs()).isGreaterThanOrEqualTo(0L);
    }
}
