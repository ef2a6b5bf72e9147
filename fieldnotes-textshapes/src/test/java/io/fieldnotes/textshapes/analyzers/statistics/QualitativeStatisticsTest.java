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

import io.fieldnotes.textshapes.ValidationException;
import io.fieldnotes.textshapes.analyzers.sentiment.SentimentAnalyzer;
import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.result.AnalysisResult;
import io.fieldnotes.textshapes.result.AnalysisWarning;
import io.fieldnotes.textshapes.result.AnalyzerKind;
import io.fieldnotes.textshapes.result.SentimentResult;
import io.fieldnotes.textshapes.result.StatisticsResult;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class QualitativeStatisticsTest {

    private final QualitativeStatistics statistics = new QualitativeStatistics();

    @Test
    void testOneWordCorpus() {
        StatisticsResult result = statistics.generateComprehensiveSummary(List.of("good", "bad", "ok"));

        DescriptiveSummary d = result.descriptive();
        assertEquals(3, d.recordCount());
        assertEquals(3, d.totalWords());
        assertEquals(1.0, d.meanWords(), 1e-12);
        assertEquals(0.0, d.stdDevWords(), 1e-12);
        assertEquals(0.0, d.skewness(), 1e-12);
        assertEquals(1.0, d.lexicalDiversity(), 1e-12);
        assertEquals(3, d.hapaxLegomena());

        DataQuality q = result.quality();
        assertEquals(60.0, q.score(), 1e-9);
        assertFalse(q.usedAnalyzerConfidence());
        assertEquals(3, q.veryShort());
        assertEquals(0.0, q.usabilityRate(), 1e-9);

        assertEquals("descriptive", result.envelope().method());
        assertEquals(0.6, result.envelope().confidence(), 1e-9);
        assertFalse(result.isSummarizing());
        assertEquals(List.of("Collect at least 10 responses for reliable thematic analysis"), result.recommendations());
        assertThat(result.insights()).extracting(Insight::topic).containsExactly("length", "vocabulary");
        assertThat(result.insights()).extracting(Insight::priority)
            .containsExactly(InsightPriority.MEDIUM, InsightPriority.LOW);
    }

    @Test
    void testDuplicatesAndNonResponses() {
        StatisticsResult result = statistics.generateComprehensiveSummary(TextCorpus.ofTexts("dup", List.of(
            "Great coffee",
            "great coffee!",
            "N/A",
            "The service was slow and the staff seemed tired today")));

        DataQuality q = result.quality();
        assertEquals(1, q.duplicates());
        assertEquals(1, q.nonResponses());
        assertEquals(75.0, q.completionRate(), 1e-9);
        assertEquals(0.75, q.uniqueness(), 1e-9);
        assertEquals(0.25, q.adequacy(), 1e-9);
        assertTrue(result.envelope().hasWarning(AnalysisWarning.DUPLICATE_RESPONSES));
        assertThat(result.recommendations()).contains("Review duplicate responses before drawing conclusions");
        assertThat(result.insights()).extracting(Insight::topic).contains("duplicates");
    }

    @Test
    void testSummarizingModeUsesAnalyzerConfidence() {
        TextCorpus corpus = TextCorpus.ofTexts("reviews", List.of(
            "The staff were very helpful and friendly",
            "The room was terrible and dirty",
            "Breakfast was good but the coffee was cold",
            "Check in was easy and quick",
            "Parking was expensive"));
        SentimentResult sentiment = new SentimentAnalyzer().score(corpus);
        Map<AnalyzerKind, AnalysisResult> prior = new EnumMap<>(AnalyzerKind.class);
        prior.put(AnalyzerKind.SENTIMENT, sentiment);
        prior.put(AnalyzerKind.STATISTICS, statistics.generateComprehensiveSummary(corpus));

        StatisticsResult result = statistics.generateComprehensiveSummary(corpus, prior);

        assertTrue(result.quality().usedAnalyzerConfidence());
        assertEquals(sentiment.envelope().confidence(), result.quality().analyzerConfidence(), 1e-12);
        assertThat(result.summarizedKinds()).containsExactly(AnalyzerKind.SENTIMENT);
        assertEquals("descriptive_summary", result.envelope().method());
        assertThat(result.insights()).extracting(Insight::topic).contains("sentiment");
        assertThat(result.quality().score()).isBetween(0.0, 100.0);
    }

    @Test
    void testQuartilesAndTopWords() {
        StatisticsResult result = statistics.generateComprehensiveSummary(TextCorpus.ofTexts("q", List.of(
            "coffee",
            "coffee beans",
            "fresh coffee beans daily",
            "coffee beans roasted fresh every single morning here")));

        DescriptiveSummary d = result.descriptive();
        assertEquals(1.0, d.minWords());
        assertEquals(8.0, d.maxWords());
        assertThat(d.q1Words()).isLessThanOrEqualTo(d.medianWords());
        assertThat(d.q3Words()).isGreaterThanOrEqualTo(d.medianWords());
        assertThat(d.interquartileRange()).isGreaterThanOrEqualTo(0.0);
        assertEquals("coffee", d.topWords().get(0).term());
        assertEquals(4, d.topWords().get(0).count());
    }

    @Test
    void testEmptyCorpusIsRejected() {
        assertThrows(ValidationException.class, () -> statistics.generateComprehensiveSummary(List.of()));
    }
}
