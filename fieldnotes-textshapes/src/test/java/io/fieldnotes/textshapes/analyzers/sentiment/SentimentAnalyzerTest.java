package io.fieldnotes.textshapes.analyzers.sentiment;

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
import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.corpus.TextRecord;
import io.fieldnotes.textshapes.result.AnalysisWarning;
import io.fieldnotes.textshapes.result.SentimentResult;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SentimentAnalyzerTest {

    private final SentimentAnalyzer analyzer = new SentimentAnalyzer();

    private RecordSentiment score(String text) {
        return analyzer.scoreRecord(TextRecord.of("x", text));
    }

    @Test
    void testSingleWordRecordsAreLowConfidenceAndNeverFail() {
        SentimentResult result = analyzer.score(TextCorpus.ofTexts("tiny", List.of("good", "bad", "ok")));

        assertEquals(3, result.records().size());
        for (RecordSentiment rs : result.records()) {
            assertTrue(rs.lowConfidence(), rs.recordId());
            assertEquals(0.0, rs.polarity());
            assertEquals(0.0, rs.subjectivity());
            assertEquals(Emotion.NEUTRAL, rs.emotion());
        }
        assertEquals(0.0, result.volatility());
        assertTrue(result.envelope().hasWarning(AnalysisWarning.INSUFFICIENT_DATA));
        assertTrue(result.envelope().hasWarning(AnalysisWarning.LOW_CONFIDENCE));
    }

    @Test
    void testIntensifierScalesPolarity() {
        RecordSentiment plain = score("The food was good");
        RecordSentiment boosted = score("The food was very good");

        assertEquals(0.7, plain.polarity(), 1e-9);
        assertEquals(0.91, boosted.polarity(), 1e-9);
        assertEquals(SentimentLabel.VERY_POSITIVE, boosted.label());
        assertEquals(IntensityLevel.HIGH, boosted.intensityLevel());
        assertFalse(boosted.lowConfidence());
    }

    @Test
    void testNegationFlipsAndDampens() {
        RecordSentiment rs = score("The food was not good");
        assertEquals(-0.35, rs.polarity(), 1e-9);
        assertEquals(SentimentLabel.NEGATIVE, rs.label());
    }

    @Test
    void testShifterExpiresOutsideWindow() {
        RecordSentiment rs = score("not the food at all good");
        assertEquals(0.7, rs.polarity(), 1e-9);
    }

    @Test
    void testScoresStayInRange() {
        List<String> texts = List.of(
            "extremely terrible awful horrible service",
            "incredibly absolutely perfect wonderful excellent",
            "not not never bad",
            "totally really very happy happy happy",
            "We went there on Tuesday");
        for (String text : texts) {
            RecordSentiment rs = score(text);
            assertThat(rs.polarity()).as(text).isBetween(-1.0, 1.0);
            assertThat(rs.subjectivity()).as(text).isBetween(0.0, 1.0);
            assertThat(rs.confidence()).as(text).isBetween(0.0, 1.0);
        }
        assertTrue(score("We went there on Tuesday").lowConfidence());
    }

    @Test
    void testDominantEmotion() {
        assertEquals(Emotion.JOY, score("I am so happy and glad").emotion());
        assertEquals(Emotion.ANGER, score("I was angry and frustrated with the wait").emotion());
        assertEquals(Emotion.NEUTRAL, score("The staff were friendly").emotion());
    }

    @Test
    void testAggregates() {
        SentimentResult result = analyzer.score(TextCorpus.ofTexts("mix", List.of(
            "The staff were very helpful",
            "The room was terrible and dirty",
            "Breakfast was good",
            "The wait was slow",
            "Check in was easy")));

        assertEquals(5, result.records().size());
        assertFalse(result.envelope().hasWarning(AnalysisWarning.INSUFFICIENT_DATA));
        assertTrue(result.volatility() > 0.0);
        assertThat(result.meanPolarity()).isBetween(-1.0, 1.0);
        int labelled = result.labelDistribution().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(5, labelled);
        assertFalse(result.hasTrend());
        assertTrue(result.byCategory().isEmpty());
        assertNotNull(result.forRecord("r2"));
        assertTrue(result.forRecord("r2").polarity() < 0);
    }

    @Test
    void testDailyTrendAndCategoryBreakdown() {
        TextCorpus corpus = TextCorpus.builder("timed")
            .add("a", "The service was good today", Instant.parse("2024-05-01T09:00:00Z"), "service", Map.of())
            .add("b", "The service was great again", Instant.parse("2024-05-01T17:00:00Z"), "service", Map.of())
            .add("c", "The price was terrible though", Instant.parse("2024-05-02T10:00:00Z"), "price", Map.of())
            .build();

        SentimentResult result = analyzer.score(corpus);

        assertThat(result.trend()).extracting(TrendPoint::period)
            .containsExactly(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 2));
        assertEquals(2, result.trend().get(0).count());
        assertEquals(0.75, result.trend().get(0).meanPolarity(), 1e-9);
        assertThat(result.byCategory()).containsOnlyKeys("service", "price");
        assertEquals(SentimentLabel.VERY_NEGATIVE, result.byCategory().get("price").label());
        assertEquals(1, result.sentimentShifts());
        assertEquals(0.5, result.consistency(), 1e-9);
    }

    @Test
    void testEmptyCorpusIsRejected() {
        assertThrows(ValidationException.class, () -> analyzer.score(TextCorpus.empty("none")));
    }
}
