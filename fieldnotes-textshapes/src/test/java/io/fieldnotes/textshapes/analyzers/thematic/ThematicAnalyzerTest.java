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

import io.fieldnotes.textshapes.ValidationException;
import io.fieldnotes.textshapes.config.AnalysisOptions;
import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.result.AnalysisWarning;
import io.fieldnotes.textshapes.result.ThematicResult;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ThematicAnalyzerTest {

    static final TextCorpus FEEDBACK = TextCorpus.ofTexts("feedback", List.of(
        "The coffee was fresh and the espresso strong",
        "Loved the espresso, great coffee flavor",
        "Coffee tasted burnt, espresso was bitter",
        "Fresh coffee and a smooth espresso every visit",
        "Parking was impossible, the parking lot was full",
        "No parking spaces near the entrance",
        "Parking garage was closed and the lot was full",
        "Staff were friendly and the barista remembered my name",
        "The barista staff were welcoming",
        "Friendly staff, quick barista service",
        "Parking lot was small and crowded",
        "Staff and barista training shows"));

    @ParameterizedTest
    @EnumSource(ThemeStrategy.class)
    void testThemesPartitionTheCorpus(ThemeStrategy strategy) {
        ThematicResult result = new ThematicAnalyzer().identifyThemes(FEEDBACK, 3, strategy);

        assertEquals(3, result.themes().size());
        List<String> members = new ArrayList<>();
        for (Theme theme : result.themes()) {
            members.addAll(theme.memberIds());
        }
        assertEquals(FEEDBACK.size(), members.size());
        assertEquals(new HashSet<>(FEEDBACK.records().stream().map(r -> r.id()).toList()), new HashSet<>(members));
        for (int i = 0; i < FEEDBACK.size(); i++) {
            assertNotNull(result.themeOf(FEEDBACK.get(i).id()));
        }
        for (Theme theme : result.themes()) {
            assertThat(theme.coherence()).isBetween(0.0, 1.0);
            assertThat(theme.exemplars().size()).isLessThanOrEqualTo(ThematicAnalyzer.EXEMPLAR_COUNT);
            assertThat(theme.topTerms().size()).isLessThanOrEqualTo(ThematicAnalyzer.TOP_TERMS);
        }
        assertFalse(result.degraded());
        assertEquals(strategy, result.strategy());
    }

    @Test
    void testClusteringGivesNonEmptyThemes() {
        ThematicResult result = new ThematicAnalyzer().identifyThemes(FEEDBACK, 3, ThemeStrategy.CLUSTERING);
        for (Theme theme : result.themes()) {
            assertFalse(theme.isEmpty(), theme.label());
        }
        assertEquals("kmeans_cosine", result.envelope().method());
    }

    @ParameterizedTest
    @EnumSource(ThemeStrategy.class)
    void testSameSeedSameThemes(ThemeStrategy strategy) {
        AnalysisOptions options = AnalysisOptions.builder().randomSeed(1234).nThemes(3).strategy(strategy).build();
        ThematicResult first = new ThematicAnalyzer(options).identifyThemes(FEEDBACK);
        ThematicResult second = new ThematicAnalyzer(options).identifyThemes(FEEDBACK);

        assertEquals(first.themes(), second.themes());
        assertEquals(first.iterations(), second.iterations());
    }

    @Test
    void testIdenticalTextsStillFillEveryTheme() {
        TextCorpus same = TextCorpus.ofTexts("same", Collections.nCopies(12, "coffee beans roasted fresh"));

        ThematicResult result = new ThematicAnalyzer().identifyThemes(same, 3, ThemeStrategy.CLUSTERING);

        assertEquals(3, result.themes().size());
        for (Theme theme : result.themes()) {
            assertFalse(theme.isEmpty());
            assertEquals(1.0, theme.coherence(), 1e-9);
            assertEquals("coffee / beans / roasted", theme.label());
        }
    }

    @Test
    void testSmallCorpusDegradesToOneTheme() {
        TextCorpus small = TextCorpus.ofTexts("small", List.of("good coffee", "bad parking", "friendly staff"));

        ThematicResult result = new ThematicAnalyzer().identifyThemes(small, 5, ThemeStrategy.CLUSTERING);

        assertTrue(result.degraded());
        assertEquals(1, result.themes().size());
        assertEquals(3, result.themes().get(0).size());
        assertTrue(result.envelope().hasWarning(AnalysisWarning.INSUFFICIENT_DATA_FOR_CLUSTERING));
        assertEquals(5, result.requestedThemes());
    }

    @Test
    void testThemeCountIsClampedToRecordCount() {
        ThematicResult result = new ThematicAnalyzer().identifyThemes(FEEDBACK, 40, ThemeStrategy.CLUSTERING);

        assertEquals(FEEDBACK.size(), result.themes().size());
        assertTrue(result.envelope().hasWarning(AnalysisWarning.THEMES_CLAMPED));
        assertEquals(40, result.requestedThemes());
    }

    @Test
    void testInvalidThemeCount() {
        ThematicAnalyzer analyzer = new ThematicAnalyzer();
        assertThrows(ValidationException.class, () -> analyzer.identifyThemes(FEEDBACK, 0, ThemeStrategy.CLUSTERING));
        assertThrows(ValidationException.class,
            () -> analyzer.identifyThemes(TextCorpus.empty("e"), 3, ThemeStrategy.CLUSTERING));
    }

    @Test
    void testEvolutionCountsThemesPerDay() {
        TextCorpus.Builder builder = TextCorpus.builder("timed");
        for (int i = 0; i < FEEDBACK.size(); i++) {
            Instant day = Instant.parse(i < 6 ? "2024-06-01T12:00:00Z" : "2024-06-02T12:00:00Z");
            builder.add(FEEDBACK.get(i).id(), FEEDBACK.get(i).text(), day, null, Map.of());
        }

        ThematicResult result = new ThematicAnalyzer().identifyThemes(builder.build(), 3, ThemeStrategy.CLUSTERING);

        assertEquals(2, result.evolution().size());
        for (ThemePeriod period : result.evolution()) {
            assertThat(period.themeCounts()).containsOnlyKeys(0, 1, 2);
            assertEquals(6, period.themeCounts().values().stream().mapToInt(Integer::intValue).sum());
        }
    }

    @Test
    void testCoherenceOfSingleTermIsZero() {
        TermVectorizer.TermMatrix matrix = TermVectorizer.vectorize(
            TextCorpus.ofTexts("one", List.of("parking", "parking lot")), Set.of());
        assertEquals(0.0, ThematicAnalyzer.coherence(matrix, List.of(0)));
        assertEquals(Math.sqrt(0.5), ThematicAnalyzer.coherence(matrix, List.of(0, 1)), 1e-9);
    }

    @Test
    void testVectorizerDropsShortAndStopWords() {
        TermVectorizer.TermMatrix matrix = TermVectorizer.vectorize(
            TextCorpus.ofTexts("v", List.of("The ok coffee is on the go", "coffee coffee beans")),
            Set.of("the", "is"));
        assertEquals(List.of("coffee", "beans"), matrix.vocabulary());
        assertArrayEquals(new double[]{1, 0}, matrix.counts()[0]);
        assertArrayEquals(new double[]{2, 1}, matrix.counts()[1]);
    }
}
