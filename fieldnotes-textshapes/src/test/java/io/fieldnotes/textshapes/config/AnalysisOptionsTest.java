package io.fieldnotes.textshapes.config;

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
import io.fieldnotes.textshapes.analyzers.thematic.ThemeStrategy;
import io.fieldnotes.textshapes.result.AnalyzerKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class AnalysisOptionsTest {

    @Test
    void testDefaults() {
        AnalysisOptions options = AnalysisOptions.defaults();
        assertTrue(options.isAuto());
        assertEquals(5, options.nThemes());
        assertEquals(ThemeStrategy.CLUSTERING, options.strategy());
        assertEquals(42L, options.randomSeed());
        assertEquals(List.of(2, 3), options.ngramSizes());
        assertEquals(10, options.topK());
        assertEquals("respondent_id", options.respondentKey());
        assertNull(options.categoryKeywords());
        assertEquals(AnalysisOptions.DEFAULT_CATEGORY_THRESHOLD, options.categoryThreshold());
        assertTrue(options.keywordCodes().isEmpty());
        assertFalse(options.allowDegraded());
        assertFalse(options.parallel());
        assertTrue(options.stopWords().contains("the"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"auto", "AUTO", " ", ""})
    void testAutoSpellings(String analysisType) {
        assertTrue(AnalysisOptions.builder().analysisType(analysisType).build().isAuto());
    }

    @Test
    void testCommaSeparatedKindsKeepRunOrder() {
        AnalysisOptions options = AnalysisOptions.builder().analysisType("statistics, sentiment,content").build();
        assertFalse(options.isAuto());
        assertThat(options.requestedKinds())
            .containsExactly(AnalyzerKind.CONTENT, AnalyzerKind.SENTIMENT, AnalyzerKind.STATISTICS);
    }

    @Test
    void testUnknownKindIsRejected() {
        assertThatThrownBy(() -> AnalysisOptions.builder().analysisType("sentiment,astrology"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("astrology");
    }

    @Test
    void testFromMap() {
        AnalysisOptions options = AnalysisOptions.fromMap(Map.of(
            "analysis_type", "thematic",
            "n_themes", 3,
            "clustering_strategy", "lda",
            "random_seed", "7",
            "keyword_codes", Map.of("waiting", List.of("wait", "queue")),
            "category_keywords", Map.of("pricing", "Cost, price"),
            "ngram_sizes", "1,2",
            "allow_degraded", "true",
            "parallel", true));

        assertThat(options.requestedKinds()).containsExactly(AnalyzerKind.THEMATIC);
        assertEquals(3, options.nThemes());
        assertEquals(ThemeStrategy.TOPIC_MODEL, options.strategy());
        assertEquals(7L, options.randomSeed());
        assertEquals(List.of("wait", "queue"), options.keywordCodes().get("waiting"));
        assertThat(options.categoryKeywords().get("pricing")).containsExactly("cost", "price");
        assertEquals(List.of(1, 2), options.ngramSizes());
        assertTrue(options.allowDegraded());
        assertTrue(options.parallel());
    }

    @Test
    void testFromMapRejectsUnknownKeys() {
        assertThatThrownBy(() -> AnalysisOptions.fromMap(Map.of("n_topics", 4)))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Unknown option: n_topics");
    }

    @Test
    void testFromMapRejectsMalformedValues() {
        assertThrows(ValidationException.class, () -> AnalysisOptions.fromMap(Map.of("n_themes", "many")));
        assertThrows(ValidationException.class, () -> AnalysisOptions.fromMap(Map.of("parallel", "yes")));
        assertThrows(ValidationException.class, () -> AnalysisOptions.fromMap(Map.of("keyword_codes", "wait")));
        assertThrows(ValidationException.class, () -> AnalysisOptions.fromMap(Map.of("clustering_strategy", "dbscan")));
    }

    @Test
    void testNumericBounds() {
        assertThrows(ValidationException.class, () -> AnalysisOptions.builder().nThemes(0));
        assertThrows(ValidationException.class, () -> AnalysisOptions.builder().topK(-1));
        assertThrows(ValidationException.class, () -> AnalysisOptions.builder().ngramSizes(List.of()));
        assertThrows(ValidationException.class, () -> AnalysisOptions.builder().ngramSizes(List.of(2, 0)));
    }

    @Test
    void testFromPropertiesUsesDottedKeysForMaps() {
        Properties properties = new Properties();
        properties.setProperty("analysis_type", "coding");
        properties.setProperty("keyword_codes.waiting", "wait,queue");
        properties.setProperty("keyword_codes.staff", "rude,friendly");
        properties.setProperty("top_k", "4");

        AnalysisOptions options = AnalysisOptions.fromProperties(properties);

        assertThat(options.requestedKinds()).containsExactly(AnalyzerKind.CODING);
        assertThat(options.keywordCodes()).containsOnlyKeys("staff", "waiting");
        assertEquals(List.of("rude", "friendly"), options.keywordCodes().get("staff"));
        assertEquals(4, options.topK());
    }

    @Test
    void testToBuilderKeepsEverythingButWhatIsChanged() {
        AnalysisOptions base = AnalysisOptions.builder().nThemes(4).randomSeed(99).analyze(AnalyzerKind.SENTIMENT).build();
        AnalysisOptions derived = base.toBuilder().analysisType("auto").build();

        assertTrue(derived.isAuto());
        assertEquals(4, derived.nThemes());
        assertEquals(99L, derived.randomSeed());
        assertFalse(base.isAuto());
    }

    @Test
    void testCategoryThreshold() {
        AnalysisOptions options = AnalysisOptions.fromMap(Map.of("category_threshold", "0.25"));
        assertEquals(0.25, options.categoryThreshold(), 1e-12);
        assertEquals(0.0, AnalysisOptions.fromMap(Map.of("category_threshold", 0)).categoryThreshold());

        assertThatThrownBy(() -> AnalysisOptions.builder().categoryThreshold(1.0))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("category_threshold");
        assertThrows(ValidationException.class, () -> AnalysisOptions.builder().categoryThreshold(-0.1));
        assertThrows(ValidationException.class, () -> AnalysisOptions.builder().categoryThreshold(Double.NaN));
        assertThatThrownBy(() -> AnalysisOptions.fromMap(Map.of("category_threshold", "high")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("must be a number");
    }

    @Test
    void testCategoryKeywordsMustBeSingleWords() {
        assertThatThrownBy(() -> AnalysisOptions.builder()
            .categoryKeywords(Map.of("service", List.of("slow", "wait time"))))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("'wait time' is not a single word");
        assertThrows(ValidationException.class, () -> AnalysisOptions.builder()
            .categoryKeywords(Map.of("service", List.of("check-in"))));

        AnalysisOptions options = AnalysisOptions.builder()
            .categoryKeywords(Map.of("service", List.of(" Slow ", "don't")))
            .build();
        assertThat(options.categoryKeywords().get("service")).containsExactly("slow", "don't");
    }
}
