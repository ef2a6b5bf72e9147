package io.fieldnotes.textshapes.text;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class TextUtilsTest {

    @Test
    void testTokenizeLowercasesAndKeepsContractions() {
        assertEquals(List.of("i", "don't", "like", "the", "2nd", "menu"),
            TextUtils.tokenize("I DON’T like the 2nd menu!!"));
        assertTrue(TextUtils.tokenize(null).isEmpty());
        assertTrue(TextUtils.tokenize("... ?!").isEmpty());
    }

    @Test
    void testSentences() {
        assertEquals(List.of("Slow service", "Would not return", "Maybe"),
            TextUtils.sentences("Slow service. Would not return!! Maybe?"));
        assertEquals(List.of("no punctuation here"), TextUtils.sentences("no punctuation here"));
    }

    @Test
    void testTopCountsIsStableForTies() {
        Map<String, Integer> counts = TextUtils.countInOrder(List.of("b", "a", "c", "a", "b", "d"));
        assertThat(TextUtils.topCounts(counts, 3)).containsExactly(
            new TextUtils.TermCount("b", 2), new TextUtils.TermCount("a", 2), new TextUtils.TermCount("c", 1));
    }

    @Test
    void testCosine() {
        double[] a = {1, 0, 1};
        assertEquals(1.0, TextUtils.cosineSimilarity(a, a), 1e-12);
        assertEquals(0.0, TextUtils.cosineSimilarity(a, new double[]{0, 1, 0}), 1e-12);
        assertEquals(0.0, TextUtils.cosineSimilarity(a, new double[3]), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> TextUtils.cosineSimilarity(a, new double[2]));
    }

    @Test
    void testJaccard() {
        assertEquals(0.5, TextUtils.jaccard(Set.of(1, 2, 3), Set.of(2, 3, 4, 1, 5, 6)), 1e-12);
        assertEquals(0.0, TextUtils.jaccard(Set.of(), Set.of()), 1e-12);
    }

    @Test
    void testStatisticsAndMedian() {
        TextUtils.Statistics stats = TextUtils.computeStatistics(new double[]{2, 4, 4, 4, 5, 5, 7, 9});
        assertEquals(2.0, stats.min());
        assertEquals(9.0, stats.max());
        assertEquals(5.0, stats.mean(), 1e-12);
        assertEquals(2.0, stats.stdDev(), 1e-12);
        assertEquals(0.4, stats.coefficientOfVariation(), 1e-12);
        assertEquals(4.5, TextUtils.median(new double[]{9, 2, 4, 5}), 1e-12);
        assertEquals(0.0, TextUtils.computeStatistics(new double[0]).coefficientOfVariation());
    }

    @Test
    void testNonResponses() {
        assertTrue(ResponseMarkers.isNonResponse("N/A"));
        assertTrue(ResponseMarkers.isNonResponse("  none. "));
        assertTrue(ResponseMarkers.isNonResponse("???"));
        assertFalse(ResponseMarkers.isNonResponse("none of the staff helped"));
    }

    @Test
    void testUncertaintyAndIndicators() {
        assertTrue(ResponseMarkers.isUncertain("I'm not sure, maybe later"));
        assertTrue(ResponseMarkers.isUncertain("I don’t know"));
        assertFalse(ResponseMarkers.isUncertain("Sure thing"));
        assertTrue(ResponseMarkers.hasPositiveIndicator("Yes, very satisfied"));
        assertTrue(ResponseMarkers.hasNegativeIndicator("Poor value"));
        assertFalse(ResponseMarkers.hasNegativeIndicator("Nothing to add"));
    }

    @Test
    void testStopWords() {
        assertTrue(StopWords.english().contains("the"));
        assertFalse(StopWords.english().contains("coffee"));
        assertEquals(Set.of("foo", "bar"), StopWords.of(List.of(" Foo", "BAR", "")));
    }
}
