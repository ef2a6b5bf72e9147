package io.fieldnotes.textshapes.analyzers.content;

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
import io.fieldnotes.textshapes.result.ContentResult;
import io.fieldnotes.textshapes.text.TextUtils.TermCount;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ContentAnalyzerTest {

    private static final TextCorpus COFFEE = TextCorpus.ofTexts("coffee", List.of(
        "The coffee beans were roasted fresh.",
        "Fresh coffee beans every morning!",
        "Why are the coffee beans so expensive?",
        "I am happy and pleased with the coffee",
        "Great coffee beans, good and great value."));

    @Test
    void testLengthStatistics() {
        ContentResult result = new ContentAnalyzer().analyzeStructure(COFFEE);

        assertEquals(5, result.recordCount());
        assertEquals(5.0, result.wordCounts().min());
        assertEquals(8.0, result.wordCounts().max());
        assertEquals(1.0, result.sentenceCounts().mean());
        assertThat(result.lexicalDiversity()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        assertEquals(result.uniqueTokens() / (double) result.totalTokens(), result.lexicalDiversity(), 1e-12);
        assertEquals(0.2, result.questionDensity(), 1e-12);
        assertEquals(0.2, result.exclamationDensity(), 1e-12);
        assertFalse(result.envelope().hasWarning(AnalysisWarning.INSUFFICIENT_DATA));
    }

    @Test
    void testNgramsSkipStopWordsAndRankByCount() {
        ContentResult result = new ContentAnalyzer().analyzeStructure(COFFEE);

        List<TermCount> bigrams = result.ngrams(2);
        assertEquals(new TermCount("coffee beans", 4), bigrams.get(0));
        assertThat(bigrams).extracting(TermCount::term).noneMatch(t -> t.startsWith("the "));
        assertThat(result.ngrams()).containsOnlyKeys(2, 3);
        assertTrue(result.ngrams(4).isEmpty());
        assertEquals(new TermCount("coffee", 5), result.topWords().get(0));
    }

    @Test
    void testPosDistributionSumsToOne() {
        ContentResult result = new ContentAnalyzer().analyzeStructure(COFFEE);
        double total = result.posDistribution().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, total, 1e-9);
        assertTrue(result.posDistribution().containsKey(PartOfSpeech.DETERMINER));
    }

    @Test
    void testDefaultCategories() {
        ContentResult result = new ContentAnalyzer().analyzeStructure(COFFEE);

        assertEquals("emotional_words", result.categoryAssignments().get("r4"));
        assertEquals("descriptive_words", result.categoryAssignments().get("r5"));
        assertEquals(ContentAnalyzer.UNCATEGORIZED, result.categoryAssignments().get("r1"));
        assertEquals(3, result.categoryDistribution().get(ContentAnalyzer.UNCATEGORIZED));
        int total = result.categoryDistribution().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(5, total);
    }

    @Test
    void testCallerCategoriesReplaceDefaults() {
        AnalysisOptions options = AnalysisOptions.builder()
            .categoryKeywords(Map.of("product", List.of("coffee", "beans")))
            .ngramSizes(List.of(1))
            .topK(2)
            .build();
        ContentResult result = new ContentAnalyzer(options).analyzeStructure(COFFEE);

        assertThat(result.categoryDistribution()).containsOnlyKeys("product", ContentAnalyzer.UNCATEGORIZED);
        assertEquals(5, result.categoryDistribution().get("product"));
        assertThat(result.ngrams()).containsOnlyKeys(1);
        assertEquals(2, result.ngrams(1).size());
    }

    @Test
    void testSingleKeywordOverlapMustExceedThreshold() {
        ContentAnalyzer analyzer = new ContentAnalyzer();
        assertEquals(ContentAnalyzer.UNCATEGORIZED, analyzer.categorize(Set.of("great", "coffee")));
        assertEquals("descriptive_words", analyzer.categorize(Set.of("great", "good")));
    }

    @Test
    void testCategoryThresholdIsConfigurable() {
        ContentAnalyzer lenient = new ContentAnalyzer(AnalysisOptions.builder().categoryThreshold(0.0).build());
        assertEquals("descriptive_words", lenient.categorize(Set.of("great", "coffee")));
        assertEquals(ContentAnalyzer.UNCATEGORIZED, lenient.categorize(Set.of("coffee")));

        ContentAnalyzer strict = new ContentAnalyzer(AnalysisOptions.builder().categoryThreshold(0.5).build());
        assertEquals(ContentAnalyzer.UNCATEGORIZED, strict.categorize(Set.of("great", "good")));
    }

    @Test
    void testDensitiesCountEveryMark() {
        ContentResult result = new ContentAnalyzer().analyzeStructure(
            TextCorpus.ofTexts("marks", List.of("Why? Really? How?", "Fine!!", "ok")));
        assertEquals(1.0, result.questionDensity(), 1e-12);
        assertEquals(2.0 / 3.0, result.exclamationDensity(), 1e-12);
    }

    @Test
    void testBigramRepetition() {
        ContentPatterns patterns = new ContentAnalyzer().analyzeStructure(COFFEE).patterns();

        assertEquals(16, patterns.totalBigrams());
        assertEquals(13, patterns.uniqueBigrams());
        assertEquals(3.0 / 16.0, patterns.bigramRepetitionRate(), 1e-12);
        assertThat(patterns.phrasePatterns()).isEmpty();
    }

    @Test
    void testRepeatedSentencesWithinRecord() {
        TextCorpus corpus = TextCorpus.ofTexts("staff", List.of(
            "The staff were friendly and helpful today. The staff were friendly but slow.",
            "Parking was easy."));
        ContentPatterns patterns = new ContentAnalyzer().patterns(corpus);

        assertThat(patterns.phrasePatterns()).hasSize(1);
        PhrasePattern pattern = patterns.phrasePatterns().get(0);
        assertEquals("r1", pattern.recordId());
        assertEquals(4, pattern.sharedWords());
        assertEquals("The staff were friendly but slow", pattern.second());
    }

    @Test
    void testNoBigramsMeansNoRepetition() {
        ContentPatterns patterns = new ContentAnalyzer().patterns(TextCorpus.ofTexts("short", List.of("Coffee", "Tea")));
        assertEquals(0, patterns.totalBigrams());
        assertEquals(0.0, patterns.bigramRepetitionRate());
    }

    @Test
    void testGroupsByMetadataAndCategory() {
        TextCorpus corpus = TextCorpus.builder("sites")
            .add("a", "Is the coffee good?", null, "drinks", Map.of("site", "north"))
            .add("b", "Great coffee and great service", null, "drinks", Map.of("site", "north"))
            .add("c", "Slow service today", null, null, Map.of("site", "south"))
            .build();
        ContentResult result = new ContentAnalyzer().analyzeStructure(corpus);

        assertThat(result.groups()).extracting(ContentGroup::label)
            .containsExactly("category=drinks", "site=north");
        ContentGroup north = result.groups().get(1);
        assertEquals(2, north.recordCount());
        assertEquals(9, north.totalWords());
        assertEquals(4.5, north.meanWords(), 1e-12);
        assertEquals(4.5, north.meanSentenceLength(), 1e-12);
        assertEquals(7.0 / 9.0, north.lexicalDiversity(), 1e-12);
        assertEquals("descriptive_words", north.prominentCategory());
        assertEquals(0.5, north.questionDensity(), 1e-12);
        assertEquals("category=drinks", result.largestGroup().label());
    }

    @Test
    void testNoSharedValuesMeansNoGroups() {
        ContentResult result = new ContentAnalyzer().analyzeStructure(COFFEE);
        assertThat(result.groups()).isEmpty();
        assertNull(result.largestGroup());
    }

    @Test
    void testSmallCorpusCarriesWarning() {
        ContentResult result = new ContentAnalyzer().analyzeStructure(
            TextCorpus.ofTexts("small", List.of("One answer here", "Another answer")));
        assertTrue(result.envelope().hasWarning(AnalysisWarning.INSUFFICIENT_DATA));
        assertEquals(2, result.recordCount());
    }

    @Test
    void testEmptyCorpusIsRejected() {
        assertThrows(ValidationException.class, () -> new ContentAnalyzer().analyzeStructure(TextCorpus.empty("e")));
    }

    @Test
    void testTagger() {
        HeuristicPosTagger tagger = new HeuristicPosTagger();
        assertEquals(List.of(PartOfSpeech.PRONOUN, PartOfSpeech.VERB, PartOfSpeech.DETERMINER, PartOfSpeech.NOUN),
            tagger.tag(List.of("we", "want", "the", "coffee")));
        assertEquals(PartOfSpeech.ADVERB, tagger.tagWord("quickly"));
        assertEquals(PartOfSpeech.NUMBER, tagger.tagWord("42"));
    }
}
