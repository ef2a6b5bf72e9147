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

import io.fieldnotes.textshapes.config.AnalysisOptions;
import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.corpus.TextRecord;
import io.fieldnotes.textshapes.harness.CorpusAnalyzer;
import io.fieldnotes.textshapes.result.AnalysisWarning;
import io.fieldnotes.textshapes.result.AnalyzerKind;
import io.fieldnotes.textshapes.result.ContentResult;
import io.fieldnotes.textshapes.result.ResultEnvelope;
import io.fieldnotes.textshapes.text.TextUtils;
import io.fieldnotes.textshapes.text.TextUtils.TermCount;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Structural and linguistic features of a corpus.
///
/// ## Features
///
/// - word and sentence count statistics per record (min, mean, max, stdev)
/// - lexical diversity: unique tokens over total tokens
/// - n-gram frequency tables for each configured `n`, stop words removed;
///   ranking is stable, so equal counts keep first-seen order
/// - part-of-speech distribution from [HeuristicPosTagger]
/// - category assignment against keyword sets
/// - question and exclamation marks per record
/// - repetition: bigram repetition rate and sentence pairs within a record
///   sharing at least [#MIN_SHARED_WORDS] words
/// - a breakdown per metadata value (and per record category) for every
///   value shared by two or more records
///
/// ## Category Assignment
///
/// A record's overlap with a category is the fraction of the category's
/// keywords present in the record's token set. The best category wins when
/// that fraction exceeds the `category_threshold` option (0.1 by default);
/// otherwise the record is [#UNCATEGORIZED]. Equal overlaps go to the
/// category listed first. Keywords are single words.
///
/// ## Usage
/// ```java
/// ContentResult result = new ContentAnalyzer(AnalysisOptions.defaults()).analyzeStructure(corpus);
/// List<TermCount> bigrams = result.ngrams().get(2);
/// ```
public final class ContentAnalyzer implements CorpusAnalyzer<ContentResult> {

    private static final Logger logger = LogManager.getLogger(ContentAnalyzer.class);

    public static final String UNCATEGORIZED = "uncategorized";

    /// Distinct words two sentences must share to count as a repeated phrase.
    public static final int MIN_SHARED_WORDS = 3;

    public static final int MAX_PHRASE_PATTERNS = 10;

    /// Metadata key under which record categories are grouped.
    public static final String CATEGORY_GROUP = "category";

    /// Categories used when the caller supplies none.
    public static final Map<String, Set<String>> DEFAULT_CATEGORIES = defaultCategories();

    private final Set<String> stopWords;
    private final List<Integer> ngramSizes;
    private final int topK;
    private final Map<String, Set<String>> categories;
    private final double categoryThreshold;
    private final HeuristicPosTagger tagger = new HeuristicPosTagger();

    public ContentAnalyzer() {
        this(AnalysisOptions.defaults());
    }

    public ContentAnalyzer(AnalysisOptions options) {
        this.stopWords = options.stopWords();
        this.ngramSizes = options.ngramSizes();
        this.topK = options.topK();
        this.categories = options.categoryKeywords() != null ? options.categoryKeywords() : DEFAULT_CATEGORIES;
        this.categoryThreshold = options.categoryThreshold();
    }

    private static Map<String, Set<String>> defaultCategories() {
        Map<String, Set<String>> c = new LinkedHashMap<>();
        c.put("emotional_words", orderedSet("happy", "sad", "angry", "excited", "frustrated",
            "pleased", "disappointed", "love", "hate", "enjoy"));
        c.put("action_words", orderedSet("do", "make", "create", "build", "develop",
            "implement", "execute", "perform", "achieve", "complete"));
        c.put("descriptive_words", orderedSet("good", "bad", "great", "excellent", "poor",
            "amazing", "terrible", "wonderful", "awful", "nice"));
        c.put("temporal_words", orderedSet("now", "then", "before", "after", "today",
            "yesterday", "tomorrow", "always", "never", "sometimes"));
        return Collections.unmodifiableMap(c);
    }

    private static Set<String> orderedSet(String... words) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(words)));
    }

    @Override
    public AnalyzerKind getAnalyzerKind() {
        return AnalyzerKind.CONTENT;
    }

    @Override
    public String getDescription() {
        return "Length statistics, lexical diversity, n-grams, POS distribution, categorization and group breakdown";
    }

    @Override
    public ContentResult run(TextCorpus corpus) {
        return analyzeStructure(corpus);
    }

    /// Extracts structural features.
    ///
    /// @param corpus a non-empty corpus
    /// @return the content result
    public ContentResult analyzeStructure(TextCorpus corpus) {
        corpus.requireNonEmpty("Content analysis");
        int n = corpus.size();

        double[] wordCounts = new double[n];
        double[] sentenceCounts = new double[n];
        List<String> allTokens = new ArrayList<>();
        Map<Integer, Map<String, Integer>> ngramCounts = new LinkedHashMap<>();
        for (int size : ngramSizes) {
            ngramCounts.put(size, new LinkedHashMap<>());
        }
        Map<PartOfSpeech, Integer> posCounts = new EnumMap<>(PartOfSpeech.class);
        Map<String, String> assignments = new LinkedHashMap<>();
        Map<String, Integer> categoryDistribution = new LinkedHashMap<>();
        for (String category : categories.keySet()) {
            categoryDistribution.put(category, 0);
        }
        categoryDistribution.put(UNCATEGORIZED, 0);
        int questions = 0;
        int exclamations = 0;

        for (int i = 0; i < n; i++) {
            TextRecord record = corpus.get(i);
            List<String> tokens = TextUtils.tokenize(record.text());
            wordCounts[i] = tokens.size();
            sentenceCounts[i] = TextUtils.sentences(record.text()).size();
            allTokens.addAll(tokens);

            List<String> content = new ArrayList<>(tokens);
            content.removeIf(stopWords::contains);
            for (Map.Entry<Integer, Map<String, Integer>> e : ngramCounts.entrySet()) {
                countNgrams(content, e.getKey(), e.getValue());
            }

            for (PartOfSpeech pos : tagger.tag(tokens)) {
                posCounts.merge(pos, 1, Integer::sum);
            }

            String category = categorize(new HashSet<>(tokens));
            assignments.put(record.id(), category);
            categoryDistribution.merge(category, 1, Integer::sum);

            questions += countChar(record.text(), '?');
            exclamations += countChar(record.text(), '!');
        }

        int totalTokens = allTokens.size();
        int uniqueTokens = new HashSet<>(allTokens).size();
        double lexicalDiversity = totalTokens == 0 ? 0.0 : (double) uniqueTokens / totalTokens;

        Map<Integer, List<TermCount>> ngrams = new LinkedHashMap<>();
        ngramCounts.forEach((size, counts) -> ngrams.put(size, TextUtils.topCounts(counts, topK)));

        Map<PartOfSpeech, Double> posDistribution = new EnumMap<>(PartOfSpeech.class);
        if (totalTokens > 0) {
            posCounts.forEach((pos, count) -> posDistribution.put(pos, (double) count / totalTokens));
        }

        List<String> contentTokens = new ArrayList<>(allTokens);
        contentTokens.removeIf(stopWords::contains);
        List<TermCount> topWords = TextUtils.topCounts(TextUtils.countInOrder(contentTokens), topK);

        TextUtils.Statistics wordStats = TextUtils.computeStatistics(wordCounts);
        TextUtils.Statistics sentenceStats = TextUtils.computeStatistics(sentenceCounts);

        List<AnalysisWarning> warnings = new ArrayList<>();
        if (!AnalyzerKind.CONTENT.meetsMinimum(n)) {
            warnings.add(AnalysisWarning.insufficientData(AnalysisWarning.INSUFFICIENT_DATA,
                "Only " + n + " records; content statistics need at least "
                    + AnalyzerKind.CONTENT.minimumRecords()));
        }
        ContentPatterns patterns = patterns(corpus);
        List<ContentGroup> groups = groups(corpus);

        int categorized = n - categoryDistribution.get(UNCATEGORIZED);
        double confidence = Math.min(1.0, n / 20.0) * 0.5 + Math.min(1.0, wordStats.mean() / 20.0) * 0.5;
        String summary = String.format(Locale.ROOT,
            "%d records, %.1f words on average, lexical diversity %.2f, %d categorized",
            n, wordStats.mean(), lexicalDiversity, categorized);

        logger.debug("Content analysis of {}: {} tokens, {} unique", corpus.sourceId(), totalTokens, uniqueTokens);

        return new ContentResult(
            new ResultEnvelope("structural", confidence, warnings, summary),
            n, wordStats, sentenceStats, lexicalDiversity, totalTokens, uniqueTokens,
            ngrams, posDistribution, assignments, categoryDistribution, topWords,
            (double) questions / n, (double) exclamations / n, patterns, groups);
    }

    /// Assigns the best-matching category for a token set.
    ///
    /// @param tokens lower-cased record tokens
    /// @return the category name or [#UNCATEGORIZED]
    public String categorize(Set<String> tokens) {
        String best = UNCATEGORIZED;
        double bestOverlap = categoryThreshold;
        for (Map.Entry<String, Set<String>> e : categories.entrySet()) {
            Set<String> keywords = e.getValue();
            if (keywords.isEmpty()) continue;
            int matched = 0;
            for (String keyword : keywords) {
                if (tokens.contains(keyword)) matched++;
            }
            double overlap = (double) matched / keywords.size();
            if (overlap > bestOverlap) {
                best = e.getKey();
                bestOverlap = overlap;
            }
        }
        return best;
    }

    /// Measures repetition of word sequences and sentences.
    ///
    /// @param corpus the records
    /// @return repetition measures
    public ContentPatterns patterns(TextCorpus corpus) {
        Map<String, Integer> bigrams = new LinkedHashMap<>();
        Map<String, Integer> trigrams = new LinkedHashMap<>();
        List<PhrasePattern> phrases = new ArrayList<>();
        for (TextRecord record : corpus) {
            List<String> content = TextUtils.tokenize(record.text());
            content.removeIf(stopWords::contains);
            countNgrams(content, 2, bigrams);
            countNgrams(content, 3, trigrams);

            List<String> sentences = TextUtils.sentences(record.text());
            List<Set<String>> words = new ArrayList<>();
            for (String sentence : sentences) {
                words.add(new HashSet<>(TextUtils.tokenize(sentence)));
            }
            for (int i = 0; i < sentences.size() && phrases.size() < MAX_PHRASE_PATTERNS; i++) {
                for (int j = i + 1; j < sentences.size() && phrases.size() < MAX_PHRASE_PATTERNS; j++) {
                    Set<String> shared = new HashSet<>(words.get(i));
                    shared.retainAll(words.get(j));
                    if (shared.size() >= MIN_SHARED_WORDS) {
                        phrases.add(new PhrasePattern(record.id(), sentences.get(i), sentences.get(j), shared.size()));
                    }
                }
            }
        }
        int totalBigrams = 0;
        for (int count : bigrams.values()) totalBigrams += count;
        double repetition = totalBigrams == 0 ? 0.0 : (double) (totalBigrams - bigrams.size()) / totalBigrams;
        return new ContentPatterns(totalBigrams, bigrams.size(), trigrams.size(), repetition, phrases);
    }

    /// Breaks the corpus down by shared metadata values.
    ///
    /// Every scalar metadata entry and the record category define a group
    /// `key=value`. Groups with fewer than two records are dropped.
    ///
    /// @param corpus the records
    /// @return groups in first-seen order
    public List<ContentGroup> groups(TextCorpus corpus) {
        Map<GroupKey, Set<TextRecord>> members = new LinkedHashMap<>();
        for (TextRecord record : corpus) {
            if (record.hasCategory()) {
                members.computeIfAbsent(new GroupKey(CATEGORY_GROUP, record.category()), k -> new LinkedHashSet<>())
                    .add(record);
            }
            record.metadata().forEach((key, value) ->
                members.computeIfAbsent(new GroupKey(key, String.valueOf(value)), k -> new LinkedHashSet<>())
                    .add(record));
        }
        List<ContentGroup> groups = new ArrayList<>();
        members.forEach((group, records) -> {
            if (records.size() >= 2) {
                groups.add(describeGroup(group, records));
            }
        });
        return groups;
    }

    private record GroupKey(String key, String value) {}

    private ContentGroup describeGroup(GroupKey group, Set<TextRecord> records) {
        int words = 0;
        int sentences = 0;
        int questions = 0;
        Set<String> unique = new HashSet<>();
        Map<String, Integer> keywordHits = new LinkedHashMap<>();
        for (TextRecord record : records) {
            List<String> tokens = TextUtils.tokenize(record.text());
            words += tokens.size();
            sentences += TextUtils.sentences(record.text()).size();
            questions += countChar(record.text(), '?');
            unique.addAll(tokens);
            for (Map.Entry<String, Set<String>> e : categories.entrySet()) {
                int hits = 0;
                for (String token : tokens) {
                    if (e.getValue().contains(token)) hits++;
                }
                keywordHits.merge(e.getKey(), hits, Integer::sum);
            }
        }
        String prominent = UNCATEGORIZED;
        int best = 0;
        for (Map.Entry<String, Integer> e : keywordHits.entrySet()) {
            if (e.getValue() > best) {
                prominent = e.getKey();
                best = e.getValue();
            }
        }
        int n = records.size();
        return new ContentGroup(group.key(), group.value(), n, words, (double) words / n,
            sentences == 0 ? 0.0 : (double) words / sentences,
            words == 0 ? 0.0 : (double) unique.size() / words,
            prominent, (double) questions / n);
    }

    private static int countChar(String text, char c) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) count++;
        }
        return count;
    }

    private static void countNgrams(List<String> tokens, int size, Map<String, Integer> counts) {
        for (int start = 0; start + size <= tokens.size(); start++) {
            counts.merge(String.join(" ", tokens.subList(start, start + size)), 1, Integer::sum);
        }
    }
}
