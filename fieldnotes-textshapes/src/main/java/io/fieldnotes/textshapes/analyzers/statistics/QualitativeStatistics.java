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

import io.fieldnotes.textshapes.analyzers.sentiment.SentimentLabel;
import io.fieldnotes.textshapes.analyzers.thematic.Theme;
import io.fieldnotes.textshapes.config.AnalysisOptions;
import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.corpus.TextRecord;
import io.fieldnotes.textshapes.harness.CorpusAnalyzer;
import io.fieldnotes.textshapes.result.AnalysisReport;
import io.fieldnotes.textshapes.result.AnalysisResult;
import io.fieldnotes.textshapes.result.AnalysisWarning;
import io.fieldnotes.textshapes.result.AnalyzerKind;
import io.fieldnotes.textshapes.result.CodingResult;
import io.fieldnotes.textshapes.result.ContentResult;
import io.fieldnotes.textshapes.result.ResultEnvelope;
import io.fieldnotes.textshapes.result.SentimentResult;
import io.fieldnotes.textshapes.result.StatisticsResult;
import io.fieldnotes.textshapes.result.SurveyResult;
import io.fieldnotes.textshapes.result.ThematicResult;
import io.fieldnotes.textshapes.text.ResponseMarkers;
import io.fieldnotes.textshapes.text.TextUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Corpus-wide descriptive statistics, data quality, insights and
/// methodology recommendations.
///
/// ## Modes
///
/// - **standalone**: [#generateComprehensiveSummary(TextCorpus)] looks at the
///   corpus only.
/// - **summarizing**: [#generateComprehensiveSummary(TextCorpus, Map)] also
///   reads results of the other analyzers; sentiment and content confidence
///   enter the quality score and each supplied result may add an insight.
///
/// The quality score formulas are documented on [DataQuality].
///
/// ## Usage
/// ```java
/// StatisticsResult stats = new QualitativeStatistics().generateComprehensiveSummary(corpus);
/// double quality = stats.quality().score();
/// ```
public final class QualitativeStatistics implements CorpusAnalyzer<StatisticsResult> {

    private static final Logger logger = LogManager.getLogger(QualitativeStatistics.class);

    /// Words a record needs to count as adequate.
    public static final int ADEQUATE_WORDS = 5;
    /// Records below this many words are very short.
    public static final int SHORT_WORDS = 3;

    private static final Set<String> FILLER = Set.of(
        "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by");

    private final Set<String> stopWords;
    private final int topK;

    public QualitativeStatistics() {
        this(AnalysisOptions.defaults());
    }

    public QualitativeStatistics(AnalysisOptions options) {
        this.stopWords = options.stopWords();
        this.topK = options.topK();
    }

    @Override
    public AnalyzerKind getAnalyzerKind() {
        return AnalyzerKind.STATISTICS;
    }

    @Override
    public String getDescription() {
        return "Descriptive statistics, data quality score, insights and recommendations";
    }

    @Override
    public StatisticsResult run(TextCorpus corpus) {
        return generateComprehensiveSummary(corpus);
    }

    public StatisticsResult generateComprehensiveSummary(List<String> texts) {
        return generateComprehensiveSummary(TextCorpus.ofTexts("texts", texts));
    }

    public StatisticsResult generateComprehensiveSummary(TextCorpus corpus) {
        return generateComprehensiveSummary(corpus, Map.of());
    }

    /// Summarizes a corpus together with a finished report's results.
    public StatisticsResult generateComprehensiveSummary(TextCorpus corpus, AnalysisReport report) {
        return generateComprehensiveSummary(corpus, report.getResults());
    }

    /// Summarizes a corpus, optionally over prior analyzer results.
    ///
    /// @param corpus a non-empty corpus
    /// @param prior results of other analyzers, possibly empty; a statistics entry is ignored
    /// @return statistics, quality, insights and recommendations
    public StatisticsResult generateComprehensiveSummary(TextCorpus corpus, Map<AnalyzerKind, ? extends AnalysisResult> prior) {
        corpus.requireNonEmpty("Statistical summary");

        DescriptiveSummary descriptive = describe(corpus);
        Double analyzerConfidence = analyzerConfidence(prior);
        DataQuality quality = assessQuality(corpus, analyzerConfidence);

        Set<AnalyzerKind> summarized = EnumSet.noneOf(AnalyzerKind.class);
        for (AnalyzerKind kind : prior.keySet()) {
            if (kind != AnalyzerKind.STATISTICS) summarized.add(kind);
        }

        List<Insight> insights = insights(descriptive, quality, prior);
        List<String> recommendations = recommendations(corpus.size(), quality);

        List<AnalysisWarning> warnings = new ArrayList<>();
        if (quality.duplicates() > 0) {
            warnings.add(AnalysisWarning.dataQuality(AnalysisWarning.DUPLICATE_RESPONSES,
                quality.duplicates() + " record(s) repeat an earlier response"));
        }
        String method = summarized.isEmpty() ? "descriptive" : "descriptive_summary";
        String summary = String.format(Locale.ROOT,
            "%d records, %.1f words on average, vocabulary %d, data quality %.1f/100",
            descriptive.recordCount(), descriptive.meanWords(), descriptive.vocabularySize(), quality.score());
        logger.debug("Statistics for {}: {}", corpus.sourceId(), summary);

        return new StatisticsResult(new ResultEnvelope(method, quality.score() / 100.0, warnings, summary),
            descriptive, quality, insights, recommendations, summarized);
    }

    /// Computes descriptive statistics.
    public DescriptiveSummary describe(TextCorpus corpus) {
        DescriptiveStatistics words = new DescriptiveStatistics();
        long totalChars = 0;
        int sentences = 0;
        List<String> allTokens = new ArrayList<>();
        List<String> contentTokens = new ArrayList<>();
        for (TextRecord record : corpus) {
            List<String> tokens = TextUtils.tokenize(record.text());
            words.addValue(tokens.size());
            totalChars += record.text().length();
            sentences += TextUtils.sentences(record.text()).size();
            allTokens.addAll(tokens);
            for (String token : tokens) {
                if (!stopWords.contains(token)) contentTokens.add(token);
            }
        }
        Map<String, Integer> counts = TextUtils.countInOrder(allTokens);
        int hapax = 0;
        for (int c : counts.values()) {
            if (c == 1) hapax++;
        }
        int n = corpus.size();
        double skewness = n < 3 || Double.isNaN(words.getSkewness()) ? 0.0 : words.getSkewness();
        double stdDev = n < 2 ? 0.0 : words.getStandardDeviation();
        return new DescriptiveSummary(n, (long) words.getSum(), totalChars, words.getMean(),
            words.getPercentile(50), stdDev, words.getMin(), words.getMax(),
            words.getPercentile(25), words.getPercentile(75), skewness, (double) totalChars / n, sentences,
            counts.size(), allTokens.isEmpty() ? 0.0 : (double) counts.size() / allTokens.size(), hapax,
            TextUtils.topCounts(TextUtils.countInOrder(contentTokens), topK));
    }

    /// Scores data quality; pass null `analyzerConfidence` for standalone mode.
    public DataQuality assessQuality(TextCorpus corpus, Double analyzerConfidence) {
        int n = corpus.size();
        int adequate = 0;
        int nonResponses = 0;
        int veryShort = 0;
        int repetitive = 0;
        int lowInformation = 0;
        int unusable = 0;
        Set<String> distinct = new HashSet<>();
        for (TextRecord record : corpus) {
            List<String> tokens = TextUtils.tokenize(record.text());
            boolean nonResponse = ResponseMarkers.isNonResponse(record.text());
            if (tokens.size() >= ADEQUATE_WORDS) adequate++;
            if (nonResponse) nonResponses++;
            if (tokens.size() < SHORT_WORDS) veryShort++;
            if (nonResponse || tokens.size() < SHORT_WORDS) unusable++;
            if (tokens.size() > ADEQUATE_WORDS) {
                if (new HashSet<>(tokens).size() < 0.5 * tokens.size()) repetitive++;
                int content = 0;
                for (String t : tokens) {
                    if (!FILLER.contains(t)) content++;
                }
                if (content < 0.3 * tokens.size()) lowInformation++;
            }
            distinct.add(TextUtils.normalize(record.text()));
        }
        double adequacy = (double) adequate / n;
        double answered = 1.0 - (double) nonResponses / n;
        double uniqueness = (double) distinct.size() / n;
        double score = analyzerConfidence == null
            ? 100.0 * (0.4 * adequacy + 0.3 * answered + 0.3 * uniqueness)
            : 100.0 * (0.35 * adequacy + 0.25 * answered + 0.2 * uniqueness + 0.2 * analyzerConfidence);
        double usability = 100.0 * (n - unusable) / n;
        double richness = 100.0 * Math.max(0, n - repetitive - lowInformation) / n;
        return new DataQuality(TextUtils.clamp(score, 0.0, 100.0), adequacy, answered, uniqueness,
            analyzerConfidence, usability, richness, nonResponses, veryShort, repetitive, lowInformation,
            n - distinct.size());
    }

    private static Double analyzerConfidence(Map<AnalyzerKind, ? extends AnalysisResult> prior) {
        double sum = 0.0;
        int count = 0;
        for (AnalyzerKind kind : List.of(AnalyzerKind.SENTIMENT, AnalyzerKind.CONTENT)) {
            AnalysisResult result = prior.get(kind);
            if (result != null) {
                sum += result.envelope().confidence();
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    private static List<Insight> insights(DescriptiveSummary d, DataQuality q,
                                          Map<AnalyzerKind, ? extends AnalysisResult> prior) {
        List<Insight> insights = new ArrayList<>();
        if (d.meanWords() < 10) {
            insights.add(new Insight(InsightPriority.MEDIUM, "length", String.format(Locale.ROOT,
                "Responses are brief (%.1f words on average); prompts that invite more detail would help",
                d.meanWords())));
        } else if (d.meanWords() > 100) {
            insights.add(new Insight(InsightPriority.LOW, "length", String.format(Locale.ROOT,
                "Responses are very detailed (%.1f words on average), indicating high engagement", d.meanWords())));
        }
        if (q.score() > 80) {
            insights.add(new Insight(InsightPriority.LOW, "quality",
                "Data quality is excellent with high completion and content richness"));
        } else if (q.score() < 50) {
            insights.add(new Insight(InsightPriority.HIGH, "quality", String.format(Locale.ROOT,
                "Data quality concerns detected (score %.1f); review the collection method", q.score())));
        }
        if (d.lexicalDiversity() > 0.7) {
            insights.add(new Insight(InsightPriority.LOW, "vocabulary",
                "High lexical diversity indicates rich and varied language"));
        } else if (d.lexicalDiversity() < 0.3) {
            insights.add(new Insight(InsightPriority.MEDIUM, "vocabulary",
                "Low lexical diversity suggests repetitive or constrained responses"));
        }
        if (q.duplicates() > 0) {
            insights.add(new Insight(InsightPriority.MEDIUM, "duplicates",
                q.duplicates() + " response(s) duplicate earlier ones"));
        }

        if (prior.get(AnalyzerKind.SENTIMENT) instanceof SentimentResult sentiment) {
            SentimentLabel overall = SentimentLabel.of(sentiment.meanPolarity());
            insights.add(new Insight(InsightPriority.MEDIUM, "sentiment", String.format(Locale.ROOT,
                "Overall sentiment is %s (mean polarity %.2f)",
                overall.name().toLowerCase(Locale.ROOT).replace('_', ' '), sentiment.meanPolarity())));
        }
        if (prior.get(AnalyzerKind.THEMATIC) instanceof ThematicResult thematic && !thematic.themes().isEmpty()) {
            Theme largest = thematic.themes().stream().max(Comparator.comparingInt(Theme::size)).orElseThrow();
            insights.add(new Insight(thematic.degraded() ? InsightPriority.LOW : InsightPriority.MEDIUM, "themes",
                String.format(Locale.ROOT, "%d theme(s) found; the largest, '%s', covers %d records",
                    thematic.themes().size(), largest.label(), largest.size())));
        }
        if (prior.get(AnalyzerKind.CODING) instanceof CodingResult coding) {
            insights.add(new Insight(InsightPriority.LOW, "coding", String.format(Locale.ROOT,
                "Keyword codes cover %.0f%% of records", coding.coverage() * 100)));
        }
        if (prior.get(AnalyzerKind.CONTENT) instanceof ContentResult content && !content.topWords().isEmpty()) {
            insights.add(new Insight(InsightPriority.LOW, "content",
                "Most frequent term: '" + content.topWords().get(0).term() + "'"));
        }
        if (prior.get(AnalyzerKind.SURVEY) instanceof SurveyResult survey
            && survey.comparison().mostContrasting() != null) {
            var pair = survey.comparison().mostContrasting();
            insights.add(new Insight(InsightPriority.MEDIUM, "survey", String.format(Locale.ROOT,
                "Questions %s and %s differ most in sentiment (%.2f)", pair.first(), pair.second(),
                pair.sentimentDifference())));
        }
        // stable: insertion order within a priority
        insights.sort(Comparator.comparing(Insight::priority));
        return insights;
    }

    private static List<String> recommendations(int n, DataQuality q) {
        List<String> out = new ArrayList<>();
        if (n < AnalyzerKind.THEMATIC.minimumRecords()) {
            out.add("Collect at least " + AnalyzerKind.THEMATIC.minimumRecords()
                + " responses for reliable thematic analysis");
        }
        if (q.completionRate() < 70) {
            out.add("Simplify questions or give clearer instructions to improve response rates");
        }
        if (q.richnessScore() < 60) {
            out.add("Encourage more detailed and varied responses");
        }
        if (q.duplicates() > 0) {
            out.add("Review duplicate responses before drawing conclusions");
        }
        if (out.isEmpty()) {
            out.add("Data is suitable for the selected analyses");
        }
        return out;
    }
}
