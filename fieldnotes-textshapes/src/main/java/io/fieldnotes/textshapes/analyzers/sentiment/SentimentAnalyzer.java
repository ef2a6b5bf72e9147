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

import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.corpus.TextRecord;
import io.fieldnotes.textshapes.harness.CorpusAnalyzer;
import io.fieldnotes.textshapes.result.AnalysisWarning;
import io.fieldnotes.textshapes.result.AnalyzerKind;
import io.fieldnotes.textshapes.result.ResultEnvelope;
import io.fieldnotes.textshapes.result.SentimentResult;
import io.fieldnotes.textshapes.text.TextUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/// Lexicon-based polarity, subjectivity and emotion scoring.
///
/// ## Per Record
///
/// Tokens are scored against [SentimentLexicon]. A modifier or negator
/// applies to the next scored word within two tokens. Record polarity and
/// subjectivity are the means over scored words, clamped to `[-1, 1]` and
/// `[0, 1]`.
///
/// Single-word and non-lexical records get polarity 0 and are flagged
/// `lowConfidence`; they never fail.
///
/// ## Corpus Aggregates
///
/// - mean and median polarity, mean subjectivity
/// - volatility: population variance of polarity, exactly 0 when every
///   record has the same polarity
/// - daily trend when any record has a timestamp
/// - per-category breakdown when any record has a category
/// - label, emotion and intensity distributions, shift count and consistency
///
/// ## Usage
/// ```java
/// SentimentResult result = new SentimentAnalyzer().score(corpus);
/// double mean = result.meanPolarity();
/// ```
///
/// This analyzer has no hard minimum; below five records the envelope carries
/// an `insufficient_data` warning.
public final class SentimentAnalyzer implements CorpusAnalyzer<SentimentResult> {

    private static final Logger logger = LogManager.getLogger(SentimentAnalyzer.class);

    /// Tokens a modifier or negator reaches forward.
    private static final int SHIFTER_WINDOW = 2;

    private final SentimentLexicon lexicon;

    public SentimentAnalyzer() {
        this(SentimentLexicon.defaultLexicon());
    }

    public SentimentAnalyzer(SentimentLexicon lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public AnalyzerKind getAnalyzerKind() {
        return AnalyzerKind.SENTIMENT;
    }

    @Override
    public String getDescription() {
        return "Lexicon polarity, subjectivity and emotion per record with corpus trends";
    }

    @Override
    public SentimentResult run(TextCorpus corpus) {
        return score(corpus);
    }

    /// Scores every record and aggregates.
    ///
    /// @param corpus a non-empty corpus
    /// @return per-record scores and aggregates
    public SentimentResult score(TextCorpus corpus) {
        corpus.requireNonEmpty("Sentiment analysis");

        List<RecordSentiment> scored = new ArrayList<>(corpus.size());
        for (TextRecord record : corpus) {
            scored.add(scoreRecord(record));
        }

        double[] polarities = new double[scored.size()];
        double subjectivitySum = 0.0;
        double confidenceSum = 0.0;
        int lowConfidence = 0;
        Map<SentimentLabel, Integer> labels = new EnumMap<>(SentimentLabel.class);
        Map<Emotion, Integer> emotions = new EnumMap<>(Emotion.class);
        Map<IntensityLevel, Integer> intensities = new EnumMap<>(IntensityLevel.class);
        for (int i = 0; i < scored.size(); i++) {
            RecordSentiment rs = scored.get(i);
            polarities[i] = rs.polarity();
            subjectivitySum += rs.subjectivity();
            confidenceSum += rs.confidence();
            if (rs.lowConfidence()) lowConfidence++;
            labels.merge(rs.label(), 1, Integer::sum);
            emotions.merge(rs.emotion(), 1, Integer::sum);
            intensities.merge(rs.intensityLevel(), 1, Integer::sum);
        }

        int n = scored.size();
        TextUtils.Statistics stats = TextUtils.computeStatistics(polarities);
        double meanPolarity = stats.mean();
        double volatility = allEqual(polarities) ? 0.0 : stats.stdDev() * stats.stdDev();
        double medianPolarity = TextUtils.median(polarities);
        double meanSubjectivity = subjectivitySum / n;

        List<TrendPoint> trend = corpus.hasTimestamps() ? trend(corpus, scored) : List.of();
        Map<String, CategorySentiment> byCategory = corpus.hasCategories()
            ? byCategory(corpus, scored) : Map.of();

        List<SentimentLabel> sequence = timeOrderedLabels(corpus, scored);
        int shifts = 0;
        for (int i = 1; i < sequence.size(); i++) {
            if (sequence.get(i) != sequence.get(i - 1)) shifts++;
        }
        double consistency = sequence.size() < 2 ? 1.0 : 1.0 - (double) shifts / (sequence.size() - 1);

        List<AnalysisWarning> warnings = new ArrayList<>();
        if (!AnalyzerKind.SENTIMENT.meetsMinimum(n)) {
            warnings.add(AnalysisWarning.insufficientData(AnalysisWarning.INSUFFICIENT_DATA,
                "Only " + n + " records scored; sentiment aggregates need at least "
                    + AnalyzerKind.SENTIMENT.minimumRecords()));
        }
        if (lowConfidence > 0) {
            warnings.add(AnalysisWarning.lowConfidence(
                lowConfidence + " of " + n + " records are single-word or carry no sentiment terms"));
        }

        String summary = String.format(Locale.ROOT, "%d records, mean polarity %.2f (%s), volatility %.3f",
            n, meanPolarity, SentimentLabel.of(meanPolarity).name().toLowerCase(Locale.ROOT), volatility);
        ResultEnvelope envelope = new ResultEnvelope("lexicon", confidenceSum / n, warnings, summary);

        logger.debug("Scored {} records: mean polarity {}, {} low-confidence", n, meanPolarity, lowConfidence);

        return new SentimentResult(envelope, scored, meanPolarity, medianPolarity, meanSubjectivity,
            volatility, trend, byCategory, labels, emotions, intensities, shifts, consistency);
    }

    /// Scores a single record.
    ///
    /// @param record the record
    /// @return its sentiment
    public RecordSentiment scoreRecord(TextRecord record) {
        List<String> tokens = TextUtils.tokenize(record.text());
        double confidence = Math.min(1.0, tokens.size() / 10.0);

        double polaritySum = 0.0;
        double subjectivitySum = 0.0;
        int matched = 0;
        double modifier = 1.0;
        boolean negated = false;
        int sinceShifter = 0;
        for (String token : tokens) {
            if (lexicon.isNegator(token)) {
                negated = true;
                sinceShifter = 0;
                continue;
            }
            if (lexicon.isModifier(token)) {
                modifier *= lexicon.modifier(token);
                sinceShifter = 0;
                continue;
            }
            SentimentLexicon.Entry entry = lexicon.lookup(token);
            if (entry == null) {
                if (++sinceShifter > SHIFTER_WINDOW) {
                    modifier = 1.0;
                    negated = false;
                }
                continue;
            }
            double p = entry.polarity() * modifier;
            if (negated) {
                p *= SentimentLexicon.NEGATION_FACTOR;
            }
            polaritySum += TextUtils.clamp(p, -1.0, 1.0);
            subjectivitySum += TextUtils.clamp(entry.subjectivity() * Math.max(1.0, modifier), 0.0, 1.0);
            matched++;
            modifier = 1.0;
            negated = false;
            sinceShifter = 0;
        }

        boolean lowConfidence = tokens.size() < 2 || matched == 0;
        double polarity = 0.0;
        double subjectivity = 0.0;
        if (!lowConfidence) {
            polarity = TextUtils.clamp(polaritySum / matched, -1.0, 1.0);
            subjectivity = TextUtils.clamp(subjectivitySum / matched, 0.0, 1.0);
        }
        Emotion emotion = lowConfidence ? Emotion.NEUTRAL : dominantEmotion(tokens);

        return new RecordSentiment(record.id(), polarity, subjectivity, emotion, Math.abs(polarity),
            IntensityLevel.of(polarity), SentimentLabel.of(polarity), confidence, lowConfidence, matched);
    }

    /// Most frequent emotion keyword family; ties go to declaration order.
    static Emotion dominantEmotion(List<String> tokens) {
        Emotion best = Emotion.NEUTRAL;
        int bestCount = 0;
        for (Emotion emotion : Emotion.values()) {
            int count = 0;
            for (String token : tokens) {
                if (emotion.keywords().contains(token)) count++;
            }
            if (count > bestCount) {
                best = emotion;
                bestCount = count;
            }
        }
        return best;
    }

    private static boolean allEqual(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (values[i] != values[0]) return false;
        }
        return true;
    }

    private static List<TrendPoint> trend(TextCorpus corpus, List<RecordSentiment> scored) {
        Map<LocalDate, double[]> daily = new TreeMap<>();
        for (int i = 0; i < corpus.size(); i++) {
            TextRecord record = corpus.get(i);
            if (!record.hasTimestamp()) continue;
            LocalDate day = record.timestamp().atZone(ZoneOffset.UTC).toLocalDate();
            double[] acc = daily.computeIfAbsent(day, d -> new double[2]);
            acc[0] += scored.get(i).polarity();
            acc[1]++;
        }
        List<TrendPoint> trend = new ArrayList<>(daily.size());
        daily.forEach((day, acc) -> trend.add(new TrendPoint(day, acc[0] / acc[1], (int) acc[1])));
        return trend;
    }

    private static Map<String, CategorySentiment> byCategory(TextCorpus corpus, List<RecordSentiment> scored) {
        Map<String, double[]> acc = new LinkedHashMap<>();
        for (int i = 0; i < corpus.size(); i++) {
            TextRecord record = corpus.get(i);
            if (!record.hasCategory()) continue;
            double[] a = acc.computeIfAbsent(record.category(), c -> new double[3]);
            a[0] += scored.get(i).polarity();
            a[1] += scored.get(i).subjectivity();
            a[2]++;
        }
        Map<String, CategorySentiment> out = new LinkedHashMap<>();
        acc.forEach((category, a) -> {
            double mean = a[0] / a[2];
            out.put(category, new CategorySentiment(category, (int) a[2], mean, a[1] / a[2], SentimentLabel.of(mean)));
        });
        return out;
    }

    /// Labels in timestamp order when timestamps exist, otherwise corpus order.
    private static List<SentimentLabel> timeOrderedLabels(TextCorpus corpus, List<RecordSentiment> scored) {
        List<Integer> order = new ArrayList<>();
        boolean timed = corpus.hasTimestamps();
        for (int i = 0; i < corpus.size(); i++) {
            if (!timed || corpus.get(i).hasTimestamp()) order.add(i);
        }
        if (timed) {
            order.sort(Comparator.comparing(i -> corpus.get(i).timestamp()));
        }
        List<SentimentLabel> labels = new ArrayList<>(order.size());
        for (int i : order) {
            labels.add(scored.get(i).label());
        }
        return labels;
    }
}
