package io.fieldnotes.textshapes.analyzers.survey;

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

import io.fieldnotes.textshapes.analyzers.content.ContentAnalyzer;
import io.fieldnotes.textshapes.analyzers.sentiment.SentimentAnalyzer;
import io.fieldnotes.textshapes.config.AnalysisOptions;
import io.fieldnotes.textshapes.corpus.SurveyDataset;
import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.corpus.TextRecord;
import io.fieldnotes.textshapes.harness.CorpusAnalyzer;
import io.fieldnotes.textshapes.result.AnalysisWarning;
import io.fieldnotes.textshapes.result.AnalyzerKind;
import io.fieldnotes.textshapes.result.ResultEnvelope;
import io.fieldnotes.textshapes.result.SurveyResult;
import io.fieldnotes.textshapes.text.ResponseMarkers;
import io.fieldnotes.textshapes.text.TextUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Survey-level analysis: per question, across questions, and per respondent.
///
/// ## Per Question
///
/// Each question corpus runs through [ContentAnalyzer] and
/// [SentimentAnalyzer] when it has at least five answers. Smaller questions
/// are reported as [QuestionStatus#LIMITED] with response patterns only, and
/// unanswered ones as [QuestionStatus#NO_RESPONSES]. An empty question is
/// never an error.
///
/// ## Respondents
///
/// Respondents are identified by a metadata key, `respondent_id` unless
/// configured otherwise. For each respondent:
///
/// ```
/// completion  = answered / questions
/// consistency = 1 - min(1, CV(words per answer))
/// engagement  = 0.5 completion + 0.3 consistency + 0.2 min(1, meanWords / 20)
/// ```
///
/// Roster entries without answers are listed as excluded rather than scored.
///
/// ## Usage
/// ```java
/// SurveyResult result = new SurveyAnalyzer(options).analyze(dataset);
/// QuestionReport q1 = result.byQuestion().get("q1");
/// ```
public final class SurveyAnalyzer implements CorpusAnalyzer<SurveyResult> {

    private static final Logger logger = LogManager.getLogger(SurveyAnalyzer.class);

    /// Answers needed for content and sentiment analysis of a question.
    public static final int MIN_QUESTION_RESPONSES =
        Math.max(AnalyzerKind.CONTENT.minimumRecords(), AnalyzerKind.SENTIMENT.minimumRecords());

    private static final int SHORT_WORDS = 3;
    private static final int DETAILED_WORDS = 20;

    private final ContentAnalyzer contentAnalyzer;
    private final SentimentAnalyzer sentimentAnalyzer;
    private final String respondentKey;

    public SurveyAnalyzer() {
        this(AnalysisOptions.defaults());
    }

    public SurveyAnalyzer(AnalysisOptions options) {
        this.contentAnalyzer = new ContentAnalyzer(options);
        this.sentimentAnalyzer = new SentimentAnalyzer();
        this.respondentKey = options.respondentKey();
    }

    @Override
    public AnalyzerKind getAnalyzerKind() {
        return AnalyzerKind.SURVEY;
    }

    @Override
    public String getDescription() {
        return "Per-question analysis, question comparison and respondent engagement";
    }

    /// Groups the corpus by its `question_id` metadata and analyzes the result.
    @Override
    public SurveyResult run(TextCorpus corpus) {
        return analyze(SurveyDataset.fromCorpus(corpus, TextCorpus.QUESTION_ID_KEY));
    }

    /// Runs all survey analyses.
    ///
    /// Respondent patterns are included when any answer carries the
    /// respondent key or the dataset has a roster.
    public SurveyResult analyze(SurveyDataset dataset) {
        Map<String, QuestionReport> byQuestion = analyzeByQuestion(dataset);
        QuestionComparison comparison = compareQuestions(dataset);
        RespondentPatterns respondents = hasRespondents(dataset)
            ? analyzeRespondentPatterns(dataset, respondentKey) : null;

        int ok = 0;
        int limited = 0;
        int empty = 0;
        List<AnalysisWarning> warnings = new ArrayList<>();
        for (QuestionReport report : byQuestion.values()) {
            switch (report.status()) {
                case OK -> ok++;
                case LIMITED -> limited++;
                case NO_RESPONSES -> empty++;
            }
        }
        if (limited > 0) {
            warnings.add(AnalysisWarning.insufficientData(AnalysisWarning.INSUFFICIENT_DATA,
                limited + " question(s) have fewer than " + MIN_QUESTION_RESPONSES
                    + " responses and were not analyzed for content or sentiment"));
        }
        if (respondents != null && respondents.unattributedResponses() > 0) {
            warnings.add(AnalysisWarning.dataQuality(AnalysisWarning.UNATTRIBUTED_RESPONSES,
                respondents.unattributedResponses() + " response(s) lack the '" + respondentKey + "' key"));
        }

        int questions = dataset.questionCount();
        double confidence = questions == 0 ? 0.0 : (double) ok / questions;
        StringBuilder summary = new StringBuilder(String.format(Locale.ROOT,
            "%d questions, %d responses: %d analyzed, %d limited, %d without responses",
            questions, dataset.totalResponses(), ok, limited, empty));
        if (comparison.mostPositive() != null) {
            summary.append("; most positive '").append(comparison.mostPositive()).append('\'');
        }
        if (respondents != null) {
            summary.append(String.format(Locale.ROOT, "; %d respondents, mean engagement %.2f",
                respondents.respondents().size(), respondents.meanEngagement()));
        }
        logger.debug("Survey {} analyzed: {}", dataset.surveyId(), summary);

        return new SurveyResult(new ResultEnvelope("per_question", confidence, warnings, summary.toString()),
            byQuestion, comparison, respondents);
    }

    /// Analyzes each question independently.
    ///
    /// @return one report per question, in dataset order
    public Map<String, QuestionReport> analyzeByQuestion(SurveyDataset dataset) {
        Map<String, QuestionReport> reports = new LinkedHashMap<>();
        dataset.questions().forEach((questionId, corpus) -> reports.put(questionId, analyzeQuestion(questionId, corpus)));
        return Collections.unmodifiableMap(reports);
    }

    private QuestionReport analyzeQuestion(String questionId, TextCorpus corpus) {
        if (corpus.isEmpty()) {
            return new QuestionReport(questionId, QuestionStatus.NO_RESPONSES, 0, null, null,
                ResponsePatterns.EMPTY, null, List.of());
        }
        ResponsePatterns patterns = responsePatterns(corpus);
        RepresentativeResponses representatives = representatives(corpus);
        if (corpus.size() < MIN_QUESTION_RESPONSES) {
            AnalysisWarning warning = AnalysisWarning.insufficientData(AnalysisWarning.INSUFFICIENT_DATA,
                "Question " + questionId + " has " + corpus.size() + " responses; content and sentiment need "
                    + MIN_QUESTION_RESPONSES);
            return new QuestionReport(questionId, QuestionStatus.LIMITED, corpus.size(), null, null,
                patterns, representatives, List.of(warning));
        }
        return new QuestionReport(questionId, QuestionStatus.OK, corpus.size(),
            contentAnalyzer.analyzeStructure(corpus), sentimentAnalyzer.score(corpus),
            patterns, representatives, List.of());
    }

    /// Counts stock answers and length bands.
    public static ResponsePatterns responsePatterns(TextCorpus corpus) {
        if (corpus.isEmpty()) {
            return ResponsePatterns.EMPTY;
        }
        int valid = 0;
        int nonResponses = 0;
        int uncertain = 0;
        int shortResponses = 0;
        int detailed = 0;
        int positive = 0;
        int negative = 0;
        long words = 0;
        long chars = 0;
        for (TextRecord record : corpus) {
            String text = record.text();
            int wc = TextUtils.wordCount(text);
            words += wc;
            chars += text.length();
            if (ResponseMarkers.isNonResponse(text)) {
                nonResponses++;
            } else {
                valid++;
                if (ResponseMarkers.isUncertain(text)) {
                    uncertain++;
                } else if (wc < SHORT_WORDS) {
                    shortResponses++;
                } else if (wc >= DETAILED_WORDS) {
                    detailed++;
                }
            }
            if (ResponseMarkers.hasPositiveIndicator(text)) positive++;
            if (ResponseMarkers.hasNegativeIndicator(text)) negative++;
        }
        int n = corpus.size();
        return new ResponsePatterns(n, valid, nonResponses, uncertain, shortResponses, detailed,
            positive, negative, (double) words / n, (double) chars / n);
    }

    /// Picks the longest, median-length and shortest answers.
    ///
    /// Ties in length keep corpus order.
    public static RepresentativeResponses representatives(TextCorpus corpus) {
        if (corpus.isEmpty()) {
            return null;
        }
        List<TextRecord> byLength = new ArrayList<>(corpus.records());
        byLength.sort(Comparator.comparingInt((TextRecord r) -> r.text().length()).reversed());
        int last = byLength.size() - 1;
        TextRecord median = byLength.size() > 2 ? byLength.get(byLength.size() / 2) : null;
        TextRecord shortest = last > 0 ? byLength.get(last) : null;
        return new RepresentativeResponses(byLength.get(0), median, shortest);
    }

    /// Compares answered questions by sentiment, length and response rate.
    public QuestionComparison compareQuestions(SurveyDataset dataset) {
        Map<String, QuestionMetrics> metrics = new LinkedHashMap<>();
        dataset.questions().forEach((questionId, corpus) -> {
            if (!corpus.isEmpty()) metrics.put(questionId, metrics(questionId, corpus));
        });

        List<String> bySentiment = new ArrayList<>(metrics.keySet());
        bySentiment.sort((a, b) -> Double.compare(metrics.get(b).meanPolarity(), metrics.get(a).meanPolarity()));
        List<String> byLength = new ArrayList<>(metrics.keySet());
        byLength.sort((a, b) -> Double.compare(metrics.get(b).meanWords(), metrics.get(a).meanWords()));

        List<String> ids = new ArrayList<>(metrics.keySet());
        List<QuestionDifference> differences = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                QuestionMetrics a = metrics.get(ids.get(i));
                QuestionMetrics b = metrics.get(ids.get(j));
                differences.add(new QuestionDifference(a.questionId(), b.questionId(),
                    Math.abs(a.meanPolarity() - b.meanPolarity()),
                    Math.abs(a.meanWords() - b.meanWords()),
                    Math.abs(a.responseRate() - b.responseRate())));
            }
        }
        differences.sort((a, b) -> Double.compare(b.sentimentDifference(), a.sentimentDifference()));

        String mostNegative = bySentiment.isEmpty() ? null : bySentiment.get(bySentiment.size() - 1);
        // ties go to the earlier question
        for (String id : ids) {
            if (metrics.get(id).meanPolarity() == metrics.get(mostNegative).meanPolarity()) {
                mostNegative = id;
                break;
            }
        }
        return new QuestionComparison(metrics, bySentiment, byLength,
            bySentiment.isEmpty() ? null : bySentiment.get(0), mostNegative,
            byLength.isEmpty() ? null : byLength.get(0), differences);
    }

    private QuestionMetrics metrics(String questionId, TextCorpus corpus) {
        double[] polarity = new double[corpus.size()];
        double[] words = new double[corpus.size()];
        int valid = 0;
        for (int i = 0; i < corpus.size(); i++) {
            TextRecord record = corpus.get(i);
            polarity[i] = sentimentAnalyzer.scoreRecord(record).polarity();
            words[i] = TextUtils.wordCount(record.text());
            if (!ResponseMarkers.isNonResponse(record.text())) valid++;
        }
        TextUtils.Statistics p = TextUtils.computeStatistics(polarity);
        TextUtils.Statistics w = TextUtils.computeStatistics(words);
        return new QuestionMetrics(questionId, corpus.size(), p.mean(), p.stdDev() * p.stdDev(), w.mean(),
            (double) valid / corpus.size());
    }

    /// Profiles respondents across the survey.
    ///
    /// Completion counts asked questions only; answers in the unassigned
    /// group add to a respondent's word counts but not to completion.
    ///
    /// @param dataset the survey
    /// @param respondentKey metadata key holding the respondent id
    /// @return engagement per respondent
    public RespondentPatterns analyzeRespondentPatterns(SurveyDataset dataset, String respondentKey) {
        int questions = dataset.askedQuestionCount();
        Map<String, Set<String>> answeredQuestions = new LinkedHashMap<>();
        Map<String, List<Double>> wordCounts = new LinkedHashMap<>();
        int unattributed = 0;
        for (Map.Entry<String, TextCorpus> entry : dataset.questions().entrySet()) {
            for (TextRecord record : entry.getValue()) {
                String respondent = record.metadataValue(respondentKey).orElse(null);
                if (respondent == null) {
                    unattributed++;
                    continue;
                }
                Set<String> answered = answeredQuestions.computeIfAbsent(respondent, k -> new LinkedHashSet<>());
                if (dataset.isQuestion(entry.getKey())) {
                    answered.add(entry.getKey());
                }
                wordCounts.computeIfAbsent(respondent, k -> new ArrayList<>())
                    .add((double) TextUtils.wordCount(record.text()));
            }
        }

        List<RespondentEngagement> respondents = new ArrayList<>();
        Map<EngagementLevel, Integer> levels = new EnumMap<>(EngagementLevel.class);
        for (EngagementLevel level : EngagementLevel.values()) levels.put(level, 0);
        double engagementSum = 0.0;
        for (Map.Entry<String, Set<String>> entry : answeredQuestions.entrySet()) {
            List<Double> counts = wordCounts.get(entry.getKey());
            double[] values = new double[counts.size()];
            for (int i = 0; i < values.length; i++) values[i] = counts.get(i);
            TextUtils.Statistics stats = TextUtils.computeStatistics(values);

            int answered = entry.getValue().size();
            double completion = questions == 0 ? 0.0 : (double) answered / questions;
            double consistency = 1.0 - Math.min(1.0, stats.coefficientOfVariation());
            double engagement = 0.5 * completion + 0.3 * consistency + 0.2 * Math.min(1.0, stats.mean() / 20.0);
            EngagementLevel level = EngagementLevel.of(completion, stats.mean());
            respondents.add(new RespondentEngagement(entry.getKey(), answered, questions, completion,
                stats.mean(), consistency, engagement, level));
            levels.merge(level, 1, Integer::sum);
            engagementSum += engagement;
        }

        List<String> excluded = new ArrayList<>();
        for (String rostered : dataset.roster()) {
            if (!answeredQuestions.containsKey(rostered)) excluded.add(rostered);
        }
        if (!excluded.isEmpty()) {
            logger.debug("Survey {}: {} rostered respondents gave no answers", dataset.surveyId(), excluded.size());
        }
        double meanEngagement = respondents.isEmpty() ? 0.0 : engagementSum / respondents.size();
        return new RespondentPatterns(respondentKey, respondents, excluded, unattributed, meanEngagement, levels);
    }

    private boolean hasRespondents(SurveyDataset dataset) {
        if (!dataset.roster().isEmpty()) return true;
        for (TextCorpus corpus : dataset.questions().values()) {
            if (corpus.hasMetadataKey(respondentKey)) return true;
        }
        return false;
    }
}
