package io.fieldnotes.textshapes.detect;

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

import io.fieldnotes.textshapes.analyzers.thematic.ThemeStrategy;
import io.fieldnotes.textshapes.config.AnalysisOptions;
import io.fieldnotes.textshapes.corpus.SurveyDataset;
import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.corpus.TextRecord;
import io.fieldnotes.textshapes.result.AnalyzerKind;
import io.fieldnotes.textshapes.text.TextUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/// Classifies a dataset and ranks the analyzers for it.
///
/// ## Profile Rules
///
/// Applied in order:
///
/// 1. fewer than 3 records: [DatasetProfile#INSUFFICIENT_DATA]
/// 2. question grouping present: [DatasetProfile#STRUCTURED_SURVEY] when the
///    mean is under 8 words or at least half the records use rating language,
///    otherwise [DatasetProfile#OPEN_SURVEY]
/// 3. length coefficient of variation above 1.0: [DatasetProfile#MIXED]
/// 4. interview markers in at least 30 % of records, or a mean of 50 words or
///    more: [DatasetProfile#INTERVIEW]
/// 5. otherwise [DatasetProfile#OPEN_SURVEY]
///
/// ## Scoring
///
/// ```
/// score = clamp((n >= minimum ? 0.4 : -0.2) + 0.6 * methodScore, 0, 1)
/// ```
///
/// | Analyzer | methodScore |
/// |----------|-------------|
/// | sentiment | `min(1, 0.3 + opinionRatio)` |
/// | content | `min(1, 0.5 + 0.5 structureRatio)` |
/// | thematic | `min(1, 0.4 + n / 50)` from 10 records, else 0.2 |
/// | coding | `min(1, 0.5 + causalRatio)` with keyword codes, else 0 |
/// | survey | 1 with a question grouping, else 0 |
/// | statistics | 0.8 |
///
/// ## Status
///
/// Below its minimum, thematic and sentiment are DEGRADED while content and
/// coding are SKIPPED. Coding is also SKIPPED without keyword codes, survey
/// without a grouping, and any analyzer the profile does not list.
public final class AutoDetector {

    private static final Logger logger = LogManager.getLogger(AutoDetector.class);

    private static final Pattern INTERVIEW_SPEAKER =
        Pattern.compile("(?im)(^|\\s)(interviewer|interviewee|respondent|participant|q|a)\\s*:");
    private static final List<String> INTERVIEW_PHRASES = List.of(
        "tell me about", "how do you", "what is your", "can you describe", "walk me through");
    private static final List<String> SURVEY_PHRASES = List.of(
        "strongly agree", "strongly disagree", "agree", "disagree", "satisfied", "rating", "scale",
        "questionnaire", "excellent", "good", "fair", "poor", "1 5", "1 10");
    private static final Set<String> OPINION_WORDS = Set.of(
        "think", "feel", "believe", "opinion", "good", "bad", "like", "dislike");
    private static final Set<String> STRUCTURE_WORDS = Set.of(
        "first", "second", "third", "finally", "category", "type", "section", "item");
    private static final Pattern STRUCTURE_MARKUP = Pattern.compile("(?m)(:|^\\s*([-•*]|\\d+[.)])\\s)");
    private static final List<String> CAUSAL_PHRASES = List.of(
        "because", "reason", "cause", "due to", "result", "therefore", "since");

    private final boolean hasKeywordCodes;

    public AutoDetector() {
        this(AnalysisOptions.defaults());
    }

    public AutoDetector(AnalysisOptions options) {
        this.hasKeywordCodes = !options.keywordCodes().isEmpty();
    }

    /// Assesses a flat corpus. Records carrying `question_id` metadata count as grouped.
    public DatasetAssessment assess(TextCorpus corpus) {
        boolean grouped = corpus.hasMetadataKey(TextCorpus.QUESTION_ID_KEY);
        int questions = grouped ? corpus.groupByMetadata(TextCorpus.QUESTION_ID_KEY).size() : 0;
        return assess(characterize(corpus, grouped, questions));
    }

    /// Assesses a survey over all of its answers.
    public DatasetAssessment assess(SurveyDataset dataset) {
        return assess(characterize(dataset.flatten(), true, dataset.questionCount()));
    }

    /// Profiles and ranks from measured characteristics.
    public DatasetAssessment assess(DatasetCharacteristics c) {
        DatasetProfile profile = profile(c);
        List<Recommendation> recommendations = recommend(c, profile);
        int n = c.recordCount();
        int themes = Math.min(Math.max(3, n / 5), 8);
        ThemeStrategy strategy = n < 100 ? ThemeStrategy.CLUSTERING : ThemeStrategy.TOPIC_MODEL;
        DatasetAssessment assessment = new DatasetAssessment(profile, c, recommendations, qualityWarnings(c),
            themes, strategy);
        logger.debug("Assessed {} records as {}; selected {}", n, profile, assessment.selectedKinds());
        return assessment;
    }

    /// Measures a corpus.
    ///
    /// @param corpus the records
    /// @param grouped whether answers are grouped by question
    /// @param questionCount number of question groups
    public static DatasetCharacteristics characterize(TextCorpus corpus, boolean grouped, int questionCount) {
        int n = corpus.size();
        double[] words = new double[n];
        int interview = 0;
        int survey = 0;
        int opinion = 0;
        int structure = 0;
        int causal = 0;
        long tokenCount = 0;
        Set<String> vocabulary = new HashSet<>();
        Set<String> distinct = new HashSet<>();
        for (int i = 0; i < n; i++) {
            TextRecord record = corpus.get(i);
            String text = record.text();
            List<String> tokens = TextUtils.tokenize(text);
            words[i] = tokens.size();
            tokenCount += tokens.size();
            vocabulary.addAll(tokens);
            String padded = " " + String.join(" ", tokens) + " ";
            distinct.add(padded);

            if (INTERVIEW_SPEAKER.matcher(text).find() || containsPhrase(padded, INTERVIEW_PHRASES)) interview++;
            if (containsPhrase(padded, SURVEY_PHRASES)) survey++;
            if (containsWord(tokens, OPINION_WORDS)) opinion++;
            if (STRUCTURE_MARKUP.matcher(text).find() || containsWord(tokens, STRUCTURE_WORDS)) structure++;
            if (containsPhrase(padded, CAUSAL_PHRASES)) causal++;
        }
        TextUtils.Statistics stats = n == 0 ? new TextUtils.Statistics(0, 0, 0, 0) : TextUtils.computeStatistics(words);
        double share = n == 0 ? 0.0 : 1.0 / n;
        return new DatasetCharacteristics(n, stats.mean(), stats.coefficientOfVariation(),
            tokenCount == 0 ? 0.0 : (double) vocabulary.size() / tokenCount,
            n == 0 ? 0.0 : (double) distinct.size() / n,
            grouped, questionCount, corpus.hasTimestamps(), corpus.hasCategories(),
            interview * share, survey * share, opinion * share, structure * share, causal * share,
            SampleSize.of(n));
    }

    /// Applies the profile rules.
    public static DatasetProfile profile(DatasetCharacteristics c) {
        if (c.recordCount() < 3) {
            return DatasetProfile.INSUFFICIENT_DATA;
        }
        if (c.grouped()) {
            return c.meanWords() < 8 || c.surveyPatternRatio() >= 0.5
                ? DatasetProfile.STRUCTURED_SURVEY : DatasetProfile.OPEN_SURVEY;
        }
        if (c.lengthVariation() > 1.0) {
            return DatasetProfile.MIXED;
        }
        if (c.interviewMarkerRatio() >= 0.3 || c.meanWords() >= 50) {
            return DatasetProfile.INTERVIEW;
        }
        return DatasetProfile.OPEN_SURVEY;
    }

    /// Scores every analyzer; selected ones first, then by score, then run order.
    public List<Recommendation> recommend(DatasetCharacteristics c, DatasetProfile profile) {
        List<Recommendation> out = new ArrayList<>();
        for (AnalyzerKind kind : AnalyzerKind.values()) {
            out.add(recommendation(kind, c, profile));
        }
        out.sort(Comparator
            .comparing((Recommendation r) -> r.status() == Recommendation.Status.SKIPPED)
            .thenComparing(Comparator.comparingDouble(Recommendation::score).reversed())
            .thenComparing(Recommendation::kind));
        return out;
    }

    private Recommendation recommendation(AnalyzerKind kind, DatasetCharacteristics c, DatasetProfile profile) {
        int n = c.recordCount();
        boolean meets = kind.meetsMinimum(n);
        double methodScore;
        String basis;
        switch (kind) {
            case SENTIMENT -> {
                methodScore = Math.min(1.0, 0.3 + c.opinionRatio());
                basis = String.format(Locale.ROOT, "opinion language in %.0f%% of records", c.opinionRatio() * 100);
            }
            case CONTENT -> {
                methodScore = Math.min(1.0, 0.5 + 0.5 * c.structureRatio());
                basis = String.format(Locale.ROOT, "structure markers in %.0f%% of records", c.structureRatio() * 100);
            }
            case THEMATIC -> {
                methodScore = n >= AnalyzerKind.THEMATIC.minimumRecords() ? Math.min(1.0, 0.4 + n / 50.0) : 0.2;
                basis = n + " records to group";
            }
            case CODING -> {
                methodScore = hasKeywordCodes ? Math.min(1.0, 0.5 + c.causalRatio()) : 0.0;
                basis = String.format(Locale.ROOT, "causal language in %.0f%% of records", c.causalRatio() * 100);
            }
            case SURVEY -> {
                methodScore = c.grouped() ? 1.0 : 0.0;
                basis = c.grouped() ? c.questionCount() + " question group(s)" : "no question grouping";
            }
            default -> {
                methodScore = 0.8;
                basis = "always applicable";
            }
        }
        double score = TextUtils.clamp((meets ? 0.4 : -0.2) + 0.6 * methodScore, 0.0, 1.0);

        Recommendation.Status status;
        String reason;
        if (!profile.isApplicable(kind)) {
            status = Recommendation.Status.SKIPPED;
            reason = "not applicable to " + profile.name().toLowerCase(Locale.ROOT) + " data";
        } else if (kind == AnalyzerKind.SURVEY && !c.grouped()) {
            status = Recommendation.Status.SKIPPED;
            reason = "requires answers grouped by question";
        } else if (kind == AnalyzerKind.CODING && !hasKeywordCodes) {
            status = Recommendation.Status.SKIPPED;
            reason = "no keyword codes configured";
        } else if (!meets) {
            boolean degradable = kind == AnalyzerKind.THEMATIC || kind == AnalyzerKind.SENTIMENT;
            status = degradable ? Recommendation.Status.DEGRADED : Recommendation.Status.SKIPPED;
            reason = "needs " + kind.minimumRecords() + " records, has " + n
                + (degradable ? "; runs in degraded mode" : "");
        } else {
            status = Recommendation.Status.RUN;
            reason = "suitable";
        }
        return new Recommendation(kind, score, status, Recommendation.Priority.of(score), reason + "; " + basis);
    }

    private static List<String> qualityWarnings(DatasetCharacteristics c) {
        List<String> warnings = new ArrayList<>();
        if (c.recordCount() < 5) {
            warnings.add("Very small text sample; results may not be reliable");
        }
        if (c.meanWords() < 5) {
            warnings.add("Texts are very short, which limits analysis depth");
        }
        if (c.recordCount() > 0 && c.uniqueRatio() < 0.8) {
            warnings.add("High text duplication detected, which may skew results");
        }
        return warnings;
    }

    private static boolean containsPhrase(String padded, List<String> phrases) {
        for (String phrase : phrases) {
            if (padded.contains(" " + phrase + " ")) return true;
        }
        return false;
    }

    private static boolean containsWord(List<String> tokens, Set<String> words) {
        for (String t : tokens) {
            if (words.contains(t)) return true;
        }
        return false;
    }
}
