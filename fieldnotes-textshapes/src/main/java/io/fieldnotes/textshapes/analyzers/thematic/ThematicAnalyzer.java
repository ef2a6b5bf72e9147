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
import io.fieldnotes.textshapes.corpus.TextRecord;
import io.fieldnotes.textshapes.harness.CorpusAnalyzer;
import io.fieldnotes.textshapes.result.AnalysisWarning;
import io.fieldnotes.textshapes.result.AnalyzerKind;
import io.fieldnotes.textshapes.result.ResultEnvelope;
import io.fieldnotes.textshapes.result.ThematicResult;
import io.fieldnotes.textshapes.text.TextUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.IntToDoubleFunction;

/// Groups records into themes.
///
/// ## Strategies
///
/// | Strategy | Engine | Membership |
/// |----------|--------|------------|
/// | [ThemeStrategy#CLUSTERING] | [KMeansClusterer] over unit TF vectors | exactly one theme per record; `k` non-empty themes |
/// | [ThemeStrategy#TOPIC_MODEL] | [TopicModelEstimator] over raw counts | most probable topic; topics may be empty |
///
/// Both use one [TermVectorizer] vocabulary per call and the configured seed.
///
/// ## Degraded Mode
///
/// Below [AnalyzerKind#THEMATIC]'s minimum the corpus becomes one theme with
/// all records and an `insufficient_data_for_clustering` warning. A theme
/// count above the record count is clamped with a `themes_clamped` warning.
///
/// ## Theme Quality
///
/// Each theme's coherence is the mean pairwise cosine similarity between the
/// corpus occurrence vectors of its top [#COHERENCE_TERMS] terms; themes with
/// fewer than two terms score 0.
///
/// ## Usage
/// ```java
/// ThematicResult result = new ThematicAnalyzer(options)
///     .identifyThemes(corpus, 4, ThemeStrategy.CLUSTERING);
/// for (Theme theme : result.themes()) {
///     System.out.println(theme.label() + " " + theme.size());
/// }
/// ```
public final class ThematicAnalyzer implements CorpusAnalyzer<ThematicResult> {

    private static final Logger logger = LogManager.getLogger(ThematicAnalyzer.class);

    public static final int EXEMPLAR_COUNT = 3;
    public static final int TOP_TERMS = 10;
    public static final int COHERENCE_TERMS = 5;
    public static final int LABEL_TERMS = 3;

    /// Minimum top-term Jaccard overlap for two themes to be related.
    public static final double RELATIONSHIP_THRESHOLD = 0.1;

    private final Set<String> stopWords;
    private final int nThemes;
    private final ThemeStrategy strategy;
    private final long seed;

    public ThematicAnalyzer() {
        this(AnalysisOptions.defaults());
    }

    public ThematicAnalyzer(AnalysisOptions options) {
        this.stopWords = options.stopWords();
        this.nThemes = options.nThemes();
        this.strategy = options.strategy();
        this.seed = options.randomSeed();
    }

    @Override
    public AnalyzerKind getAnalyzerKind() {
        return AnalyzerKind.THEMATIC;
    }

    @Override
    public String getDescription() {
        return "Theme identification by cosine k-means or probabilistic topic modeling";
    }

    @Override
    public ThematicResult run(TextCorpus corpus) {
        return identifyThemes(corpus, nThemes, strategy);
    }

    /// Identifies themes with the configured count and strategy.
    public ThematicResult identifyThemes(TextCorpus corpus) {
        return identifyThemes(corpus, nThemes, strategy);
    }

    /// Identifies themes.
    ///
    /// @param corpus a non-empty corpus
    /// @param requestedThemes positive number of themes
    /// @param strategy grouping strategy
    /// @return themes with quality scores
    public ThematicResult identifyThemes(TextCorpus corpus, int requestedThemes, ThemeStrategy strategy) {
        corpus.requireNonEmpty("Thematic analysis");
        if (requestedThemes <= 0) {
            throw new ValidationException("n_themes must be positive, got: " + requestedThemes);
        }
        TermVectorizer.TermMatrix matrix = TermVectorizer.vectorize(corpus, stopWords);
        int n = corpus.size();
        List<AnalysisWarning> warnings = new ArrayList<>();

        if (!AnalyzerKind.THEMATIC.meetsMinimum(n)) {
            warnings.add(AnalysisWarning.insufficientData(AnalysisWarning.INSUFFICIENT_DATA_FOR_CLUSTERING,
                "Only " + n + " records; clustering needs at least " + AnalyzerKind.THEMATIC.minimumRecords()
                    + ", so all records form a single theme"));
            logger.warn("Thematic analysis of {} degraded to a single theme ({} records)", corpus.sourceId(), n);
            return degraded(corpus, matrix, requestedThemes, strategy, warnings);
        }

        int k = requestedThemes;
        if (k > n) {
            warnings.add(AnalysisWarning.insufficientData(AnalysisWarning.THEMES_CLAMPED,
                "Requested " + requestedThemes + " themes for " + n + " records; using " + n));
            k = n;
        }

        int[] assignments;
        double[][] memberScores;
        List<List<Integer>> termRanking;
        int iterations;
        boolean converged;
        String method;
        if (strategy == ThemeStrategy.CLUSTERING) {
            double[][] unit = matrix.normalizedRows();
            KMeansClusterer.ClusteringResult fit = new KMeansClusterer(unit, k, seed).fit();
            assignments = fit.assignments();
            memberScores = new double[n][k];
            for (int i = 0; i < n; i++) {
                for (int c = 0; c < k; c++) {
                    memberScores[i][c] = TextUtils.cosineSimilarity(unit[i], fit.centroids()[c]);
                }
            }
            termRanking = rankTermsByMembership(matrix, assignments, k);
            iterations = fit.iterations();
            converged = fit.converged();
            method = "kmeans_cosine";
            logger.debug("Clustering fit: {}", fit);
        } else {
            TopicModelEstimator.TopicModelResult fit = new TopicModelEstimator(matrix.counts(), k, seed).fit();
            assignments = fit.hardAssignments();
            memberScores = fit.docTopics();
            termRanking = rankTermsByWeight(fit.topicTerms());
            iterations = fit.iterations();
            converged = fit.converged();
            method = "plsa_em";
            logger.debug("Topic model fit: {}", fit);
        }
        if (!converged) {
            warnings.add(AnalysisWarning.convergence(
                method + " did not converge within " + iterations + " iterations; returning the best fit found"));
            logger.warn("Thematic analysis of {} did not converge after {} iterations", corpus.sourceId(), iterations);
        }

        List<Theme> themes = new ArrayList<>(k);
        for (int t = 0; t < k; t++) {
            List<Integer> members = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if (assignments[i] == t) members.add(i);
            }
            final int theme = t;
            themes.add(buildTheme(t, corpus, matrix, members, termRanking.get(t), i -> memberScores[i][theme]));
        }
        return assemble(corpus, strategy, requestedThemes, themes, false, iterations, converged,
            matrix.dimensions(), method, warnings);
    }

    private ThematicResult degraded(TextCorpus corpus, TermVectorizer.TermMatrix matrix, int requestedThemes,
                                    ThemeStrategy strategy, List<AnalysisWarning> warnings) {
        int n = corpus.size();
        List<Integer> members = new ArrayList<>(n);
        int[] assignments = new int[n];
        for (int i = 0; i < n; i++) members.add(i);
        double[][] unit = matrix.normalizedRows();
        double[] centroid = new double[matrix.dimensions()];
        for (double[] row : unit) {
            for (int d = 0; d < centroid.length; d++) centroid[d] += row[d] / n;
        }
        List<List<Integer>> ranking = rankTermsByMembership(matrix, assignments, 1);
        Theme theme = buildTheme(0, corpus, matrix, members, ranking.get(0),
            i -> TextUtils.cosineSimilarity(unit[i], centroid));
        return assemble(corpus, strategy, requestedThemes, List.of(theme), true, 0, true,
            matrix.dimensions(), "single_theme", warnings);
    }

    private ThematicResult assemble(TextCorpus corpus, ThemeStrategy strategy, int requestedThemes,
                                    List<Theme> themes, boolean degraded, int iterations, boolean converged,
                                    int vocabularySize, String method, List<AnalysisWarning> warnings) {
        List<ThemeRelationship> relationships = new ArrayList<>();
        for (int a = 0; a < themes.size(); a++) {
            for (int b = a + 1; b < themes.size(); b++) {
                double similarity = TextUtils.jaccard(new HashSet<>(themes.get(a).topTerms()),
                    new HashSet<>(themes.get(b).topTerms()));
                if (similarity > RELATIONSHIP_THRESHOLD) {
                    relationships.add(new ThemeRelationship(a, b, similarity));
                }
            }
        }

        List<ThemePeriod> evolution = corpus.hasTimestamps() ? evolution(corpus, themes) : List.of();

        double weighted = 0.0;
        int total = 0;
        Theme largest = themes.get(0);
        for (Theme theme : themes) {
            weighted += theme.coherence() * theme.size();
            total += theme.size();
            if (theme.size() > largest.size()) largest = theme;
        }
        double confidence = total == 0 ? 0.0 : weighted / total;
        if (degraded) confidence *= 0.5;
        confidence = TextUtils.clamp(confidence, 0.0, 1.0);

        String summary = String.format(Locale.ROOT, "%d theme%s over %d records via %s; largest '%s' (%d records)",
            themes.size(), themes.size() == 1 ? "" : "s", corpus.size(), method, largest.label(), largest.size());

        return new ThematicResult(new ResultEnvelope(method, confidence, warnings, summary),
            strategy, requestedThemes, themes, degraded, iterations, converged, vocabularySize,
            relationships, evolution);
    }

    private Theme buildTheme(int id, TextCorpus corpus, TermVectorizer.TermMatrix matrix, List<Integer> members,
                             List<Integer> rankedTerms, IntToDoubleFunction score) {
        List<String> memberIds = new ArrayList<>(members.size());
        for (int i : members) memberIds.add(corpus.get(i).id());

        List<Integer> byScore = new ArrayList<>(members);
        // stable sort keeps corpus order among equal scores
        byScore.sort((a, b) -> Double.compare(score.applyAsDouble(b), score.applyAsDouble(a)));
        List<Theme.Exemplar> exemplars = new ArrayList<>();
        for (int i = 0; i < Math.min(EXEMPLAR_COUNT, byScore.size()); i++) {
            TextRecord record = corpus.get(byScore.get(i));
            exemplars.add(new Theme.Exemplar(record.id(), record.text(), score.applyAsDouble(byScore.get(i))));
        }

        List<String> topTerms = new ArrayList<>();
        for (int term : rankedTerms) {
            if (topTerms.size() == TOP_TERMS) break;
            topTerms.add(matrix.vocabulary().get(term));
        }
        String label = topTerms.isEmpty()
            ? "theme-" + (id + 1)
            : String.join(" / ", topTerms.subList(0, Math.min(LABEL_TERMS, topTerms.size())));

        return new Theme(id, label, memberIds, exemplars, topTerms,
            coherence(matrix, rankedTerms.subList(0, Math.min(COHERENCE_TERMS, rankedTerms.size()))));
    }

    /// Mean pairwise cosine similarity of the terms' occurrence vectors.
    static double coherence(TermVectorizer.TermMatrix matrix, List<Integer> terms) {
        if (terms.size() < 2) {
            return 0.0;
        }
        double sum = 0.0;
        int pairs = 0;
        for (int a = 0; a < terms.size(); a++) {
            double[] colA = matrix.column(terms.get(a));
            for (int b = a + 1; b < terms.size(); b++) {
                sum += TextUtils.cosineSimilarity(colA, matrix.column(terms.get(b)));
                pairs++;
            }
        }
        return TextUtils.clamp(sum / pairs, 0.0, 1.0);
    }

    /// Terms ranked by total count within each cluster; zero-count terms are left out.
    private static List<List<Integer>> rankTermsByMembership(TermVectorizer.TermMatrix matrix, int[] assignments, int k) {
        double[][] weights = new double[k][matrix.dimensions()];
        for (int i = 0; i < assignments.length; i++) {
            for (int w = 0; w < matrix.dimensions(); w++) {
                weights[assignments[i]][w] += matrix.counts()[i][w];
            }
        }
        return rankTermsByWeight(weights);
    }

    private static List<List<Integer>> rankTermsByWeight(double[][] weights) {
        List<List<Integer>> ranking = new ArrayList<>(weights.length);
        for (double[] row : weights) {
            List<Integer> terms = new ArrayList<>();
            for (int w = 0; w < row.length; w++) {
                if (row[w] > 0.0) terms.add(w);
            }
            // stable: equal weights keep vocabulary (first-seen) order
            terms.sort((a, b) -> Double.compare(row[b], row[a]));
            ranking.add(terms);
        }
        return ranking;
    }

    private static List<ThemePeriod> evolution(TextCorpus corpus, List<Theme> themes) {
        Map<String, Integer> themeOf = new LinkedHashMap<>();
        for (Theme theme : themes) {
            for (String id : theme.memberIds()) themeOf.put(id, theme.id());
        }
        Map<LocalDate, Map<Integer, Integer>> periods = new TreeMap<>();
        for (TextRecord record : corpus) {
            if (!record.hasTimestamp()) continue;
            LocalDate day = record.timestamp().atZone(ZoneOffset.UTC).toLocalDate();
            Map<Integer, Integer> counts = periods.computeIfAbsent(day, d -> {
                Map<Integer, Integer> init = new LinkedHashMap<>();
                for (Theme theme : themes) init.put(theme.id(), 0);
                return init;
            });
            counts.merge(themeOf.get(record.id()), 1, Integer::sum);
        }
        List<ThemePeriod> out = new ArrayList<>(periods.size());
        periods.forEach((day, counts) -> out.add(new ThemePeriod(day, counts)));
        return out;
    }
}
