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
import io.fieldnotes.textshapes.text.StopWords;
import io.fieldnotes.textshapes.text.TextUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/// Immutable configuration for one analysis call.
///
/// ## Recognized Options
///
/// | Key | Type | Default |
/// |-----|------|---------|
/// | `analysis_type` | `auto` or comma-separated analyzer kinds | `auto` |
/// | `n_themes` | positive integer | 5 |
/// | `clustering_strategy` | `clustering` or `topic_model` | `clustering` |
/// | `stop_words` | set of words | bundled English list |
/// | `category_keywords` | map of category to single-word keywords | content defaults |
/// | `category_threshold` | keyword overlap in `[0, 1)` a category must exceed | 0.1 |
/// | `random_seed` | integer | 42 |
/// | `keyword_codes` | map of code name to keywords | none |
/// | `respondent_key` | metadata key | `respondent_id` |
/// | `ngram_sizes` | list of integers | 2, 3 |
/// | `top_k` | positive integer | 10 |
/// | `allow_degraded` | boolean | false |
/// | `parallel` | boolean | false |
///
/// ## Usage
///
/// ```java
/// AnalysisOptions options = AnalysisOptions.builder()
///     .nThemes(4)
///     .strategy(ThemeStrategy.TOPIC_MODEL)
///     .randomSeed(7)
///     .build();
///
/// AnalysisOptions fromCaller = AnalysisOptions.fromMap(Map.of(
///     "analysis_type", "sentiment,content",
///     "n_themes", 3));
/// ```
public final class AnalysisOptions {

    public static final int DEFAULT_N_THEMES = 5;
    public static final long DEFAULT_RANDOM_SEED = 42L;
    public static final int DEFAULT_TOP_K = 10;
    public static final double DEFAULT_CATEGORY_THRESHOLD = 0.1;
    public static final String DEFAULT_RESPONDENT_KEY = "respondent_id";
    public static final String AUTO = "auto";

    private static final AnalysisOptions DEFAULTS = builder().build();

    private final Set<AnalyzerKind> requestedKinds;
    private final int nThemes;
    private final ThemeStrategy strategy;
    private final Set<String> stopWords;
    private final Map<String, Set<String>> categoryKeywords;
    private final double categoryThreshold;
    private final long randomSeed;
    private final Map<String, List<String>> keywordCodes;
    private final String respondentKey;
    private final List<Integer> ngramSizes;
    private final int topK;
    private final boolean allowDegraded;
    private final boolean parallel;

    private AnalysisOptions(Builder b) {
        this.requestedKinds = Collections.unmodifiableSet(b.requestedKinds.isEmpty()
            ? EnumSet.noneOf(AnalyzerKind.class) : EnumSet.copyOf(b.requestedKinds));
        this.nThemes = b.nThemes;
        this.strategy = b.strategy;
        this.stopWords = b.stopWords;
        this.categoryKeywords = b.categoryKeywords;
        this.categoryThreshold = b.categoryThreshold;
        this.randomSeed = b.randomSeed;
        this.keywordCodes = b.keywordCodes;
        this.respondentKey = b.respondentKey;
        this.ngramSizes = b.ngramSizes;
        this.topK = b.topK;
        this.allowDegraded = b.allowDegraded;
        this.parallel = b.parallel;
    }

    public static AnalysisOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder pre-filled with this configuration.
    public Builder toBuilder() {
        Builder b = new Builder();
        b.requestedKinds.addAll(requestedKinds);
        b.nThemes = nThemes;
        b.strategy = strategy;
        b.stopWords = stopWords;
        b.categoryKeywords = categoryKeywords;
        b.categoryThreshold = categoryThreshold;
        b.randomSeed = randomSeed;
        b.keywordCodes = keywordCodes;
        b.respondentKey = respondentKey;
        b.ngramSizes = ngramSizes;
        b.topK = topK;
        b.allowDegraded = allowDegraded;
        b.parallel = parallel;
        return b;
    }

    /// Parses the string-keyed option surface.
    ///
    /// @param options option values keyed as in the class table
    /// @return the parsed options
    /// @throws ValidationException for unknown keys or malformed values
    public static AnalysisOptions fromMap(Map<String, ?> options) {
        Builder b = builder();
        for (Map.Entry<String, ?> e : options.entrySet()) {
            String key = e.getKey();
            Object value = e.getValue();
            if (value == null) {
                continue;
            }
            switch (key) {
                case "analysis_type" -> b.analysisType(String.valueOf(value));
                case "n_themes" -> b.nThemes(toInt(key, value));
                case "clustering_strategy" -> b.strategy(ThemeStrategy.fromName(String.valueOf(value)));
                case "stop_words" -> b.stopWords(toStrings(key, value));
                case "category_keywords" -> {
                    Map<String, Collection<String>> categories = new LinkedHashMap<>();
                    toMap(key, value).forEach((k, v) -> categories.put(k, toStrings(key, v)));
                    b.categoryKeywords(categories);
                }
                case "category_threshold" -> b.categoryThreshold(toDouble(key, value));
                case "random_seed" -> b.randomSeed(toLong(key, value));
                case "keyword_codes" -> {
                    Map<String, Collection<String>> codes = new LinkedHashMap<>();
                    toMap(key, value).forEach((k, v) -> codes.put(k, toStrings(key, v)));
                    b.keywordCodes(codes);
                }
                case "respondent_key" -> b.respondentKey(String.valueOf(value));
                case "ngram_sizes" -> {
                    List<Integer> sizes = new ArrayList<>();
                    for (String s : toStrings(key, value)) {
                        sizes.add(toInt(key, s));
                    }
                    b.ngramSizes(sizes);
                }
                case "top_k" -> b.topK(toInt(key, value));
                case "allow_degraded" -> b.allowDegraded(toBoolean(key, value));
                case "parallel" -> b.parallel(toBoolean(key, value));
                default -> throw new ValidationException("Unknown option: " + key);
            }
        }
        return b.build();
    }

    /// Parses options from properties.
    ///
    /// Map-valued options use dotted keys, e.g. `category_keywords.pricing=cost,price`
    /// and `keyword_codes.waiting=wait,queue`. List values are comma-separated.
    ///
    /// @param properties the properties
    /// @return the parsed options
    public static AnalysisOptions fromProperties(Properties properties) {
        Map<String, Object> flat = new LinkedHashMap<>();
        Map<String, Map<String, Object>> nested = new LinkedHashMap<>();
        for (String name : new TreeSet<>(properties.stringPropertyNames())) {
            String value = properties.getProperty(name);
            int dot = name.indexOf('.');
            if (dot > 0) {
                nested.computeIfAbsent(name.substring(0, dot), k -> new LinkedHashMap<>())
                    .put(name.substring(dot + 1), value);
            } else {
                flat.put(name, value);
            }
        }
        flat.putAll(nested);
        return fromMap(flat);
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Option " + key + " must be an integer, got: " + value, e);
        }
    }

    private static long toLong(String key, Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Option " + key + " must be an integer, got: " + value, e);
        }
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Option " + key + " must be a number, got: " + value, e);
        }
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String s = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (s.equals("true")) return true;
        if (s.equals("false")) return false;
        throw new ValidationException("Option " + key + " must be true or false, got: " + value);
    }

    private static List<String> toStrings(String key, Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof Collection<?> c) {
            for (Object o : c) out.add(String.valueOf(o));
        } else if (value instanceof String s) {
            for (String part : s.split(",")) {
                if (!part.isBlank()) out.add(part.trim());
            }
        } else {
            throw new ValidationException("Option " + key + " must be a list or comma-separated string");
        }
        return out;
    }

    private static Map<String, Object> toMap(String key, Object value) {
        if (!(value instanceof Map<?, ?> m)) {
            throw new ValidationException("Option " + key + " must be a map");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        m.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    /// True when the analyzers are chosen by auto-detection.
    public boolean isAuto() {
        return requestedKinds.isEmpty();
    }

    /// Explicitly requested analyzers; empty in auto mode.
    public Set<AnalyzerKind> requestedKinds() {
        return requestedKinds;
    }

    public int nThemes() {
        return nThemes;
    }

    public ThemeStrategy strategy() {
        return strategy;
    }

    public Set<String> stopWords() {
        return stopWords;
    }

    /// Caller categories for content categorization, or null for the defaults.
    public Map<String, Set<String>> categoryKeywords() {
        return categoryKeywords;
    }

    /// Keyword overlap a category must exceed to be assigned.
    public double categoryThreshold() {
        return categoryThreshold;
    }

    public long randomSeed() {
        return randomSeed;
    }

    /// Keyword rules for automatic coding, possibly empty.
    public Map<String, List<String>> keywordCodes() {
        return keywordCodes;
    }

    public String respondentKey() {
        return respondentKey;
    }

    public List<Integer> ngramSizes() {
        return ngramSizes;
    }

    public int topK() {
        return topK;
    }

    public boolean allowDegraded() {
        return allowDegraded;
    }

    public boolean parallel() {
        return parallel;
    }

    @Override
    public String toString() {
        return "AnalysisOptions[analysis_type=" + (isAuto() ? AUTO : requestedKinds)
            + ", n_themes=" + nThemes + ", clustering_strategy=" + strategy.mnemonic()
            + ", random_seed=" + randomSeed + ", ngram_sizes=" + ngramSizes
            + ", keyword_codes=" + keywordCodes.keySet() + ", parallel=" + parallel + "]";
    }

    public static final class Builder {
        private final Set<AnalyzerKind> requestedKinds = new LinkedHashSet<>();
        private int nThemes = DEFAULT_N_THEMES;
        private ThemeStrategy strategy = ThemeStrategy.CLUSTERING;
        private Set<String> stopWords = StopWords.english();
        private Map<String, Set<String>> categoryKeywords;
        private double categoryThreshold = DEFAULT_CATEGORY_THRESHOLD;
        private long randomSeed = DEFAULT_RANDOM_SEED;
        private Map<String, List<String>> keywordCodes = Map.of();
        private String respondentKey = DEFAULT_RESPONDENT_KEY;
        private List<Integer> ngramSizes = List.of(2, 3);
        private int topK = DEFAULT_TOP_K;
        private boolean allowDegraded;
        private boolean parallel;

        private Builder() {}

        /// Sets `auto` or a comma-separated list of analyzer kinds.
        ///
        /// @throws ValidationException for unknown kinds
        public Builder analysisType(String analysisType) {
            requestedKinds.clear();
            if (analysisType == null || analysisType.isBlank()
                || analysisType.trim().equalsIgnoreCase(AUTO)) {
                return this;
            }
            for (String part : analysisType.split(",")) {
                if (!part.isBlank()) {
                    requestedKinds.add(AnalyzerKind.fromName(part));
                }
            }
            return this;
        }

        public Builder analyze(AnalyzerKind... kinds) {
            requestedKinds.clear();
            Collections.addAll(requestedKinds, kinds);
            return this;
        }

        public Builder nThemes(int nThemes) {
            if (nThemes <= 0) {
                throw new ValidationException("n_themes must be positive, got: " + nThemes);
            }
            this.nThemes = nThemes;
            return this;
        }

        public Builder strategy(ThemeStrategy strategy) {
            this.strategy = Objects.requireNonNull(strategy, "strategy cannot be null");
            return this;
        }

        public Builder stopWords(Collection<String> stopWords) {
            this.stopWords = StopWords.of(Objects.requireNonNull(stopWords, "stopWords cannot be null"));
            return this;
        }

        public Builder categoryKeywords(Map<String, ? extends Collection<String>> categories) {
            Map<String, Set<String>> copy = new LinkedHashMap<>();
            categories.forEach((name, words) -> {
                if (name == null || name.isBlank()) {
                    throw new ValidationException("category_keywords has a blank category name");
                }
                Set<String> normalized = new LinkedHashSet<>();
                for (String w : words) {
                    if (w == null || w.isBlank()) continue;
                    String keyword = w.trim().toLowerCase(Locale.ROOT);
                    // categories are matched against single tokens
                    List<String> tokens = TextUtils.tokenize(keyword);
                    if (tokens.size() != 1 || tokens.get(0).length() != keyword.length()) {
                        throw new ValidationException("Category '" + name + "' keyword '" + w.trim()
                            + "' is not a single word");
                    }
                    normalized.add(tokens.get(0));
                }
                if (normalized.isEmpty()) {
                    throw new ValidationException("Category '" + name + "' has no keywords");
                }
                copy.put(name, Collections.unmodifiableSet(normalized));
            });
            this.categoryKeywords = Collections.unmodifiableMap(copy);
            return this;
        }

        public Builder categoryThreshold(double categoryThreshold) {
            if (!(categoryThreshold >= 0.0 && categoryThreshold < 1.0)) {
                throw new ValidationException("category_threshold must be in [0, 1), got: " + categoryThreshold);
            }
            this.categoryThreshold = categoryThreshold;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder keywordCodes(Map<String, ? extends Collection<String>> codes) {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            codes.forEach((name, words) -> {
                if (name == null || name.isBlank()) {
                    throw new ValidationException("keyword_codes has a blank code name");
                }
                List<String> keywords = new ArrayList<>();
                for (String w : words) {
                    if (w != null && !w.isBlank()) keywords.add(w.trim());
                }
                copy.put(name, List.copyOf(keywords));
            });
            this.keywordCodes = Collections.unmodifiableMap(copy);
            return this;
        }

        public Builder respondentKey(String respondentKey) {
            if (respondentKey == null || respondentKey.isBlank()) {
                throw new ValidationException("respondent_key must not be blank");
            }
            this.respondentKey = respondentKey;
            return this;
        }

        public Builder ngramSizes(List<Integer> sizes) {
            if (sizes.isEmpty()) {
                throw new ValidationException("ngram_sizes must not be empty");
            }
            for (Integer n : sizes) {
                if (n == null || n < 1) {
                    throw new ValidationException("ngram_sizes entries must be positive, got: " + n);
                }
            }
            this.ngramSizes = List.copyOf(new LinkedHashSet<>(sizes));
            return this;
        }

        public Builder topK(int topK) {
            if (topK <= 0) {
                throw new ValidationException("top_k must be positive, got: " + topK);
            }
            this.topK = topK;
            return this;
        }

        public Builder allowDegraded(boolean allowDegraded) {
            this.allowDegraded = allowDegraded;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }
}
