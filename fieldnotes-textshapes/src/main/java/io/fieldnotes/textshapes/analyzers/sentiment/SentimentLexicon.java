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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/// Word-level polarity and subjectivity scores plus the valence shifters.
///
/// ## Resource Format
///
/// `sentiment-lexicon.tsv` holds one entry per line:
/// ```
/// word<TAB>polarity<TAB>subjectivity
/// ```
/// Lines starting with `#` are comments.
///
/// ## Valence Shifters
///
/// - intensifiers multiply the next scored word (`very good` scores above `good`)
/// - diminishers damp it
/// - negators flip and halve it (`not good` becomes mildly negative)
public final class SentimentLexicon {

    private static final Logger logger = LogManager.getLogger(SentimentLexicon.class);

    static final String RESOURCE = "sentiment-lexicon.tsv";

    private static final Map<String, Double> INTENSIFIERS = Map.of(
        "very", 1.3, "extremely", 1.8, "highly", 1.5, "completely", 1.6,
        "absolutely", 1.7, "totally", 1.6, "really", 1.3, "so", 1.2, "incredibly", 1.8);

    private static final Map<String, Double> DIMINISHERS = Map.of(
        "slightly", 0.5, "somewhat", 0.7, "rather", 0.8, "fairly", 0.8,
        "quite", 0.9, "bit", 0.7, "barely", 0.4, "kinda", 0.7);

    private static final Set<String> NEGATORS = Set.of(
        "not", "no", "never", "none", "nobody", "nothing", "neither", "nor", "cannot", "without",
        "don't", "doesn't", "didn't", "isn't", "wasn't", "aren't", "weren't", "won't", "wouldn't",
        "can't", "couldn't", "shouldn't", "hasn't", "haven't", "hadn't");

    /// Multiplier applied to a negated word's polarity.
    public static final double NEGATION_FACTOR = -0.5;

    private static final SentimentLexicon DEFAULT = new SentimentLexicon(load());

    private final Map<String, Entry> entries;

    private SentimentLexicon(Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /// Returns the bundled English lexicon.
    public static SentimentLexicon defaultLexicon() {
        return DEFAULT;
    }

    /// Looks up a lower-cased word.
    ///
    /// @return the entry, or null if the word carries no sentiment
    public Entry lookup(String word) {
        return entries.get(word);
    }

    public int size() {
        return entries.size();
    }

    /// Intensifier or diminisher multiplier for a word, or 1.0.
    public double modifier(String word) {
        Double m = INTENSIFIERS.get(word);
        if (m != null) return m;
        m = DIMINISHERS.get(word);
        return m != null ? m : 1.0;
    }

    public boolean isModifier(String word) {
        return INTENSIFIERS.containsKey(word) || DIMINISHERS.containsKey(word);
    }

    public boolean isNegator(String word) {
        return NEGATORS.contains(word);
    }

    private static Map<String, Entry> load() {
        Map<String, Entry> entries = new HashMap<>();
        try (InputStream in = SentimentLexicon.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + RESOURCE);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                String[] parts = line.split("\t");
                if (parts.length != 3) {
                    throw new IllegalStateException(RESOURCE + ":" + lineNumber + " expected 3 columns");
                }
                entries.put(parts[0].trim(),
                    new Entry(Double.parseDouble(parts[1].trim()), Double.parseDouble(parts[2].trim())));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }
        logger.debug("Loaded {} sentiment lexicon entries", entries.size());
        return entries;
    }

    /// Lexicon scores of one word.
    ///
    /// @param polarity in `[-1, 1]`
    /// @param subjectivity in `[0, 1]`
    public record Entry(double polarity, double subjectivity) {}
}
