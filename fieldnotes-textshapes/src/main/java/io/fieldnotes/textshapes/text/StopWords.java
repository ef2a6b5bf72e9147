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

import io.fieldnotes.textshapes.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/// Stop-word sets used by n-gram extraction, vectorization and top-word tables.
///
/// The bundled English list is loaded once from `stopwords-en.txt` on the
/// classpath. Callers may replace it per analysis through
/// [io.fieldnotes.textshapes.config.AnalysisOptions].
public final class StopWords {

    private static final Logger logger = LogManager.getLogger(StopWords.class);

    static final String ENGLISH_RESOURCE = "stopwords-en.txt";

    private static final Set<String> ENGLISH = load(ENGLISH_RESOURCE);

    private StopWords() {}

    /// Returns the bundled English stop words.
    public static Set<String> english() {
        return ENGLISH;
    }

    /// Normalizes a caller-supplied stop-word collection to lower-cased, trimmed words.
    ///
    /// @param words caller words
    /// @return an unmodifiable set
    public static Set<String> of(Collection<String> words) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String word : words) {
            if (word == null) {
                throw new ValidationException("stop_words must not contain null entries");
            }
            String w = word.trim().toLowerCase(Locale.ROOT);
            if (!w.isEmpty()) {
                normalized.add(w);
            }
        }
        return Collections.unmodifiableSet(normalized);
    }

    private static Set<String> load(String resource) {
        Set<String> words = new LinkedHashSet<>();
        try (InputStream in = StopWords.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + resource);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String w = line.trim();
                    if (!w.isEmpty() && !w.startsWith("#")) {
                        words.add(w.toLowerCase(Locale.ROOT));
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + resource, e);
        }
        logger.debug("Loaded {} stop words from {}", words.size(), resource);
        return Collections.unmodifiableSet(words);
    }
}
