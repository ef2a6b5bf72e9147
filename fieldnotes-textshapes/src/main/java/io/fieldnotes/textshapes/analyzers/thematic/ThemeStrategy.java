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

import java.util.Locale;

/// How [ThematicAnalyzer] groups records.
public enum ThemeStrategy {

    /// Cosine k-means over term-frequency vectors; every record in exactly one theme.
    CLUSTERING("clustering"),

    /// Probabilistic latent semantic analysis; membership by most probable topic.
    TOPIC_MODEL("topic_model");

    private final String mnemonic;

    ThemeStrategy(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String mnemonic() {
        return mnemonic;
    }

    /// Resolves a strategy name; `lda` is accepted for the topic model.
    ///
    /// @throws ValidationException for unknown names
    public static ThemeStrategy fromName(String name) {
        if (name != null) {
            String n = name.trim().toLowerCase(Locale.ROOT);
            if (n.equals("lda") || n.equals("plsa")) {
                return TOPIC_MODEL;
            }
            for (ThemeStrategy s : values()) {
                if (s.mnemonic.equals(n)) return s;
            }
        }
        throw new ValidationException("Unknown clustering_strategy: " + name
            + ". Available: clustering, topic_model");
    }
}
