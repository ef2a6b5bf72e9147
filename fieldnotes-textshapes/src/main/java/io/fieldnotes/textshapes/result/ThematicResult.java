package io.fieldnotes.textshapes.result;

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

import io.fieldnotes.textshapes.analyzers.thematic.Theme;
import io.fieldnotes.textshapes.analyzers.thematic.ThemePeriod;
import io.fieldnotes.textshapes.analyzers.thematic.ThemeRelationship;
import io.fieldnotes.textshapes.analyzers.thematic.ThemeStrategy;

import java.util.List;
import java.util.Objects;

/// Output of [io.fieldnotes.textshapes.analyzers.thematic.ThematicAnalyzer].
///
/// @param envelope common result fields
/// @param strategy the requested strategy
/// @param requestedThemes the requested theme count
/// @param themes the themes, by id
/// @param degraded true when the corpus was too small and a single theme was produced
/// @param iterations iterations run by the fitting engine
/// @param converged whether the engine converged
/// @param vocabularySize number of terms in the vectorization vocabulary
/// @param relationships theme pairs with overlapping top terms
/// @param evolution theme counts per day, empty without timestamps
public record ThematicResult(
    ResultEnvelope envelope,
    ThemeStrategy strategy,
    int requestedThemes,
    List<Theme> themes,
    boolean degraded,
    int iterations,
    boolean converged,
    int vocabularySize,
    List<ThemeRelationship> relationships,
    List<ThemePeriod> evolution
) implements AnalysisResult {

    public ThematicResult {
        Objects.requireNonNull(envelope, "envelope cannot be null");
        Objects.requireNonNull(strategy, "strategy cannot be null");
        themes = List.copyOf(themes);
        relationships = List.copyOf(relationships);
        evolution = List.copyOf(evolution);
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.THEMATIC;
    }

    /// Finds the theme containing a record.
    ///
    /// @return the theme, or null if the record is in none
    public Theme themeOf(String recordId) {
        for (Theme theme : themes) {
            if (theme.memberIds().contains(recordId)) return theme;
        }
        return null;
    }
}
