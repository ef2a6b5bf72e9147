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
import io.fieldnotes.textshapes.result.AnalyzerKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Everything [AutoDetector] concludes about a dataset.
///
/// @param profile the dataset profile
/// @param characteristics measured properties
/// @param recommendations every analyzer, selected ones first, best score first
/// @param qualityWarnings text-quality concerns, possibly empty
/// @param suggestedThemes theme count suited to the record count
/// @param suggestedStrategy thematic strategy suited to the record count
public record DatasetAssessment(
    DatasetProfile profile,
    DatasetCharacteristics characteristics,
    List<Recommendation> recommendations,
    List<String> qualityWarnings,
    int suggestedThemes,
    ThemeStrategy suggestedStrategy
) {
    public DatasetAssessment {
        Objects.requireNonNull(profile, "profile cannot be null");
        Objects.requireNonNull(characteristics, "characteristics cannot be null");
        recommendations = List.copyOf(recommendations);
        qualityWarnings = List.copyOf(qualityWarnings);
    }

    /// Analyzers auto mode runs, in run order.
    public List<AnalyzerKind> selectedKinds() {
        List<AnalyzerKind> kinds = new ArrayList<>();
        for (AnalyzerKind kind : AnalyzerKind.values()) {
            Recommendation r = recommendation(kind);
            if (r != null && r.isSelected()) kinds.add(kind);
        }
        return kinds;
    }

    /// The recommendation for a kind, or null.
    public Recommendation recommendation(AnalyzerKind kind) {
        for (Recommendation r : recommendations) {
            if (r.kind() == kind) return r;
        }
        return null;
    }
}
