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

import io.fieldnotes.textshapes.result.AnalyzerKind;

import java.util.Locale;
import java.util.Objects;

/// Suitability of one analyzer for a dataset.
///
/// @param kind the analyzer
/// @param score suitability in `[0, 1]`
/// @param status whether auto mode runs it
/// @param priority label derived from the score
/// @param rationale why the status and score were given
public record Recommendation(AnalyzerKind kind, double score, Status status, Priority priority, String rationale) {

    public Recommendation {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(priority, "priority cannot be null");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be in [0, 1], got: " + score);
        }
    }

    /// Whether auto mode runs this analyzer.
    public boolean isSelected() {
        return status != Status.SKIPPED;
    }

    /// What auto mode does with an analyzer.
    public enum Status {
        /// Runs normally.
        RUN,
        /// Runs below its minimum with a reduced method and a warning.
        DEGRADED,
        /// Not run.
        SKIPPED;

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /// Score band: primary ≥ 0.7, secondary ≥ 0.4, optional below.
    public enum Priority {
        PRIMARY,
        SECONDARY,
        OPTIONAL;

        public static Priority of(double score) {
            if (score >= 0.7) return PRIMARY;
            if (score >= 0.4) return SECONDARY;
            return OPTIONAL;
        }

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
