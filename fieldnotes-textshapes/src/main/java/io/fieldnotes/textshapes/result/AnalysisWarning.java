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

import java.util.Objects;

/// A non-fatal issue attached to a result envelope.
///
/// Warnings never abort an analysis. The `code` is a stable machine-readable
/// identifier such as `insufficient_data_for_clustering` or `did_not_converge`.
///
/// @param kind the warning family
/// @param code stable identifier
/// @param message human-readable detail
public record AnalysisWarning(Kind kind, String code, String message) {

    public static final String INSUFFICIENT_DATA = "insufficient_data";
    public static final String INSUFFICIENT_DATA_FOR_CLUSTERING = "insufficient_data_for_clustering";
    public static final String DID_NOT_CONVERGE = "did_not_converge";
    public static final String LOW_CONFIDENCE = "low_confidence";
    public static final String THEMES_CLAMPED = "themes_clamped";
    public static final String DUPLICATE_RESPONSES = "duplicate_responses";
    public static final String UNATTRIBUTED_RESPONSES = "unattributed_responses";

    public AnalysisWarning {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(code, "code cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }

    /// Input too small for the reliable method; a degraded method was used.
    public static AnalysisWarning insufficientData(String code, String message) {
        return new AnalysisWarning(Kind.INSUFFICIENT_DATA, code, message);
    }

    /// An iterative method reached its iteration bound without stabilizing.
    public static AnalysisWarning convergence(String message) {
        return new AnalysisWarning(Kind.CONVERGENCE, DID_NOT_CONVERGE, message);
    }

    public static AnalysisWarning lowConfidence(String message) {
        return new AnalysisWarning(Kind.LOW_CONFIDENCE, LOW_CONFIDENCE, message);
    }

    public static AnalysisWarning dataQuality(String code, String message) {
        return new AnalysisWarning(Kind.DATA_QUALITY, code, message);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }

    /// Warning families.
    public enum Kind {
        INSUFFICIENT_DATA,
        CONVERGENCE,
        LOW_CONFIDENCE,
        DATA_QUALITY
    }
}
