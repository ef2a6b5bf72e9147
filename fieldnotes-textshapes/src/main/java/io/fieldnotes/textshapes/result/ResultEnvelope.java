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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Fields common to every [AnalysisResult].
///
/// @param method the method actually used, e.g. `lexicon` or `kmeans_cosine`
/// @param confidence quality indicator in `[0, 1]`
/// @param warnings non-fatal issues, in the order they were raised
/// @param summary one-line human-readable summary
public record ResultEnvelope(String method, double confidence, List<AnalysisWarning> warnings, String summary) {

    public ResultEnvelope {
        Objects.requireNonNull(method, "method cannot be null");
        Objects.requireNonNull(summary, "summary cannot be null");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
        }
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /// Checks whether a warning with the given code was raised.
    public boolean hasWarning(String code) {
        for (AnalysisWarning w : warnings) {
            if (w.code().equals(code)) return true;
        }
        return false;
    }

    /// Returns a copy with one more warning.
    public ResultEnvelope withWarning(AnalysisWarning warning) {
        List<AnalysisWarning> all = new ArrayList<>(warnings);
        all.add(warning);
        return new ResultEnvelope(method, confidence, all, summary);
    }
}
