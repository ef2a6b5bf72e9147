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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/// Coarse shape of a dataset, used to pick analyzers.
///
/// Each profile carries the analyzers applicable to it. The table is closed:
///
/// | Profile | Analyzers |
/// |---------|-----------|
/// | INTERVIEW | sentiment, content, thematic, coding, statistics |
/// | OPEN_SURVEY | as INTERVIEW, plus survey |
/// | STRUCTURED_SURVEY | survey, content, sentiment, statistics |
/// | MIXED | all |
/// | INSUFFICIENT_DATA | sentiment, statistics |
///
/// Applicable does not mean selected: [AutoDetector] still skips survey
/// without a question grouping and coding without keyword codes.
public enum DatasetProfile {

    INTERVIEW(EnumSet.of(AnalyzerKind.SENTIMENT, AnalyzerKind.CONTENT, AnalyzerKind.THEMATIC,
        AnalyzerKind.CODING, AnalyzerKind.STATISTICS)),
    OPEN_SURVEY(EnumSet.of(AnalyzerKind.SENTIMENT, AnalyzerKind.CONTENT, AnalyzerKind.THEMATIC,
        AnalyzerKind.CODING, AnalyzerKind.SURVEY, AnalyzerKind.STATISTICS)),
    STRUCTURED_SURVEY(EnumSet.of(AnalyzerKind.SURVEY, AnalyzerKind.CONTENT, AnalyzerKind.SENTIMENT,
        AnalyzerKind.STATISTICS)),
    MIXED(EnumSet.allOf(AnalyzerKind.class)),
    INSUFFICIENT_DATA(EnumSet.of(AnalyzerKind.SENTIMENT, AnalyzerKind.STATISTICS));

    private final Set<AnalyzerKind> applicable;

    DatasetProfile(Set<AnalyzerKind> applicable) {
        this.applicable = Collections.unmodifiableSet(applicable);
    }

    public Set<AnalyzerKind> applicableKinds() {
        return applicable;
    }

    public boolean isApplicable(AnalyzerKind kind) {
        return applicable.contains(kind);
    }
}
