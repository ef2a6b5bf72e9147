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

import java.util.Locale;

/// Sample-size category of a corpus.
///
/// | Category | Records |
/// |----------|---------|
/// | VERY_SMALL | < 5 |
/// | SMALL | < 20 |
/// | MEDIUM | < 50 |
/// | LARGE | < 200 |
/// | VERY_LARGE | ≥ 200 |
public enum SampleSize {
    VERY_SMALL,
    SMALL,
    MEDIUM,
    LARGE,
    VERY_LARGE;

    public static SampleSize of(int records) {
        if (records < 5) return VERY_SMALL;
        if (records < 20) return SMALL;
        if (records < 50) return MEDIUM;
        if (records < 200) return LARGE;
        return VERY_LARGE;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
