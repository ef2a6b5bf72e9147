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

/// Five-way polarity label.
public enum SentimentLabel {
    VERY_POSITIVE,
    POSITIVE,
    NEUTRAL,
    NEGATIVE,
    VERY_NEGATIVE;

    /// Labels a polarity: `> 0.5`, `> 0.1`, `> -0.1`, `> -0.5`, otherwise very negative.
    public static SentimentLabel of(double polarity) {
        if (polarity > 0.5) return VERY_POSITIVE;
        if (polarity > 0.1) return POSITIVE;
        if (polarity > -0.1) return NEUTRAL;
        if (polarity > -0.5) return NEGATIVE;
        return VERY_NEGATIVE;
    }
}
