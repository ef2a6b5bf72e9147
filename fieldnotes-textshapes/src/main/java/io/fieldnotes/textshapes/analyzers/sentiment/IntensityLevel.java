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

/// Strength of a polarity regardless of its sign.
public enum IntensityLevel {
    LOW,
    MEDIUM,
    HIGH;

    /// `|polarity| > 0.7` is high, `> 0.3` medium, otherwise low.
    public static IntensityLevel of(double polarity) {
        double magnitude = Math.abs(polarity);
        if (magnitude > 0.7) return HIGH;
        if (magnitude > 0.3) return MEDIUM;
        return LOW;
    }
}
