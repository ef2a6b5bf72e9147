package io.fieldnotes.textshapes.analyzers.survey;

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

/// Coarse respondent engagement.
///
/// | Level | Completion | Mean words per answer |
/// |-------|------------|-----------------------|
/// | HIGH | ≥ 0.8 | ≥ 10 |
/// | MEDIUM | ≥ 0.5 | ≥ 5 |
/// | LOW | otherwise | |
public enum EngagementLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static EngagementLevel of(double completionRate, double meanWords) {
        if (completionRate >= 0.8 && meanWords >= 10) return HIGH;
        if (completionRate >= 0.5 && meanWords >= 5) return MEDIUM;
        return LOW;
    }
}
