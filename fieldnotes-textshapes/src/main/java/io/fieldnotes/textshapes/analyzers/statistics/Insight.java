package io.fieldnotes.textshapes.analyzers.statistics;

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

/// A ranked observation about the data.
///
/// @param priority urgency
/// @param topic short topic key such as `length`, `quality` or `sentiment`
/// @param message human-readable observation
public record Insight(InsightPriority priority, String topic, String message) {

    public Insight {
        Objects.requireNonNull(priority, "priority cannot be null");
        Objects.requireNonNull(topic, "topic cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }

    @Override
    public String toString() {
        return "[" + priority + "] " + message;
    }
}
