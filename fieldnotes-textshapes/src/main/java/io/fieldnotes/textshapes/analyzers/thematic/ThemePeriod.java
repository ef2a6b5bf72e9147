package io.fieldnotes.textshapes.analyzers.thematic;

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

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Theme membership counts for records collected on one day (UTC).
///
/// @param period the day
/// @param themeCounts theme id to number of records
public record ThemePeriod(LocalDate period, Map<Integer, Integer> themeCounts) {
    public ThemePeriod {
        themeCounts = Collections.unmodifiableMap(new LinkedHashMap<>(themeCounts));
    }
}
