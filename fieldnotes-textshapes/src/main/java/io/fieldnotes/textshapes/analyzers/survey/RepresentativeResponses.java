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

import io.fieldnotes.textshapes.corpus.TextRecord;

import java.util.ArrayList;
import java.util.List;

/// Responses spanning the length range of a question.
///
/// Absent slots are null: one response fills only `longest`, two fill
/// `longest` and `shortest`.
///
/// @param longest the longest response
/// @param median the response at the middle of the length ordering
/// @param shortest the shortest response
public record RepresentativeResponses(TextRecord longest, TextRecord median, TextRecord shortest) {

    /// Non-null responses, longest first.
    public List<TextRecord> asList() {
        List<TextRecord> out = new ArrayList<>(3);
        if (longest != null) out.add(longest);
        if (median != null) out.add(median);
        if (shortest != null) out.add(shortest);
        return out;
    }
}
