package io.fieldnotes.textshapes.analyzers.coding;

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

import java.util.List;

/// Shape of the coding applied so far.
///
/// @param codedRecords records carrying at least one segment
/// @param meanCodesPerRecord distinct codes per coded record, mean
/// @param maxCodesPerRecord distinct codes per coded record, max
/// @param meanSegmentLength mean segment length in characters
/// @param topPairs most frequent code pairs within a record, strongest first
public record CodePatterns(
    int codedRecords,
    double meanCodesPerRecord,
    int maxCodesPerRecord,
    double meanSegmentLength,
    List<CodePair> topPairs
) {
    public CodePatterns {
        topPairs = List.copyOf(topPairs);
    }

    /// Two codes applied to the same records.
    ///
    /// @param first code name, earlier in creation order
    /// @param second code name, later in creation order
    /// @param records records carrying both
    public record CodePair(String first, String second, int records) {}
}
