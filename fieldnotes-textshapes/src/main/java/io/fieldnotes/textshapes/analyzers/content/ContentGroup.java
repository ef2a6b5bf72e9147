package io.fieldnotes.textshapes.analyzers.content;

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

/// Content features of the records sharing one metadata value.
///
/// @param key the metadata key, or `category` for the record category
/// @param value the shared value
/// @param recordCount records in the group
/// @param totalWords words across the group
/// @param meanWords words per record
/// @param meanSentenceLength words per sentence
/// @param lexicalDiversity unique tokens over total tokens within the group
/// @param prominentCategory category with the most keyword hits, or `uncategorized`
/// @param questionDensity question marks per record
public record ContentGroup(
    String key,
    String value,
    int recordCount,
    int totalWords,
    double meanWords,
    double meanSentenceLength,
    double lexicalDiversity,
    String prominentCategory,
    double questionDensity
) {

    /// The group label, `key=value`.
    public String label() {
        return key + "=" + value;
    }
}
