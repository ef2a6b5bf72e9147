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

import java.util.List;
import java.util.Objects;

/// A group of related records.
///
/// @param id theme index, `0 .. k-1`
/// @param label top terms joined by ` / `, or `theme-<id+1>` without terms
/// @param memberIds ids of the member records in corpus order
/// @param exemplars most central or most probable members
/// @param topTerms highest-weight terms, strongest first
/// @param coherence mean pairwise similarity of the top terms, in `[0, 1]`
public record Theme(
    int id,
    String label,
    List<String> memberIds,
    List<Exemplar> exemplars,
    List<String> topTerms,
    double coherence
) {
    public Theme {
        Objects.requireNonNull(label, "label cannot be null");
        memberIds = List.copyOf(memberIds);
        exemplars = List.copyOf(exemplars);
        topTerms = List.copyOf(topTerms);
    }

    public int size() {
        return memberIds.size();
    }

    public boolean isEmpty() {
        return memberIds.isEmpty();
    }

    /// A representative member quote.
    ///
    /// @param recordId the record
    /// @param text the record text
    /// @param score centrality (cosine to centroid) or topic probability
    public record Exemplar(String recordId, String text, double score) {}
}
