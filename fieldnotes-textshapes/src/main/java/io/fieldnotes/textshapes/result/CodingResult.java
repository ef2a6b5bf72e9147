package io.fieldnotes.textshapes.result;

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

import io.fieldnotes.textshapes.analyzers.coding.AppliedSegment;
import io.fieldnotes.textshapes.analyzers.coding.Code;
import io.fieldnotes.textshapes.analyzers.coding.CodeFrequency;
import io.fieldnotes.textshapes.analyzers.coding.CodePatterns;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Output of a coding pass over a corpus.
///
/// @param envelope common result fields; confidence is the coverage
/// @param codes the codebook in creation order
/// @param segments applied segments on records of the corpus
/// @param frequency per-code counts
/// @param cooccurrence record-level co-occurrence matrix
/// @param codedRecords ids of records with at least one segment
/// @param coverage fraction of records coded
/// @param patterns coding density and top code pairs
public record CodingResult(
    ResultEnvelope envelope,
    List<Code> codes,
    List<AppliedSegment> segments,
    Map<String, CodeFrequency> frequency,
    Map<String, Map<String, Integer>> cooccurrence,
    List<String> codedRecords,
    double coverage,
    CodePatterns patterns
) implements AnalysisResult {

    public CodingResult {
        Objects.requireNonNull(envelope, "envelope cannot be null");
        codes = List.copyOf(codes);
        segments = List.copyOf(segments);
        frequency = Collections.unmodifiableMap(new LinkedHashMap<>(frequency));
        cooccurrence = Collections.unmodifiableMap(new LinkedHashMap<>(cooccurrence));
        codedRecords = List.copyOf(codedRecords);
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.CODING;
    }

    /// Segments applied to one record.
    public List<AppliedSegment> segmentsFor(String recordId) {
        return segments.stream().filter(s -> s.recordId().equals(recordId)).toList();
    }
}
