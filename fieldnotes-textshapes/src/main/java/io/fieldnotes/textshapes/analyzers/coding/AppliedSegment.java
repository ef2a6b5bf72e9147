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

import java.util.Objects;

/// One application of a code to a character span of a record.
///
/// Two segments denote the same coding decision when record, span and code
/// agree; see [#sameDecision(AppliedSegment)]. The coder id only records who
/// made it.
///
/// @param recordId the coded record
/// @param start span start, inclusive
/// @param end span end, exclusive
/// @param text the covered text
/// @param codeName the applied code
/// @param coderId who applied it
public record AppliedSegment(String recordId, int start, int end, String text, String codeName, String coderId) {

    public AppliedSegment {
        Objects.requireNonNull(recordId, "recordId cannot be null");
        Objects.requireNonNull(codeName, "codeName cannot be null");
        Objects.requireNonNull(coderId, "coderId cannot be null");
        text = text == null ? "" : text;
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ") for record " + recordId);
        }
    }

    public int length() {
        return end - start;
    }

    /// Record, span and code, without the coder.
    public DecisionKey decisionKey() {
        return new DecisionKey(recordId, start, end, codeName);
    }

    public boolean sameDecision(AppliedSegment other) {
        return decisionKey().equals(other.decisionKey());
    }

    /// Identity of a coding decision, independent of the coder.
    public record DecisionKey(String recordId, int start, int end, String codeName) {}
}
