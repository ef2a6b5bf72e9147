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

import io.fieldnotes.textshapes.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// The closed set of analyzers, in the fixed order the orchestrator runs them.
///
/// Declaration order is the run order: independent analyzers first, then
/// [#STATISTICS], which may summarize the others and therefore always runs
/// last. Each kind carries its minimum record count; `0` means no hard minimum.
public enum AnalyzerKind {

    CONTENT("content", 5),
    SENTIMENT("sentiment", 5),
    THEMATIC("thematic", 10),
    CODING("coding", 8),
    SURVEY("survey", 0),
    STATISTICS("statistics", 1);

    private final String mnemonic;
    private final int minimumRecords;

    AnalyzerKind(String mnemonic, int minimumRecords) {
        this.mnemonic = mnemonic;
        this.minimumRecords = minimumRecords;
    }

    /// The lower-case name used in options and reports.
    public String mnemonic() {
        return mnemonic;
    }

    /// Minimum number of records for a reliable (non-degraded) run.
    public int minimumRecords() {
        return minimumRecords;
    }

    /// Checks the record count against the minimum.
    public boolean meetsMinimum(int recordCount) {
        return recordCount >= minimumRecords;
    }

    /// Resolves a kind by mnemonic or constant name, ignoring case.
    ///
    /// @param name the analyzer name
    /// @return the kind
    /// @throws ValidationException for unknown names
    public static AnalyzerKind fromName(String name) {
        if (name != null) {
            String n = name.trim().toLowerCase(Locale.ROOT);
            for (AnalyzerKind kind : values()) {
                if (kind.mnemonic.equals(n)) {
                    return kind;
                }
            }
        }
        throw new ValidationException("Unknown analyzer kind: " + name + ". Available: " + mnemonics());
    }

    public static List<String> mnemonics() {
        List<String> names = new ArrayList<>();
        for (AnalyzerKind kind : values()) {
            names.add(kind.mnemonic);
        }
        return names;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
