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

/// Agreement between two coders' segment sets.
///
/// | Field | Measure |
/// |-------|---------|
/// | `agreement` | Jaccard index over coding decisions (record, span, code) |
/// | `kappa` | Cohen's kappa over record × code presence units |
/// | `percentAgreement` | share of record × code units both coders judged alike |
///
/// Identical non-empty sets give `agreement = 1`; disjoint sets and two empty
/// sets give `0`.
///
/// @param agreement Jaccard agreement in `[0, 1]`
/// @param kappa Cohen's kappa in `[-1, 1]`
/// @param percentAgreement unit agreement in `[0, 1]`
/// @param shared decisions made by both coders
/// @param onlyFirst decisions made only by the first coder
/// @param onlySecond decisions made only by the second coder
public record ReliabilityResult(
    double agreement,
    double kappa,
    double percentAgreement,
    int shared,
    int onlyFirst,
    int onlySecond
) {
    /// Conventional reading of kappa (Landis and Koch).
    public String interpretation() {
        if (kappa < 0.0) return "poor";
        if (kappa <= 0.20) return "slight";
        if (kappa <= 0.40) return "fair";
        if (kappa <= 0.60) return "moderate";
        if (kappa <= 0.80) return "substantial";
        return "almost_perfect";
    }
}
