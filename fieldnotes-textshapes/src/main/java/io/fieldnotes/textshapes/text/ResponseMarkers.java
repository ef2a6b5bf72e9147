package io.fieldnotes.textshapes.text;

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
import java.util.Set;

/// Recognizes stock survey answers.
///
/// Matching is done on [TextUtils#normalize(String)] output, so case and
/// punctuation never matter: `"N/A"`, `"n/a."` and `"n a"` are the same
/// answer. A text with no word tokens at all counts as a non-response.
public final class ResponseMarkers {

    /// Whole answers that carry no content.
    public static final Set<String> NON_RESPONSES = Set.of(
        "n a", "na", "not applicable", "no response", "no answer", "skip", "skipped",
        "none", "no comment", "no comments", "nil", "pass");

    /// Phrases that mark an undecided answer.
    public static final List<String> UNCERTAIN = List.of(
        "maybe", "not sure", "uncertain", "don't know", "dont know", "unsure", "unclear", "no idea");

    public static final Set<String> POSITIVE_INDICATORS = Set.of(
        "yes", "agree", "good", "satisfied", "positive", "excellent");

    public static final Set<String> NEGATIVE_INDICATORS = Set.of(
        "no", "disagree", "bad", "unsatisfied", "dissatisfied", "negative", "poor");

    private ResponseMarkers() {}

    public static boolean isNonResponse(String text) {
        String normalized = TextUtils.normalize(text);
        return normalized.isEmpty() || NON_RESPONSES.contains(normalized);
    }

    public static boolean isUncertain(String text) {
        String padded = " " + TextUtils.normalize(text) + " ";
        for (String phrase : UNCERTAIN) {
            if (padded.contains(" " + phrase + " ")) return true;
        }
        return false;
    }

    public static boolean hasPositiveIndicator(String text) {
        return containsAny(text, POSITIVE_INDICATORS);
    }

    public static boolean hasNegativeIndicator(String text) {
        return containsAny(text, NEGATIVE_INDICATORS);
    }

    private static boolean containsAny(String text, Set<String> words) {
        for (String token : TextUtils.tokenize(text)) {
            if (words.contains(token)) return true;
        }
        return false;
    }
}
