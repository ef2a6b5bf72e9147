package io.fieldnotes.textshapes.analyzers.sentiment;

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

import java.util.Set;

/// The closed set of emotions detected in a record.
///
/// [#NEUTRAL] is assigned when no emotion keyword occurs.
public enum Emotion {
    JOY(Set.of("happy", "joy", "pleased", "excited", "delighted", "cheerful", "glad", "content")),
    ANGER(Set.of("angry", "mad", "furious", "annoyed", "irritated", "rage", "frustrated")),
    SADNESS(Set.of("sad", "depressed", "unhappy", "miserable", "disappointed", "gloomy")),
    FEAR(Set.of("afraid", "scared", "terrified", "anxious", "worried", "nervous", "frightened")),
    SURPRISE(Set.of("surprised", "amazed", "astonished", "shocked", "stunned")),
    DISGUST(Set.of("disgusted", "revolted", "sickened", "appalled")),
    NEUTRAL(Set.of());

    private final Set<String> keywords;

    Emotion(Set<String> keywords) {
        this.keywords = keywords;
    }

    public Set<String> keywords() {
        return keywords;
    }
}
