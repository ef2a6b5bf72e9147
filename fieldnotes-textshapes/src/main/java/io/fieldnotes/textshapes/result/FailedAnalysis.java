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

import java.util.Objects;

/// An analyzer that threw during an auto-mode run.
///
/// @param kind the analyzer that failed
/// @param errorType simple class name of the exception
/// @param message the exception message
public record FailedAnalysis(AnalyzerKind kind, String errorType, String message) {

    public FailedAnalysis {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(errorType, "errorType cannot be null");
        message = message == null ? "" : message;
    }

    public static FailedAnalysis of(AnalyzerKind kind, Throwable error) {
        return new FailedAnalysis(kind, error.getClass().getSimpleName(), error.getMessage());
    }
}
