package io.fieldnotes.textshapes;

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

/// Raised when caller-supplied input cannot be analyzed.
///
/// Covers empty corpora, malformed records, duplicate record ids or code
/// names, unknown analyzer kinds, bad option values, and explicit analyzer
/// requests whose minimum record count is not met. It is always surfaced to
/// the caller and never retried.
///
/// Input-quality problems that still permit a degraded analysis are not
/// errors; they are reported as [io.fieldnotes.textshapes.result.AnalysisWarning]
/// values in a result envelope.
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
