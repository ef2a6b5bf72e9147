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

import com.google.gson.JsonParseException;
import io.fieldnotes.textshapes.ValidationException;
import io.fieldnotes.textshapes.report.ReportGson;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Portable snapshot of a coding scheme.
///
/// ## Usage
/// ```java
/// String json = coder.exportCodebook().toJson();
/// QualitativeCoder other = new QualitativeCoder("coder-b");
/// other.importCodebook(Codebook.fromJson(json));
/// ```
///
/// @param codes codes in creation order
/// @param categories category name to description, in creation order
/// @param exportedAt when the snapshot was taken
public record Codebook(List<Code> codes, Map<String, String> categories, Instant exportedAt) {

    public Codebook {
        codes = codes == null ? List.of() : List.copyOf(codes);
        categories = categories == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(categories));
    }

    public String toJson() {
        return ReportGson.gson().toJson(this);
    }

    /// Parses a codebook written by [#toJson()].
    ///
    /// @throws ValidationException if the text is not a codebook
    public static Codebook fromJson(String json) {
        try {
            Codebook codebook = ReportGson.gson().fromJson(json, Codebook.class);
            if (codebook == null) {
                throw new ValidationException("Empty codebook document");
            }
            return codebook;
        } catch (JsonParseException e) {
            throw new ValidationException("Malformed codebook: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Gson wraps exceptions thrown by record constructors
            if (e.getCause() instanceof ValidationException invalid) {
                throw invalid;
            }
            throw e;
        }
    }
}
