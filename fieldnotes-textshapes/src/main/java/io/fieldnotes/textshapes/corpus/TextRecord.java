package io.fieldnotes.textshapes.corpus;

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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// One immutable response in a [TextCorpus].
///
/// ## Invariants
///
/// - `id` is non-blank and unique within its corpus
/// - `text` is non-blank; it is stored trimmed
/// - `metadata` values are scalars: [String], [Number] or [Boolean]
///
/// `timestamp` and `category` are optional and may be `null`.
///
/// @param id stable record identifier
/// @param text the response text
/// @param timestamp when the response was collected, or null
/// @param category caller-assigned category, or null
/// @param metadata scalar metadata (never null; empty when absent)
public record TextRecord(
    String id,
    String text,
    Instant timestamp,
    String category,
    Map<String, Object> metadata
) {

    public TextRecord {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Record id must not be blank");
        }
        if (text == null || text.trim().isEmpty()) {
            throw new ValidationException("Record '" + id + "' has empty text");
        }
        text = text.trim();
        if (category != null && category.isBlank()) {
            category = null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        if (metadata != null) {
            for (Map.Entry<String, Object> e : metadata.entrySet()) {
                Object value = e.getValue();
                if (e.getKey() == null) {
                    throw new ValidationException("Record '" + id + "' has a null metadata key");
                }
                if (value == null) {
                    continue;
                }
                if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                    throw new ValidationException("Record '" + id + "' metadata '" + e.getKey()
                        + "' is not a scalar: " + value.getClass().getSimpleName());
                }
                copy.put(e.getKey(), value);
            }
        }
        metadata = Collections.unmodifiableMap(copy);
    }

    /// Creates a record with text only.
    public static TextRecord of(String id, String text) {
        return new TextRecord(id, text, null, null, Map.of());
    }

    public boolean hasTimestamp() {
        return timestamp != null;
    }

    public boolean hasCategory() {
        return category != null;
    }

    /// Returns a metadata value rendered as a string.
    ///
    /// @param key metadata key
    /// @return the value as a string, or empty when absent
    public Optional<String> metadataValue(String key) {
        Object value = metadata.get(Objects.requireNonNull(key, "key cannot be null"));
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }
}
