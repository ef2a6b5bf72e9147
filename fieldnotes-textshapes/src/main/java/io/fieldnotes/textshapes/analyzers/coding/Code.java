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

import io.fieldnotes.textshapes.ValidationException;

import java.util.List;
import java.util.Objects;

/// A caller-defined tag applied to text segments.
///
/// @param name unique name within a coding session
/// @param description what the code captures
/// @param keywords words or phrases that trigger automatic coding; may be empty
/// @param category optional grouping, or null
public record Code(String name, String description, List<String> keywords, String category) {

    public Code {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Code name cannot be blank");
        }
        name = name.trim();
        description = description == null ? "" : description;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        for (String keyword : keywords) {
            Objects.requireNonNull(keyword, "keywords cannot contain null");
            if (keyword.isBlank()) {
                throw new ValidationException("Code '" + name + "' has a blank keyword");
            }
        }
    }

    public boolean hasKeywords() {
        return !keywords.isEmpty();
    }

    /// Returns a copy assigned to another category.
    public Code withCategory(String category) {
        return new Code(name, description, keywords, category);
    }
}
