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

/// Raised when a code name is already defined in a coding session.
public class DuplicateCodeException extends ValidationException {

    private final String codeName;

    public DuplicateCodeException(String codeName) {
        super("Code already exists: " + codeName);
        this.codeName = codeName;
    }

    public String getCodeName() {
        return codeName;
    }
}
