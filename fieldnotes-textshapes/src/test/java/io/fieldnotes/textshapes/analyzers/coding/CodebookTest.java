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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class CodebookTest {

    @Test
    void testCodebookMovesBetweenSessions() {
        QualitativeCoder source = new QualitativeCoder("lead");
        source.createCode("cost", "Mentions of price", List.of("price", "expensive"));
        source.createCode("staff", "Mentions of staff", List.of("staff"));
        source.createCategory("service", "Service experience", List.of("staff"));

        String json = source.exportCodebook().toJson();
        Codebook codebook = Codebook.fromJson(json);

        QualitativeCoder target = new QualitativeCoder("second");
        target.importCodebook(codebook);

        assertEquals(source.getCodes(), target.getCodes());
        assertEquals("service", target.getCode("staff").category());
        assertThat(target.getCategories()).containsEntry("service", "Service experience");
        assertNotNull(codebook.exportedAt());
        assertThat(json).contains("\"expensive\"").contains("\"exportedAt\"");
    }

    @Test
    void testImportRejectsExistingCodes() {
        QualitativeCoder source = new QualitativeCoder();
        source.createCode("cost", "", List.of("price"));
        QualitativeCoder target = new QualitativeCoder();
        target.createCode("cost", "local", List.of());

        Codebook codebook = source.exportCodebook();
        DuplicateCodeException e = assertThrows(DuplicateCodeException.class, () -> target.importCodebook(codebook));
        assertEquals("cost", e.getCodeName());
        assertEquals("local", target.getCode("cost").description());
    }

    @Test
    void testMalformedDocuments() {
        assertThrows(ValidationException.class, () -> Codebook.fromJson("{\"codes\": [ {\"name\": "));
        assertThrows(ValidationException.class, () -> Codebook.fromJson(""));
        assertThrows(ValidationException.class, () -> Codebook.fromJson("{\"exportedAt\": \"yesterday\"}"));
    }

    @Test
    void testBlankCodeNameIsRejected() {
        assertThrows(ValidationException.class, () -> Codebook.fromJson("{\"codes\": [{\"name\": \" \"}]}"));
    }
}
