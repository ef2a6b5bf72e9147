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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class TextCorpusTest {

    @Test
    void testGeneratedIdsFollowInsertionOrder() {
        TextCorpus corpus = TextCorpus.builder("interviews")
            .add("The onboarding was confusing.")
            .add("Great mentors.")
            .build();

        assertEquals(2, corpus.size());
        assertEquals("r1", corpus.get(0).id());
        assertEquals("r2", corpus.get(1).id());
        assertEquals("Great mentors.", corpus.byId("r2").text());
    }

    @Test
    void testGeneratedIdsSkipCallerIds() {
        TextCorpus corpus = TextCorpus.builder("mixed")
            .add("r2", "explicit id")
            .add("generated id")
            .build();

        assertThat(corpus.records()).extracting(TextRecord::id).containsExactly("r2", "r3");
    }

    @Test
    void testWhitespaceTextIsRejected() {
        TextCorpus.Builder builder = TextCorpus.builder("bad").add("fine");
        assertThrows(ValidationException.class, () -> builder.add("   \t "));
    }

    @Test
    void testDuplicateIdsAreRejected() {
        TextCorpus.Builder builder = TextCorpus.builder("dup").add("a", "first");
        assertThatThrownBy(() -> builder.add("a", "second"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Duplicate record id 'a'");
    }

    @Test
    void testTextIsTrimmed() {
        TextRecord record = TextRecord.of("x", "  padded answer \n");
        assertEquals("padded answer", record.text());
    }

    @Test
    void testNonScalarMetadataIsRejected() {
        assertThrows(ValidationException.class,
            () -> new TextRecord("x", "text", null, null, Map.of("nested", List.of(1, 2))));
    }

    @Test
    void testFromEntriesParsesTimestampForms() {
        Instant instant = Instant.parse("2024-03-01T10:00:00Z");
        TextCorpus corpus = TextCorpus.fromEntries("entries", List.of(
            Map.of("text", "instant", "timestamp", instant),
            Map.of("text", "date", "timestamp", Date.from(instant)),
            Map.of("text", "millis", "timestamp", instant.toEpochMilli()),
            Map.of("text", "iso instant", "timestamp", "2024-03-01T10:00:00Z"),
            Map.of("text", "local date time", "timestamp", "2024-03-01T10:00:00"),
            Map.of("text", "bare date", "timestamp", "2024-03-01")));

        for (int i = 0; i < 5; i++) {
            assertEquals(instant, corpus.get(i).timestamp(), corpus.get(i).text());
        }
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), corpus.get(5).timestamp());
        assertTrue(corpus.hasTimestamps());
    }

    @Test
    void testFromEntriesRejectsUnparseableTimestamp() {
        assertThatThrownBy(() -> TextCorpus.fromEntries("entries",
            List.of(Map.of("text", "x", "timestamp", "last tuesday"))))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("unparseable timestamp");
    }

    @Test
    void testFromEntriesRequiresText() {
        assertThrows(ValidationException.class,
            () -> TextCorpus.fromEntries("entries", List.of(Map.of("id", "a"))));
    }

    @Test
    void testFromEntriesKeepsIdsCategoriesAndMetadata() {
        TextCorpus corpus = TextCorpus.fromEntries("q1", List.of(
            Map.of("id", 7, "text", "Too expensive", "category", "pricing",
                "metadata", Map.of("respondent_id", "p1", "age", 31))));

        TextRecord record = corpus.get(0);
        assertEquals("7", record.id());
        assertEquals("pricing", record.category());
        assertEquals("p1", record.metadataValue("respondent_id").orElseThrow());
        assertEquals("31", record.metadataValue("age").orElseThrow());
        assertTrue(record.metadataValue("missing").isEmpty());
    }

    @Test
    void testViews() {
        TextCorpus corpus = TextCorpus.builder("views")
            .add("a", "one", null, "billing", Map.of("question_id", "q1"))
            .add("b", "two", null, "support", Map.of("question_id", "q2"))
            .add("c", "three", null, "billing", Map.of("question_id", "q1"))
            .add("d", "four")
            .build();

        assertThat(corpus.texts()).containsExactly("one", "two", "three", "four");
        assertThat(corpus.categories()).containsExactly("billing", "support");
        assertTrue(corpus.hasCategories());
        assertFalse(corpus.hasTimestamps());
        assertTrue(corpus.hasMetadataKey(TextCorpus.QUESTION_ID_KEY));

        Map<String, List<TextRecord>> groups = corpus.groupByMetadata(TextCorpus.QUESTION_ID_KEY);
        assertThat(groups.keySet()).containsExactly("q1", "q2");
        assertThat(groups.get("q1")).extracting(TextRecord::id).containsExactly("a", "c");
    }

    @Test
    void testEmptyCorpusIsAValueButNotAnalyzable() {
        TextCorpus empty = TextCorpus.empty("nobody");
        assertTrue(empty.isEmpty());
        assertThrows(ValidationException.class, () -> empty.requireNonEmpty("Anything"));
    }

    @Test
    void testRecordsAreReadOnly() {
        TextCorpus corpus = TextCorpus.ofTexts("ro", List.of("one"));
        assertThrows(UnsupportedOperationException.class, () -> corpus.records().add(TextRecord.of("x", "y")));
        assertThrows(UnsupportedOperationException.class, () -> corpus.get(0).metadata().put("k", "v"));
    }
}
