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
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// An ordered, read-only sequence of [TextRecord]s sharing a logical source.
///
/// ## Purpose
///
/// The corpus is the shared input of every analyzer. It is built once per
/// analysis request and never mutated; analyzers only read it, which lets the
/// orchestrator run them independently over the same instance.
///
/// ## Construction
///
/// Records with empty or whitespace-only text are rejected, never silently
/// dropped. Record ids must be unique; when the caller gives none, ids are
/// assigned as `r1`, `r2`, ... in insertion order.
///
/// ```java
/// TextCorpus corpus = TextCorpus.builder("exit-interviews")
///     .add("The onboarding was confusing.")
///     .add("r-17", "Great mentors.", Instant.parse("2024-03-01T10:00:00Z"), "team-a", Map.of())
///     .build();
///
/// TextCorpus fromCaller = TextCorpus.fromEntries("q1", List.of(
///     Map.of("text", "Too expensive", "category", "pricing"),
///     Map.of("text", "Loved it", "timestamp", "2024-03-02")));
/// ```
///
/// A corpus may be empty as a value, since an unanswered survey question is
/// still a question. Analyzer entry points reject empty corpora.
public final class TextCorpus implements Iterable<TextRecord> {

    /// Metadata key that groups records into survey questions.
    public static final String QUESTION_ID_KEY = "question_id";

    private final String sourceId;
    private final List<TextRecord> records;
    private final Map<String, TextRecord> byId;

    private TextCorpus(String sourceId, List<TextRecord> records) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId cannot be null");
        Map<String, TextRecord> index = new LinkedHashMap<>();
        for (TextRecord record : records) {
            if (index.putIfAbsent(record.id(), record) != null) {
                throw new ValidationException("Duplicate record id '" + record.id() + "' in corpus " + sourceId);
            }
        }
        this.records = List.copyOf(records);
        this.byId = Collections.unmodifiableMap(index);
    }

    /// Creates a corpus from already validated records.
    ///
    /// @throws ValidationException if record ids repeat
    public static TextCorpus of(String sourceId, List<TextRecord> records) {
        return new TextCorpus(sourceId, records);
    }

    /// Creates an empty corpus.
    public static TextCorpus empty(String sourceId) {
        return new TextCorpus(sourceId, List.of());
    }

    /// Creates a corpus of plain texts with generated ids.
    public static TextCorpus ofTexts(String sourceId, List<String> texts) {
        Builder builder = builder(sourceId);
        texts.forEach(builder::add);
        return builder.build();
    }

    /// Builds a corpus from caller-supplied entries.
    ///
    /// Each entry is a map with a required `text` and optional `id`,
    /// `metadata`, `timestamp` and `category` keys.
    ///
    /// @param sourceId logical source of the entries
    /// @param entries caller entries in order
    /// @return the corpus
    /// @throws ValidationException for empty text, a malformed field, or a duplicate id
    public static TextCorpus fromEntries(String sourceId, List<? extends Map<String, ?>> entries) {
        Objects.requireNonNull(entries, "entries cannot be null");
        Builder builder = builder(sourceId);
        int index = 0;
        for (Map<String, ?> entry : entries) {
            index++;
            if (entry == null) {
                throw new ValidationException("Entry " + index + " is null");
            }
            Object text = entry.get("text");
            if (!(text instanceof String)) {
                throw new ValidationException("Entry " + index + " has no text");
            }
            Object id = entry.get("id");
            Object category = entry.get("category");
            if (category != null && !(category instanceof String)) {
                throw new ValidationException("Entry " + index + " category must be a string");
            }
            Object metadata = entry.get("metadata");
            if (metadata != null && !(metadata instanceof Map)) {
                throw new ValidationException("Entry " + index + " metadata must be a map");
            }
            Map<String, Object> meta = new LinkedHashMap<>();
            if (metadata != null) {
                for (Map.Entry<?, ?> e : ((Map<?, ?>) metadata).entrySet()) {
                    meta.put(String.valueOf(e.getKey()), e.getValue());
                }
            }
            builder.add(id == null ? null : String.valueOf(id), (String) text,
                parseTimestamp(entry.get("timestamp"), index), (String) category, meta);
        }
        return builder.build();
    }

    /// Interprets a caller timestamp.
    ///
    /// Accepts [Instant], [Date], epoch milliseconds, and ISO-8601 strings in
    /// instant, local date-time (UTC) or date (UTC midnight) form.
    static Instant parseTimestamp(Object value, int entryIndex) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            try {
                return Instant.parse(trimmed);
            } catch (DateTimeParseException ignored) {
                // try the local forms next
            }
            try {
                return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                // try a bare date next
            }
            try {
                return LocalDate.parse(trimmed).atStartOfDay().toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new ValidationException("Entry " + entryIndex + " has an unparseable timestamp: " + s, e);
            }
        }
        throw new ValidationException("Entry " + entryIndex + " timestamp has unsupported type "
            + value.getClass().getSimpleName());
    }

    public static Builder builder(String sourceId) {
        return new Builder(sourceId);
    }

    public String sourceId() {
        return sourceId;
    }

    public List<TextRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public TextRecord get(int index) {
        return records.get(index);
    }

    /// Looks up a record by id.
    ///
    /// @return the record, or null if absent
    public TextRecord byId(String id) {
        return byId.get(id);
    }

    public List<String> texts() {
        List<String> texts = new ArrayList<>(records.size());
        for (TextRecord r : records) {
            texts.add(r.text());
        }
        return texts;
    }

    public boolean hasTimestamps() {
        for (TextRecord r : records) {
            if (r.hasTimestamp()) return true;
        }
        return false;
    }

    public boolean hasCategories() {
        for (TextRecord r : records) {
            if (r.hasCategory()) return true;
        }
        return false;
    }

    /// Returns the distinct categories in first-seen order.
    public Set<String> categories() {
        Set<String> categories = new LinkedHashSet<>();
        for (TextRecord r : records) {
            if (r.hasCategory()) categories.add(r.category());
        }
        return categories;
    }

    /// Checks whether any record carries the given metadata key.
    public boolean hasMetadataKey(String key) {
        for (TextRecord r : records) {
            if (r.metadata().containsKey(key)) return true;
        }
        return false;
    }

    /// Groups records by a metadata value, preserving first-seen group order.
    ///
    /// Records without the key are left out.
    ///
    /// @param key metadata key
    /// @return ordered groups of records
    public Map<String, List<TextRecord>> groupByMetadata(String key) {
        Map<String, List<TextRecord>> groups = new LinkedHashMap<>();
        for (TextRecord r : records) {
            r.metadataValue(key).ifPresent(v -> groups.computeIfAbsent(v, k -> new ArrayList<>()).add(r));
        }
        return groups;
    }

    /// Throws if the corpus is empty.
    ///
    /// @param operation the operation name used in the message
    /// @throws ValidationException when there are no records
    public void requireNonEmpty(String operation) {
        if (records.isEmpty()) {
            throw new ValidationException(operation + " requires a non-empty corpus (source " + sourceId + ")");
        }
    }

    @Override
    public Iterator<TextRecord> iterator() {
        return records.iterator();
    }

    @Override
    public String toString() {
        return "TextCorpus[source=" + sourceId + ", records=" + records.size() + "]";
    }

    /// Accumulates records and validates them on [#build()].
    public static final class Builder {
        private final String sourceId;
        private final List<TextRecord> records = new ArrayList<>();
        private final Set<String> ids = new HashSet<>();

        private Builder(String sourceId) {
            this.sourceId = Objects.requireNonNull(sourceId, "sourceId cannot be null");
        }

        /// Adds a text with a generated id.
        public Builder add(String text) {
            return add(null, text, null, null, Map.of());
        }

        /// Adds a text with an explicit id.
        public Builder add(String id, String text) {
            return add(id, text, null, null, Map.of());
        }

        /// Adds a fully specified record.
        ///
        /// @param id record id, or null to generate `r<n>`
        /// @param text non-blank text
        /// @param timestamp collection time, or null
        /// @param category category, or null
        /// @param metadata scalar metadata, or null
        /// @return this builder
        public Builder add(String id, String text, Instant timestamp, String category, Map<String, ?> metadata) {
            String recordId = id;
            if (recordId == null) {
                int n = records.size() + 1;
                recordId = "r" + n;
                while (ids.contains(recordId)) {
                    recordId = "r" + (++n);
                }
            }
            if (text == null || text.trim().isEmpty()) {
                throw new ValidationException("Entry " + (records.size() + 1) + " of " + sourceId
                    + " has empty or whitespace-only text");
            }
            if (!ids.add(recordId)) {
                throw new ValidationException("Duplicate record id '" + recordId + "' in corpus " + sourceId);
            }
            Map<String, Object> meta = new LinkedHashMap<>();
            if (metadata != null) {
                meta.putAll(metadata);
            }
            records.add(new TextRecord(recordId, text, timestamp, category, meta));
            return this;
        }

        public Builder add(TextRecord record) {
            if (!ids.add(record.id())) {
                throw new ValidationException("Duplicate record id '" + record.id() + "' in corpus " + sourceId);
            }
            records.add(record);
            return this;
        }

        public TextCorpus build() {
            return new TextCorpus(sourceId, records);
        }
    }
}
