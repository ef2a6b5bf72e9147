package io.fieldnotes.textshapes.report;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/// Centralized Gson configuration for rendering analysis results.
///
/// ## Purpose
///
/// Provides a configured [Gson] instance that serializes any
/// [io.fieldnotes.textshapes.result.AnalysisResult], the merged
/// [io.fieldnotes.textshapes.result.AnalysisReport], and the coding
/// [io.fieldnotes.textshapes.analyzers.coding.Codebook].
///
/// ## Usage
///
/// ```java
/// String json = ReportGson.gson().toJson(report);
///
/// // one line per result
/// String line = ReportGson.compactGson().toJson(report.getResult(AnalyzerKind.SENTIMENT));
/// ```
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable reports |
/// | HTML escaping | Disabled | Quotes and apostrophes in response text stay readable |
/// | Special floats | Allowed | Undefined statistics render as `NaN` |
/// | Enums | Lower-case | `"open_survey"` rather than `"OPEN_SURVEY"` |
/// | `Instant`, `LocalDate` | ISO-8601 strings | |
///
/// ## Thread Safety
///
/// The [Gson] instance is immutable and shared.
public final class ReportGson {

    private static final Gson INSTANCE = builder().create();

    private ReportGson() {
        // Utility class
    }

    /// Returns the shared pretty-printing instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with the report defaults.
    ///
    /// @return a builder that callers may customize further
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe())
            .registerTypeAdapter(LocalDate.class, new LocalDateAdapter().nullSafe())
            .registerTypeAdapterFactory(new LowerCaseEnumTypeAdapterFactory());
    }

    /// Creates a compact (single-line) Gson instance for NDJSON output.
    public static Gson compactGson() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe())
            .registerTypeAdapter(LocalDate.class, new LocalDateAdapter().nullSafe())
            .registerTypeAdapterFactory(new LowerCaseEnumTypeAdapterFactory())
            .create();
    }

    private static final class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            String text = in.nextString();
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                throw new JsonParseException("Not an ISO-8601 instant: " + text, e);
            }
        }
    }

    private static final class LocalDateAdapter extends TypeAdapter<LocalDate> {
        @Override
        public void write(JsonWriter out, LocalDate value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public LocalDate read(JsonReader in) throws IOException {
            String text = in.nextString();
            try {
                return LocalDate.parse(text);
            } catch (DateTimeParseException e) {
                throw new JsonParseException("Not an ISO-8601 date: " + text, e);
            }
        }
    }

    /// Writes enum constants as lower-case names and reads them case-insensitively.
    static final class LowerCaseEnumTypeAdapterFactory implements TypeAdapterFactory {

        @Override
        @SuppressWarnings({"unchecked", "rawtypes"})
        public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
            Class<? super T> raw = type.getRawType();
            if (!Enum.class.isAssignableFrom(raw) || raw == Enum.class) {
                return null;
            }
            // constant-specific bodies are anonymous subclasses
            Class<?> enumClass = raw.isEnum() ? raw : raw.getSuperclass();
            return (TypeAdapter<T>) new LowerCaseEnumAdapter(enumClass);
        }
    }

    private static final class LowerCaseEnumAdapter<E extends Enum<E>> extends TypeAdapter<E> {

        private final Map<String, E> byName = new HashMap<>();

        LowerCaseEnumAdapter(Class<E> enumClass) {
            for (E constant : enumClass.getEnumConstants()) {
                byName.put(constant.name().toLowerCase(Locale.ROOT), constant);
            }
        }

        @Override
        public void write(JsonWriter out, E value) throws IOException {
            if (value == null) {
                out.nullValue();
                return;
            }
            out.value(value.name().toLowerCase(Locale.ROOT));
        }

        @Override
        public E read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            String text = in.nextString();
            E constant = byName.get(text.trim().toLowerCase(Locale.ROOT));
            if (constant == null) {
                throw new JsonParseException("Unknown constant '" + text + "', expected one of " + byName.keySet());
            }
            return constant;
        }
    }
}
