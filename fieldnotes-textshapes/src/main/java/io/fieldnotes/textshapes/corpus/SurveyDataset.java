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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// A multi-question survey: question id to the [TextCorpus] of its answers.
///
/// ## Purpose
///
/// Used by [io.fieldnotes.textshapes.analyzers.survey.SurveyAnalyzer] to
/// analyze each question, compare questions, and profile respondents.
/// Question corpora may differ in length because respondents skip questions,
/// and a question corpus may be empty.
///
/// An optional respondent roster lists everyone who was invited; respondents
/// are otherwise discovered from the respondent metadata key of the answers.
///
/// ## Usage
///
/// ```java
/// SurveyDataset survey = SurveyDataset.builder("onboarding-survey")
///     .question("q1", q1Answers)
///     .question("q2", TextCorpus.empty("q2"))
///     .respondents(List.of("p1", "p2", "p3"))
///     .build();
/// ```
public final class SurveyDataset {

    /// Name given to the group of records that carry no question id.
    public static final String UNASSIGNED = "unassigned";

    private final String surveyId;
    private final Map<String, TextCorpus> questions;
    private final Set<String> roster;
    private final String unassignedGroup;

    private SurveyDataset(String surveyId, Map<String, TextCorpus> questions, Set<String> roster,
                          String unassignedGroup) {
        this.surveyId = surveyId;
        this.questions = Collections.unmodifiableMap(new LinkedHashMap<>(questions));
        this.roster = Collections.unmodifiableSet(new LinkedHashSet<>(roster));
        this.unassignedGroup = unassignedGroup;
    }

    /// Splits one corpus into questions by a metadata key.
    ///
    /// Records lacking the key are grouped under [#UNASSIGNED], or under
    /// `unassigned-2`, `unassigned-3`, ... when a real question already has
    /// that id. The group is reported by [#unassignedGroup()]. A corpus with
    /// no grouping at all becomes a single question named after its source.
    ///
    /// @param corpus the flat corpus
    /// @param questionKey metadata key holding the question id
    /// @return the dataset
    public static SurveyDataset fromCorpus(TextCorpus corpus, String questionKey) {
        Objects.requireNonNull(corpus, "corpus cannot be null");
        Builder builder = builder(corpus.sourceId());
        if (!corpus.hasMetadataKey(questionKey)) {
            return builder.question(corpus.sourceId(), corpus).build();
        }
        Map<String, List<TextRecord>> grouped = new LinkedHashMap<>(corpus.groupByMetadata(questionKey));
        List<TextRecord> unassigned = new ArrayList<>();
        for (TextRecord r : corpus) {
            if (!r.metadata().containsKey(questionKey)) {
                unassigned.add(r);
            }
        }
        grouped.forEach((questionId, records) -> builder.question(questionId, TextCorpus.of(questionId, records)));
        if (!unassigned.isEmpty()) {
            String groupId = UNASSIGNED;
            for (int suffix = 2; grouped.containsKey(groupId); suffix++) {
                groupId = UNASSIGNED + "-" + suffix;
            }
            builder.question(groupId, TextCorpus.of(groupId, unassigned));
            builder.unassignedGroup = groupId;
        }
        return builder.build();
    }

    public static Builder builder(String surveyId) {
        return new Builder(surveyId);
    }

    public String surveyId() {
        return surveyId;
    }

    public Map<String, TextCorpus> questions() {
        return questions;
    }

    public Set<String> questionIds() {
        return questions.keySet();
    }

    public TextCorpus question(String questionId) {
        return questions.get(questionId);
    }

    public int questionCount() {
        return questions.size();
    }

    /// The group holding records that had no question id, if
    /// [#fromCorpus(TextCorpus, String)] created one. It is not a question.
    public Optional<String> unassignedGroup() {
        return Optional.ofNullable(unassignedGroup);
    }

    /// Whether the id names an asked question rather than the unassigned group.
    public boolean isQuestion(String questionId) {
        return questions.containsKey(questionId) && !questionId.equals(unassignedGroup);
    }

    /// Number of asked questions, the unassigned group excluded.
    public int askedQuestionCount() {
        return unassignedGroup == null ? questions.size() : questions.size() - 1;
    }

    /// Declared respondents, possibly empty.
    public Set<String> roster() {
        return roster;
    }

    /// Total number of answers across all questions.
    public int totalResponses() {
        int total = 0;
        for (TextCorpus c : questions.values()) {
            total += c.size();
        }
        return total;
    }

    /// Merges all questions into one corpus.
    ///
    /// Record ids become `questionId/recordId` and each record of an asked
    /// question gains a `question_id` metadata entry, so the flat corpus can
    /// be regrouped. Records of the unassigned group stay without one.
    ///
    /// @return the flattened corpus
    public TextCorpus flatten() {
        TextCorpus.Builder builder = TextCorpus.builder(surveyId);
        questions.forEach((questionId, corpus) -> {
            for (TextRecord r : corpus) {
                Map<String, Object> meta = new LinkedHashMap<>(r.metadata());
                if (!questionId.equals(unassignedGroup)) {
                    meta.put(TextCorpus.QUESTION_ID_KEY, questionId);
                }
                builder.add(questionId + "/" + r.id(), r.text(), r.timestamp(), r.category(), meta);
            }
        });
        return builder.build();
    }

    @Override
    public String toString() {
        return "SurveyDataset[" + surveyId + ", questions=" + questions.size()
            + ", responses=" + totalResponses() + "]";
    }

    public static final class Builder {
        private final String surveyId;
        private final Map<String, TextCorpus> questions = new LinkedHashMap<>();
        private final Set<String> roster = new LinkedHashSet<>();
        private String unassignedGroup;

        private Builder(String surveyId) {
            this.surveyId = Objects.requireNonNull(surveyId, "surveyId cannot be null");
        }

        /// Adds a question.
        ///
        /// @throws ValidationException if the question id is blank or repeats
        public Builder question(String questionId, TextCorpus answers) {
            if (questionId == null || questionId.isBlank()) {
                throw new ValidationException("Question id must not be blank");
            }
            Objects.requireNonNull(answers, "answers cannot be null");
            if (questions.putIfAbsent(questionId, answers) != null) {
                throw new ValidationException("Duplicate question id '" + questionId + "'");
            }
            return this;
        }

        /// Declares the invited respondents.
        public Builder respondents(Collection<String> respondentIds) {
            for (String id : respondentIds) {
                if (id == null || id.isBlank()) {
                    throw new ValidationException("Respondent ids must not be blank");
                }
                roster.add(id);
            }
            return this;
        }

        public SurveyDataset build() {
            if (questions.isEmpty()) {
                throw new ValidationException("Survey " + surveyId + " has no questions");
            }
            return new SurveyDataset(surveyId, questions, roster, unassignedGroup);
        }
    }
}
