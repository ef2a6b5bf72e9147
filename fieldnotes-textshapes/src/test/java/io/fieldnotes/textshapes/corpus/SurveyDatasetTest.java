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

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SurveyDatasetTest {

    @Test
    void testFromCorpusGroupsByQuestionKey() {
        TextCorpus flat = TextCorpus.builder("flat")
            .add(null, "Friendly staff", null, null, Map.of("question_id", "likes"))
            .add(null, "Long wait", null, null, Map.of("question_id", "dislikes"))
            .add(null, "Great coffee", null, null, Map.of("question_id", "likes"))
            .add(null, "No comment", null, null, Map.of())
            .build();

        SurveyDataset dataset = SurveyDataset.fromCorpus(flat, "question_id");

        assertThat(dataset.questionIds()).containsExactly("likes", "dislikes", "unassigned");
        assertEquals(Optional.of("unassigned"), dataset.unassignedGroup());
        assertEquals(4, dataset.totalResponses());
        assertEquals(2, dataset.askedQuestionCount());
        assertFalse(dataset.isQuestion("unassigned"));
        assertTrue(dataset.isQuestion("likes"));
    }

    @Test
    void testUnassignedGroupDoesNotOverwriteQuestionOfTheSameName() {
        TextCorpus flat = TextCorpus.builder("flat")
            .add(null, "First real answer", null, null, Map.of("question_id", "unassigned"))
            .add(null, "Second real answer", null, null, Map.of("question_id", "unassigned"))
            .add(null, "Answer without a question", null, null, Map.of())
            .build();

        SurveyDataset dataset = SurveyDataset.fromCorpus(flat, "question_id");

        assertEquals(3, dataset.totalResponses());
        assertThat(dataset.questionIds()).containsExactly("unassigned", "unassigned-2");
        assertEquals(2, dataset.question("unassigned").size());
        assertEquals(Optional.of("unassigned-2"), dataset.unassignedGroup());
        assertTrue(dataset.isQuestion("unassigned"));
        assertEquals(1, dataset.askedQuestionCount());
    }

    @Test
    void testSuffixSkipsEveryTakenName() {
        TextCorpus flat = TextCorpus.builder("flat")
            .add(null, "One", null, null, Map.of("question_id", "unassigned"))
            .add(null, "Two", null, null, Map.of("question_id", "unassigned-2"))
            .add(null, "Three", null, null, Map.of())
            .build();

        assertEquals(Optional.of("unassigned-3"), SurveyDataset.fromCorpus(flat, "question_id").unassignedGroup());
    }

    @Test
    void testCorpusWithoutQuestionKeyIsOneQuestion() {
        SurveyDataset dataset = SurveyDataset.fromCorpus(TextCorpus.ofTexts("pulse", List.of("Fine", "Busy")), "question_id");

        assertThat(dataset.questionIds()).containsExactly("pulse");
        assertTrue(dataset.unassignedGroup().isEmpty());
        assertEquals(1, dataset.askedQuestionCount());
    }

    @Test
    void testFlattenRoundTripsTheUnassignedGroup() {
        TextCorpus flat = TextCorpus.builder("flat")
            .add(null, "Real answer", null, null, Map.of("question_id", "unassigned"))
            .add(null, "Stray answer", null, null, Map.of())
            .build();
        SurveyDataset dataset = SurveyDataset.fromCorpus(flat, "question_id");

        TextCorpus flattened = dataset.flatten();
        assertEquals("unassigned", flattened.byId("unassigned/r1").metadata().get("question_id"));
        assertFalse(flattened.byId("unassigned-2/r2").metadata().containsKey("question_id"));

        SurveyDataset regrouped = SurveyDataset.fromCorpus(flattened, "question_id");
        assertThat(regrouped.questionIds()).containsExactly("unassigned", "unassigned-2");
        assertEquals(2, regrouped.totalResponses());
    }

    @Test
    void testBuilderRejectsDuplicateAndBlankIds() {
        SurveyDataset.Builder builder = SurveyDataset.builder("s").question("q1", TextCorpus.empty("q1"));
        assertThrows(ValidationException.class, () -> builder.question("q1", TextCorpus.empty("q1")));
        assertThrows(ValidationException.class, () -> builder.question(" ", TextCorpus.empty("x")));
        assertThrows(ValidationException.class, () -> SurveyDataset.builder("none").build());
    }
}
