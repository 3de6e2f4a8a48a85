package org.example.quizbot.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QuestionTest {

    @Test
    void constructor_rejectsInvalidQuestions() {
        assertThrows(IllegalArgumentException.class, () -> new Question(" ", List.of("a", "b"), 0, "", "Penal"));
        assertThrows(IllegalArgumentException.class, () -> new Question("Q", List.of("a"), 0, "", "Penal"));
        assertThrows(IllegalArgumentException.class, () -> new Question("Q", List.of("a", "b"), 2, "", "Penal"));
        assertThrows(NullPointerException.class, () -> new Question("Q", Arrays.asList("a", null), 0, "", "Penal"));
    }

    @Test
    void constructor_defaultsExplanationAndTopic() {
        Question question = new Question("Q", List.of("a", "b"), 1, null, " ");

        assertEquals("", question.explanation());
        assertEquals(Question.DEFAULT_TOPIC, question.topic());
        assertEquals("b", question.correctOption());
    }

    @Test
    void constructor_copiesOptions() {
        List<String> options = new ArrayList<>(List.of("a", "b"));
        Question question = new Question("Q", options, 0, "", "Penal");
        options.add("c");

        assertEquals(2, question.options().size());
    }

    @Test
    void fingerprint_ignoresSurroundingWhitespaceAndExplanation() {
        Question first = new Question("Qual a capital?", List.of("a", "b"), 1, "x", "General");
        Question second = new Question("  Qual a capital?  ", List.of("c", "d"), 1, "y", "Penal");
        Question third = new Question("Qual a capital?", List.of("a", "b"), 0, "x", "General");

        assertEquals(first.fingerprint(), second.fingerprint());
        assertNotEquals(first.fingerprint(), third.fingerprint());
    }
}
