package org.example.quizbot.model;

import java.util.List;
import java.util.Objects;

/**
 * A single multiple-choice question as it travels from a source to the channel.
 * Explanation length is not limited here; the publisher trims it for the platform.
 */
public record Question(
        String text,
        List<String> options,
        int correctIndex,
        String explanation,
        String topic
) {
    public static final String DEFAULT_TOPIC = "General";

    public Question {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Question text must not be blank");
        }
        if (options == null || options.size() < 2) {
            throw new IllegalArgumentException("Question needs at least two options");
        }
        options = options.stream()
                .map(option -> Objects.requireNonNull(option, "option"))
                .toList();
        if (correctIndex < 0 || correctIndex >= options.size()) {
            throw new IllegalArgumentException(
                    "Correct index " + correctIndex + " out of range for " + options.size() + " options");
        }
        explanation = explanation == null ? "" : explanation;
        topic = topic == null || topic.isBlank() ? DEFAULT_TOPIC : topic;
    }

    public QuestionFingerprint fingerprint() {
        return QuestionFingerprint.of(this);
    }

    public String correctOption() {
        return options.get(correctIndex);
    }
}
