package org.example.quizbot.model;

import java.util.List;

public record QuestionBatch(
        String topic,
        List<Question> questions,
        BatchSource source
) {
    public QuestionBatch {
        questions = questions == null ? List.of() : List.copyOf(questions);
        source = source == null ? BatchSource.NONE : source;
    }

    public static QuestionBatch empty(String topic) {
        return new QuestionBatch(topic, List.of(), BatchSource.NONE);
    }

    public boolean isEmpty() {
        return questions.isEmpty();
    }

    public int size() {
        return questions.size();
    }
}
