package org.example.quizbot.model;

/**
 * Dedup key of a question: trimmed text plus correct option index.
 * Two questions sharing both are treated as the same question even if their options differ.
 */
public record QuestionFingerprint(String text, int correctIndex) {

    public QuestionFingerprint {
        text = text == null ? "" : text.trim();
    }

    public static QuestionFingerprint of(Question question) {
        return new QuestionFingerprint(question.text(), question.correctIndex());
    }
}
