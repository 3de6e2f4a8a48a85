package org.example.quizbot.provider;

/**
 * Exception thrown when a single provider fetch attempt fails.
 */
public class QuestionProviderException extends RuntimeException {

    public QuestionProviderException(String message) {
        super(message);
    }

    public QuestionProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
