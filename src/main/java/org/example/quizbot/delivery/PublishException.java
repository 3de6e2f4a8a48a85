package org.example.quizbot.delivery;

/**
 * Exception thrown when a publish call to the channel fails.
 */
public class PublishException extends RuntimeException {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
