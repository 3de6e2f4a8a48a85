package org.example.quizbot.delivery;

import org.example.quizbot.model.Question;

/**
 * Outbound channel for assembled questions.
 */
public interface QuizPublisher {

    /**
     * Publish one question as a quiz poll.
     *
     * @throws PublishException if the channel rejects or cannot be reached
     */
    void publishQuestion(Question question);

    /**
     * Publish a plain notice, e.g. when no questions could be loaded.
     *
     * @throws PublishException if the channel rejects or cannot be reached
     */
    void publishNotice(String text);

    /**
     * Get the name of this publisher for logging/debugging.
     */
    String getPublisherName();
}
