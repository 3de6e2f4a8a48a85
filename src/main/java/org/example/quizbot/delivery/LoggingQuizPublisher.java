package org.example.quizbot.delivery;

import org.example.quizbot.model.Question;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publisher that only writes to the log. Used for local runs without channel credentials.
 */
public class LoggingQuizPublisher implements QuizPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingQuizPublisher.class);

    @Override
    public void publishQuestion(Question question) {
        log.info("[{}] {} {} (correct={})",
                question.topic(), question.text(), question.options(), question.correctIndex());
    }

    @Override
    public void publishNotice(String text) {
        log.info("Notice: {}", text);
    }

    @Override
    public String getPublisherName() {
        return "log";
    }
}
