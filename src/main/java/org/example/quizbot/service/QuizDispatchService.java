package org.example.quizbot.service;

import org.example.quizbot.delivery.PublishException;
import org.example.quizbot.delivery.QuizPublisher;
import org.example.quizbot.model.DispatchOrigin;
import org.example.quizbot.model.DispatchResult;
import org.example.quizbot.model.Question;
import org.example.quizbot.model.QuestionBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Single entry point shared by the rotation scheduler and manual triggers:
 * assemble a batch for a topic and hand every question to the publisher.
 */
@Service
public class QuizDispatchService {

    private static final Logger log = LoggerFactory.getLogger(QuizDispatchService.class);

    private final QuestionBatchService batchService;
    private final QuizPublisher publisher;
    private final DispatchMetricsService metricsService;
    private final Clock clock;

    public QuizDispatchService(
            QuestionBatchService batchService,
            QuizPublisher publisher,
            DispatchMetricsService metricsService,
            Clock clock) {
        this.batchService = batchService;
        this.publisher = publisher;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    public DispatchResult dispatch(String topic, int count, DispatchOrigin origin) {
        metricsService.recordDispatchRequested();
        LocalDateTime startedAt = LocalDateTime.now(clock);
        long startedAtMs = clock.millis();
        log.info("Starting {} dispatch for topic '{}' (count={})", origin, topic, count);

        try {
            QuestionBatch batch = batchService.assembleBatch(topic, count);
            int published = 0;
            int failures = 0;

            if (batch.isEmpty()) {
                log.error("No questions obtained for topic '{}'", topic);
                notifyEmptyBatch(topic);
            } else {
                for (Question question : batch.questions()) {
                    try {
                        publisher.publishQuestion(question);
                        published++;
                    } catch (PublishException e) {
                        failures++;
                        log.error("Failed to publish question to {}: {}", publisher.getPublisherName(), e.getMessage(), e);
                    }
                }
            }

            DispatchResult result = new DispatchResult(
                    topic,
                    origin,
                    count,
                    batch.size(),
                    published,
                    failures,
                    batch.source(),
                    startedAt,
                    Math.max(0L, clock.millis() - startedAtMs)
            );
            metricsService.recordDispatchCompleted(result);
            log.info("Finished {} dispatch for topic '{}': published={}, failures={}, source={}",
                    origin, topic, published, failures, batch.source());
            return result;
        } catch (RuntimeException e) {
            metricsService.recordDispatchFailed(Math.max(0L, clock.millis() - startedAtMs));
            log.error("Dispatch for topic '{}' failed", topic, e);
            throw e;
        }
    }

    public String getPublisherName() {
        return publisher.getPublisherName();
    }

    private void notifyEmptyBatch(String topic) {
        try {
            publisher.publishNotice(
                    "⚠️ Could not load questions for *" + topic + "* right now. Please try again later.");
        } catch (PublishException e) {
            log.error("Failed to publish empty-batch notice for topic '{}'", topic, e);
        }
    }
}
