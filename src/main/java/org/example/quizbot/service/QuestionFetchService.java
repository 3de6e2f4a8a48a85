package org.example.quizbot.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.quizbot.config.QuizBotProperties;
import org.example.quizbot.provider.ProviderQuery;
import org.example.quizbot.provider.QuestionProviderClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retries provider fetches with exponential backoff. Exhausted retries are reported as
 * an empty result, never as an exception: an unavailable provider is an expected condition.
 */
@Service
public class QuestionFetchService {

    private static final Logger log = LoggerFactory.getLogger(QuestionFetchService.class);

    private final QuestionProviderClient providerClient;
    private final int maxAttempts;
    private final Duration backoffBase;
    private final double jitterFactor;
    private final Sleeper sleeper;

    @Autowired
    public QuestionFetchService(QuestionProviderClient providerClient, QuizBotProperties properties) {
        this(
                providerClient,
                properties.getRetry().getMaxAttempts(),
                properties.getRetry().getBackoffBase(),
                properties.getRetry().getJitterFactor(),
                Thread::sleep
        );
    }

    QuestionFetchService(
            QuestionProviderClient providerClient,
            int maxAttempts,
            Duration backoffBase,
            double jitterFactor,
            Sleeper sleeper) {
        this.providerClient = providerClient;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffBase = backoffBase == null ? Duration.ZERO : backoffBase;
        this.jitterFactor = Math.max(0.0, jitterFactor);
        this.sleeper = sleeper;
    }

    public Optional<JsonNode> fetchWithRetry(ProviderQuery query) {
        return fetchWithRetry(query, maxAttempts, backoffBase);
    }

    public Optional<JsonNode> fetchWithRetry(ProviderQuery query, int attempts, Duration base) {
        if (!providerClient.isConfigured()) {
            log.warn("Question provider not configured; skipping remote fetch");
            return Optional.empty();
        }

        int limit = Math.max(1, attempts);
        for (int attempt = 1; attempt <= limit; attempt++) {
            try {
                log.debug("Fetching questions from {} provider: count={}, topic={} (attempt {}/{})",
                        providerClient.getProviderName(), query.count(), query.topic(), attempt, limit);
                return Optional.ofNullable(providerClient.fetch(query))
                        .filter(node -> !node.isNull() && !node.isMissingNode())
                        .filter(node -> !(node.isContainerNode() && node.isEmpty()));
            } catch (RuntimeException e) {
                log.warn("Question provider call failed ({}/{}): {}", attempt, limit, e.getMessage());
                if (attempt == limit) {
                    break;
                }
                long delayMs = backoffDelayMs(base, attempt);
                try {
                    sleeper.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while backing off from question provider");
                    return Optional.empty();
                }
            }
        }

        log.warn("Question provider unavailable after {} attempts", limit);
        return Optional.empty();
    }

    /**
     * base * 2^(attempt-1), stretched by up to {@code jitterFactor} when jitter is enabled.
     */
    long backoffDelayMs(Duration base, int attempt) {
        long exponential = (base == null ? 0L : base.toMillis()) * (1L << Math.min(30, attempt - 1));
        if (jitterFactor <= 0.0) {
            return exponential;
        }
        double stretch = 1.0 + ThreadLocalRandom.current().nextDouble() * jitterFactor;
        return (long) (exponential * stretch);
    }

    public boolean isProviderConfigured() {
        return providerClient.isConfigured();
    }

    public String getProviderName() {
        return providerClient.getProviderName();
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
