package org.example.quizbot.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.quizbot.config.QuizBotProperties;
import org.example.quizbot.model.BatchSource;
import org.example.quizbot.model.Question;
import org.example.quizbot.model.QuestionBatch;
import org.example.quizbot.model.QuestionFingerprint;
import org.example.quizbot.provider.ProviderQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Assembles fingerprint-unique question batches. Questions are pulled from the provider one
 * at a time; when the provider yields nothing usable the local bank fills the batch instead.
 * Every question handed out is registered in the {@link RecentQuestionCache}.
 */
@Service
public class QuestionBatchService {

    private static final Logger log = LoggerFactory.getLogger(QuestionBatchService.class);

    private final QuestionFetchService fetchService;
    private final QuestionNormalizer normalizer;
    private final RecentQuestionCache recentCache;
    private final QuestionBankService bankService;
    private final int attemptFactor;
    private final boolean avoidRecent;
    private final Duration deadline;    // nullable
    private final Random random;
    private final Clock clock;

    @Autowired
    public QuestionBatchService(
            QuestionFetchService fetchService,
            QuestionNormalizer normalizer,
            RecentQuestionCache recentCache,
            QuestionBankService bankService,
            QuizBotProperties properties,
            Clock clock) {
        this(
                fetchService,
                normalizer,
                recentCache,
                bankService,
                properties.getBatch().getAttemptFactor(),
                properties.getBatch().isAvoidRecent(),
                properties.getBatch().getDeadline(),
                new Random(),
                clock
        );
    }

    QuestionBatchService(
            QuestionFetchService fetchService,
            QuestionNormalizer normalizer,
            RecentQuestionCache recentCache,
            QuestionBankService bankService,
            int attemptFactor,
            boolean avoidRecent,
            Duration deadline,
            Random random,
            Clock clock) {
        this.fetchService = fetchService;
        this.normalizer = normalizer;
        this.recentCache = recentCache;
        this.bankService = bankService;
        this.attemptFactor = Math.max(1, attemptFactor);
        this.avoidRecent = avoidRecent;
        this.deadline = deadline == null || deadline.isZero() || deadline.isNegative() ? null : deadline;
        this.random = random;
        this.clock = clock;
    }

    /**
     * Returns at most {@code count} questions with pairwise distinct fingerprints.
     * An empty batch means nothing could be sourced at all; it is never an exception.
     */
    public QuestionBatch assembleBatch(String topic, int count) {
        if (count <= 0) {
            return QuestionBatch.empty(topic);
        }

        List<Question> batch = new ArrayList<>();
        Set<QuestionFingerprint> seen = new HashSet<>();
        try {
            collectFromProvider(topic, count, batch, seen);
        } catch (RuntimeException e) {
            log.error("Unexpected error while collecting questions for topic '{}'", topic, e);
        }

        QuestionBatch result;
        if (!batch.isEmpty()) {
            Collections.shuffle(batch, random);
            result = new QuestionBatch(topic, batch.subList(0, Math.min(count, batch.size())), BatchSource.PROVIDER);
        } else {
            log.warn("Provider returned no usable questions for topic '{}'; using local fallback bank", topic);
            result = assembleFromBank(topic, count);
        }

        result.questions().forEach(question -> recentCache.register(question.fingerprint()));
        recentCache.persist();
        log.info("Assembled {} question(s) for topic '{}' from {}", result.size(), topic, result.source());
        return result;
    }

    private void collectFromProvider(
            String topic,
            int count,
            List<Question> batch,
            Set<QuestionFingerprint> seen) {
        int maxIterations = count * attemptFactor;
        Instant startedAt = clock.instant();
        int iterations = 0;
        while (batch.size() < count && iterations < maxIterations) {
            iterations++;
            if (deadlineExceeded(startedAt)) {
                log.warn("Batch deadline of {} reached for topic '{}' after {} fetches", deadline, topic, iterations - 1);
                return;
            }

            Optional<JsonNode> response = fetchService.fetchWithRetry(ProviderQuery.single(topic));
            if (response.isEmpty()) {
                log.warn("Question provider unavailable for topic '{}'; stopping after {} fetches", topic, iterations);
                return;
            }

            List<Question> candidates = normalizer.normalize(response.get(), topic);
            for (Question candidate : candidates) {
                QuestionFingerprint fingerprint = candidate.fingerprint();
                if (seen.contains(fingerprint)) {
                    continue;
                }
                if (avoidRecent && recentCache.contains(fingerprint)) {
                    log.debug("Skipping recently delivered question: {}", fingerprint.text());
                    continue;
                }
                seen.add(fingerprint);
                batch.add(candidate);
                recentCache.register(fingerprint);
                if (batch.size() >= count) {
                    return;
                }
            }
        }
        if (batch.size() < count) {
            log.info("Collected {} of {} question(s) for topic '{}' within {} fetches",
                    batch.size(), count, topic, iterations);
        }
    }

    /**
     * Fills the batch from the bank. Distinct entries are used first, preferring ones outside the
     * recency window; when the bank is too small the remainder is sampled with replacement.
     */
    QuestionBatch assembleFromBank(String topic, int count) {
        List<Question> candidates = bankService.candidatesFor(topic);
        if (candidates.isEmpty()) {
            log.error("Fallback bank is empty; no questions available for topic '{}'", topic);
            return QuestionBatch.empty(topic);
        }

        Map<QuestionFingerprint, Question> distinct = new LinkedHashMap<>();
        for (Question candidate : candidates) {
            distinct.putIfAbsent(candidate.fingerprint(), candidate);
        }
        List<Question> pool = new ArrayList<>(distinct.values());
        Collections.shuffle(pool, random);
        pool.sort(Comparator.comparing(question -> recentCache.contains(question.fingerprint())));

        List<Question> batch = new ArrayList<>(count);
        for (Question question : pool) {
            if (batch.size() >= count) {
                break;
            }
            batch.add(question);
        }
        if (batch.size() < count) {
            log.info("Fallback bank has only {} distinct question(s) for topic '{}'; repeating to reach {}",
                    pool.size(), topic, count);
        }
        while (batch.size() < count) {
            batch.add(pool.get(random.nextInt(pool.size())));
        }
        return new QuestionBatch(topic, batch, BatchSource.FALLBACK);
    }

    private boolean deadlineExceeded(Instant startedAt) {
        return deadline != null && Duration.between(startedAt, clock.instant()).compareTo(deadline) >= 0;
    }

    public RecentQuestionCache getRecentCache() {
        return recentCache;
    }
}
