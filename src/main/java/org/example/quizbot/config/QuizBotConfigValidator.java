package org.example.quizbot.config;

import jakarta.annotation.PostConstruct;
import org.example.quizbot.model.RotationSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Validates {@code quizbot.*} settings before any dispatch component is built.
 * All problems are reported together; startup fails if there is at least one.
 */
@Component
public class QuizBotConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(QuizBotConfigValidator.class);

    static final String MODE_TELEGRAM = "telegram";
    static final String MODE_LOG = "log";

    private final QuizBotProperties properties;

    public QuizBotConfigValidator(QuizBotProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void validateOnStartup() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            String message = "Invalid configuration:\n- " + String.join("\n- ", problems);
            log.error(message);
            throw new IllegalStateException(message);
        }

        log.info("Configuration validated");
        log.info("Question provider: {}", isBlank(properties.getProvider().getUrl())
                ? "(not configured)"
                : properties.getProvider().getUrl());
        log.info("Delivery: mode={}, chatId={}", deliveryMode(), properties.getDelivery().getChatId());
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        QuizBotProperties.Delivery delivery = properties.getDelivery();
        String mode = deliveryMode();
        if (MODE_TELEGRAM.equals(mode)) {
            if (isBlank(delivery.getTelegramToken())) {
                problems.add("quizbot.delivery.telegram-token is not set (TELEGRAM_TOKEN).");
            }
            if (isBlank(delivery.getChatId())) {
                problems.add("quizbot.delivery.chat-id is not set (CANAL_ID).");
            }
        } else if (!MODE_LOG.equals(mode)) {
            problems.add("quizbot.delivery.mode must be 'telegram' or 'log', got '" + delivery.getMode() + "'.");
        }

        if (isBlank(properties.getProvider().getUrl())) {
            log.warn("quizbot.provider.url is not set; every batch will come from the local bank");
        }
        if (properties.getRetry().getMaxAttempts() < 1) {
            problems.add("quizbot.retry.max-attempts must be at least 1.");
        }
        if (properties.getRecency().getCapacity() < 1) {
            problems.add("quizbot.recency.capacity must be at least 1.");
        }
        if (properties.getBatch().getDefaultCount() < 1
                || properties.getBatch().getDefaultCount() > properties.getBatch().getMaxCount()) {
            problems.add("quizbot.batch.default-count must be between 1 and quizbot.batch.max-count.");
        }
        if (properties.getTopics().isEmpty()) {
            problems.add("quizbot.topics must list at least one topic.");
        }

        try {
            toRotationSchedule();
        } catch (IllegalArgumentException | DateTimeException e) {
            problems.add("Rotation schedule is invalid: " + e.getMessage());
        }
        return problems;
    }

    /**
     * Builds the rotation from {@code quizbot.timezone}, {@code quizbot.schedule.slot-times}
     * and {@code quizbot.schedule.rotation}. The n-th slot time fires the n-th topic of the day.
     */
    public RotationSchedule toRotationSchedule() {
        ZoneId zone = ZoneId.of(properties.getTimezone());
        List<String> slotTimes = properties.getSchedule().getSlotTimes();
        List<RotationSchedule.Slot> slots = new ArrayList<>();
        for (int i = 0; i < slotTimes.size(); i++) {
            String value = slotTimes.get(i) == null ? "" : slotTimes.get(i).trim();
            try {
                slots.add(new RotationSchedule.Slot(LocalTime.parse(value), i));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Slot time '" + value + "' is not HH:mm", e);
            }
        }
        return new RotationSchedule(zone, properties.getSchedule().getRotation(), slots);
    }

    public String deliveryMode() {
        String mode = properties.getDelivery().getMode();
        return mode == null ? "" : mode.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
