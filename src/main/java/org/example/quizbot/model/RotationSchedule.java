package org.example.quizbot.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Three-day topic rotation. Each day bucket (1, 2 or 3) owns an ordered triplet of topics;
 * each slot fires at a fixed wall-clock time and picks the topic at its index.
 */
public record RotationSchedule(
        ZoneId zone,
        Map<Integer, List<String>> topicsByBucket,
        List<Slot> slots
) {
    public static final int BUCKET_COUNT = 3;
    public static final int TOPICS_PER_DAY = 3;

    public RotationSchedule {
        if (zone == null) {
            throw new IllegalArgumentException("Rotation zone is required");
        }
        if (topicsByBucket == null || topicsByBucket.size() != BUCKET_COUNT) {
            throw new IllegalArgumentException("Rotation needs exactly " + BUCKET_COUNT + " day buckets");
        }
        Map<Integer, List<String>> copy = new LinkedHashMap<>();
        for (int bucket = 1; bucket <= BUCKET_COUNT; bucket++) {
            List<String> topics = topicsByBucket.get(bucket);
            if (topics == null || topics.size() != TOPICS_PER_DAY) {
                throw new IllegalArgumentException(
                        "Day bucket " + bucket + " must list exactly " + TOPICS_PER_DAY + " topics");
            }
            if (topics.stream().anyMatch(topic -> topic == null || topic.isBlank())) {
                throw new IllegalArgumentException("Day bucket " + bucket + " contains a blank topic");
            }
            copy.put(bucket, topics.stream().map(String::trim).toList());
        }
        topicsByBucket = Map.copyOf(copy);

        if (slots == null || slots.isEmpty()) {
            throw new IllegalArgumentException("Rotation needs at least one slot");
        }
        for (Slot slot : slots) {
            if (slot.index() < 0 || slot.index() >= TOPICS_PER_DAY) {
                throw new IllegalArgumentException("Slot index out of range: " + slot.index());
            }
        }
        slots = slots.stream()
                .sorted(Comparator.comparing(Slot::time))
                .toList();
    }

    /**
     * Day-of-month modulo 3, with remainder 0 mapped to bucket 3.
     */
    public static int dayBucket(LocalDate date) {
        int remainder = date.getDayOfMonth() % BUCKET_COUNT;
        return remainder == 0 ? BUCKET_COUNT : remainder;
    }

    public List<String> topicsFor(LocalDate date) {
        return topicsByBucket.get(dayBucket(date));
    }

    public String topicFor(LocalDate date, int slotIndex) {
        return topicsFor(date).get(slotIndex);
    }

    public record Slot(LocalTime time, int index) {
        public Slot {
            if (time == null) {
                throw new IllegalArgumentException("Slot time is required");
            }
        }
    }
}
