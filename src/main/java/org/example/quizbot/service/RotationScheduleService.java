package org.example.quizbot.service;

import org.example.quizbot.model.RotationSchedule;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Resolves which topic is due for each daily slot. Resolution always uses the date of the
 * instant it is asked for, so a long-running process follows the calendar.
 */
@Service
public class RotationScheduleService {

    private final RotationSchedule schedule;
    private final Clock clock;

    public RotationScheduleService(RotationSchedule schedule, Clock clock) {
        this.schedule = schedule;
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(schedule.zone()));
    }

    public int dayBucket(LocalDate date) {
        return RotationSchedule.dayBucket(date);
    }

    public List<String> topicsFor(LocalDate date) {
        return schedule.topicsFor(date);
    }

    public String topicForSlot(LocalDate date, int slotIndex) {
        return schedule.topicFor(date, slotIndex);
    }

    public String currentTopicForSlot(int slotIndex) {
        return topicForSlot(today(), slotIndex);
    }

    public List<SlotPlan> planFor(LocalDate date) {
        return schedule.slots().stream()
                .map(slot -> new SlotPlan(slot.time(), slot.index(), schedule.topicFor(date, slot.index())))
                .toList();
    }

    public List<SlotPlan> todayPlan() {
        return planFor(today());
    }

    public RotationSchedule getSchedule() {
        return schedule;
    }

    public record SlotPlan(LocalTime time, int slotIndex, String topic) {
    }
}
