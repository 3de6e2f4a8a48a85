package org.example.quizbot.service;

import jakarta.annotation.PreDestroy;
import org.example.quizbot.config.QuizBotProperties;
import org.example.quizbot.model.DispatchOrigin;
import org.example.quizbot.model.RotationSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Registers one daily trigger per rotation slot. Triggers only resolve the topic and hand the
 * batch off to the dispatch executor, so provider backoff never delays other triggers.
 * Missed firings (process down) are not replayed.
 */
@Component
public class RotationScheduler {

    private static final Logger log = LoggerFactory.getLogger(RotationScheduler.class);

    private final TaskScheduler taskScheduler;
    private final TaskExecutor dispatchExecutor;
    private final RotationScheduleService rotationScheduleService;
    private final QuizDispatchService dispatchService;
    private final boolean enabled;
    private final int defaultCount;
    private final List<ScheduledFuture<?>> triggers = new ArrayList<>();

    public RotationScheduler(
            @Qualifier("rotationTaskScheduler") TaskScheduler taskScheduler,
            @Qualifier("dispatchExecutor") TaskExecutor dispatchExecutor,
            RotationScheduleService rotationScheduleService,
            QuizDispatchService dispatchService,
            QuizBotProperties properties) {
        this.taskScheduler = taskScheduler;
        this.dispatchExecutor = dispatchExecutor;
        this.rotationScheduleService = rotationScheduleService;
        this.dispatchService = dispatchService;
        this.enabled = properties.getSchedule().isEnabled();
        this.defaultCount = properties.getBatch().getDefaultCount();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void scheduleOnStartup() {
        registerTriggers();
    }

    synchronized int registerTriggers() {
        if (!enabled) {
            log.info("Automatic rotation dispatch is disabled");
            return 0;
        }
        if (!triggers.isEmpty()) {
            return triggers.size();
        }

        RotationSchedule schedule = rotationScheduleService.getSchedule();
        for (RotationSchedule.Slot slot : schedule.slots()) {
            CronTrigger trigger = new CronTrigger(cronFor(slot), schedule.zone());
            triggers.add(taskScheduler.schedule(() -> fire(slot.index()), trigger));
            log.info("Scheduled automatic dispatch: slot {} at {} ({})", slot.index(), slot.time(), schedule.zone());
        }
        return triggers.size();
    }

    /**
     * Resolves today's topic for the slot at the moment of firing and queues the dispatch.
     */
    void fire(int slotIndex) {
        try {
            LocalDate today = rotationScheduleService.today();
            String topic = rotationScheduleService.topicForSlot(today, slotIndex);
            log.info("Rotation trigger fired: slot {} on {} (bucket {}) -> topic '{}'",
                    slotIndex, today, rotationScheduleService.dayBucket(today), topic);
            dispatchExecutor.execute(() -> runDispatch(topic));
        } catch (Exception e) {
            log.error("Error handling rotation trigger for slot {}", slotIndex, e);
        }
    }

    private void runDispatch(String topic) {
        try {
            dispatchService.dispatch(topic, defaultCount, DispatchOrigin.SCHEDULED);
        } catch (Exception e) {
            log.error("Scheduled dispatch for topic '{}' failed", topic, e);
        }
    }

    static String cronFor(RotationSchedule.Slot slot) {
        return String.format("0 %d %d * * *", slot.time().getMinute(), slot.time().getHour());
    }

    public synchronized int getTriggerCount() {
        return triggers.size();
    }

    @PreDestroy
    public synchronized void shutdown() {
        triggers.forEach(trigger -> trigger.cancel(false));
        triggers.clear();
        log.info("Rotation scheduler shutting down");
    }
}
