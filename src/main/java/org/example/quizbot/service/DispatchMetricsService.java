package org.example.quizbot.service;

import org.example.quizbot.model.BatchSource;
import org.example.quizbot.model.DispatchResult;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
public class DispatchMetricsService {

    private final LongAdder dispatchRequested = new LongAdder();
    private final LongAdder dispatchCompleted = new LongAdder();
    private final LongAdder dispatchFallbackCompleted = new LongAdder();
    private final LongAdder dispatchEmpty = new LongAdder();
    private final LongAdder dispatchFailed = new LongAdder();
    private final LongAdder questionsPublished = new LongAdder();
    private final LongAdder publishFailures = new LongAdder();
    private final AtomicLong dispatchLatencyTotalMs = new AtomicLong(0);

    public void recordDispatchRequested() {
        dispatchRequested.increment();
    }

    public void recordDispatchCompleted(DispatchResult result) {
        dispatchCompleted.increment();
        if (result.source() == BatchSource.FALLBACK) {
            dispatchFallbackCompleted.increment();
        }
        if (result.assembled() == 0) {
            dispatchEmpty.increment();
        }
        questionsPublished.add(result.published());
        publishFailures.add(result.publishFailures());
        if (result.durationMs() > 0) {
            dispatchLatencyTotalMs.addAndGet(result.durationMs());
        }
    }

    public void recordDispatchFailed(long durationMs) {
        dispatchFailed.increment();
        if (durationMs > 0) {
            dispatchLatencyTotalMs.addAndGet(durationMs);
        }
    }

    public Map<String, Object> snapshot() {
        long completed = dispatchCompleted.sum();
        long failed = dispatchFailed.sum();
        long measured = completed + failed;
        long avgLatencyMs = measured == 0 ? 0 : dispatchLatencyTotalMs.get() / measured;

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("dispatchRequested", dispatchRequested.sum());
        metrics.put("dispatchCompleted", completed);
        metrics.put("dispatchFallbackCompleted", dispatchFallbackCompleted.sum());
        metrics.put("dispatchEmpty", dispatchEmpty.sum());
        metrics.put("dispatchFailed", failed);
        metrics.put("questionsPublished", questionsPublished.sum());
        metrics.put("publishFailures", publishFailures.sum());
        metrics.put("dispatchAverageLatencyMs", avgLatencyMs);
        return metrics;
    }
}
