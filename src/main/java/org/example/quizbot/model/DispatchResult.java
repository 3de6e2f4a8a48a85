package org.example.quizbot.model;

import java.time.LocalDateTime;

public record DispatchResult(
        String topic,
        DispatchOrigin origin,
        int requested,
        int assembled,
        int published,
        int publishFailures,
        BatchSource source,
        LocalDateTime startedAt,
        long durationMs
) {
    public boolean delivered() {
        return published > 0;
    }
}
