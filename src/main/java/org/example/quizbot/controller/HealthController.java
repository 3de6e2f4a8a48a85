package org.example.quizbot.controller;

import org.example.quizbot.service.DispatchMetricsService;
import org.example.quizbot.service.QuestionBankService;
import org.example.quizbot.service.QuestionFetchService;
import org.example.quizbot.service.QuizDispatchService;
import org.example.quizbot.service.RecentQuestionCache;
import org.example.quizbot.service.RotationScheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

@RestController
public class HealthController {

    private final QuestionFetchService fetchService;
    private final QuizDispatchService dispatchService;
    private final RecentQuestionCache recentQuestionCache;
    private final QuestionBankService bankService;
    private final RotationScheduler rotationScheduler;
    private final DispatchMetricsService metricsService;

    public HealthController(
            QuestionFetchService fetchService,
            QuizDispatchService dispatchService,
            RecentQuestionCache recentQuestionCache,
            QuestionBankService bankService,
            RotationScheduler rotationScheduler,
            DispatchMetricsService metricsService) {
        this.fetchService = fetchService;
        this.dispatchService = dispatchService;
        this.recentQuestionCache = recentQuestionCache;
        this.bankService = bankService;
        this.rotationScheduler = rotationScheduler;
        this.metricsService = metricsService;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/details")
    public HealthDetails healthDetails() {
        boolean providerConfigured = fetchService.isProviderConfigured();
        return new HealthDetails(
                providerConfigured ? "ok" : "degraded",
                LocalDateTime.now(),
                new ProviderHealth(providerConfigured, fetchService.getProviderName()),
                dispatchService.getPublisherName(),
                new CacheHealth(
                        recentQuestionCache.size(),
                        recentQuestionCache.capacity(),
                        recentQuestionCache.isPersistent()
                ),
                bankService.size(),
                rotationScheduler.getTriggerCount(),
                metricsService.snapshot()
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            LocalDateTime asOf,
            ProviderHealth provider,
            String publisher,
            CacheHealth recencyCache,
            int fallbackBankSize,
            int scheduledTriggers,
            Map<String, Object> dispatchMetrics
    ) {
    }

    public record ProviderHealth(boolean configured, String name) {
    }

    public record CacheHealth(int size, int capacity, boolean persistent) {
    }
}
