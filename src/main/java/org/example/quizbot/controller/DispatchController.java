package org.example.quizbot.controller;

import org.example.quizbot.config.QuizBotProperties;
import org.example.quizbot.model.DispatchOrigin;
import org.example.quizbot.model.DispatchResult;
import org.example.quizbot.model.QuestionBatch;
import org.example.quizbot.service.QuestionBatchService;
import org.example.quizbot.service.QuizDispatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Manual "send now" trigger. Runs the same dispatch path as the rotation scheduler.
 */
@RestController
@RequestMapping("/api")
public class DispatchController {

    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    private final QuizDispatchService dispatchService;
    private final QuestionBatchService batchService;
    private final QuizBotProperties properties;

    public DispatchController(
            QuizDispatchService dispatchService,
            QuestionBatchService batchService,
            QuizBotProperties properties) {
        this.dispatchService = dispatchService;
        this.batchService = batchService;
        this.properties = properties;
    }

    @GetMapping("/topics")
    public List<String> getTopics() {
        return properties.getTopics();
    }

    @PostMapping("/dispatch/{topic}")
    public ResponseEntity<DispatchResult> dispatch(
            @PathVariable String topic,
            @RequestParam(required = false) Integer count) {
        Optional<String> knownTopic = resolveTopic(topic);
        if (knownTopic.isEmpty()) {
            log.warn("Manual dispatch requested for unknown topic '{}'", topic);
            return ResponseEntity.badRequest().build();
        }
        int resolvedCount = count == null ? properties.getBatch().getDefaultCount() : count;
        if (!isValidCount(resolvedCount)) {
            return ResponseEntity.badRequest().build();
        }

        try {
            return ResponseEntity.ok(dispatchService.dispatch(knownTopic.get(), resolvedCount, DispatchOrigin.MANUAL));
        } catch (Exception e) {
            log.error("Manual dispatch failed for topic '{}'", topic, e);
            return ResponseEntity.status(500).build();
        }
    }

    @GetMapping("/dispatch/preview/{topic}")
    public ResponseEntity<QuestionBatch> preview(
            @PathVariable String topic,
            @RequestParam(required = false) Integer count) {
        Optional<String> knownTopic = resolveTopic(topic);
        if (knownTopic.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        int resolvedCount = count == null ? properties.getBatch().getDefaultCount() : count;
        if (!isValidCount(resolvedCount)) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(batchService.assembleBatch(knownTopic.get(), resolvedCount));
    }

    private Optional<String> resolveTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            return Optional.empty();
        }
        String wanted = topic.trim();
        return properties.getTopics().stream()
                .filter(known -> known.equalsIgnoreCase(wanted))
                .findFirst();
    }

    private boolean isValidCount(int count) {
        return count >= 1 && count <= properties.getBatch().getMaxCount();
    }
}
