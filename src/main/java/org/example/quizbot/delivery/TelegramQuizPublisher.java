package org.example.quizbot.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.quizbot.model.Question;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes quiz polls and notices through the Telegram Bot API.
 */
public class TelegramQuizPublisher implements QuizPublisher {

    private static final Logger log = LoggerFactory.getLogger(TelegramQuizPublisher.class);

    static final int MAX_QUESTION_LENGTH = 300;
    static final int MAX_OPTION_LENGTH = 100;
    static final int MAX_EXPLANATION_LENGTH = 200;

    private final RestClient restClient;
    private final String chatId;

    public TelegramQuizPublisher(RestClient.Builder restClientBuilder, String apiBase, String token, String chatId) {
        this.restClient = restClientBuilder
                .baseUrl(apiBase + "/bot" + token)
                .build();
        this.chatId = chatId;
        log.info("Telegram publisher initialized: chatId={}", chatId);
    }

    @Override
    public void publishQuestion(Question question) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("question", trimToLength("[" + question.topic() + "] " + question.text(), MAX_QUESTION_LENGTH));
        body.put("options", question.options().stream()
                .map(option -> Map.of("text", trimToLength(option, MAX_OPTION_LENGTH)))
                .toList());
        body.put("type", "quiz");
        body.put("correct_option_id", question.correctIndex());
        String explanation = trimToLength(question.explanation(), MAX_EXPLANATION_LENGTH);
        if (!explanation.isBlank()) {
            body.put("explanation", explanation);
        }
        body.put("is_anonymous", false);
        call("sendPoll", body);
    }

    @Override
    public void publishNotice(String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("parse_mode", "Markdown");
        call("sendMessage", body);
    }

    @Override
    public String getPublisherName() {
        return "telegram";
    }

    private void call(String method, Map<String, Object> body) {
        try {
            JsonNode response = restClient.post()
                    .uri("/" + method)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null || !response.path("ok").asBoolean(false)) {
                String description = response == null ? "empty response" : response.path("description").asText("unknown error");
                throw new PublishException("Telegram " + method + " rejected: " + description);
            }
        } catch (RestClientResponseException e) {
            log.error("Telegram API error on {}: {} - {}", method, e.getStatusCode(), e.getResponseBodyAsString());
            throw new PublishException("Telegram API error: " + e.getStatusCode(), e);
        } catch (PublishException e) {
            throw e;
        } catch (Exception e) {
            throw new PublishException("Failed to call Telegram " + method, e);
        }
    }

    static String trimToLength(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        if (trimmed.length() <= maxLength) {
            return trimmed;
        }
        return trimmed.substring(0, maxLength - 3).trim() + "...";
    }
}
