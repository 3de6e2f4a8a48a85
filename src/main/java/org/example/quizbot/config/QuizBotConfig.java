package org.example.quizbot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.quizbot.delivery.LoggingQuizPublisher;
import org.example.quizbot.delivery.QuizPublisher;
import org.example.quizbot.delivery.TelegramQuizPublisher;
import org.example.quizbot.provider.HttpQuestionProviderClient;
import org.example.quizbot.provider.QuestionProviderClient;
import org.example.quizbot.service.RecentQuestionCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Creates the question provider, the channel publisher and the recency cache.
 */
@Configuration
public class QuizBotConfig {

    private static final Logger log = LoggerFactory.getLogger(QuizBotConfig.class);

    @Bean
    public QuestionProviderClient questionProviderClient(QuizBotProperties properties, ObjectMapper objectMapper) {
        QuizBotProperties.Provider provider = properties.getProvider();
        log.info("Configuring question provider: url={}, timeout={}", provider.getUrl(), provider.getTimeout());
        return new HttpQuestionProviderClient(
                restClientBuilder(provider.getTimeout()),
                provider.getUrl(),
                provider.getCountParam(),
                provider.getTopicParam(),
                objectMapper
        );
    }

    @Bean
    public QuizPublisher quizPublisher(QuizBotProperties properties, QuizBotConfigValidator validator) {
        QuizBotProperties.Delivery delivery = properties.getDelivery();
        String mode = validator.deliveryMode();
        log.info("Configuring quiz publisher: {}", mode);

        return switch (mode) {
            case QuizBotConfigValidator.MODE_TELEGRAM -> new TelegramQuizPublisher(
                    restClientBuilder(delivery.getTimeout()),
                    delivery.getTelegramApiBase(),
                    delivery.getTelegramToken(),
                    delivery.getChatId()
            );
            case QuizBotConfigValidator.MODE_LOG -> new LoggingQuizPublisher();
            default -> {
                log.warn("Unknown delivery mode '{}', falling back to log publisher", mode);
                yield new LoggingQuizPublisher();
            }
        };
    }

    @Bean
    public RecentQuestionCache recentQuestionCache(QuizBotProperties properties, ObjectMapper objectMapper) {
        QuizBotProperties.Recency recency = properties.getRecency();
        String snapshotPath = recency.getSnapshotPath();
        RecentQuestionCache cache = new RecentQuestionCache(
                recency.getCapacity(),
                snapshotPath == null || snapshotPath.isBlank() ? null : Path.of(snapshotPath.trim()),
                objectMapper
        );
        cache.load();
        log.info("Recency cache ready: capacity={}, persistent={}, size={}",
                cache.capacity(), cache.isPersistent(), cache.size());
        return cache;
    }

    private RestClient.Builder restClientBuilder(Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return RestClient.builder().requestFactory(requestFactory);
    }
}
