package org.example.quizbot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.example.quizbot.provider.ProviderQuery;
import org.example.quizbot.provider.QuestionProviderClient;
import org.example.quizbot.provider.QuestionProviderException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuestionFetchServiceTest {

    @Mock
    private QuestionProviderClient providerClient;

    private final List<Long> sleeps = new ArrayList<>();

    private QuestionFetchService service(int maxAttempts, Duration backoffBase) {
        return new QuestionFetchService(providerClient, maxAttempts, backoffBase, 0.0, sleeps::add);
    }

    @Test
    void fetchWithRetry_alwaysFailing_returnsEmptyAfterExactlyMaxAttempts() {
        when(providerClient.isConfigured()).thenReturn(true);
        when(providerClient.getProviderName()).thenReturn("http");
        when(providerClient.fetch(any())).thenThrow(new QuestionProviderException("timeout"));

        Optional<JsonNode> result = service(4, Duration.ofMillis(100)).fetchWithRetry(ProviderQuery.single("Penal"));

        assertTrue(result.isEmpty());
        verify(providerClient, times(4)).fetch(any());
        assertEquals(List.of(100L, 200L, 400L), sleeps);
        long totalSleep = sleeps.stream().mapToLong(Long::longValue).sum();
        assertTrue(totalSleep >= 100L * (1 + 2 + 4));
    }

    @Test
    void fetchWithRetry_returnsImmediatelyOnSuccess() throws Exception {
        JsonNode payload = new ObjectMapper().readTree("{\"question\": \"Q\"}");
        when(providerClient.isConfigured()).thenReturn(true);
        when(providerClient.getProviderName()).thenReturn("http");
        when(providerClient.fetch(any()))
                .thenThrow(new QuestionProviderException("connection refused"))
                .thenReturn(payload);

        Optional<JsonNode> result = service(3, Duration.ofMillis(700)).fetchWithRetry(ProviderQuery.single("Penal"));

        assertEquals(Optional.of(payload), result);
        verify(providerClient, times(2)).fetch(any());
        assertEquals(List.of(700L), sleeps);
    }

    @Test
    void fetchWithRetry_explicitAttemptsOverrideDefaults() {
        when(providerClient.isConfigured()).thenReturn(true);
        when(providerClient.getProviderName()).thenReturn("http");
        when(providerClient.fetch(any())).thenThrow(new IllegalStateException("bad body"));

        Optional<JsonNode> result = service(3, Duration.ofMillis(700))
                .fetchWithRetry(ProviderQuery.single(null), 2, Duration.ofMillis(50));

        assertTrue(result.isEmpty());
        verify(providerClient, times(2)).fetch(any());
        assertEquals(List.of(50L), sleeps);
    }

    @Test
    void fetchWithRetry_nullBodyIsNoData() {
        when(providerClient.isConfigured()).thenReturn(true);
        when(providerClient.getProviderName()).thenReturn("http");
        when(providerClient.fetch(any())).thenReturn(NullNode.getInstance());

        assertTrue(service(3, Duration.ofMillis(10)).fetchWithRetry(ProviderQuery.single("Penal")).isEmpty());
        verify(providerClient, times(1)).fetch(any());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void fetchWithRetry_emptyContainerIsNoData() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        when(providerClient.isConfigured()).thenReturn(true);
        when(providerClient.getProviderName()).thenReturn("http");
        when(providerClient.fetch(any())).thenReturn(mapper.readTree("[]"), mapper.readTree("{}"));
        QuestionFetchService service = service(3, Duration.ofMillis(10));

        assertTrue(service.fetchWithRetry(ProviderQuery.single("Penal")).isEmpty());
        assertTrue(service.fetchWithRetry(ProviderQuery.single("Penal")).isEmpty());
        verify(providerClient, times(2)).fetch(any());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void fetchWithRetry_unconfiguredProvider_skipsRemoteCall() {
        when(providerClient.isConfigured()).thenReturn(false);

        assertTrue(service(3, Duration.ofMillis(10)).fetchWithRetry(ProviderQuery.single("Penal")).isEmpty());
        verify(providerClient, never()).fetch(any());
    }

    @Test
    void fetchWithRetry_interruptedBackoff_returnsEmptyAndKeepsInterruptFlag() {
        when(providerClient.isConfigured()).thenReturn(true);
        when(providerClient.getProviderName()).thenReturn("http");
        when(providerClient.fetch(any())).thenThrow(new QuestionProviderException("timeout"));
        QuestionFetchService service = new QuestionFetchService(providerClient, 3, Duration.ofMillis(10), 0.0, millis -> {
            throw new InterruptedException("stop");
        });

        try {
            assertTrue(service.fetchWithRetry(ProviderQuery.single("Penal")).isEmpty());
            assertTrue(Thread.currentThread().isInterrupted());
            verify(providerClient, times(1)).fetch(any());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void backoffDelayMs_withJitterNeverGoesBelowExponentialDelay() {
        QuestionFetchService service = new QuestionFetchService(providerClient, 3, Duration.ofMillis(100), 0.5, sleeps::add);

        for (int i = 0; i < 20; i++) {
            long delay = service.backoffDelayMs(Duration.ofMillis(100), 3);
            assertTrue(delay >= 400L && delay <= 600L, "delay " + delay);
        }
        assertFalse(service.backoffDelayMs(Duration.ofMillis(100), 1) < 100L);
    }
}
