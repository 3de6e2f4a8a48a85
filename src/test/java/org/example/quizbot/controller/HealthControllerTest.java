package org.example.quizbot.controller;

import org.example.quizbot.service.DispatchMetricsService;
import org.example.quizbot.service.QuestionBankService;
import org.example.quizbot.service.QuestionFetchService;
import org.example.quizbot.service.QuizDispatchService;
import org.example.quizbot.service.RecentQuestionCache;
import org.example.quizbot.service.RotationScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private QuestionFetchService fetchService;

    @MockitoBean
    private QuizDispatchService dispatchService;

    @MockitoBean
    private RecentQuestionCache recentQuestionCache;

    @MockitoBean
    private QuestionBankService bankService;

    @MockitoBean
    private RotationScheduler rotationScheduler;

    @MockitoBean
    private DispatchMetricsService metricsService;

    @Test
    void health_returnsOk() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("ok")));
    }

    @Test
    void healthDetails_reportsComponentState() throws Exception {
        when(fetchService.isProviderConfigured()).thenReturn(true);
        when(fetchService.getProviderName()).thenReturn("http");
        when(dispatchService.getPublisherName()).thenReturn("telegram");
        when(recentQuestionCache.size()).thenReturn(42);
        when(recentQuestionCache.capacity()).thenReturn(500);
        when(recentQuestionCache.isPersistent()).thenReturn(true);
        when(bankService.size()).thenReturn(18);
        when(rotationScheduler.getTriggerCount()).thenReturn(3);
        when(metricsService.snapshot()).thenReturn(Map.of("dispatchCompleted", 5L));

        mockMvc.perform(get("/health/details"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("ok")))
                .andExpect(jsonPath("$.provider.configured", is(true)))
                .andExpect(jsonPath("$.provider.name", is("http")))
                .andExpect(jsonPath("$.publisher", is("telegram")))
                .andExpect(jsonPath("$.recencyCache.size", is(42)))
                .andExpect(jsonPath("$.recencyCache.capacity", is(500)))
                .andExpect(jsonPath("$.recencyCache.persistent", is(true)))
                .andExpect(jsonPath("$.fallbackBankSize", is(18)))
                .andExpect(jsonPath("$.scheduledTriggers", is(3)))
                .andExpect(jsonPath("$.dispatchMetrics.dispatchCompleted", is(5)));
    }

    @Test
    void healthDetails_unconfiguredProviderIsDegraded() throws Exception {
        when(fetchService.isProviderConfigured()).thenReturn(false);
        when(metricsService.snapshot()).thenReturn(Map.of());

        mockMvc.perform(get("/health/details"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("degraded")));
    }
}
