package org.example.quizbot.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Question provider reached over HTTP GET, e.g. {@code GET /questoes?qtd=1&topico=Penal}.
 */
public class HttpQuestionProviderClient implements QuestionProviderClient {

    private static final Logger log = LoggerFactory.getLogger(HttpQuestionProviderClient.class);

    private final RestClient restClient;
    private final String endpointUrl;
    private final String countParam;
    private final String topicParam;
    private final ObjectMapper objectMapper;

    public HttpQuestionProviderClient(
            RestClient.Builder restClientBuilder,
            String endpointUrl,
            String countParam,
            String topicParam,
            ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.build();
        this.endpointUrl = endpointUrl == null ? "" : endpointUrl.trim();
        this.countParam = countParam;
        this.topicParam = topicParam;
        this.objectMapper = objectMapper;
        log.info("HTTP question provider initialized: url={}", isConfigured() ? this.endpointUrl : "(not configured)");
    }

    @Override
    public JsonNode fetch(ProviderQuery query) {
        if (!isConfigured()) {
            throw new QuestionProviderException("Question provider URL is not configured");
        }
        URI uri = buildUri(query);
        try {
            String body = restClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(String.class);
            if (body == null || body.isBlank()) {
                return null;
            }
            return objectMapper.readTree(body);
        } catch (RestClientResponseException e) {
            throw new QuestionProviderException("Question provider returned " + e.getStatusCode(), e);
        } catch (Exception e) {
            throw new QuestionProviderException("Question provider request failed: " + e.getMessage(), e);
        }
    }

    URI buildUri(ProviderQuery query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(endpointUrl)
                .queryParam(countParam, query.count());
        if (query.hasTopic()) {
            builder.queryParam(topicParam, query.topic());
        }
        return builder.encode().build().toUri();
    }

    @Override
    public boolean isConfigured() {
        return !endpointUrl.isBlank();
    }

    @Override
    public String getProviderName() {
        return "http";
    }
}
