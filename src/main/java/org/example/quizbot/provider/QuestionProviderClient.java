package org.example.quizbot.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Abstraction for remote question sources.
 */
public interface QuestionProviderClient {

    /**
     * Perform one fetch attempt. Implementations never retry.
     *
     * @param query requested count and optional topic
     * @return the raw JSON payload, possibly {@code null} when the body is empty
     * @throws QuestionProviderException on timeout, connection failure, non-2xx status or unreadable body
     */
    JsonNode fetch(ProviderQuery query);

    /**
     * Check if an endpoint is configured at all.
     *
     * @return true if {@link #fetch(ProviderQuery)} can issue a request
     */
    boolean isConfigured();

    /**
     * Get the name of this provider for logging/debugging.
     *
     * @return provider name
     */
    String getProviderName();
}
