package org.example.quizbot.provider;

/**
 * Parameters of one provider request.
 */
public record ProviderQuery(
        int count,
        String topic    // nullable
) {
    public ProviderQuery {
        if (count < 1) {
            throw new IllegalArgumentException("Provider query count must be positive");
        }
        topic = topic == null || topic.isBlank() ? null : topic.trim();
    }

    public static ProviderQuery single(String topic) {
        return new ProviderQuery(1, topic);
    }

    public boolean hasTopic() {
        return topic != null;
    }
}
