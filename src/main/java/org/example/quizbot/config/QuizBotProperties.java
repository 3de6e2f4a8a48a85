package org.example.quizbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "quizbot")
public class QuizBotProperties {

    private String timezone = "America/Sao_Paulo";
    private List<String> topics = new ArrayList<>(List.of(
            "Penal",
            "Constitucional",
            "Raciocínio Lógico",
            "Processo Penal",
            "Direitos Humanos"
    ));
    private Provider provider = new Provider();
    private Retry retry = new Retry();
    private Recency recency = new Recency();
    private Batch batch = new Batch();
    private Schedule schedule = new Schedule();
    private Delivery delivery = new Delivery();

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public List<String> getTopics() {
        return topics;
    }

    public void setTopics(List<String> topics) {
        this.topics = topics == null ? new ArrayList<>() : topics;
    }

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Recency getRecency() {
        return recency;
    }

    public void setRecency(Recency recency) {
        this.recency = recency;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public void setDelivery(Delivery delivery) {
        this.delivery = delivery;
    }

    public static class Provider {
        private String url = "";
        private Duration timeout = Duration.ofSeconds(10);
        private String countParam = "qtd";
        private String topicParam = "topico";

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getCountParam() {
            return countParam;
        }

        public void setCountParam(String countParam) {
            this.countParam = countParam;
        }

        public String getTopicParam() {
            return topicParam;
        }

        public void setTopicParam(String topicParam) {
            this.topicParam = topicParam;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofMillis(700);
        private double jitterFactor = 0.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoffBase() {
            return backoffBase;
        }

        public void setBackoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }
    }

    public static class Recency {
        private int capacity = 500;
        private String snapshotPath = "";

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public String getSnapshotPath() {
            return snapshotPath;
        }

        public void setSnapshotPath(String snapshotPath) {
            this.snapshotPath = snapshotPath;
        }
    }

    public static class Batch {
        private int defaultCount = 10;
        private int maxCount = 20;
        private int attemptFactor = 4;
        private boolean avoidRecent = true;
        private Duration deadline;

        public int getDefaultCount() {
            return defaultCount;
        }

        public void setDefaultCount(int defaultCount) {
            this.defaultCount = defaultCount;
        }

        public int getMaxCount() {
            return maxCount;
        }

        public void setMaxCount(int maxCount) {
            this.maxCount = maxCount;
        }

        public int getAttemptFactor() {
            return attemptFactor;
        }

        public void setAttemptFactor(int attemptFactor) {
            this.attemptFactor = attemptFactor;
        }

        public boolean isAvoidRecent() {
            return avoidRecent;
        }

        public void setAvoidRecent(boolean avoidRecent) {
            this.avoidRecent = avoidRecent;
        }

        public Duration getDeadline() {
            return deadline;
        }

        public void setDeadline(Duration deadline) {
            this.deadline = deadline;
        }
    }

    public static class Schedule {
        private boolean enabled = true;
        private List<String> slotTimes = new ArrayList<>(List.of("08:00", "15:00", "20:00"));
        private Map<Integer, List<String>> rotation = defaultRotation();

        private static Map<Integer, List<String>> defaultRotation() {
            Map<Integer, List<String>> rotation = new LinkedHashMap<>();
            rotation.put(1, new ArrayList<>(List.of("Penal", "Constitucional", "Raciocínio Lógico")));
            rotation.put(2, new ArrayList<>(List.of("Processo Penal", "Direitos Humanos", "Penal")));
            rotation.put(3, new ArrayList<>(List.of("Constitucional", "Raciocínio Lógico", "Processo Penal")));
            return rotation;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /**
         * Wall-clock times (HH:mm); the n-th entry fires the n-th topic of the day.
         */
        public List<String> getSlotTimes() {
            return slotTimes;
        }

        public void setSlotTimes(List<String> slotTimes) {
            this.slotTimes = slotTimes == null ? new ArrayList<>() : slotTimes;
        }

        public Map<Integer, List<String>> getRotation() {
            return rotation;
        }

        public void setRotation(Map<Integer, List<String>> rotation) {
            this.rotation = rotation == null ? new LinkedHashMap<>() : rotation;
        }
    }

    public static class Delivery {
        private String mode = "telegram";
        private String telegramToken = "";
        private String chatId = "";
        private String telegramApiBase = "https://api.telegram.org";
        private Duration timeout = Duration.ofSeconds(15);

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getTelegramToken() {
            return telegramToken;
        }

        public void setTelegramToken(String telegramToken) {
            this.telegramToken = telegramToken;
        }

        public String getChatId() {
            return chatId;
        }

        public void setChatId(String chatId) {
            this.chatId = chatId;
        }

        public String getTelegramApiBase() {
            return telegramApiBase;
        }

        public void setTelegramApiBase(String telegramApiBase) {
            this.telegramApiBase = telegramApiBase;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
